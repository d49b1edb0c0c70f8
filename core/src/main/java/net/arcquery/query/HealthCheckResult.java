// This file is part of ArcQuery.
// Copyright (C) 2026  The ArcQuery Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.arcquery.query;

/**
 * The result of a connectivity check.
 * 
 * @since 1.0
 */
public final class HealthCheckResult {
  public static enum Status {
    OK,
    ERROR
  }
  
  private final Status status;
  private final String message;
  
  public HealthCheckResult(final Status status, final String message) {
    this.status = status;
    this.message = message;
  }
  
  public static HealthCheckResult ok(final String message) {
    return new HealthCheckResult(Status.OK, message);
  }
  
  public static HealthCheckResult error(final String message) {
    return new HealthCheckResult(Status.ERROR, message);
  }
  
  public Status status() {
    return status;
  }
  
  public String message() {
    return message;
  }
  
  @Override
  public String toString() {
    return status + ": " + message;
  }
}
