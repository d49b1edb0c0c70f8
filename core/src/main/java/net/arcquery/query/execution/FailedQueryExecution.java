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
package net.arcquery.query.execution;

/**
 * An execution that failed before any chunk was scheduled, such as one 
 * requested with a context that was already canceled. The deferred is 
 * already called back with the exception.
 *  
 * @param <T> The result type.
 * 
 * @since 1.0
 */
public class FailedQueryExecution<T> extends QueryExecution<T> {
  
  /**
   * @param ex The non-null failure handed to callers of {@link #deferred()}.
   * @throws IllegalArgumentException if the exception was null.
   */
  public FailedQueryExecution(final Exception ex) {
    if (ex == null) {
      throw new IllegalArgumentException("Exception cannot be null.");
    }
    callback(ex);
  }
  
  /** Nothing is running. */
  @Override
  public void cancel() { }
}
