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
package net.arcquery.utils;

/**
 * Thrown by {@link JSON} and {@link YAML} when the underlying stream or file
 * couldn't be read, as opposed to being malformed.
 * @since 1.0
 */
public final class JSONException extends RuntimeException {
  private static final long serialVersionUID = -4279302853226370176L;

  /** @param cause The I/O failure. */
  public JSONException(final Throwable cause) {
    super(cause);
  }
  
  /**
   * @param msg What was being read.
   * @param cause The I/O failure.
   */
  public JSONException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
