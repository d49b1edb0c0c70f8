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
package net.arcquery.exceptions;

import net.arcquery.query.TimeRange;

/**
 * Wraps the failure of a single chunk of a split query. The message is
 * prefixed with the chunk's bounds, e.g. 
 * {@code [chunk 2026-02-18 06:00 to 2026-02-18 12:00] Arc error (HTTP 500): boom}.
 * 
 * @since 1.0
 */
public class ChunkExecutionException extends QueryExecutionException {
  private static final long serialVersionUID = 8224985140151773207L;

  /** The chunk that failed. */
  private final TimeRange chunk;
  
  /**
   * Default ctor.
   * @param chunk The non-null chunk that failed.
   * @param order The index of the chunk in the plan.
   * @param cause The non-null failure.
   */
  public ChunkExecutionException(final TimeRange chunk, 
                                 final int order, 
                                 final Throwable cause) {
    super("[chunk " + chunk.toShortString() + "] " + describe(cause), 
        cause instanceof QueryExecutionException ? 
            ((QueryExecutionException) cause).getStatusCode() : 500,
        order, 
        cause);
    this.chunk = chunk;
  }
  
  /** @return The chunk that failed. */
  public TimeRange chunk() {
    return chunk;
  }
  
  private static String describe(final Throwable cause) {
    if (cause == null) {
      return "unknown error";
    }
    return cause.getMessage() != null ? cause.getMessage() : cause.toString();
  }
}
