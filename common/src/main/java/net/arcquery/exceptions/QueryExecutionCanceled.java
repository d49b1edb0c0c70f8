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

/**
 * Exception bubbled up when a query or one of its chunks is canceled before
 * it could finish.
 * 
 * @since 1.0
 */
public class QueryExecutionCanceled extends QueryExecutionException {
  private static final long serialVersionUID = 4620783101953622873L;

  /** The status code used when the caller canceled the request. */
  public static final int STATUS_CODE = 400;
  
  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   */
  public QueryExecutionCanceled(final String msg) {
    super(msg, STATUS_CODE);
  }
  
  /**
   * Ctor that sets a chunk order for the exception.
   * @param msg A non-null message to be given.
   * @param order An optional order for the result in a set of chunks.
   */
  public QueryExecutionCanceled(final String msg, final int order) {
    super(msg, STATUS_CODE, order);
  }

  /**
   * Ctor setting a message, chunk order and cause.
   * @param msg A non-null message to be given.
   * @param order An optional order for the result in a set of chunks.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionCanceled(final String msg, 
                                final int order,
                                final Throwable t) {
    super(msg, STATUS_CODE, order, t);
  }

}
