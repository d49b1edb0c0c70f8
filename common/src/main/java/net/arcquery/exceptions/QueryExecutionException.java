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
 * Base exception for anything that fails a query. The message ends up in
 * front of the user so it should say what went wrong and, where possible,
 * what to change. The status code follows HTTP semantics.
 * 
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = -3180459272652950383L;

  /** The index of the chunk that failed in a split query, -1 if the query
   * wasn't split. */
  protected final int order;
  
  /** An HTTP style status code. */
  protected final int status_code;
  
  /**
   * Ctor for an unsplit query.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1, null);
  }
  
  /**
   * Ctor for a chunk of a split query.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   * @param order The chunk index.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final int order) {
    this(msg, status_code, order, null);
  }
  
  /**
   * Ctor wrapping a cause for an unsplit query.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   * @param t The failure behind this one.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code,
                                 final Throwable t) {
    this(msg, status_code, -1, t);
  }
  
  /**
   * Full ctor.
   * @param msg A non-null message.
   * @param status_code The status code to report.
   * @param order The chunk index or -1.
   * @param t The failure behind this one, may be null.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final int order,
                                 final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    this.order = order;
  }
  
  /** @return The chunk index in a split query, -1 otherwise. */
  public int getOrder() {
    return order;
  }
  
  /** @return The HTTP style status code. */
  public int getStatusCode() {
    return status_code;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass().getSimpleName())
        .append(": ")
        .append(getMessage())
        .append(" (status=")
        .append(status_code);
    if (order >= 0) {
      buf.append(", chunk=")
         .append(order);
    }
    return buf.append(")").toString();
  }
}
