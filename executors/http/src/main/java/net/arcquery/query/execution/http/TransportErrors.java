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
package net.arcquery.query.execution.http;

import java.io.EOFException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import org.apache.http.ConnectionClosedException;
import org.apache.http.NoHttpResponseException;
import org.apache.http.MalformedChunkCodingException;
import org.apache.http.TruncatedChunkException;
import org.apache.http.conn.ConnectTimeoutException;

import com.google.common.base.Throwables;

import net.arcquery.exceptions.RemoteQueryExecutionException;

/**
 * Maps transport failures to messages a user can act on.
 * 
 * @since 1.0
 */
public final class TransportErrors {
  
  /** Transport failure categories. */
  public static enum Category {
    TIMEOUT("Query timed out - try reducing the time range, increasing the "
        + "timeout in datasource settings, or enabling query splitting"),
    CONNECTION_REFUSED("Cannot connect to Arc - connection refused. Check "
        + "that Arc is running and the URL is correct"),
    UNKNOWN_HOST("Cannot connect to Arc - hostname not found. Check the URL "
        + "in datasource settings"),
    PREMATURE_END("Arc closed the connection unexpectedly - the query may be "
        + "too large. Try enabling query splitting or reducing the time range");
    
    private final String message;
    
    Category(final String message) {
      this.message = message;
    }
    
    public String message() {
      return message;
    }
  }
  
  /** Status used for transport failures. */
  public static final int STATUS_CODE = 502;
  
  private TransportErrors() { }
  
  /**
   * @param t The failure, may be null.
   * @return The category of the failure, null if it wasn't recognized.
   */
  public static Category categorize(final Throwable t) {
    if (t == null) {
      return null;
    }
    for (final Throwable cause : Throwables.getCausalChain(t)) {
      // connect timeouts extend InterruptedIOException too
      if (cause instanceof SocketTimeoutException 
          || cause instanceof ConnectTimeoutException) {
        return Category.TIMEOUT;
      }
      if (cause instanceof ConnectException) {
        return Category.CONNECTION_REFUSED;
      }
      if (cause instanceof UnknownHostException) {
        return Category.UNKNOWN_HOST;
      }
      if (cause instanceof EOFException 
          || cause instanceof NoHttpResponseException
          || cause instanceof ConnectionClosedException
          || cause instanceof TruncatedChunkException
          || cause instanceof MalformedChunkCodingException) {
        return Category.PREMATURE_END;
      }
      if (cause instanceof InterruptedIOException) {
        return Category.TIMEOUT;
      }
    }
    return null;
  }
  
  /**
   * Wraps the failure with a message for its category.
   * @param t The non-null failure.
   * @param endpoint The endpoint called.
   * @return The exception to throw, with the failure as the cause.
   */
  public static RemoteQueryExecutionException toException(final Throwable t, 
                                                          final String endpoint) {
    final Category category = categorize(t);
    final String message = category != null ? category.message() 
        : String.format("Request to Arc failed: %s", t.getMessage());
    return new RemoteQueryExecutionException(message, endpoint, STATUS_CODE, t);
  }
}
