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

import java.util.concurrent.atomic.AtomicBoolean;

import com.stumbleupon.async.Deferred;

/**
 * A state container for asynchronous queries. Executors return an instance
 * of this when accepting a query. The caller can then wait on the 
 * {@link #deferred()} for results or, if it needs to go away, cancel the
 * request.
 *
 * @param <T> The type of data that's returned by the query.
 * 
 * @since 1.0
 */
public abstract class QueryExecution<T> {
  
  /** The deferred that will be called with a result (good data or an 
   * exception) */
  protected final Deferred<T> deferred;
  
  /** A thread safe boolean to use when calling or canceling. */
  protected final AtomicBoolean completed;
  
  /**
   * Default ctor.
   */
  public QueryExecution() {
    deferred = new Deferred<T>();
    completed = new AtomicBoolean();
  }
  
  /** @return The deferred that will be called with a result. */
  public Deferred<T> deferred() {
    return deferred;
  }
  
  /** @return Whether or not the deferred has been called. */
  public boolean isCompleted() {
    return completed.get();
  }
  
  /**
   * Passes the result to the deferred and triggers it's callback chain.
   * @param result A result of type T, null or an exception.
   * @throws IllegalStateException if the deferred was already called.
   */
  protected void callback(final Object result) {
    if (completed.compareAndSet(false, true)) {
      deferred.callback(result);
    } else {
      throw new IllegalStateException("Callback was already executed: " + this);
    }
  }
  
  /**
   * Cancels the query if it's outstanding. Implementations should call back
   * with a {@link net.arcquery.exceptions.QueryExecutionCanceled} if the 
   * deferred wasn't called yet.
   */
  public abstract void cancel();
}
