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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.arcquery.utils.DateTime;

/**
 * The caller's handle on a running request. Components poll 
 * {@link #isCancelled()} at their suspension points and in-flight remote 
 * calls register hooks via {@link #onCancel(Runnable)} so they can be aborted
 * when the caller goes away. A context with a timeout cancels itself when
 * the deadline passes, running the hooks the same way.
 * 
 * @since 1.0
 */
public class QueryContext {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);
  
  /** Shared timer firing the deadlines of all contexts. */
  private static final ScheduledThreadPoolExecutor TIMER;
  static {
    TIMER = new ScheduledThreadPoolExecutor(1, new ThreadFactoryBuilder()
        .setNameFormat("arc-deadline-%d")
        .setDaemon(true)
        .build());
    TIMER.setRemoveOnCancelPolicy(true);
  }
  
  /** Flipped once when the caller cancels. */
  private final AtomicBoolean cancelled;
  
  /** Optional absolute deadline in epoch millis, 0 for none. */
  private final long deadline;
  
  /** Hooks to run on cancellation. */
  private final List<Runnable> hooks;
  
  /** The pending deadline task, null without a timeout. */
  private final ScheduledFuture<?> deadline_task;
  
  /**
   * Protected ctor, use the builder.
   * @param builder The non-null builder.
   */
  protected QueryContext(final Builder builder) {
    cancelled = new AtomicBoolean();
    deadline = builder.timeout > 0 ? 
        DateTime.currentTimeMillis() + builder.timeout : 0;
    hooks = new CopyOnWriteArrayList<Runnable>();
    final long timeout = builder.timeout;
    if (timeout > 0) {
      deadline_task = TIMER.schedule(new Runnable() {
        @Override
        public void run() {
          if (LOG.isDebugEnabled()) {
            LOG.debug("Query deadline of " + timeout 
                + "ms passed, canceling");
          }
          cancel();
        }
      }, timeout, TimeUnit.MILLISECONDS);
    } else {
      deadline_task = null;
    }
  }
  
  /** @return True if the caller canceled or the deadline passed. */
  public boolean isCancelled() {
    if (cancelled.get()) {
      return true;
    }
    if (deadline > 0 && DateTime.currentTimeMillis() >= deadline) {
      // the timer may lag the clock
      cancel();
      return true;
    }
    return false;
  }
  
  /** @return The absolute deadline in epoch millis or 0 if there isn't one. */
  public long deadline() {
    return deadline;
  }
  
  /**
   * Cancels the request and runs each registered hook once. Subsequent calls
   * are no-ops. Also called by the timer when the deadline passes.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    if (deadline_task != null) {
      deadline_task.cancel(false);
    }
    for (final Runnable hook : hooks) {
      runHook(hook);
    }
    hooks.clear();
  }
  
  /**
   * Registers a hook to run on cancellation. If the context was already
   * canceled the hook runs immediately on the calling thread.
   * @param hook A non-null hook.
   */
  public void onCancel(final Runnable hook) {
    if (hook == null) {
      throw new IllegalArgumentException("Hook cannot be null.");
    }
    hooks.add(hook);
    if (cancelled.get() && hooks.remove(hook)) {
      runHook(hook);
    }
  }
  
  /**
   * Removes a previously registered hook, e.g. once the call it guards has
   * completed.
   * @param hook The hook to remove.
   */
  public void removeCancelHook(final Runnable hook) {
    hooks.remove(hook);
  }
  
  private void runHook(final Runnable hook) {
    try {
      hook.run();
    } catch (RuntimeException e) {
      LOG.warn("Cancellation hook threw an exception: " + hook, e);
    }
  }
  
  /** @return A context without a deadline. */
  public static QueryContext newContext() {
    return newBuilder().build();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long timeout;
    
    /**
     * @param timeout An optional overall timeout in milliseconds. 0 or less
     * means no deadline.
     * @return The builder.
     */
    public Builder setTimeout(final long timeout) {
      this.timeout = timeout;
      return this;
    }
    
    public QueryContext build() {
      return new QueryContext(this);
    }
  }
}
