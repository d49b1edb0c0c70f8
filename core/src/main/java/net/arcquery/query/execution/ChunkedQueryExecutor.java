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

import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import net.arcquery.configuration.ArcSettings;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.ChunkExecutionException;
import net.arcquery.exceptions.QueryExecutionCanceled;
import net.arcquery.exceptions.QueryExecutionException;
import net.arcquery.query.QueryBackend;
import net.arcquery.query.QueryContext;
import net.arcquery.query.TimeRange;
import net.arcquery.query.macro.MacroExpander;
import net.arcquery.query.processor.FrameMerger;
import net.arcquery.query.split.ChunkPlan;
import net.arcquery.utils.DateTime;

/**
 * Runs the chunks of a split query on a shared worker pool with at most
 * {@link ArcSettings#maxConcurrency()} chunks of the query in flight. Each
 * chunk expands the SQL template for its bounds and calls the backend. When
 * the last chunk finishes the results are examined in chunk order: the first
 * failure, in chunk order rather than completion order, fails the query; 
 * otherwise the frames are merged in chunk order.
 * <p>
 * Chunks waiting for a permit give up once the {@link QueryContext} is 
 * canceled and running chunks are aborted through the context's hooks.
 * 
 * @since 1.0
 */
public class ChunkedQueryExecutor {
  private static final Logger LOG = 
      LoggerFactory.getLogger(ChunkedQueryExecutor.class);
  
  /** How long a chunk waits for a permit before re-checking cancellation. */
  @VisibleForTesting
  static final long PERMIT_POLL_MS = 50;
  
  /** The backend to run chunks against. */
  private final QueryBackend backend;
  
  /** The shared pool chunks run on. */
  private final ExecutorService pool;
  
  /** Executions that haven't completed yet. */
  private final Set<ChunkedExecution> outstanding_executions;
  
  /**
   * Default ctor.
   * @param backend A non-null backend.
   * @param pool A non-null worker pool shared across queries.
   */
  public ChunkedQueryExecutor(final QueryBackend backend, 
                              final ExecutorService pool) {
    if (backend == null) {
      throw new IllegalArgumentException("Backend cannot be null.");
    }
    if (pool == null) {
      throw new IllegalArgumentException("Pool cannot be null.");
    }
    this.backend = backend;
    this.pool = pool;
    outstanding_executions = ConcurrentHashMap.newKeySet();
  }
  
  /**
   * Launches the chunks.
   * @param settings The non-null settings for the query.
   * @param sql The SQL template with macros.
   * @param plan The non-null chunk plan.
   * @param context The non-null context.
   * @return An execution whose deferred resolves to the merged frame, null
   * if no chunk returned a frame, or a {@link QueryExecutionException}.
   */
  public QueryExecution<DataFrame> executeQuery(final ArcSettings settings, 
                                                final String sql, 
                                                final ChunkPlan plan,
                                                final QueryContext context) {
    if (context.isCancelled()) {
      return new FailedQueryExecution<DataFrame>(new QueryExecutionCanceled(
          "Query was canceled before it ran"));
    }
    final ChunkedExecution execution = 
        new ChunkedExecution(settings, sql, plan, context);
    outstanding_executions.add(execution);
    execution.launch();
    return execution;
  }
  
  /** Cancels every outstanding execution. */
  public void cancelAll() {
    for (final ChunkedExecution execution : outstanding_executions) {
      execution.cancel();
    }
  }
  
  @VisibleForTesting
  int outstanding() {
    return outstanding_executions.size();
  }
  
  /** The execution of one split query. */
  class ChunkedExecution extends QueryExecution<DataFrame> {
    private final ArcSettings settings;
    private final String sql;
    private final ChunkPlan plan;
    private final QueryContext context;
    
    /** Limits the chunks of this query in flight. */
    private final Semaphore permits;
    
    /** Index addressed results. */
    private final DataFrame[] frames;
    private final QueryExecutionException[] errors;
    
    /** Chunks that haven't finished. */
    private final AtomicInteger remaining;
    
    /** When the execution started. */
    private final long start;
    
    ChunkedExecution(final ArcSettings settings, 
                     final String sql, 
                     final ChunkPlan plan, 
                     final QueryContext context) {
      this.settings = settings;
      this.sql = sql;
      this.plan = plan;
      this.context = context;
      permits = new Semaphore(settings.maxConcurrency());
      frames = new DataFrame[plan.size()];
      errors = new QueryExecutionException[plan.size()];
      remaining = new AtomicInteger(plan.size());
      start = DateTime.nanoTime();
    }
    
    void launch() {
      for (int i = 0; i < plan.size(); i++) {
        try {
          pool.execute(new ChunkTask(i));
        } catch (RejectedExecutionException e) {
          errors[i] = new ChunkExecutionException(plan.get(i), i, 
              new QueryExecutionException("Worker pool rejected the chunk", 
                  503, i, e));
          finishChunk(i);
        }
      }
    }
    
    @Override
    public void cancel() {
      context.cancel();
      if (!completed.get()) {
        try {
          callback(new QueryExecutionCanceled("Query was canceled upstream"));
        } catch (IllegalStateException e) {
          // already called, don't care.
        }
      }
      outstanding_executions.remove(this);
    }
    
    /** Records the end of a chunk and completes the query after the last. */
    private void finishChunk(final int index) {
      if (remaining.decrementAndGet() > 0) {
        return;
      }
      outstanding_executions.remove(this);
      if (completed.get()) {
        return;
      }
      Object result = null;
      for (int i = 0; i < errors.length; i++) {
        if (errors[i] != null) {
          result = context.isCancelled() ? 
              new QueryExecutionCanceled("Query was canceled", i, errors[i]) 
              : errors[i];
          break;
        }
      }
      if (result == null) {
        try {
          result = FrameMerger.merge(Arrays.asList(frames));
        } catch (RuntimeException e) {
          result = new QueryExecutionException("Failed to merge chunk "
              + "results: " + e.getMessage(), 500, e);
        }
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Split query finished " + plan.size() + " chunks in " 
            + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms" 
            + (result instanceof Exception ? " with error: " + result : ""));
      }
      try {
        callback(result);
      } catch (IllegalStateException e) {
        // canceled concurrently
      }
    }
    
    /** Waits for a permit, giving up on cancellation. */
    private boolean acquire() throws InterruptedException {
      while (!permits.tryAcquire(PERMIT_POLL_MS, TimeUnit.MILLISECONDS)) {
        if (context.isCancelled()) {
          return false;
        }
      }
      if (context.isCancelled()) {
        permits.release();
        return false;
      }
      return true;
    }
    
    /** Runs one chunk. Any failure is attributed to the chunk. */
    class ChunkTask implements Runnable {
      private final int index;
      
      ChunkTask(final int index) {
        this.index = index;
      }
      
      @Override
      public void run() {
        final TimeRange chunk = plan.get(index);
        try {
          if (!acquire()) {
            errors[index] = new ChunkExecutionException(chunk, index, 
                new QueryExecutionCanceled("Query was canceled", index));
            return;
          }
          try {
            final String expanded = 
                MacroExpander.expand(sql, chunk, plan.range());
            if (LOG.isDebugEnabled()) {
              LOG.debug("Running chunk " + index + " " + chunk.toShortString());
            }
            frames[index] = backend.execute(settings, expanded, context);
          } finally {
            permits.release();
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          errors[index] = new ChunkExecutionException(chunk, index, 
              new QueryExecutionCanceled("Interrupted waiting to run", index, e));
        } catch (Throwable t) {
          errors[index] = new ChunkExecutionException(chunk, index, t);
        } finally {
          finishChunk(index);
        }
      }
    }
  }
}
