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

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.arcquery.configuration.ArcSettings;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.QueryExecutionCanceled;
import net.arcquery.exceptions.QueryExecutionException;
import net.arcquery.query.execution.ChunkedQueryExecutor;
import net.arcquery.query.macro.MacroExpander;
import net.arcquery.query.macro.TimeOrdering;
import net.arcquery.query.processor.FramePreparer;
import net.arcquery.query.split.ChunkPlan;
import net.arcquery.query.split.SplitDuration;
import net.arcquery.query.split.SplitEligibility;
import net.arcquery.query.split.TimeRangeSplitter;
import net.arcquery.utils.DateTime;

/**
 * The host facing entry point. Each query in a request is run in order: the
 * SQL template is checked for split eligibility, ordered by time for time
 * series results, then run either as a single query or as a set of time
 * chunks whose frames are merged. The resulting frame is then classified and
 * reshaped for the host.
 * <p>
 * Failures are reported per query and never abort the other queries of the
 * request.
 * 
 * @since 1.0
 */
public class ArcDatasource implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ArcDatasource.class);
  
  public static final String HEALTH_QUERY = "SHOW DATABASES";
  public static final String HEALTH_OK = "Arc datasource is working";
  
  /** Custom metadata keys. */
  public static final String SPLIT_CHUNKS = "splitChunks";
  public static final String EXECUTION_TIME = "executionTime";
  
  private final QueryBackend backend;
  private final ExecutorService pool;
  private final boolean owns_pool;
  private final ChunkedQueryExecutor executor;
  
  /**
   * Ctor that creates and owns a daemon worker pool for chunks.
   * @param backend The non-null backend.
   */
  public ArcDatasource(final QueryBackend backend) {
    this(backend, Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setNameFormat("arc-chunk-%d")
        .setDaemon(true)
        .build()), true);
  }
  
  /**
   * Ctor using a pool owned by the caller. {@link #close()} won't shut it
   * down.
   * @param backend The non-null backend.
   * @param pool The non-null pool.
   */
  public ArcDatasource(final QueryBackend backend, final ExecutorService pool) {
    this(backend, pool, false);
  }
  
  private ArcDatasource(final QueryBackend backend, 
                        final ExecutorService pool,
                        final boolean owns_pool) {
    if (backend == null) {
      throw new IllegalArgumentException("Backend cannot be null.");
    }
    this.backend = backend;
    this.pool = pool;
    this.owns_pool = owns_pool;
    executor = new ChunkedQueryExecutor(backend, pool);
  }
  
  /**
   * Runs the queries in order.
   * @param settings The non-null datasource settings.
   * @param queries The non-null queries.
   * @param context The non-null context shared by the queries.
   * @return A map of reference IDs to responses in query order.
   */
  public Map<String, DataResponse> queryData(final ArcSettings settings, 
                                             final List<DataQuery> queries,
                                             final QueryContext context) {
    final Map<String, DataResponse> responses = Maps.newLinkedHashMap();
    for (final DataQuery query : queries) {
      responses.put(query.spec().getRefId(), 
          query(settings, query, context));
    }
    return responses;
  }
  
  /**
   * Parses the host's JSON query model then runs it.
   * @param settings The non-null datasource settings.
   * @param ref_id The reference ID of the query.
   * @param model The JSON query model.
   * @param range The non-null range to query.
   * @param context The non-null context.
   * @return The response, with a 400 error if the model was invalid.
   */
  public DataResponse query(final ArcSettings settings,
                            final String ref_id,
                            final JsonNode model,
                            final TimeRange range,
                            final QueryContext context) {
    final QuerySpec spec;
    try {
      spec = QuerySpec.parse(ref_id, model);
    } catch (IllegalArgumentException e) {
      LOG.warn("Invalid model for query " + ref_id + ": " + e.getMessage());
      return DataResponse.ofError(new QueryExecutionException(
          "failed to unmarshal query model: " + e.getMessage(), 400, e));
    }
    return query(settings, new DataQuery(spec, range), context);
  }

  /**
   * Runs a single query, capturing failures in the response.
   * @param settings The non-null datasource settings.
   * @param query The non-null query.
   * @param context The non-null context.
   * @return The response, never null.
   */
  public DataResponse query(final ArcSettings settings, 
                            final DataQuery query,
                            final QueryContext context) {
    final QuerySpec spec = query.spec();
    try {
      String sql = spec.effectiveSql();
      if (Strings.isNullOrEmpty(sql.trim())) {
        return DataResponse.ofError(
            new QueryExecutionException("Query SQL is empty", 400));
      }
      final ArcSettings effective = settings.withDatabase(spec.getDatabase());
      final SplitDuration split = SplitDuration.resolve(
          Strings.isNullOrEmpty(spec.getSplitDuration()) ? 
              effective.splitDuration() : spec.getSplitDuration(), 
          query.timeRange());
      final boolean eligible = 
          SplitEligibility.analyze(sql, spec.getRefId()) == null;
      if (spec.getFormat() == QueryFormat.TIME_SERIES) {
        sql = TimeOrdering.apply(sql);
      }
      
      if (split.isEnabled() && eligible) {
        return runSplit(effective, sql, spec, query.timeRange(), split, 
            context);
      }
      return runSingle(effective, sql, spec, query.timeRange(), context);
    } catch (QueryExecutionException e) {
      LOG.warn("Query " + spec.getRefId() + " failed: " + e.getMessage());
      return DataResponse.ofError(e);
    } catch (RuntimeException e) {
      LOG.error("Unexpected failure running query " + spec.getRefId(), e);
      return DataResponse.ofError(new QueryExecutionException(
          "Query failed: " + e.getMessage(), 500, e));
    }
  }
  
  private DataResponse runSingle(final ArcSettings settings, 
                                 final String sql,
                                 final QuerySpec spec, 
                                 final TimeRange range,
                                 final QueryContext context) {
    final String expanded = MacroExpander.expand(sql, range);
    final DataFrame frame = backend.execute(settings, expanded, context);
    final List<DataFrame> frames = FramePreparer.prepare(frame, spec);
    if (frames.isEmpty()) {
      LOG.warn("Query " + spec.getRefId() + " returned no frames.");
      return DataResponse.empty();
    }
    return DataResponse.ofFrames(frames);
  }
  
  private DataResponse runSplit(final ArcSettings settings, 
                                final String sql,
                                final QuerySpec spec, 
                                final TimeRange range,
                                final SplitDuration split,
                                final QueryContext context) {
    final long start = DateTime.nanoTime();
    final ChunkPlan plan = TimeRangeSplitter.split(range, split.chunkSize());
    LOG.info("Splitting query " + spec.getRefId() + " into " + plan.size() 
        + " chunks of " + split.chunkSize());
    
    final DataFrame merged;
    try {
      merged = executor.executeQuery(settings, sql, plan, context)
          .deferred().join();
    } catch (QueryExecutionException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      context.cancel();
      throw new QueryExecutionCanceled("Interrupted waiting for chunks", 0, e);
    } catch (Exception e) {
      throw new QueryExecutionException("Split query failed: " 
          + e.getMessage(), 500, e);
    }
    
    if (merged == null) {
      LOG.warn("Split query " + spec.getRefId() + " returned no frames.");
      return DataResponse.empty();
    }
    merged.meta().setExecutedQueryString(sql);
    merged.meta().putCustom(SPLIT_CHUNKS, plan.size());
    merged.meta().putCustom(EXECUTION_TIME, 
        DateTime.msFromNanoDiff(DateTime.nanoTime(), start));
    final List<DataFrame> frames = FramePreparer.prepare(merged, spec);
    if (frames.isEmpty()) {
      return DataResponse.empty();
    }
    return DataResponse.ofFrames(frames);
  }
  
  /**
   * Checks connectivity by listing databases.
   * @param settings The non-null settings.
   * @return The result, never null.
   */
  public HealthCheckResult checkHealth(final ArcSettings settings) {
    try {
      backend.execute(settings, HEALTH_QUERY, QueryContext.newContext());
      return HealthCheckResult.ok(HEALTH_OK);
    } catch (RuntimeException e) {
      LOG.warn("Health check failed: " + e.getMessage());
      return HealthCheckResult.error("Failed to connect to Arc: " 
          + e.getMessage());
    }
  }
  
  /**
   * Parses the host's settings then checks connectivity.
   * @param json_data The settings document.
   * @param secure The decrypted secure values.
   * @return The result, never null.
   */
  public HealthCheckResult checkHealth(final JsonNode json_data, 
                                       final Map<String, String> secure) {
    final ArcSettings settings;
    try {
      settings = ArcSettings.parse(json_data, secure);
    } catch (IllegalArgumentException e) {
      return HealthCheckResult.error("failed to get settings: " 
          + e.getMessage());
    }
    return checkHealth(settings);
  }
  
  @Override
  public void close() {
    executor.cancelAll();
    if (owns_pool) {
      pool.shutdownNow();
    }
  }
}
