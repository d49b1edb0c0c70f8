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

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import net.arcquery.configuration.ArcSettings;
import net.arcquery.data.DataFrame;
import net.arcquery.data.decode.ArrowFrameDecoder;
import net.arcquery.data.decode.FrameDecoder;
import net.arcquery.data.decode.JsonFrameDecoder;
import net.arcquery.exceptions.FrameDecodeException;
import net.arcquery.exceptions.QueryExecutionCanceled;
import net.arcquery.exceptions.RemoteQueryExecutionException;
import net.arcquery.query.QueryBackend;
import net.arcquery.query.QueryContext;
import net.arcquery.utils.DateTime;
import net.arcquery.utils.JSON;
import net.arcquery.utils.SharedHttpClient;

/**
 * Runs SQL against Arc's HTTP API. The body is decoded from JSON or, when 
 * the settings ask for it, from an Arrow IPC stream read straight off the
 * connection.
 * <p>
 * Canceling the {@link QueryContext} aborts the request in flight.
 * 
 * @since 1.0
 */
public class HttpQueryBackend implements QueryBackend {
  private static final Logger LOG = 
      LoggerFactory.getLogger(HttpQueryBackend.class);
  
  public static final String JSON_PATH = "/api/v1/query";
  public static final String ARROW_PATH = "/api/v1/query/arrow";
  public static final String DATABASE_HEADER = "X-Arc-Database";
  
  private final SharedHttpClient client;
  private final FrameDecoder json_decoder;
  private final BufferAllocator allocator;
  
  /**
   * Default ctor.
   * @param client The non-null, initialized shared client.
   * @param allocator The non-null allocator Arrow responses are read into.
   */
  public HttpQueryBackend(final SharedHttpClient client, 
                          final BufferAllocator allocator) {
    if (client == null) {
      throw new IllegalArgumentException("Client cannot be null.");
    }
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null.");
    }
    this.client = client;
    this.allocator = allocator;
    json_decoder = new JsonFrameDecoder();
  }
  
  @Override
  public DataFrame execute(final ArcSettings settings, 
                           final String sql,
                           final QueryContext context) {
    if (context.isCancelled()) {
      throw new QueryExecutionCanceled("Query was canceled before it ran");
    }
    final String endpoint = endpoint(settings);
    final HttpPost post = buildRequest(settings, sql, endpoint);
    final Runnable abort = post::abort;
    context.onCancel(abort);
    
    final long start = DateTime.nanoTime();
    try (final CloseableHttpResponse response = 
            client.getClient().execute(post)) {
      final int status = response.getStatusLine().getStatusCode();
      if (status != 200) {
        final String message = ArcResponses.errorMessage(status, 
            ArcResponses.readBody(response));
        LOG.warn("Arc returned HTTP " + status + " from " + endpoint);
        throw new RemoteQueryExecutionException(message, endpoint, status);
      }
      
      final HttpEntity entity = response.getEntity();
      if (entity == null) {
        throw new RemoteQueryExecutionException(
            "Arc returned HTTP 200 with no body", endpoint, 500);
      }
      final DataFrame frame;
      try (final InputStream stream = entity.getContent()) {
        frame = decoder(settings).decode(stream);
      }
      final double elapsed = DateTime.msFromNanoDiff(DateTime.nanoTime(), start);
      frame.meta().setExecutedQueryString(sql);
      frame.meta().putCustom("executionTime", elapsed);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Arc returned " + frame.rowCount() + " rows in " 
            + elapsed + "ms for: " + sql);
      }
      return frame;
    } catch (FrameDecodeException e) {
      if (context.isCancelled()) {
        throw new QueryExecutionCanceled("Query was canceled", -1, e);
      }
      // the body stopped mid stream rather than being malformed
      if (TransportErrors.categorize(e.getCause()) != null) {
        throw TransportErrors.toException(e.getCause(), endpoint);
      }
      throw e;
    } catch (IOException e) {
      if (context.isCancelled()) {
        throw new QueryExecutionCanceled("Query was canceled", -1, e);
      }
      LOG.warn("Request to " + endpoint + " failed: " + e.getMessage());
      throw TransportErrors.toException(e, endpoint);
    } finally {
      context.removeCancelHook(abort);
    }
  }
  
  @VisibleForTesting
  static String endpoint(final ArcSettings settings) {
    return settings.url() + (settings.useArrow() ? ARROW_PATH : JSON_PATH);
  }
  
  @VisibleForTesting
  static HttpPost buildRequest(final ArcSettings settings, 
                               final String sql,
                               final String endpoint) {
    final HttpPost post = new HttpPost(endpoint);
    final int timeout_ms = settings.timeout() * 1000;
    post.setConfig(RequestConfig.custom()
        .setConnectTimeout(timeout_ms)
        .setSocketTimeout(timeout_ms)
        .setConnectionRequestTimeout(timeout_ms)
        .build());
    post.setHeader(HttpHeaders.CONTENT_TYPE, 
        ContentType.APPLICATION_JSON.getMimeType());
    post.setHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.apiKey());
    if (!Strings.isNullOrEmpty(settings.database())) {
      post.setHeader(DATABASE_HEADER, settings.database());
    }
    post.setEntity(new StringEntity(
        JSON.serializeToString(Collections.singletonMap("sql", sql)), 
        ContentType.APPLICATION_JSON));
    return post;
  }
  
  private FrameDecoder decoder(final ArcSettings settings) {
    if (settings.useArrow()) {
      return new ArrowFrameDecoder(allocator, 
          settings.timestampUnitCorrection());
    }
    return json_decoder;
  }
}
