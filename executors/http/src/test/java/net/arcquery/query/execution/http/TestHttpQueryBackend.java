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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Matchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.channels.Channels;
import java.time.Instant;
import java.util.Arrays;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.http.HttpHeaders;
import org.apache.http.StatusLine;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import com.fasterxml.jackson.databind.JsonNode;

import net.arcquery.configuration.ArcSettings;
import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.FrameDecodeException;
import net.arcquery.exceptions.QueryExecutionCanceled;
import net.arcquery.exceptions.RemoteQueryExecutionException;
import net.arcquery.query.QueryContext;
import net.arcquery.utils.JSON;
import net.arcquery.utils.SharedHttpClient;

public class TestHttpQueryBackend {
  private static final String SQL = "SELECT time, value FROM cpu "
      + "WHERE time >= '2026-02-18T10:00:00Z' AND time < '2026-02-18T11:00:00Z'";
  private static final String JSON_BODY = "{\"columns\":[\"time\",\"value\"],"
      + "\"data\":[[\"2026-02-18T10:00:00Z\",1.5],[\"2026-02-18T10:01:00Z\",null]]}";
  
  private BufferAllocator allocator;
  private SharedHttpClient shared;
  private CloseableHttpClient client;
  private CloseableHttpResponse response;
  private StatusLine status;
  private ArcSettings settings;
  private QueryContext context;
  
  @Before
  public void before() throws Exception {
    allocator = new RootAllocator(Long.MAX_VALUE);
    shared = mock(SharedHttpClient.class);
    client = mock(CloseableHttpClient.class);
    response = mock(CloseableHttpResponse.class);
    status = mock(StatusLine.class);
    
    when(shared.getClient()).thenReturn(client);
    when(client.execute(any(HttpUriRequest.class))).thenReturn(response);
    when(response.getStatusLine()).thenReturn(status);
    when(status.getStatusCode()).thenReturn(200);
    when(response.getEntity()).thenReturn(new StringEntity(JSON_BODY));
    
    settings = ArcSettings.newBuilder()
        .setUrl("http://arc:8000/")
        .setApiKey("secret")
        .setDatabase("telemetry")
        .setTimeout(10)
        .build();
    context = QueryContext.newContext();
  }
  
  @After
  public void after() throws Exception {
    allocator.close();
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new HttpQueryBackend(null, allocator);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new HttpQueryBackend(shared, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void endpoint() throws Exception {
    assertEquals("http://arc:8000/api/v1/query", 
        HttpQueryBackend.endpoint(settings));
    assertEquals("http://arc:8000/api/v1/query/arrow", 
        HttpQueryBackend.endpoint(
            settings.toBuilder().setUseArrow(true).build()));
  }
  
  @Test
  public void buildRequest() throws Exception {
    final HttpPost post = HttpQueryBackend.buildRequest(settings, SQL, 
        "http://arc:8000/api/v1/query");
    assertEquals("http://arc:8000/api/v1/query", post.getURI().toString());
    assertEquals("application/json", 
        post.getFirstHeader(HttpHeaders.CONTENT_TYPE).getValue());
    assertEquals("Bearer secret", 
        post.getFirstHeader(HttpHeaders.AUTHORIZATION).getValue());
    assertEquals("telemetry", 
        post.getFirstHeader(HttpQueryBackend.DATABASE_HEADER).getValue());
    assertEquals(10000, post.getConfig().getSocketTimeout());
    assertEquals(10000, post.getConfig().getConnectTimeout());
    
    final JsonNode body = JSON.parseToNode(EntityUtils.toString(post.getEntity()));
    assertEquals(1, body.size());
    assertEquals(SQL, body.get("sql").asText());
  }
  
  @Test
  public void executeJson() throws Exception {
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    final DataFrame frame = backend.execute(settings, SQL, context);
    
    assertEquals(2, frame.columnCount());
    assertEquals(2, frame.rowCount());
    assertEquals(ColumnType.TIMESTAMP, frame.column(0).type());
    assertEquals(Instant.parse("2026-02-18T10:01:00Z"), 
        frame.column(0).getInstant(1));
    assertEquals(1.5, (Double) frame.column(1).get(0), 0.0001);
    assertNull(frame.column(1).get(1));
    assertEquals(SQL, frame.meta().getExecutedQueryString());
    assertTrue(frame.meta().getCustom().get("executionTime") instanceof Double);
    
    final ArgumentCaptor<HttpUriRequest> captor = 
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(client, times(1)).execute(captor.capture());
    assertEquals("http://arc:8000/api/v1/query", 
        captor.getValue().getURI().toString());
    verify(response, times(1)).close();
  }
  
  @Test
  public void executeArrow() throws Exception {
    final Schema schema = new Schema(Arrays.asList(
        Field.nullable("time", new ArrowType.Timestamp(TimeUnit.MILLISECOND, "UTC")),
        Field.nullable("value", 
            new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE))));
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (final VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
         final ArrowStreamWriter writer = new ArrowStreamWriter(root, 
             new DictionaryProvider.MapDictionaryProvider(), 
             Channels.newChannel(out))) {
      root.allocateNew();
      ((TimeStampVector) root.getVector(0)).setSafe(0, 1771408800000L);
      ((Float8Vector) root.getVector(1)).setSafe(0, 42.5);
      root.setRowCount(1);
      writer.start();
      writer.writeBatch();
      writer.end();
    }
    when(response.getEntity()).thenReturn(new ByteArrayEntity(out.toByteArray()));
    
    final ArcSettings arrow = settings.toBuilder().setUseArrow(true).build();
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    final DataFrame frame = backend.execute(arrow, SQL, context);
    assertEquals(1, frame.rowCount());
    assertEquals(Instant.ofEpochSecond(1771408800L), 
        frame.column(0).getInstant(0));
    assertEquals(42.5, (Double) frame.column(1).get(0), 0.0001);
    
    final ArgumentCaptor<HttpUriRequest> captor = 
        ArgumentCaptor.forClass(HttpUriRequest.class);
    verify(client).execute(captor.capture());
    assertEquals("http://arc:8000/api/v1/query/arrow", 
        captor.getValue().getURI().toString());
  }
  
  @Test
  public void executeErrorStatus() throws Exception {
    when(status.getStatusCode()).thenReturn(400);
    when(response.getEntity()).thenReturn(
        new StringEntity("{\"error\":\"table not found: cpu\"}"));
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals("Arc error (HTTP 400): table not found: cpu", e.getMessage());
      assertEquals(400, e.getStatusCode());
      assertEquals("http://arc:8000/api/v1/query", e.remoteEndpoint());
    }
    
    when(status.getStatusCode()).thenReturn(502);
    when(response.getEntity()).thenReturn(null);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals("Arc returned HTTP 502 with no error message", 
          e.getMessage());
      assertEquals(502, e.getStatusCode());
    }
  }
  
  @Test
  public void executeNoBody() throws Exception {
    when(response.getEntity()).thenReturn(null);
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals("Arc returned HTTP 200 with no body", e.getMessage());
      assertEquals(500, e.getStatusCode());
    }
  }
  
  @Test
  public void executeMalformedBody() throws Exception {
    when(response.getEntity()).thenReturn(new StringEntity("[1, 2]"));
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected FrameDecodeException");
    } catch (FrameDecodeException e) { }
  }
  
  @Test
  public void executeTransportFailures() throws Exception {
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    final SocketTimeoutException timeout = 
        new SocketTimeoutException("Read timed out");
    when(client.execute(any(HttpUriRequest.class))).thenThrow(timeout);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(TransportErrors.Category.TIMEOUT.message(), e.getMessage());
      assertEquals(502, e.getStatusCode());
      assertSame(timeout, e.getCause());
    }
    
    when(client.execute(any(HttpUriRequest.class))).thenThrow(
        new ConnectException("Connection refused"));
    try {
      backend.execute(settings, SQL, context);
      fail("Expected RemoteQueryExecutionException");
    } catch (RemoteQueryExecutionException e) {
      assertEquals(TransportErrors.Category.CONNECTION_REFUSED.message(), 
          e.getMessage());
    }
  }
  
  @Test
  public void executeCanceledBefore() throws Exception {
    context.cancel();
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
    verify(client, never()).execute(any(HttpUriRequest.class));
  }
  
  @Test
  public void executeCanceledInFlight() throws Exception {
    doAnswer(invocation -> {
      final HttpPost post = (HttpPost) invocation.getArguments()[0];
      context.cancel();
      assertTrue(post.isAborted());
      throw new IOException("Socket closed");
    }).when(client).execute(any(HttpUriRequest.class));
    
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    try {
      backend.execute(settings, SQL, context);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) { }
  }
  
  @Test
  public void cancelHookRemoved() throws Exception {
    final ArgumentCaptor<HttpUriRequest> captor = 
        ArgumentCaptor.forClass(HttpUriRequest.class);
    final HttpQueryBackend backend = new HttpQueryBackend(shared, allocator);
    backend.execute(settings, SQL, context);
    verify(client).execute(captor.capture());
    
    context.cancel();
    assertFalse(((HttpPost) captor.getValue()).isAborted());
  }
}
