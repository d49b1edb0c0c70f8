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
package net.arcquery.data.decode;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.Test;

import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.FrameDecodeException;

public class TestJsonFrameDecoder {
  private final JsonFrameDecoder decoder = new JsonFrameDecoder();
  
  @Test
  public void decode() throws Exception {
    final DataFrame frame = decode("{\"columns\":[\"time\",\"host\",\"value\","
        + "\"up\"],\"data\":["
        + "[\"2026-02-18T10:00:00Z\",\"web01\",42.5,true],"
        + "[\"2026-02-18T10:01:00Z\",null,null,false],"
        + "[\"2026-02-18T10:02:00Z\",\"web02\",7,null]]}");
    assertEquals(4, frame.columnCount());
    assertEquals(3, frame.rowCount());
    
    assertEquals(ColumnType.TIMESTAMP, frame.column(0).type());
    assertEquals(Instant.parse("2026-02-18T10:01:00Z"), 
        frame.column(0).getInstant(1));
    assertEquals(ColumnType.STRING, frame.column(1).type());
    assertNull(frame.column(1).get(1));
    assertEquals(ColumnType.FLOAT64, frame.column(2).type());
    assertEquals(42.5, (Double) frame.column(2).get(0), 0.0001);
    assertNull(frame.column(2).get(1));
    assertEquals(7.0, (Double) frame.column(2).get(2), 0.0001);
    assertEquals(ColumnType.BOOL, frame.column(3).type());
    assertEquals(false, frame.column(3).get(1));
    assertTrue(frame.column(3).isNullable());
  }
  
  @Test
  public void inferFromFirstNonNull() throws Exception {
    final DataFrame frame = decode("{\"columns\":[\"a\"],\"data\":"
        + "[[null],[\"1.5\"]]}");
    assertEquals(ColumnType.STRING, frame.column(0).type());
    assertEquals("1.5", frame.column(0).get(1));
    
    final DataFrame all_null = decode("{\"columns\":[\"a\"],\"data\":"
        + "[[null],[null]]}");
    assertEquals(ColumnType.STRING, all_null.column(0).type());
  }
  
  @Test
  public void timestampDetection() throws Exception {
    // by value under any name
    DataFrame frame = decode("{\"columns\":[\"created\"],\"data\":"
        + "[[\"2026-02-18 10:00:00\"]]}");
    assertEquals(ColumnType.TIMESTAMP, frame.column(0).type());
    
    // by name, unparseable values become null
    frame = decode("{\"columns\":[\"_time\"],\"data\":"
        + "[[\"yesterday\"],[\"2026-02-18T10:00:00Z\"]]}");
    assertEquals(ColumnType.TIMESTAMP, frame.column(0).type());
    assertNull(frame.column(0).get(0));
    assertEquals(Instant.parse("2026-02-18T10:00:00Z"), 
        frame.column(0).getInstant(1));
    
    // numbers are always float64
    frame = decode("{\"columns\":[\"time\"],\"data\":[[1771408800]]}");
    assertEquals(ColumnType.FLOAT64, frame.column(0).type());
  }
  
  @Test
  public void fromEpoch() throws Exception {
    assertEquals(Instant.parse("2026-02-18T10:00:00Z"), 
        JsonFrameDecoder.fromEpoch(1771408800));
    assertEquals(Instant.parse("2026-02-18T10:00:00.250Z"), 
        JsonFrameDecoder.fromEpoch(1771408800.25));
    assertEquals(Instant.parse("2026-02-18T10:00:00.123Z"), 
        JsonFrameDecoder.fromEpoch(1771408800123d));
  }
  
  @Test
  public void coercionMismatch() throws Exception {
    try {
      decode("{\"columns\":[\"value\"],\"data\":[[1.0],[\"abc\"]]}");
      fail("Expected FrameDecodeException");
    } catch (FrameDecodeException e) {
      assertTrue(e.getMessage().contains("Column [value] expects FLOAT64"));
    }
    
    try {
      decode("{\"columns\":[\"up\"],\"data\":[[true],[1]]}");
      fail("Expected FrameDecodeException");
    } catch (FrameDecodeException e) { }
    
    // numeric strings are fine
    final DataFrame frame = 
        decode("{\"columns\":[\"value\"],\"data\":[[1.0],[\" 2.5 \"]]}");
    assertEquals(2.5, (Double) frame.column(0).get(1), 0.0001);
  }
  
  @Test
  public void emptyData() throws Exception {
    final DataFrame frame = decode("{\"columns\":[\"time\"],\"data\":[]}");
    assertEquals(0, frame.columnCount());
    assertTrue(frame.isEmpty());
  }
  
  @Test
  public void shapeErrors() throws Exception {
    assertDecodeError("{\"data\":[]}", "Missing 'columns' field in response");
    assertDecodeError("{\"columns\":[]}", "Missing 'data' field in response");
    assertDecodeError("{\"columns\":{},\"data\":[]}", 
        "Field 'columns' must be an array but was OBJECT");
    assertDecodeError("{\"columns\":[\"a\",\"b\"],\"data\":[[1]]}", 
        "Row 0 has 1 values but there are 2 columns");
    assertDecodeError("[1, 2]", 
        "Expected a JSON object response but got ARRAY");
    
    try {
      decode("{\"columns\": [");
      fail("Expected FrameDecodeException");
    } catch (FrameDecodeException e) {
      assertTrue(e.getMessage().startsWith("Invalid JSON response"));
      assertEquals(500, e.getStatusCode());
    }
  }
  
  private void assertDecodeError(final String json, final String message) {
    try {
      decode(json);
      fail("Expected FrameDecodeException");
    } catch (FrameDecodeException e) {
      assertEquals(message, e.getMessage());
    }
  }
  
  private DataFrame decode(final String json) {
    return decoder.decode(new ByteArrayInputStream(
        json.getBytes(StandardCharsets.UTF_8)));
  }
}
