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
package net.arcquery.query.processor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import net.arcquery.data.Column;
import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;
import net.arcquery.data.decode.JsonFrameDecoder;
import net.arcquery.utils.JSON;

public class TestFrameMerger {

  @Test
  public void emptyAndSingle() throws Exception {
    assertNull(FrameMerger.merge(null));
    assertNull(FrameMerger.merge(Collections.<DataFrame>emptyList()));
    
    final DataFrame frame = frame(0, 1.0, 2.0);
    assertSame(frame, FrameMerger.merge(Collections.singletonList(frame)));
  }
  
  @Test
  public void chunkOrder() throws Exception {
    final DataFrame a = frame(0, 1.0, 2.0);
    final DataFrame b = frame(120, 3.0);
    final DataFrame c = frame(180, 4.0, 5.0);
    final DataFrame merged = FrameMerger.merge(Arrays.asList(a, b, c));
    assertSame(a, merged);
    assertEquals(5, merged.rowCount());
    for (int i = 0; i < 5; i++) {
      assertEquals((double) (i + 1), (Double) merged.column(1).get(i), 0.0001);
    }
    assertEquals(Instant.ofEpochSecond(240), merged.column(0).getInstant(4));
  }
  
  @Test
  public void skipsEmptyLeadingAndNulls() throws Exception {
    final DataFrame empty = new DataFrame("A");
    final DataFrame b = frame(0, 1.0);
    final DataFrame c = frame(60, 2.0);
    final DataFrame merged = 
        FrameMerger.merge(Arrays.asList(empty, null, b, null, c));
    assertSame(b, merged);
    assertEquals(2, merged.rowCount());
    
    // an empty frame with columns isn't the base either
    final DataFrame no_rows = frame(0);
    assertSame(b, FrameMerger.merge(Arrays.asList(no_rows, b)));
  }
  
  @Test
  public void allEmpty() throws Exception {
    final DataFrame empty = new DataFrame("A");
    assertSame(empty, FrameMerger.merge(Arrays.asList(null, empty, null)));
    assertNull(FrameMerger.merge(Arrays.<DataFrame>asList(null, null)));
  }
  
  @Test
  public void skipsMismatchedSchema() throws Exception {
    final DataFrame a = frame(0, 1.0);
    final DataFrame extra_column = frame(60, 9.0);
    final Column host = new Column("host", ColumnType.STRING, true);
    host.append("web01");
    extra_column.addColumn(host);
    
    final DataFrame wrong_type = new DataFrame("A");
    final Column time = new Column("time", ColumnType.TIMESTAMP, false);
    time.append(Instant.ofEpochSecond(120));
    final Column value = new Column("value", ColumnType.STRING, true);
    value.append("nope");
    wrong_type.addColumn(time).addColumn(value);
    
    final DataFrame c = frame(180, 2.0);
    final DataFrame merged = 
        FrameMerger.merge(Arrays.asList(a, extra_column, wrong_type, c));
    assertEquals(2, merged.rowCount());
    assertEquals(2, merged.columnCount());
    assertEquals(2.0, (Double) merged.column(1).get(1), 0.0001);
  }
  
  @Test
  public void skipsNullableIntoNonNullable() throws Exception {
    final DataFrame a = new DataFrame("A");
    final Column strict = new Column("value", ColumnType.INT64, false);
    strict.append(1L);
    a.addColumn(strict);
    
    final DataFrame b = new DataFrame("A");
    final Column loose = new Column("value", ColumnType.INT64, true);
    loose.append(null);
    b.addColumn(loose);
    
    assertEquals(1, FrameMerger.merge(Arrays.asList(a, b)).rowCount());
  }
  
  @Test
  public void keepsChunkWithAllNullColumn() throws Exception {
    final JsonFrameDecoder decoder = new JsonFrameDecoder();
    final DataFrame a = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"cpu\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:00:00Z\",1.0,5.0],"
        + "[\"2026-02-18T10:01:00Z\",2.0,6.0]]}"));
    final DataFrame b = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"cpu\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:02:00Z\",3.0,null],"
        + "[\"2026-02-18T10:03:00Z\",4.0,null]]}"));
    assertEquals(ColumnType.STRING, b.column(2).type());
    
    final DataFrame merged = FrameMerger.merge(Arrays.asList(a, b));
    assertEquals(4, merged.rowCount());
    assertEquals(ColumnType.FLOAT64, merged.column(2).type());
    assertEquals(3.0, (Double) merged.column(1).get(2), 0.0001);
    assertEquals(4.0, (Double) merged.column(1).get(3), 0.0001);
    assertEquals(6.0, (Double) merged.column(2).get(1), 0.0001);
    assertNull(merged.column(2).get(2));
    assertNull(merged.column(2).get(3));
    assertEquals(Instant.parse("2026-02-18T10:03:00Z"), 
        merged.column(0).getInstant(3));
  }
  
  @Test
  public void allNullBaseColumnTakesLaterType() throws Exception {
    final JsonFrameDecoder decoder = new JsonFrameDecoder();
    final DataFrame a = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:00:00Z\",null]]}"));
    final DataFrame b = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:01:00Z\",null]]}"));
    final DataFrame c = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:02:00Z\",7.5]]}"));
    final DataFrame d = decoder.decode(JSON.parseToNode(
        "{\"columns\":[\"time\",\"mem\"],\"data\":["
        + "[\"2026-02-18T10:03:00Z\",\"oops\"]]}"));
    
    final DataFrame merged = FrameMerger.merge(Arrays.asList(a, b, c, d));
    assertSame(a, merged);
    // the string chunk comes after the column was typed so it is dropped
    assertEquals(3, merged.rowCount());
    assertEquals(ColumnType.FLOAT64, merged.column(1).type());
    assertNull(merged.column(1).get(0));
    assertNull(merged.column(1).get(1));
    assertEquals(7.5, (Double) merged.column(1).get(2), 0.0001);
  }
  
  @Test
  public void allNullIntoNonNullableSkipped() throws Exception {
    final DataFrame a = frame(0, 1.0);
    final DataFrame b = new DataFrame("A");
    final Column time = new Column("time", ColumnType.TIMESTAMP, true);
    time.append(null);
    final Column value = new Column("value", ColumnType.STRING, true);
    value.append(null);
    b.addColumn(time).addColumn(value);
    
    assertEquals(1, FrameMerger.merge(Arrays.asList(a, b)).rowCount());
  }
  
  /** A time and value frame with rows a minute apart. */
  static DataFrame frame(final long start, final double... values) {
    final Column time = new Column("time", ColumnType.TIMESTAMP, false);
    final Column value = new Column("value", ColumnType.FLOAT64, true);
    for (int i = 0; i < values.length; i++) {
      time.append(Instant.ofEpochSecond(start + i * 60));
      value.append(values[i]);
    }
    final DataFrame frame = new DataFrame("A");
    frame.addColumn(time).addColumn(value);
    return frame;
  }
}
