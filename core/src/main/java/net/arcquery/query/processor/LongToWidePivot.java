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

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.arcquery.data.Column;
import net.arcquery.data.DataFrame;

/**
 * Converts a long time series frame, one row per (time, labels), into a wide
 * frame with one row per distinct timestamp and one nullable column per
 * (value column, label set). Labels come from the factor columns with nulls
 * as empty strings. Cells for series without a row at a timestamp are null;
 * no rows are invented for timestamps missing from the input.
 * <p>
 * Series columns keep the value column's name and carry the labels; they are
 * ordered by value column and then by label values.
 * 
 * @since 1.0
 */
public final class LongToWidePivot {
  
  /** Orders label value lists element by element. */
  private static final Comparator<List<String>> LABEL_ORDER = 
      new Comparator<List<String>>() {
    @Override
    public int compare(final List<String> a, final List<String> b) {
      for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
        final int cmp = a.get(i).compareTo(b.get(i));
        if (cmp != 0) {
          return cmp;
        }
      }
      return Integer.compare(a.size(), b.size());
    }
  };
  
  private LongToWidePivot() { }
  
  /**
   * Pivots the frame.
   * @param frame A non-null long frame sorted ascending by time.
   * @param schema The frame's schema.
   * @return A new wide frame sharing the input's name and reference ID.
   * @throws IllegalArgumentException if the frame isn't long, holds a null 
   * time or isn't sorted.
   */
  public static DataFrame pivot(final DataFrame frame, 
                                final TimeSeriesSchema schema) {
    if (schema.kind() != TimeSeriesSchema.Kind.LONG) {
      throw new IllegalArgumentException("Frame is not a long time series: " 
          + schema);
    }
    final int rows = frame.rowCount();
    final Column time = frame.column(schema.timeIndex());
    
    // map each input row to its output row
    final int[] wide_row = new int[rows];
    final Column wide_time = new Column(time.name(), time.type(), false);
    Instant previous = null;
    for (int i = 0; i < rows; i++) {
      final Instant ts = time.getInstant(i);
      if (ts == null) {
        throw new IllegalArgumentException("Null time at row " + i 
            + " of column " + time.name());
      }
      if (previous != null && ts.isBefore(previous)) {
        throw new IllegalArgumentException("Rows are not sorted by time at " 
            + "row " + i + ": " + ts + " < " + previous);
      }
      if (previous == null || !ts.equals(previous)) {
        wide_time.append(ts);
        previous = ts;
      }
      wide_row[i] = wide_time.size() - 1;
    }
    final int wide_rows = wide_time.size();
    
    final List<Map<List<String>, Column>> series = Lists.newArrayList();
    for (int v = 0; v < schema.valueIndices().size(); v++) {
      series.add(new TreeMap<List<String>, Column>(LABEL_ORDER));
    }
    
    for (int i = 0; i < rows; i++) {
      final List<String> label_values = 
          Lists.newArrayListWithCapacity(schema.factorIndices().size());
      for (final int factor : schema.factorIndices()) {
        label_values.add(Strings.nullToEmpty((String) frame.column(factor).get(i)));
      }
      for (int v = 0; v < schema.valueIndices().size(); v++) {
        final Column source = frame.column(schema.valueIndices().get(v));
        Column target = series.get(v).get(label_values);
        if (target == null) {
          target = new Column(source.name(), source.type(), true, 
              labels(frame, schema, label_values));
          target.extend(wide_rows);
          series.get(v).put(label_values, target);
        }
        target.set(wide_row[i], source.get(i));
      }
    }
    
    final DataFrame wide = new DataFrame(frame.name());
    wide.addColumn(wide_time);
    for (int v = 0; v < series.size(); v++) {
      if (series.get(v).isEmpty()) {
        final Column source = frame.column(schema.valueIndices().get(v));
        wide.addColumn(new Column(source.name(), source.type(), true));
        continue;
      }
      for (final Column column : series.get(v).values()) {
        wide.addColumn(column);
      }
    }
    wide.setRefId(frame.refId());
    wide.meta().copyFrom(frame.meta());
    return wide;
  }
  
  private static Map<String, String> labels(final DataFrame frame, 
                                            final TimeSeriesSchema schema,
                                            final List<String> values) {
    final Map<String, String> labels = Maps.newLinkedHashMap();
    for (int f = 0; f < schema.factorIndices().size(); f++) {
      labels.put(frame.column(schema.factorIndices().get(f)).name(), 
          values.get(f));
    }
    return labels;
  }
}
