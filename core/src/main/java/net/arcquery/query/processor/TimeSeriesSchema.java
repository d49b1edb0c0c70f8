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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.Lists;

import net.arcquery.data.Column;
import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;

/**
 * Classifies a frame's layout. The first timestamp column is the time index,
 * numeric and boolean columns hold values and string columns are factors
 * (labels). A frame with a time index and values is long if it has factors
 * and wide otherwise.
 * 
 * @since 1.0
 */
public final class TimeSeriesSchema {
  
  public static enum Kind {
    NOT_TIME_SERIES,
    WIDE,
    LONG
  }
  
  private final Kind kind;
  private final int time_index;
  private final List<Integer> value_indices;
  private final List<Integer> factor_indices;
  
  private TimeSeriesSchema(final Kind kind, 
                           final int time_index,
                           final List<Integer> value_indices, 
                           final List<Integer> factor_indices) {
    this.kind = kind;
    this.time_index = time_index;
    this.value_indices = Collections.unmodifiableList(value_indices);
    this.factor_indices = Collections.unmodifiableList(factor_indices);
  }
  
  /**
   * Inspects the frame.
   * @param frame A non-null frame.
   * @return The schema.
   */
  public static TimeSeriesSchema of(final DataFrame frame) {
    int time_index = -1;
    final List<Integer> values = Lists.newArrayList();
    final List<Integer> factors = Lists.newArrayList();
    for (int i = 0; i < frame.columnCount(); i++) {
      final Column column = frame.column(i);
      if (column.type() == ColumnType.TIMESTAMP) {
        if (time_index < 0) {
          time_index = i;
        }
      } else if (column.type().isNumeric() || column.type() == ColumnType.BOOL) {
        values.add(i);
      } else if (column.type() == ColumnType.STRING) {
        factors.add(i);
      }
    }
    final Kind kind;
    if (time_index < 0 || values.isEmpty()) {
      kind = Kind.NOT_TIME_SERIES;
    } else if (!factors.isEmpty()) {
      kind = Kind.LONG;
    } else {
      kind = Kind.WIDE;
    }
    return new TimeSeriesSchema(kind, time_index, values, factors);
  }
  
  /** @return The layout. */
  public Kind kind() {
    return kind;
  }
  
  /** @return The time column index or -1. */
  public int timeIndex() {
    return time_index;
  }
  
  /** @return The value column indices in order. */
  public List<Integer> valueIndices() {
    return value_indices;
  }
  
  /** @return The factor column indices in order. */
  public List<Integer> factorIndices() {
    return factor_indices;
  }
  
  @Override
  public String toString() {
    return "kind=" + kind + ", timeIndex=" + time_index + ", values=" 
        + value_indices + ", factors=" + factor_indices;
  }
}
