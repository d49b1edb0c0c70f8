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
import java.util.Arrays;
import java.util.Comparator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.arcquery.data.Column;
import net.arcquery.data.DataFrame;

/**
 * Puts rows in ascending time order. Sorted input, the common case, costs a
 * single scan; otherwise rows are stably sorted so rows sharing a timestamp
 * keep their relative order.
 * 
 * @since 1.0
 */
public final class TimeSorter {
  private static final Logger LOG = LoggerFactory.getLogger(TimeSorter.class);
  
  private TimeSorter() { }
  
  /**
   * @param frame A non-null frame.
   * @param time_index The index of a timestamp column.
   * @return The frame itself if already ascending, empty, ragged or holding
   * a null time, else a sorted copy sharing the name, reference ID and 
   * metadata.
   */
  public static DataFrame ensureAscending(final DataFrame frame, 
                                          final int time_index) {
    final int rows;
    try {
      rows = frame.rowCount();
    } catch (IllegalStateException e) {
      LOG.warn("Not sorting a frame with ragged columns", e);
      return frame;
    }
    if (rows < 2) {
      return frame;
    }
    final Column time = frame.column(time_index);
    final Instant[] times = new Instant[rows];
    boolean sorted = true;
    for (int i = 0; i < rows; i++) {
      times[i] = time.getInstant(i);
      if (times[i] == null) {
        return frame;
      }
      if (i > 0 && times[i].isBefore(times[i - 1])) {
        sorted = false;
      }
    }
    if (sorted) {
      return frame;
    }
    
    if (LOG.isDebugEnabled()) {
      LOG.debug("Sorting " + rows + " rows of frame " + frame.name() 
          + " by time");
    }
    final Integer[] boxed = new Integer[rows];
    for (int i = 0; i < rows; i++) {
      boxed[i] = i;
    }
    // object sorts are stable
    Arrays.sort(boxed, new Comparator<Integer>() {
      @Override
      public int compare(final Integer a, final Integer b) {
        return times[a].compareTo(times[b]);
      }
    });
    final int[] order = new int[rows];
    for (int i = 0; i < rows; i++) {
      order[i] = boxed[i];
    }
    
    final DataFrame result = new DataFrame(frame.name());
    for (final Column column : frame.columns()) {
      result.addColumn(column.reorder(order));
    }
    result.setRefId(frame.refId());
    result.meta().copyFrom(frame.meta());
    return result;
  }
}
