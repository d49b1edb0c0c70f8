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

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.arcquery.data.Column;
import net.arcquery.data.DataFrame;

/**
 * Concatenates the row-wise results of a split query, in chunk order, into
 * the first frame that has rows. Frames that don't share the base schema
 * are skipped. A column holding only nulls matches any type, so a chunk
 * where a metric is absent still contributes its rows, and a base column
 * that is all null takes the type of the first chunk with values for it.
 * The base frame is extended in place; the other inputs must not be used 
 * afterwards.
 * 
 * @since 1.0
 */
public final class FrameMerger {
  private static final Logger LOG = LoggerFactory.getLogger(FrameMerger.class);
  
  private FrameMerger() { }
  
  /**
   * Merges the frames.
   * @param frames The frames in chunk order. Entries may be null.
   * @return Null for no input, the sole frame for one input, the first 
   * non-null frame if none has rows or the extended base frame otherwise.
   */
  public static DataFrame merge(final List<DataFrame> frames) {
    if (frames == null || frames.isEmpty()) {
      return null;
    }
    if (frames.size() == 1) {
      return frames.get(0);
    }
    
    int base_index = -1;
    for (int i = 0; i < frames.size(); i++) {
      final DataFrame frame = frames.get(i);
      if (frame != null && !frame.isEmpty()) {
        base_index = i;
        break;
      }
    }
    if (base_index < 0) {
      for (final DataFrame frame : frames) {
        if (frame != null) {
          return frame;
        }
      }
      return null;
    }
    final DataFrame base = frames.get(base_index);
    
    // columns of the base that have seen a value, so their type is fixed
    final boolean[] typed = new boolean[base.columnCount()];
    for (int c = 0; c < typed.length; c++) {
      typed[c] = !base.column(c).isAllNull();
    }
    
    // count first so each column grows exactly once
    final List<DataFrame> sources = Lists.newArrayList();
    int extra = 0;
    for (int i = base_index + 1; i < frames.size(); i++) {
      final DataFrame frame = frames.get(i);
      if (frame == null) {
        continue;
      }
      final int rows;
      try {
        rows = frame.rowCount();
      } catch (IllegalStateException e) {
        LOG.warn("Skipping frame " + i + " with ragged columns", e);
        continue;
      }
      if (rows == 0) {
        continue;
      }
      if (!compatible(base, frame, typed)) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Skipping frame " + i + " with a different schema: " 
              + frame);
        }
        continue;
      }
      adoptTypes(base, frame, typed);
      sources.add(frame);
      extra += rows;
    }
    if (extra == 0) {
      return base;
    }
    
    int offset = base.rowCount();
    for (final Column column : base.columns()) {
      column.extend(extra);
    }
    for (final DataFrame frame : sources) {
      final int rows = frame.rowCount();
      for (int c = 0; c < base.columnCount(); c++) {
        final Column target = base.column(c);
        final Column source = frame.column(c);
        // an all null source may carry a different type, the slots are 
        // already null
        if (source.type() != target.type()) {
          continue;
        }
        for (int r = 0; r < rows; r++) {
          target.set(offset + r, source.get(r));
        }
      }
      offset += rows;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Merged " + (sources.size() + 1) + " frames into " 
          + base.rowCount() + " rows");
    }
    return base;
  }
  
  /**
   * Whether the frame's rows can be appended to the base. The column counts
   * must match and each column must either share the base type, hold only
   * nulls, or meet a base column that is still all null. Nulls are never
   * headed for a non-nullable column.
   * @param base The base frame.
   * @param frame The candidate frame.
   * @param typed Which base columns have seen a value.
   * @return True if the frame can be appended.
   */
  static boolean compatible(final DataFrame base, 
                            final DataFrame frame,
                            final boolean[] typed) {
    if (frame.columnCount() != base.columnCount()) {
      return false;
    }
    for (int i = 0; i < base.columnCount(); i++) {
      final Column target = base.column(i);
      final Column source = frame.column(i);
      if (!target.isNullable() && source.isNullable()) {
        return false;
      }
      if (target.type() == source.type()) {
        continue;
      }
      if (!target.isNullable()) {
        return false;
      }
      if (typed[i] && !source.isAllNull()) {
        return false;
      }
    }
    return true;
  }
  
  /** Switches all null base columns to the type of the frame's values. */
  private static void adoptTypes(final DataFrame base, 
                                 final DataFrame frame,
                                 final boolean[] typed) {
    for (int i = 0; i < typed.length; i++) {
      if (typed[i]) {
        continue;
      }
      final Column source = frame.column(i);
      if (source.isAllNull()) {
        continue;
      }
      final Column target = base.column(i);
      if (target.type() != source.type()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Column [" + target.name() + "] changes from " 
              + target.type() + " to " + source.type());
        }
        base.setColumn(i, target.withType(source.type()));
      }
      typed[i] = true;
    }
  }
}
