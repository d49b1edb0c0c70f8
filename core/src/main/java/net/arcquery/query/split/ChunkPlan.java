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
package net.arcquery.query.split;

import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.arcquery.query.TimeRange;

/**
 * The ordered, contiguous chunks a range is cut into. The first chunk starts
 * at the range start, the last ends at the range end and each chunk ends 
 * where the next begins.
 * 
 * @since 1.0
 */
public final class ChunkPlan implements Iterable<TimeRange> {
  private final TimeRange range;
  private final List<TimeRange> chunks;
  
  ChunkPlan(final TimeRange range, final List<TimeRange> chunks) {
    this.range = range;
    this.chunks = ImmutableList.copyOf(chunks);
  }
  
  /** @return The range that was split. */
  public TimeRange range() {
    return range;
  }
  
  /** @return The chunks in time order. */
  public List<TimeRange> chunks() {
    return chunks;
  }
  
  /** @return The number of chunks, at least one. */
  public int size() {
    return chunks.size();
  }
  
  /**
   * @param index The chunk index.
   * @return The chunk.
   */
  public TimeRange get(final int index) {
    return chunks.get(index);
  }
  
  @Override
  public Iterator<TimeRange> iterator() {
    return chunks.iterator();
  }
  
  @Override
  public String toString() {
    return chunks.toString();
  }
}
