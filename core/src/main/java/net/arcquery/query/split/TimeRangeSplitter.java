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

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.google.common.collect.Lists;

import net.arcquery.query.TimeRange;

/**
 * Cuts a range into chunks whose internal boundaries are multiples of the 
 * chunk size counted from the Unix epoch, so the same wall clock buckets are
 * produced no matter where the range starts. Only the first and last chunk
 * can be partial.
 * 
 * @since 1.0
 */
public final class TimeRangeSplitter {
  
  private TimeRangeSplitter() { }
  
  /**
   * Splits the range.
   * @param range The non-null range.
   * @param chunk_size The chunk size. Zero, negative or sub-second sizes yield
   * one chunk.
   * @return The plan, never empty.
   */
  public static ChunkPlan split(final TimeRange range, 
                                final Duration chunk_size) {
    final long chunk_seconds = chunk_size == null ? 0 : chunk_size.getSeconds();
    final List<TimeRange> chunks = Lists.newArrayList();
    if (chunk_seconds <= 0) {
      chunks.add(range);
      return new ChunkPlan(range, chunks);
    }
    
    final Instant from = range.from();
    final Instant to = range.to();
    Instant boundary = Instant.ofEpochSecond(
        (Math.floorDiv(from.getEpochSecond(), chunk_seconds) + 1) * chunk_seconds);
    if (!boundary.isBefore(to)) {
      chunks.add(range);
      return new ChunkPlan(range, chunks);
    }
    
    chunks.add(new TimeRange(from, boundary));
    while (boundary.isBefore(to)) {
      Instant end = boundary.plusSeconds(chunk_seconds);
      if (end.isAfter(to)) {
        end = to;
      }
      chunks.add(new TimeRange(boundary, end));
      boundary = end;
    }
    return new ChunkPlan(range, chunks);
  }
  
  /**
   * Helper for the epoch second form.
   * @param from The inclusive start in epoch seconds.
   * @param to The exclusive end in epoch seconds.
   * @param chunk_size The chunk size.
   * @return The plan.
   */
  public static ChunkPlan split(final long from, 
                                final long to, 
                                final Duration chunk_size) {
    return split(TimeRange.ofEpochSeconds(from, to), chunk_size);
  }
}
