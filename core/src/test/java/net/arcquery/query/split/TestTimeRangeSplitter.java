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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.time.Duration;
import java.time.Instant;

import org.junit.Test;

import net.arcquery.query.TimeRange;

public class TestTimeRangeSplitter {
  
  @Test
  public void aligned() throws Exception {
    // 2026-02-18T00:00:00Z to 2026-02-19T00:00:00Z in 6h chunks
    final ChunkPlan plan = TimeRangeSplitter.split(1771372800, 1771459200, 
        Duration.ofHours(6));
    assertEquals(4, plan.size());
    assertEquals(TimeRange.ofEpochSeconds(1771372800, 1771394400), plan.get(0));
    assertEquals(TimeRange.ofEpochSeconds(1771437600, 1771459200), plan.get(3));
  }
  
  @Test
  public void unaligned() throws Exception {
    // 10:17 to 13:42 in 1h chunks
    final long from = 1771408800 + 17 * 60;
    final long to = 1771408800 + 3 * 3600 + 42 * 60;
    final ChunkPlan plan = TimeRangeSplitter.split(from, to, 
        Duration.ofHours(1));
    assertEquals(4, plan.size());
    assertEquals(TimeRange.ofEpochSeconds(from, 1771412400), plan.get(0));
    assertEquals(TimeRange.ofEpochSeconds(1771412400, 1771416000), plan.get(1));
    assertEquals(TimeRange.ofEpochSeconds(1771416000, 1771419600), plan.get(2));
    assertEquals(TimeRange.ofEpochSeconds(1771419600, to), plan.get(3));
  }
  
  @Test
  public void contiguousAndAligned() throws Exception {
    final long[][] cases = new long[][] {
      { 1771408801, 1771408801 + 86400 * 9 + 1234 },
      { 1771400000, 1771500000 },
      { 1, 999999 }
    };
    final Duration[] sizes = new Duration[] { 
        Duration.ofHours(1), Duration.ofHours(6), Duration.ofDays(1), 
        Duration.ofDays(7) };
    for (final long[] range : cases) {
      for (final Duration size : sizes) {
        final ChunkPlan plan = TimeRangeSplitter.split(range[0], range[1], size);
        assertEquals(Instant.ofEpochSecond(range[0]), plan.get(0).from());
        assertEquals(Instant.ofEpochSecond(range[1]), 
            plan.get(plan.size() - 1).to());
        for (int i = 0; i < plan.size() - 1; i++) {
          assertEquals(plan.get(i).to(), plan.get(i + 1).from());
          assertEquals(0, plan.get(i).to().getEpochSecond() % size.getSeconds());
        }
      }
    }
  }
  
  @Test
  public void singleChunk() throws Exception {
    final TimeRange range = TimeRange.ofEpochSeconds(1771408800, 1771412400);
    ChunkPlan plan = TimeRangeSplitter.split(range, Duration.ZERO);
    assertEquals(1, plan.size());
    assertSame(range, plan.get(0));
    
    plan = TimeRangeSplitter.split(range, Duration.ofHours(-1));
    assertEquals(1, plan.size());
    
    // boundary not before the end
    plan = TimeRangeSplitter.split(range, Duration.ofHours(1));
    assertEquals(1, plan.size());
    assertEquals(range, plan.get(0));
    
    plan = TimeRangeSplitter.split(range, Duration.ofDays(1));
    assertEquals(1, plan.size());
    assertSame(range, plan.range());
  }
}
