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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.time.Duration;

import org.junit.Test;

import net.arcquery.query.TimeRange;

public class TestSplitDuration {
  private static final long START = 1771113600;
  
  @Test
  public void auto() throws Exception {
    assertFalse(SplitDuration.auto(Duration.ofHours(2)).isEnabled());
    assertEquals(Duration.ofHours(1), 
        SplitDuration.auto(Duration.ofHours(3)).chunkSize());
    assertEquals(Duration.ofHours(1), 
        SplitDuration.auto(Duration.ofHours(12)).chunkSize());
    assertEquals(Duration.ofHours(6), 
        SplitDuration.auto(Duration.ofDays(3)).chunkSize());
    assertEquals(Duration.ofDays(1), 
        SplitDuration.auto(Duration.ofDays(14)).chunkSize());
    assertEquals(Duration.ofDays(7), 
        SplitDuration.auto(Duration.ofDays(45)).chunkSize());
    assertFalse(SplitDuration.auto(Duration.ZERO).isEnabled());
  }
  
  @Test
  public void resolve() throws Exception {
    final TimeRange twelve_hours = range(12 * 3600);
    assertEquals(Duration.ofHours(1), 
        SplitDuration.resolve("auto", twelve_hours).chunkSize());
    assertEquals(Duration.ofHours(1), 
        SplitDuration.resolve(null, twelve_hours).chunkSize());
    assertEquals(Duration.ofHours(1), 
        SplitDuration.resolve("", twelve_hours).chunkSize());
    assertSame(SplitDuration.DISABLED, 
        SplitDuration.resolve("off", twelve_hours));
    assertSame(SplitDuration.DISABLED, 
        SplitDuration.resolve("OFF", twelve_hours));
    
    // explicit ignores the span
    final TimeRange two_hours = range(2 * 3600);
    assertTrue(SplitDuration.resolve("1h", two_hours).isEnabled());
    assertEquals(Duration.ofHours(6), 
        SplitDuration.resolve("6h", two_hours).chunkSize());
    assertEquals(Duration.ofHours(12), 
        SplitDuration.resolve("12h", two_hours).chunkSize());
    assertEquals(Duration.ofDays(1), 
        SplitDuration.resolve("1d", two_hours).chunkSize());
    assertEquals(Duration.ofDays(3), 
        SplitDuration.resolve("3d", two_hours).chunkSize());
    assertEquals(Duration.ofDays(7), 
        SplitDuration.resolve("7d", two_hours).chunkSize());
    
    assertFalse(SplitDuration.resolve("2h", twelve_hours).isEnabled());
    assertFalse(SplitDuration.resolve("bogus", twelve_hours).isEnabled());
  }
  
  private static TimeRange range(final long seconds) {
    return TimeRange.ofEpochSeconds(START, START + seconds);
  }
}
