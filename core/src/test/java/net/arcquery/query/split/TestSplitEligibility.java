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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.arcquery.query.split.SplitEligibility.Reason;

public class TestSplitEligibility {

  @Test
  public void eligible() throws Exception {
    assertNull(SplitEligibility.analyze(
        "SELECT time, value FROM cpu WHERE $__timeFilter(time)", "A"));
    assertNull(SplitEligibility.analyze("SELECT $__timeGroup(time, '1h') AS t, "
        + "avg(value) FROM cpu WHERE $__timeFilter(time) GROUP BY 1", "A"));
    assertNull(SplitEligibility.analyze(
        "SELECT * FROM cpu WHERE time > $__timeFrom()", "A"));
  }
  
  @Test
  public void limit() throws Exception {
    assertEquals(Reason.LIMIT, SplitEligibility.analyze(
        "SELECT * FROM cpu WHERE $__timeFilter(time) limit 10", "A"));
    assertTrue(SplitEligibility.containsLimit("SELECT * FROM t LIMIT 5"));
    assertFalse(SplitEligibility.containsLimit("SELECT limited FROM t"));
    assertFalse(SplitEligibility.containsLimit("SELECT * FROM rate_limits"));
  }
  
  @Test
  public void aggregation() throws Exception {
    assertEquals(Reason.AGGREGATION_WITHOUT_TIME_GROUP, 
        SplitEligibility.analyze("SELECT host, avg(value) FROM cpu WHERE "
            + "$__timeFilter(time) GROUP BY host", "A"));
    assertTrue(SplitEligibility.containsAggregationWithoutTimeGroup(
        "SELECT DISTINCT host FROM cpu"));
    assertTrue(SplitEligibility.containsAggregationWithoutTimeGroup(
        "SELECT COUNT (*) FROM cpu"));
    assertTrue(SplitEligibility.containsAggregationWithoutTimeGroup(
        "SELECT approx_count_distinct(host) FROM cpu"));
    assertTrue(SplitEligibility.containsAggregationWithoutTimeGroup(
        "SELECT row_number() OVER (PARTITION BY host) FROM cpu"));
    assertFalse(SplitEligibility.containsAggregationWithoutTimeGroup(
        "SELECT time, value FROM cpu"));
  }
  
  @Test
  public void noTimeFilter() throws Exception {
    assertEquals(Reason.NO_TIME_FILTER, 
        SplitEligibility.analyze("SELECT time, value FROM cpu", "A"));
    assertTrue(SplitEligibility.referencesTimeRange(
        "SELECT * FROM cpu WHERE time < $__timeTo()"));
  }
  
  @Test
  public void union() throws Exception {
    assertEquals(Reason.UNION, SplitEligibility.analyze(
        "SELECT time FROM a WHERE $__timeFilter(time) UNION ALL "
        + "SELECT time FROM b WHERE $__timeFilter(time)", "A"));
    assertFalse(SplitEligibility.containsUnion("SELECT reunion FROM t"));
  }
  
  @Test
  public void firstReasonWins() throws Exception {
    assertEquals(Reason.LIMIT, SplitEligibility.analyze(
        "SELECT count(*) FROM cpu LIMIT 1", "A"));
  }
}
