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
package net.arcquery.query;

/**
 * A {@link QuerySpec} paired with the time range it runs over.
 * 
 * @since 1.0
 */
public class DataQuery {
  private final QuerySpec spec;
  private final TimeRange time_range;
  
  /**
   * Default ctor.
   * @param spec A non-null query.
   * @param time_range A non-null time range.
   */
  public DataQuery(final QuerySpec spec, final TimeRange time_range) {
    if (spec == null) {
      throw new IllegalArgumentException("Query spec cannot be null.");
    }
    if (time_range == null) {
      throw new IllegalArgumentException("Time range cannot be null.");
    }
    this.spec = spec;
    this.time_range = time_range;
  }
  
  /** @return The query. */
  public QuerySpec spec() {
    return spec;
  }
  
  /** @return The time range. */
  public TimeRange timeRange() {
    return time_range;
  }
  
  @Override
  public String toString() {
    return "spec={" + spec + "}, timeRange=" + time_range;
  }
}
