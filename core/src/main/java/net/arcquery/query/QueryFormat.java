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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Strings;

/**
 * The result format a query asks for. Only an exact {@code time_series} 
 * orders the SQL by time; a missing or unknown format is shaped like a time
 * series but runs the SQL as written.
 * 
 * @since 1.0
 */
public enum QueryFormat {
  TIME_SERIES("time_series"),
  TABLE("table"),
  /** Missing or not one of the known names. */
  UNSPECIFIED("");
  
  private final String name;
  
  QueryFormat(final String name) {
    this.name = name;
  }
  
  /** @return The wire name, e.g. {@code time_series}. */
  @JsonValue
  public String wireName() {
    return name;
  }
  
  /**
   * Resolves a wire name. Names are matched exactly.
   * @param name The name, may be null.
   * @return The format, {@link #UNSPECIFIED} for null, empty or unknown 
   * names.
   */
  @JsonCreator
  public static QueryFormat fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      return UNSPECIFIED;
    }
    for (final QueryFormat format : values()) {
      if (format != UNSPECIFIED && format.name.equals(name)) {
        return format;
      }
    }
    return UNSPECIFIED;
  }
}
