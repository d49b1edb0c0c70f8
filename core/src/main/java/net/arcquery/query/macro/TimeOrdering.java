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
package net.arcquery.query.macro;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

/**
 * Appends {@code ORDER BY time ASC} to time series SQL that doesn't order
 * its rows, so the engine returns them in the order the sorter expects and
 * the client side sort stays a linear check.
 * 
 * @since 1.0
 */
public final class TimeOrdering {
  public static final String ORDER_CLAUSE = " ORDER BY time ASC";
  
  private static final CharMatcher TRAILING = CharMatcher.anyOf(" \t\n\r;");
  
  private TimeOrdering() { }
  
  /**
   * Adds the ordering clause when the SQL has no {@code ORDER BY} and 
   * mentions {@code time}. The clause is placed before a trailing 
   * {@code LIMIT} or {@code OFFSET}; trailing semicolons are dropped.
   * @param sql The SQL, may be null.
   * @return The rewritten or original SQL.
   */
  public static String apply(final String sql) {
    if (Strings.isNullOrEmpty(sql)) {
      return sql;
    }
    final String lower = sql.toLowerCase();
    if (lower.contains("order by") || !lower.contains("time")) {
      return sql;
    }
    final String trimmed = TRAILING.trimTrailingFrom(sql);
    final String trimmed_lower = trimmed.toLowerCase();
    final int limit = trimmed_lower.lastIndexOf(" limit ");
    final int offset = trimmed_lower.lastIndexOf(" offset ");
    
    int insert = trimmed.length();
    if (limit >= 0 && (offset < 0 || limit < offset)) {
      insert = limit;
    } else if (offset >= 0) {
      insert = offset;
    }
    return trimmed.substring(0, insert) + ORDER_CLAUSE 
        + trimmed.substring(insert);
  }
}
