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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.arcquery.query.TimeRange;
import net.arcquery.utils.DateTime;

/**
 * Rewrites the time macros in a SQL template into literal SQL for a given
 * chunk. Supported macros:
 * <ul>
 * <li>{@code $__timeFilter(col)}: {@code col >= '<from>' AND col < '<to>'}</li>
 * <li>{@code $__timeFrom()} and {@code $__timeTo()}: quoted bounds</li>
 * <li>{@code $__interval}: a bucket width derived from the original range</li>
 * <li>{@code $__timeGroup(col, 'interval')}: epoch aligned bucketing</li>
 * </ul>
 * Bounds are RFC 3339 UTC at second precision. Macros that can't be parsed
 * are left in place and logged, never thrown. Expanding already expanded SQL
 * is a no-op.
 * 
 * @since 1.0
 */
public final class MacroExpander {
  private static final Logger LOG = LoggerFactory.getLogger(MacroExpander.class);
  
  public static final String TIME_FILTER = "$__timeFilter(";
  public static final String TIME_FROM = "$__timeFrom()";
  public static final String TIME_TO = "$__timeTo()";
  public static final String INTERVAL = "$__interval";
  public static final String TIME_GROUP = "$__timeGroup(";
  
  /** Used when {@code $__timeFilter()} has no argument. */
  public static final String DEFAULT_TIME_COLUMN = "time";
  
  /** Used when a {@code $__timeGroup} interval isn't in the table. */
  public static final long DEFAULT_GROUP_SECONDS = 3600;
  
  /** Doesn't match longer identifiers such as {@code $__interval_ms}. */
  private static final Pattern INTERVAL_PATTERN = 
      Pattern.compile(Pattern.quote(INTERVAL) + "(?![A-Za-z0-9_])");
  
  /** Interval spellings to seconds. */
  private static final Map<String, Long> INTERVALS = 
      ImmutableMap.<String, Long>builder()
        .put("1s", 1L)
        .put("1 second", 1L)
        .put("5s", 5L)
        .put("5 seconds", 5L)
        .put("10s", 10L)
        .put("10 seconds", 10L)
        .put("30s", 30L)
        .put("30 seconds", 30L)
        .put("1m", 60L)
        .put("1 minute", 60L)
        .put("5m", 300L)
        .put("5 minutes", 300L)
        .put("10m", 600L)
        .put("10 minutes", 600L)
        .put("15m", 900L)
        .put("15 minutes", 900L)
        .put("30m", 1800L)
        .put("30 minutes", 1800L)
        .put("1h", 3600L)
        .put("1 hour", 3600L)
        .put("6h", 21600L)
        .put("6 hours", 21600L)
        .put("12h", 43200L)
        .put("12 hours", 43200L)
        .put("1d", 86400L)
        .put("1 day", 86400L)
        .build();
  
  private MacroExpander() { }
  
  /**
   * Expands the macros for an unsplit query.
   * @param sql The SQL template, may be null.
   * @param range The non-null range.
   * @return The expanded SQL.
   */
  public static String expand(final String sql, final TimeRange range) {
    return expand(sql, range, range);
  }
  
  /**
   * Expands the macros for one chunk of a split query. {@code $__interval} is
   * derived from the original range so every chunk buckets the same way.
   * @param sql The SQL template, may be null.
   * @param chunk The non-null chunk bounds for filters.
   * @param original The non-null range the caller asked for.
   * @return The expanded SQL.
   */
  public static String expand(final String sql, 
                              final TimeRange chunk, 
                              final TimeRange original) {
    if (Strings.isNullOrEmpty(sql)) {
      return sql;
    }
    final String from = quote(DateTime.formatRfc3339(chunk.from()));
    final String to = quote(DateTime.formatRfc3339(chunk.to()));
    
    String result = expandCalls(sql, TIME_FILTER, new MacroFunction() {
      @Override
      public String expand(final String args) {
        String column = args.trim();
        if (column.isEmpty()) {
          LOG.warn("No column given to " + TIME_FILTER + "), defaulting to '" 
              + DEFAULT_TIME_COLUMN + "'");
          column = DEFAULT_TIME_COLUMN;
        }
        return column + " >= " + from + " AND " + column + " < " + to;
      }
    });
    
    result = result.replace(TIME_FROM, from);
    result = result.replace(TIME_TO, to);
    result = INTERVAL_PATTERN.matcher(result).replaceAll(
        Matcher.quoteReplacement(interval(original.duration())));
    
    result = expandCalls(result, TIME_GROUP, new MacroFunction() {
      @Override
      public String expand(final String args) {
        final List<String> parts = splitArguments(args);
        if (parts.size() != 2 || parts.get(0).trim().isEmpty()) {
          LOG.warn("Invalid " + TIME_GROUP + ") arguments, expected a column "
              + "and an interval: [" + args + "]");
          return null;
        }
        final String column = parts.get(0).trim();
        final long seconds = intervalSeconds(parts.get(1));
        return "to_timestamp((epoch_ns(" + column + ") // 1000000000 // " 
            + seconds + ") * " + seconds + ")";
      }
    });
    
    if (LOG.isTraceEnabled()) {
      LOG.trace("Expanded [" + sql + "] to [" + result + "]");
    }
    return result;
  }
  
  /**
   * The auto interval for a query range.
   * @param range The span of the original query.
   * @return The interval as SQL interval text.
   */
  public static String interval(final Duration range) {
    if (range.compareTo(Duration.ofDays(7)) > 0) {
      return "1 hour";
    }
    if (range.compareTo(Duration.ofDays(1)) > 0) {
      return "10 minutes";
    }
    if (range.compareTo(Duration.ofHours(6)) > 0) {
      return "1 minute";
    }
    return "10 seconds";
  }
  
  /**
   * Resolves an interval spelling, with or without quotes, to seconds.
   * @param interval The interval text, e.g. {@code '1h'} or {@code 10 minutes}.
   * @return The seconds or {@link #DEFAULT_GROUP_SECONDS} if unknown.
   */
  public static long intervalSeconds(final String interval) {
    String cleaned = Strings.nullToEmpty(interval).trim();
    cleaned = cleaned.replace("'", "").replace("\"", "").trim().toLowerCase();
    final Long seconds = INTERVALS.get(cleaned);
    if (seconds == null) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Unknown group interval [" + interval + "], using " 
            + DEFAULT_GROUP_SECONDS + "s");
      }
      return DEFAULT_GROUP_SECONDS;
    }
    return seconds;
  }
  
  /** Produces the replacement for a macro's argument text or null to leave
   * the macro as is. */
  interface MacroFunction {
    String expand(final String args);
  }
  
  /**
   * Replaces every call of the macro, left to right. Arguments end at the
   * balanced closing parenthesis, ignoring parentheses in string literals.
   * An unterminated call stops the scan and leaves the rest untouched.
   */
  static String expandCalls(final String sql, 
                            final String prefix, 
                            final MacroFunction function) {
    int start = sql.indexOf(prefix);
    if (start < 0) {
      return sql;
    }
    final StringBuilder buf = new StringBuilder(sql.length() + 64);
    int position = 0;
    while (start >= 0) {
      final int open = start + prefix.length() - 1;
      final int close = findClose(sql, open);
      if (close < 0) {
        LOG.warn("Unterminated " + prefix + " macro in SQL, leaving it as is");
        break;
      }
      buf.append(sql, position, start);
      final String replacement = function.expand(sql.substring(open + 1, close));
      if (replacement == null) {
        buf.append(sql, start, close + 1);
      } else {
        buf.append(replacement);
      }
      position = close + 1;
      start = sql.indexOf(prefix, position);
    }
    buf.append(sql, position, sql.length());
    return buf.toString();
  }
  
  /** @return The index of the parenthesis closing the one at {@code open} or
   * -1 if there isn't one. */
  static int findClose(final String sql, final int open) {
    int depth = 0;
    boolean in_string = false;
    for (int i = open; i < sql.length(); i++) {
      final char c = sql.charAt(i);
      if (c == '\'') {
        in_string = !in_string;
      } else if (!in_string) {
        if (c == '(') {
          depth++;
        } else if (c == ')') {
          depth--;
          if (depth == 0) {
            return i;
          }
        }
      }
    }
    return -1;
  }
  
  /** Splits on top level commas only. */
  static List<String> splitArguments(final String args) {
    final List<String> parts = Lists.newArrayList();
    int depth = 0;
    boolean in_string = false;
    int last = 0;
    for (int i = 0; i < args.length(); i++) {
      final char c = args.charAt(i);
      if (c == '\'') {
        in_string = !in_string;
      } else if (!in_string) {
        if (c == '(') {
          depth++;
        } else if (c == ')') {
          depth--;
        } else if (c == ',' && depth == 0) {
          parts.add(args.substring(last, i));
          last = i + 1;
        }
      }
    }
    parts.add(args.substring(last));
    return parts;
  }
  
  private static String quote(final String value) {
    return "'" + value + "'";
  }
}
