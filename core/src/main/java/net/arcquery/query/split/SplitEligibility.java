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

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.arcquery.query.macro.MacroExpander;

/**
 * Decides whether a SQL template can be split by time without changing its
 * answer. Splitting is refused when a chunk-local result would differ from
 * the global one. The checks are conservative text scans: a false positive
 * only costs performance, a false negative returns wrong data.
 * 
 * @since 1.0
 */
public final class SplitEligibility {
  private static final Logger LOG = 
      LoggerFactory.getLogger(SplitEligibility.class);
  
  /** Why a query can't be split. */
  public static enum Reason {
    /** LIMIT would apply per chunk. */
    LIMIT("query has a LIMIT"),
    
    /** Aggregates would be computed per chunk. */
    AGGREGATION_WITHOUT_TIME_GROUP("aggregation without " 
        + MacroExpander.TIME_GROUP + ")"),
    
    /** The query ignores the time range so each chunk returns the same. */
    NO_TIME_FILTER("query has no time filter"),
    
    /** Macros in compound statements aren't safe to rewrite per chunk. */
    UNION("UNION query");
    
    private final String description;
    
    Reason(final String description) {
      this.description = description;
    }
    
    /** @return A readable description. */
    public String description() {
      return description;
    }
  }
  
  /** Aggregate functions, matched as {@code NAME(} with optional whitespace. */
  static final List<String> AGGREGATE_FUNCTIONS = ImmutableList.of(
      "SUM", "FSUM", "COUNT", "COUNTIF", "AVG", "FAVG", "MIN", "MAX", 
      "ANY_VALUE", "ARG_MIN", "ARG_MIN_NULL", "ARG_MAX", "ARG_MAX_NULL", 
      "FIRST", "LAST", "PRODUCT", "STRING_AGG", "LIST", "ARRAY_AGG", 
      "BOOL_AND", "BOOL_OR", "BIT_AND", "BIT_OR", "BIT_XOR", "BITSTRING_AGG",
      "GEOMETRIC_MEAN", "WEIGHTED_AVG", "MEDIAN", "MODE", "MAD", "STDDEV", 
      "STDDEV_POP", "STDDEV_SAMP", "VARIANCE", "VAR_POP", "VAR_SAMP", 
      "SKEWNESS", "SKEWNESS_POP", "KURTOSIS", "KURTOSIS_POP", "ENTROPY", 
      "CORR", "COVAR_POP", "COVAR_SAMP", "QUANTILE", "QUANTILE_CONT", 
      "QUANTILE_DISC", "HISTOGRAM", "HISTOGRAM_EXACT", "HISTOGRAM_VALUES", 
      "APPROX_COUNT_DISTINCT", "APPROX_QUANTILE", "APPROX_TOP_K", 
      "RESERVOIR_QUANTILE", "REGR_AVGX", "REGR_AVGY", "REGR_COUNT", 
      "REGR_INTERCEPT", "REGR_R2", "REGR_SLOPE", "REGR_SXX", "REGR_SXY", 
      "REGR_SYY");
  
  private static final Pattern LIMIT_PATTERN = 
      Pattern.compile("\\bLIMIT\\b", Pattern.CASE_INSENSITIVE);
  
  private static final Pattern GROUP_BY_PATTERN = 
      Pattern.compile("\\bGROUP\\s+BY\\b", Pattern.CASE_INSENSITIVE);
  
  /** DISTINCT followed by whitespace, a parenthesis or the end. */
  private static final Pattern DISTINCT_PATTERN = 
      Pattern.compile("DISTINCT(\\s|\\(|$)", Pattern.CASE_INSENSITIVE);
  
  /** Substring semantics on purpose: {@code ARG_MIN(} also hits {@code MIN(}. */
  private static final Pattern AGGREGATE_PATTERN = Pattern.compile(
      "(" + Joiner.on('|').join(AGGREGATE_FUNCTIONS) + ")\\s*\\(", 
      Pattern.CASE_INSENSITIVE);
  
  private static final Pattern WINDOW_PATTERN = 
      Pattern.compile("\\bOVER\\s*\\(", Pattern.CASE_INSENSITIVE);
  
  private static final Pattern UNION_PATTERN = 
      Pattern.compile("\\bUNION\\b", Pattern.CASE_INSENSITIVE);
  
  private SplitEligibility() { }
  
  /**
   * Runs the checks in order and returns the first that blocks splitting.
   * @param sql The SQL template with macros.
   * @param ref_id The query reference ID for logging.
   * @return The blocking reason or null if the query can be split.
   */
  public static Reason analyze(final String sql, final String ref_id) {
    final String text = Strings.nullToEmpty(sql);
    final Reason reason;
    if (containsLimit(text)) {
      reason = Reason.LIMIT;
    } else if (containsAggregationWithoutTimeGroup(text)) {
      reason = Reason.AGGREGATION_WITHOUT_TIME_GROUP;
    } else if (!referencesTimeRange(text)) {
      reason = Reason.NO_TIME_FILTER;
    } else if (containsUnion(text)) {
      reason = Reason.UNION;
    } else {
      return null;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Skipping split for query " + ref_id + ": " 
          + reason.description());
    }
    return reason;
  }
  
  /**
   * @param sql The non-null SQL.
   * @return True if the SQL has a standalone LIMIT keyword in any case.
   */
  public static boolean containsLimit(final String sql) {
    return LIMIT_PATTERN.matcher(sql).find();
  }
  
  /**
   * @param sql The non-null SQL.
   * @return True if the SQL groups, de-duplicates, aggregates or uses a 
   * window function without bucketing by {@code $__timeGroup}.
   */
  public static boolean containsAggregationWithoutTimeGroup(final String sql) {
    if (sql.contains(MacroExpander.TIME_GROUP)) {
      return false;
    }
    return GROUP_BY_PATTERN.matcher(sql).find()
        || DISTINCT_PATTERN.matcher(sql).find()
        || AGGREGATE_PATTERN.matcher(sql).find()
        || WINDOW_PATTERN.matcher(sql).find();
  }
  
  /**
   * @param sql The non-null SQL.
   * @return True if the SQL uses the time filter or a time bound macro.
   */
  public static boolean referencesTimeRange(final String sql) {
    return sql.contains("$__timeFilter") 
        || sql.contains("$__timeFrom") 
        || sql.contains("$__timeTo");
  }
  
  /**
   * @param sql The non-null SQL.
   * @return True if the SQL has a UNION keyword.
   */
  public static boolean containsUnion(final String sql) {
    return UNION_PATTERN.matcher(sql).find();
  }
}
