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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import net.arcquery.query.TimeRange;
import net.arcquery.utils.DateTime;

/**
 * Decides whether and with what chunk size a query range is split. Settings
 * values:
 * <ul>
 * <li>{@code off}: never split</li>
 * <li>{@code auto} or empty: pick from the range span</li>
 * <li>{@code 1h, 6h, 12h, 1d, 3d, 7d}: fixed chunk size</li>
 * </ul>
 * Anything else disables splitting.
 * 
 * @since 1.0
 */
public final class SplitDuration {
  private static final Logger LOG = LoggerFactory.getLogger(SplitDuration.class);
  
  public static final String OFF = "off";
  public static final String AUTO = "auto";
  
  /** The decision for ranges that aren't split. */
  public static final SplitDuration DISABLED = 
      new SplitDuration(Duration.ZERO, false);
  
  /** The explicit settings. */
  private static final Map<String, Duration> EXPLICIT;
  static {
    final ImmutableMap.Builder<String, Duration> builder = 
        ImmutableMap.builder();
    for (final String value : new String[] { "1h", "6h", "12h", "1d", "3d", "7d" }) {
      builder.put(value, Duration.ofMillis(DateTime.parseDuration(value)));
    }
    EXPLICIT = builder.build();
  }
  
  private final Duration chunk_size;
  private final boolean enabled;
  
  private SplitDuration(final Duration chunk_size, final boolean enabled) {
    this.chunk_size = chunk_size;
    this.enabled = enabled;
  }
  
  /** @return The chunk size, zero when disabled. */
  public Duration chunkSize() {
    return chunk_size;
  }
  
  /** @return Whether or not the range should be split. */
  public boolean isEnabled() {
    return enabled;
  }
  
  /**
   * Resolves a settings value for the range.
   * @param setting The setting, may be null or empty for auto.
   * @param range The non-null query range.
   * @return The decision.
   */
  public static SplitDuration resolve(final String setting, 
                                      final TimeRange range) {
    final String value = Strings.nullToEmpty(setting).trim().toLowerCase();
    if (value.equals(OFF)) {
      return DISABLED;
    }
    if (value.isEmpty() || value.equals(AUTO)) {
      return auto(range.duration());
    }
    final Duration explicit = EXPLICIT.get(value);
    if (explicit == null) {
      LOG.warn("Unknown split duration [" + setting + "], not splitting.");
      return DISABLED;
    }
    return new SplitDuration(explicit, true);
  }
  
  /**
   * Picks a chunk size from the span: under 3 hours isn't split, under a 
   * day uses 1h, under a week 6h, under 30 days 1d and 7d beyond.
   * @param span The range span. Zero or negative spans aren't split.
   * @return The decision.
   */
  public static SplitDuration auto(final Duration span) {
    if (span.isNegative() || span.isZero() 
        || span.compareTo(Duration.ofHours(3)) < 0) {
      return DISABLED;
    }
    if (span.compareTo(Duration.ofHours(24)) < 0) {
      return new SplitDuration(Duration.ofHours(1), true);
    }
    if (span.compareTo(Duration.ofDays(7)) < 0) {
      return new SplitDuration(Duration.ofHours(6), true);
    }
    if (span.compareTo(Duration.ofDays(30)) < 0) {
      return new SplitDuration(Duration.ofDays(1), true);
    }
    return new SplitDuration(Duration.ofDays(7), true);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final SplitDuration other = (SplitDuration) o;
    return enabled == other.enabled 
        && Objects.equal(chunk_size, other.chunk_size);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(chunk_size, enabled);
  }
  
  @Override
  public String toString() {
    return enabled ? "split every " + chunk_size : "no split";
  }
}
