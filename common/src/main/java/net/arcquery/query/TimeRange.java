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

import java.time.Duration;
import java.time.Instant;

import com.google.common.base.Objects;

import net.arcquery.utils.DateTime;

/**
 * An immutable, half open time interval {@code [from, to)}. Used both for
 * the range the caller asked for and for the chunks a split query is cut
 * into.
 * 
 * @since 1.0
 */
public final class TimeRange {
  /** The inclusive start. */
  private final Instant from;
  
  /** The exclusive end. */
  private final Instant to;
  
  /**
   * Default ctor.
   * @param from The non-null inclusive start.
   * @param to The non-null exclusive end, not before {@code from}.
   * @throws IllegalArgumentException if an argument was null or the end
   * preceded the start.
   */
  public TimeRange(final Instant from, final Instant to) {
    if (from == null) {
      throw new IllegalArgumentException("From cannot be null.");
    }
    if (to == null) {
      throw new IllegalArgumentException("To cannot be null.");
    }
    if (to.isBefore(from)) {
      throw new IllegalArgumentException("To " + to 
          + " cannot be before from " + from);
    }
    this.from = from;
    this.to = to;
  }
  
  /**
   * Helper for epoch second bounds.
   * @param from The inclusive start in Unix epoch seconds.
   * @param to The exclusive end in Unix epoch seconds.
   * @return A new range.
   */
  public static TimeRange ofEpochSeconds(final long from, final long to) {
    return new TimeRange(Instant.ofEpochSecond(from), Instant.ofEpochSecond(to));
  }
  
  /** @return The inclusive start. */
  public Instant from() {
    return from;
  }
  
  /** @return The exclusive end. */
  public Instant to() {
    return to;
  }
  
  /** @return The span between the two bounds. */
  public Duration duration() {
    return Duration.between(from, to);
  }
  
  /** @return The bounds at minute precision, e.g. 
   * {@code 2026-02-18 06:00 to 2026-02-18 12:00}. */
  public String toShortString() {
    return DateTime.formatShort(from) + " to " + DateTime.formatShort(to);
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeRange other = (TimeRange) o;
    return Objects.equal(from, other.from) && Objects.equal(to, other.to);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(from, to);
  }
  
  @Override
  public String toString() {
    return "[" + from + ", " + to + ")";
  }
}
