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
package net.arcquery.utils;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

import com.google.common.base.Strings;

/**
 * Utility class that provides helpers for dealing with durations, timestamps
 * and the textual forms the Arc engine and the SQL macros use.
 * @since 1.0
 */
public class DateTime {

  /** RFC 3339 at second precision, always UTC with a {@code Z} suffix. */
  private static final DateTimeFormatter RFC3339_SECONDS = 
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'")
        .withZone(ZoneOffset.UTC);
  
  /** Compact minute precision form used in chunk descriptions. */
  private static final DateTimeFormatter SHORT = 
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
        .withZone(ZoneOffset.UTC);
  
  /** Local date time with a space separator and optional fraction. */
  private static final DateTimeFormatter SPACE_SEPARATED = 
      new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .toFormatter();
  
  /**
   * Parses a human-readable duration (e.g, "10m", "3h", "14d") into
   * milliseconds.
   * <p>
   * Formats supported:<ul>
   * <li>{@code ms}: milliseconds</li>
   * <li>{@code s}: seconds</li>
   * <li>{@code m}: minutes</li>
   * <li>{@code h}: hours</li>
   * <li>{@code d}: days</li>
   * <li>{@code w}: weeks</li></ul>
   * @param duration The human-readable duration to parse.
   * @return A strictly positive number of milliseconds.
   * @throws IllegalArgumentException if the interval was malformed.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    final String lower = duration.trim().toLowerCase();
    int unit = 0;
    while (unit < lower.length() && Character.isDigit(lower.charAt(unit))) {
      unit++;
    }
    if (unit == 0 || unit >= lower.length()) {
      throw new IllegalArgumentException("Invalid duration, must have an "
          + "integer and unit: " + duration);
    }
    final long interval;
    try {
      interval = Long.parseLong(lower.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " 
          + duration, e);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " 
          + duration);
    }
    final long multiplier;
    switch (lower.substring(unit)) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      default: throw new IllegalArgumentException("Invalid duration (suffix): " 
          + duration);
    }
    if ((double) interval * multiplier * 1000 > Long.MAX_VALUE) {
      throw new IllegalArgumentException("Duration must be < Long.MAX_VALUE ms: " 
          + duration);
    }
    return interval * multiplier * 1000;
  }
  
  /**
   * Formats the instant as RFC 3339 in UTC, truncated to whole seconds, e.g.
   * {@code 2026-02-18T10:00:00Z}.
   * @param instant A non-null instant.
   * @return The formatted string.
   */
  public static String formatRfc3339(final Instant instant) {
    return RFC3339_SECONDS.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }
  
  /**
   * Formats the instant at minute precision in UTC, e.g. 
   * {@code 2026-02-18 06:00}.
   * @param instant A non-null instant.
   * @return The formatted string.
   */
  public static String formatShort(final Instant instant) {
    return SHORT.format(instant);
  }
  
  /**
   * Attempts to parse a timestamp string as returned by the engine. Accepted:
   * <ul>
   * <li>RFC 3339 with an offset, e.g. {@code 2026-02-18T10:00:00.5+01:00}</li>
   * <li>ISO local date time with optional fraction, assumed UTC, e.g.
   * {@code 2026-02-18T10:00:00.000000}</li>
   * <li>Space separated local date time, assumed UTC, e.g. 
   * {@code 2026-02-18 10:00:00}</li>
   * </ul>
   * @param value The value to parse, may be null.
   * @return The instant truncated to milliseconds or null if the value could
   * not be parsed.
   */
  public static Instant parseTimestamp(final String value) {
    if (Strings.isNullOrEmpty(value)) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
          .toInstant().truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException e) {
      // try the next layout
    }
    try {
      return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException e) {
      // try the next layout
    }
    try {
      return LocalDateTime.parse(value, SPACE_SEPARATED)
          .toInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MILLIS);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
  
  /**
   * Pass through to {@link System#currentTimeMillis()} for use in classes to
   * make unit testing easier.
   * @return The current epoch time in milliseconds
   */
  public static long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  /**
   * Pass through to {@link System#nanoTime()} for use in classes to
   * make unit testing easier.
   * @return The current value of the nano timer.
   */
  public static long nanoTime() {
    return System.nanoTime();
  }
  
  /**
   * Calculates the difference between two values and returns the time in
   * milliseconds as a double.
   * @param end The end timestamp
   * @param start The start timestamp
   * @return The value in milliseconds
   * @throws IllegalArgumentException if end is less than start
   */
  public static double msFromNanoDiff(final long end, final long start) {
    if (end < start) {
      throw new IllegalArgumentException("End (" + end + ") cannot be less "
          + "than start (" + start + ")");
    }
    return ((double) end - (double) start) / 1000000;
  }
}
