// This file is part of AFExtract.
// Copyright (C) 2026  The AFExtract Authors.
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
package net.afextract.utils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import com.google.common.base.Strings;

/**
 * Utility class for converting timestamps between the data source's native
 * UTC instants and the configured display zone, plus simple duration
 * parsing.
 * @since 1.0
 */
public class DateTime {

  /** ID of the UTC timezone */
  public static final String UTC_ID = "UTC";
  
  /** The date the data source reports for "never ends". Anything at or past
   * this instant is treated as no value. */
  public static final Instant MAX_SOURCE_TIME = 
      Instant.parse("9999-12-31T23:59:59Z");
  
  /**
   * Resolves a zone ID, validating it against the zones the JVM knows.
   * @param tz A non-null and non-empty zone ID.
   * @return The zone.
   * @throws IllegalArgumentException if the zone was null, empty or unknown.
   */
  public static ZoneId zone(final String tz) {
    if (Strings.isNullOrEmpty(tz)) {
      throw new IllegalArgumentException("Time zone cannot be null or empty.");
    }
    try {
      return ZoneId.of(tz);
    } catch (DateTimeException e) {
      throw new IllegalArgumentException("Unknown time zone: " + tz, e);
    }
  }
  
  /**
   * Whether or not the instant is the source's sentinel max date.
   * @param timestamp An instant, may be null.
   * @return True if the timestamp is at or past the sentinel.
   */
  public static boolean isMaxSourceTime(final Instant timestamp) {
    return timestamp != null && !timestamp.isBefore(MAX_SOURCE_TIME);
  }
  
  /**
   * Converts a source instant to the display zone.
   * @param timestamp The source instant. May be null.
   * @param zone A non-null display zone.
   * @return The converted time or null if the timestamp was null or the
   * sentinel max date.
   */
  public static ZonedDateTime toDisplay(final Instant timestamp, 
                                        final ZoneId zone) {
    if (timestamp == null || isMaxSourceTime(timestamp)) {
      return null;
    }
    return timestamp.atZone(zone);
  }
  
  /**
   * Converts a display time back to the source's native UTC instant.
   * @param timestamp A display time. May be null.
   * @return The instant or null if the timestamp was null.
   */
  public static Instant toSource(final ZonedDateTime timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
  
  /**
   * Parses a duration string into milliseconds, e.g. "60d" or "1h".
   * Units are 'ms' for milliseconds, 's' seconds, 'm' minutes, 'h' hours,
   * 'd' days, 'w' weeks, 'n' months of 30 days and 'y' years of 365 days.
   * @param duration The string to parse.
   * @return The duration in milliseconds.
   * @throws IllegalArgumentException if the duration was null, empty, 
   * non-positive or had an unknown unit.
   */
  public static final long parseDuration(final String duration) {
    if (Strings.isNullOrEmpty(duration)) {
      throw new IllegalArgumentException("Duration cannot be null or empty.");
    }
    long interval;
    long multiplier;
    int unit = 0;
    while (Character.isDigit(duration.charAt(unit))) {
      unit++;
      if (unit >= duration.length()) {
        throw new IllegalArgumentException("Invalid duration, must have an "
            + "integer and unit: " + duration);
      }
    }
    try {
      interval = Long.parseLong(duration.substring(0, unit));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration (number): " 
          + duration);
    }
    if (interval <= 0) {
      throw new IllegalArgumentException("Zero or negative duration: " 
          + duration);
    }
    final String units = duration.substring(unit).toLowerCase();
    switch (units) {
      case "ms": return interval;
      case "s": multiplier = 1; break;
      case "m": multiplier = 60; break;
      case "h": multiplier = 3600; break;
      case "d": multiplier = 3600 * 24; break;
      case "w": multiplier = 3600 * 24 * 7; break;
      case "n": multiplier = 3600 * 24 * 30; break;
      case "y": multiplier = 3600 * 24 * 365; break;
      default: 
        throw new IllegalArgumentException("Invalid duration (suffix): " 
            + duration);
    }
    multiplier *= 1000;
    if ((double) interval * multiplier > Long.MAX_VALUE) {
      throw new IllegalArgumentException(
          "Duration must be < Long.MAX_VALUE ms: " + duration);
    }
    return interval * multiplier;
  }
  
}
