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
package net.afextract.data;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import net.afextract.utils.DateTime;

/**
 * A sample converted to the display zone.
 * 
 * @since 1.0
 */
public class TimeSeriesPoint implements Comparable<TimeSeriesPoint> {
  
  /** The display timestamp. */
  private final ZonedDateTime timestamp;
  
  /** The value. */
  private final Object value;
  
  /**
   * Default ctor.
   * @param timestamp A non-null timestamp.
   * @param value The value, may be null.
   */
  public TimeSeriesPoint(final ZonedDateTime timestamp, final Object value) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.timestamp = timestamp;
    this.value = value;
  }
  
  /**
   * Converts a raw sample.
   * @param sample A non-null sample.
   * @param zone A non-null display zone.
   * @return The point or null if the sample sits at the source's sentinel 
   * max date, i.e. there is no point.
   */
  public static TimeSeriesPoint fromSample(final Sample sample, 
                                           final ZoneId zone) {
    final ZonedDateTime ts = DateTime.toDisplay(sample.timestamp(), zone);
    if (ts == null) {
      return null;
    }
    return new TimeSeriesPoint(ts, sample.value());
  }
  
  /** @return The display timestamp. */
  public ZonedDateTime timestamp() {
    return timestamp;
  }
  
  /** @return The value. May be null. */
  public Object value() {
    return value;
  }
  
  @Override
  public int compareTo(final TimeSeriesPoint o) {
    return timestamp.compareTo(o.timestamp);
  }
  
  @Override
  public String toString() {
    return "{timestamp=" + timestamp + ", value=" + value + "}";
  }
}
