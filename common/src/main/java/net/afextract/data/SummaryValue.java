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

import java.time.Instant;

/**
 * One summary result from the data source. The tag is null for expression
 * (calculation) summaries, the timestamp may be the sentinel max date.
 * 
 * @since 1.0
 */
public class SummaryValue {
  
  /** The tag name, null for calculations. */
  private final String tag;
  
  /** The summary that was computed. */
  private final SummaryType type;
  
  /** The value. */
  private final Object value;
  
  /** The timestamp the source associated with the value. */
  private final Instant timestamp;
  
  /**
   * Default ctor.
   * @param tag The tag name, null for calculations.
   * @param type A non-null summary type.
   * @param value The value, may be null.
   * @param timestamp The source timestamp, may be null.
   */
  public SummaryValue(final String tag, 
                      final SummaryType type, 
                      final Object value,
                      final Instant timestamp) {
    if (type == null) {
      throw new IllegalArgumentException("Summary type cannot be null.");
    }
    this.tag = tag;
    this.type = type;
    this.value = value;
    this.timestamp = timestamp;
  }
  
  /** @return The tag name. May be null. */
  public String tag() {
    return tag;
  }
  
  /** @return The summary type. */
  public SummaryType type() {
    return type;
  }
  
  /** @return The value. May be null. */
  public Object value() {
    return value;
  }
  
  /** @return The source timestamp. May be null. */
  public Instant timestamp() {
    return timestamp;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("{tag=")
        .append(tag)
        .append(", type=")
        .append(type)
        .append(", value=")
        .append(value)
        .append(", timestamp=")
        .append(timestamp)
        .append("}")
        .toString();
  }
}
