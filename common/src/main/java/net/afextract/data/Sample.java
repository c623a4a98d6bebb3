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

import com.google.common.base.Objects;

/**
 * A raw sample as returned by the data source, timestamped in the source's
 * native UTC. The value may be numeric, a string or a digital state.
 * 
 * @since 1.0
 */
public class Sample {
  
  /** The source timestamp. */
  private final Instant timestamp;
  
  /** The value, may be null. */
  private final Object value;
  
  /**
   * Default ctor.
   * @param timestamp A non-null timestamp.
   * @param value The value, may be null.
   */
  public Sample(final Instant timestamp, final Object value) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null.");
    }
    this.timestamp = timestamp;
    this.value = value;
  }
  
  /** @return The source timestamp. */
  public Instant timestamp() {
    return timestamp;
  }
  
  /** @return The value. May be null. */
  public Object value() {
    return value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final Sample other = (Sample) o;
    return Objects.equal(timestamp, other.timestamp)
        && Objects.equal(value, other.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(timestamp, value);
  }
  
  @Override
  public String toString() {
    return "{timestamp=" + timestamp + ", value=" + value + "}";
  }
}
