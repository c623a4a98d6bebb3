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

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * The summaries a data source can compute, with the bit flags it uses to
 * request several at once.
 * 
 * @since 1.0
 */
public enum SummaryType {
  TOTAL(1),
  AVERAGE(2),
  MINIMUM(4),
  MAXIMUM(8),
  RANGE(16),
  STD_DEV(32),
  POP_STD_DEV(64),
  COUNT(128),
  PERCENT_GOOD(8192),
  TOTAL_WITH_UOM(16384);
  
  /** Every summary. */
  public static final int ALL = 24831;
  
  /** The summaries that make sense for non-numeric tags. */
  public static final int ALL_FOR_NON_NUMERIC = 8320;
  
  private final int flag;
  
  SummaryType(final int flag) {
    this.flag = flag;
  }
  
  /** @return The bit flag. */
  public int flag() {
    return flag;
  }
  
  /**
   * Expands a bit mask into the set of summaries.
   * @param mask A mask of one or more flags, e.g. {@code 1 | 8}.
   * @return The non-null set of summaries.
   * @throws IllegalArgumentException if the mask was zero or had bits that
   * do not map to a summary.
   */
  public static Set<SummaryType> fromMask(final int mask) {
    if (mask == 0) {
      throw new IllegalArgumentException("Summary mask cannot be zero.");
    }
    final Set<SummaryType> types = EnumSet.noneOf(SummaryType.class);
    int remaining = mask;
    for (final SummaryType type : values()) {
      if ((mask & type.flag) != 0) {
        types.add(type);
        remaining &= ~type.flag;
      }
    }
    if (remaining != 0) {
      throw new IllegalArgumentException("Unknown summary flags in mask: " 
          + mask);
    }
    return types;
  }
  
  /**
   * @param types A non-null collection of summaries.
   * @return The bit mask.
   */
  public static int toMask(final Collection<SummaryType> types) {
    int mask = 0;
    for (final SummaryType type : types) {
      mask |= type.flag;
    }
    return mask;
  }
}
