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

import com.google.common.base.Objects;

import net.afextract.utils.Config;

/**
 * An opaque paging hint forwarded to the data source for bulk calls.
 * 
 * @since 1.0
 */
public class PagingConfig {
  
  /** What the page size counts. */
  public static enum PageType {
    TAG_COUNT,
    EVENT_COUNT
  }
  
  private final PageType type;
  private final int size;
  
  /**
   * Default ctor.
   * @param type A non-null page type.
   * @param size The page size, greater than zero.
   */
  public PagingConfig(final PageType type, final int size) {
    if (type == null) {
      throw new IllegalArgumentException("Page type cannot be null.");
    }
    if (size < 1) {
      throw new IllegalArgumentException("Page size must be at least 1: " 
          + size);
    }
    this.type = type;
    this.size = size;
  }
  
  /**
   * @param config A non-null config.
   * @return The paging hint configured via {@link Config#PAGING_TYPE_KEY} 
   * and {@link Config#PAGING_SIZE_KEY}.
   */
  public static PagingConfig fromConfig(final Config config) {
    return new PagingConfig(
        PageType.valueOf(config.getString(Config.PAGING_TYPE_KEY)
            .trim().toUpperCase()),
        config.getInt(Config.PAGING_SIZE_KEY));
  }
  
  /** @return The page type. */
  public PageType type() {
    return type;
  }
  
  /** @return The page size. */
  public int size() {
    return size;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    final PagingConfig other = (PagingConfig) o;
    return type == other.type && size == other.size;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, size);
  }
  
  @Override
  public String toString() {
    return type + ":" + size;
  }
}
