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

import com.google.common.base.Strings;

/**
 * A resolved time-series tag. Two tags are equal when their names match, 
 * the handle is whatever the data source needs to read samples.
 * 
 * @since 1.0
 */
public class Tag implements Comparable<Tag> {
  
  /** The non-null tag name. */
  private final String name;
  
  /** The opaque data source handle. */
  private final Object handle;
  
  /**
   * Default ctor.
   * @param name A non-null and non-empty name.
   * @param handle An optional data source handle.
   * @throws IllegalArgumentException if the name was null or empty.
   */
  public Tag(final String name, final Object handle) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Tag name cannot be null or empty.");
    }
    this.name = name;
    this.handle = handle;
  }
  
  /** @return The tag name. */
  public String name() {
    return name;
  }
  
  /** @return The data source handle. May be null. */
  public Object handle() {
    return handle;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    return name.equals(((Tag) o).name);
  }
  
  @Override
  public int hashCode() {
    return name.hashCode();
  }
  
  @Override
  public int compareTo(final Tag o) {
    return name.compareTo(o.name);
  }
  
  @Override
  public String toString() {
    return name;
  }
}
