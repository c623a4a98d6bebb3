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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * An ordered collection of unique tags. Insertion order drives the order of
 * output columns, duplicates by name are dropped keeping the first.
 * 
 * @since 1.0
 */
public class TagSet implements Iterable<Tag> {
  
  /** An empty set. */
  public static final TagSet EMPTY = new TagSet(ImmutableList.<Tag>of());
  
  /** Name to tag, in insertion order. */
  private final LinkedHashMap<String, Tag> tags;
  
  /**
   * Default ctor.
   * @param tags A non-null collection of tags.
   */
  public TagSet(final Collection<Tag> tags) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    this.tags = new LinkedHashMap<String, Tag>();
    for (final Tag tag : tags) {
      if (tag == null) {
        throw new IllegalArgumentException("Tags cannot contain a null.");
      }
      if (!this.tags.containsKey(tag.name())) {
        this.tags.put(tag.name(), tag);
      }
    }
  }
  
  /**
   * @param tags The tags to wrap.
   * @return A set of the tags.
   */
  public static TagSet of(final Tag... tags) {
    return new TagSet(Lists.newArrayList(tags));
  }
  
  /** @return The number of tags. */
  public int size() {
    return tags.size();
  }
  
  /** @return True if there aren't any tags. */
  public boolean isEmpty() {
    return tags.isEmpty();
  }
  
  /**
   * @param name A tag name.
   * @return The tag if present, null if not.
   */
  public Tag get(final String name) {
    return tags.get(name);
  }
  
  /** @return The tags in order as an immutable list. */
  public List<Tag> asList() {
    return ImmutableList.copyOf(tags.values());
  }
  
  /** @return The tag names in order. */
  public List<String> names() {
    return ImmutableList.copyOf(tags.keySet());
  }
  
  /**
   * Returns a contiguous slice of the set.
   * @param from The first index, inclusive.
   * @param to The last index, exclusive.
   * @return A new set.
   * @throws IndexOutOfBoundsException if the indices were out of bounds.
   */
  public TagSet slice(final int from, final int to) {
    return new TagSet(asList().subList(from, to));
  }
  
  @Override
  public Iterator<Tag> iterator() {
    return asList().iterator();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o)
      return true;
    if (o == null || getClass() != o.getClass())
      return false;
    return asList().equals(((TagSet) o).asList());
  }
  
  @Override
  public int hashCode() {
    return asList().hashCode();
  }
  
  @Override
  public String toString() {
    return tags.keySet().toString();
  }
}
