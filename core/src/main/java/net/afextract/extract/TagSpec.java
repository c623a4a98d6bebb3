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
package net.afextract.extract;

import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import net.afextract.data.TagSet;

/**
 * Which tags to extract: an already resolved set, a list of identifiers to
 * look up, or a column whose cells hold identifiers per row.
 * 
 * @since 1.0
 */
public class TagSpec {
  
  /** The forms a spec can take. */
  public static enum Type {
    TAG_SET,
    IDENTIFIERS,
    COLUMN
  }
  
  private final Type type;
  private final TagSet tags;
  private final List<String> identifiers;
  private final String column;
  
  private TagSpec(final Type type, 
                  final TagSet tags, 
                  final List<String> identifiers,
                  final String column) {
    this.type = type;
    this.tags = tags;
    this.identifiers = identifiers;
    this.column = column;
  }
  
  /**
   * @param tags A non-null set of resolved tags.
   * @return A spec returning the set as is.
   */
  public static TagSpec of(final TagSet tags) {
    if (tags == null) {
      throw new IllegalArgumentException("Tags cannot be null.");
    }
    return new TagSpec(Type.TAG_SET, tags, null, null);
  }
  
  /**
   * @param identifiers A non-null, non-empty list of tag queries.
   * @return A spec resolving each identifier through the data source.
   */
  public static TagSpec identifiers(final List<String> identifiers) {
    if (identifiers == null || identifiers.isEmpty()) {
      throw new IllegalArgumentException(
          "Identifiers cannot be null or empty.");
    }
    for (final String identifier : identifiers) {
      if (Strings.isNullOrEmpty(identifier)) {
        throw new IllegalArgumentException(
            "Identifiers cannot contain a null or empty entry.");
      }
    }
    return new TagSpec(Type.IDENTIFIERS, null, 
        ImmutableList.copyOf(identifiers), null);
  }
  
  /**
   * @param identifiers One or more tag queries.
   * @return A spec resolving each identifier through the data source.
   */
  public static TagSpec identifiers(final String... identifiers) {
    return identifiers(ImmutableList.copyOf(identifiers));
  }
  
  /**
   * @param column A non-null column name.
   * @return A spec reading identifiers from the column of each row.
   */
  public static TagSpec column(final String column) {
    if (Strings.isNullOrEmpty(column)) {
      throw new IllegalArgumentException("Column cannot be null or empty.");
    }
    return new TagSpec(Type.COLUMN, null, null, column);
  }
  
  /** @return The form of the spec. */
  public Type type() {
    return type;
  }
  
  /** @return The resolved tags for {@link Type#TAG_SET}. */
  public TagSet tags() {
    return tags;
  }
  
  /** @return The queries for {@link Type#IDENTIFIERS}. */
  public List<String> identifiers() {
    return identifiers;
  }
  
  /** @return The column for {@link Type#COLUMN}. */
  public String column() {
    return column;
  }
  
  /** @return True if the tags vary per row. */
  public boolean isPerRow() {
    return type == Type.COLUMN;
  }
  
  @Override
  public String toString() {
    switch (type) {
    case TAG_SET:
      return "tags" + tags;
    case IDENTIFIERS:
      return "identifiers" + identifiers;
    default:
      return "column[" + column + "]";
    }
  }
}
