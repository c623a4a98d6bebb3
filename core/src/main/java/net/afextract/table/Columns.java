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
package net.afextract.table;

import com.google.common.collect.ImmutableSet;

/**
 * Column names shared by hierarchy and result tables, plus the helpers for
 * the {@code "Name [suffix]"} convention used by condensed tables.
 * 
 * @since 1.0
 */
public final class Columns {
  public static final String NODE = "Node";
  public static final String PATH = "Path";
  public static final String NAME = "Name";
  public static final String LEVEL = "Level";
  public static final String TEMPLATE = "Template";
  public static final String START = "Starttime";
  public static final String END = "Endtime";
  
  public static final String PROCEDURE = "Procedure";
  public static final String TAG = "Tag";
  public static final String TIME = "Time";
  public static final String VALUE = "Value";
  public static final String SUMMARY = "Summary";
  
  /** Prefix of the referenced element columns. */
  public static final String REFERENCED_ELEMENT = "Referenced_el";
  
  /** Scope label for untemplated rows. */
  public static final String NO_TEMPLATE = "None";
  
  /** The columns every hierarchy table starts with. */
  public static final ImmutableSet<String> STRUCTURAL = ImmutableSet.of(
      NODE, PATH, NAME, LEVEL, TEMPLATE, START, END);
  
  private Columns() { }
  
  /**
   * @param column A non-null column name.
   * @return True if the name already carries a bracket suffix.
   */
  public static boolean isSuffixed(final String column) {
    return column.contains("[");
  }
  
  /**
   * Appends the suffix unless the column already has one.
   * @param column A non-null column name.
   * @param suffix A non-null suffix.
   * @return The suffixed name.
   */
  public static String suffixed(final String column, final String suffix) {
    if (isSuffixed(column)) {
      return column;
    }
    return column + " [" + suffix + "]";
  }
  
  /**
   * @param column A column name.
   * @return The part before the bracket suffix, or the column if it has none.
   */
  public static String baseName(final String column) {
    final int idx = column.indexOf(" [");
    return idx < 0 ? column : column.substring(0, idx);
  }
  
  /**
   * @param column A column name.
   * @return The text inside the first bracket pair, null if there is none.
   */
  public static String suffixOf(final String column) {
    final int open = column.indexOf('[');
    final int close = column.indexOf(']', open + 1);
    if (open < 0 || close < 0) {
      return null;
    }
    return column.substring(open + 1, close);
  }
  
  /**
   * @param template A template name, may be null.
   * @return The label used in column suffixes.
   */
  public static String scopeLabel(final String template) {
    return template == null ? NO_TEMPLATE : template;
  }
}
