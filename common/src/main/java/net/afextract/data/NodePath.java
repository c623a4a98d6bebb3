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

import java.util.List;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * Helpers for the backslash separated node paths the data source hands out,
 * e.g. {@code \\Server\Database\Root\Child\Leaf}. The first four pieces of
 * a split path are the fixed infrastructure prefix ({@code "", "", Server, 
 * Database}), the rest are the node keys from the root down.
 * 
 * @since 1.0
 */
public final class NodePath {
  
  /** The path separator. */
  public static final char SEPARATOR = '\\';
  
  /** Number of separators before the root key. */
  public static final int PREFIX_SEPARATORS = 4;
  
  private static final Splitter SPLITTER = Splitter.on(SEPARATOR);
  
  private NodePath() { }
  
  /**
   * Splits the path on the separator.
   * @param path A non-null path.
   * @return The pieces, including the empty leading ones.
   * @throws IllegalArgumentException if the path was null or empty or had 
   * fewer than {@link #PREFIX_SEPARATORS} separators.
   */
  public static List<String> split(final String path) {
    if (Strings.isNullOrEmpty(path)) {
      throw new IllegalArgumentException("Path cannot be null or empty.");
    }
    final List<String> pieces = SPLITTER.splitToList(path);
    if (pieces.size() - 1 < PREFIX_SEPARATORS) {
      throw new IllegalArgumentException("Path must have at least " 
          + PREFIX_SEPARATORS + " separators: " + path);
    }
    return pieces;
  }
  
  /**
   * @param path A non-null path.
   * @return The depth of the node, 0 for roots.
   */
  public static int level(final String path) {
    return split(path).size() - 1 - PREFIX_SEPARATORS;
  }
  
  /**
   * @param path A non-null path.
   * @return The node keys from the root down, {@code level + 1} entries.
   */
  public static List<String> keys(final String path) {
    final List<String> pieces = split(path);
    return pieces.subList(PREFIX_SEPARATORS, pieces.size());
  }
  
  /**
   * @param path A non-null path.
   * @return The key of the top level ancestor.
   */
  public static String root(final String path) {
    return keys(path).get(0);
  }
  
  /**
   * @param path A non-null path.
   * @return The last key.
   */
  public static String leaf(final String path) {
    final List<String> keys = keys(path);
    return keys.get(keys.size() - 1);
  }
  
}
