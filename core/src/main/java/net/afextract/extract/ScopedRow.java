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

import java.time.ZonedDateTime;
import java.util.Map;

import net.afextract.data.Node;

/**
 * One row of an extraction scope: the node it stands for and the time range
 * to read. An open end means the node is still running.
 * 
 * @since 1.0
 */
public class ScopedRow {
  private final int index;
  private final Node node;
  private final ZonedDateTime start;
  private final ZonedDateTime end;
  private final Map<String, Object> values;
  
  /**
   * Default ctor.
   * @param index The row index in the source table.
   * @param node The non-null node.
   * @param start The start, may be null for assets.
   * @param end The end, null if open.
   * @param values The source row.
   */
  public ScopedRow(final int index, 
                   final Node node, 
                   final ZonedDateTime start,
                   final ZonedDateTime end,
                   final Map<String, Object> values) {
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null.");
    }
    this.index = index;
    this.node = node;
    this.start = start;
    this.end = end;
    this.values = values;
  }
  
  /** @return The row index in the source table. */
  public int index() {
    return index;
  }
  
  /** @return The node. */
  public Node node() {
    return node;
  }
  
  /** @return The top level ancestor's key. */
  public String procedure() {
    return node.root();
  }
  
  /** @return The start. May be null. */
  public ZonedDateTime start() {
    return start;
  }
  
  /** @return The end. Null if open. */
  public ZonedDateTime end() {
    return end;
  }
  
  /** @return The source row. */
  public Map<String, Object> values() {
    return values;
  }
  
  @Override
  public String toString() {
    return "{index=" + index + ", node=" + node.path() + ", start=" + start 
        + ", end=" + end + "}";
  }
}
