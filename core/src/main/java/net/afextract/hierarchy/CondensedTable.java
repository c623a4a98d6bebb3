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
package net.afextract.hierarchy;

import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.afextract.data.Node;
import net.afextract.exceptions.InvalidShapeException;
import net.afextract.extract.ExtractionScope;
import net.afextract.extract.ScopedRow;
import net.afextract.table.BaseTable;
import net.afextract.table.Columns;

/**
 * The output of the {@link Condenser}: one row per leaf path with every
 * level's columns side by side, suffixed by level or template. The deepest
 * {@code Node [*]} column selects the node each row is extracted for.
 *
 * @since 1.0
 */
public class CondensedTable extends BaseTable implements ExtractionScope {
  private static final Logger LOG = LoggerFactory.getLogger(CondensedTable.class);

  /** The deepest node column, null for an empty table. */
  private final String leaf_column;

  /**
   * Default ctor.
   * @param columns The non-null columns in level order.
   * @param rows The non-null rows.
   * @throws InvalidShapeException if there are rows but no node column.
   */
  public CondensedTable(final List<String> columns,
                        final List<Map<String, Object>> rows) {
    super(columns, rows);
    String leaf = null;
    for (final String column : this.columns) {
      if (Columns.isSuffixed(column)
          && Columns.baseName(column).equals(Columns.NODE)) {
        leaf = column;
      }
    }
    if (leaf == null && !this.rows.isEmpty()) {
      throw new InvalidShapeException(
          "A condensed table needs at least one node column", Columns.NODE);
    }
    leaf_column = leaf;
  }

  /** @return The node columns, shallowest first. */
  public List<String> nodeColumns() {
    final List<String> node_columns = Lists.newArrayList();
    for (final String column : columns) {
      if (Columns.isSuffixed(column)
          && Columns.baseName(column).equals(Columns.NODE)) {
        node_columns.add(column);
      }
    }
    return node_columns;
  }

  /** @return The deepest node column. Null if the table is empty. */
  public String leafNodeColumn() {
    return leaf_column;
  }

  /**
   * Rows without a node at the deepest level are skipped. The end comes from
   * the inherited end time of that level.
   */
  @Override
  public List<ScopedRow> scopedRows() {
    if (leaf_column == null) {
      return Collections.emptyList();
    }
    final String suffix = Columns.suffixOf(leaf_column);
    final String start_column = Columns.suffixed(Columns.START, suffix);
    final String end_column = Columns.suffixed(Columns.END, suffix);

    final List<ScopedRow> scoped = Lists.newArrayListWithCapacity(rows.size());
    int skipped = 0;
    for (int i = 0; i < rows.size(); i++) {
      final Map<String, Object> row = rows.get(i);
      final Node node = (Node) row.get(leaf_column);
      if (node == null) {
        skipped++;
        continue;
      }
      scoped.add(new ScopedRow(i, node,
          (ZonedDateTime) row.get(start_column),
          (ZonedDateTime) row.get(end_column),
          Collections.unmodifiableMap(row)));
    }
    if (skipped > 0) {
      LOG.warn("Skipped {} rows without a node in {}", skipped, leaf_column);
    }
    return scoped;
  }

  @Override
  public CondensedTable slice(final int from, final int to) {
    return new CondensedTable(columns, rows.subList(from, to));
  }
}
