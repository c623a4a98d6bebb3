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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

/**
 * The base for tables keeping the column order in a list and each row as a
 * map. Subclasses decide who may mutate.
 * 
 * @since 1.0
 */
public abstract class BaseTable implements Tabular {
  
  /** The column names in order. */
  protected final List<String> columns;
  
  /** The rows. */
  protected final List<Map<String, Object>> rows;
  
  /**
   * Ctor for an empty table with the given columns.
   * @param columns A non-null list of columns.
   */
  protected BaseTable(final List<String> columns) {
    if (columns == null) {
      throw new IllegalArgumentException("Columns cannot be null.");
    }
    this.columns = Lists.newArrayList();
    for (final String column : columns) {
      addColumn(column);
    }
    rows = Lists.newArrayList();
  }
  
  /**
   * Ctor copying the given rows. Row keys not in the columns are appended
   * to the columns.
   * @param columns A non-null list of columns.
   * @param rows A non-null list of rows.
   */
  protected BaseTable(final List<String> columns, 
                      final List<Map<String, Object>> rows) {
    this(columns);
    if (rows == null) {
      throw new IllegalArgumentException("Rows cannot be null.");
    }
    for (final Map<String, Object> row : rows) {
      appendRow(row);
    }
  }
  
  @Override
  public List<String> columns() {
    return Collections.unmodifiableList(columns);
  }
  
  @Override
  public boolean hasColumn(final String column) {
    return columns.contains(column);
  }
  
  @Override
  public int size() {
    return rows.size();
  }
  
  @Override
  public Map<String, Object> row(final int index) {
    return Collections.unmodifiableMap(rows.get(index));
  }
  
  @Override
  public List<Map<String, Object>> rows() {
    final List<Map<String, Object>> views = 
        Lists.newArrayListWithCapacity(rows.size());
    for (final Map<String, Object> row : rows) {
      views.add(Collections.unmodifiableMap(row));
    }
    return Collections.unmodifiableList(views);
  }
  
  @Override
  public Object get(final int index, final String column) {
    return rows.get(index).get(column);
  }
  
  @Override
  public List<Object> column(final String column) {
    if (!columns.contains(column)) {
      throw new IllegalArgumentException("No such column: " + column);
    }
    final List<Object> values = new ArrayList<Object>(rows.size());
    for (final Map<String, Object> row : rows) {
      values.add(row.get(column));
    }
    return values;
  }
  
  /**
   * Adds a column to the end if it isn't present.
   * @param column A non-null column name.
   */
  protected void addColumn(final String column) {
    if (column == null) {
      throw new IllegalArgumentException("Column name cannot be null.");
    }
    if (!columns.contains(column)) {
      columns.add(column);
    }
  }
  
  /**
   * Copies the row into the table, adding any new columns.
   * @param row A non-null row.
   */
  protected void appendRow(final Map<String, Object> row) {
    final Map<String, Object> copy = new LinkedHashMap<String, Object>(row);
    for (final String column : copy.keySet()) {
      addColumn(column);
    }
    rows.add(copy);
  }
  
  /**
   * Sets a single cell.
   * @param index The row index.
   * @param column A column that must exist.
   * @param value The value, may be null.
   */
  protected void set(final int index, final String column, final Object value) {
    if (!columns.contains(column)) {
      throw new IllegalArgumentException("No such column: " + column);
    }
    rows.get(index).put(column, value);
  }
  
  /**
   * Stable sort of the rows.
   * @param comparator A non-null comparator.
   */
  protected void sortRows(final Comparator<Map<String, Object>> comparator) {
    Collections.sort(rows, comparator);
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass().getSimpleName())
        .append(columns);
    for (final Map<String, Object> row : rows) {
      buf.append("\n");
      final List<Object> values = Lists.newArrayListWithCapacity(columns.size());
      for (final String column : columns) {
        values.add(row.get(column));
      }
      Joiner.on(", ").useForNull("null").appendTo(buf, values);
    }
    return buf.toString();
  }
}
