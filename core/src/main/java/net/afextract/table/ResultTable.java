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

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

/**
 * The output of an extraction. Rows are appended by the extractor, callers
 * only read.
 * 
 * @since 1.0
 */
public class ResultTable extends BaseTable {
  
  /**
   * Ctor for an empty table.
   * @param columns A non-null list of columns.
   */
  public ResultTable(final List<String> columns) {
    super(columns);
  }
  
  /**
   * Appends a row, adding any new columns.
   * @param row A non-null row.
   * @return The table.
   */
  public ResultTable addRow(final Map<String, Object> row) {
    if (row == null) {
      throw new IllegalArgumentException("Row cannot be null.");
    }
    appendRow(row);
    return this;
  }
  
  /**
   * Stable sort on a column of comparable values with missing values last.
   * @param column A column that must exist.
   * @return The table.
   */
  public ResultTable sortBy(final String column) {
    if (!hasColumn(column)) {
      throw new IllegalArgumentException("No such column: " + column);
    }
    final Ordering<Comparable<Object>> ordering = 
        Ordering.<Comparable<Object>>natural().nullsLast();
    sortRows(new Comparator<Map<String, Object>>() {
      @SuppressWarnings("unchecked")
      @Override
      public int compare(final Map<String, Object> a, 
                         final Map<String, Object> b) {
        return ordering.compare((Comparable<Object>) a.get(column), 
            (Comparable<Object>) b.get(column));
      }
    });
    return this;
  }
  
  /**
   * Concatenates tables in order. The columns are the union in order of 
   * first appearance.
   * @param tables A non-null list of tables.
   * @return A new table.
   */
  public static ResultTable concat(final List<ResultTable> tables) {
    final List<String> columns = Lists.newArrayList();
    for (final ResultTable table : tables) {
      for (final String column : table.columns) {
        if (!columns.contains(column)) {
          columns.add(column);
        }
      }
    }
    final ResultTable result = new ResultTable(columns);
    for (final ResultTable table : tables) {
      for (final Map<String, Object> row : table.rows) {
        result.appendRow(row);
      }
    }
    return result;
  }
}
