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

import java.util.List;
import java.util.Map;

/**
 * A read-only view of a table: ordered, named columns over a list of rows.
 * A missing cell is a null value.
 * 
 * @since 1.0
 */
public interface Tabular {

  /** @return The column names in order. */
  List<String> columns();
  
  /**
   * @param column A column name.
   * @return True if the table has the column.
   */
  boolean hasColumn(final String column);
  
  /** @return The number of rows. */
  int size();
  
  /**
   * @param index A row index.
   * @return An unmodifiable view of the row keyed on column name.
   * @throws IndexOutOfBoundsException if the index was out of bounds.
   */
  Map<String, Object> row(final int index);
  
  /** @return An unmodifiable view of all of the rows. */
  List<Map<String, Object>> rows();
  
  /**
   * @param index A row index.
   * @param column A column name.
   * @return The cell value, null if missing.
   */
  Object get(final int index, final String column);
  
  /**
   * @param column A column name.
   * @return The values of the column in row order.
   * @throws IllegalArgumentException if the column does not exist.
   */
  List<Object> column(final String column);
  
}
