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

import net.afextract.table.Tabular;

/**
 * A table an extraction can run over. Each scoped row supplies the node and
 * time range for one data source call.
 * 
 * @since 1.0
 */
public interface ExtractionScope extends Tabular {

  /** @return The rows to extract for, in table order. */
  List<ScopedRow> scopedRows();
  
  /**
   * @param from The first row, inclusive.
   * @param to The last row, exclusive.
   * @return A scope of the same type over the given rows.
   */
  ExtractionScope slice(final int from, final int to);
  
}
