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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.afextract.data.DataSource;
import net.afextract.data.Tag;
import net.afextract.data.TagSet;
import net.afextract.exceptions.InvalidShapeException;
import net.afextract.exceptions.NotFoundException;
import net.afextract.table.Tabular;

/**
 * Turns a {@link TagSpec} into tags. Identifiers are looked up through the
 * data source, column specs are resolved per row with each distinct cell
 * looked up once.
 * <p>
 * Cells may list several identifiers separated by commas. Summaries want a
 * single tag per row so {@link CellMode#SINGLE_TAG} rejects anything else,
 * time series take the whole list with {@link CellMode#TAG_LIST}.
 *
 * @since 1.0
 */
public class TagResolver {
  private static final Logger LOG = LoggerFactory.getLogger(TagResolver.class);

  /** How many tags a cell may resolve to. */
  public static enum CellMode {
    SINGLE_TAG,
    TAG_LIST
  }

  private static final Splitter CELL_SPLITTER =
      Splitter.on(',').trimResults().omitEmptyStrings();

  /** The data source, may be null if only tag sets are resolved. */
  private final DataSource data_source;

  /**
   * Default ctor.
   * @param data_source The data source to look up identifiers. May be null
   * in which case only resolved tag sets are accepted.
   */
  public TagResolver(final DataSource data_source) {
    this.data_source = data_source;
  }

  /**
   * Resolves a spec that applies to every row.
   * @param spec A non-null tag set or identifier spec.
   * @return The non-empty tags.
   * @throws IllegalArgumentException if the spec was a column spec or
   * identifiers were given without a data source.
   * @throws NotFoundException if an identifier matched nothing.
   */
  public TagSet resolve(final TagSpec spec) {
    if (spec == null) {
      throw new IllegalArgumentException("Tag spec cannot be null.");
    }
    switch (spec.type()) {
    case TAG_SET:
      if (spec.tags().isEmpty()) {
        throw new NotFoundException("No tags were given", null);
      }
      return spec.tags();
    case IDENTIFIERS:
      return resolveIdentifiers(spec.identifiers());
    default:
      throw new IllegalArgumentException("Column tag specs must be resolved "
          + "per row: " + spec);
    }
  }

  /**
   * Looks up each identifier and merges the results in order.
   * @param identifiers A non-null list of queries.
   * @return The non-empty tags.
   * @throws NotFoundException naming the first identifier that matched
   * nothing.
   */
  public TagSet resolveIdentifiers(final List<String> identifiers) {
    if (data_source == null) {
      throw new IllegalArgumentException("A data source is required to "
          + "resolve tag identifiers: " + identifiers);
    }
    final List<Tag> tags = Lists.newArrayList();
    for (final String identifier : identifiers) {
      final List<Tag> found = data_source.findTags(identifier);
      if (found == null || found.isEmpty()) {
        throw new NotFoundException("No tags were found for query: "
            + identifier, identifier);
      }
      tags.addAll(found);
    }
    return new TagSet(tags);
  }

  /**
   * Resolves the tags of each scoped row from a column.
   * @param table The non-null table the rows came from.
   * @param rows The non-null rows.
   * @param column The column holding identifiers.
   * @param mode How many tags a cell may hold.
   * @return One tag set per row, in row order.
   * @throws InvalidShapeException if the column is missing, a cell is empty
   * or a single tag cell resolved to more than one tag.
   * @throws NotFoundException if an identifier matched nothing.
   */
  public List<TagSet> resolvePerRow(final Tabular table,
                                    final List<ScopedRow> rows,
                                    final String column,
                                    final CellMode mode) {
    if (!table.hasColumn(column)) {
      throw new InvalidShapeException("The column option was set but "
          + column + " is not a valid column", column);
    }
    final Map<Object, TagSet> cache = Maps.newHashMap();
    final List<TagSet> resolved = Lists.newArrayListWithCapacity(rows.size());
    for (final ScopedRow row : rows) {
      final Object cell = row.values().get(column);
      TagSet tags = cache.get(cell);
      if (tags == null) {
        tags = resolveCell(cell, column, row.index(), mode);
        cache.put(cell, tags);
      }
      resolved.add(tags);
    }
    LOG.debug("Resolved {} distinct cells of column {} for {} rows",
        cache.size(), column, rows.size());
    return resolved;
  }

  /**
   * Resolves a single cell.
   * @param cell The cell value.
   * @param column The column, for errors.
   * @param index The row index, for errors.
   * @param mode How many tags the cell may hold.
   * @return The non-empty tags.
   */
  private TagSet resolveCell(final Object cell,
                             final String column,
                             final int index,
                             final CellMode mode) {
    final TagSet tags;
    if (cell instanceof TagSet) {
      tags = (TagSet) cell;
    } else if (cell instanceof Tag) {
      tags = TagSet.of((Tag) cell);
    } else {
      final List<String> identifiers = cell == null ?
          Lists.<String>newArrayList() : splitCell(cell.toString());
      if (identifiers.isEmpty()) {
        throw new InvalidShapeException("Empty tag cell in column " + column
            + " at row " + index, column);
      }
      if (mode == CellMode.SINGLE_TAG && identifiers.size() != 1) {
        throw new InvalidShapeException("Expected exactly one tag per cell in "
            + "column " + column + " but row " + index + " has "
            + identifiers.size() + ": " + cell, column);
      }
      tags = resolveIdentifiers(identifiers);
    }
    if (tags.isEmpty()) {
      throw new InvalidShapeException("Empty tag cell in column " + column
          + " at row " + index, column);
    }
    if (mode == CellMode.SINGLE_TAG && tags.size() != 1) {
      throw new InvalidShapeException("Expected exactly one tag per cell in "
          + "column " + column + " but row " + index + " resolved to "
          + tags, column);
    }
    return tags;
  }

  /**
   * @param cell A non-null cell.
   * @return The trimmed, non-empty identifiers in the cell.
   */
  public static List<String> splitCell(final String cell) {
    return CELL_SPLITTER.splitToList(cell);
  }
}
