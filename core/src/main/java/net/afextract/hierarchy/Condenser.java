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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.afextract.data.Node;
import net.afextract.data.NodePath;
import net.afextract.table.Columns;
import net.afextract.utils.Config;

/**
 * Merges the levels of a {@link HierarchyTable} into one wide table with a
 * row per leaf path.
 * <p>
 * Levels are processed shallowest first. Each level's columns get a
 * {@code " [suffix]"} appended, then the rows are outer joined onto the
 * running table on the path keys of their ancestors. Ancestors without
 * descendants and descendants without ancestors both survive. A level
 * without rows gets {@link #MISSING_LEVEL_KEY} as its key so the following
 * level still has something to join on.
 * <p>
 * Finally value-identical rows collapse and the {@code Endtime} columns are
 * filled top down: the shallowest with "now", each deeper one from its
 * parent.
 *
 * @since 1.0
 */
public class Condenser {
  private static final Logger LOG = LoggerFactory.getLogger(Condenser.class);

  /** The key used for a level that has no rows. */
  public static final String MISSING_LEVEL_KEY = "<missing level>";

  /** How column suffixes are built. */
  public static enum SuffixMode {
    /** Always the level number. */
    LEVEL,

    /** The level's template when it has exactly one, else the level number. */
    TEMPLATE
  }

  /** The suffix mode. */
  private final SuffixMode suffix_mode;

  /**
   * Default ctor.
   * @param suffix_mode A non-null suffix mode.
   */
  public Condenser(final SuffixMode suffix_mode) {
    if (suffix_mode == null) {
      throw new IllegalArgumentException("Suffix mode cannot be null.");
    }
    this.suffix_mode = suffix_mode;
  }

  /**
   * Ctor reading {@link Config#CONDENSE_SUFFIX_KEY}.
   * @param config A non-null config.
   */
  public Condenser(final Config config) {
    this(SuffixMode.valueOf(config.getString(Config.CONDENSE_SUFFIX_KEY)
        .trim().toUpperCase()));
  }

  /** @return The suffix mode. */
  public SuffixMode suffixMode() {
    return suffix_mode;
  }

  /**
   * Condenses the table.
   * @param table A non-null table.
   * @param now The time used to fill the shallowest end times.
   * @return The condensed table.
   */
  public CondensedTable condense(final HierarchyTable table,
                                 final ZonedDateTime now) {
    if (table.size() < 1) {
      return new CondensedTable(new ArrayList<String>(),
          new ArrayList<Map<String, Object>>());
    }

    int min_level = Integer.MAX_VALUE;
    int max_level = Integer.MIN_VALUE;
    for (final Map<String, Object> row : table.rows()) {
      final int level = (Integer) row.get(Columns.LEVEL);
      min_level = Math.min(min_level, level);
      max_level = Math.max(max_level, level);
    }
    LOG.info("Condensing {} rows across levels {} to {}",
        table.size(), min_level, max_level);

    final List<String> columns = Lists.newArrayList();
    final Set<String> used_suffixes = Sets.newHashSet();
    List<JoinRow> running = null;
    for (int level = min_level; level <= max_level; level++) {
      final List<Map<String, Object>> level_rows = Lists.newArrayList();
      for (final Map<String, Object> row : table.rows()) {
        if ((Integer) row.get(Columns.LEVEL) == level) {
          level_rows.add(row);
        }
      }

      if (level_rows.isEmpty()) {
        LOG.debug("No rows at level {}, using a placeholder key", level);
        for (final JoinRow row : running) {
          row.keys.add(MISSING_LEVEL_KEY);
        }
        continue;
      }

      final String suffix = suffixFor(level, level_rows, used_suffixes);
      final List<String> level_columns = Lists.newArrayList();
      for (final String column : table.columns()) {
        if (column.equals(Columns.PATH) || !keepColumn(column, level_rows)) {
          continue;
        }
        level_columns.add(column);
        final String renamed = Columns.suffixed(column, suffix);
        if (!columns.contains(renamed)) {
          columns.add(renamed);
        }
      }

      final List<JoinRow> right = Lists.newArrayListWithCapacity(
          level_rows.size());
      for (final Map<String, Object> row : level_rows) {
        final Map<String, Object> values = new LinkedHashMap<String, Object>();
        for (final String column : level_columns) {
          final Object value = row.get(column);
          if (value != null) {
            values.put(Columns.suffixed(column, suffix), value);
          }
        }
        right.add(new JoinRow(
            new ArrayList<String>(NodePath.keys((String) row.get(Columns.PATH))),
            values));
      }

      running = running == null ? right : outerJoin(running, right, level);
    }

    final List<Map<String, Object>> rows = dedupe(running, columns);
    fillEndTimes(rows, columns, now);
    LOG.info("Condensed {} rows into {} rows with {} columns",
        table.size(), rows.size(), columns.size());
    return new CondensedTable(columns, rows);
  }

  /**
   * Joins the level's rows onto the running rows on the first {@code level}
   * keys. Matched and unmatched left rows keep the left order, unmatched
   * right rows follow in their own order.
   * @param left The running rows, each with {@code level} keys.
   * @param right The level's rows, each with {@code level + 1} keys.
   * @param level The level being joined.
   * @return The joined rows, each with {@code level + 1} keys.
   */
  static List<JoinRow> outerJoin(final List<JoinRow> left,
                                 final List<JoinRow> right,
                                 final int level) {
    final ListMultimap<List<String>, JoinRow> right_map =
        LinkedListMultimap.create();
    for (final JoinRow row : right) {
      right_map.put(row.keys.subList(0, level), row);
    }

    final Set<List<String>> completed = new HashSet<List<String>>();
    final List<JoinRow> joined = Lists.newArrayListWithCapacity(
        Math.max(left.size(), right.size()));
    for (final JoinRow row : left) {
      final List<JoinRow> matches = right_map.get(row.keys);
      if (matches.isEmpty()) {
        row.keys.add(null);
        joined.add(row);
        continue;
      }
      completed.add(row.keys);
      for (final JoinRow match : matches) {
        final Map<String, Object> values =
            new LinkedHashMap<String, Object>(row.values);
        values.putAll(match.values);
        joined.add(new JoinRow(new ArrayList<String>(match.keys), values));
      }
    }

    for (final JoinRow row : right) {
      if (!completed.contains(row.keys.subList(0, level))) {
        joined.add(row);
      }
    }
    return joined;
  }

  /**
   * Picks the level's suffix.
   * @param level The level.
   * @param rows The level's rows.
   * @param used Suffixes already taken, updated.
   * @return The suffix.
   */
  private String suffixFor(final int level,
                           final List<Map<String, Object>> rows,
                           final Set<String> used) {
    if (suffix_mode == SuffixMode.TEMPLATE) {
      final Set<Object> templates = Sets.newHashSet();
      for (final Map<String, Object> row : rows) {
        templates.add(row.get(Columns.TEMPLATE));
      }
      if (templates.size() == 1) {
        final Object template = templates.iterator().next();
        if (template != null && !used.contains(template)) {
          used.add((String) template);
          return (String) template;
        }
      }
    }
    final String suffix = Integer.toString(level);
    used.add(suffix);
    return suffix;
  }

  /**
   * Drops columns that are empty for the whole level, except the end time
   * of event levels which is filled later.
   * @param column The column.
   * @param rows The level's rows.
   * @return Whether or not to keep the column.
   */
  private static boolean keepColumn(final String column,
                                    final List<Map<String, Object>> rows) {
    for (final Map<String, Object> row : rows) {
      if (row.get(column) != null) {
        return true;
      }
      if (column.equals(Columns.END)
          && ((Node) row.get(Columns.NODE)).kind() == Node.Kind.EVENT) {
        return true;
      }
    }
    return false;
  }

  /**
   * Drops the keys and collapses rows whose values print the same.
   * @param joined The joined rows.
   * @param columns The output columns.
   * @return The unique rows in first seen order.
   */
  private static List<Map<String, Object>> dedupe(final List<JoinRow> joined,
                                                  final List<String> columns) {
    final Set<String> seen = new LinkedHashSet<String>();
    final List<Map<String, Object>> rows = Lists.newArrayList();
    final Joiner joiner = Joiner.on('\u0001').useForNull("");
    for (final JoinRow row : joined) {
      final List<Object> values = Lists.newArrayListWithCapacity(columns.size());
      for (final String column : columns) {
        values.add(row.values.get(column));
      }
      if (seen.add(joiner.join(values))) {
        rows.add(row.values);
      }
    }
    if (rows.size() != joined.size()) {
      LOG.debug("Dropped {} duplicate rows", joined.size() - rows.size());
    }
    return rows;
  }

  /**
   * Fills the end time columns in level order.
   * @param rows The rows to fill.
   * @param columns The columns in level order.
   * @param now The fill for the shallowest column.
   */
  private static void fillEndTimes(final List<Map<String, Object>> rows,
                                   final List<String> columns,
                                   final ZonedDateTime now) {
    final List<String> end_columns = Lists.newArrayList();
    for (final String column : columns) {
      if (Columns.baseName(column).equals(Columns.END)
          && Columns.isSuffixed(column)) {
        end_columns.add(column);
      }
    }
    for (final Map<String, Object> row : rows) {
      Object parent = now;
      for (final String column : end_columns) {
        if (row.get(column) == null) {
          row.put(column, parent);
        }
        parent = row.get(column);
      }
    }
  }

  /** A row carrying its path keys while joining. */
  static class JoinRow {
    final List<String> keys;
    final Map<String, Object> values;

    JoinRow(final List<String> keys, final Map<String, Object> values) {
      this.keys = keys;
      this.values = values;
    }
  }
}
