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

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;

import net.afextract.data.DataSource;
import net.afextract.data.Node;
import net.afextract.exceptions.EmptyResultException;
import net.afextract.exceptions.NotFoundException;
import net.afextract.extract.ExtractionScope;
import net.afextract.extract.ScopedRow;
import net.afextract.table.BaseTable;
import net.afextract.table.Columns;
import net.afextract.utils.DateTime;

/**
 * A flat table with one row per node of a hierarchy. Starts with the
 * {@link Columns#STRUCTURAL} columns and may be extended with attribute and
 * referenced element columns for the rows of one template.
 * <p>
 * Only the owning thread may augment the table.
 *
 * @since 1.0
 */
public class HierarchyTable extends BaseTable implements ExtractionScope {
  private static final Logger LOG = LoggerFactory.getLogger(HierarchyTable.class);

  /** The source used for augmentation. */
  protected final DataSource data_source;

  /** The display zone. */
  protected final ZoneId zone;

  /**
   * Ctor flattening the nodes. Duplicates by path are dropped, keeping the
   * first.
   * @param data_source The non-null data source.
   * @param nodes The non-null nodes.
   * @param zone The non-null display zone.
   */
  public HierarchyTable(final DataSource data_source,
                        final List<Node> nodes,
                        final ZoneId zone) {
    super(Lists.newArrayList(Columns.NODE, Columns.PATH, Columns.NAME,
        Columns.LEVEL, Columns.TEMPLATE, Columns.START, Columns.END));
    if (data_source == null) {
      throw new IllegalArgumentException("Data source cannot be null.");
    }
    if (nodes == null) {
      throw new IllegalArgumentException("Nodes cannot be null.");
    }
    if (zone == null) {
      throw new IllegalArgumentException("Zone cannot be null.");
    }
    this.data_source = data_source;
    this.zone = zone;

    final Map<String, Node> unique = new LinkedHashMap<String, Node>();
    for (final Node node : nodes) {
      if (!unique.containsKey(node.path())) {
        unique.put(node.path(), node);
      }
    }
    for (final Node node : unique.values()) {
      final Map<String, Object> row = new LinkedHashMap<String, Object>();
      row.put(Columns.NODE, node);
      row.put(Columns.PATH, node.path());
      row.put(Columns.NAME, node.name());
      row.put(Columns.LEVEL, node.level());
      row.put(Columns.TEMPLATE, node.template());
      row.put(Columns.START, DateTime.toDisplay(node.start(), zone));
      row.put(Columns.END, DateTime.toDisplay(node.end(), zone));
      rows.add(row);
    }
    if (unique.size() != nodes.size()) {
      LOG.debug("Dropped {} duplicate nodes", nodes.size() - unique.size());
    }
  }

  /**
   * Ctor for slices.
   * @param table The source table.
   * @param rows The rows to keep.
   */
  protected HierarchyTable(final HierarchyTable table,
                           final List<Map<String, Object>> rows) {
    super(table.columns, rows);
    data_source = table.data_source;
    zone = table.zone;
  }

  /**
   * Loads the roots and their descendants into a table.
   * @param data_source The non-null data source.
   * @param roots The non-null roots.
   * @param depth How many levels below the roots to load.
   * @param max_count The max number of descendants to load.
   * @param zone The non-null display zone.
   * @return The table.
   */
  public static HierarchyTable build(final DataSource data_source,
                                     final List<Node> roots,
                                     final int depth,
                                     final int max_count,
                                     final ZoneId zone) {
    if (roots == null) {
      throw new IllegalArgumentException("Roots cannot be null.");
    }
    if (depth < 0) {
      throw new IllegalArgumentException("Depth cannot be negative: " + depth);
    }
    final List<Node> nodes = Lists.newArrayList(roots);
    if (!roots.isEmpty() && depth > 0) {
      nodes.addAll(data_source.loadDescendants(roots, depth, max_count));
    }
    LOG.info("Loaded {} nodes for {} roots to depth {}",
        nodes.size(), roots.size(), depth);
    return new HierarchyTable(data_source, nodes, zone);
  }

  /**
   * Adds a column per attribute, filled for the rows of the given template
   * only. A fetch that fails for one cell leaves that cell missing. Numeric
   * looking columns are cast to doubles afterwards.
   * @param attributes The non-null attribute names.
   * @param template The template to scope to, null for untemplated rows.
   * @return The table.
   * @throws NotFoundException if no row has the template.
   */
  public HierarchyTable addAttributes(final List<String> attributes,
                                      final String template) {
    if (attributes == null) {
      throw new IllegalArgumentException("Attributes cannot be null.");
    }
    final List<Integer> scope = rowsForTemplate(template);
    final String label = Columns.scopeLabel(template);
    LOG.info("Fetching {} attribute(s) for {} rows of template {}",
        attributes.size(), scope.size(), label);
    for (final String attribute : attributes) {
      final String column = attribute + " [" + label + "]";
      addColumn(column);
      for (final int index : scope) {
        final Node node = (Node) rows.get(index).get(Columns.NODE);
        Object value;
        try {
          value = data_source.attributeValue(node, attribute);
        } catch (RuntimeException e) {
          LOG.warn("Failed to fetch attribute {} for {}",
              attribute, node.path(), e);
          value = null;
        }
        set(index, column, value);
      }
    }
    castNumericColumns();
    return this;
  }

  /**
   * Adds attributes for the template of the first row at the given level.
   * @param attributes The non-null attribute names.
   * @param level The level to scope to.
   * @return The table.
   * @throws NotFoundException if no row is at the level.
   */
  public HierarchyTable addAttributes(final List<String> attributes,
                                      final int level) {
    return addAttributes(attributes, templateAtLevel(level));
  }

  /**
   * Fans the referenced elements of the rows of the given template out into
   * {@code Referenced_el [template](i)} columns.
   * @param template The template to scope to, null for untemplated rows.
   * @return The table.
   * @throws NotFoundException if no row has the template.
   * @throws EmptyResultException if none of the rows reference anything.
   */
  public HierarchyTable addReferencedElements(final String template) {
    final List<Integer> scope = rowsForTemplate(template);
    final String label = Columns.scopeLabel(template);
    final Map<Integer, List<String>> referenced =
        new LinkedHashMap<Integer, List<String>>();
    int max = 0;
    for (final int index : scope) {
      final Node node = (Node) rows.get(index).get(Columns.NODE);
      List<String> elements = data_source.referencedElements(node);
      if (elements == null) {
        elements = Collections.emptyList();
      }
      referenced.put(index, elements);
      max = Math.max(max, elements.size());
    }
    if (max == 0) {
      throw new EmptyResultException(
          "No results found for the specified template: " + label, label);
    }
    for (int i = 0; i < max; i++) {
      addColumn(Columns.REFERENCED_ELEMENT + " [" + label + "](" + i + ")");
    }
    for (final Map.Entry<Integer, List<String>> entry : referenced.entrySet()) {
      for (int i = 0; i < entry.getValue().size(); i++) {
        set(entry.getKey(),
            Columns.REFERENCED_ELEMENT + " [" + label + "](" + i + ")",
            entry.getValue().get(i));
      }
    }
    return this;
  }

  /**
   * Adds referenced elements for the template of the first row at the given
   * level.
   * @param level The level to scope to.
   * @return The table.
   */
  public HierarchyTable addReferencedElements(final int level) {
    return addReferencedElements(templateAtLevel(level));
  }

  /**
   * Condenses the table with level suffixes.
   * @return The condensed table.
   */
  public CondensedTable condense() {
    return condense(new Condenser(Condenser.SuffixMode.LEVEL));
  }

  /**
   * Condenses the table with the given condenser.
   * @param condenser A non-null condenser.
   * @return The condensed table.
   */
  public CondensedTable condense(final Condenser condenser) {
    return condenser.condense(this, data_source.currentTime(zone));
  }

  /** @return The display zone. */
  public ZoneId zone() {
    return zone;
  }

  @Override
  public List<ScopedRow> scopedRows() {
    final List<ScopedRow> scoped = Lists.newArrayListWithCapacity(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      final Map<String, Object> row = rows.get(i);
      scoped.add(new ScopedRow(i,
          (Node) row.get(Columns.NODE),
          (ZonedDateTime) row.get(Columns.START),
          (ZonedDateTime) row.get(Columns.END),
          Collections.unmodifiableMap(row)));
    }
    return scoped;
  }

  @Override
  public HierarchyTable slice(final int from, final int to) {
    return new HierarchyTable(this, rows.subList(from, to));
  }

  /**
   * @param template A template, may be null.
   * @return The indices of the rows with the template.
   * @throws NotFoundException if there weren't any.
   */
  private List<Integer> rowsForTemplate(final String template) {
    final List<Integer> scope = Lists.newArrayList();
    for (int i = 0; i < rows.size(); i++) {
      if (Objects.equal(template, rows.get(i).get(Columns.TEMPLATE))) {
        scope.add(i);
      }
    }
    if (scope.isEmpty()) {
      throw new NotFoundException("No rows found for template: "
          + Columns.scopeLabel(template), template);
    }
    return scope;
  }

  /**
   * @param level A level.
   * @return The template of the first row at the level, may be null.
   * @throws NotFoundException if no row is at the level.
   */
  private String templateAtLevel(final int level) {
    for (final Map<String, Object> row : rows) {
      if (((Integer) row.get(Columns.LEVEL)) == level) {
        return (String) row.get(Columns.TEMPLATE);
      }
    }
    throw new NotFoundException("No rows found at level: " + level,
        Integer.toString(level));
  }

  /**
   * Converts every non-structural column whose values are all numeric to
   * doubles. Anything else is left alone.
   */
  private void castNumericColumns() {
    for (final String column : columns) {
      if (Columns.STRUCTURAL.contains(column)) {
        continue;
      }
      boolean numeric = false;
      for (final Map<String, Object> row : rows) {
        final Object value = row.get(column);
        if (value == null) {
          continue;
        }
        if (toDouble(value) == null) {
          numeric = false;
          break;
        }
        numeric = true;
      }
      if (!numeric) {
        continue;
      }
      for (final Map<String, Object> row : rows) {
        final Object value = row.get(column);
        if (value != null) {
          row.put(column, toDouble(value));
        }
      }
    }
  }

  /**
   * @param value A non-null value.
   * @return The value as a double or null if it isn't numeric.
   */
  private static Double toDouble(final Object value) {
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      return Doubles.tryParse(((String) value).trim());
    }
    return null;
  }
}
