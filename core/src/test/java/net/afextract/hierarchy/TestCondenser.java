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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.afextract.HierarchyFixtures;
import net.afextract.data.Node;
import net.afextract.extract.ScopedRow;
import net.afextract.table.Columns;
import net.afextract.utils.Config;

public class TestCondenser extends HierarchyFixtures {

  @Test
  public void condenseTwoBatches() throws Exception {
    final CondensedTable condensed = table().condense();

    // one row per phase
    assertEquals(4, condensed.size());
    int name_families = 0;
    for (final String column : condensed.columns()) {
      if (Columns.baseName(column).equals(Columns.NAME)) {
        name_families++;
      }
      assertTrue(column, Columns.isSuffixed(column));
      assertFalse(column, Columns.baseName(column).equals(Columns.PATH));
    }
    assertEquals(3, name_families);
    assertEquals(Lists.newArrayList("Node [0]", "Node [1]", "Node [2]"),
        condensed.nodeColumns());
    assertEquals("Node [2]", condensed.leafNodeColumn());

    assertEquals(Lists.<Object>newArrayList("P1a", "P1b", "P2a", "P2b"),
        condensed.column("Name [2]"));
    assertEquals(Lists.<Object>newArrayList("U1", "U1", "U2", "U2"),
        condensed.column("Name [1]"));
    assertEquals(Lists.<Object>newArrayList("B1", "B1", "B2", "B2"),
        condensed.column("Name [0]"));
    assertSame(B1, condensed.get(1, "Node [0]"));
    assertSame(P2B, condensed.get(3, "Node [2]"));
    assertEquals(2, condensed.get(0, "Level [2]"));
    assertEquals("Unit Procedure", condensed.get(0, "Template [1]"));
  }

  @Test
  public void condenseFillsEndTimes() throws Exception {
    final CondensedTable condensed = table().condense();

    // explicit ends are kept
    assertEquals(utc("2024-01-01T10:00:00Z"), condensed.get(0, "Endtime [0]"));
    assertEquals(utc("2024-01-01T09:00:00Z"), condensed.get(0, "Endtime [1]"));
    assertEquals(utc("2024-01-01T05:00:00Z"), condensed.get(0, "Endtime [2]"));

    // open batch is "now" and the unit inherits it
    assertEquals(NOW, condensed.get(2, "Endtime [0]"));
    assertEquals(NOW, condensed.get(2, "Endtime [1]"));
    assertEquals(utc("2024-01-02T05:00:00Z"), condensed.get(2, "Endtime [2]"));
    assertEquals(NOW, condensed.get(3, "Endtime [2]"));
  }

  @Test
  public void condenseInheritsParentEndTimes() throws Exception {
    final Node root = event("R", "Procedure",
        "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z");
    final Node child = event("R\\C", "Unit Procedure",
        "2024-03-01T01:00:00Z", null);
    final Node grandchild = event("R\\C\\G", "Phase",
        "2024-03-01T02:00:00Z", null);
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(root, child, grandchild), UTC).condense();

    assertEquals(1, condensed.size());
    final Object end = condensed.get(0, "Endtime [0]");
    assertEquals(utc("2024-03-02T00:00:00Z"), end);
    assertEquals(end, condensed.get(0, "Endtime [1]"));
    assertEquals(end, condensed.get(0, "Endtime [2]"));
  }

  @Test
  public void condenseKeepsSuffixedColumns() throws Exception {
    when(data_source.attributeValue(P1A, "Temp")).thenReturn(21.5);
    final HierarchyTable table = table();
    table.addAttributes(Lists.newArrayList("Temp"), "Phase");
    final CondensedTable condensed = table.condense();
    assertTrue(condensed.hasColumn("Temp [Phase]"));
    assertFalse(condensed.hasColumn("Temp [Phase] [2]"));
    // all missing at levels 0 and 1 so it appears once
    final List<String> temps = Lists.newArrayList();
    for (final String column : condensed.columns()) {
      if (Columns.baseName(column).equals("Temp")) {
        temps.add(column);
      }
    }
    assertEquals(Lists.newArrayList("Temp [Phase]"), temps);
    assertEquals(21.5, condensed.get(0, "Temp [Phase]"));
  }

  @Test
  public void condenseTemplateSuffixes() throws Exception {
    final CondensedTable condensed = table().condense(
        new Condenser(Condenser.SuffixMode.TEMPLATE));
    assertTrue(condensed.hasColumn("Name [Procedure]"));
    assertTrue(condensed.hasColumn("Name [Unit Procedure]"));
    assertTrue(condensed.hasColumn("Name [Phase]"));
    assertEquals("Node [Phase]", condensed.leafNodeColumn());
    assertEquals(4, condensed.scopedRows().size());
    assertEquals(NOW, condensed.get(3, "Endtime [Unit Procedure]"));
  }

  @Test
  public void condenseTemplateSuffixFallsBackToLevel() throws Exception {
    final Node mixed = event("B1\\U1\\P1c", "Other",
        "2024-01-01T05:00:00Z", "2024-01-01T09:00:00Z");
    final Node reused = event("B1\\U1\\P1a\\S1", "Procedure",
        "2024-01-01T01:00:00Z", "2024-01-01T02:00:00Z");
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(B1, U1, P1A, mixed, reused), UTC)
        .condense(new Condenser(Condenser.SuffixMode.TEMPLATE));

    assertTrue(condensed.hasColumn("Name [Procedure]"));
    assertTrue(condensed.hasColumn("Name [Unit Procedure]"));
    // two templates at level 2
    assertTrue(condensed.hasColumn("Name [2]"));
    // level 3 template already taken by level 0
    assertTrue(condensed.hasColumn("Name [3]"));
  }

  @Test
  public void condenseFromConfig() throws Exception {
    config.overrideConfig(Config.CONDENSE_SUFFIX_KEY, " Template ");
    assertEquals(Condenser.SuffixMode.TEMPLATE,
        new Condenser(config).suffixMode());
    config.overrideConfig(Config.CONDENSE_SUFFIX_KEY, "nope");
    try {
      new Condenser(config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void condenseKeepsAncestorsAndOrphans() throws Exception {
    final Node childless = event("B3", "Procedure",
        "2024-01-03T00:00:00Z", "2024-01-03T10:00:00Z");
    final Node orphan = event("B1\\U9\\P9", "Phase",
        "2024-01-01T06:00:00Z", "2024-01-01T07:00:00Z");
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(B1, childless, U1, P1A, orphan), UTC).condense();

    assertEquals(3, condensed.size());
    assertEquals(Lists.<Object>newArrayList("B1", "B3", null),
        condensed.column("Name [0]"));
    assertEquals(Lists.<Object>newArrayList("P1a", null, "P9"),
        condensed.column("Name [2]"));

    // the childless batch has no leaf node to extract for
    final List<ScopedRow> rows = condensed.scopedRows();
    assertEquals(2, rows.size());
    assertSame(P1A, rows.get(0).node());
    assertSame(orphan, rows.get(1).node());
    assertEquals(2, rows.get(1).index());
  }

  @Test
  public void condenseMissingLevel() throws Exception {
    final Node phase = event("B1\\U1\\P1", "Phase",
        "2024-01-01T01:00:00Z", "2024-01-01T02:00:00Z");
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(B1, phase), UTC).condense();

    assertEquals("<missing level>", Condenser.MISSING_LEVEL_KEY);
    assertEquals(2, condensed.size());
    assertTrue(condensed.hasColumn("Name [0]"));
    assertFalse(condensed.hasColumn("Name [1]"));
    assertTrue(condensed.hasColumn("Name [2]"));
    assertEquals(NOW, condensed.get(1, "Endtime [0]"));
    assertEquals(utc("2024-01-01T02:00:00Z"), condensed.get(1, "Endtime [2]"));
  }

  @Test
  public void condenseRootsNotAtLevelZero() throws Exception {
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(U1, P1A, P1B), UTC).condense();
    assertEquals(2, condensed.size());
    assertEquals(Lists.newArrayList("Node [1]", "Node [2]"),
        condensed.nodeColumns());
  }

  @Test
  public void condenseAssetsDropEmptyTimes() throws Exception {
    final Node plant = Node.newBuilder()
        .setKind(Node.Kind.ASSET)
        .setPath(PREFIX + "Plant")
        .build();
    final Node area = Node.newBuilder()
        .setKind(Node.Kind.ASSET)
        .setPath(PREFIX + "Plant\\Area")
        .setTemplate("Area")
        .build();
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.newArrayList(plant, area), UTC).condense();

    assertEquals(1, condensed.size());
    assertFalse(condensed.hasColumn("Endtime [0]"));
    assertFalse(condensed.hasColumn("Starttime [1]"));
    assertFalse(condensed.hasColumn("Template [0]"));
    assertTrue(condensed.hasColumn("Template [1]"));
  }

  @Test
  public void condenseEmpty() throws Exception {
    final CondensedTable condensed = new HierarchyTable(data_source,
        Lists.<Node>newArrayList(), UTC).condense();
    assertEquals(0, condensed.size());
    assertTrue(condensed.columns().isEmpty());
    assertNull(condensed.leafNodeColumn());
    assertTrue(condensed.scopedRows().isEmpty());
  }

  @Test
  public void outerJoin() throws Exception {
    final List<Condenser.JoinRow> left = Lists.newArrayList(
        joinRow("Name [0]", "A", "A"),
        joinRow("Name [0]", "B", "B"));
    final List<Condenser.JoinRow> right = Lists.newArrayList(
        joinRow("Name [1]", "A1", "A", "A1"),
        joinRow("Name [1]", "C1", "C", "C1"),
        joinRow("Name [1]", "A2", "A", "A2"));

    final List<Condenser.JoinRow> joined = Condenser.outerJoin(left, right, 1);
    assertEquals(4, joined.size());
    assertEquals(Lists.newArrayList("A", "A1"), joined.get(0).keys);
    assertEquals(ImmutableMap.of("Name [0]", "A", "Name [1]", "A1"),
        joined.get(0).values);
    assertEquals(Lists.newArrayList("A", "A2"), joined.get(1).keys);
    assertEquals(Lists.newArrayList("B", null), joined.get(2).keys);
    assertEquals(ImmutableMap.of("Name [0]", "B"), joined.get(2).values);
    assertEquals(Lists.newArrayList("C", "C1"), joined.get(3).keys);
    assertEquals(ImmutableMap.of("Name [1]", "C1"), joined.get(3).values);
  }

  private static Condenser.JoinRow joinRow(final String column,
                                           final Object value,
                                           final String... keys) {
    final Map<String, Object> values = new LinkedHashMap<String, Object>();
    values.put(column, value);
    return new Condenser.JoinRow(Lists.newArrayList(keys), values);
  }
}
