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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

public class TestResultTable {

  @Test
  public void addRow() throws Exception {
    final ResultTable table = new ResultTable(
        Lists.newArrayList(Columns.TIME, Columns.VALUE));
    assertSame(table, table.addRow(ImmutableMap.<String, Object>of(
        Columns.TIME, 1, Columns.VALUE, 42.0)));
    table.addRow(ImmutableMap.<String, Object>of(
        Columns.TIME, 2, "Extra", "x"));

    assertEquals(Lists.newArrayList(Columns.TIME, Columns.VALUE, "Extra"),
        table.columns());
    assertEquals(2, table.size());
    assertEquals(Lists.<Object>newArrayList(42.0, null),
        table.column(Columns.VALUE));
    assertEquals("x", table.row(1).get("Extra"));

    try {
      table.addRow(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      table.column("Nope");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void rowsAreCopies() throws Exception {
    final Map<String, Object> row = Maps.newLinkedHashMap();
    row.put(Columns.VALUE, 1);
    final ResultTable table = new ResultTable(Lists.newArrayList(Columns.VALUE))
        .addRow(row);
    row.put(Columns.VALUE, 2);
    assertEquals(1, table.get(0, Columns.VALUE));

    try {
      table.rows().get(0).put(Columns.VALUE, 3);
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }

  @Test
  public void sortBy() throws Exception {
    final ResultTable table = new ResultTable(
        Lists.newArrayList(Columns.TIME, Columns.VALUE));
    table.addRow(row(3, "a"));
    table.addRow(row(null, "b"));
    table.addRow(row(1, "c"));
    table.addRow(row(3, "d"));
    table.sortBy(Columns.TIME);

    assertEquals(Lists.<Object>newArrayList(1, 3, 3, null),
        table.column(Columns.TIME));
    // stable
    assertEquals(Lists.<Object>newArrayList("c", "a", "d", "b"),
        table.column(Columns.VALUE));

    try {
      table.sortBy("Nope");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void concat() throws Exception {
    final ResultTable a = new ResultTable(
        Lists.newArrayList(Columns.TIME, "A"));
    a.addRow(ImmutableMap.<String, Object>of(Columns.TIME, 1, "A", 1.0));
    final ResultTable b = new ResultTable(
        Lists.newArrayList(Columns.TIME, "B"));
    b.addRow(ImmutableMap.<String, Object>of(Columns.TIME, 2, "B", 2.0));
    final ResultTable empty = new ResultTable(
        Lists.<String>newArrayList());

    final ResultTable merged = ResultTable.concat(
        Lists.newArrayList(a, empty, b));
    assertEquals(Lists.newArrayList(Columns.TIME, "A", "B"), merged.columns());
    assertEquals(Lists.<Object>newArrayList(1, 2), merged.column(Columns.TIME));
    assertEquals(Lists.<Object>newArrayList(1.0, null), merged.column("A"));

    assertTrue(ResultTable.concat(Lists.<ResultTable>newArrayList())
        .columns().isEmpty());
  }

  private static Map<String, Object> row(final Object time,
                                         final String value) {
    final Map<String, Object> row = Maps.newLinkedHashMap();
    row.put(Columns.TIME, time);
    row.put(Columns.VALUE, value);
    return row;
  }
}
