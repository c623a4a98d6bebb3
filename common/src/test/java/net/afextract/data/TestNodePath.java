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
package net.afextract.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestNodePath {

  @Test
  public void level() throws Exception {
    assertEquals(0, NodePath.level("\\\\Srv\\DB\\Batch1"));
    assertEquals(1, NodePath.level("\\\\Srv\\DB\\Batch1\\Unit1"));
    assertEquals(2, NodePath.level("\\\\Srv\\DB\\Batch1\\Unit1\\Phase1"));
  }

  @Test
  public void keys() throws Exception {
    assertEquals(Lists.newArrayList("Batch1", "Unit1", "Phase1"),
        NodePath.keys("\\\\Srv\\DB\\Batch1\\Unit1\\Phase1"));
    assertEquals("Batch1", NodePath.root("\\\\Srv\\DB\\Batch1\\Unit1"));
    assertEquals("Unit1", NodePath.leaf("\\\\Srv\\DB\\Batch1\\Unit1"));
  }

  @Test
  public void split() throws Exception {
    assertEquals(Lists.newArrayList("", "", "Srv", "DB", "Batch1"),
        NodePath.split("\\\\Srv\\DB\\Batch1"));

    try {
      NodePath.split(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      NodePath.split("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      NodePath.split("\\\\Srv\\DB");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
