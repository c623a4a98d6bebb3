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
package net.afextract.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import org.junit.Test;

public final class TestDateTime {

  @Test
  public void zone() throws Exception {
    assertEquals(ZoneId.of("America/Los_Angeles"),
        DateTime.zone("America/Los_Angeles"));
    assertEquals(ZoneId.of("UTC"), DateTime.zone(DateTime.UTC_ID));
  }

  @Test
  public void zoneErrors() throws Exception {
    try {
      DateTime.zone(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.zone("");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      DateTime.zone("Nothere/Nowhere");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void isMaxSourceTime() throws Exception {
    assertTrue(DateTime.isMaxSourceTime(DateTime.MAX_SOURCE_TIME));
    assertTrue(DateTime.isMaxSourceTime(
        DateTime.MAX_SOURCE_TIME.plusSeconds(1)));
    assertFalse(DateTime.isMaxSourceTime(Instant.ofEpochSecond(1357300800L)));
    assertFalse(DateTime.isMaxSourceTime(null));
  }

  @Test
  public void toDisplay() throws Exception {
    final ZoneId zone = ZoneId.of("Europe/Berlin");
    final ZonedDateTime display = DateTime.toDisplay(
        Instant.parse("2024-07-01T10:00:00Z"), zone);
    assertEquals(12, display.getHour());
    assertEquals(zone, display.getZone());
    assertEquals(Instant.parse("2024-07-01T10:00:00Z"),
        DateTime.toSource(display));

    assertNull(DateTime.toDisplay(null, zone));
    assertNull(DateTime.toDisplay(DateTime.MAX_SOURCE_TIME, zone));
    assertNull(DateTime.toSource(null));
  }

  @Test
  public void parseDuration() throws Exception {
    assertEquals(500L, DateTime.parseDuration("500ms"));
    assertEquals(60000L, DateTime.parseDuration("60s"));
    assertEquals(60000L, DateTime.parseDuration("1m"));
    assertEquals(7200000L, DateTime.parseDuration("2h"));
    assertEquals(60L * 86400000L, DateTime.parseDuration("60d"));
    assertEquals(7L * 86400000L, DateTime.parseDuration("1w"));
    assertEquals(30L * 86400000L, DateTime.parseDuration("1n"));
    assertEquals(365L * 86400000L, DateTime.parseDuration("1y"));
    assertEquals(86400000L, DateTime.parseDuration("1D"));
  }

  @Test
  public void parseDurationErrors() throws Exception {
    final String[] bad = new String[] { "", "60", "s", "0s", "1x", "1.5h" };
    for (final String duration : bad) {
      try {
        DateTime.parseDuration(duration);
        fail("Expected IllegalArgumentException for " + duration);
      } catch (IllegalArgumentException e) { }
    }

    try {
      DateTime.parseDuration(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
