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
import static org.junit.Assert.assertNull;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import org.junit.Test;

import net.afextract.utils.DateTime;

public class TestTimeSeriesPoint {

  @Test
  public void fromSample() throws Exception {
    final ZoneId zone = ZoneId.of("America/Denver");
    final TimeSeriesPoint point = TimeSeriesPoint.fromSample(
        new Sample(Instant.parse("2024-01-01T12:00:00Z"), 42.5), zone);
    assertEquals(ZonedDateTime.of(2024, 1, 1, 5, 0, 0, 0, zone),
        point.timestamp());
    assertEquals(zone, point.timestamp().getZone());
    assertEquals(42.5, point.value());
  }

  @Test
  public void fromSampleSentinel() throws Exception {
    assertNull(TimeSeriesPoint.fromSample(
        new Sample(DateTime.MAX_SOURCE_TIME, "No Data"), ZoneId.of("UTC")));
  }
}
