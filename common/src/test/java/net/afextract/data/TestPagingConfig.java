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

import net.afextract.utils.Config;

public class TestPagingConfig {

  @Test
  public void fromConfig() throws Exception {
    final Config config = new Config();
    assertEquals(new PagingConfig(PagingConfig.PageType.EVENT_COUNT, 1000),
        PagingConfig.fromConfig(config));

    config.overrideConfig(Config.PAGING_TYPE_KEY, " tag_count ");
    config.overrideConfig(Config.PAGING_SIZE_KEY, "50");
    final PagingConfig paging = PagingConfig.fromConfig(config);
    assertEquals(PagingConfig.PageType.TAG_COUNT, paging.type());
    assertEquals(50, paging.size());
  }

  @Test
  public void ctorErrors() throws Exception {
    try {
      new PagingConfig(null, 10);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      new PagingConfig(PagingConfig.PageType.TAG_COUNT, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
