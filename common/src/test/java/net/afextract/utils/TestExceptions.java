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

import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;

public class TestExceptions {

  @Test
  public void getCause() throws Exception {
    final IllegalStateException cause = new IllegalStateException("Boo!");
    final Deferred<Object> good = Deferred.fromResult(null);
    final Deferred<Object> bad = Deferred.fromError(cause);
    final ArrayList<Deferred<Object>> deferreds = Lists.newArrayList(good, bad);
    try {
      Deferred.groupInOrder(deferreds).join();
      fail("Expected DeferredGroupException");
    } catch (DeferredGroupException e) {
      assertSame(cause, Exceptions.getCause(e));
    }
  }

  @Test
  public void asRuntime() throws Exception {
    final IllegalStateException runtime = new IllegalStateException("Boo!");
    assertSame(runtime, Exceptions.asRuntime(runtime));
    assertSame(runtime, Exceptions.asRuntime(
        new ExecutionException(runtime)));

    final IOException checked = new IOException("Boo!");
    final RuntimeException wrapped = Exceptions.asRuntime(checked);
    assertSame(checked, wrapped.getCause());

    try {
      Exceptions.asRuntime(new OutOfMemoryError("Boo!"));
      fail("Expected OutOfMemoryError");
    } catch (OutOfMemoryError e) {
      assertTrue(e.getMessage().contains("Boo!"));
    }
  }
}
