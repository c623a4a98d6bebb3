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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

import com.google.common.collect.Lists;

import net.afextract.HierarchyFixtures;
import net.afextract.data.Tag;
import net.afextract.data.TagSet;
import net.afextract.exceptions.DataSourceException;
import net.afextract.exceptions.ExecutionCanceledException;
import net.afextract.hierarchy.CondensedTable;
import net.afextract.hierarchy.HierarchyTable;
import net.afextract.table.Columns;
import net.afextract.table.ResultTable;
import net.afextract.threadpools.FixedWorkerPool;
import net.afextract.utils.Config;

public class TestChunkedParallelRunner extends HierarchyFixtures {
  private static final Tag A = new Tag("A", "a");
  private static final Tag B = new Tag("B", "b");
  private static final Tag C = new Tag("C", "c");

  private FixedWorkerPool pool;
  private Extractor extractor;
  private ChunkedParallelRunner runner;

  @Before
  public void before() throws Exception {
    when(data_source.interpolatedValues(any(), any(), any(), any(), any(),
        any())).thenAnswer(TestExtractor.hourly());
    when(data_source.summary(any(), any(), any(), any(), any(), any(),
        any())).thenAnswer(TestExtractor.averages());
    when(data_source.calculationSummary(any(), any(), any(), any(), any(),
        any(), any(), any(), any())).thenAnswer(TestExtractor.calculation());
    config.overrideConfig(Config.MAX_WORKERS_KEY, "4");
    pool = new FixedWorkerPool(config);
    extractor = new Extractor(data_source, config);
    runner = new ChunkedParallelRunner(extractor, pool, config);
  }

  @After
  public void after() throws Exception {
    pool.shutdown();
  }

  @Test
  public void ctor() throws Exception {
    try {
      new ChunkedParallelRunner(null, pool, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    try {
      new ChunkedParallelRunner(extractor, null, config);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void chunks() throws Exception {
    List<int[]> chunks = ChunkedParallelRunner.chunks(10, 4);
    assertEquals(3, chunks.size());
    assertArrayEquals(new int[] { 0, 4 }, chunks.get(0));
    assertArrayEquals(new int[] { 4, 8 }, chunks.get(1));
    assertArrayEquals(new int[] { 8, 10 }, chunks.get(2));

    chunks = ChunkedParallelRunner.chunks(4, 4);
    assertEquals(1, chunks.size());
    assertArrayEquals(new int[] { 0, 4 }, chunks.get(0));

    assertTrue(ChunkedParallelRunner.chunks(0, 4).isEmpty());
    assertEquals(3, ChunkedParallelRunner.chunks(3, 1).size());

    try {
      ChunkedParallelRunner.chunks(10, 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void interpolatedMatchesDirect() throws Exception {
    final CondensedTable condensed = table().condense();
    final ExtractRequest request = TestExtractor.interpolated()
        .setTagSet(TagSet.of(A, B)).build();
    final ResultTable direct = extractor.execute(condensed, request);

    for (final int chunk_size : new int[] { 1, 3, condensed.size(),
        condensed.size() + 1 }) {
      final ResultTable chunked = runner.run(condensed, request, chunk_size);
      assertEquals(direct.columns(), chunked.columns());
      assertEquals("chunk size " + chunk_size, direct.rows(), chunked.rows());
    }
  }

  @Test
  public void summaryMatchesDirect() throws Exception {
    final HierarchyTable table = table();
    final ExtractRequest request = TestExtractor.summary()
        .setTagSet(TagSet.of(A)).build();
    final ResultTable direct = extractor.execute(table, request);

    for (final int chunk_size : new int[] { 1, 3, table.size(),
        table.size() + 1 }) {
      final ResultTable chunked = runner.run(table, request, chunk_size);
      assertEquals(16, chunked.size());
      assertEquals(direct.columns(), chunked.columns());
      assertEquals("chunk size " + chunk_size, direct.rows(), chunked.rows());
      // chunk order is kept
      assertEquals("B1", chunked.get(0, Columns.NODE));
      assertEquals("P2b", chunked.get(15, Columns.NODE));
    }
  }

  @Test
  public void calcMatchesDirect() throws Exception {
    final CondensedTable condensed = table().condense();
    final ExtractRequest request = TestExtractor.calc()
        .setExpression("'A' + 'B'").build();
    final ResultTable chunked = runner.run(condensed, request, 2);
    assertEquals(extractor.execute(condensed, request).rows(), chunked.rows());
    assertEquals(4, chunked.size());
  }

  @Test
  public void defaultChunkSize() throws Exception {
    final CondensedTable condensed = table().condense();
    final ExtractRequest request = TestExtractor.interpolated()
        .setTagSet(TagSet.of(A)).build();
    assertEquals(23, runner.run(condensed, request).size());
  }

  @Test
  public void emptyScope() throws Exception {
    final HierarchyTable empty = new HierarchyTable(data_source,
        Collections.emptyList(), UTC);
    final ResultTable result = runner.run(empty, TestExtractor.summary()
        .setTagSet(TagSet.of(A)).build(), 2);
    assertEquals(0, result.size());
    assertTrue(result.columns().isEmpty());
  }

  @Test
  public void notChunkable() throws Exception {
    try {
      runner.run(table().condense(), ExtractRequest.newBuilder()
          .setOperation(Operation.RECORDED_EXTRACT)
          .setTagSet(TagSet.of(A))
          .build(), 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      runner.run(table().condense(), ExtractRequest.newBuilder()
          .setOperation(Operation.CONTINUOUS_INTERPOLATED_EXTRACT)
          .setTagSet(TagSet.of(A))
          .setInterval("1h")
          .build(), 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      runner.run(TagSet.of(A), NOW.minusHours(1), NOW,
          TestExtractor.calc().setExpression("'A'").build(), 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      runner.run(table(), null, 2);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void badChunkSize() throws Exception {
    try {
      runner.run(table(), TestExtractor.summary()
          .setTagSet(TagSet.of(A)).build(), 0);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void tagChunks() throws Exception {
    final ExtractRequest request = TestExtractor.summary()
        .setTagSet(TagSet.of(A)).build();
    final ResultTable result = runner.run(TagSet.of(A, B, C),
        NOW.minusHours(2), NOW, request, 2);
    assertEquals(6, result.size());
    assertEquals("A", result.get(0, Columns.TAG));
    assertEquals("C", result.get(4, Columns.TAG));

    verify(data_source).summary(eq(TagSet.of(A, B)), any(), any(), any(),
        any(), any(), any());
    verify(data_source).summary(eq(TagSet.of(C)), any(), any(), any(),
        any(), any(), any());
  }

  @Test
  public void tagChunksInterpolated() throws Exception {
    final ResultTable result = runner.run(TagSet.of(A, B, C),
        NOW.minusHours(2), NOW, TestExtractor.interpolated()
            .setTagSet(TagSet.of(A)).build(), 1);
    // each chunk has its own time column so rows are appended per chunk
    assertEquals(Lists.newArrayList(Columns.TIME, "A", "B", "C"),
        result.columns());
    assertEquals(9, result.size());
    assertEquals("C12", result.get(8, "C"));
    verify(data_source, times(3)).interpolatedValues(any(), any(), any(),
        any(), any(), any());
  }

  @Test
  public void chunkFailure() throws Exception {
    final IllegalStateException cause = new IllegalStateException("Boo!");
    doThrow(cause).when(data_source).summary(eq(TagSet.of(B)), any(), any(),
        any(), any(), any(), any());
    try {
      runner.run(TagSet.of(A, B, C), NOW.minusHours(2), NOW,
          TestExtractor.summary().setTagSet(TagSet.of(A)).build(), 1);
      fail("Expected DataSourceException");
    } catch (DataSourceException e) {
      assertTrue(e.getCause() == cause);
    }
    // every chunk still ran
    verify(data_source, times(3)).summary(any(), any(), any(), any(), any(),
        any(), any());
  }

  @Test
  public void timeout() throws Exception {
    config.overrideConfig(Config.TIMEOUT_KEY, "50");
    doAnswer(new Answer<Object>() {
      @Override
      public Object answer(final InvocationOnMock invocation)
          throws Throwable {
        Thread.sleep(10000);
        return Collections.emptyList();
      }
    }).when(data_source).summary(any(), any(), any(), any(), any(), any(),
        any());
    final ChunkedParallelRunner timed =
        new ChunkedParallelRunner(extractor, pool, config);
    try {
      timed.run(table(), TestExtractor.summary()
          .setTagSet(TagSet.of(A)).build(), 4);
      fail("Expected ExecutionCanceledException");
    } catch (ExecutionCanceledException e) {
      assertEquals(2, e.getPending());
    }
  }
}
