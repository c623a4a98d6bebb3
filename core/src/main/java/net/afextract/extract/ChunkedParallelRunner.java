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

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.DeferredGroupException;
import com.stumbleupon.async.TimeoutException;

import net.afextract.data.TagSet;
import net.afextract.exceptions.ExecutionCanceledException;
import net.afextract.table.ResultTable;
import net.afextract.utils.Config;
import net.afextract.utils.Exceptions;
import net.afextract.threadpools.WorkerPool;

/**
 * Splits the rows of a scope, or a set of tags, into consecutive chunks and
 * runs the extraction for each chunk on the worker pool. Each chunk writes
 * into its own {@link Deferred} slot and the calling thread concatenates the
 * slots in chunk order.
 * <p>
 * Only {@link Operation#isChunkable()} operations are accepted. If any chunk
 * fails, every failure is logged and the first is rethrown once all chunks
 * have finished. A configured timeout cancels the outstanding chunks.
 *
 * @since 1.0
 */
public class ChunkedParallelRunner {
  private static final Logger LOG = LoggerFactory.getLogger(
      ChunkedParallelRunner.class);

  /** The extractor each chunk runs. */
  private final Extractor extractor;

  /** Where chunks run. */
  private final WorkerPool pool;

  /** Chunk size when none is given. */
  private final int default_chunk_size;

  /** How long to wait in ms, 0 for ever. */
  private final long timeout;

  /**
   * Default ctor.
   * @param extractor A non-null extractor.
   * @param pool A non-null worker pool.
   * @param config A non-null config.
   */
  public ChunkedParallelRunner(final Extractor extractor,
                               final WorkerPool pool,
                               final Config config) {
    if (extractor == null) {
      throw new IllegalArgumentException("Extractor cannot be null.");
    }
    if (pool == null) {
      throw new IllegalArgumentException("Worker pool cannot be null.");
    }
    this.extractor = extractor;
    this.pool = pool;
    default_chunk_size = config.getInt(Config.CHUNK_SIZE_KEY);
    timeout = config.getLong(Config.TIMEOUT_KEY);
  }

  /**
   * Runs the extraction over the scope with the configured chunk size.
   * @param scope A non-null scope.
   * @param request A non-null chunkable request.
   * @return The concatenated results.
   */
  public ResultTable run(final ExtractionScope scope,
                         final ExtractRequest request) {
    return run(scope, request, default_chunk_size);
  }

  /**
   * Runs the extraction over the scope.
   * @param scope A non-null scope.
   * @param request A non-null chunkable request.
   * @param chunk_size The rows per chunk, at least 1.
   * @return The concatenated results.
   * @throws IllegalArgumentException if the operation can't be chunked or
   * the chunk size was less than 1.
   * @throws ExecutionCanceledException if the run timed out.
   */
  public ResultTable run(final ExtractionScope scope,
                         final ExtractRequest request,
                         final int chunk_size) {
    checkChunkable(request);
    final List<Callable<ResultTable>> tasks = Lists.newArrayList();
    for (final int[] bounds : chunks(scope.size(), chunk_size)) {
      final ExtractionScope chunk = scope.slice(bounds[0], bounds[1]);
      tasks.add(() -> extractor.execute(chunk, request));
    }
    return runChunks(tasks, request.operation());
  }

  /**
   * Runs the extraction over the tags with the configured chunk size.
   * @param tags A non-null set of tags.
   * @param start The non-null start.
   * @param end The non-null end.
   * @param request A non-null chunkable request.
   * @return The concatenated results.
   */
  public ResultTable run(final TagSet tags,
                         final ZonedDateTime start,
                         final ZonedDateTime end,
                         final ExtractRequest request) {
    return run(tags, start, end, request, default_chunk_size);
  }

  /**
   * Runs the extraction over the tags.
   * @param tags A non-null set of tags.
   * @param start The non-null start.
   * @param end The non-null end.
   * @param request A non-null chunkable request.
   * @param chunk_size The tags per chunk, at least 1.
   * @return The concatenated results.
   * @throws IllegalArgumentException if the operation can't be chunked over
   * tags or the chunk size was less than 1.
   * @throws ExecutionCanceledException if the run timed out.
   */
  public ResultTable run(final TagSet tags,
                         final ZonedDateTime start,
                         final ZonedDateTime end,
                         final ExtractRequest request,
                         final int chunk_size) {
    checkChunkable(request);
    if (request.operation() == Operation.CALC_SUMMARY_EXTRACT) {
      throw new IllegalArgumentException(request.operation()
          + " does not run over a tag set");
    }
    final List<Callable<ResultTable>> tasks = Lists.newArrayList();
    for (final int[] bounds : chunks(tags.size(), chunk_size)) {
      final TagSet chunk = tags.slice(bounds[0], bounds[1]);
      tasks.add(() -> extractor.execute(chunk, start, end, request));
    }
    return runChunks(tasks, request.operation());
  }

  /**
   * Computes consecutive chunk bounds. The last chunk may be shorter, there
   * are no empty chunks.
   * @param size The number of items.
   * @param chunk_size The items per chunk.
   * @return A list of {@code [from, to)} pairs.
   * @throws IllegalArgumentException if the chunk size was less than 1.
   */
  public static List<int[]> chunks(final int size, final int chunk_size) {
    if (chunk_size < 1) {
      throw new IllegalArgumentException("Chunk size must be at least 1: "
          + chunk_size);
    }
    final List<int[]> chunks = Lists.newArrayList();
    for (int from = 0; from < size; from += chunk_size) {
      chunks.add(new int[] { from, Math.min(size, from + chunk_size) });
    }
    return chunks;
  }

  /**
   * Submits the tasks and waits for all of them.
   * @param tasks The tasks in chunk order.
   * @param operation The operation for logging.
   * @return The concatenated results.
   */
  private ResultTable runChunks(final List<Callable<ResultTable>> tasks,
                                final Operation operation) {
    if (tasks.isEmpty()) {
      return new ResultTable(new ArrayList<String>());
    }
    LOG.info("Running {} in {} chunks on {} workers",
        operation, tasks.size(), pool.workers());

    final List<Deferred<ResultTable>> slots =
        Lists.newArrayListWithCapacity(tasks.size());
    final List<Future<?>> futures =
        Lists.newArrayListWithCapacity(tasks.size());
    for (int i = 0; i < tasks.size(); i++) {
      final Callable<ResultTable> task = tasks.get(i);
      final Deferred<ResultTable> slot = new Deferred<ResultTable>();
      slots.add(slot);
      final int order = i;
      try {
        futures.add(pool.submit(new Runnable() {
          @Override
          public void run() {
            try {
              slot.callback(task.call());
            } catch (Exception e) {
              LOG.debug("Chunk {} of {} failed", order, operation, e);
              slot.callback(e);
            } catch (Throwable t) {
              LOG.debug("Chunk {} of {} failed", order, operation, t);
              slot.callback(new RuntimeException(t));
            }
          }
        }));
      } catch (RejectedExecutionException e) {
        cancel(futures);
        throw new ExecutionCanceledException("Worker pool rejected chunk "
            + order + " of " + operation, tasks.size() - order, e);
      }
    }

    try {
      final Deferred<ArrayList<ResultTable>> group =
          Deferred.groupInOrder(slots);
      final ArrayList<ResultTable> results = timeout > 0 ?
          group.join(timeout) : group.join();
      return ResultTable.concat(results);
    } catch (DeferredGroupException e) {
      int failed = 0;
      for (int i = 0; i < e.results().size(); i++) {
        final Object result = e.results().get(i);
        if (result instanceof Throwable) {
          LOG.error("Chunk {} of {} failed", i, operation, (Throwable) result);
          failed++;
        }
      }
      LOG.error("{} of {} chunks failed for {}",
          failed, tasks.size(), operation);
      throw Exceptions.asRuntime(Exceptions.getCause(e));
    } catch (TimeoutException e) {
      final int pending = cancel(futures);
      throw new ExecutionCanceledException(operation + " timed out after "
          + timeout + "ms with " + pending + " chunks outstanding",
          pending, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      final int pending = cancel(futures);
      throw new ExecutionCanceledException(operation + " was interrupted "
          + "with " + pending + " chunks outstanding", pending, e);
    } catch (Exception e) {
      throw Exceptions.asRuntime(e);
    }
  }

  /**
   * Cancels and interrupts unfinished chunks.
   * @param futures The chunk futures.
   * @return The number of chunks that had not finished.
   */
  private static int cancel(final List<Future<?>> futures) {
    int pending = 0;
    for (final Future<?> future : futures) {
      if (!future.isDone()) {
        future.cancel(true);
        pending++;
      }
    }
    return pending;
  }

  /**
   * @param request The request.
   * @throws IllegalArgumentException if the operation can't be chunked.
   */
  private static void checkChunkable(final ExtractRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (!request.operation().isChunkable()) {
      throw new IllegalArgumentException("Chunked runs only support "
          + "interpolated, summary and calculation summary extracts, not "
          + request.operation());
    }
  }
}
