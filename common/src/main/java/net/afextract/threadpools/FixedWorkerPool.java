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
package net.afextract.threadpools;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.stumbleupon.async.Deferred;

import net.afextract.utils.Config;

/**
 * A fixed size pool with a bounded queue, sized from 
 * {@link Config#MAX_WORKERS_KEY} and {@link Config#QUEUE_MAX_SIZE_KEY}.
 * 
 * @since 1.0
 */
public class FixedWorkerPool implements WorkerPool {
  private static final Logger LOG = LoggerFactory.getLogger(FixedWorkerPool.class);

  /** The thread count. */
  private final int workers;
  
  /** The pool. */
  private final ExecutorService fixed_thread_pool;

  /**
   * Default ctor.
   * @param config A non-null config.
   * @throws IllegalArgumentException if the config was null or the sizes
   * were less than 1.
   */
  public FixedWorkerPool(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    workers = config.getInt(Config.MAX_WORKERS_KEY);
    final int max_size = config.getInt(Config.QUEUE_MAX_SIZE_KEY);
    if (workers < 1) {
      throw new IllegalArgumentException("Worker count must be at least 1: " 
          + workers);
    }
    if (max_size < 1) {
      throw new IllegalArgumentException("Queue size must be at least 1: " 
          + max_size);
    }
    LOG.info("Initializing new FixedWorkerPool with queue max capacity of {}", 
        max_size);
    fixed_thread_pool = new ThreadPoolExecutor(workers, workers, 0L, 
        TimeUnit.MILLISECONDS, 
        new LinkedBlockingQueue<Runnable>(max_size),
        new ThreadFactoryBuilder()
          .setNameFormat("afx-worker-%d")
          .setDaemon(true)
          .build());
    LOG.info("Initialized new FixedWorkerPool with {} threads", workers);
  }
  
  @Override
  public <T> Future<T> submit(final Callable<T> task) {
    return fixed_thread_pool.submit(task);
  }

  @Override
  public Future<?> submit(final Runnable task) {
    return fixed_thread_pool.submit(task);
  }
  
  @Override
  public int workers() {
    return workers;
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (!fixed_thread_pool.isShutdown()) {
      fixed_thread_pool.shutdown();
      LOG.info("Shutting down FixedWorkerPool, no more tasks will be executed!");
    }
    return Deferred.fromResult(null);
  }

  /** @return Whether or not the pool has been shut down. */
  public boolean isShutdown() {
    return fixed_thread_pool.isShutdown();
  }
  
}
