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
package net.afextract.core;

import java.io.Closeable;
import java.time.ZoneId;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.afextract.data.DataSource;
import net.afextract.data.DataSourceFactory;
import net.afextract.data.Node;
import net.afextract.exceptions.NotFoundException;
import net.afextract.extract.ChunkedParallelRunner;
import net.afextract.extract.Extractor;
import net.afextract.hierarchy.CondensedTable;
import net.afextract.hierarchy.Condenser;
import net.afextract.hierarchy.HierarchyTable;
import net.afextract.threadpools.FixedWorkerPool;
import net.afextract.threadpools.WorkerPool;
import net.afextract.utils.Config;

/**
 * The entry point tying a config and a data source to the hierarchy,
 * extraction and chunked execution components. The caller owns the data
 * source, {@link #close()} only releases the worker pool.
 *
 * @since 1.0
 */
public class HierarchyEngine implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(HierarchyEngine.class);

  /** The config. */
  private final Config config;

  /** The data source. */
  private final DataSource data_source;

  /** The display zone. */
  private final ZoneId zone;

  /** The condenser built from the config. */
  private final Condenser condenser;

  /** The extractor. */
  private final Extractor extractor;

  /** The worker pool for chunked runs. */
  private final WorkerPool pool;

  /** The chunked runner. */
  private final ChunkedParallelRunner runner;

  /**
   * Ctor creating a fixed worker pool from the config.
   * @param config A non-null config.
   * @param data_source A non-null data source.
   */
  public HierarchyEngine(final Config config, final DataSource data_source) {
    this(config, data_source, new FixedWorkerPool(config));
  }

  /**
   * Ctor with a given pool.
   * @param config A non-null config.
   * @param data_source A non-null data source.
   * @param pool A non-null worker pool, shut down on close.
   */
  public HierarchyEngine(final Config config,
                         final DataSource data_source,
                         final WorkerPool pool) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (data_source == null) {
      throw new IllegalArgumentException("Data source cannot be null.");
    }
    if (pool == null) {
      throw new IllegalArgumentException("Worker pool cannot be null.");
    }
    this.config = config;
    this.data_source = data_source;
    zone = config.getTimeZone();
    condenser = new Condenser(config);
    extractor = new Extractor(data_source, config);
    this.pool = pool;
    runner = new ChunkedParallelRunner(extractor, pool, config);
    LOG.info("Initialized engine with display zone {} and {} workers",
        zone, pool.workers());
  }

  /**
   * Connects through the factory and builds an engine.
   * @param config A non-null config.
   * @param factory A non-null data source factory.
   * @return The engine.
   */
  public static HierarchyEngine connect(final Config config,
                                        final DataSourceFactory factory) {
    if (factory == null) {
      throw new IllegalArgumentException("Factory cannot be null.");
    }
    return new HierarchyEngine(config, factory.connect(config));
  }

  /**
   * Loads the roots and descendants to the configured depth.
   * @param roots The non-null roots.
   * @return The table.
   */
  public HierarchyTable buildHierarchy(final List<Node> roots) {
    return buildHierarchy(roots, config.getInt(Config.HIERARCHY_DEPTH_KEY));
  }

  /**
   * Loads the roots and descendants to the given depth.
   * @param roots The non-null roots.
   * @param depth How many levels below the roots to load.
   * @return The table.
   */
  public HierarchyTable buildHierarchy(final List<Node> roots,
                                       final int depth) {
    return HierarchyTable.build(data_source, roots, depth,
        config.getInt(Config.HIERARCHY_MAX_NODES_KEY), zone);
  }

  /**
   * Searches for roots and loads their descendants.
   * @param query The source specific root query.
   * @param start The opaque search start, e.g. "*-1d".
   * @param end The opaque search end, e.g. "*".
   * @param template An optional root template filter.
   * @param depth How many levels below the roots to load.
   * @return The table.
   * @throws NotFoundException if no roots matched.
   */
  public HierarchyTable findHierarchy(final String query,
                                      final String start,
                                      final String end,
                                      final String template,
                                      final int depth) {
    final List<Node> roots = data_source.findNodes(query, start, end,
        template, config.getInt(Config.HIERARCHY_MAX_NODES_KEY));
    if (roots == null || roots.isEmpty()) {
      throw new NotFoundException("No nodes were found for query: " + query,
          query);
    }
    return buildHierarchy(roots, depth);
  }

  /**
   * Condenses with the configured suffix mode.
   * @param table A non-null table.
   * @return The condensed table.
   */
  public CondensedTable condense(final HierarchyTable table) {
    return table.condense(condenser);
  }

  /** @return The config. */
  public Config config() {
    return config;
  }

  /** @return The data source. */
  public DataSource dataSource() {
    return data_source;
  }

  /** @return The extractor. */
  public Extractor extractor() {
    return extractor;
  }

  /** @return The worker pool. */
  public WorkerPool pool() {
    return pool;
  }

  /** @return The chunked runner. */
  public ChunkedParallelRunner runner() {
    return runner;
  }

  @Override
  public void close() {
    pool.shutdown();
  }
}
