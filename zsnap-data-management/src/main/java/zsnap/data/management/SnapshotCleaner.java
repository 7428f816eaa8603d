/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package zsnap.data.management;

import java.io.IOException;
import java.io.PrintStream;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.config.CleanerConfig;
import zsnap.data.management.config.PoolConfig;
import zsnap.data.management.config.PoolConfigurator;
import zsnap.data.management.dataset.Filesystem;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.PoolDiscovery;
import zsnap.data.management.eviction.EvictionPolicyFactory;
import zsnap.data.management.eviction.EvictionResult;
import zsnap.data.management.eviction.EvictionScheduler;
import zsnap.data.management.prune.FilePruner;
import zsnap.data.management.report.PoolReport;
import zsnap.data.management.report.SnapshotStatusLister;
import zsnap.data.management.retention.MaxRetentionEnforcer;
import zsnap.data.management.retention.SnapshotDestroyer;


/**
 * Runs the cleaning passes over every configured pool, in configuration order.
 *
 * <p>
 *   For each pool: discovery, then either the list mode output, or in this order the destruction of snapshots out of
 *   their maxRetention, the file age pass, the file capacity pass, best effort eviction and the final report.
 * </p>
 */
@Slf4j
public class SnapshotCleaner {

  private final PrintStream out;
  private final PoolDiscovery discovery;
  private final PoolConfigurator configurator;
  private final MaxRetentionEnforcer maxRetentionEnforcer;
  private final FilePruner filePruner;
  private final EvictionScheduler evictionScheduler;

  public SnapshotCleaner(CleanerContext context, PrintStream out) {
    this(context, out, new EvictionPolicyFactory());
  }

  public SnapshotCleaner(CleanerContext context, PrintStream out, EvictionPolicyFactory policyFactory) {
    this.out = out;
    SnapshotDestroyer destroyer = new SnapshotDestroyer(context);
    this.discovery = new PoolDiscovery(context);
    this.configurator = new PoolConfigurator(policyFactory);
    this.maxRetentionEnforcer = new MaxRetentionEnforcer(destroyer);
    this.filePruner = new FilePruner(context);
    this.evictionScheduler = new EvictionScheduler(destroyer, policyFactory);
  }

  public void run(CleanerConfig config, boolean listOnly) throws IOException {
    for (PoolConfig poolConfig : config.getPools()) {
      if (listOnly) {
        list(poolConfig);
      } else {
        clean(poolConfig);
      }
    }
  }

  /**
   * Print the keep decision of every snapshot of the pool.
   */
  public void list(PoolConfig poolConfig) throws IOException {
    Pool pool = load(poolConfig);
    for (String line : new SnapshotStatusLister().list(pool)) {
      this.out.println(line);
    }
  }

  /**
   * Run every cleaning pass on the pool.
   *
   * @return the final report
   */
  public PoolReport clean(PoolConfig poolConfig) throws IOException {
    Pool pool = load(poolConfig);

    this.maxRetentionEnforcer.enforce(pool);

    for (Filesystem filesystem : pool.getFilesystems()) {
      this.filePruner.deleteFilesOverMaxFileAge(filesystem);
    }
    for (Filesystem filesystem : pool.getFilesystems()) {
      this.filePruner.deleteOldestFilesOverMaxCapacity(filesystem);
    }

    EvictionResult eviction = this.evictionScheduler.run(pool);
    log.info(String.format("Destroyed %d best effort snapshots on pool %s", eviction.getDestroyedSnapshots(), pool));

    PoolReport report = PoolReport.of(pool);
    report.log();
    return report;
  }

  private Pool load(PoolConfig poolConfig) throws IOException {
    log.info(String.format("Getting datasets information for zpool %s, this may take a while...",
        poolConfig.getName()));
    Pool pool = this.discovery.discover(poolConfig.getName());
    this.configurator.configure(pool, poolConfig);
    return pool;
  }
}
