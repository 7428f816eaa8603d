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

package zsnap.data.management.config;

import com.google.common.base.Optional;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Filesystem;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.eviction.EvictionPolicyFactory;
import zsnap.data.management.prune.MaxFileAgeParser;
import zsnap.data.management.retention.policy.RetentionPolicyParser;


/**
 * Attaches a {@link PoolConfig} to a discovered {@link Pool}. Datasets that do not exist on the pool are reported and
 * skipped; any invalid value aborts.
 */
@Slf4j
public class PoolConfigurator {

  private final EvictionPolicyFactory policyFactory;

  public PoolConfigurator(EvictionPolicyFactory policyFactory) {
    this.policyFactory = policyFactory;
  }

  public void configure(Pool pool, PoolConfig config) {
    // throws on an unknown policy
    this.policyFactory.create(config.getBestEffortPolicy());
    pool.setBestEffortPolicy(config.getBestEffortPolicy());
    pool.setMaxCapacity(config.getMaxCapacity());

    for (DatasetConfig datasetConfig : config.getDatasets()) {
      Optional<Dataset> dataset = pool.getDataset(datasetConfig.getName());
      if (!dataset.isPresent()) {
        log.error(String.format("Dataset '%s' does NOT exist on Zpool '%s'", datasetConfig.getName(), pool));
        continue;
      }
      configure(dataset.get(), datasetConfig);
    }
  }

  private void configure(Dataset dataset, DatasetConfig config) {
    if (config.getRetentionPolicy().isPresent()) {
      dataset.setRetentionPolicy(RetentionPolicyParser.parse(config.getRetentionPolicy().get()));
      log.debug(String.format("%s retentionPolicy: %s", dataset, dataset.getRetentionPolicy().get()));
    }
    if (config.getMaxRetention().isPresent()) {
      dataset.setMaxRetention(RetentionPolicyParser.parse(config.getMaxRetention().get()));
      log.debug(String.format("%s maxRetention: %s", dataset, dataset.getMaxRetention().get()));
    }

    boolean hasFileSettings = config.getMaxFileAge().isPresent() || config.getMaxCapacity().isPresent()
        || config.getMountPoint().isPresent();
    if (!(dataset instanceof Filesystem)) {
      if (hasFileSettings) {
        log.warn(String.format("%s is not a filesystem, ignoring maxFileAge, maxCapacity and mountPoint", dataset));
      }
      return;
    }
    Filesystem filesystem = (Filesystem) dataset;
    if (config.getMaxFileAge().isPresent()) {
      filesystem.setMaxFileAge(MaxFileAgeParser.parseDays(config.getMaxFileAge().get()));
    }
    if (config.getMaxCapacity().isPresent()) {
      filesystem.setMaxCapacity(config.getMaxCapacity().get());
    }
    if (config.getMountPoint().isPresent()) {
      filesystem.setMountPoint(config.getMountPoint().get());
    }
  }
}
