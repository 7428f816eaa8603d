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

package zsnap.data.management.dataset;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.Lists;

import lombok.Getter;
import lombok.Setter;

import zsnap.configuration.ConfigurationKeys;
import zsnap.data.management.CleanerContext;
import zsnap.data.management.accounting.SpaceAccounting;
import zsnap.data.management.retention.KeepDecisionEngine;


/**
 * A storage pool and the datasets it contains, in discovery order.
 */
public class Pool {

  @Getter
  private final String name;
  @Getter
  private final CleanerContext context;
  @Getter
  private final SpaceAccounting accounting;
  @Getter
  private final KeepDecisionEngine keepDecisionEngine;

  @Getter
  @Setter
  private double maxCapacity = ConfigurationKeys.DEFAULT_POOL_MAX_CAPACITY;
  @Getter
  @Setter
  private String bestEffortPolicy = ConfigurationKeys.DEFAULT_BEST_EFFORT_POLICY;

  private final List<Dataset> datasets = Lists.newArrayList();

  public Pool(String name, CleanerContext context, SpaceAccounting accounting) {
    this.name = name;
    this.context = context;
    this.accounting = accounting;
    this.keepDecisionEngine = new KeepDecisionEngine(context);
  }

  public void addDataset(Dataset dataset) {
    this.datasets.add(dataset);
  }

  public List<Dataset> getDatasets() {
    return Collections.unmodifiableList(this.datasets);
  }

  public List<Filesystem> getFilesystems() {
    List<Filesystem> filesystems = Lists.newArrayList();
    for (Dataset dataset : this.datasets) {
      if (dataset instanceof Filesystem) {
        filesystems.add((Filesystem) dataset);
      }
    }
    return filesystems;
  }

  public Optional<Dataset> getDataset(String datasetName) {
    for (Dataset dataset : this.datasets) {
      if (dataset.getName().equals(datasetName)) {
        return Optional.of(dataset);
      }
    }
    return Optional.absent();
  }

  public List<Snapshot> getSnapshots() {
    List<Snapshot> snapshots = Lists.newArrayList();
    for (Dataset dataset : this.datasets) {
      snapshots.addAll(dataset.getSnapshots());
    }
    return snapshots;
  }

  public long getUsed() throws IOException {
    return this.accounting.getUsed(this);
  }

  public long getAvailable() throws IOException {
    return this.accounting.getAvailable(this);
  }

  /**
   * Fraction of the pool in use, <code>used / (used + available)</code>.
   */
  public double getCapacity() throws IOException {
    long used = getUsed();
    long total = used + getAvailable();
    return total == 0 ? 0.0 : (double) used / total;
  }

  /**
   * Sum of the space referenced by every dataset of the pool.
   */
  public long getReferenced() throws IOException {
    long referenced = 0;
    for (Dataset dataset : this.datasets) {
      referenced += dataset.getReferenced();
    }
    return referenced;
  }

  @Override
  public String toString() {
    return this.name;
  }
}
