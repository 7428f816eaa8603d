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

package zsnap.data.management.accounting;

import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.collect.Maps;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;


/**
 * {@link SpaceAccounting} for preview runs. Each destroyed snapshot moves its used space from the pool's used figure
 * to its available figure, and no longer counts in the used figure of its dataset and of that dataset's ancestors.
 */
@Slf4j
public class SimulatedSpaceAccounting implements SpaceAccounting {

  private long used;
  private long available;
  private final Map<String, Long> freedByDataset = Maps.newHashMap();

  public SimulatedSpaceAccounting(long used, long available) {
    this.used = used;
    this.available = available;
  }

  @Override
  public long getUsed(Pool pool) {
    return this.used;
  }

  @Override
  public long getAvailable(Pool pool) {
    return this.available;
  }

  @Override
  public long getReferenced(Dataset dataset) {
    return dataset.getDiscoveredReferenced().or(0L);
  }

  @Override
  public Optional<Long> getUsed(Dataset dataset) {
    Optional<Long> discovered = dataset.getDiscoveredUsed();
    if (!discovered.isPresent()) {
      return discovered;
    }
    Long freed = this.freedByDataset.get(dataset.getName());
    return Optional.of(discovered.get() - (freed == null ? 0L : freed));
  }

  @Override
  public void snapshotDestroyed(Snapshot snapshot) {
    long freed = snapshot.getUsedOrZero();
    this.used -= freed;
    this.available += freed;
    Optional<Dataset> dataset = Optional.of(snapshot.getDataset());
    while (dataset.isPresent()) {
      Long previous = this.freedByDataset.get(dataset.get().getName());
      this.freedByDataset.put(dataset.get().getName(), (previous == null ? 0L : previous) + freed);
      dataset = dataset.get().getParent();
    }
    log.debug("Simulated destruction of {} frees {} bytes, pool used is now {}", snapshot, freed, this.used);
  }
}
