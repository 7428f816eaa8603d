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

package zsnap.data.management.eviction;

import java.io.IOException;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;
import zsnap.data.management.retention.SnapshotDestroyer;


/**
 * Destroys best effort snapshots, one at a time, while a pool is over its maxCapacity.
 *
 * <p>
 *   Each round, datasets are visited in discovery order and the pool's {@link EvictionPolicy} picks one of those that
 *   still have removable snapshots; that dataset loses its earliest removable snapshot. The loop stops once the pool
 *   is under maxCapacity, or when no removable snapshot remains.
 * </p>
 */
@Slf4j
public class EvictionScheduler {

  private final SnapshotDestroyer destroyer;
  private final EvictionPolicyFactory policyFactory;

  public EvictionScheduler(SnapshotDestroyer destroyer, EvictionPolicyFactory policyFactory) {
    this.destroyer = destroyer;
    this.policyFactory = policyFactory;
  }

  public EvictionResult run(Pool pool) throws IOException {
    EvictionPolicy policy = this.policyFactory.create(pool.getBestEffortPolicy());
    int destroyed = 0;
    while (pool.getCapacity() > pool.getMaxCapacity()) {
      log.info(String.format("Zpool capacity: %s (used: %d, available: %d)", pool.getCapacity(), pool.getUsed(),
          pool.getAvailable()));
      Optional<EvictionCandidate> candidate = select(pool, policy);
      if (!candidate.isPresent()) {
        log.warn(String.format("Pool %s is over maxCapacity %s but has no removable snapshot left", pool,
            pool.getMaxCapacity()));
        return new EvictionResult(destroyed, false);
      }
      Snapshot snapshot = candidate.get().getEarliestRemovable();
      log.debug(String.format("Policy %s picked %s, destroying %s", pool.getBestEffortPolicy(), candidate.get(),
          snapshot));
      this.destroyer.destroy(snapshot);
      destroyed++;
    }
    return new EvictionResult(destroyed, true);
  }

  @VisibleForTesting
  static Optional<EvictionCandidate> select(Pool pool, EvictionPolicy policy) throws IOException {
    EvictionCandidate selected = null;
    for (Dataset dataset : pool.getDatasets()) {
      List<Snapshot> removable = dataset.getRemovableSnapshots();
      if (removable.isEmpty()) {
        continue;
      }
      EvictionCandidate candidate = new EvictionCandidate(dataset, removable, dataset.getSnapshots().size());
      if (selected == null || policy.isPreferred(candidate, selected)) {
        selected = candidate;
      }
    }
    return Optional.fromNullable(selected);
  }
}
