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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import lombok.Getter;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Snapshot;


/**
 * A dataset that still has removable snapshots, as seen by an {@link EvictionPolicy}.
 */
@Getter
public class EvictionCandidate {

  private final Dataset dataset;
  private final List<Snapshot> removableSnapshots;
  private final int snapshotCount;

  public EvictionCandidate(Dataset dataset, List<Snapshot> removableSnapshots, int snapshotCount) {
    Preconditions.checkArgument(!removableSnapshots.isEmpty(), "%s has no removable snapshot", dataset);
    this.dataset = dataset;
    this.removableSnapshots = ImmutableList.copyOf(removableSnapshots);
    this.snapshotCount = snapshotCount;
  }

  /**
   * The snapshot that goes if this candidate is chosen.
   */
  public Snapshot getEarliestRemovable() {
    return this.removableSnapshots.get(0);
  }

  @Override
  public String toString() {
    return String.format("%s (%d removable of %d)", this.dataset, this.removableSnapshots.size(), this.snapshotCount);
  }
}
