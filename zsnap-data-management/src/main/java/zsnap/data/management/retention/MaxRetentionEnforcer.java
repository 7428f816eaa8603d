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

package zsnap.data.management.retention;

import java.io.IOException;
import java.util.List;

import com.google.common.collect.ImmutableList;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.KeepDecision;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;


/**
 * Destroys every snapshot of a pool whose keep decision is {@link KeepDecision#DESTROY}.
 */
@Slf4j
public class MaxRetentionEnforcer {

  private final SnapshotDestroyer destroyer;

  public MaxRetentionEnforcer(SnapshotDestroyer destroyer) {
    this.destroyer = destroyer;
  }

  /**
   * @return the number of destroyed snapshots
   */
  public int enforce(Pool pool) throws IOException {
    int destroyed = 0;
    for (Dataset dataset : pool.getDatasets()) {
      List<Snapshot> snapshots = ImmutableList.copyOf(dataset.getSnapshots());
      for (Snapshot snapshot : snapshots) {
        if (snapshot.getKeepDecision() == KeepDecision.DESTROY) {
          this.destroyer.destroy(snapshot);
          destroyed++;
        }
      }
    }
    if (destroyed > 0) {
      log.info(String.format("Destroyed %d snapshots out of their maxRetention on pool %s", destroyed, pool));
    }
    return destroyed;
  }
}
