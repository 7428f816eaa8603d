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

package zsnap.data.management.report;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Maps;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;


/**
 * Space and snapshot summary of a pool, logged at the end of a cleaning run.
 */
@Slf4j
@Getter
public class PoolReport {

  private final String poolName;
  private final long used;
  private final long usedByData;
  private final long usedBySnapshots;
  private final long available;
  private final long total;
  private final int snapshotCount;
  private final Map<String, Integer> snapshotsPerTag;

  private PoolReport(String poolName, long used, long referenced, long available, int snapshotCount,
      Map<String, Integer> snapshotsPerTag) {
    this.poolName = poolName;
    this.used = used;
    this.usedByData = referenced;
    this.usedBySnapshots = Math.max(0L, used - referenced);
    this.available = available;
    this.total = used + available;
    this.snapshotCount = snapshotCount;
    this.snapshotsPerTag = Collections.unmodifiableMap(snapshotsPerTag);
  }

  /**
   * Snapshot the current state of <code>pool</code>. Space used by snapshots is the pool usage minus what its datasets
   * reference, and never negative: datasets sharing blocks, clones for instance, may reference more than the pool
   * uses. The total is the pool usage plus its available space.
   */
  public static PoolReport of(Pool pool) throws IOException {
    long referenced = pool.getReferenced();
    long used = pool.getUsed();
    Map<String, Integer> perTag = Maps.newTreeMap();
    int count = 0;
    for (Snapshot snapshot : pool.getSnapshots()) {
      count++;
      for (String tag : snapshot.getTags()) {
        Integer current = perTag.get(tag);
        perTag.put(tag, current == null ? 1 : current + 1);
      }
    }
    return new PoolReport(pool.getName(), used, referenced, pool.getAvailable(), count, perTag);
  }

  public void log() {
    log.info(String.format("Pool %s", this.poolName));
    log.info(String.format("  Used:              %d", this.used));
    log.info(String.format("  Used by data:      %d", this.usedByData));
    log.info(String.format("  Used by snapshots: %d", this.usedBySnapshots));
    log.info(String.format("  Available:         %d", this.available));
    log.info(String.format("  Total:             %d", this.total));
    log.info(String.format("  Snapshots:         %d", this.snapshotCount));
    for (Map.Entry<String, Integer> entry : this.snapshotsPerTag.entrySet()) {
      log.info(String.format("  Tagged '%s':%s%d", entry.getKey(), "      ", entry.getValue()));
    }
  }
}
