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

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.CleanerContext;
import zsnap.data.management.dataset.Snapshot;


/**
 * Destroys snapshots on the storage system, or only logs the destruction in preview mode, and then moves the
 * in-memory snapshot to its destroyed state.
 */
@Slf4j
public class SnapshotDestroyer {

  private final CleanerContext context;

  public SnapshotDestroyer(CleanerContext context) {
    this.context = context;
  }

  public void destroy(Snapshot snapshot) throws IOException {
    if (this.context.isDryRun()) {
      log.info(String.format("Would destroy snapshot %s", snapshot));
    } else {
      this.context.getStorage().destroy(snapshot.getName());
      log.info(String.format("Destroyed snapshot %s", snapshot));
    }
    snapshot.getDataset().destroySnapshot(snapshot);
  }
}
