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

import java.io.IOException;

import com.google.common.base.Optional;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;


/**
 * Source of the space figures the cleaner bases its decisions on.
 *
 * <p>
 *   {@link LiveSpaceAccounting} asks the storage system on every call. {@link SimulatedSpaceAccounting} starts from the
 *   figures seen at discovery and subtracts what each destroyed snapshot would have freed, so that a preview run takes
 *   the same decisions as a real one.
 * </p>
 */
public interface SpaceAccounting {

  long getUsed(Pool pool) throws IOException;

  long getAvailable(Pool pool) throws IOException;

  long getReferenced(Dataset dataset) throws IOException;

  /**
   * Space used by <code>dataset</code>, its descendants and their snapshots, absent when the storage system has no
   * value.
   */
  Optional<Long> getUsed(Dataset dataset) throws IOException;

  /**
   * Called once for every snapshot that leaves the pool.
   */
  void snapshotDestroyed(Snapshot snapshot);
}
