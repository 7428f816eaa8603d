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
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;
import zsnap.storage.CommandExecutionException;
import zsnap.storage.PropertyRow;
import zsnap.storage.StorageCommands;


/**
 * {@link SpaceAccounting} that reads every figure from the storage system.
 */
@Slf4j
public class LiveSpaceAccounting implements SpaceAccounting {

  private final StorageCommands storage;

  public LiveSpaceAccounting(StorageCommands storage) {
    this.storage = storage;
  }

  @Override
  public long getUsed(Pool pool) throws IOException {
    return getLongProperty(this.storage, pool.getName(), "used");
  }

  @Override
  public long getAvailable(Pool pool) throws IOException {
    return getLongProperty(this.storage, pool.getName(), "available");
  }

  @Override
  public long getReferenced(Dataset dataset) throws IOException {
    return getLongProperty(this.storage, dataset.getName(), "referenced");
  }

  @Override
  public Optional<Long> getUsed(Dataset dataset) throws IOException {
    for (PropertyRow row : this.storage.get(dataset.getName(), ImmutableList.of("used"), false)) {
      if (row.getProperty().equals("used")) {
        return Optional.fromNullable(Longs.tryParse(row.getValue()));
      }
    }
    return Optional.absent();
  }

  @Override
  public void snapshotDestroyed(Snapshot snapshot) {
    log.debug("Snapshot {} destroyed, {} bytes will be read back from the pool", snapshot, snapshot.getUsedOrZero());
  }

  /**
   * Read a single numeric property of <code>entity</code>.
   *
   * @throws CommandExecutionException if the property is missing or not a number
   */
  public static long getLongProperty(StorageCommands storage, String entity, String property) throws IOException {
    List<PropertyRow> rows = storage.get(entity, ImmutableList.of(property), false);
    for (PropertyRow row : rows) {
      if (row.getEntity().equals(entity) && row.getProperty().equals(property)) {
        Long value = Longs.tryParse(row.getValue());
        if (value == null) {
          throw new CommandExecutionException(
              String.format("Property %s of %s is not a number: %s", property, entity, row.getValue()));
        }
        return value;
      }
    }
    throw new CommandExecutionException(String.format("Property %s of %s was not returned", property, entity));
  }
}
