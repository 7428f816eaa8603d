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
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.primitives.Longs;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.CleanerContext;
import zsnap.data.management.accounting.LiveSpaceAccounting;
import zsnap.data.management.accounting.SimulatedSpaceAccounting;
import zsnap.data.management.accounting.SpaceAccounting;
import zsnap.storage.PropertyRow;
import zsnap.storage.StorageCommands;


/**
 * Builds the in-memory model of a {@link Pool} from one recursive property query.
 *
 * <p>
 *   Rows are expected grouped by entity, starting with the <code>type</code> row. Entities of a type other than
 *   filesystem, volume or snapshot (bookmarks for instance) are skipped. A value of <code>-</code> means the storage
 *   system has no value for that property and leaves it unset, as does any other value that is not a number.
 * </p>
 */
@Slf4j
public class PoolDiscovery {

  public static final List<String> DISCOVERY_PROPERTIES =
      ImmutableList.of("type", "creation", "used", "available", "referenced", "userrefs");

  private static final String NO_VALUE = "-";

  private final CleanerContext context;

  public PoolDiscovery(CleanerContext context) {
    this.context = context;
  }

  public Pool discover(String poolName) throws IOException {
    StorageCommands storage = this.context.getStorage();
    long used = LiveSpaceAccounting.getLongProperty(storage, poolName, "used");
    long available = LiveSpaceAccounting.getLongProperty(storage, poolName, "available");
    SpaceAccounting accounting =
        this.context.isDryRun() ? new SimulatedSpaceAccounting(used, available) : new LiveSpaceAccounting(storage);
    Pool pool = new Pool(poolName, this.context, accounting);

    ParseState state = new ParseState();
    for (PropertyRow row : storage.get(poolName, DISCOVERY_PROPERTIES, true)) {
      if ("type".equals(row.getProperty())) {
        startEntity(pool, state, row);
      } else {
        applyProperty(state, row);
      }
    }

    for (Dataset dataset : pool.getDatasets()) {
      dataset.sortSnapshotsByCreation();
    }
    log.info(String.format("Discovered %d datasets and %d snapshots on pool %s", pool.getDatasets().size(),
        pool.getSnapshots().size(), poolName));
    return pool;
  }

  private void startEntity(Pool pool, ParseState state, PropertyRow row) throws IOException {
    String name = row.getEntity();
    state.reset(name);
    switch (row.getValue()) {
      case "filesystem":
        addDataset(pool, state, new Filesystem(name, pool, findParent(state, name).orNull()));
        break;
      case "volume":
        addDataset(pool, state, new Volume(name, pool, findParent(state, name).orNull()));
        break;
      case "snapshot":
        Dataset dataset = state.datasetOf(name);
        state.snapshot = new Snapshot(name, dataset);
        dataset.addSnapshot(state.snapshot);
        break;
      default:
        log.debug(String.format("Ignoring %s of type %s", name, row.getValue()));
        state.ignored = true;
    }
  }

  private static void addDataset(Pool pool, ParseState state, Dataset dataset) {
    pool.addDataset(dataset);
    state.datasets.put(dataset.getName(), dataset);
    state.dataset = dataset;
  }

  private void applyProperty(ParseState state, PropertyRow row) throws IOException {
    if (!row.getEntity().equals(state.entity)) {
      throw new IOException(String.format("Property %s of %s appears before its type", row.getProperty(),
          row.getEntity()));
    }
    if (state.ignored || NO_VALUE.equals(row.getValue())) {
      return;
    }
    Long value = Longs.tryParse(row.getValue());
    if (value == null) {
      log.debug(String.format("Property %s of %s is not a number, leaving it unset: %s", row.getProperty(),
          row.getEntity(), row.getValue()));
      return;
    }
    if (state.snapshot != null) {
      applySnapshotProperty(state.snapshot, row.getProperty(), value);
    } else {
      applyDatasetProperty(state.dataset, row.getProperty(), value);
    }
  }

  private void applySnapshotProperty(Snapshot snapshot, String property, long value) {
    switch (property) {
      case "creation":
        snapshot.setCreationTime(Optional.of(new DateTime(value * 1000L, this.context.getTimeZone())));
        break;
      case "used":
        snapshot.setUsed(Optional.of(value));
        break;
      case "referenced":
        snapshot.setReferenced(Optional.of(value));
        break;
      case "userrefs":
        snapshot.setUserrefs(Optional.of(value));
        break;
      default:
        break;
    }
  }

  private void applyDatasetProperty(Dataset dataset, String property, long value) {
    switch (property) {
      case "used":
        dataset.setDiscoveredUsed(Optional.of(value));
        break;
      case "referenced":
        dataset.setDiscoveredReferenced(Optional.of(value));
        break;
      default:
        break;
    }
  }

  /**
   * Nearest already discovered ancestor of <code>datasetName</code>.
   */
  private static Optional<Dataset> findParent(ParseState state, String datasetName) {
    String name = datasetName;
    while (name.contains("/")) {
      name = StringUtils.substringBeforeLast(name, "/");
      Dataset parent = state.datasets.get(name);
      if (parent != null) {
        return Optional.of(parent);
      }
    }
    return Optional.absent();
  }

  /**
   * Entity whose rows are currently being read, and the datasets seen so far. The last dataset read stays current
   * while its snapshots are read.
   */
  private static class ParseState {
    private final Map<String, Dataset> datasets = Maps.newHashMap();
    private String entity;
    private Dataset dataset;
    private Snapshot snapshot;
    private boolean ignored;

    void reset(String entity) {
      this.entity = entity;
      this.snapshot = null;
      this.ignored = false;
    }

    Dataset datasetOf(String snapshotName) throws IOException {
      String datasetName = StringUtils.substringBefore(snapshotName, "@");
      if (this.dataset != null && this.dataset.getName().equals(datasetName)) {
        return this.dataset;
      }
      Dataset found = this.datasets.get(datasetName);
      if (found == null) {
        throw new IOException(String.format("Snapshot %s listed before its dataset %s", snapshotName, datasetName));
      }
      return found;
    }
  }
}
