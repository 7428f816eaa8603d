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
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import lombok.Getter;
import lombok.Setter;

import zsnap.data.management.retention.policy.RetentionPolicy;


/**
 * A dataset of a {@link Pool}: a {@link Filesystem} or a {@link Volume}.
 *
 * <p>
 *   Retention settings not configured on a dataset are inherited from its nearest ancestor that has them. A value
 *   set explicitly on a dataset, <code>none</code> included, stops the inheritance.
 * </p>
 */
public abstract class Dataset {

  @Getter
  private final String name;
  @Getter
  private final Pool pool;
  private final Dataset parent;
  private final List<Snapshot> snapshots = Lists.newArrayList();

  @Getter
  @Setter
  private Optional<Long> discoveredUsed = Optional.absent();
  @Getter
  @Setter
  private Optional<Long> discoveredReferenced = Optional.absent();

  @Getter
  private Optional<RetentionPolicy> maxRetention = Optional.absent();
  @Getter
  private Optional<RetentionPolicy> retentionPolicy = Optional.absent();

  protected Dataset(String name, Pool pool, Dataset parent) {
    this.name = name;
    this.pool = pool;
    this.parent = parent;
  }

  public Optional<Dataset> getParent() {
    return Optional.fromNullable(this.parent);
  }

  public void setMaxRetention(RetentionPolicy maxRetention) {
    this.maxRetention = Optional.of(maxRetention);
  }

  public void setRetentionPolicy(RetentionPolicy retentionPolicy) {
    this.retentionPolicy = Optional.of(retentionPolicy);
  }

  /**
   * Policy bounding how long snapshots may live. Empty when neither this dataset nor any ancestor has one.
   */
  public RetentionPolicy getEffectiveMaxRetention() {
    for (Dataset dataset = this; dataset != null; dataset = dataset.parent) {
      if (dataset.maxRetention.isPresent()) {
        return dataset.maxRetention.get();
      }
    }
    return new RetentionPolicy(Collections.emptyList());
  }

  /**
   * Policy selecting the snapshots that must be kept. Empty when neither this dataset nor any ancestor has one.
   */
  public RetentionPolicy getEffectiveRetentionPolicy() {
    for (Dataset dataset = this; dataset != null; dataset = dataset.parent) {
      if (dataset.retentionPolicy.isPresent()) {
        return dataset.retentionPolicy.get();
      }
    }
    return new RetentionPolicy(Collections.emptyList());
  }

  public void addSnapshot(Snapshot snapshot) {
    Preconditions.checkArgument(snapshot.getDataset() == this, "Snapshot %s does not belong to %s", snapshot, this);
    this.snapshots.add(snapshot);
  }

  /**
   * Active snapshots, oldest first.
   */
  public List<Snapshot> getSnapshots() {
    return Collections.unmodifiableList(this.snapshots);
  }

  /**
   * Snapshots whose keep decision allows destroying them, oldest first.
   */
  public List<Snapshot> getRemovableSnapshots() throws IOException {
    List<Snapshot> removable = Lists.newArrayList();
    for (Snapshot snapshot : this.snapshots) {
      if (snapshot.getKeepDecision().isRemovable()) {
        removable.add(snapshot);
      }
    }
    return removable;
  }

  /**
   * Record that <code>snapshot</code> no longer exists: it leaves this dataset, the pool accounting is told about the
   * space it freed and it moves to the destroyed state.
   */
  public void destroySnapshot(Snapshot snapshot) {
    Preconditions.checkArgument(snapshot.getDataset() == this, "Snapshot %s does not belong to %s", snapshot, this);
    Preconditions.checkState(this.snapshots.remove(snapshot), "Snapshot %s was already removed", snapshot);
    snapshot.markDestroyed();
    this.pool.getAccounting().snapshotDestroyed(snapshot);
  }

  void sortSnapshotsByCreation() {
    Collections.sort(this.snapshots, new Comparator<Snapshot>() {
      @Override
      public int compare(Snapshot s1, Snapshot s2) {
        return Long.compare(creationMillis(s1), creationMillis(s2));
      }
    });
  }

  private static long creationMillis(Snapshot snapshot) {
    return snapshot.getCreationTime().isPresent() ? snapshot.getCreationTime().get().getMillis() : Long.MIN_VALUE;
  }

  /**
   * Space referenced by this dataset, as seen by the pool accounting.
   */
  public long getReferenced() throws IOException {
    return this.pool.getAccounting().getReferenced(this);
  }

  public Optional<Long> getUsed() throws IOException {
    return this.pool.getAccounting().getUsed(this);
  }

  @Override
  public String toString() {
    return this.name;
  }
}
