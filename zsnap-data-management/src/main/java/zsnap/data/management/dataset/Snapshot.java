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
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.DateTime;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

import lombok.Getter;
import lombok.Setter;

import zsnap.data.management.retention.policy.TimestampedSnapshot;


/**
 * A snapshot of a {@link Dataset}.
 *
 * <p>
 *   The keep decision is computed at most once per run and memoised. User holds (tags) are fetched lazily, and not at
 *   all when the storage system reported zero user references. Once {@link Dataset#destroySnapshot(Snapshot)} has
 *   been called, every operation except the read-only getters fails with {@link IllegalStateException}.
 * </p>
 */
public class Snapshot implements TimestampedSnapshot {

  public enum State {
    ACTIVE,
    DESTROYED
  }

  @Getter
  private final String name;
  @Getter
  private final Dataset dataset;

  @Getter
  @Setter
  private Optional<DateTime> creationTime = Optional.absent();
  @Getter
  @Setter
  private Optional<Long> used = Optional.absent();
  @Getter
  @Setter
  private Optional<Long> referenced = Optional.absent();
  @Getter
  @Setter
  private Optional<Long> userrefs = Optional.absent();

  @Getter
  private State state = State.ACTIVE;

  private Set<String> tags;
  private KeepDecision keepDecision;

  public Snapshot(String name, Dataset dataset) {
    Preconditions.checkArgument(name.startsWith(dataset.getName() + "@"), "%s is not a snapshot of %s", name, dataset);
    this.name = name;
    this.dataset = dataset;
  }

  @Override
  public String getSuffix() {
    return StringUtils.substringAfter(this.name, "@");
  }

  /**
   * Space used by this snapshot alone, 0 when unknown.
   */
  public long getUsedOrZero() {
    return this.used.or(0L);
  }

  public boolean isDestroyed() {
    return this.state == State.DESTROYED;
  }

  /**
   * @return the memoised keep decision, computed on first call
   */
  public KeepDecision getKeepDecision() throws IOException {
    checkActive();
    if (this.keepDecision == null) {
      this.keepDecision = this.dataset.getPool().getKeepDecisionEngine().decide(this);
    }
    return this.keepDecision;
  }

  /**
   * User holds on this snapshot, fetched from the storage system on first call.
   */
  public Set<String> getTags() throws IOException {
    checkActive();
    if (this.tags == null) {
      if (this.userrefs.isPresent() && this.userrefs.get() == 0) {
        this.tags = Sets.newTreeSet();
      } else {
        this.tags = Sets.newTreeSet(this.dataset.getPool().getContext().getStorage().listTags(this.name));
      }
    }
    return Collections.unmodifiableSet(this.tags);
  }

  /**
   * Record a hold placed on this snapshot.
   */
  public void addTag(String tag) throws IOException {
    getTags();
    if (this.tags.add(tag) && this.userrefs.isPresent()) {
      this.userrefs = Optional.of(this.userrefs.get() + 1);
    }
  }

  /**
   * Record a hold released from this snapshot.
   */
  public void removeTag(String tag) throws IOException {
    getTags();
    if (this.tags.remove(tag) && this.userrefs.isPresent()) {
      this.userrefs = Optional.of(Math.max(0L, this.userrefs.get() - 1));
    }
  }

  void markDestroyed() {
    checkActive();
    this.state = State.DESTROYED;
  }

  private void checkActive() {
    Preconditions.checkState(this.state == State.ACTIVE, "Snapshot %s has been destroyed", this.name);
  }

  @Override
  public String toString() {
    return this.name;
  }
}
