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

import org.joda.time.DateTime;

import com.google.common.base.Optional;

import lombok.extern.slf4j.Slf4j;

import zsnap.configuration.ConfigurationKeys;
import zsnap.data.management.CleanerContext;
import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.KeepDecision;
import zsnap.data.management.dataset.Snapshot;
import zsnap.data.management.retention.policy.RetentionClause;
import zsnap.data.management.retention.policy.RetentionPolicy;


/**
 * Decides whether a snapshot must be kept, must be destroyed or may be destroyed, and records the answer on the
 * storage system as the <code>keep</code> user hold.
 *
 * <ol>
 *   <li>With a non empty effective maxRetention, a snapshot matching none of its clauses must be destroyed; otherwise
 *   it is best effort.</li>
 *   <li>A snapshot matching the effective retentionPolicy must be kept, whatever maxRetention said.</li>
 *   <li>A snapshot matched by neither policy is best effort.</li>
 * </ol>
 *
 * The hold is placed or released at most once, and only when it does not already reflect the decision.
 */
@Slf4j
public class KeepDecisionEngine {

  private final CleanerContext context;

  public KeepDecisionEngine(CleanerContext context) {
    this.context = context;
  }

  public KeepDecision decide(Snapshot snapshot) throws IOException {
    Dataset dataset = snapshot.getDataset();
    DateTime now = this.context.getNow();
    KeepDecision decision = KeepDecision.BEST_EFFORT;

    RetentionPolicy maxRetention = dataset.getEffectiveMaxRetention();
    if (!maxRetention.isEmpty()) {
      Optional<RetentionClause> match = maxRetention.firstMatch(snapshot, now);
      if (match.isPresent()) {
        log.debug(String.format("Snapshot %s is within maxRetention (%s), may keep it.", snapshot, match.get()));
      } else {
        log.debug(String.format("Snapshot %s does NOT match maxRetention %s, must destroy it.", snapshot,
            maxRetention));
        decision = KeepDecision.DESTROY;
      }
    }

    Optional<RetentionClause> keep = dataset.getEffectiveRetentionPolicy().firstMatch(snapshot, now);
    if (keep.isPresent()) {
      log.debug(String.format("Snapshot %s matches retention policy %s, must keep it.", snapshot, keep.get()));
      decision = KeepDecision.KEEP;
    }

    if (decision == KeepDecision.KEEP) {
      hold(snapshot);
    } else {
      release(snapshot);
    }
    return decision;
  }

  private void hold(Snapshot snapshot) throws IOException {
    if (snapshot.getTags().contains(ConfigurationKeys.KEEP_TAG)) {
      return;
    }
    if (this.context.isDryRun()) {
      log.info(String.format("Would hold %s on %s", ConfigurationKeys.KEEP_TAG, snapshot));
    } else {
      log.debug(String.format("Holding %s on %s", ConfigurationKeys.KEEP_TAG, snapshot));
      this.context.getStorage().hold(ConfigurationKeys.KEEP_TAG, snapshot.getName());
    }
    snapshot.addTag(ConfigurationKeys.KEEP_TAG);
  }

  private void release(Snapshot snapshot) throws IOException {
    if (!snapshot.getTags().contains(ConfigurationKeys.KEEP_TAG)) {
      return;
    }
    if (this.context.isDryRun()) {
      log.info(String.format("Would release %s from %s", ConfigurationKeys.KEEP_TAG, snapshot));
    } else {
      log.debug(String.format("Releasing %s from %s", ConfigurationKeys.KEEP_TAG, snapshot));
      this.context.getStorage().release(ConfigurationKeys.KEEP_TAG, snapshot.getName());
    }
    snapshot.removeTag(ConfigurationKeys.KEEP_TAG);
  }
}
