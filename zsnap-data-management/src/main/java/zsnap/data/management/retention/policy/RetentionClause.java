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

package zsnap.data.management.retention.policy;

import lombok.extern.slf4j.Slf4j;

import org.joda.time.DateTime;
import org.joda.time.LocalDate;

import com.google.common.base.Optional;


/**
 * One clause of a retention policy string, e.g. <code>7 days</code> or <code>3 1st sunday of the month</code>.
 * Clauses are immutable and remember the text they were parsed from.
 */
@Slf4j
public abstract class RetentionClause {

  private final String source;

  protected RetentionClause(String source) {
    this.source = source;
  }

  /**
   * Whether <code>snapshot</code> matches this clause.
   *
   * @param now the reference time of the current run
   */
  public boolean matches(TimestampedSnapshot snapshot, DateTime now) {
    boolean matches = accept(snapshot, now);
    if (matches) {
      log.debug(String.format("Snapshot %s matches policy %s.", snapshot.getName(), this.source));
    }
    return matches;
  }

  protected abstract boolean accept(TimestampedSnapshot snapshot, DateTime now);

  /**
   * Creation date of <code>snapshot</code>, absent when its creation time is unknown.
   */
  protected static Optional<LocalDate> creationDate(TimestampedSnapshot snapshot) {
    if (snapshot.getCreationTime().isPresent()) {
      return Optional.of(snapshot.getCreationTime().get().toLocalDate());
    }
    return Optional.absent();
  }

  @Override
  public String toString() {
    return this.source;
  }
}
