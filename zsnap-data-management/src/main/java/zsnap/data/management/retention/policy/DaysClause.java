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

import org.joda.time.DateTime;
import org.joda.time.LocalDate;

import com.google.common.base.Optional;

import lombok.Getter;


/**
 * <code>N day[s]</code>: snapshots whose creation date is on or after <code>today - N days</code>.
 */
@Getter
public class DaysClause extends RetentionClause {

  private final int days;

  public DaysClause(String source, int days) {
    super(source);
    this.days = days;
  }

  @Override
  protected boolean accept(TimestampedSnapshot snapshot, DateTime now) {
    Optional<LocalDate> creation = creationDate(snapshot);
    return creation.isPresent() && !creation.get().isBefore(now.toLocalDate().minusDays(this.days));
  }
}
