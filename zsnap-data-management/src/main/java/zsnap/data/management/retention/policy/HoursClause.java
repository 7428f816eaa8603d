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

import lombok.Getter;


/**
 * <code>N hour[s]</code>: snapshots created at or after <code>now - N hours</code>.
 */
@Getter
public class HoursClause extends RetentionClause {

  private final int hours;

  public HoursClause(String source, int hours) {
    super(source);
    this.hours = hours;
  }

  @Override
  protected boolean accept(TimestampedSnapshot snapshot, DateTime now) {
    return snapshot.getCreationTime().isPresent()
        && !snapshot.getCreationTime().get().isBefore(now.minusHours(this.hours));
  }
}
