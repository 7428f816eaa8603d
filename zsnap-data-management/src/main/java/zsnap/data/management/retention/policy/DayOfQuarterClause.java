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
 * <code>N K(st|nd|rd|th) day of the quarter</code>: snapshots created on day <code>K</code> of January, April, July or
 * October, no earlier than <code>3 * N</code> months before the first day of the current month.
 */
@Getter
public class DayOfQuarterClause extends RetentionClause {

  private final int quarters;
  private final int dayOfMonth;

  public DayOfQuarterClause(String source, int quarters, int dayOfMonth) {
    super(source);
    this.quarters = quarters;
    this.dayOfMonth = dayOfMonth;
  }

  @Override
  protected boolean accept(TimestampedSnapshot snapshot, DateTime now) {
    Optional<LocalDate> creation = creationDate(snapshot);
    if (!creation.isPresent()
        || creation.get().getDayOfMonth() != this.dayOfMonth
        || creation.get().getMonthOfYear() % 3 != 1) {
      return false;
    }
    LocalDate reference = CalendarUtils.monthsBack(CalendarUtils.firstOfMonth(now.toLocalDate()), 3 * this.quarters);
    return !creation.get().isBefore(reference);
  }
}
