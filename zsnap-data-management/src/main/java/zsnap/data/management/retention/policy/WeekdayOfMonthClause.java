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
 * <code>N K(st|nd|rd|th) &lt;weekday&gt; of the month</code>: snapshots created on the <code>K</code>-th such weekday of
 * one of the last <code>N</code> months.
 *
 * <p>
 *   The current month only counts when its <code>K</code>-th weekday is today or already past. Otherwise the window
 *   reaches one month further back so that <code>N</code> occurrences are always covered.
 * </p>
 */
@Getter
public class WeekdayOfMonthClause extends RetentionClause {

  private final int months;
  private final int weekOfMonth;
  private final int weekday;

  public WeekdayOfMonthClause(String source, int months, int weekOfMonth, int weekday) {
    super(source);
    this.months = months;
    this.weekOfMonth = weekOfMonth;
    this.weekday = weekday;
  }

  @Override
  protected boolean accept(TimestampedSnapshot snapshot, DateTime now) {
    Optional<LocalDate> creation = creationDate(snapshot);
    if (!creation.isPresent()
        || creation.get().getDayOfWeek() != this.weekday
        || CalendarUtils.weekOfMonth(creation.get().getDayOfMonth()) != this.weekOfMonth) {
      return false;
    }
    return !creation.get().isBefore(referenceDate(now.toLocalDate()));
  }

  LocalDate referenceDate(LocalDate today) {
    Optional<LocalDate> thisMonth = CalendarUtils.kthWeekdayOfMonth(today, this.weekOfMonth, this.weekday);
    boolean occurred = thisMonth.isPresent() && !thisMonth.get().isAfter(today);
    return CalendarUtils.monthsBack(CalendarUtils.firstOfMonth(today), occurred ? this.months - 1 : this.months);
  }
}
