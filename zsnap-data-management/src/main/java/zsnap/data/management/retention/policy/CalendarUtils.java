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

import java.util.Map;

import org.joda.time.DateTimeConstants;
import org.joda.time.LocalDate;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;


/**
 * Calendar arithmetic used by the calendar based {@link RetentionClause}s.
 */
public class CalendarUtils {

  public static final String WEEKDAY_REGEX = "(monday|tuesday|wednesday|thursday|friday|saturday|sunday)";

  private static final Map<String, Integer> WEEKDAYS = ImmutableMap.<String, Integer>builder()
      .put("monday", DateTimeConstants.MONDAY)
      .put("tuesday", DateTimeConstants.TUESDAY)
      .put("wednesday", DateTimeConstants.WEDNESDAY)
      .put("thursday", DateTimeConstants.THURSDAY)
      .put("friday", DateTimeConstants.FRIDAY)
      .put("saturday", DateTimeConstants.SATURDAY)
      .put("sunday", DateTimeConstants.SUNDAY)
      .build();

  private CalendarUtils() {
  }

  /**
   * @return the ISO day of week ({@link DateTimeConstants#MONDAY} ... {@link DateTimeConstants#SUNDAY}) named
   *         <code>name</code>
   */
  public static int weekdayOf(String name) {
    Integer weekday = WEEKDAYS.get(name);
    if (weekday == null) {
      throw new IllegalArgumentException("Unknown weekday " + name);
    }
    return weekday;
  }

  /**
   * First day of the month <code>date</code> falls in.
   */
  public static LocalDate firstOfMonth(LocalDate date) {
    return date.withDayOfMonth(1);
  }

  /**
   * Goes back <code>months</code> months from <code>firstOfMonth</code>, rolling into previous years as needed.
   */
  public static LocalDate monthsBack(LocalDate firstOfMonth, int months) {
    return firstOfMonth.minusMonths(months);
  }

  /**
   * Bucket of a day of month: days 1-7 are in week 1, 8-14 in week 2, ..., 29 and later in week 5.
   */
  public static int weekOfMonth(int dayOfMonth) {
    return Math.min((dayOfMonth - 1) / 7 + 1, 5);
  }

  /**
   * Date of the <code>k</code>-th <code>weekday</code> of the month of <code>dateInMonth</code>, absent when the month
   * has fewer than <code>k</code> such days.
   */
  public static Optional<LocalDate> kthWeekdayOfMonth(LocalDate dateInMonth, int k, int weekday) {
    if (k < 1) {
      return Optional.absent();
    }
    LocalDate first = firstOfMonth(dateInMonth);
    int offset = (weekday - first.getDayOfWeek() + 7) % 7;
    LocalDate occurrence = first.plusDays(offset + 7 * (k - 1));
    if (occurrence.getMonthOfYear() != first.getMonthOfYear()) {
      return Optional.absent();
    }
    return Optional.of(occurrence);
  }
}
