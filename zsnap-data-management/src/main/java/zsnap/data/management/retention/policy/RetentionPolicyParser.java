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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;


/**
 * Parser for retention policy strings. Clauses are separated by the literal <code> and </code>; each one is trimmed
 * and matched, case sensitively, against the grammars below.
 *
 * <pre>
 *   all
 *   none
 *   N hour[s]
 *   N day[s]
 *   N week[s]
 *   N &lt;weekday&gt;[s]
 *   N K(st|nd|rd|th) &lt;weekday&gt; of the month
 *   N K(st|nd|rd|th) day of the month
 *   N K(st|nd|rd|th) day of the quarter
 *   &#64;suffix
 * </pre>
 */
public class RetentionPolicyParser {

  private static final String ORDINAL = "(\\d+)(?:st|nd|rd|th)";

  private static final Pattern ALL = Pattern.compile("all");
  private static final Pattern NONE = Pattern.compile("none");
  private static final Pattern HOURS = Pattern.compile("(\\d+) hours?");
  private static final Pattern DAYS = Pattern.compile("(\\d+) days?");
  private static final Pattern WEEKS = Pattern.compile("(\\d+) weeks?");
  private static final Pattern WEEKDAY = Pattern.compile("(\\d+) " + CalendarUtils.WEEKDAY_REGEX + "s?");
  private static final Pattern WEEKDAY_OF_MONTH =
      Pattern.compile("(\\d+) " + ORDINAL + " " + CalendarUtils.WEEKDAY_REGEX + " of the month");
  private static final Pattern DAY_OF_MONTH = Pattern.compile("(\\d+) " + ORDINAL + " day of the month");
  private static final Pattern DAY_OF_QUARTER = Pattern.compile("(\\d+) " + ORDINAL + " day of the quarter");
  private static final Pattern SNAPSHOT_NAME = Pattern.compile("@([^ ]*)");

  private static final Splitter CLAUSE_SPLITTER = Splitter.on(" and ");

  private RetentionPolicyParser() {
  }

  public static RetentionPolicy parse(String policy) {
    if (StringUtils.isBlank(policy)) {
      throw new InvalidRetentionPolicyException("Retention policy must not be empty");
    }
    List<RetentionClause> clauses = Lists.newArrayList();
    for (String clause : CLAUSE_SPLITTER.split(policy)) {
      clauses.add(parseClause(clause.trim()));
    }
    return new RetentionPolicy(clauses);
  }

  public static RetentionClause parseClause(String clause) {
    try {
      Matcher matcher;
      if (ALL.matcher(clause).matches()) {
        return new AllClause(clause);
      }
      if (NONE.matcher(clause).matches()) {
        return new NoneClause(clause);
      }
      if ((matcher = HOURS.matcher(clause)).matches()) {
        return new HoursClause(clause, Integer.parseInt(matcher.group(1)));
      }
      if ((matcher = DAYS.matcher(clause)).matches()) {
        return new DaysClause(clause, Integer.parseInt(matcher.group(1)));
      }
      if ((matcher = WEEKS.matcher(clause)).matches()) {
        return new WeeksClause(clause, Integer.parseInt(matcher.group(1)));
      }
      if ((matcher = WEEKDAY.matcher(clause)).matches()) {
        return new WeekdayClause(clause, Integer.parseInt(matcher.group(1)),
            CalendarUtils.weekdayOf(matcher.group(2)));
      }
      if ((matcher = WEEKDAY_OF_MONTH.matcher(clause)).matches()) {
        return new WeekdayOfMonthClause(clause, Integer.parseInt(matcher.group(1)),
            Integer.parseInt(matcher.group(2)), CalendarUtils.weekdayOf(matcher.group(3)));
      }
      if ((matcher = DAY_OF_MONTH.matcher(clause)).matches()) {
        return new DayOfMonthClause(clause, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
      }
      if ((matcher = DAY_OF_QUARTER.matcher(clause)).matches()) {
        return new DayOfQuarterClause(clause, Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
      }
      if ((matcher = SNAPSHOT_NAME.matcher(clause)).matches()) {
        return new SnapshotNameClause(clause, matcher.group(1));
      }
    } catch (NumberFormatException nfe) {
      throw new InvalidRetentionPolicyException(String.format("Number out of range in policy clause '%s'", clause),
          nfe);
    }
    throw new InvalidRetentionPolicyException(String.format("Cannot parse policy clause '%s'", clause));
  }
}
