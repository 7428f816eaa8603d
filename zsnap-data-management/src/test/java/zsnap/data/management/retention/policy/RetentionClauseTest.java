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
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.base.Optional;

import zsnap.data.management.PoolFixture;


@Test(groups = { "zsnap.data.management.retention" })
public class RetentionClauseTest {

  private static final DateTime NOW = PoolFixture.NOW;

  @Test
  public void testHours() {
    RetentionClause clause = RetentionPolicyParser.parseClause("24 hours");
    Assert.assertTrue(clause.matches(created(NOW.minusHours(24)), NOW));
    Assert.assertFalse(clause.matches(created(NOW.minusHours(25)), NOW));
  }

  @Test
  public void testDaysCompareDates() {
    RetentionClause clause = RetentionPolicyParser.parseClause("7 days");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 12, 0, 1)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 10, 11, 23, 59)), NOW));
  }

  @Test
  public void testWeeks() {
    RetentionClause clause = RetentionPolicyParser.parseClause("1 week");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 12, 0, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 10, 11, 0, 0)), NOW));
  }

  @Test
  public void testTwoMondays() {
    RetentionClause clause = RetentionPolicyParser.parseClause("2 monday");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 19, 8, 0)), NOW));
    Assert.assertTrue(clause.matches(created(date(2026, 10, 12, 8, 0)), NOW));
    Assert.assertTrue(clause.matches(created(date(2026, 10, 5, 8, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 9, 28, 8, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 10, 13, 8, 0)), NOW));
  }

  @Test
  public void testFirstMondayOfTheMonthAfterItOccurred() {
    RetentionClause clause = RetentionPolicyParser.parseClause("1 1st monday of the month");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 5, 8, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 10, 12, 8, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 9, 7, 8, 0)), NOW));
  }

  @Test
  public void testFirstMondayOfTheMonthBeforeItOccurred() {
    // a Sunday, the first Monday of November is tomorrow
    DateTime now = date(2026, 11, 1, 12, 0);
    RetentionClause clause = RetentionPolicyParser.parseClause("1 1st monday of the month");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 5, 8, 0)), now));
    Assert.assertFalse(clause.matches(created(date(2026, 9, 7, 8, 0)), now));
  }

  @Test
  public void testMissingFifthWeekdayCountsAsNotOccurred() {
    // October 2026 has four Mondays, August 31st is the last fifth Monday
    Assert.assertTrue(RetentionPolicyParser.parseClause("2 5th monday of the month")
        .matches(created(date(2026, 8, 31, 8, 0)), NOW));
    Assert.assertFalse(RetentionPolicyParser.parseClause("1 5th monday of the month")
        .matches(created(date(2026, 8, 31, 8, 0)), NOW));
  }

  @Test
  public void testDayOfMonth() {
    RetentionClause clause = RetentionPolicyParser.parseClause("2 1st day of the month");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 1, 0, 0)), NOW));
    Assert.assertTrue(clause.matches(created(date(2026, 9, 1, 0, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 8, 1, 0, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 9, 2, 0, 0)), NOW));
  }

  @Test
  public void testDayOfMonthAcrossYears() {
    DateTime now = date(2026, 1, 15, 12, 0);
    Assert.assertTrue(RetentionPolicyParser.parseClause("2 1st day of the month")
        .matches(created(date(2025, 12, 1, 0, 0)), now));
    Assert.assertFalse(RetentionPolicyParser.parseClause("1 1st day of the month")
        .matches(created(date(2025, 12, 1, 0, 0)), now));
  }

  @Test
  public void testDayOfQuarter() {
    RetentionClause clause = RetentionPolicyParser.parseClause("1 1st day of the quarter");
    Assert.assertTrue(clause.matches(created(date(2026, 10, 1, 0, 0)), NOW));
    Assert.assertTrue(clause.matches(created(date(2026, 7, 1, 0, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 4, 1, 0, 0)), NOW));
    Assert.assertFalse(clause.matches(created(date(2026, 9, 1, 0, 0)), NOW));
  }

  @Test
  public void testSnapshotName() {
    RetentionClause clause = RetentionPolicyParser.parseClause("@initial");
    Assert.assertTrue(clause.matches(new FixedSnapshot("tank/home@initial", Optional.<DateTime>absent()), NOW));
    Assert.assertFalse(clause.matches(new FixedSnapshot("tank/home@initial2", Optional.<DateTime>absent()), NOW));
  }

  @Test
  public void testUnknownCreationTime() {
    FixedSnapshot snapshot = new FixedSnapshot("tank@unknown", Optional.<DateTime>absent());
    Assert.assertTrue(RetentionPolicyParser.parseClause("all").matches(snapshot, NOW));
    Assert.assertFalse(RetentionPolicyParser.parseClause("none").matches(snapshot, NOW));
    Assert.assertFalse(RetentionPolicyParser.parseClause("7 days").matches(snapshot, NOW));
    Assert.assertFalse(RetentionPolicyParser.parseClause("2 monday").matches(snapshot, NOW));
  }

  @Test
  public void testPolicyFirstMatch() {
    RetentionPolicy policy = RetentionPolicy.parse("2 monday and 7 days");
    Assert.assertEquals(policy.firstMatch(created(date(2026, 10, 12, 8, 0)), NOW).get().toString(), "2 monday");
    Assert.assertEquals(policy.firstMatch(created(date(2026, 10, 13, 8, 0)), NOW).get().toString(), "7 days");
    Assert.assertFalse(policy.firstMatch(created(date(2026, 10, 1, 8, 0)), NOW).isPresent());
  }

  private static DateTime date(int year, int month, int day, int hour, int minute) {
    return new DateTime(year, month, day, hour, minute, PoolFixture.ZONE);
  }

  private static TimestampedSnapshot created(DateTime creation) {
    return new FixedSnapshot("tank@auto", Optional.of(creation));
  }

  private static class FixedSnapshot implements TimestampedSnapshot {
    private final String name;
    private final Optional<DateTime> creation;

    FixedSnapshot(String name, Optional<DateTime> creation) {
      this.name = name;
      this.creation = creation;
    }

    @Override
    public String getName() {
      return this.name;
    }

    @Override
    public String getSuffix() {
      return this.name.substring(this.name.indexOf('@') + 1);
    }

    @Override
    public Optional<DateTime> getCreationTime() {
      return this.creation;
    }
  }
}
