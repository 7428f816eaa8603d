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

import org.joda.time.DateTime;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import lombok.EqualsAndHashCode;


/**
 * An ordered list of {@link RetentionClause}s. A snapshot matches the policy when it matches any clause.
 */
@EqualsAndHashCode(of = "text")
public class RetentionPolicy {

  private static final Joiner CLAUSE_JOINER = Joiner.on(" and ");

  private final List<RetentionClause> clauses;
  private final String text;

  public RetentionPolicy(List<? extends RetentionClause> clauses) {
    this.clauses = ImmutableList.copyOf(clauses);
    this.text = CLAUSE_JOINER.join(this.clauses);
  }

  /**
   * Parse a policy string such as <code>7 days and 4 sundays and @initial</code>.
   *
   * @throws InvalidRetentionPolicyException if any clause is not recognized
   */
  public static RetentionPolicy parse(String policy) {
    return RetentionPolicyParser.parse(policy);
  }

  public List<RetentionClause> getClauses() {
    return this.clauses;
  }

  public boolean isEmpty() {
    return this.clauses.isEmpty();
  }

  /**
   * @return the first clause matching <code>snapshot</code>, in declaration order
   */
  public Optional<RetentionClause> firstMatch(TimestampedSnapshot snapshot, DateTime now) {
    for (RetentionClause clause : this.clauses) {
      if (clause.matches(snapshot, now)) {
        return Optional.of(clause);
      }
    }
    return Optional.absent();
  }

  @Override
  public String toString() {
    return this.text;
  }
}
