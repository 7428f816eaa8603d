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

package zsnap.data.management.prune;

import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * Parses maxFileAge values: <code>N day[s]</code> or <code>N week[s]</code>.
 */
public class MaxFileAgeParser {

  private static final Pattern DAYS = Pattern.compile("(\\d+) days?");
  private static final Pattern WEEKS = Pattern.compile("(\\d+) weeks?");

  private MaxFileAgeParser() {
  }

  /**
   * @return the age in days
   * @throws IllegalArgumentException if <code>maxFileAge</code> is not recognized
   */
  public static int parseDays(String maxFileAge) {
    String value = maxFileAge.trim();
    try {
      Matcher matcher = DAYS.matcher(value);
      if (matcher.matches()) {
        return Integer.parseInt(matcher.group(1));
      }
      matcher = WEEKS.matcher(value);
      if (matcher.matches()) {
        return Math.multiplyExact(Integer.parseInt(matcher.group(1)), 7);
      }
    } catch (NumberFormatException | ArithmeticException e) {
      throw new IllegalArgumentException(String.format("maxFileAge out of range: '%s'", maxFileAge), e);
    }
    throw new IllegalArgumentException(String.format("Cannot parse maxFileAge '%s'", maxFileAge));
  }
}
