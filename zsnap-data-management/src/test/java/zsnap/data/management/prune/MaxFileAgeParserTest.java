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

import org.testng.Assert;
import org.testng.annotations.Test;


@Test(groups = { "zsnap.data.management.prune" })
public class MaxFileAgeParserTest {

  @Test
  public void testParse() {
    Assert.assertEquals(MaxFileAgeParser.parseDays("30 days"), 30);
    Assert.assertEquals(MaxFileAgeParser.parseDays("1 day"), 1);
    Assert.assertEquals(MaxFileAgeParser.parseDays(" 2 weeks "), 14);
    Assert.assertEquals(MaxFileAgeParser.parseDays("1 week"), 7);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownUnit() {
    MaxFileAgeParser.parseDays("3 months");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testOverflow() {
    MaxFileAgeParser.parseDays("999999999 weeks");
  }
}
