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

package zsnap.util;

import org.testng.Assert;
import org.testng.annotations.Test;

import zsnap.annotation.Alias;


@Test(groups = { "zsnap.api.util" })
public class ClassAliasResolverTest {

  @Test
  public void testAliasIgnoresCase() throws Exception {
    ClassAliasResolver<Strategy> resolver = new ClassAliasResolver<>(Strategy.class);
    Assert.assertEquals(resolver.resolveClass("FAST"), FastStrategy.class);
    Assert.assertEquals(resolver.resolveClass("Fast"), FastStrategy.class);
  }

  @Test
  public void testResolveClass() throws Exception {
    ClassAliasResolver<Strategy> resolver = new ClassAliasResolver<>(Strategy.class);

    Assert.assertEquals(resolver.resolveClass("fast"), FastStrategy.class);
    Assert.assertEquals(resolver.resolveClass(FastStrategy.class.getName()), FastStrategy.class);

    try {
      resolver.resolveClass("unrelated");
      Assert.fail();
    } catch (ClassNotFoundException cnfe) {
      // expected
    }

    try {
      resolver.resolveClass(UnrelatedClass.class.getName());
      Assert.fail();
    } catch (ClassNotFoundException cnfe) {
      // expected, not a Strategy
    }
  }

  @Test
  public void testGetAliases() {
    ClassAliasResolver<Strategy> resolver = new ClassAliasResolver<>(Strategy.class);
    Assert.assertTrue(resolver.getAliases().contains("fast"));
    Assert.assertFalse(resolver.getAliases().contains("unrelated"));
  }

  public interface Strategy {
  }

  @Alias(value = "fast")
  public static class FastStrategy implements Strategy {
  }

  @Alias(value = "fast")
  public static class UnrelatedClass {
  }

  @Alias(value = "unrelated")
  public static class AnotherUnrelatedClass {
  }
}
