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

package zsnap.data.management.retention;

import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.Test;

import zsnap.data.management.PoolFixture;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.retention.policy.RetentionPolicy;


@Test(groups = { "zsnap.data.management.retention" })
public class MaxRetentionEnforcerTest {

  @Test
  public void testDestroysSnapshotsOutOfMaxRetention() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200)
        .filesystem("tank/home")
        .snapshot("tank/home@old", PoolFixture.daysAgo(40), 10)
        .snapshot("tank/home@older", PoolFixture.daysAgo(50), 10)
        .snapshot("tank/home@recent", PoolFixture.daysAgo(2), 10);
    Pool pool = fixture.discover(false);
    pool.getDataset("tank/home").get().setMaxRetention(RetentionPolicy.parse("30 days"));

    int destroyed = new MaxRetentionEnforcer(new SnapshotDestroyer(pool.getContext())).enforce(pool);

    Assert.assertEquals(destroyed, 2);
    Mockito.verify(fixture.storage).destroy("tank/home@old");
    Mockito.verify(fixture.storage).destroy("tank/home@older");
    Mockito.verify(fixture.storage, Mockito.never()).destroy("tank/home@recent");
    Assert.assertEquals(pool.getDataset("tank/home").get().getSnapshots().size(), 1);
  }

  @Test
  public void testPreviewOnlyLogs() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).snapshot("tank@old", PoolFixture.daysAgo(40), 100);
    Pool pool = fixture.discover(true);
    pool.getDataset("tank").get().setMaxRetention(RetentionPolicy.parse("1 week"));

    Assert.assertEquals(new MaxRetentionEnforcer(new SnapshotDestroyer(pool.getContext())).enforce(pool), 1);

    Mockito.verify(fixture.storage, Mockito.never()).destroy(Mockito.anyString());
    Assert.assertTrue(pool.getSnapshots().isEmpty());
    Assert.assertEquals(pool.getUsed(), 700L);
  }
}
