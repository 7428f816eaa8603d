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

package zsnap.data.management.accounting;

import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import zsnap.data.management.PoolFixture;
import zsnap.data.management.dataset.Dataset;
import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;
import zsnap.storage.CommandExecutionException;
import zsnap.storage.PropertyRow;
import zsnap.storage.StorageCommands;


@Test(groups = { "zsnap.data.management.accounting" })
public class SpaceAccountingTest {

  @Test
  public void testPreviewAccountingMovesSnapshotSpace() throws Exception {
    Pool pool = new PoolFixture("tank", 900, 100)
        .snapshot("tank@a", PoolFixture.daysAgo(3), 150)
        .snapshot("tank@b", PoolFixture.daysAgo(2), 50)
        .discover(true);
    Dataset tank = pool.getDataset("tank").get();

    Assert.assertEquals(pool.getCapacity(), 0.9, 1e-9);
    tank.destroySnapshot(tank.getSnapshots().get(0));

    Assert.assertEquals(pool.getUsed(), 750L);
    Assert.assertEquals(pool.getAvailable(), 250L);
    Assert.assertEquals(pool.getCapacity(), 0.75, 1e-9);
    Assert.assertEquals(pool.getReferenced(), 100L);
  }

  @Test
  public void testPreviewDatasetUsageIncludesAncestors() throws Exception {
    Pool pool = new PoolFixture("tank", 900, 100)
        .row("tank", "used", "900")
        .filesystem("tank/home")
        .row("tank/home", "used", "300")
        .snapshot("tank/home@a", PoolFixture.daysAgo(3), 120)
        .filesystem("tank/vm")
        .discover(true);
    Dataset home = pool.getDataset("tank/home").get();

    home.destroySnapshot(home.getSnapshots().get(0));

    Assert.assertEquals(home.getUsed().get().longValue(), 180L);
    Assert.assertEquals(pool.getDataset("tank").get().getUsed().get().longValue(), 780L);
    Assert.assertFalse(pool.getDataset("tank/vm").get().getUsed().isPresent());
  }

  @Test
  public void testLiveDatasetUsage() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 900, 100).filesystem("tank/home");
    Pool pool = fixture.discover(false);
    Mockito.when(fixture.storage.get("tank/home", ImmutableList.of("used"), false)).thenReturn(
        ImmutableList.of(new PropertyRow("tank/home", "used", "300")),
        ImmutableList.of(new PropertyRow("tank/home", "used", "-")));
    Dataset home = pool.getDataset("tank/home").get();

    Assert.assertEquals(home.getUsed().get().longValue(), 300L);
    Assert.assertFalse(home.getUsed().isPresent());
  }

  @Test
  public void testSnapshotOfUnknownSizeFreesNothing() throws Exception {
    Pool pool = new PoolFixture("tank", 900, 100)
        .row("tank@a", "type", "snapshot")
        .row("tank@a", "used", "-")
        .discover(true);
    Dataset tank = pool.getDataset("tank").get();
    Snapshot snapshot = tank.getSnapshots().get(0);

    tank.destroySnapshot(snapshot);

    Assert.assertEquals(pool.getUsed(), 900L);
  }

  @Test
  public void testLiveAccountingQueriesEveryTime() throws Exception {
    StorageCommands storage = Mockito.mock(StorageCommands.class);
    Mockito.when(storage.get("tank", ImmutableList.of("used"), false)).thenReturn(
        ImmutableList.of(new PropertyRow("tank", "used", "900")),
        ImmutableList.of(new PropertyRow("tank", "used", "700")));
    LiveSpaceAccounting accounting = new LiveSpaceAccounting(storage);
    Pool pool = Mockito.mock(Pool.class);
    Mockito.when(pool.getName()).thenReturn("tank");

    Assert.assertEquals(accounting.getUsed(pool), 900L);
    Assert.assertEquals(accounting.getUsed(pool), 700L);
  }

  @Test(expectedExceptions = CommandExecutionException.class)
  public void testLiveAccountingRejectsMissingValue() throws Exception {
    StorageCommands storage = Mockito.mock(StorageCommands.class);
    Mockito.when(storage.get("tank", ImmutableList.of("used"), false))
        .thenReturn(ImmutableList.of(new PropertyRow("tank", "used", "-")));
    LiveSpaceAccounting.getLongProperty(storage, "tank", "used");
  }
}
