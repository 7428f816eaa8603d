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

import java.nio.file.Path;
import java.nio.file.Paths;

import org.joda.time.DateTime;
import org.mockito.Mockito;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import zsnap.data.management.PoolFixture;
import zsnap.data.management.dataset.Filesystem;
import zsnap.data.management.dataset.Pool;
import zsnap.fs.FileEntry;
import zsnap.fs.TimestampKind;
import zsnap.storage.PropertyRow;


@Test(groups = { "zsnap.data.management.prune" })
public class FilePrunerTest {

  private static final Path LOGS = Paths.get("/tank/logs");
  private static final Path DATA = Paths.get("/srv/data");

  @Test
  public void testDeleteFilesOverMaxFileAge() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/logs");
    Pool pool = fixture.discover(false);
    Filesystem logs = (Filesystem) pool.getDataset("tank/logs").get();
    // inherited from the pool's root filesystem
    ((Filesystem) pool.getDataset("tank").get()).setMaxFileAge(30);
    FileEntry a = file(LOGS.resolve("a.log"), PoolFixture.daysAgo(40), 1);
    FileEntry b = file(LOGS.resolve("b.log"), PoolFixture.daysAgo(35), 1);
    Mockito.when(fixture.fileSystem.listFilesOlderThan(LOGS, TimestampKind.CHANGE, 30))
        .thenReturn(ImmutableList.of(a, b));
    Mockito.when(fixture.fileSystem.deleteEmptyDirectories(LOGS, TimestampKind.CHANGE, 30))
        .thenReturn(ImmutableList.<Path>of());

    Assert.assertEquals(new FilePruner(pool.getContext()).deleteFilesOverMaxFileAge(logs), 2);

    Mockito.verify(fixture.fileSystem).delete(a.getPath());
    Mockito.verify(fixture.fileSystem).delete(b.getPath());
    Mockito.verify(fixture.fileSystem).deleteEmptyDirectories(LOGS, TimestampKind.CHANGE, 30);
  }

  @Test
  public void testPreviewDoesNotDelete() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/logs");
    Pool pool = fixture.discover(true);
    Filesystem logs = (Filesystem) pool.getDataset("tank/logs").get();
    logs.setMaxFileAge(7);
    Mockito.when(fixture.fileSystem.listFilesOlderThan(LOGS, TimestampKind.CHANGE, 7))
        .thenReturn(ImmutableList.of(file(LOGS.resolve("a.log"), PoolFixture.daysAgo(40), 1)));

    Assert.assertEquals(new FilePruner(pool.getContext()).deleteFilesOverMaxFileAge(logs), 1);

    Mockito.verify(fixture.fileSystem, Mockito.never()).delete(Mockito.any(Path.class));
    Mockito.verify(fixture.fileSystem, Mockito.never())
        .deleteEmptyDirectories(Mockito.any(Path.class), Mockito.any(TimestampKind.class), Mockito.anyInt());
  }

  @Test
  public void testNoMaxFileAge() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/logs");
    Pool pool = fixture.discover(false);

    Assert.assertEquals(new FilePruner(pool.getContext())
        .deleteFilesOverMaxFileAge((Filesystem) pool.getDataset("tank/logs").get()), 0);
    Mockito.verifyNoInteractions(fixture.fileSystem);
  }

  @Test
  public void testDeleteOldestFilesOverMaxCapacity() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/data");
    Pool pool = fixture.discover(false);
    Filesystem data = (Filesystem) pool.getDataset("tank/data").get();
    data.setMaxCapacity(0.5);
    data.setMountPoint(DATA.toString());
    stubQuota(fixture, "tank/data", "100", "150", "1000");

    FileEntry oldest = file(DATA.resolve("1"), PoolFixture.daysAgo(10), 10);
    FileEntry cutoff = file(DATA.resolve("2"), PoolFixture.daysAgo(10).plusHours(1), 20);
    FileEntry sameDay = file(DATA.resolve("3"), PoolFixture.daysAgo(10).plusHours(2), 5);
    FileEntry recent = file(DATA.resolve("4"), PoolFixture.daysAgo(5), 30);
    Mockito.when(fixture.fileSystem.listFiles(DATA)).thenReturn(ImmutableList.of(recent, sameDay, cutoff, oldest));
    Mockito.when(fixture.fileSystem.deleteEmptyDirectories(DATA, TimestampKind.MODIFICATION, 10))
        .thenReturn(ImmutableList.<Path>of());

    Assert.assertEquals(new FilePruner(pool.getContext()).deleteOldestFilesOverMaxCapacity(data), 3);

    Mockito.verify(fixture.fileSystem).delete(oldest.getPath());
    Mockito.verify(fixture.fileSystem).delete(cutoff.getPath());
    Mockito.verify(fixture.fileSystem).delete(sameDay.getPath());
    Mockito.verify(fixture.fileSystem, Mockito.never()).delete(recent.getPath());
    Mockito.verify(fixture.fileSystem).deleteEmptyDirectories(DATA, TimestampKind.MODIFICATION, 10);
  }

  @Test
  public void testQuotaUsedWithoutRefquota() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/data");
    Pool pool = fixture.discover(false);
    Filesystem data = (Filesystem) pool.getDataset("tank/data").get();
    data.setMaxCapacity(0.5);
    stubQuota(fixture, "tank/data", "100", "0", "400");

    Assert.assertEquals(new FilePruner(pool.getContext()).deleteOldestFilesOverMaxCapacity(data), 0);
    Mockito.verify(fixture.fileSystem, Mockito.never()).listFiles(Mockito.any(Path.class));
  }

  @Test
  public void testNoQuotaSkipsCapacityPass() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200).filesystem("tank/data");
    Pool pool = fixture.discover(false);
    Filesystem data = (Filesystem) pool.getDataset("tank/data").get();
    data.setMaxCapacity(0.1);
    stubQuota(fixture, "tank/data", "100", "0", "-");

    Assert.assertEquals(new FilePruner(pool.getContext()).deleteOldestFilesOverMaxCapacity(data), 0);
    Mockito.verifyNoInteractions(fixture.fileSystem);
  }

  @Test
  public void testPreviewUsesSimulatedUsage() throws Exception {
    PoolFixture fixture = new PoolFixture("tank", 800, 200)
        .filesystem("tank/data")
        .row("tank/data", "used", "160")
        .snapshot("tank/data@old", PoolFixture.daysAgo(30), 70);
    Pool pool = fixture.discover(true);
    Filesystem data = (Filesystem) pool.getDataset("tank/data").get();
    data.setMaxCapacity(0.5);
    Mockito.when(fixture.storage.get("tank/data", ImmutableList.of("refquota", "quota"), false))
        .thenReturn(ImmutableList.of(new PropertyRow("tank/data", "refquota", "200"),
            new PropertyRow("tank/data", "quota", "0")));
    FilePruner pruner = new FilePruner(pool.getContext());

    // the destroyed snapshot no longer counts, leaving 90 used out of a 100 threshold
    data.destroySnapshot(data.getSnapshots().get(0));
    Assert.assertEquals(data.getUsed().get().longValue(), 90L);
    Assert.assertEquals(pruner.deleteOldestFilesOverMaxCapacity(data), 0);

    Mockito.verify(fixture.storage, Mockito.never()).get("tank/data", ImmutableList.of("used"), false);
    Mockito.verifyNoInteractions(fixture.fileSystem);
  }

  private static void stubQuota(PoolFixture fixture, String filesystem, String used, String refquota, String quota)
      throws Exception {
    Mockito.when(fixture.storage.get(filesystem, ImmutableList.of("refquota", "quota"), false))
        .thenReturn(ImmutableList.of(new PropertyRow(filesystem, "refquota", refquota),
            new PropertyRow(filesystem, "quota", quota)));
    Mockito.when(fixture.storage.get(filesystem, ImmutableList.of("used"), false))
        .thenReturn(ImmutableList.of(new PropertyRow(filesystem, "used", used)));
  }

  private static FileEntry file(Path path, DateTime modification, long size) {
    return new FileEntry(path, modification.getMillis(), modification.getMillis(), size);
  }
}
