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

package zsnap.fs;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;


@Test(groups = { "zsnap.fs" })
public class LocalFileSystemCommandsTest {

  private static final long DAY = TimeUnit.DAYS.toMillis(1);

  private final long now = System.currentTimeMillis();
  private final Supplier<Long> clock = Suppliers.ofInstance(this.now);
  private Path root;
  private LocalFileSystemCommands fileSystem;

  @BeforeMethod
  public void setUp() throws Exception {
    this.root = Files.createTempDirectory("zsnap-fs");
    this.fileSystem = new LocalFileSystemCommands(this.clock);
  }

  @AfterMethod
  public void tearDown() throws Exception {
    FileUtils.deleteDirectory(this.root.toFile());
  }

  @Test
  public void testIsOlderThanCountsWholeDays() {
    Assert.assertFalse(LocalFileSystemCommands.isOlderThan(this.now - 2 * DAY, 2, this.now));
    Assert.assertFalse(LocalFileSystemCommands.isOlderThan(this.now - 3 * DAY + 1, 2, this.now));
    Assert.assertTrue(LocalFileSystemCommands.isOlderThan(this.now - 3 * DAY, 2, this.now));
  }

  @Test
  public void testWalkFailureIsAnIOException() {
    final AccessDeniedException denied = new AccessDeniedException("/tank/locked");
    Stream<Path> walk = Stream.of(this.root).map(path -> {
      throw new UncheckedIOException(denied);
    });

    try {
      LocalFileSystemCommands.collect(walk);
      Assert.fail();
    } catch (IOException ioe) {
      Assert.assertSame(ioe, denied);
    }
  }

  @Test(expectedExceptions = IOException.class)
  public void testListFilesOfMissingRoot() throws Exception {
    this.fileSystem.listFiles(this.root.resolve("missing"));
  }

  @Test
  public void testListFilesOnlyReturnsRegularFiles() throws Exception {
    Path file = createFile("a/b/data.bin", "12345", 0);
    Files.createDirectories(this.root.resolve("empty"));

    List<FileEntry> files = this.fileSystem.listFiles(this.root);

    Assert.assertEquals(files.size(), 1);
    Assert.assertEquals(files.get(0).getPath(), file);
    Assert.assertEquals(files.get(0).getSize(), 5);
  }

  @Test
  public void testListFilesOlderThanByModificationTime() throws Exception {
    Path old = createFile("old.log", "x", 10);
    createFile("recent.log", "x", 1);

    List<FileEntry> files = this.fileSystem.listFilesOlderThan(this.root, TimestampKind.MODIFICATION, 5);

    Assert.assertEquals(files.size(), 1);
    Assert.assertEquals(files.get(0).getPath(), old);
  }

  @Test
  public void testDelete() throws Exception {
    Path file = createFile("gone.txt", "x", 0);
    this.fileSystem.delete(file);
    Assert.assertFalse(Files.exists(file));
  }

  @Test
  public void testDeleteEmptyDirectories() throws Exception {
    Path parent = Files.createDirectories(this.root.resolve("parent"));
    Path child = Files.createDirectories(parent.resolve("child"));
    Path kept = Files.createDirectories(this.root.resolve("kept"));
    createFile("kept/file.txt", "x", 0);
    Path recent = Files.createDirectories(this.root.resolve("recent"));
    setAge(child, 10);
    setAge(parent, 10);
    setAge(kept, 10);
    setAge(recent, 0);
    setAge(this.root, 10);

    List<Path> deleted = this.fileSystem.deleteEmptyDirectories(this.root, TimestampKind.MODIFICATION, 5);

    Assert.assertEquals(Sets.newHashSet(deleted), ImmutableSet.of(child));
    // deleting child refreshed the modification time of parent
    Assert.assertTrue(Files.exists(parent));
    Assert.assertTrue(Files.exists(kept));
    Assert.assertTrue(Files.exists(recent));
    Assert.assertTrue(Files.exists(this.root));
  }

  private Path createFile(String relative, String content, int ageDays) throws Exception {
    Path file = this.root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    setAge(file, ageDays);
    return file;
  }

  private void setAge(Path path, int ageDays) throws Exception {
    Files.setLastModifiedTime(path, FileTime.fromMillis(this.now - ageDays * DAY - 1000));
  }
}
