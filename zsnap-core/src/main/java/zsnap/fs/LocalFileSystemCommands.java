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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.extern.slf4j.Slf4j;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import com.google.common.collect.Lists;


/**
 * {@link FileSystemCommands} working on the local filesystem through <code>java.nio.file</code>. The change time is
 * read from the <code>unix:ctime</code> attribute; on platforms without it the modification time is used instead.
 * Symbolic links are neither followed nor reported.
 */
@Slf4j
public class LocalFileSystemCommands implements FileSystemCommands {

  private static final long DAY_MILLIS = TimeUnit.DAYS.toMillis(1);
  private static final String CTIME_ATTRIBUTE = "unix:ctime";

  private final Supplier<Long> currentTimeMillis;
  private boolean ctimeSupported = true;

  public LocalFileSystemCommands() {
    this(new Supplier<Long>() {
      @Override
      public Long get() {
        return System.currentTimeMillis();
      }
    });
  }

  @VisibleForTesting
  LocalFileSystemCommands(Supplier<Long> currentTimeMillis) {
    this.currentTimeMillis = currentTimeMillis;
  }

  @Override
  public List<FileEntry> listFiles(Path root) throws IOException {
    List<FileEntry> entries = Lists.newArrayList();
    for (Path path : walk(root)) {
      BasicFileAttributes attributes =
          Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
      if (attributes.isRegularFile()) {
        long modificationTime = attributes.lastModifiedTime().toMillis();
        entries.add(new FileEntry(path, modificationTime, changeTime(path, modificationTime), attributes.size()));
      }
    }
    return entries;
  }

  @Override
  public List<FileEntry> listFilesOlderThan(Path root, TimestampKind kind, int days) throws IOException {
    long now = this.currentTimeMillis.get();
    List<FileEntry> older = Lists.newArrayList();
    for (FileEntry entry : listFiles(root)) {
      if (isOlderThan(entry.getTime(kind), days, now)) {
        older.add(entry);
      }
    }
    return older;
  }

  @Override
  public void delete(Path path) throws IOException {
    Files.delete(path);
  }

  @Override
  public List<Path> deleteEmptyDirectories(Path root, TimestampKind kind, int days) throws IOException {
    List<Path> directories = Lists.newArrayList();
    for (Path path : walk(root)) {
      if (!path.equals(root) && Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
        directories.add(path);
      }
    }
    // deepest first, so that a parent emptied by its children is examined after them
    Collections.sort(directories, Comparator.comparingInt(Path::getNameCount).reversed());

    long now = this.currentTimeMillis.get();
    List<Path> deleted = Lists.newArrayList();
    for (Path directory : directories) {
      if (isEmpty(directory) && isOlderThan(directoryTime(directory, kind), days, now)) {
        Files.delete(directory);
        deleted.add(directory);
      }
    }
    return deleted;
  }

  private static List<Path> walk(Path root) throws IOException {
    try (Stream<Path> stream = Files.walk(root)) {
      return collect(stream);
    }
  }

  /**
   * Drain a directory walk, rethrowing a failure hit while iterating as the {@link IOException} it wraps.
   */
  @VisibleForTesting
  static List<Path> collect(Stream<Path> walk) throws IOException {
    try {
      return walk.collect(Collectors.toList());
    } catch (UncheckedIOException uioe) {
      throw uioe.getCause();
    }
  }

  @VisibleForTesting
  static boolean isOlderThan(long time, int days, long now) {
    return (now - time) / DAY_MILLIS > days;
  }

  private static boolean isEmpty(Path directory) throws IOException {
    try (DirectoryStream<Path> children = Files.newDirectoryStream(directory)) {
      return !children.iterator().hasNext();
    }
  }

  private long directoryTime(Path directory, TimestampKind kind) throws IOException {
    long modificationTime = Files.getLastModifiedTime(directory, LinkOption.NOFOLLOW_LINKS).toMillis();
    return kind == TimestampKind.CHANGE ? changeTime(directory, modificationTime) : modificationTime;
  }

  private long changeTime(Path path, long modificationTime) throws IOException {
    if (!this.ctimeSupported) {
      return modificationTime;
    }
    try {
      return ((FileTime) Files.getAttribute(path, CTIME_ATTRIBUTE, LinkOption.NOFOLLOW_LINKS)).toMillis();
    } catch (UnsupportedOperationException | IllegalArgumentException e) {
      log.warn("File change time is not available on this platform, using modification time instead");
      this.ctimeSupported = false;
      return modificationTime;
    }
  }
}
