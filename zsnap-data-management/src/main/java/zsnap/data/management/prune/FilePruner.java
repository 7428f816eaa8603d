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

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.joda.time.Days;
import org.joda.time.LocalDate;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Longs;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.CleanerContext;
import zsnap.data.management.dataset.Filesystem;
import zsnap.fs.FileEntry;
import zsnap.fs.FileSystemCommands;
import zsnap.fs.TimestampKind;
import zsnap.storage.PropertyRow;


/**
 * Deletes files from mounted filesystems, either because they are older than the filesystem's maxFileAge or because
 * the filesystem uses more than maxCapacity of its quota. Empty directories left behind are removed too, the mount
 * point itself excepted.
 */
@Slf4j
public class FilePruner {

  private final CleanerContext context;

  public FilePruner(CleanerContext context) {
    this.context = context;
  }

  /**
   * Delete the files whose status change time is older than the effective maxFileAge.
   *
   * @return the number of deleted files
   */
  public int deleteFilesOverMaxFileAge(Filesystem filesystem) throws IOException {
    Optional<Integer> maxFileAge = filesystem.getEffectiveMaxFileAge();
    if (!maxFileAge.isPresent()) {
      return 0;
    }
    Path root = filesystem.getMountPoint();
    int days = maxFileAge.get();
    log.info(String.format("Deleting files older than %d days in %s", days, root));

    FileSystemCommands fileSystem = this.context.getFileSystem();
    List<FileEntry> files = fileSystem.listFilesOlderThan(root, TimestampKind.CHANGE, days);
    deleteFiles(files);
    deleteEmptyDirectories(root, TimestampKind.CHANGE, days);
    return files.size();
  }

  /**
   * Delete the oldest files, by modification time, until the filesystem would use no more than maxCapacity of its
   * quota. Every file last modified on or before the day of the cutoff file goes.
   *
   * @return the number of deleted files
   */
  public int deleteOldestFilesOverMaxCapacity(Filesystem filesystem) throws IOException {
    Optional<Double> maxCapacity = filesystem.getEffectiveMaxCapacity();
    if (!maxCapacity.isPresent()) {
      return 0;
    }

    Optional<Long> refquota = Optional.absent();
    Optional<Long> quota = Optional.absent();
    List<PropertyRow> rows = this.context.getStorage().get(filesystem.getName(),
        ImmutableList.of("refquota", "quota"), false);
    for (PropertyRow row : rows) {
      Optional<Long> value = Optional.fromNullable(Longs.tryParse(row.getValue()));
      if ("refquota".equals(row.getProperty())) {
        refquota = value;
      } else if ("quota".equals(row.getProperty())) {
        quota = value;
      }
    }

    long limit;
    if (refquota.isPresent() && refquota.get() > 0) {
      limit = refquota.get();
    } else if (quota.isPresent() && quota.get() > 0) {
      limit = quota.get();
    } else {
      log.warn(String.format("%s has maxCapacity %s but neither refquota nor quota, skipping", filesystem,
          maxCapacity.get()));
      return 0;
    }
    Optional<Long> used = filesystem.getUsed();
    if (!used.isPresent()) {
      log.warn(String.format("Used space of %s is unknown, skipping", filesystem));
      return 0;
    }

    double threshold = maxCapacity.get() * limit;
    if (used.get() <= threshold) {
      log.debug(String.format("%s uses %d of %d bytes, under maxCapacity %s", filesystem, used.get(), limit,
          maxCapacity.get()));
      return 0;
    }

    Path root = filesystem.getMountPoint();
    List<FileEntry> files = CapacityCutoff.sortOldestFirst(this.context.getFileSystem().listFiles(root));
    Optional<FileEntry> cutoff = CapacityCutoff.find(files, used.get(), threshold);
    if (!cutoff.isPresent()) {
      log.warn(String.format("%s is over maxCapacity %s but %s holds no file", filesystem, maxCapacity.get(), root));
      return 0;
    }

    LocalDate cutoffDate = toDate(cutoff.get().getModificationTime());
    int ageDays = Days.daysBetween(cutoffDate, this.context.getToday()).getDays();
    log.info(String.format("%s uses %d of %d bytes, deleting files of %s modified on or before %s", filesystem,
        used.get(), limit, root, cutoffDate));

    List<FileEntry> toDelete = Lists.newArrayList();
    for (FileEntry file : files) {
      if (!toDate(file.getModificationTime()).isAfter(cutoffDate)) {
        toDelete.add(file);
      }
    }
    deleteFiles(toDelete);
    deleteEmptyDirectories(root, TimestampKind.MODIFICATION, ageDays);
    return toDelete.size();
  }

  private LocalDate toDate(long millis) {
    return new LocalDate(millis, this.context.getTimeZone());
  }

  private void deleteFiles(List<FileEntry> files) throws IOException {
    for (FileEntry file : files) {
      if (this.context.isDryRun()) {
        log.info(String.format("Would delete %s", file.getPath()));
      } else {
        log.debug(String.format("Deleting %s", file.getPath()));
        this.context.getFileSystem().delete(file.getPath());
      }
    }
  }

  private void deleteEmptyDirectories(Path root, TimestampKind kind, int days) throws IOException {
    if (this.context.isDryRun()) {
      log.info(String.format("Would delete empty directories of %s older than %d days", root, days));
      return;
    }
    for (Path directory : this.context.getFileSystem().deleteEmptyDirectories(root, kind, days)) {
      log.debug(String.format("Deleted empty directory %s", directory));
    }
  }
}
