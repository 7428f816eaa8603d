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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.Lists;

import zsnap.fs.FileEntry;


/**
 * Finds how many of the oldest files have to go for a filesystem to fall back under its capacity threshold.
 */
public class CapacityCutoff {

  public static final Comparator<FileEntry> OLDEST_FIRST = new Comparator<FileEntry>() {
    @Override
    public int compare(FileEntry f1, FileEntry f2) {
      int byTime = Long.compare(f1.getModificationTime(), f2.getModificationTime());
      return byTime != 0 ? byTime : f1.getPath().compareTo(f2.getPath());
    }
  };

  private CapacityCutoff() {
  }

  public static List<FileEntry> sortOldestFirst(List<FileEntry> files) {
    List<FileEntry> sorted = Lists.newArrayList(files);
    Collections.sort(sorted, OLDEST_FIRST);
    return sorted;
  }

  /**
   * Walk <code>oldestFirst</code>, subtracting each file's size from <code>used</code>, and stop at the first file
   * after which the projected usage is strictly under <code>threshold</code>. When usage never gets under the
   * threshold the last file is returned.
   *
   * @return the cutoff file, absent when there are no files
   */
  public static Optional<FileEntry> find(List<FileEntry> oldestFirst, long used, double threshold) {
    long projected = used;
    FileEntry cutoff = null;
    for (FileEntry file : oldestFirst) {
      projected -= file.getSize();
      cutoff = file;
      if (projected < threshold) {
        break;
      }
    }
    return Optional.fromNullable(cutoff);
  }
}
