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
import java.nio.file.Path;
import java.util.List;


/**
 * Narrow interface used to scan and prune the files of a mounted dataset.
 *
 * <p>
 *   Ages are counted in whole days the way <code>find -ctime +n</code> does: a file is older than <code>n</code>
 *   days when the number of complete 24 hour periods since its timestamp is strictly greater than <code>n</code>.
 * </p>
 */
public interface FileSystemCommands {

  /**
   * List every regular file under <code>root</code>, recursively.
   */
  List<FileEntry> listFiles(Path root) throws IOException;

  /**
   * List the regular files under <code>root</code> older than <code>days</code> according to <code>kind</code>.
   */
  List<FileEntry> listFilesOlderThan(Path root, TimestampKind kind, int days) throws IOException;

  /**
   * Delete a single file.
   */
  void delete(Path path) throws IOException;

  /**
   * Delete the empty directories under <code>root</code> older than <code>days</code>, children before parents.
   * <code>root</code> itself is never deleted.
   *
   * @return the deleted directories
   */
  List<Path> deleteEmptyDirectories(Path root, TimestampKind kind, int days) throws IOException;
}
