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

package zsnap.data.management;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Getter;

import zsnap.fs.FileSystemCommands;
import zsnap.storage.StorageCommands;


/**
 * State shared by every component of one cleaner run: the command interfaces, the preview flag and the reference
 * time captured once when the run starts.
 */
@Getter
@AllArgsConstructor
public class CleanerContext {

  private final StorageCommands storage;
  private final FileSystemCommands fileSystem;

  /**
   * When true nothing is held, released, destroyed or deleted; the would-be actions are logged instead.
   */
  private final boolean dryRun;

  private final DateTime now;

  public DateTimeZone getTimeZone() {
    return this.now.getZone();
  }

  public LocalDate getToday() {
    return this.now.toLocalDate();
  }
}
