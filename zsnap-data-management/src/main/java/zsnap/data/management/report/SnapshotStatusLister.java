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

package zsnap.data.management.report;

import java.io.IOException;
import java.util.List;

import com.google.common.collect.Lists;

import zsnap.data.management.dataset.Pool;
import zsnap.data.management.dataset.Snapshot;


/**
 * Produces the list mode output: one line per snapshot with its keep decision.
 */
public class SnapshotStatusLister {

  public List<String> list(Pool pool) throws IOException {
    List<String> lines = Lists.newArrayList();
    for (Snapshot snapshot : pool.getSnapshots()) {
      lines.add(String.format("%s %s", snapshot.getName(), snapshot.getKeepDecision().getDescription()));
    }
    return lines;
  }
}
