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

package zsnap.zfs;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import zsnap.storage.CommandExecutionException;
import zsnap.storage.PropertyRow;
import zsnap.storage.StorageCommands;
import zsnap.util.CommandRunner;


/**
 * {@link StorageCommands} backed by the <code>zfs</code> command line tool. Every query uses scripted (<code>-H</code>)
 * and parsable (<code>-p</code>) output, so columns are tab separated and sizes and dates are plain numbers.
 */
@Slf4j
public class ZfsCommandLine implements StorageCommands {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n').omitEmptyStrings();
  private static final Splitter TAB_SPLITTER = Splitter.on('\t');
  private static final Joiner COMMA_JOINER = Joiner.on(',');

  private final String zfsCommand;
  private final CommandRunner runner;

  public ZfsCommandLine(String zfsCommand, CommandRunner runner) {
    this.zfsCommand = zfsCommand;
    this.runner = runner;
  }

  @Override
  public List<PropertyRow> get(String entity, List<String> properties, boolean recursive) throws IOException {
    ImmutableList.Builder<String> command = ImmutableList.<String>builder().add(this.zfsCommand, "get");
    if (recursive) {
      command.add("-r");
    }
    command.add("-H", "-p", "-o", "name,property,value", COMMA_JOINER.join(properties), entity);

    List<PropertyRow> rows = Lists.newArrayList();
    for (String line : LINE_SPLITTER.split(this.runner.run(command.build()))) {
      List<String> columns = TAB_SPLITTER.limit(3).splitToList(line);
      if (columns.size() != 3) {
        throw new CommandExecutionException(String.format("Unexpected output line from zfs get: '%s'", line));
      }
      rows.add(new PropertyRow(columns.get(0), columns.get(1), columns.get(2)));
    }
    return rows;
  }

  @Override
  public void destroy(String snapshot) throws IOException {
    String output = this.runner.run(ImmutableList.of(this.zfsCommand, "destroy", "-d", snapshot));
    if (!output.isEmpty()) {
      log.debug(output);
    }
  }

  @Override
  public void hold(String tag, String snapshot) throws IOException {
    this.runner.run(ImmutableList.of(this.zfsCommand, "hold", tag, snapshot));
  }

  @Override
  public void release(String tag, String snapshot) throws IOException {
    this.runner.run(ImmutableList.of(this.zfsCommand, "release", tag, snapshot));
  }

  @Override
  public Set<String> listTags(String snapshot) throws IOException {
    Set<String> tags = Sets.newLinkedHashSet();
    for (String line : LINE_SPLITTER.split(this.runner.run(ImmutableList.of(this.zfsCommand, "holds", "-H", snapshot)))) {
      List<String> columns = TAB_SPLITTER.splitToList(line);
      if (columns.size() < 2) {
        throw new CommandExecutionException(String.format("Unexpected output line from zfs holds: '%s'", line));
      }
      tags.add(columns.get(1).trim());
    }
    return tags;
  }
}
