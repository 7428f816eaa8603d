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

package zsnap.runtime;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;

import org.apache.commons.cli.ParseException;
import org.joda.time.DateTime;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;

import lombok.extern.slf4j.Slf4j;

import zsnap.data.management.CleanerContext;
import zsnap.data.management.SnapshotCleaner;
import zsnap.data.management.config.CleanerConfig;
import zsnap.fs.LocalFileSystemCommands;
import zsnap.util.ProcessCommandRunner;
import zsnap.zfs.ZfsCommandLine;


/**
 * Entry point of the snapshot cleaner.
 *
 * <p>
 *   Exits with 0 on success, 1 on any error and 2 on invalid command line arguments.
 * </p>
 */
@Slf4j
public class SnapshotCleanerMain {

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  @VisibleForTesting
  static int run(String[] args, PrintStream out) {
    CliOptions.Arguments arguments;
    try {
      arguments = CliOptions.parseArgs(args);
    } catch (ParseException pe) {
      System.err.println(pe.getMessage());
      System.err.print(CliOptions.usage(SnapshotCleanerMain.class));
      return EXIT_USAGE;
    }
    if (arguments.isHelp()) {
      out.print(CliOptions.usage(SnapshotCleanerMain.class));
      return EXIT_SUCCESS;
    }

    if (arguments.isForce()) {
      log.warn("-f or --force is provided, we will actually clean.");
    } else {
      log.warn("Neither -f nor --force is provided, we will NOT clean anything.");
    }

    try {
      CleanerConfig config = CleanerConfig.fromConfig(loadConfig(new File(arguments.getConfFile())));
      CleanerContext context = new CleanerContext(
          new ZfsCommandLine(config.getZfsCommand(), new ProcessCommandRunner()), new LocalFileSystemCommands(),
          !arguments.isForce(), new DateTime(config.getTimeZone()));
      new SnapshotCleaner(context, out).run(config, arguments.isList());
      return EXIT_SUCCESS;
    } catch (IOException | UncheckedIOException | ConfigException | IllegalArgumentException
        | IllegalStateException e) {
      log.error("Snapshot cleaning failed", e);
      return EXIT_FAILURE;
    }
  }

  @VisibleForTesting
  static Config loadConfig(File file) {
    log.info(String.format("Loading configuration from %s", file));
    return ConfigFactory.parseFile(file, ConfigParseOptions.defaults().setAllowMissing(false)).resolve();
  }
}
