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

import java.io.PrintWriter;
import java.io.StringWriter;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import zsnap.configuration.ConfigurationKeys;


/**
 * Command line options of the snapshot cleaner.
 */
public class CliOptions {

  static final Option HELP_OPTION =
      Option.builder("h").longOpt("help").desc("Display usage information").build();
  static final Option DRY_RUN_OPTION = Option.builder("d").longOpt("dry-run")
      .desc("Only log what would be done (default)").build();
  static final Option FORCE_OPTION = Option.builder("f").longOpt("force")
      .desc("Actually hold, release and destroy snapshots and delete files").build();
  static final Option LIST_OPTION = Option.builder("l").longOpt("list")
      .desc("List every snapshot with its keep decision and exit").build();
  static final Option CONF_FILE_OPTION = Option.builder("c").longOpt("conffile").hasArg().argName("file")
      .desc("Configuration file, default " + ConfigurationKeys.DEFAULT_CONFIG_FILE).build();

  /**
   * Parsed command line.
   */
  @Getter
  @AllArgsConstructor
  @ToString
  public static class Arguments {
    private final boolean help;
    private final boolean force;
    private final boolean list;
    private final String confFile;
  }

  private CliOptions() {
  }

  /**
   * @throws ParseException on unknown options, a missing option argument or both <code>-d</code> and <code>-f</code>
   */
  public static Arguments parseArgs(String[] args) throws ParseException {
    CommandLine cmd = new DefaultParser().parse(options(), args);
    if (!cmd.getArgList().isEmpty()) {
      throw new ParseException("Unexpected arguments: " + cmd.getArgList());
    }
    return new Arguments(cmd.hasOption(HELP_OPTION.getOpt()), cmd.hasOption(FORCE_OPTION.getOpt()),
        cmd.hasOption(LIST_OPTION.getOpt()),
        cmd.getOptionValue(CONF_FILE_OPTION.getOpt(), ConfigurationKeys.DEFAULT_CONFIG_FILE));
  }

  /**
   * Usage of the command line, as printed by <code>--help</code>.
   */
  public static String usage(Class<?> caller) {
    StringWriter usage = new StringWriter();
    PrintWriter writer = new PrintWriter(usage);
    HelpFormatter formatter = new HelpFormatter();
    formatter.printHelp(writer, formatter.getWidth(), caller.getSimpleName(), null, options(),
        formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
    writer.flush();
    return usage.toString();
  }

  private static Options options() {
    Options options = new Options();
    options.addOption(HELP_OPTION);
    options.addOptionGroup(new OptionGroup().addOption(DRY_RUN_OPTION).addOption(FORCE_OPTION));
    options.addOption(LIST_OPTION);
    options.addOption(CONF_FILE_OPTION);
    return options;
  }
}
