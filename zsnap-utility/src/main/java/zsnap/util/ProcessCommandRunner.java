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

package zsnap.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.google.common.base.Joiner;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;

import zsnap.storage.CommandExecutionException;


/**
 * A {@link CommandRunner} starting one local process per command. Standard error is captured in a temporary file so
 * that it can be reported when the command fails.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

  private static final Joiner SPACE_JOINER = Joiner.on(' ');

  @Override
  public String run(List<String> command) throws IOException {
    String commandLine = SPACE_JOINER.join(command);
    log.debug("Running: {}", commandLine);

    File stderrFile = File.createTempFile("zsnap-", ".stderr");
    try {
      Process process;
      try {
        process = new ProcessBuilder(command).redirectError(stderrFile).start();
      } catch (IOException ioe) {
        throw new CommandExecutionException("Failed to start " + commandLine, ioe);
      }

      String output;
      try (InputStream stdout = process.getInputStream()) {
        output = CharStreams.toString(new InputStreamReader(stdout, StandardCharsets.UTF_8));
      }

      int exitCode;
      try {
        exitCode = process.waitFor();
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
        process.destroy();
        throw new CommandExecutionException("Interrupted while waiting for " + commandLine, ie);
      }

      if (exitCode != 0) {
        String error = Files.asCharSource(stderrFile, StandardCharsets.UTF_8).read().trim();
        throw new CommandExecutionException(
            String.format("Command '%s' exited with status %d: %s", commandLine, exitCode, error));
      }
      return output;
    } finally {
      if (!stderrFile.delete()) {
        log.debug("Could not delete temporary file {}", stderrFile);
      }
    }
  }
}
