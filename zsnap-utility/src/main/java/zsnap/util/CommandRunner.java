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

import java.io.IOException;
import java.util.List;


/**
 * Runs an external command to completion and returns its standard output.
 */
public interface CommandRunner {

  /**
   * @param command the program followed by its arguments
   * @return everything the command wrote to its standard output
   * @throws zsnap.storage.CommandExecutionException if the command cannot be started or exits with a non zero status
   */
  String run(List<String> command) throws IOException;
}
