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

package zsnap.storage;

import java.io.IOException;


/**
 * Thrown when a command against the storage system or the filesystem fails. The current run must not go on after
 * such a failure, the state of the external system is unknown.
 */
public class CommandExecutionException extends IOException {

  private static final long serialVersionUID = 1L;

  public CommandExecutionException(String message) {
    super(message);
  }

  public CommandExecutionException(Throwable cause) {
    super(cause);
  }

  public CommandExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
