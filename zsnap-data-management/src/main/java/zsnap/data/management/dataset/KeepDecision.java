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

package zsnap.data.management.dataset;

/**
 * Verdict of the keep-decision engine for one snapshot.
 */
public enum KeepDecision {

  KEEP("must NOT be destroyed"),
  DESTROY("must be destroyed"),
  BEST_EFFORT("can be destroyed");

  private final String description;

  KeepDecision(String description) {
    this.description = description;
  }

  /**
   * Whether a snapshot with this decision may be picked by the eviction scheduler.
   */
  public boolean isRemovable() {
    return this != KEEP;
  }

  public String getDescription() {
    return this.description;
  }
}
