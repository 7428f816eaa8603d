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

package zsnap.data.management.eviction;

/**
 * Chooses, among the datasets of an over-full pool, the one whose earliest removable snapshot is destroyed next.
 * Implementations are looked up by their {@link zsnap.annotation.Alias}.
 */
public interface EvictionPolicy {

  /**
   * @return true if <code>challenger</code> is strictly preferred over <code>current</code>. Ties keep the current
   *         choice.
   */
  boolean isPreferred(EvictionCandidate challenger, EvictionCandidate current);
}
