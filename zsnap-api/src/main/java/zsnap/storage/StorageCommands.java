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
import java.util.List;
import java.util.Set;


/**
 * Narrow interface to query and mutate the storage system. Every method is synchronous and either succeeds or throws;
 * callers never retry.
 */
public interface StorageCommands {

  /**
   * Get the given properties of an entity (pool, dataset or snapshot).
   *
   * @param entity full name of the entity
   * @param properties names of the properties to fetch
   * @param recursive whether descendants of the entity are listed as well. Rows of an entity are contiguous and a
   *                  dataset is always listed before its snapshots and its children.
   */
  List<PropertyRow> get(String entity, List<String> properties, boolean recursive) throws IOException;

  /**
   * Destroy a snapshot, deferring the destruction while user holds exist.
   */
  void destroy(String snapshot) throws IOException;

  /**
   * Place the user hold <code>tag</code> on a snapshot.
   */
  void hold(String tag, String snapshot) throws IOException;

  /**
   * Remove the user hold <code>tag</code> from a snapshot.
   */
  void release(String tag, String snapshot) throws IOException;

  /**
   * List the user holds currently placed on a snapshot.
   */
  Set<String> listTags(String snapshot) throws IOException;
}
