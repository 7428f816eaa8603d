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

package zsnap.configuration;

/**
 * Configuration keys and defaults used by the snapshot cleaner.
 */
public class ConfigurationKeys {

  public static final String CONFIG_PREFIX = "zsnap";

  public static final String DEFAULT_CONFIG_FILE = "/usr/local/etc/zfs-snapshots-cleaner.conf";

  /**
   * Storage command line
   */
  public static final String ZFS_COMMAND_KEY = CONFIG_PREFIX + ".zfs.command";
  public static final String DEFAULT_ZFS_COMMAND = "/sbin/zfs";

  /**
   * Time zone used to turn snapshot creation times into calendar dates.
   */
  public static final String TIMEZONE_KEY = CONFIG_PREFIX + ".timezone";

  public static final String POOLS_KEY = CONFIG_PREFIX + ".pools";

  /**
   * Keys relative to one pool entry.
   */
  public static final String POOL_NAME_KEY = "name";
  public static final String POOL_MAX_CAPACITY_KEY = "maxCapacity";
  public static final String POOL_BEST_EFFORT_POLICY_KEY = "bestEffortPolicy";
  public static final String POOL_DATASETS_KEY = "datasets";
  public static final double DEFAULT_POOL_MAX_CAPACITY = 0.8;
  public static final String DEFAULT_BEST_EFFORT_POLICY = "morerem";

  /**
   * Keys relative to one dataset entry.
   */
  public static final String DATASET_NAME_KEY = "name";
  public static final String DATASET_RETENTION_POLICY_KEY = "retentionPolicy";
  public static final String DATASET_MAX_RETENTION_KEY = "maxRetention";
  public static final String DATASET_MAX_FILE_AGE_KEY = "maxFileAge";
  public static final String DATASET_MAX_CAPACITY_KEY = "maxCapacity";
  public static final String DATASET_MOUNT_POINT_KEY = "mountPoint";

  /**
   * Name of the user hold recording a must-keep decision.
   */
  public static final String KEEP_TAG = "keep";
}
