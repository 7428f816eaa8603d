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

package zsnap.data.management.config;

import com.google.common.base.Optional;
import com.typesafe.config.Config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import zsnap.configuration.ConfigurationKeys;
import zsnap.util.ConfigUtils;


/**
 * Settings of one dataset entry of a pool. Every setting is optional: an absent one is inherited from the parent
 * dataset, or unconfigured.
 */
@Getter
@AllArgsConstructor
@ToString
public class DatasetConfig {

  private final String name;
  private final Optional<String> retentionPolicy;
  private final Optional<String> maxRetention;
  private final Optional<String> maxFileAge;
  private final Optional<Double> maxCapacity;
  private final Optional<String> mountPoint;

  public static DatasetConfig fromConfig(Config config) {
    return new DatasetConfig(config.getString(ConfigurationKeys.DATASET_NAME_KEY),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.DATASET_RETENTION_POLICY_KEY),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.DATASET_MAX_RETENTION_KEY),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.DATASET_MAX_FILE_AGE_KEY),
        ConfigUtils.getOptionalDouble(config, ConfigurationKeys.DATASET_MAX_CAPACITY_KEY),
        ConfigUtils.getOptionalString(config, ConfigurationKeys.DATASET_MOUNT_POINT_KEY));
  }
}
