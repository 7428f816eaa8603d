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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import zsnap.configuration.ConfigurationKeys;
import zsnap.util.ConfigUtils;


/**
 * Settings of one pool entry.
 */
@Getter
@AllArgsConstructor
@ToString
public class PoolConfig {

  private final String name;
  private final double maxCapacity;
  private final String bestEffortPolicy;
  private final List<DatasetConfig> datasets;

  public static PoolConfig fromConfig(Config config) {
    ImmutableList.Builder<DatasetConfig> datasets = ImmutableList.builder();
    for (Config dataset : ConfigUtils.getConfigList(config, ConfigurationKeys.POOL_DATASETS_KEY)) {
      datasets.add(DatasetConfig.fromConfig(dataset));
    }
    return new PoolConfig(config.getString(ConfigurationKeys.POOL_NAME_KEY),
        ConfigUtils.getDouble(config, ConfigurationKeys.POOL_MAX_CAPACITY_KEY,
            ConfigurationKeys.DEFAULT_POOL_MAX_CAPACITY),
        ConfigUtils.getString(config, ConfigurationKeys.POOL_BEST_EFFORT_POLICY_KEY,
            ConfigurationKeys.DEFAULT_BEST_EFFORT_POLICY),
        datasets.build());
  }
}
