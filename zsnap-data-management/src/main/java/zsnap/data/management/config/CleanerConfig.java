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

import org.joda.time.DateTimeZone;

import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import zsnap.configuration.ConfigurationKeys;
import zsnap.util.ConfigUtils;


/**
 * Whole cleaner configuration, read from the <code>zsnap</code> section of a HOCON file.
 *
 * @see ConfigurationKeys
 */
@Getter
@AllArgsConstructor
@ToString
public class CleanerConfig {

  private final String zfsCommand;
  private final DateTimeZone timeZone;
  private final List<PoolConfig> pools;

  /**
   * @throws com.typesafe.config.ConfigException if a required key is missing or a value has the wrong type
   * @throws IllegalArgumentException if the time zone is unknown
   */
  public static CleanerConfig fromConfig(Config config) {
    ImmutableList.Builder<PoolConfig> pools = ImmutableList.builder();
    for (Config pool : ConfigUtils.getConfigList(config, ConfigurationKeys.POOLS_KEY)) {
      pools.add(PoolConfig.fromConfig(pool));
    }
    DateTimeZone timeZone = ConfigUtils.hasNonEmptyPath(config, ConfigurationKeys.TIMEZONE_KEY)
        ? DateTimeZone.forID(config.getString(ConfigurationKeys.TIMEZONE_KEY))
        : DateTimeZone.getDefault();
    return new CleanerConfig(
        ConfigUtils.getString(config, ConfigurationKeys.ZFS_COMMAND_KEY, ConfigurationKeys.DEFAULT_ZFS_COMMAND),
        timeZone, pools.build());
  }
}
