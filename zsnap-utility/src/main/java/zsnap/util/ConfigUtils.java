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

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Optional;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;


/**
 * Utility class for dealing with {@link Config} objects.
 */
public class ConfigUtils {

  /**
   * Return string value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   *
   * @param config in which the path may be present
   * @param path key to look for in the config object
   * @return string value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   */
  public static String getString(Config config, String path, String def) {
    if (config.hasPath(path)) {
      return config.getString(path);
    }
    return def;
  }

  /**
   * Return double value at <code>path</code> if <code>config</code> has path. If not return <code>def</code>
   */
  public static double getDouble(Config config, String path, double def) {
    if (config.hasPath(path)) {
      return config.getDouble(path);
    }
    return def;
  }

  /**
   * Return the string value at <code>path</code>, or {@link Optional#absent()} if <code>config</code> does not have
   * the path. An explicitly configured empty string is returned as is.
   */
  public static Optional<String> getOptionalString(Config config, String path) {
    if (config.hasPath(path)) {
      return Optional.of(config.getString(path));
    }
    return Optional.absent();
  }

  /**
   * Return the double value at <code>path</code>, or {@link Optional#absent()} if <code>config</code> does not have
   * the path.
   *
   * @throws ConfigException.WrongType if the value is not a number
   */
  public static Optional<Double> getOptionalDouble(Config config, String path) {
    if (config.hasPath(path)) {
      return Optional.of(config.getDouble(path));
    }
    return Optional.absent();
  }

  /**
   * Return the list of objects at <code>path</code>, or an empty list if <code>config</code> does not have the path.
   */
  public static List<? extends Config> getConfigList(Config config, String path) {
    if (config.hasPath(path)) {
      return config.getConfigList(path);
    }
    return Collections.emptyList();
  }

  /**
   * Check if the given <code>key</code> exists in <code>config</code> and it is not null or empty.
   * Uses {@link StringUtils#isNotBlank(CharSequence)}
   */
  public static boolean hasNonEmptyPath(Config config, String key) {
    return config.hasPath(key) && StringUtils.isNotBlank(config.getString(key));
  }
}
