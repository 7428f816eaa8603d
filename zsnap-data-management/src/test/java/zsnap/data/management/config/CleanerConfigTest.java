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

import org.joda.time.DateTimeZone;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import zsnap.configuration.ConfigurationKeys;


@Test(groups = { "zsnap.data.management.config" })
public class CleanerConfigTest {

  private static final String CONFIG = "zsnap {\n"
      + "  zfs.command = /usr/sbin/zfs\n"
      + "  timezone = Europe/Paris\n"
      + "  pools = [\n"
      + "    {\n"
      + "      name = tank\n"
      + "      maxCapacity = 0.9\n"
      + "      bestEffortPolicy = oldest\n"
      + "      datasets = [\n"
      + "        { name = \"tank/home\", retentionPolicy = \"7 days and 4 sundays\", maxRetention = none }\n"
      + "        { name = \"tank/logs\", maxFileAge = \"2 weeks\", maxCapacity = 0.5, mountPoint = /var/log }\n"
      + "      ]\n"
      + "    }\n"
      + "    { name = backup }\n"
      + "  ]\n"
      + "}\n";

  @Test
  public void testFromConfig() {
    CleanerConfig config = CleanerConfig.fromConfig(ConfigFactory.parseString(CONFIG));

    Assert.assertEquals(config.getZfsCommand(), "/usr/sbin/zfs");
    Assert.assertEquals(config.getTimeZone(), DateTimeZone.forID("Europe/Paris"));
    Assert.assertEquals(config.getPools().size(), 2);

    PoolConfig tank = config.getPools().get(0);
    Assert.assertEquals(tank.getName(), "tank");
    Assert.assertEquals(tank.getMaxCapacity(), 0.9, 1e-9);
    Assert.assertEquals(tank.getBestEffortPolicy(), "oldest");

    DatasetConfig home = tank.getDatasets().get(0);
    Assert.assertEquals(home.getRetentionPolicy().get(), "7 days and 4 sundays");
    Assert.assertEquals(home.getMaxRetention().get(), "none");
    Assert.assertFalse(home.getMaxFileAge().isPresent());

    DatasetConfig logs = tank.getDatasets().get(1);
    Assert.assertEquals(logs.getMaxFileAge().get(), "2 weeks");
    Assert.assertEquals(logs.getMaxCapacity().get(), 0.5, 1e-9);
    Assert.assertEquals(logs.getMountPoint().get(), "/var/log");
    Assert.assertFalse(logs.getRetentionPolicy().isPresent());
  }

  @Test
  public void testDefaults() {
    CleanerConfig config = CleanerConfig.fromConfig(ConfigFactory.parseString(CONFIG));
    PoolConfig backup = config.getPools().get(1);

    Assert.assertEquals(backup.getMaxCapacity(), ConfigurationKeys.DEFAULT_POOL_MAX_CAPACITY, 1e-9);
    Assert.assertEquals(backup.getBestEffortPolicy(), ConfigurationKeys.DEFAULT_BEST_EFFORT_POLICY);
    Assert.assertTrue(backup.getDatasets().isEmpty());

    CleanerConfig empty = CleanerConfig.fromConfig(ConfigFactory.empty());
    Assert.assertEquals(empty.getZfsCommand(), ConfigurationKeys.DEFAULT_ZFS_COMMAND);
    Assert.assertEquals(empty.getTimeZone(), DateTimeZone.getDefault());
    Assert.assertTrue(empty.getPools().isEmpty());
  }

  @Test(expectedExceptions = ConfigException.class)
  public void testPoolNameIsRequired() {
    CleanerConfig.fromConfig(ConfigFactory.parseString("zsnap.pools = [{ maxCapacity = 0.5 }]"));
  }

  @Test(expectedExceptions = ConfigException.WrongType.class)
  public void testInvalidNumber() {
    CleanerConfig.fromConfig(ConfigFactory.parseString("zsnap.pools = [{ name = tank, maxCapacity = full }]"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testUnknownTimeZone() {
    CleanerConfig.fromConfig(ConfigFactory.parseString("zsnap.timezone = Mars/Olympus"));
  }
}
