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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import zsnap.util.ClassAliasResolver;


/**
 * Creates {@link EvictionPolicy}s from the bestEffortPolicy setting of a pool. The value is an alias
 * (<code>oldest</code>, <code>morerem</code>, <code>biggest</code>, <code>more</code>) or a fully qualified class name.
 */
public class EvictionPolicyFactory {

  private static final Map<String, String> SYNONYMS = ImmutableMap.of("more-removable", "morerem");

  private final ClassAliasResolver<EvictionPolicy> resolver;

  public EvictionPolicyFactory() {
    this(new ClassAliasResolver<>(EvictionPolicy.class));
  }

  public EvictionPolicyFactory(ClassAliasResolver<EvictionPolicy> resolver) {
    this.resolver = resolver;
  }

  /**
   * @throws IllegalArgumentException if <code>name</code> does not resolve to an {@link EvictionPolicy}
   */
  public EvictionPolicy create(String name) {
    String alias = SYNONYMS.containsKey(name) ? SYNONYMS.get(name) : name;
    try {
      return this.resolver.resolveClass(alias).getDeclaredConstructor().newInstance();
    } catch (ClassNotFoundException cnfe) {
      throw new IllegalArgumentException(String.format("Unknown bestEffortPolicy '%s', expected one of %s", name,
          this.resolver.getAliases()), cnfe);
    } catch (ReflectiveOperationException roe) {
      throw new IllegalArgumentException(String.format("Cannot instantiate bestEffortPolicy '%s'", name), roe);
    }
  }
}
