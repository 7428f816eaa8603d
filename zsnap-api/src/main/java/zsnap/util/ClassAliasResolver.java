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

import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import org.reflections.Reflections;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import zsnap.annotation.Alias;


/**
 * Maps the {@link Alias} of every <code>zsnap</code> class implementing a plug-in interface to that class, so that a
 * setting can name an implementation by its alias, in any case, or by its class name.
 *
 * <p>
 *   An alias claimed by two classes keeps the first class found; the other one is reported and ignored.
 * </p>
 */
@Slf4j
public class ClassAliasResolver<T> {

  private static final String SCANNED_PACKAGE = "zsnap";

  private final Class<T> pluginType;
  private final Map<String, Class<? extends T>> classesByAlias;

  public ClassAliasResolver(Class<T> pluginType) {
    this.pluginType = pluginType;
    Map<String, Class<? extends T>> found = Maps.newTreeMap(String.CASE_INSENSITIVE_ORDER);
    for (Class<? extends T> candidate : new Reflections(SCANNED_PACKAGE).getSubTypesOf(pluginType)) {
      Alias alias = candidate.getAnnotation(Alias.class);
      if (alias == null) {
        continue;
      }
      Class<? extends T> previous = found.get(alias.value());
      if (previous != null) {
        log.warn(String.format("Alias %s of %s is already taken by %s, ignoring it", alias.value(),
            candidate.getName(), previous.getName()));
      } else {
        found.put(alias.value(), candidate);
      }
    }
    this.classesByAlias = ImmutableSortedMap.copyOf(found, String.CASE_INSENSITIVE_ORDER);
    log.debug(String.format("Aliases of %s: %s", pluginType.getSimpleName(), this.classesByAlias.keySet()));
  }

  /**
   * The class registered under <code>aliasOrClassName</code>, compared without case, or else the class of that name.
   *
   * @throws ClassNotFoundException if neither exists or the named class does not implement the plug-in type
   */
  public Class<? extends T> resolveClass(String aliasOrClassName) throws ClassNotFoundException {
    Class<? extends T> aliased = this.classesByAlias.get(aliasOrClassName);
    if (aliased != null) {
      return aliased;
    }
    Class<?> named = Class.forName(aliasOrClassName);
    if (!this.pluginType.isAssignableFrom(named)) {
      throw new ClassNotFoundException(String.format("%s is not a %s", aliasOrClassName, this.pluginType.getName()));
    }
    return named.asSubclass(this.pluginType);
  }

  /**
   * Known aliases, sorted without case.
   */
  public Set<String> getAliases() {
    return this.classesByAlias.keySet();
  }
}
