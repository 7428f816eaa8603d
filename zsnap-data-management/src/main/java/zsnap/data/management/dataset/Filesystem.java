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

package zsnap.data.management.dataset;

import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.common.base.Optional;

import lombok.Getter;


/**
 * A mounted dataset. Besides snapshot retention it carries the file pruning settings.
 */
public class Filesystem extends Dataset {

  @Getter
  private Optional<Integer> maxFileAge = Optional.absent();
  @Getter
  private Optional<Double> maxCapacity = Optional.absent();
  private Optional<String> mountPoint = Optional.absent();

  public Filesystem(String name, Pool pool, Dataset parent) {
    super(name, pool, parent);
  }

  /**
   * @param maxFileAge in days
   */
  public void setMaxFileAge(int maxFileAge) {
    this.maxFileAge = Optional.of(maxFileAge);
  }

  public void setMaxCapacity(double maxCapacity) {
    this.maxCapacity = Optional.of(maxCapacity);
  }

  public void setMountPoint(String mountPoint) {
    this.mountPoint = Optional.of(mountPoint);
  }

  /**
   * Configured mount point, <code>/&lt;name&gt;</code> otherwise. Not inherited.
   */
  public Path getMountPoint() {
    return Paths.get(this.mountPoint.or("/" + getName()));
  }

  public Optional<Integer> getEffectiveMaxFileAge() {
    for (Optional<Dataset> dataset = Optional.<Dataset>of(this); dataset.isPresent();
        dataset = dataset.get().getParent()) {
      if (dataset.get() instanceof Filesystem && ((Filesystem) dataset.get()).maxFileAge.isPresent()) {
        return ((Filesystem) dataset.get()).maxFileAge;
      }
    }
    return Optional.absent();
  }

  public Optional<Double> getEffectiveMaxCapacity() {
    for (Optional<Dataset> dataset = Optional.<Dataset>of(this); dataset.isPresent();
        dataset = dataset.get().getParent()) {
      if (dataset.get() instanceof Filesystem && ((Filesystem) dataset.get()).maxCapacity.isPresent()) {
        return ((Filesystem) dataset.get()).maxCapacity;
      }
    }
    return Optional.absent();
  }
}
