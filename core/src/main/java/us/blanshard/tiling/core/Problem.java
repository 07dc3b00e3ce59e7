/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.tiling.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A tile placement problem: the landscape, the tiles available, and the
 * number of bushes of each color that must be left showing.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Problem {
  public final Landscape landscape;
  public final Inventory inventory;
  public final VisibilityTarget target;

  public Problem(Landscape landscape, Inventory inventory, VisibilityTarget target) {
    this.landscape = checkNotNull(landscape);
    this.inventory = checkNotNull(inventory);
    this.target = checkNotNull(target);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Problem)) return false;
    Problem that = (Problem) o;
    return this.landscape.equals(that.landscape)
        && this.inventory.equals(that.inventory)
        && this.target.equals(that.target);
  }

  @Override public int hashCode() {
    return Objects.hashCode(landscape, inventory, target);
  }

  @Override public String toString() {
    return landscape + "tiles " + inventory + ", targets " + target;
  }
}
