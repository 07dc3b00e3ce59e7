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
package us.blanshard.tiling.csp;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

import javax.annotation.concurrent.Immutable;

/**
 * Caller-imposed bounds on a search.  A search that would go past them stops
 * with {@link Solver.State#ABORTED}.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class SearchLimits {

  /** No limits at all. */
  public static final SearchLimits NONE = new SearchLimits(Long.MAX_VALUE, Integer.MAX_VALUE);

  /** The most tentative assignments the search may make. */
  public final long maxNodes;

  /** The most variables that may be assigned at once. */
  public final int maxDepth;

  private SearchLimits(long maxNodes, int maxDepth) {
    checkArgument(maxNodes >= 0, "Negative node limit %s", maxNodes);
    checkArgument(maxDepth >= 0, "Negative depth limit %s", maxDepth);
    this.maxNodes = maxNodes;
    this.maxDepth = maxDepth;
  }

  public static SearchLimits maxNodes(long maxNodes) {
    return new SearchLimits(maxNodes, Integer.MAX_VALUE);
  }

  public SearchLimits withMaxNodes(long maxNodes) {
    return new SearchLimits(maxNodes, maxDepth);
  }

  public SearchLimits withMaxDepth(int maxDepth) {
    return new SearchLimits(maxNodes, maxDepth);
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxNodes", maxNodes)
        .add("maxDepth", maxDepth)
        .toString();
  }
}
