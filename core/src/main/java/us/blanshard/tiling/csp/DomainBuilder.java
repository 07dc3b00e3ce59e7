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

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.InvalidProblemException;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Tile;

import com.google.common.collect.ImmutableList;

import java.util.logging.Logger;

/**
 * Turns a {@link Problem} into a {@link Model}: one variable per footprint,
 * with a domain holding {@link Tile#NO_TILE} plus every tile whose shape is
 * in stock.  Where the bushes are doesn't limit where tiles can go; it only
 * decides what each placement contributes to the visible counts.
 *
 * @author Luke Blanshard
 */
public final class DomainBuilder {
  private static final Logger logger = Logger.getLogger(DomainBuilder.class.getName());

  private DomainBuilder() {}

  public static Model build(Problem problem) throws InvalidProblemException {
    Landscape landscape = problem.landscape;
    if (!landscape.isTileable()) {
      throw new InvalidProblemException(String.format(
          "Landscape is %d x %d; both dimensions must be multiples of %d",
          landscape.getHeight(), landscape.getWidth(), Tile.SIZE));
    }

    int legal = Tile.NO_TILE.bit;
    for (Shape shape : Shape.values()) {
      if (problem.inventory.count(shape) > 0)
        for (Tile tile : Tile.ofShape(shape))
          legal |= tile.bit;
    }

    ImmutableList<Footprint> footprints = Footprint.all(landscape);
    int[] domains = new int[footprints.size()];
    int[] visible = new int[footprints.size() * Tile.COUNT * Color.COUNT];
    for (int var = 0; var < footprints.size(); ++var) {
      domains[var] = legal;
      Footprint footprint = footprints.get(var);
      for (Tile tile : Tile.ALL)
        for (Color color : Color.ALL)
          visible[Model.index(var, tile.ordinal(), color.index)] =
              footprint.visible(landscape, tile, color);
    }

    logger.fine("Built " + footprints.size() + " variables for a "
        + landscape.getHeight() + " x " + landscape.getWidth() + " landscape");
    return new Model(problem, footprints, domains, visible);
  }
}
