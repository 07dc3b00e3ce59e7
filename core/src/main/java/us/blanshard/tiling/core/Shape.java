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

/**
 * The three kinds of tile in an {@link Inventory}.  Orientation is not part of
 * the shape: every EL tile counts against the same stock.
 *
 * @author Luke Blanshard
 */
public enum Shape {
  FULL_BLOCK("Full Block"),
  OUTER_BOUNDARY("Outer Boundary"),
  EL_SHAPE("El Shape");

  /** The number of shapes. */
  public static final int COUNT = 3;

  private final String displayName;

  private Shape(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
