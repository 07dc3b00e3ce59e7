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

import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A bush color, numbered from one to four.  Landscape cells without a bush
 * have no color; the number zero stands for that in the input formats.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Color implements Comparable<Color> {
  /** The number of colors. */
  public static final int COUNT = 4;

  /** The number, in the range 1..4. */
  public final int number;

  /** The index, one less than the number. */
  public final int index;

  public static Color of(int number) {
    checkElementIndex(number - 1, COUNT, "color number");
    return instances[number - 1];
  }

  public static Color ofIndex(int index) {
    return instances[index];
  }

  /** Tells whether the given number is a valid color number. */
  public static boolean isColor(int number) {
    return number >= 1 && number <= COUNT;
  }

  /** Converts 0 to null, 1-4 to the corresponding color. */
  @Nullable public static Color color(int number) {
    return number == 0 ? null : of(number);
  }

  /** Converts null to 0, non-null to the corresponding number. */
  public static int number(@Nullable Color color) {
    return color == null ? 0 : color.number;
  }

  /** All the colors. */
  public static final List<Color> ALL;

  @Override public int compareTo(Color that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return Integer.toString(number);
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return number;
  }

  private Color(int index) {
    this.index = index;
    this.number = index + 1;
  }

  private static final Color[] instances;
  static {
    instances = new Color[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Color(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
