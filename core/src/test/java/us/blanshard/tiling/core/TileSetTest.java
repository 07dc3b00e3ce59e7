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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static us.blanshard.tiling.core.Tile.EL_TOP_LEFT;
import static us.blanshard.tiling.core.Tile.FULL_BLOCK;
import static us.blanshard.tiling.core.Tile.NO_TILE;
import static us.blanshard.tiling.core.Tile.OUTER_BOUNDARY;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Arrays;
import java.util.Iterator;
import java.util.Set;

public class TileSetTest {

  @Test public void of() {
    assertEquals(0, TileSet.of().bits);
    assertEquals(FULL_BLOCK.bit | NO_TILE.bit, TileSet.of(FULL_BLOCK, NO_TILE).bits);
    assertSame(TileSet.of(FULL_BLOCK), FULL_BLOCK.asSet());
    assertEquals(Tile.COUNT, TileSet.ofBits(TileSet.ALL_BITS).size());
  }

  @Test public void copyOf() {
    assertSame(TileSet.of(FULL_BLOCK, EL_TOP_LEFT),
               TileSet.copyOf(Arrays.asList(EL_TOP_LEFT, FULL_BLOCK, EL_TOP_LEFT)));
    assertEquals(4, TileSet.copyOf(Tile.ofShape(Shape.EL_SHAPE)).size());
  }

  @Test public void contains() {
    TileSet set = TileSet.of(NO_TILE, EL_TOP_LEFT);
    assertTrue(set.contains(EL_TOP_LEFT));
    assertFalse(set.contains(FULL_BLOCK));
    assertFalse(set.contains((Object) "EL_TOP_LEFT"));
  }

  @Test public void iterationOrder() {
    TileSet set = TileSet.of(EL_TOP_LEFT, NO_TILE, OUTER_BOUNDARY);
    Iterator<Tile> it = set.iterator();
    assertSame(NO_TILE, it.next());
    assertSame(OUTER_BOUNDARY, it.next());
    assertSame(EL_TOP_LEFT, it.next());
    assertFalse(it.hasNext());
  }

  @Test public void equals() {
    Set<Tile> hashSet = Sets.newHashSet(FULL_BLOCK, OUTER_BOUNDARY);
    TileSet set = TileSet.of(FULL_BLOCK, OUTER_BOUNDARY);
    assertEquals(set, hashSet);
    assertEquals(hashSet, set);
    assertEquals(hashSet.hashCode(), set.hashCode());
  }
}
