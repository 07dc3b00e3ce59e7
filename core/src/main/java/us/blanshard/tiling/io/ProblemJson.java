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
package us.blanshard.tiling.io;

import us.blanshard.tiling.core.Color;
import us.blanshard.tiling.core.Footprint;
import us.blanshard.tiling.core.Inventory;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.Solution;
import us.blanshard.tiling.core.Tile;
import us.blanshard.tiling.core.VisibilityTarget;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Static methods that convert problems and solutions to and from json.
 *
 * <p> A problem looks like
 * {@code {"landscape":[[1,0,...],...],"tiles":{"FULL_BLOCK":1,...},"targets":{"1":4}}},
 * and a solution like
 * {@code {"landscape":[...],"placements":[{"row":0,"column":1,"tile":"EL_TOP_LEFT"},...]}}.
 *
 * @author Luke Blanshard
 */
public class ProblemJson {

  /** A convenience for reading/writing problems and solutions. */
  public static final Gson GSON = registerAll(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that problems and
   * solutions can be serialized and deserialized.
   */
  public static GsonBuilder registerAll(GsonBuilder builder) {
    final TypeAdapter<Landscape> landscapeAdapter = new TypeAdapter<Landscape>() {
      @Override public void write(JsonWriter out, Landscape value) throws IOException {
        out.beginArray();
        for (int r = 0; r < value.getHeight(); ++r) {
          out.beginArray();
          for (int c = 0; c < value.getWidth(); ++c)
            out.value(Color.number(value.get(r, c)));
          out.endArray();
        }
        out.endArray();
      }
      @Override public Landscape read(JsonReader in) throws IOException {
        List<int[]> rows = Lists.newArrayList();
        in.beginArray();
        while (in.hasNext()) {
          List<Integer> row = Lists.newArrayList();
          in.beginArray();
          while (in.hasNext())
            row.add(in.nextInt());
          in.endArray();
          int[] array = new int[row.size()];
          for (int i = 0; i < array.length; ++i)
            array[i] = row.get(i);
          rows.add(array);
        }
        in.endArray();
        try {
          return Landscape.fromRows(rows.toArray(new int[rows.size()][]));
        } catch (IllegalArgumentException e) {
          throw new JsonParseException("Bad landscape: " + e.getMessage(), e);
        }
      }
    };
    builder.registerTypeAdapter(Landscape.class, landscapeAdapter);

    builder.registerTypeAdapter(Problem.class, new TypeAdapter<Problem>() {
      @Override public void write(JsonWriter out, Problem value) throws IOException {
        out.beginObject();
        out.name("landscape");
        landscapeAdapter.write(out, value.landscape);
        out.name("tiles").beginObject();
        for (Shape shape : Shape.values())
          out.name(shape.name()).value(value.inventory.count(shape));
        out.endObject();
        out.name("targets").beginObject();
        for (Map.Entry<Color, Integer> e : value.target.asMap().entrySet())
          out.name(e.getKey().toString()).value(e.getValue());
        out.endObject();
        out.endObject();
      }
      @Override public Problem read(JsonReader in) throws IOException {
        Landscape landscape = null;
        Map<Shape, Integer> tiles = Maps.newEnumMap(Shape.class);
        Map<Color, Integer> targets = Maps.newTreeMap();
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("landscape")) {
            landscape = landscapeAdapter.read(in);
          } else if (name.equals("tiles")) {
            in.beginObject();
            while (in.hasNext()) {
              String shape = in.nextName();
              try {
                tiles.put(Shape.valueOf(shape), in.nextInt());
              } catch (IllegalArgumentException e) {
                throw new JsonParseException("Unknown tile " + shape, e);
              }
            }
            in.endObject();
          } else if (name.equals("targets")) {
            in.beginObject();
            while (in.hasNext()) {
              String color = in.nextName();
              try {
                targets.put(Color.of(Integer.parseInt(color)), in.nextInt());
              } catch (RuntimeException e) {
                throw new JsonParseException("Bad target color " + color, e);
              }
            }
            in.endObject();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        if (landscape == null) throw new JsonParseException("No landscape");
        try {
          return new Problem(landscape, Inventory.of(tiles), VisibilityTarget.of(targets));
        } catch (IllegalArgumentException e) {
          throw new JsonParseException(e.getMessage(), e);
        }
      }
    });

    builder.registerTypeAdapter(Solution.class, new TypeAdapter<Solution>() {
      @Override public void write(JsonWriter out, Solution value) throws IOException {
        out.beginObject();
        out.name("landscape");
        landscapeAdapter.write(out, value.landscape);
        out.name("placements").beginArray();
        for (Map.Entry<Footprint, Tile> e : value.getPlacements().entrySet()) {
          out.beginObject();
          out.name("row").value(e.getKey().row);
          out.name("column").value(e.getKey().column);
          out.name("tile").value(e.getValue().name());
          out.endObject();
        }
        out.endArray();
        out.endObject();
      }
      @Override public Solution read(JsonReader in) throws IOException {
        Landscape landscape = null;
        Map<Footprint, Tile> placements = Maps.newHashMap();
        in.beginObject();
        while (in.hasNext()) {
          String name = in.nextName();
          if (name.equals("landscape")) {
            landscape = landscapeAdapter.read(in);
          } else if (name.equals("placements")) {
            in.beginArray();
            while (in.hasNext())
              readPlacement(in, placements);
            in.endArray();
          } else {
            in.skipValue();
          }
        }
        in.endObject();
        if (landscape == null) throw new JsonParseException("No landscape");
        try {
          return new Solution(landscape, placements);
        } catch (IllegalArgumentException e) {
          throw new JsonParseException(e.getMessage(), e);
        }
      }
    });
    return builder;
  }

  private static void readPlacement(JsonReader in, Map<Footprint, Tile> placements)
      throws IOException {
    int row = -1, column = -1;
    Tile tile = null;
    in.beginObject();
    while (in.hasNext()) {
      String name = in.nextName();
      if (name.equals("row")) {
        row = in.nextInt();
      } else if (name.equals("column")) {
        column = in.nextInt();
      } else if (name.equals("tile")) {
        String tileName = in.nextString();
        try {
          tile = Tile.valueOf(tileName);
        } catch (IllegalArgumentException e) {
          throw new JsonParseException("Unknown tile " + tileName, e);
        }
      } else {
        in.skipValue();
      }
    }
    in.endObject();
    if (row < 0 || column < 0 || tile == null)
      throw new JsonParseException("Incomplete placement");
    placements.put(Footprint.of(row, column), tile);
  }

  public static String toJson(Problem problem) {
    return GSON.toJson(problem);
  }

  public static String toJson(Solution solution) {
    return GSON.toJson(solution);
  }

  public static Problem problemFromJson(String json) throws ProblemFormatException {
    try {
      Problem problem = GSON.fromJson(json, Problem.class);
      if (problem == null) throw new ProblemFormatException("Empty problem json");
      return problem;
    } catch (JsonParseException e) {
      throw new ProblemFormatException("Invalid problem json: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      throw new ProblemFormatException("Invalid problem json: " + e.getMessage(), e);
    } catch (NumberFormatException e) {
      // JsonReader.nextInt rejects fractions and overflow this way.
      throw new ProblemFormatException("Invalid problem json: " + e.getMessage(), e);
    }
  }

  public static Solution solutionFromJson(String json) throws ProblemFormatException {
    try {
      Solution solution = GSON.fromJson(json, Solution.class);
      if (solution == null) throw new ProblemFormatException("Empty solution json");
      return solution;
    } catch (JsonParseException e) {
      throw new ProblemFormatException("Invalid solution json: " + e.getMessage(), e);
    } catch (IllegalStateException e) {
      throw new ProblemFormatException("Invalid solution json: " + e.getMessage(), e);
    } catch (NumberFormatException e) {
      // JsonReader.nextInt rejects fractions and overflow this way.
      throw new ProblemFormatException("Invalid solution json: " + e.getMessage(), e);
    }
  }
}
