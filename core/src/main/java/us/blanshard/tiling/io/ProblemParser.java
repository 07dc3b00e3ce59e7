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
import us.blanshard.tiling.core.Inventory;
import us.blanshard.tiling.core.Landscape;
import us.blanshard.tiling.core.Problem;
import us.blanshard.tiling.core.Shape;
import us.blanshard.tiling.core.VisibilityTarget;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads problems in the plain text format:
 *
 * <pre>
 * # Comment lines and blank lines are skipped.
 * 1 0 2 3 ...          landscape rows: color numbers, 0 for no bush
 * ...
 * {FULL_BLOCK=2, OUTER_BOUNDARY=1, EL_SHAPE=3}
 * 1:4                  visibility targets, color:count
 * 2:7
 * </pre>
 *
 * Rows shorter than the longest are padded on the right with empty cells.
 * Tile names left out of the tile line get zero tiles.
 *
 * @author Luke Blanshard
 */
public final class ProblemParser {
  private static final Logger logger = Logger.getLogger(ProblemParser.class.getName());

  private static final Splitter CELL_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final Splitter TILE_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Splitter PAIR_SPLITTER = Splitter.on('=').trimResults();
  private static final Splitter TARGET_SPLITTER = Splitter.on(':').trimResults();

  private ProblemParser() {}

  public static Problem parse(String text) throws ProblemFormatException {
    try {
      return parse(new StringReader(text));
    } catch (IOException e) {
      throw new AssertionError(e);
    }
  }

  public static Problem parse(Reader reader) throws IOException, ProblemFormatException {
    List<String> lines = CharStreams.readLines(reader);
    int i = 0;

    List<int[]> rows = Lists.newArrayList();
    int width = 0;
    for (; i < lines.size(); ++i) {
      String line = lines.get(i).trim();
      if (isSkipped(line)) continue;
      if (line.startsWith("{")) break;
      int[] row = parseRow(i + 1, line);
      rows.add(row);
      width = Math.max(width, row.length);
    }
    if (rows.isEmpty())
      throw new ProblemFormatException("No landscape data found");

    Inventory inventory = Inventory.of(0, 0, 0);
    if (i < lines.size()) {
      inventory = parseTiles(i + 1, lines.get(i).trim());
      ++i;
    }

    Map<Color, Integer> targets = Maps.newTreeMap();
    for (; i < lines.size(); ++i) {
      String line = lines.get(i).trim();
      if (isSkipped(line) || line.indexOf(':') < 0) continue;
      parseTarget(i + 1, line, targets);
    }

    return new Problem(toLandscape(rows, width), inventory, VisibilityTarget.of(targets));
  }

  private static boolean isSkipped(String line) {
    return line.isEmpty() || line.startsWith("#");
  }

  private static int[] parseRow(int lineNumber, String line) throws ProblemFormatException {
    List<String> cells = CELL_SPLITTER.splitToList(line);
    int[] row = new int[cells.size()];
    for (int c = 0; c < row.length; ++c) {
      int value = parseInt(lineNumber, cells.get(c), line, "Invalid landscape data");
      if (value != 0 && !Color.isColor(value))
        throw ProblemFormatException.atLine(lineNumber, "Invalid bush color " + value, line);
      row[c] = value;
    }
    return row;
  }

  private static Inventory parseTiles(int lineNumber, String line) throws ProblemFormatException {
    if (!line.endsWith("}"))
      throw ProblemFormatException.atLine(lineNumber, "Invalid tile count format", line);
    Map<Shape, Integer> counts = Maps.newEnumMap(Shape.class);
    for (String item : TILE_SPLITTER.split(line.substring(1, line.length() - 1))) {
      List<String> pair = PAIR_SPLITTER.splitToList(item);
      if (pair.size() != 2)
        throw ProblemFormatException.atLine(lineNumber, "Invalid tile count format", line);
      Shape shape;
      try {
        shape = Shape.valueOf(pair.get(0));
      } catch (IllegalArgumentException e) {
        throw ProblemFormatException.atLine(lineNumber, "Unknown tile " + pair.get(0), line);
      }
      int count = parseInt(lineNumber, pair.get(1), line, "Invalid tile count format");
      if (count < 0)
        throw ProblemFormatException.atLine(lineNumber, "Negative tile count", line);
      counts.put(shape, count);
    }
    return Inventory.of(counts);
  }

  private static void parseTarget(int lineNumber, String line, Map<Color, Integer> targets)
      throws ProblemFormatException {
    List<String> pair = TARGET_SPLITTER.splitToList(line);
    if (pair.size() != 2)
      throw ProblemFormatException.atLine(lineNumber, "Invalid visibility format", line);
    int color = parseInt(lineNumber, pair.get(0), line, "Invalid visibility format");
    int count = parseInt(lineNumber, pair.get(1), line, "Invalid visibility format");
    if (!Color.isColor(color))
      throw ProblemFormatException.atLine(lineNumber, "Invalid target color " + color, line);
    if (count < 0)
      throw ProblemFormatException.atLine(lineNumber, "Negative target", line);
    targets.put(Color.of(color), count);
  }

  private static int parseInt(int lineNumber, String s, String line, String message)
      throws ProblemFormatException {
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      throw ProblemFormatException.atLine(lineNumber, message, line);
    }
  }

  private static Landscape toLandscape(List<int[]> rows, int width) {
    Landscape.Builder builder = Landscape.builder(rows.size(), width);
    boolean ragged = false;
    for (int r = 0; r < rows.size(); ++r) {
      int[] row = rows.get(r);
      if (row.length < width) ragged = true;
      for (int c = 0; c < row.length; ++c)
        builder.set(r, c, Color.color(row[c]));
    }
    if (ragged)
      logger.warning("Landscape rows have differing lengths; padded to width " + width);
    return builder.build();
  }
}
