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
package us.blanshard.tiling.stats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.base.Splitter;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class SolveStatsTest {

  @Test public void printsRowPerProblem() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    SolveStats.generate(2, 17, new int[][] {{1, 1}, {1, 2}}, new PrintStream(bytes, true, "UTF-8"));

    List<String> lines = Splitter.on('\n').omitEmptyStrings().splitToList(
        new String(bytes.toByteArray(), StandardCharsets.UTF_8));
    assertEquals(5, lines.size());
    assertEquals("Size\tSeed\tState\tNodes\tBacktracks\tMicros", lines.get(0));
    for (String line : lines.subList(1, lines.size())) {
      List<String> fields = Splitter.on('\t').splitToList(line);
      assertEquals(line, 6, fields.size());
      assertEquals(line, "SUCCESS", fields.get(2));
      assertTrue(line, fields.get(1).startsWith("0x"));
    }
    assertTrue(lines.get(1).startsWith("1x1\t"));
    assertTrue(lines.get(2).startsWith("1x2\t"));
  }

  @Test public void warmUpPrintsNothing() {
    SolveStats.generate(1, 0, new int[][] {{2, 2}}, null);
  }
}
