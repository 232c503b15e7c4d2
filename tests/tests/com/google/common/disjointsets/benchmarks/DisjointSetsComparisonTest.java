/*
 * Copyright 2024 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.common.disjointsets.benchmarks;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.disjointsets.TestDataGenerator;
import com.google.common.disjointsets.benchmarks.DisjointSetsComparison.Timing;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs {@link DisjointSetsComparison} on small sizes, as a unit test. */
@RunWith(JUnit4.class)
public final class DisjointSetsComparisonTest {

  @Test
  public void testRunSmallSizes() {
    ImmutableList<Timing> timings = DisjointSetsComparison.run(1, 4, new TestDataGenerator());
    assertEquals(4, timings.size());
    for (int i = 0; i < timings.size(); i++) {
      Timing timing = timings.get(i);
      assertEquals(2 << i, timing.size);
      assertTrue(timing.naiveNanos >= 0);
      assertTrue(timing.findNanos >= 0);
      assertTrue(timing.unionNanos >= 0);
      assertEquals(timing.findNanos + timing.unionNanos, timing.findAndUnionNanos());
    }
  }

  @Test
  public void testPrintOneRowPerSize() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, UTF_8);
    DisjointSetsComparison.print(out, DisjointSetsComparison.run(2, 3, new TestDataGenerator(7)));

    List<String> lines = Splitter.on('\n').omitEmptyStrings().trimResults()
        .splitToList(new String(bytes.toByteArray(), UTF_8));
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).endsWith("union + find"));
    assertTrue(lines.get(1).startsWith("4 "));
    assertTrue(lines.get(2).startsWith("8 "));
  }

  @Test
  public void testInvalidRangeFails() {
    TestDataGenerator data = new TestDataGenerator();
    assertThrows(IllegalArgumentException.class, () -> DisjointSetsComparison.run(3, 2, data));
    assertThrows(IllegalArgumentException.class, () -> DisjointSetsComparison.run(-1, 2, data));
    assertThrows(IllegalArgumentException.class, () -> DisjointSetsComparison.run(0, 31, data));
  }
}
