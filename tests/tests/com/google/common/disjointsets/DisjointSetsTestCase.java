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
package com.google.common.disjointsets;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Before;

/** Common code for disjoint set tests. */
public abstract class DisjointSetsTestCase {
  /**
   * The TestDataGenerator contains the Random used in unit tests as well as utility methods for
   * producing test data.
   */
  protected TestDataGenerator data;

  /**
   * Initializes the TestDataGenerator, and in particular, the random number generator it contains.
   */
  @Before
  public final void setUp() {
    data = new TestDataGenerator();
  }

  /** Returns the given groups of elements as a set of sets, ignoring all ordering. */
  public static ImmutableSet<ImmutableSet<Integer>> partition(int[]... groups) {
    ImmutableSet.Builder<ImmutableSet<Integer>> result = ImmutableSet.builder();
    for (int[] group : groups) {
      result.add(ImmutableSet.copyOf(Ints.asList(group)));
    }
    return result.build();
  }

  /** Returns the current groups of 'sets' as a set of sets, ignoring all ordering. */
  public static ImmutableSet<ImmutableSet<Integer>> partitionOf(DisjointSets sets) {
    return NaiveDisjointSets.toSetOfSets(sets.values());
  }

  /**
   * Asserts that the groups of 'sets' contain every element exactly once, that their number is
   * numGroups(), and that the internal state is valid.
   */
  public static void assertIsPartition(DisjointSets sets) {
    List<Integer> all = new ArrayList<>();
    for (List<Integer> group : sets.values()) {
      assertTrue("Empty group in " + sets, !group.isEmpty());
      all.addAll(group);
    }
    Collections.sort(all);
    assertEquals(sets.numElements(), all.size());
    for (int i = 0; i < all.size(); i++) {
      assertEquals("Element missing or repeated in " + sets, i, (int) all.get(i));
    }
    assertEquals(sets.numGroups(), sets.keys().size());
    assertTrue(sets.isValid());
  }
}
