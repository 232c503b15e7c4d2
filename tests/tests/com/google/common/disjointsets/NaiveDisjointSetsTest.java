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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link NaiveDisjointSets}. */
@RunWith(JUnit4.class)
public class NaiveDisjointSetsTest extends DisjointSetsTestCase {

  @Test
  public void testConstructorCreatesSingletons() {
    NaiveDisjointSets naive = new NaiveDisjointSets(3);
    assertEquals(3, naive.numGroups());
    assertEquals(ImmutableList.of(1), naive.group(1));
    assertEquals("[[0], [1], [2]]", naive.toString());
    assertEquals(0, new NaiveDisjointSets(0).numGroups());
    assertThrows(IllegalArgumentException.class, () -> new NaiveDisjointSets(-1));
  }

  @Test
  public void testUnionByIndex() {
    NaiveDisjointSets naive = new NaiveDisjointSets(4);

    // Equal sizes: the first group is appended to the second, and its slot removed.
    naive.unionByIndex(0, 1);
    assertEquals("[[1, 0], [2], [3]]", naive.toString());
    assertEquals(1, naive.numMoved());

    // The larger group absorbs the smaller one, and later positions shift down.
    naive.unionByIndex(0, 2);
    assertEquals("[[1, 0, 3], [2]]", naive.toString());
    assertEquals(2, naive.numMoved());

    naive.unionByIndex(1, 0);
    assertEquals("[[1, 0, 3, 2]]", naive.toString());
    assertEquals(3, naive.numMoved());
    assertEquals(partition(new int[] {0, 1, 2, 3}), naive.toSetOfSets());
  }

  @Test
  public void testUnionOfSamePositionIsNoOp() {
    NaiveDisjointSets naive = new NaiveDisjointSets(2);
    naive.unionByIndex(1, 1);
    assertEquals(2, naive.numGroups());
    assertEquals(0, naive.numMoved());
  }

  @Test
  public void testOutOfRangePositionFails() {
    NaiveDisjointSets naive = new NaiveDisjointSets(2);
    assertThrows(IndexOutOfBoundsException.class, () -> naive.unionByIndex(0, 2));
    naive.unionByIndex(0, 1);
    assertThrows(IndexOutOfBoundsException.class, () -> naive.unionByIndex(1, 0));
  }

  @Test
  public void testGroupsAreUnmodifiable() {
    NaiveDisjointSets naive = new NaiveDisjointSets(2);
    assertThrows(UnsupportedOperationException.class, () -> naive.group(0).add(5));
    for (List<Integer> group : naive) {
      assertThrows(UnsupportedOperationException.class, () -> group.add(5));
    }
  }
}
