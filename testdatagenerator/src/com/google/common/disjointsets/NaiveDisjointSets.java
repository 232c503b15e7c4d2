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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A deliberately simple partition of the elements {@code 0..n-1}, kept as an explicit list of
 * groups. Groups are addressed by their position in that list, which changes as groups are merged.
 * Merging moves every element of the smaller group, so a full sequence of merges costs O(n log n).
 *
 * <p>Used as the reference against which {@link DisjointSets} is tested and benchmarked.
 *
 * <p>WARNING: This API is not stable and not intended for use outside of tests and benchmarks.
 */
public class NaiveDisjointSets implements Iterable<List<Integer>> {
  private final List<List<Integer>> groups;
  /** The total number of elements moved from one group to another so far. */
  private long numMoved = 0;

  /** Creates {@code n} groups, where group {@code i} contains only element {@code i}. */
  public NaiveDisjointSets(int n) {
    Preconditions.checkArgument(n >= 0, "Negative number of elements: %s", n);
    groups = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      List<Integer> group = new ArrayList<>();
      group.add(i);
      groups.add(group);
    }
  }

  /**
   * Merges the groups at positions {@code i1} and {@code i2}. The elements of the smaller group are
   * appended to the larger one, and the emptied position is removed, shifting all later groups down
   * by one. When both groups have the same size, the group at {@code i1} is the one emptied. Does
   * nothing if {@code i1 == i2}.
   */
  public void unionByIndex(int i1, int i2) {
    Preconditions.checkElementIndex(i1, groups.size());
    Preconditions.checkElementIndex(i2, groups.size());
    if (i1 == i2) {
      return;
    }

    List<Integer> group1 = groups.get(i1);
    List<Integer> group2 = groups.get(i2);
    if (group1.size() > group2.size()) {
      group1.addAll(group2);
      numMoved += group2.size();
      groups.remove(i2);
    } else {
      group2.addAll(group1);
      numMoved += group1.size();
      groups.remove(i1);
    }
  }

  /** Returns the number of groups. */
  public int numGroups() {
    return groups.size();
  }

  /** Returns an unmodifiable view of the elements of the group at position {@code i}. */
  public List<Integer> group(int i) {
    return Collections.unmodifiableList(groups.get(i));
  }

  /** Returns the total number of elements moved between groups by all merges so far. */
  public long numMoved() {
    return numMoved;
  }

  /** Returns the partition as a set of sets of elements, ignoring all ordering. */
  public ImmutableSet<ImmutableSet<Integer>> toSetOfSets() {
    return toSetOfSets(this);
  }

  /** Returns the given groups as a set of sets of elements, ignoring all ordering. */
  public static ImmutableSet<ImmutableSet<Integer>> toSetOfSets(
      Iterable<? extends Iterable<Integer>> groups) {
    ImmutableSet.Builder<ImmutableSet<Integer>> result = ImmutableSet.builder();
    for (Iterable<Integer> group : groups) {
      result.add(ImmutableSet.copyOf(group));
    }
    return result.build();
  }

  @Override
  public Iterator<List<Integer>> iterator() {
    Iterable<List<Integer>> views = Iterables.transform(groups, Collections::unmodifiableList);
    return views.iterator();
  }

  @Override
  public String toString() {
    return ImmutableList.copyOf(groups).toString();
  }
}
