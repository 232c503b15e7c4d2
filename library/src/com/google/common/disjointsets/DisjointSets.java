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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A disjoint set (AKA union-find set, AKA merge-find set) over the fixed universe of elements
 * {@code 0..n-1}. It stores a partition of the universe into disjoint groups, and allows us to
 * efficiently merge groups and find the representative member, or root, of a group.
 *
 * <p>Elements are dense int ids. The tree of each group is stored in two parallel arrays indexed
 * by id: the parent of each element, and for roots, the number of elements in the group. A root is
 * its own parent.
 *
 * <p>This implementation uses both path compression and union-by-size. Union-by-size alone bounds
 * the height of every tree by log2(n), so {@link #find}, {@link #union} and {@link #unionRoots} are
 * guaranteed O(log n). With path compression as well, a sequence of operations has O(a(n))
 * amortized cost per operation, where a(n) is the inverse Ackermann function, which is less than 5
 * for any n that we'll ever care about.
 *
 * <p>Note that {@link #find} mutates the structure, even though it never changes which elements
 * are in which group. {@link #findRoot} is the non-mutating equivalent.
 *
 * <p>This class is not thread-safe. Callers that share an instance between threads must serialize
 * all access to it, including calls to {@link #find}.
 */
public final class DisjointSets {
  private static final Logger log = Platform.getLoggerForClass(DisjointSets.class);

  /** The index of the parent of each element. Roots are their own parent. */
  private final int[] parents;
  /** For roots, the number of elements that have this element as their root. */
  private final int[] sizes;
  /** The number of distinct roots. */
  private int numGroups;

  /**
   * Creates a new disjoint set of {@code n} elements, each of which is initially in its own group.
   *
   * @throws IllegalArgumentException if n is negative
   */
  public DisjointSets(int n) {
    Preconditions.checkArgument(n >= 0, "Negative number of elements: %s", n);
    parents = new int[n];
    sizes = new int[n];
    clear();
  }

  /** Puts every element back into its own group, so that numGroups() == numElements(). */
  public void clear() {
    for (int i = 0; i < parents.length; i++) {
      parents[i] = i;
      sizes[i] = 1;
    }
    numGroups = parents.length;
  }

  /** Returns the number of elements, which is fixed at construction. */
  public int numElements() {
    return parents.length;
  }

  /** Returns the current number of disjoint groups. */
  public int numGroups() {
    return numGroups;
  }

  /** Returns true if element {@code i} is the root of its group. */
  public boolean isRoot(int i) {
    checkElement(i);
    return parents[i] == i;
  }

  /**
   * Returns the root of the group containing element {@code i}, without modifying the structure.
   * The cost is proportional to the depth of i in its tree.
   */
  public int findRoot(int i) {
    checkElement(i);
    int root = i;
    while (root != parents[root]) {
      root = parents[root];
    }
    return root;
  }

  /**
   * Returns the root of the group containing element {@code i}. Every element on the path from i
   * to the root is then made a direct child of the root, so later lookups of these elements are
   * faster. Group membership and group sizes are not changed.
   */
  public int find(int i) {
    int root = findRoot(i);
    // Path compression.
    while (i != root) {
      int next = parents[i];
      parents[i] = root;
      i = next;
    }
    return root;
  }

  /** Returns true if elements {@code i} and {@code j} are in the same group. */
  public boolean connected(int i, int j) {
    return find(i) == find(j);
  }

  /** Returns the number of elements in the group containing element {@code i}. */
  public int groupSize(int i) {
    return sizes[find(i)];
  }

  /**
   * Merges the groups that have the given roots. The root of the larger group is kept, and the
   * root of the smaller group becomes its child. If both groups have the same size, {@code root1}
   * is kept.
   *
   * <p>Returns the kept and removed roots, or {@link UnionResult#ALREADY_UNIONED} if {@code root1 ==
   * root2}, in which case nothing is changed.
   *
   * @throws IndexOutOfBoundsException if either argument is not an element
   * @throws IllegalArgumentException if either argument is not currently a root
   */
  @CanIgnoreReturnValue
  public UnionResult unionRoots(int root1, int root2) {
    Preconditions.checkArgument(isRoot(root1), "Element %s is not a root", root1);
    Preconditions.checkArgument(isRoot(root2), "Element %s is not a root", root2);
    if (root1 == root2) {
      return UnionResult.ALREADY_UNIONED;
    }

    numGroups--;

    // Attach the smaller tree below the larger one, to keep trees shallow.
    if (sizes[root1] >= sizes[root2]) {
      sizes[root1] += sizes[root2];
      parents[root2] = root1;
      return UnionResult.of(root1, root2);
    } else {
      sizes[root2] += sizes[root1];
      parents[root1] = root2;
      return UnionResult.of(root2, root1);
    }
  }

  /**
   * Merges the groups containing elements {@code i} and {@code j}, which need not be roots. Both
   * roots are found with {@link #find}, then merged as by {@link #unionRoots}. Returns {@link
   * UnionResult#ALREADY_UNIONED} if i and j were already in the same group.
   */
  @CanIgnoreReturnValue
  public UnionResult union(int i, int j) {
    int root1 = find(i);
    int root2 = find(j);
    return unionRoots(root1, root2);
  }

  /**
   * Returns a snapshot of the current partition, as a map from the root of each group to the
   * elements of that group in ascending order. Groups are ordered by the first appearance of their
   * root while scanning elements from 0 upwards, i.e. by their smallest element. Every element is
   * passed through {@link #find}, so this also compresses all paths.
   */
  public ImmutableMap<Integer, ImmutableList<Integer>> groups() {
    Map<Integer, ImmutableList.Builder<Integer>> builders = new LinkedHashMap<>();
    for (int i = 0; i < parents.length; i++) {
      builders.computeIfAbsent(find(i), root -> ImmutableList.builder()).add(i);
    }
    ImmutableMap.Builder<Integer, ImmutableList<Integer>> result =
        ImmutableMap.builderWithExpectedSize(builders.size());
    for (Map.Entry<Integer, ImmutableList.Builder<Integer>> entry : builders.entrySet()) {
      result.put(entry.getKey(), entry.getValue().build());
    }
    return result.buildOrThrow();
  }

  /** Returns the roots of all groups, in the same order as {@link #groups()}. */
  public ImmutableSet<Integer> keys() {
    return groups().keySet();
  }

  /** Returns the elements of each group, in the same order as {@link #groups()}. */
  public ImmutableCollection<ImmutableList<Integer>> values() {
    return groups().values();
  }

  /**
   * Returns true if the internal state is consistent: every parent is an element, every element
   * reaches a root, the size of every root is the number of elements that reach it, and the number
   * of groups is the number of roots. If not, logs the first problem found and returns false.
   */
  public boolean isValid() {
    int n = parents.length;
    for (int i = 0; i < n; i++) {
      if (parents[i] < 0 || parents[i] >= n) {
        log.info("Parent " + parents[i] + " of element " + i + " is not an element");
        return false;
      }
    }

    // A root is reached within n steps unless there is a cycle.
    int[] counts = new int[n];
    int numRoots = 0;
    for (int i = 0; i < n; i++) {
      int root = i;
      int steps = 0;
      while (root != parents[root]) {
        if (++steps > n) {
          log.info("Element " + i + " is on or leads to a cycle");
          return false;
        }
        root = parents[root];
      }
      counts[root]++;
      if (root == i) {
        numRoots++;
      }
    }

    for (int i = 0; i < n; i++) {
      if (parents[i] == i && sizes[i] != counts[i]) {
        log.info("Root " + i + " has size " + sizes[i] + " but " + counts[i] + " elements");
        return false;
      }
    }
    if (numRoots != numGroups) {
      log.info("Found " + numRoots + " roots but the number of groups is " + numGroups);
      return false;
    }
    return true;
  }

  /** Returns the parent of element {@code i}, which is {@code i} itself for a root. */
  @VisibleForTesting
  int parent(int i) {
    checkElement(i);
    return parents[i];
  }

  /** Overwrites the parent of element {@code i}, bypassing all invariants. */
  @VisibleForTesting
  void setParentForTesting(int i, int parent) {
    parents[i] = parent;
  }

  /** Returns the groups, as for example {@code {0=[0, 1], 2=[2], 4=[3, 4]}}. */
  @Override
  public String toString() {
    return groups().toString();
  }

  private void checkElement(int i) {
    Preconditions.checkElementIndex(i, parents.length);
  }
}
