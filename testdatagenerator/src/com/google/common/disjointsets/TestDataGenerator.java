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
import java.util.List;
import java.util.Random;

/**
 * Utility methods for generating test data for disjoint set unit tests and benchmarks. State
 * consists of a java.util.Random which is used in generating test data.
 *
 * <p>WARNING: These APIs are not stable and not intended for use outside of benchmarks and unit
 * tests.
 */
public class TestDataGenerator {

  /** The default seed for the random number generator. */
  public static final int DEFAULT_RANDOM_SEED = 123455;

  /** The single Random that this TestDataGenerator's random methods are based on. */
  public Random rand;

  /** Constructs a new TestDataGenerator with its internal Random seeded with the default value. */
  public TestDataGenerator() {
    rand = new Random(DEFAULT_RANDOM_SEED);
  }

  /** Constructs a new TestDataGenerator with its internal Random seeded to the provided value. */
  public TestDataGenerator(int seed) {
    rand = new Random(seed);
  }

  /** Resets the random seed to the default value. */
  public void resetSeed() {
    rand.setSeed(DEFAULT_RANDOM_SEED);
  }

  /** Sets the random number generator to the given seed. */
  public void setSeed(int seed) {
    rand.setSeed(seed);
  }

  /** Returns {@link Random#nextInt(int)} from the TestDataGenerator's internal Random. */
  public int nextInt(int n) {
    return rand.nextInt(n);
  }

  /** Returns a uniformly chosen element of the given non-empty list. */
  public <T> T choice(List<T> list) {
    Preconditions.checkArgument(!list.isEmpty());
    return list.get(rand.nextInt(list.size()));
  }

  /**
   * Chooses two group positions of {@code naive} uniformly at random, which may be the same, and
   * then a random element from each of the two groups. {@code naive} must have at least one group,
   * and is not modified.
   */
  public RandomMerge randomMerge(NaiveDisjointSets naive) {
    Preconditions.checkArgument(naive.numGroups() > 0, "No groups to choose from");
    int index1 = nextInt(naive.numGroups());
    int index2 = nextInt(naive.numGroups());
    int element1 = choice(naive.group(index1));
    int element2 = choice(naive.group(index2));
    return new RandomMerge(index1, index2, element1, element2);
  }

  /**
   * Returns a sequence of random merges that reduces {@code n} singleton groups to a single group,
   * generated by applying each merge to a {@link NaiveDisjointSets} as it is chosen. Some of the
   * merges may be no-ops, when both positions are the same.
   */
  public ImmutableList<RandomMerge> randomMergeSequence(int n) {
    NaiveDisjointSets naive = new NaiveDisjointSets(n);
    ImmutableList.Builder<RandomMerge> merges = ImmutableList.builder();
    while (naive.numGroups() > 1) {
      RandomMerge merge = randomMerge(naive);
      merge.applyTo(naive);
      merges.add(merge);
    }
    return merges.build();
  }

  /**
   * One step of a random merge sequence. The same step merges the groups at positions {@code
   * index1} and {@code index2} of a {@link NaiveDisjointSets}, and the groups containing {@code
   * element1} and {@code element2} of an equivalent {@link DisjointSets}.
   */
  public static final class RandomMerge {
    public final int index1;
    public final int index2;
    public final int element1;
    public final int element2;

    public RandomMerge(int index1, int index2, int element1, int element2) {
      this.index1 = index1;
      this.index2 = index2;
      this.element1 = element1;
      this.element2 = element2;
    }

    /** Merges the groups at positions index1 and index2. */
    public void applyTo(NaiveDisjointSets naive) {
      naive.unionByIndex(index1, index2);
    }

    /** Merges the groups containing element1 and element2. */
    public UnionResult applyTo(DisjointSets sets) {
      return sets.union(element1, element2);
    }

    @Override
    public String toString() {
      return "RandomMerge[indices=(" + index1 + ", " + index2 + "), elements=(" + element1 + ", "
          + element2 + ")]";
    }
  }
}
