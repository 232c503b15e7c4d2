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

import com.google.common.collect.ImmutableList;
import com.google.common.disjointsets.TestDataGenerator;
import com.google.common.disjointsets.TestDataGenerator.RandomMerge;

/**
 * A base class for JMH @State in disjoint set benchmarks which provides a seeded TestDataGenerator
 * and random merge sequences built from it.
 */
public class DisjointSetsBenchmarkBaseState {
  protected TestDataGenerator data;

  /**
   * Reinitializes the TestDataGenerator, which reinitializes the contained Random to a known state.
   * This is equivalent to calling data.resetSeed().
   */
  public void setup() {
    data = new TestDataGenerator();
  }

  /**
   * Abstract benchmark state that holds a precomputed sequence of random merges which reduces
   * {@code numElements} singleton groups to a single group. Generating the sequence is not part of
   * the measured cost.
   */
  public abstract static class RandomMergeSequenceState extends DisjointSetsBenchmarkBaseState {
    protected ImmutableList<RandomMerge> merges;

    /** Builds the merge sequence from 'data', which must already be set up. */
    protected void setupMerges(int numElements) {
      merges = data.randomMergeSequence(numElements);
    }
  }
}
