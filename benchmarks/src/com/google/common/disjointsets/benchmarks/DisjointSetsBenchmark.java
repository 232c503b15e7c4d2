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

import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.disjointsets.DisjointSets;
import com.google.common.disjointsets.NaiveDisjointSets;
import com.google.common.disjointsets.TestDataGenerator.RandomMerge;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/** Benchmarks for {@link DisjointSets}, with {@link NaiveDisjointSets} as a baseline. */
public final class DisjointSetsBenchmark {

  private DisjointSetsBenchmark() {}

  /** Benchmark state that holds a disjoint set which is merged into one consecutive chain. */
  @State(Scope.Thread)
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(NANOSECONDS)
  @Warmup(iterations = 3, time = 5, timeUnit = SECONDS)
  @Measurement(iterations = 5, time = 5, timeUnit = SECONDS)
  public static class ConsecutiveElementsState extends DisjointSetsBenchmarkBaseState {
    @Param({"64", "512", "4096", "32768", "262144"})
    int numElements;

    private DisjointSets sets;

    @Setup(Level.Trial)
    @Override
    public void setup() {
      super.setup();
      sets = new DisjointSets(numElements);
    }

    /**
     * Measures the amount of time it takes to reset numElements groups, union each element with
     * the next, and then find the root of the second element.
     */
    @Benchmark
    public int find() {
      sets.clear();
      for (int i = 0; i + 1 < numElements; i++) {
        sets.union(i, i + 1);
      }
      return sets.find(1);
    }
  }

  /** Benchmark state that merges random groups until a single group remains. */
  @State(Scope.Thread)
  @BenchmarkMode(Mode.AverageTime)
  @OutputTimeUnit(MICROSECONDS)
  @Warmup(iterations = 3, time = 5, timeUnit = SECONDS)
  @Measurement(iterations = 5, time = 5, timeUnit = SECONDS)
  public static class RandomMergeState
      extends DisjointSetsBenchmarkBaseState.RandomMergeSequenceState {
    @Param({"32", "1024", "32768"})
    int numElements;

    @Setup(Level.Trial)
    @Override
    public void setup() {
      super.setup();
      setupMerges(numElements);
    }

    /** Measures finding both roots and merging them, for every step of the merge sequence. */
    @Benchmark
    public int findAndUnionRoots() {
      DisjointSets sets = new DisjointSets(numElements);
      for (RandomMerge merge : merges) {
        int root1 = sets.find(merge.element1);
        int root2 = sets.find(merge.element2);
        sets.unionRoots(root1, root2);
      }
      return sets.numGroups();
    }

    /** Measures the same merge sequence on the naive list-of-groups structure. */
    @Benchmark
    public long naiveUnionByIndex() {
      NaiveDisjointSets naive = new NaiveDisjointSets(numElements);
      for (RandomMerge merge : merges) {
        merge.applyTo(naive);
      }
      return naive.numMoved();
    }
  }
}
