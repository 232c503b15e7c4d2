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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.disjointsets.DisjointSets;
import com.google.common.disjointsets.NaiveDisjointSets;
import com.google.common.disjointsets.TestDataGenerator;
import com.google.common.disjointsets.TestDataGenerator.RandomMerge;
import java.io.PrintStream;
import java.util.logging.Logger;

/**
 * Compares the time taken by {@link DisjointSets} and {@link NaiveDisjointSets} to merge random
 * groups until a single group remains, over a range of sizes. Unlike the JMH benchmarks, the two
 * structures are driven in lockstep by the same random merges, and the time of each kind of step is
 * accumulated separately: the naive merge, the two finds, and the union of the two roots.
 *
 * <p>Usage: {@code DisjointSetsComparison [minLog2Size maxLog2Size [seed]]}. The default sizes are
 * 2^5 through 2^19.
 */
public final class DisjointSetsComparison {
  private static final Logger log = Logger.getLogger(DisjointSetsComparison.class.getName());

  static final int DEFAULT_MIN_LOG2_SIZE = 5;
  static final int DEFAULT_MAX_LOG2_SIZE = 19;

  private DisjointSetsComparison() {}

  /** Accumulated times for merging one universe of {@code size} elements into a single group. */
  public static final class Timing {
    public final int size;
    public final long naiveNanos;
    public final long findNanos;
    public final long unionNanos;

    Timing(int size, long naiveNanos, long findNanos, long unionNanos) {
      this.size = size;
      this.naiveNanos = naiveNanos;
      this.findNanos = findNanos;
      this.unionNanos = unionNanos;
    }

    /** Returns the time spent finding roots plus merging them. */
    public long findAndUnionNanos() {
      return findNanos + unionNanos;
    }
  }

  /** Runs the comparison for sizes 2^minLog2Size through 2^maxLog2Size, inclusive. */
  public static ImmutableList<Timing> run(int minLog2Size, int maxLog2Size, TestDataGenerator data) {
    Preconditions.checkArgument(
        0 <= minLog2Size && minLog2Size <= maxLog2Size && maxLog2Size < 31,
        "Invalid size range 2^%s..2^%s",
        minLog2Size,
        maxLog2Size);
    ImmutableList.Builder<Timing> timings = ImmutableList.builder();
    for (int log2Size = minLog2Size; log2Size <= maxLog2Size; log2Size++) {
      int size = 1 << log2Size;
      log.info("Benchmarking size " + size);
      timings.add(time(size, data));
    }
    return timings.build();
  }

  private static Timing time(int size, TestDataGenerator data) {
    DisjointSets sets = new DisjointSets(size);
    NaiveDisjointSets naive = new NaiveDisjointSets(size);
    Stopwatch naiveTimer = Stopwatch.createUnstarted();
    Stopwatch findTimer = Stopwatch.createUnstarted();
    Stopwatch unionTimer = Stopwatch.createUnstarted();

    while (naive.numGroups() > 1) {
      RandomMerge merge = data.randomMerge(naive);

      naiveTimer.start();
      merge.applyTo(naive);
      naiveTimer.stop();

      findTimer.start();
      int root1 = sets.find(merge.element1);
      int root2 = sets.find(merge.element2);
      findTimer.stop();

      unionTimer.start();
      sets.unionRoots(root1, root2);
      unionTimer.stop();
    }
    Preconditions.checkState(
        sets.numGroups() == naive.numGroups(),
        "Expected %s groups, found %s",
        naive.numGroups(),
        sets.numGroups());

    return new Timing(
        size,
        naiveTimer.elapsed(NANOSECONDS),
        findTimer.elapsed(NANOSECONDS),
        unionTimer.elapsed(NANOSECONDS));
  }

  /** Prints one row per size, with times in seconds. */
  public static void print(PrintStream out, Iterable<Timing> timings) {
    out.printf("%10s %14s %14s %14s %14s%n", "size", "naive", "find 2 sets", "union",
        "union + find");
    for (Timing t : timings) {
      out.printf(
          "%10d %14.6f %14.6f %14.6f %14.6f%n",
          t.size,
          seconds(t.naiveNanos),
          seconds(t.findNanos),
          seconds(t.unionNanos),
          seconds(t.findAndUnionNanos()));
    }
  }

  private static double seconds(long nanos) {
    return nanos / 1e9;
  }

  public static void main(String[] args) {
    int minLog2Size = DEFAULT_MIN_LOG2_SIZE;
    int maxLog2Size = DEFAULT_MAX_LOG2_SIZE;
    int seed = TestDataGenerator.DEFAULT_RANDOM_SEED;
    if (args.length >= 2) {
      minLog2Size = Integer.parseInt(args[0]);
      maxLog2Size = Integer.parseInt(args[1]);
    }
    if (args.length >= 3) {
      seed = Integer.parseInt(args[2]);
    }

    log.info("Running benchmark (this might take a while).");
    print(System.out, run(minLog2Size, maxLog2Size, new TestDataGenerator(seed)));
  }
}
