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

/**
 * The outcome of merging two groups of a {@link DisjointSets}: the root that represents the merged
 * group, and the root that was absorbed into it. Merging two elements that were already in the
 * same group returns the {@link #ALREADY_UNIONED} sentinel, which has no kept or removed root.
 */
public final class UnionResult {
  /** Returned when both arguments were already in the same group, so nothing was merged. */
  public static final UnionResult ALREADY_UNIONED = new UnionResult(-1, -1);

  private final int keptRoot;
  private final int removedRoot;

  private UnionResult(int keptRoot, int removedRoot) {
    this.keptRoot = keptRoot;
    this.removedRoot = removedRoot;
  }

  /** Returns the result of a merge that kept {@code keptRoot} and absorbed {@code removedRoot}. */
  static UnionResult of(int keptRoot, int removedRoot) {
    Preconditions.checkArgument(keptRoot != removedRoot);
    return new UnionResult(keptRoot, removedRoot);
  }

  /** Returns true if two distinct groups were merged, false for {@link #ALREADY_UNIONED}. */
  public boolean merged() {
    return this != ALREADY_UNIONED;
  }

  /**
   * Returns the root that survived the merge.
   *
   * @throws IllegalStateException if nothing was merged
   */
  public int keptRoot() {
    Preconditions.checkState(merged(), "No groups were merged");
    return keptRoot;
  }

  /**
   * Returns the root that was absorbed, and which is no longer a root.
   *
   * @throws IllegalStateException if nothing was merged
   */
  public int removedRoot() {
    Preconditions.checkState(merged(), "No groups were merged");
    return removedRoot;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof UnionResult)) {
      return false;
    }
    UnionResult that = (UnionResult) other;
    return keptRoot == that.keptRoot && removedRoot == that.removedRoot;
  }

  @Override
  public int hashCode() {
    return 31 * keptRoot + removedRoot;
  }

  @Override
  public String toString() {
    if (!merged()) {
      return "UnionResult[already unioned]";
    }
    return "UnionResult[kept=" + keptRoot + ", removed=" + removedRoot + "]";
  }
}
