/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.tensorform.index;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Result of {@link IndexAnalyzer#analyze analyzing} an index tuple.
 *
 * <p>Free and repeated indices are in ascending order of count.
 */
public final class IndexAnalysis {
  /** Fixed indices, keyed by their position in the tuple. */
  public final ImmutableSortedMap<Integer, FixedIndex> fixedIndices;
  /** Indices that occur exactly once. */
  public final ImmutableList<Index> freeIndices;
  /** Indices that occur exactly twice; each implies a summation. */
  public final ImmutableList<Index> repeatedIndices;
  /** Number of {@link AxisIndex#AXIS} entries. */
  public final int axisCount;

  IndexAnalysis(ImmutableSortedMap<Integer, FixedIndex> fixedIndices,
      ImmutableList<Index> freeIndices, ImmutableList<Index> repeatedIndices,
      int axisCount) {
    this.fixedIndices = requireNonNull(fixedIndices, "fixedIndices");
    this.freeIndices = requireNonNull(freeIndices, "freeIndices");
    this.repeatedIndices = requireNonNull(repeatedIndices, "repeatedIndices");
    this.axisCount = axisCount;
  }

  /** Returns the number of positions accounted for: each repeated index
   * consumes two positions, every other entry one. */
  public int positionCount() {
    return fixedIndices.size() + freeIndices.size()
        + 2 * repeatedIndices.size() + axisCount;
  }

  /** Returns the distinct indices, free or repeated, in ascending order. */
  public ImmutableList<Index> distinctIndices() {
    return ImmutableList.sortedCopyOf(
        ImmutableList.<Index>builder()
            .addAll(freeIndices)
            .addAll(repeatedIndices)
            .build());
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof IndexAnalysis
        && fixedIndices.equals(((IndexAnalysis) obj).fixedIndices)
        && freeIndices.equals(((IndexAnalysis) obj).freeIndices)
        && repeatedIndices.equals(((IndexAnalysis) obj).repeatedIndices)
        && axisCount == ((IndexAnalysis) obj).axisCount;
  }

  @Override public int hashCode() {
    return Objects.hash(fixedIndices, freeIndices, repeatedIndices, axisCount);
  }

  @Override public String toString() {
    return "{fixed: " + fixedIndices
        + ", free: " + freeIndices
        + ", repeated: " + repeatedIndices
        + ", axes: " + axisCount + "}";
  }
}
