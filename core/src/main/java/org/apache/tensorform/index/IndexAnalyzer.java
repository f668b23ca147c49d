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

import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.runtime.InternalInvariantError;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Classifies the entries of an index tuple.
 *
 * <p>Each {@link Index} is counted by identity: one occurrence makes it free,
 * two make it repeated (an implied summation, under the Einstein
 * convention), more are illegal. {@link FixedIndex} entries are recorded by
 * position. {@link AxisIndex} entries are only counted.
 */
public abstract class IndexAnalyzer {
  private IndexAnalyzer() {
  }

  /**
   * Analyzes an index tuple.
   *
   * @param indices Index tuple
   * @param litmus  What to do if an index occurs more than twice
   * @return Classification of the tuple
   */
  public static IndexAnalysis analyze(List<? extends IndexBase> indices,
      Litmus litmus) {
    final ImmutableSortedMap.Builder<Integer, FixedIndex> fixed =
        ImmutableSortedMap.naturalOrder();
    final Map<Index, Integer> counts = new TreeMap<>();
    int axisCount = 0;
    for (int i = 0; i < indices.size(); i++) {
      final IndexBase index = indices.get(i);
      if (index instanceof Index) {
        counts.merge((Index) index, 1, Integer::sum);
      } else if (index instanceof FixedIndex) {
        fixed.put(i, (FixedIndex) index);
      } else if (index == AxisIndex.AXIS) {
        ++axisCount;
      }
    }

    final ImmutableList.Builder<Index> free = ImmutableList.builder();
    final ImmutableList.Builder<Index> repeated = ImmutableList.builder();
    for (Map.Entry<Index, Integer> e : counts.entrySet()) {
      switch (e.getValue()) {
      case 1:
        free.add(e.getKey());
        break;
      case 2:
        repeated.add(e.getKey());
        break;
      default:
        throw litmus.fail(ErrorKind.INDEX,
            "Too many index repetitions in {}: {} occurs {} times",
            indices, e.getKey(), e.getValue());
      }
    }

    final IndexAnalysis analysis =
        new IndexAnalysis(fixed.build(), free.build(), repeated.build(),
            axisCount);
    if (analysis.positionCount() != indices.size()) {
      throw new InternalInvariantError("Logic breach in index analysis: "
          + analysis + " accounts for " + analysis.positionCount()
          + " of " + indices.size() + " positions in " + indices);
    }
    return analysis;
  }

  /** Returns the indices that occur exactly twice in a tuple, in ascending
   * order. */
  public static ImmutableList<Index> repeatedIndices(
      List<? extends IndexBase> indices, Litmus litmus) {
    return analyze(indices, litmus).repeatedIndices;
  }
}
