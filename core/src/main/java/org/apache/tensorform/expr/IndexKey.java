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
package org.apache.tensorform.expr;

import org.apache.tensorform.index.AxisIndex;
import org.apache.tensorform.index.FixedIndex;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Elements of the key of an indexing expression, and the rules that turn a
 * key into an index tuple.
 *
 * <p>A key element may be an {@link IndexBase} token, an {@link Integer} or
 * {@link Long} (converted to a {@link FixedIndex}), {@link #SLICE} (a
 * complete slice, which keeps an axis), {@link #ELLIPSIS} (as many complete
 * slices as needed to reach the rank of the indexed expression), or an
 * {@link ExprMultiIndex} or {@link List} of such elements, which is spliced
 * into the key.
 */
public final class IndexKey {
  private IndexKey() {
  }

  /** Complete slice, written ":"; keeps one axis. */
  public static final AxisIndex SLICE = AxisIndex.AXIS;

  /** Ellipsis, written "..."; keeps all axes not otherwise indexed. */
  public static final Ellipsis ELLIPSIS = Ellipsis.INSTANCE;

  /** Type of {@link #ELLIPSIS}. */
  public enum Ellipsis {
    INSTANCE;

    @Override public String toString() {
      return "...";
    }
  }

  /**
   * Converts a key into an index tuple for an expression of a given rank.
   *
   * <p>Nested lists are spliced into the key, one level deep. An ellipsis
   * expands into axis markers; if the key has more elements than the rank,
   * it expands into nothing, and the caller rejects the tuple because its
   * length differs from the rank.
   *
   * @param key    Key elements
   * @param rank   Rank of the expression being indexed
   * @param litmus What to do if the key is not valid
   * @return Index tuple
   */
  public static ImmutableList<IndexBase> normalize(List<?> key, int rank,
      Litmus litmus) {
    final List<@Nullable IndexBase> flat = new ArrayList<>();
    int ellipsisPosition = -1;
    for (Object element : key) {
      for (Object item : splice(element)) {
        if (item == ELLIPSIS) {
          if (ellipsisPosition >= 0) {
            throw litmus.fail(ErrorKind.INDEX, "Found duplicate ellipsis");
          }
          ellipsisPosition = flat.size();
          flat.add(null);
        } else {
          flat.add(toIndex(item, litmus));
        }
      }
    }

    final ImmutableList.Builder<IndexBase> b = ImmutableList.builder();
    for (int i = 0; i < flat.size(); i++) {
      final IndexBase index = flat.get(i);
      if (i == ellipsisPosition) {
        final int n = Math.max(0, rank - (flat.size() - 1));
        for (int j = 0; j < n; j++) {
          b.add(AxisIndex.AXIS);
        }
      } else if (index != null) {
        b.add(index);
      }
    }
    return b.build();
  }

  /**
   * Converts a single key element into an index token. Lists and the
   * ellipsis are not allowed here.
   */
  public static IndexBase toIndex(@Nullable Object item, Litmus litmus) {
    if (item instanceof IndexBase) {
      return (IndexBase) item;
    }
    if (item instanceof Integer || item instanceof Long
        || item instanceof Short || item instanceof Byte) {
      final long value = ((Number) item).longValue();
      if (value < 0 || value > Integer.MAX_VALUE) {
        throw litmus.fail(ErrorKind.INDEX,
            "Fixed index out of range: {}", value);
      }
      return FixedIndex.of((int) value);
    }
    throw litmus.fail(ErrorKind.INDEX,
        "Can't convert this object to index: {}", item);
  }

  private static List<?> splice(@Nullable Object element) {
    if (element instanceof ExprMultiIndex) {
      return ((ExprMultiIndex) element).getIndices();
    }
    if (element instanceof List) {
      return (List<?>) element;
    }
    return Collections.singletonList(element);
  }
}
