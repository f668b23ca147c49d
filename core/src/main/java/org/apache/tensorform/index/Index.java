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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Free or bound index.
 *
 * <p>The identity of an index is its count, a number minted by an
 * {@link IndexGenerator}; two indices are the same index if and only if their
 * counts are equal. Whether an index is free or bound (summed) depends on how
 * many times it occurs in an expression, not on the index itself.
 *
 * <p>Indices are ordered by count. That order is the canonical order of free
 * indices and of implicit summations.
 */
public final class Index extends IndexBase implements Comparable<Index> {
  private final long count;

  Index(long count) {
    this.count = count;
  }

  public long getCount() {
    return count;
  }

  @Override public int compareTo(Index o) {
    return Long.compare(count, o.count);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof Index
        && count == ((Index) obj).count;
  }

  @Override public int hashCode() {
    return Long.hashCode(count);
  }

  @Override public String toPrettyString() {
    return "i_" + count;
  }

  @Override public String toString() {
    return "Index(" + count + ")";
  }
}
