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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Index with a concrete, non-negative integer value; selects one component
 * along an axis.
 */
public final class FixedIndex extends IndexBase {
  // list of common values, to reduce memory allocations
  private static final FixedIndex[] CACHE = new FixedIndex[8];

  static {
    for (int i = 0; i < CACHE.length; i++) {
      CACHE[i] = new FixedIndex(i);
    }
  }

  private final int value;

  private FixedIndex(int value) {
    this.value = value;
  }

  /** Creates a fixed index. */
  public static FixedIndex of(int value) {
    checkArgument(value >= 0, "negative fixed index %s", value);
    return value < CACHE.length ? CACHE[value] : new FixedIndex(value);
  }

  public int getValue() {
    return value;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof FixedIndex
        && value == ((FixedIndex) obj).value;
  }

  @Override public int hashCode() {
    return value;
  }

  @Override public String toPrettyString() {
    return Integer.toString(value);
  }

  @Override public String toString() {
    return "FixedIndex(" + value + ")";
  }
}
