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

import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Mints fresh {@link Index} objects.
 *
 * <p>The counter is monotonic and is never decremented; it is safe to mint
 * indices from several threads at once. Uniqueness, not order, is guaranteed
 * across threads.
 *
 * <p>{@link #GLOBAL} is the process-wide generator. It is never reset during a
 * run, so that indices minted by independent pieces of code never collide.
 * Code that needs reproducible index numbers, such as tests that compare
 * digests, should create its own generator. Indices from two different
 * generators may collide, so they must not be mixed in one expression.
 */
public class IndexGenerator {
  /** Process-wide generator. */
  public static final IndexGenerator GLOBAL = new IndexGenerator(0);

  private final AtomicLong counter;

  /** Creates a generator whose first index will have count {@code start}. */
  public IndexGenerator(long start) {
    checkArgument(start >= 0, "negative start %s", start);
    this.counter = new AtomicLong(start);
  }

  /** Creates a fresh index. */
  public Index next() {
    return new Index(counter.getAndIncrement());
  }

  /** Creates a list of {@code n} fresh indices, in ascending order. */
  public ImmutableList<Index> next(int n) {
    checkArgument(n >= 0, "negative count %s", n);
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(next());
    }
    return b.build();
  }

  /** Returns the count that the next index will have. Does not mint. */
  public long peek() {
    return counter.get();
  }
}
