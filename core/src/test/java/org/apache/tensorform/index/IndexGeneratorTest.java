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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link IndexGenerator} and the index tokens.
 */
class IndexGeneratorTest {
  @Test void testMonotonic() {
    final IndexGenerator generator = new IndexGenerator(5);
    assertThat(generator.peek(), is(5L));
    final Index i = generator.next();
    final Index j = generator.next();
    assertThat(i.getCount(), is(5L));
    assertThat(j.getCount(), is(6L));
    assertThat(i.compareTo(j) < 0, is(true));
    final ImmutableList<Index> list = generator.next(3);
    assertThat(list, hasToString("[Index(7), Index(8), Index(9)]"));
    assertThat(generator.peek(), is(10L));
    assertThat(generator.next(0).isEmpty(), is(true));
  }

  @Test void testIndexIdentity() {
    final IndexGenerator g1 = new IndexGenerator(0);
    final IndexGenerator g2 = new IndexGenerator(0);
    final Index i1 = g1.next();
    final Index i2 = g2.next();
    // Same counter value means same index.
    assertThat(i1, is(i2));
    assertThat(i1.hashCode(), is(i2.hashCode()));
    assertThat(i1, not(is(g1.next())));
    assertThat(i1, hasToString("Index(0)"));
    assertThat(i1.toPrettyString(), is("i_0"));
  }

  @Test void testFixedIndex() {
    assertThat(FixedIndex.of(1), is(FixedIndex.of(1)));
    assertThat(FixedIndex.of(100), is(FixedIndex.of(100)));
    assertThat(FixedIndex.of(1), not(is(FixedIndex.of(2))));
    assertThat(FixedIndex.of(3).getValue(), is(3));
    assertThat(FixedIndex.of(3), hasToString("FixedIndex(3)"));
    assertThat(FixedIndex.of(3).toPrettyString(), is("3"));
    assertThrows(IllegalArgumentException.class, () -> FixedIndex.of(-1));
  }

  @Test void testAxis() {
    assertThat(AxisIndex.AXIS, hasToString("Axis"));
    assertThat(AxisIndex.AXIS.toPrettyString(), is(":"));
  }

  @Test void testBadArguments() {
    assertThrows(IllegalArgumentException.class, () -> new IndexGenerator(-1));
    assertThrows(IllegalArgumentException.class,
        () -> new IndexGenerator(0).next(-1));
  }

  /** Indices minted concurrently are all distinct. */
  @Test void testConcurrent() throws Exception {
    final IndexGenerator generator = new IndexGenerator(0);
    final Set<Index> seen = ConcurrentHashMap.newKeySet();
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        futures.add(
            executor.submit(() -> {
              for (int n = 0; n < 1000; n++) {
                seen.add(generator.next());
              }
            }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }
    assertThat(seen.size(), is(4000));
    assertThat(generator.peek(), is(4000L));
  }
}
