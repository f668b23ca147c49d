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
import org.apache.tensorform.runtime.IndexException;
import org.apache.tensorform.runtime.InternalInvariantError;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link IndexAnalyzer}.
 */
class IndexAnalyzerTest {
  private final IndexGenerator generator = new IndexGenerator(0);

  private static IndexAnalysis analyze(IndexBase... indices) {
    return IndexAnalyzer.analyze(ImmutableList.copyOf(indices), Litmus.THROW);
  }

  @Test void testEmpty() {
    final IndexAnalysis analysis = analyze();
    assertThat(analysis.fixedIndices.isEmpty(), is(true));
    assertThat(analysis.freeIndices.isEmpty(), is(true));
    assertThat(analysis.repeatedIndices.isEmpty(), is(true));
    assertThat(analysis.axisCount, is(0));
    assertThat(analysis.positionCount(), is(0));
  }

  @Test void testClassification() {
    final Index i = generator.next();
    final Index j = generator.next();
    final Index k = generator.next();
    final IndexAnalysis analysis =
        analyze(k, FixedIndex.of(2), i, AxisIndex.AXIS, k, j,
            AxisIndex.AXIS);
    assertThat(analysis.freeIndices, is(ImmutableList.of(i, j)));
    assertThat(analysis.repeatedIndices, is(ImmutableList.of(k)));
    assertThat(analysis.fixedIndices.size(), is(1));
    assertThat(analysis.fixedIndices.get(1), is(FixedIndex.of(2)));
    assertThat(analysis.axisCount, is(2));
    assertThat(analysis.positionCount(), is(7));
    assertThat(analysis.distinctIndices(), is(ImmutableList.of(i, j, k)));
    assertThat(analysis,
        hasToString("{fixed: {1=FixedIndex(2)}, free: [Index(0), Index(1)], "
            + "repeated: [Index(2)], axes: 2}"));
  }

  /** Free and repeated indices come out in ascending order, whatever the
   * order in the tuple. */
  @Test void testOrder() {
    final List<Index> ids = generator.next(4);
    final IndexAnalysis analysis =
        analyze(ids.get(3), ids.get(1), ids.get(2), ids.get(0), ids.get(3),
            ids.get(1));
    assertThat(analysis.freeIndices,
        is(ImmutableList.of(ids.get(0), ids.get(2))));
    assertThat(analysis.repeatedIndices,
        is(ImmutableList.of(ids.get(1), ids.get(3))));
  }

  @Test void testTwiceIsRepeated() {
    final Index i = generator.next();
    final IndexAnalysis analysis = analyze(i, i);
    assertThat(analysis.freeIndices.isEmpty(), is(true));
    assertThat(analysis.repeatedIndices, is(ImmutableList.of(i)));
    assertThat(IndexAnalyzer.repeatedIndices(ImmutableList.of(i, i),
        Litmus.THROW), is(ImmutableList.of(i)));
  }

  @Test void testTooManyRepetitions() {
    final Index i = generator.next();
    final IndexException e =
        assertThrows(IndexException.class, () -> analyze(i, i, i));
    assertThat(e.getKind(), is(ErrorKind.INDEX));
    assertThat(e.getMessage(), containsString("Too many index repetitions"));
    assertThat(e.getMessage(), containsString("Index(0) occurs 3 times"));

    assertThrows(IndexException.class,
        () -> analyze(i, FixedIndex.of(0), i, i, i));
  }

  /** An index token the analyzer does not know about breaks its
   * post-condition; that is a defect, reported as an error rather than
   * through the litmus. */
  @Test void testPostConditionBreach() {
    final IndexBase alien = new IndexBase() {
      @Override public String toPrettyString() {
        return "?";
      }

      @Override public String toString() {
        return "Alien";
      }
    };
    final Litmus litmus = (kind, message, args) -> {
      throw new AssertionError("litmus must not be called");
    };
    final InternalInvariantError e =
        assertThrows(InternalInvariantError.class,
            () -> IndexAnalyzer.analyze(ImmutableList.of(alien), litmus));
    assertThat(e.getMessage(), containsString("Logic breach"));
    assertThat(e instanceof AssertionError, is(true));
  }
}
