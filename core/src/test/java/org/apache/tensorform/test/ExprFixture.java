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
package org.apache.tensorform.test;

import org.apache.tensorform.expr.ExprBuilder;
import org.apache.tensorform.expr.ExprNode;
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexGenerator;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.runtime.TensorException;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import java.util.function.Function;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import static java.util.Objects.requireNonNull;

/**
 * Helper for testing the construction of tensor expressions.
 *
 * <p>Each fixture has its own {@link IndexGenerator}, starting at 0, so
 * that index numbers in expected canonical forms are predictable.
 *
 * <p>Typical usage:
 *
 * <blockquote><pre>
 * final ExprFixture f = ExprFixture.create();
 * f.expr(b -&gt; b.transpose(b.symbol("v", 3)))
 *     .fails(ErrorKind.SHAPE, "Transposed is only defined .*");
 * </pre></blockquote>
 */
public class ExprFixture {
  public final ExprBuilder builder;

  private ExprFixture(ExprBuilder builder) {
    this.builder = requireNonNull(builder, "builder");
  }

  /** Creates a fixture whose builder throws on error, works in three
   * dimensions and applies the zero shortcut. */
  public static ExprFixture create() {
    return new ExprFixture(
        new ExprBuilder(Litmus.THROW, new IndexGenerator(0), 3, true));
  }

  public ExprFixture withSpatialDimension(int spatialDimension) {
    return new ExprFixture(builder.withSpatialDimension(spatialDimension));
  }

  public ExprFixture withZeroShortcut(boolean zeroShortcut) {
    return new ExprFixture(
        new ExprBuilder(builder.getLitmus(), builder.getIndexGenerator(),
            builder.getSpatialDimension(), zeroShortcut));
  }

  /** Mints a fresh index. */
  public Index index() {
    return builder.index();
  }

  /** Mints {@code n} fresh indices. */
  public ImmutableList<Index> indices(int n) {
    return builder.indices(n);
  }

  /** Creates a checker for an expression built by a function. */
  public Checker expr(Function<ExprBuilder, ExprNode> function) {
    return new Checker(function);
  }

  /** Checks an expression, or the failure to build it. */
  public class Checker {
    private final Function<ExprBuilder, ExprNode> function;

    Checker(Function<ExprBuilder, ExprNode> function) {
      this.function = function;
    }

    /** Builds the expression, which must succeed. */
    public ExprNode ok() {
      return function.apply(builder);
    }

    /** Builds the expression and checks its rank and free indices. */
    public ExprNode ok(int rank, Index... freeIndices) {
      final ExprNode node = ok();
      assertThat(node.getRank(), is(rank));
      assertThat(node.getFreeIndices(), is(ImmutableList.copyOf(freeIndices)));
      return node;
    }

    /** Builds the expression and checks its canonical form. */
    public ExprNode ok(String digest) {
      final ExprNode node = ok();
      assertThat(node.toString(), is(digest));
      return node;
    }

    /** Checks that building the expression fails with an error of a given
     * kind whose message matches a regular expression. */
    public TensorException fails(ErrorKind kind, String messageRegex) {
      final TensorException e =
          assertThrows(TensorException.class, () -> function.apply(builder));
      assertThat(e.getKind(), is(kind));
      assertThat("message [" + e.getMessage() + "] does not match "
              + messageRegex,
          e.getMessage().matches(messageRegex), is(true));
      return e;
    }
  }
}
