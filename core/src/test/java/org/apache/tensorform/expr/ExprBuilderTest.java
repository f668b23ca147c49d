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

import org.apache.tensorform.index.FixedIndex;
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.test.ExprFixture;
import org.apache.tensorform.type.TensorType;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for {@link ExprBuilder}: arithmetic, indexing and implicit
 * summation.
 */
class ExprBuilderTest {
  private final ExprFixture f = ExprFixture.create();
  private final ExprBuilder b = f.builder;

  private final ExprSymbol x = b.symbol("x");
  private final ExprSymbol y = b.symbol("y");
  private final ExprSymbol v = b.symbol("v", 3);
  private final ExprSymbol w = b.symbol("w", 3);
  private final ExprSymbol a = b.symbol("A", 3, 3);
  private final ExprSymbol m = b.symbol("M", 3, 3);

  @Test void testScalarProduct() {
    final ExprNode p =
        f.expr(b -> b.times(b.literal(2), b.literal(3)))
            .ok("Product(Number(2), Number(3))");
    assertThat(p.getKind(), is(ExprKind.PRODUCT));
    assertThat(p.getRank(), is(0));
    assertThat(p.getFreeIndices().isEmpty(), is(true));
    assertThat(p.toPrettyString(), is("(2 * 3)"));
    assertThat(b.times(2, x), hasToString("Product(Number(2), Symbol('x'))"));
  }

  @Test void testIndexFixed() {
    final ExprNode e =
        f.expr(b -> b.index(a, 0, 1))
            .ok("Indexed(Symbol('A', [3, 3]), "
                + "MultiIndex(FixedIndex(0), FixedIndex(1)))");
    assertThat(e.getKind(), is(ExprKind.INDEXED));
    assertThat(e.getRank(), is(0));
    assertThat(e.getFreeIndices().isEmpty(), is(true));
    final ExprMultiIndex multiIndex = ((ExprCall) e).getMultiIndex();
    assertThat(multiIndex.getIndices(),
        is(ImmutableList.<IndexBase>of(FixedIndex.of(0), FixedIndex.of(1))));
    assertThat(e.toPrettyString(), is("A[0, 1]"));
  }

  @Test void testIndexWithLong() {
    assertThat(b.index(a, 0L, 1L), is(b.index(a, 0, 1)));
    assertThat(b.index(a, FixedIndex.of(2), 1), is(b.index(a, 2, 1)));
  }

  @Test void testIndexOutOfRange() {
    f.expr(b -> b.index(a, 3, 0))
        .fails(ErrorKind.INDEX,
            "Fixed index 3 out of range for axis 0 of dimension 3");
    f.expr(b -> b.index(a, -1, 0))
        .fails(ErrorKind.INDEX, "Fixed index out of range: -1");
  }

  @Test void testIndexWrongLength() {
    f.expr(b -> b.index(a, 0))
        .fails(ErrorKind.INDEX,
            "Invalid number of indices \\(1\\) for tensor expression of "
                + "rank 2: A");
    f.expr(b -> b.index(x, 0))
        .fails(ErrorKind.INDEX, "Invalid number of indices \\(1\\) .*");
  }

  @Test void testIndexUnsupported() {
    f.expr(b -> b.index(a, 0, "j"))
        .fails(ErrorKind.INDEX, "Can't convert this object to index: j");
    f.expr(b -> b.index(a, 0, 1.5))
        .fails(ErrorKind.INDEX, "Can't convert this object to index: 1.5");
  }

  @Test void testFreeIndex() {
    final Index i = f.index();
    final Index j = f.index();
    final ExprNode e = f.expr(b -> b.index(a, i, j)).ok(0, i, j);
    assertThat(e.getType().getIndexDimension(i), is(3));
    assertThat(e.toPrettyString(), is("A[i_0, i_1]"));
  }

  /** A[i, i] is the trace of A. */
  @Test void testTrace() {
    final Index i = f.index();
    final ExprNode e =
        f.expr(b -> b.index(a, i, i))
            .ok("IndexSum(Indexed(Symbol('A', [3, 3]), "
                + "MultiIndex(Index(0), Index(0))), MultiIndex(Index(0)))");
    assertThat(e.getKind(), is(ExprKind.INDEX_SUM));
    assertThat(e.getRank(), is(0));
    assertThat(e.getFreeIndices().isEmpty(), is(true));
    assertThat(e.toPrettyString(), is("sum_{i_0} A[i_0, i_0]"));
  }

  @Test void testIndexDimensionMismatch() {
    final Index i = f.index();
    final ExprSymbol rectangle = b.symbol("R", 3, 2);
    f.expr(b -> b.index(rectangle, i, i))
        .fails(ErrorKind.INDEX,
            "Index i_0 has dimension 3 in one operand and 2 in another");
  }

  @Test void testTooManyRepetitions() {
    final Index i = f.index();
    // rank 2, free index i
    final ExprNode t = b.times(b.index(v, i), a);
    assertThat(t.getRank(), is(2));
    assertThat(t.getFreeIndices(), is(ImmutableList.of(i)));
    f.expr(b -> b.index(t, i, i))
        .fails(ErrorKind.INDEX, "Too many index repetitions .*");
  }

  /** v[i] * M[i, j] contracts i and leaves j free. */
  @Test void testImplicitSummation() {
    final Index i = f.index();
    final Index j = f.index();
    final ExprNode e =
        f.expr(b -> b.times(b.index(v, i), b.index(m, i, j)))
            .ok(0, j);
    assertThat(e.getKind(), is(ExprKind.INDEX_SUM));
    assertThat(e,
        hasToString("IndexSum(Product("
            + "Indexed(Symbol('v', [3]), MultiIndex(Index(0))), "
            + "Indexed(Symbol('M', [3, 3]), MultiIndex(Index(0), Index(1)))), "
            + "MultiIndex(Index(0)))"));
    // The product underneath still lists i, once, as a pending contraction.
    final ExprNode product = e.getOperands().get(0);
    assertThat(product.getFreeIndices(), is(ImmutableList.of(i, j)));
  }

  /** v[i] * M[i, :] is a vector with no free indices. */
  @Test void testSliceContraction() {
    final Index i = f.index();
    final ExprNode e =
        f.expr(b -> b.times(b.index(v, i), b.index(m, i, IndexKey.SLICE)))
            .ok(1);
    assertThat(e.getKind(), is(ExprKind.INDEX_SUM));
    assertThat(e.getShape(), is(ImmutableList.of(3)));
  }

  @Test void testSlice() {
    final Index i = f.index();
    final ExprNode e =
        f.expr(b -> b.index(a, i, IndexKey.SLICE))
            .ok("ComponentTensor(Indexed(Symbol('A', [3, 3]), "
                + "MultiIndex(Index(0), Index(1))), MultiIndex(Index(1)))");
    assertThat(e.getRank(), is(1));
    assertThat(e.getFreeIndices(), is(ImmutableList.of(i)));
    assertThat(e.toPrettyString(), is("{ A | A_{i_1} = A[i_0, i_1] }"));

    // A column: fixed row, sliced column
    final ExprNode column = b.index(a, IndexKey.SLICE, 2);
    assertThat(column.getRank(), is(1));
    assertThat(column.getFreeIndices().isEmpty(), is(true));
  }

  @Test void testEllipsisIsIdentity() {
    final ExprSymbol t3 = b.symbol("T", 3, 2, 4);
    for (ExprNode e : ImmutableList.of(x, v, a, t3)) {
      assertThat(b.index(e, IndexKey.ELLIPSIS), sameInstance(e));
    }
    assertThat(b.index(t3, IndexKey.SLICE, IndexKey.SLICE, IndexKey.ELLIPSIS),
        is(b.index(t3, IndexKey.ELLIPSIS)));
    assertThat(b.index(t3, IndexKey.SLICE, IndexKey.SLICE, IndexKey.SLICE),
        sameInstance(t3));
    assertThat(b.index(x), sameInstance(x));
  }

  @Test void testEllipsisExpansion() {
    final ExprSymbol t3 = b.symbol("T", 3, 2, 4);
    final Index i = f.index();
    final ExprNode e = b.index(t3, i, IndexKey.ELLIPSIS);
    assertThat(e.getShape(), is(ImmutableList.of(2, 4)));
    assertThat(e.getFreeIndices(), is(ImmutableList.of(i)));

    final ExprNode e2 = b.index(t3, IndexKey.ELLIPSIS, 1);
    assertThat(e2.getShape(), is(ImmutableList.of(3, 2)));
    assertThat(e2.getFreeIndices().isEmpty(), is(true));
  }

  @Test void testDuplicateEllipsis() {
    f.expr(b -> b.index(a, IndexKey.ELLIPSIS, 0, IndexKey.ELLIPSIS))
        .fails(ErrorKind.INDEX, "Found duplicate ellipsis");
  }

  @Test void testNestedKey() {
    final ImmutableList<Index> ij = f.indices(2);
    final ExprNode e1 = b.index(a, ij);
    final ExprNode e2 = b.index(a, ij.get(0), ij.get(1));
    final ExprNode e3 = b.index(a, b.multiIndex(ij.get(0), ij.get(1)));
    assertThat(e1, is(e2));
    assertThat(e3, is(e2));
  }

  /** Indexing a component tensor by its own indices gives back the
   * expression inside. */
  @Test void testComponentTensorRoundTrip() {
    final Index i = f.index();
    final Index j = f.index();
    final ExprNode mij = b.index(m, i, j);
    final ExprNode t = b.asTensor(mij, i, j);
    assertThat(t.getKind(), is(ExprKind.COMPONENT_TENSOR));
    assertThat(t.getShape(), is(ImmutableList.of(3, 3)));
    assertThat(t.getFreeIndices().isEmpty(), is(true));
    assertThat(b.index(t, i, j), sameInstance(mij));
    assertThat(b.index(t, j, i), not(sameInstance(mij)));
    assertThat(b.asTensor(mij), sameInstance(mij));
  }

  @Test void testMatrixProduct() {
    final ExprSymbol p = b.symbol("P", 3, 2);
    final ExprSymbol q = b.symbol("Q", 2, 4);
    final ExprNode pq = f.expr(b -> b.times(p, q)).ok(2);
    assertThat(pq.getKind(), is(ExprKind.COMPONENT_TENSOR));
    assertThat(pq.getShape(), is(ImmutableList.of(3, 4)));

    final ExprNode pu = b.times(p, b.symbol("u", 2));
    assertThat(pu.getShape(), is(ImmutableList.of(3)));
    assertThat(pu.getFreeIndices().isEmpty(), is(true));

    f.expr(b -> b.times(p, p))
        .fails(ErrorKind.SHAPE,
            "Dimension mismatch in product of shapes \\[3, 2\\] and \\[3, 2\\]");
  }

  @Test void testIllegalProducts() {
    f.expr(b -> b.times(v, w))
        .fails(ErrorKind.SHAPE,
            "Invalid combination of tensor ranks in product: 1 and 1");
    f.expr(b -> b.times(v, a))
        .fails(ErrorKind.SHAPE,
            "Invalid combination of tensor ranks in product: 1 and 2");
    f.expr(b -> b.times(a, b.symbol("T", 3, 3, 3)))
        .fails(ErrorKind.SHAPE,
            "Invalid combination of tensor ranks in product: 2 and 3");
  }

  @Test void testRepeatedIndicesInDotProduct() {
    final Index i = f.index();
    final ExprNode p = b.times(b.index(v, i), a);
    final ExprNode q = b.times(b.index(w, i), w);
    f.expr(b -> b.times(p, q))
        .fails(ErrorKind.INDEX,
            "Not expecting repeated indices in non-scalar product: .*");
  }

  @Test void testScalarTimesTensor() {
    final ExprNode e =
        f.expr(b -> b.times(b.literal(2), a))
            .ok("ComponentTensor(Product(Number(2), "
                + "Indexed(Symbol('A', [3, 3]), MultiIndex(Index(0), Index(1)))), "
                + "MultiIndex(Index(0), Index(1)))");
    assertThat(e.getShape(), is(ImmutableList.of(3, 3)));

    // The scalar goes first, whichever side it was on.
    final ExprFixture f2 = ExprFixture.create();
    assertThat(f2.builder.times(a, 2), is(e));
  }

  @Test void testScalarWithFreeIndexTimesTensor() {
    final Index i = f.index();
    final ExprNode e = b.times(b.index(v, i), a);
    assertThat(e.getShape(), is(ImmutableList.of(3, 3)));
    assertThat(e.getFreeIndices(), is(ImmutableList.of(i)));
    assertThat(e.getType().getIndexDimension(i), is(3));
  }

  @Test void testZeroShortcut() {
    final ExprZero z = b.zero(3, 3);
    assertThat(z, hasToString("Zero([3, 3], {})"));
    assertThat(z.toPrettyString(), is("0"));
    assertThat(b.times(z, v), hasToString("Zero([3], {})"));
    assertThat(b.times(b.literal(2), z), hasToString("Zero([3, 3], {})"));
    assertThat(b.times(a, z), instanceOf(ExprZero.class));

    final Index i = f.index();
    final Index j = f.index();
    assertThat(b.index(z, i, j),
        hasToString("Zero([], {Index(0)=3, Index(1)=3})"));

    final ExprNode zi = b.index(b.zero(3), i);
    final ExprNode s = b.times(zi, b.index(v, i));
    assertThat(s, instanceOf(ExprZero.class));
    assertThat(s.getType().isTrueScalar(), is(true));
  }

  /** The type of a zero shortcut is the type the full construction would
   * have produced. */
  @Test void testZeroShortcutMatchesFullConstruction() {
    final ExprFixture on = ExprFixture.create();
    final ExprFixture off = ExprFixture.create().withZeroShortcut(false);
    final ExprBuilder b1 = on.builder;
    final ExprBuilder b2 = off.builder;
    final Index i1 = on.index();
    final Index i2 = off.index();
    assertThat(i1, is(i2));

    final ExprNode e1 = b1.index(b1.zero(3, 3), i1, IndexKey.SLICE);
    final ExprNode e2 = b2.index(b2.zero(3, 3), i2, IndexKey.SLICE);
    assertThat(e1, instanceOf(ExprZero.class));
    assertThat(e2.getKind(), is(ExprKind.COMPONENT_TENSOR));
    assertThat(e1.getType(), is(e2.getType()));

    final ExprNode p1 = b1.times(b1.zero(3, 2), b1.symbol("u", 2));
    final ExprNode p2 = b2.times(b2.zero(3, 2), b2.symbol("u", 2));
    assertThat(p1, instanceOf(ExprZero.class));
    assertThat(p2.getKind(), is(ExprKind.COMPONENT_TENSOR));
    assertThat(p1.getType(), is(p2.getType()));

    final ExprNode q1 = b1.times(b1.index(b1.symbol("u", 3), i1), b1.zero(3));
    final ExprNode q2 = b2.times(b2.index(b2.symbol("u", 3), i2), b2.zero(3));
    assertThat(q1, instanceOf(ExprZero.class));
    assertThat(q1.getType(), is(q2.getType()));
    assertThat(q1.getType(),
        is(TensorType.of(ImmutableList.of(3),
            q1.getType().getIndexDimensions())));
    assertThat(q1.getFreeIndices(), is(ImmutableList.of(i1)));
  }

  @Test void testSum() {
    final ExprNode e = f.expr(b -> b.plus(2, x)).ok("Sum(Number(2), Symbol('x'))");
    assertThat(e.toPrettyString(), is("(2 + x)"));
    assertThat(b.plus(a, m).getShape(), is(ImmutableList.of(3, 3)));

    final Index i = f.index();
    assertThat(b.plus(b.index(v, i), b.index(w, i)).getFreeIndices(),
        is(ImmutableList.of(i)));
  }

  @Test void testIllegalSums() {
    f.expr(b -> b.plus(a, v))
        .fails(ErrorKind.SHAPE,
            "Can't add expressions with different ranks: A has rank 2, "
                + "v has rank 1");
    f.expr(b -> b.plus(a, b.symbol("R", 3, 2)))
        .fails(ErrorKind.SHAPE, "Can't add expressions with different shapes: .*");
    final Index i = f.index();
    final Index j = f.index();
    f.expr(b -> b.plus(b.index(v, i), b.index(v, j)))
        .fails(ErrorKind.INDEX,
            "Can't add expressions with different free indices: .*");
  }

  @Test void testMinusAndNegate() {
    f.expr(b -> b.minus(x, y))
        .ok("Sum(Symbol('x'), Product(Number(-1), Symbol('y')))");
    f.expr(b -> b.minus(x, 1))
        .ok("Sum(Symbol('x'), Product(Number(-1), Number(1)))");
    final ExprNode n = b.negate(a);
    assertThat(n.getKind(), is(ExprKind.COMPONENT_TENSOR));
    assertThat(n.getShape(), is(ImmutableList.of(3, 3)));
  }

  @Test void testDivide() {
    final ExprNode e =
        f.expr(b -> b.divide(a, 2))
            .ok("Division(Symbol('A', [3, 3]), Number(2))");
    assertThat(e.getShape(), is(ImmutableList.of(3, 3)));
    assertThat(e.toPrettyString(), is("(A / 2)"));
    assertThat(b.divide(1, x).getRank(), is(0));

    f.expr(b -> b.divide(x, v))
        .fails(ErrorKind.SHAPE, "Division by non-scalar is undefined: v");
    final Index i = f.index();
    f.expr(b -> b.divide(x, b.index(v, i)))
        .fails(ErrorKind.SHAPE, "Division by non-scalar is undefined: v\\[i_0\\]");
  }

  @Test void testPowerAndMod() {
    f.expr(b -> b.power(x, 2)).ok("Power(Symbol('x'), Number(2))");
    assertThat(b.power(x, 2).toPrettyString(), is("(x ** 2)"));
    f.expr(b -> b.mod(7, y)).ok("Mod(Number(7), Symbol('y'))");
    f.expr(b -> b.power(v, 2))
        .fails(ErrorKind.SHAPE, "Power of non-scalar expression is undefined: v");
    f.expr(b -> b.power(2, v))
        .fails(ErrorKind.SHAPE, "Power of non-scalar expression is undefined: v");
    final Index i = f.index();
    f.expr(b -> b.mod(b.index(v, i), 2))
        .fails(ErrorKind.SHAPE, "Mod of non-scalar expression is undefined: .*");
  }

  @Test void testAbsAndTranspose() {
    final Index i = f.index();
    final ExprNode vi = b.index(v, i);
    final ExprNode abs = b.abs(vi);
    assertThat(abs.getType(), is(vi.getType()));
    assertThat(abs.toPrettyString(), is("|v[i_0]|"));

    final ExprSymbol r = b.symbol("R", 3, 2);
    final ExprNode t = f.expr(b -> b.transpose(r)).ok("Transposed(Symbol('R', [3, 2]))");
    assertThat(t.getShape(), is(ImmutableList.of(2, 3)));
    assertThat(t.toPrettyString(), is("(R)^T"));
    f.expr(b -> b.transpose(v))
        .fails(ErrorKind.SHAPE,
            "Transposed is only defined for rank 2 tensors, got rank 1: v");
  }

  @Test void testMathFunctions() {
    f.expr(b -> b.sqrt(x)).ok("sqrt(Symbol('x'))");
    assertThat(b.sqrt(x).toPrettyString(), is("sqrt(x)"));
    for (ExprNode e
        : ImmutableList.of(b.exp(x), b.ln(x), b.cos(x), b.sin(x), b.floor(x),
            b.ceil(x))) {
      assertThat(e.getKind(), is(ExprKind.MATH_FUNCTION));
      assertThat(e.getType(), is(TensorType.SCALAR));
    }
    assertThat(b.ln(x).toString(), is("ln(Symbol('x'))"));
    f.expr(b -> b.cos(v))
        .fails(ErrorKind.SHAPE, "Expecting scalar argument to cos, got v");
    final Index i = f.index();
    f.expr(b -> b.exp(b.index(v, i)))
        .fails(ErrorKind.SHAPE, "Expecting scalar argument to exp, got .*");
  }

  @Test void testLiterals() {
    assertThat(b.literal(2), hasToString("Number(2)"));
    assertThat(b.literal(0.5), hasToString("Number(0.5)"));
    assertThat(b.literal(-3L).getValue().intValue(), is(-3));
    assertThat(b.literal(new BigDecimal("2.50")),
        hasToString("Number(2.50)"));
    assertThat(b.literal(0).isZero(), is(true));
  }

  /** A float literal keeps the value that it prints as. */
  @Test void testFloatLiteral() {
    assertThat(b.literal(0.1f), hasToString("Number(0.1)"));
    assertThat(b.literal(0.1f), is(b.literal(0.1)));
    assertThat(b.literal(2.5f), hasToString("Number(2.5)"));
  }

  @Test void testUnsupportedLiteral() {
    assertThrows(IllegalArgumentException.class,
        () -> b.literal(new AtomicInteger(3)));
    assertThrows(IllegalArgumentException.class,
        () -> b.literal(Double.NaN));
  }

  @Test void testRestricted() {
    final ExprNode p =
        f.expr(b -> b.restricted(a, "+"))
            .ok("PositiveRestricted(Symbol('A', [3, 3]))");
    assertThat(p.getKind(), is(ExprKind.POSITIVE_RESTRICTED));
    assertThat(p.isA(ExprKind.RESTRICTED), is(true));
    assertThat(p.getType(), is(a.getType()));
    assertThat(p.toPrettyString(), is("(A)('+')"));
    assertThat(b.positiveRestricted(a), is(p));

    final ExprNode n =
        f.expr(b -> b.restricted(x, "-"))
            .ok("NegativeRestricted(Symbol('x'))");
    assertThat(n.getKind(), is(ExprKind.NEGATIVE_RESTRICTED));
    assertThat(b.negativeRestricted(x), is(n));
    assertThat(n, not(is(b.positiveRestricted(x))));
  }

  /** A restricted expression keeps its free indices and can take part in
   * index notation. */
  @Test void testRestrictedIndexed() {
    final Index i = f.index();
    final ExprNode vi = b.index(v, i);
    final ExprNode r = f.expr(b -> b.restricted(vi, "-")).ok(0, i);
    final ExprNode jump =
        f.expr(b -> b.minus(b.positiveRestricted(vi), r)).ok(0, i);
    assertThat(jump.getKind(), is(ExprKind.SUM));
    final ExprNode c = b.index(b.positiveRestricted(v), 1);
    assertThat(c.getRank(), is(0));
  }

  @Test void testRestrictedInvalidSide() {
    f.expr(b -> b.restricted(x, "x"))
        .fails(ErrorKind.RESTRICTION,
            "Invalid side 'x' in restriction operator");
    f.expr(b -> b.restricted(x, "+-"))
        .fails(ErrorKind.RESTRICTION, "Invalid side '\\+-' .*");
  }

  @Test void testIndexSum() {
    final Index i = f.index();
    final ExprNode s = b.indexSum(b.index(v, i), i);
    assertThat(s.getKind(), is(ExprKind.INDEX_SUM));
    assertThat(s.getFreeIndices().isEmpty(), is(true));
    f.expr(b -> b.indexSum(x, i))
        .fails(ErrorKind.INDEX, "Index i_0 is not free in x");
  }
}
