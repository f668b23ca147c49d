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

import org.apache.tensorform.config.TensorSystemProperty;
import org.apache.tensorform.index.AxisIndex;
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexAnalysis;
import org.apache.tensorform.index.IndexAnalyzer;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.index.IndexGenerator;
import org.apache.tensorform.op.TensorMathFunction;
import org.apache.tensorform.op.TensorOperator;
import org.apache.tensorform.op.TensorSpatialDerivativeOperator;
import org.apache.tensorform.op.TensorStdOperatorTable;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;

import org.apiguardian.api.API;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Factory for tensor expressions.
 *
 * <p>All expressions are created through a builder. Besides creating calls,
 * the builder applies the summation convention: when an operation leaves an
 * index repeated, once in each of two factors, the builder wraps the result
 * in an {@link ExprKind#INDEX_SUM} over that index. It also implements the
 * product of tensors and indexing by slices in terms of index notation.
 *
 * <p>A builder is immutable and may be shared between threads. Fresh indices
 * come from its {@link IndexGenerator}; tests inject their own generator to
 * get predictable index numbers.
 */
public class ExprBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExprBuilder.class);

  /** Default ExprBuilder. Throws on illegal expressions, and mints indices
   * from {@link IndexGenerator#GLOBAL}. */
  public static final ExprBuilder DEFAULT = new ExprBuilder();

  //~ Instance fields --------------------------------------------------------

  protected final Litmus litmus;
  protected final IndexGenerator indexGenerator;
  private final TensorSpatialDerivativeOperator spatialDerivative;
  private final boolean zeroShortcut;

  //~ Constructors -----------------------------------------------------------

  /** Creates an ExprBuilder with default settings. */
  public ExprBuilder() {
    this(Litmus.THROW, IndexGenerator.GLOBAL);
  }

  /** Creates an ExprBuilder, taking the spatial dimension and zero shortcut
   * from system properties. */
  public ExprBuilder(Litmus litmus, IndexGenerator indexGenerator) {
    this(litmus, indexGenerator,
        TensorSystemProperty.SPATIAL_DIMENSION.value(),
        TensorSystemProperty.ENABLE_ZERO_SHORTCUT.value());
  }

  /**
   * Creates an ExprBuilder.
   *
   * @param litmus           What to do if an expression is not legal
   * @param indexGenerator   Source of fresh indices
   * @param spatialDimension Number of spatial coordinates, 1 to 3
   * @param zeroShortcut     Whether products and indexing of a zero tensor
   *                         yield a zero tensor directly
   */
  public ExprBuilder(Litmus litmus, IndexGenerator indexGenerator,
      int spatialDimension, boolean zeroShortcut) {
    this.litmus = requireNonNull(litmus, "litmus");
    this.indexGenerator = requireNonNull(indexGenerator, "indexGenerator");
    this.spatialDerivative =
        TensorStdOperatorTable.spatialDerivative(spatialDimension);
    this.zeroShortcut = zeroShortcut;
  }

  //~ Methods ----------------------------------------------------------------

  public Litmus getLitmus() {
    return litmus;
  }

  public IndexGenerator getIndexGenerator() {
    return indexGenerator;
  }

  public int getSpatialDimension() {
    return spatialDerivative.getDimension();
  }

  /** Returns a builder that is the same as this but uses a different
   * spatial dimension. */
  public ExprBuilder withSpatialDimension(int spatialDimension) {
    return new ExprBuilder(litmus, indexGenerator, spatialDimension,
        zeroShortcut);
  }

  //~ Indices ----------------------------------------------------------------

  /** Mints a fresh index. */
  public Index index() {
    return indexGenerator.next();
  }

  /** Mints {@code n} fresh indices. */
  public ImmutableList<Index> indices(int n) {
    return indexGenerator.next(n);
  }

  /** Creates an index tuple. */
  public ExprMultiIndex multiIndex(IndexBase... indices) {
    return multiIndex(Arrays.asList(indices));
  }

  /** Creates an index tuple. */
  public ExprMultiIndex multiIndex(List<? extends IndexBase> indices) {
    for (IndexBase index : indices) {
      requireNonNull(index, "index");
    }
    return new ExprMultiIndex(indices);
  }

  //~ Terminals --------------------------------------------------------------

  /**
   * Creates a numeric literal.
   *
   * <p>Integral values and {@link BigDecimal} values are held exactly;
   * {@link Double} and {@link Float} values are converted using their
   * canonical string representation, so {@code 0.1} and {@code 0.1f} both
   * become exactly 0.1. Other kinds of number are not accepted.
   */
  public ExprLiteral literal(Number value) {
    requireNonNull(value, "value");
    final BigDecimal d;
    if (value instanceof BigDecimal) {
      d = (BigDecimal) value;
    } else if (value instanceof BigInteger) {
      d = new BigDecimal((BigInteger) value);
    } else if (value instanceof Double || value instanceof Float) {
      final double v = value.doubleValue();
      checkArgument(Double.isFinite(v), "non-finite literal %s", value);
      d = new BigDecimal(value.toString());
    } else {
      checkArgument(value instanceof Long || value instanceof Integer
              || value instanceof Short || value instanceof Byte,
          "unsupported number class %s: %s", value.getClass().getName(),
          value);
      d = BigDecimal.valueOf(value.longValue());
    }
    return new ExprLiteral(d);
  }

  /** Creates a zero tensor of a given type. */
  public ExprZero zero(TensorType type) {
    return new ExprZero(type);
  }

  /** Creates a zero tensor of a given shape, with no free indices. */
  public ExprZero zero(int... shape) {
    return new ExprZero(TensorType.of(shape));
  }

  /** Creates a named tensor of a given shape; a scalar if the shape is
   * empty. */
  public ExprSymbol symbol(String name, int... shape) {
    return new ExprSymbol(name, TensorType.of(shape));
  }

  /** Creates an argument defined on a finite element. */
  public ExprArgument argument(FiniteElement element, int number) {
    return new ExprArgument(element, number);
  }

  /** Creates a labelled alias for an expression. */
  public ExprVariable variable(String label, ExprNode expression) {
    return new ExprVariable(label, expression);
  }

  //~ Calls ------------------------------------------------------------------

  /**
   * Creates a call to an operator.
   *
   * <p>The operator validates the operands and derives the type of the call;
   * if the operands are not legal, nothing is created. No implicit summation
   * is applied.
   */
  public ExprCall makeCall(TensorOperator op, ExprNode... operands) {
    return makeCall(op, ImmutableList.copyOf(operands));
  }

  /** Creates a call to an operator with a list of operands. */
  public ExprCall makeCall(TensorOperator op,
      List<? extends ExprNode> operands) {
    final TensorType type = op.deriveType(litmus, operands);
    return new ExprCall(type, op, operands);
  }

  //~ Arithmetic -------------------------------------------------------------

  /** Creates the sum of two tensors of equal shape and free indices. */
  public ExprNode plus(ExprNode a, ExprNode b) {
    return makeCall(TensorStdOperatorTable.SUM, a, b);
  }

  public ExprNode plus(ExprNode a, Number b) {
    return plus(a, literal(b));
  }

  public ExprNode plus(Number a, ExprNode b) {
    return plus(literal(a), b);
  }

  /** Creates {@code a - b}, represented as {@code a + (-1 * b)}. */
  public ExprNode minus(ExprNode a, ExprNode b) {
    return plus(a, negate(b));
  }

  public ExprNode minus(ExprNode a, Number b) {
    return minus(a, literal(b));
  }

  public ExprNode minus(Number a, ExprNode b) {
    return minus(literal(a), b);
  }

  /** Creates {@code -a}, represented as {@code -1 * a}. */
  public ExprNode negate(ExprNode a) {
    return times(literal(-1), a);
  }

  /**
   * Creates the product of two tensors.
   *
   * <p>If both are non-scalar, the first must have rank 2 and the second
   * rank 1 or 2, and the result is the dot product over the last axis of the
   * first and the first axis of the second. Otherwise the scalar multiplies
   * each component of the other operand. In either case, an index free in
   * both operands is summed over.
   */
  public ExprNode times(ExprNode a, ExprNode b) {
    final ImmutableList<Index> repeated =
        IndexAnalyzer.repeatedIndices(
            ImmutableList.copyOf(
                Iterables.concat(a.getFreeIndices(), b.getFreeIndices())),
            litmus);
    final int r1 = a.getRank();
    final int r2 = b.getRank();

    if (r1 == 2 && (r2 == 1 || r2 == 2)) {
      if (!repeated.isEmpty()) {
        throw litmus.fail(ErrorKind.INDEX,
            "Not expecting repeated indices in non-scalar product: {}",
            repeated);
      }
      if (a.getType().getDimension(1) != b.getType().getDimension(0)) {
        throw litmus.fail(ErrorKind.SHAPE,
            "Dimension mismatch in product of shapes {} and {}",
            a.getShape(), b.getShape());
      }
      if (isZeroShortcut(a, b)) {
        final List<Integer> shape = new ArrayList<>();
        shape.add(a.getType().getDimension(0));
        shape.addAll(b.getShape().subList(1, r2));
        return zero(TensorType.of(shape, contract(a, b, repeated)));
      }
      final ImmutableList<Index> ai = indices(r1 - 1);
      final ImmutableList<Index> bi = indices(r2 - 1);
      final Index k = index();
      final ExprNode s =
          times(index(a, ImmutableList.builder().addAll(ai).add(k).build()),
              index(b, ImmutableList.builder().add(k).addAll(bi).build()));
      return asTensor(s, ImmutableList.<Index>builder().addAll(ai)
          .addAll(bi).build());
    }

    if (r1 != 0 && r2 != 0) {
      throw litmus.fail(ErrorKind.SHAPE,
          "Invalid combination of tensor ranks in product: {} and {}",
          r1, r2);
    }

    if (r1 != 0 || r2 != 0) {
      // Scalar first
      final ExprNode scalar = r1 == 0 ? a : b;
      final ExprNode tensor = r1 == 0 ? b : a;
      if (isZeroShortcut(a, b)) {
        return zero(
            TensorType.of(tensor.getShape(), contract(a, b, repeated)));
      }
      final ImmutableList<Index> ii = indices(tensor.getRank());
      final ExprNode p =
          makeCall(TensorStdOperatorTable.PRODUCT, scalar, index(tensor, ii));
      return sumOver(asTensor(p, ii), repeated);
    }

    if (isZeroShortcut(a, b)) {
      return zero(TensorType.of(ImmutableList.of(), contract(a, b, repeated)));
    }
    return sumOver(makeCall(TensorStdOperatorTable.PRODUCT, a, b), repeated);
  }

  public ExprNode times(ExprNode a, Number b) {
    return times(a, literal(b));
  }

  public ExprNode times(Number a, ExprNode b) {
    return times(literal(a), b);
  }

  /** Creates the quotient of a tensor and a true scalar. */
  public ExprNode divide(ExprNode a, ExprNode b) {
    return makeCall(TensorStdOperatorTable.DIVISION, a, b);
  }

  public ExprNode divide(ExprNode a, Number b) {
    return divide(a, literal(b));
  }

  public ExprNode divide(Number a, ExprNode b) {
    return divide(literal(a), b);
  }

  public ExprNode power(ExprNode a, ExprNode b) {
    return makeCall(TensorStdOperatorTable.POWER, a, b);
  }

  public ExprNode power(ExprNode a, Number b) {
    return power(a, literal(b));
  }

  public ExprNode power(Number a, ExprNode b) {
    return power(literal(a), b);
  }

  public ExprNode mod(ExprNode a, ExprNode b) {
    return makeCall(TensorStdOperatorTable.MOD, a, b);
  }

  public ExprNode mod(ExprNode a, Number b) {
    return mod(a, literal(b));
  }

  public ExprNode mod(Number a, ExprNode b) {
    return mod(literal(a), b);
  }

  public ExprNode abs(ExprNode a) {
    return makeCall(TensorStdOperatorTable.ABS, a);
  }

  public ExprNode transpose(ExprNode a) {
    return makeCall(TensorStdOperatorTable.TRANSPOSE, a);
  }

  //~ Restrictions -----------------------------------------------------------

  /**
   * Restricts an expression to one side of an interior facet, as in
   * {@code a('+')}.
   *
   * @param expression Expression of any type
   * @param side       "+" or "-"
   * @return Restricted expression, of the same type as {@code expression}
   */
  public ExprNode restricted(ExprNode expression, String side) {
    requireNonNull(side, "side");
    final TensorOperator op = TensorStdOperatorTable.restriction(side);
    if (op == null) {
      throw litmus.fail(ErrorKind.RESTRICTION,
          "Invalid side '{}' in restriction operator", side);
    }
    return makeCall(op, expression);
  }

  /** Restricts an expression to the positive side of an interior facet. */
  public ExprNode positiveRestricted(ExprNode expression) {
    return makeCall(TensorStdOperatorTable.POSITIVE_RESTRICTED, expression);
  }

  /** Restricts an expression to the negative side of an interior facet. */
  public ExprNode negativeRestricted(ExprNode expression) {
    return makeCall(TensorStdOperatorTable.NEGATIVE_RESTRICTED, expression);
  }

  //~ Elementary functions ---------------------------------------------------

  public ExprNode sqrt(ExprNode a) {
    return call(TensorStdOperatorTable.SQRT, a);
  }

  public ExprNode exp(ExprNode a) {
    return call(TensorStdOperatorTable.EXP, a);
  }

  public ExprNode ln(ExprNode a) {
    return call(TensorStdOperatorTable.LN, a);
  }

  public ExprNode cos(ExprNode a) {
    return call(TensorStdOperatorTable.COS, a);
  }

  public ExprNode sin(ExprNode a) {
    return call(TensorStdOperatorTable.SIN, a);
  }

  public ExprNode floor(ExprNode a) {
    return call(TensorStdOperatorTable.FLOOR, a);
  }

  public ExprNode ceil(ExprNode a) {
    return call(TensorStdOperatorTable.CEIL, a);
  }

  /** Applies an elementary function to a true scalar. */
  public ExprNode call(TensorMathFunction function, ExprNode a) {
    return makeCall(function, a);
  }

  //~ Index notation ---------------------------------------------------------

  /**
   * Creates a component or slice of a tensor, as in {@code A[i, 0, :]}.
   *
   * <p>See {@link IndexKey} for the elements a key may contain. A key that
   * consists only of slices returns the expression itself. Slices become
   * fresh indices, and the result is a tensor over those indices. An index
   * that occurs both in the key and among the free indices of the
   * expression, or twice in the key, is summed over.
   *
   * @param expression Tensor expression of rank R
   * @param key        Key whose normalized length is R
   * @return Expression for the component or slice
   */
  public ExprNode index(ExprNode expression, Object... key) {
    return index(expression, Arrays.asList(key));
  }

  /** Creates a component or slice of a tensor; see
   * {@link #index(ExprNode, Object...)}. */
  public ExprNode index(ExprNode expression, List<?> key) {
    checkArgument(!expression.getType().isIndexTuple(),
        "cannot index an index tuple: %s", expression);
    final int rank = expression.getRank();
    final ImmutableList<IndexBase> tuple =
        IndexKey.normalize(key, rank, litmus);
    final IndexAnalysis analysis =
        IndexAnalyzer.analyze(
            ImmutableList.copyOf(
                Iterables.concat(expression.getFreeIndices(), tuple)),
            litmus);
    if (tuple.size() != rank) {
      throw litmus.fail(ErrorKind.INDEX,
          "Invalid number of indices ({}) for tensor expression of rank {}: {}",
          tuple.size(), rank, expression.toPrettyString());
    }

    // A key of complete slices selects the whole tensor.
    if (analysis.axisCount == rank) {
      return expression;
    }

    // Indexing a component tensor with its own indices gives back the
    // expression it was built from.
    if (expression.isA(ExprKind.COMPONENT_TENSOR)) {
      final ExprCall call = (ExprCall) expression;
      if (call.getMultiIndex().getIndices().equals(tuple)) {
        return call.operands.get(0);
      }
    }

    final List<IndexBase> indices = new ArrayList<>();
    final List<Index> axisIndices = new ArrayList<>();
    for (IndexBase index : tuple) {
      if (index == AxisIndex.AXIS) {
        final Index i = index();
        axisIndices.add(i);
        indices.add(i);
      } else {
        indices.add(index);
      }
    }
    ExprNode a =
        makeCall(TensorStdOperatorTable.INDEXED, expression,
            multiIndex(indices));
    a = asTensor(a, axisIndices);
    a = sumOver(a, analysis.repeatedIndices);

    if (zeroShortcut && expression instanceof ExprZero) {
      LOGGER.debug("Zero shortcut in indexing {}", expression);
      return zero(a.getType());
    }
    return a;
  }

  /** Creates a tensor whose axes range over the given free indices of a
   * scalar-valued expression. Returns the expression unchanged if there are
   * no indices. */
  public ExprNode asTensor(ExprNode expression, Index... indices) {
    return asTensor(expression, Arrays.asList(indices));
  }

  /** Creates a tensor whose axes range over the given free indices of a
   * scalar-valued expression. */
  public ExprNode asTensor(ExprNode expression, List<Index> indices) {
    if (indices.isEmpty()) {
      return expression;
    }
    return makeCall(TensorStdOperatorTable.COMPONENT_TENSOR, expression,
        multiIndex(indices));
  }

  /** Creates a sum over a free index. */
  public ExprNode indexSum(ExprNode summand, Index index) {
    return makeCall(TensorStdOperatorTable.INDEX_SUM, summand,
        multiIndex(index));
  }

  //~ Differentiation --------------------------------------------------------

  /**
   * Creates the derivative of an expression with respect to one or more
   * spatial coordinates, as in {@code f.dx(i, j)}.
   *
   * <p>Each element of {@code indices} is an {@link Index}, a
   * {@link org.apache.tensorform.index.FixedIndex} or an {@link Integer}.
   * The derivatives are applied from left to right. Then each index that
   * occurs twice, counting the free indices of {@code expression} and the
   * derivative indices, is summed over, in ascending order. All indices are
   * checked before the first derivative is created.
   */
  @API(since = "1.0", status = API.Status.EXPERIMENTAL)
  public ExprNode dx(ExprNode expression, Object... indices) {
    final List<IndexBase> derivativeIndices = new ArrayList<>();
    for (Object o : indices) {
      final IndexBase index = IndexKey.toIndex(o, litmus);
      spatialDerivative.checkIndex(litmus, index);
      derivativeIndices.add(index);
    }
    final ImmutableList<Index> repeated =
        IndexAnalyzer.repeatedIndices(
            ImmutableList.copyOf(
                Iterables.concat(expression.getFreeIndices(),
                    derivativeIndices)),
            litmus);
    ExprNode d = expression;
    for (IndexBase index : derivativeIndices) {
      d = makeCall(spatialDerivative, d, multiIndex(index));
    }
    return sumOver(d, repeated);
  }

  //~ Helpers ----------------------------------------------------------------

  /** Wraps an expression in one index sum per index, in the order given. */
  private ExprNode sumOver(ExprNode expression, List<Index> repeated) {
    ExprNode e = expression;
    for (Index i : repeated) {
      LOGGER.debug("Implicit summation over {} in {}", i, e);
      e = indexSum(e, i);
    }
    return e;
  }

  private boolean isZeroShortcut(ExprNode a, ExprNode b) {
    if (zeroShortcut && (a instanceof ExprZero || b instanceof ExprZero)) {
      LOGGER.debug("Zero shortcut in product of {} and {}", a, b);
      return true;
    }
    return false;
  }

  /** Returns the free indices of a product of two expressions after the
   * repeated indices have been summed over. */
  private Map<Index, Integer> contract(ExprNode a, ExprNode b,
      List<Index> repeated) {
    final Map<Index, Integer> dimensions =
        new TreeMap<>(
            TensorType.mergeIndexDimensions(litmus,
                ImmutableList.of(a.getType().getIndexDimensions(),
                    b.getType().getIndexDimensions())));
    for (Index i : repeated) {
      dimensions.remove(i);
    }
    return dimensions;
  }
}
