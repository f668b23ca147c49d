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
package org.apache.tensorform.op;

import org.apache.tensorform.expr.ExprKind;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Implementation of the standard set of tensor operators.
 *
 * <p>Operators are stateless singletons; compare them with
 * {@link Object#equals} or by {@link ExprKind}.
 */
public class TensorStdOperatorTable {
  private TensorStdOperatorTable() {
  }

  //~ Algebraic operators ----------------------------------------------------

  /** Sum of tensors, "+". */
  public static final TensorSumOperator SUM = new TensorSumOperator();

  /** Product, "*". */
  public static final TensorProductOperator PRODUCT =
      new TensorProductOperator();

  /** Division by a true scalar, "/". */
  public static final TensorDivisionOperator DIVISION =
      new TensorDivisionOperator();

  /** Power of true scalars, "**". */
  public static final TensorScalarInfixOperator POWER =
      new TensorScalarInfixOperator("Power", ExprKind.POWER, "**");

  /** Remainder of true scalars, "%". */
  public static final TensorScalarInfixOperator MOD =
      new TensorScalarInfixOperator("Mod", ExprKind.MOD, "%");

  public static final TensorAbsOperator ABS = new TensorAbsOperator();

  public static final TensorTransposeOperator TRANSPOSE =
      new TensorTransposeOperator();

  //~ Elementary functions ---------------------------------------------------

  public static final TensorMathFunction SQRT = new TensorMathFunction("sqrt");

  public static final TensorMathFunction EXP = new TensorMathFunction("exp");

  /** Natural logarithm. */
  public static final TensorMathFunction LN = new TensorMathFunction("ln");

  public static final TensorMathFunction COS = new TensorMathFunction("cos");

  public static final TensorMathFunction SIN = new TensorMathFunction("sin");

  public static final TensorMathFunction FLOOR =
      new TensorMathFunction("floor");

  public static final TensorMathFunction CEIL = new TensorMathFunction("ceil");

  private static final ImmutableMap<String, TensorMathFunction> MATH_FUNCTIONS =
      ImmutableMap.<String, TensorMathFunction>builder()
          .put(SQRT.getName(), SQRT)
          .put(EXP.getName(), EXP)
          .put(LN.getName(), LN)
          .put(COS.getName(), COS)
          .put(SIN.getName(), SIN)
          .put(FLOOR.getName(), FLOOR)
          .put(CEIL.getName(), CEIL)
          .build();

  //~ Index notation ---------------------------------------------------------

  public static final TensorIndexedOperator INDEXED =
      new TensorIndexedOperator();

  public static final TensorComponentTensorOperator COMPONENT_TENSOR =
      new TensorComponentTensorOperator();

  public static final TensorIndexSumOperator INDEX_SUM =
      new TensorIndexSumOperator();

  //~ Restrictions -----------------------------------------------------------

  /** Restriction to the positive side of an interior facet, "a('+')". */
  public static final TensorRestrictedOperator POSITIVE_RESTRICTED =
      new TensorRestrictedOperator("PositiveRestricted",
          ExprKind.POSITIVE_RESTRICTED, "+");

  /** Restriction to the negative side of an interior facet, "a('-')". */
  public static final TensorRestrictedOperator NEGATIVE_RESTRICTED =
      new TensorRestrictedOperator("NegativeRestricted",
          ExprKind.NEGATIVE_RESTRICTED, "-");

  //~ Differentiation --------------------------------------------------------

  /** Largest supported spatial dimension. */
  public static final int MAX_SPATIAL_DIMENSION = 3;

  private static final TensorSpatialDerivativeOperator[] SPATIAL_DERIVATIVES = {
      new TensorSpatialDerivativeOperator(1),
      new TensorSpatialDerivativeOperator(2),
      new TensorSpatialDerivativeOperator(3),
  };

  /** Spatial derivative in three dimensions. */
  public static final TensorSpatialDerivativeOperator SPATIAL_DERIVATIVE =
      spatialDerivative(3);

  /** Returns the spatial derivative operator for a given number of
   * coordinates, between 1 and {@link #MAX_SPATIAL_DIMENSION}. */
  public static TensorSpatialDerivativeOperator spatialDerivative(
      int dimension) {
    checkArgument(dimension >= 1 && dimension <= MAX_SPATIAL_DIMENSION,
        "spatial dimension %s out of range", dimension);
    return SPATIAL_DERIVATIVES[dimension - 1];
  }

  /** Returns the restriction operator for a side, "+" or "-"; returns
   * null for any other side. */
  public static @Nullable TensorRestrictedOperator restriction(String side) {
    switch (side) {
    case "+":
      return POSITIVE_RESTRICTED;
    case "-":
      return NEGATIVE_RESTRICTED;
    default:
      return null;
    }
  }

  /** Looks up an elementary function by name, such as "sqrt"; returns null
   * if there is no such function. */
  public static @Nullable TensorMathFunction mathFunction(String name) {
    return MATH_FUNCTIONS.get(name);
  }
}
