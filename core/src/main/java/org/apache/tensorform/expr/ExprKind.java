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

import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Enumerates the possible types of {@link ExprNode}.
 *
 * <p>The values are immutable, canonical constants, so you can use kinds to
 * find particular types of expressions quickly. To quickly choose between a
 * number of options, use a switch statement:</p>
 *
 * <blockquote>
 * <pre>switch (expr.getKind()) {
 * case {@link #SUM}:
 *     ...;
 * case {@link #PRODUCT}:
 *     ...;
 * default:
 *     throw new AssertionError("unexpected");
 * }</pre>
 * </blockquote>
 */
public enum ExprKind {
  //~ Terminals --------------------------------------------------------------

  /** Numeric literal; see {@link ExprLiteral}. */
  LITERAL,

  /** Zero tensor of a given type; see {@link ExprZero}. */
  ZERO,

  /** Named tensor; see {@link ExprSymbol}. */
  SYMBOL,

  /** Argument defined on a finite element; see {@link ExprArgument}. */
  ARGUMENT,

  /** Labelled alias for a sub-expression; see {@link ExprVariable}. */
  VARIABLE,

  /** Index tuple; see {@link ExprMultiIndex}. */
  MULTI_INDEX,

  //~ Algebraic operators ----------------------------------------------------

  /** Sum of tensors of equal rank and free indices. */
  SUM,

  /** Product of a scalar and a tensor, or a matrix product. */
  PRODUCT,

  /** Division by a true scalar. */
  DIVISION,

  /** Power of two true scalars. */
  POWER,

  /** Remainder of two true scalars. */
  MOD,

  /** Absolute value. */
  ABS,

  /** Transpose of a rank 2 tensor. */
  TRANSPOSE,

  /** Elementary function (sqrt, exp, ln, sin, cos, floor, ceil) of a true
   * scalar. */
  MATH_FUNCTION,

  //~ Index notation ---------------------------------------------------------

  /** Component of a tensor selected by an index tuple. */
  INDEXED,

  /** Tensor whose components are a scalar expression, one per value of an
   * index tuple. */
  COMPONENT_TENSOR,

  /** Summation over a repeated index. */
  INDEX_SUM,

  //~ Differentiation --------------------------------------------------------

  /** Derivative with respect to a spatial coordinate. */
  SPATIAL_DERIVATIVE,

  //~ Restrictions -----------------------------------------------------------

  /** Value on the positive side of an interior facet, {@code a('+')}. */
  POSITIVE_RESTRICTED,

  /** Value on the negative side of an interior facet, {@code a('-')}. */
  NEGATIVE_RESTRICTED;

  /** Terminal kinds. */
  public static final Set<ExprKind> TERMINAL =
      EnumSet.of(LITERAL, ZERO, SYMBOL, ARGUMENT, MULTI_INDEX);

  /** Operators that require true scalar operands. */
  public static final Set<ExprKind> SCALAR_ONLY =
      EnumSet.of(POWER, MOD, MATH_FUNCTION);

  /** Operators that take an index tuple operand. */
  public static final Set<ExprKind> INDEX_NOTATION =
      Sets.immutableEnumSet(INDEXED, COMPONENT_TENSOR, INDEX_SUM,
          SPATIAL_DERIVATIVE);

  /** Restrictions to one side of an interior facet. */
  public static final Set<ExprKind> RESTRICTED =
      EnumSet.of(POSITIVE_RESTRICTED, NEGATIVE_RESTRICTED);

  /** Returns whether this {@code ExprKind} belongs to a given category. */
  public final boolean belongsTo(Collection<ExprKind> category) {
    return category.contains(this);
  }
}
