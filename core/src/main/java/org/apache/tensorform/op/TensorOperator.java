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
import org.apache.tensorform.expr.ExprMultiIndex;
import org.apache.tensorform.expr.ExprNode;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * A <code>TensorOperator</code> is a type of node in a tensor expression.
 *
 * <p>Operators do not hold operands; an {@link org.apache.tensorform.expr.ExprCall}
 * is an occurrence of an operator applied to operands. An operator validates
 * its operands and derives the type of the call in
 * {@link #deriveType(Litmus, List)}, before the call is created.
 *
 * <p>The standard operators are in {@link TensorStdOperatorTable}.
 */
public abstract class TensorOperator {
  //~ Instance fields --------------------------------------------------------

  /**
   * The name of the operator. Ex. "Sum" or "sqrt"
   */
  private final String name;

  /**
   * See {@link ExprKind}.
   */
  public final ExprKind kind;

  //~ Constructors -----------------------------------------------------------

  /**
   * Creates an operator.
   */
  protected TensorOperator(String name, ExprKind kind) {
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
  }

  //~ Methods ----------------------------------------------------------------

  public String getName() {
    return name;
  }

  public ExprKind getKind() {
    return kind;
  }

  /**
   * Validates the operands of a call to this operator and derives the type
   * of the call.
   *
   * @param litmus   What to do if the operands are not legal
   * @param operands Operands
   * @return Type of the call
   */
  public abstract TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands);

  /** Returns the text that the canonical form of a call to this operator
   * has after its operands. The canonical form of a call is the name of the
   * operator, then the operands, then this suffix, as in
   * "Sum(Number(1), Symbol('x'))". Empty by default. */
  public String digestSuffix() {
    return "";
  }

  /** Returns the human-readable form of a call to this operator. */
  public abstract String unparse(List<? extends ExprNode> operands);

  /** Checks the number of operands. Calls with the wrong number of operands
   * are a programming error, not a user error. */
  protected void checkOperandCount(List<? extends ExprNode> operands,
      int min, int max) {
    checkArgument(operands.size() >= min && operands.size() <= max,
        "%s expects between %s and %s operands, got %s", name, min, max,
        operands.size());
  }

  /** Returns the type of a tensor operand. */
  protected TensorType tensorType(ExprNode operand) {
    final TensorType type = operand.getType();
    checkArgument(!type.isIndexTuple(),
        "index tuple %s cannot be an operand of %s", operand, name);
    return type;
  }

  /** Returns an operand as an index tuple. */
  protected ExprMultiIndex multiIndex(ExprNode operand) {
    checkArgument(operand instanceof ExprMultiIndex,
        "%s expects an index tuple, got %s", name, operand);
    return (ExprMultiIndex) operand;
  }

  @Override public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof TensorOperator)) {
      return false;
    }
    if (!obj.getClass().equals(this.getClass())) {
      return false;
    }
    TensorOperator other = (TensorOperator) obj;
    return name.equals(other.name) && kind == other.kind;
  }

  @Override public int hashCode() {
    return Objects.hash(kind, name);
  }

  @Override public String toString() {
    return name;
  }
}
