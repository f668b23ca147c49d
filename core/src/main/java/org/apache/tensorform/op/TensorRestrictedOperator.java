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
import org.apache.tensorform.expr.ExprNode;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Restriction of an expression to one side of an interior facet.
 *
 * <p>The result has the type of the operand. Each instance stands for one
 * side; see {@link TensorStdOperatorTable#POSITIVE_RESTRICTED} and
 * {@link TensorStdOperatorTable#NEGATIVE_RESTRICTED}.
 */
public class TensorRestrictedOperator extends TensorOperator {
  private final String side;

  TensorRestrictedOperator(String name, ExprKind kind, String side) {
    super(name, kind);
    this.side = requireNonNull(side, "side");
  }

  /** Returns the side, "+" or "-". */
  public String getSide() {
    return side;
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 1, 1);
    return tensorType(operands.get(0));
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return "(" + operands.get(0).toPrettyString() + ")('" + side + "')";
  }

  @Override public boolean equals(@Nullable Object obj) {
    return super.equals(obj)
        && side.equals(((TensorRestrictedOperator) obj).side);
  }

  @Override public int hashCode() {
    return super.hashCode() * 31 + side.hashCode();
  }
}
