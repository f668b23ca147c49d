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

import org.apache.tensorform.op.TensorOperator;
import org.apache.tensorform.type.TensorType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An expression formed by a call to an operator with zero or more
 * expressions as operands.
 *
 * <p>Operators may be algebraic ({@code +}, {@code *}), elementary functions
 * ({@code sqrt}), or index notation ({@code Indexed}, {@code IndexSum}).
 * The type of a call is derived by its operator before the call is created,
 * so a call that exists is always well-formed.
 *
 * <p>Use {@link ExprBuilder#makeCall} to create calls.
 */
public class ExprCall extends ExprNode {
  //~ Instance fields --------------------------------------------------------

  public final TensorOperator op;
  public final ImmutableList<ExprNode> operands;
  public final TensorType type;
  public final int nodeCount;

  /**
   * Hash code, computed on construction from the cached hash codes of the
   * operands.
   */
  private final int hash;

  //~ Constructors -----------------------------------------------------------

  ExprCall(TensorType type, TensorOperator op,
      List<? extends ExprNode> operands) {
    this.type = requireNonNull(type, "type");
    this.op = requireNonNull(op, "operator");
    this.operands = ImmutableList.copyOf(operands);
    this.nodeCount = computeNodeCount(this.operands);
    this.hash = Objects.hash(op, this.operands);
  }

  //~ Methods ----------------------------------------------------------------

  static int computeNodeCount(List<ExprNode> nodes) {
    int n = 1;
    for (ExprNode operand : nodes) {
      n += operand.nodeCount();
    }
    return n;
  }

  public TensorOperator getOperator() {
    return op;
  }

  @Override public TensorType getType() {
    return type;
  }

  @Override public ExprKind getKind() {
    return op.kind;
  }

  @Override public List<ExprNode> getOperands() {
    return operands;
  }

  /** Returns the index operand of an index notation call. */
  public ExprMultiIndex getMultiIndex() {
    if (!isA(ExprKind.INDEX_NOTATION)) {
      throw new IllegalStateException(op + " has no index operand");
    }
    return (ExprMultiIndex) operands.get(1);
  }

  @Override public int nodeCount() {
    return nodeCount;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override List<Object> digestParts() {
    final List<Object> parts = new ArrayList<>();
    parts.add(op.getName() + "(");
    for (int i = 0; i < operands.size(); i++) {
      if (i > 0) {
        parts.add(", ");
      }
      parts.add(operands.get(i));
    }
    parts.add(op.digestSuffix() + ")");
    return parts;
  }

  @Override public String toPrettyString() {
    return op.unparse(operands);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    // Pairs of calls still to compare; an explicit stack, so that deep trees
    // do not overflow the call stack.
    final Deque<ExprCall> lefts = new ArrayDeque<>();
    final Deque<ExprCall> rights = new ArrayDeque<>();
    lefts.push(this);
    rights.push((ExprCall) o);
    while (!lefts.isEmpty()) {
      final ExprCall left = lefts.pop();
      final ExprCall right = rights.pop();
      if (left.hash != right.hash
          || !left.op.equals(right.op)
          || left.operands.size() != right.operands.size()) {
        return false;
      }
      for (int i = 0; i < left.operands.size(); i++) {
        final ExprNode x = left.operands.get(i);
        final ExprNode y = right.operands.get(i);
        if (x == y) {
          continue;
        }
        if (x instanceof ExprCall && y instanceof ExprCall) {
          lefts.push((ExprCall) x);
          rights.push((ExprCall) y);
        } else if (!x.equals(y)) {
          return false;
        }
      }
    }
    return true;
  }

  @Override public int hashCode() {
    return hash;
  }
}
