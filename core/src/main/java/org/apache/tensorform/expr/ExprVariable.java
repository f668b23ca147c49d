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

import org.apache.tensorform.type.TensorType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Labelled alias for a sub-expression.
 *
 * <p>A variable has the type of the expression it labels. Two variables are
 * equal if they have the same label and equal expressions.
 */
public class ExprVariable extends ExprNode {
  private final String label;
  private final ExprNode expression;

  ExprVariable(String label, ExprNode expression) {
    this.label = requireNonNull(label, "label");
    this.expression = requireNonNull(expression, "expression");
    checkArgument(!expression.getType().isIndexTuple(),
        "cannot label an index tuple");
  }

  public String getLabel() {
    return label;
  }

  public ExprNode getExpression() {
    return expression;
  }

  @Override public TensorType getType() {
    return expression.getType();
  }

  @Override public ExprKind getKind() {
    return ExprKind.VARIABLE;
  }

  @Override public List<ExprNode> getOperands() {
    return ImmutableList.of(expression);
  }

  @Override public int nodeCount() {
    return 1 + expression.nodeCount();
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitVariable(this);
  }

  @Override List<Object> digestParts() {
    return ImmutableList.of("Variable('" + label + "', ", expression, ")");
  }

  @Override public String toPrettyString() {
    return label;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprVariable
        && label.equals(((ExprVariable) obj).label)
        && expression.equals(((ExprVariable) obj).expression);
  }

  @Override public int hashCode() {
    return Objects.hash(label, expression);
  }
}
