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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.math.BigDecimal;

import static java.util.Objects.requireNonNull;

/**
 * Constant numeric value.
 *
 * <p>The value is held exactly, as a {@link BigDecimal}. Two literals are
 * equal only if their values have the same scale, so {@code 2} and
 * {@code 2.0} are different literals.
 */
public class ExprLiteral extends ExprNode {
  private final BigDecimal value;

  ExprLiteral(BigDecimal value) {
    this.value = requireNonNull(value, "value");
  }

  public BigDecimal getValue() {
    return value;
  }

  /** Returns whether this literal is numerically zero, at any scale. */
  public boolean isZero() {
    return value.signum() == 0;
  }

  @Override public TensorType getType() {
    return TensorType.SCALAR;
  }

  @Override public ExprKind getKind() {
    return ExprKind.LITERAL;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitLiteral(this);
  }

  @Override String computeDigest() {
    return "Number(" + value.toPlainString() + ")";
  }

  @Override public String toPrettyString() {
    return value.toPlainString();
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprLiteral
        && value.equals(((ExprLiteral) obj).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }
}
