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

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Test or trial function of a form, defined on a {@link FiniteElement}.
 *
 * <p>The number distinguishes arguments of the same element: by convention
 * 0 is the test function and 1 the trial function.
 */
public class ExprArgument extends ExprNode {
  private final FiniteElement element;
  private final int number;
  private final TensorType type;

  ExprArgument(FiniteElement element, int number) {
    this.element = requireNonNull(element, "element");
    checkArgument(number >= 0, "negative argument number %s", number);
    this.number = number;
    this.type = TensorType.of(element.getValueShape());
  }

  public FiniteElement getElement() {
    return element;
  }

  public int getNumber() {
    return number;
  }

  @Override public TensorType getType() {
    return type;
  }

  @Override public ExprKind getKind() {
    return ExprKind.ARGUMENT;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitArgument(this);
  }

  @Override String computeDigest() {
    return "Argument(" + element + ", " + number + ")";
  }

  @Override public String toPrettyString() {
    return "v_" + number;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprArgument
        && number == ((ExprArgument) obj).number
        && element.equals(((ExprArgument) obj).element);
  }

  @Override public int hashCode() {
    return Objects.hash(element, number);
  }
}
