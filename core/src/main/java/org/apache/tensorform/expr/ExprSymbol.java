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
 * Named tensor of a given shape, such as a coefficient or a constant
 * matrix. A symbol has no free indices.
 */
public class ExprSymbol extends ExprNode {
  private final String name;
  private final TensorType type;

  ExprSymbol(String name, TensorType type) {
    this.name = requireNonNull(name, "name");
    this.type = requireNonNull(type, "type");
    checkArgument(!name.isEmpty(), "empty symbol name");
    checkArgument(type.getFreeIndices().isEmpty() && !type.isIndexTuple(),
        "symbol type must be a plain shape: %s", type);
  }

  public String getName() {
    return name;
  }

  @Override public TensorType getType() {
    return type;
  }

  @Override public ExprKind getKind() {
    return ExprKind.SYMBOL;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitSymbol(this);
  }

  @Override String computeDigest() {
    if (type.getRank() == 0) {
      return "Symbol('" + name + "')";
    }
    return "Symbol('" + name + "', " + type.getShape() + ")";
  }

  @Override public String toPrettyString() {
    return name;
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprSymbol
        && name.equals(((ExprSymbol) obj).name)
        && type.equals(((ExprSymbol) obj).type);
  }

  @Override public int hashCode() {
    return Objects.hash(name, type);
  }
}
