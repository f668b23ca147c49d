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

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Tensor all of whose components are zero.
 *
 * <p>A zero carries a full type, including free indices, so that it can
 * stand in for the expression it replaces.
 */
public class ExprZero extends ExprNode {
  private final TensorType type;

  ExprZero(TensorType type) {
    this.type = requireNonNull(type, "type");
    checkArgument(!type.isIndexTuple(), "zero cannot be an index tuple");
  }

  @Override public TensorType getType() {
    return type;
  }

  @Override public ExprKind getKind() {
    return ExprKind.ZERO;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitZero(this);
  }

  @Override String computeDigest() {
    return "Zero(" + type.getShape() + ", " + type.getIndexDimensions() + ")";
  }

  @Override public String toPrettyString() {
    return "0";
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprZero
        && type.equals(((ExprZero) obj).type);
  }

  @Override public int hashCode() {
    return type.hashCode();
  }
}
