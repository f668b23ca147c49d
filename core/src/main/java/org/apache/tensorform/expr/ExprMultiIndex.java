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

import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.type.TensorType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tuple of index tokens, used as the index operand of
 * {@link ExprKind#INDEXED}, {@link ExprKind#COMPONENT_TENSOR},
 * {@link ExprKind#INDEX_SUM} and {@link ExprKind#SPATIAL_DERIVATIVE} calls.
 *
 * <p>Its type is {@link TensorType#INDEX_TUPLE}; a multi-index is not a
 * tensor and cannot be an operand of an algebraic operator.
 */
public class ExprMultiIndex extends ExprNode {
  private final ImmutableList<IndexBase> indices;

  ExprMultiIndex(List<? extends IndexBase> indices) {
    this.indices = ImmutableList.copyOf(indices);
  }

  public ImmutableList<IndexBase> getIndices() {
    return indices;
  }

  public int size() {
    return indices.size();
  }

  public IndexBase get(int i) {
    return indices.get(i);
  }

  /** Returns the {@link Index} entries of this tuple, in tuple order. */
  public ImmutableList<Index> getIndexEntries() {
    final ImmutableList.Builder<Index> b = ImmutableList.builder();
    for (IndexBase index : indices) {
      if (index instanceof Index) {
        b.add((Index) index);
      }
    }
    return b.build();
  }

  @Override public TensorType getType() {
    return TensorType.INDEX_TUPLE;
  }

  @Override public ExprKind getKind() {
    return ExprKind.MULTI_INDEX;
  }

  @Override public <R> R accept(ExprVisitor<R> visitor) {
    return visitor.visitMultiIndex(this);
  }

  @Override String computeDigest() {
    return indices.stream().map(IndexBase::toString)
        .collect(Collectors.joining(", ", "MultiIndex(", ")"));
  }

  @Override public String toPrettyString() {
    return indices.stream().map(IndexBase::toPrettyString)
        .collect(Collectors.joining(", "));
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof ExprMultiIndex
        && indices.equals(((ExprMultiIndex) obj).indices);
  }

  @Override public int hashCode() {
    return indices.hashCode();
  }
}
