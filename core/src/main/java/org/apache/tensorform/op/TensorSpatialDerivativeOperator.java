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
import org.apache.tensorform.index.AxisIndex;
import org.apache.tensorform.index.FixedIndex;
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexAnalyzer;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Derivative of an expression with respect to one spatial coordinate.
 *
 * <p>The coordinate is given by a fixed index, or by an index that becomes
 * free in the result and ranges over the spatial dimension of this
 * operator. The shape of the result is the shape of the operand. If the
 * index is already free in the operand, the derivative holds a pending
 * contraction, and the index remains listed once among the free indices.
 */
public class TensorSpatialDerivativeOperator extends TensorOperator {
  private final int dimension;

  TensorSpatialDerivativeOperator(int dimension) {
    super("SpatialDerivative", ExprKind.SPATIAL_DERIVATIVE);
    checkArgument(dimension > 0, "non-positive spatial dimension %s",
        dimension);
    this.dimension = dimension;
  }

  /** Returns the number of spatial coordinates. */
  public int getDimension() {
    return dimension;
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, 2);
    final ExprNode expression = operands.get(0);
    final TensorType type = tensorType(expression);
    final ExprMultiIndex multiIndex = multiIndex(operands.get(1));
    checkArgument(multiIndex.size() == 1,
        "expecting a single derivative index, got %s", multiIndex);
    final IndexBase index = multiIndex.get(0);
    checkIndex(litmus, index);
    if (index instanceof FixedIndex) {
      return type;
    }
    IndexAnalyzer.analyze(
        ImmutableList.<IndexBase>builder().add(index)
            .addAll(type.getFreeIndices()).build(),
        litmus);
    return type.withIndexDimensions(
        TensorType.mergeIndexDimensions(litmus,
            ImmutableList.of(type.getIndexDimensions(),
                ImmutableMap.of((Index) index, dimension))));
  }

  /** Checks that an index can be a derivative index in this space: it must
   * not be a whole axis, and a fixed index must be less than the
   * dimension. */
  public void checkIndex(Litmus litmus, IndexBase index) {
    if (index == AxisIndex.AXIS) {
      throw litmus.fail(ErrorKind.INDEX,
          "Can't take partial derivative w.r.t. whole axis");
    }
    if (index instanceof FixedIndex) {
      final int value = ((FixedIndex) index).getValue();
      if (value >= dimension) {
        throw litmus.fail(ErrorKind.INDEX,
            "Fixed derivative index {} out of range for spatial dimension {}",
            value, dimension);
      }
    }
  }

  /** {@inheritDoc}
   *
   * <p>The canonical form includes the spatial dimension, because derivatives
   * in spaces of different dimension are different expressions. */
  @Override public String digestSuffix() {
    return ", dim=" + dimension;
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return "d[" + operands.get(0).toPrettyString() + "]/dx_"
        + operands.get(1).toPrettyString();
  }

  @Override public boolean equals(@Nullable Object obj) {
    return super.equals(obj)
        && dimension == ((TensorSpatialDerivativeOperator) obj).dimension;
  }

  @Override public int hashCode() {
    return super.hashCode() * 31 + dimension;
  }
}
