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
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexAnalyzer;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Product of two or more tensors.
 *
 * <p>Legal combinations, folded from left to right, are a scalar times
 * anything, anything times a scalar, (m&times;n)&middot;(n&times;p) giving
 * (m&times;p), and (m&times;n)&middot;(n) giving (m).
 *
 * <p>The free indices of the product are the union of the free indices of
 * its operands. An index that is free in two operands is a pending
 * contraction; it remains listed once until an enclosing index sum removes
 * it. The product never inserts that sum itself.
 */
public class TensorProductOperator extends TensorInfixOperator {
  TensorProductOperator() {
    super("Product", ExprKind.PRODUCT, "*");
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, Integer.MAX_VALUE);
    List<Integer> shape = ImmutableList.of();
    final List<Map<Index, Integer>> dimensions = new ArrayList<>();
    final List<Index> indices = new ArrayList<>();
    for (ExprNode operand : operands) {
      final TensorType type = tensorType(operand);
      shape = productShape(litmus, shape, type.getShape());
      dimensions.add(type.getIndexDimensions());
      indices.addAll(type.getFreeIndices());
    }
    IndexAnalyzer.analyze(indices, litmus);
    return TensorType.of(shape,
        TensorType.mergeIndexDimensions(litmus, dimensions));
  }

  /** Returns the shape of the product of tensors of two shapes. */
  static List<Integer> productShape(Litmus litmus, List<Integer> shape1,
      List<Integer> shape2) {
    if (shape1.isEmpty()) {
      return shape2;
    }
    if (shape2.isEmpty()) {
      return shape1;
    }
    if (shape1.size() != 2 || shape2.size() > 2) {
      throw litmus.fail(ErrorKind.SHAPE,
          "Invalid combination of tensor ranks in product: {} and {}", shape1.size(),
          shape2.size());
    }
    if (!shape1.get(1).equals(shape2.get(0))) {
      throw litmus.fail(ErrorKind.SHAPE,
          "Dimension mismatch in product of shapes {} and {}", shape1,
          shape2);
    }
    return shape2.size() == 1
        ? ImmutableList.of(shape1.get(0))
        : ImmutableList.of(shape1.get(0), shape2.get(1));
  }
}
