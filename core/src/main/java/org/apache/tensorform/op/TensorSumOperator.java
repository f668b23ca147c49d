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
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Sum of two or more tensors.
 *
 * <p>All operands must have the same shape and the same free indices; the
 * result has the type of the first operand.
 */
public class TensorSumOperator extends TensorInfixOperator {
  TensorSumOperator() {
    super("Sum", ExprKind.SUM, "+");
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, Integer.MAX_VALUE);
    final ExprNode first = operands.get(0);
    final TensorType type = tensorType(first);
    for (ExprNode operand : operands.subList(1, operands.size())) {
      final TensorType type2 = tensorType(operand);
      if (type2.getRank() != type.getRank()) {
        throw litmus.fail(ErrorKind.SHAPE,
            "Can't add expressions with different ranks: {} has rank {}, "
                + "{} has rank {}",
            first.toPrettyString(), type.getRank(),
            operand.toPrettyString(), type2.getRank());
      }
      if (!type2.getShape().equals(type.getShape())) {
        throw litmus.fail(ErrorKind.SHAPE,
            "Can't add expressions with different shapes: {} and {}",
            type.getShape(), type2.getShape());
      }
      if (!type2.getFreeIndices().equals(type.getFreeIndices())) {
        throw litmus.fail(ErrorKind.INDEX,
            "Can't add expressions with different free indices: {} and {}",
            type.getFreeIndices(), type2.getFreeIndices());
      }
      TensorType.mergeIndexDimensions(litmus,
          ImmutableList.of(type.getIndexDimensions(), type2.getIndexDimensions()));
    }
    return type;
  }
}
