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
import org.apache.tensorform.index.Index;
import org.apache.tensorform.index.IndexBase;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Sum of an expression over all values of one of its free indices.
 *
 * <p>The result has the shape of the summand, and the index is no longer
 * free.
 */
public class TensorIndexSumOperator extends TensorOperator {
  TensorIndexSumOperator() {
    super("IndexSum", ExprKind.INDEX_SUM);
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, 2);
    final ExprNode summand = operands.get(0);
    final TensorType type = tensorType(summand);
    final ExprMultiIndex multiIndex = multiIndex(operands.get(1));
    if (multiIndex.size() != 1) {
      throw litmus.fail(ErrorKind.INDEX,
          "Expecting a single index to sum over, got ({})",
          multiIndex.toPrettyString());
    }
    final IndexBase index = multiIndex.get(0);
    if (!(index instanceof Index) || !type.hasFreeIndex((Index) index)) {
      throw litmus.fail(ErrorKind.INDEX, "Index {} is not free in {}",
          index.toPrettyString(), summand.toPrettyString());
    }
    final Map<Index, Integer> dimensions =
        new TreeMap<>(type.getIndexDimensions());
    dimensions.remove(index);
    return type.withIndexDimensions(dimensions);
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return "sum_{" + operands.get(1).toPrettyString() + "} "
        + operands.get(0).toPrettyString();
  }
}
