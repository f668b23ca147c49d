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
import com.google.common.collect.Iterables;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Component of a tensor, selected by an index tuple with one entry per axis.
 *
 * <p>A fixed entry selects one component along its axis; an {@link Index}
 * entry becomes a free index whose dimension is that of its axis; an
 * {@link AxisIndex#AXIS} entry keeps the axis, so the rank of the result is
 * the number of axis entries.
 */
public class TensorIndexedOperator extends TensorOperator {
  TensorIndexedOperator() {
    super("Indexed", ExprKind.INDEXED);
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, 2);
    final ExprNode expression = operands.get(0);
    final TensorType type = tensorType(expression);
    final ExprMultiIndex multiIndex = multiIndex(operands.get(1));
    if (multiIndex.size() != type.getRank()) {
      throw litmus.fail(ErrorKind.INDEX,
          "Invalid number of indices ({}) for tensor expression of rank {}: {}",
          multiIndex.size(), type.getRank(), expression.toPrettyString());
    }
    IndexAnalyzer.analyze(
        ImmutableList.copyOf(
            Iterables.concat(type.getFreeIndices(), multiIndex.getIndices())),
        litmus);

    final ImmutableList.Builder<Integer> shape = ImmutableList.builder();
    final List<Map<Index, Integer>> dimensions = new ArrayList<>();
    dimensions.add(type.getIndexDimensions());
    for (int i = 0; i < multiIndex.size(); i++) {
      final IndexBase index = multiIndex.get(i);
      final int dimension = type.getDimension(i);
      if (index instanceof FixedIndex) {
        final int value = ((FixedIndex) index).getValue();
        if (value >= dimension) {
          throw litmus.fail(ErrorKind.INDEX,
              "Fixed index {} out of range for axis {} of dimension {}",
              value, i, dimension);
        }
      } else if (index instanceof Index) {
        dimensions.add(ImmutableMap.of((Index) index, dimension));
      } else {
        shape.add(dimension);
      }
    }
    return TensorType.of(shape.build(),
        TensorType.mergeIndexDimensions(litmus, dimensions));
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return operands.get(0).toPrettyString()
        + "[" + operands.get(1).toPrettyString() + "]";
  }
}
