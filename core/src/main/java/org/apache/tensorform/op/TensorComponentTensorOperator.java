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
import org.apache.tensorform.index.IndexAnalysis;
import org.apache.tensorform.index.IndexAnalyzer;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tensor built from a scalar-valued expression by turning some of its free
 * indices into axes.
 *
 * <p>The result has one axis per index, with the dimension of that index,
 * and the indices are no longer free.
 */
public class TensorComponentTensorOperator extends TensorOperator {
  TensorComponentTensorOperator() {
    super("ComponentTensor", ExprKind.COMPONENT_TENSOR);
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, 2);
    final ExprNode expression = operands.get(0);
    final TensorType type = tensorType(expression);
    final ExprMultiIndex multiIndex = multiIndex(operands.get(1));
    checkArgument(multiIndex.size() > 0, "empty index tuple");
    if (!type.isScalarValued()) {
      throw litmus.fail(ErrorKind.SHAPE,
          "Expecting scalar valued expression in component tensor, "
              + "got rank {}: {}",
          type.getRank(), expression.toPrettyString());
    }
    final IndexAnalysis analysis =
        IndexAnalyzer.analyze(multiIndex.getIndices(), litmus);
    if (analysis.freeIndices.size() != multiIndex.size()) {
      throw litmus.fail(ErrorKind.INDEX,
          "Expecting distinct indices in component tensor, got ({})",
          multiIndex.toPrettyString());
    }

    final Map<Index, Integer> dimensions =
        new TreeMap<>(type.getIndexDimensions());
    final ImmutableList.Builder<Integer> shape = ImmutableList.builder();
    for (Index index : multiIndex.getIndexEntries()) {
      final Integer dimension = dimensions.remove(index);
      if (dimension == null) {
        throw litmus.fail(ErrorKind.INDEX, "Index {} is not free in {}",
            index.toPrettyString(), expression.toPrettyString());
      }
      shape.add(dimension);
    }
    return TensorType.of(shape.build(), dimensions);
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return "{ A | A_{" + operands.get(1).toPrettyString() + "} = "
        + operands.get(0).toPrettyString() + " }";
  }
}
