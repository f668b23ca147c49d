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

import java.util.List;

/**
 * Binary operator that is only defined on true scalars, such as power and
 * remainder.
 */
public class TensorScalarInfixOperator extends TensorInfixOperator {
  TensorScalarInfixOperator(String name, ExprKind kind, String symbol) {
    super(name, kind, symbol);
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 2, 2);
    for (ExprNode operand : operands) {
      if (!tensorType(operand).isTrueScalar()) {
        throw litmus.fail(ErrorKind.SHAPE,
            "{} of non-scalar expression is undefined: {}", getName(),
            operand.toPrettyString());
      }
    }
    return TensorType.SCALAR;
  }
}
