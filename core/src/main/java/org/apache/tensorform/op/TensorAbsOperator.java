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
import org.apache.tensorform.type.TensorType;
import org.apache.tensorform.util.Litmus;

import java.util.List;

/**
 * Absolute value. The result has the type of the operand.
 */
public class TensorAbsOperator extends TensorOperator {
  TensorAbsOperator() {
    super("Abs", ExprKind.ABS);
  }

  @Override public TensorType deriveType(Litmus litmus,
      List<? extends ExprNode> operands) {
    checkOperandCount(operands, 1, 1);
    return tensorType(operands.get(0));
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return "|" + operands.get(0).toPrettyString() + "|";
  }
}
