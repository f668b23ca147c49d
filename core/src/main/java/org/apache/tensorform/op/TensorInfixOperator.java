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

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Operator whose human-readable form places a symbol between its operands,
 * such as "(a + b)".
 */
public abstract class TensorInfixOperator extends TensorOperator {
  private final String symbol;

  protected TensorInfixOperator(String name, ExprKind kind, String symbol) {
    super(name, kind);
    this.symbol = requireNonNull(symbol, "symbol");
  }

  public String getSymbol() {
    return symbol;
  }

  @Override public String unparse(List<? extends ExprNode> operands) {
    return operands.stream().map(ExprNode::toPrettyString)
        .collect(Collectors.joining(" " + symbol + " ", "(", ")"));
  }
}
