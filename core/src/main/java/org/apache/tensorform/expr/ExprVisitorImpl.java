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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Default implementation of {@link ExprVisitor}, which visits each node but
 * does nothing while it's there.
 *
 * @param <R> Return type from each {@code visitXxx} method.
 */
public class ExprVisitorImpl<@Nullable R> implements ExprVisitor<R> {
  //~ Instance fields --------------------------------------------------------

  protected final boolean deep;

  //~ Constructors -----------------------------------------------------------

  protected ExprVisitorImpl(boolean deep) {
    this.deep = deep;
  }

  //~ Methods ----------------------------------------------------------------

  @Override public R visitLiteral(ExprLiteral literal) {
    return null;
  }

  @Override public R visitZero(ExprZero zero) {
    return null;
  }

  @Override public R visitSymbol(ExprSymbol symbol) {
    return null;
  }

  @Override public R visitArgument(ExprArgument argument) {
    return null;
  }

  @Override public R visitVariable(ExprVariable variable) {
    if (!deep) {
      return null;
    }
    return variable.getExpression().accept(this);
  }

  @Override public R visitMultiIndex(ExprMultiIndex multiIndex) {
    return null;
  }

  @Override public R visitCall(ExprCall call) {
    if (!deep) {
      return null;
    }

    R r = null;
    for (ExprNode operand : call.operands) {
      r = operand.accept(this);
    }
    return r;
  }
}
