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

/**
 * Visitor pattern for traversing a tree of {@link ExprNode} objects.
 *
 * <p>There is one method per concrete sub-class of {@link ExprNode}; because
 * the family is closed, a visitor handles every kind of expression.
 *
 * @see ExprVisitorImpl
 *
 * @param <R> Return type
 */
public interface ExprVisitor<R> {
  //~ Methods ----------------------------------------------------------------

  R visitLiteral(ExprLiteral literal);

  R visitZero(ExprZero zero);

  R visitSymbol(ExprSymbol symbol);

  R visitArgument(ExprArgument argument);

  R visitVariable(ExprVariable variable);

  R visitMultiIndex(ExprMultiIndex multiIndex);

  R visitCall(ExprCall call);
}
