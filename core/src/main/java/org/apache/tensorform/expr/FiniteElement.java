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

import java.util.List;

/**
 * Finite element on which an {@link ExprArgument} is defined.
 *
 * <p>Elements are supplied by the caller. The expression engine only needs
 * the shape of the values the element produces, and an identity:
 * implementations must implement {@link #equals}, {@link #hashCode} and
 * {@link #toString} consistently, because the string becomes part of the
 * canonical form of every argument defined on the element.
 */
public interface FiniteElement {
  /** Returns the shape of a value of this element; empty for a scalar
   * element. */
  List<Integer> getValueShape();
}
