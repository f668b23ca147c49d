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
package org.apache.tensorform.type;

/**
 * Enumeration of the kinds of {@link TensorType}.
 */
public enum TensorTypeName {
  /** Tensor value: a shape plus a set of free indices. A scalar is a tensor
   * of rank 0. */
  TENSOR,

  /** Type of an index tuple operand, such as the indices of an Indexed
   * expression. An index tuple has no value of its own. */
  INDEX_TUPLE
}
