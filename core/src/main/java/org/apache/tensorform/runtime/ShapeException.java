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
package org.apache.tensorform.runtime;

/**
 * Thrown when the rank or shape of an operand is incompatible with the
 * operator being built; for example, adding a vector to a matrix, or dividing
 * by an expression that is not a true scalar.
 */
public class ShapeException extends TensorException {
  private static final long serialVersionUID = 1L;

  public ShapeException(String message) {
    super(message);
  }

  @Override public ErrorKind getKind() {
    return ErrorKind.SHAPE;
  }
}
