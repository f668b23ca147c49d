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
 * Classification of a construction-time legality violation.
 *
 * <p>Defects in the engine itself are not classified here; they are raised as
 * {@link InternalInvariantError}.
 */
public enum ErrorKind {
  /** Rank or shape incompatible with the requested operator. */
  SHAPE,

  /** Illegal index pattern. */
  INDEX,

  /** Restriction to a side that is neither "+" nor "-". */
  RESTRICTION;

  /** Creates the exception that reports a violation of this kind. */
  public TensorException ex(String message) {
    switch (this) {
    case SHAPE:
      return new ShapeException(message);
    case INDEX:
      return new IndexException(message);
    case RESTRICTION:
      return new RestrictionException(message);
    default:
      throw new AssertionError(this);
    }
  }
}
