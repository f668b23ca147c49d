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

import org.apache.tensorform.config.TensorSystemProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all legality violations raised while building a tensor
 * expression.
 *
 * <p>A violation is permanent: the engine never retries or recovers, and no
 * partially built expression is returned to the caller.
 *
 * @see ShapeException
 * @see IndexException
 */
public abstract class TensorException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private static final Logger LOGGER =
      LoggerFactory.getLogger(TensorException.class);

  /**
   * Creates a TensorException.
   *
   * @param message error message
   */
  protected TensorException(String message) {
    super(message);
    LOGGER.trace("TensorException", this);
    if (TensorSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }

  /** Returns the classification of this violation. */
  public abstract ErrorKind getKind();
}
