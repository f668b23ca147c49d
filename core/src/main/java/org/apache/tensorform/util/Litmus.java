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
package org.apache.tensorform.util;

import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.runtime.TensorException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

/**
 * Callback to be called when a legality check fails.
 *
 * <p>A failed check must abort the construction in progress. Implementations
 * either throw, or return the exception for the caller to throw:
 *
 * <blockquote><pre>
 * if (!type.isTrueScalar()) {
 *   throw litmus.fail(ErrorKind.SHAPE, "Division by non-scalar {}", b);
 * }</pre></blockquote>
 *
 * <p>Either way, no partially built node escapes.
 */
public interface Litmus {
  /** Implementation of {@link Litmus} that throws the exception. */
  Litmus THROW = (kind, message, args) -> {
    throw kind.ex(format(message, args));
  };

  /** Implementation of {@link Litmus} that logs the violation at WARN level
   * and then throws the exception. */
  Litmus LOG_AND_THROW = new Litmus() {
    private final Logger logger = LoggerFactory.getLogger(Litmus.class);

    @Override public TensorException fail(ErrorKind kind, String message,
        @Nullable Object... args) {
      final String s = format(message, args);
      logger.warn("{} violation: {}", kind, s);
      throw kind.ex(s);
    }
  };

  /** Called when a check fails. Never completes normally from the point of
   * view of the caller: it either throws, or returns an exception that the
   * caller throws.
   *
   * @param kind Classification of the violation
   * @param message Message, with "{}" placeholders
   * @param args Arguments
   */
  TensorException fail(ErrorKind kind, String message, @Nullable Object... args);

  /** Checks a condition. If the condition is false, calls {@link #fail}
   * and throws the result. */
  default void check(boolean condition, ErrorKind kind, String message,
      @Nullable Object... args) {
    if (!condition) {
      throw fail(kind, message, args);
    }
  }

  /** Formats a message in SLF4J style. */
  static String format(String message, @Nullable Object... args) {
    return MessageFormatter.arrayFormat(message, args).getMessage();
  }
}
