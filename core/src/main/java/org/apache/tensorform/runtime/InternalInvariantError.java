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
 * Thrown when an internal consistency check of the engine fails.
 *
 * <p>Unlike {@link TensorException}, this does not mean that the user built an
 * illegal expression; it means the engine has a bug. It is never routed
 * through a {@link org.apache.tensorform.util.Litmus} and should not be
 * caught.
 */
public class InternalInvariantError extends AssertionError {
  private static final long serialVersionUID = 1L;

  public InternalInvariantError(String message) {
    super(message);
  }
}
