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
package org.apache.tensorform.index;

/**
 * Element of an index tuple.
 *
 * <p>There are exactly three kinds: {@link Index} (a named free or bound
 * index), {@link FixedIndex} (a concrete integer component) and
 * {@link AxisIndex} (an unassigned axis). The constructor is package-private,
 * so the family is closed.
 *
 * <p>{@link #toString()} returns the canonical form, which takes part in the
 * digest of expressions; {@link #toPrettyString()} is for humans.
 */
public abstract class IndexBase {
  IndexBase() {
  }

  /** Returns a human-readable form, for example "i_3", "0" or ":". */
  public abstract String toPrettyString();

  @Override public abstract String toString();
}
