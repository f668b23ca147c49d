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
 * Marker for an unassigned axis; the result of a complete slice ({@code :})
 * or of expanding an ellipsis.
 *
 * <p>There is only one instance, {@link #AXIS}, so it may be compared using
 * {@code ==}.
 */
public final class AxisIndex extends IndexBase {
  /** The axis marker. */
  public static final AxisIndex AXIS = new AxisIndex();

  private AxisIndex() {
  }

  @Override public String toPrettyString() {
    return ":";
  }

  @Override public String toString() {
    return "Axis";
  }
}
