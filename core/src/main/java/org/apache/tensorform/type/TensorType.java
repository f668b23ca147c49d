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

import org.apache.tensorform.index.Index;
import org.apache.tensorform.runtime.ErrorKind;
import org.apache.tensorform.util.Litmus;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Type of a tensor expression.
 *
 * <p>A type consists of a shape, the ordered list of dimension sizes (whose
 * length is the rank), and the free indices of the expression together with
 * the dimension each index ranges over. Free indices are kept in ascending
 * order of count.
 *
 * <p>Types are immutable and compared by value.
 */
public final class TensorType {
  /** Type of a scalar with no free indices. */
  public static final TensorType SCALAR =
      new TensorType(TensorTypeName.TENSOR, ImmutableList.of(),
          ImmutableSortedMap.of());

  /** Type of an index tuple. */
  public static final TensorType INDEX_TUPLE =
      new TensorType(TensorTypeName.INDEX_TUPLE, ImmutableList.of(),
          ImmutableSortedMap.of());

  private final TensorTypeName typeName;
  private final ImmutableList<Integer> shape;
  private final ImmutableSortedMap<Index, Integer> indexDimensions;

  private TensorType(TensorTypeName typeName, ImmutableList<Integer> shape,
      ImmutableSortedMap<Index, Integer> indexDimensions) {
    this.typeName = requireNonNull(typeName, "typeName");
    this.shape = requireNonNull(shape, "shape");
    this.indexDimensions = requireNonNull(indexDimensions, "indexDimensions");
    for (int d : shape) {
      checkArgument(d > 0, "non-positive dimension in shape %s", shape);
    }
    for (int d : indexDimensions.values()) {
      checkArgument(d > 0, "non-positive index dimension in %s",
          indexDimensions);
    }
  }

  /** Creates a tensor type with a given shape and no free indices. */
  public static TensorType of(List<Integer> shape) {
    return of(shape, ImmutableSortedMap.of());
  }

  /** Creates a tensor type with a given shape and free indices. */
  public static TensorType of(List<Integer> shape,
      Map<Index, Integer> indexDimensions) {
    if (shape.isEmpty() && indexDimensions.isEmpty()) {
      return SCALAR;
    }
    return new TensorType(TensorTypeName.TENSOR, ImmutableList.copyOf(shape),
        ImmutableSortedMap.copyOf(indexDimensions));
  }

  /** Creates a tensor type with the given dimensions and no free indices. */
  public static TensorType of(int... shape) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int d : shape) {
      b.add(d);
    }
    return of(b.build());
  }

  /**
   * Merges the index dimensions of several types into one map.
   *
   * <p>An index that occurs in more than one map must have the same dimension
   * in each.
   *
   * @param litmus What to do if the dimensions of an index disagree
   * @param maps   Maps from index to dimension
   * @return Merged map
   */
  public static ImmutableSortedMap<Index, Integer> mergeIndexDimensions(
      Litmus litmus, Iterable<? extends Map<Index, Integer>> maps) {
    final Map<Index, Integer> merged = new TreeMap<>();
    for (Map<Index, Integer> map : maps) {
      for (Map.Entry<Index, Integer> e : map.entrySet()) {
        final Integer previous = merged.putIfAbsent(e.getKey(), e.getValue());
        if (previous != null && !previous.equals(e.getValue())) {
          throw litmus.fail(ErrorKind.INDEX,
              "Index {} has dimension {} in one operand and {} in another",
              e.getKey().toPrettyString(), previous, e.getValue());
        }
      }
    }
    return ImmutableSortedMap.copyOf(merged);
  }

  public TensorTypeName getTypeName() {
    return typeName;
  }

  /** Returns whether this is the type of an index tuple. */
  public boolean isIndexTuple() {
    return typeName == TensorTypeName.INDEX_TUPLE;
  }

  public ImmutableList<Integer> getShape() {
    return shape;
  }

  public int getRank() {
    return shape.size();
  }

  /** Returns the dimension of the {@code i}th axis. */
  public int getDimension(int i) {
    return shape.get(i);
  }

  /** Returns the free indices, in ascending order. */
  public ImmutableList<Index> getFreeIndices() {
    return indexDimensions.keySet().asList();
  }

  /** Returns the map from each free index to its dimension. */
  public ImmutableSortedMap<Index, Integer> getIndexDimensions() {
    return indexDimensions;
  }

  /** Returns the dimension of a free index, or null if the index is not
   * free in this type. */
  public @Nullable Integer getIndexDimension(Index index) {
    return indexDimensions.get(index);
  }

  public boolean hasFreeIndex(Index index) {
    return indexDimensions.containsKey(index);
  }

  /** Returns whether values of this type are scalars, possibly with free
   * indices. */
  public boolean isScalarValued() {
    return typeName == TensorTypeName.TENSOR && shape.isEmpty();
  }

  /** Returns whether values of this type represent a single scalar value:
   * rank 0 and no free indices. This is the only definition of "true scalar"
   * used by operators. */
  public boolean isTrueScalar() {
    return isScalarValued() && indexDimensions.isEmpty();
  }

  /** Returns a type with the same free indices and a different shape. */
  public TensorType withShape(List<Integer> shape) {
    return of(shape, indexDimensions);
  }

  /** Returns a type with the same shape and different free indices. */
  public TensorType withIndexDimensions(Map<Index, Integer> indexDimensions) {
    return of(shape, indexDimensions);
  }

  @Override public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof TensorType
        && typeName == ((TensorType) obj).typeName
        && shape.equals(((TensorType) obj).shape)
        && indexDimensions.equals(((TensorType) obj).indexDimensions);
  }

  @Override public int hashCode() {
    return Objects.hash(typeName, shape, indexDimensions);
  }

  /** Returns a string such as "[3, 3]{i_1: 2}". */
  @Override public String toString() {
    if (isIndexTuple()) {
      return "INDEX_TUPLE";
    }
    final StringBuilder sb = new StringBuilder();
    sb.append(shape);
    if (!indexDimensions.isEmpty()) {
      sb.append('{');
      int i = 0;
      for (Map.Entry<Index, Integer> e : indexDimensions.entrySet()) {
        if (i++ > 0) {
          sb.append(", ");
        }
        sb.append(e.getKey().toPrettyString()).append(": ").append(e.getValue());
      }
      sb.append('}');
    }
    return sb.toString();
  }
}
