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

import org.apache.tensorform.index.Index;
import org.apache.tensorform.type.TensorType;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;

/**
 * Tensor expression.
 *
 * <p>Every expression has a type, which records its shape and its free
 * indices. Some common expressions are: {@link ExprLiteral} (constant value),
 * {@link ExprSymbol} (named tensor), {@link ExprCall} (call to operator with
 * operands). Expressions are generally created using an {@link ExprBuilder}
 * factory.</p>
 *
 * <p>All sub-classes of ExprNode are immutable, and all of them live in this
 * package.</p>
 */
public abstract class ExprNode {
  //~ Instance fields --------------------------------------------------------

  // Computed on first use, and never re-set.
  private @Nullable String digest;

  //~ Constructors -----------------------------------------------------------

  ExprNode() {
  }

  //~ Methods ----------------------------------------------------------------

  public abstract TensorType getType();

  /**
   * Returns the kind of node this is.
   *
   * @return Node kind, never null
   */
  public abstract ExprKind getKind();

  public boolean isA(ExprKind kind) {
    return getKind() == kind;
  }

  public boolean isA(Collection<ExprKind> kinds) {
    return getKind().belongsTo(kinds);
  }

  /** Returns the operands; empty for a terminal. */
  public List<ExprNode> getOperands() {
    return ImmutableList.of();
  }

  public int getRank() {
    return getType().getRank();
  }

  public ImmutableList<Integer> getShape() {
    return getType().getShape();
  }

  /** Returns the free indices of this expression, in ascending order. */
  public ImmutableList<Index> getFreeIndices() {
    return getType().getFreeIndices();
  }

  /** Returns the number of nodes in this expression.
   *
   * <p>Terminals have a count of 1. Calls have a count of 1 plus the sum of
   * their operands. */
  public int nodeCount() {
    return 1;
  }

  /**
   * Accepts a visitor, dispatching to the right overloaded
   * {@link ExprVisitor#visitLiteral visitXxx} method.
   */
  public abstract <R> R accept(ExprVisitor<R> visitor);

  /** Computes the canonical form of this node. Called at most once per
   * node, modulo benign races.
   *
   * <p>Terminals override this method. Other nodes describe their canonical
   * form in {@link #digestParts()}, and this method writes it out using an
   * explicit stack, so that the depth of a tree is not limited by the depth
   * of the call stack. */
  String computeDigest() {
    final StringBuilder sb = new StringBuilder();
    final Deque<Object> work = new ArrayDeque<>();
    work.push(this);
    while (!work.isEmpty()) {
      final Object o = work.pop();
      if (!(o instanceof ExprNode)) {
        sb.append(o);
        continue;
      }
      final ExprNode node = (ExprNode) o;
      final String nodeDigest = node.digest;
      if (nodeDigest != null) {
        sb.append(nodeDigest);
        continue;
      }
      final List<Object> parts = node.digestParts();
      for (int i = parts.size() - 1; i >= 0; i--) {
        work.push(parts.get(i));
      }
    }
    return sb.toString();
  }

  /** Returns the pieces of the canonical form of this node: strings, and
   * operands whose canonical forms go in between. A terminal has a single
   * piece, its own canonical form. */
  List<Object> digestParts() {
    return ImmutableList.of(computeDigest());
  }

  /** Returns the canonical form of this expression, such as
   * "Product(Number(2), Symbol('x'))". Two expressions are equal if and only
   * if their canonical forms are equal. */
  @Override public final String toString() {
    String digest = this.digest;
    if (digest == null) {
      digest = computeDigest();
      this.digest = digest;
    }
    return digest;
  }

  /** Returns a human-readable form of this expression, such as "2 * x".
   * Different expressions may have the same pretty form.
   *
   * <p>Unlike {@link #toString()}, {@link #equals} and {@link #hashCode},
   * which do not recurse, this method recurses once per level of the tree,
   * as do visitors. */
  public abstract String toPrettyString();

  /** {@inheritDoc}
   *
   * <p>Every node must implement {@link #equals} based on its content
   */
  @Override public abstract boolean equals(@Nullable Object obj);

  /** {@inheritDoc}
   *
   * <p>Every node must implement {@link #hashCode} consistent with
   * {@link #equals}
   */
  @Override public abstract int hashCode();
}
