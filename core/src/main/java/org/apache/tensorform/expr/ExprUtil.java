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
import org.apache.tensorform.util.Util;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Collection;

/**
 * Utility methods concerning tensor expressions.
 */
public class ExprUtil {
  private ExprUtil() {
  }

  /**
   * Returns whether an expression occurs within a tree, either as the tree
   * itself or as a descendant. A node matches if it is the same object as
   * {@code item} or is structurally equal to it.
   *
   * @param tree Tree to search
   * @param item Expression to look for
   * @return Whether the item was found
   */
  public static boolean contains(ExprNode tree, ExprNode item) {
    if (tree.nodeCount() < item.nodeCount()) {
      return false;
    }
    try {
      tree.accept(new ExprFinder(item));
      return false;
    } catch (Util.FoundOne e) {
      return true;
    }
  }

  /** Returns the total number of nodes in a list of expressions. */
  public static int nodeCount(Collection<? extends ExprNode> nodes) {
    int n = 0;
    for (ExprNode node : nodes) {
      n += node.nodeCount();
    }
    return n;
  }

  /** Returns every index that occurs in a tree, free or bound, in
   * ascending order. */
  public static ImmutableSortedSet<Index> allIndices(ExprNode tree) {
    final ImmutableSortedSet.Builder<Index> b =
        ImmutableSortedSet.naturalOrder();
    tree.accept(
        new ExprVisitorImpl<Void>(true) {
          @Override public Void visitMultiIndex(ExprMultiIndex multiIndex) {
            b.addAll(multiIndex.getIndexEntries());
            return null;
          }

          @Override public Void visitZero(ExprZero zero) {
            b.addAll(zero.getFreeIndices());
            return null;
          }
        });
    return b.build();
  }

  /** Returns whether an expression is a true scalar: rank 0 and no free
   * indices. */
  public static boolean isTrueScalar(ExprNode node) {
    return node.getType().isTrueScalar();
  }

  /** Visitor that throws {@link Util.FoundOne} when it meets a node equal to
   * a given expression. */
  private static class ExprFinder extends ExprVisitorImpl<Void> {
    private final ExprNode item;

    ExprFinder(ExprNode item) {
      super(true);
      this.item = item;
    }

    private void check(ExprNode node) {
      if (node == item || node.equals(item)) {
        throw new Util.FoundOne(node);
      }
    }

    @Override public Void visitLiteral(ExprLiteral literal) {
      check(literal);
      return null;
    }

    @Override public Void visitZero(ExprZero zero) {
      check(zero);
      return null;
    }

    @Override public Void visitSymbol(ExprSymbol symbol) {
      check(symbol);
      return null;
    }

    @Override public Void visitArgument(ExprArgument argument) {
      check(argument);
      return null;
    }

    @Override public Void visitVariable(ExprVariable variable) {
      check(variable);
      return super.visitVariable(variable);
    }

    @Override public Void visitMultiIndex(ExprMultiIndex multiIndex) {
      check(multiIndex);
      return null;
    }

    @Override public Void visitCall(ExprCall call) {
      check(call);
      return super.visitCall(call);
    }
  }
}
