/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.ecmatree.pass;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ecmatree.ast.FunctionNode;
import com.google.javascript.ecmatree.ast.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * NodeTraversal walks a syntax tree depth first, left to right, skipping absent children.
 *
 * <p>The children of a node are snapshotted before they are visited, so a callback may replace
 * the node it is looking at (or any of its siblings) without disturbing the walk. Replacement
 * nodes spliced in during the walk are not visited.
 */
public final class NodeTraversal {

  private static final Logger logger = Logger.getLogger(NodeTraversal.class.getName());

  private final Callback callback;

  /** Function nodes enclosing the current node, innermost first. */
  private final Deque<FunctionNode> functions = new ArrayDeque<>();

  private @Nullable Node currentNode;
  private int visited;

  /** Callback for tree-based traversals */
  public interface Callback {
    /**
     * Visits a node in preorder (before its children) and decides whether its children should be
     * traversed. If this returns false, neither the children nor the node itself are passed to
     * {@link #visit}.
     */
    boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent);

    /** Visits a node in postorder (after its children). */
    void visit(NodeTraversal t, Node n, @Nullable Node parent);
  }

  /** Abstract callback to visit all nodes in postorder. */
  public abstract static class AbstractPostOrderCallback implements Callback {
    @Override
    public final boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
      return true;
    }
  }

  /** Abstract callback to visit all nodes in preorder. */
  public abstract static class AbstractPreOrderCallback implements Callback {
    @Override
    public final void visit(NodeTraversal t, Node n, @Nullable Node parent) {}
  }

  public NodeTraversal(Callback callback) {
    this.callback = checkNotNull(callback);
  }

  /** Traverses a tree rooted at {@code root}, which need not be a {@code Program}. */
  public static void traverse(Node root, Callback cb) {
    new NodeTraversal(cb).traverse(root);
  }

  /** Returns every node under {@code root}, root included, in preorder. */
  public static ImmutableList<Node> preOrder(Node root) {
    ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    traverse(
        root,
        new AbstractPreOrderCallback() {
          @Override
          public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
            nodes.add(n);
            return true;
          }
        });
    return nodes.build();
  }

  public void traverse(Node root) {
    checkNotNull(root);
    visited = 0;
    functions.clear();
    traverseBranch(root, root.getParent());
    currentNode = null;
    logger.log(Level.FINEST, "Traversed {0} nodes under {1}", new Object[] {visited, root});
  }

  private void traverseBranch(Node n, @Nullable Node parent) {
    currentNode = n;
    visited++;
    if (!callback.shouldTraverse(this, n, parent)) {
      return;
    }

    boolean isFunction = n instanceof FunctionNode;
    if (isFunction) {
      functions.push((FunctionNode) n);
    }
    traverseChildren(n);
    if (isFunction) {
      functions.pop();
    }

    currentNode = n;
    callback.visit(this, n, parent);
  }

  private void traverseChildren(Node n) {
    // children() is a snapshot; replacements made by the callback do not shift it.
    List<@Nullable Node> children = n.children();
    for (Node child : children) {
      if (child != null) {
        traverseBranch(child, n);
      }
    }
  }

  /** Returns the node currently being visited. */
  public @Nullable Node getCurrentNode() {
    return currentNode;
  }

  /**
   * Returns the innermost function whose parameters or body contain the current node, or null at
   * the top level. A function node is not its own enclosing function.
   */
  public @Nullable FunctionNode getEnclosingFunction() {
    return functions.peek();
  }
}
