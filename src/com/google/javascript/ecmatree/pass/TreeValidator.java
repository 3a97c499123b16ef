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

import com.google.javascript.ecmatree.ast.Node;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * This class walks a syntax tree and validates that it is really a tree: every present child
 * names the node that lists it as its parent, and no node is reachable twice.
 */
public final class TreeValidator {

  private static final Logger logger = Logger.getLogger(TreeValidator.class.getName());

  /** Violation handler */
  public interface ViolationHandler {
    void handleViolation(String message, Node n);
  }

  private final ViolationHandler violationHandler;

  public TreeValidator(ViolationHandler handler) {
    this.violationHandler = checkNotNull(handler);
  }

  /** Creates a validator that throws {@link IllegalStateException} on the first violation. */
  public TreeValidator() {
    this(
        new ViolationHandler() {
          @Override
          public void handleViolation(String message, Node n) {
            Node parent = n.getParent();
            throw new IllegalStateException(
                message
                    + ". Reference node:\n"
                    + n.toStringTree()
                    + "\n Parent node:\n"
                    + ((parent != null) ? parent.toStringTree() : " no parent "));
          }
        });
  }

  /**
   * Validates the subtree under {@code root}. The root's own parent link is not checked, so a
   * subtree of a larger tree can be validated on its own.
   */
  public void validate(Node root) {
    Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    validateBranch(root, null, seen);
  }

  private void validateBranch(Node n, @Nullable Node expectedParent, Set<Node> seen) {
    if (!seen.add(n)) {
      violation("Node reachable more than once", n);
      return;
    }
    if (expectedParent != null && n.getParent() != expectedParent) {
      violation("Parent link does not match the node holding this child: " + expectedParent, n);
    }
    for (Node child : n.presentChildren()) {
      validateBranch(child, n, seen);
    }
  }

  private void violation(String message, Node n) {
    logger.log(Level.FINE, "Tree violation at {0}: {1}", new Object[] {n, message});
    violationHandler.handleViolation(message, n);
  }
}
