/**
 * Copyright (c) 2011, University of Konstanz, Distributed Systems Group All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without modification, are permitted
 * provided that the following conditions are met: * Redistributions of source code must retain the
 * above copyright notice, this list of conditions and the following disclaimer. * Redistributions
 * in binary form must reproduce the above copyright notice, this list of conditions and the
 * following disclaimer in the documentation and/or other materials provided with the distribution.
 * * Neither the name of the University of Konstanz nor the names of its contributors may be used to
 * endorse or promote products derived from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND ANY EXPRESS OR
 * IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND
 * FITNESS FOR A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING,
 * BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS;
 * OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT,
 * STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package io.metatree.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

import static java.util.Objects.requireNonNull;

/**
 * Class implements main serialization algorithm. Other classes can extend it.
 *
 * <p>
 * The tree is traversed in document order with an explicit stack of open nodes instead of
 * recursion, so arbitrarily deep trees can be written.
 * </p>
 *
 * @param <T> the node type of the tree to serialize
 */
public abstract class AbstractSerializer<T> implements Callable<Void> {

  /** Root of the subtree to serialize. */
  private final T root;

  /** Nodes whose end has not been emitted yet. */
  private final Deque<T> openNodes;

  /** Remaining children of the open nodes. */
  private final Deque<Iterator<? extends T>> pendingChildren;

  /**
   * Constructor.
   *
   * @param root root of the subtree to serialize
   */
  protected AbstractSerializer(final T root) {
    this.root = requireNonNull(root);
    openNodes = new ArrayDeque<>();
    pendingChildren = new ArrayDeque<>();
  }

  /**
   * Serialize the tree.
   *
   * @return {@code null}
   */
  @Override
  public Void call() {
    emitStartDocument();

    visit(root);
    while (!pendingChildren.isEmpty()) {
      final Iterator<? extends T> children = pendingChildren.peek();
      if (children.hasNext()) {
        visit(children.next());
      } else {
        // All children are written.
        pendingChildren.pop();
        emitEndNode(openNodes.pop());
      }
    }

    emitEndDocument();
    return null;
  }

  private void visit(final T node) {
    final List<? extends T> children = getChildren(node);
    final boolean withChildren = !children.isEmpty();
    emitNode(node, withChildren);
    if (withChildren) {
      openNodes.push(node);
      pendingChildren.push(children.iterator());
    }
  }

  /**
   * Get the number of open ancestors of the node currently emitted.
   *
   * @return the nesting level, {@code 0} for the root
   */
  protected final int getLevel() {
    return openNodes.size();
  }

  /**
   * Get the children of a node.
   *
   * @param node the node
   * @return the children in document order
   */
  protected abstract List<? extends T> getChildren(T node);

  /**
   * Emit start document.
   */
  protected abstract void emitStartDocument();

  /**
   * Emit a node. A node without children is emitted completely.
   *
   * @param node the node
   * @param withChildren determines if {@link #emitEndNode(Object)} follows after the children
   */
  protected abstract void emitNode(T node, boolean withChildren);

  /**
   * Emit end of a node with children.
   *
   * @param node the node
   */
  protected abstract void emitEndNode(T node);

  /**
   * Emit end document.
   */
  protected abstract void emitEndDocument();
}
