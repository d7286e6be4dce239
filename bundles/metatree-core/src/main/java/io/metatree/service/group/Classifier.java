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

package io.metatree.service.group;

import com.google.common.collect.ImmutableList;
import io.metatree.node.SourceNode;

import java.util.function.Predicate;

import static io.metatree.service.group.ClassificationTable.carriesAttributes;
import static java.util.Objects.requireNonNull;

/**
 * Decides the {@link Category} of an element. The rules are tried in order and the first match
 * wins; the last rule always matches, so classification is total.
 */
public final class Classifier {

  /** One row of the rule list. */
  private record Rule(Category category, Predicate<SourceNode> matches) {
  }

  private final ImmutableList<Rule> rules;

  /**
   * Constructor.
   *
   * @param table the naming conventions
   */
  public Classifier(final ClassificationTable table) {
    requireNonNull(table);
    rules = ImmutableList.of(
        new Rule(Category.NIL, node -> !carriesAttributes(node) && !node.hasChildren() && !node.hasText()),
        new Rule(Category.FUNDAMENTAL, node -> isFundamental(node, table)),
        new Rule(Category.PLAIN_VALUE,
            node -> node.hasText() && !carriesAttributes(node) && !node.hasChildren()
                && !table.isCompoundObject(node.getName())),
        new Rule(Category.GROUP, node -> true));
  }

  private static boolean isFundamental(final SourceNode node, final ClassificationTable table) {
    if (carriesAttributes(node) || node.hasText() || node.getChildren().size() != 1) {
      return false;
    }
    final SourceNode wrapper = node.getChildren().get(0);
    return !carriesAttributes(wrapper) && !wrapper.hasChildren() && table.isPrimitiveWrapper(wrapper.getName());
  }

  /**
   * Classify an element.
   *
   * @param node the element
   * @return its category
   */
  public Category classify(final SourceNode node) {
    requireNonNull(node);
    for (final Rule rule : rules) {
      if (rule.matches().test(node)) {
        return rule.category();
      }
    }
    throw new AssertionError("The last rule always matches.");
  }
}
