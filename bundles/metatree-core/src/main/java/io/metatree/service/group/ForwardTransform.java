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

import io.metatree.access.TransformConfiguration;
import io.metatree.node.GroupNode;
import io.metatree.node.NamespaceRecord;
import io.metatree.node.SourceNode;
import io.metatree.settings.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Rewrites a structured XML document into the generic group/attribute tree.
 *
 * <p>
 * The root element becomes the top-level group. Every other element is classified by the
 * {@link Classifier} and named by the {@link Namer}, except for two shapes recognized first:
 * object properties, which are collapsed into one group typed with the object's tag, and record
 * lists, whose records are each wrapped into a group keyed by a fresh token. XML attributes become
 * {@code @}-prefixed attribute entries. The namespace records of the root are appended after all
 * content of the top-level group.
 * </p>
 *
 * <p>
 * Instances are immutable. Every call of {@link #apply(SourceNode)} uses its own token generator,
 * so the output is a pure function of the input and the configuration.
 * </p>
 */
public final class ForwardTransform {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ForwardTransform.class);

  private final TransformConfiguration config;

  private final ClassificationTable table;

  private final Classifier classifier;

  private final Supplier<TokenGenerator> tokenGenerators;

  /**
   * Constructor.
   *
   * @param config the transform configuration
   */
  public ForwardTransform(final TransformConfiguration config) {
    this(config, TokenGenerator::counting);
  }

  /**
   * Constructor.
   *
   * @param config the transform configuration
   * @param tokenGenerators supplies one token generator per invocation
   */
  public ForwardTransform(final TransformConfiguration config, final Supplier<TokenGenerator> tokenGenerators) {
    this.config = requireNonNull(config);
    this.tokenGenerators = requireNonNull(tokenGenerators);
    table = new ClassificationTable(config);
    classifier = new Classifier(table);
  }

  /**
   * Transform a document.
   *
   * @param root the document root
   * @return the top-level group of the generic tree
   */
  public GroupNode apply(final SourceNode root) {
    requireNonNull(root);
    final Invocation invocation =
        new Invocation(new Namer(config.getSeparator(), requireNonNull(tokenGenerators.get())));
    final GroupNode tree = invocation.transformRoot(root);
    LOGGER.debug("Transformed '{}' into {} groups and {} attribute entries.", root.getQualifiedName(),
        invocation.groups, invocation.attributes);
    return tree;
  }

  /**
   * State of one call.
   */
  private final class Invocation {

    private final Namer namer;

    private int groups;

    private int attributes;

    Invocation(final Namer namer) {
      this.namer = namer;
    }

    GroupNode transformRoot(final SourceNode root) {
      final GroupNode.Builder group = GroupNode.newBuilder(root.getQualifiedName());
      final Namer.Siblings siblings = namer.newSiblings();
      fillGroup(root, group, siblings, true);
      for (final NamespaceRecord record : NamespaceRecorder.record(root)) {
        group.entry(record.toGroup());
        siblings.fixed(Constants.NAMESPACE_RECORD_PREFIX + record.getPosition());
      }
      groups++;
      return group.build();
    }

    /**
     * Emit the attributes, text and children of an element into the group standing for it.
     */
    private void fillGroup(final SourceNode node, final GroupNode.Builder group, final Namer.Siblings siblings,
        final boolean isRoot) {
      if (!isRoot) {
        // Bindings of the root are recorded as namespace records instead.
        for (final Map.Entry<String, String> binding : node.getNamespaces().entrySet()) {
          final String declaration = binding.getKey().isEmpty()
              ? Constants.XMLNS
              : Constants.XMLNS + ":" + binding.getKey();
          addAttribute(group, siblings.fixed(Constants.ATTRIBUTE_MARKER + declaration), binding.getValue(), null);
        }
      }
      for (final Map.Entry<QName, String> attribute : node.getAttributes().entrySet()) {
        addAttribute(group, siblings.fixed(Constants.ATTRIBUTE_MARKER + SourceNode.qualifiedName(attribute.getKey())),
            attribute.getValue(), null);
      }
      if (node.hasText()) {
        addAttribute(group, siblings.fixed(Constants.VALUE_ENTRY), node.getText(), null);
      }

      if (table.isRecordList(node)) {
        for (final SourceNode record : node.getChildren()) {
          final GroupNode.Builder wrapper =
              GroupNode.newBuilder(namer.freshName(siblings, Constants.RECORD_WRAPPER_NAME))
                       .type(Constants.RECORD_WRAPPER_TYPE);
          emitChild(record, wrapper, namer.newSiblings());
          group.entry(wrapper.build());
          groups++;
        }
      } else {
        for (final SourceNode child : node.getChildren()) {
          emitChild(child, group, siblings);
        }
      }

      if (group.isEmpty()) {
        addNilMarker(group, siblings);
      }
    }

    /**
     * Emit a child element into the group of its parent.
     */
    private void emitChild(final SourceNode node, final GroupNode.Builder parent, final Namer.Siblings siblings) {
      if (table.isRecordList(node)) {
        // Records are wrapped whatever shape the single record has.
        final GroupNode.Builder group = GroupNode.newBuilder(namer.name(siblings, node.getQualifiedName()));
        fillGroup(node, group, namer.newSiblings(), false);
        parent.entry(group.build());
        groups++;
        return;
      }

      final Optional<SourceNode> object = table.objectOf(node);
      if (object.isPresent()) {
        // The property is the role under which the object is emitted.
        final GroupNode.Builder group = GroupNode.newBuilder(namer.name(siblings, node.getQualifiedName()))
                                                 .type(object.get().getQualifiedName());
        fillGroup(object.get(), group, namer.newSiblings(), false);
        parent.entry(group.build());
        groups++;
        return;
      }

      final String name = namer.name(siblings, node.getQualifiedName());
      switch (classifier.classify(node)) {
        case NIL -> {
          final GroupNode.Builder group = GroupNode.newBuilder(name);
          addNilMarker(group, namer.newSiblings());
          parent.entry(group.build());
          groups++;
        }
        case FUNDAMENTAL -> {
          final SourceNode wrapper = node.getChildren().get(0);
          addAttribute(parent, name, wrapper.getText(), wrapper.getQualifiedName());
        }
        case PLAIN_VALUE -> addAttribute(parent, name, node.getText(), null);
        case GROUP -> {
          final GroupNode.Builder group = GroupNode.newBuilder(name);
          fillGroup(node, group, namer.newSiblings(), false);
          parent.entry(group.build());
          groups++;
        }
        default -> throw new AssertionError();
      }
    }

    private void addNilMarker(final GroupNode.Builder group, final Namer.Siblings siblings) {
      addAttribute(group, siblings.fixed(Constants.NIL_REASON_ENTRY), Constants.NIL_REASON_UNKNOWN, null);
    }

    private void addAttribute(final GroupNode.Builder group, final String name, final String value,
        final String type) {
      group.attribute(name, value, type);
      attributes++;
    }
  }
}
