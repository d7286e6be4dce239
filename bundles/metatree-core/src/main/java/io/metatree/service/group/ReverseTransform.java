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
import io.metatree.exception.MalformedGroupException;
import io.metatree.node.AttributeEntry;
import io.metatree.node.Entry;
import io.metatree.node.GroupNode;
import io.metatree.node.NamespaceRecord;
import io.metatree.node.SourceNode;
import io.metatree.settings.Constants;
import io.metatree.utils.XMLToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Rebuilds the structured XML document from a generic group/attribute tree, relying only on the
 * naming and marking conventions of the {@link ForwardTransform}.
 *
 * <p>
 * Namespace records are collected once, up front, and declared on the rebuilt root. Everywhere
 * else they are skipped. Disambiguation suffixes are stripped at the first separator; the name of
 * the top-level group is taken as is.
 * </p>
 */
public final class ReverseTransform {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(ReverseTransform.class);

  private final String separator;

  /**
   * Constructor.
   *
   * @param config the transform configuration
   */
  public ReverseTransform(final TransformConfiguration config) {
    separator = requireNonNull(config).getSeparator();
  }

  /**
   * Rebuild a document.
   *
   * @param tree the top-level group of the generic tree
   * @return the document root
   * @throws MalformedGroupException if a name does not denote a qualified XML name
   */
  public SourceNode apply(final GroupNode tree) {
    requireNonNull(tree);
    final Map<String, String> rootBindings = NamespaceRecorder.toBindings(NamespaceRecorder.collect(tree));
    LOGGER.debug("Declaring {} namespace bindings on the root '{}'.", rootBindings.size(), tree.getName());
    return rebuildElement(tree.getName(), tree, rootBindings, new HashMap<>());
  }

  /**
   * Rebuild the element standing for a group.
   *
   * @param tag the qualified tag of the element
   * @param group the group holding the content of the element
   * @param declared namespaces declared on the element in addition to its own {@code @xmlns} entries
   * @param outerScope the bindings in scope at the parent
   */
  private SourceNode rebuildElement(final String tag, final GroupNode group, final Map<String, String> declared,
      final Map<String, String> outerScope) {
    final Map<String, String> declarations = new LinkedHashMap<>(declared);
    declarations.putAll(declarationsOf(group));
    final Map<String, String> scope = new HashMap<>(outerScope);
    scope.putAll(declarations);

    final SourceNode.Builder builder = SourceNode.newBuilder(resolve(tag, scope, false));
    declarations.forEach(builder::namespace);
    fillElement(group, builder, scope);
    return builder.build();
  }

  /**
   * Rebuild the attributes, text and children of an element from the entries of a group.
   */
  private void fillElement(final GroupNode group, final SourceNode.Builder builder, final Map<String, String> scope) {
    for (final Entry entry : group.getEntries()) {
      switch (entry.getKind()) {
        case ATTRIBUTE -> fillFromAttribute((AttributeEntry) entry, builder, scope);
        case GROUP -> fillFromGroup((GroupNode) entry, builder, scope);
        default -> throw new AssertionError();
      }
    }
  }

  private void fillFromAttribute(final AttributeEntry entry, final SourceNode.Builder builder,
      final Map<String, String> scope) {
    final String name = entry.getName();
    if (name.startsWith(Constants.ATTRIBUTE_MARKER)) {
      final String attributeName = name.substring(Constants.ATTRIBUTE_MARKER.length());
      if (!isDeclaration(attributeName)) {
        builder.attribute(resolve(attributeName, scope, true), entry.getValue());
      }
    } else if (Constants.VALUE_ENTRY.equals(name)) {
      builder.text(entry.getValue());
    } else if (Constants.NIL_REASON_ENTRY.equals(name) && Constants.NIL_REASON_UNKNOWN.equals(entry.getValue())) {
      // Nil marker, the element stays empty.
      LOGGER.trace("Nil marker in '{}'.", builder.getName());
    } else {
      final SourceNode.Builder element = SourceNode.newBuilder(resolve(strip(name), scope, false));
      final String type = entry.getType();
      if (type == null) {
        element.text(entry.getValue());
      } else {
        element.child(SourceNode.newBuilder(resolve(type, scope, false)).text(entry.getValue()).build());
      }
      builder.child(element.build());
    }
  }

  private void fillFromGroup(final GroupNode group, final SourceNode.Builder builder,
      final Map<String, String> scope) {
    if (NamespaceRecord.isRecordName(group.getName())) {
      return;
    }
    final String type = group.getType();
    if (type == null) {
      builder.child(rebuildElement(strip(group.getName()), group, Map.of(), scope));
    } else if (Constants.RECORD_WRAPPER_TYPE.equals(type)) {
      fillElement(group, builder, scope);
    } else {
      // Object property: the group is named by the property and typed with the object.
      builder.child(SourceNode.newBuilder(resolve(strip(group.getName()), scope, false))
                              .child(rebuildElement(type, group, Map.of(), scope))
                              .build());
    }
  }

  private String strip(final String name) {
    return Namer.baseName(name, separator);
  }

  private static boolean isDeclaration(final String attributeName) {
    return Constants.XMLNS.equals(attributeName) || attributeName.startsWith(Constants.XMLNS + ":");
  }

  /**
   * Get the namespace declarations carried as {@code @xmlns} entries of a group.
   */
  private static Map<String, String> declarationsOf(final GroupNode group) {
    final Map<String, String> declarations = new LinkedHashMap<>();
    for (final AttributeEntry attribute : group.getAttributes()) {
      final String name = attribute.getName();
      if (!name.startsWith(Constants.ATTRIBUTE_MARKER)) {
        continue;
      }
      final String attributeName = name.substring(Constants.ATTRIBUTE_MARKER.length());
      if (Constants.XMLNS.equals(attributeName)) {
        declarations.put(XMLConstants.DEFAULT_NS_PREFIX, attribute.getValue());
      } else if (attributeName.startsWith(Constants.XMLNS + ":")) {
        declarations.put(attributeName.substring(Constants.XMLNS.length() + 1), attribute.getValue());
      }
    }
    return declarations;
  }

  /**
   * Resolve a qualified name against the bindings in scope.
   *
   * @param qualifiedName the name, {@code prefix:localName} or just the local name
   * @param scope the bindings in scope
   * @param isAttribute unprefixed attribute names are never in the default namespace
   * @return the resolved name, without namespace URI if the prefix is unbound
   */
  private static QName resolve(final String qualifiedName, final Map<String, String> scope,
      final boolean isAttribute) {
    if (!XMLToken.isQName(qualifiedName)) {
      throw new MalformedGroupException("'%s' is no qualified XML name.", qualifiedName);
    }
    final int colon = qualifiedName.indexOf(':');
    final String prefix = colon == -1 ? XMLConstants.DEFAULT_NS_PREFIX : qualifiedName.substring(0, colon);
    final String localName = qualifiedName.substring(colon + 1);
    if (prefix.isEmpty()) {
      return isAttribute
          ? new QName(localName)
          : new QName(scope.getOrDefault(prefix, XMLConstants.NULL_NS_URI), localName);
    }
    if (XMLConstants.XML_NS_PREFIX.equals(prefix)) {
      return new QName(XMLConstants.XML_NS_URI, localName, prefix);
    }
    final String uri = scope.get(prefix);
    if (uri == null) {
      LOGGER.warn("The prefix '{}' of '{}' is not bound to a namespace.", prefix, qualifiedName);
      return new QName(XMLConstants.NULL_NS_URI, localName, prefix);
    }
    return new QName(uri, localName, prefix);
  }
}
