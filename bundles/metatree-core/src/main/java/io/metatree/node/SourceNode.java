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

package io.metatree.node;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Immutable element of a structured XML document: a namespace-qualified tag name, its attributes,
 * the namespace declarations made on the element, its element children in document order and its
 * direct text content.
 *
 * <p>
 * Text content is stored trimmed. Whitespace-only text is therefore empty, which is what makes
 * indentation insignificant for the transforms. Two nodes are equal if their names (including
 * prefixes), attributes, namespace declarations, text and children are equal; the order of
 * attributes and namespace declarations is irrelevant.
 * </p>
 */
public final class SourceNode {

  /** The tag name. */
  private final QName name;

  /** Attributes, order irrelevant. */
  private final ImmutableMap<QName, String> attributes;

  /** Namespace declarations made on this element, prefix to URI, in document order. */
  private final ImmutableMap<String, String> namespaces;

  /** Element children in document order. */
  private final ImmutableList<SourceNode> children;

  /** Trimmed direct text content, never {@code null}. */
  private final String text;

  private SourceNode(final Builder builder) {
    name = builder.name;
    attributes = ImmutableMap.copyOf(builder.attributes);
    namespaces = ImmutableMap.copyOf(builder.namespaces);
    children = ImmutableList.copyOf(builder.children);
    text = builder.text.toString().trim();
  }

  /**
   * Get a new builder for an element.
   *
   * @param name the tag name
   * @return a new builder instance
   */
  public static Builder newBuilder(final QName name) {
    return new Builder(name);
  }

  /**
   * Get a new builder for an element without namespace.
   *
   * @param localName the local name of the tag
   * @return a new builder instance
   */
  public static Builder newBuilder(final String localName) {
    return new Builder(new QName(localName));
  }

  public QName getName() {
    return name;
  }

  /**
   * Get the tag name as written in the document, that is {@code prefix:localName} or just the local
   * name if the element is unprefixed.
   *
   * @return the qualified tag name
   */
  public String getQualifiedName() {
    return qualifiedName(name);
  }

  public ImmutableMap<QName, String> getAttributes() {
    return attributes;
  }

  public ImmutableMap<String, String> getNamespaces() {
    return namespaces;
  }

  public ImmutableList<SourceNode> getChildren() {
    return children;
  }

  public String getText() {
    return text;
  }

  public boolean hasAttributes() {
    return !attributes.isEmpty();
  }

  public boolean hasNamespaces() {
    return !namespaces.isEmpty();
  }

  public boolean hasChildren() {
    return !children.isEmpty();
  }

  public boolean hasText() {
    return !text.isEmpty();
  }

  /**
   * Get the tag of a qualified name as written in a document.
   *
   * @param name the name
   * @return {@code prefix:localName}, or the local name if there is no prefix
   */
  public static String qualifiedName(final QName name) {
    requireNonNull(name);
    return name.getPrefix().isEmpty() ? name.getLocalPart() : name.getPrefix() + ":" + name.getLocalPart();
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof SourceNode other)) {
      return false;
    }
    return name.equals(other.name) && name.getPrefix().equals(other.name.getPrefix())
        && attributes.equals(other.attributes) && namespaces.equals(other.namespaces) && text.equals(other.text)
        && children.equals(other.children);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, attributes, namespaces, text, children);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", getQualifiedName())
                      .add("attributes", attributes)
                      .add("namespaces", namespaces)
                      .add("text", text)
                      .add("children", children.size())
                      .toString();
  }

  /**
   * Builder to build a {@link SourceNode} instance.
   */
  public static final class Builder {

    private final QName name;

    private final Map<QName, String> attributes = new LinkedHashMap<>();

    private final Map<String, String> namespaces = new LinkedHashMap<>();

    private final List<SourceNode> children = new ArrayList<>();

    private final StringBuilder text = new StringBuilder();

    /**
     * Constructor.
     *
     * @param name the tag name
     */
    private Builder(final QName name) {
      this.name = requireNonNull(name);
    }

    public QName getName() {
      return name;
    }

    /**
     * Add an attribute. A later attribute with the same name replaces an earlier one.
     *
     * @param attributeName name of the attribute
     * @param value value of the attribute
     * @return this builder instance
     */
    public Builder attribute(final QName attributeName, final String value) {
      attributes.put(requireNonNull(attributeName), requireNonNull(value));
      return this;
    }

    /**
     * Add an attribute without namespace.
     *
     * @param localName local name of the attribute
     * @param value value of the attribute
     * @return this builder instance
     */
    public Builder attribute(final String localName, final String value) {
      return attribute(new QName(localName), value);
    }

    /**
     * Declare a namespace on this element.
     *
     * @param prefix the prefix, empty for the default namespace
     * @param uri the namespace URI
     * @return this builder instance
     */
    public Builder namespace(final String prefix, final String uri) {
      namespaces.put(requireNonNull(prefix), requireNonNull(uri));
      return this;
    }

    /**
     * Append a child element.
     *
     * @param child the child
     * @return this builder instance
     */
    public Builder child(final SourceNode child) {
      children.add(requireNonNull(child));
      return this;
    }

    /**
     * Append text content. Consecutive chunks are concatenated, the result is trimmed once the node
     * is built.
     *
     * @param content the text to append
     * @return this builder instance
     */
    public Builder text(final String content) {
      text.append(requireNonNull(content));
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link SourceNode} instance
     */
    public SourceNode build() {
      checkArgument(!name.getLocalPart().isEmpty(), "Element name must not be empty!");
      return new SourceNode(this);
    }
  }
}
