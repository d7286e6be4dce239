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

package io.metatree.service.xml.serialize;

import io.metatree.exception.MetatreeIOException;
import io.metatree.node.SourceNode;
import io.metatree.service.AbstractSerializer;
import io.metatree.settings.CharsForSerializing;
import io.metatree.settings.Constants;
import io.metatree.utils.XMLToken;
import org.checkerframework.checker.index.qual.NonNegative;

import javax.xml.namespace.QName;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <h1>XmlSerializer</h1>
 *
 * <p>
 * Most efficient way to serialize a {@link SourceNode} tree into an OutputStream. The encoding
 * always is UTF-8. Note that the OutputStream internally is wrapped by a BufferedOutputStream.
 * There is no need to buffer it again outside of this class.
 * </p>
 */
public final class XmlSerializer extends AbstractSerializer<SourceNode> {

  /** OutputStream to write to. */
  private final OutputStream out;

  /** Indent output. */
  private final boolean indent;

  /** Serialize XML declaration. */
  private final boolean serializeXMLDeclaration;

  /** Number of spaces to indent. */
  private final int indentSpaces;

  /**
   * Private constructor.
   *
   * @param builder builder of XML Serializer
   */
  private XmlSerializer(final XmlSerializerBuilder builder) {
    super(builder.root);
    out = new BufferedOutputStream(builder.stream, 4096);
    indent = builder.indent;
    serializeXMLDeclaration = builder.declaration;
    indentSpaces = builder.indentSpaces;
  }

  @Override
  protected List<SourceNode> getChildren(final SourceNode node) {
    return node.getChildren();
  }

  @Override
  protected void emitStartDocument() {
    try {
      if (serializeXMLDeclaration) {
        out.write(CharsForSerializing.XML_DECLARATION.getBytes());
        if (indent) {
          out.write(CharsForSerializing.NEWLINE.getBytes());
        }
      }
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected void emitNode(final SourceNode node, final boolean withChildren) {
    try {
      indent();
      out.write(CharsForSerializing.OPEN.getBytes());
      write(node.getQualifiedName());

      // Emit namespace declarations.
      for (final Map.Entry<String, String> namespace : node.getNamespaces().entrySet()) {
        if (namespace.getKey().isEmpty()) {
          out.write(CharsForSerializing.XMLNS.getBytes());
        } else {
          out.write(CharsForSerializing.XMLNS_COLON.getBytes());
          write(namespace.getKey());
          out.write(CharsForSerializing.EQUAL_QUOTE.getBytes());
        }
        write(XMLToken.escapeAttribute(namespace.getValue()));
        out.write(CharsForSerializing.QUOTE.getBytes());
      }

      // Emit attributes.
      for (final Map.Entry<QName, String> attribute : node.getAttributes().entrySet()) {
        out.write(CharsForSerializing.SPACE.getBytes());
        write(SourceNode.qualifiedName(attribute.getKey()));
        out.write(CharsForSerializing.EQUAL_QUOTE.getBytes());
        write(XMLToken.escapeAttribute(attribute.getValue()));
        out.write(CharsForSerializing.QUOTE.getBytes());
      }

      if (!withChildren && !node.hasText()) {
        out.write(CharsForSerializing.SLASH_CLOSE.getBytes());
        newLine();
        return;
      }

      out.write(CharsForSerializing.CLOSE.getBytes());
      write(XMLToken.escapeContent(node.getText()));
      if (withChildren) {
        newLine();
      } else {
        writeEndTag(node);
      }
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected void emitEndNode(final SourceNode node) {
    try {
      indent();
      writeEndTag(node);
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected void emitEndDocument() {
    try {
      out.flush();
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  private void writeEndTag(final SourceNode node) throws IOException {
    out.write(CharsForSerializing.OPEN_SLASH.getBytes());
    write(node.getQualifiedName());
    out.write(CharsForSerializing.CLOSE.getBytes());
    newLine();
  }

  /**
   * Indentation of output.
   *
   * @throws IOException if can't indent output
   */
  private void indent() throws IOException {
    if (indent) {
      for (int i = 0, spaces = getLevel() * indentSpaces; i < spaces; i++) {
        out.write(CharsForSerializing.SPACE.getBytes());
      }
    }
  }

  private void newLine() throws IOException {
    if (indent) {
      out.write(CharsForSerializing.NEWLINE.getBytes());
    }
  }

  /**
   * Write characters of string.
   *
   * @param value value to write
   * @throws IOException if can't write to string
   */
  private void write(final String value) throws IOException {
    out.write(value.getBytes(Constants.DEFAULT_ENCODING));
  }

  /**
   * Constructor, setting the necessary stuff.
   *
   * @param root the document root
   * @param stream {@link OutputStream} to write to, not closed by the serializer
   * @return a new builder instance
   */
  public static XmlSerializerBuilder newBuilder(final SourceNode root, final OutputStream stream) {
    return new XmlSerializerBuilder(root, stream);
  }

  /**
   * XmlSerializerBuilder to setup the XmlSerializer.
   */
  public static final class XmlSerializerBuilder {

    /** Intermediate boolean for indendation, not necessary. */
    private boolean indent;

    /** Intermediate boolean for serializing the XML declaration, not necessary. */
    private boolean declaration;

    /** Intermediate number of spaces to indent. */
    private int indentSpaces = 2;

    /** Stream to pipe to. */
    private final OutputStream stream;

    /** Root of the tree to write. */
    private final SourceNode root;

    private XmlSerializerBuilder(final SourceNode root, final OutputStream stream) {
      this.root = checkNotNull(root);
      this.stream = checkNotNull(stream);
    }

    /**
     * Pretty prints the output.
     *
     * @return this builder instance
     */
    public XmlSerializerBuilder prettyPrint() {
      indent = true;
      return this;
    }

    /**
     * Specify the number of spaces to indent with (default: 2).
     *
     * @param indentSpaces number of spaces
     * @return this builder instance
     */
    public XmlSerializerBuilder indentSpaces(final @NonNegative int indentSpaces) {
      checkArgument(indentSpaces >= 0, "Indentation must not be negative!");
      this.indentSpaces = indentSpaces;
      return this;
    }

    /**
     * Specify if the XML declaration should be emitted.
     *
     * @return this builder instance
     */
    public XmlSerializerBuilder emitXMLDeclaration() {
      declaration = true;
      return this;
    }

    /**
     * Building new {@link XmlSerializer} instance.
     *
     * @return a new instance
     */
    public XmlSerializer build() {
      return new XmlSerializer(this);
    }
  }
}
