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

package io.metatree.service.group.serialize;

import com.google.common.collect.ImmutableList;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.AttributeEntry;
import io.metatree.node.Entry;
import io.metatree.node.EntryKind;
import io.metatree.node.GroupNode;
import io.metatree.service.AbstractSerializer;
import io.metatree.settings.CharsForSerializing;
import io.metatree.settings.Constants;
import io.metatree.utils.XMLToken;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Serializes a generic tree into the generic group/attribute vocabulary, UTF-8 encoded:
 *
 * <pre>
 * &lt;group name="a"&gt;
 *   &lt;group name="b"&gt;
 *     &lt;attribute name="@x" value="1"/&gt;
 *   &lt;/group&gt;
 * &lt;/group&gt;
 * </pre>
 */
public final class GroupXmlSerializer extends AbstractSerializer<Entry> {

  /** OutputStream to write to. */
  private final OutputStream out;

  /** Indent output. */
  private final boolean indent;

  /** Serialize XML declaration. */
  private final boolean serializeXMLDeclaration;

  private GroupXmlSerializer(final Builder builder) {
    super(builder.tree);
    out = new BufferedOutputStream(builder.stream, 4096);
    indent = builder.indent;
    serializeXMLDeclaration = builder.declaration;
  }

  @Override
  protected List<? extends Entry> getChildren(final Entry entry) {
    return entry.getKind() == EntryKind.GROUP ? ((GroupNode) entry).getEntries() : ImmutableList.of();
  }

  @Override
  protected void emitStartDocument() {
    try {
      if (serializeXMLDeclaration) {
        out.write(CharsForSerializing.XML_DECLARATION.getBytes());
        newLine();
      }
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected void emitNode(final Entry entry, final boolean withChildren) {
    try {
      indent();
      switch (entry.getKind()) {
        case GROUP -> {
          out.write(CharsForSerializing.OPEN_GROUP.getBytes());
          writeNameAndType(entry);
          out.write(withChildren ? CharsForSerializing.CLOSE.getBytes() : CharsForSerializing.SLASH_CLOSE.getBytes());
        }
        case ATTRIBUTE -> {
          out.write(CharsForSerializing.OPEN_ATTRIBUTE.getBytes());
          out.write(CharsForSerializing.NAME_EQUAL_QUOTE.getBytes());
          write(XMLToken.escapeAttribute(entry.getName()));
          out.write(CharsForSerializing.QUOTE.getBytes());
          out.write(CharsForSerializing.VALUE_EQUAL_QUOTE.getBytes());
          write(XMLToken.escapeAttribute(((AttributeEntry) entry).getValue()));
          out.write(CharsForSerializing.QUOTE.getBytes());
          writeType(entry);
          out.write(CharsForSerializing.SLASH_CLOSE.getBytes());
        }
        default -> throw new AssertionError();
      }
      newLine();
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  private void writeNameAndType(final Entry entry) throws IOException {
    out.write(CharsForSerializing.NAME_EQUAL_QUOTE.getBytes());
    write(XMLToken.escapeAttribute(entry.getName()));
    out.write(CharsForSerializing.QUOTE.getBytes());
    writeType(entry);
  }

  private void writeType(final Entry entry) throws IOException {
    if (entry.hasType()) {
      out.write(CharsForSerializing.TYPE_EQUAL_QUOTE.getBytes());
      write(XMLToken.escapeAttribute(entry.getType()));
      out.write(CharsForSerializing.QUOTE.getBytes());
    }
  }

  @Override
  protected void emitEndNode(final Entry entry) {
    try {
      indent();
      out.write(CharsForSerializing.CLOSE_GROUP.getBytes());
      newLine();
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

  private void indent() throws IOException {
    if (indent) {
      for (int i = 0; i < getLevel(); i++) {
        out.write(CharsForSerializing.SPACE.getBytes());
        out.write(CharsForSerializing.SPACE.getBytes());
      }
    }
  }

  private void newLine() throws IOException {
    if (indent) {
      out.write(CharsForSerializing.NEWLINE.getBytes());
    }
  }

  private void write(final String value) throws IOException {
    out.write(value.getBytes(Constants.DEFAULT_ENCODING));
  }

  /**
   * Get a new builder.
   *
   * @param tree the top-level group
   * @param stream {@link OutputStream} to write to, not closed by the serializer
   * @return a new builder instance
   */
  public static Builder newBuilder(final GroupNode tree, final OutputStream stream) {
    return new Builder(tree, stream);
  }

  /**
   * Builder to setup the {@link GroupXmlSerializer}.
   */
  public static final class Builder {

    private final GroupNode tree;

    private final OutputStream stream;

    private boolean indent;

    private boolean declaration;

    private Builder(final GroupNode tree, final OutputStream stream) {
      this.tree = checkNotNull(tree);
      this.stream = checkNotNull(stream);
    }

    /**
     * Pretty prints the output.
     *
     * @return this builder instance
     */
    public Builder prettyPrint() {
      indent = true;
      return this;
    }

    /**
     * Emit the XML declaration.
     *
     * @return this builder instance
     */
    public Builder emitXMLDeclaration() {
      declaration = true;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link GroupXmlSerializer} instance
     */
    public GroupXmlSerializer build() {
      return new GroupXmlSerializer(this);
    }
  }
}
