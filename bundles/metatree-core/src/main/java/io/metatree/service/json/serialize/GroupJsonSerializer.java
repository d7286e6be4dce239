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

package io.metatree.service.json.serialize;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.google.common.collect.ImmutableList;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.AttributeEntry;
import io.metatree.node.Entry;
import io.metatree.node.EntryKind;
import io.metatree.node.GroupNode;
import io.metatree.service.AbstractSerializer;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Serializes a generic tree as JSON. Every group is an object with the members {@code group},
 * {@code type} (if present) and {@code entries}; every attribute entry an object with the members
 * {@code attribute}, {@code value} and {@code type} (if present). The entries keep their order, so
 * groups and attributes stay interleaved as in the tree.
 */
public final class GroupJsonSerializer extends AbstractSerializer<Entry> {

  /** Member holding the name of a group. */
  public static final String GROUP = "group";

  /** Member holding the name of an attribute entry. */
  public static final String ATTRIBUTE = "attribute";

  /** Member holding the value of an attribute entry. */
  public static final String VALUE = "value";

  /** Member holding the optional type. */
  public static final String TYPE = "type";

  /** Member holding the entries of a group. */
  public static final String ENTRIES = "entries";

  /** Shared JsonFactory instance (thread-safe, reusable). */
  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private final JsonGenerator generator;

  /**
   * Constructor.
   *
   * @param tree the top-level group
   * @param writer the writer to write to, not closed by the serializer
   * @param prettyPrint determines if the output is indented
   */
  public GroupJsonSerializer(final GroupNode tree, final Writer writer, final boolean prettyPrint) {
    super(tree);
    requireNonNull(writer);
    try {
      generator = JSON_FACTORY.createGenerator(writer);
      generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (prettyPrint) {
        generator.useDefaultPrettyPrinter();
      }
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected List<? extends Entry> getChildren(final Entry entry) {
    return entry.getKind() == EntryKind.GROUP ? ((GroupNode) entry).getEntries() : ImmutableList.of();
  }

  @Override
  protected void emitStartDocument() {
    // The top-level group is the document.
  }

  @Override
  protected void emitNode(final Entry entry, final boolean withChildren) {
    try {
      generator.writeStartObject();
      if (entry.getKind() == EntryKind.GROUP) {
        generator.writeStringField(GROUP, entry.getName());
        writeType(entry);
        generator.writeArrayFieldStart(ENTRIES);
        if (!withChildren) {
          generator.writeEndArray();
          generator.writeEndObject();
        }
      } else {
        generator.writeStringField(ATTRIBUTE, entry.getName());
        generator.writeStringField(VALUE, ((AttributeEntry) entry).getValue());
        writeType(entry);
        generator.writeEndObject();
      }
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  private void writeType(final Entry entry) throws IOException {
    if (entry.hasType()) {
      generator.writeStringField(TYPE, entry.getType());
    }
  }

  @Override
  protected void emitEndNode(final Entry entry) {
    try {
      generator.writeEndArray();
      generator.writeEndObject();
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  @Override
  protected void emitEndDocument() {
    try {
      generator.close();
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }
}
