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

package io.metatree.service.json.shredder;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.metatree.exception.MalformedGroupException;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.AttributeEntry;
import io.metatree.node.Entry;
import io.metatree.node.GroupNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static io.metatree.service.json.serialize.GroupJsonSerializer.ATTRIBUTE;
import static io.metatree.service.json.serialize.GroupJsonSerializer.ENTRIES;
import static io.metatree.service.json.serialize.GroupJsonSerializer.GROUP;
import static io.metatree.service.json.serialize.GroupJsonSerializer.TYPE;
import static io.metatree.service.json.serialize.GroupJsonSerializer.VALUE;
import static java.util.Objects.requireNonNull;

/**
 * Reads the JSON form of a generic tree, as written by
 * {@link io.metatree.service.json.serialize.GroupJsonSerializer}, back into a {@link GroupNode}.
 * Members may appear in any order; unknown members are rejected.
 */
public final class GroupJsonShredder implements Callable<GroupNode> {

  /** Shared JsonFactory instance (thread-safe, reusable). */
  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private final Reader reader;

  /**
   * Constructor.
   *
   * @param reader the reader, not closed by the shredder
   */
  public GroupJsonShredder(final Reader reader) {
    this.reader = requireNonNull(reader);
  }

  /**
   * Parse the JSON form given as string.
   *
   * @param json the JSON document
   * @return the top-level group
   */
  public static GroupNode shred(final String json) {
    return new GroupJsonShredder(new StringReader(requireNonNull(json))).call();
  }

  /**
   * Invoking the shredder.
   *
   * @return the top-level group
   * @throws MetatreeIOException if the JSON is not well-formed
   * @throws MalformedGroupException if the JSON does not describe a generic tree
   */
  @Override
  public GroupNode call() {
    try (final JsonParser parser = JSON_FACTORY.createParser(reader)) {
      parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      final Entry entry = readEntry(parser);
      if (!(entry instanceof GroupNode tree)) {
        throw new MalformedGroupException("The top-level entry must be a group.");
      }
      if (parser.nextToken() != null) {
        throw new MalformedGroupException("Unexpected content after the top-level group.");
      }
      return tree;
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  /**
   * Read one entry; the parser is positioned on its {@code START_OBJECT}.
   */
  private static Entry readEntry(final JsonParser parser) throws IOException {
    String groupName = null;
    String attributeName = null;
    String value = null;
    String type = null;
    List<Entry> entries = null;

    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      final String member = parser.currentName();
      final JsonToken token = parser.nextToken();
      switch (member) {
        case GROUP -> groupName = readString(parser, token, member);
        case ATTRIBUTE -> attributeName = readString(parser, token, member);
        case VALUE -> value = readString(parser, token, member);
        case TYPE -> type = token == JsonToken.VALUE_NULL ? null : readString(parser, token, member);
        case ENTRIES -> entries = readEntries(parser, token);
        default -> throw new MalformedGroupException("Unexpected member '%s'.", member);
      }
    }
    expect(parser.currentToken(), JsonToken.END_OBJECT);

    if (groupName != null && attributeName == null && value == null) {
      final GroupNode.Builder group = GroupNode.newBuilder(groupName).type(type);
      if (entries != null) {
        entries.forEach(group::entry);
      }
      return group.build();
    }
    if (attributeName != null && groupName == null && entries == null) {
      if (value == null) {
        throw new MalformedGroupException("The attribute '%s' has no value.", attributeName);
      }
      return new AttributeEntry(attributeName, value, type);
    }
    throw new MalformedGroupException("An entry must be either a group or an attribute.");
  }

  private static List<Entry> readEntries(final JsonParser parser, final JsonToken token) throws IOException {
    expect(token, JsonToken.START_ARRAY);
    final List<Entry> entries = new ArrayList<>();
    JsonToken next;
    while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
      expect(next, JsonToken.START_OBJECT);
      entries.add(readEntry(parser));
    }
    return entries;
  }

  private static String readString(final JsonParser parser, final JsonToken token, final String member)
      throws IOException {
    if (token != JsonToken.VALUE_STRING) {
      throw new MalformedGroupException("The member '%s' must be a string.", member);
    }
    return parser.getText();
  }

  private static void expect(final @Nullable JsonToken actual, final JsonToken expected) {
    if (actual != expected) {
      throw new MalformedGroupException("Expected %s but found %s.", expected, actual);
    }
  }
}
