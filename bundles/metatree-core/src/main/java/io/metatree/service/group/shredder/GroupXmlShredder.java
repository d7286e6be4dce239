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

package io.metatree.service.group.shredder;

import io.metatree.exception.MalformedGroupException;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.AttributeEntry;
import io.metatree.node.GroupNode;
import io.metatree.service.xml.shredder.XmlShredder;
import io.metatree.settings.Constants;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.XMLConstants;
import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads a document of the generic group/attribute vocabulary into a {@link GroupNode} tree. This
 * is the structural validation boundary of the reverse direction: anything but {@code group} and
 * {@code attribute} elements with their {@code name}, {@code value} and {@code type} attributes is
 * rejected.
 */
public final class GroupXmlShredder implements Callable<GroupNode> {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(GroupXmlShredder.class);

  private static final QName NAME = new QName(Constants.NAME_ATTRIBUTE);

  private static final QName VALUE = new QName(Constants.VALUE_ATTRIBUTE);

  private static final QName TYPE = new QName(Constants.TYPE_ATTRIBUTE);

  /** {@link XMLEventReader}. */
  private final XMLEventReader reader;

  /**
   * Constructor.
   *
   * @param reader the reader, use {@link XmlShredder#createStringReader(String)} and friends; it is
   *        closed after shredding
   */
  public GroupXmlShredder(final XMLEventReader reader) {
    this.reader = checkNotNull(reader);
  }

  /**
   * Parse a document given as string.
   *
   * @param xmlString the document
   * @return the top-level group
   * @throws MetatreeIOException if the document is not well-formed
   * @throws MalformedGroupException if the document does not conform to the vocabulary
   */
  public static GroupNode shred(final String xmlString) {
    return new GroupXmlShredder(XmlShredder.createStringReader(xmlString)).call();
  }

  /**
   * Invoking the shredder.
   *
   * @return the top-level group
   * @throws MetatreeIOException if the document is not well-formed
   * @throws MalformedGroupException if the document does not conform to the vocabulary
   */
  @Override
  public GroupNode call() {
    try {
      return shred();
    } catch (final XMLStreamException e) {
      throw new MetatreeIOException(e);
    } finally {
      try {
        reader.close();
      } catch (final XMLStreamException e) {
        LOGGER.warn("Closing the XML event reader failed.", e);
      }
    }
  }

  private GroupNode shred() throws XMLStreamException {
    final Deque<GroupNode.Builder> groups = new ArrayDeque<>();
    GroupNode tree = null;
    boolean inAttribute = false;

    while (reader.hasNext() && tree == null) {
      final XMLEvent event = reader.nextEvent();

      switch (event.getEventType()) {
        case XMLStreamConstants.START_ELEMENT -> {
          final StartElement element = event.asStartElement();
          if (inAttribute) {
            throw new MalformedGroupException("An attribute must not have child elements, found '%s'.",
                element.getName());
          }
          final String kind = kindOf(element);
          if (Constants.GROUP_ELEMENT.equals(kind)) {
            checkAttributes(element, false);
            groups.push(GroupNode.newBuilder(required(element, NAME)).type(optional(element, TYPE)));
          } else {
            if (groups.isEmpty()) {
              throw new MalformedGroupException("The top-level element must be a group.");
            }
            checkAttributes(element, true);
            groups.peek()
                  .entry(new AttributeEntry(required(element, NAME), required(element, VALUE), optional(element, TYPE)));
            inAttribute = true;
          }
        }
        case XMLStreamConstants.END_ELEMENT -> {
          if (inAttribute) {
            inAttribute = false;
          } else {
            final GroupNode group = groups.pop().build();
            if (groups.isEmpty()) {
              tree = group;
            } else {
              groups.peek().entry(group);
            }
          }
        }
        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
          if (!event.asCharacters().isWhiteSpace()) {
            throw new MalformedGroupException("Unexpected text content '%s'.", event.asCharacters().getData().trim());
          }
        }
        default -> {
          // Comments, processing instructions and the like carry no content.
        }
      }
    }

    if (tree == null) {
      throw new MalformedGroupException("The document has no top-level group.");
    }
    LOGGER.debug("Read the generic tree '{}'.", tree.getName());
    return tree;
  }

  private static String kindOf(final StartElement element) {
    final QName name = element.getName();
    if (!XMLConstants.NULL_NS_URI.equals(name.getNamespaceURI())
        || !(Constants.GROUP_ELEMENT.equals(name.getLocalPart())
            || Constants.ATTRIBUTE_ELEMENT.equals(name.getLocalPart()))) {
      throw new MalformedGroupException("Unexpected element '%s'.", name);
    }
    return name.getLocalPart();
  }

  private static void checkAttributes(final StartElement element, final boolean isAttribute) {
    for (final Iterator<Attribute> it = element.getAttributes(); it.hasNext();) {
      final QName name = it.next().getName();
      if (!(NAME.equals(name) || TYPE.equals(name) || (isAttribute && VALUE.equals(name)))) {
        throw new MalformedGroupException("Unexpected attribute '%s' on '%s'.", name, element.getName());
      }
    }
  }

  private static String required(final StartElement element, final QName name) {
    final Attribute attribute = element.getAttributeByName(name);
    if (attribute == null) {
      throw new MalformedGroupException("Missing attribute '%s' on '%s'.", name, element.getName());
    }
    return attribute.getValue();
  }

  private static @Nullable String optional(final StartElement element, final QName name) {
    final Attribute attribute = element.getAttributeByName(name);
    return attribute == null ? null : attribute.getValue();
  }
}
