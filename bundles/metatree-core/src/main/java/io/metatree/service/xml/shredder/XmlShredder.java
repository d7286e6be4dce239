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

package io.metatree.service.xml.shredder;

import io.metatree.exception.MetatreeIOException;
import io.metatree.node.SourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.Namespace;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class reads a document from a given {@link XMLEventReader} into an immutable
 * {@link SourceNode} tree. Comments, processing instructions and the document type declaration are
 * not part of the tree; text is trimmed.
 *
 * <p>
 * A shredder reads one document and is not reusable.
 * </p>
 */
public final class XmlShredder implements Callable<SourceNode> {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(XmlShredder.class);

  /** {@link XMLEventReader}. */
  private final XMLEventReader reader;

  /** Determines if the reader is closed after shredding. */
  private final boolean closeReader;

  /**
   * Builder to build an {@link XmlShredder} instance.
   */
  public static class Builder {

    /** {@link XMLEventReader} implementation. */
    private final XMLEventReader reader;

    /** Determines if the reader is closed after shredding. */
    private boolean closeReader = true;

    /**
     * Constructor.
     *
     * @param reader {@link XMLEventReader} implementation
     */
    public Builder(final XMLEventReader reader) {
      this.reader = checkNotNull(reader);
    }

    /**
     * Keep the reader open after shredding (default: it is closed).
     *
     * @return this builder instance
     */
    public Builder keepReaderOpen() {
      closeReader = false;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link XmlShredder} instance
     */
    public XmlShredder build() {
      return new XmlShredder(this);
    }
  }

  /**
   * Private constructor.
   *
   * @param builder builder reference
   */
  private XmlShredder(final Builder builder) {
    reader = builder.reader;
    closeReader = builder.closeReader;
  }

  /**
   * Invoking the shredder.
   *
   * @return the document root
   * @throws MetatreeIOException if the document is not well-formed
   */
  @Override
  public SourceNode call() {
    try {
      return shred();
    } catch (final XMLStreamException e) {
      throw new MetatreeIOException(e);
    } finally {
      if (closeReader) {
        try {
          reader.close();
        } catch (final XMLStreamException e) {
          LOGGER.warn("Closing the XML event reader failed.", e);
        }
      }
    }
  }

  private SourceNode shred() throws XMLStreamException {
    final Deque<SourceNode.Builder> parents = new ArrayDeque<>();
    SourceNode root = null;
    int elements = 0;

    // Iterate over all events up to the end of the root element.
    while (reader.hasNext() && root == null) {
      final XMLEvent event = reader.nextEvent();

      switch (event.getEventType()) {
        case XMLStreamConstants.START_ELEMENT -> {
          parents.push(newElement(event.asStartElement()));
          elements++;
        }
        case XMLStreamConstants.END_ELEMENT -> {
          final SourceNode element = parents.pop().build();
          if (parents.isEmpty()) {
            root = element;
          } else {
            parents.peek().child(element);
          }
        }
        case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
          if (!parents.isEmpty()) {
            parents.peek().text(event.asCharacters().getData());
          }
        }
        default -> {
          // Comments, processing instructions, whitespace outside of the root.
        }
      }
    }

    if (root == null) {
      throw new MetatreeIOException("The document has no root element.",
          new XMLStreamException("Premature end of document."));
    }
    LOGGER.debug("Shredded {} elements below the root '{}'.", elements, root.getQualifiedName());
    return root;
  }

  /**
   * Start a new element.
   *
   * @param event the current event from the StAX parser
   * @return the builder of the element
   */
  private static SourceNode.Builder newElement(final StartElement event) {
    final SourceNode.Builder element = SourceNode.newBuilder(event.getName());

    // Parse namespaces.
    for (final Iterator<Namespace> it = event.getNamespaces(); it.hasNext();) {
      final Namespace namespace = it.next();
      element.namespace(namespace.getPrefix(), namespace.getNamespaceURI());
    }

    // Parse attributes.
    for (final Iterator<Attribute> it = event.getAttributes(); it.hasNext();) {
      final Attribute attribute = it.next();
      element.attribute(attribute.getName(), attribute.getValue());
    }
    return element;
  }

  /**
   * Parse a document given as string.
   *
   * @param xmlString the document
   * @return the document root
   * @throws MetatreeIOException if the document is not well-formed
   */
  public static SourceNode shred(final String xmlString) {
    return new Builder(createStringReader(xmlString)).build().call();
  }

  private static XMLInputFactory newFactory() {
    final XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
    return factory;
  }

  /**
   * Create a new {@link XMLEventReader} instance on a string.
   *
   * @param xmlString the XML document as a string to parse
   * @return an {@link XMLEventReader}
   * @throws MetatreeIOException if creating the xml event reader fails
   */
  public static XMLEventReader createStringReader(final String xmlString) {
    checkNotNull(xmlString);
    return createReader(new StringReader(xmlString));
  }

  /**
   * Create a new {@link XMLEventReader} instance on a byte stream. The encoding is taken from the
   * XML declaration.
   *
   * @param in the input stream, not closed by the reader
   * @return an {@link XMLEventReader}
   * @throws MetatreeIOException if creating the xml event reader fails
   */
  public static XMLEventReader createReader(final InputStream in) {
    checkNotNull(in);
    try {
      return newFactory().createXMLEventReader(in);
    } catch (final XMLStreamException e) {
      throw new MetatreeIOException(e.getMessage(), e);
    }
  }

  /**
   * Create a new {@link XMLEventReader} instance on a character stream.
   *
   * @param in the reader, not closed by the event reader
   * @return an {@link XMLEventReader}
   * @throws MetatreeIOException if creating the xml event reader fails
   */
  public static XMLEventReader createReader(final Reader in) {
    checkNotNull(in);
    try {
      return newFactory().createXMLEventReader(in);
    } catch (final XMLStreamException e) {
      throw new MetatreeIOException(e.getMessage(), e);
    }
  }
}
