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

package io.metatree.access;

import io.metatree.exception.MalformedGroupException;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.GroupNode;
import io.metatree.node.SourceNode;
import io.metatree.service.group.ForwardTransform;
import io.metatree.service.group.ReverseTransform;
import io.metatree.service.group.serialize.GroupXmlSerializer;
import io.metatree.service.group.shredder.GroupXmlShredder;
import io.metatree.service.json.serialize.GroupJsonSerializer;
import io.metatree.service.json.shredder.GroupJsonShredder;
import io.metatree.service.xml.serialize.XmlSerializer;
import io.metatree.service.xml.shredder.XmlShredder;
import io.metatree.settings.Constants;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;

import static java.util.Objects.requireNonNull;

/**
 * Entry point of the library: parses, transforms and writes documents in both directions with one
 * {@link TransformConfiguration}.
 *
 * <pre>
 * final Transforms transforms = Transforms.create();
 * final GroupNode tree = transforms.forward("&lt;a&gt;&lt;b x=\"1\"&gt;hi&lt;/b&gt;&lt;/a&gt;");
 * final String xml = transforms.toXml(transforms.reverse(tree));
 * </pre>
 *
 * <p>
 * Instances are immutable and thread-safe.
 * </p>
 */
public final class Transforms {

  private final TransformConfiguration config;

  private final ForwardTransform forward;

  private final ReverseTransform reverse;

  private Transforms(final TransformConfiguration config) {
    this.config = requireNonNull(config);
    forward = new ForwardTransform(config);
    reverse = new ReverseTransform(config);
  }

  /**
   * Create the transforms with the default configuration.
   *
   * @return the transforms
   */
  public static Transforms create() {
    return new Transforms(TransformConfiguration.defaults());
  }

  /**
   * Create the transforms.
   *
   * @param config the configuration
   * @return the transforms
   */
  public static Transforms create(final TransformConfiguration config) {
    return new Transforms(config);
  }

  public TransformConfiguration getConfiguration() {
    return config;
  }

  /**
   * Transform a structured document into the generic tree.
   *
   * @param root the document root
   * @return the generic tree
   */
  public GroupNode forward(final SourceNode root) {
    return forward.apply(root);
  }

  /**
   * Parse and transform a structured document.
   *
   * @param xml the document
   * @return the generic tree
   * @throws MetatreeIOException if the document is not well-formed
   */
  public GroupNode forward(final String xml) {
    return forward.apply(XmlShredder.shred(xml));
  }

  /**
   * Parse and transform a structured document.
   *
   * @param in the document, not closed
   * @return the generic tree
   * @throws MetatreeIOException if the document is not well-formed
   */
  public GroupNode forward(final InputStream in) {
    return forward.apply(new XmlShredder.Builder(XmlShredder.createReader(in)).build().call());
  }

  /**
   * Rebuild the structured document of a generic tree.
   *
   * @param tree the generic tree
   * @return the document root
   */
  public SourceNode reverse(final GroupNode tree) {
    return reverse.apply(tree);
  }

  /**
   * Parse a document of the generic vocabulary and rebuild the structured document.
   *
   * @param groupXml the generic document
   * @return the document root
   * @throws MetatreeIOException if the document is not well-formed
   * @throws MalformedGroupException if the document does not conform to the generic vocabulary
   */
  public SourceNode reverse(final String groupXml) {
    return reverse.apply(GroupXmlShredder.shred(groupXml));
  }

  /**
   * Parse a document of the generic vocabulary and rebuild the structured document.
   *
   * @param in the generic document, not closed
   * @return the document root
   * @throws MetatreeIOException if the document is not well-formed
   * @throws MalformedGroupException if the document does not conform to the generic vocabulary
   */
  public SourceNode reverse(final InputStream in) {
    return reverse.apply(new GroupXmlShredder(XmlShredder.createReader(in)).call());
  }

  /**
   * Write a structured document.
   *
   * @param root the document root
   * @param out the stream to write to, not closed
   * @param prettyPrint determines if the output is indented
   */
  public void writeXml(final SourceNode root, final OutputStream out, final boolean prettyPrint) {
    final XmlSerializer.XmlSerializerBuilder builder = XmlSerializer.newBuilder(root, out).emitXMLDeclaration();
    if (prettyPrint) {
      builder.prettyPrint();
    }
    builder.build().call();
  }

  /**
   * Write a structured document, without indentation.
   *
   * @param root the document root
   * @return the document
   */
  public String toXml(final SourceNode root) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeXml(root, out, false);
    return out.toString(Constants.DEFAULT_ENCODING);
  }

  /**
   * Write a generic tree in the generic vocabulary.
   *
   * @param tree the generic tree
   * @param out the stream to write to, not closed
   * @param prettyPrint determines if the output is indented
   */
  public void writeGroupXml(final GroupNode tree, final OutputStream out, final boolean prettyPrint) {
    final GroupXmlSerializer.Builder builder = GroupXmlSerializer.newBuilder(tree, out).emitXMLDeclaration();
    if (prettyPrint) {
      builder.prettyPrint();
    }
    builder.build().call();
  }

  /**
   * Write a generic tree in the generic vocabulary, indented.
   *
   * @param tree the generic tree
   * @return the generic document
   */
  public String toGroupXml(final GroupNode tree) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    writeGroupXml(tree, out, true);
    return out.toString(Constants.DEFAULT_ENCODING);
  }

  /**
   * Write the JSON form of a generic tree.
   *
   * @param tree the generic tree
   * @return the JSON document
   */
  public String toJson(final GroupNode tree) {
    final StringWriter writer = new StringWriter();
    new GroupJsonSerializer(tree, writer, true).call();
    return writer.toString();
  }

  /**
   * Read the JSON form of a generic tree.
   *
   * @param json the JSON document
   * @return the generic tree
   * @throws MetatreeIOException if the JSON is not well-formed
   * @throws MalformedGroupException if the JSON does not describe a generic tree
   */
  public GroupNode fromJson(final String json) {
    return GroupJsonShredder.shred(json);
  }
}
