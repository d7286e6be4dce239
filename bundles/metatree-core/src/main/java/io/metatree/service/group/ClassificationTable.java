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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.metatree.access.TransformConfiguration;
import io.metatree.node.SourceNode;

import javax.xml.namespace.QName;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * The naming conventions and structural shapes the transforms recognize, in one place: primitive
 * scalar wrappers, compound objects, object properties and record lists.
 */
public final class ClassificationTable {

  private final ImmutableSet<String> primitiveWrappers;

  private final Pattern compoundObjectPattern;

  private final ImmutableSet<String> recordListNames;

  private final boolean detectRecordLists;

  private final int minimumRecordCount;

  /**
   * Constructor.
   *
   * @param config the transform configuration
   */
  public ClassificationTable(final TransformConfiguration config) {
    requireNonNull(config);
    primitiveWrappers = config.getPrimitiveWrappers();
    compoundObjectPattern = config.getCompoundObjectPattern();
    recordListNames = config.getRecordListNames();
    detectRecordLists = config.isDetectingRecordLists();
    minimumRecordCount = config.getMinimumRecordCount();
  }

  /**
   * Determines if an element carries attributes. Namespace declarations count as attributes, as
   * they have to be preserved the same way.
   *
   * @param node the element
   * @return {@code true} if the element has attributes or namespace declarations
   */
  public static boolean carriesAttributes(final SourceNode node) {
    return node.hasAttributes() || node.hasNamespaces();
  }

  /**
   * Determines if a tag denotes an element which only wraps a primitive scalar.
   *
   * @param name the tag
   * @return {@code true} if the local name is listed as primitive wrapper
   */
  public boolean isPrimitiveWrapper(final QName name) {
    return primitiveWrappers.contains(name.getLocalPart());
  }

  /**
   * Determines if a tag denotes a compound object, e.g. {@code gmd:CI_Citation}.
   *
   * @param name the tag
   * @return {@code true} if the local name matches the compound object pattern
   */
  public boolean isCompoundObject(final QName name) {
    return compoundObjectPattern.matcher(name.getLocalPart()).matches();
  }

  /**
   * Determines if an element is a property which wraps exactly one compound object and nothing
   * else, e.g. {@code <gmd:citation><gmd:CI_Citation>...</gmd:CI_Citation></gmd:citation>}.
   *
   * @param node the element
   * @return the wrapped object, or empty if the element is no object property
   */
  public Optional<SourceNode> objectOf(final SourceNode node) {
    final ImmutableList<SourceNode> children = node.getChildren();
    if (carriesAttributes(node) || node.hasText() || children.size() != 1) {
      return Optional.empty();
    }
    final SourceNode object = children.get(0);
    return isCompoundObject(object.getName()) ? Optional.of(object) : Optional.empty();
  }

  /**
   * Determines if an element is a record list, a container of homogeneous sub-records. Elements
   * listed by name are record lists as soon as they have element children; otherwise an element
   * without own text is one if it has at least the minimum number of children, all children share
   * one tag and every child has element children of its own.
   *
   * @param node the element
   * @return {@code true} if every child has to be wrapped as a record
   */
  public boolean isRecordList(final SourceNode node) {
    final ImmutableList<SourceNode> children = node.getChildren();
    if (children.isEmpty() || node.hasText()) {
      return false;
    }
    if (recordListNames.contains(node.getQualifiedName())) {
      return true;
    }
    if (!detectRecordLists || children.size() < minimumRecordCount) {
      return false;
    }
    final String recordName = children.get(0).getQualifiedName();
    return children.stream()
                   .allMatch(child -> child.hasChildren() && child.getQualifiedName().equals(recordName));
  }
}
