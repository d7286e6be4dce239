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

package io.metatree.settings;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Constants shared by the transforms and their I/O adapters.
 */
public final class Constants {

  /**
   * Private constructor.
   */
  private Constants() {
    // Cannot be instantiated.
    throw new AssertionError("May not be instantiated!");
  }

  // --- Varia
  // ------------------------------------------------------------------

  /** Default internal encoding. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

  // --- Generic vocabulary
  // ------------------------------------------------------

  /** Marker prepended to entries which stand for an XML attribute. */
  public static final String ATTRIBUTE_MARKER = "@";

  /** Name of the entry holding the direct text content of a group. */
  public static final String VALUE_ENTRY = "value";

  /** Name of the entry marking an element without any content. */
  public static final String NIL_REASON_ENTRY = "nilReason";

  /** Value of the nil marker entry. */
  public static final String NIL_REASON_UNKNOWN = "unknown";

  /** Name prefix of namespace records. */
  public static final String NAMESPACE_RECORD_PREFIX = "namespace_";

  /** Name of the prefix entry of a namespace record. */
  public static final String NAMESPACE_PREFIX_ENTRY = "prefix";

  /** Name of the URI entry of a namespace record. */
  public static final String NAMESPACE_URI_ENTRY = "uri";

  /** Base name of record-list wrapper groups. */
  public static final String RECORD_WRAPPER_NAME = "record";

  /** Type of record-list wrapper groups. Not a valid XML name, so it never clashes with a tag. */
  public static final String RECORD_WRAPPER_TYPE = "#record";

  /** Default disambiguation separator. */
  public static final String DEFAULT_SEPARATOR = "_";

  /** Element name of groups in the generic vocabulary. */
  public static final String GROUP_ELEMENT = "group";

  /** Element name of attribute entries in the generic vocabulary. */
  public static final String ATTRIBUTE_ELEMENT = "attribute";

  /** Name attribute of the generic vocabulary. */
  public static final String NAME_ATTRIBUTE = "name";

  /** Value attribute of the generic vocabulary. */
  public static final String VALUE_ATTRIBUTE = "value";

  /** Type attribute of the generic vocabulary. */
  public static final String TYPE_ATTRIBUTE = "type";

  /** Prefix used for namespace declarations. */
  public static final String XMLNS = "xmlns";
}
