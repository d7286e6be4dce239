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

/**
 * Holding all byte representations needed to write the XML flavours of this project: the
 * reconstructed source documents and the generic group/attribute vocabulary.
 */
public enum CharsForSerializing {

  /** " ". */
  SPACE(" "),

  /** "&lt;". */
  OPEN("<"),

  /** "&gt;". */
  CLOSE(">"),

  /** "\"". */
  QUOTE("\""),

  /** "=\"". */
  EQUAL_QUOTE("=\""),

  /** "&lt;/". */
  OPEN_SLASH("</"),

  /** "/&gt;". */
  SLASH_CLOSE("/>"),

  /** " xmlns=\"". */
  XMLNS(" xmlns=\""),

  /** " xmlns:". */
  XMLNS_COLON(" xmlns:"),

  /** XML declaration. */
  XML_DECLARATION("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"),

  /** "&lt;group". */
  OPEN_GROUP("<" + Constants.GROUP_ELEMENT),

  /** "&lt;/group&gt;". */
  CLOSE_GROUP("</" + Constants.GROUP_ELEMENT + ">"),

  /** "&lt;attribute". */
  OPEN_ATTRIBUTE("<" + Constants.ATTRIBUTE_ELEMENT),

  /** " name=\"". */
  NAME_EQUAL_QUOTE(" " + Constants.NAME_ATTRIBUTE + "=\""),

  /** " value=\"". */
  VALUE_EQUAL_QUOTE(" " + Constants.VALUE_ATTRIBUTE + "=\""),

  /** " type=\"". */
  TYPE_EQUAL_QUOTE(" " + Constants.TYPE_ATTRIBUTE + "=\""),

  /** Newline. */
  NEWLINE("\n");

  /** Getting the bytes for the chars. */
  private final byte[] bytes;

  /**
   * Private constructor.
   *
   * @param chars the chars to encode
   */
  CharsForSerializing(final String chars) {
    bytes = chars.getBytes(Constants.DEFAULT_ENCODING);
  }

  /**
   * Getting the bytes.
   *
   * @return the bytes for the chars
   */
  public byte[] getBytes() {
    return bytes;
  }

}
