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

/**
 * The categories an element of a structured document is classified into by the
 * {@link Classifier}. Each category determines the shape of the entry emitted into the generic
 * tree.
 */
public enum Category {

  /**
   * No attributes, no children and no text. Emitted as a group holding the nil marker entry
   * {@code nilReason = "unknown"}.
   * <p>
   * Example: {@code <a/>}
   */
  NIL,

  /**
   * Wraps exactly one primitive scalar wrapper element. Emitted as an attribute entry whose type
   * tag is the wrapper's tag.
   * <p>
   * Example: {@code <gmd:title><gco:CharacterString>x</gco:CharacterString></gmd:title>}
   */
  FUNDAMENTAL,

  /**
   * Text only. Emitted as an untyped attribute entry.
   * <p>
   * Example: {@code <b>hi</b>}
   */
  PLAIN_VALUE,

  /**
   * Anything with attributes or element children, and text-only compound objects. Emitted as a
   * group.
   * <p>
   * Example: {@code <b x="1">hi</b>}
   */
  GROUP
}
