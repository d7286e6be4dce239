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

package io.metatree.node;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Leaf entry holding one name/value pair and an optional type tag.
 */
public final class AttributeEntry implements Entry {

  private final String name;

  private final String value;

  private final @Nullable String type;

  /**
   * Constructor.
   *
   * @param name the name
   * @param value the value
   * @param type the type tag or {@code null}
   */
  public AttributeEntry(final String name, final String value, final @Nullable String type) {
    this.name = requireNonNull(name);
    this.value = requireNonNull(value);
    this.type = type;
  }

  /**
   * Constructor for an untyped entry.
   *
   * @param name the name
   * @param value the value
   */
  public AttributeEntry(final String name, final String value) {
    this(name, value, null);
  }

  @Override
  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  @Override
  public @Nullable String getType() {
    return type;
  }

  @Override
  public EntryKind getKind() {
    return EntryKind.ATTRIBUTE;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof AttributeEntry other)) {
      return false;
    }
    return name.equals(other.name) && value.equals(other.value) && Objects.equal(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, value, type);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("value", value)
                      .add("type", type)
                      .omitNullValues()
                      .toString();
  }
}
