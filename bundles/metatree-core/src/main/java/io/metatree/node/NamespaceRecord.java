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
import io.metatree.settings.Constants;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Optional;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One namespace binding of the document root, materialized in the generic tree as a group named
 * {@code namespace_<position>} with the attribute entries {@code prefix} and {@code uri}.
 */
public final class NamespaceRecord {

  /** Names reserved for namespace records. */
  private static final Pattern RECORD_NAME =
      Pattern.compile(Pattern.quote(Constants.NAMESPACE_RECORD_PREFIX) + "\\d{1,9}");

  private final String prefix;

  private final String uri;

  private final int position;

  /**
   * Constructor.
   *
   * @param prefix the prefix, empty for the default namespace
   * @param uri the namespace URI
   * @param position the position of the binding among the root's bindings
   */
  public NamespaceRecord(final String prefix, final String uri, final @NonNegative int position) {
    checkArgument(position >= 0, "position must be >= 0!");
    this.prefix = requireNonNull(prefix);
    this.uri = requireNonNull(uri);
    this.position = position;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getUri() {
    return uri;
  }

  public int getPosition() {
    return position;
  }

  /**
   * Determines if a name is reserved for namespace records.
   *
   * @param name the name to check
   * @return {@code true} if the name has the form {@code namespace_<N>}
   */
  public static boolean isRecordName(final String name) {
    return RECORD_NAME.matcher(requireNonNull(name)).matches();
  }

  /**
   * Materialize this record as a group.
   *
   * @return the group
   */
  public GroupNode toGroup() {
    return GroupNode.newBuilder(Constants.NAMESPACE_RECORD_PREFIX + position)
                    .attribute(Constants.NAMESPACE_PREFIX_ENTRY, prefix)
                    .attribute(Constants.NAMESPACE_URI_ENTRY, uri)
                    .build();
  }

  /**
   * Read a record back from its group.
   *
   * @param group the group
   * @return the record, or empty if the group is no namespace record or lacks one of its entries
   */
  public static Optional<NamespaceRecord> fromGroup(final GroupNode group) {
    requireNonNull(group);
    if (!isRecordName(group.getName())) {
      return Optional.empty();
    }
    final Optional<AttributeEntry> prefixEntry = group.getAttribute(Constants.NAMESPACE_PREFIX_ENTRY);
    final Optional<AttributeEntry> uriEntry = group.getAttribute(Constants.NAMESPACE_URI_ENTRY);
    if (prefixEntry.isEmpty() || uriEntry.isEmpty()) {
      return Optional.empty();
    }
    final int position = Integer.parseInt(group.getName().substring(Constants.NAMESPACE_RECORD_PREFIX.length()));
    return Optional.of(new NamespaceRecord(prefixEntry.get().getValue(), uriEntry.get().getValue(), position));
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof NamespaceRecord other)) {
      return false;
    }
    return prefix.equals(other.prefix) && uri.equals(other.uri) && position == other.position;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(prefix, uri, position);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("prefix", prefix)
                      .add("uri", uri)
                      .add("position", position)
                      .toString();
  }
}
