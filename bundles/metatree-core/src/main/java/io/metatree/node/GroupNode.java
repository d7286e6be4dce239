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
import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Composite entry of the generic tree: a name, optional type metadata and an ordered list of
 * child entries.
 */
public final class GroupNode implements Entry {

  private final String name;

  private final @Nullable String type;

  private final ImmutableList<Entry> entries;

  private GroupNode(final Builder builder) {
    name = builder.name;
    type = builder.type;
    entries = ImmutableList.copyOf(builder.entries);
  }

  /**
   * Get a new builder.
   *
   * @param name the name of the group
   * @return a new builder instance
   */
  public static Builder newBuilder(final String name) {
    return new Builder(name);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public @Nullable String getType() {
    return type;
  }

  @Override
  public EntryKind getKind() {
    return EntryKind.GROUP;
  }

  /**
   * Get all child entries in order.
   *
   * @return the child entries
   */
  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  /**
   * Get the child groups in order.
   *
   * @return the child groups
   */
  public ImmutableList<GroupNode> getGroups() {
    return entries.stream()
                  .filter(entry -> entry.getKind() == EntryKind.GROUP)
                  .map(GroupNode.class::cast)
                  .collect(ImmutableList.toImmutableList());
  }

  /**
   * Get the child attribute entries in order.
   *
   * @return the attribute entries
   */
  public ImmutableList<AttributeEntry> getAttributes() {
    return entries.stream()
                  .filter(entry -> entry.getKind() == EntryKind.ATTRIBUTE)
                  .map(AttributeEntry.class::cast)
                  .collect(ImmutableList.toImmutableList());
  }

  /**
   * Find a child entry by name.
   *
   * @param entryName the name
   * @return the entry, if present
   */
  public Optional<Entry> getEntry(final String entryName) {
    requireNonNull(entryName);
    return entries.stream().filter(entry -> entry.getName().equals(entryName)).findFirst();
  }

  /**
   * Find a child attribute entry by name.
   *
   * @param entryName the name
   * @return the attribute entry, if present
   */
  public Optional<AttributeEntry> getAttribute(final String entryName) {
    return getEntry(entryName).filter(entry -> entry.getKind() == EntryKind.ATTRIBUTE)
                              .map(AttributeEntry.class::cast);
  }

  /**
   * Find a child group by name.
   *
   * @param entryName the name
   * @return the group, if present
   */
  public Optional<GroupNode> getGroup(final String entryName) {
    return getEntry(entryName).filter(entry -> entry.getKind() == EntryKind.GROUP).map(GroupNode.class::cast);
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof GroupNode other)) {
      return false;
    }
    return name.equals(other.name) && Objects.equal(type, other.type) && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, entries);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("type", type)
                      .add("entries", entries)
                      .omitNullValues()
                      .toString();
  }

  /**
   * Builder to build a {@link GroupNode} instance.
   */
  public static final class Builder {

    private final String name;

    private @Nullable String type;

    private final List<Entry> entries = new ArrayList<>();

    /**
     * Constructor.
     *
     * @param name the name of the group
     */
    private Builder(final String name) {
      this.name = requireNonNull(name);
    }

    /**
     * Set the type metadata.
     *
     * @param type the type or {@code null}
     * @return this builder instance
     */
    public Builder type(final @Nullable String type) {
      this.type = type;
      return this;
    }

    /**
     * Append an entry.
     *
     * @param entry the entry
     * @return this builder instance
     */
    public Builder entry(final Entry entry) {
      entries.add(requireNonNull(entry));
      return this;
    }

    /**
     * Append an untyped attribute entry.
     *
     * @param entryName the name
     * @param value the value
     * @return this builder instance
     */
    public Builder attribute(final String entryName, final String value) {
      return entry(new AttributeEntry(entryName, value));
    }

    /**
     * Append an attribute entry.
     *
     * @param entryName the name
     * @param value the value
     * @param entryType the type tag or {@code null}
     * @return this builder instance
     */
    public Builder attribute(final String entryName, final String value, final @Nullable String entryType) {
      return entry(new AttributeEntry(entryName, value, entryType));
    }

    /**
     * Determines if no entry has been appended so far.
     *
     * @return {@code true} if the group is still empty
     */
    public boolean isEmpty() {
      return entries.isEmpty();
    }

    /**
     * Build an instance.
     *
     * @return {@link GroupNode} instance
     */
    public GroupNode build() {
      return new GroupNode(this);
    }
  }
}
