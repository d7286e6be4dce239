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
import io.metatree.node.NamespaceRecord;
import io.metatree.settings.Constants;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Produces collision-free entry names within one sibling list.
 *
 * <p>
 * A base name is kept as is, unless a preceding sibling was emitted under the same base name or the
 * base name is reserved by the generic vocabulary ({@code value}, {@code nilReason},
 * {@code namespace_<N>}). In that case the separator and a fresh token are appended. Everything from
 * the first separator on is dropped by {@link #baseName(String)} to recover the base name.
 * </p>
 *
 * <p>
 * A namer belongs to one transform invocation. It is not thread-safe.
 * </p>
 */
public final class Namer {

  private final String separator;

  private final TokenGenerator tokens;

  /**
   * Constructor.
   *
   * @param separator the separator between base name and token
   * @param tokens the token source of the current invocation
   */
  public Namer(final String separator, final TokenGenerator tokens) {
    this.separator = requireNonNull(separator);
    this.tokens = requireNonNull(tokens);
    checkArgument(!separator.isEmpty(), "The separator must not be empty!");
  }

  /**
   * Names already taken in one sibling list.
   */
  public static final class Siblings {

    /** Names of the entries in the list. */
    private final Set<String> names = new HashSet<>();

    /** Base names under which entries were emitted. */
    private final Set<String> baseNames = new HashSet<>();

    private Siblings() {
    }

    /**
     * Register a name which is fixed by the vocabulary, e.g. the name of an attribute entry.
     *
     * @param name the name
     * @return the name
     */
    public String fixed(final String name) {
      names.add(requireNonNull(name));
      return name;
    }

    /**
     * Determines if a name is taken.
     *
     * @param name the name
     * @return {@code true} if an entry of the list has this name
     */
    public boolean contains(final String name) {
      return names.contains(name);
    }
  }

  /**
   * Start a new, empty sibling list.
   *
   * @return the sibling list
   */
  public Siblings newSiblings() {
    return new Siblings();
  }

  /**
   * Determines if a base name is reserved by the generic vocabulary and thus never used unsuffixed
   * for content.
   *
   * @param baseName the base name
   * @return {@code true} if it is reserved
   */
  public static boolean isReserved(final String baseName) {
    return Constants.VALUE_ENTRY.equals(baseName) || Constants.NIL_REASON_ENTRY.equals(baseName)
        || NamespaceRecord.isRecordName(baseName);
  }

  /**
   * Compute the name of the next entry of a sibling list and register it.
   *
   * @param siblings the sibling list
   * @param baseName the base name, usually the tag of the element
   * @return the name, unique within the sibling list
   */
  public String name(final Siblings siblings, final String baseName) {
    requireNonNull(siblings);
    requireNonNull(baseName);
    final String name;
    if (isReserved(baseName) || siblings.baseNames.contains(baseName) || siblings.contains(baseName)) {
      name = suffixed(siblings, baseName);
    } else {
      name = baseName;
    }
    siblings.baseNames.add(baseName);
    return siblings.fixed(name);
  }

  /**
   * Compute a name which is suffixed regardless of the preceding siblings, as needed for record-list
   * wrappers, and register it.
   *
   * @param siblings the sibling list
   * @param baseName the base name
   * @return the name, unique within the sibling list
   */
  public String freshName(final Siblings siblings, final String baseName) {
    requireNonNull(siblings);
    requireNonNull(baseName);
    final String name = suffixed(siblings, baseName);
    siblings.baseNames.add(baseName);
    return siblings.fixed(name);
  }

  private String suffixed(final Siblings siblings, final String baseName) {
    String candidate = baseName + separator + tokens.next();
    while (siblings.contains(candidate) || isReserved(candidate)) {
      // "namespace" plus a numeric token looks like a namespace record.
      candidate = isReserved(candidate)
          ? candidate + separator + tokens.next()
          : baseName + separator + tokens.next();
    }
    return candidate;
  }

  /**
   * Disambiguate a whole sibling list of base names. Applying this to its own output changes
   * nothing.
   *
   * @param baseNames the base names in sibling order
   * @return the names in sibling order
   */
  public ImmutableList<String> disambiguate(final List<String> baseNames) {
    final Siblings siblings = newSiblings();
    return baseNames.stream().map(baseName -> name(siblings, baseName)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Recover the base name of a (possibly) disambiguated name.
   *
   * @param name the name
   * @return everything before the first occurrence of the separator
   */
  public String baseName(final String name) {
    return baseName(name, separator);
  }

  /**
   * Recover the base name of a (possibly) disambiguated name.
   *
   * @param name the name
   * @param separator the separator
   * @return everything before the first occurrence of the separator
   */
  public static String baseName(final String name, final String separator) {
    requireNonNull(name);
    final int index = name.indexOf(requireNonNull(separator));
    return index == -1 ? name : name.substring(0, index);
  }
}
