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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSet;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.metatree.exception.MetatreeIOException;
import io.metatree.settings.Constants;
import org.checkerframework.checker.index.qual.Positive;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Settings of the forward and reverse transforms. Instances are immutable and can be shared; the
 * defaults match the ISO 19115/19139 style of metadata documents (object types such as
 * {@code MD_Metadata} wrapped by lower camel case properties, scalars wrapped in
 * {@code gco:CharacterString} and friends).
 */
public final class TransformConfiguration {

  /** Local names of elements which only wrap a primitive scalar. */
  public static final ImmutableSet<String> DEFAULT_PRIMITIVE_WRAPPERS =
      ImmutableSet.of("CharacterString", "Boolean", "Integer", "Real", "Decimal", "Date", "DateTime", "Measure",
          "Distance", "Scale", "Angle", "Length", "Record", "RecordType", "Binary", "LocalName", "ScopedName",
          "TypeName", "MemberName", "UnlimitedInteger");

  /** Local names of elements which denote a compound object, e.g. {@code MD_Metadata}. */
  public static final String DEFAULT_COMPOUND_OBJECT_PATTERN = "[A-Z][A-Z0-9]*_[A-Za-z0-9]+";

  /** Minimum number of homogeneous records for structural record-list detection. */
  public static final int DEFAULT_MINIMUM_RECORD_COUNT = 2;

  /** Separator between a base name and its disambiguation token. */
  private final String separator;

  /** Local names of primitive scalar wrappers. */
  private final ImmutableSet<String> primitiveWrappers;

  /** Pattern of local names of compound objects. */
  private final Pattern compoundObjectPattern;

  /** Qualified names of elements which are always treated as record lists. */
  private final ImmutableSet<String> recordListNames;

  /** Determines if record lists are recognized structurally. */
  private final boolean detectRecordLists;

  /** Minimum number of records for structural detection. */
  private final int minimumRecordCount;

  private TransformConfiguration(final Builder builder) {
    separator = builder.separator;
    primitiveWrappers = ImmutableSet.copyOf(builder.primitiveWrappers);
    compoundObjectPattern = builder.compoundObjectPattern;
    recordListNames = ImmutableSet.copyOf(builder.recordListNames);
    detectRecordLists = builder.detectRecordLists;
    minimumRecordCount = builder.minimumRecordCount;
  }

  /**
   * Get the default configuration.
   *
   * @return the default configuration
   */
  public static TransformConfiguration defaults() {
    return newBuilder().build();
  }

  /**
   * Get a new builder, initialized with the defaults.
   *
   * @return a new builder instance
   */
  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Get a new builder, initialized with the settings of this configuration.
   *
   * @return a new builder instance
   */
  public Builder toBuilder() {
    return new Builder().separator(separator)
                        .primitiveWrappers(primitiveWrappers)
                        .compoundObjectPattern(compoundObjectPattern.pattern())
                        .recordListNames(recordListNames)
                        .detectRecordLists(detectRecordLists)
                        .minimumRecordCount(minimumRecordCount);
  }

  public String getSeparator() {
    return separator;
  }

  public ImmutableSet<String> getPrimitiveWrappers() {
    return primitiveWrappers;
  }

  public Pattern getCompoundObjectPattern() {
    return compoundObjectPattern;
  }

  public ImmutableSet<String> getRecordListNames() {
    return recordListNames;
  }

  public boolean isDetectingRecordLists() {
    return detectRecordLists;
  }

  public int getMinimumRecordCount() {
    return minimumRecordCount;
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof TransformConfiguration other)) {
      return false;
    }
    return separator.equals(other.separator) && primitiveWrappers.equals(other.primitiveWrappers)
        && compoundObjectPattern.pattern().equals(other.compoundObjectPattern.pattern())
        && recordListNames.equals(other.recordListNames) && detectRecordLists == other.detectRecordLists
        && minimumRecordCount == other.minimumRecordCount;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(separator, primitiveWrappers, compoundObjectPattern.pattern(), recordListNames,
        detectRecordLists, minimumRecordCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("separator", separator)
                      .add("primitiveWrappers", primitiveWrappers)
                      .add("compoundObjectPattern", compoundObjectPattern)
                      .add("recordListNames", recordListNames)
                      .add("detectRecordLists", detectRecordLists)
                      .add("minimumRecordCount", minimumRecordCount)
                      .toString();
  }

  /**
   * Serializing a {@link TransformConfiguration} as json.
   *
   * @param config to be serialized
   * @param writer the writer to write to, not closed by this method
   * @throws MetatreeIOException if an I/O error occurs
   */
  public static void serialize(final TransformConfiguration config, final Writer writer) {
    requireNonNull(config);
    requireNonNull(writer);
    try {
      final JsonWriter jsonWriter = new JsonWriter(writer);
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name("separator").value(config.separator);
      jsonWriter.name("primitiveWrappers").beginArray();
      for (final String wrapper : config.primitiveWrappers) {
        jsonWriter.value(wrapper);
      }
      jsonWriter.endArray();
      jsonWriter.name("compoundObjectPattern").value(config.compoundObjectPattern.pattern());
      jsonWriter.name("recordListNames").beginArray();
      for (final String recordList : config.recordListNames) {
        jsonWriter.value(recordList);
      }
      jsonWriter.endArray();
      jsonWriter.name("detectRecordLists").value(config.detectRecordLists);
      jsonWriter.name("minimumRecordCount").value(config.minimumRecordCount);
      jsonWriter.endObject();
      jsonWriter.flush();
    } catch (final IOException e) {
      throw new MetatreeIOException(e);
    }
  }

  /**
   * Generate a {@link TransformConfiguration} out of its json form. Unknown names are skipped and
   * missing names keep their defaults.
   *
   * @param reader the reader to read from, not closed by this method
   * @return a new {@link TransformConfiguration} instance
   * @throws MetatreeIOException if an I/O error occurs or the json is malformed
   * @throws IllegalArgumentException if one of the values is invalid
   */
  public static TransformConfiguration deserialize(final Reader reader) {
    requireNonNull(reader);
    final Builder builder = newBuilder();
    try {
      final JsonReader jsonReader = new JsonReader(reader);
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        switch (name) {
          case "separator" -> builder.separator(jsonReader.nextString());
          case "primitiveWrappers" -> builder.primitiveWrappers(readStrings(jsonReader));
          case "compoundObjectPattern" -> builder.compoundObjectPattern(jsonReader.nextString());
          case "recordListNames" -> builder.recordListNames(readStrings(jsonReader));
          case "detectRecordLists" -> builder.detectRecordLists(jsonReader.nextBoolean());
          case "minimumRecordCount" -> builder.minimumRecordCount(jsonReader.nextInt());
          default -> jsonReader.skipValue();
        }
      }
      jsonReader.endObject();
    } catch (final IOException | IllegalStateException e) {
      throw new MetatreeIOException("Malformed transform configuration.", e);
    }
    return builder.build();
  }

  private static Set<String> readStrings(final JsonReader jsonReader) throws IOException {
    final Set<String> values = new LinkedHashSet<>();
    jsonReader.beginArray();
    while (jsonReader.peek() != JsonToken.END_ARRAY) {
      values.add(jsonReader.nextString());
    }
    jsonReader.endArray();
    return values;
  }

  /**
   * Builder to build a {@link TransformConfiguration} instance.
   */
  public static final class Builder {

    private String separator = Constants.DEFAULT_SEPARATOR;

    private Set<String> primitiveWrappers = new LinkedHashSet<>(DEFAULT_PRIMITIVE_WRAPPERS);

    private Pattern compoundObjectPattern = Pattern.compile(DEFAULT_COMPOUND_OBJECT_PATTERN);

    private Set<String> recordListNames = new LinkedHashSet<>();

    private boolean detectRecordLists = true;

    private int minimumRecordCount = DEFAULT_MINIMUM_RECORD_COUNT;

    private Builder() {
    }

    /**
     * Set the disambiguation separator.
     *
     * @param separator the separator, must neither be empty, start with the attribute marker nor contain a colon
     * @return this builder instance
     */
    public Builder separator(final String separator) {
      requireNonNull(separator);
      checkArgument(!separator.isEmpty(), "The separator must not be empty!");
      checkArgument(!separator.startsWith(Constants.ATTRIBUTE_MARKER), "The separator must not start with '%s'!",
          Constants.ATTRIBUTE_MARKER);
      checkArgument(separator.indexOf(':') == -1, "The separator must not contain the prefix delimiter ':'!");
      this.separator = separator;
      return this;
    }

    /**
     * Set the local names of the primitive scalar wrappers.
     *
     * @param localNames the local names
     * @return this builder instance
     */
    public Builder primitiveWrappers(final Set<String> localNames) {
      primitiveWrappers = new LinkedHashSet<>(requireNonNull(localNames));
      return this;
    }

    /**
     * Add a primitive scalar wrapper.
     *
     * @param localName the local name
     * @return this builder instance
     */
    public Builder addPrimitiveWrapper(final String localName) {
      primitiveWrappers.add(requireNonNull(localName));
      return this;
    }

    /**
     * Set the pattern which local names of compound objects match.
     *
     * @param regex the regular expression
     * @return this builder instance
     * @throws IllegalArgumentException if the expression is invalid
     */
    public Builder compoundObjectPattern(final String regex) {
      requireNonNull(regex);
      try {
        compoundObjectPattern = Pattern.compile(regex);
      } catch (final PatternSyntaxException e) {
        throw new IllegalArgumentException("Invalid compound object pattern: " + regex, e);
      }
      return this;
    }

    /**
     * Set the qualified names of elements which are always record lists.
     *
     * @param qualifiedNames the names, {@code prefix:localName} or just the local name
     * @return this builder instance
     */
    public Builder recordListNames(final Set<String> qualifiedNames) {
      recordListNames = new LinkedHashSet<>(requireNonNull(qualifiedNames));
      return this;
    }

    /**
     * Add the qualified name of an element which is always a record list.
     *
     * @param qualifiedName the name, {@code prefix:localName} or just the local name
     * @return this builder instance
     */
    public Builder addRecordListName(final String qualifiedName) {
      recordListNames.add(requireNonNull(qualifiedName));
      return this;
    }

    /**
     * Determines if record lists are recognized structurally (default: yes).
     *
     * @param detect {@code true} to recognize them
     * @return this builder instance
     */
    public Builder detectRecordLists(final boolean detect) {
      detectRecordLists = detect;
      return this;
    }

    /**
     * Set the minimum number of homogeneous records for structural detection.
     *
     * @param count the count, at least 2
     * @return this builder instance
     */
    public Builder minimumRecordCount(final @Positive int count) {
      checkArgument(count >= 2, "A record list has at least two records!");
      minimumRecordCount = count;
      return this;
    }

    /**
     * Build an instance.
     *
     * @return {@link TransformConfiguration} instance
     */
    public TransformConfiguration build() {
      return new TransformConfiguration(this);
    }
  }
}
