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
import io.metatree.node.EntryKind;
import io.metatree.node.GroupNode;
import io.metatree.node.NamespaceRecord;
import io.metatree.node.SourceNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Captures the namespace bindings of a document root as {@link NamespaceRecord}s and finds them
 * again in a generic tree.
 */
public final class NamespaceRecorder {

  /** Logger. */
  private static final Logger LOGGER = LoggerFactory.getLogger(NamespaceRecorder.class);

  private NamespaceRecorder() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Record the namespace bindings declared on the document root, in document order.
   *
   * @param root the document root
   * @return one record per binding, positions counting from {@code 0}
   */
  public static ImmutableList<NamespaceRecord> record(final SourceNode root) {
    requireNonNull(root);
    final ImmutableList.Builder<NamespaceRecord> records = ImmutableList.builder();
    int position = 0;
    for (final Map.Entry<String, String> binding : root.getNamespaces().entrySet()) {
      records.add(new NamespaceRecord(binding.getKey(), binding.getValue(), position));
      position++;
    }
    return records.build();
  }

  /**
   * Collect all namespace records anywhere in a generic tree. Records lacking their prefix or URI
   * entry are skipped.
   *
   * @param tree the generic tree
   * @return the records ordered by position
   */
  public static ImmutableList<NamespaceRecord> collect(final GroupNode tree) {
    requireNonNull(tree);
    final List<NamespaceRecord> records = new ArrayList<>();
    final Deque<GroupNode> stack = new ArrayDeque<>();
    stack.push(tree);
    while (!stack.isEmpty()) {
      final GroupNode group = stack.pop();
      if (NamespaceRecord.isRecordName(group.getName())) {
        final Optional<NamespaceRecord> record = NamespaceRecord.fromGroup(group);
        if (record.isPresent()) {
          records.add(record.get());
        } else {
          LOGGER.warn("Incomplete namespace record '{}' is ignored.", group.getName());
        }
        continue;
      }
      group.getEntries()
           .reverse()
           .stream()
           .filter(entry -> entry.getKind() == EntryKind.GROUP)
           .forEach(entry -> stack.push((GroupNode) entry));
    }
    records.sort(Comparator.comparingInt(NamespaceRecord::getPosition));
    return ImmutableList.copyOf(records);
  }

  /**
   * Get the prefix to URI bindings of records. If a prefix is recorded twice, the later record wins.
   *
   * @param records the records
   * @return the bindings in record order
   */
  public static Map<String, String> toBindings(final List<NamespaceRecord> records) {
    final Map<String, String> bindings = new LinkedHashMap<>();
    for (final NamespaceRecord record : records) {
      bindings.put(record.getPrefix(), record.getUri());
    }
    return bindings;
  }
}
