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
import io.metatree.node.GroupNode;
import io.metatree.node.NamespaceRecord;
import io.metatree.node.SourceNode;
import io.metatree.service.xml.shredder.XmlShredder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class NamespaceRecorderTest {

  private static final String ROOT = "<gmd:MD_Metadata xmlns:gmd=\"http://www.isotc211.org/2005/gmd\" "
      + "xmlns:gco=\"http://www.isotc211.org/2005/gco\" xmlns=\"http://example.org/default\">"
      + "<inner xmlns:q=\"http://example.org/q\"/></gmd:MD_Metadata>";

  @Test
  public void testRecordInDocumentOrder() {
    final ImmutableList<NamespaceRecord> records = NamespaceRecorder.record(XmlShredder.shred(ROOT));
    assertEquals(ImmutableList.of(new NamespaceRecord("gmd", "http://www.isotc211.org/2005/gmd", 0),
        new NamespaceRecord("gco", "http://www.isotc211.org/2005/gco", 1),
        new NamespaceRecord("", "http://example.org/default", 2)), records);
  }

  @Test
  public void testNoBindings() {
    assertTrue(NamespaceRecorder.record(SourceNode.newBuilder("a").build()).isEmpty());
  }

  @Test
  public void testCollectAnywhereOrderedByPosition() {
    final GroupNode tree = GroupNode.newBuilder("a")
                                    .entry(new NamespaceRecord("b", "urn:b", 1).toGroup())
                                    .entry(GroupNode.newBuilder("inner")
                                                    .entry(new NamespaceRecord("a", "urn:a", 0).toGroup())
                                                    .build())
                                    .build();
    assertEquals(ImmutableList.of(new NamespaceRecord("a", "urn:a", 0), new NamespaceRecord("b", "urn:b", 1)),
        NamespaceRecorder.collect(tree));
  }

  @Test
  public void testIncompleteRecordsAreSkipped() {
    final GroupNode tree = GroupNode.newBuilder("a")
                                    .entry(GroupNode.newBuilder("namespace_0").attribute("uri", "urn:a").build())
                                    .entry(new NamespaceRecord("b", "urn:b", 1).toGroup())
                                    .build();
    assertEquals(ImmutableList.of(new NamespaceRecord("b", "urn:b", 1)), NamespaceRecorder.collect(tree));
  }

  @Test
  public void testToBindings() {
    final Map<String, String> bindings = NamespaceRecorder.toBindings(
        ImmutableList.of(new NamespaceRecord("a", "urn:a", 0), new NamespaceRecord("", "urn:d", 1)));
    assertEquals(Map.of("a", "urn:a", "", "urn:d"), bindings);
  }
}
