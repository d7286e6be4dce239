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

import io.metatree.MetatreeTestHelper;
import io.metatree.access.TransformConfiguration;
import io.metatree.node.AttributeEntry;
import io.metatree.node.Entry;
import io.metatree.node.GroupNode;
import io.metatree.node.NamespaceRecord;
import io.metatree.node.SourceNode;
import io.metatree.service.xml.shredder.XmlShredder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ForwardTransformTest {

  private ForwardTransform forward;

  @BeforeEach
  public void setUp() {
    forward = new ForwardTransform(TransformConfiguration.defaults());
  }

  @Test
  public void testRepeatedSiblings() {
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("b").attribute("@x", "1").attribute("value", "hi").build())
                                        .entry(GroupNode.newBuilder("b_1")
                                                        .attribute("@x", "2")
                                                        .attribute("value", "bye")
                                                        .build())
                                        .build();
    assertEquals(expected, forward.apply(XmlShredder.shred(MetatreeTestHelper.REPEATED_SIBLINGS)));
  }

  @Test
  public void testEmptyRoot() {
    final GroupNode expected = GroupNode.newBuilder("a").attribute("nilReason", "unknown").build();
    assertEquals(expected, forward.apply(XmlShredder.shred(MetatreeTestHelper.EMPTY)));
  }

  @Test
  public void testNilChild() {
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("status").attribute("nilReason", "unknown").build())
                                        .build();
    assertEquals(expected, forward.apply(XmlShredder.shred("<a><status/></a>")));
  }

  @Test
  public void testRecordList() {
    final GroupNode.Builder list = GroupNode.newBuilder("list");
    for (int i = 1; i <= 3; i++) {
      list.entry(GroupNode.newBuilder("record_" + i)
                          .type("#record")
                          .entry(GroupNode.newBuilder("item").attribute("n", String.valueOf(i)).build())
                          .build());
    }
    final GroupNode expected = GroupNode.newBuilder("doc").entry(list.build()).build();
    assertEquals(expected, forward.apply(XmlShredder.shred(MetatreeTestHelper.RECORD_LIST)));
  }

  @Test
  public void testRecordListWrappersAreUnique() {
    final GroupNode list = forward.apply(XmlShredder.shred(MetatreeTestHelper.RECORD_LIST)).getGroup("list").orElseThrow();
    final Set<String> names = list.getGroups().stream().map(GroupNode::getName).collect(Collectors.toSet());
    assertEquals(3, names.size());
    assertTrue(list.getGroups().stream().allMatch(group -> "#record".equals(group.getType())));
  }

  @Test
  public void testFundamentalValue() {
    final SourceNode root = XmlShredder.shred(
        "<a xmlns:gco=\"http://www.isotc211.org/2005/gco\"><title><gco:CharacterString>Sea</gco:CharacterString></title></a>");
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .attribute("title", "Sea", "gco:CharacterString")
                                        .entry(new NamespaceRecord("gco", "http://www.isotc211.org/2005/gco", 0).toGroup())
                                        .build();
    assertEquals(expected, forward.apply(root));
  }

  @Test
  public void testObjectProperty() {
    final SourceNode root =
        XmlShredder.shred("<a><citation><CI_Citation id=\"c1\"><title>t</title></CI_Citation></citation></a>");
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("citation")
                                                        .type("CI_Citation")
                                                        .attribute("@id", "c1")
                                                        .attribute("title", "t")
                                                        .build())
                                        .build();
    assertEquals(expected, forward.apply(root));
  }

  @Test
  public void testEmptyObject() {
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("role")
                                                        .type("CI_RoleCode")
                                                        .attribute("nilReason", "unknown")
                                                        .build())
                                        .build();
    assertEquals(expected, forward.apply(XmlShredder.shred("<a><role><CI_RoleCode/></role></a>")));
  }

  @Test
  public void testInnerNamespaceDeclaration() {
    final SourceNode root =
        XmlShredder.shred("<a><box xmlns=\"http://example.org/extent\" units=\"deg\"><west>1</west></box></a>");
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("box")
                                                        .attribute("@xmlns", "http://example.org/extent")
                                                        .attribute("@units", "deg")
                                                        .attribute("west", "1")
                                                        .build())
                                        .build();
    assertEquals(expected, forward.apply(root));
  }

  @Test
  public void testReservedContentNames() {
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .attribute("value_1", "3")
                                        .attribute("nilReason_2", "none")
                                        .build();
    assertEquals(expected, forward.apply(XmlShredder.shred("<a><value>3</value><nilReason>none</nilReason></a>")));
  }

  @Test
  public void testNamespaceRecordsAreAppended() {
    final SourceNode root = XmlShredder.shred(
        "<r xmlns=\"http://example.org/d\" xmlns:p=\"http://example.org/p\"><p:x>1</p:x><y>2</y></r>");
    final List<Entry> entries = forward.apply(root).getEntries();
    assertEquals(4, entries.size());
    assertEquals(new AttributeEntry("p:x", "1"), entries.get(0));
    assertEquals(new AttributeEntry("y", "2"), entries.get(1));
    assertEquals(new NamespaceRecord("", "http://example.org/d", 0).toGroup(), entries.get(2));
    assertEquals(new NamespaceRecord("p", "http://example.org/p", 1).toGroup(), entries.get(3));
  }

  @Test
  public void testCustomSeparator() {
    final ForwardTransform custom = new ForwardTransform(TransformConfiguration.newBuilder().separator("--").build());
    final GroupNode tree = custom.apply(XmlShredder.shred(MetatreeTestHelper.REPEATED_SIBLINGS));
    assertTrue(tree.getGroup("b--1").isPresent());
  }

  @Test
  public void testTokensComeFromSupplier() {
    final ForwardTransform custom =
        new ForwardTransform(TransformConfiguration.defaults(), () -> new TokenGenerator() {
          private char next = 'a';

          @Override
          public String next() {
            return String.valueOf(next++);
          }
        });
    final GroupNode tree = custom.apply(XmlShredder.shred(MetatreeTestHelper.REPEATED_SIBLINGS));
    assertTrue(tree.getGroup("b_a").isPresent());
  }

  @Test
  public void testDeterministic() {
    final SourceNode root = XmlShredder.shred(MetatreeTestHelper.resource(MetatreeTestHelper.SAMPLE_METADATA));
    assertEquals(forward.apply(root), forward.apply(root));
  }

  @Test
  public void testSiblingNamesAreUnique() {
    final GroupNode tree =
        forward.apply(XmlShredder.shred(MetatreeTestHelper.resource(MetatreeTestHelper.SAMPLE_METADATA)));
    final Deque<GroupNode> groups = new ArrayDeque<>();
    groups.push(tree);
    while (!groups.isEmpty()) {
      final GroupNode group = groups.pop();
      final Set<String> names = new HashSet<>();
      for (final Entry entry : group.getEntries()) {
        assertTrue(names.add(entry.getName()), "Duplicate name " + entry.getName() + " in " + group.getName());
      }
      group.getGroups().forEach(groups::push);
    }
  }

  @Test
  public void testConfiguredRecordListWithSingleObjectRecord() {
    final ForwardTransform custom =
        new ForwardTransform(TransformConfiguration.newBuilder().addRecordListName("list").build());
    final GroupNode expected = GroupNode.newBuilder("doc")
                                        .entry(GroupNode.newBuilder("list")
                                                        .entry(GroupNode.newBuilder("record_1")
                                                                        .type("#record")
                                                                        .entry(GroupNode.newBuilder("CI_X")
                                                                                        .attribute("n", "1")
                                                                                        .build())
                                                                        .build())
                                                        .build())
                                        .build();
    assertEquals(expected, custom.apply(XmlShredder.shred("<doc><list><CI_X><n>1</n></CI_X></list></doc>")));
  }

  @Test
  public void testConfiguredRecordListWithSingleWrapperRecord() {
    final ForwardTransform custom =
        new ForwardTransform(TransformConfiguration.newBuilder().addRecordListName("list").build());
    final GroupNode expected = GroupNode.newBuilder("doc")
                                        .entry(GroupNode.newBuilder("list")
                                                        .entry(GroupNode.newBuilder("record_1")
                                                                        .type("#record")
                                                                        .attribute("CharacterString", "x")
                                                                        .build())
                                                        .build())
                                        .build();
    assertEquals(expected,
        custom.apply(XmlShredder.shred("<doc><list><CharacterString>x</CharacterString></list></doc>")));
  }
}
