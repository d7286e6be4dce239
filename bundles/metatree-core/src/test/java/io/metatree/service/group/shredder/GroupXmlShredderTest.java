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

package io.metatree.service.group.shredder;

import io.metatree.MetatreeTestHelper;
import io.metatree.access.Transforms;
import io.metatree.exception.MalformedGroupException;
import io.metatree.exception.MetatreeException;
import io.metatree.node.GroupNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class GroupXmlShredderTest {

  @Test
  public void testShred() {
    final GroupNode tree = GroupXmlShredder.shred("""
        <group name="a">
          <group name="role" type="gmd:CI_RoleCode">
            <attribute name="@codeListValue" value="author"/>
          </group>
          <attribute name="title" value="Sea" type="gco:CharacterString"/>
        </group>
        """);
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .entry(GroupNode.newBuilder("role")
                                                        .type("gmd:CI_RoleCode")
                                                        .attribute("@codeListValue", "author")
                                                        .build())
                                        .attribute("title", "Sea", "gco:CharacterString")
                                        .build();
    assertEquals(expected, tree);
  }

  @Test
  public void testSampleMetadataReimport() {
    final Transforms transforms = Transforms.create();
    final GroupNode tree = transforms.forward(MetatreeTestHelper.resource(MetatreeTestHelper.SAMPLE_METADATA));
    assertEquals(tree, GroupXmlShredder.shred(transforms.toGroupXml(tree)));
  }

  @Test
  public void testValuesKeepWhitespace() {
    final GroupNode tree = GroupNode.newBuilder("a").attribute("t", " two\nlines\t").build();
    assertEquals(tree, GroupXmlShredder.shred(Transforms.create().toGroupXml(tree)));
  }

  @Test
  public void testUnexpectedElement() {
    assertThrows(MalformedGroupException.class,
        () -> GroupXmlShredder.shred("<group name=\"a\"><entry name=\"b\"/></group>"));
  }

  @Test
  public void testAttributeAsTopLevel() {
    assertThrows(MalformedGroupException.class, () -> GroupXmlShredder.shred("<attribute name=\"a\" value=\"b\"/>"));
  }

  @Test
  public void testMissingName() {
    assertThrows(MalformedGroupException.class, () -> GroupXmlShredder.shred("<group/>"));
  }

  @Test
  public void testMissingValue() {
    assertThrows(MalformedGroupException.class,
        () -> GroupXmlShredder.shred("<group name=\"a\"><attribute name=\"b\"/></group>"));
  }

  @Test
  public void testUnexpectedAttribute() {
    assertThrows(MalformedGroupException.class,
        () -> GroupXmlShredder.shred("<group name=\"a\" value=\"b\"/>"));
  }

  @Test
  public void testTextContent() {
    assertThrows(MalformedGroupException.class, () -> GroupXmlShredder.shred("<group name=\"a\">text</group>"));
  }

  @Test
  public void testNestedInAttribute() {
    assertThrows(MalformedGroupException.class, () -> GroupXmlShredder.shred(
        "<group name=\"a\"><attribute name=\"b\" value=\"c\"><group name=\"d\"/></attribute></group>"));
  }

  @Test
  public void testNotWellFormed() {
    assertThrows(MetatreeException.class, () -> GroupXmlShredder.shred("<group name=\"a\">"));
  }
}
