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

package io.metatree.service.group.serialize;

import io.metatree.node.GroupNode;
import io.metatree.settings.Constants;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class GroupXmlSerializerTest {

  private static final GroupNode TREE = GroupNode.newBuilder("a")
                                                 .entry(GroupNode.newBuilder("b")
                                                                 .attribute("@x", "1")
                                                                 .attribute("value", "hi")
                                                                 .build())
                                                 .entry(GroupNode.newBuilder("b_1")
                                                                 .attribute("@x", "2")
                                                                 .attribute("value", "bye")
                                                                 .build())
                                                 .build();

  @Test
  public void testPrettyPrint() {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    GroupXmlSerializer.newBuilder(TREE, out).prettyPrint().emitXMLDeclaration().build().call();
    final String expected = """
        <?xml version="1.0" encoding="UTF-8"?>
        <group name="a">
          <group name="b">
            <attribute name="@x" value="1"/>
            <attribute name="value" value="hi"/>
          </group>
          <group name="b_1">
            <attribute name="@x" value="2"/>
            <attribute name="value" value="bye"/>
          </group>
        </group>
        """;
    assertEquals(expected, out.toString(Constants.DEFAULT_ENCODING));
  }

  @Test
  public void testTypesAndEscaping() {
    final GroupNode tree = GroupNode.newBuilder("a")
                                    .entry(GroupNode.newBuilder("role").type("gmd:CI_RoleCode").build())
                                    .attribute("title", "<Sea & \"Ocean\">", "gco:CharacterString")
                                    .build();
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    GroupXmlSerializer.newBuilder(tree, out).build().call();
    assertEquals("<group name=\"a\"><group name=\"role\" type=\"gmd:CI_RoleCode\"/>"
        + "<attribute name=\"title\" value=\"&lt;Sea &amp; &quot;Ocean&quot;&gt;\" type=\"gco:CharacterString\"/>"
        + "</group>", out.toString(Constants.DEFAULT_ENCODING));
  }
}
