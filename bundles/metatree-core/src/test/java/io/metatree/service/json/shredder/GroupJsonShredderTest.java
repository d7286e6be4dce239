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

package io.metatree.service.json.shredder;

import io.metatree.MetatreeTestHelper;
import io.metatree.access.Transforms;
import io.metatree.exception.MalformedGroupException;
import io.metatree.exception.MetatreeIOException;
import io.metatree.node.GroupNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public final class GroupJsonShredderTest {

  @Test
  public void testShred() {
    final GroupNode tree = GroupJsonShredder.shred("""
        {
          "entries": [
            {"value": "1", "attribute": "@x"},
            {"group": "role", "type": "CI_RoleCode", "entries": []},
            {"attribute": "title", "value": "Sea", "type": null}
          ],
          "group": "a"
        }
        """);
    final GroupNode expected = GroupNode.newBuilder("a")
                                        .attribute("@x", "1")
                                        .entry(GroupNode.newBuilder("role").type("CI_RoleCode").build())
                                        .attribute("title", "Sea")
                                        .build();
    assertEquals(expected, tree);
  }

  @Test
  public void testSampleMetadataReimport() {
    final Transforms transforms = Transforms.create();
    final GroupNode tree = transforms.forward(MetatreeTestHelper.resource(MetatreeTestHelper.SAMPLE_METADATA));
    assertEquals(tree, transforms.fromJson(transforms.toJson(tree)));
  }

  @Test
  public void testTopLevelAttribute() {
    assertThrows(MalformedGroupException.class, () -> GroupJsonShredder.shred("{\"attribute\":\"a\",\"value\":\"b\"}"));
  }

  @Test
  public void testAmbiguousEntry() {
    assertThrows(MalformedGroupException.class,
        () -> GroupJsonShredder.shred("{\"group\":\"a\",\"attribute\":\"b\",\"value\":\"c\"}"));
  }

  @Test
  public void testMissingValue() {
    assertThrows(MalformedGroupException.class,
        () -> GroupJsonShredder.shred("{\"group\":\"a\",\"entries\":[{\"attribute\":\"b\"}]}"));
  }

  @Test
  public void testUnknownMember() {
    assertThrows(MalformedGroupException.class, () -> GroupJsonShredder.shred("{\"group\":\"a\",\"size\":1}"));
  }

  @Test
  public void testNumberValue() {
    assertThrows(MalformedGroupException.class,
        () -> GroupJsonShredder.shred("{\"group\":\"a\",\"entries\":[{\"attribute\":\"b\",\"value\":1}]}"));
  }

  @Test
  public void testTrailingContent() {
    assertThrows(MalformedGroupException.class, () -> GroupJsonShredder.shred("{\"group\":\"a\"} {\"group\":\"b\"}"));
  }

  @Test
  public void testNotWellFormed() {
    assertThrows(MetatreeIOException.class, () -> GroupJsonShredder.shred("{\"group\":\"a\","));
  }
}
