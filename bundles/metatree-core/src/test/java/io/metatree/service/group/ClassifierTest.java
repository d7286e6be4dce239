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

import io.metatree.access.TransformConfiguration;
import io.metatree.node.SourceNode;
import io.metatree.service.xml.shredder.XmlShredder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ClassifierTest {

  private static final String GCO = "xmlns:gco=\"http://www.isotc211.org/2005/gco\"";

  private ClassificationTable table;

  private Classifier classifier;

  @BeforeEach
  public void setUp() {
    table = new ClassificationTable(TransformConfiguration.defaults());
    classifier = new Classifier(table);
  }

  @Test
  public void testNil() {
    assertEquals(Category.NIL, classifier.classify(SourceNode.newBuilder("status").build()));
    assertEquals(Category.NIL, classifier.classify(SourceNode.newBuilder("status").text("  \n ").build()));
  }

  @Test
  public void testEmptyWithAttributesIsGroup() {
    final SourceNode node = SourceNode.newBuilder("status").attribute("nilReason", "missing").build();
    assertEquals(Category.GROUP, classifier.classify(node));
  }

  @Test
  public void testEmptyWithNamespaceIsGroup() {
    final SourceNode node = SourceNode.newBuilder("box").namespace("", "http://example.org/extent").build();
    assertEquals(Category.GROUP, classifier.classify(node));
  }

  @Test
  public void testFundamental() {
    final SourceNode node =
        XmlShredder.shred("<title " + GCO + "><gco:CharacterString>Sea</gco:CharacterString></title>");
    assertEquals(Category.FUNDAMENTAL, classifier.classify(node));
  }

  @Test
  public void testWrapperWithAttributesIsNoFundamental() {
    final SourceNode node =
        XmlShredder.shred("<title " + GCO + "><gco:CharacterString id=\"t\">Sea</gco:CharacterString></title>");
    assertEquals(Category.GROUP, classifier.classify(node));
  }

  @Test
  public void testUnknownWrapperIsNoFundamental() {
    final SourceNode node = XmlShredder.shred("<title " + GCO + "><gco:Text>Sea</gco:Text></title>");
    assertEquals(Category.GROUP, classifier.classify(node));
  }

  @Test
  public void testConfiguredWrapper() {
    final Classifier custom =
        new Classifier(new ClassificationTable(TransformConfiguration.newBuilder().addPrimitiveWrapper("Text").build()));
    final SourceNode node = XmlShredder.shred("<title " + GCO + "><gco:Text>Sea</gco:Text></title>");
    assertEquals(Category.FUNDAMENTAL, custom.classify(node));
  }

  @Test
  public void testPlainValue() {
    assertEquals(Category.PLAIN_VALUE, classifier.classify(XmlShredder.shred("<west> -180 </west>")));
  }

  @Test
  public void testTextWithAttributesIsGroup() {
    assertEquals(Category.GROUP, classifier.classify(XmlShredder.shred("<b x=\"1\">hi</b>")));
  }

  @Test
  public void testCompoundTextIsGroup() {
    assertEquals(Category.GROUP, classifier.classify(XmlShredder.shred("<CI_Date>2015</CI_Date>")));
  }

  @Test
  public void testCompoundObject() {
    assertTrue(table.isCompoundObject(SourceNode.newBuilder("CI_Citation").build().getName()));
    assertTrue(table.isCompoundObject(SourceNode.newBuilder("MD_Metadata").build().getName()));
    assertFalse(table.isCompoundObject(SourceNode.newBuilder("LanguageCode").build().getName()));
    assertFalse(table.isCompoundObject(SourceNode.newBuilder("file_name").build().getName()));
  }

  @Test
  public void testObjectOf() {
    final SourceNode property = XmlShredder.shred("<citation><CI_Citation><title>t</title></CI_Citation></citation>");
    assertEquals("CI_Citation", table.objectOf(property).orElseThrow().getQualifiedName());
    assertTrue(table.objectOf(XmlShredder.shred("<citation a=\"1\"><CI_Citation/></citation>")).isEmpty());
    assertTrue(table.objectOf(XmlShredder.shred("<citation><Citation/></citation>")).isEmpty());
  }

  @Test
  public void testRecordList() {
    assertTrue(table.isRecordList(XmlShredder.shred("<list><item><n>1</n></item><item><n>2</n></item></list>")));
    // Records must have element children.
    assertFalse(table.isRecordList(XmlShredder.shred("<a><b x=\"1\">hi</b><b x=\"2\">bye</b></a>")));
    // Records must share one tag.
    assertFalse(table.isRecordList(XmlShredder.shred("<list><item><n>1</n></item><other><n>2</n></other></list>")));
    // A single record is no list.
    assertFalse(table.isRecordList(XmlShredder.shred("<list><item><n>1</n></item></list>")));
  }

  @Test
  public void testConfiguredRecordList() {
    final ClassificationTable custom = new ClassificationTable(
        TransformConfiguration.newBuilder().addRecordListName("list").detectRecordLists(false).build());
    assertTrue(custom.isRecordList(XmlShredder.shred("<list><item>1</item></list>")));
    assertFalse(custom.isRecordList(XmlShredder.shred("<other><item><n>1</n></item><item><n>2</n></item></other>")));
  }
}
