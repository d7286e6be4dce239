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
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public final class NamerTest {

  @Test
  public void testRepeatedNamesAreSuffixed() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    assertEquals(ImmutableList.of("b", "b_1", "c", "b_2"), namer.disambiguate(List.of("b", "b", "c", "b")));
  }

  @Test
  public void testSiblingUniqueness() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    final List<String> names = namer.disambiguate(List.of("b", "b_1", "b", "value", "nilReason", "b", "b_1"));
    assertEquals(names.size(), new HashSet<>(names).size(), names.toString());
  }

  @Test
  public void testIdempotence() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    final ImmutableList<String> names = namer.disambiguate(List.of("b", "b", "c", "b", "d"));
    assertEquals(names, new Namer("_", TokenGenerator.counting()).disambiguate(names));
  }

  @Test
  public void testReservedNamesAreSuffixed() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    final Namer.Siblings siblings = namer.newSiblings();
    assertEquals("value_1", namer.name(siblings, "value"));
    assertEquals("nilReason_2", namer.name(siblings, "nilReason"));
    assertTrue(Namer.isReserved("namespace_0"));
    assertFalse(Namer.isReserved("namespace"));
  }

  @Test
  public void testSuffixNeverLooksLikeNamespaceRecord() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    final Namer.Siblings siblings = namer.newSiblings();
    assertEquals("namespace", namer.name(siblings, "namespace"));
    final String second = namer.name(siblings, "namespace");
    assertEquals("namespace_1_2", second);
    assertFalse(Namer.isReserved(second));
    assertEquals("namespace", namer.baseName(second));
  }

  @Test
  public void testTakenNamesAreSkipped() {
    final TokenGenerator tokens = mock(TokenGenerator.class);
    when(tokens.next()).thenReturn("1", "2");
    final Namer namer = new Namer("_", tokens);
    final Namer.Siblings siblings = namer.newSiblings();
    siblings.fixed("b_1");
    assertEquals("b", namer.name(siblings, "b"));
    assertEquals("b_2", namer.name(siblings, "b"));
    verify(tokens, times(2)).next();
  }

  @Test
  public void testFirstOccurrenceDrawsNoToken() {
    final TokenGenerator tokens = mock(TokenGenerator.class);
    final Namer namer = new Namer("_", tokens);
    assertEquals(ImmutableList.of("a", "b", "c"), namer.disambiguate(List.of("a", "b", "c")));
    verify(tokens, never()).next();
  }

  @Test
  public void testFreshName() {
    final Namer namer = new Namer("_", TokenGenerator.counting());
    final Namer.Siblings siblings = namer.newSiblings();
    assertEquals("record_1", namer.freshName(siblings, "record"));
    assertEquals("record_2", namer.freshName(siblings, "record"));
  }

  @Test
  public void testBaseName() {
    final Namer namer = new Namer("--", TokenGenerator.counting());
    assertEquals("gmd:keyword", namer.baseName("gmd:keyword--17"));
    assertEquals("gmd:keyword", namer.baseName("gmd:keyword"));
    assertEquals("b", Namer.baseName("b_1_2", "_"));
  }
}
