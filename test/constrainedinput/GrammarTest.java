/*
 * Copyright 2010 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package constrainedinput;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import junit.framework.TestCase;

import java.io.IOException;
import java.util.List;

public class GrammarTest extends TestCase {
  private Grammar grammar;

  @Override
  protected void setUp() throws IOException {
    grammar = Fixtures.assignments();
  }

  public void testSplitAlternative() {
    assertEquals(ImmutableList.of("<var>", " := ", "<rhs>"),
        Grammar.splitAlternative("<var> := <rhs>"));
    assertEquals(ImmutableList.of(), Grammar.splitAlternative(""));
  }

  public void testIsNonterminal() {
    assertTrue(Grammar.isNonterminal("<assgn>"));
    assertFalse(Grammar.isNonterminal("<a b>"));
    assertFalse(Grammar.isNonterminal("x"));
  }

  public void testReachability() {
    assertTrue(grammar.reachable("<start>", "<digit>"));
    assertTrue(grammar.reachable("<var>", "<var>"));
    assertFalse(grammar.reachable("<rhs>", "<assgn>"));
    assertTrue(grammar.isRecursive("<stmt>"));
    assertFalse(grammar.isRecursive("<assgn>"));
  }

  public void testMinimalCost() {
    assertEquals(1, grammar.minimalCost("<var>"));
    assertEquals(2, grammar.minimalCost("<rhs>"));
    assertEquals(4, grammar.minimalCost("<assgn>"));
    assertEquals(6, grammar.minimalCost("<start>"));
    assertEquals(ImmutableList.of("<assgn>"),
        grammar.cheapestAlternative("<stmt>"));
  }

  public void testFiniteLanguage() {
    assertEquals(26, grammar.finiteLanguage("<var>", 100).size());
    assertEquals(36, grammar.finiteLanguage("<rhs>", 100).size());
    assertNull(grammar.finiteLanguage("<rhs>", 20));
    assertNull(grammar.finiteLanguage("<stmt>", 100));
  }

  public void testUndefinedNonterminal() {
    try {
      Grammar.create(ImmutableMap.<String, List<String>>of(
          "<start>", ImmutableList.of("<missing>")));
      fail("Should have rejected an undefined nonterminal");
    } catch (GrammarException expected) {
      assertTrue(expected.getMessage().contains("<missing>"));
    }
  }

  public void testMissingStartSymbol() {
    try {
      Grammar.create(ImmutableMap.<String, List<String>>of(
          "<a>", ImmutableList.of("x")));
      fail("Should have rejected a grammar without <start>");
    } catch (GrammarException expected) {
    }
  }

  public void testUnreachableNonterminal() {
    try {
      Grammar.create(ImmutableMap.<String, List<String>>of(
          "<start>", ImmutableList.of("x"),
          "<island>", ImmutableList.of("y")));
      fail("Should have rejected an unreachable nonterminal");
    } catch (GrammarException expected) {
      assertTrue(expected.getMessage().contains("<island>"));
    }
  }

  public void testUnproductiveNonterminal() {
    try {
      Grammar.create(ImmutableMap.<String, List<String>>of(
          "<start>", ImmutableList.of("<loop>"),
          "<loop>", ImmutableList.of("<loop>x")));
      fail("Should have rejected a nonterminal that derives no word");
    } catch (GrammarException expected) {
    }
  }

  public void testAlternativesOfUndefined() {
    try {
      grammar.alternatives("<nope>");
      fail();
    } catch (GrammarException expected) {
    }
  }
}
