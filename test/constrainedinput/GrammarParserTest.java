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

public class GrammarParserTest extends TestCase {
  private Grammar grammar;
  private GrammarParser parser;

  @Override
  protected void setUp() throws IOException {
    grammar = Fixtures.assignments();
    parser = GrammarParser.create(grammar);
  }

  public void testParseAssignsIdsInPreOrder() {
    DerivationTree tree = parser.parse("a := 7", IdSource.startingAt(10));
    assertEquals(10, tree.id());
    assertEquals(11, tree.child(0).id());
    assertEquals("a := 7", tree.render());
    assertEquals("<digit>",
        tree.getSubtree(Path.of(0, 0, 2, 0)).value());
  }

  public void testParseFromOtherNonterminal() {
    DerivationTree tree = parser.parse("q", "<rhs>", IdSource.startingAt(0));
    assertEquals("<rhs>", tree.value());
    assertEquals("<var>", tree.child(0).value());
  }

  public void testRejects() {
    assertFalse(parser.accepts("x := ", "<start>"));
    assertFalse(parser.accepts("xy", "<var>"));
    assertTrue(parser.accepts("x := 1 ; y := 2 ; z := y", "<start>"));
    try {
      parser.parse("1 := x", IdSource.startingAt(0));
      fail("Should not parse");
    } catch (GrammarException expected) {
      assertTrue(expected.getMessage().contains("1 := x"));
    }
  }

  public void testPlaceholderTokensBecomeOpenLeaves() {
    List<String> tokens = ImmutableList.<String>builder()
        .add("<var>")
        .addAll(GrammarParser.characters(" := "))
        .add("<rhs>")
        .build();
    DerivationTree tree =
        parser.parseTokens(tokens, "<assgn>", IdSource.startingAt(0));
    assertNotNull(tree);
    assertEquals(ImmutableList.of(Path.of(0), Path.of(2)), tree.openLeaves());
    assertNotNull(
        parser.parseTokens(tokens, "<stmt>", IdSource.startingAt(0)));
    assertNull(parser.parseTokens(tokens, "<rhs>", IdSource.startingAt(0)));
  }

  public void testLeftRecursionAndEpsilon() {
    Grammar listGrammar = Grammar.create(ImmutableMap.<String, List<String>>of(
        "<start>", ImmutableList.of("<list>"),
        "<list>", ImmutableList.of("<list>x", "")));
    GrammarParser listParser = GrammarParser.create(listGrammar);
    assertTrue(listParser.accepts("", "<start>"));
    assertTrue(listParser.accepts("xxx", "<start>"));
    assertFalse(listParser.accepts("xyx", "<start>"));
    assertEquals("xxx",
        listParser.parse("xxx", IdSource.startingAt(0)).render());
  }
}
