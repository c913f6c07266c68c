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

import junit.framework.TestCase;

import java.io.IOException;

public class GrammarFileParserTest extends TestCase {
  public void testLoadFixture() throws IOException {
    Grammar grammar = Fixtures.assignments();
    assertEquals(6, grammar.nonterminals().size());
    assertEquals(26, grammar.alternatives("<var>").size());
    assertEquals(ImmutableList.of("<assgn>", " ; ", "<stmt>"),
        grammar.alternatives("<stmt>").get(1));
  }

  public void testEscapesAndEpsilon() {
    Grammar grammar = GrammarFileParser.parse(
        "<start> ::= \"\\\"<q>\\\"\"\n<q> ::= \"\" | \"a\\\\b\"");
    assertEquals(ImmutableList.of("\"", "<q>", "\""),
        grammar.alternatives("<start>").get(0));
    assertEquals(ImmutableList.of(), grammar.alternatives("<q>").get(0));
    assertEquals(ImmutableList.of("a\\b"), grammar.alternatives("<q>").get(1));
  }

  public void testToStringParsesBack() throws IOException {
    Grammar grammar = Fixtures.assignments();
    Grammar again = GrammarFileParser.parse(grammar.toString());
    for (String nonterminal : grammar.nonterminals()) {
      assertEquals(grammar.alternatives(nonterminal),
          again.alternatives(nonterminal));
    }
  }

  public void testErrorReportsLine() {
    try {
      GrammarFileParser.parse("<start> ::= \"<a>\"\n<a> ::= b");
      fail("Should have rejected an unquoted alternative");
    } catch (GrammarException expected) {
      assertTrue(expected.getMessage(),
          expected.getMessage().contains("line 2"));
    }
  }

  public void testDuplicateRule() {
    try {
      GrammarFileParser.parse("<start> ::= \"a\"\n<start> ::= \"b\"");
      fail();
    } catch (GrammarException expected) {
      assertTrue(expected.getMessage().contains("Duplicate"));
    }
  }
}
