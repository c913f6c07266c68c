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

import java.io.IOException;
import java.util.List;

/**
 * Grammars and constraints shared by the tests.
 */
final class Fixtures {
  static final String ASSIGNMENTS = "test/data/assignments.grammar";
  static final String DEFINED_BEFORE_USE =
      "test/data/defined_before_use.constraint";

  private Fixtures() {}

  static Grammar assignments() throws IOException {
    return new FileLoader().loadGrammar(ASSIGNMENTS);
  }

  static String definedBeforeUse() throws IOException {
    return new FileLoader().toString(DEFINED_BEFORE_USE);
  }

  /** A word is either one digit or one letter from a to c. */
  static Grammar digitOrLetter() {
    return Grammar.create(ImmutableMap.<String, List<String>>of(
        "<start>", ImmutableList.of("<digit>", "<letter>"),
        "<digit>", ImmutableList.of("0", "1", "2"),
        "<letter>", ImmutableList.of("a", "b", "c")));
  }

  /** A list of x's, an equals sign and a number. */
  static Grammar countedList() {
    return Grammar.create(ImmutableMap.<String, List<String>>of(
        "<start>", ImmutableList.of("<list>=<num>"),
        "<list>", ImmutableList.of("x", "x<list>"),
        "<num>", ImmutableList.of("<digit>", "<digit><num>"),
        "<digit>", ImmutableList.of(
            "0", "1", "2", "3", "4", "5", "6", "7", "8", "9")));
  }

  static DerivationTree parse(Grammar grammar, String input) {
    return GrammarParser.create(grammar).parse(input, IdSource.startingAt(0));
  }
}
