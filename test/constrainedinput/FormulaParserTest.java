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
import com.google.common.collect.ImmutableSet;

import junit.framework.TestCase;

import java.io.IOException;

public class FormulaParserTest extends TestCase {
  private final FormulaParser parser =
      FormulaParser.create(PredicateSignature.standard());

  public void testQuantifiers() throws IOException {
    Formula formula = parser.parse(Fixtures.definedBeforeUse());
    assertEquals(ImmutableSet.of(Variable.start()), formula.freeVariables());

    ForallFormula outer = (ForallFormula) formula;
    assertEquals(Variable.bound("use_assgn", "<assgn>"),
        outer.boundVariable());
    assertEquals(Variable.start(), outer.inVariable());
    assertEquals("{<var> lhs} := {<rhs> rhs}",
        outer.matchExpression().text());

    ForallFormula inner = (ForallFormula) outer.body();
    assertEquals(Variable.bound("rhs", "<rhs>"), inner.inVariable());
    assertNull(inner.matchExpression());

    ExistsFormula exists = (ExistsFormula) inner.body();
    ConjunctiveFormula body = (ConjunctiveFormula) exists.body();
    assertTrue(body.conjuncts().get(0) instanceof StructuralPredicateFormula);
    assertTrue(body.conjuncts().get(1) instanceof SmtFormula);
  }

  public void testFreeNonterminalIsQuantifiedOverStart() {
    ForallFormula formula = (ForallFormula) parser.parse("(= <var> \"x\")");
    assertEquals("<var>", formula.boundVariable().type());
    assertEquals(Variable.start(), formula.inVariable());
    SmtFormula atom = (SmtFormula) formula.body();
    assertEquals(ImmutableList.of(formula.boundVariable()), atom.variables());
    assertEquals("(= " + formula.boundVariable().name() + " \"x\")",
        atom.text());
  }

  public void testFreeNonterminalInPredicate() {
    ForallFormula formula =
        (ForallFormula) parser.parse("forall <assgn> a in start: "
            + "level(\"EQ\", \"<stmt>\", a, <var>)");
    ForallFormula desugared = (ForallFormula) formula.body();
    assertEquals("<var>", desugared.boundVariable().type());
    assertTrue(desugared.body() instanceof StructuralPredicateFormula);
  }

  public void testPrecedence() {
    Formula formula = parser.parse(
        "(= start \"a\") or (= start \"b\") and not (= start \"c\")");
    DisjunctiveFormula disjunction = (DisjunctiveFormula) formula;
    assertEquals(2, disjunction.disjuncts().size());
    ConjunctiveFormula conjunction =
        (ConjunctiveFormula) disjunction.disjuncts().get(1);
    assertTrue(conjunction.conjuncts().get(1) instanceof NegatedFormula);
  }

  public void testImplicationDesugars() {
    DisjunctiveFormula formula = (DisjunctiveFormula) parser.parse(
        "(= start \"a\") implies (= start \"b\")");
    assertTrue(formula.disjuncts().get(0) instanceof NegatedFormula);
    assertTrue(formula.disjuncts().get(1) instanceof SmtFormula);
  }

  public void testParenthesizedFormula() {
    Formula formula = parser.parse(
        "((= start \"a\") or (= start \"b\")) and true");
    assertTrue(formula instanceof ConjunctiveFormula);
  }

  public void testConstantDeclaration() {
    Formula formula = parser.parse("const s: <start>; (= s \"x\")");
    assertEquals(ImmutableSet.of(Variable.constant("s", "<start>")),
        formula.freeVariables());
  }

  public void testComments() {
    Formula formula = parser.parse("# leading\n(= start \"x\") # trailing");
    assertTrue(formula instanceof SmtFormula);
  }

  public void testErrors() {
    String[] malformed = {
        "unknown(start)",
        "before(start)",
        "before(x, start)",
        "count(start, \"<var>\")",
        "forall <var> v start: true",
        "(= start \"x\"",
        "(< <var> 3)",
        "true true"};
    for (String text : malformed) {
      try {
        parser.parse(text);
        fail("Should have rejected " + text);
      } catch (FormulaException expected) {
      }
    }
  }

  public void testGrammarCheck() throws IOException {
    Grammar grammar = Fixtures.assignments();
    try {
      parser.parse("forall <nope> x in start: true", grammar);
      fail("Should have rejected an undefined type");
    } catch (FormulaException expected) {
    }
    try {
      parser.parse("exists <assgn> a=\"{<digit> d} := 1\" in start: true",
          grammar);
      fail("Should have rejected an underivable match expression");
    } catch (FormulaException expected) {
    }
  }

  public void testMissingSignature() {
    try {
      FormulaParser.create(null);
      fail();
    } catch (ConfigurationException expected) {
    }
  }

  public void testUnparseParsesBack() throws IOException {
    String[] constraints = {
        Fixtures.definedBeforeUse(),
        "(= <var> \"x\") or not before(start, start)",
        "const s: <start>; exists <digit> d in s: (str.in_re d "
            + "(re.range \"1\" \"3\"))",
        "count(start, \"<assgn>\", <digit>)"};
    for (String constraint : constraints) {
      Formula formula = parser.parse(constraint);
      String printed = FormulaUnparser.unparseWithConstants(formula);
      assertEquals(printed, formula, parser.parse(printed));
    }
  }
}
