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

public class FormulasTest extends TestCase {
  private static final Variable VAR = Variable.bound("v", "<var>");
  private static final SmtFormula IS_X =
      SmtFormula.create("(= v \"x\")", ImmutableList.of(VAR));
  private static final SmtFormula IS_Y =
      SmtFormula.create("(= v \"y\")", ImmutableList.of(VAR));

  public void testAndOrFoldConstants() {
    assertEquals(IS_X, Formulas.and(SmtFormula.TRUE, IS_X));
    assertEquals(SmtFormula.FALSE, Formulas.and(IS_X, SmtFormula.FALSE));
    assertEquals(SmtFormula.TRUE, Formulas.or(IS_X, SmtFormula.TRUE));
    assertEquals(IS_Y, Formulas.or(SmtFormula.FALSE, IS_Y));
    assertEquals(SmtFormula.TRUE, Formulas.and());
  }

  public void testAndFlattens() {
    Formula nested = Formulas.and(Formulas.and(IS_X, IS_Y), IS_X);
    assertEquals(ImmutableList.of(IS_X, IS_Y, IS_X),
        Formulas.conjuncts(nested));
  }

  public void testNegationNormalForm() {
    Formula formula = NegatedFormula.create(ForallFormula.create(VAR,
        Variable.start(), Formulas.or(IS_X,
            NegatedFormula.create(StructuralPredicateFormula.create("before",
                ImmutableList.<Object>of(VAR, Variable.start()))))));
    ExistsFormula nnf = (ExistsFormula) Formulas.toNegationNormalForm(formula);
    ConjunctiveFormula body = (ConjunctiveFormula) nnf.body();
    assertEquals("(not (= v \"x\"))",
        ((SmtFormula) body.conjuncts().get(0)).text());
    assertTrue(body.conjuncts().get(1) instanceof StructuralPredicateFormula);
  }

  public void testNegatedPredicateStaysWrapped() {
    Formula atom = SemanticPredicateFormula.create("count",
        ImmutableList.<Object>of(Variable.start(), "<var>", VAR));
    Formula nnf = Formulas.toNegationNormalForm(NegatedFormula.create(atom));
    assertEquals(NegatedFormula.create(atom), nnf);
  }

  public void testDoubleNegation() {
    assertEquals(IS_X, Formulas.toNegationNormalForm(
        NegatedFormula.create(NegatedFormula.create(IS_X))));
  }

  public void testCheckWellFormed() throws IOException {
    Grammar grammar = Fixtures.assignments();
    PredicateSignature signature = PredicateSignature.standard();
    Formulas.checkWellFormed(ForallFormula.create(VAR, Variable.start(), IS_X),
        grammar, signature);
    try {
      Formulas.checkWellFormed(IS_X, grammar, signature);
      fail("v is free");
    } catch (FormulaException expected) {
    }
    try {
      Formulas.checkWellFormed(ForallFormula.create(
          Variable.bound("n", "<number>"), Variable.start(), SmtFormula.TRUE),
          grammar, signature);
      fail("<number> is not in the grammar");
    } catch (FormulaException expected) {
    }
    try {
      Formulas.checkWellFormed(StructuralPredicateFormula.create("before",
          ImmutableList.<Object>of(Variable.start())), grammar, signature);
      fail("before takes two arguments");
    } catch (FormulaException expected) {
    }
  }
}
