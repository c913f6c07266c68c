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
import java.time.Duration;

public class EvaluatorTest extends TestCase {
  private Grammar grammar;
  private Formula definedBeforeUse;
  private Z3SmtSolver smtSolver;
  private Evaluator evaluator;

  @Override
  protected void setUp() throws IOException {
    grammar = Fixtures.assignments();
    PredicateSignature signature = PredicateSignature.standard();
    definedBeforeUse = FormulaParser.create(signature)
        .parse(Fixtures.definedBeforeUse(), grammar);
    smtSolver = Z3SmtSolver.create(Duration.ofSeconds(5));
    evaluator = Evaluator.create(grammar, signature, smtSolver);
  }

  @Override
  protected void tearDown() {
    smtSolver.close();
  }

  private boolean holds(String input, Formula formula) {
    return evaluator.evaluate(Fixtures.parse(grammar, input), formula);
  }

  public void testDefinedBeforeUse() {
    assertTrue(holds("x := 1 ; y := x", definedBeforeUse));
    assertTrue(holds("a := 1 ; b := 2 ; c := b ; d := a", definedBeforeUse));
    assertFalse(holds("x := y", definedBeforeUse));
    // A variable is not defined by the assignment that uses it.
    assertFalse(holds("x := x", definedBeforeUse));
    assertFalse(holds("y := x ; x := 1", definedBeforeUse));
  }

  public void testVacuousUniversal() {
    assertTrue(holds("x := 1", definedBeforeUse));
    assertTrue(holds("x := 1 ; y := 2", definedBeforeUse));
  }

  public void testRepeatable() {
    DerivationTree tree = Fixtures.parse(grammar, "x := 1 ; y := x");
    assertTrue(evaluator.evaluate(tree, definedBeforeUse));
    assertTrue(evaluator.evaluate(tree, definedBeforeUse));
  }

  public void testSmtAtoms() {
    Formula longRhs = FormulaParser.create(PredicateSignature.standard())
        .parse("forall <assgn> a=\"{<var> v} := {<rhs> r}\" in start: "
            + "(or (= v r) (str.in_re r (re.range \"0\" \"9\")))", grammar);
    assertTrue(holds("x := 1 ; y := y", longRhs));
    assertFalse(holds("x := 1 ; y := z", longRhs));
  }

  public void testConstantOfWrongType() {
    Variable variable = Variable.constant("v", "<var>");
    Formula formula = SmtFormula.create("(= v \"x\")",
        ImmutableList.of(variable));
    try {
      holds("x := 1", formula);
      fail();
    } catch (FormulaException expected) {
    }
  }

  public void testUnknownAnswerIsReported() {
    SmtSolver undecided = new SmtSolver() {
      @Override
      public SmtResult solve(SmtQuery query) {
        return SmtResult.unknown("timeout");
      }
    };
    Evaluator evaluator = Evaluator.create(grammar,
        PredicateSignature.standard(), undecided);
    try {
      evaluator.evaluate(Fixtures.parse(grammar, "x := 1 ; y := x"),
          definedBeforeUse);
      fail();
    } catch (SmtUnknownException expected) {
    }
  }
}
