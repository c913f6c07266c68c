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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import junit.framework.TestCase;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public class InputGeneratorTest extends TestCase {
  private static final String NO_TWO_DIGIT_DIGITS =
      "forall <digit> d in start: (= d \"12\")";

  private Z3SmtSolver smtSolver;

  @Override
  protected void setUp() {
    smtSolver = Z3SmtSolver.create(Duration.ofSeconds(5));
  }

  @Override
  protected void tearDown() {
    smtSolver.close();
  }

  private InputGenerator generator(Grammar grammar, String constraint,
      SolverConfiguration configuration) {
    return InputGenerator.create(grammar, constraint,
        PredicateSignature.standard(), smtSolver, configuration);
  }

  public void testDefinedBeforeUse() throws IOException {
    Grammar grammar = Fixtures.assignments();
    String constraint = Fixtures.definedBeforeUse();
    List<String> solutions = generator(grammar, constraint,
        SolverConfiguration.defaults()).generate(10);
    assertEquals(10, solutions.size());
    assertEquals(10, ImmutableSet.copyOf(solutions).size());

    Formula formula = FormulaParser.create(PredicateSignature.standard())
        .parse(constraint, grammar);
    Evaluator evaluator = Evaluator.create(grammar,
        PredicateSignature.standard(), smtSolver);
    for (String solution : solutions) {
      assertFalse(solution.equals("x := y"));
      assertTrue(solution, evaluator.evaluate(
          Fixtures.parse(grammar, solution), formula));
    }
  }

  public void testDeterministic() throws IOException {
    Grammar grammar = Fixtures.assignments();
    SolverConfiguration configuration = SolverConfiguration.builder()
        .expansionPolicy(ExpansionPolicy.RANDOM)
        .randomSeed(7)
        .build();
    List<String> first = generator(grammar, Fixtures.definedBeforeUse(),
        configuration).generate(5);
    List<String> second = generator(grammar, Fixtures.definedBeforeUse(),
        configuration).generate(5);
    assertEquals(5, first.size());
    assertEquals(first, second);
  }

  public void testUnsatisfiableAtomPrunes() {
    InputGenerator generator = generator(Fixtures.digitOrLetter(),
        NO_TWO_DIGIT_DIGITS, SolverConfiguration.defaults());
    List<String> solutions = generator.generate(10);
    assertEquals(ImmutableSet.of("a", "b", "c"),
        ImmutableSet.copyOf(solutions));
    assertEquals(3, solutions.size());
    assertTrue(generator.isExhausted());
    assertEquals(SearchResult.Kind.EXHAUSTED, generator.advance().kind());
  }

  public void testUnknownAnswersPrune() {
    SmtSolver undecided = new SmtSolver() {
      @Override
      public SmtResult solve(SmtQuery query) {
        return SmtResult.unknown("timeout");
      }
    };
    InputGenerator generator = InputGenerator.create(
        Fixtures.digitOrLetter(), NO_TWO_DIGIT_DIGITS,
        PredicateSignature.standard(), undecided,
        SolverConfiguration.defaults());
    assertEquals(ImmutableSet.of("a", "b", "c"),
        ImmutableSet.copyOf(generator.generate(10)));
  }

  public void testFreeInstantiationBudget() throws IOException {
    Grammar grammar = Fixtures.assignments();
    // The shortest word takes six expansions.
    InputGenerator tooSmall = InputGenerator.create(grammar, SmtFormula.TRUE,
        PredicateSignature.standard(), smtSolver,
        SolverConfiguration.builder().maxFreeInstantiations(5).build());
    assertEquals(SearchResult.Kind.EXHAUSTED, tooSmall.advance().kind());

    InputGenerator one = InputGenerator.create(grammar, SmtFormula.TRUE,
        PredicateSignature.standard(), smtSolver,
        SolverConfiguration.builder()
            .maxFreeInstantiations(6)
            .maxFreeFillings(1)
            .build());
    assertEquals(ImmutableList.of("a := a"), one.generate(5));

    // Six expansions leave only the single letter choices open.
    InputGenerator several = InputGenerator.create(grammar, SmtFormula.TRUE,
        PredicateSignature.standard(), smtSolver,
        SolverConfiguration.builder().maxFreeInstantiations(6).build());
    List<String> solutions = several.generate(20);
    assertEquals(10, solutions.size());
    assertEquals("a := a", solutions.get(0));
    assertEquals("a := j", solutions.get(9));
    assertTrue(several.isExhausted());
  }

  public void testSimpleExistentialFormula() throws IOException {
    assertExistentialSolutions("exists <var> v in start: (= v \"x\")", 5);
  }

  public void testSimpleExistentialFormulaWithBind() throws IOException {
    assertExistentialSolutions(
        "exists <rhs> r=\"{<var> v}\" in start: (= v \"x\")", 10);
  }

  private void assertExistentialSolutions(String constraint,
      int maxFreeInstantiations) throws IOException {
    Grammar grammar = Fixtures.assignments();
    InputGenerator generator = generator(grammar, constraint,
        SolverConfiguration.builder()
            .maxFreeInstantiations(maxFreeInstantiations)
            .build());
    List<String> solutions = generator.generate(10);
    assertEquals(10, solutions.size());
    assertEquals(10, ImmutableSet.copyOf(solutions).size());

    Formula formula = FormulaParser.create(PredicateSignature.standard())
        .parse(constraint, grammar);
    Evaluator evaluator = Evaluator.create(grammar,
        PredicateSignature.standard(), smtSolver);
    for (String solution : solutions) {
      assertTrue(solution, solution.contains("x"));
      assertTrue(solution, evaluator.evaluate(
          Fixtures.parse(grammar, solution), formula));
    }
  }

  public void testDefinedBeforeUseWithVariableRightHandSide()
      throws IOException {
    Grammar grammar = Fixtures.assignments();
    String constraint = "(" + Fixtures.definedBeforeUse()
        + ") and exists <rhs> r=\"{<var> v}\" in start: true";
    List<String> solutions = generator(grammar, constraint,
        SolverConfiguration.defaults()).generate(5);
    assertEquals(5, solutions.size());

    // Some assignment reads a variable, so a definition had to be inserted.
    Pattern variableUse = Pattern.compile(":= [a-z]");
    Formula definedBeforeUse = FormulaParser.create(
        PredicateSignature.standard()).parse(
            Fixtures.definedBeforeUse(), grammar);
    Evaluator evaluator = Evaluator.create(grammar,
        PredicateSignature.standard(), smtSolver);
    for (String solution : solutions) {
      assertTrue(solution, variableUse.matcher(solution).find());
      assertTrue(solution, solution.contains(" ; "));
      assertTrue(solution, evaluator.evaluate(
          Fixtures.parse(grammar, solution), definedBeforeUse));
    }
  }

  public void testSmtInstantiationsAreCapped() {
    final List<SmtQuery> modelQueries = Lists.newArrayList();
    SmtSolver scripted = new SmtSolver() {
      @Override
      public SmtResult solve(SmtQuery query) {
        if (query.constants().isEmpty()) {
          return SmtResult.sat(ImmutableMap.<String, String>of());
        }
        modelQueries.add(query);
        String letter = String.valueOf((char) ('a' + modelQueries.size() - 1));
        Map<String, String> model = Maps.newHashMap();
        for (String constant : query.constants()) {
          model.put(constant, letter);
        }
        return SmtResult.sat(model);
      }
    };
    InputGenerator generator = InputGenerator.create(
        Fixtures.digitOrLetter(), "forall <letter> l in start: (= l \"a\")",
        PredicateSignature.standard(), scripted,
        SolverConfiguration.builder().maxSmtInstantiations(2).build());
    List<String> solutions = generator.generate(10);

    assertEquals(ImmutableSet.of("0", "1", "2", "a", "b"),
        ImmutableSet.copyOf(solutions));
    assertEquals(5, solutions.size());
    assertEquals(2, modelQueries.size());
    List<String> first = modelQueries.get(0).assertions();
    List<String> second = modelQueries.get(1).assertions();
    assertEquals(first.size() + 1, second.size());
    String blocking = second.get(second.size() - 1);
    assertTrue(blocking, blocking.startsWith("(not "));
    assertTrue(blocking, blocking.contains("\"a\""));
  }

  public void testTimeBudgetExhausts() throws IOException {
    InputGenerator generator = generator(Fixtures.assignments(),
        Fixtures.definedBeforeUse(),
        SolverConfiguration.builder()
            .timeBudget(Duration.ofMillis(50))
            .build());
    SearchResult result = generator.advance();
    for (int i = 0; i < 10000
        && result.kind() != SearchResult.Kind.EXHAUSTED; i++) {
      result = generator.advance();
    }
    assertEquals(SearchResult.Kind.EXHAUSTED, result.kind());
    assertTrue(generator.isExhausted());
    assertEquals(SearchResult.Kind.EXHAUSTED, generator.advance().kind());
  }

  public void testCountAssignsDuringSearch() {
    Grammar grammar = Fixtures.countedList();
    List<String> solutions = generator(grammar,
        "forall <start> s=\"{<list> l}={<num> n}\" in start:"
            + " count(l, \"<list>\", n)",
        SolverConfiguration.defaults()).generate(3);
    assertEquals(3, solutions.size());
    assertTrue(solutions.toString(), solutions.contains("x=1"));
    for (String solution : solutions) {
      int equals = solution.indexOf('=');
      assertEquals(solution, CharMatcher.is('x').countIn(solution),
          Integer.parseInt(solution.substring(equals + 1)));
      assertEquals(solution, equals,
          CharMatcher.is('x').countIn(solution));
    }
  }

  public void testExistentialInsertion() throws IOException {
    List<String> solutions = generator(Fixtures.assignments(),
        "exists <digit> d in start: (= d \"7\")",
        SolverConfiguration.defaults()).generate(3);
    assertFalse(solutions.isEmpty());
    for (String solution : solutions) {
      assertTrue(solution, solution.contains("7"));
    }
  }

  public void testStepLimit() throws IOException {
    InputGenerator generator = generator(Fixtures.assignments(),
        Fixtures.definedBeforeUse(),
        SolverConfiguration.builder().maxStepsPerAdvance(1).build());
    assertEquals(SearchResult.Kind.NOT_YET, generator.advance().kind());
    assertFalse(generator.isExhausted());
  }

  public void testRequiresSignature() {
    try {
      InputGenerator.create(Fixtures.digitOrLetter(), SmtFormula.TRUE, null,
          smtSolver, SolverConfiguration.defaults());
      fail();
    } catch (ConfigurationException expected) {
    }
  }

  public void testConstantsMustDenoteTheStartSymbol() {
    Variable letter = Variable.constant("l", "<letter>");
    Formula formula =
        SmtFormula.create("(= l \"a\")", ImmutableList.of(letter));
    try {
      InputGenerator.create(Fixtures.digitOrLetter(), formula,
          PredicateSignature.standard(), smtSolver,
          SolverConfiguration.defaults());
      fail();
    } catch (FormulaException expected) {
    }
  }
}
