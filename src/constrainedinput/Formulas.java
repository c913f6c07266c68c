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
import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

/**
 * Static helpers for building, normalizing and checking formulas.
 */
public final class Formulas {
  private Formulas() {}

  public static Formula and(Formula... formulas) {
    return and(Arrays.asList(formulas));
  }

  /**
   * Conjoins formulas, flattening nested conjunctions and folding the
   * constants true and false.
   */
  public static Formula and(List<? extends Formula> formulas) {
    List<Formula> conjuncts = Lists.newArrayList();
    for (Formula formula : formulas) {
      for (Formula conjunct : conjuncts(formula)) {
        if (conjunct instanceof SmtFormula
            && ((SmtFormula) conjunct).isFalse()) {
          return SmtFormula.FALSE;
        }
        if (!(conjunct instanceof SmtFormula
            && ((SmtFormula) conjunct).isTrue())) {
          conjuncts.add(conjunct);
        }
      }
    }
    if (conjuncts.isEmpty()) {
      return SmtFormula.TRUE;
    }
    return conjuncts.size() == 1
        ? conjuncts.get(0) : ConjunctiveFormula.create(conjuncts);
  }

  public static Formula or(Formula... formulas) {
    return or(Arrays.asList(formulas));
  }

  /** The dual of {@link #and(List)}. */
  public static Formula or(List<? extends Formula> formulas) {
    List<Formula> disjuncts = Lists.newArrayList();
    for (Formula formula : formulas) {
      List<Formula> parts = formula instanceof DisjunctiveFormula
          ? ((DisjunctiveFormula) formula).disjuncts()
          : ImmutableList.of(formula);
      for (Formula disjunct : parts) {
        if (disjunct instanceof SmtFormula
            && ((SmtFormula) disjunct).isTrue()) {
          return SmtFormula.TRUE;
        }
        if (!(disjunct instanceof SmtFormula
            && ((SmtFormula) disjunct).isFalse())) {
          disjuncts.add(disjunct);
        }
      }
    }
    if (disjuncts.isEmpty()) {
      return SmtFormula.FALSE;
    }
    return disjuncts.size() == 1
        ? disjuncts.get(0) : DisjunctiveFormula.create(disjuncts);
  }

  /** Splits a formula into its top-level conjuncts. */
  public static ImmutableList<Formula> conjuncts(Formula formula) {
    if (formula instanceof ConjunctiveFormula) {
      ImmutableList.Builder<Formula> result = ImmutableList.builder();
      for (Formula conjunct : ((ConjunctiveFormula) formula).conjuncts()) {
        result.addAll(conjuncts(conjunct));
      }
      return result.build();
    }
    return ImmutableList.of(formula);
  }

  /**
   * Pushes negations down to the atoms. Negated SMT atoms become SMT atoms;
   * negated predicate atoms stay wrapped in a {@link NegatedFormula}, and no
   * other formula is negated in the result.
   */
  public static Formula toNegationNormalForm(Formula formula) {
    return formula.accept(new NegationNormalForm(false));
  }

  private static final class NegationNormalForm
      implements FormulaVisitor<Formula> {
    private final boolean negated;

    NegationNormalForm(boolean negated) {
      this.negated = negated;
    }

    private List<Formula> all(List<Formula> formulas) {
      List<Formula> result = Lists.newArrayList();
      for (Formula formula : formulas) {
        result.add(formula.accept(this));
      }
      return result;
    }

    @Override
    public Formula visitConjunction(ConjunctiveFormula formula) {
      List<Formula> arguments = all(formula.conjuncts());
      return negated ? or(arguments) : and(arguments);
    }

    @Override
    public Formula visitDisjunction(DisjunctiveFormula formula) {
      List<Formula> arguments = all(formula.disjuncts());
      return negated ? and(arguments) : or(arguments);
    }

    @Override
    public Formula visitNegation(NegatedFormula formula) {
      return formula.argument().accept(new NegationNormalForm(!negated));
    }

    @Override
    public Formula visitSmt(SmtFormula formula) {
      return negated ? formula.negate() : formula;
    }

    @Override
    public Formula visitStructuralPredicate(
        StructuralPredicateFormula formula) {
      return negated ? NegatedFormula.create(formula) : formula;
    }

    @Override
    public Formula visitSemanticPredicate(SemanticPredicateFormula formula) {
      return negated ? NegatedFormula.create(formula) : formula;
    }

    @Override
    public Formula visitForall(ForallFormula formula) {
      Formula body = formula.body().accept(this);
      return negated
          ? ExistsFormula.create(formula.boundVariable(),
              formula.inVariable(), formula.matchExpression(), body)
          : ForallFormula.create(formula.boundVariable(),
              formula.inVariable(), formula.matchExpression(), body);
    }

    @Override
    public Formula visitExists(ExistsFormula formula) {
      Formula body = formula.body().accept(this);
      return negated
          ? ForallFormula.create(formula.boundVariable(),
              formula.inVariable(), formula.matchExpression(), body)
          : ExistsFormula.create(formula.boundVariable(),
              formula.inVariable(), formula.matchExpression(), body);
    }
  }

  /**
   * Checks that a formula can be solved against a grammar: its only free
   * variables are constants, every variable's type is a nonterminal of the
   * grammar, every predicate is declared in the signature with the right
   * arity, and every match expression is derivable from its quantifier's
   * type.
   *
   * @throws FormulaException describing the first problem found
   */
  public static void checkWellFormed(Formula formula, Grammar grammar,
      PredicateSignature signature) {
    for (Variable variable : formula.freeVariables()) {
      if (variable.kind() != Variable.Kind.CONSTANT) {
        throw new FormulaException("Unbound variable " + variable);
      }
      checkType(variable, grammar);
    }
    formula.accept(new WellFormedness(grammar, signature));
  }

  private static void checkType(Variable variable, Grammar grammar) {
    if (!grammar.isDefined(variable.type())) {
      throw new FormulaException(String.format(
          "Type %s of %s is not a nonterminal of the grammar",
          variable.type(), variable));
    }
  }

  private static final class WellFormedness implements FormulaVisitor<Void> {
    private final Grammar grammar;
    private final PredicateSignature signature;

    WellFormedness(Grammar grammar, PredicateSignature signature) {
      this.grammar = grammar;
      this.signature = signature;
    }

    @Override
    public Void visitConjunction(ConjunctiveFormula formula) {
      for (Formula conjunct : formula.conjuncts()) {
        conjunct.accept(this);
      }
      return null;
    }

    @Override
    public Void visitDisjunction(DisjunctiveFormula formula) {
      for (Formula disjunct : formula.disjuncts()) {
        disjunct.accept(this);
      }
      return null;
    }

    @Override
    public Void visitNegation(NegatedFormula formula) {
      return formula.argument().accept(this);
    }

    @Override
    public Void visitSmt(SmtFormula formula) {
      return null;
    }

    @Override
    public Void visitStructuralPredicate(StructuralPredicateFormula formula) {
      signature.check(formula);
      return null;
    }

    @Override
    public Void visitSemanticPredicate(SemanticPredicateFormula formula) {
      signature.check(formula);
      return null;
    }

    @Override
    public Void visitForall(ForallFormula formula) {
      return quantifier(formula);
    }

    @Override
    public Void visitExists(ExistsFormula formula) {
      return quantifier(formula);
    }

    private Void quantifier(QuantifiedFormula formula) {
      for (Variable variable : formula.boundVariables()) {
        checkType(variable, grammar);
      }
      checkType(formula.inVariable(), grammar);
      if (formula.matchExpression() != null) {
        formula.matchExpression().treePrefixes(grammar,
            formula.boundVariable().type(), IdSource.startingAt(0));
      }
      return formula.body().accept(this);
    }
  }
}
