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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Decides whether a complete derivation tree satisfies a formula. Evaluation
 * is a pure function of the tree, the formula and the bindings: SMT atoms are
 * decided by asking the SMT solver about constant strings, and semantic
 * predicates are only asked for true or false, never for tree edits.
 */
public final class Evaluator {
  private static final Logger logger = LogManager.getLogger(Evaluator.class);

  private final Grammar grammar;
  private final PredicateSignature signature;
  private final SmtSolver smtSolver;

  private Evaluator(Grammar grammar, PredicateSignature signature,
      SmtSolver smtSolver) {
    this.grammar = Preconditions.checkNotNull(grammar);
    this.signature = Preconditions.checkNotNull(signature);
    this.smtSolver = Preconditions.checkNotNull(smtSolver);
  }

  public static Evaluator create(Grammar grammar, PredicateSignature signature,
      SmtSolver smtSolver) {
    return new Evaluator(grammar, signature, smtSolver);
  }

  /**
   * Evaluates formula with each of its constants bound to the root of tree.
   *
   * @throws FormulaException if a free variable is not a constant of the
   *         root's type
   */
  public boolean evaluate(DerivationTree tree, Formula formula) {
    return evaluate(tree, formula, rootBindings(tree, formula));
  }

  /**
   * @param tree a complete derivation tree
   * @param formula the formula to evaluate
   * @param bindings node ids for the free variables of formula
   * @throws SmtUnknownException if the SMT solver cannot decide an atom
   */
  public boolean evaluate(DerivationTree tree, Formula formula,
      Bindings bindings) {
    Preconditions.checkArgument(tree.isComplete(),
        "Only complete trees can be evaluated: %s", tree);
    boolean result = formula.accept(new Evaluation(tree, bindings));
    logger.debug("{} evaluates to {} on \"{}\"", formula, result,
        tree.render());
    return result;
  }

  static Bindings rootBindings(DerivationTree tree, Formula formula) {
    Bindings bindings = Bindings.empty();
    for (Variable variable : formula.freeVariables()) {
      if (variable.kind() != Variable.Kind.CONSTANT
          || !variable.type().equals(tree.value())) {
        throw new FormulaException(String.format(
            "Cannot bind %s of type %s to a tree rooted in %s",
            variable, variable.type(), tree.value()));
      }
      bindings = bindings.bind(variable, tree.id());
    }
    return bindings;
  }

  /**
   * Decides an SMT atom whose variables are all bound to complete nodes by
   * substituting their renderings.
   */
  static boolean evaluateSmt(SmtSolver smtSolver, DerivationTree tree,
      SmtFormula atom, Bindings bindings) {
    if (atom.isTrue() || atom.isFalse()) {
      return atom.isTrue();
    }
    Map<Variable, String> values = Maps.newHashMap();
    for (Variable variable : atom.variables()) {
      DerivationTree node =
          tree.getSubtree(bindings.resolve(variable, tree));
      values.put(variable, SExpression.quote(node.render()));
    }
    SmtQuery query = SmtQuery.create(ImmutableList.<String>of(),
        ImmutableList.of(atom.renamed(values)));
    SmtResult result = smtSolver.solve(query);
    switch (result.status()) {
      case SAT:
        return true;
      case UNSAT:
        return false;
      default:
        throw new SmtUnknownException(
            "SMT solver could not decide " + atom.renamed(values) + ": "
            + result.reason());
    }
  }

  /** Replaces the variables among arguments with the paths they denote. */
  static List<Object> resolveArguments(PredicateFormula atom,
      DerivationTree tree, Bindings bindings) {
    ImmutableList.Builder<Object> result = ImmutableList.builder();
    for (Object argument : atom.arguments()) {
      result.add(argument instanceof Variable
          ? bindings.resolve((Variable) argument, tree) : argument);
    }
    return result.build();
  }

  /**
   * Finds the nodes a quantifier ranges over in tree: nodes of the bound
   * variable's type inside the subtree of the in-variable's node, matching
   * the match expression if there is one.
   *
   * @return the bindings for each match, extending bindings, in pre-order
   */
  static ImmutableList<Bindings> matches(Grammar grammar, DerivationTree tree,
      QuantifiedFormula quantifier, Bindings bindings) {
    Path range = bindings.resolve(quantifier.inVariable(), tree);
    String type = quantifier.boundVariable().type();
    ImmutableList.Builder<Bindings> result = ImmutableList.builder();
    for (Map.Entry<Path, DerivationTree> entry :
        tree.getSubtree(range).nodes().entrySet()) {
      DerivationTree node = entry.getValue();
      if (!node.value().equals(type)) {
        continue;
      }
      Bindings extended =
          bindings.bind(quantifier.boundVariable(), node.id());
      if (quantifier.matchExpression() != null) {
        Path path = range.concat(entry.getKey());
        ImmutableMap<Variable, Path> placeholders =
            quantifier.matchExpression().match(grammar, tree, path);
        if (placeholders == null) {
          continue;
        }
        for (Map.Entry<Variable, Path> placeholder : placeholders.entrySet()) {
          extended = extended.bind(placeholder.getKey(),
              tree.getSubtree(placeholder.getValue()).id());
        }
      }
      result.add(extended);
    }
    return result.build();
  }

  private final class Evaluation implements FormulaVisitor<Boolean> {
    private final DerivationTree tree;
    private final Bindings bindings;

    Evaluation(DerivationTree tree, Bindings bindings) {
      this.tree = tree;
      this.bindings = bindings;
    }

    @Override
    public Boolean visitConjunction(ConjunctiveFormula formula) {
      for (Formula conjunct : formula.conjuncts()) {
        if (!conjunct.accept(this)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public Boolean visitDisjunction(DisjunctiveFormula formula) {
      for (Formula disjunct : formula.disjuncts()) {
        if (disjunct.accept(this)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public Boolean visitNegation(NegatedFormula formula) {
      return !formula.argument().accept(this);
    }

    @Override
    public Boolean visitSmt(SmtFormula formula) {
      return evaluateSmt(smtSolver, tree, formula, bindings);
    }

    @Override
    public Boolean visitStructuralPredicate(
        StructuralPredicateFormula formula) {
      return signature.structural(formula).evaluate(tree,
          resolveArguments(formula, tree, bindings));
    }

    @Override
    public Boolean visitSemanticPredicate(SemanticPredicateFormula formula) {
      SemanticResult result = signature.semantic(formula).evaluate(grammar,
          tree, resolveArguments(formula, tree, bindings));
      return result.kind() == SemanticResult.Kind.TRUE;
    }

    @Override
    public Boolean visitForall(ForallFormula formula) {
      for (Bindings match : matches(grammar, tree, formula, bindings)) {
        if (!formula.body().accept(new Evaluation(tree, match))) {
          return false;
        }
      }
      return true;
    }

    @Override
    public Boolean visitExists(ExistsFormula formula) {
      for (Bindings match : matches(grammar, tree, formula, bindings)) {
        if (formula.body().accept(new Evaluation(tree, match))) {
          return true;
        }
      }
      return false;
    }
  }
}
