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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Decides what can be decided without search: splits conjunctions, drops
 * obligations that already hold, prunes states with an obligation that
 * already fails, applies the assignments of semantic predicates, and
 * discharges universal obligations whose range can no longer change.
 */
public final class SimplificationRule implements TransitionRule {
  private static final Logger logger =
      LogManager.getLogger(SimplificationRule.class);

  private SimplificationRule() {}

  public static SimplificationRule create() {
    return new SimplificationRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    Run run = new Run(state, context);
    if (!run.simplify()) {
      logger.debug("Pruned {}", state);
      return ImmutableList.of();
    }
    if (!run.changed) {
      return null;
    }
    return ImmutableList.of(state.toBuilder()
        .tree(run.tree, run.ids)
        .obligations(run.kept)
        .build());
  }

  /** One pass over the obligations of a state. */
  private static final class Run {
    final SolverState state;
    final SolverContext context;
    final Deque<Obligation> work;
    final List<Obligation> kept = Lists.newArrayList();
    final IdSource ids;
    DerivationTree tree;
    boolean changed;

    Run(SolverState state, SolverContext context) {
      this.state = state;
      this.context = context;
      this.work = new ArrayDeque<Obligation>(state.obligations());
      this.ids = state.ids();
      this.tree = state.tree();
    }

    /** @return false if an obligation is violated */
    boolean simplify() {
      while (!work.isEmpty()) {
        Obligation obligation = work.pop();
        Formula formula = obligation.formula();
        Boolean value;
        if (formula instanceof ConjunctiveFormula) {
          List<Formula> conjuncts = ((ConjunctiveFormula) formula).conjuncts();
          for (Formula conjunct : Lists.reverse(conjuncts)) {
            work.push(Obligation.create(conjunct, obligation.bindings()));
          }
          changed = true;
          continue;
        } else if (formula instanceof SmtFormula) {
          value = smt((SmtFormula) formula, obligation.bindings());
        } else if (formula instanceof StructuralPredicateFormula) {
          value = structural((StructuralPredicateFormula) formula,
              obligation.bindings());
        } else if (formula instanceof SemanticPredicateFormula) {
          value = semantic((SemanticPredicateFormula) formula,
              obligation.bindings(), false);
        } else if (formula instanceof NegatedFormula) {
          value = negated((NegatedFormula) formula, obligation.bindings());
        } else if (formula instanceof ForallFormula) {
          value = canDischarge(obligation) ? Boolean.TRUE : null;
        } else {
          value = null;
        }
        if (value == null) {
          if (kept.contains(obligation)) {
            changed = true;
          } else {
            kept.add(obligation);
          }
        } else if (value) {
          changed = true;
        } else {
          return false;
        }
      }
      return true;
    }

    private Boolean smt(SmtFormula atom, Bindings bindings) {
      if (atom.isTrue() || atom.isFalse()) {
        return atom.isTrue();
      }
      for (Variable variable : atom.variables()) {
        if (!tree.getSubtree(bindings.resolve(variable, tree)).isComplete()) {
          return null;
        }
      }
      return Evaluator.evaluateSmt(context.smtSolver(), tree, atom, bindings);
    }

    private Boolean structural(StructuralPredicateFormula atom,
        Bindings bindings) {
      StructuralPredicate predicate = context.signature().structural(atom);
      if (!predicate.isStableUnderGrowth() && !tree.isComplete()) {
        return null;
      }
      return predicate.evaluate(tree,
          Evaluator.resolveArguments(atom, tree, bindings));
    }

    private Boolean negated(NegatedFormula formula, Bindings bindings) {
      Formula argument = formula.argument();
      Boolean value;
      if (argument instanceof StructuralPredicateFormula) {
        value = structural((StructuralPredicateFormula) argument, bindings);
      } else if (argument instanceof SemanticPredicateFormula) {
        value = semantic((SemanticPredicateFormula) argument, bindings, true);
      } else {
        throw new FormulaException(
            "Not in negation normal form: " + formula);
      }
      return value == null ? null : !value;
    }

    private Boolean semantic(SemanticPredicateFormula atom, Bindings bindings,
        boolean negated) {
      SemanticResult result = context.signature().semantic(atom).evaluate(
          context.grammar(), tree,
          Evaluator.resolveArguments(atom, tree, bindings));
      switch (result.kind()) {
        case TRUE:
          return true;
        case FALSE:
          return false;
        case NOT_READY:
          return null;
        default:
          // An assignment makes the atom true; it cannot make it false.
          return negated ? null : assign(result.assignment());
      }
    }

    /**
     * Fixes the subtrees of an assignment.
     *
     * @return true if applied, false if a value cannot be parsed or
     *         contradicts a complete node, null if a node cannot be replaced
     *         yet
     */
    private Boolean assign(Map<Path, String> assignment) {
      for (Path path : assignment.keySet()) {
        if (!tree.getSubtree(path).isComplete()
            && hasReferencedDescendant(path)) {
          return null;
        }
      }
      DerivationTree result = tree;
      for (Map.Entry<Path, String> entry : assignment.entrySet()) {
        DerivationTree node = result.getSubtree(entry.getKey());
        if (node.isComplete()) {
          if (!node.render().equals(entry.getValue())) {
            return false;
          }
          continue;
        }
        DerivationTree parsed = context.parser().parseTokens(
            GrammarParser.characters(entry.getValue()), node.value(), ids);
        if (parsed == null) {
          logger.debug("{} does not derive \"{}\"", node.value(),
              entry.getValue());
          return false;
        }
        result = result.replacePath(entry.getKey(), parsed.withId(node.id()));
      }
      tree = result;
      return true;
    }

    private boolean hasReferencedDescendant(Path path) {
      for (Obligation obligation : pending()) {
        for (Long id : obligation.bindings().asMap().values()) {
          Path bound = tree.findNode(id);
          if (bound != null && !bound.equals(path) && path.isPrefixOf(bound)) {
            return true;
          }
        }
      }
      return false;
    }

    private Iterable<Obligation> pending() {
      List<Obligation> result = Lists.newArrayList(kept);
      result.addAll(work);
      return result;
    }

    /**
     * A universal obligation is done once its range is complete, it has been
     * instantiated for every match, and no existential obligation could
     * still insert new matches.
     */
    private boolean canDischarge(Obligation obligation) {
      QuantifiedFormula quantifier = (QuantifiedFormula) obligation.formula();
      Path range = obligation.bindings().resolve(quantifier.inVariable(), tree);
      if (!tree.getSubtree(range).isComplete()) {
        return false;
      }
      for (Obligation other : pending()) {
        if (other.formula() instanceof ExistsFormula) {
          return false;
        }
      }
      for (Bindings match : Evaluator.matches(context.grammar(), tree,
          quantifier, obligation.bindings())) {
        if (!state.isInstantiated(obligation,
            match.get(quantifier.boundVariable()))) {
          return false;
        }
      }
      return true;
    }
  }
}
