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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Solves the SMT obligations that constrain unfinished nodes in one query.
 * Each node becomes a string constant; nodes that are already complete are
 * pinned to their rendering and nodes with a small finite language are
 * restricted to it. Up to the configured number of models are enumerated,
 * each model yielding a successor in which the solved nodes are replaced by
 * parses of their values.
 *
 * <p>A node is only solved for if no obligation refers to a node strictly
 * inside it, since replacing the node would orphan that reference.
 */
public final class SmtSolvingRule implements TransitionRule {
  private static final Logger logger =
      LogManager.getLogger(SmtSolvingRule.class);

  private SmtSolvingRule() {}

  public static SmtSolvingRule create() {
    return new SmtSolvingRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    DerivationTree tree = state.tree();
    List<Obligation> batch = Lists.newArrayList();
    for (Obligation obligation : state.obligations()) {
      if (obligation.formula() instanceof SmtFormula
          && isSolvable(state, obligation)) {
        batch.add(obligation);
      }
    }
    if (batch.isEmpty()) {
      return null;
    }

    // Node ids in first-use order, and the unfinished ones among them.
    Set<Long> nodes = Sets.newLinkedHashSet();
    List<String> assertions = Lists.newArrayList();
    for (Obligation obligation : batch) {
      SmtFormula atom = (SmtFormula) obligation.formula();
      Map<Variable, String> names = Maps.newHashMap();
      for (Variable variable : atom.variables()) {
        long id = obligation.bindings().get(variable);
        nodes.add(id);
        names.put(variable, constant(id));
      }
      assertions.add(atom.renamed(names));
    }
    Set<Long> unfinished = Sets.newLinkedHashSet();
    for (long id : nodes) {
      DerivationTree node = tree.getSubtree(tree.findNode(id));
      if (node.isComplete()) {
        assertions.add(String.format("(= %s %s)", constant(id),
            SExpression.quote(node.render())));
      } else {
        unfinished.add(id);
        String domain = domain(context.grammar(), constant(id), node.value());
        if (domain != null) {
          assertions.add(domain);
        }
      }
    }
    List<String> constants = Lists.newArrayList();
    for (long id : nodes) {
      constants.add(constant(id));
    }
    SmtQuery query = SmtQuery.create(constants, assertions);

    List<SolverState> result = Lists.newArrayList();
    IdSource ids = state.ids();
    int limit = context.configuration().maxSmtInstantiations();
    for (int models = 0; models < limit; models++) {
      SmtResult answer = context.smtSolver().solve(query);
      if (answer.status() == SmtResult.Status.UNKNOWN) {
        if (models == 0) {
          logger.warn("Pruning state, SMT solver gave up: {}",
              answer.reason());
        }
        break;
      }
      if (answer.status() == SmtResult.Status.UNSAT) {
        break;
      }
      SolverState successor =
          successor(state, context, batch, unfinished, answer, ids);
      if (successor != null) {
        result.add(successor);
      }
      query = query.withAssertion(blockingClause(unfinished, answer));
    }
    logger.debug("{} models for {}", result.size(), batch);
    return result;
  }

  /**
   * An SMT obligation can be solved now if one of its nodes is unfinished and
   * none of its unfinished nodes has a referenced descendant.
   */
  private static boolean isSolvable(SolverState state, Obligation obligation) {
    DerivationTree tree = state.tree();
    SmtFormula atom = (SmtFormula) obligation.formula();
    if (atom.isTrue() || atom.isFalse()) {
      return false;
    }
    boolean unfinished = false;
    for (Variable variable : atom.variables()) {
      Path path = obligation.bindings().resolve(variable, tree);
      if (tree.getSubtree(path).isComplete()) {
        continue;
      }
      unfinished = true;
      for (Obligation other : state.obligations()) {
        for (Long id : other.bindings().asMap().values()) {
          Path bound = tree.findNode(id);
          if (bound != null && !bound.equals(path) && path.isPrefixOf(bound)) {
            return false;
          }
        }
      }
    }
    return unfinished;
  }

  private static String constant(long id) {
    return "n" + id;
  }

  /** Restricts a constant to a small finite language, or returns null. */
  private static String domain(Grammar grammar, String constant,
      String nonterminal) {
    ImmutableSet<String> words = grammar.finiteLanguage(nonterminal,
        SolverConfiguration.MAX_DOMAIN_SIZE);
    if (words == null) {
      return null;
    }
    List<String> choices = Lists.newArrayList();
    for (String word : words) {
      choices.add(
          String.format("(= %s %s)", constant, SExpression.quote(word)));
    }
    return choices.size() == 1
        ? choices.get(0) : "(or " + Joiner.on(' ').join(choices) + ")";
  }

  private static String blockingClause(Set<Long> unfinished,
      SmtResult answer) {
    List<String> equalities = Lists.newArrayList();
    for (long id : unfinished) {
      equalities.add(String.format("(= %s %s)", constant(id),
          SExpression.quote(answer.model().get(constant(id)))));
    }
    return equalities.size() == 1 ? "(not " + equalities.get(0) + ")"
        : "(not (and " + Joiner.on(' ').join(equalities) + "))";
  }

  /** Applies a model, or returns null if a value does not parse. */
  private static SolverState successor(SolverState state,
      SolverContext context, List<Obligation> batch, Set<Long> unfinished,
      SmtResult answer, IdSource ids) {
    DerivationTree tree = state.tree();
    for (long id : unfinished) {
      DerivationTree node = tree.getSubtree(tree.findNode(id));
      String value = answer.model().get(constant(id));
      DerivationTree parsed = context.parser().parseTokens(
          GrammarParser.characters(value), node.value(), ids);
      if (parsed == null) {
        logger.debug("Model value \"{}\" is not a word of {}", value,
            node.value());
        return null;
      }
      tree = tree.replaceNode(id, parsed.withId(id));
    }
    SolverState.Builder builder = state.toBuilder().tree(tree, ids);
    for (Obligation obligation : batch) {
      builder.remove(obligation);
    }
    return builder.build();
  }
}
