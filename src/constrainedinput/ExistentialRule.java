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
import com.google.common.collect.Lists;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;

/**
 * Eliminates the first existential obligation that has a match or an
 * insertion point. There is one successor per
 * existing match, and one per way of inserting a new match into the tree:
 * a tree of the match expression's shape (or an open node of the quantified
 * type) placed by the {@link TreeInserter}.
 */
public final class ExistentialRule implements TransitionRule {
  private static final Logger logger =
      LogManager.getLogger(ExistentialRule.class);

  private ExistentialRule() {}

  public static ExistentialRule create() {
    return new ExistentialRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    for (Obligation obligation : state.obligations()) {
      if (obligation.formula() instanceof ExistsFormula) {
        List<SolverState> successors = eliminate(state, context, obligation);
        if (successors != null) {
          return successors;
        }
      }
    }
    return null;
  }

  private List<SolverState> eliminate(SolverState state,
      SolverContext context, Obligation obligation) {
    ExistsFormula quantifier = (ExistsFormula) obligation.formula();
    DerivationTree tree = state.tree();
    List<SolverState> result = Lists.newArrayList();
    for (Bindings match : Evaluator.matches(context.grammar(), tree,
        quantifier, obligation.bindings())) {
      result.add(state.toBuilder()
          .replace(obligation, ImmutableList.of(
              Obligation.create(quantifier.body(), match)))
          .build());
    }

    IdSource ids = state.ids();
    Path range = obligation.bindings().resolve(quantifier.inVariable(), tree);
    String type = quantifier.boundVariable().type();
    List<MatchExpression.TreePrefix> templates;
    if (quantifier.matchExpression() == null) {
      templates = ImmutableList.of(new MatchExpression.TreePrefix(
          DerivationTree.open(type, ids), ImmutableMap.<Variable, Path>of()));
    } else {
      templates = quantifier.matchExpression().treePrefixes(
          context.grammar(), type, ids);
    }
    for (MatchExpression.TreePrefix template : templates) {
      for (TreeInserter.Insertion insertion :
          context.inserter().insert(tree, range, template.tree, ids)) {
        Bindings bindings = obligation.bindings()
            .bind(quantifier.boundVariable(), insertion.insertedId());
        for (Map.Entry<Variable, Path> placeholder :
            template.placeholders.entrySet()) {
          long id = placeholder.getValue().isRoot() ? insertion.insertedId()
              : template.tree.getSubtree(placeholder.getValue()).id();
          bindings = bindings.bind(placeholder.getKey(), id);
        }
        result.add(state.toBuilder()
            .tree(insertion.tree(), ids)
            .replace(obligation, ImmutableList.of(
                Obligation.create(quantifier.body(), bindings)))
            .build());
      }
    }
    if (result.isEmpty()) {
      // Later expansions may still create a match or an insertion point.
      return null;
    }
    logger.debug("{} has {} successors for {}", tree, result.size(),
        quantifier);
    return result;
  }
}
