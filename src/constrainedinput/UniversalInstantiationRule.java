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

import java.util.List;

/**
 * Instantiates universal obligations for matches that appeared since the
 * last instantiation. All new instances go into a single successor; the
 * universal obligation stays, since the tree may still grow new matches.
 */
public final class UniversalInstantiationRule implements TransitionRule {
  private UniversalInstantiationRule() {}

  public static UniversalInstantiationRule create() {
    return new UniversalInstantiationRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    SolverState.Builder successor = state.toBuilder();
    boolean changed = false;
    for (Obligation obligation : state.obligations()) {
      if (!(obligation.formula() instanceof ForallFormula)) {
        continue;
      }
      ForallFormula quantifier = (ForallFormula) obligation.formula();
      for (Bindings match : Evaluator.matches(context.grammar(), state.tree(),
          quantifier, obligation.bindings())) {
        long nodeId = match.get(quantifier.boundVariable());
        if (!state.isInstantiated(obligation, nodeId)) {
          successor.add(Obligation.create(quantifier.body(), match))
              .instantiated(obligation, nodeId);
          changed = true;
        }
      }
    }
    return changed ? ImmutableList.of(successor.build()) : null;
  }
}
