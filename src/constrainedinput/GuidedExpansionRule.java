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

import java.util.List;

/**
 * Expands the first open leaf in pre-order, with one successor per
 * alternative of its nonterminal.
 */
public final class GuidedExpansionRule implements TransitionRule {
  private GuidedExpansionRule() {}

  public static GuidedExpansionRule create() {
    return new GuidedExpansionRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    ImmutableList<Path> leaves = state.tree().openLeaves();
    if (leaves.isEmpty()) {
      return null;
    }
    Path leaf = leaves.get(0);
    String nonterminal = state.tree().getSubtree(leaf).value();
    List<SolverState> result = Lists.newArrayList();
    IdSource ids = state.ids();
    for (List<String> alternative :
        context.grammar().alternatives(nonterminal)) {
      result.add(state.toBuilder()
          .tree(state.tree().expand(leaf, alternative, ids), ids)
          .build());
    }
    return result;
  }
}
