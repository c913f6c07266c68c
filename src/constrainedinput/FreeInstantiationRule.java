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

import java.util.List;

/**
 * Closes the open leaves no obligation refers to, directly or through an
 * ancestor, with the {@link DefaultTreeExpander}. Each of up to
 * {@link SolverConfiguration#maxFreeFillings()} distinct closings becomes a
 * successor. Expansions count against the configured budget for free
 * instantiations; a state whose free leaves do not fit the remaining budget
 * is a dead end.
 */
public final class FreeInstantiationRule implements TransitionRule {
  private static final Logger logger =
      LogManager.getLogger(FreeInstantiationRule.class);

  private FreeInstantiationRule() {}

  public static FreeInstantiationRule create() {
    return new FreeInstantiationRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    List<Path> free = Lists.newArrayList();
    for (Path leaf : state.tree().openLeaves()) {
      if (!state.isConstrained(leaf)) {
        free.add(leaf);
      }
    }
    if (free.isEmpty()) {
      return null;
    }
    IdSource ids = state.ids();
    SolverConfiguration configuration = context.configuration();
    int budget = configuration.maxFreeInstantiations()
        - state.freeExpansions();
    List<DefaultTreeExpander.Expansion> fillings = context.expander()
        .fillings(state.tree(), free, ids, budget,
            configuration.maxFreeFillings());
    if (fillings.isEmpty()) {
      logger.debug("Free instantiation budget exhausted for {}", state);
      return ImmutableList.of();
    }
    List<SolverState> result = Lists.newArrayList();
    for (DefaultTreeExpander.Expansion filling : fillings) {
      result.add(state.toBuilder()
          .tree(filling.tree(), ids)
          .freeExpansions(state.freeExpansions() + filling.expansions())
          .build());
    }
    return result;
  }
}
