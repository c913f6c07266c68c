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

/** Splits the first disjunctive obligation into one state per disjunct. */
public final class DisjunctionRule implements TransitionRule {
  private DisjunctionRule() {}

  public static DisjunctionRule create() {
    return new DisjunctionRule();
  }

  @Override
  public List<SolverState> apply(SolverState state, SolverContext context) {
    for (Obligation obligation : state.obligations()) {
      if (obligation.formula() instanceof DisjunctiveFormula) {
        List<SolverState> result = Lists.newArrayList();
        for (Formula disjunct :
            ((DisjunctiveFormula) obligation.formula()).disjuncts()) {
          result.add(state.toBuilder()
              .replace(obligation, ImmutableList.of(
                  Obligation.create(disjunct, obligation.bindings())))
              .build());
        }
        return result;
      }
    }
    return null;
  }
}
