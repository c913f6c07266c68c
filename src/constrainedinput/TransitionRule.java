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

import java.util.List;

/**
 * One way of making progress on a search state.
 */
public interface TransitionRule {
  /**
   * Derives the successors of a state.
   *
   * @param state the state to work on
   * @param context the grammar, solver and configuration of the search
   * @return null if the rule does not apply to state; otherwise the
   *         successors, where an empty list means state is a dead end
   * @throws SmtUnknownException if the SMT solver cannot decide a query the
   *         rule depends on
   */
  List<SolverState> apply(SolverState state, SolverContext context);
}
