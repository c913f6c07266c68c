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

/**
 * The boundary to an external SMT solver with a theory of strings.
 */
public interface SmtSolver {
  /**
   * Checks the satisfiability of a query. Implementations bound the time
   * spent on one query and answer {@link SmtResult.Status#UNKNOWN} when it
   * runs out.
   *
   * @return the status and, if satisfiable, a value for every declared
   *         constant
   */
  SmtResult solve(SmtQuery query);
}
