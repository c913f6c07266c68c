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

import com.google.common.collect.ImmutableSet;

/**
 * A constraint over the nodes of a derivation tree. Formulas are immutable and
 * compare structurally. The kinds of formulas are closed: connectives, SMT
 * atoms, structural and semantic predicate atoms, and the two quantifiers.
 */
public abstract class Formula {
  Formula() {}

  public abstract <R> R accept(FormulaVisitor<R> visitor);

  /** Returns the variables that occur free in this formula. */
  public abstract ImmutableSet<Variable> freeVariables();

  /** Prints the formula in the syntax read by {@link FormulaParser}. */
  @Override
  public String toString() {
    return FormulaUnparser.unparse(this);
  }
}
