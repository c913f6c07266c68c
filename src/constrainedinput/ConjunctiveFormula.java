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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;

/** The conjunction of two or more formulas. */
public final class ConjunctiveFormula extends Formula {
  private final ImmutableList<Formula> conjuncts;

  private ConjunctiveFormula(ImmutableList<Formula> conjuncts) {
    this.conjuncts = conjuncts;
  }

  public static ConjunctiveFormula create(List<? extends Formula> conjuncts) {
    Preconditions.checkArgument(conjuncts.size() >= 2,
        "A conjunction needs at least two arguments");
    return new ConjunctiveFormula(ImmutableList.copyOf(conjuncts));
  }

  public ImmutableList<Formula> conjuncts() {
    return conjuncts;
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitConjunction(this);
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
    for (Formula conjunct : conjuncts) {
      result.addAll(conjunct.freeVariables());
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ConjunctiveFormula
        && conjuncts.equals(((ConjunctiveFormula) obj).conjuncts);
  }

  @Override
  public int hashCode() {
    return 31 * conjuncts.hashCode() + 1;
  }
}
