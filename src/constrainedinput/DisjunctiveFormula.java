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

/** The disjunction of two or more formulas. */
public final class DisjunctiveFormula extends Formula {
  private final ImmutableList<Formula> disjuncts;

  private DisjunctiveFormula(ImmutableList<Formula> disjuncts) {
    this.disjuncts = disjuncts;
  }

  public static DisjunctiveFormula create(List<? extends Formula> disjuncts) {
    Preconditions.checkArgument(disjuncts.size() >= 2,
        "A disjunction needs at least two arguments");
    return new DisjunctiveFormula(ImmutableList.copyOf(disjuncts));
  }

  public ImmutableList<Formula> disjuncts() {
    return disjuncts;
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitDisjunction(this);
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
    for (Formula disjunct : disjuncts) {
      result.addAll(disjunct.freeVariables());
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DisjunctiveFormula
        && disjuncts.equals(((DisjunctiveFormula) obj).disjuncts);
  }

  @Override
  public int hashCode() {
    return 31 * disjuncts.hashCode() + 2;
  }
}
