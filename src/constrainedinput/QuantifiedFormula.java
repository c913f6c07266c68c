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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Set;

/**
 * A quantifier ranging over the nodes of the bound variable's type inside the
 * subtree of another variable, optionally restricted to nodes matching a
 * {@link MatchExpression}. The match expression's placeholders are bound
 * alongside the bound variable.
 */
public abstract class QuantifiedFormula extends Formula {
  private final Variable boundVariable;
  private final Variable inVariable;
  private final MatchExpression matchExpression;
  private final Formula body;

  QuantifiedFormula(Variable boundVariable, Variable inVariable,
      MatchExpression matchExpression, Formula body) {
    this.boundVariable = Preconditions.checkNotNull(boundVariable);
    this.inVariable = Preconditions.checkNotNull(inVariable);
    this.matchExpression = matchExpression;
    this.body = Preconditions.checkNotNull(body);
    if (matchExpression != null
        && matchExpression.boundVariables().contains(boundVariable)) {
      throw new FormulaException(boundVariable
          + " is bound by both the quantifier and its match expression");
    }
  }

  public Variable boundVariable() {
    return boundVariable;
  }

  public Variable inVariable() {
    return inVariable;
  }

  /** Returns the match expression, or null if there is none. */
  public MatchExpression matchExpression() {
    return matchExpression;
  }

  public Formula body() {
    return body;
  }

  /** Returns the bound variable followed by the match expression's ones. */
  public ImmutableSet<Variable> boundVariables() {
    ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
    result.add(boundVariable);
    if (matchExpression != null) {
      result.addAll(matchExpression.boundVariables());
    }
    return result.build();
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    Set<Variable> result = Sets.newLinkedHashSet();
    result.add(inVariable);
    result.addAll(Sets.difference(body.freeVariables(), boundVariables()));
    return ImmutableSet.copyOf(result);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    QuantifiedFormula other = (QuantifiedFormula) obj;
    return boundVariable.equals(other.boundVariable)
        && inVariable.equals(other.inVariable)
        && Objects.equal(matchExpression, other.matchExpression)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(getClass(), boundVariable, inVariable,
        matchExpression, body);
  }
}
