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

/**
 * A formula the search still has to make true, together with the nodes its
 * free variables are bound to. Bindings of variables that do not occur free
 * in the formula are dropped, so equal obligations compare equal.
 */
public final class Obligation {
  private final Formula formula;
  private final Bindings bindings;

  private Obligation(Formula formula, Bindings bindings) {
    this.formula = formula;
    this.bindings = bindings;
  }

  /**
   * @throws FormulaException if a free variable of formula is unbound
   */
  public static Obligation create(Formula formula, Bindings bindings) {
    for (Variable variable : formula.freeVariables()) {
      if (!bindings.isBound(variable)) {
        throw new FormulaException(
            "Unbound variable " + variable + " in " + formula);
      }
    }
    return new Obligation(formula,
        bindings.restrictTo(formula.freeVariables()));
  }

  public Formula formula() {
    return formula;
  }

  public Bindings bindings() {
    return bindings;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Obligation)) {
      return false;
    }
    Obligation other = (Obligation) obj;
    return formula.equals(other.formula) && bindings.equals(other.bindings);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(formula, bindings);
  }

  @Override
  public String toString() {
    return formula + " @ " + bindings;
  }
}
