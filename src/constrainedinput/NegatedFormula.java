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
import com.google.common.collect.ImmutableSet;

/** The negation of a formula. */
public final class NegatedFormula extends Formula {
  private final Formula argument;

  private NegatedFormula(Formula argument) {
    this.argument = Preconditions.checkNotNull(argument);
  }

  public static NegatedFormula create(Formula argument) {
    return new NegatedFormula(argument);
  }

  public Formula argument() {
    return argument;
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitNegation(this);
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    return argument.freeVariables();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof NegatedFormula
        && argument.equals(((NegatedFormula) obj).argument);
  }

  @Override
  public int hashCode() {
    return 31 * argument.hashCode() + 3;
  }
}
