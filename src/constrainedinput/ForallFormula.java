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

/** Holds if the body holds for every matching node; vacuously if none. */
public final class ForallFormula extends QuantifiedFormula {
  private ForallFormula(Variable boundVariable, Variable inVariable,
      MatchExpression matchExpression, Formula body) {
    super(boundVariable, inVariable, matchExpression, body);
  }

  /**
   * @param matchExpression may be null
   */
  public static ForallFormula create(Variable boundVariable,
      Variable inVariable, MatchExpression matchExpression, Formula body) {
    return new ForallFormula(boundVariable, inVariable, matchExpression, body);
  }

  public static ForallFormula create(Variable boundVariable,
      Variable inVariable, Formula body) {
    return create(boundVariable, inVariable, null, body);
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitForall(this);
  }
}
