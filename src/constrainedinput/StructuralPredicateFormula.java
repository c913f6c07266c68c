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

/** An atom whose truth depends only on the positions of its arguments. */
public final class StructuralPredicateFormula extends PredicateFormula {
  private StructuralPredicateFormula(String name, List<?> arguments) {
    super(name, arguments);
  }

  public static StructuralPredicateFormula create(String name,
      List<?> arguments) {
    return new StructuralPredicateFormula(name, arguments);
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitStructuralPredicate(this);
  }
}
