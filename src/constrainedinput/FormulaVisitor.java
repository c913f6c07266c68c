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
 * Dispatches on the kind of a {@link Formula}.
 *
 * @param <R> the result type
 */
public interface FormulaVisitor<R> {
  R visitConjunction(ConjunctiveFormula formula);

  R visitDisjunction(DisjunctiveFormula formula);

  R visitNegation(NegatedFormula formula);

  R visitSmt(SmtFormula formula);

  R visitStructuralPredicate(StructuralPredicateFormula formula);

  R visitSemanticPredicate(SemanticPredicateFormula formula);

  R visitForall(ForallFormula formula);

  R visitExists(ExistsFormula formula);
}
