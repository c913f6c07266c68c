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

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * Prints formulas in the concrete syntax read by {@link FormulaParser}.
 * Connectives are always parenthesized, and quantifiers are parenthesized
 * when they are an argument of a connective, so printing and parsing again
 * yields an equal formula.
 */
public final class FormulaUnparser implements FormulaVisitor<String> {
  private static final FormulaUnparser INSTANCE = new FormulaUnparser();

  private FormulaUnparser() {}

  public static String unparse(Formula formula) {
    return formula.accept(INSTANCE);
  }

  /** Prints the formula with its constants declared up front. */
  public static String unparseWithConstants(Formula formula) {
    StringBuilder builder = new StringBuilder();
    for (Variable variable : formula.freeVariables()) {
      if (variable.kind() == Variable.Kind.CONSTANT) {
        builder.append("const ").append(variable.name()).append(": ")
            .append(variable.type()).append(";\n");
      }
    }
    return builder.append(unparse(formula)).toString();
  }

  static String quote(String text) {
    return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }

  private String argument(Formula formula) {
    String result = formula.accept(this);
    return formula instanceof QuantifiedFormula ? "(" + result + ")" : result;
  }

  private String connective(List<Formula> arguments, String operator) {
    List<String> printed = Lists.newArrayList();
    for (Formula formula : arguments) {
      printed.add(argument(formula));
    }
    return "(" + Joiner.on(" " + operator + " ").join(printed) + ")";
  }

  @Override
  public String visitConjunction(ConjunctiveFormula formula) {
    return connective(formula.conjuncts(), "and");
  }

  @Override
  public String visitDisjunction(DisjunctiveFormula formula) {
    return connective(formula.disjuncts(), "or");
  }

  @Override
  public String visitNegation(NegatedFormula formula) {
    return "not " + argument(formula.argument());
  }

  @Override
  public String visitSmt(SmtFormula formula) {
    return formula.text();
  }

  @Override
  public String visitStructuralPredicate(StructuralPredicateFormula formula) {
    return predicate(formula);
  }

  @Override
  public String visitSemanticPredicate(SemanticPredicateFormula formula) {
    return predicate(formula);
  }

  private String predicate(PredicateFormula formula) {
    List<String> arguments = Lists.newArrayList();
    for (Object argument : formula.arguments()) {
      arguments.add(argument instanceof String
          ? quote((String) argument) : argument.toString());
    }
    return formula.name() + "(" + Joiner.on(", ").join(arguments) + ")";
  }

  @Override
  public String visitForall(ForallFormula formula) {
    return quantifier("forall", formula);
  }

  @Override
  public String visitExists(ExistsFormula formula) {
    return quantifier("exists", formula);
  }

  private String quantifier(String keyword, QuantifiedFormula formula) {
    StringBuilder builder = new StringBuilder(keyword).append(' ')
        .append(formula.boundVariable().type()).append(' ')
        .append(formula.boundVariable().name());
    if (formula.matchExpression() != null) {
      builder.append('=').append(quote(formula.matchExpression().text()));
    }
    return builder.append(" in ").append(formula.inVariable().name())
        .append(": ").append(formula.body().accept(this)).toString();
  }
}
