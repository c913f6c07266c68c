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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An SMT-LIB boolean term over string variables, e.g.
 * {@code (= (str.len lhs) 1)}. Each variable stands for the rendering of the
 * node it is bound to. Symbols that are not variables are left to the SMT
 * solver to interpret.
 */
public final class SmtFormula extends Formula {
  public static final SmtFormula TRUE =
      new SmtFormula(SExpression.parse("true"), ImmutableList.<Variable>of());
  public static final SmtFormula FALSE =
      new SmtFormula(SExpression.parse("false"), ImmutableList.<Variable>of());

  private final SExpression expression;
  private final ImmutableList<Variable> variables;

  private SmtFormula(SExpression expression,
      ImmutableList<Variable> variables) {
    this.expression = expression;
    this.variables = variables;
  }

  /**
   * @param text an SMT-LIB boolean term
   * @param variables the variables occurring in text
   * @throws FormulaException if text is malformed, two variables share a
   *         name, or a variable is used as a number
   */
  public static SmtFormula create(String text, List<Variable> variables) {
    return create(SExpression.parse(text), variables);
  }

  static SmtFormula create(SExpression expression, List<Variable> variables) {
    Set<String> names = Sets.newHashSet();
    for (Variable variable : variables) {
      if (!names.add(variable.name())) {
        throw new FormulaException(
            "Two variables named " + variable.name() + " in " + expression);
      }
    }
    expression.checkStringSorts(names);
    return new SmtFormula(expression, ImmutableList.copyOf(variables));
  }

  SExpression expression() {
    return expression;
  }

  public String text() {
    return expression.toString();
  }

  public ImmutableList<Variable> variables() {
    return variables;
  }

  public boolean isTrue() {
    return expression.isSymbol() && expression.atom().equals("true");
  }

  public boolean isFalse() {
    return expression.isSymbol() && expression.atom().equals("false");
  }

  /** Returns the negated term, folding constants and double negations. */
  public SmtFormula negate() {
    if (isTrue()) {
      return FALSE;
    }
    if (isFalse()) {
      return TRUE;
    }
    if (!expression.isAtom() && expression.elements().size() == 2
        && expression.elements().get(0).isSymbol()
        && expression.elements().get(0).atom().equals("not")) {
      return new SmtFormula(expression.elements().get(1), variables);
    }
    return new SmtFormula(SExpression.parse("(not " + expression + ")"),
        variables);
  }

  /**
   * Returns the term with each variable replaced by the SMT constant name
   * that names maps it to.
   */
  String renamed(Map<Variable, String> names) {
    Map<String, String> renaming = Maps.newHashMap();
    for (Variable variable : variables) {
      String name = names.get(variable);
      if (name != null) {
        renaming.put(variable.name(), name);
      }
    }
    return expression.rename(renaming).toString();
  }

  @Override
  public <R> R accept(FormulaVisitor<R> visitor) {
    return visitor.visitSmt(this);
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    return ImmutableSet.copyOf(variables);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SmtFormula)) {
      return false;
    }
    SmtFormula other = (SmtFormula) obj;
    return expression.equals(other.expression)
        && variables.equals(other.variables);
  }

  @Override
  public int hashCode() {
    return 31 * expression.hashCode() + variables.hashCode();
  }
}
