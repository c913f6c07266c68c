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

import java.util.List;

/**
 * An application of a named predicate. Arguments are variables, string
 * literals or integers; the predicate itself is looked up by name in the
 * {@link PredicateSignature} of whoever evaluates the formula.
 */
public abstract class PredicateFormula extends Formula {
  private final String name;
  private final ImmutableList<Object> arguments;

  PredicateFormula(String name, List<?> arguments) {
    this.name = name;
    for (Object argument : arguments) {
      if (!(argument instanceof Variable || argument instanceof String
          || argument instanceof Integer)) {
        throw new FormulaException(String.format(
            "Argument %s of %s is neither a variable, a string nor an integer",
            argument, name));
      }
    }
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public String name() {
    return name;
  }

  public ImmutableList<Object> arguments() {
    return arguments;
  }

  @Override
  public ImmutableSet<Variable> freeVariables() {
    ImmutableSet.Builder<Variable> result = ImmutableSet.builder();
    for (Object argument : arguments) {
      if (argument instanceof Variable) {
        result.add((Variable) argument);
      }
    }
    return result.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    PredicateFormula other = (PredicateFormula) obj;
    return name.equals(other.name) && arguments.equals(other.arguments);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * getClass().hashCode() + name.hashCode())
        + arguments.hashCode();
  }
}
