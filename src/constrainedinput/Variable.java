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

import java.util.regex.Pattern;

/**
 * A variable standing for a node of a derivation tree. Its type is the
 * nonterminal the node must be labeled with. Constants are bound by the
 * caller (usually to the root of the tree); bound variables are introduced by
 * quantifiers and match expressions.
 */
public final class Variable {
  /** The kinds of variables. */
  public enum Kind { CONSTANT, BOUND }

  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String name;
  private final String type;
  private final Kind kind;

  private Variable(String name, String type, Kind kind) {
    if (!NAME.matcher(name).matches()) {
      throw new FormulaException("Invalid variable name " + name);
    }
    if (!Grammar.isNonterminal(type)) {
      throw new FormulaException(
          "Type of " + name + " is not a nonterminal: " + type);
    }
    this.name = name;
    this.type = type;
    this.kind = Preconditions.checkNotNull(kind);
  }

  public static Variable constant(String name, String type) {
    return new Variable(name, type, Kind.CONSTANT);
  }

  public static Variable bound(String name, String type) {
    return new Variable(name, type, Kind.BOUND);
  }

  /** The variable {@code start} standing for the whole tree. */
  public static Variable start() {
    return constant("start", Grammar.START_SYMBOL);
  }

  public String name() {
    return name;
  }

  public String type() {
    return type;
  }

  public Kind kind() {
    return kind;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Variable)) {
      return false;
    }
    Variable other = (Variable) obj;
    return name.equals(other.name) && type.equals(other.type)
        && kind == other.kind;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, type, kind);
  }

  @Override
  public String toString() {
    return name;
  }
}
