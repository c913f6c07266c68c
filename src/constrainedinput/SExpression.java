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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parsed SMT-LIB term: an atom (symbol, numeral or string literal) or a
 * parenthesized list of terms. Only as much of SMT-LIB is understood as is
 * needed to find, rename and sort-check the variables of an SMT atom; the
 * solver itself sees the printed text.
 */
final class SExpression {
  /** Operators whose arguments must be integers or reals */
  private static final ImmutableSet<String> ARITHMETIC = ImmutableSet.of(
      "+", "-", "*", "div", "mod", "abs", "<", "<=", ">", ">=");

  private final String atom;
  private final boolean stringLiteral;
  private final ImmutableList<SExpression> elements;

  private SExpression(String atom, boolean stringLiteral,
      ImmutableList<SExpression> elements) {
    this.atom = atom;
    this.stringLiteral = stringLiteral;
    this.elements = elements;
  }

  /**
   * @throws FormulaException if text is not exactly one well-formed term
   */
  static SExpression parse(String text) {
    Reader reader = new Reader(text);
    SExpression result = reader.term();
    reader.skipWhitespace();
    if (reader.pos != text.length()) {
      throw new FormulaException("Trailing text after SMT term: " + text);
    }
    return result;
  }

  /**
   * Returns the end of the term starting at offset start of text.
   *
   * @throws FormulaException if no complete term starts there
   */
  static int termEnd(String text, int start) {
    Reader reader = new Reader(text);
    reader.pos = start;
    reader.term();
    return reader.pos;
  }

  /** Quotes value as an SMT-LIB string literal. */
  static String quote(String value) {
    StringBuilder builder = new StringBuilder("\"");
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '"') {
        builder.append("\"\"");
      } else if (c == '\\' || c < 0x20 || c > 0x7e) {
        builder.append(String.format("\\u{%x}", (int) c));
      } else {
        builder.append(c);
      }
    }
    return builder.append('"').toString();
  }

  boolean isAtom() {
    return elements == null;
  }

  boolean isSymbol() {
    return elements == null && !stringLiteral;
  }

  String atom() {
    return atom;
  }

  ImmutableList<SExpression> elements() {
    return elements;
  }

  /** Returns all symbols, including operator names, in order of occurrence. */
  ImmutableSet<String> symbols() {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    collectSymbols(result);
    return result.build();
  }

  private void collectSymbols(ImmutableSet.Builder<String> result) {
    if (isSymbol()) {
      result.add(atom);
    } else if (elements != null) {
      for (SExpression element : elements) {
        element.collectSymbols(result);
      }
    }
  }

  /** Renames the symbols that are keys of renaming. */
  SExpression rename(Map<String, String> renaming) {
    if (isSymbol()) {
      String renamed = renaming.get(atom);
      return renamed == null ? this : new SExpression(renamed, false, null);
    }
    if (elements == null) {
      return this;
    }
    ImmutableList.Builder<SExpression> renamed = ImmutableList.builder();
    for (SExpression element : elements) {
      renamed.add(element.rename(renaming));
    }
    return new SExpression(null, false, renamed.build());
  }

  /**
   * Checks that none of the given string-valued symbols is used directly as
   * an argument of an arithmetic operator.
   *
   * @throws FormulaException on the first such use
   */
  void checkStringSorts(Set<String> stringSymbols) {
    if (elements == null || elements.isEmpty()) {
      return;
    }
    SExpression head = elements.get(0);
    if (head.isSymbol() && ARITHMETIC.contains(head.atom)) {
      for (SExpression argument : elements.subList(1, elements.size())) {
        if (argument.isSymbol() && stringSymbols.contains(argument.atom)) {
          throw new FormulaException(String.format(
              "String variable %s used as a number in %s",
              argument.atom, this));
        }
      }
    }
    for (SExpression element : elements) {
      element.checkStringSorts(stringSymbols);
    }
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SExpression && toString().equals(obj.toString());
  }

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public String toString() {
    if (elements == null) {
      return atom;
    }
    return "(" + Joiner.on(' ').join(elements) + ")";
  }

  private static final class Reader {
    private final String text;
    private int pos = 0;

    Reader(String text) {
      this.text = text;
    }

    SExpression term() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw new FormulaException("Unexpected end of SMT term: " + text);
      }
      char c = text.charAt(pos);
      if (c == '(') {
        pos++;
        List<SExpression> elements = Lists.newArrayList();
        skipWhitespace();
        while (pos < text.length() && text.charAt(pos) != ')') {
          elements.add(term());
          skipWhitespace();
        }
        if (pos >= text.length()) {
          throw new FormulaException("Unbalanced '(' in SMT term: " + text);
        }
        pos++;
        return new SExpression(null, false, ImmutableList.copyOf(elements));
      }
      if (c == ')') {
        throw new FormulaException("Unbalanced ')' in SMT term: " + text);
      }
      if (c == '"') {
        return new SExpression(stringLiteral(), true, null);
      }
      if (c == '|') {
        int close = text.indexOf('|', pos + 1);
        if (close < 0) {
          throw new FormulaException("Unterminated |symbol| in " + text);
        }
        String symbol = text.substring(pos, close + 1);
        pos = close + 1;
        return new SExpression(symbol, false, null);
      }
      int start = pos;
      while (pos < text.length() && !Character.isWhitespace(text.charAt(pos))
          && "()\"".indexOf(text.charAt(pos)) < 0) {
        pos++;
      }
      return new SExpression(text.substring(start, pos), false, null);
    }

    /** Reads a literal, keeping its quotes and doubled-quote escapes. */
    private String stringLiteral() {
      int start = pos;
      pos++;
      while (pos < text.length()) {
        if (text.charAt(pos) == '"') {
          if (pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
            pos += 2;
            continue;
          }
          pos++;
          return text.substring(start, pos);
        }
        pos++;
      }
      throw new FormulaException("Unterminated string in SMT term: " + text);
    }

    void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }
  }
}
