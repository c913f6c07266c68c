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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Parses the concrete syntax of constraints:
 *
 * <pre>
 * constraint := ("const" NAME ":" NONTERMINAL ";")* formula
 * formula    := quantifier | formula ("and" | "or" | "xor" | "implies" |
 *               "iff") formula | "not" formula | "(" formula ")" | atom
 * quantifier := ("forall" | "exists") NONTERMINAL [NAME] ["=" STRING]
 *               "in" NAME ":" formula
 * atom       := "true" | "false" | SMT-LIB term | NAME "(" args ")"
 * </pre>
 *
 * Binding strength decreases from "not" over "and", "or", "xor" and
 * "implies" (right associative) to "iff"; a quantifier's body extends as far
 * to the right as possible. Without declarations, a single constant
 * {@code start: <start>} is assumed. A nonterminal occurring where a variable
 * is expected, as in {@code (= <var> "x")}, stands for a fresh variable
 * quantified universally over the first constant.
 * <p>
 * Text from {@code #} to the end of a line is a comment.
 * <p>
 * Predicates are resolved against a {@link PredicateSignature}, which must be
 * supplied up front.
 */
public final class FormulaParser {
  private static final ImmutableSet<String> FORMULA_KEYWORDS =
      ImmutableSet.of("forall", "exists", "not", "true", "false");

  private final PredicateSignature signature;

  private FormulaParser(PredicateSignature signature) {
    this.signature = signature;
  }

  /**
   * @throws ConfigurationException if signature is null
   */
  public static FormulaParser create(PredicateSignature signature) {
    if (signature == null) {
      throw new ConfigurationException(
          "Parsing a constraint requires a predicate signature");
    }
    return new FormulaParser(signature);
  }

  /**
   * @throws FormulaException if text is malformed or uses unknown predicates
   *         or unbound variables
   */
  public Formula parse(String text) {
    return new Run(text).constraint();
  }

  /** Parses text and checks the result against grammar. */
  public Formula parse(String text, Grammar grammar) {
    Formula formula = parse(text);
    Formulas.checkWellFormed(formula, grammar, signature);
    return formula;
  }

  private final class Run {
    private final String text;
    private int pos = 0;
    private final Map<String, Variable> scope = Maps.newHashMap();
    private Variable firstConstant;
    private int freshNames = 0;

    Run(String text) {
      this.text = text;
    }

    Formula constraint() {
      while (keyword("const")) {
        String name = identifier();
        expect(":");
        Variable constant = Variable.constant(name, nonterminal());
        expect(";");
        if (scope.put(name, constant) != null) {
          throw error("Constant " + name + " declared twice");
        }
        if (firstConstant == null) {
          firstConstant = constant;
        }
      }
      if (firstConstant == null) {
        firstConstant = Variable.start();
        scope.put(firstConstant.name(), firstConstant);
      }
      Formula result = formula();
      skipWhitespace();
      if (pos != text.length()) {
        throw error("Unexpected text");
      }
      return result;
    }

    private Formula formula() {
      Formula left = implication();
      while (keyword("iff")) {
        Formula right = implication();
        left = DisjunctiveFormula.create(Lists.newArrayList(
            ConjunctiveFormula.create(Lists.newArrayList(left, right)),
            ConjunctiveFormula.create(Lists.<Formula>newArrayList(
                NegatedFormula.create(left), NegatedFormula.create(right)))));
      }
      return left;
    }

    private Formula implication() {
      Formula left = exclusiveOr();
      if (keyword("implies")) {
        Formula right = implication();
        return DisjunctiveFormula.create(Lists.newArrayList(
            NegatedFormula.create(left), right));
      }
      return left;
    }

    private Formula exclusiveOr() {
      Formula left = disjunction();
      while (keyword("xor")) {
        Formula right = disjunction();
        left = DisjunctiveFormula.create(Lists.newArrayList(
            ConjunctiveFormula.create(Lists.newArrayList(
                left, NegatedFormula.create(right))),
            ConjunctiveFormula.create(Lists.newArrayList(
                NegatedFormula.create(left), right))));
      }
      return left;
    }

    private Formula disjunction() {
      List<Formula> disjuncts = Lists.newArrayList(conjunction());
      while (keyword("or")) {
        disjuncts.add(conjunction());
      }
      return disjuncts.size() == 1
          ? disjuncts.get(0) : DisjunctiveFormula.create(disjuncts);
    }

    private Formula conjunction() {
      List<Formula> conjuncts = Lists.newArrayList(unary());
      while (keyword("and")) {
        conjuncts.add(unary());
      }
      return conjuncts.size() == 1
          ? conjuncts.get(0) : ConjunctiveFormula.create(conjuncts);
    }

    private Formula unary() {
      if (keyword("not")) {
        return NegatedFormula.create(unary());
      }
      if (keyword("forall")) {
        return quantifier(true);
      }
      if (keyword("exists")) {
        return quantifier(false);
      }
      return atom();
    }

    private Formula quantifier(boolean universal) {
      String type = nonterminal();
      String name;
      skipWhitespace();
      if (startsIdentifier() && !lookingAtKeyword("in")) {
        name = identifier();
      } else {
        name = freshName(type);
      }
      MatchExpression matchExpression = null;
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == '=') {
        pos++;
        matchExpression = MatchExpression.parse(stringLiteral());
      }
      if (!keyword("in")) {
        throw error("Expected 'in'");
      }
      Variable inVariable = lookup(identifier());
      expect(":");
      Variable bound = Variable.bound(name, type);
      Map<String, Variable> saved = Maps.newHashMap(scope);
      scope.put(name, bound);
      if (matchExpression != null) {
        for (Variable variable : matchExpression.boundVariables()) {
          scope.put(variable.name(), variable);
        }
      }
      Formula body = formula();
      scope.clear();
      scope.putAll(saved);
      return universal
          ? ForallFormula.create(bound, inVariable, matchExpression, body)
          : ExistsFormula.create(bound, inVariable, matchExpression, body);
    }

    private Formula atom() {
      if (keyword("true")) {
        return SmtFormula.TRUE;
      }
      if (keyword("false")) {
        return SmtFormula.FALSE;
      }
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == '(') {
        if (parenthesizedFormulaAhead()) {
          pos++;
          Formula result = formula();
          expect(")");
          return result;
        }
        return smtAtom();
      }
      if (startsIdentifier()) {
        return predicateAtom(identifier());
      }
      throw error("Expected a formula");
    }

    /**
     * Decides whether the parenthesis at pos opens a formula rather than an
     * SMT term, by looking at what follows it.
     */
    private boolean parenthesizedFormulaAhead() {
      int p = skipWhitespace(pos + 1);
      if (p >= text.length()) {
        return false;
      }
      if (text.charAt(p) == '(') {
        return true;
      }
      int end = p;
      while (end < text.length()
          && Character.isJavaIdentifierPart(text.charAt(end))) {
        end++;
      }
      String word = text.substring(p, end);
      if (FORMULA_KEYWORDS.contains(word)) {
        return true;
      }
      int next = skipWhitespace(end);
      return !word.isEmpty() && signature.get(word) != null
          && next < text.length() && text.charAt(next) == '(';
    }

    private Formula smtAtom() {
      int end = SExpression.termEnd(text, pos);
      SExpression expression = SExpression.parse(text.substring(pos, end));
      pos = end;
      List<Variable> variables = Lists.newArrayList();
      List<Variable> freeNonterminals = Lists.newArrayList();
      Map<String, String> renaming = Maps.newHashMap();
      for (String symbol : expression.symbols()) {
        if (Grammar.isNonterminal(symbol)) {
          Variable fresh = Variable.bound(freshName(symbol), symbol);
          renaming.put(symbol, fresh.name());
          freeNonterminals.add(fresh);
          variables.add(fresh);
        } else if (scope.containsKey(symbol)) {
          variables.add(scope.get(symbol));
        }
      }
      Formula atom = SmtFormula.create(expression.rename(renaming), variables);
      return quantifyOverStart(atom, freeNonterminals);
    }

    private Formula predicateAtom(String name) {
      Predicate predicate = signature.get(name);
      if (predicate == null) {
        throw error("Unknown predicate " + name);
      }
      expect("(");
      List<Object> arguments = Lists.newArrayList();
      List<Variable> freeNonterminals = Lists.newArrayList();
      skipWhitespace();
      if (pos < text.length() && text.charAt(pos) == ')') {
        pos++;
      } else {
        do {
          arguments.add(predicateArgument(freeNonterminals));
        } while (consume(","));
        expect(")");
      }
      PredicateFormula atom = predicate instanceof StructuralPredicate
          ? StructuralPredicateFormula.create(name, arguments)
          : SemanticPredicateFormula.create(name, arguments);
      signature.check(atom);
      return quantifyOverStart(atom, freeNonterminals);
    }

    private Object predicateArgument(List<Variable> freeNonterminals) {
      skipWhitespace();
      if (pos >= text.length()) {
        throw error("Expected an argument");
      }
      char c = text.charAt(pos);
      if (c == '"') {
        return stringLiteral();
      }
      if (c == '-' || Character.isDigit(c)) {
        int start = pos++;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
          pos++;
        }
        try {
          return Integer.valueOf(text.substring(start, pos));
        } catch (NumberFormatException e) {
          throw error("Malformed integer " + text.substring(start, pos));
        }
      }
      if (c == '<') {
        String type = nonterminal();
        Variable fresh = Variable.bound(freshName(type), type);
        freeNonterminals.add(fresh);
        return fresh;
      }
      return lookup(identifier());
    }

    private Formula quantifyOverStart(Formula atom, List<Variable> variables) {
      Formula result = atom;
      for (Variable variable : Lists.reverse(variables)) {
        result = ForallFormula.create(variable, firstConstant, result);
      }
      return result;
    }

    private Variable lookup(String name) {
      Variable variable = scope.get(name);
      if (variable == null) {
        throw error("Unbound variable " + name);
      }
      return variable;
    }

    private String freshName(String type) {
      String base = type.substring(1, type.length() - 1)
          .replaceAll("[^A-Za-z0-9_]", "_");
      if (base.isEmpty() || Character.isDigit(base.charAt(0))) {
        base = "v" + base;
      }
      String name;
      do {
        name = base + "_" + freshNames++;
      } while (scope.containsKey(name));
      return name;
    }

    private String nonterminal() {
      skipWhitespace();
      int close = text.indexOf('>', pos);
      if (pos >= text.length() || text.charAt(pos) != '<' || close < 0) {
        throw error("Expected a nonterminal");
      }
      String result = text.substring(pos, close + 1);
      if (!Grammar.isNonterminal(result)) {
        throw error("Malformed nonterminal " + result);
      }
      pos = close + 1;
      return result;
    }

    private boolean startsIdentifier() {
      return pos < text.length()
          && (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '_');
    }

    private String identifier() {
      skipWhitespace();
      if (!startsIdentifier()) {
        throw error("Expected a name");
      }
      int start = pos;
      while (pos < text.length()
          && (Character.isLetterOrDigit(text.charAt(pos))
              || text.charAt(pos) == '_')) {
        pos++;
      }
      return text.substring(start, pos);
    }

    /** Reads a double-quoted string with backslash escapes. */
    private String stringLiteral() {
      skipWhitespace();
      if (pos >= text.length() || text.charAt(pos) != '"') {
        throw error("Expected a string");
      }
      StringBuilder builder = new StringBuilder();
      pos++;
      while (pos < text.length()) {
        char c = text.charAt(pos++);
        if (c == '"') {
          return builder.toString();
        }
        if (c == '\\' && pos < text.length()) {
          c = text.charAt(pos++);
        }
        builder.append(c);
      }
      throw error("Unterminated string");
    }

    private boolean lookingAtKeyword(String word) {
      int end = pos + word.length();
      return text.startsWith(word, pos) && (end == text.length()
          || !(Character.isLetterOrDigit(text.charAt(end))
              || text.charAt(end) == '_'));
    }

    /** Consumes word if it comes next as a whole word. */
    private boolean keyword(String word) {
      skipWhitespace();
      if (lookingAtKeyword(word)) {
        pos += word.length();
        return true;
      }
      return false;
    }

    private boolean consume(String token) {
      skipWhitespace();
      if (text.startsWith(token, pos)) {
        pos += token.length();
        return true;
      }
      return false;
    }

    private void expect(String token) {
      if (!consume(token)) {
        throw error("Expected '" + token + "'");
      }
    }

    private void skipWhitespace() {
      pos = skipWhitespace(pos);
    }

    private int skipWhitespace(int from) {
      int p = from;
      while (p < text.length()) {
        if (text.charAt(p) == '#') {
          while (p < text.length() && text.charAt(p) != '\n') {
            p++;
          }
        } else if (Character.isWhitespace(text.charAt(p))) {
          p++;
        } else {
          break;
        }
      }
      return p;
    }

    private FormulaException error(String message) {
      int shown = Math.min(text.length(), pos + 20);
      return new FormulaException(String.format("%s at offset %d near \"%s\"",
          message, pos, text.substring(Math.min(pos, text.length()), shown)));
    }
  }
}
