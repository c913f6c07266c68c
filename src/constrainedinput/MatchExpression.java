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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A pattern in the concrete syntax of the grammar, such as
 * {@code "{<var> lhs} := {<rhs> rhs}"}. Braces introduce a placeholder that
 * binds a variable to the matching node; a bare nonterminal such as
 * {@code <digit>} matches any node of that type without binding it; text in
 * square brackets is optional. Everything else is literal text.
 * <p>
 * A match expression is interpreted relative to the type of the quantified
 * variable: it is parsed with that nonterminal into one or more tree
 * prefixes, in which placeholders are open leaves. A node matches if its
 * subtree has the shape of one of the prefixes.
 */
public final class MatchExpression {
  private final String text;
  private final ImmutableList<Element> elements;
  private final ImmutableList<Variable> boundVariables;

  /** Prefixes for the last grammar and type this expression was used with */
  private Grammar cachedGrammar;
  private String cachedType;
  private ImmutableList<TreePrefix> cachedPrefixes;

  private MatchExpression(String text, ImmutableList<Element> elements) {
    this.text = text;
    this.elements = elements;
    List<Variable> variables = Lists.newArrayList();
    Set<String> names = Sets.newHashSet();
    for (Element element : elements) {
      element.collectVariables(variables, false);
    }
    for (Variable variable : variables) {
      if (!names.add(variable.name())) {
        throw new FormulaException(String.format(
            "%s is bound twice in match expression \"%s\"",
            variable.name(), text));
      }
    }
    this.boundVariables = ImmutableList.copyOf(variables);
  }

  /**
   * @param text the match expression without the surrounding quotes
   * @throws FormulaException if text is malformed
   */
  public static MatchExpression parse(String text) {
    Reader reader = new Reader(text);
    ImmutableList<Element> elements = reader.elements(false);
    if (reader.pos != text.length()) {
      throw new FormulaException(
          "Unbalanced ']' in match expression \"" + text + "\"");
    }
    return new MatchExpression(text, elements);
  }

  public String text() {
    return text;
  }

  /** Returns the variables bound by placeholders, left to right. */
  public ImmutableList<Variable> boundVariables() {
    return boundVariables;
  }

  /**
   * Tries to match the node at path in tree.
   *
   * @return the placeholder bindings (absolute paths), or null if the node
   *         does not match
   */
  public ImmutableMap<Variable, Path> match(Grammar grammar,
      DerivationTree tree, Path path) {
    DerivationTree node = tree.getSubtree(path);
    for (TreePrefix prefix : prefixes(grammar, node.value())) {
      if (matches(prefix.tree, node)) {
        ImmutableMap.Builder<Variable, Path> result = ImmutableMap.builder();
        for (Map.Entry<Variable, Path> binding :
            prefix.placeholders.entrySet()) {
          result.put(binding.getKey(), path.concat(binding.getValue()));
        }
        return result.build();
      }
    }
    return null;
  }

  private static boolean matches(DerivationTree prefix, DerivationTree node) {
    if (!prefix.value().equals(node.value())) {
      return false;
    }
    if (prefix.isOpen()) {
      return true;
    }
    if (node.isOpen() || node.children().size() != prefix.children().size()) {
      return false;
    }
    for (int i = 0; i < node.children().size(); i++) {
      if (!matches(prefix.child(i), node.child(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Builds the trees of the given type that have the shape of this
   * expression, with open leaves at the placeholders. There is one prefix
   * per way of choosing the optional parts that the grammar admits, the
   * choices omitting more optional text coming first.
   *
   * @throws FormulaException if type derives none of them
   */
  public ImmutableList<TreePrefix> treePrefixes(Grammar grammar, String type,
      IdSource ids) {
    GrammarParser parser = GrammarParser.create(grammar);
    ImmutableList.Builder<TreePrefix> result = ImmutableList.builder();
    for (List<Element> choice : expandOptionals(elements)) {
      List<String> tokens = Lists.newArrayList();
      List<Variable> openLeafVariables = Lists.newArrayList();
      for (Element element : choice) {
        element.appendTokens(tokens, openLeafVariables);
      }
      DerivationTree tree = parser.parseTokens(tokens, type, ids);
      if (tree == null) {
        continue;
      }
      ImmutableMap.Builder<Variable, Path> placeholders =
          ImmutableMap.builder();
      List<Path> openLeaves = tree.openLeaves();
      for (int i = 0; i < openLeaves.size(); i++) {
        if (openLeafVariables.get(i) != null) {
          placeholders.put(openLeafVariables.get(i), openLeaves.get(i));
        }
      }
      result.add(new TreePrefix(tree, placeholders.build()));
    }
    ImmutableList<TreePrefix> prefixes = result.build();
    if (prefixes.isEmpty()) {
      throw new FormulaException(String.format(
          "Match expression \"%s\" is not derivable from %s", text, type));
    }
    return prefixes;
  }

  private ImmutableList<TreePrefix> prefixes(Grammar grammar, String type) {
    if (grammar != cachedGrammar || !type.equals(cachedType)) {
      cachedPrefixes = treePrefixes(grammar, type, IdSource.startingAt(0));
      cachedGrammar = grammar;
      cachedType = type;
    }
    return cachedPrefixes;
  }

  /** Flattens optional groups, fewest present groups first. */
  private static List<List<Element>> expandOptionals(List<Element> elements) {
    List<List<Element>> result = Lists.newArrayList();
    result.add(Lists.<Element>newArrayList());
    for (Element element : elements) {
      List<List<Element>> extended = Lists.newArrayList();
      if (element.optional != null) {
        List<List<Element>> inner = expandOptionals(element.optional);
        for (List<Element> prefix : result) {
          extended.add(prefix);
        }
        for (List<Element> prefix : result) {
          for (List<Element> choice : inner) {
            List<Element> combined = Lists.newArrayList(prefix);
            combined.addAll(choice);
            extended.add(combined);
          }
        }
      } else {
        for (List<Element> prefix : result) {
          List<Element> combined = Lists.newArrayList(prefix);
          combined.add(element);
          extended.add(combined);
        }
      }
      result = extended;
    }
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof MatchExpression
        && text.equals(((MatchExpression) obj).text);
  }

  @Override
  public int hashCode() {
    return text.hashCode();
  }

  @Override
  public String toString() {
    return text;
  }

  /** A tree of a match expression's shape and where its placeholders are. */
  static final class TreePrefix {
    final DerivationTree tree;
    final ImmutableMap<Variable, Path> placeholders;

    TreePrefix(DerivationTree tree, ImmutableMap<Variable, Path> placeholders) {
      this.tree = tree;
      this.placeholders = placeholders;
    }
  }

  /**
   * One piece of a match expression: literal text, a placeholder (with or
   * without a variable), or an optional group.
   */
  private static final class Element {
    final String literal;
    final String type;
    final Variable variable;
    final ImmutableList<Element> optional;

    private Element(String literal, String type, Variable variable,
        ImmutableList<Element> optional) {
      this.literal = literal;
      this.type = type;
      this.variable = variable;
      this.optional = optional;
    }

    void appendTokens(List<String> tokens, List<Variable> openLeafVariables) {
      if (literal != null) {
        tokens.addAll(GrammarParser.characters(literal));
      } else {
        tokens.add(type);
        openLeafVariables.add(variable);
      }
    }

    void collectVariables(List<Variable> variables, boolean inOptional) {
      if (variable != null) {
        if (inOptional) {
          throw new FormulaException("Variable " + variable.name()
              + " may not be bound inside an optional group");
        }
        variables.add(variable);
      }
      if (optional != null) {
        for (Element element : optional) {
          element.collectVariables(variables, true);
        }
      }
    }
  }

  private static final class Reader {
    private final String text;
    private int pos = 0;

    Reader(String text) {
      this.text = text;
    }

    ImmutableList<Element> elements(boolean inOptional) {
      ImmutableList.Builder<Element> result = ImmutableList.builder();
      StringBuilder literal = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (c == ']') {
          if (!inOptional) {
            break;
          }
          flush(literal, result);
          pos++;
          return result.build();
        } else if (c == '[') {
          flush(literal, result);
          pos++;
          ImmutableList<Element> group = elements(true);
          result.add(new Element(null, null, null, group));
        } else if (c == '{') {
          flush(literal, result);
          result.add(placeholder());
        } else if (c == '<' && nonterminalEnd() > 0) {
          flush(literal, result);
          int end = nonterminalEnd();
          result.add(new Element(null, text.substring(pos, end), null, null));
          pos = end;
        } else {
          literal.append(c);
          pos++;
        }
      }
      if (inOptional) {
        throw new FormulaException(
            "Unterminated '[' in match expression \"" + text + "\"");
      }
      flush(literal, result);
      return result.build();
    }

    /** Returns the end of a nonterminal starting at pos, or -1. */
    private int nonterminalEnd() {
      int close = text.indexOf('>', pos);
      if (close < 0) {
        return -1;
      }
      return Grammar.isNonterminal(text.substring(pos, close + 1))
          ? close + 1 : -1;
    }

    private Element placeholder() {
      int close = text.indexOf('}', pos);
      if (close < 0) {
        throw new FormulaException(
            "Unterminated '{' in match expression \"" + text + "\"");
      }
      String[] parts = text.substring(pos + 1, close).trim().split("\\s+");
      if (parts.length != 2 || !Grammar.isNonterminal(parts[0])) {
        throw new FormulaException("Malformed placeholder "
            + text.substring(pos, close + 1) + ", expected {<type> name}");
      }
      pos = close + 1;
      return new Element(null, parts[0], Variable.bound(parts[1], parts[0]),
          null);
    }

    private static void flush(StringBuilder literal,
        ImmutableList.Builder<Element> result) {
      if (literal.length() > 0) {
        result.add(new Element(literal.toString(), null, null, null));
        literal.setLength(0);
      }
    }
  }
}
