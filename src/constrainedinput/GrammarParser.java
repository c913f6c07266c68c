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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses strings into closed derivation trees. The parser works top-down over
 * token spans and memoizes which nonterminal derives which span, which keeps
 * it polynomial and lets it handle left-recursive and empty rules. When a
 * string has several derivations, the one found first is returned: earlier
 * alternatives win, and shorter leading children win within an alternative.
 * <p>
 * Besides plain strings, the parser accepts token lists in which a token may
 * be a nonterminal placeholder. A placeholder is derived only by its own
 * nonterminal and becomes an open leaf, which is how match expressions are
 * turned into tree prefixes.
 */
public final class GrammarParser {
  private final Grammar grammar;

  private GrammarParser(Grammar grammar) {
    this.grammar = grammar;
  }

  public static GrammarParser create(Grammar grammar) {
    return new GrammarParser(grammar);
  }

  /** Parses input as a word of the start symbol. */
  public DerivationTree parse(String input, IdSource ids) {
    return parse(input, grammar.startSymbol(), ids);
  }

  /**
   * @param input the string to parse
   * @param nonterminal the nonterminal input should be derived from
   * @param ids the source of node ids, assigned in pre-order
   * @return a closed derivation tree whose rendering is input
   * @throws GrammarException if nonterminal does not derive input
   */
  public DerivationTree parse(String input, String nonterminal, IdSource ids) {
    DerivationTree result = parseTokens(characters(input), nonterminal, ids);
    if (result == null) {
      throw new GrammarException(String.format(
          "Cannot derive \"%s\" from %s", input, nonterminal));
    }
    return result;
  }

  /** Returns whether nonterminal derives input. */
  public boolean accepts(String input, String nonterminal) {
    return new Run(characters(input)).parseSpan(nonterminal, 0,
        input.length()) != null;
  }

  /**
   * Parses a token list in which each token is a single character or a
   * nonterminal placeholder.
   *
   * @return the tree, or null if nonterminal does not derive the tokens
   */
  DerivationTree parseTokens(List<String> tokens, String nonterminal,
      IdSource ids) {
    grammar.alternatives(nonterminal);  // throws if undefined
    Node root = new Run(tokens).parseSpan(nonterminal, 0, tokens.size());
    return root == null ? null : root.toTree(ids);
  }

  static List<String> characters(String input) {
    List<String> tokens = Lists.newArrayListWithCapacity(input.length());
    for (int i = 0; i < input.length(); i++) {
      tokens.add(String.valueOf(input.charAt(i)));
    }
    return tokens;
  }

  /** A parse result before ids are assigned. */
  private static final class Node {
    final String value;
    final List<Node> children;

    Node(String value, List<Node> children) {
      this.value = value;
      this.children = children;
    }

    DerivationTree toTree(IdSource ids) {
      if (children == null) {
        return DerivationTree.open(ids.next(), value);
      }
      long id = ids.next();
      List<DerivationTree> childTrees = Lists.newArrayList();
      for (Node child : children) {
        childTrees.add(child.toTree(ids));
      }
      return DerivationTree.create(id, value, childTrees);
    }
  }

  private static final class Span {
    final String nonterminal;
    final int start;
    final int end;

    Span(String nonterminal, int start, int end) {
      this.nonterminal = nonterminal;
      this.start = start;
      this.end = end;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Span)) {
        return false;
      }
      Span other = (Span) obj;
      return start == other.start && end == other.end
          && nonterminal.equals(other.nonterminal);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(nonterminal, start, end);
    }
  }

  /** The state of parsing one token list. */
  private final class Run {
    private final List<String> tokens;
    private final Map<Span, Node> parsed = Maps.newHashMap();
    private final Set<Span> failed = Sets.newHashSet();
    private final Set<Span> active = Sets.newHashSet();

    /** Counts cut-off cycles; failures seen under a cut-off are not cached. */
    private int cycleCuts = 0;

    Run(List<String> tokens) {
      this.tokens = tokens;
    }

    Node parseSpan(String nonterminal, int start, int end) {
      Span span = new Span(nonterminal, start, end);
      Node known = parsed.get(span);
      if (known != null) {
        return known;
      }
      if (failed.contains(span)) {
        return null;
      }
      if (end == start + 1 && tokens.get(start).equals(nonterminal)) {
        Node placeholder = new Node(nonterminal, null);
        parsed.put(span, placeholder);
        return placeholder;
      }
      if (!active.add(span)) {
        cycleCuts++;
        return null;
      }
      int cutsBefore = cycleCuts;
      Node result = null;
      for (List<String> alternative : grammar.alternatives(nonterminal)) {
        List<Node> children = matchSequence(alternative, 0, start, end);
        if (children != null) {
          result = new Node(nonterminal, children);
          break;
        }
      }
      active.remove(span);
      if (result != null) {
        parsed.put(span, result);
      } else if (cycleCuts == cutsBefore) {
        failed.add(span);
      }
      return result;
    }

    private List<Node> matchSequence(List<String> symbols, int index,
        int start, int end) {
      if (index == symbols.size()) {
        return start == end ? Lists.<Node>newArrayList() : null;
      }
      String symbol = symbols.get(index);
      if (!Grammar.isNonterminal(symbol)) {
        if (!matchesTerminal(symbol, start, end)) {
          return null;
        }
        List<Node> rest =
            matchSequence(symbols, index + 1, start + symbol.length(), end);
        if (rest != null) {
          rest.add(0, new Node(symbol, ImmutableList.<Node>of()));
        }
        return rest;
      }
      int reserved = terminalLength(symbols, index + 1);
      for (int split = start; split <= end - reserved; split++) {
        Node child = parseSpan(symbol, start, split);
        if (child == null) {
          continue;
        }
        List<Node> rest = matchSequence(symbols, index + 1, split, end);
        if (rest != null) {
          rest.add(0, child);
          return rest;
        }
      }
      return null;
    }

    private boolean matchesTerminal(String terminal, int start, int end) {
      if (start + terminal.length() > end) {
        return false;
      }
      for (int i = 0; i < terminal.length(); i++) {
        String token = tokens.get(start + i);
        if (token.length() != 1 || token.charAt(0) != terminal.charAt(i)) {
          return false;
        }
      }
      return true;
    }

    /** Returns the number of tokens the terminals from index on consume. */
    private int terminalLength(List<String> symbols, int index) {
      int length = 0;
      for (int i = index; i < symbols.size(); i++) {
        if (!Grammar.isNonterminal(symbols.get(i))) {
          length += symbols.get(i).length();
        }
      }
      return length;
    }
  }
}
