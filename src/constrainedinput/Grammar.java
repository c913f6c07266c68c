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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A context-free grammar. Each nonterminal, written in angle brackets, maps to
 * an ordered list of alternatives; each alternative is a sequence of symbols,
 * where a symbol is either a nonterminal or a literal terminal string. The
 * start symbol is always {@value #START_SYMBOL}.
 * <p>
 * Grammars are validated on construction: every referenced nonterminal must be
 * defined, every defined nonterminal must be reachable from the start symbol
 * and able to derive some terminal string.
 */
public final class Grammar {
  public static final String START_SYMBOL = "<start>";

  private static final Pattern NONTERMINAL = Pattern.compile("<[^<> ]+>");

  private final ImmutableMap<String, ImmutableList<ImmutableList<String>>>
      rules;

  /** Nonterminals reachable in one or more derivation steps */
  private final ImmutableMap<String, ImmutableSet<String>> properlyReachable;

  /** The fewest nonterminal expansions needed to close each nonterminal */
  private final ImmutableMap<String, Integer> minimalCosts;

  private Grammar(
      ImmutableMap<String, ImmutableList<ImmutableList<String>>> rules) {
    this.rules = rules;
    checkReferences();
    this.properlyReachable = computeReachability();
    checkReachable();
    this.minimalCosts = computeMinimalCosts();
  }

  /**
   * @param alternatives a map from nonterminals to their alternatives, each
   *        written as literal text interleaved with nonterminal references,
   *        e.g. {@code "<var> := <rhs>"}. The empty string is the empty
   *        alternative.
   * @return the validated grammar
   * @throws GrammarException if the grammar is ill-formed
   */
  public static Grammar create(
      Map<String, ? extends List<String>> alternatives) {
    ImmutableMap.Builder<String, ImmutableList<ImmutableList<String>>> builder =
        ImmutableMap.builder();
    for (Map.Entry<String, ? extends List<String>> entry :
        alternatives.entrySet()) {
      if (!isNonterminal(entry.getKey())) {
        throw new GrammarException(
            "Rule for non-nonterminal " + entry.getKey());
      }
      if (entry.getValue().isEmpty()) {
        throw new GrammarException(
            entry.getKey() + " has no alternatives");
      }
      ImmutableList.Builder<ImmutableList<String>> expansions =
          ImmutableList.builder();
      for (String alternative : entry.getValue()) {
        expansions.add(splitAlternative(alternative));
      }
      builder.put(entry.getKey(), expansions.build());
    }
    return new Grammar(builder.build());
  }

  /** Returns whether symbol is a nonterminal reference such as {@code <x>}. */
  public static boolean isNonterminal(String symbol) {
    return NONTERMINAL.matcher(symbol).matches();
  }

  /**
   * Splits an alternative into its symbols. Adjacent literal characters form a
   * single terminal symbol.
   */
  static ImmutableList<String> splitAlternative(String alternative) {
    ImmutableList.Builder<String> symbols = ImmutableList.builder();
    Matcher matcher = NONTERMINAL.matcher(alternative);
    int last = 0;
    while (matcher.find()) {
      if (matcher.start() > last) {
        symbols.add(alternative.substring(last, matcher.start()));
      }
      symbols.add(matcher.group());
      last = matcher.end();
    }
    if (last < alternative.length()) {
      symbols.add(alternative.substring(last));
    }
    return symbols.build();
  }

  public String startSymbol() {
    return START_SYMBOL;
  }

  public ImmutableSet<String> nonterminals() {
    return rules.keySet();
  }

  public boolean isDefined(String nonterminal) {
    return rules.containsKey(nonterminal);
  }

  /**
   * @return the alternatives of nonterminal, in declaration order
   * @throws GrammarException if nonterminal is not defined
   */
  public ImmutableList<ImmutableList<String>> alternatives(String nonterminal) {
    ImmutableList<ImmutableList<String>> result = rules.get(nonterminal);
    if (result == null) {
      throw new GrammarException("Undefined nonterminal " + nonterminal);
    }
    return result;
  }

  /**
   * Returns whether a tree rooted in {@code from} can contain a node labeled
   * {@code to}. Every nonterminal reaches itself.
   */
  public boolean reachable(String from, String to) {
    if (from.equals(to)) {
      return true;
    }
    ImmutableSet<String> reached = properlyReachable.get(from);
    return reached != null && reached.contains(to);
  }

  /** Returns whether nonterminal can occur strictly below itself. */
  public boolean isRecursive(String nonterminal) {
    ImmutableSet<String> reached = properlyReachable.get(nonterminal);
    return reached != null && reached.contains(nonterminal);
  }

  /**
   * Returns the smallest number of nonterminal expansions needed to turn an
   * open node labeled nonterminal into a closed tree.
   */
  public int minimalCost(String nonterminal) {
    Integer cost = minimalCosts.get(nonterminal);
    if (cost == null) {
      throw new GrammarException("Undefined nonterminal " + nonterminal);
    }
    return cost;
  }

  /** Returns the minimal cost of closing all nonterminals of an expansion. */
  public int minimalCost(List<String> expansion) {
    int cost = 0;
    for (String symbol : expansion) {
      if (isNonterminal(symbol)) {
        cost += minimalCost(symbol);
      }
    }
    return cost;
  }

  /** Returns the first alternative of nonterminal with the least cost. */
  public ImmutableList<String> cheapestAlternative(String nonterminal) {
    ImmutableList<String> best = null;
    int bestCost = Integer.MAX_VALUE;
    for (ImmutableList<String> alternative : alternatives(nonterminal)) {
      int cost = minimalCost(alternative);
      if (cost < bestCost) {
        best = alternative;
        bestCost = cost;
      }
    }
    return best;
  }

  /**
   * Enumerates the language of a nonterminal whose language is finite and
   * small, such as a single-character variable name.
   *
   * @param nonterminal the nonterminal whose words are wanted
   * @param limit the largest number of words to produce
   * @return the words in derivation order, or null if the language is infinite
   *         or has more than limit words
   */
  public ImmutableSet<String> finiteLanguage(String nonterminal, int limit) {
    if (isRecursive(nonterminal)) {
      return null;
    }
    for (String reached : properlyReachable.get(nonterminal)) {
      if (isRecursive(reached)) {
        return null;
      }
    }
    Set<String> words = words(nonterminal, limit);
    return words == null ? null : ImmutableSet.copyOf(words);
  }

  private Set<String> words(String nonterminal, int limit) {
    Set<String> result = Sets.newLinkedHashSet();
    for (ImmutableList<String> alternative : alternatives(nonterminal)) {
      Set<String> prefixes = Sets.newLinkedHashSet();
      prefixes.add("");
      for (String symbol : alternative) {
        Set<String> suffixes;
        if (isNonterminal(symbol)) {
          suffixes = words(symbol, limit);
          if (suffixes == null) {
            return null;
          }
        } else {
          suffixes = ImmutableSet.of(symbol);
        }
        Set<String> extended = Sets.newLinkedHashSet();
        for (String prefix : prefixes) {
          for (String suffix : suffixes) {
            extended.add(prefix + suffix);
            if (extended.size() > limit) {
              return null;
            }
          }
        }
        prefixes = extended;
      }
      result.addAll(prefixes);
      if (result.size() > limit) {
        return null;
      }
    }
    return result;
  }

  private void checkReferences() {
    if (!rules.containsKey(START_SYMBOL)) {
      throw new GrammarException("Grammar has no " + START_SYMBOL + " rule");
    }
    for (Map.Entry<String, ImmutableList<ImmutableList<String>>> entry :
        rules.entrySet()) {
      for (List<String> alternative : entry.getValue()) {
        for (String symbol : alternative) {
          if (isNonterminal(symbol) && !rules.containsKey(symbol)) {
            throw new GrammarException(String.format(
                "%s refers to undefined nonterminal %s",
                entry.getKey(), symbol));
          }
        }
      }
    }
  }

  private ImmutableMap<String, ImmutableSet<String>> computeReachability() {
    ImmutableMap.Builder<String, ImmutableSet<String>> result =
        ImmutableMap.builder();
    for (String nonterminal : rules.keySet()) {
      Set<String> reached = Sets.newLinkedHashSet();
      Deque<String> worklist = new ArrayDeque<String>();
      worklist.push(nonterminal);
      while (!worklist.isEmpty()) {
        for (List<String> alternative : rules.get(worklist.pop())) {
          for (String symbol : alternative) {
            if (isNonterminal(symbol) && reached.add(symbol)) {
              worklist.push(symbol);
            }
          }
        }
      }
      result.put(nonterminal, ImmutableSet.copyOf(reached));
    }
    return result.build();
  }

  private void checkReachable() {
    Set<String> unreachable = Sets.newTreeSet(rules.keySet());
    unreachable.remove(START_SYMBOL);
    unreachable.removeAll(properlyReachable.get(START_SYMBOL));
    if (!unreachable.isEmpty()) {
      throw new GrammarException("Unreachable nonterminals: "
          + Joiner.on(", ").join(unreachable));
    }
  }

  /** Relaxes costs until a fixpoint is reached. */
  private ImmutableMap<String, Integer> computeMinimalCosts() {
    Map<String, Integer> costs = Maps.newLinkedHashMap();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Map.Entry<String, ImmutableList<ImmutableList<String>>> entry :
          rules.entrySet()) {
        for (List<String> alternative : entry.getValue()) {
          int cost = 1;
          for (String symbol : alternative) {
            if (isNonterminal(symbol)) {
              Integer childCost = costs.get(symbol);
              if (childCost == null) {
                cost = -1;
                break;
              }
              cost += childCost;
            }
          }
          Integer known = costs.get(entry.getKey());
          if (cost > 0 && (known == null || cost < known)) {
            costs.put(entry.getKey(), cost);
            changed = true;
          }
        }
      }
    }
    List<String> unproductive = Lists.newArrayList();
    for (String nonterminal : rules.keySet()) {
      if (!costs.containsKey(nonterminal)) {
        unproductive.add(nonterminal);
      }
    }
    if (!unproductive.isEmpty()) {
      throw new GrammarException("Nonterminals derive no terminal string: "
          + Joiner.on(", ").join(unproductive));
    }
    return ImmutableMap.copyOf(costs);
  }

  /** Prints the grammar in the format read by {@link GrammarFileParser}. */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (Map.Entry<String, ImmutableList<ImmutableList<String>>> entry :
        rules.entrySet()) {
      List<String> quoted = Lists.newArrayList();
      for (List<String> alternative : entry.getValue()) {
        quoted.add(GrammarFileParser.quote(Joiner.on("").join(alternative)));
      }
      builder.append(entry.getKey()).append(" ::= ")
          .append(Joiner.on(" | ").join(quoted)).append('\n');
    }
    return builder.toString();
  }
}
