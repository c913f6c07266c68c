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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Closes open leaves that no obligation constrains, without looking at any
 * formula. Leaves are expanded depth first, left to right, and every
 * expansion counts against a budget. Alternatives that could not be closed
 * within the remaining budget are never chosen, so every choice leads to a
 * closed tree.
 *
 * <p>{@link #fillings} enumerates several closings by backtracking over the
 * choices, the last choice varying fastest. Under
 * {@link ExpansionPolicy#SHORTEST_FIRST} the alternatives of a node are
 * tried cheapest first; under {@link ExpansionPolicy#RANDOM} in a seeded
 * random order.
 */
public final class DefaultTreeExpander {
  private final Grammar grammar;
  private final ExpansionPolicy policy;
  private final long seed;

  private DefaultTreeExpander(Grammar grammar, ExpansionPolicy policy,
      long seed) {
    this.grammar = Preconditions.checkNotNull(grammar);
    this.policy = Preconditions.checkNotNull(policy);
    this.seed = seed;
  }

  public static DefaultTreeExpander create(Grammar grammar,
      ExpansionPolicy policy, long seed) {
    return new DefaultTreeExpander(grammar, policy, seed);
  }

  /**
   * Closes the subtrees below the given open leaves.
   *
   * @param tree the tree to expand
   * @param leaves paths of open leaves of tree
   * @param ids the source of ids for new nodes
   * @param budget the largest number of expansions allowed
   * @return the closed tree and the number of expansions, or null if closing
   *         the leaves takes more than budget expansions
   */
  public Expansion fill(DerivationTree tree, List<Path> leaves, IdSource ids,
      int budget) {
    List<Expansion> result = fillings(tree, leaves, ids, budget, 1);
    return result.isEmpty() ? null : result.get(0);
  }

  /**
   * Enumerates up to limit closings of the given open leaves. The first one
   * is the closing {@link #fill} returns.
   *
   * @return the closings, empty if none fits the budget
   */
  public List<Expansion> fillings(DerivationTree tree, List<Path> leaves,
      IdSource ids, int budget, int limit) {
    Preconditions.checkArgument(limit > 0, "Nonpositive limit %s", limit);
    int pendingCost = 0;
    for (Path leaf : leaves) {
      pendingCost += grammar.minimalCost(tree.getSubtree(leaf).value());
    }
    // Seeded per tree so that a state's expansion does not depend on the
    // order in which the search visits states.
    Run run = new Run(ids, budget, limit,
        new Random(seed * 31 + tree.fingerprint().hashCode()));
    if (pendingCost <= budget) {
      run.enumerate(tree, ImmutableList.copyOf(leaves), 0, pendingCost);
    }
    return run.results;
  }

  /** One enumeration; results fill up until the limit is reached. */
  private final class Run {
    final IdSource ids;
    final int budget;
    final int limit;
    final Random random;
    final List<Expansion> results = Lists.newArrayList();

    Run(IdSource ids, int budget, int limit, Random random) {
      this.ids = ids;
      this.budget = budget;
      this.limit = limit;
      this.random = random;
    }

    /**
     * @param pending open leaves still to close, next one first
     * @param pendingCost the minimal cost of closing all pending leaves
     * @return true once enough closings were found
     */
    boolean enumerate(DerivationTree tree, List<Path> pending,
        int expansions, int pendingCost) {
      if (pending.isEmpty()) {
        results.add(new Expansion(tree, expansions));
        return results.size() >= limit;
      }
      Path path = pending.get(0);
      List<Path> rest = pending.subList(1, pending.size());
      String nonterminal = tree.getSubtree(path).value();
      int restCost = pendingCost - grammar.minimalCost(nonterminal);
      for (List<String> alternative :
          candidates(nonterminal, budget - expansions - restCost)) {
        List<Path> next = Lists.newArrayList();
        for (int i = 0; i < alternative.size(); i++) {
          if (Grammar.isNonterminal(alternative.get(i))) {
            next.add(path.child(i));
          }
        }
        next.addAll(rest);
        if (enumerate(tree.expand(path, alternative, ids), next,
            expansions + 1, restCost + grammar.minimalCost(alternative))) {
          return true;
        }
      }
      return false;
    }

    /** The alternatives that can be closed with available expansions. */
    private List<ImmutableList<String>> candidates(String nonterminal,
        int available) {
      List<ImmutableList<String>> result = Lists.newArrayList();
      for (ImmutableList<String> alternative :
          grammar.alternatives(nonterminal)) {
        if (1 + grammar.minimalCost(alternative) <= available) {
          result.add(alternative);
        }
      }
      if (policy == ExpansionPolicy.RANDOM) {
        Collections.shuffle(result, random);
      } else {
        Collections.sort(result, new Comparator<List<String>>() {
          @Override
          public int compare(List<String> a, List<String> b) {
            return Integer.compare(grammar.minimalCost(a),
                grammar.minimalCost(b));
          }
        });
      }
      return result;
    }
  }

  /** A closed tree and the expansions it took. */
  public static final class Expansion {
    private final DerivationTree tree;
    private final int expansions;

    Expansion(DerivationTree tree, int expansions) {
      this.tree = tree;
      this.expansions = expansions;
    }

    public DerivationTree tree() {
      return tree;
    }

    public int expansions() {
      return expansions;
    }
  }
}
