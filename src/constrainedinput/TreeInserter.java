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
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * Places a new subtree inside an existing derivation tree, keeping every
 * existing node (and its id) in the result. Two kinds of positions are
 * tried:
 *
 * <ul>
 * <li>an open leaf from which the subtree's type is reachable, which is
 * replaced by a shortest derivation chain ending in the subtree;
 * <li>a node of a recursive type T, which is wrapped in a new T node derived
 * by an alternative that contains T again, the old node going to that
 * position and a chain to the subtree to another one.
 * </ul>
 */
public final class TreeInserter {
  private final Grammar grammar;
  private final Map<String, Map<String, Integer>> distances = Maps.newHashMap();

  private TreeInserter(Grammar grammar) {
    this.grammar = Preconditions.checkNotNull(grammar);
  }

  public static TreeInserter create(Grammar grammar) {
    return new TreeInserter(grammar);
  }

  /**
   * Computes every way of inserting subtree below the node at range.
   *
   * @param tree the tree to insert into
   * @param range the path of the node the subtree has to end up under
   * @param subtree the tree to insert; its nodes keep their ids, except that
   *        its root takes the id of an open leaf it replaces directly
   * @param ids the source of ids for chain and wrapper nodes
   * @return the insertions, open leaves first, each in pre-order
   */
  public List<Insertion> insert(DerivationTree tree, Path range,
      DerivationTree subtree, IdSource ids) {
    String type = subtree.value();
    List<Insertion> leafInsertions = Lists.newArrayList();
    List<Insertion> wrapperInsertions = Lists.newArrayList();
    for (Map.Entry<Path, DerivationTree> entry :
        tree.getSubtree(range).nodes().entrySet()) {
      Path path = range.concat(entry.getKey());
      DerivationTree node = entry.getValue();
      if (!node.isNonterminal() || !grammar.reachable(node.value(), type)) {
        continue;
      }
      if (node.isOpen()) {
        if (node.value().equals(type)) {
          DerivationTree placed = subtree.withId(node.id());
          leafInsertions.add(
              new Insertion(tree.replacePath(path, placed), node.id()));
        } else {
          leafInsertions.add(new Insertion(tree.replacePath(path,
              chain(node.value(), node.id(), subtree, ids)), subtree.id()));
        }
      } else if (!path.equals(range) && grammar.isRecursive(node.value())) {
        for (DerivationTree wrapper : wrappers(node, subtree, ids)) {
          wrapperInsertions.add(new Insertion(tree.replacePath(path, wrapper),
              subtree.id()));
        }
      }
    }
    leafInsertions.addAll(wrapperInsertions);
    return leafInsertions;
  }

  private List<DerivationTree> wrappers(DerivationTree node,
      DerivationTree subtree, IdSource ids) {
    String type = node.value();
    List<DerivationTree> result = Lists.newArrayList();
    for (ImmutableList<String> alternative : grammar.alternatives(type)) {
      for (int i = 0; i < alternative.size(); i++) {
        if (!alternative.get(i).equals(type)) {
          continue;
        }
        for (int j = 0; j < alternative.size(); j++) {
          String symbol = alternative.get(j);
          if (j == i || !Grammar.isNonterminal(symbol)
              || !grammar.reachable(symbol, subtree.value())) {
            continue;
          }
          List<DerivationTree> children = Lists.newArrayList();
          for (int k = 0; k < alternative.size(); k++) {
            if (k == i) {
              children.add(node);
            } else if (k == j) {
              children.add(symbol.equals(subtree.value())
                  ? subtree : chain(symbol, ids.next(), subtree, ids));
            } else {
              children.addAll(DerivationTree.childrenFor(
                  alternative.subList(k, k + 1), ids));
            }
          }
          result.add(DerivationTree.create(type, children, ids));
        }
      }
    }
    return result;
  }

  /**
   * Builds a tree rooted in from, with the given root id, that derives
   * subtree along a shortest path; every other position is an open leaf or a
   * terminal.
   */
  DerivationTree chain(String from, long rootId, DerivationTree subtree,
      IdSource ids) {
    Map<String, Integer> distance = distancesTo(subtree.value());
    Preconditions.checkArgument(distance.containsKey(from),
        "%s cannot derive %s", from, subtree.value());
    List<String> best = null;
    int bestIndex = -1;
    int bestDistance = Integer.MAX_VALUE;
    for (ImmutableList<String> alternative : grammar.alternatives(from)) {
      for (int i = 0; i < alternative.size(); i++) {
        Integer d = distance.get(alternative.get(i));
        if (d != null && d < bestDistance) {
          best = alternative;
          bestIndex = i;
          bestDistance = d;
        }
      }
    }
    List<DerivationTree> children = Lists.newArrayList();
    for (int k = 0; k < best.size(); k++) {
      if (k == bestIndex) {
        String symbol = best.get(k);
        children.add(symbol.equals(subtree.value())
            ? subtree : chain(symbol, ids.next(), subtree, ids));
      } else {
        children.addAll(
            DerivationTree.childrenFor(best.subList(k, k + 1), ids));
      }
    }
    return DerivationTree.create(rootId, from, children);
  }

  /** Number of expansions from each nonterminal to the target. */
  private Map<String, Integer> distancesTo(String target) {
    Map<String, Integer> result = distances.get(target);
    if (result != null) {
      return result;
    }
    result = Maps.newHashMap();
    result.put(target, 0);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (String nonterminal : grammar.nonterminals()) {
        if (nonterminal.equals(target)) {
          continue;
        }
        for (ImmutableList<String> alternative :
            grammar.alternatives(nonterminal)) {
          for (String symbol : alternative) {
            Integer d = result.get(symbol);
            Integer current = result.get(nonterminal);
            if (d != null && (current == null || d + 1 < current)) {
              result.put(nonterminal, d + 1);
              changed = true;
            }
          }
        }
      }
    }
    distances.put(target, result);
    return result;
  }

  /** An insertion result: the new tree and the id of the inserted root. */
  public static final class Insertion {
    private final DerivationTree tree;
    private final long insertedId;

    Insertion(DerivationTree tree, long insertedId) {
      this.tree = tree;
      this.insertedId = insertedId;
    }

    public DerivationTree tree() {
      return tree;
    }

    public long insertedId() {
      return insertedId;
    }
  }
}
