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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Map;

/**
 * An immutable derivation tree. A node is labeled with a grammar symbol and is
 * either <em>open</em> (a nonterminal that has not been expanded yet) or has a
 * possibly empty list of children. Terminal symbols are closed leaves.
 * <p>
 * Every node carries an id that is unique within a tree. Replacing a node with
 * an expansion of itself keeps its id, so formulas can refer to a node across
 * tree versions even though its path may change. Operations that modify a tree
 * return a new root that shares all untouched subtrees with the old one.
 */
public final class DerivationTree {
  private final long id;
  private final String value;

  /** null if and only if this node is open */
  private final ImmutableList<DerivationTree> children;

  private final int size;
  private final boolean complete;

  /** All nodes keyed by path, in pre-order; computed on first use */
  private ImmutableMap<Path, DerivationTree> nodes;

  /** Node paths keyed by id; computed on first use */
  private ImmutableMap<Long, Path> pathsById;

  private DerivationTree(long id, String value,
      ImmutableList<DerivationTree> children) {
    this.id = id;
    this.value = Preconditions.checkNotNull(value);
    this.children = children;
    int size = 1;
    boolean complete = children != null;
    if (children != null) {
      for (DerivationTree child : children) {
        size += child.size;
        complete &= child.complete;
      }
    }
    this.size = size;
    this.complete = complete;
  }

  /** Creates an open leaf with a fresh id. */
  public static DerivationTree open(String nonterminal, IdSource ids) {
    return open(ids.next(), nonterminal);
  }

  /** Creates an open leaf with the given id. */
  public static DerivationTree open(long id, String nonterminal) {
    Preconditions.checkArgument(Grammar.isNonterminal(nonterminal),
        "Only nonterminals can be open: %s", nonterminal);
    return new DerivationTree(id, nonterminal, null);
  }

  /** Creates a closed node with a fresh id. */
  public static DerivationTree create(String value,
      List<DerivationTree> children, IdSource ids) {
    return create(ids.next(), value, children);
  }

  /** Creates a closed node with the given id. */
  public static DerivationTree create(long id, String value,
      List<DerivationTree> children) {
    return new DerivationTree(id, value, ImmutableList.copyOf(children));
  }

  /** Creates a closed leaf for a terminal symbol. */
  public static DerivationTree terminal(String value, IdSource ids) {
    return new DerivationTree(ids.next(), value,
        ImmutableList.<DerivationTree>of());
  }

  /**
   * Creates the children of an expansion: nonterminals become open leaves and
   * terminals closed leaves, all with fresh ids.
   */
  static ImmutableList<DerivationTree> childrenFor(List<String> expansion,
      IdSource ids) {
    ImmutableList.Builder<DerivationTree> result = ImmutableList.builder();
    for (String symbol : expansion) {
      result.add(Grammar.isNonterminal(symbol)
          ? open(symbol, ids) : terminal(symbol, ids));
    }
    return result.build();
  }

  public long id() {
    return id;
  }

  public String value() {
    return value;
  }

  /** Returns the children of this node, or null if it is open. */
  public ImmutableList<DerivationTree> children() {
    return children;
  }

  public DerivationTree child(int index) {
    Preconditions.checkState(children != null, "Open node has no children");
    return children.get(index);
  }

  public boolean isOpen() {
    return children == null;
  }

  public boolean isNonterminal() {
    return Grammar.isNonterminal(value);
  }

  /** Returns true iff no open leaves remain in this tree. */
  public boolean isComplete() {
    return complete;
  }

  /** Returns the number of nodes in this tree. */
  public int size() {
    return size;
  }

  public int depth() {
    int depth = 0;
    if (children != null) {
      for (DerivationTree child : children) {
        depth = Math.max(depth, child.depth() + 1);
      }
    }
    return depth;
  }

  /** Returns a copy of this node with a different root id. */
  public DerivationTree withId(long newId) {
    return newId == id ? this : new DerivationTree(newId, value, children);
  }

  public boolean hasPath(Path path) {
    DerivationTree node = this;
    for (int i = 0; i < path.length(); i++) {
      if (node.children == null || path.get(i) >= node.children.size()) {
        return false;
      }
      node = node.children.get(path.get(i));
    }
    return true;
  }

  /**
   * @throws IllegalArgumentException if no node exists at path
   */
  public DerivationTree getSubtree(Path path) {
    DerivationTree node = this;
    for (int i = 0; i < path.length(); i++) {
      Preconditions.checkArgument(node.children != null
          && path.get(i) < node.children.size(), "No node at %s", path);
      node = node.children.get(path.get(i));
    }
    return node;
  }

  /**
   * Returns a tree in which the node at path is replaced by replacement. Nodes
   * off the path to the replaced node are shared with this tree.
   */
  public DerivationTree replacePath(Path path, DerivationTree replacement) {
    return replace(path, 0, replacement);
  }

  /**
   * Replaces the node with the given id.
   *
   * @throws IllegalArgumentException if no node has that id
   */
  public DerivationTree replaceNode(long nodeId, DerivationTree replacement) {
    Path path = findNode(nodeId);
    Preconditions.checkArgument(path != null, "No node with id %s", nodeId);
    return replacePath(path, replacement);
  }

  private DerivationTree replace(Path path, int depth,
      DerivationTree replacement) {
    if (depth == path.length()) {
      return replacement;
    }
    Preconditions.checkArgument(children != null
        && path.get(depth) < children.size(), "No node at %s", path);
    int index = path.get(depth);
    List<DerivationTree> newChildren = Lists.newArrayList(children);
    newChildren.set(index,
        children.get(index).replace(path, depth + 1, replacement));
    return new DerivationTree(id, value, ImmutableList.copyOf(newChildren));
  }

  /**
   * Expands the open leaf at path with the given alternative. The expanded
   * node keeps its id; the new children are open or terminal leaves.
   */
  public DerivationTree expand(Path path, List<String> alternative,
      IdSource ids) {
    DerivationTree leaf = getSubtree(path);
    Preconditions.checkArgument(leaf.isOpen(), "%s is not open", path);
    return replacePath(path, new DerivationTree(leaf.id, leaf.value,
        childrenFor(alternative, ids)));
  }

  /** Returns all nodes keyed by their paths, in pre-order. */
  public ImmutableMap<Path, DerivationTree> nodes() {
    if (nodes == null) {
      ImmutableMap.Builder<Path, DerivationTree> builder =
          ImmutableMap.builder();
      collect(Path.ROOT, builder);
      nodes = builder.build();
    }
    return nodes;
  }

  private void collect(Path path,
      ImmutableMap.Builder<Path, DerivationTree> builder) {
    builder.put(path, this);
    if (children != null) {
      for (int i = 0; i < children.size(); i++) {
        children.get(i).collect(path.child(i), builder);
      }
    }
  }

  /** Returns all paths in pre-order. */
  public ImmutableList<Path> paths() {
    return nodes().keySet().asList();
  }

  /** Returns the paths of all open leaves, left to right. */
  public ImmutableList<Path> openLeaves() {
    ImmutableList.Builder<Path> result = ImmutableList.builder();
    if (!complete) {
      for (Map.Entry<Path, DerivationTree> entry : nodes().entrySet()) {
        if (entry.getValue().isOpen()) {
          result.add(entry.getKey());
        }
      }
    }
    return result.build();
  }

  /** Returns the paths of all leaves, open or closed, left to right. */
  public ImmutableList<Path> leaves() {
    ImmutableList.Builder<Path> result = ImmutableList.builder();
    for (Map.Entry<Path, DerivationTree> entry : nodes().entrySet()) {
      DerivationTree node = entry.getValue();
      if (node.children == null || node.children.isEmpty()) {
        result.add(entry.getKey());
      }
    }
    return result.build();
  }

  /** Returns the path of the node with the given id, or null if none. */
  public Path findNode(long nodeId) {
    if (pathsById == null) {
      ImmutableMap.Builder<Long, Path> builder = ImmutableMap.builder();
      for (Map.Entry<Path, DerivationTree> entry : nodes().entrySet()) {
        builder.put(entry.getValue().id, entry.getKey());
      }
      pathsById = builder.buildOrThrow();
    }
    return pathsById.get(nodeId);
  }

  /** Concatenates the terminal leaves; open leaves contribute nothing. */
  public String render() {
    StringBuilder builder = new StringBuilder();
    render(builder, false);
    return builder.toString();
  }

  private void render(StringBuilder builder, boolean showOpen) {
    if (children == null) {
      if (showOpen) {
        builder.append(value);
      }
    } else if (children.isEmpty()) {
      if (!isNonterminal()) {
        builder.append(value);
      }
    } else {
      for (DerivationTree child : children) {
        child.render(builder, showOpen);
      }
    }
  }

  /**
   * Returns whether both trees have the same shape and labels, ignoring ids.
   */
  public boolean structurallyEquals(DerivationTree other) {
    if (!value.equals(other.value)
        || (children == null) != (other.children == null)) {
      return false;
    }
    if (children == null) {
      return true;
    }
    if (children.size() != other.children.size()) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).structurallyEquals(other.children.get(i))) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a string identifying this tree including node ids, used to detect
   * duplicate search states.
   */
  String fingerprint() {
    StringBuilder builder = new StringBuilder();
    fingerprint(builder);
    return builder.toString();
  }

  private void fingerprint(StringBuilder builder) {
    builder.append(id).append(':').append(value.length()).append(':')
        .append(value);
    if (children != null) {
      builder.append('(');
      for (DerivationTree child : children) {
        child.fingerprint(builder);
      }
      builder.append(')');
    }
  }

  /** Like {@link #render()}, but shows open leaves as their nonterminal. */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    render(builder, true);
    return builder.toString();
  }
}
