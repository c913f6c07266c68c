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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Map;
import java.util.Set;

/**
 * An immutable assignment of variables to node ids. Ids rather than paths are
 * stored so that bindings survive edits that move a node, such as wrapping it
 * in a new parent.
 */
public final class Bindings {
  private static final Bindings EMPTY =
      new Bindings(ImmutableMap.<Variable, Long>of());

  private final ImmutableMap<Variable, Long> nodes;

  private Bindings(ImmutableMap<Variable, Long> nodes) {
    this.nodes = nodes;
  }

  public static Bindings empty() {
    return EMPTY;
  }

  public static Bindings of(Variable variable, long nodeId) {
    return EMPTY.bind(variable, nodeId);
  }

  /** Returns bindings in which variable is bound to nodeId, shadowing it. */
  public Bindings bind(Variable variable, long nodeId) {
    Map<Variable, Long> result = Maps.newLinkedHashMap(nodes);
    result.put(variable, nodeId);
    return new Bindings(ImmutableMap.copyOf(result));
  }

  public Bindings bindAll(Map<Variable, Long> more) {
    Map<Variable, Long> result = Maps.newLinkedHashMap(nodes);
    result.putAll(more);
    return new Bindings(ImmutableMap.copyOf(result));
  }

  /** Keeps only the given variables. */
  public Bindings restrictTo(Set<Variable> variables) {
    Map<Variable, Long> result = Maps.newLinkedHashMap();
    for (Map.Entry<Variable, Long> entry : nodes.entrySet()) {
      if (variables.contains(entry.getKey())) {
        result.put(entry.getKey(), entry.getValue());
      }
    }
    return result.size() == nodes.size()
        ? this : new Bindings(ImmutableMap.copyOf(result));
  }

  /** Returns the id of the node variable is bound to, or null. */
  public Long get(Variable variable) {
    return nodes.get(variable);
  }

  public boolean isBound(Variable variable) {
    return nodes.containsKey(variable);
  }

  /**
   * Returns the path of the node variable is bound to in tree.
   *
   * @throws FormulaException if variable is unbound or its node is not in tree
   */
  public Path resolve(Variable variable, DerivationTree tree) {
    Long id = nodes.get(variable);
    if (id == null) {
      throw new FormulaException("Unbound variable " + variable);
    }
    Path path = tree.findNode(id);
    if (path == null) {
      throw new FormulaException(String.format(
          "Variable %s is bound to node %d, which is not in the tree",
          variable, id));
    }
    return path;
  }

  public ImmutableMap<Variable, Long> asMap() {
    return nodes;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bindings && nodes.equals(((Bindings) obj).nodes);
  }

  @Override
  public int hashCode() {
    return nodes.hashCode();
  }

  @Override
  public String toString() {
    return "{" + Joiner.on(", ").withKeyValueSeparator("=").join(nodes) + "}";
  }
}
