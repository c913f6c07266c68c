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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * A node of the search: a partial derivation tree and the obligations it
 * still has to satisfy. States are immutable; rules derive successors with
 * {@link #toBuilder()}.
 *
 * <p>Besides the obligations, a state remembers which nodes each universal
 * obligation has already been instantiated for, how many expansions the
 * default expander has spent on its lineage, and the next free node id.
 */
public final class SolverState {
  private final DerivationTree tree;
  private final ImmutableList<Obligation> obligations;
  private final ImmutableSetMultimap<Obligation, Long> instantiated;
  private final int freeExpansions;
  private final long nextId;

  private SolverState(Builder builder) {
    this.tree = builder.tree;
    this.obligations = ImmutableList.copyOf(builder.obligations);
    this.instantiated = builder.instantiated.build();
    this.freeExpansions = builder.freeExpansions;
    this.nextId = builder.nextId;
  }

  /**
   * The state the search starts from: an open root with the given
   * obligation.
   */
  static SolverState initial(DerivationTree root, Obligation obligation,
      long nextId) {
    Builder builder = new Builder();
    builder.tree = root;
    builder.obligations.add(obligation);
    builder.nextId = nextId;
    return builder.build();
  }

  public DerivationTree tree() {
    return tree;
  }

  public ImmutableList<Obligation> obligations() {
    return obligations;
  }

  /** Whether the universal obligation was instantiated for the node. */
  public boolean isInstantiated(Obligation universal, long nodeId) {
    return instantiated.containsEntry(universal, nodeId);
  }

  public int freeExpansions() {
    return freeExpansions;
  }

  public long nextId() {
    return nextId;
  }

  /** A source of ids that do not occur in this state's tree. */
  public IdSource ids() {
    return IdSource.startingAt(nextId);
  }

  /** Paths of the nodes the obligations refer to. */
  public ImmutableSet<Path> referencedPaths() {
    ImmutableSet.Builder<Path> result = ImmutableSet.builder();
    for (Obligation obligation : obligations) {
      for (Long id : obligation.bindings().asMap().values()) {
        Path path = tree.findNode(id);
        if (path != null) {
          result.add(path);
        }
      }
    }
    return result.build();
  }

  /**
   * Whether an obligation refers to the node at path or to one of its
   * ancestors.
   */
  public boolean isConstrained(Path path) {
    for (Path referenced : referencedPaths()) {
      if (referenced.isPrefixOf(path)) {
        return true;
      }
    }
    return false;
  }

  /** A complete tree without obligations is a solution candidate. */
  public boolean isSolution() {
    return obligations.isEmpty() && tree.isComplete();
  }

  /** Identifies states that behave the same in the rest of the search. */
  String fingerprint() {
    return tree.fingerprint() + " | " + Joiner.on(" & ").join(obligations)
        + " | " + instantiated + " | " + freeExpansions;
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.tree = tree;
    builder.obligations.addAll(obligations);
    builder.instantiated.putAll(instantiated);
    builder.freeExpansions = freeExpansions;
    builder.nextId = nextId;
    return builder;
  }

  @Override
  public String toString() {
    return tree + " with " + obligations;
  }

  /** Assembles a successor state. */
  public static final class Builder {
    private DerivationTree tree;
    private final List<Obligation> obligations = Lists.newArrayList();
    private ImmutableSetMultimap.Builder<Obligation, Long> instantiated =
        ImmutableSetMultimap.builder();
    private int freeExpansions;
    private long nextId;

    private Builder() {}

    public Builder tree(DerivationTree newTree) {
      this.tree = Preconditions.checkNotNull(newTree);
      return this;
    }

    /** Sets the tree and the first id no node of it uses. */
    public Builder tree(DerivationTree newTree, IdSource ids) {
      this.nextId = Math.max(nextId, ids.peek());
      return tree(newTree);
    }

    /** Replaces the obligations. */
    public Builder obligations(List<Obligation> newObligations) {
      obligations.clear();
      obligations.addAll(newObligations);
      return this;
    }

    /**
     * Replaces one obligation with others, which take its place in the
     * order.
     */
    public Builder replace(Obligation old, List<Obligation> replacements) {
      int index = obligations.indexOf(old);
      Preconditions.checkArgument(index >= 0, "No obligation %s", old);
      obligations.remove(index);
      for (Obligation replacement : replacements) {
        if (!obligations.contains(replacement)) {
          obligations.add(index++, replacement);
        }
      }
      return this;
    }

    public Builder remove(Obligation old) {
      return replace(old, ImmutableList.<Obligation>of());
    }

    /** Appends an obligation unless an equal one is already present. */
    public Builder add(Obligation obligation) {
      if (!obligations.contains(obligation)) {
        obligations.add(obligation);
      }
      return this;
    }

    public Builder instantiated(Obligation universal, long nodeId) {
      instantiated.put(universal, nodeId);
      return this;
    }

    public Builder freeExpansions(int count) {
      this.freeExpansions = count;
      return this;
    }

    public SolverState build() {
      Preconditions.checkState(tree != null, "No tree");
      // Drop records of universals that are no longer pending.
      ImmutableSetMultimap<Obligation, Long> all = instantiated.build();
      instantiated = ImmutableSetMultimap.builder();
      for (Obligation universal : all.keySet()) {
        if (obligations.contains(universal)) {
          instantiated.putAll(universal, all.get(universal));
        }
      }
      return new SolverState(this);
    }
  }
}
