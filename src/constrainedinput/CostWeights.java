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

import com.google.common.base.MoreObjects;

/**
 * The weights of the search cost: a weighted sum of the tree size, the number
 * of open leaves, the number of undischarged quantifiers, and the number of
 * obligations waiting on unfinished nodes. States with lower cost are
 * explored first.
 */
public final class CostWeights {
  public static final CostWeights DEFAULT = new CostWeights(1, 1, 2, 1);

  private final double treeSize;
  private final double openLeaves;
  private final double undischargedQuantifiers;
  private final double blockedObligations;

  private CostWeights(double treeSize, double openLeaves,
      double undischargedQuantifiers, double blockedObligations) {
    this.treeSize = treeSize;
    this.openLeaves = openLeaves;
    this.undischargedQuantifiers = undischargedQuantifiers;
    this.blockedObligations = blockedObligations;
  }

  /**
   * @throws ConfigurationException if a weight is negative or not a number
   */
  public static CostWeights create(double treeSize, double openLeaves,
      double undischargedQuantifiers, double blockedObligations) {
    check("treeSize", treeSize);
    check("openLeaves", openLeaves);
    check("undischargedQuantifiers", undischargedQuantifiers);
    check("blockedObligations", blockedObligations);
    return new CostWeights(treeSize, openLeaves, undischargedQuantifiers,
        blockedObligations);
  }

  private static void check(String name, double weight) {
    if (!(weight >= 0) || Double.isInfinite(weight)) {
      throw new ConfigurationException(
          "Cost weight " + name + " must be a finite non-negative number: "
          + weight);
    }
  }

  /** Computes the cost of a search state. */
  public double cost(SolverState state) {
    DerivationTree tree = state.tree();
    int quantifiers = 0;
    int blocked = 0;
    for (Obligation obligation : state.obligations()) {
      if (obligation.formula() instanceof QuantifiedFormula) {
        quantifiers++;
      }
      for (Long id : obligation.bindings().asMap().values()) {
        Path path = tree.findNode(id);
        if (path != null && !tree.getSubtree(path).isComplete()) {
          blocked++;
          break;
        }
      }
    }
    return treeSize * tree.size() + openLeaves * tree.openLeaves().size()
        + undischargedQuantifiers * quantifiers
        + blockedObligations * blocked;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("treeSize", treeSize)
        .add("openLeaves", openLeaves)
        .add("undischargedQuantifiers", undischargedQuantifiers)
        .add("blockedObligations", blockedObligations)
        .toString();
  }
}
