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

import java.util.List;

/**
 * A relation between node positions. Arguments bound to variables are passed
 * as {@link Path}s of the evaluated tree; literal arguments are passed as they
 * appear in the formula.
 */
public abstract class StructuralPredicate implements Predicate {
  private final String name;
  private final int arity;
  private final boolean stableUnderGrowth;

  /**
   * @param stableUnderGrowth whether a result computed on a partial tree stays
   *        valid while open leaves are expanded and nodes are wrapped in new
   *        parents. Unstable predicates are only evaluated on complete trees.
   */
  protected StructuralPredicate(String name, int arity,
      boolean stableUnderGrowth) {
    this.name = name;
    this.arity = arity;
    this.stableUnderGrowth = stableUnderGrowth;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int arity() {
    return arity;
  }

  public boolean isStableUnderGrowth() {
    return stableUnderGrowth;
  }

  public abstract boolean evaluate(DerivationTree tree, List<Object> arguments);

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
