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

/**
 * The outcome of one {@link InputGenerator#advance()} call: a solution, no
 * solution yet (the search may be resumed), or permanent exhaustion.
 */
public final class SearchResult {
  /** The kinds of outcomes. */
  public enum Kind { SOLUTION, NOT_YET, EXHAUSTED }

  private static final SearchResult NOT_YET =
      new SearchResult(Kind.NOT_YET, null);
  private static final SearchResult EXHAUSTED =
      new SearchResult(Kind.EXHAUSTED, null);

  private final Kind kind;
  private final DerivationTree tree;

  private SearchResult(Kind kind, DerivationTree tree) {
    this.kind = kind;
    this.tree = tree;
  }

  static SearchResult solution(DerivationTree tree) {
    Preconditions.checkArgument(tree.isComplete());
    return new SearchResult(Kind.SOLUTION, tree);
  }

  static SearchResult notYet() {
    return NOT_YET;
  }

  static SearchResult exhausted() {
    return EXHAUSTED;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the solution tree, or null unless this is a solution. */
  public DerivationTree tree() {
    return tree;
  }

  @Override
  public String toString() {
    return kind == Kind.SOLUTION ? "SOLUTION \"" + tree.render() + "\""
        : kind.name();
  }
}
