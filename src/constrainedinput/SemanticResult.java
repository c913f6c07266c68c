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
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** The outcome of evaluating a {@link SemanticPredicate}. */
public final class SemanticResult {
  /** The kinds of outcomes. */
  public enum Kind { TRUE, FALSE, NOT_READY, ASSIGNMENT }

  public static final SemanticResult TRUE =
      new SemanticResult(Kind.TRUE, ImmutableMap.<Path, String>of());
  public static final SemanticResult FALSE =
      new SemanticResult(Kind.FALSE, ImmutableMap.<Path, String>of());
  public static final SemanticResult NOT_READY =
      new SemanticResult(Kind.NOT_READY, ImmutableMap.<Path, String>of());

  private final Kind kind;
  private final ImmutableMap<Path, String> assignment;

  private SemanticResult(Kind kind, ImmutableMap<Path, String> assignment) {
    this.kind = kind;
    this.assignment = assignment;
  }

  public static SemanticResult of(boolean value) {
    return value ? TRUE : FALSE;
  }

  /**
   * A proposal to replace the nodes at the given paths with derivations of
   * the given strings.
   */
  public static SemanticResult assignment(Map<Path, String> assignment) {
    Preconditions.checkArgument(!assignment.isEmpty());
    return new SemanticResult(Kind.ASSIGNMENT,
        ImmutableMap.copyOf(assignment));
  }

  public Kind kind() {
    return kind;
  }

  public ImmutableMap<Path, String> assignment() {
    return assignment;
  }

  @Override
  public String toString() {
    return kind == Kind.ASSIGNMENT ? "ASSIGNMENT" + assignment : kind.name();
  }
}
