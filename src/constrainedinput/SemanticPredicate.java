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
 * A relation over node contents. Arguments bound to variables are passed as
 * {@link Path}s of the evaluated tree. Besides true and false, a semantic
 * predicate may answer that it is not ready yet, or propose strings for some
 * of its arguments that would make it true.
 */
public abstract class SemanticPredicate implements Predicate {
  private final String name;
  private final int arity;

  protected SemanticPredicate(String name, int arity) {
    this.name = name;
    this.arity = arity;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public int arity() {
    return arity;
  }

  public abstract SemanticResult evaluate(Grammar grammar, DerivationTree tree,
      List<Object> arguments);

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
