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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A satisfiability query over string constants, kept as SMT-LIB text.
 */
public final class SmtQuery {
  private final ImmutableList<String> constants;
  private final ImmutableList<String> assertions;

  private SmtQuery(ImmutableList<String> constants,
      ImmutableList<String> assertions) {
    this.constants = constants;
    this.assertions = assertions;
  }

  /**
   * @param constants names of the String-sorted constants to declare
   * @param assertions boolean SMT-LIB terms over those constants
   */
  public static SmtQuery create(List<String> constants,
      List<String> assertions) {
    return new SmtQuery(ImmutableList.copyOf(constants),
        ImmutableList.copyOf(assertions));
  }

  public ImmutableList<String> constants() {
    return constants;
  }

  public ImmutableList<String> assertions() {
    return assertions;
  }

  /** Returns this query with one more assertion. */
  public SmtQuery withAssertion(String assertion) {
    return new SmtQuery(constants, ImmutableList.<String>builder()
        .addAll(assertions).add(assertion).build());
  }

  /** Returns the query as an SMT-LIB script without a check-sat command. */
  public String toSmtLib() {
    StringBuilder builder = new StringBuilder();
    for (String constant : constants) {
      builder.append("(declare-const ").append(constant).append(" String)\n");
    }
    for (String assertion : assertions) {
      builder.append("(assert ").append(assertion).append(")\n");
    }
    return builder.toString();
  }

  @Override
  public String toString() {
    return toSmtLib();
  }
}
