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

import java.util.Arrays;
import java.util.List;

/**
 * An ordered list of transition rules. The successors of a state come from
 * the first rule that applies to it.
 */
public final class RuleStrategy {
  private final ImmutableList<TransitionRule> rules;

  private RuleStrategy(ImmutableList<TransitionRule> rules) {
    this.rules = rules;
  }

  /**
   * Simplification, then disjunction splitting, universal instantiation,
   * existential instantiation, SMT solving, free instantiation and finally
   * guided expansion.
   */
  public static RuleStrategy standard() {
    return of(SimplificationRule.create(), DisjunctionRule.create(),
        UniversalInstantiationRule.create(), ExistentialRule.create(),
        SmtSolvingRule.create(), FreeInstantiationRule.create(),
        GuidedExpansionRule.create());
  }

  public static RuleStrategy of(TransitionRule... rules) {
    return of(Arrays.asList(rules));
  }

  /**
   * @throws ConfigurationException if rules is empty
   */
  public static RuleStrategy of(List<? extends TransitionRule> rules) {
    if (rules.isEmpty()) {
      throw new ConfigurationException("A strategy needs at least one rule");
    }
    return new RuleStrategy(ImmutableList.copyOf(rules));
  }

  public ImmutableList<TransitionRule> rules() {
    return rules;
  }

  /**
   * @return the successors from the first applicable rule, or null if no
   *         rule applies
   */
  List<SolverState> successors(SolverState state, SolverContext context) {
    for (TransitionRule rule : rules) {
      List<SolverState> successors = rule.apply(state, context);
      if (successors != null) {
        return successors;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return rules.toString();
  }
}
