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

import junit.framework.TestCase;

import java.time.Duration;

public class SolverConfigurationTest extends TestCase {
  public void testDefaults() {
    SolverConfiguration configuration = SolverConfiguration.defaults();
    assertEquals(100, configuration.maxFreeInstantiations());
    assertEquals(10, configuration.maxFreeFillings());
    assertEquals(10, configuration.maxSmtInstantiations());
    assertSame(CostWeights.DEFAULT, configuration.costWeights());
    assertEquals(ExpansionPolicy.SHORTEST_FIRST,
        configuration.expansionPolicy());
    assertNull(configuration.timeBudget());
    assertEquals(7, configuration.strategy().rules().size());
  }

  public void testRejectsOutOfRangeValues() {
    assertInvalid(SolverConfiguration.builder().maxFreeInstantiations(-1));
    assertInvalid(SolverConfiguration.builder().maxFreeFillings(0));
    assertInvalid(SolverConfiguration.builder().maxSmtInstantiations(0));
    assertInvalid(SolverConfiguration.builder().smtTimeout(Duration.ZERO));
    assertInvalid(SolverConfiguration.builder().maxStepsPerAdvance(0));
    assertInvalid(
        SolverConfiguration.builder().timeBudget(Duration.ofSeconds(-1)));
  }

  private static void assertInvalid(SolverConfiguration.Builder builder) {
    try {
      builder.build();
      fail();
    } catch (ConfigurationException expected) {
    }
  }

  public void testCostWeights() {
    try {
      CostWeights.create(1, -1, 0, 0);
      fail();
    } catch (ConfigurationException expected) {
    }
    try {
      CostWeights.create(1, Double.NaN, 0, 0);
      fail();
    } catch (ConfigurationException expected) {
    }
    assertNotNull(CostWeights.create(0, 0, 0, 0));
  }

  public void testStrategyNeedsRules() {
    try {
      RuleStrategy.of();
      fail();
    } catch (ConfigurationException expected) {
    }
  }
}
