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
import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * The knobs of the search. Instances are immutable and built with
 * {@link #builder()}; {@link Builder#build()} rejects invalid values with a
 * {@link ConfigurationException}.
 */
public final class SolverConfiguration {
  /** Largest finite language that becomes an explicit SMT domain. */
  static final int MAX_DOMAIN_SIZE = 100;

  private final int maxFreeInstantiations;
  private final int maxFreeFillings;
  private final int maxSmtInstantiations;
  private final CostWeights costWeights;
  private final Duration smtTimeout;
  private final ExpansionPolicy expansionPolicy;
  private final long randomSeed;
  private final int maxStepsPerAdvance;
  private final Duration timeBudget;
  private final RuleStrategy strategy;

  private SolverConfiguration(Builder builder) {
    this.maxFreeInstantiations = builder.maxFreeInstantiations;
    this.maxFreeFillings = builder.maxFreeFillings;
    this.maxSmtInstantiations = builder.maxSmtInstantiations;
    this.costWeights = builder.costWeights;
    this.smtTimeout = builder.smtTimeout;
    this.expansionPolicy = builder.expansionPolicy;
    this.randomSeed = builder.randomSeed;
    this.maxStepsPerAdvance = builder.maxStepsPerAdvance;
    this.timeBudget = builder.timeBudget;
    this.strategy = builder.strategy;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static SolverConfiguration defaults() {
    return builder().build();
  }

  /**
   * How many expansions the default expander may spend on unconstrained
   * leaves along one line of the search.
   */
  public int maxFreeInstantiations() {
    return maxFreeInstantiations;
  }

  /**
   * How many distinct ways of closing the unconstrained leaves of one state
   * are tried, each becoming a successor.
   */
  public int maxFreeFillings() {
    return maxFreeFillings;
  }

  /** How many models are enumerated per SMT solving step. */
  public int maxSmtInstantiations() {
    return maxSmtInstantiations;
  }

  public CostWeights costWeights() {
    return costWeights;
  }

  public Duration smtTimeout() {
    return smtTimeout;
  }

  public ExpansionPolicy expansionPolicy() {
    return expansionPolicy;
  }

  public long randomSeed() {
    return randomSeed;
  }

  /** How many states one call to advance may explore. */
  public int maxStepsPerAdvance() {
    return maxStepsPerAdvance;
  }

  /** The wall-clock budget of the whole search, or null for none. */
  public Duration timeBudget() {
    return timeBudget;
  }

  public RuleStrategy strategy() {
    return strategy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxFreeInstantiations", maxFreeInstantiations)
        .add("maxFreeFillings", maxFreeFillings)
        .add("maxSmtInstantiations", maxSmtInstantiations)
        .add("costWeights", costWeights)
        .add("smtTimeout", smtTimeout)
        .add("expansionPolicy", expansionPolicy)
        .add("randomSeed", randomSeed)
        .add("maxStepsPerAdvance", maxStepsPerAdvance)
        .add("timeBudget", timeBudget)
        .toString();
  }

  /** Collects configuration values; unset values keep their defaults. */
  public static final class Builder {
    private int maxFreeInstantiations = 100;
    private int maxFreeFillings = 10;
    private int maxSmtInstantiations = 10;
    private CostWeights costWeights = CostWeights.DEFAULT;
    private Duration smtTimeout = Duration.ofSeconds(5);
    private ExpansionPolicy expansionPolicy = ExpansionPolicy.SHORTEST_FIRST;
    private long randomSeed;
    private int maxStepsPerAdvance = 10000;
    private Duration timeBudget;
    private RuleStrategy strategy = RuleStrategy.standard();

    private Builder() {}

    public Builder maxFreeInstantiations(int value) {
      this.maxFreeInstantiations = value;
      return this;
    }

    public Builder maxFreeFillings(int value) {
      this.maxFreeFillings = value;
      return this;
    }

    public Builder maxSmtInstantiations(int value) {
      this.maxSmtInstantiations = value;
      return this;
    }

    public Builder costWeights(CostWeights value) {
      this.costWeights = Preconditions.checkNotNull(value);
      return this;
    }

    public Builder smtTimeout(Duration value) {
      this.smtTimeout = Preconditions.checkNotNull(value);
      return this;
    }

    public Builder expansionPolicy(ExpansionPolicy value) {
      this.expansionPolicy = Preconditions.checkNotNull(value);
      return this;
    }

    public Builder randomSeed(long value) {
      this.randomSeed = value;
      return this;
    }

    public Builder maxStepsPerAdvance(int value) {
      this.maxStepsPerAdvance = value;
      return this;
    }

    /** Pass null to search without a time limit. */
    public Builder timeBudget(Duration value) {
      this.timeBudget = value;
      return this;
    }

    public Builder strategy(RuleStrategy value) {
      this.strategy = Preconditions.checkNotNull(value);
      return this;
    }

    /**
     * @throws ConfigurationException if a value is out of range
     */
    public SolverConfiguration build() {
      if (maxFreeInstantiations < 0) {
        throw new ConfigurationException(
            "maxFreeInstantiations must not be negative: "
            + maxFreeInstantiations);
      }
      if (maxFreeFillings < 1) {
        throw new ConfigurationException(
            "maxFreeFillings must be at least 1: " + maxFreeFillings);
      }
      if (maxSmtInstantiations < 1) {
        throw new ConfigurationException(
            "maxSmtInstantiations must be at least 1: "
            + maxSmtInstantiations);
      }
      if (smtTimeout.isZero() || smtTimeout.isNegative()) {
        throw new ConfigurationException(
            "smtTimeout must be positive: " + smtTimeout);
      }
      if (maxStepsPerAdvance < 1) {
        throw new ConfigurationException(
            "maxStepsPerAdvance must be at least 1: " + maxStepsPerAdvance);
      }
      if (timeBudget != null && (timeBudget.isZero()
          || timeBudget.isNegative())) {
        throw new ConfigurationException(
            "timeBudget must be positive: " + timeBudget);
      }
      return new SolverConfiguration(this);
    }
  }
}
