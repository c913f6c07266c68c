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
 * Everything the transition rules share during one search.
 */
public final class SolverContext {
  private final Grammar grammar;
  private final PredicateSignature signature;
  private final SmtSolver smtSolver;
  private final SolverConfiguration configuration;
  private final GrammarParser parser;
  private final DefaultTreeExpander expander;
  private final TreeInserter inserter;

  private SolverContext(Grammar grammar, PredicateSignature signature,
      SmtSolver smtSolver, SolverConfiguration configuration) {
    this.grammar = Preconditions.checkNotNull(grammar);
    this.signature = Preconditions.checkNotNull(signature);
    this.smtSolver = Preconditions.checkNotNull(smtSolver);
    this.configuration = Preconditions.checkNotNull(configuration);
    this.parser = GrammarParser.create(grammar);
    this.expander = DefaultTreeExpander.create(grammar,
        configuration.expansionPolicy(), configuration.randomSeed());
    this.inserter = TreeInserter.create(grammar);
  }

  static SolverContext create(Grammar grammar, PredicateSignature signature,
      SmtSolver smtSolver, SolverConfiguration configuration) {
    return new SolverContext(grammar, signature, smtSolver, configuration);
  }

  public Grammar grammar() {
    return grammar;
  }

  public PredicateSignature signature() {
    return signature;
  }

  public SmtSolver smtSolver() {
    return smtSolver;
  }

  public SolverConfiguration configuration() {
    return configuration;
  }

  public GrammarParser parser() {
    return parser;
  }

  public DefaultTreeExpander expander() {
    return expander;
  }

  public TreeInserter inserter() {
    return inserter;
  }
}
