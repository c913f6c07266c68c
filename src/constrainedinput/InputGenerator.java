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

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Generates words of a grammar that satisfy a formula. The search is a
 * priority queue of {@link SolverState}s ordered by cost. Each call to
 * {@link #advance()} pops states, derives their successors with the
 * configured {@link RuleStrategy}, and stops at the first solution, after
 * the configured number of steps, or when the queue runs dry.
 *
 * <p>Every solution is checked with the {@link Evaluator} before it is
 * returned, and no rendered string is returned twice. The order of
 * solutions only depends on the grammar, the formula and the
 * configuration.
 *
 * @author elnatan@google.com (Elnatan Reisner)
 */
public final class InputGenerator {
  private static final Logger logger =
      LogManager.getLogger(InputGenerator.class);

  private static final HashFunction DIGEST = Hashing.murmur3_128();

  private final SolverContext context;
  private final Formula formula;
  private final Evaluator evaluator;

  /** States waiting to be explored, cheapest first */
  private final PriorityQueue<QueuedState> queue;

  /** 128-bit digests of the fingerprints of every state ever queued */
  private final Set<HashCode> seenStates;

  /** Digests of the renderings of the solutions returned so far */
  private final Set<HashCode> solutions;

  private final Stopwatch stopwatch;
  private long sequence;
  private boolean exhausted;

  private InputGenerator(Grammar grammar, Formula formula,
      PredicateSignature signature, SmtSolver smtSolver,
      SolverConfiguration configuration) {
    Formulas.checkWellFormed(formula, grammar, signature);
    this.context =
        SolverContext.create(grammar, signature, smtSolver, configuration);
    this.formula = formula;
    this.evaluator = Evaluator.create(grammar, signature, smtSolver);
    this.queue = new PriorityQueue<QueuedState>();
    this.seenStates = Sets.newHashSet();
    this.solutions = Sets.newHashSet();
    this.stopwatch = Stopwatch.createUnstarted();

    DerivationTree root = DerivationTree.open(0, grammar.startSymbol());
    Obligation obligation =
        Obligation.create(Formulas.toNegationNormalForm(formula),
            Evaluator.rootBindings(root, formula));
    enqueue(SolverState.initial(root, obligation, 1));
  }

  /**
   * Creates a generator for a formula term.
   *
   * @param grammar the grammar solutions are derived from
   * @param formula a formula whose free variables are constants of the
   *        grammar's start symbol
   * @param signature the predicates formula may use
   * @param smtSolver decides SMT atoms
   * @param configuration the search options
   * @throws FormulaException if formula is not well-formed for grammar
   */
  public static InputGenerator create(Grammar grammar, Formula formula,
      PredicateSignature signature, SmtSolver smtSolver,
      SolverConfiguration configuration) {
    if (signature == null) {
      throw new ConfigurationException("No predicate signature");
    }
    return new InputGenerator(grammar, formula, signature, smtSolver,
        configuration);
  }

  /**
   * Creates a generator for a formula in concrete syntax.
   *
   * @throws ConfigurationException if signature is null
   * @throws FormulaException if the constraint does not parse or is not
   *         well-formed for grammar
   */
  public static InputGenerator create(Grammar grammar, String constraint,
      PredicateSignature signature, SmtSolver smtSolver,
      SolverConfiguration configuration) {
    Formula formula = FormulaParser.create(signature).parse(constraint);
    return create(grammar, formula, signature, smtSolver, configuration);
  }

  /**
   * Explores at most the configured number of states.
   *
   * @return the next solution, {@link SearchResult.Kind#NOT_YET} if none
   *         was found within the step limit, or
   *         {@link SearchResult.Kind#EXHAUSTED} once the queue is empty or the
   *         time budget is spent; exhaustion is permanent
   */
  public SearchResult advance() {
    if (exhausted) {
      return SearchResult.exhausted();
    }
    if (!stopwatch.isRunning()) {
      stopwatch.start();
    }
    SolverConfiguration configuration = context.configuration();
    for (int step = 0; step < configuration.maxStepsPerAdvance(); step++) {
      if (outOfTime()) {
        logger.info("Time budget of {} spent", configuration.timeBudget());
        return exhaust();
      }
      QueuedState next = queue.poll();
      if (next == null) {
        logger.info("Search exhausted after {} solutions", solutions.size());
        return exhaust();
      }
      SolverState state = next.state;
      logger.debug("Popped state with cost {}: {} ({} obligations)",
          next.cost, state.tree(), state.obligations().size());
      if (state.isSolution()) {
        if (accept(state.tree())) {
          logger.info("Solution: \"{}\"", state.tree().render());
          return SearchResult.solution(state.tree());
        }
        continue;
      }
      List<SolverState> successors;
      try {
        successors = configuration.strategy().successors(state, context);
      } catch (SmtUnknownException e) {
        logger.warn("Pruned a state: {}", e.getMessage());
        continue;
      }
      if (successors == null) {
        logger.debug("No rule applies to {}", state);
        continue;
      }
      for (SolverState successor : successors) {
        enqueue(successor);
      }
    }
    return SearchResult.notYet();
  }

  private boolean outOfTime() {
    return context.configuration().timeBudget() != null
        && stopwatch.elapsed(TimeUnit.NANOSECONDS)
            >= context.configuration().timeBudget().toNanos();
  }

  private SearchResult exhaust() {
    exhausted = true;
    queue.clear();
    return SearchResult.exhausted();
  }

  private void enqueue(SolverState state) {
    if (seenStates.add(digest(state.fingerprint()))) {
      queue.add(new QueuedState(
          context.configuration().costWeights().cost(state), sequence++,
          state));
    }
  }

  /** Checks a candidate solution against the formula and earlier ones. */
  private boolean accept(DerivationTree tree) {
    String rendered = tree.render();
    HashCode key = digest(rendered);
    if (solutions.contains(key)) {
      return false;
    }
    boolean valid;
    try {
      valid = evaluator.evaluate(tree, formula);
    } catch (SmtUnknownException e) {
      logger.warn("Cannot check \"{}\": {}", rendered, e.getMessage());
      return false;
    }
    if (!valid) {
      logger.debug("Discarded \"{}\", it does not satisfy {}", rendered,
          formula);
      return false;
    }
    solutions.add(key);
    return true;
  }

  private static HashCode digest(String text) {
    return DIGEST.hashString(text, Charsets.UTF_8);
  }

  /** Whether the search is permanently over. */
  public boolean isExhausted() {
    return exhausted;
  }

  /**
   * Returns the solutions as a lazy sequence, which ends when the search
   * is exhausted. Each call to next may run for a long time, and forever if
   * no further solution is ever found without exhausting the search.
   */
  public Iterator<DerivationTree> solutions() {
    return new AbstractIterator<DerivationTree>() {
      @Override
      protected DerivationTree computeNext() {
        while (true) {
          SearchResult result = advance();
          switch (result.kind()) {
            case SOLUTION:
              return result.tree();
            case EXHAUSTED:
              return endOfData();
            default:
              break;
          }
        }
      }
    };
  }

  /**
   * Returns the renderings of up to count further solutions; fewer if the
   * search is exhausted first.
   */
  public List<String> generate(int count) {
    Preconditions.checkArgument(count >= 0, "Negative count %s", count);
    List<String> result = Lists.newArrayList();
    Iterator<DerivationTree> iterator = solutions();
    while (result.size() < count && iterator.hasNext()) {
      result.add(iterator.next().render());
    }
    return result;
  }

  /** A queued state; cheaper first, then older first. */
  private static final class QueuedState implements Comparable<QueuedState> {
    final double cost;
    final long sequence;
    final SolverState state;

    QueuedState(double cost, long sequence, SolverState state) {
      this.cost = cost;
      this.sequence = sequence;
      this.state = state;
    }

    @Override
    public int compareTo(QueuedState other) {
      int byCost = Double.compare(cost, other.cost);
      if (byCost != 0) {
        return byCost;
      }
      return Long.compare(sequence, other.sequence);
    }
  }

  public static void main(String[] args) throws IOException {
    if (args.length < 3) {
      System.out.println(
          "Usage:\n"
          + "java -jar <jarfile> grammarFile constraintFile numSolutions "
          + "[timeoutSeconds]\n\n"
          + "grammarFile holds rules of the form <nt> ::= \"alt\" | \"alt\"\n"
          + "constraintFile holds a formula over the grammar's nonterminals\n"
          + "numSolutions---generation stops after this many solutions\n"
          + "timeoutSeconds bounds the whole search (default: unbounded)\n\n"
          + "This will print one generated input per line.");
      System.exit(0);
    }
    FileLoader loader = new FileLoader();
    Grammar grammar = loader.loadGrammar(args[0]);
    String constraint = loader.toString(args[1]);
    int numSolutions = Integer.valueOf(args[2]);
    SolverConfiguration.Builder builder = SolverConfiguration.builder();
    if (args.length > 3) {
      builder.timeBudget(Duration.ofSeconds(Long.valueOf(args[3])));
    }
    SolverConfiguration configuration = builder.build();
    Z3SmtSolver smtSolver = Z3SmtSolver.create(configuration.smtTimeout());
    try {
      InputGenerator generator = create(grammar, constraint,
          PredicateSignature.standard(), smtSolver, configuration);
      for (String solution : generator.generate(numSolutions)) {
        System.out.println(solution);
      }
    } finally {
      smtSolver.close();
    }
  }
}
