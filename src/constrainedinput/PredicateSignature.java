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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * The table of predicates a formula may use, by name. Parsers, evaluators and
 * solvers are each handed a signature explicitly; there is no global registry.
 */
public final class PredicateSignature {
  private static final PredicateSignature STANDARD =
      of(StandardPredicates.ALL);

  private final ImmutableMap<String, Predicate> predicates;

  private PredicateSignature(ImmutableMap<String, Predicate> predicates) {
    this.predicates = predicates;
  }

  /** Returns the signature of {@link StandardPredicates}. */
  public static PredicateSignature standard() {
    return STANDARD;
  }

  public static PredicateSignature of(Predicate... predicates) {
    return of(Arrays.asList(predicates));
  }

  /**
   * @throws ConfigurationException if two predicates share a name
   */
  public static PredicateSignature of(List<? extends Predicate> predicates) {
    Map<String, Predicate> table = Maps.newLinkedHashMap();
    for (Predicate predicate : predicates) {
      if (table.put(predicate.name(), predicate) != null) {
        throw new ConfigurationException(
            "Two predicates named " + predicate.name());
      }
    }
    return new PredicateSignature(ImmutableMap.copyOf(table));
  }

  /** Returns a signature that also contains predicate. */
  public PredicateSignature with(Predicate predicate) {
    Map<String, Predicate> table = Maps.newLinkedHashMap(predicates);
    table.put(predicate.name(), predicate);
    return new PredicateSignature(ImmutableMap.copyOf(table));
  }

  /** Returns the predicate with the given name, or null if there is none. */
  public Predicate get(String name) {
    return predicates.get(name);
  }

  public ImmutableMap<String, Predicate> asMap() {
    return predicates;
  }

  /**
   * @throws FormulaException if the atom's predicate is undeclared, of the
   *         wrong kind, or applied to the wrong number of arguments
   */
  public void check(PredicateFormula atom) {
    Predicate predicate = predicates.get(atom.name());
    if (predicate == null) {
      throw new FormulaException("Unknown predicate " + atom.name());
    }
    boolean structural = atom instanceof StructuralPredicateFormula;
    if (structural != (predicate instanceof StructuralPredicate)) {
      throw new FormulaException(String.format("%s is not a %s predicate",
          atom.name(), structural ? "structural" : "semantic"));
    }
    if (predicate.arity() != atom.arguments().size()) {
      throw new FormulaException(String.format(
          "%s takes %d arguments, got %d", atom.name(), predicate.arity(),
          atom.arguments().size()));
    }
  }

  public StructuralPredicate structural(StructuralPredicateFormula atom) {
    check(atom);
    return (StructuralPredicate) predicates.get(atom.name());
  }

  public SemanticPredicate semantic(SemanticPredicateFormula atom) {
    check(atom);
    return (SemanticPredicate) predicates.get(atom.name());
  }
}
