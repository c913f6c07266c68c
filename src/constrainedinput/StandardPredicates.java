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
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * The predicates available in {@link PredicateSignature#standard()}.
 */
public final class StandardPredicates {
  private StandardPredicates() {}

  /** before(a, b): a lies entirely to the left of b. */
  public static final StructuralPredicate BEFORE =
      new StructuralPredicate("before", 2, true) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return path(this, arguments, 0).isBefore(path(this, arguments, 1));
        }
      };

  /** after(a, b): a lies entirely to the right of b. */
  public static final StructuralPredicate AFTER =
      new StructuralPredicate("after", 2, true) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return path(this, arguments, 1).isBefore(path(this, arguments, 0));
        }
      };

  /** within(a, b): a is b or a descendant of b. */
  public static final StructuralPredicate WITHIN =
      new StructuralPredicate("within", 2, true) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return path(this, arguments, 1).isPrefixOf(path(this, arguments, 0));
        }
      };

  public static final StructuralPredicate SAME_POSITION =
      new StructuralPredicate("same_position", 2, true) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return path(this, arguments, 0).equals(path(this, arguments, 1));
        }
      };

  public static final StructuralPredicate DIFFERENT_POSITION =
      new StructuralPredicate("different_position", 2, true) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return !path(this, arguments, 0).equals(path(this, arguments, 1));
        }
      };

  /**
   * consecutive(a, b): b starts right where a ends, i.e. a is before b and
   * nothing between them contributes text.
   */
  public static final StructuralPredicate CONSECUTIVE =
      new StructuralPredicate("consecutive", 2, false) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          Path first = path(this, arguments, 0);
          Path second = path(this, arguments, 1);
          if (!first.isBefore(second)) {
            return false;
          }
          for (Path leaf : tree.leaves()) {
            if (first.isBefore(leaf) && leaf.isBefore(second)) {
              DerivationTree node = tree.getSubtree(leaf);
              if (node.isOpen() || !node.render().isEmpty()) {
                return false;
              }
            }
          }
          return true;
        }
      };

  /**
   * level(op, &lt;nt&gt;, a, b): compares how many ancestors labeled nt a and b
   * have. op is one of EQ, NE, LT, LE, GT and GE.
   */
  public static final StructuralPredicate LEVEL =
      new StructuralPredicate("level", 4, false) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          String op = string(this, arguments, 0);
          String nonterminal = string(this, arguments, 1);
          int first = ancestors(tree, path(this, arguments, 2), nonterminal);
          int second = ancestors(tree, path(this, arguments, 3), nonterminal);
          if (op.equals("EQ")) {
            return first == second;
          } else if (op.equals("NE")) {
            return first != second;
          } else if (op.equals("LT")) {
            return first < second;
          } else if (op.equals("LE")) {
            return first <= second;
          } else if (op.equals("GT")) {
            return first > second;
          } else if (op.equals("GE")) {
            return first >= second;
          }
          throw new FormulaException("Unknown level comparison " + op);
        }
      };

  /**
   * nth(k, a, b): a is the k-th node (counting from 1, in pre-order) labeled
   * like a inside b.
   */
  public static final StructuralPredicate NTH =
      new StructuralPredicate("nth", 3, false) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          int k = integer(this, arguments, 0);
          Path node = path(this, arguments, 1);
          Path container = path(this, arguments, 2);
          if (!container.isPrefixOf(node)) {
            return false;
          }
          String label = tree.getSubtree(node).value();
          int seen = 0;
          for (Map.Entry<Path, DerivationTree> entry :
              tree.getSubtree(container).nodes().entrySet()) {
            if (entry.getValue().value().equals(label)) {
              seen++;
              if (container.concat(entry.getKey()).equals(node)) {
                return seen == k;
              }
            }
          }
          return false;
        }
      };

  /**
   * count(in, "&lt;nt&gt;", num): the subtree of in has exactly num nodes
   * labeled nt. Once in is complete, an unfinished num is assigned the count.
   */
  public static final SemanticPredicate COUNT =
      new SemanticPredicate("count", 3) {
        @Override
        public SemanticResult evaluate(Grammar grammar, DerivationTree tree,
            List<Object> arguments) {
          DerivationTree in = tree.getSubtree(path(this, arguments, 0));
          String nonterminal = string(this, arguments, 1);
          Path numPath = path(this, arguments, 2);
          if (!in.isComplete()) {
            return SemanticResult.NOT_READY;
          }
          int count = 0;
          for (DerivationTree node : in.nodes().values()) {
            if (node.value().equals(nonterminal)) {
              count++;
            }
          }
          DerivationTree num = tree.getSubtree(numPath);
          if (!num.isComplete()) {
            return SemanticResult.assignment(
                ImmutableMap.of(numPath, String.valueOf(count)));
          }
          return SemanticResult.of(num.render().equals(String.valueOf(count)));
        }
      };

  static final ImmutableList<Predicate> ALL = ImmutableList.<Predicate>of(
      BEFORE, AFTER, WITHIN, SAME_POSITION, DIFFERENT_POSITION, CONSECUTIVE,
      LEVEL, NTH, COUNT);

  private static int ancestors(DerivationTree tree, Path path,
      String nonterminal) {
    int result = 0;
    for (int length = 0; length < path.length(); length++) {
      if (tree.getSubtree(path.prefix(length)).value().equals(nonterminal)) {
        result++;
      }
    }
    return result;
  }

  private static Path path(Predicate predicate, List<Object> arguments,
      int index) {
    Object argument = arguments.get(index);
    if (!(argument instanceof Path)) {
      throw new FormulaException(String.format(
          "Argument %d of %s must be a variable, got %s",
          index + 1, predicate.name(), argument));
    }
    return (Path) argument;
  }

  private static String string(Predicate predicate, List<Object> arguments,
      int index) {
    Object argument = arguments.get(index);
    if (!(argument instanceof String)) {
      throw new FormulaException(String.format(
          "Argument %d of %s must be a string, got %s",
          index + 1, predicate.name(), argument));
    }
    return (String) argument;
  }

  private static int integer(Predicate predicate, List<Object> arguments,
      int index) {
    Object argument = arguments.get(index);
    if (argument instanceof Integer) {
      return (Integer) argument;
    }
    if (argument instanceof String) {
      try {
        return Integer.parseInt((String) argument);
      } catch (NumberFormatException e) {
        throw new FormulaException(String.format(
            "Argument %d of %s must be an integer, got %s",
            index + 1, predicate.name(), argument));
      }
    }
    throw new FormulaException(String.format(
        "Argument %d of %s must be an integer, got %s",
        index + 1, predicate.name(), argument));
  }
}
