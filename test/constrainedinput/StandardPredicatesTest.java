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

import junit.framework.TestCase;

import java.io.IOException;
import java.util.List;

public class StandardPredicatesTest extends TestCase {
  private static final Path FIRST = Path.of(0, 0);
  private static final Path SEPARATOR = Path.of(0, 1);
  private static final Path REST = Path.of(0, 2);
  private static final Path SECOND = Path.of(0, 2, 0);

  private Grammar grammar;
  private DerivationTree tree;

  @Override
  protected void setUp() throws IOException {
    grammar = Fixtures.assignments();
    tree = Fixtures.parse(grammar, "x := 1 ; y := x");
  }

  private static List<Object> args(Object... arguments) {
    return ImmutableList.copyOf(arguments);
  }

  public void testOrdering() {
    assertTrue(StandardPredicates.BEFORE.evaluate(tree, args(FIRST, SECOND)));
    assertFalse(StandardPredicates.BEFORE.evaluate(tree, args(SECOND, FIRST)));
    assertFalse(StandardPredicates.BEFORE.evaluate(tree, args(REST, SECOND)));
    assertTrue(StandardPredicates.AFTER.evaluate(tree, args(SECOND, FIRST)));
  }

  public void testWithinAndPosition() {
    assertTrue(StandardPredicates.WITHIN.evaluate(tree, args(SECOND, REST)));
    assertTrue(StandardPredicates.WITHIN.evaluate(tree, args(REST, REST)));
    assertFalse(StandardPredicates.WITHIN.evaluate(tree, args(FIRST, REST)));
    assertTrue(StandardPredicates.SAME_POSITION.evaluate(tree,
        args(FIRST, FIRST)));
    assertTrue(StandardPredicates.DIFFERENT_POSITION.evaluate(tree,
        args(FIRST, SECOND)));
  }

  public void testConsecutive() {
    assertTrue(StandardPredicates.CONSECUTIVE.evaluate(tree,
        args(FIRST, SEPARATOR)));
    assertFalse(StandardPredicates.CONSECUTIVE.evaluate(tree,
        args(FIRST, SECOND)));
    assertFalse(StandardPredicates.CONSECUTIVE.isStableUnderGrowth());
  }

  public void testLevel() {
    // One <stmt> above the first assignment, two above the second.
    assertFalse(StandardPredicates.LEVEL.evaluate(tree,
        args("EQ", "<stmt>", FIRST, SECOND)));
    assertTrue(StandardPredicates.LEVEL.evaluate(tree,
        args("LT", "<stmt>", FIRST, SECOND)));
    assertTrue(StandardPredicates.LEVEL.evaluate(tree,
        args("GE", "<stmt>", SECOND, FIRST)));
    try {
      StandardPredicates.LEVEL.evaluate(tree,
          args("ABOUT", "<stmt>", FIRST, SECOND));
      fail();
    } catch (FormulaException expected) {
    }
  }

  public void testNth() {
    assertTrue(StandardPredicates.NTH.evaluate(tree,
        args(2, SECOND, Path.ROOT)));
    assertTrue(StandardPredicates.NTH.evaluate(tree,
        args("1", SECOND, REST)));
    assertFalse(StandardPredicates.NTH.evaluate(tree,
        args(1, SECOND, Path.ROOT)));
    assertFalse(StandardPredicates.NTH.evaluate(tree,
        args(1, FIRST, REST)));
  }

  public void testArgumentKinds() {
    try {
      StandardPredicates.BEFORE.evaluate(tree, args("x", SECOND));
      fail();
    } catch (FormulaException expected) {
    }
  }

  public void testCount() {
    Path rhs = Path.of(0, 0, 2);
    assertEquals(SemanticResult.TRUE, StandardPredicates.COUNT.evaluate(
        grammar, tree, args(REST, "<assgn>", rhs)));
    assertEquals(SemanticResult.FALSE, StandardPredicates.COUNT.evaluate(
        grammar, tree, args(Path.ROOT, "<assgn>", rhs)));
  }

  public void testCountProposesAssignment() {
    Path rhs = Path.of(0, 0, 2);
    DerivationTree open =
        tree.replacePath(rhs, DerivationTree.open(100, "<rhs>"));
    SemanticResult result = StandardPredicates.COUNT.evaluate(grammar, open,
        args(REST, "<assgn>", rhs));
    assertEquals(SemanticResult.Kind.ASSIGNMENT, result.kind());
    assertEquals(ImmutableMap.of(rhs, "1"), result.assignment());

    assertEquals(SemanticResult.Kind.NOT_READY,
        StandardPredicates.COUNT.evaluate(grammar, open,
            args(Path.ROOT, "<assgn>", rhs)).kind());
  }
}
