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

import junit.framework.TestCase;

import java.time.Duration;

public class Z3SmtSolverTest extends TestCase {
  private Z3SmtSolver solver;

  @Override
  protected void setUp() {
    solver = Z3SmtSolver.create(Duration.ofSeconds(5));
  }

  @Override
  protected void tearDown() {
    solver.close();
  }

  public void testSatisfiable() {
    SmtResult result = solver.solve(SmtQuery.create(
        ImmutableList.of("n1", "n2"),
        ImmutableList.of("(= (str.len n1) 3)", "(str.prefixof \"ab\" n1)",
            "(= n2 (str.++ n1 \"!\"))")));
    assertEquals(SmtResult.Status.SAT, result.status());
    String n1 = result.model().get("n1");
    assertEquals(3, n1.length());
    assertTrue(n1.startsWith("ab"));
    assertEquals(n1 + "!", result.model().get("n2"));
  }

  public void testBlockingClause() {
    SmtQuery query = SmtQuery.create(ImmutableList.of("n1"),
        ImmutableList.of("(or (= n1 \"a\") (= n1 \"b\"))"));
    String first = solver.solve(query).model().get("n1");
    query = query.withAssertion("(not (= n1 \"" + first + "\"))");
    String second = solver.solve(query).model().get("n1");
    assertFalse(first.equals(second));
    query = query.withAssertion("(not (= n1 \"" + second + "\"))");
    assertEquals(SmtResult.Status.UNSAT, solver.solve(query).status());
  }

  public void testUnsatisfiable() {
    SmtResult result = solver.solve(SmtQuery.create(ImmutableList.of("n1"),
        ImmutableList.of("(= n1 \"a\")", "(= n1 \"b\")")));
    assertEquals(SmtResult.Status.UNSAT, result.status());
  }

  public void testClosedQuery() {
    assertEquals(SmtResult.Status.SAT, solver.solve(SmtQuery.create(
        ImmutableList.<String>of(),
        ImmutableList.of("(= (str.len \"abc\") 3)"))).status());
  }

  public void testRejectsIllSortedQuery() {
    try {
      solver.solve(SmtQuery.create(ImmutableList.of("n1"),
          ImmutableList.of("(= n1 5)")));
      fail();
    } catch (FormulaException expected) {
    }
  }

  public void testUnescape() {
    assertEquals("A\\b", Z3SmtSolver.unescape("\\u{41}\\b"));
    assertEquals("tab\there", Z3SmtSolver.unescape("tab\\u{9}here"));
  }
}
