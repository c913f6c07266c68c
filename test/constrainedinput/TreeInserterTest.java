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

import java.io.IOException;
import java.util.List;

public class TreeInserterTest extends TestCase {
  private Grammar grammar;
  private TreeInserter inserter;

  @Override
  protected void setUp() throws IOException {
    grammar = Fixtures.assignments();
    inserter = TreeInserter.create(grammar);
  }

  private static DerivationTree variable(long id, String name,
      IdSource ids) {
    return DerivationTree.create(id, "<var>",
        ImmutableList.of(DerivationTree.terminal(name, ids)));
  }

  public void testIntoOpenLeaf() {
    IdSource ids = IdSource.startingAt(1);
    DerivationTree tree = DerivationTree.open(0, "<start>")
        .expand(Path.ROOT, ImmutableList.of("<stmt>"), ids);
    long stmtId = tree.child(0).id();
    DerivationTree q = variable(50, "q", ids);

    List<TreeInserter.Insertion> insertions =
        inserter.insert(tree, Path.ROOT, q, ids);
    assertEquals(1, insertions.size());
    DerivationTree result = insertions.get(0).tree();
    assertEquals("q := <rhs>", result.toString());
    assertEquals(50, insertions.get(0).insertedId());
    assertEquals(stmtId, result.child(0).id());
    assertEquals(Path.of(0, 0, 0), result.findNode(50));
  }

  public void testSameTypeLeafKeepsItsId() {
    IdSource ids = IdSource.startingAt(1);
    DerivationTree tree = DerivationTree.open(0, "<var>");
    List<TreeInserter.Insertion> insertions =
        inserter.insert(tree, Path.ROOT, variable(50, "q", ids), ids);
    assertEquals(1, insertions.size());
    assertEquals(0, insertions.get(0).insertedId());
    assertEquals("q", insertions.get(0).tree().render());
  }

  public void testWrapsRecursiveNode() {
    DerivationTree tree = Fixtures.parse(grammar, "x := 1");
    IdSource ids = IdSource.startingAt(100);
    DerivationTree stmt = tree.child(0);
    DerivationTree assignment = DerivationTree.open("<assgn>", ids);

    List<TreeInserter.Insertion> insertions =
        inserter.insert(tree, Path.ROOT, assignment, ids);
    assertEquals(1, insertions.size());
    DerivationTree result = insertions.get(0).tree();
    assertEquals("<assgn> ; x := 1", result.toString());
    // The old statement moved below the new one and kept its subtree.
    assertSame(stmt, result.getSubtree(Path.of(0, 2)));
    assertEquals(Path.of(0, 0), result.findNode(assignment.id()));
  }

  public void testNothingOutsideRange() {
    DerivationTree tree = Fixtures.parse(grammar, "x := 1 ; y := 2");
    IdSource ids = IdSource.startingAt(100);
    // The second assignment has no open leaf and no recursive node below.
    assertTrue(inserter.insert(tree, Path.of(0, 2, 0),
        DerivationTree.open("<assgn>", ids), ids).isEmpty());
  }

  public void testChain() {
    IdSource ids = IdSource.startingAt(1);
    DerivationTree chain = inserter.chain("<stmt>", 7,
        variable(50, "z", ids), ids);
    assertEquals(7, chain.id());
    assertEquals("z := <rhs>", chain.toString());
  }
}
