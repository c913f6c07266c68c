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

public class PathTest extends TestCase {
  public void testNavigation() {
    Path path = Path.of(0, 2, 1);
    assertEquals(3, path.length());
    assertEquals(2, path.get(1));
    assertEquals(Path.of(0, 2), path.parent());
    assertEquals(Path.of(0, 2, 1, 4), path.child(4));
    assertEquals(Path.of(0), path.prefix(1));
    assertEquals(path, Path.of(0).concat(Path.of(2, 1)));
    assertTrue(Path.ROOT.isRoot());
    assertEquals("(0, 2, 1)", path.toString());
  }

  public void testPrefix() {
    assertTrue(Path.ROOT.isPrefixOf(Path.of(1)));
    assertTrue(Path.of(1, 2).isPrefixOf(Path.of(1, 2)));
    assertTrue(Path.of(1).isPrefixOf(Path.of(1, 0, 3)));
    assertFalse(Path.of(1, 0, 3).isPrefixOf(Path.of(1)));
    assertFalse(Path.of(2).isPrefixOf(Path.of(1, 2)));
  }

  public void testBefore() {
    assertTrue(Path.of(0, 5).isBefore(Path.of(1)));
    assertFalse(Path.of(1).isBefore(Path.of(0, 5)));
    // Neither ancestors nor descendants come before a node.
    assertFalse(Path.of(0).isBefore(Path.of(0, 1)));
    assertFalse(Path.of(0, 1).isBefore(Path.of(0)));
    assertFalse(Path.of(0).isBefore(Path.of(0)));
  }

  public void testOrder() {
    assertTrue(Path.of(0).compareTo(Path.of(0, 1)) < 0);
    assertTrue(Path.of(0, 1).compareTo(Path.of(1)) < 0);
    assertEquals(0, Path.of(3, 4).compareTo(Path.of(3, 4)));
  }
}
