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

import java.util.List;

public class PredicateSignatureTest extends TestCase {
  /** A predicate that holds when its argument's node is a leaf. */
  private static final StructuralPredicate IS_LEAF =
      new StructuralPredicate("is_leaf", 1, false) {
        @Override
        public boolean evaluate(DerivationTree tree, List<Object> arguments) {
          return tree.getSubtree((Path) arguments.get(0)).children().isEmpty();
        }
      };

  public void testStandard() {
    PredicateSignature signature = PredicateSignature.standard();
    assertEquals(9, signature.asMap().size());
    assertSame(StandardPredicates.BEFORE, signature.get("before"));
    assertNull(signature.get("is_leaf"));
  }

  public void testExtension() {
    PredicateSignature signature =
        PredicateSignature.standard().with(IS_LEAF);
    assertSame(IS_LEAF, signature.get("is_leaf"));
    signature.check(StructuralPredicateFormula.create("is_leaf",
        ImmutableList.<Object>of(Variable.start())));
  }

  public void testDuplicateNames() {
    try {
      PredicateSignature.of(IS_LEAF, StandardPredicates.BEFORE, IS_LEAF);
      fail();
    } catch (ConfigurationException expected) {
    }
  }

  public void testWrongKind() {
    try {
      PredicateSignature.standard().check(SemanticPredicateFormula.create(
          "before", ImmutableList.<Object>of(Variable.start(),
              Variable.start())));
      fail("before is structural");
    } catch (FormulaException expected) {
    }
  }
}
