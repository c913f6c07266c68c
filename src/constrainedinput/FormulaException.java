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

/**
 * Thrown for ill-formed formulas: unbound variables, unknown predicates,
 * arity or sort mismatches, and syntax errors in the constraint language.
 */
public class FormulaException extends ConstraintException {
  private static final long serialVersionUID = 1L;

  public FormulaException(String message) {
    super(message);
  }

  public FormulaException(String message, Throwable cause) {
    super(message, cause);
  }
}
