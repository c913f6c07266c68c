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
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** The answer of an {@link SmtSolver}. */
public final class SmtResult {
  /** Satisfiable, unsatisfiable, or undecided (including timeouts). */
  public enum Status { SAT, UNSAT, UNKNOWN }

  private static final SmtResult UNSAT_RESULT =
      new SmtResult(Status.UNSAT, ImmutableMap.<String, String>of(), "");

  private final Status status;
  private final ImmutableMap<String, String> model;
  private final String reason;

  private SmtResult(Status status, ImmutableMap<String, String> model,
      String reason) {
    this.status = status;
    this.model = model;
    this.reason = reason;
  }

  /** A satisfiable result with the value of each declared constant. */
  public static SmtResult sat(Map<String, String> model) {
    return new SmtResult(Status.SAT, ImmutableMap.copyOf(model), "");
  }

  public static SmtResult unsat() {
    return UNSAT_RESULT;
  }

  public static SmtResult unknown(String reason) {
    return new SmtResult(Status.UNKNOWN, ImmutableMap.<String, String>of(),
        Preconditions.checkNotNull(reason));
  }

  public Status status() {
    return status;
  }

  /** Returns the model; empty unless the status is SAT. */
  public ImmutableMap<String, String> model() {
    return model;
  }

  /** Returns why the solver gave up; empty unless the status is UNKNOWN. */
  public String reason() {
    return reason;
  }

  @Override
  public String toString() {
    return status == Status.SAT ? "SAT " + model
        : status == Status.UNKNOWN ? "UNKNOWN (" + reason + ")" : "UNSAT";
  }
}
