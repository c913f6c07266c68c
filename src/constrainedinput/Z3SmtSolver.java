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
import com.google.common.collect.Maps;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;

/**
 * A wrapper around a Z3 context. Every query gets a fresh solver with the
 * configured timeout; the context is shared and must be released with
 * {@link #close()}.
 */
public final class Z3SmtSolver implements SmtSolver, AutoCloseable {
  private static final Logger logger = LogManager.getLogger(Z3SmtSolver.class);

  private final Context context;
  private final int timeoutMillis;

  private Z3SmtSolver(Duration timeout) {
    Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(),
        "Timeout must be positive: %s", timeout);
    this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
    this.context = new Context();
  }

  /**
   * @param timeout the budget for a single query
   * @return a solver backed by a new Z3 context
   */
  public static Z3SmtSolver create(Duration timeout) {
    return new Z3SmtSolver(timeout);
  }

  /**
   * @throws FormulaException if Z3 rejects the query, e.g. because an atom
   *         applies a string variable to an operator of another sort
   */
  @Override
  public SmtResult solve(SmtQuery query) {
    String script = query.toSmtLib();
    logger.trace("SMT query:\n{}", script);
    Solver solver = context.mkSolver();
    Params params = context.mkParams();
    params.add("timeout", timeoutMillis);
    solver.setParameters(params);
    try {
      BoolExpr[] assertions =
          context.parseSMTLIB2String(script, null, null, null, null);
      solver.add(assertions);
      Status status = solver.check();
      if (status == Status.UNSATISFIABLE) {
        return SmtResult.unsat();
      }
      if (status == Status.UNKNOWN) {
        String reason = solver.getReasonUnknown();
        logger.warn("Z3 returned unknown ({}) for\n{}", reason, script);
        return SmtResult.unknown(reason);
      }
      return SmtResult.sat(model(solver.getModel(), query));
    } catch (Z3Exception e) {
      throw new FormulaException("Z3 rejected the query\n" + script, e);
    }
  }

  private Map<String, String> model(Model model, SmtQuery query) {
    Map<String, String> result = Maps.newLinkedHashMap();
    for (String constant : query.constants()) {
      Expr<?> value = model.getConstInterp(
          context.mkConst(constant, context.getStringSort()));
      // Constants the assertions leave unconstrained have no interpretation.
      result.put(constant, value == null ? "" : unescape(value.getString()));
    }
    return result;
  }

  /** Decodes the \\u{...} escapes Z3 uses for non-printable characters. */
  static String unescape(String value) {
    StringBuilder builder = new StringBuilder();
    int i = 0;
    while (i < value.length()) {
      char c = value.charAt(i);
      if (c == '\\' && value.startsWith("\\u{", i)) {
        int close = value.indexOf('}', i);
        if (close > 0) {
          builder.appendCodePoint(
              Integer.parseInt(value.substring(i + 3, close), 16));
          i = close + 1;
          continue;
        }
      }
      builder.append(c);
      i++;
    }
    return builder.toString();
  }

  @Override
  public void close() {
    context.close();
  }
}
