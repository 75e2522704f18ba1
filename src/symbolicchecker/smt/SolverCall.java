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

package symbolicchecker.smt;

import com.google.common.base.Objects;

import symbolicchecker.ir.TlaEx;

/**
 * One call made on a {@link SolverContext}, with its answer when it has one.
 * Two calls match when they have the same kind, the same printed expression
 * and the same pop count; answers are not compared.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class SolverCall {
  /** What was called */
  public enum Kind {
    ASSERT, PUSH, POP, CHECK_SAT, EVAL
  }

  private final Kind kind;
  private final TlaEx expr;
  private final int count;
  private final SatResult result;
  private final TlaEx value;

  private SolverCall(Kind kind, TlaEx expr, int count, SatResult result,
      TlaEx value) {
    this.kind = kind;
    this.expr = expr;
    this.count = count;
    this.result = result;
    this.value = value;
  }

  public static SolverCall assertion(TlaEx expr) {
    return new SolverCall(Kind.ASSERT, expr, 0, null, null);
  }

  public static SolverCall push() {
    return new SolverCall(Kind.PUSH, null, 0, null, null);
  }

  public static SolverCall pop(int n) {
    return new SolverCall(Kind.POP, null, n, null, null);
  }

  public static SolverCall checkSat(SatResult result) {
    return new SolverCall(Kind.CHECK_SAT, null, 0, result, null);
  }

  public static SolverCall eval(TlaEx expr, TlaEx value) {
    return new SolverCall(Kind.EVAL, expr, 0, null, value);
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the asserted or evaluated expression, or null */
  public TlaEx getExpr() {
    return expr;
  }

  public int getCount() {
    return count;
  }

  /** @return the answer of a CHECK_SAT call, or null */
  public SatResult getResult() {
    return result;
  }

  /** @return the answer of an EVAL call, or null */
  public TlaEx getValue() {
    return value;
  }

  /** Issues this call on {@code solver}, ignoring the recorded answer. */
  void applyTo(SolverContext solver) {
    switch (kind) {
      case ASSERT:
        solver.assertGroundExpr(expr);
        break;
      case PUSH:
        solver.push();
        break;
      case POP:
        solver.pop(count);
        break;
      case CHECK_SAT:
        solver.checkSat();
        break;
      case EVAL:
        solver.evalGroundExpr(expr);
        break;
      default:
        throw new IllegalStateException("unknown call " + kind);
    }
  }

  public boolean matches(SolverCall other) {
    return kind == other.kind && count == other.count
        && Objects.equal(String.valueOf(expr), String.valueOf(other.expr));
  }

  @Override
  public String toString() {
    switch (kind) {
      case ASSERT:
        return "assert " + expr;
      case POP:
        return "pop " + count;
      case CHECK_SAT:
        return "check-sat" + (result == null ? "" : " -> " + result);
      case EVAL:
        return "eval " + expr + (value == null ? "" : " -> " + value);
      default:
        return "push";
    }
  }
}
