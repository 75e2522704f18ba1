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

import com.google.common.base.Preconditions;

import symbolicchecker.ir.TlaEx;

import java.util.List;

/**
 * Answers from a {@link SolverLog} instead of a solver. Every call must match
 * the next recorded one.
 *
 * @author The tla-symbolic-checker Authors
 */
public class ReplayingSolverContext implements SolverContext {
  private final SolverConfig config;
  private final List<SolverCall> calls;
  private int next = 0;
  private int level = 0;

  public ReplayingSolverContext(SolverConfig config, SolverLog log) {
    this.config = Preconditions.checkNotNull(config);
    this.calls = log.getCalls();
  }

  /** @return true if every recorded call has been replayed */
  public boolean isExhausted() {
    return next == calls.size();
  }

  @Override
  public SolverConfig config() {
    return config;
  }

  @Override
  public void assertGroundExpr(TlaEx ex) {
    GroundExprs.checkConstraint(ex, config.getSmtEncoding());
    expect(SolverCall.assertion(ex));
  }

  @Override
  public SatResult checkSat() {
    return expect(SolverCall.checkSat(null)).getResult();
  }

  @Override
  public TlaEx evalGroundExpr(TlaEx ex) {
    return expect(SolverCall.eval(ex, null)).getValue();
  }

  /** Recorded answers come back at once, so there is nothing to stop. */
  @Override
  public void interrupt() {
  }

  @Override
  public void push() {
    expect(SolverCall.push());
    level++;
  }

  @Override
  public void pop() {
    pop(1);
  }

  @Override
  public void pop(int n) {
    Preconditions.checkArgument(n >= 0 && n <= level,
        "cannot pop %s of %s scopes", n, level);
    expect(SolverCall.pop(n));
    level -= n;
  }

  @Override
  public int contextLevel() {
    return level;
  }

  @Override
  public void dispose() {
    next = calls.size();
  }

  private SolverCall expect(SolverCall actual) {
    if (next >= calls.size()) {
      throw new IllegalStateException(
          "replay diverged: unexpected call after the end: " + actual);
    }
    SolverCall recorded = calls.get(next);
    if (!recorded.matches(actual)) {
      throw new IllegalStateException("replay diverged at call " + next
          + ": recorded " + recorded + ", got " + actual);
    }
    next++;
    return recorded;
  }
}
