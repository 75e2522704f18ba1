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

package symbolicchecker.trex;

import symbolicchecker.ir.TlaEx;
import symbolicchecker.smt.SatResult;
import symbolicchecker.smt.SolverConfig;
import symbolicchecker.smt.SolverContext;

/**
 * A solver that stalls on every check after the first few, and answers
 * {@link SatResult#UNKNOWN} when interrupted.
 *
 * @author The tla-symbolic-checker Authors
 */
class SlowSolverContext implements SolverContext {
  private final SolverContext delegate;
  private final long delayMillis;
  private int fastChecks;
  private volatile Thread sleeper;
  private volatile boolean cancelled;
  private volatile boolean interrupted;

  SlowSolverContext(SolverContext delegate, long delayMillis,
      int fastChecks) {
    this.delegate = delegate;
    this.delayMillis = delayMillis;
    this.fastChecks = fastChecks;
  }

  @Override
  public SolverConfig config() {
    return delegate.config();
  }

  @Override
  public void assertGroundExpr(TlaEx ex) {
    delegate.assertGroundExpr(ex);
  }

  @Override
  public SatResult checkSat() {
    if (fastChecks > 0) {
      fastChecks--;
      return delegate.checkSat();
    }
    sleeper = Thread.currentThread();
    try {
      if (cancelled) {
        throw new InterruptedException();
      }
      Thread.sleep(delayMillis);
    } catch (InterruptedException e) {
      interrupted = true;
      return SatResult.UNKNOWN;
    } finally {
      sleeper = null;
      cancelled = false;
      Thread.interrupted();
    }
    return delegate.checkSat();
  }

  /** @return true if a stalled check was cut short */
  boolean wasInterrupted() {
    return interrupted;
  }

  @Override
  public void interrupt() {
    cancelled = true;
    Thread thread = sleeper;
    if (thread != null) {
      thread.interrupt();
    }
  }

  @Override
  public TlaEx evalGroundExpr(TlaEx ex) {
    return delegate.evalGroundExpr(ex);
  }

  @Override
  public void push() {
    delegate.push();
  }

  @Override
  public void pop() {
    delegate.pop();
  }

  @Override
  public void pop(int n) {
    delegate.pop(n);
  }

  @Override
  public int contextLevel() {
    return delegate.contextLevel();
  }

  @Override
  public void dispose() {
    delegate.dispose();
  }
}
