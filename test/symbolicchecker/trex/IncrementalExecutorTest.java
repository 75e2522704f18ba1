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

import symbolicchecker.CheckerOptions;
import symbolicchecker.ir.Tla;
import symbolicchecker.smt.InMemorySolverContext;
import symbolicchecker.smt.SatResult;
import symbolicchecker.smt.SmtEncoding;
import symbolicchecker.smt.SolverConfig;

/**
 * Tests for {@link TransitionExecutor} over an
 * {@link IncrementalExecutionContext} and the arrays encoding.
 *
 * @author The tla-symbolic-checker Authors
 */
public class IncrementalExecutorTest extends TransitionExecutorTestBase {
  protected SmtEncoding encoding() {
    return SmtEncoding.ARRAYS;
  }

  @Override
  protected ExecutionContext createContext() {
    return new IncrementalExecutionContext(new InMemorySolverContext(
        SolverConfig.withEncoding(encoding())));
  }

  public void testFailsAsSoonAsTheStepIsUnsatisfiable() {
    executor.beginStep();
    assertFalse(executor.rewriteStep(Tla.bool(false)));
    assertEquals(FailureReason.UNSAT, executor.getFailureReason());
  }

  public void testSlowSolverTimesOut() {
    SlowSolverContext slow = new SlowSolverContext(new InMemorySolverContext(
        SolverConfig.withEncoding(encoding())), 5000, 0);
    TransitionExecutor timed = TransitionExecutor.create(
        new IncrementalExecutionContext(slow), 3, 3, 50);
    try {
      long start = System.currentTimeMillis();
      timed.beginStep();
      assertFalse(timed.rewriteStep(Tla.assign("x'", Tla.integer(1))));
      assertEquals(ExecutorState.FAILED, timed.getState());
      assertEquals(FailureReason.TIMEOUT, timed.getFailureReason());
      assertTrue(slow.wasInterrupted());
      assertTrue(System.currentTimeMillis() - start < 5000);
    } finally {
      timed.dispose();
    }
  }

  public void testRestoreAfterTimeout() {
    SlowSolverContext slow = new SlowSolverContext(new InMemorySolverContext(
        SolverConfig.withEncoding(encoding())), 5000, 2);
    TransitionExecutor timed = TransitionExecutor.create(
        new IncrementalExecutionContext(slow), 3, 3, 50);
    try {
      timed.beginStep();
      assertTrue(timed.rewriteStep(Tla.assign("x'", Tla.integer(1))));
      assertTrue(timed.commitStep());
      ExecutionSnapshot snapshot = timed.snapshot();
      int level = slow.contextLevel();

      timed.beginStep();
      assertFalse(timed.rewriteStep(Tla.assign("x'", Tla.integer(2))));
      assertEquals(FailureReason.TIMEOUT, timed.getFailureReason());
      assertTrue(slow.wasInterrupted());

      timed.restore(snapshot);
      assertEquals(level, slow.contextLevel());
      assertEquals(ExecutorState.STEP_COMMITTED, timed.getState());
      assertEquals(1, timed.getBindingHistory().size());
    } finally {
      timed.dispose();
    }
  }

  public void testSlowInvariantCheckIsUnknown() {
    SlowSolverContext slow = new SlowSolverContext(
        new InMemorySolverContext(SolverConfig.withEncoding(encoding())),
        5000, 2);
    TransitionExecutor timed = TransitionExecutor.create(
        new IncrementalExecutionContext(slow), 3, 3, 50);
    try {
      timed.beginStep();
      assertTrue(timed.rewriteStep(Tla.assign("x'", Tla.integer(1))));
      assertTrue(timed.commitStep());
      assertEquals(SatResult.UNKNOWN,
          timed.mayViolate(Tla.eq(Tla.name("x"), Tla.integer(1))));
      assertEquals(ExecutorState.STEP_COMMITTED, timed.getState());
    } finally {
      timed.dispose();
    }
  }

  public void testCreateFromOptions() {
    CheckerOptions options = new CheckerOptions();
    options.solver = CheckerOptions.SolverKind.MEMORY;
    options.maxSteps = 3;
    TransitionExecutor created = TransitionExecutor.create(options);
    try {
      assertTrue(created.getContext() instanceof IncrementalExecutionContext);
      assertEquals(3, created.getMaxSteps());
    } finally {
      created.dispose();
    }
  }
}
