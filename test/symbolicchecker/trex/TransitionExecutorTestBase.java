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

import junit.framework.TestCase;

import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.rewriter.Binding;
import symbolicchecker.rewriter.NoApplicableRuleException;
import symbolicchecker.rewriter.TypeMismatchException;
import symbolicchecker.smt.SatResult;

/**
 * Behaviour shared by every kind of {@link ExecutionContext}. Subclasses
 * choose the context, the solver and the encoding.
 *
 * @author The tla-symbolic-checker Authors
 */
public abstract class TransitionExecutorTestBase extends TestCase {
  protected TransitionExecutor executor;

  /** Creates a fresh context over a fresh solver. */
  protected abstract ExecutionContext createContext();

  @Override
  protected void setUp() {
    executor = createExecutor(10, 8);
  }

  @Override
  protected void tearDown() {
    executor.dispose();
  }

  protected TransitionExecutor createExecutor(int maxSteps,
      int maxSnapshotDepth) {
    return TransitionExecutor.create(createContext(), maxSteps,
        maxSnapshotDepth, 0);
  }

  /** Runs one whole step. */
  protected boolean step(TlaEx ex) {
    executor.beginStep();
    return executor.rewriteStep(ex) && executor.commitStep();
  }

  /** {@code s' := {1, 2, 3}} */
  protected static TlaEx initSet() {
    return Tla.assign("s'",
        Tla.enumSet(Tla.integer(1), Tla.integer(2), Tla.integer(3)));
  }

  /** {@code s' := {x \in s: ~(x = 2)}} */
  protected static TlaEx dropTwo() {
    return Tla.assign("s'", Tla.filter("x", Tla.name("s"),
        Tla.not(Tla.eq(Tla.name("x"), Tla.integer(2)))));
  }

  public void testFreshExecutorIsIdle() {
    assertEquals(ExecutorState.IDLE, executor.getState());
    assertEquals(-1, executor.getStepNo());
    assertTrue(executor.getBindingHistory().isEmpty());
    assertNull(executor.getFailureReason());
  }

  public void testStepLifecycle() {
    executor.beginStep();
    assertEquals(ExecutorState.STEP_IN_PROGRESS, executor.getState());
    assertEquals(0, executor.getStepNo());
    assertTrue(executor.rewriteStep(Tla.assign("x'", Tla.integer(1))));
    assertTrue(executor.stepBinding().contains("x'"));
    assertTrue(executor.commitStep());
    assertEquals(ExecutorState.STEP_COMMITTED, executor.getState());

    Binding current = executor.currentBinding();
    assertTrue(current.contains("x"));
    assertFalse(current.contains("x'"));
    assertEquals(CellT.integer(), current.get("x").getType());
    assertEquals(1, executor.getBindingHistory().size());
  }

  public void testSeveralExpressionsInOneStep() {
    executor.beginStep();
    assertTrue(executor.rewriteStep(Tla.assign("x'", Tla.integer(1))));
    assertTrue(executor.rewriteStep(Tla.assign("y'", Tla.name("x'"))));
    assertTrue(executor.commitStep());
    assertEquals(executor.currentBinding().get("x"),
        executor.currentBinding().get("y"));
  }

  public void testNextStepSeesCommittedState() {
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    assertTrue(step(Tla.and(Tla.eq(Tla.name("x"), Tla.integer(1)),
        Tla.assign("x'", Tla.integer(2)))));
    assertEquals(1, executor.getStepNo());
    assertEquals(2, executor.getBindingHistory().size());
  }

  public void testUnsatisfiableStepFails() {
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    executor.beginStep();
    boolean rewritten = executor.rewriteStep(
        Tla.eq(Tla.name("x"), Tla.integer(2)));
    if (executor.getContext().streamsConstraints()) {
      assertFalse(rewritten);
    } else {
      assertTrue(rewritten);
      assertFalse(executor.commitStep());
    }
    assertEquals(ExecutorState.FAILED, executor.getState());
    assertEquals(FailureReason.UNSAT, executor.getFailureReason());
    try {
      executor.rewriteStep(Tla.bool(true));
      fail("rewrote in a failed executor");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
  }

  public void testUnassignedVariablesKeepTheirCells() {
    assertTrue(step(Tla.and(Tla.assign("x'", Tla.integer(1)),
        Tla.assign("y'", Tla.integer(2)))));
    ArenaCell y = executor.currentBinding().get("y");
    assertTrue(step(Tla.assign("x'", Tla.integer(3))));
    assertEquals(y, executor.currentBinding().get("y"));
  }

  public void testRewriteErrorFailsTheExecutor() {
    executor.beginStep();
    try {
      executor.rewriteStep(Tla.name("unbound"));
      fail("rewrote an unbound name");
    } catch (NoApplicableRuleException e) {
      // expected
    }
    assertEquals(ExecutorState.FAILED, executor.getState());
    assertEquals(FailureReason.ERROR, executor.getFailureReason());
  }

  public void testStepExpressionMustBeBoolean() {
    executor.beginStep();
    try {
      executor.rewriteStep(Tla.integer(4));
      fail("accepted an integer step");
    } catch (TypeMismatchException e) {
      assertEquals(FailureReason.ERROR, executor.getFailureReason());
    }
  }

  public void testOperationsOutOfOrder() {
    try {
      executor.commitStep();
      fail("committed without a step");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
    try {
      executor.snapshot();
      fail("took a snapshot before the first step");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
    executor.beginStep();
    try {
      executor.beginStep();
      fail("began a step twice");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
    try {
      executor.mayViolate(Tla.bool(true));
      fail("checked an invariant in the middle of a step");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
  }

  public void testStepBound() {
    executor.dispose();
    executor = createExecutor(1, 8);
    assertTrue(step(Tla.assign("x'", Tla.integer(0))));
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    try {
      executor.beginStep();
      fail("went past the step bound");
    } catch (InvalidStateTransitionException e) {
      assertEquals(1, executor.getStepNo());
    }
  }

  public void testRestoreUndoesSteps() {
    assertTrue(step(initSet()));
    ExecutionSnapshot snapshot = executor.snapshot();
    int cells = executor.getContext().getArena().cellCount();
    int level = executor.getContext().getSolverContext().contextLevel();
    Binding binding = executor.currentBinding();

    assertTrue(step(dropTwo()));
    assertTrue(step(Tla.assign("s'", Tla.enumSet(Tla.integer(9)))));
    assertEquals(2, executor.getStepNo());

    executor.restore(snapshot);
    assertEquals(ExecutorState.STEP_COMMITTED, executor.getState());
    assertEquals(0, executor.getStepNo());
    assertEquals(cells, executor.getContext().getArena().cellCount());
    assertEquals(level,
        executor.getContext().getSolverContext().contextLevel());
    assertEquals(binding, executor.currentBinding());
    assertEquals(1, executor.getBindingHistory().size());
    assertEquals(1, executor.liveSnapshotCount());
  }

  public void testImmediateRestoreChangesNothing() {
    assertTrue(step(initSet()));
    assertTrue(step(dropTwo()));
    ExecutionContext context = executor.getContext();
    int cells = context.getArena().cellCount();
    int edges = context.getArena().edgeCount();
    int depth = executor.getBindingHistory().size();
    int level = context.getSolverContext().contextLevel();

    executor.restore(executor.snapshot());
    assertEquals(cells, context.getArena().cellCount());
    assertEquals(edges, context.getArena().edgeCount());
    assertEquals(depth, executor.getBindingHistory().size());
    assertEquals(level, context.getSolverContext().contextLevel());
    assertEquals(1, executor.getStepNo());
    assertEquals(SatResult.UNSAT, executor.mayViolate(
        Tla.in(Tla.integer(3), Tla.name("s"))));
  }

  public void testRestoreReusesCellIds() {
    assertTrue(step(Tla.assign("x'", Tla.integer(0))));
    ExecutionSnapshot snapshot = executor.snapshot();
    assertTrue(step(Tla.assign("x'", Tla.integer(7))));
    int seven = executor.currentBinding().get("x").getId();

    executor.restore(snapshot);
    assertTrue(step(Tla.assign("x'", Tla.integer(8))));
    ArenaCell eight = executor.currentBinding().get("x");
    assertEquals(seven, eight.getId());
    assertEquals(SatResult.UNSAT,
        executor.mayViolate(Tla.eq(Tla.name("x"), Tla.integer(8))));
  }

  public void testRestoreAfterFailure() {
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    ExecutionSnapshot snapshot = executor.snapshot();
    assertFalse(step(Tla.bool(false)));
    assertEquals(ExecutorState.FAILED, executor.getState());

    executor.restore(snapshot);
    assertNull(executor.getFailureReason());
    assertTrue(step(Tla.assign("x'", Tla.integer(2))));
    assertEquals(1, executor.getStepNo());
  }

  public void testRestoreKillsLaterSnapshots() {
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    ExecutionSnapshot first = executor.snapshot();
    assertTrue(step(Tla.assign("x'", Tla.integer(2))));
    ExecutionSnapshot second = executor.snapshot();
    assertEquals(2, executor.liveSnapshotCount());

    executor.restore(first);
    executor.restore(first);
    assertEquals(1, executor.liveSnapshotCount());
    try {
      executor.restore(second);
      fail("restored a dead snapshot");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
  }

  public void testRestoreDuringStep() {
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    ExecutionSnapshot snapshot = executor.snapshot();
    executor.beginStep();
    try {
      executor.restore(snapshot);
      fail("restored in the middle of a step");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
  }

  public void testSnapshotDepthBound() {
    executor.dispose();
    executor = createExecutor(10, 2);
    assertTrue(step(Tla.assign("x'", Tla.integer(1))));
    ExecutionSnapshot first = executor.snapshot();
    executor.snapshot();
    try {
      executor.snapshot();
      fail("took more snapshots than allowed");
    } catch (InvalidStateTransitionException e) {
      // expected
    }
    executor.restore(first);
    executor.snapshot();
    assertEquals(2, executor.liveSnapshotCount());
  }

  public void testInvariantChecks() {
    TlaEx twoIsIn = Tla.in(Tla.integer(2), Tla.name("s"));
    assertTrue(step(initSet()));
    int cells = executor.getContext().getArena().cellCount();
    int level = executor.getContext().getSolverContext().contextLevel();
    assertEquals(SatResult.UNSAT, executor.mayViolate(twoIsIn));
    assertEquals(cells, executor.getContext().getArena().cellCount());
    assertEquals(level,
        executor.getContext().getSolverContext().contextLevel());
    assertEquals(ExecutorState.STEP_COMMITTED, executor.getState());

    assertTrue(step(dropTwo()));
    assertEquals(SatResult.SAT, executor.mayViolate(twoIsIn));
    assertEquals(SatResult.UNSAT, executor.mayViolate(
        Tla.in(Tla.integer(3), Tla.name("s"))));
  }

  public void testFilteredSetAcrossSteps() {
    assertTrue(step(initSet()));
    assertTrue(step(dropTwo()));
    ArenaCell s = executor.currentBinding().get("s");
    assertEquals(2, executor.getContext().getArena().getHas(s).size());
    assertTrue(step(Tla.assign("s'", Tla.filter("x", Tla.name("s"),
        Tla.eq(Tla.name("x"), Tla.integer(2))))));
    s = executor.currentBinding().get("s");
    assertTrue(executor.getContext().getArena().getHas(s).isEmpty());
  }
}
