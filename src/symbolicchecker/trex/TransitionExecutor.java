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

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.CheckerException;
import symbolicchecker.CheckerOptions;
import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.rewriter.Binding;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;
import symbolicchecker.smt.SatResult;
import symbolicchecker.smt.SolverContext;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives the symbolic execution of a transition system one step at a time.
 * <p>
 * A step is begun, fed with step expressions, and committed if the solver
 * finds the accumulated constraints satisfiable. Assignments to primed
 * variables made during a step become the binding of the next state.
 * Snapshots taken between steps allow a search to go back and try another
 * transition without redoing the shared history:
 *
 * <pre>
 * IDLE --beginStep--> STEP_IN_PROGRESS --commitStep--> STEP_COMMITTED
 *                          |                             |  ^
 *                          +--(unsat, error)--> FAILED   |  +--restore
 *                                                        +--beginStep
 * </pre>
 *
 * An executor is confined to one thread.
 *
 * @author The tla-symbolic-checker Authors
 */
public class TransitionExecutor {
  private static final Logger logger =
      LoggerFactory.getLogger(TransitionExecutor.class);

  private final ExecutionContext context;
  private final int maxSteps;
  private final int maxSnapshotDepth;
  private final long stepTimeoutMillis;

  /** Snapshots that may still be restored, oldest first */
  private final List<ExecutionSnapshot> liveSnapshots = Lists.newArrayList();

  private ExecutorState state = ExecutorState.IDLE;
  private FailureReason failureReason;

  /** The index of the latest step begun; the initial step is 0 */
  private int stepNo = -1;

  /** The binding of the step in progress, with its primed assignments */
  private Binding stepBinding;

  private int nextSnapshotId = 0;
  private ExecutorService timeoutExecutor;

  private TransitionExecutor(ExecutionContext context, int maxSteps,
      int maxSnapshotDepth, long stepTimeoutMillis) {
    Preconditions.checkArgument(maxSteps >= 0, "negative step bound");
    Preconditions.checkArgument(maxSnapshotDepth >= 1,
        "at least one snapshot must be allowed");
    Preconditions.checkArgument(stepTimeoutMillis >= 0, "negative timeout");
    this.context = context;
    this.maxSteps = maxSteps;
    this.maxSnapshotDepth = maxSnapshotDepth;
    this.stepTimeoutMillis = stepTimeoutMillis;
  }

  /**
   * Creates an executor.
   *
   * @param context the context that owns the arena, bindings and solver
   * @param maxSteps how many steps may follow the initial one
   * @param maxSnapshotDepth how many snapshots may be live at once
   * @param stepTimeoutMillis how long a single solver check may take before
   *        the step fails with {@link FailureReason#TIMEOUT}; 0 for no limit
   */
  public static TransitionExecutor create(ExecutionContext context,
      int maxSteps, int maxSnapshotDepth, long stepTimeoutMillis) {
    return new TransitionExecutor(context, maxSteps, maxSnapshotDepth,
        stepTimeoutMillis);
  }

  /**
   * Creates an executor over {@code solverContext}, using the offline context
   * if the options ask for it and the online one otherwise.
   */
  public static TransitionExecutor create(CheckerOptions options,
      SolverContext solverContext) {
    ExecutionContext context = options.offline
        ? OfflineExecutionContext.create(solverContext)
        : new IncrementalExecutionContext(solverContext);
    return create(context, options.maxSteps, options.maxSnapshotDepth,
        options.stepTimeoutMillis);
  }

  /** Creates an executor over the solver the options select. */
  public static TransitionExecutor create(CheckerOptions options) {
    return create(options, options.createSolverContext());
  }

  public ExecutionContext getContext() {
    return context;
  }

  public ExecutorState getState() {
    return state;
  }

  /** @return why the executor failed, or null if it has not */
  public FailureReason getFailureReason() {
    return failureReason;
  }

  /** @return the index of the latest step begun, or -1 before the first */
  public int getStepNo() {
    return stepNo;
  }

  public int getMaxSteps() {
    return maxSteps;
  }

  /** @return the bindings of the committed steps, oldest first */
  public ImmutableList<Binding> getBindingHistory() {
    return context.getBindingHistory();
  }

  /** @return the binding of the last committed step */
  public Binding currentBinding() {
    return context.currentBinding();
  }

  /** @return the binding of the step in progress */
  public Binding stepBinding() {
    requireState("read the step binding", ExecutorState.STEP_IN_PROGRESS);
    return stepBinding;
  }

  /** @return how many snapshots may still be restored */
  public int liveSnapshotCount() {
    return liveSnapshots.size();
  }

  /**
   * Starts a new step in a new solver scope.
   *
   * @throws InvalidStateTransitionException unless idle or committed, or if
   *         the step bound is reached
   */
  public void beginStep() {
    requireState("begin a step", ExecutorState.IDLE,
        ExecutorState.STEP_COMMITTED);
    if (stepNo + 1 > maxSteps) {
      throw new InvalidStateTransitionException(
          "cannot begin step " + (stepNo + 1) + ": the bound is " + maxSteps);
    }
    context.getRewriter().push();
    stepNo++;
    stepBinding = context.currentBinding();
    state = ExecutorState.STEP_IN_PROGRESS;
    logger.debug("step {} begun", stepNo);
  }

  /**
   * Rewrites a Boolean step expression and asserts it. Assignments
   * {@code x' := e} in the expression bind {@code x'} for the rest of the
   * step.
   *
   * @return false if the online context already found the step
   *         unsatisfiable or timed out; the executor has then failed
   * @throws symbolicchecker.CheckerException if rewriting fails; the executor
   *         has then failed with {@link FailureReason#ERROR}
   */
  public boolean rewriteStep(TlaEx ex) {
    requireState("rewrite a step expression",
        ExecutorState.STEP_IN_PROGRESS);
    try {
      SymbState result = context.getRewriter().rewriteUntilDone(
          new SymbState(ex, context.getArena(), stepBinding));
      ArenaCell cell = result.asCell();
      if (!cell.getType().equals(CellT.bool())) {
        throw new TypeMismatchException(
            "a step expression must be Boolean, found " + cell.getType(), ex);
      }
      context.setArena(result.getArena());
      stepBinding = result.getBinding();
      context.getSolverContext().assertGroundExpr(cell.toNameEx());
    } catch (RuntimeException e) {
      fail(FailureReason.ERROR);
      logger.warn("step {} failed: {}", stepNo, e.getMessage());
      throw e;
    }
    if (!context.streamsConstraints()) {
      return true;
    }
    SatResult result = checkSatWithinLimit();
    if (result == null) {
      fail(FailureReason.TIMEOUT);
      return false;
    } else if (result == SatResult.UNSAT) {
      fail(FailureReason.UNSAT);
      return false;
    }
    return true;
  }

  /**
   * Checks the constraints of the step. If they are satisfiable, the primed
   * assignments of the step become the new binding; variables the step did
   * not assign keep their cells.
   *
   * @return true if the step was committed, false if the executor failed
   */
  public boolean commitStep() {
    requireState("commit a step", ExecutorState.STEP_IN_PROGRESS);
    SatResult result = checkSatWithinLimit();
    if (result == null) {
      fail(FailureReason.TIMEOUT);
      return false;
    }
    switch (result) {
      case SAT:
        context.pushBinding(stepBinding.shiftPrimed());
        stepBinding = null;
        state = ExecutorState.STEP_COMMITTED;
        logger.debug("step {} committed: {}", stepNo,
            context.currentBinding());
        return true;
      case UNSAT:
        fail(FailureReason.UNSAT);
        return false;
      default:
        fail(FailureReason.UNKNOWN);
        return false;
    }
  }

  /**
   * Saves the extent of the context after a committed step.
   *
   * @throws InvalidStateTransitionException unless committed, or if the
   *         snapshot bound is reached
   */
  public ExecutionSnapshot snapshot() {
    requireState("take a snapshot", ExecutorState.STEP_COMMITTED);
    if (liveSnapshots.size() >= maxSnapshotDepth) {
      throw new InvalidStateTransitionException("more than "
          + maxSnapshotDepth + " live snapshots");
    }
    ExecutionSnapshot snapshot = context.snapshot(nextSnapshotId++, stepNo);
    liveSnapshots.add(snapshot);
    return snapshot;
  }

  /**
   * Goes back to a snapshot: pops the solver scopes, truncates the arena and
   * the binding history, and returns to {@link ExecutorState#STEP_COMMITTED}.
   * Snapshots taken after {@code snapshot} can no longer be restored;
   * {@code snapshot} itself can be restored again.
   *
   * @throws InvalidStateTransitionException while a step is in progress, or
   *         if the snapshot is no longer live
   */
  public void restore(ExecutionSnapshot snapshot) {
    requireState("restore a snapshot", ExecutorState.STEP_COMMITTED,
        ExecutorState.FAILED);
    int index = liveSnapshots.indexOf(snapshot);
    if (index < 0) {
      throw new InvalidStateTransitionException(
          "snapshot " + snapshot.getId() + " is no longer live");
    }
    context.restore(snapshot);
    while (liveSnapshots.size() > index + 1) {
      liveSnapshots.remove(liveSnapshots.size() - 1);
    }
    stepNo = snapshot.getStepNo();
    stepBinding = null;
    failureReason = null;
    state = ExecutorState.STEP_COMMITTED;
    logger.debug("restored snapshot {} at step {}", snapshot.getId(), stepNo);
  }

  /**
   * Checks whether the current state may violate {@code invariant}, a state
   * predicate over the unprimed variables. The check runs in a temporary scope
   * and leaves no trace in the arena or the solver.
   *
   * @return {@link SatResult#SAT} if a violation is possible,
   *         {@link SatResult#UNSAT} if not, and {@link SatResult#UNKNOWN} if
   *         the solver could not tell or timed out
   */
  public SatResult mayViolate(TlaEx invariant) {
    requireState("check an invariant", ExecutorState.STEP_COMMITTED);
    SymbStateRewriter rewriter = context.getRewriter();
    Arena saved = context.getArena();
    rewriter.push();
    try {
      SymbState result = rewriter.rewriteUntilDone(
          new SymbState(Tla.not(invariant), saved, context.currentBinding()));
      context.getSolverContext().assertGroundExpr(result.getEx());
      SatResult answer = checkSatWithinLimit();
      if (answer == null) {
        logger.warn("invariant check at step {} timed out", stepNo);
        return SatResult.UNKNOWN;
      }
      return answer;
    } finally {
      rewriter.pop();
      saved.discardFuture();
      context.setArena(saved);
    }
  }

  /** Releases the solver and the timeout thread. */
  public void dispose() {
    if (timeoutExecutor != null) {
      timeoutExecutor.shutdownNow();
    }
    context.dispose();
  }

  /**
   * Runs the check on the timeout thread. When the limit passes, the solver is
   * interrupted and the check is awaited, so that no solver call is still in
   * flight when the caller goes on to pop scopes or restore.
   *
   * @return the answer of the solver, or null if it timed out
   */
  private SatResult checkSatWithinLimit() {
    final SolverContext solver = context.getSolverContext();
    if (stepTimeoutMillis == 0) {
      return solver.checkSat();
    }
    if (timeoutExecutor == null) {
      timeoutExecutor = Executors.newSingleThreadExecutor(
          new ThreadFactoryBuilder()
              .setNameFormat("solver-check-%d")
              .setDaemon(true)
              .build());
    }
    Future<SatResult> check = timeoutExecutor.submit(
        new Callable<SatResult>() {
          @Override
          public SatResult call() {
            return solver.checkSat();
          }
        });
    try {
      return check.get(stepTimeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.warn("step {}: no answer within {} ms", stepNo,
          stepTimeoutMillis);
      solver.interrupt();
      awaitInterrupted(check);
      return null;
    } catch (InterruptedException e) {
      solver.interrupt();
      awaitInterrupted(check);
      Thread.currentThread().interrupt();
      throw new CheckerException("interrupted while checking step " + stepNo,
          e);
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new CheckerException("solver check failed", e.getCause());
    }
  }

  /** Waits for an interrupted check to leave the solver. */
  private void awaitInterrupted(Future<SatResult> check) {
    try {
      SatResult late = Uninterruptibles.getUninterruptibly(check);
      logger.debug("interrupted check of step {} answered {}", stepNo, late);
    } catch (ExecutionException e) {
      logger.warn("interrupted check of step {} failed", stepNo,
          e.getCause());
    }
  }

  private void fail(FailureReason reason) {
    state = ExecutorState.FAILED;
    failureReason = reason;
    logger.info("step {} failed: {}", stepNo, reason);
  }

  private void requireState(String action, ExecutorState... allowed) {
    for (ExecutorState s : allowed) {
      if (state == s) {
        return;
      }
    }
    throw new InvalidStateTransitionException(
        "cannot " + action + " in state " + state);
  }
}
