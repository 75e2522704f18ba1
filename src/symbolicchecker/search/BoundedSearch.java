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

package symbolicchecker.search;

import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.ir.TlaEx;
import symbolicchecker.smt.SatResult;
import symbolicchecker.trex.ExecutionSnapshot;
import symbolicchecker.trex.ExecutorState;
import symbolicchecker.trex.FailureReason;
import symbolicchecker.trex.TransitionExecutor;

import java.util.List;

/**
 * Looks for a reachable state that violates the invariant of a
 * {@link TransitionSystem}, trying transitions depth first up to the step
 * bound of the executor.
 * <p>
 * After each committed step a snapshot is taken, and each alternative
 * transition is tried from it; restoring the snapshot undoes a tried
 * transition. A step that is unsatisfiable is simply skipped. A query the
 * solver cannot decide does not stop the search, but a search that finds no
 * counterexample after such a query reports {@link SearchResult.Kind#UNKNOWN}.
 * <p>
 * The executor needs room for one snapshot per step.
 *
 * @author The tla-symbolic-checker Authors
 */
public class BoundedSearch {
  private static final Logger logger =
      LoggerFactory.getLogger(BoundedSearch.class);

  private final TransitionExecutor executor;
  private final TransitionSystem system;

  /** The transitions taken from the initial state to the current one */
  private final List<Integer> path = Lists.newArrayList();

  private boolean degraded;

  public BoundedSearch(TransitionExecutor executor, TransitionSystem system) {
    this.executor = executor;
    this.system = system;
  }

  /** Runs the search. The executor must be idle. */
  public SearchResult run() {
    logger.info("searching up to {} steps with {} transitions",
        executor.getMaxSteps(), system.getNextAlternatives().size());
    degraded = false;
    path.clear();
    executor.beginStep();
    if (!executor.rewriteStep(system.getInit()) || !executor.commitStep()) {
      noteFailure();
      logger.info("no initial state");
      return finish(null);
    }
    return finish(checkAndExplore());
  }

  private SearchResult checkAndExplore() {
    SatResult violation = executor.mayViolate(system.getInvariant());
    if (violation == SatResult.SAT) {
      logger.info("invariant may be violated after {} steps",
          executor.getStepNo());
      return SearchResult.counterexample(executor.getBindingHistory(), path);
    } else if (violation == SatResult.UNKNOWN) {
      degraded = true;
    }
    if (executor.getStepNo() == executor.getMaxSteps()) {
      return null;
    }
    ExecutionSnapshot snapshot = executor.snapshot();
    List<TlaEx> next = system.getNextAlternatives();
    for (int i = 0; i < next.size(); i++) {
      executor.beginStep();
      path.add(i);
      if (executor.rewriteStep(next.get(i))
          && executor.commitStep()) {
        SearchResult found = checkAndExplore();
        if (found != null) {
          return found;
        }
      } else {
        noteFailure();
      }
      path.remove(path.size() - 1);
      executor.restore(snapshot);
    }
    return null;
  }

  private void noteFailure() {
    if (executor.getState() == ExecutorState.FAILED
        && executor.getFailureReason() != FailureReason.UNSAT) {
      logger.warn("step {} undecided: {}", executor.getStepNo(),
          executor.getFailureReason());
      degraded = true;
    }
  }

  private SearchResult finish(SearchResult found) {
    SearchResult result;
    if (found != null) {
      result = found;
    } else if (degraded) {
      result = SearchResult.unknown();
    } else {
      result = SearchResult.noError();
    }
    logger.info("search finished: {}", result.getKind());
    return result;
  }
}
