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

import symbolicchecker.smt.RecordingSolverContext;
import symbolicchecker.smt.SolverContext;
import symbolicchecker.smt.SolverLog;

/**
 * An execution context that holds constraints back until the solver is
 * queried, and records every solver call in a {@link SolverLog} that can be
 * replayed later.
 *
 * @author The tla-symbolic-checker Authors
 */
public class OfflineExecutionContext extends ExecutionContext {
  private final RecordingSolverContext recorder;

  private OfflineExecutionContext(RecordingSolverContext recorder) {
    super(recorder);
    this.recorder = recorder;
  }

  /** @param solverContext the solver that answers the deferred queries */
  public static OfflineExecutionContext create(SolverContext solverContext) {
    return new OfflineExecutionContext(
        new RecordingSolverContext(solverContext, true));
  }

  public SolverLog getSolverLog() {
    return recorder.getLog();
  }

  @Override
  public boolean streamsConstraints() {
    return false;
  }
}
