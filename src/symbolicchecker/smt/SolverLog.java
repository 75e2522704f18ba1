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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.List;

/**
 * The calls made on a solver context, in order.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SolverLog {
  private final List<SolverCall> calls = Lists.newArrayList();

  void append(SolverCall call) {
    calls.add(call);
  }

  public ImmutableList<SolverCall> getCalls() {
    return ImmutableList.copyOf(calls);
  }

  public int size() {
    return calls.size();
  }

  /** @return the recorded answers of the CHECK_SAT calls, in order */
  public ImmutableList<SatResult> checkSatResults() {
    ImmutableList.Builder<SatResult> results = ImmutableList.builder();
    for (SolverCall call : calls) {
      if (call.getKind() == SolverCall.Kind.CHECK_SAT) {
        results.add(call.getResult());
      }
    }
    return results.build();
  }

  /**
   * Issues every recorded call on {@code solver}.
   *
   * @return the answers {@code solver} gave to the CHECK_SAT calls
   */
  public ImmutableList<SatResult> replayOn(SolverContext solver) {
    ImmutableList.Builder<SatResult> results = ImmutableList.builder();
    for (SolverCall call : calls) {
      if (call.getKind() == SolverCall.Kind.CHECK_SAT) {
        results.add(solver.checkSat());
      } else {
        call.applyTo(solver);
      }
    }
    return results.build();
  }

  @Override
  public String toString() {
    return Joiner.on('\n').join(calls);
  }
}
