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

import symbolicchecker.StackableContext;
import symbolicchecker.ir.TlaEx;

/**
 * The narrow interface through which the core talks to a constraint solver.
 * <p>
 * Constraints are ground expressions: Boolean and integer literals, cell
 * references tagged with their types, the Boolean connectives, equality, and
 * the set-membership operators of the configured {@link SmtEncoding}. Cell
 * references become solver constants named after the cell.
 *
 * @author The tla-symbolic-checker Authors
 */
public interface SolverContext extends StackableContext {
  SolverConfig config();

  /**
   * Adds a constraint to the current scope.
   *
   * @throws ConstraintEncodingException if {@code ex} is not a ground
   *         constraint
   */
  void assertGroundExpr(TlaEx ex);

  /** Checks whether the constraints of all open scopes can hold together. */
  SatResult checkSat();

  /**
   * Evaluates a Boolean or integer ground term in the model found by the last
   * {@link #checkSat()} that returned {@link SatResult#SAT}.
   *
   * @return a {@link symbolicchecker.ir.ValEx}
   * @throws IllegalStateException if there is no such model
   */
  TlaEx evalGroundExpr(TlaEx ex);

  /**
   * Asks a {@link #checkSat()} running on another thread to give up; that
   * check then answers {@link SatResult#UNKNOWN}. This is the only method that
   * may be called while another thread uses the context.
   */
  void interrupt();

  /** Releases the solver. The context must not be used afterwards. */
  void dispose();
}
