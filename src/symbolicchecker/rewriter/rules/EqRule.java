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

package symbolicchecker.rewriter.rules;

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.rewriter.IntValueCache;
import symbolicchecker.rewriter.RewriterException;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

/**
 * Rewrites an equality between Boolean or integer values. Equal cells give
 * TRUE and cells of distinct literals give FALSE without asking the solver.
 *
 * @author The tla-symbolic-checker Authors
 */
public class EqRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public EqRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.EQ;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not an equality", state.getEx());
    }
    OperEx eq = (OperEx) state.getEx();
    SymbState leftState =
        rewriter.rewriteUntilDone(state.setRex(eq.getArg(0)));
    SymbState rightState =
        rewriter.rewriteUntilDone(leftState.setRex(eq.getArg(1)));
    ArenaCell left = leftState.asCell();
    ArenaCell right = rightState.asCell();
    return equality(rightState, left, right, eq);
  }

  /**
   * Makes a Boolean cell for {@code left = right}.
   *
   * @param source the expression to blame in errors
   */
  private SymbState equality(SymbState state, ArenaCell left,
      ArenaCell right, OperEx source) {
    Arena arena = state.getArena();
    if (!left.getType().equals(right.getType())) {
      throw new TypeMismatchException("comparing " + left.getType()
          + " with " + right.getType(), source);
    }
    CellT type = left.getType();
    if (!type.equals(CellT.bool()) && !type.equals(CellT.integer())) {
      throw new RewriterException(
          "equality over " + type + " is not supported", source);
    }
    if (left.getId() == right.getId()) {
      return state.setRex(arena.cellTrue().toNameEx());
    }
    if (areDistinctConstants(left, right)) {
      return state.setRex(arena.cellFalse().toNameEx());
    }
    arena = arena.appendCell(CellT.bool());
    ArenaCell result = arena.topCell();
    rewriter.getSolverContext().assertGroundExpr(Tla.iff(result.toNameEx(),
        Tla.eq(left.toNameEx(), right.toNameEx())));
    return state.setArena(arena).setRex(result.toNameEx());
  }

  private boolean areDistinctConstants(ArenaCell left, ArenaCell right) {
    if (left.getType().equals(CellT.bool())) {
      return isBuiltin(left) && isBuiltin(right);
    }
    IntValueCache cache = rewriter.getIntValueCache();
    Long leftValue = cache.valueOf(left);
    Long rightValue = cache.valueOf(right);
    return leftValue != null && rightValue != null
        && !leftValue.equals(rightValue);
  }

  private static boolean isBuiltin(ArenaCell cell) {
    return cell.getId() == Arena.FALSE_CELL_ID
        || cell.getId() == Arena.TRUE_CELL_ID;
  }
}
