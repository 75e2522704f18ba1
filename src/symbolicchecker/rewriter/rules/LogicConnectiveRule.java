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

import com.google.common.collect.Lists;

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

import java.util.List;

/**
 * Rewrites conjunctions and disjunctions from left to right. Rewriting stops
 * at the first argument that is the predefined cell deciding the result
 * (FALSE for a conjunction, TRUE for a disjunction); the other predefined cell
 * is dropped.
 *
 * @author The tla-symbolic-checker Authors
 */
public class LogicConnectiveRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public LogicConnectiveRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    if (!(state.getEx() instanceof OperEx)) {
      return false;
    }
    TlaOper oper = ((OperEx) state.getEx()).getOper();
    return oper == TlaOper.AND || oper == TlaOper.OR;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a conjunction or disjunction",
          state.getEx());
    }
    OperEx oper = (OperEx) state.getEx();
    boolean isAnd = oper.getOper() == TlaOper.AND;
    int dominantId = isAnd ? Arena.FALSE_CELL_ID : Arena.TRUE_CELL_ID;
    int neutralId = isAnd ? Arena.TRUE_CELL_ID : Arena.FALSE_CELL_ID;

    SymbState current = state;
    List<TlaEx> live = Lists.newArrayList();
    for (TlaEx arg : oper.getArgs()) {
      current = rewriter.rewriteUntilDone(current.setRex(arg));
      ArenaCell cell = current.asCell();
      if (!cell.getType().equals(CellT.bool())) {
        throw new TypeMismatchException(
            "connective over a " + cell.getType() + " cell", arg);
      }
      if (cell.getId() == dominantId) {
        return current;
      }
      if (cell.getId() != neutralId) {
        live.add(cell.toNameEx());
      }
    }
    Arena arena = current.getArena();
    if (live.isEmpty()) {
      return current.setRex(arena.findCellById(neutralId).toNameEx());
    }
    if (live.size() == 1) {
      return current.setRex(live.get(0));
    }
    arena = arena.appendCell(CellT.bool());
    ArenaCell result = arena.topCell();
    TlaEx junction = isAnd ? Tla.and(live) : Tla.or(live);
    rewriter.getSolverContext().assertGroundExpr(
        Tla.iff(result.toNameEx(), junction));
    return current.setArena(arena).setRex(result.toNameEx());
  }
}
