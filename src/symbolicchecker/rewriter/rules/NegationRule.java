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
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

/**
 * Rewrites a negation; the negation of a predefined cell is folded.
 *
 * @author The tla-symbolic-checker Authors
 */
public class NegationRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public NegationRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.NOT;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a negation", state.getEx());
    }
    OperEx not = (OperEx) state.getEx();
    SymbState argState =
        rewriter.rewriteUntilDone(state.setRex(not.getArg(0)));
    ArenaCell arg = argState.asCell();
    if (!arg.getType().equals(CellT.bool())) {
      throw new TypeMismatchException(
          "negation of a " + arg.getType() + " cell", not);
    }
    Arena arena = argState.getArena();
    if (arg.getId() == Arena.TRUE_CELL_ID) {
      return argState.setRex(arena.cellFalse().toNameEx());
    }
    if (arg.getId() == Arena.FALSE_CELL_ID) {
      return argState.setRex(arena.cellTrue().toNameEx());
    }
    arena = arena.appendCell(CellT.bool());
    ArenaCell result = arena.topCell();
    rewriter.getSolverContext().assertGroundExpr(
        Tla.iff(result.toNameEx(), Tla.not(arg.toNameEx())));
    return argState.setArena(arena).setRex(result.toNameEx());
  }
}
