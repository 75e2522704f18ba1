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
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.ValEx;
import symbolicchecker.rewriter.IntValueCache;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;

/**
 * Rewrites an integer literal to a cell that the solver knows equals it. Each
 * literal gets one cell per scope.
 *
 * @author The tla-symbolic-checker Authors
 */
public class IntConstRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public IntConstRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof ValEx && ((ValEx) state.getEx()).isInt();
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not an integer literal", state.getEx());
    }
    long value = ((ValEx) state.getEx()).intValue();
    IntValueCache cache = rewriter.getIntValueCache();
    ArenaCell cached = cache.get(value, state.getArena());
    if (cached != null) {
      return state.setRex(cached.toNameEx());
    }
    Arena arena = state.getArena().appendCell(CellT.integer());
    ArenaCell cell = arena.topCell();
    rewriter.getSolverContext().assertGroundExpr(
        Tla.eq(cell.toNameEx(), Tla.integer(value)));
    cache.put(value, cell);
    return state.setArena(arena).setRex(cell.toNameEx());
  }
}
