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
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.rewriter.Binding;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

import java.util.List;

/**
 * Rewrites a set comprehension {@code {x \in S: P}}.
 * <p>
 * The predicate is rewritten once per potential element of S, with x bound to
 * that element. Elements whose predicate rewrites to the FALSE cell cannot be
 * in the result and are left out. The new set holds the other elements, and
 * a single constraint states that each of them is in the new set iff it is
 * in S and its predicate holds.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SetFilterRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public SetFilterRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.FILTER;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a set comprehension", state.getEx());
    }
    OperEx filter = (OperEx) state.getEx();
    String varName = ((NameEx) filter.getArg(0)).getName();
    TlaEx pred = filter.getArg(2);

    SymbState current =
        rewriter.rewriteUntilDone(state.setRex(filter.getArg(1)));
    ArenaCell set = current.asCell();
    if (!set.getType().isFinSet()) {
      throw new TypeMismatchException(
          "a set comprehension over a " + set.getType() + " cell", filter);
    }

    Binding outer = current.getBinding();
    ArenaCell shadowed = outer.get(varName);
    List<ArenaCell> survivors = Lists.newArrayList();
    List<TlaEx> conds = Lists.newArrayList();
    for (ArenaCell elem : current.getArena().getHas(set)) {
      SymbState predState = rewriter.rewriteUntilDone(
          current.setRex(pred).setBinding(outer.with(varName, elem)));
      ArenaCell predCell = predState.asCell();
      if (!predCell.getType().equals(CellT.bool())) {
        throw new TypeMismatchException(
            "a set comprehension with a " + predCell.getType()
                + " predicate", filter);
      }
      Binding restored = shadowed == null
          ? predState.getBinding().without(varName)
          : predState.getBinding().with(varName, shadowed);
      current = predState.setBinding(restored);
      if (predCell.getId() != Arena.FALSE_CELL_ID) {
        survivors.add(elem);
        conds.add(Tla.and(predCell.toNameEx(),
            rewriter.getEncoder().membership(elem, set)));
      }
    }

    Arena arena = current.getArena().appendCell(set.getType());
    ArenaCell result = arena.topCell();
    arena = arena.appendHas(result, survivors);
    TlaEx members = rewriter.getEncoder().defineMembers(result, survivors,
        conds);
    if (members != null) {
      rewriter.getSolverContext().assertGroundExpr(members);
    }
    return current.setArena(arena).setRex(result.toNameEx());
  }
}
