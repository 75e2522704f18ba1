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
import com.google.common.collect.Sets;

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.rewriter.RewriterException;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Rewrites a set enumeration {@code {e1, ..., en}} to a new set cell that
 * contains the cells of the elements. Elements that rewrite to the same cell
 * are kept once.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SetCtorRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public SetCtorRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.ENUM_SET;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a set enumeration", state.getEx());
    }
    OperEx ctor = (OperEx) state.getEx();
    SymbStateRewriter.SeqRewrite rewritten =
        rewriter.rewriteSeqUntilDone(state, ctor.getArgs());
    SymbState current = rewritten.getState();

    List<ArenaCell> elems = Lists.newArrayList();
    Set<Integer> seen = Sets.newHashSet();
    for (ArenaCell cell : rewritten.getCells()) {
      if (seen.add(cell.getId())) {
        elems.add(cell);
      }
    }

    CellT setType = setType(ctor, elems);
    Arena arena = current.getArena().appendCell(setType);
    ArenaCell set = arena.topCell();
    arena = arena.appendHas(set, elems);
    List<TlaEx> conds = Collections.<TlaEx>nCopies(elems.size(),
        arena.cellTrue().toNameEx());
    TlaEx members = rewriter.getEncoder().defineMembers(set, elems, conds);
    if (members != null) {
      rewriter.getSolverContext().assertGroundExpr(members);
    }
    return current.setArena(arena).setRex(set.toNameEx());
  }

  private static CellT setType(OperEx ctor, List<ArenaCell> elems) {
    if (elems.isEmpty()) {
      if (!ctor.getTypeTag().isFinSet()) {
        throw new RewriterException("the type of an empty set is unknown",
            ctor);
      }
      return ctor.getTypeTag();
    }
    CellT elemType = elems.get(0).getType();
    for (ArenaCell elem : elems) {
      if (!elem.getType().equals(elemType)) {
        throw new TypeMismatchException("a set of " + elemType
            + " cannot contain a " + elem.getType(), ctor);
      }
    }
    return CellT.finSet(elemType);
  }
}
