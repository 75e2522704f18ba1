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
import symbolicchecker.rewriter.IntValueCache;
import symbolicchecker.rewriter.RewriterException;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.rewriter.TypeMismatchException;

import java.util.List;

/**
 * Rewrites {@code x \in S}: x is in S when some potential element of S is in
 * S and equals x. Elements that are literals other than x are skipped.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SetInRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public SetInRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.IN;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a membership test", state.getEx());
    }
    OperEx in = (OperEx) state.getEx();
    SymbState setState = rewriter.rewriteUntilDone(state.setRex(in.getArg(1)));
    ArenaCell set = setState.asCell();
    if (!set.getType().isFinSet()) {
      throw new TypeMismatchException(
          "membership in a " + set.getType() + " cell", in);
    }
    SymbState elemState =
        rewriter.rewriteUntilDone(setState.setRex(in.getArg(0)));
    ArenaCell elem = elemState.asCell();
    CellT elemType = set.getType().elemType();
    if (!elem.getType().equals(elemType)) {
      throw new TypeMismatchException("a " + elem.getType()
          + " cannot be in a set of " + elemType, in);
    }

    Arena arena = elemState.getArena();
    List<TlaEx> cases = Lists.newArrayList();
    for (ArenaCell candidate : arena.getHas(set)) {
      TlaEx selected = rewriter.getEncoder().membership(candidate, set);
      if (candidate.getId() == elem.getId()) {
        cases.add(selected);
      } else if (!areDistinctLiterals(candidate, elem)) {
        if (elemType.isFinSet()) {
          throw new RewriterException(
              "membership in a set of sets is not supported", in);
        }
        cases.add(Tla.and(selected,
            Tla.eq(elem.toNameEx(), candidate.toNameEx())));
      }
    }
    if (cases.isEmpty()) {
      return elemState.setRex(arena.cellFalse().toNameEx());
    }
    arena = arena.appendCell(CellT.bool());
    ArenaCell result = arena.topCell();
    TlaEx membership = cases.size() == 1 ? cases.get(0) : Tla.or(cases);
    rewriter.getSolverContext().assertGroundExpr(
        Tla.iff(result.toNameEx(), membership));
    return elemState.setArena(arena).setRex(result.toNameEx());
  }

  private boolean areDistinctLiterals(ArenaCell a, ArenaCell b) {
    IntValueCache cache = rewriter.getIntValueCache();
    Long first = cache.valueOf(a);
    Long second = cache.valueOf(b);
    return first != null && second != null && !first.equals(second);
  }
}
