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

package symbolicchecker.rewriter;

import com.google.common.collect.Lists;

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.smt.SatResult;

import java.util.List;

/**
 * Tests for {@link SymbStateRewriter}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SymbStateRewriterTest extends RewriterTestBase {
  public void testCreateArenaFixesBuiltinCells() {
    assertEquals(2, arena.cellCount());
    assertEquals(SatResult.SAT, solver.checkSat());
    assertEquals(SatResult.UNSAT,
        checkWith(arena.cellFalse().toNameEx()));
    assertEquals(SatResult.UNSAT,
        checkWith(Tla.not(arena.cellTrue().toNameEx())));
  }

  public void testNormalizedStateIsReturnedAsIs() {
    SymbState state =
        new SymbState(arena.cellTrue().toNameEx(), arena, binding);
    assertSame(state, rewriter.rewriteUntilDone(state));
    assertEquals(0, rewriter.ruleApplications());
  }

  public void testBoundNameBecomesItsCell() {
    ArenaCell p = bindNew("p", CellT.bool());
    assertEquals(p, rewriteToCell(Tla.name("p")));
  }

  public void testUnboundNameHasNoRule() {
    try {
      rewrite(Tla.name("unbound"));
      fail("rewrote an unbound name");
    } catch (NoApplicableRuleException e) {
      assertEquals("unbound", e.getEx().toString());
    }
  }

  public void testConstantExpressionsAreRewrittenOnce() {
    TlaEx ex = Tla.or(Tla.eq(Tla.integer(1), Tla.integer(2)), Tla.bool(false));
    ArenaCell first = rewriteToCell(ex);
    long applications = rewriter.ruleApplications();
    assertTrue(applications > 0);
    assertEquals(first, rewriteToCell(ex));
    assertEquals(applications, rewriter.ruleApplications());
  }

  public void testStateExpressionsAreNotCached() {
    bindNew("p", CellT.bool());
    TlaEx ex = Tla.not(Tla.name("p"));
    ArenaCell first = rewriteToCell(ex);
    ArenaCell second = rewriteToCell(ex);
    assertFalse(first.equals(second));
  }

  public void testRewriteSequenceThreadsTheArena() {
    SymbStateRewriter.SeqRewrite seq = rewriter.rewriteSeqUntilDone(
        new SymbState(Tla.bool(true), arena, binding),
        java.util.Arrays.asList(Tla.integer(10), Tla.integer(11),
            Tla.integer(10)));
    assertEquals(3, seq.getCells().size());
    assertEquals(seq.getCells().get(0), seq.getCells().get(2));
    assertEquals(4, seq.getState().getArena().cellCount());
  }

  public void testPopForgetsCachedCells() {
    rewriter.push();
    assertEquals(1, rewriter.contextLevel());
    assertEquals(1, solver.contextLevel());
    ArenaCell nine = rewriteToCell(Tla.integer(9));
    assertEquals(nine, rewriter.getIntValueCache().get(9, arena));
    rewriter.pop();
    assertEquals(0, rewriter.contextLevel());
    assertEquals(0, solver.contextLevel());
    assertNull(rewriter.getIntValueCache().get(9, arena));
    assertNull(rewriter.getIntValueCache().valueOf(nine));
  }

  public void testCacheIgnoresCellsOfOtherArenas() {
    Arena before = arena;
    ArenaCell seven = rewriteToCell(Tla.integer(7));
    assertEquals(seven, rewriter.getIntValueCache().get(7, arena));
    assertNull(rewriter.getIntValueCache().get(7, before));
  }

  public void testRulesComeInFixedOrder() {
    assertEquals(10, rewriter.getRules().size());
    assertEquals("SubstRule",
        rewriter.getRules().get(0).getClass().getSimpleName());
    assertEquals("AssignmentRule",
        rewriter.getRules().get(9).getClass().getSimpleName());
  }

  private static int nodeCount(TlaEx ex) {
    int count = 1;
    if (ex instanceof OperEx) {
      for (TlaEx arg : ((OperEx) ex).getArgs()) {
        count += nodeCount(arg);
      }
    }
    return count;
  }

  private static TlaEx[] range(int from, int to) {
    TlaEx[] ints = new TlaEx[to - from + 1];
    for (int i = from; i <= to; i++) {
      ints[i - from] = Tla.integer(i);
    }
    return ints;
  }

  /** @return how many rules rewriting {@code ex} took */
  private long applicationsFor(TlaEx ex) {
    long before = rewriter.ruleApplications();
    rewrite(ex);
    return rewriter.ruleApplications() - before;
  }

  public void testConnectivesAndSetsTakeOneRulePerNode() {
    bindNew("p", CellT.bool());
    for (int n = 1; n <= 12; n++) {
      List<TlaEx> conjuncts = Lists.newArrayList();
      for (int i = 0; i < n; i++) {
        conjuncts.add(Tla.or(Tla.name("p"),
            Tla.not(Tla.eq(Tla.integer(i), Tla.integer(i + 1)))));
      }
      TlaEx and = Tla.and(conjuncts);
      assertTrue(and.toString(), applicationsFor(and) <= nodeCount(and));

      TlaEx set = Tla.in(Tla.integer(n), Tla.enumSet(range(1, n)));
      assertTrue(set.toString(), applicationsFor(set) <= nodeCount(set));
    }
  }

  public void testNestedFiltersStayQuadratic() {
    for (int n = 1; n <= 8; n++) {
      TlaEx inner = Tla.filter("y", Tla.enumSet(range(1, n)),
          Tla.not(Tla.eq(Tla.name("y"), Tla.integer(1))));
      TlaEx outer = Tla.filter("x", inner,
          Tla.or(Tla.eq(Tla.name("x"), Tla.integer(2)),
              Tla.eq(Tla.name("x"), Tla.integer(n))));
      int nodes = nodeCount(outer);
      long applications = applicationsFor(outer);
      assertTrue(outer + " took " + applications,
          applications <= (long) nodes * nodes);
    }
  }

  public void testCyclingRulesAreStopped() {
    rewriter.addRuleFirst(new RenamingRule("pong", "ping"));
    rewriter.addRuleFirst(new RenamingRule("ping", "pong"));
    try {
      rewrite(Tla.name("ping"));
      fail("rewrote forever");
    } catch (RewriterException e) {
      assertFalse(e instanceof NoApplicableRuleException);
      assertEquals(SymbStateRewriter.APPLICATIONS_PER_NODE,
          rewriter.ruleApplications());
    }
  }

  /** Rewrites one name to another. */
  private static class RenamingRule implements RewritingRule {
    private final String from;
    private final String to;

    RenamingRule(String from, String to) {
      this.from = from;
      this.to = to;
    }

    @Override
    public boolean isApplicable(SymbState state) {
      return state.getEx().toString().equals(from);
    }

    @Override
    public SymbState apply(SymbState state) {
      return state.setRex(Tla.name(to));
    }
  }

  public void testPopTooFar() {
    try {
      rewriter.pop();
      fail("popped the base scope");
    } catch (IllegalArgumentException e) {
      // expected
    }
  }
}
