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

import com.google.common.collect.ImmutableList;

import junit.framework.TestCase;

import symbolicchecker.arena.Arena;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.ValEx;

/**
 * Tests for {@link RecordingSolverContext}, {@link SolverLog} and
 * {@link ReplayingSolverContext}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class RecordingSolverContextTest extends TestCase {
  private SolverConfig config;
  private NameEx b;
  private NameEx i;

  @Override
  protected void setUp() {
    config = SolverConfig.withEncoding(SmtEncoding.ARRAYS);
    Arena arena = Arena.create().appendCell(CellT.bool());
    b = arena.topCell().toNameEx();
    arena = arena.appendCell(CellT.integer());
    i = arena.topCell().toNameEx();
  }

  private static void runSession(SolverContext solver) {
    solver.push();
    solver.checkSat();
    solver.pop();
  }

  public void testRecordsEveryCall() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), false);
    recorder.assertGroundExpr(Tla.eq(i, Tla.integer(5)));
    recorder.push();
    recorder.assertGroundExpr(b);
    assertEquals(SatResult.SAT, recorder.checkSat());
    assertEquals(ValEx.ofInt(5).toString(),
        recorder.evalGroundExpr(i).toString());
    recorder.pop();

    SolverLog log = recorder.getLog();
    assertEquals(6, log.size());
    assertEquals(SolverCall.Kind.ASSERT, log.getCalls().get(0).getKind());
    assertEquals(SolverCall.Kind.PUSH, log.getCalls().get(1).getKind());
    assertEquals(SolverCall.Kind.EVAL, log.getCalls().get(4).getKind());
    assertEquals(1, log.getCalls().get(5).getCount());
    assertEquals(ImmutableList.of(SatResult.SAT), log.checkSatResults());
    recorder.dispose();
  }

  public void testDeferredCallsWaitForTheNextQuery() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), true);
    assertTrue(recorder.isDeferred());
    recorder.push();
    recorder.assertGroundExpr(b);
    recorder.assertGroundExpr(Tla.not(b));
    assertEquals(1, recorder.contextLevel());
    assertEquals(3, recorder.pendingCalls());
    assertEquals(SatResult.UNSAT, recorder.checkSat());
    assertEquals(0, recorder.pendingCalls());
    recorder.pop();
    assertEquals(SatResult.SAT, recorder.checkSat());
    recorder.dispose();
  }

  public void testDeferredContextStillRejectsBadConstraints() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), true);
    try {
      recorder.assertGroundExpr(Tla.in(i, i));
      fail("recorded a constraint no solver accepts");
    } catch (ConstraintEncodingException e) {
      assertEquals(0, recorder.getLog().size());
    }
    recorder.dispose();
  }

  public void testReplayReturnsRecordedAnswers() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), false);
    recorder.assertGroundExpr(b);
    recorder.push();
    recorder.assertGroundExpr(Tla.not(b));
    recorder.checkSat();
    recorder.pop();
    recorder.checkSat();
    recorder.dispose();

    ReplayingSolverContext replay =
        new ReplayingSolverContext(config, recorder.getLog());
    replay.assertGroundExpr(b);
    replay.push();
    replay.assertGroundExpr(Tla.not(b));
    assertEquals(SatResult.UNSAT, replay.checkSat());
    replay.pop();
    assertEquals(SatResult.SAT, replay.checkSat());
    assertTrue(replay.isExhausted());
  }

  public void testReplayDetectsDivergence() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), false);
    recorder.assertGroundExpr(b);
    recorder.dispose();

    ReplayingSolverContext replay =
        new ReplayingSolverContext(config, recorder.getLog());
    try {
      replay.assertGroundExpr(Tla.not(b));
      fail("replayed a different assertion");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().startsWith("replay diverged"));
    }
  }

  public void testReplayPastTheEnd() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), false);
    runSession(recorder);
    recorder.dispose();

    ReplayingSolverContext replay =
        new ReplayingSolverContext(config, recorder.getLog());
    runSession(replay);
    assertTrue(replay.isExhausted());
    try {
      replay.checkSat();
      fail("replayed past the end of the log");
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testReplayOnAnotherSolver() {
    RecordingSolverContext recorder = new RecordingSolverContext(
        new InMemorySolverContext(config), false);
    recorder.assertGroundExpr(Tla.iff(b, Tla.eq(i, Tla.integer(2))));
    recorder.assertGroundExpr(Tla.eq(i, Tla.integer(3)));
    recorder.push();
    recorder.assertGroundExpr(b);
    recorder.checkSat();
    recorder.pop();
    recorder.checkSat();
    recorder.dispose();

    SolverContext fresh = new InMemorySolverContext(config);
    assertEquals(recorder.getLog().checkSatResults(),
        recorder.getLog().replayOn(fresh));
    assertEquals(ImmutableList.of(SatResult.UNSAT, SatResult.SAT),
        recorder.getLog().checkSatResults());
    fresh.dispose();
  }
}
