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
import symbolicchecker.rewriter.RewriterException;
import symbolicchecker.rewriter.RewriterTestBase;
import symbolicchecker.rewriter.SymbState;

/**
 * Tests for {@link AssignmentRule}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class AssignmentRuleTest extends RewriterTestBase {
  public void testBindsThePrimedName() {
    SymbState state = rewrite(Tla.assign("x'", Tla.integer(3)));
    assertEquals(Arena.TRUE_CELL_ID, state.asCell().getId());
    ArenaCell x = state.getBinding().get("x'");
    assertNotNull(x);
    assertEquals(rewriter.getIntValueCache().get(3, arena), x);
  }

  public void testAssignmentsInAConjunction() {
    SymbState state = rewrite(Tla.and(
        Tla.assign("x'", Tla.integer(1)),
        Tla.assign("s'", Tla.enumSet(Tla.integer(1), Tla.integer(2)))));
    assertEquals(Arena.TRUE_CELL_ID, state.asCell().getId());
    assertEquals(CellT.integer(), state.getBinding().get("x'").getType());
    assertEquals(CellT.finSet(CellT.integer()),
        state.getBinding().get("s'").getType());
  }

  public void testValueMaySeeCurrentState() {
    ArenaCell x = bindNew("x", CellT.integer());
    SymbState state = rewrite(Tla.assign("x'", Tla.name("x")));
    assertEquals(x, state.getBinding().get("x'"));
  }

  public void testDoubleAssignment() {
    rewrite(Tla.assign("x'", Tla.integer(1)));
    try {
      rewrite(Tla.assign("x'", Tla.integer(2)));
      fail("assigned x' twice");
    } catch (RewriterException e) {
      assertTrue(e.getMessage().contains("assigned twice"));
    }
  }
}
