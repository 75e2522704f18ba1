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
import symbolicchecker.rewriter.TypeMismatchException;
import symbolicchecker.smt.SatResult;

/**
 * Tests for {@link SetInRule}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SetInRuleTest extends RewriterTestBase {
  public void testLiteralMember() {
    ArenaCell in = rewriteToCell(Tla.in(Tla.integer(2),
        Tla.enumSet(Tla.integer(1), Tla.integer(2), Tla.integer(3))));
    assertEquals(CellT.bool(), in.getType());
    assertEquals(SatResult.UNSAT, checkWith(Tla.not(in.toNameEx())));
  }

  public void testLiteralNonMemberIsFalse() {
    assertEquals(Arena.FALSE_CELL_ID, rewriteToCell(Tla.in(Tla.integer(5),
        Tla.enumSet(Tla.integer(1), Tla.integer(2)))).getId());
  }

  public void testNothingIsInTheEmptySet() {
    assertEquals(Arena.FALSE_CELL_ID, rewriteToCell(Tla.in(Tla.integer(1),
        Tla.emptySet(CellT.integer()))).getId());
  }

  public void testUnknownElement() {
    ArenaCell i = bindNew("i", CellT.integer());
    ArenaCell in = rewriteToCell(Tla.in(Tla.name("i"),
        Tla.enumSet(Tla.integer(1), Tla.integer(2))));
    solver.assertGroundExpr(Tla.eq(i.toNameEx(), Tla.integer(7)));
    assertEquals(SatResult.UNSAT, checkWith(in.toNameEx()));
    assertEquals(SatResult.SAT, checkWith(Tla.not(in.toNameEx())));
  }

  public void testWrongElementType() {
    try {
      rewrite(Tla.in(Tla.bool(true), Tla.enumSet(Tla.integer(1))));
      fail("looked for a Boolean among integers");
    } catch (TypeMismatchException e) {
      // expected
    }
  }

  public void testMembershipInNonSet() {
    try {
      rewrite(Tla.in(Tla.integer(1), Tla.integer(1)));
      fail("looked inside an integer");
    } catch (TypeMismatchException e) {
      // expected
    }
  }

  public void testSetsOfSetsAreUnsupported() {
    try {
      rewrite(Tla.in(Tla.enumSet(Tla.integer(1)),
          Tla.enumSet(Tla.enumSet(Tla.integer(2)))));
      fail("compared sets");
    } catch (RewriterException e) {
      // expected
    }
  }
}
