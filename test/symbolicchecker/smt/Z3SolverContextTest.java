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

/**
 * Tests for {@link Z3SolverContext} under the arrays encoding.
 *
 * @author The tla-symbolic-checker Authors
 */
public class Z3SolverContextTest extends SolverContextTestBase {
  @Override
  protected SolverContext createSolver(SolverConfig config) {
    return new Z3SolverContext(config);
  }

  @Override
  protected SmtEncoding encoding() {
    return SmtEncoding.ARRAYS;
  }

  public void testSeedAndTimeoutAreAccepted() {
    SolverContext tuned = new Z3SolverContext(SolverConfig.builder()
        .setRandomSeed(7)
        .setTimeoutSeconds(10)
        .build());
    try {
      tuned.assertGroundExpr(newCell(symbolicchecker.ir.CellT.bool()));
      assertEquals(SatResult.SAT, tuned.checkSat());
    } finally {
      tuned.dispose();
    }
  }
}
