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

package symbolicchecker.ir;

/**
 * Operator tags. The first group appears in specifications; the second group
 * only appears in ground constraints handed to a solver.
 *
 * @author The tla-symbolic-checker Authors
 */
public enum TlaOper {
  AND("/\\", -1, false),
  OR("\\/", -1, false),
  NOT("~", 1, false),
  EQ("=", 2, false),
  IN("\\in", 2, false),
  /** {@code {e_1, ..., e_n}} */
  ENUM_SET("{}", -1, false),
  /** {@code {x \in S: P}}, arguments: the bound name, S and P */
  FILTER("filter", 3, false),
  /** {@code x' := e} */
  ASSIGN(":=", 2, false),

  IFF("<=>", 2, true),
  /** membership of a cell in a set cell: an array read or an oracle */
  SELECT_IN_SET("selectInSet", 2, true),
  /** arguments: element, base array, stored Boolean */
  STORE_IN_SET("storeInSet", 3, true),
  /** arguments: the set cell, the chain of stores defining it */
  STORE_LAST("storeLast", 2, true),
  EMPTY_SET("emptySet", 0, true);

  public static final int VARIADIC = -1;

  private final String symbol;
  private final int arity;
  private final boolean solverLevel;

  private TlaOper(String symbol, int arity, boolean solverLevel) {
    this.symbol = symbol;
    this.arity = arity;
    this.solverLevel = solverLevel;
  }

  public String getSymbol() {
    return symbol;
  }

  /** @return the number of arguments, or {@link #VARIADIC} */
  public int getArity() {
    return arity;
  }

  public boolean isSolverLevel() {
    return solverLevel;
  }

  public boolean acceptsArity(int n) {
    return arity == VARIADIC || arity == n;
  }
}
