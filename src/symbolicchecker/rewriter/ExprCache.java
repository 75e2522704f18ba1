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

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.TlaEx;

/**
 * Cells of constant expressions, keyed by the unique id of the source node, so
 * that a constant is rewritten only once per scope.
 *
 * @author The tla-symbolic-checker Authors
 */
public class ExprCache extends LeveledCache<Long> {
  public ArenaCell get(TlaEx ex, Arena arena) {
    return lookup(ex.getUid(), arena);
  }

  public void put(TlaEx ex, ArenaCell cell) {
    store(ex.getUid(), cell);
  }
}
