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

import java.util.Map;

/**
 * The cell made for each integer literal, so a literal has one cell.
 *
 * @author The tla-symbolic-checker Authors
 */
public class IntValueCache extends LeveledCache<Long> {
  /** @return the cell of {@code value}, or null if none was made yet */
  public ArenaCell get(long value, Arena arena) {
    return lookup(value, arena);
  }

  public void put(long value, ArenaCell cell) {
    store(value, cell);
  }

  /** @return the literal {@code cell} was made for, or null */
  public Long valueOf(ArenaCell cell) {
    for (Map.Entry<Long, Entry> entry : entries()) {
      if (entry.getValue().cell.equals(cell)) {
        return entry.getKey();
      }
    }
    return null;
  }
}
