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

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import symbolicchecker.StackableContext;
import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;

import java.util.Iterator;
import java.util.Map;

/**
 * A cache of cells whose entries remember the scope level they were added
 * at. Popping a scope drops its entries, together with the constraints the
 * solver forgot about those cells.
 *
 * @param <K> the cache key
 *
 * @author The tla-symbolic-checker Authors
 */
abstract class LeveledCache<K> implements StackableContext {
  private final Map<K, Entry> entries = Maps.newHashMap();
  private int level = 0;

  /**
   * @return the cached cell, or null if there is none or it does not belong
   *         to {@code arena}
   */
  ArenaCell lookup(K key, Arena arena) {
    Entry entry = entries.get(key);
    if (entry == null || entry.cell.getId() >= arena.cellCount()
        || !arena.findCellById(entry.cell.getId()).equals(entry.cell)) {
      return null;
    }
    return entry.cell;
  }

  void store(K key, ArenaCell cell) {
    entries.put(key, new Entry(cell, level));
  }

  Iterable<Map.Entry<K, Entry>> entries() {
    return entries.entrySet();
  }

  public int size() {
    return entries.size();
  }

  @Override
  public void push() {
    level++;
  }

  @Override
  public void pop() {
    pop(1);
  }

  @Override
  public void pop(int n) {
    Preconditions.checkArgument(n >= 0 && n <= level,
        "cannot pop %s of %s scopes", n, level);
    level -= n;
    Iterator<Entry> it = entries.values().iterator();
    while (it.hasNext()) {
      if (it.next().level > level) {
        it.remove();
      }
    }
  }

  @Override
  public int contextLevel() {
    return level;
  }

  /** A cached cell and the level it was cached at. */
  static final class Entry {
    final ArenaCell cell;
    final int level;

    Entry(ArenaCell cell, int level) {
      this.cell = cell;
      this.level = level;
    }
  }
}
