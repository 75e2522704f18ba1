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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import symbolicchecker.arena.ArenaCell;

import java.util.Map;

/**
 * An immutable mapping from variable names to the cells that stand for their
 * values. Names keep the order in which they were first bound.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class Binding {
  private static final Binding EMPTY =
      new Binding(ImmutableMap.<String, ArenaCell>of());

  private final ImmutableMap<String, ArenaCell> map;

  private Binding(ImmutableMap<String, ArenaCell> map) {
    this.map = map;
  }

  public static Binding empty() {
    return EMPTY;
  }

  public static Binding of(Map<String, ArenaCell> map) {
    return new Binding(ImmutableMap.copyOf(map));
  }

  /** @return a binding where {@code name} maps to {@code cell} */
  public Binding with(String name, ArenaCell cell) {
    Preconditions.checkNotNull(cell);
    Map<String, ArenaCell> copy = Maps.newLinkedHashMap(map);
    copy.put(name, cell);
    return new Binding(ImmutableMap.copyOf(copy));
  }

  /** @return a binding without {@code name} */
  public Binding without(String name) {
    if (!map.containsKey(name)) {
      return this;
    }
    Map<String, ArenaCell> copy = Maps.newLinkedHashMap(map);
    copy.remove(name);
    return new Binding(ImmutableMap.copyOf(copy));
  }

  /** @return the cell bound to {@code name}, or null */
  public ArenaCell get(String name) {
    return map.get(name);
  }

  public boolean contains(String name) {
    return map.containsKey(name);
  }

  public ImmutableSet<String> names() {
    return map.keySet();
  }

  public ImmutableSet<String> primedNames() {
    ImmutableSet.Builder<String> primed = ImmutableSet.builder();
    for (String name : map.keySet()) {
      if (isPrimed(name)) {
        primed.add(name);
      }
    }
    return primed.build();
  }

  /**
   * Moves the next-state values into place: every {@code x'} becomes
   * {@code x}, and an unprimed {@code x} without a primed counterpart keeps
   * its cell.
   */
  public Binding shiftPrimed() {
    Map<String, ArenaCell> shifted = Maps.newLinkedHashMap();
    for (Map.Entry<String, ArenaCell> entry : map.entrySet()) {
      if (!isPrimed(entry.getKey())) {
        shifted.put(entry.getKey(), entry.getValue());
      }
    }
    for (Map.Entry<String, ArenaCell> entry : map.entrySet()) {
      if (isPrimed(entry.getKey())) {
        String name = entry.getKey();
        shifted.put(name.substring(0, name.length() - 1), entry.getValue());
      }
    }
    return new Binding(ImmutableMap.copyOf(shifted));
  }

  public ImmutableMap<String, ArenaCell> asMap() {
    return map;
  }

  public int size() {
    return map.size();
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  private static boolean isPrimed(String name) {
    return name.endsWith("'");
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Binding && map.equals(((Binding) obj).map);
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public String toString() {
    return map.toString();
  }
}
