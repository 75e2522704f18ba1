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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.TlaEx;

/**
 * The unit of work of the rewriter: an expression, the arena its cells live
 * in, and the binding of the names in scope. A state is normalized when its
 * expression is a single cell reference. States are immutable; the setters
 * return modified copies.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class SymbState {
  private final TlaEx ex;
  private final Arena arena;
  private final Binding binding;

  public SymbState(TlaEx ex, Arena arena, Binding binding) {
    this.ex = Preconditions.checkNotNull(ex);
    this.arena = Preconditions.checkNotNull(arena);
    this.binding = Preconditions.checkNotNull(binding);
  }

  public TlaEx getEx() {
    return ex;
  }

  public Arena getArena() {
    return arena;
  }

  public Binding getBinding() {
    return binding;
  }

  public SymbState setRex(TlaEx newEx) {
    return new SymbState(newEx, arena, binding);
  }

  public SymbState setArena(Arena newArena) {
    return new SymbState(ex, newArena, binding);
  }

  public SymbState setBinding(Binding newBinding) {
    return new SymbState(ex, arena, newBinding);
  }

  public boolean isNormalized() {
    return ArenaCell.isCellRef(ex);
  }

  /**
   * @return the cell a normalized state refers to
   * @throws symbolicchecker.arena.UnknownCellException if the state is not
   *         normalized or its cell is not in the arena
   */
  public ArenaCell asCell() {
    return arena.findCellByNameEx(ex);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("ex", ex)
        .add("arena", arena)
        .add("binding", binding)
        .toString();
  }
}
