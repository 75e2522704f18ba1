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

package symbolicchecker.trex;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import symbolicchecker.arena.Arena;
import symbolicchecker.rewriter.Binding;
import symbolicchecker.rewriter.SymbStateRewriter;
import symbolicchecker.smt.SolverContext;

import java.util.List;

/**
 * Owns everything one run accumulates: the rewriter with its solver context,
 * the current arena view and the history of variable bindings, one frame per
 * committed step. Contexts share nothing, so separate contexts may be used
 * from separate threads.
 *
 * @author The tla-symbolic-checker Authors
 */
public abstract class ExecutionContext {
  private final SymbStateRewriter rewriter;
  private final List<Binding> bindingHistory = Lists.newArrayList();
  private Arena arena;

  protected ExecutionContext(SolverContext solverContext) {
    this.rewriter = new SymbStateRewriter(solverContext);
    this.arena = rewriter.createArena();
  }

  /**
   * @return true if constraints reach the solver as soon as they are
   *         asserted, so that checking after each step expression is cheap
   */
  public abstract boolean streamsConstraints();

  public SymbStateRewriter getRewriter() {
    return rewriter;
  }

  public SolverContext getSolverContext() {
    return rewriter.getSolverContext();
  }

  public Arena getArena() {
    return arena;
  }

  void setArena(Arena arena) {
    Preconditions.checkArgument(arena.sameLineage(this.arena),
        "%s belongs to another context", arena);
    this.arena = arena;
  }

  public ImmutableList<Binding> getBindingHistory() {
    return ImmutableList.copyOf(bindingHistory);
  }

  /** @return the binding of the last committed step, or the empty binding */
  public Binding currentBinding() {
    return bindingHistory.isEmpty()
        ? Binding.empty() : bindingHistory.get(bindingHistory.size() - 1);
  }

  void pushBinding(Binding binding) {
    bindingHistory.add(binding);
  }

  ExecutionSnapshot snapshot(int id, int stepNo) {
    return new ExecutionSnapshot(id, arena, rewriter.contextLevel(),
        bindingHistory.size(), stepNo);
  }

  /** Truncates the arena, the scopes and the binding history. */
  void restore(ExecutionSnapshot snapshot) {
    Preconditions.checkArgument(snapshot.getContextLevel()
        <= rewriter.contextLevel(), "%s is ahead of this context", snapshot);
    rewriter.pop(rewriter.contextLevel() - snapshot.getContextLevel());
    snapshot.getArena().discardFuture();
    setArena(snapshot.getArena());
    while (bindingHistory.size() > snapshot.getBindingDepth()) {
      bindingHistory.remove(bindingHistory.size() - 1);
    }
  }

  public void dispose() {
    rewriter.dispose();
  }
}
