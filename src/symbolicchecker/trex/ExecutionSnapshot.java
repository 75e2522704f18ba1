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

import com.google.common.base.MoreObjects;

import symbolicchecker.arena.Arena;

/**
 * The extent of an execution context at one moment: its arena view, the
 * scope level of its rewriter and solver, and the depth of its binding
 * history. Restoring a snapshot truncates the context back to that extent.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class ExecutionSnapshot {
  private final int id;
  private final Arena arena;
  private final int contextLevel;
  private final int bindingDepth;
  private final int stepNo;

  ExecutionSnapshot(int id, Arena arena, int contextLevel, int bindingDepth,
      int stepNo) {
    this.id = id;
    this.arena = arena;
    this.contextLevel = contextLevel;
    this.bindingDepth = bindingDepth;
    this.stepNo = stepNo;
  }

  public int getId() {
    return id;
  }

  public Arena getArena() {
    return arena;
  }

  public int getContextLevel() {
    return contextLevel;
  }

  public int getBindingDepth() {
    return bindingDepth;
  }

  public int getStepNo() {
    return stepNo;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("arena", arena)
        .add("contextLevel", contextLevel)
        .add("bindingDepth", bindingDepth)
        .add("stepNo", stepNo)
        .toString();
  }
}
