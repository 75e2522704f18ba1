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

package symbolicchecker.search;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import symbolicchecker.ir.TlaEx;

import java.util.List;

/**
 * A system to check: an initial predicate over primed variables, the
 * alternative next-state transitions, and a state invariant over unprimed
 * variables.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class TransitionSystem {
  private final TlaEx init;
  private final ImmutableList<TlaEx> nextAlternatives;
  private final TlaEx invariant;

  public TransitionSystem(TlaEx init, List<? extends TlaEx> nextAlternatives,
      TlaEx invariant) {
    this.init = Preconditions.checkNotNull(init);
    this.nextAlternatives = ImmutableList.copyOf(nextAlternatives);
    this.invariant = Preconditions.checkNotNull(invariant);
  }

  public TlaEx getInit() {
    return init;
  }

  public ImmutableList<TlaEx> getNextAlternatives() {
    return nextAlternatives;
  }

  public TlaEx getInvariant() {
    return invariant;
  }
}
