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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import symbolicchecker.rewriter.Binding;

import java.util.List;

/**
 * The outcome of a {@link BoundedSearch}.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class SearchResult {
  /** What the search found */
  public enum Kind {
    /** no state within the bound violates the invariant */
    NO_ERROR,
    /** some state may violate the invariant; see the trace */
    COUNTEREXAMPLE,
    /**
     * no violation was found, but the solver could not decide some query, so
     * one may exist
     */
    UNKNOWN
  }

  private final Kind kind;
  private final ImmutableList<Binding> trace;
  private final ImmutableList<Integer> transitions;

  private SearchResult(Kind kind, List<Binding> trace,
      List<Integer> transitions) {
    this.kind = kind;
    this.trace = ImmutableList.copyOf(trace);
    this.transitions = ImmutableList.copyOf(transitions);
  }

  public static SearchResult noError() {
    return new SearchResult(Kind.NO_ERROR, ImmutableList.<Binding>of(),
        ImmutableList.<Integer>of());
  }

  public static SearchResult unknown() {
    return new SearchResult(Kind.UNKNOWN, ImmutableList.<Binding>of(),
        ImmutableList.<Integer>of());
  }

  /**
   * @param trace the bindings of the states from the initial one to the
   *        violating one
   * @param transitions the index of the transition taken at each step after
   *        the initial one
   */
  public static SearchResult counterexample(List<Binding> trace,
      List<Integer> transitions) {
    return new SearchResult(Kind.COUNTEREXAMPLE, trace, transitions);
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the states of a counterexample, or an empty list */
  public ImmutableList<Binding> getTrace() {
    return trace;
  }

  /** @return the transitions of a counterexample, or an empty list */
  public ImmutableList<Integer> getTransitions() {
    return transitions;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("transitions", transitions)
        .add("trace", trace)
        .toString();
  }
}
