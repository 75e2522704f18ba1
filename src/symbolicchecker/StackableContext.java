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

package symbolicchecker;

/**
 * Something that accumulates facts in nested scopes. Popping a scope forgets
 * everything added since the matching push.
 *
 * @author The tla-symbolic-checker Authors
 */
public interface StackableContext {
  /** Saves the current state. */
  void push();

  /** Reverts to the state saved by the last {@link #push()}. */
  void pop();

  /** Pops {@code n} scopes at once. */
  void pop(int n);

  /** @return the number of scopes pushed and not yet popped */
  int contextLevel();
}
