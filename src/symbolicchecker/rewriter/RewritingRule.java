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

/**
 * Rewriting logic for one shape of expression. The rewriter tries its rules
 * in order and applies the first one that is applicable.
 *
 * @author The tla-symbolic-checker Authors
 */
public interface RewritingRule {
  /** @return true if this rule handles the expression of {@code state} */
  boolean isApplicable(SymbState state);

  /**
   * Rewrites the expression of {@code state}, possibly extending its arena
   * and asserting constraints.
   *
   * @return a state whose expression differs from the input one; usually a
   *         cell reference
   * @throws RuleMisuseException if the rule is not applicable to
   *         {@code state}
   */
  SymbState apply(SymbState state);
}
