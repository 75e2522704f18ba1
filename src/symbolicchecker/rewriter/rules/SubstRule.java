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

package symbolicchecker.rewriter.rules;

import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.NameEx;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;

/**
 * Replaces a bound variable with its cell.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SubstRule implements RewritingRule {
  public SubstRule(SymbStateRewriter rewriter) {}

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof NameEx
        && !ArenaCell.isCellRef(state.getEx())
        && state.getBinding().contains(((NameEx) state.getEx()).getName());
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not a bound name", state.getEx());
    }
    String name = ((NameEx) state.getEx()).getName();
    return state.setRex(state.getBinding().get(name).toNameEx());
  }
}
