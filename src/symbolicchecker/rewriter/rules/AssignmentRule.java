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

import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.rewriter.RewriterException;
import symbolicchecker.rewriter.RewritingRule;
import symbolicchecker.rewriter.RuleMisuseException;
import symbolicchecker.rewriter.SymbState;
import symbolicchecker.rewriter.SymbStateRewriter;

/**
 * Rewrites {@code x' := e}: binds {@code x'} to the cell of {@code e} and
 * yields TRUE. A name may be assigned once per step.
 *
 * @author The tla-symbolic-checker Authors
 */
public class AssignmentRule implements RewritingRule {
  private final SymbStateRewriter rewriter;

  public AssignmentRule(SymbStateRewriter rewriter) {
    this.rewriter = rewriter;
  }

  @Override
  public boolean isApplicable(SymbState state) {
    return state.getEx() instanceof OperEx
        && ((OperEx) state.getEx()).getOper() == TlaOper.ASSIGN;
  }

  @Override
  public SymbState apply(SymbState state) {
    if (!isApplicable(state)) {
      throw new RuleMisuseException("not an assignment", state.getEx());
    }
    OperEx assign = (OperEx) state.getEx();
    String name = ((NameEx) assign.getArg(0)).getName();
    if (state.getBinding().contains(name)) {
      throw new RewriterException(name + " is assigned twice", assign);
    }
    SymbState valueState =
        rewriter.rewriteUntilDone(state.setRex(assign.getArg(1)));
    return valueState
        .setBinding(valueState.getBinding().with(name, valueState.asCell()))
        .setRex(valueState.getArena().cellTrue().toNameEx());
  }
}
