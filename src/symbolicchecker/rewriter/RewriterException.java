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

import symbolicchecker.CheckerException;
import symbolicchecker.ir.TlaEx;

/**
 * An error in rewriting an expression. The message names the expression and,
 * when known, its source location.
 *
 * @author The tla-symbolic-checker Authors
 */
public class RewriterException extends CheckerException {
  private static final long serialVersionUID = 1L;

  private final transient TlaEx ex;

  public RewriterException(String message, TlaEx ex) {
    super(describe(message, ex));
    this.ex = ex;
  }

  /** @return the expression that could not be rewritten */
  public TlaEx getEx() {
    return ex;
  }

  private static String describe(String message, TlaEx ex) {
    if (ex.getLocation() == null) {
      return message + ": " + ex;
    }
    return message + ": " + ex + " at " + ex.getLocation();
  }
}
