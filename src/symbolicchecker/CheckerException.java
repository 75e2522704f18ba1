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
 * The root of the errors raised by the model checking core. These are fatal to
 * the current step: they signal a broken front-end contract, a gap in the rule
 * set or a constraint the solver cannot take.
 *
 * @author The tla-symbolic-checker Authors
 */
public class CheckerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public CheckerException(String message) {
    super(message);
  }

  public CheckerException(String message, Throwable cause) {
    super(message, cause);
  }
}
