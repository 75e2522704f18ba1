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

package symbolicchecker.ir;

/**
 * How much of the execution an expression depends on.
 *
 * @author The tla-symbolic-checker Authors
 */
public enum ExprGrade {
  /** no free names: the value is the same in every state */
  CONSTANT,
  /** refers to unprimed names only */
  STATE,
  /** refers to at least one primed name */
  ACTION;

  /** The least grade covering both arguments. */
  public ExprGrade join(ExprGrade other) {
    return compareTo(other) >= 0 ? this : other;
  }
}
