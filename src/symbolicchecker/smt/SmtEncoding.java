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

package symbolicchecker.smt;

/**
 * How set membership is expressed to the solver. Fixed for a whole run: rules
 * emit shapes that only one encoding understands.
 *
 * @author The tla-symbolic-checker Authors
 */
public enum SmtEncoding {
  /** a set is an array from element identities to Booleans */
  ARRAYS,
  /** every (element, set) pair has its own Boolean constant */
  ORACLES;

  /**
   * @param text {@code arrays} or {@code oracles}, in any case
   * @throws IllegalArgumentException for any other text
   */
  public static SmtEncoding parse(String text) {
    for (SmtEncoding encoding : values()) {
      if (encoding.name().equalsIgnoreCase(text.trim())) {
        return encoding;
      }
    }
    throw new IllegalArgumentException(
        "unexpected SMT encoding: " + text + ", expected arrays or oracles");
  }
}
