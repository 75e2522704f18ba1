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

import com.google.common.base.Preconditions;

/**
 * A reference to a variable, a bound name or, after rewriting, an arena cell.
 * A name ending with a prime refers to the next-state copy of a variable.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class NameEx extends TlaEx {
  private final String name;

  public NameEx(String name) {
    this(name, null, null);
  }

  public NameEx(String name, CellT typeTag, SourceLocation location) {
    super(typeTag, location);
    Preconditions.checkArgument(name != null && !name.isEmpty(),
        "empty name");
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public boolean isPrimed() {
    return name.endsWith("'");
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitName(this);
  }

  @Override
  public String toString() {
    return name;
  }
}
