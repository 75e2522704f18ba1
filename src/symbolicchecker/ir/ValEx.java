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
 * A Boolean or integer literal.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class ValEx extends TlaEx {
  private final Object value;

  private ValEx(Object value, CellT typeTag, SourceLocation location) {
    super(typeTag, location);
    this.value = value;
  }

  public static ValEx ofBool(boolean value) {
    return ofBool(value, null);
  }

  public static ValEx ofBool(boolean value, SourceLocation location) {
    return new ValEx(value, CellT.bool(), location);
  }

  public static ValEx ofInt(long value) {
    return ofInt(value, null);
  }

  public static ValEx ofInt(long value, SourceLocation location) {
    return new ValEx(value, CellT.integer(), location);
  }

  public boolean isBool() {
    return value instanceof Boolean;
  }

  public boolean isInt() {
    return value instanceof Long;
  }

  /** @throws ClassCastException if this is not a Boolean literal */
  public boolean boolValue() {
    return (Boolean) value;
  }

  /** @throws ClassCastException if this is not an integer literal */
  public long intValue() {
    return (Long) value;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitVal(this);
  }

  @Override
  public String toString() {
    if (isBool()) {
      return boolValue() ? "TRUE" : "FALSE";
    }
    return value.toString();
  }
}
