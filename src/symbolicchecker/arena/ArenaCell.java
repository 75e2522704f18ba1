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

package symbolicchecker.arena;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.TlaEx;

/**
 * A symbolic memory location standing for one specification value. Cells are
 * numbered by the arena that allocated them and never change afterwards.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class ArenaCell {
  /** Prefix of the names that refer to cells in expressions */
  public static final String NAME_PREFIX = "$C$";

  private final int id;
  private final CellT type;

  ArenaCell(int id, CellT type) {
    this.id = id;
    this.type = Preconditions.checkNotNull(type);
  }

  public int getId() {
    return id;
  }

  public CellT getType() {
    return type;
  }

  /** @return a name expression referring to this cell, tagged with its type */
  public NameEx toNameEx() {
    return new NameEx(toString(), type, null);
  }

  public static boolean isCellName(String name) {
    return name.startsWith(NAME_PREFIX);
  }

  /** @return true if {@code ex} is a reference to a cell */
  public static boolean isCellRef(TlaEx ex) {
    return ex instanceof NameEx && isCellName(((NameEx) ex).getName());
  }

  /**
   * @return the identity encoded in a cell name
   * @throws IllegalArgumentException if the name does not refer to a cell
   */
  public static int idFromName(String name) {
    Preconditions.checkArgument(isCellName(name), "not a cell name: %s", name);
    try {
      return Integer.parseInt(name.substring(NAME_PREFIX.length()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a cell name: " + name, e);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ArenaCell)) {
      return false;
    }
    ArenaCell other = (ArenaCell) obj;
    return id == other.id && type.equals(other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(id, type);
  }

  @Override
  public String toString() {
    return NAME_PREFIX + id;
  }
}
