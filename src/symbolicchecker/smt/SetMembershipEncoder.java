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

import com.google.common.base.Preconditions;

import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;

import java.util.List;

/**
 * Builds the constraints that tie the membership of a set cell to its
 * potential elements. One implementation exists per {@link SmtEncoding}.
 *
 * @author The tla-symbolic-checker Authors
 */
public abstract class SetMembershipEncoder {
  private final SmtEncoding encoding;

  private SetMembershipEncoder(SmtEncoding encoding) {
    this.encoding = encoding;
  }

  public static SetMembershipEncoder forEncoding(SmtEncoding encoding) {
    switch (encoding) {
      case ARRAYS:
        return new ArraysEncoder();
      case ORACLES:
        return new OraclesEncoder();
      default:
        throw new IllegalArgumentException("unknown encoding " + encoding);
    }
  }

  public SmtEncoding getEncoding() {
    return encoding;
  }

  /** @return the Boolean term stating that {@code elem} is in {@code set} */
  public TlaEx membership(ArenaCell elem, ArenaCell set) {
    return Tla.selectInSet(elem.toNameEx(), set.toNameEx());
  }

  /**
   * Builds one constraint stating that, for every i, {@code elems.get(i)} is
   * in {@code set} exactly when {@code conds.get(i)} holds, and that nothing
   * else is.
   *
   * @return the constraint, or null if there is nothing to assert
   */
  public TlaEx defineMembers(ArenaCell set, List<ArenaCell> elems,
      List<? extends TlaEx> conds) {
    Preconditions.checkArgument(elems.size() == conds.size(),
        "%s elements but %s conditions", elems.size(), conds.size());
    return encode(set, elems, conds);
  }

  abstract TlaEx encode(ArenaCell set, List<ArenaCell> elems,
      List<? extends TlaEx> conds);

  /**
   * A chain of stores over the empty array, bound to the set by a single
   * {@code STORE_LAST}. The innermost store is the last element.
   */
  private static final class ArraysEncoder extends SetMembershipEncoder {
    ArraysEncoder() {
      super(SmtEncoding.ARRAYS);
    }

    @Override
    TlaEx encode(ArenaCell set, List<ArenaCell> elems,
        List<? extends TlaEx> conds) {
      TlaEx chain = Tla.emptySetConst(set.getType());
      for (int i = elems.size() - 1; i >= 0; i--) {
        chain = Tla.storeInSet(elems.get(i).toNameEx(), chain, conds.get(i));
      }
      return Tla.storeLast(set.toNameEx(), chain);
    }
  }

  /** A right-nested conjunction of one equivalence per element. */
  private static final class OraclesEncoder extends SetMembershipEncoder {
    OraclesEncoder() {
      super(SmtEncoding.ORACLES);
    }

    @Override
    TlaEx encode(ArenaCell set, List<ArenaCell> elems,
        List<? extends TlaEx> conds) {
      TlaEx result = null;
      for (int i = elems.size() - 1; i >= 0; i--) {
        TlaEx iff = Tla.iff(membership(elems.get(i), set), conds.get(i));
        result = result == null ? iff : Tla.and(iff, result);
      }
      return result;
    }
  }
}
