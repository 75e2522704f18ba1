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
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Static factories for expression nodes. Boolean-valued operators get the
 * {@code Bool} type tag; set constructors get their set type once it is known.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class Tla {
  private Tla() {}

  public static NameEx name(String name) {
    return new NameEx(name);
  }

  /** @return the next-state copy of a variable, e.g. {@code x'} */
  public static NameEx prime(String name) {
    return new NameEx(name + "'");
  }

  public static ValEx bool(boolean value) {
    return ValEx.ofBool(value);
  }

  public static ValEx integer(long value) {
    return ValEx.ofInt(value);
  }

  public static OperEx and(TlaEx... args) {
    return boolOper(TlaOper.AND, ImmutableList.copyOf(args));
  }

  public static OperEx and(List<? extends TlaEx> args) {
    return boolOper(TlaOper.AND, args);
  }

  public static OperEx or(TlaEx... args) {
    return boolOper(TlaOper.OR, ImmutableList.copyOf(args));
  }

  public static OperEx or(List<? extends TlaEx> args) {
    return boolOper(TlaOper.OR, args);
  }

  public static OperEx not(TlaEx arg) {
    return boolOper(TlaOper.NOT, ImmutableList.of(arg));
  }

  public static OperEx eq(TlaEx left, TlaEx right) {
    return boolOper(TlaOper.EQ, ImmutableList.of(left, right));
  }

  public static OperEx in(TlaEx elem, TlaEx set) {
    return boolOper(TlaOper.IN, ImmutableList.of(elem, set));
  }

  /** A non-empty set enumeration; its type is found during rewriting. */
  public static OperEx enumSet(TlaEx... elems) {
    Preconditions.checkArgument(elems.length > 0,
        "use emptySet(elemType) for the empty set");
    return new OperEx(TlaOper.ENUM_SET, elems);
  }

  public static OperEx emptySet(CellT elemType) {
    return new OperEx(TlaOper.ENUM_SET, ImmutableList.<TlaEx>of(),
        CellT.finSet(elemType), null);
  }

  /** {@code {varName \in set: pred}} */
  public static OperEx filter(String varName, TlaEx set, TlaEx pred) {
    return new OperEx(TlaOper.FILTER, name(varName), set, pred);
  }

  /** {@code primedName := value}, e.g. {@code assign("x'", e)} */
  public static OperEx assign(String primedName, TlaEx value) {
    return boolOper(TlaOper.ASSIGN,
        ImmutableList.of(name(primedName), value));
  }

  public static OperEx iff(TlaEx left, TlaEx right) {
    return boolOper(TlaOper.IFF, ImmutableList.of(left, right));
  }

  public static OperEx selectInSet(TlaEx elem, TlaEx set) {
    return boolOper(TlaOper.SELECT_IN_SET, ImmutableList.of(elem, set));
  }

  public static OperEx storeInSet(TlaEx elem, TlaEx base, TlaEx cond) {
    return new OperEx(TlaOper.STORE_IN_SET, ImmutableList.of(elem, base, cond),
        base.getTypeTag(), null);
  }

  public static OperEx storeLast(TlaEx set, TlaEx chain) {
    return boolOper(TlaOper.STORE_LAST, ImmutableList.of(set, chain));
  }

  /** The empty array a chain of stores starts from. */
  public static OperEx emptySetConst(CellT setType) {
    return new OperEx(TlaOper.EMPTY_SET, ImmutableList.<TlaEx>of(), setType,
        null);
  }

  private static OperEx boolOper(TlaOper oper, List<? extends TlaEx> args) {
    return new OperEx(oper, args, CellT.bool(), null);
  }
}
