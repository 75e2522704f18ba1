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

import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.ValEx;

/**
 * Shape checks shared by all solver contexts, so that a malformed constraint
 * is rejected when it is asserted, whatever solver sits behind the context.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class GroundExprs {
  private GroundExprs() {}

  /**
   * Checks that {@code ex} is a Boolean ground constraint in the given
   * encoding.
   *
   * @throws ConstraintEncodingException otherwise
   */
  public static void checkConstraint(TlaEx ex, SmtEncoding encoding) {
    if (kindOf(ex, encoding) != Kind.BOOL) {
      throw new ConstraintEncodingException("not a Boolean constraint", ex);
    }
  }

  /** @return the identity of the cell that {@code ex} refers to */
  public static int cellId(TlaEx ex) {
    return ArenaCell.idFromName(((NameEx) ex).getName());
  }

  /** The sort of a well-formed ground term. */
  enum Kind {
    BOOL, INT, SET
  }

  static Kind kindOf(TlaEx ex, SmtEncoding encoding) {
    if (ex instanceof ValEx) {
      return ((ValEx) ex).isBool() ? Kind.BOOL : Kind.INT;
    }
    if (ex instanceof NameEx) {
      return cellKind(ex);
    }
    OperEx oper = (OperEx) ex;
    switch (oper.getOper()) {
      case AND:
      case OR:
      case NOT:
      case IFF:
        for (TlaEx arg : oper.getArgs()) {
          expect(arg, Kind.BOOL, encoding);
        }
        return Kind.BOOL;

      case EQ:
        Kind left = kindOf(oper.getArg(0), encoding);
        if (left == Kind.SET) {
          throw new ConstraintEncodingException("set equality", ex);
        }
        expect(oper.getArg(1), left, encoding);
        return Kind.BOOL;

      case SELECT_IN_SET:
        expectCell(oper.getArg(0));
        expect(oper.getArg(1), Kind.SET, encoding);
        if (encoding == SmtEncoding.ORACLES) {
          expectCell(oper.getArg(1));
        }
        return Kind.BOOL;

      case STORE_IN_SET:
        expectArrays(ex, encoding);
        expectCell(oper.getArg(0));
        expect(oper.getArg(1), Kind.SET, encoding);
        expect(oper.getArg(2), Kind.BOOL, encoding);
        return Kind.SET;

      case STORE_LAST:
        expectArrays(ex, encoding);
        expectCell(oper.getArg(0));
        expect(oper.getArg(0), Kind.SET, encoding);
        expect(oper.getArg(1), Kind.SET, encoding);
        return Kind.BOOL;

      case EMPTY_SET:
        expectArrays(ex, encoding);
        if (!ex.getTypeTag().isFinSet()) {
          throw new ConstraintEncodingException("untyped empty set", ex);
        }
        return Kind.SET;

      default:
        throw new ConstraintEncodingException(
            "operator " + oper.getOper() + " cannot be sent to a solver", ex);
    }
  }

  private static Kind cellKind(TlaEx ex) {
    if (!ArenaCell.isCellRef(ex)) {
      throw new ConstraintEncodingException("free name in a constraint", ex);
    }
    CellT type = ex.getTypeTag();
    if (type.equals(CellT.bool())) {
      return Kind.BOOL;
    } else if (type.equals(CellT.integer())) {
      return Kind.INT;
    } else if (type.isFinSet()) {
      return Kind.SET;
    }
    throw new ConstraintEncodingException(
        "cells of type " + type + " have no solver sort", ex);
  }

  private static void expect(TlaEx ex, Kind kind, SmtEncoding encoding) {
    Kind actual = kindOf(ex, encoding);
    if (actual != kind) {
      throw new ConstraintEncodingException(
          "expected a " + kind + " term, found " + actual, ex);
    }
  }

  private static void expectCell(TlaEx ex) {
    if (!ArenaCell.isCellRef(ex)) {
      throw new ConstraintEncodingException("expected a cell", ex);
    }
  }

  private static void expectArrays(TlaEx ex, SmtEncoding encoding) {
    if (encoding != SmtEncoding.ARRAYS) {
      throw new ConstraintEncodingException(
          "array operator in the " + encoding + " encoding", ex);
    }
  }
}
