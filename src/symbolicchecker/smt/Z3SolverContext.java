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

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.ValEx;

import java.util.List;

/**
 * A wrapper around a Z3 {@link Solver}.
 * <p>
 * Boolean and integer cells become Z3 constants of the same name. Under the
 * arrays encoding a set cell is an array from element ids to Booleans; under
 * the oracles encoding each membership {@code e \in s} is its own Boolean
 * constant, {@code in_e_s}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class Z3SolverContext implements SolverContext {
  private static final Logger logger =
      LoggerFactory.getLogger(Z3SolverContext.class);

  private final SolverConfig config;
  private final Context context;
  private final Solver solver;
  private final IntSort intSort;
  private final BoolSort boolSort;

  private int level = 0;

  /** Set while {@link #checkSat()} is inside Z3 */
  private volatile boolean checking;

  /** The model of the last satisfiable check, or null */
  private Model model;

  public Z3SolverContext(SolverConfig config) {
    this.config = Preconditions.checkNotNull(config);
    context = new Context();
    solver = context.mkSolver();
    intSort = context.getIntSort();
    boolSort = context.getBoolSort();
    if (config.getTimeoutSeconds() > 0 || config.getRandomSeed() != 0) {
      Params params = context.mkParams();
      if (config.getTimeoutSeconds() > 0) {
        params.add("timeout", config.getTimeoutSeconds() * 1000);
      }
      if (config.getRandomSeed() != 0) {
        params.add("random_seed", config.getRandomSeed());
      }
      solver.setParameters(params);
    }
    logger.debug("created Z3 context with {}", config);
  }

  @Override
  public SolverConfig config() {
    return config;
  }

  @Override
  public void assertGroundExpr(TlaEx ex) {
    GroundExprs.checkConstraint(ex, config.getSmtEncoding());
    Expr<BoolSort> formula = toBool(ex);
    if (config.isDebug()) {
      logger.debug("assert {}", formula);
    }
    solver.add(formula);
    model = null;
  }

  @Override
  public SatResult checkSat() {
    Status status;
    checking = true;
    try {
      status = solver.check();
    } finally {
      checking = false;
    }
    switch (status) {
      case SATISFIABLE:
        model = solver.getModel();
        return SatResult.SAT;
      case UNSATISFIABLE:
        model = null;
        return SatResult.UNSAT;
      default:
        model = null;
        logger.warn("Z3 returned UNKNOWN: {}", solver.getReasonUnknown());
        return SatResult.UNKNOWN;
    }
  }

  @Override
  public TlaEx evalGroundExpr(TlaEx ex) {
    if (model == null) {
      throw new IllegalStateException("no model: the last check was not SAT");
    }
    GroundExprs.Kind kind = GroundExprs.kindOf(ex, config.getSmtEncoding());
    switch (kind) {
      case BOOL:
        return ValEx.ofBool(model.eval(toBool(ex), true).isTrue());
      case INT:
        Expr<IntSort> value = model.eval(toInt(ex), true);
        return ValEx.ofInt(((IntNum) value).getInt64());
      default:
        throw new ConstraintEncodingException("cannot evaluate a set", ex);
    }
  }

  /** Cancels the running check through {@link Context#interrupt()}. */
  @Override
  public void interrupt() {
    if (checking) {
      logger.debug("interrupting Z3");
      context.interrupt();
    }
  }

  @Override
  public void push() {
    solver.push();
    level++;
  }

  @Override
  public void pop() {
    pop(1);
  }

  @Override
  public void pop(int n) {
    Preconditions.checkArgument(n >= 0 && n <= level,
        "cannot pop %s of %s scopes", n, level);
    if (n > 0) {
      solver.pop(n);
      level -= n;
      model = null;
    }
  }

  @Override
  public int contextLevel() {
    return level;
  }

  @Override
  public void dispose() {
    model = null;
    context.close();
  }

  private Expr<?> toZ3(TlaEx ex) {
    if (ex instanceof ValEx) {
      ValEx val = (ValEx) ex;
      if (val.isBool()) {
        return context.mkBool(val.boolValue());
      }
      return context.mkInt(val.intValue());
    }
    if (ex instanceof NameEx) {
      return cellConst((NameEx) ex);
    }
    OperEx oper = (OperEx) ex;
    List<TlaEx> args = oper.getArgs();
    switch (oper.getOper()) {
      case AND:
        return context.mkAnd(toBools(args));
      case OR:
        return context.mkOr(toBools(args));
      case NOT:
        return context.mkNot(toBool(args.get(0)));
      case IFF:
        return context.mkIff(toBool(args.get(0)), toBool(args.get(1)));
      case EQ:
        if (GroundExprs.kindOf(args.get(0), config.getSmtEncoding())
            == GroundExprs.Kind.INT) {
          return context.mkEq(toInt(args.get(0)), toInt(args.get(1)));
        }
        return context.mkEq(toBool(args.get(0)), toBool(args.get(1)));
      case SELECT_IN_SET:
        if (config.getSmtEncoding() == SmtEncoding.ORACLES) {
          return context.mkBoolConst("in_" + GroundExprs.cellId(args.get(0))
              + "_" + GroundExprs.cellId(args.get(1)));
        }
        return context.mkSelect(toArray(args.get(1)), elemIndex(args.get(0)));
      case STORE_IN_SET:
        return context.mkStore(toArray(args.get(1)), elemIndex(args.get(0)),
            toBool(args.get(2)));
      case STORE_LAST:
        return context.mkEq(toArray(args.get(0)), toArray(args.get(1)));
      case EMPTY_SET:
        return context.mkConstArray(intSort, context.mkFalse());
      default:
        throw new ConstraintEncodingException("no Z3 counterpart", ex);
    }
  }

  private Expr<?> cellConst(NameEx cell) {
    CellT type = cell.getTypeTag();
    if (type.equals(CellT.bool())) {
      return context.mkBoolConst(cell.getName());
    } else if (type.equals(CellT.integer())) {
      return context.mkIntConst(cell.getName());
    }
    return context.mkArrayConst(cell.getName(), intSort, boolSort);
  }

  /** Elements are indexed by the identity of their cell. */
  private Expr<IntSort> elemIndex(TlaEx elem) {
    return context.mkInt(GroundExprs.cellId(elem));
  }

  @SuppressWarnings("unchecked")
  private Expr<BoolSort> toBool(TlaEx ex) {
    return (Expr<BoolSort>) toZ3(ex);
  }

  @SuppressWarnings("unchecked")
  private Expr<IntSort> toInt(TlaEx ex) {
    return (Expr<IntSort>) toZ3(ex);
  }

  @SuppressWarnings("unchecked")
  private Expr<ArraySort<IntSort, BoolSort>> toArray(TlaEx ex) {
    return (Expr<ArraySort<IntSort, BoolSort>>) toZ3(ex);
  }

  @SuppressWarnings("unchecked")
  private Expr<BoolSort>[] toBools(List<TlaEx> args) {
    Expr<BoolSort>[] result = new Expr[args.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = toBool(args.get(i));
    }
    return result;
  }
}
