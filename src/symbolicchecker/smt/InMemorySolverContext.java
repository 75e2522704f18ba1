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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.CellT;
import symbolicchecker.ir.NameEx;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.ir.TlaOper;
import symbolicchecker.ir.ValEx;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

/**
 * A solver context that decides small constraint sets on its own, without a
 * native solver.
 * <p>
 * Integer cells must be pinned to literals by top-level equalities, and sets
 * cannot be compared with each other; everything else is Boolean. The free
 * Boolean atoms are Boolean cells and the memberships that no
 * {@code STORE_LAST} defines. They are decided by a backtracking search that
 * evaluates every constraint in three-valued logic after each decision. When
 * the search runs out of budget, meets an unpinned integer cell, or is
 * interrupted, the answer is {@link SatResult#UNKNOWN}. An interrupt is either
 * {@link #interrupt()} or an interrupt of the checking thread.
 * <p>
 * This backend exists for tests and small examples. Real runs use Z3.
 *
 * @author The tla-symbolic-checker Authors
 */
public class InMemorySolverContext implements SolverContext {
  private static final Logger logger =
      LoggerFactory.getLogger(InMemorySolverContext.class);

  /** How many decisions a single check may make */
  static final int MAX_DECISIONS = 1 << 20;

  private final SolverConfig config;

  /** The assertions of each open scope; the first is the base scope */
  private final List<List<TlaEx>> frames = Lists.newArrayList();

  /** The model of the last satisfiable check, or null */
  private Model model;

  private boolean disposed;

  /** Set by {@link #interrupt()}, cleared when a check ends */
  private volatile boolean interruptRequested;

  public InMemorySolverContext(SolverConfig config) {
    this.config = Preconditions.checkNotNull(config);
    frames.add(Lists.<TlaEx>newArrayList());
  }

  @Override
  public SolverConfig config() {
    return config;
  }

  @Override
  public void assertGroundExpr(TlaEx ex) {
    checkLive();
    GroundExprs.checkConstraint(ex, config.getSmtEncoding());
    if (config.isDebug()) {
      logger.debug("assert {}", ex);
    }
    frames.get(frames.size() - 1).add(ex);
    model = null;
  }

  @Override
  public SatResult checkSat() {
    checkLive();
    try {
      return search();
    } finally {
      interruptRequested = false;
    }
  }

  private SatResult search() {
    List<TlaEx> constraints = Lists.newArrayList();
    for (List<TlaEx> frame : frames) {
      constraints.addAll(frame);
    }
    Model candidate = new Model(config.getSmtEncoding());
    for (TlaEx ex : conjuncts(constraints)) {
      candidate.pin(ex);
    }
    for (TlaEx ex : constraints) {
      candidate.collect(ex);
    }
    candidate.addUndefinedMembers();
    Integer unpinned = candidate.firstUnpinnedInt();
    if (unpinned != null) {
      logger.warn("integer cell {}{} has no literal value",
          ArenaCell.NAME_PREFIX, unpinned);
      return SatResult.UNKNOWN;
    }
    Search search = new Search(candidate, constraints);
    SatResult result = search.run();
    if (result == SatResult.SAT) {
      model = candidate;
    } else if (result == SatResult.UNKNOWN) {
      logger.warn("gave up after {} decisions over {} atoms",
          search.decisions, candidate.atoms.size());
    }
    return result;
  }

  @Override
  public TlaEx evalGroundExpr(TlaEx ex) {
    checkLive();
    if (model == null) {
      throw new IllegalStateException("no model: the last check was not SAT");
    }
    GroundExprs.Kind kind = GroundExprs.kindOf(ex, config.getSmtEncoding());
    switch (kind) {
      case BOOL:
        Boolean value = model.evalBool(ex);
        return ValEx.ofBool(value != null && value);
      case INT:
        return ValEx.ofInt(model.evalInt(ex));
      default:
        throw new ConstraintEncodingException("cannot evaluate a set", ex);
    }
  }

  @Override
  public void interrupt() {
    interruptRequested = true;
  }

  @Override
  public void push() {
    checkLive();
    frames.add(Lists.<TlaEx>newArrayList());
  }

  @Override
  public void pop() {
    pop(1);
  }

  @Override
  public void pop(int n) {
    checkLive();
    Preconditions.checkArgument(n >= 0 && n <= contextLevel(),
        "cannot pop %s of %s scopes", n, contextLevel());
    for (int i = 0; i < n; i++) {
      frames.remove(frames.size() - 1);
    }
    model = null;
  }

  @Override
  public int contextLevel() {
    return frames.size() - 1;
  }

  @Override
  public void dispose() {
    frames.clear();
    model = null;
    disposed = true;
  }

  private void checkLive() {
    if (disposed) {
      throw new IllegalStateException("solver context is disposed");
    }
  }

  /** Flattens the top-level conjunctions of {@code constraints}. */
  private static List<TlaEx> conjuncts(List<TlaEx> constraints) {
    List<TlaEx> result = Lists.newArrayList();
    for (TlaEx ex : constraints) {
      if (ex instanceof OperEx && ((OperEx) ex).getOper() == TlaOper.AND) {
        result.addAll(conjuncts(((OperEx) ex).getArgs()));
      } else {
        result.add(ex);
      }
    }
    return result;
  }

  private static boolean isOper(TlaEx ex, TlaOper oper) {
    return ex instanceof OperEx && ((OperEx) ex).getOper() == oper;
  }

  /** Backtracking over the atoms of a model. */
  private final class Search {
    private final Model model;
    private final List<TlaEx> constraints;
    private final List<String> order;
    private int decisions;

    Search(Model model, List<TlaEx> constraints) {
      this.model = model;
      this.constraints = constraints;
      this.order = model.atomsInOrder();
    }

    SatResult run() {
      try {
        return decide(0) ? SatResult.SAT : SatResult.UNSAT;
      } catch (GiveUp e) {
        model.values.clear();
        return SatResult.UNKNOWN;
      }
    }

    private boolean decide(int next) {
      Boolean verdict = evalAll();
      if (verdict != null) {
        return verdict;
      }
      if (next == order.size()) {
        // every atom is set, so every constraint is known
        throw new IllegalStateException("undecided constraint");
      }
      if (++decisions > MAX_DECISIONS
          || interruptRequested
          || Thread.currentThread().isInterrupted()) {
        throw new GiveUp();
      }
      String atom = order.get(next);
      for (boolean value : new boolean[] {false, true}) {
        model.values.put(atom, value);
        if (decide(next + 1)) {
          return true;
        }
      }
      model.values.remove(atom);
      return false;
    }

    /** @return false if a constraint fails, true if all hold, else null */
    private Boolean evalAll() {
      boolean allTrue = true;
      for (TlaEx ex : constraints) {
        Boolean value = model.evalBool(ex);
        if (value == null) {
          allTrue = false;
        } else if (!value) {
          return false;
        }
      }
      return allTrue ? true : null;
    }
  }

  /** Thrown inside a search that ran out of budget. */
  private static final class GiveUp extends RuntimeException {
    private static final long serialVersionUID = 1L;

    GiveUp() {
      super(null, null, false, false);
    }
  }

  /**
   * Values of integer cells, definitions of set cells and a partial
   * assignment of the Boolean atoms. Unassigned atoms evaluate to null.
   */
  private static final class Model {
    private final SmtEncoding encoding;
    private final Map<Integer, Long> pins = Maps.newHashMap();
    private final Map<Integer, TlaEx> setDefs = Maps.newHashMap();
    private final Set<Integer> intCells = Sets.newHashSet();
    private final Set<Integer> setCells = Sets.newHashSet();
    private final SortedSet<Integer> universe = Sets.newTreeSet();

    /** Atom name to the highest cell id it mentions */
    private final Map<String, Integer> atoms = Maps.newHashMap();
    private final Map<String, Boolean> values = Maps.newHashMap();

    Model(SmtEncoding encoding) {
      this.encoding = encoding;
    }

    void pin(TlaEx ex) {
      if (isOper(ex, TlaOper.EQ)) {
        OperEx eq = (OperEx) ex;
        pinIntCell(eq.getArg(0), eq.getArg(1));
        pinIntCell(eq.getArg(1), eq.getArg(0));
      } else if (isOper(ex, TlaOper.STORE_LAST)) {
        OperEx store = (OperEx) ex;
        int set = GroundExprs.cellId(store.getArg(0));
        if (!setDefs.containsKey(set)) {
          setDefs.put(set, store.getArg(1));
        }
      }
    }

    private void pinIntCell(TlaEx cell, TlaEx value) {
      if (cell instanceof NameEx && value instanceof ValEx
          && cell.getTypeTag().equals(CellT.integer())) {
        int id = GroundExprs.cellId(cell);
        if (!pins.containsKey(id)) {
          pins.put(id, ((ValEx) value).intValue());
        }
      }
    }

    void collect(TlaEx ex) {
      if (ex instanceof NameEx) {
        int id = GroundExprs.cellId(ex);
        CellT type = ex.getTypeTag();
        if (type.equals(CellT.bool())) {
          atoms.put(boolAtom(id), id);
        } else if (type.equals(CellT.integer())) {
          intCells.add(id);
        } else {
          setCells.add(id);
        }
        return;
      }
      if (!(ex instanceof OperEx)) {
        return;
      }
      OperEx oper = (OperEx) ex;
      if (oper.getOper() == TlaOper.SELECT_IN_SET
          || oper.getOper() == TlaOper.STORE_IN_SET) {
        universe.add(GroundExprs.cellId(oper.getArg(0)));
      }
      if (oper.getOper() == TlaOper.SELECT_IN_SET
          && encoding == SmtEncoding.ORACLES) {
        int elem = GroundExprs.cellId(oper.getArg(0));
        int set = GroundExprs.cellId(oper.getArg(1));
        atoms.put(memberAtom(elem, set), Math.max(elem, set));
      }
      for (TlaEx arg : oper.getArgs()) {
        collect(arg);
      }
    }

    /** Under arrays, the members of an undefined set are free atoms. */
    void addUndefinedMembers() {
      if (encoding != SmtEncoding.ARRAYS) {
        return;
      }
      for (int set : setCells) {
        if (!setDefs.containsKey(set)) {
          for (int elem : universe) {
            atoms.put(memberAtom(elem, set), Math.max(elem, set));
          }
        }
      }
    }

    Integer firstUnpinnedInt() {
      for (int id : intCells) {
        if (!pins.containsKey(id)) {
          return id;
        }
      }
      return null;
    }

    /** Atoms ordered so that an atom comes after the cells it mentions. */
    List<String> atomsInOrder() {
      List<String> order = Lists.newArrayList(atoms.keySet());
      Collections.sort(order, new Comparator<String>() {
        @Override
        public int compare(String a, String b) {
          int byRank = atoms.get(a).compareTo(atoms.get(b));
          return byRank != 0 ? byRank : a.compareTo(b);
        }
      });
      return ImmutableList.copyOf(order);
    }

    Boolean evalBool(TlaEx ex) {
      if (ex instanceof ValEx) {
        return ((ValEx) ex).boolValue();
      }
      if (ex instanceof NameEx) {
        return values.get(boolAtom(GroundExprs.cellId(ex)));
      }
      OperEx oper = (OperEx) ex;
      List<TlaEx> args = oper.getArgs();
      switch (oper.getOper()) {
        case AND:
          return evalJunction(args, false);
        case OR:
          return evalJunction(args, true);
        case NOT:
          Boolean arg = evalBool(args.get(0));
          return arg == null ? null : !arg;
        case IFF:
          return sameOrNull(evalBool(args.get(0)), evalBool(args.get(1)));
        case EQ:
          if (GroundExprs.kindOf(args.get(0), encoding)
              == GroundExprs.Kind.INT) {
            return evalInt(args.get(0)) == evalInt(args.get(1));
          }
          return sameOrNull(evalBool(args.get(0)), evalBool(args.get(1)));
        case SELECT_IN_SET:
          return member(GroundExprs.cellId(args.get(0)), args.get(1));
        case STORE_LAST:
          return evalStoreLast(args.get(0), args.get(1));
        default:
          throw new ConstraintEncodingException("not a Boolean term", ex);
      }
    }

    /** Returns 0 for an integer cell without a value. */
    long evalInt(TlaEx ex) {
      if (ex instanceof ValEx) {
        return ((ValEx) ex).intValue();
      }
      Long value = pins.get(GroundExprs.cellId(ex));
      return value == null ? 0L : value;
    }

    private Boolean evalJunction(List<TlaEx> args, boolean dominant) {
      boolean undecided = false;
      for (TlaEx arg : args) {
        Boolean value = evalBool(arg);
        if (value == null) {
          undecided = true;
        } else if (value == dominant) {
          return dominant;
        }
      }
      return undecided ? null : !dominant;
    }

    private Boolean evalStoreLast(TlaEx set, TlaEx chain) {
      boolean undecided = false;
      for (int elem : universe) {
        Boolean value = sameOrNull(member(elem, set), member(elem, chain));
        if (value == null) {
          undecided = true;
        } else if (!value) {
          return false;
        }
      }
      return undecided ? null : true;
    }

    private Boolean member(int elem, TlaEx set) {
      if (set instanceof NameEx) {
        int id = GroundExprs.cellId(set);
        if (encoding == SmtEncoding.ARRAYS && setDefs.containsKey(id)) {
          return member(elem, setDefs.get(id));
        }
        return values.get(memberAtom(elem, id));
      }
      OperEx oper = (OperEx) set;
      if (oper.getOper() == TlaOper.EMPTY_SET) {
        return false;
      }
      // STORE_IN_SET(stored, base, cond)
      if (GroundExprs.cellId(oper.getArg(0)) == elem) {
        return evalBool(oper.getArg(2));
      }
      return member(elem, oper.getArg(1));
    }

    private static Boolean sameOrNull(Boolean a, Boolean b) {
      return a == null || b == null ? null : a.equals(b);
    }

    private static String boolAtom(int cell) {
      return "b:" + cell;
    }

    private static String memberAtom(int elem, int set) {
      return "in:" + elem + ":" + set;
    }
  }
}
