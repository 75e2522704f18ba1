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

package symbolicchecker.rewriter;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.StackableContext;
import symbolicchecker.arena.Arena;
import symbolicchecker.arena.ArenaCell;
import symbolicchecker.ir.ExprGrade;
import symbolicchecker.ir.ExprGradeAnalysis;
import symbolicchecker.ir.ExprGradeStore;
import symbolicchecker.ir.OperEx;
import symbolicchecker.ir.Tla;
import symbolicchecker.ir.TlaEx;
import symbolicchecker.rewriter.rules.AssignmentRule;
import symbolicchecker.rewriter.rules.BuiltinConstRule;
import symbolicchecker.rewriter.rules.EqRule;
import symbolicchecker.rewriter.rules.IntConstRule;
import symbolicchecker.rewriter.rules.LogicConnectiveRule;
import symbolicchecker.rewriter.rules.NegationRule;
import symbolicchecker.rewriter.rules.SetCtorRule;
import symbolicchecker.rewriter.rules.SetFilterRule;
import symbolicchecker.rewriter.rules.SetInRule;
import symbolicchecker.rewriter.rules.SubstRule;
import symbolicchecker.smt.SetMembershipEncoder;
import symbolicchecker.smt.SolverContext;

import java.util.List;

/**
 * Rewrites symbolic states to normal form by applying a fixed, ordered list of
 * {@link RewritingRule}s until the expression is a single cell reference.
 * <p>
 * The rewriter owns the solver context its rules assert into, and caches for
 * integer literals and constant expressions. All three follow the scopes of
 * {@link #push()} and {@link #pop()}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class SymbStateRewriter implements StackableContext {
  private static final Logger logger =
      LoggerFactory.getLogger(SymbStateRewriter.class);

  private final SolverContext solverContext;
  private final ExprGradeStore gradeStore;
  private final ExprGradeAnalysis gradeAnalysis;
  private final SetMembershipEncoder encoder;
  private final IntValueCache intValueCache = new IntValueCache();
  private final ExprCache exprCache = new ExprCache();
  private ImmutableList<RewritingRule> rules;

  /**
   * How many rules may apply at one level of {@link #rewriteUntilDone}, per
   * node of the expression, before rewriting is deemed to cycle
   */
  static final int APPLICATIONS_PER_NODE = 4;

  private long ruleApplications = 0;
  private int level = 0;

  public SymbStateRewriter(SolverContext solverContext) {
    this(solverContext, new ExprGradeStore());
  }

  public SymbStateRewriter(SolverContext solverContext,
      ExprGradeStore gradeStore) {
    this.solverContext = Preconditions.checkNotNull(solverContext);
    this.gradeStore = Preconditions.checkNotNull(gradeStore);
    this.gradeAnalysis = new ExprGradeAnalysis(gradeStore);
    this.encoder = SetMembershipEncoder.forEncoding(
        solverContext.config().getSmtEncoding());
    this.rules = ImmutableList.of(
        new SubstRule(this),
        new BuiltinConstRule(this),
        new IntConstRule(this),
        new LogicConnectiveRule(this),
        new NegationRule(this),
        new EqRule(this),
        new SetCtorRule(this),
        new SetInRule(this),
        new SetFilterRule(this),
        new AssignmentRule(this));
  }

  public SolverContext getSolverContext() {
    return solverContext;
  }

  public SetMembershipEncoder getEncoder() {
    return encoder;
  }

  public IntValueCache getIntValueCache() {
    return intValueCache;
  }

  public ExprCache getExprCache() {
    return exprCache;
  }

  public ExprGradeStore getGradeStore() {
    return gradeStore;
  }

  public ImmutableList<RewritingRule> getRules() {
    return rules;
  }

  /** Puts {@code rule} before the built-in rules. */
  @VisibleForTesting
  void addRuleFirst(RewritingRule rule) {
    rules = ImmutableList.<RewritingRule>builder()
        .add(rule).addAll(rules).build();
  }

  /** @return how many times a rule has been applied so far */
  public long ruleApplications() {
    return ruleApplications;
  }

  /**
   * Creates an arena with the predefined cells and tells the solver their
   * values.
   */
  public Arena createArena() {
    Arena arena = Arena.create();
    solverContext.assertGroundExpr(arena.cellTrue().toNameEx());
    solverContext.assertGroundExpr(Tla.not(arena.cellFalse().toNameEx()));
    return arena;
  }

  /**
   * Rewrites {@code state} until its expression is a cell reference.
   *
   * @throws NoApplicableRuleException if some subexpression has no rule
   * @throws RewriterException if the rules keep rewriting without reaching a
   *         cell reference
   */
  public SymbState rewriteUntilDone(SymbState state) {
    TlaEx source = state.getEx();
    if (state.isNormalized()) {
      return state;
    }
    boolean constant = isConstant(source);
    if (constant) {
      ArenaCell cached = exprCache.get(source, state.getArena());
      if (cached != null) {
        logger.trace("cached {} -> {}", source, cached);
        return state.setRex(cached.toNameEx());
      }
    }
    SymbState current = state;
    int budget = APPLICATIONS_PER_NODE * nodeCount(source);
    for (int applied = 0; !current.isNormalized(); applied++) {
      if (applied == budget) {
        throw new RewriterException("no normal form after " + budget
            + " rule applications", source);
      }
      current = rewriteOnce(current);
    }
    if (constant) {
      exprCache.put(source, current.asCell());
    }
    return current;
  }

  /**
   * Rewrites each of {@code exs} in turn, threading the arena and the binding
   * from one to the next.
   */
  public SeqRewrite rewriteSeqUntilDone(SymbState state,
      List<? extends TlaEx> exs) {
    ImmutableList.Builder<ArenaCell> cells = ImmutableList.builder();
    SymbState current = state;
    for (TlaEx ex : exs) {
      current = rewriteUntilDone(current.setRex(ex));
      cells.add(current.asCell());
    }
    return new SeqRewrite(current, cells.build());
  }

  private SymbState rewriteOnce(SymbState state) {
    for (RewritingRule rule : rules) {
      if (rule.isApplicable(state)) {
        ruleApplications++;
        logger.trace("{} on {}", rule.getClass().getSimpleName(),
            state.getEx());
        SymbState next = rule.apply(state);
        if (next.getEx() == state.getEx()) {
          throw new IllegalStateException(rule.getClass().getSimpleName()
              + " returned its input unchanged: " + state.getEx());
        }
        return next;
      }
    }
    throw new NoApplicableRuleException("no rule applies", state.getEx());
  }

  private static int nodeCount(TlaEx ex) {
    int count = 1;
    if (ex instanceof OperEx) {
      for (TlaEx arg : ((OperEx) ex).getArgs()) {
        count += nodeCount(arg);
      }
    }
    return count;
  }

  private boolean isConstant(TlaEx ex) {
    ExprGrade grade = gradeStore.get(ex);
    if (grade == null) {
      grade = gradeAnalysis.labelWithGrades(ex);
    }
    return grade == ExprGrade.CONSTANT;
  }

  /** Pushes a scope on the solver and on both caches. */
  @Override
  public void push() {
    solverContext.push();
    intValueCache.push();
    exprCache.push();
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
    solverContext.pop(n);
    intValueCache.pop(n);
    exprCache.pop(n);
    level -= n;
  }

  @Override
  public int contextLevel() {
    return level;
  }

  public void dispose() {
    solverContext.dispose();
  }

  /** The final state of a sequence of rewrites and the cell of each. */
  public static final class SeqRewrite {
    private final SymbState state;
    private final ImmutableList<ArenaCell> cells;

    SeqRewrite(SymbState state, ImmutableList<ArenaCell> cells) {
      this.state = state;
      this.cells = cells;
    }

    public SymbState getState() {
      return state;
    }

    public ImmutableList<ArenaCell> getCells() {
      return cells;
    }
  }
}
