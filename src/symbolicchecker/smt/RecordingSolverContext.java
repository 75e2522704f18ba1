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
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import symbolicchecker.ir.TlaEx;

import java.util.List;

/**
 * Records every call made on another solver context into a {@link SolverLog}.
 * <p>
 * In deferred mode nothing reaches the wrapped solver until a query
 * ({@link #checkSat()} or {@link #evalGroundExpr(TlaEx)}) is made; then all
 * pending calls are issued in order. Scope levels are tracked here, so they are
 * right even while calls are pending.
 *
 * @author The tla-symbolic-checker Authors
 */
public class RecordingSolverContext implements SolverContext {
  private static final Logger logger =
      LoggerFactory.getLogger(RecordingSolverContext.class);

  private final SolverContext delegate;
  private final boolean deferred;
  private final SolverLog log = new SolverLog();
  private final List<SolverCall> pending = Lists.newArrayList();
  private int level;

  public RecordingSolverContext(SolverContext delegate, boolean deferred) {
    this.delegate = Preconditions.checkNotNull(delegate);
    this.deferred = deferred;
    this.level = delegate.contextLevel();
  }

  public SolverLog getLog() {
    return log;
  }

  public boolean isDeferred() {
    return deferred;
  }

  /** @return how many calls wait for the next query */
  public int pendingCalls() {
    return pending.size();
  }

  @Override
  public SolverConfig config() {
    return delegate.config();
  }

  @Override
  public void assertGroundExpr(TlaEx ex) {
    GroundExprs.checkConstraint(ex, config().getSmtEncoding());
    record(SolverCall.assertion(ex));
  }

  @Override
  public SatResult checkSat() {
    flush();
    SatResult result = delegate.checkSat();
    log.append(SolverCall.checkSat(result));
    return result;
  }

  @Override
  public TlaEx evalGroundExpr(TlaEx ex) {
    flush();
    TlaEx value = delegate.evalGroundExpr(ex);
    log.append(SolverCall.eval(ex, value));
    return value;
  }

  @Override
  public void interrupt() {
    delegate.interrupt();
  }

  @Override
  public void push() {
    record(SolverCall.push());
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
    record(SolverCall.pop(n));
    level -= n;
  }

  @Override
  public int contextLevel() {
    return level;
  }

  @Override
  public void dispose() {
    if (!pending.isEmpty()) {
      logger.debug("dropping {} pending solver calls", pending.size());
      pending.clear();
    }
    delegate.dispose();
  }

  private void record(SolverCall call) {
    log.append(call);
    if (deferred) {
      pending.add(call);
    } else {
      call.applyTo(delegate);
    }
  }

  private void flush() {
    if (pending.isEmpty()) {
      return;
    }
    logger.debug("sending {} deferred solver calls", pending.size());
    for (SolverCall call : pending) {
      call.applyTo(delegate);
    }
    pending.clear();
  }
}
