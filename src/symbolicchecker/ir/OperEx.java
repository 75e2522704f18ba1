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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * An application of a {@link TlaOper} to arguments.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class OperEx extends TlaEx {
  private final TlaOper oper;
  private final ImmutableList<TlaEx> args;

  public OperEx(TlaOper oper, TlaEx... args) {
    this(oper, ImmutableList.copyOf(args), null, null);
  }

  public OperEx(TlaOper oper, List<? extends TlaEx> args, CellT typeTag,
      SourceLocation location) {
    super(typeTag, location);
    this.oper = Preconditions.checkNotNull(oper);
    this.args = ImmutableList.copyOf(args);
    Preconditions.checkArgument(oper.acceptsArity(this.args.size()),
        "%s does not take %s arguments", oper, this.args.size());
  }

  public TlaOper getOper() {
    return oper;
  }

  public ImmutableList<TlaEx> getArgs() {
    return args;
  }

  public TlaEx getArg(int i) {
    return args.get(i);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitOper(this);
  }

  /** Prints in prefix form, e.g. {@code (\in x S)}. */
  @Override
  public String toString() {
    if (args.isEmpty()) {
      return "(" + oper.getSymbol() + ")";
    }
    return "(" + oper.getSymbol() + " " + Joiner.on(" ").join(args) + ")";
  }
}
