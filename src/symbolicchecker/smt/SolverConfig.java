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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Solver settings that stay fixed for a whole run.
 *
 * @author The tla-symbolic-checker Authors
 */
public final class SolverConfig {
  private final SmtEncoding smtEncoding;
  private final int randomSeed;
  private final int timeoutSeconds;
  private final boolean debug;

  private SolverConfig(Builder builder) {
    this.smtEncoding = builder.smtEncoding;
    this.randomSeed = builder.randomSeed;
    this.timeoutSeconds = builder.timeoutSeconds;
    this.debug = builder.debug;
  }

  /** Arrays encoding, seed 0, no timeout, no debug output. */
  public static SolverConfig defaults() {
    return builder().build();
  }

  public static SolverConfig withEncoding(SmtEncoding encoding) {
    return builder().setSmtEncoding(encoding).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public SmtEncoding getSmtEncoding() {
    return smtEncoding;
  }

  /** @return the seed for solver heuristics; 0 leaves the solver default */
  public int getRandomSeed() {
    return randomSeed;
  }

  /** @return the per-query timeout in seconds; 0 means none */
  public int getTimeoutSeconds() {
    return timeoutSeconds;
  }

  public boolean isDebug() {
    return debug;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("smtEncoding", smtEncoding)
        .add("randomSeed", randomSeed)
        .add("timeoutSeconds", timeoutSeconds)
        .add("debug", debug)
        .toString();
  }

  /** Builder for {@link SolverConfig}. */
  public static final class Builder {
    private SmtEncoding smtEncoding = SmtEncoding.ARRAYS;
    private int randomSeed = 0;
    private int timeoutSeconds = 0;
    private boolean debug = false;

    private Builder() {}

    public Builder setSmtEncoding(SmtEncoding smtEncoding) {
      this.smtEncoding = Preconditions.checkNotNull(smtEncoding);
      return this;
    }

    public Builder setRandomSeed(int randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    public Builder setTimeoutSeconds(int timeoutSeconds) {
      Preconditions.checkArgument(timeoutSeconds >= 0,
          "negative timeout: %s", timeoutSeconds);
      this.timeoutSeconds = timeoutSeconds;
      return this;
    }

    public Builder setDebug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public SolverConfig build() {
      return new SolverConfig(this);
    }
  }
}
