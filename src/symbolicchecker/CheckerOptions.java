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

package symbolicchecker;

import com.google.common.base.Ascii;
import com.google.common.base.MoreObjects;
import com.google.common.io.Files;

import symbolicchecker.smt.InMemorySolverContext;
import symbolicchecker.smt.RecordingSolverContext;
import symbolicchecker.smt.SmtEncoding;
import symbolicchecker.smt.SolverConfig;
import symbolicchecker.smt.SolverContext;
import symbolicchecker.smt.Z3SolverContext;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Options for a checking run. Fields are public and may be set directly;
 * {@link #fromProperties(Properties)} reads them from the keys documented on
 * each field.
 *
 * @author The tla-symbolic-checker Authors
 */
public class CheckerOptions {
  /** The solver behind a run. */
  public enum SolverKind {
    Z3,

    /**
     * {@link InMemorySolverContext}, a test backend. It only decides
     * constraints whose integers are pinned to literals.
     */
    MEMORY
  }

  /** {@code smt.encoding}: {@code arrays} or {@code oracles} */
  public SmtEncoding smtEncoding = SmtEncoding.ARRAYS;

  /** {@code smt.solver}: {@code z3}, or {@code memory} in tests */
  public SolverKind solver = SolverKind.Z3;

  /** {@code smt.randomSeed}; 0 keeps the solver default */
  public int randomSeed = 0;

  /** {@code smt.timeoutSeconds}; 0 means none */
  public int solverTimeoutSeconds = 0;

  /** {@code smt.record}: log every solver call */
  public boolean recordSolverCalls = false;

  /** {@code smt.debug}: log every assertion */
  public boolean debug = false;

  /** {@code search.maxSteps}: transitions after the initial step */
  public int maxSteps = 10;

  /** {@code search.maxSnapshotDepth}: live snapshots at once */
  public int maxSnapshotDepth = 64;

  /** {@code search.offline}: defer solver calls to the end of each step */
  public boolean offline = false;

  /** {@code step.timeoutMillis}; 0 means none */
  public long stepTimeoutMillis = 0;

  /** Reads options from a UTF-8 properties file. */
  public static CheckerOptions load(File file) throws IOException {
    Properties properties = new Properties();
    try (Reader reader = Files.asCharSource(file, StandardCharsets.UTF_8)
        .openBufferedStream()) {
      properties.load(reader);
    }
    return fromProperties(properties);
  }

  /**
   * @throws IllegalArgumentException naming the key of a malformed value
   */
  public static CheckerOptions fromProperties(Properties properties) {
    CheckerOptions options = new CheckerOptions();
    String encoding = properties.getProperty("smt.encoding");
    if (encoding != null) {
      try {
        options.smtEncoding = SmtEncoding.parse(encoding);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("smt.encoding: " + e.getMessage(),
            e);
      }
    }
    String solver = properties.getProperty("smt.solver");
    if (solver != null) {
      options.solver = parseSolver(solver.trim());
    }
    options.randomSeed = intValue(properties, "smt.randomSeed",
        options.randomSeed, Integer.MIN_VALUE);
    options.solverTimeoutSeconds = intValue(properties, "smt.timeoutSeconds",
        options.solverTimeoutSeconds, 0);
    options.recordSolverCalls = boolValue(properties, "smt.record",
        options.recordSolverCalls);
    options.debug = boolValue(properties, "smt.debug", options.debug);
    options.maxSteps = intValue(properties, "search.maxSteps",
        options.maxSteps, 0);
    options.maxSnapshotDepth = intValue(properties, "search.maxSnapshotDepth",
        options.maxSnapshotDepth, 1);
    options.offline = boolValue(properties, "search.offline", options.offline);
    options.stepTimeoutMillis = longValue(properties, "step.timeoutMillis",
        options.stepTimeoutMillis);
    return options;
  }

  /** @return the solver settings, fixed for the whole run */
  public SolverConfig toSolverConfig() {
    return SolverConfig.builder()
        .setSmtEncoding(smtEncoding)
        .setRandomSeed(randomSeed)
        .setTimeoutSeconds(solverTimeoutSeconds)
        .setDebug(debug)
        .build();
  }

  /**
   * Creates the solver context these options select, wrapped in a recorder
   * when {@link #recordSolverCalls} is set.
   */
  public SolverContext createSolverContext() {
    SolverConfig config = toSolverConfig();
    SolverContext context = solver == SolverKind.Z3
        ? new Z3SolverContext(config) : new InMemorySolverContext(config);
    return recordSolverCalls
        ? new RecordingSolverContext(context, false) : context;
  }

  private static SolverKind parseSolver(String value) {
    if (Ascii.equalsIgnoreCase(value, "z3")) {
      return SolverKind.Z3;
    } else if (Ascii.equalsIgnoreCase(value, "memory")) {
      return SolverKind.MEMORY;
    }
    throw new IllegalArgumentException(
        "smt.solver: expected z3 or memory, found " + value);
  }

  private static int intValue(Properties properties, String key,
      int defaultValue, int min) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    int parsed;
    try {
      parsed = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          key + ": not an integer: " + value, e);
    }
    if (parsed < min) {
      throw new IllegalArgumentException(
          key + ": must be at least " + min + ", found " + parsed);
    }
    return parsed;
  }

  private static long longValue(Properties properties, String key,
      long defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          key + ": not an integer: " + value, e);
    }
    if (parsed < 0) {
      throw new IllegalArgumentException(key + ": negative value " + parsed);
    }
    return parsed;
  }

  private static boolean boolValue(Properties properties, String key,
      boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (Ascii.equalsIgnoreCase(trimmed, "true")) {
      return true;
    } else if (Ascii.equalsIgnoreCase(trimmed, "false")) {
      return false;
    }
    throw new IllegalArgumentException(
        key + ": expected true or false, found " + value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("smtEncoding", smtEncoding)
        .add("solver", solver)
        .add("randomSeed", randomSeed)
        .add("solverTimeoutSeconds", solverTimeoutSeconds)
        .add("recordSolverCalls", recordSolverCalls)
        .add("debug", debug)
        .add("maxSteps", maxSteps)
        .add("maxSnapshotDepth", maxSnapshotDepth)
        .add("offline", offline)
        .add("stepTimeoutMillis", stepTimeoutMillis)
        .toString();
  }
}
