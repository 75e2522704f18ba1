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

import junit.framework.TestCase;

import symbolicchecker.smt.SmtEncoding;
import symbolicchecker.smt.SolverConfig;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Properties;

/**
 * Tests for {@link CheckerOptions}.
 *
 * @author The tla-symbolic-checker Authors
 */
public class CheckerOptionsTest extends TestCase {
  public void testDefaults() {
    CheckerOptions options = CheckerOptions.fromProperties(new Properties());
    assertEquals(SmtEncoding.ARRAYS, options.smtEncoding);
    assertEquals(CheckerOptions.SolverKind.Z3, options.solver);
    assertEquals(10, options.maxSteps);
    assertEquals(64, options.maxSnapshotDepth);
    assertFalse(options.offline);
    assertEquals(0, options.stepTimeoutMillis);
  }

  public void testLoadFromFile() throws IOException {
    CheckerOptions options =
        CheckerOptions.load(new File("test/data/checker.properties"));
    assertEquals(SmtEncoding.ORACLES, options.smtEncoding);
    assertEquals(CheckerOptions.SolverKind.MEMORY, options.solver);
    assertEquals(42, options.randomSeed);
    assertEquals(30, options.solverTimeoutSeconds);
    assertTrue(options.recordSolverCalls);
    assertFalse(options.debug);
    assertEquals(5, options.maxSteps);
    assertEquals(8, options.maxSnapshotDepth);
    assertTrue(options.offline);
    assertEquals(2000, options.stepTimeoutMillis);

    SolverConfig config = options.toSolverConfig();
    assertEquals(SmtEncoding.ORACLES, config.getSmtEncoding());
    assertEquals(42, config.getRandomSeed());
    assertEquals(30, config.getTimeoutSeconds());
  }

  public void testLoadMissingFile() throws IOException {
    try {
      CheckerOptions.load(new File("test/data/no-such.properties"));
      fail("loaded a missing file");
    } catch (FileNotFoundException e) {
      // expected
    }
  }

  public void testMalformedValuesNameTheKey() {
    assertRejected("search.maxSteps", "many");
    assertRejected("search.maxSteps", "-1");
    assertRejected("search.maxSnapshotDepth", "0");
    assertRejected("smt.encoding", "bitvectors");
    assertRejected("smt.solver", "cvc5");
    assertRejected("search.offline", "yes");
    assertRejected("step.timeoutMillis", "-5");
  }

  private static void assertRejected(String key, String value) {
    Properties properties = new Properties();
    properties.setProperty(key, value);
    try {
      CheckerOptions.fromProperties(properties);
      fail(key + "=" + value + " was accepted");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(key));
    }
  }
}
