/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.javascript.transpiler;

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.block;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.breakStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.empty;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.exprResult;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.name;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.program;
import static org.junit.Assert.assertThrows;

import com.google.javascript.transpiler.TranspilerOptions.DevMode;
import com.google.javascript.transpiler.generator.BreakContinueTransformer;
import com.google.javascript.transpiler.generator.StateAllocator;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ParseTreeType;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PassRunnerTest {

  private TranspilerOptions options;
  private List<String> ran;

  @Before
  public void setUp() {
    options = new TranspilerOptions();
    ran = new ArrayList<>();
  }

  private CompilerPass recording(String name, ParseTree result) {
    return root -> {
      ran.add(name);
      return result;
    };
  }

  /** Produces a tree the validator rejects. */
  private static CompilerPass lowerJumps() {
    return root -> new BreakContinueTransformer(new StateAllocator()).transform(root);
  }

  @Test
  public void testRunsPassesInOrder() {
    ParseTree first = program(exprResult(name("a")));
    ParseTree second = program(exprResult(name("b")));
    ParseTree result =
        new PassRunner(options)
            .addPass("first", recording("first", first))
            .addPass("second", recording("second", second))
            .process(program());

    assertThat(ran).containsExactly("first", "second").inOrder();
    assertThat(result).isSameInstanceAs(second);
  }

  @Test
  public void testDefaultsToNoValidation() {
    assertThat(options.getDevMode()).isEqualTo(DevMode.OFF);
    ParseTree invalid = block(exprResult(empty()));
    assertThat(new PassRunner(options).process(invalid)).isSameInstanceAs(invalid);
  }

  @Test
  public void testStartValidatesInput() {
    options.setDevMode(DevMode.START);
    PassRunner runner = new PassRunner(options).addPass("p", recording("p", program()));

    ParseTree invalid = block(exprResult(empty()));
    assertThrows(ParseTreeValidationException.class, () -> runner.process(invalid));
    assertThat(ran).isEmpty();
  }

  @Test
  public void testStartDoesNotValidateOutput() {
    options.setDevMode(DevMode.START);
    ParseTree result =
        new PassRunner(options).addPass("lower", lowerJumps()).process(block(breakStatement()));
    assertThat(result.asBlock().statements.get(0).type).isEqualTo(ParseTreeType.STATE_MACHINE);
  }

  @Test
  public void testStartAndEndValidatesOutput() {
    options.setDevMode(DevMode.START_AND_END);
    PassRunner runner =
        new PassRunner(options)
            .addPass("lower", lowerJumps())
            .addPass("noop", recording("noop", block(breakStatement())));
    runner.process(block(breakStatement()));
    assertThat(ran).containsExactly("noop");

    PassRunner failing = new PassRunner(options).addPass("lower", lowerJumps());
    ParseTreeValidationException e =
        assertThrows(
            ParseTreeValidationException.class, () -> failing.process(block(breakStatement())));
    assertThat(e.getValidationMessage())
        .isEqualTo("State machines are never valid outside of the generator lowering pass.");
  }

  @Test
  public void testEveryPassValidatesEachOutput() {
    options.setDevMode(DevMode.EVERY_PASS);
    PassRunner runner =
        new PassRunner(options)
            .addPass("lower", lowerJumps())
            .addPass("never", recording("never", program()));

    ParseTree input = block(breakStatement());
    assertThrows(ParseTreeValidationException.class, () -> runner.process(input));
    assertThat(ran).isEmpty();
  }

  @Test
  public void testPassMustReturnTree() {
    PassRunner runner = new PassRunner(options).addPass("broken", root -> null);
    assertThrows(NullPointerException.class, () -> runner.process(program()));
  }

  @Test
  public void testOptionsToString() {
    options.setDevMode(DevMode.EVERY_PASS);
    assertThat(options.toString()).contains("devMode=EVERY_PASS");
  }
}
