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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.transpiler.TranspilerOptions.DevMode;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import java.util.logging.Logger;

/**
 * Runs a sequence of named passes over a parse tree, validating the tree in between as requested by
 * {@link TranspilerOptions#getDevMode()}.
 */
public final class PassRunner {

  private static final Logger logger = Logger.getLogger(PassRunner.class.getName());

  private final TranspilerOptions options;
  private final CompilerPass validityCheck = new ValidityCheck();
  private final ImmutableList.Builder<NamedPass> passes = ImmutableList.builder();

  public PassRunner(TranspilerOptions options) {
    this.options = checkNotNull(options);
  }

  /** Adds a pass to run after the ones already added. */
  @CanIgnoreReturnValue
  public PassRunner addPass(String name, CompilerPass pass) {
    passes.add(new NamedPass(name, pass));
    return this;
  }

  /** Runs every pass in order and returns the final tree. */
  public ParseTree process(ParseTree root) {
    DevMode devMode = options.getDevMode();
    ImmutableList<NamedPass> toRun = passes.build();
    if (devMode != DevMode.OFF) {
      maybeRunValidityCheck("start", root);
    }
    for (int i = 0; i < toRun.size(); i++) {
      NamedPass pass = toRun.get(i);
      root = pass.process(root);
      boolean isLast = i == toRun.size() - 1;
      if (devMode == DevMode.EVERY_PASS || (devMode == DevMode.START_AND_END && isLast)) {
        maybeRunValidityCheck(pass.name, root);
      }
    }
    return root;
  }

  private void maybeRunValidityCheck(String passName, ParseTree root) {
    try {
      validityCheck.process(root);
    } catch (ParseTreeValidationException e) {
      logger.severe("Validity check failed for " + passName + ": " + e.getValidationMessage());
      throw e;
    }
  }

  /** A single compiler pass. */
  private static final class NamedPass implements CompilerPass {
    final String name;
    private final CompilerPass pass;

    NamedPass(String name, CompilerPass pass) {
      this.name = checkNotNull(name);
      this.pass = checkNotNull(pass);
    }

    @Override
    public ParseTree process(ParseTree root) {
      logger.fine("Running pass " + name);
      return checkNotNull(pass.process(root), "pass %s returned null", name);
    }

    @Override
    public String toString() {
      return "pass: " + name;
    }
  }
}
