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

import com.google.javascript.transpiler.parsing.trees.ParseTree;
import java.util.logging.Logger;

/**
 * A pass that verifies the structure of the parse tree. Because this walks the whole tree, it is
 * only run in development mode.
 */
final class ValidityCheck implements CompilerPass {

  private static final Logger logger = Logger.getLogger(ValidityCheck.class.getName());

  @Override
  public ParseTree process(ParseTree root) {
    logger.fine("Validating " + root.type);
    ParseTreeValidator.validate(root);
    return root;
  }
}
