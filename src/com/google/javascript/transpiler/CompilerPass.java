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

/**
 * Interface for parse tree passes. Trees are immutable, so a pass returns the tree that replaces
 * its input.
 */
public interface CompilerPass {

  /**
   * Processes the tree rooted at {@code root}.
   *
   * @return the resulting tree, which is {@code root} itself when nothing changed
   */
  ParseTree process(ParseTree root);
}
