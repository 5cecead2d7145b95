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

package com.google.javascript.transpiler.parsing.trees;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.parsing.SourceRange;
import org.jspecify.annotations.Nullable;

/** {@code for (initializer; condition; increment) body}. The three header parts are optional. */
public final class ForStatementTree extends ParseTree {
  public final @Nullable ParseTree initializer;
  public final @Nullable ParseTree condition;
  public final @Nullable ParseTree increment;
  public final ParseTree body;

  public ForStatementTree(
      @Nullable SourceRange location,
      @Nullable ParseTree initializer,
      @Nullable ParseTree condition,
      @Nullable ParseTree increment,
      ParseTree body) {
    super(ParseTreeType.FOR_STATEMENT, location);
    this.initializer = initializer;
    this.condition = condition;
    this.increment = increment;
    this.body = checkNotNull(body);
  }

  @Override
  public ImmutableList<ParseTree> children() {
    return childrenOf(initializer, condition, increment, body);
  }
}
