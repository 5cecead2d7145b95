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

import com.google.javascript.transpiler.parsing.IdentifierToken;
import com.google.javascript.transpiler.parsing.SourceRange;
import org.jspecify.annotations.Nullable;

/** {@code continue [label];} */
public final class ContinueStatementTree extends ParseTree {
  public final @Nullable IdentifierToken name;

  public ContinueStatementTree(@Nullable SourceRange location, @Nullable IdentifierToken name) {
    super(ParseTreeType.CONTINUE_STATEMENT, location);
    this.name = name;
  }

  @Override
  protected @Nullable String getDetail() {
    return getLabel();
  }

  /** The target label, or null for the nearest enclosing loop. */
  public @Nullable String getLabel() {
    return name == null ? null : name.value;
  }
}
