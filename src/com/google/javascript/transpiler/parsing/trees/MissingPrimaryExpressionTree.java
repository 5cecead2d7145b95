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

import com.google.javascript.transpiler.parsing.SourceRange;
import com.google.javascript.transpiler.parsing.Token;
import org.jspecify.annotations.Nullable;

/** Placeholder the parser leaves where it could not parse an expression. */
public final class MissingPrimaryExpressionTree extends ParseTree {
  public final @Nullable Token nextToken;

  public MissingPrimaryExpressionTree(@Nullable SourceRange location, @Nullable Token nextToken) {
    super(ParseTreeType.MISSING_PRIMARY_EXPRESSION, location);
    this.nextToken = nextToken;
  }
}
