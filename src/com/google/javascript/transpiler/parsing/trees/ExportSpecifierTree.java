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

import com.google.javascript.transpiler.parsing.IdentifierToken;
import com.google.javascript.transpiler.parsing.SourceRange;
import org.jspecify.annotations.Nullable;

/** {@code lhs [: rhs]} inside an export specifier set. */
public final class ExportSpecifierTree extends ParseTree {
  public final IdentifierToken lhs;
  public final @Nullable IdentifierToken rhs;

  public ExportSpecifierTree(
      @Nullable SourceRange location,
      IdentifierToken lhs,
      @Nullable IdentifierToken rhs) {
    super(ParseTreeType.EXPORT_SPECIFIER, location);
    this.lhs = checkNotNull(lhs);
    this.rhs = rhs;
  }

  @Override
  protected @Nullable String getDetail() {
    return rhs == null ? lhs.value : lhs.value + ":" + rhs.value;
  }
}
