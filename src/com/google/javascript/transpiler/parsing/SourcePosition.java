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

package com.google.javascript.transpiler.parsing;

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * A position in a source file. Lines and columns are 0-based; {@link #toString} prints a
 * 1-based line number the way error messages expect it.
 */
public final class SourcePosition {
  public final @Nullable SourceFile source;
  public final int offset;
  public final int line;
  public final int column;

  public SourcePosition(@Nullable SourceFile source, int offset, int line, int column) {
    checkArgument(offset >= 0 && line >= 0 && column >= 0, "negative source position");
    this.source = source;
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  @Override
  public String toString() {
    String name = source == null ? "" : source.name;
    return name + ":" + (line + 1) + ":" + column;
  }
}
