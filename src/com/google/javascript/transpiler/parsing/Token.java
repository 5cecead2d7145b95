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

import static com.google.common.base.Preconditions.checkNotNull;

import org.jspecify.annotations.Nullable;

/** A token held by a parse tree: an operator, keyword or property name. */
public class Token {
  public final TokenType type;
  public final @Nullable SourceRange location;

  public Token(TokenType type, @Nullable SourceRange location) {
    this.type = checkNotNull(type);
    this.location = location;
  }

  public IdentifierToken asIdentifier() {
    return (IdentifierToken) this;
  }

  public LiteralToken asLiteral() {
    return (LiteralToken) this;
  }

  @Override
  public String toString() {
    return type.toString();
  }
}
