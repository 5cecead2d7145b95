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

/** A name: a variable, label, property or a contextual keyword used as an operator. */
public final class IdentifierToken extends Token {
  public final String value;

  public IdentifierToken(@Nullable SourceRange location, String value) {
    super(TokenType.IDENTIFIER, location);
    this.value = checkNotNull(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
