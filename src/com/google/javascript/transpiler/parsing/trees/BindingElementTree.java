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

/** A binding with an optional default value, as found in parameter lists and patterns. */
public final class BindingElementTree extends ParseTree {
  public final ParseTree binding;
  public final @Nullable ParseTree initializer;

  public BindingElementTree(
      @Nullable SourceRange location,
      ParseTree binding,
      @Nullable ParseTree initializer) {
    super(ParseTreeType.BINDING_ELEMENT, location);
    this.binding = checkNotNull(binding);
    this.initializer = initializer;
  }

  @Override
  public ImmutableList<ParseTree> children() {
    return childrenOf(binding, initializer);
  }
}
