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

/** {@code for (initializer in collection) body} */
public final class ForInStatementTree extends ParseTree {
  public final ParseTree initializer;
  public final ParseTree collection;
  public final ParseTree body;

  public ForInStatementTree(
      @Nullable SourceRange location,
      ParseTree initializer,
      ParseTree collection,
      ParseTree body) {
    super(ParseTreeType.FOR_IN_STATEMENT, location);
    this.initializer = checkNotNull(initializer);
    this.collection = checkNotNull(collection);
    this.body = checkNotNull(body);
  }

  @Override
  public ImmutableList<ParseTree> children() {
    return childrenOf(initializer, collection, body);
  }
}
