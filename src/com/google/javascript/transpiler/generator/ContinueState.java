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

package com.google.javascript.transpiler.generator;

import org.jspecify.annotations.Nullable;

/** A {@code continue} lowered to a state; only loops are continue targets. */
public final class ContinueState extends State {
  public final @Nullable String label;

  public ContinueState(int id, @Nullable String label) {
    super(id);
    this.label = label;
  }

  @Override
  public String toString() {
    return "ContinueState(" + id + (label == null ? "" : ", " + label) + ")";
  }
}
