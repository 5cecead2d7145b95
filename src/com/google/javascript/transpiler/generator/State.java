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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One pause or resume point of a lowered generator body. Ids come from a {@link StateAllocator}
 * and are unique within one function body's lowering.
 */
public abstract class State {
  public static final int INVALID_STATE = -1;
  public static final int START_STATE = 0;

  public final int id;

  protected State(int id) {
    checkArgument(id >= 0, "invalid state id: %s", id);
    this.id = id;
  }
}
