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
 * Hands out state ids for one function body's lowering. Ids are successive integers starting at
 * the value the driver's counter holds when the allocator is created.
 *
 * <p>Not thread safe. Each compilation unit owns its allocator.
 */
public final class StateAllocator {
  private int nextState;

  public StateAllocator() {
    this(State.START_STATE);
  }

  public StateAllocator(int firstState) {
    checkArgument(firstState >= 0, "first state must not be negative: %s", firstState);
    this.nextState = firstState;
  }

  /** Returns a new state id, greater than every id returned before. */
  public int allocateState() {
    return nextState++;
  }

  /** The id the next call to {@link #allocateState} will return. */
  public int peekNextState() {
    return nextState;
  }
}
