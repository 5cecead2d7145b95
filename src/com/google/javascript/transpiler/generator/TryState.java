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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

/**
 * An exception handling region of a state machine: the states protected by a catch or finally
 * handler and the state where that handler starts.
 */
public final class TryState {

  /** The kind of handler guarding the region. */
  public enum Kind {
    CATCH,
    FINALLY
  }

  public final Kind kind;
  public final ImmutableList<Integer> tryStates;
  public final int handlerState;

  public TryState(Kind kind, ImmutableList<Integer> tryStates, int handlerState) {
    this.kind = checkNotNull(kind);
    this.tryStates = checkNotNull(tryStates);
    this.handlerState = handlerState;
  }

  @Override
  public String toString() {
    return kind + tryStates.toString() + "->" + handlerState;
  }
}
