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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.javascript.transpiler.generator.State;
import com.google.javascript.transpiler.generator.TryState;
import com.google.javascript.transpiler.parsing.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * A fragment of a generator body that has been lowered to states. It is an intermediate artifact
 * of generator lowering: the composition of fragments into one machine per function consumes it,
 * and the validator rejects any that survive into a finished tree.
 *
 * <p>Both the start state and the fall through state are always allocated, so that fragments can
 * be wired together uniformly.
 */
public final class StateMachineTree extends ParseTree {
  public final int startState;
  public final int fallThroughState;
  public final ImmutableList<State> states;
  public final ImmutableList<TryState> exceptionBlocks;

  public StateMachineTree(
      @Nullable SourceRange location,
      int startState,
      int fallThroughState,
      ImmutableList<State> states,
      ImmutableList<TryState> exceptionBlocks) {
    super(ParseTreeType.STATE_MACHINE, location);
    checkArgument(startState != State.INVALID_STATE, "start state must be allocated");
    checkArgument(fallThroughState != State.INVALID_STATE, "fall through state must be allocated");
    this.startState = startState;
    this.fallThroughState = fallThroughState;
    this.states = checkNotNull(states);
    this.exceptionBlocks = checkNotNull(exceptionBlocks);
  }

  /** The ids of the start state, the fall through state and every state of this machine. */
  public ImmutableSortedSet<Integer> getAllStateIds() {
    ImmutableSortedSet.Builder<Integer> ids = ImmutableSortedSet.naturalOrder();
    ids.add(startState, fallThroughState);
    for (State state : states) {
      ids.add(state.id);
    }
    return ids.build();
  }

  public boolean containsStateId(int id) {
    return getAllStateIds().contains(id);
  }

  @Override
  protected String getDetail() {
    return startState + "->" + fallThroughState + " " + states;
  }
}
