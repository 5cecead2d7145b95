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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.generator.BreakState;
import com.google.javascript.transpiler.generator.ContinueState;
import com.google.javascript.transpiler.generator.State;
import com.google.javascript.transpiler.generator.TryState;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StateMachineTreeTest {

  private static StateMachineTree machine(int start, int fallThrough, State... states) {
    return new StateMachineTree(
        null, start, fallThrough, ImmutableList.copyOf(states), ImmutableList.of());
  }

  @Test
  public void testAllStateIds() {
    StateMachineTree tree = machine(4, 9, new BreakState(4, null), new ContinueState(6, "l"));
    assertThat(tree.getAllStateIds()).containsExactly(4, 6, 9).inOrder();
    assertThat(tree.containsStateId(6)).isTrue();
    assertThat(tree.containsStateId(5)).isFalse();
  }

  @Test
  public void testStatesMustBeAllocated() {
    assertThrows(IllegalArgumentException.class, () -> machine(State.INVALID_STATE, 1));
    assertThrows(IllegalArgumentException.class, () -> machine(0, State.INVALID_STATE));
  }

  @Test
  public void testIsStatementWithoutChildren() {
    StateMachineTree tree = machine(0, 1, new BreakState(0, null));
    assertThat(tree.isStatement()).isTrue();
    assertThat(tree.isExpression()).isFalse();
    assertThat(tree.children()).isEmpty();
  }

  @Test
  public void testExceptionBlocks() {
    TryState handler = new TryState(TryState.Kind.CATCH, ImmutableList.of(2, 3), 5);
    StateMachineTree tree =
        new StateMachineTree(null, 2, 6, ImmutableList.of(), ImmutableList.of(handler));
    assertThat(tree.exceptionBlocks).containsExactly(handler);
    assertThat(tree.getAllStateIds()).containsExactly(2, 6);
  }

  @Test
  public void testToString() {
    assertThat(machine(0, 1, new BreakState(0, "l")).toString())
        .isEqualTo("STATE_MACHINE 0->1 [BreakState(0, l)]");
  }
}
