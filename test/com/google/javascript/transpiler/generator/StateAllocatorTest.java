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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StateAllocatorTest {

  @Test
  public void testStartsAtStartState() {
    StateAllocator allocator = new StateAllocator();
    assertThat(allocator.allocateState()).isEqualTo(State.START_STATE);
    assertThat(allocator.allocateState()).isEqualTo(State.START_STATE + 1);
  }

  @Test
  public void testStartsAtGivenState() {
    StateAllocator allocator = new StateAllocator(7);
    assertThat(allocator.peekNextState()).isEqualTo(7);
    assertThat(allocator.allocateState()).isEqualTo(7);
    assertThat(allocator.allocateState()).isEqualTo(8);
    assertThat(allocator.peekNextState()).isEqualTo(9);
  }

  @Test
  public void testPeekDoesNotAllocate() {
    StateAllocator allocator = new StateAllocator();
    allocator.peekNextState();
    assertThat(allocator.allocateState()).isEqualTo(0);
  }

  @Test
  public void testRejectsNegativeStart() {
    assertThrows(IllegalArgumentException.class, () -> new StateAllocator(State.INVALID_STATE));
  }

  @Test
  public void testStatesRejectInvalidId() {
    assertThrows(IllegalArgumentException.class, () -> new BreakState(State.INVALID_STATE, null));
  }

  @Test
  public void testStateToString() {
    assertThat(new BreakState(3, null).toString()).isEqualTo("BreakState(3)");
    assertThat(new BreakState(3, "l").toString()).isEqualTo("BreakState(3, l)");
  }
}
