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
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.block;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.breakStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.caseClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.catchClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.continueStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.declaration;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.declarations;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.defaultClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.doLoop;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.exprResult;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.finallyClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forIn;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forLoop;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forOf;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.function;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.ifStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.label;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.name;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.number;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.parameters;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.switchStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.tryStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.whileLoop;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.with;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.parsing.SourceFile;
import com.google.javascript.transpiler.parsing.SourcePosition;
import com.google.javascript.transpiler.parsing.SourceRange;
import com.google.javascript.transpiler.parsing.trees.BlockTree;
import com.google.javascript.transpiler.parsing.trees.BreakStatementTree;
import com.google.javascript.transpiler.parsing.trees.CaseClauseTree;
import com.google.javascript.transpiler.parsing.trees.IfStatementTree;
import com.google.javascript.transpiler.parsing.trees.LabelledStatementTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ParseTreeType;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.SwitchStatementTree;
import com.google.javascript.transpiler.parsing.trees.TryStatementTree;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BreakContinueTransformerTest {

  private StateAllocator stateAllocator;
  private BreakContinueTransformer transformer;

  @Before
  public void setUp() {
    stateAllocator = new StateAllocator();
    transformer = new BreakContinueTransformer(stateAllocator);
  }

  private static StateMachineTree assertStateMachine(ParseTree tree) {
    assertThat(tree.type).isEqualTo(ParseTreeType.STATE_MACHINE);
    return tree.asStateMachine();
  }

  private static BreakState assertBreak(StateMachineTree machine, int id, String label) {
    assertThat(machine.startState).isEqualTo(id);
    assertThat(machine.states).hasSize(1);
    assertThat(machine.exceptionBlocks).isEmpty();
    assertThat(machine.states.get(0)).isInstanceOf(BreakState.class);
    BreakState state = (BreakState) machine.states.get(0);
    assertThat(state.id).isEqualTo(id);
    assertThat(state.label).isEqualTo(label);
    return state;
  }

  private static ContinueState assertContinue(StateMachineTree machine, int id, String label) {
    assertThat(machine.startState).isEqualTo(id);
    assertThat(machine.states).hasSize(1);
    assertThat(machine.states.get(0)).isInstanceOf(ContinueState.class);
    ContinueState state = (ContinueState) machine.states.get(0);
    assertThat(state.id).isEqualTo(id);
    assertThat(state.label).isEqualTo(label);
    return state;
  }

  @Test
  public void testUnlabeledBreak() {
    ParseTree result = transformer.transform(block(breakStatement()));

    BlockTree block = result.asBlock();
    assertThat(block.statements).hasSize(1);
    StateMachineTree machine = assertStateMachine(block.statements.get(0));
    assertBreak(machine, 0, null);
    assertThat(machine.fallThroughState).isEqualTo(1);
    assertThat(stateAllocator.peekNextState()).isEqualTo(2);
  }

  @Test
  public void testBareJumpStatement() {
    assertBreak(assertStateMachine(transformer.transform(breakStatement("out"))), 0, "out");
  }

  @Test
  public void testLabeledContinue() {
    BlockTree block = transformer.transform(block(continueStatement("outer"))).asBlock();
    StateMachineTree machine = assertStateMachine(block.statements.get(0));
    assertContinue(machine, 0, "outer");
    assertThat(machine.fallThroughState).isEqualTo(1);
  }

  @Test
  public void testStateIdsIncrease() {
    BlockTree block =
        transformer
            .transform(block(breakStatement(), exprResult(name("x")), continueStatement()))
            .asBlock();

    StateMachineTree first = assertStateMachine(block.statements.get(0));
    StateMachineTree second = assertStateMachine(block.statements.get(2));
    assertBreak(first, 0, null);
    assertThat(first.fallThroughState).isEqualTo(1);
    assertContinue(second, 2, null);
    assertThat(second.fallThroughState).isEqualTo(3);
    assertThat(first.getAllStateIds()).containsNoneIn(second.getAllStateIds());
  }

  @Test
  public void testAllocatorStartsAtCounter() {
    transformer = new BreakContinueTransformer(new StateAllocator(10));
    StateMachineTree machine = assertStateMachine(transformer.transform(continueStatement()));
    assertContinue(machine, 10, null);
    assertThat(machine.fallThroughState).isEqualTo(11);
  }

  @Test
  public void testUnchangedWithoutJumps() {
    ParseTree tree =
        block(
            exprResult(name("x")),
            ifStatement(name("y"), block(exprResult(number(1))), null),
            tryStatement(block(), catchClause("e", block()), null));
    assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
    assertThat(stateAllocator.peekNextState()).isEqualTo(State.START_STATE);
  }

  @Test
  public void testOnlyChangedSiblingsAreRebuilt() {
    ParseTree unchanged = exprResult(name("x"));
    BlockTree block = transformer.transform(block(unchanged, breakStatement())).asBlock();
    assertThat(block.statements.get(0)).isSameInstanceAs(unchanged);
  }

  @Test
  public void testBreakInIfElse() {
    IfStatementTree result =
        (IfStatementTree)
            transformer.transform(
                ifStatement(name("c"), block(exprResult(name("x"))), breakStatement()));
    assertBreak(assertStateMachine(result.elseClause), 0, null);
  }

  @Test
  public void testBreakInTryCatchFinally() {
    TryStatementTree result =
        (TryStatementTree)
            transformer.transform(
                tryStatement(
                    block(breakStatement()),
                    catchClause("e", block(continueStatement())),
                    finallyClause(block(breakStatement("l")))));

    assertThat(result.children()).hasSize(3);
    assertThat(countStateMachines(result)).isEqualTo(3);
    assertThat(stateAllocator.peekNextState()).isEqualTo(6);
  }

  @Test
  public void testBreakInWith() {
    ParseTree result = transformer.transform(with(name("o"), block(breakStatement())));
    assertThat(countStateMachines(result)).isEqualTo(1);
  }

  @Test
  public void testSwitchLocalBreakIsKept() {
    SwitchStatementTree tree =
        switchStatement(
            name("x"),
            caseClause(number(1), exprResult(name("a")), breakStatement()),
            defaultClause(breakStatement()));
    assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
  }

  @Test
  public void testContinueInSwitchIsLowered() {
    SwitchStatementTree result =
        transformer
            .transform(switchStatement(name("x"), caseClause(number(1), continueStatement())))
            .asSwitchStatement();
    CaseClauseTree caseClause = (CaseClauseTree) result.caseClauses.get(0);
    assertContinue(assertStateMachine(caseClause.statements.get(0)), 0, null);
  }

  @Test
  public void testLabeledBreakOutOfSwitchIsLowered() {
    ParseTree tree =
        label(
            "outer",
            block(switchStatement(name("x"), caseClause(number(1), breakStatement("outer")))));
    ParseTree result = transformer.transform(tree);

    assertThat(result).isNotSameInstanceAs(tree);
    assertThat(countStateMachines(result)).isEqualTo(1);
  }

  @Test
  public void testBreakToSwitchLabelIsKept() {
    ParseTree tree =
        label(
            "s",
            label(
                "t",
                switchStatement(
                    name("x"),
                    caseClause(number(1), breakStatement("s")),
                    caseClause(number(2), breakStatement("t")))));
    assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
  }

  @Test
  public void testBreakToLabelInsideSwitchIsKept() {
    ParseTree tree =
        switchStatement(
            name("x"), caseClause(number(1), label("inner", block(breakStatement("inner")))));
    assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
  }

  @Test
  public void testBreakToLabelOutsideSwitchIsLowered() {
    ParseTree result = transformer.transform(label("l", block(breakStatement("l"))));
    LabelledStatementTree labelled = result.asLabelledStatement();
    assertBreak(assertStateMachine(labelled.statement.asBlock().statements.get(0)), 0, "l");
  }

  @Test
  public void testSwitchDoesNotAffectSiblings() {
    BlockTree result =
        transformer
            .transform(
                block(
                    switchStatement(name("x"), caseClause(number(1), breakStatement())),
                    breakStatement()))
            .asBlock();

    assertThat(result.statements.get(0).type).isEqualTo(ParseTreeType.SWITCH_STATEMENT);
    assertBreak(assertStateMachine(result.statements.get(1)), 0, null);
  }

  @Test
  public void testNestedSwitchBreakIsKept() {
    ParseTree tree =
        switchStatement(
            name("x"),
            caseClause(
                number(1),
                switchStatement(name("y"), defaultClause(breakStatement())),
                breakStatement()));
    assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
  }

  @Test
  public void testLoopsAndFunctionsAreOpaque() {
    ImmutableList<ParseTree> trees =
        ImmutableList.of(
            whileLoop(name("c"), block(breakStatement(), continueStatement())),
            doLoop(block(breakStatement()), name("c")),
            forLoop(null, null, null, block(continueStatement())),
            forIn(declarations(declaration("k", null)), name("o"), block(breakStatement())),
            forOf(name("v"), name("xs"), block(continueStatement())),
            function("f", parameters(), block(breakStatement())));
    for (ParseTree tree : trees) {
      assertThat(transformer.transform(tree)).isSameInstanceAs(tree);
    }
    assertThat(stateAllocator.peekNextState()).isEqualTo(State.START_STATE);
  }

  @Test
  public void testForInBodyIsNotLowered() {
    // A for-in loop is the target of its own unlabeled jumps.
    ParseTree loop =
        forIn(
            declarations(declaration("k", null)),
            name("o"),
            block(ifStatement(name("k"), breakStatement(), continueStatement())));
    BlockTree result = transformer.transform(block(loop, breakStatement())).asBlock();

    assertThat(result.statements.get(0)).isSameInstanceAs(loop);
    assertBreak(assertStateMachine(result.statements.get(1)), 0, null);
  }

  @Test
  public void testStateMachineIsNotTransformedAgain() {
    ParseTree once = transformer.transform(block(breakStatement()));
    int next = stateAllocator.peekNextState();

    assertThat(transformer.transform(once)).isSameInstanceAs(once);
    assertThat(stateAllocator.peekNextState()).isEqualTo(next);
  }

  @Test
  public void testSourceRangeIsKept() {
    SourcePosition position = new SourcePosition(new SourceFile("gen.js"), 12, 1, 4);
    SourceRange location = new SourceRange(position, position);
    StateMachineTree machine =
        assertStateMachine(transformer.transform(new BreakStatementTree(location, null)));
    assertThat(machine.location).isSameInstanceAs(location);
  }

  private static int countStateMachines(ParseTree tree) {
    int count = tree.type == ParseTreeType.STATE_MACHINE ? 1 : 0;
    for (ParseTree child : tree.children()) {
      count += countStateMachines(child);
    }
    return count;
  }
}
