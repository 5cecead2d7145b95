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
import com.google.common.collect.ImmutableSet;
import com.google.javascript.transpiler.ParseTreeTransformer;
import com.google.javascript.transpiler.parsing.trees.BreakStatementTree;
import com.google.javascript.transpiler.parsing.trees.ContinueStatementTree;
import com.google.javascript.transpiler.parsing.trees.DoWhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForInStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForOfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForStatementTree;
import com.google.javascript.transpiler.parsing.trees.FunctionDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.LabelledStatementTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ParseTreeType;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.SwitchStatementTree;
import com.google.javascript.transpiler.parsing.trees.WhileStatementTree;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts the break and continue statements of a statement that contains no yield into state
 * machines. Always called from a context where the containing block contains a yield; the caller
 * wraps the statement itself into a state machine and also lowers the parents of any jump this
 * transformer lowered.
 *
 * <p>A continue is always lowered. A break is lowered unless it is local to a switch statement
 * being transformed: an unlabeled break, or one naming a label bound on the switch or inside it.
 * Loops, functions and classes are returned unchanged, since their own lowering resolves the jumps
 * that target them.
 *
 * <p>Whether breaks are local is fixed per instance. A switch is rewritten by a child transformer
 * sharing the same {@link StateAllocator}, so the setting never leaks to sibling subtrees.
 */
public final class BreakContinueTransformer extends ParseTreeTransformer {
  private static final Logger logger =
      Logger.getLogger(BreakContinueTransformer.class.getName());

  private final StateAllocator stateAllocator;
  private final boolean transformBreaks;
  private final ImmutableSet<String> switchLabels;

  public BreakContinueTransformer(StateAllocator stateAllocator) {
    this(stateAllocator, true, ImmutableSet.of());
  }

  private BreakContinueTransformer(
      StateAllocator stateAllocator, boolean transformBreaks, ImmutableSet<String> switchLabels) {
    this.stateAllocator = checkNotNull(stateAllocator);
    this.transformBreaks = transformBreaks;
    this.switchLabels = switchLabels;
  }

  /** Lowers the non-local jumps of {@code statement}. */
  public ParseTree transform(ParseTree statement) {
    return checkNotNull(transformAny(checkNotNull(statement)));
  }

  private StateMachineTree stateToStateMachine(ParseTree original, State newState) {
    // Consumers wire every fragment's fall through edge, so even a single jump gets one.
    int fallThroughState = stateAllocator.allocateState();
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest("Lowered " + original + " to " + newState + ", falls through to "
          + fallThroughState);
    }
    return new StateMachineTree(
        original.location,
        newState.id,
        fallThroughState,
        ImmutableList.of(newState),
        ImmutableList.of());
  }

  private boolean isLocalBreak(BreakStatementTree tree) {
    if (transformBreaks) {
      return false;
    }
    String label = tree.getLabel();
    return label == null || switchLabels.contains(label);
  }

  @Override
  protected ParseTree transformBreakStatement(BreakStatementTree tree) {
    if (isLocalBreak(tree)) {
      return tree;
    }
    return stateToStateMachine(
        tree, new BreakState(stateAllocator.allocateState(), tree.getLabel()));
  }

  @Override
  protected ParseTree transformContinueStatement(ContinueStatementTree tree) {
    return stateToStateMachine(
        tree, new ContinueState(stateAllocator.allocateState(), tree.getLabel()));
  }

  @Override
  protected ParseTree transformDoWhileStatement(DoWhileStatementTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformForInStatement(ForInStatementTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformForOfStatement(ForOfStatementTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformForStatement(ForStatementTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformFunctionDeclaration(FunctionDeclarationTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformStateMachine(StateMachineTree tree) {
    return tree;
  }

  @Override
  protected ParseTree transformWhileStatement(WhileStatementTree tree) {
    return tree;
  }

  /**
   * Labels in front of a switch name the switch itself, so breaks to them stay local to it.
   * Inside a switch, every label bound on a nested statement is local as well.
   */
  @Override
  protected ParseTree transformLabelledStatement(LabelledStatementTree tree) {
    ParseTree statement = tree.statement;
    ImmutableSet.Builder<String> labels = ImmutableSet.builder();
    labels.add(tree.name.value);
    while (statement.type == ParseTreeType.LABELLED_STATEMENT) {
      LabelledStatementTree labelled = statement.asLabelledStatement();
      labels.add(labelled.name.value);
      statement = labelled.statement;
    }
    if (statement.type != ParseTreeType.SWITCH_STATEMENT && transformBreaks) {
      return super.transformLabelledStatement(tree);
    }

    BreakContinueTransformer inner =
        new BreakContinueTransformer(
            stateAllocator,
            transformBreaks,
            ImmutableSet.<String>builder().addAll(switchLabels).addAll(labels.build()).build());
    ParseTree transformed = inner.transformAny(tree.statement);
    if (transformed == tree.statement) {
      return tree;
    }
    return new LabelledStatementTree(tree.location, tree.name, transformed);
  }

  @Override
  protected ParseTree transformSwitchStatement(SwitchStatementTree tree) {
    if (!transformBreaks) {
      return super.transformSwitchStatement(tree);
    }
    BreakContinueTransformer inner =
        new BreakContinueTransformer(stateAllocator, false, switchLabels);
    return inner.transformSwitchStatement(tree);
  }
}
