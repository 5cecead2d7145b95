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

package com.google.javascript.transpiler;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.parsing.trees.BlockTree;
import com.google.javascript.transpiler.parsing.trees.BreakStatementTree;
import com.google.javascript.transpiler.parsing.trees.CaseClauseTree;
import com.google.javascript.transpiler.parsing.trees.CatchTree;
import com.google.javascript.transpiler.parsing.trees.ContinueStatementTree;
import com.google.javascript.transpiler.parsing.trees.DefaultClauseTree;
import com.google.javascript.transpiler.parsing.trees.DoWhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.FinallyTree;
import com.google.javascript.transpiler.parsing.trees.ForInStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForOfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForStatementTree;
import com.google.javascript.transpiler.parsing.trees.FunctionDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.IfStatementTree;
import com.google.javascript.transpiler.parsing.trees.LabelledStatementTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDefinitionTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ProgramTree;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.SwitchStatementTree;
import com.google.javascript.transpiler.parsing.trees.TryStatementTree;
import com.google.javascript.transpiler.parsing.trees.WhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.WithStatementTree;
import org.jspecify.annotations.Nullable;

/**
 * A structure preserving rewrite of the statements of a tree.
 *
 * <p>Each {@code transform} method rebuilds its tree only when one of the children changed, so an
 * untouched subtree keeps its identity. Expressions are returned as they are: outside of function
 * bodies no statement can appear inside an expression.
 */
public abstract class ParseTreeTransformer {

  public @Nullable ParseTree transformAny(@Nullable ParseTree tree) {
    if (tree == null) {
      return null;
    }
    switch (tree.type) {
      case BLOCK:
        return transformBlock((BlockTree) tree);
      case BREAK_STATEMENT:
        return transformBreakStatement((BreakStatementTree) tree);
      case CASE_CLAUSE:
        return transformCaseClause((CaseClauseTree) tree);
      case CATCH:
        return transformCatch((CatchTree) tree);
      case CONTINUE_STATEMENT:
        return transformContinueStatement((ContinueStatementTree) tree);
      case DEFAULT_CLAUSE:
        return transformDefaultClause((DefaultClauseTree) tree);
      case DO_WHILE_STATEMENT:
        return transformDoWhileStatement((DoWhileStatementTree) tree);
      case FINALLY:
        return transformFinally((FinallyTree) tree);
      case FOR_IN_STATEMENT:
        return transformForInStatement((ForInStatementTree) tree);
      case FOR_OF_STATEMENT:
        return transformForOfStatement((ForOfStatementTree) tree);
      case FOR_STATEMENT:
        return transformForStatement((ForStatementTree) tree);
      case FUNCTION_DECLARATION:
        return transformFunctionDeclaration((FunctionDeclarationTree) tree);
      case IF_STATEMENT:
        return transformIfStatement((IfStatementTree) tree);
      case LABELLED_STATEMENT:
        return transformLabelledStatement((LabelledStatementTree) tree);
      case MODULE_DEFINITION:
        return transformModuleDefinition((ModuleDefinitionTree) tree);
      case PROGRAM:
        return transformProgram((ProgramTree) tree);
      case STATE_MACHINE:
        return transformStateMachine((StateMachineTree) tree);
      case SWITCH_STATEMENT:
        return transformSwitchStatement((SwitchStatementTree) tree);
      case TRY_STATEMENT:
        return transformTryStatement((TryStatementTree) tree);
      case WHILE_STATEMENT:
        return transformWhileStatement((WhileStatementTree) tree);
      case WITH_STATEMENT:
        return transformWithStatement((WithStatementTree) tree);
      default:
        return tree;
    }
  }

  /** Transforms each element, returning {@code list} itself when no element changed. */
  protected ImmutableList<ParseTree> transformList(ImmutableList<ParseTree> list) {
    ImmutableList.Builder<ParseTree> builder = null;
    for (int i = 0; i < list.size(); i++) {
      ParseTree element = list.get(i);
      ParseTree transformed = transformAny(element);
      if (builder == null && transformed != element) {
        builder = ImmutableList.builder();
        builder.addAll(list.subList(0, i));
      }
      if (builder != null) {
        builder.add(transformed);
      }
    }
    return builder == null ? list : builder.build();
  }

  protected ParseTree transformBlock(BlockTree tree) {
    ImmutableList<ParseTree> statements = transformList(tree.statements);
    if (statements == tree.statements) {
      return tree;
    }
    return new BlockTree(tree.location, statements);
  }

  protected ParseTree transformBreakStatement(BreakStatementTree tree) {
    return tree;
  }

  protected ParseTree transformCaseClause(CaseClauseTree tree) {
    ImmutableList<ParseTree> statements = transformList(tree.statements);
    if (statements == tree.statements) {
      return tree;
    }
    return new CaseClauseTree(tree.location, tree.expression, statements);
  }

  protected ParseTree transformCatch(CatchTree tree) {
    ParseTree catchBody = transformAny(tree.catchBody);
    if (catchBody == tree.catchBody) {
      return tree;
    }
    return new CatchTree(tree.location, tree.binding, catchBody);
  }

  protected ParseTree transformContinueStatement(ContinueStatementTree tree) {
    return tree;
  }

  protected ParseTree transformDefaultClause(DefaultClauseTree tree) {
    ImmutableList<ParseTree> statements = transformList(tree.statements);
    if (statements == tree.statements) {
      return tree;
    }
    return new DefaultClauseTree(tree.location, statements);
  }

  protected ParseTree transformDoWhileStatement(DoWhileStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new DoWhileStatementTree(tree.location, body, tree.condition);
  }

  protected ParseTree transformFinally(FinallyTree tree) {
    ParseTree block = transformAny(tree.block);
    if (block == tree.block) {
      return tree;
    }
    return new FinallyTree(tree.location, block);
  }

  protected ParseTree transformForInStatement(ForInStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new ForInStatementTree(tree.location, tree.initializer, tree.collection, body);
  }

  protected ParseTree transformForOfStatement(ForOfStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new ForOfStatementTree(tree.location, tree.initializer, tree.collection, body);
  }

  protected ParseTree transformForStatement(ForStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new ForStatementTree(
        tree.location, tree.initializer, tree.condition, tree.increment, body);
  }

  protected ParseTree transformFunctionDeclaration(FunctionDeclarationTree tree) {
    ParseTree functionBody = transformAny(tree.functionBody);
    if (functionBody == tree.functionBody) {
      return tree;
    }
    return new FunctionDeclarationTree(
        tree.location, tree.name, tree.isGenerator, tree.formalParameterList, functionBody);
  }

  protected ParseTree transformIfStatement(IfStatementTree tree) {
    ParseTree ifClause = transformAny(tree.ifClause);
    ParseTree elseClause = transformAny(tree.elseClause);
    if (ifClause == tree.ifClause && elseClause == tree.elseClause) {
      return tree;
    }
    return new IfStatementTree(tree.location, tree.condition, ifClause, elseClause);
  }

  protected ParseTree transformLabelledStatement(LabelledStatementTree tree) {
    ParseTree statement = transformAny(tree.statement);
    if (statement == tree.statement) {
      return tree;
    }
    return new LabelledStatementTree(tree.location, tree.name, statement);
  }

  protected ParseTree transformModuleDefinition(ModuleDefinitionTree tree) {
    ImmutableList<ParseTree> elements = transformList(tree.elements);
    if (elements == tree.elements) {
      return tree;
    }
    return new ModuleDefinitionTree(tree.location, tree.name, elements);
  }

  protected ParseTree transformProgram(ProgramTree tree) {
    ImmutableList<ParseTree> elements = transformList(tree.programElements);
    if (elements == tree.programElements) {
      return tree;
    }
    return new ProgramTree(tree.location, elements);
  }

  protected ParseTree transformStateMachine(StateMachineTree tree) {
    return tree;
  }

  protected ParseTree transformSwitchStatement(SwitchStatementTree tree) {
    ImmutableList<ParseTree> caseClauses = transformList(tree.caseClauses);
    if (caseClauses == tree.caseClauses) {
      return tree;
    }
    return new SwitchStatementTree(tree.location, tree.expression, caseClauses);
  }

  protected ParseTree transformTryStatement(TryStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    ParseTree catchBlock = transformAny(tree.catchBlock);
    ParseTree finallyBlock = transformAny(tree.finallyBlock);
    if (body == tree.body
        && catchBlock == tree.catchBlock
        && finallyBlock == tree.finallyBlock) {
      return tree;
    }
    return new TryStatementTree(tree.location, body, catchBlock, finallyBlock);
  }

  protected ParseTree transformWhileStatement(WhileStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new WhileStatementTree(tree.location, tree.condition, body);
  }

  protected ParseTree transformWithStatement(WithStatementTree tree) {
    ParseTree body = transformAny(tree.body);
    if (body == tree.body) {
      return tree;
    }
    return new WithStatementTree(tree.location, tree.expression, body);
  }
}
