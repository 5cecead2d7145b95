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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.parsing.SourceRange;
import org.jspecify.annotations.Nullable;

/**
 * An immutable node of the abstract syntax tree.
 *
 * <p>Child slots that a grammar rule constrains are usually typed as {@code ParseTree} rather
 * than as the specific tree class, so that a malformed tree produced by a buggy pass can still be
 * represented and then rejected by the validator.
 *
 * <p>The {@code is*} predicates classify a tree by grammar category. They only look at the tree's
 * own kind (and through parentheses); they say nothing about the well-formedness of the children.
 */
public abstract class ParseTree {
  public final ParseTreeType type;
  public final @Nullable SourceRange location;

  protected ParseTree(ParseTreeType type, @Nullable SourceRange location) {
    this.type = checkNotNull(type);
    this.location = location;
  }

  /** The non-null children of this tree, in source order. */
  public ImmutableList<ParseTree> children() {
    return ImmutableList.of();
  }

  public boolean isNull() {
    return type == ParseTreeType.NULL;
  }

  public boolean isPattern() {
    switch (type) {
      case ARRAY_PATTERN:
      case OBJECT_PATTERN:
        return true;
      case PAREN_EXPRESSION:
        return asParenExpression().expression.isPattern();
      default:
        return false;
    }
  }

  public boolean isLeftHandSideExpression() {
    switch (type) {
      case THIS_EXPRESSION:
      case CLASS_EXPRESSION:
      case SUPER_EXPRESSION:
      case IDENTIFIER_EXPRESSION:
      case LITERAL_EXPRESSION:
      case ARRAY_LITERAL_EXPRESSION:
      case OBJECT_LITERAL_EXPRESSION:
      case NEW_EXPRESSION:
      case MEMBER_EXPRESSION:
      case MEMBER_LOOKUP_EXPRESSION:
      case CALL_EXPRESSION:
      case FUNCTION_DECLARATION:
      case QUASI_LITERAL_EXPRESSION:
        return true;
      case PAREN_EXPRESSION:
        return asParenExpression().expression.isLeftHandSideExpression();
      default:
        return false;
    }
  }

  /** Whether this is a MemberExpression in the grammar sense; {@code new} needs its arguments. */
  public boolean isMemberExpression() {
    switch (type) {
      case THIS_EXPRESSION:
      case CLASS_EXPRESSION:
      case SUPER_EXPRESSION:
      case IDENTIFIER_EXPRESSION:
      case LITERAL_EXPRESSION:
      case ARRAY_LITERAL_EXPRESSION:
      case OBJECT_LITERAL_EXPRESSION:
      case PAREN_EXPRESSION:
      case QUASI_LITERAL_EXPRESSION:
      case FUNCTION_DECLARATION:
      case MEMBER_LOOKUP_EXPRESSION:
      case MEMBER_EXPRESSION:
      case CALL_EXPRESSION:
        return true;
      case NEW_EXPRESSION:
        return asNewExpression().arguments != null;
      default:
        return false;
    }
  }

  /** Whether this is an AssignmentExpression, i.e. any expression except a comma expression. */
  public boolean isAssignmentExpression() {
    switch (type) {
      case ARRAY_LITERAL_EXPRESSION:
      case ARROW_FUNCTION_EXPRESSION:
      case BINARY_OPERATOR:
      case CALL_EXPRESSION:
      case CLASS_EXPRESSION:
      case CONDITIONAL_EXPRESSION:
      case FUNCTION_DECLARATION:
      case IDENTIFIER_EXPRESSION:
      case LITERAL_EXPRESSION:
      case MEMBER_EXPRESSION:
      case MEMBER_LOOKUP_EXPRESSION:
      case MISSING_PRIMARY_EXPRESSION:
      case NEW_EXPRESSION:
      case OBJECT_LITERAL_EXPRESSION:
      case PAREN_EXPRESSION:
      case POSTFIX_EXPRESSION:
      case QUASI_LITERAL_EXPRESSION:
      case SUPER_EXPRESSION:
      case THIS_EXPRESSION:
      case UNARY_EXPRESSION:
        return true;
      default:
        return false;
    }
  }

  public boolean isExpression() {
    return isAssignmentExpression() || type == ParseTreeType.COMMA_EXPRESSION;
  }

  public boolean isAssignmentOrSpread() {
    return isAssignmentExpression() || type == ParseTreeType.SPREAD_EXPRESSION;
  }

  public boolean isSpreadPatternElement() {
    return type == ParseTreeType.SPREAD_PATTERN_ELEMENT;
  }

  /**
   * Whether this tree may appear where a statement is expected. A state machine is accepted here
   * so that the validator reaches it and reports it for what it is.
   */
  public boolean isStatement() {
    switch (type) {
      case BLOCK:
      case VARIABLE_STATEMENT:
      case EMPTY_STATEMENT:
      case EXPRESSION_STATEMENT:
      case IF_STATEMENT:
      case DO_WHILE_STATEMENT:
      case WHILE_STATEMENT:
      case FOR_OF_STATEMENT:
      case FOR_IN_STATEMENT:
      case FOR_STATEMENT:
      case CONTINUE_STATEMENT:
      case BREAK_STATEMENT:
      case RETURN_STATEMENT:
      case YIELD_STATEMENT:
      case WITH_STATEMENT:
      case SWITCH_STATEMENT:
      case LABELLED_STATEMENT:
      case THROW_STATEMENT:
      case TRY_STATEMENT:
      case DEBUGGER_STATEMENT:
      case AWAIT_STATEMENT:
      case STATE_MACHINE:
        return true;
      default:
        return false;
    }
  }

  public boolean isSourceElement() {
    switch (type) {
      case FUNCTION_DECLARATION:
      case CLASS_DECLARATION:
        return true;
      default:
        return isStatement();
    }
  }

  public boolean isProgramElement() {
    switch (type) {
      case CLASS_DECLARATION:
      case EXPORT_DECLARATION:
      case FUNCTION_DECLARATION:
      case IMPORT_DECLARATION:
      case MODULE_DECLARATION:
      case MODULE_DEFINITION:
        return true;
      default:
        return isStatement();
    }
  }

  public ArgumentListTree asArgumentList() {
    return (ArgumentListTree) this;
  }

  public BlockTree asBlock() {
    return (BlockTree) this;
  }

  public BreakStatementTree asBreakStatement() {
    return (BreakStatementTree) this;
  }

  public ContinueStatementTree asContinueStatement() {
    return (ContinueStatementTree) this;
  }

  public LabelledStatementTree asLabelledStatement() {
    return (LabelledStatementTree) this;
  }

  public NewExpressionTree asNewExpression() {
    return (NewExpressionTree) this;
  }

  public ParenExpressionTree asParenExpression() {
    return (ParenExpressionTree) this;
  }

  public StateMachineTree asStateMachine() {
    return (StateMachineTree) this;
  }

  public SwitchStatementTree asSwitchStatement() {
    return (SwitchStatementTree) this;
  }

  public VariableDeclarationListTree asVariableDeclarationList() {
    return (VariableDeclarationListTree) this;
  }

  /** Text identifying this tree in dumps: a name, an operator or a literal. */
  protected @Nullable String getDetail() {
    return null;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(type.toString());
    String detail = getDetail();
    if (detail != null) {
      sb.append(' ').append(detail);
    }
    if (location != null) {
      sb.append(' ').append(location.start);
    }
    return sb.toString();
  }

  /** Collects the non-null trees among {@code trees}, in order. */
  protected static ImmutableList<ParseTree> childrenOf(@Nullable Object... trees) {
    ImmutableList.Builder<ParseTree> builder = ImmutableList.builder();
    for (Object tree : trees) {
      if (tree instanceof ParseTree) {
        builder.add((ParseTree) tree);
      } else if (tree instanceof Iterable) {
        for (Object element : (Iterable<?>) tree) {
          builder.add((ParseTree) element);
        }
      }
    }
    return builder.build();
  }
}
