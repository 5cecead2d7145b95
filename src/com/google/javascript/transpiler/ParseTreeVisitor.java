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

import com.google.javascript.transpiler.parsing.trees.ArgumentListTree;
import com.google.javascript.transpiler.parsing.trees.ArrayLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ArrayPatternTree;
import com.google.javascript.transpiler.parsing.trees.ArrowFunctionExpressionTree;
import com.google.javascript.transpiler.parsing.trees.AwaitStatementTree;
import com.google.javascript.transpiler.parsing.trees.BinaryOperatorTree;
import com.google.javascript.transpiler.parsing.trees.BindingElementTree;
import com.google.javascript.transpiler.parsing.trees.BindingIdentifierTree;
import com.google.javascript.transpiler.parsing.trees.BlockTree;
import com.google.javascript.transpiler.parsing.trees.BreakStatementTree;
import com.google.javascript.transpiler.parsing.trees.CallExpressionTree;
import com.google.javascript.transpiler.parsing.trees.CaseClauseTree;
import com.google.javascript.transpiler.parsing.trees.CatchTree;
import com.google.javascript.transpiler.parsing.trees.ClassDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ClassExpressionTree;
import com.google.javascript.transpiler.parsing.trees.CommaExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ConditionalExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ContinueStatementTree;
import com.google.javascript.transpiler.parsing.trees.DebuggerStatementTree;
import com.google.javascript.transpiler.parsing.trees.DefaultClauseTree;
import com.google.javascript.transpiler.parsing.trees.DoWhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.EmptyStatementTree;
import com.google.javascript.transpiler.parsing.trees.ExportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingListTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingTree;
import com.google.javascript.transpiler.parsing.trees.ExportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.ExportSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.ExpressionStatementTree;
import com.google.javascript.transpiler.parsing.trees.FinallyTree;
import com.google.javascript.transpiler.parsing.trees.ForInStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForOfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForStatementTree;
import com.google.javascript.transpiler.parsing.trees.FormalParameterListTree;
import com.google.javascript.transpiler.parsing.trees.FunctionDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.GetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.IdentifierExpressionTree;
import com.google.javascript.transpiler.parsing.trees.IfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ImportBindingTree;
import com.google.javascript.transpiler.parsing.trees.ImportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ImportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.ImportSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.LabelledStatementTree;
import com.google.javascript.transpiler.parsing.trees.LiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.MemberExpressionTree;
import com.google.javascript.transpiler.parsing.trees.MemberLookupExpressionTree;
import com.google.javascript.transpiler.parsing.trees.MissingPrimaryExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDefinitionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleRequireTree;
import com.google.javascript.transpiler.parsing.trees.ModuleSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.NewExpressionTree;
import com.google.javascript.transpiler.parsing.trees.NullTree;
import com.google.javascript.transpiler.parsing.trees.ObjectLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ObjectPatternFieldTree;
import com.google.javascript.transpiler.parsing.trees.ObjectPatternTree;
import com.google.javascript.transpiler.parsing.trees.ParenExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.PostfixExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ProgramTree;
import com.google.javascript.transpiler.parsing.trees.PropertyMethodAssignmentTree;
import com.google.javascript.transpiler.parsing.trees.PropertyNameAssignmentTree;
import com.google.javascript.transpiler.parsing.trees.PropertyNameShorthandTree;
import com.google.javascript.transpiler.parsing.trees.QuasiLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.QuasiLiteralPortionTree;
import com.google.javascript.transpiler.parsing.trees.QuasiSubstitutionTree;
import com.google.javascript.transpiler.parsing.trees.RestParameterTree;
import com.google.javascript.transpiler.parsing.trees.ReturnStatementTree;
import com.google.javascript.transpiler.parsing.trees.SetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.SpreadExpressionTree;
import com.google.javascript.transpiler.parsing.trees.SpreadPatternElementTree;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.SuperExpressionTree;
import com.google.javascript.transpiler.parsing.trees.SwitchStatementTree;
import com.google.javascript.transpiler.parsing.trees.ThisExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ThrowStatementTree;
import com.google.javascript.transpiler.parsing.trees.TryStatementTree;
import com.google.javascript.transpiler.parsing.trees.UnaryExpressionTree;
import com.google.javascript.transpiler.parsing.trees.VariableDeclarationListTree;
import com.google.javascript.transpiler.parsing.trees.VariableDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.VariableStatementTree;
import com.google.javascript.transpiler.parsing.trees.WhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.WithStatementTree;
import com.google.javascript.transpiler.parsing.trees.YieldStatementTree;
import org.jspecify.annotations.Nullable;

/**
 * A read-only walk over a parse tree. {@link #visitAny} dispatches on the tree's kind to one
 * {@code visit} method per kind; by default each of those visits the tree's children in source
 * order. Subclasses override the kinds they care about.
 */
public abstract class ParseTreeVisitor {

  public void visitAny(@Nullable ParseTree tree) {
    if (tree == null) {
      return;
    }

    switch (tree.type) {
      case ARGUMENT_LIST:
        visitArgumentList((ArgumentListTree) tree);
        return;
      case ARRAY_LITERAL_EXPRESSION:
        visitArrayLiteralExpression((ArrayLiteralExpressionTree) tree);
        return;
      case ARRAY_PATTERN:
        visitArrayPattern((ArrayPatternTree) tree);
        return;
      case ARROW_FUNCTION_EXPRESSION:
        visitArrowFunctionExpression((ArrowFunctionExpressionTree) tree);
        return;
      case AWAIT_STATEMENT:
        visitAwaitStatement((AwaitStatementTree) tree);
        return;
      case BINARY_OPERATOR:
        visitBinaryOperator((BinaryOperatorTree) tree);
        return;
      case BINDING_ELEMENT:
        visitBindingElement((BindingElementTree) tree);
        return;
      case BINDING_IDENTIFIER:
        visitBindingIdentifier((BindingIdentifierTree) tree);
        return;
      case BLOCK:
        visitBlock((BlockTree) tree);
        return;
      case BREAK_STATEMENT:
        visitBreakStatement((BreakStatementTree) tree);
        return;
      case CALL_EXPRESSION:
        visitCallExpression((CallExpressionTree) tree);
        return;
      case CASE_CLAUSE:
        visitCaseClause((CaseClauseTree) tree);
        return;
      case CATCH:
        visitCatch((CatchTree) tree);
        return;
      case CLASS_DECLARATION:
        visitClassDeclaration((ClassDeclarationTree) tree);
        return;
      case CLASS_EXPRESSION:
        visitClassExpression((ClassExpressionTree) tree);
        return;
      case COMMA_EXPRESSION:
        visitCommaExpression((CommaExpressionTree) tree);
        return;
      case CONDITIONAL_EXPRESSION:
        visitConditionalExpression((ConditionalExpressionTree) tree);
        return;
      case CONTINUE_STATEMENT:
        visitContinueStatement((ContinueStatementTree) tree);
        return;
      case DEBUGGER_STATEMENT:
        visitDebuggerStatement((DebuggerStatementTree) tree);
        return;
      case DEFAULT_CLAUSE:
        visitDefaultClause((DefaultClauseTree) tree);
        return;
      case DO_WHILE_STATEMENT:
        visitDoWhileStatement((DoWhileStatementTree) tree);
        return;
      case EMPTY_STATEMENT:
        visitEmptyStatement((EmptyStatementTree) tree);
        return;
      case EXPORT_DECLARATION:
        visitExportDeclaration((ExportDeclarationTree) tree);
        return;
      case EXPORT_MAPPING:
        visitExportMapping((ExportMappingTree) tree);
        return;
      case EXPORT_MAPPING_LIST:
        visitExportMappingList((ExportMappingListTree) tree);
        return;
      case EXPORT_SPECIFIER:
        visitExportSpecifier((ExportSpecifierTree) tree);
        return;
      case EXPORT_SPECIFIER_SET:
        visitExportSpecifierSet((ExportSpecifierSetTree) tree);
        return;
      case EXPRESSION_STATEMENT:
        visitExpressionStatement((ExpressionStatementTree) tree);
        return;
      case FINALLY:
        visitFinally((FinallyTree) tree);
        return;
      case FOR_IN_STATEMENT:
        visitForInStatement((ForInStatementTree) tree);
        return;
      case FOR_OF_STATEMENT:
        visitForOfStatement((ForOfStatementTree) tree);
        return;
      case FOR_STATEMENT:
        visitForStatement((ForStatementTree) tree);
        return;
      case FORMAL_PARAMETER_LIST:
        visitFormalParameterList((FormalParameterListTree) tree);
        return;
      case FUNCTION_DECLARATION:
        visitFunctionDeclaration((FunctionDeclarationTree) tree);
        return;
      case GET_ACCESSOR:
        visitGetAccessor((GetAccessorTree) tree);
        return;
      case IDENTIFIER_EXPRESSION:
        visitIdentifierExpression((IdentifierExpressionTree) tree);
        return;
      case IF_STATEMENT:
        visitIfStatement((IfStatementTree) tree);
        return;
      case IMPORT_BINDING:
        visitImportBinding((ImportBindingTree) tree);
        return;
      case IMPORT_DECLARATION:
        visitImportDeclaration((ImportDeclarationTree) tree);
        return;
      case IMPORT_SPECIFIER:
        visitImportSpecifier((ImportSpecifierTree) tree);
        return;
      case IMPORT_SPECIFIER_SET:
        visitImportSpecifierSet((ImportSpecifierSetTree) tree);
        return;
      case LABELLED_STATEMENT:
        visitLabelledStatement((LabelledStatementTree) tree);
        return;
      case LITERAL_EXPRESSION:
        visitLiteralExpression((LiteralExpressionTree) tree);
        return;
      case MEMBER_EXPRESSION:
        visitMemberExpression((MemberExpressionTree) tree);
        return;
      case MEMBER_LOOKUP_EXPRESSION:
        visitMemberLookupExpression((MemberLookupExpressionTree) tree);
        return;
      case MISSING_PRIMARY_EXPRESSION:
        visitMissingPrimaryExpression((MissingPrimaryExpressionTree) tree);
        return;
      case MODULE_DECLARATION:
        visitModuleDeclaration((ModuleDeclarationTree) tree);
        return;
      case MODULE_DEFINITION:
        visitModuleDefinition((ModuleDefinitionTree) tree);
        return;
      case MODULE_EXPRESSION:
        visitModuleExpression((ModuleExpressionTree) tree);
        return;
      case MODULE_REQUIRE:
        visitModuleRequire((ModuleRequireTree) tree);
        return;
      case MODULE_SPECIFIER:
        visitModuleSpecifier((ModuleSpecifierTree) tree);
        return;
      case NEW_EXPRESSION:
        visitNewExpression((NewExpressionTree) tree);
        return;
      case NULL:
        visitNull((NullTree) tree);
        return;
      case OBJECT_LITERAL_EXPRESSION:
        visitObjectLiteralExpression((ObjectLiteralExpressionTree) tree);
        return;
      case OBJECT_PATTERN:
        visitObjectPattern((ObjectPatternTree) tree);
        return;
      case OBJECT_PATTERN_FIELD:
        visitObjectPatternField((ObjectPatternFieldTree) tree);
        return;
      case PAREN_EXPRESSION:
        visitParenExpression((ParenExpressionTree) tree);
        return;
      case POSTFIX_EXPRESSION:
        visitPostfixExpression((PostfixExpressionTree) tree);
        return;
      case PROGRAM:
        visitProgram((ProgramTree) tree);
        return;
      case PROPERTY_METHOD_ASSIGNMENT:
        visitPropertyMethodAssignment((PropertyMethodAssignmentTree) tree);
        return;
      case PROPERTY_NAME_ASSIGNMENT:
        visitPropertyNameAssignment((PropertyNameAssignmentTree) tree);
        return;
      case PROPERTY_NAME_SHORTHAND:
        visitPropertyNameShorthand((PropertyNameShorthandTree) tree);
        return;
      case QUASI_LITERAL_EXPRESSION:
        visitQuasiLiteralExpression((QuasiLiteralExpressionTree) tree);
        return;
      case QUASI_LITERAL_PORTION:
        visitQuasiLiteralPortion((QuasiLiteralPortionTree) tree);
        return;
      case QUASI_SUBSTITUTION:
        visitQuasiSubstitution((QuasiSubstitutionTree) tree);
        return;
      case REST_PARAMETER:
        visitRestParameter((RestParameterTree) tree);
        return;
      case RETURN_STATEMENT:
        visitReturnStatement((ReturnStatementTree) tree);
        return;
      case SET_ACCESSOR:
        visitSetAccessor((SetAccessorTree) tree);
        return;
      case SPREAD_EXPRESSION:
        visitSpreadExpression((SpreadExpressionTree) tree);
        return;
      case SPREAD_PATTERN_ELEMENT:
        visitSpreadPatternElement((SpreadPatternElementTree) tree);
        return;
      case STATE_MACHINE:
        visitStateMachine((StateMachineTree) tree);
        return;
      case SUPER_EXPRESSION:
        visitSuperExpression((SuperExpressionTree) tree);
        return;
      case SWITCH_STATEMENT:
        visitSwitchStatement((SwitchStatementTree) tree);
        return;
      case THIS_EXPRESSION:
        visitThisExpression((ThisExpressionTree) tree);
        return;
      case THROW_STATEMENT:
        visitThrowStatement((ThrowStatementTree) tree);
        return;
      case TRY_STATEMENT:
        visitTryStatement((TryStatementTree) tree);
        return;
      case UNARY_EXPRESSION:
        visitUnaryExpression((UnaryExpressionTree) tree);
        return;
      case VARIABLE_DECLARATION:
        visitVariableDeclaration((VariableDeclarationTree) tree);
        return;
      case VARIABLE_DECLARATION_LIST:
        visitVariableDeclarationList((VariableDeclarationListTree) tree);
        return;
      case VARIABLE_STATEMENT:
        visitVariableStatement((VariableStatementTree) tree);
        return;
      case WHILE_STATEMENT:
        visitWhileStatement((WhileStatementTree) tree);
        return;
      case WITH_STATEMENT:
        visitWithStatement((WithStatementTree) tree);
        return;
      case YIELD_STATEMENT:
        visitYieldStatement((YieldStatementTree) tree);
        return;
    }
    throw new IllegalStateException("Unexpected parse tree type: " + tree.type);
  }

  protected void visitChildren(ParseTree tree) {
    for (ParseTree child : tree.children()) {
      visitAny(child);
    }
  }

  protected void visitArgumentList(ArgumentListTree tree) {
    visitChildren(tree);
  }

  protected void visitArrayLiteralExpression(ArrayLiteralExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitArrayPattern(ArrayPatternTree tree) {
    visitChildren(tree);
  }

  protected void visitArrowFunctionExpression(ArrowFunctionExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitAwaitStatement(AwaitStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitBinaryOperator(BinaryOperatorTree tree) {
    visitChildren(tree);
  }

  protected void visitBindingElement(BindingElementTree tree) {
    visitChildren(tree);
  }

  protected void visitBindingIdentifier(BindingIdentifierTree tree) {
    visitChildren(tree);
  }

  protected void visitBlock(BlockTree tree) {
    visitChildren(tree);
  }

  protected void visitBreakStatement(BreakStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitCallExpression(CallExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitCaseClause(CaseClauseTree tree) {
    visitChildren(tree);
  }

  protected void visitCatch(CatchTree tree) {
    visitChildren(tree);
  }

  protected void visitClassDeclaration(ClassDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitClassExpression(ClassExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitCommaExpression(CommaExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitConditionalExpression(ConditionalExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitContinueStatement(ContinueStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitDebuggerStatement(DebuggerStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitDefaultClause(DefaultClauseTree tree) {
    visitChildren(tree);
  }

  protected void visitDoWhileStatement(DoWhileStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitEmptyStatement(EmptyStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitExportDeclaration(ExportDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitExportMapping(ExportMappingTree tree) {
    visitChildren(tree);
  }

  protected void visitExportMappingList(ExportMappingListTree tree) {
    visitChildren(tree);
  }

  protected void visitExportSpecifier(ExportSpecifierTree tree) {
    visitChildren(tree);
  }

  protected void visitExportSpecifierSet(ExportSpecifierSetTree tree) {
    visitChildren(tree);
  }

  protected void visitExpressionStatement(ExpressionStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitFinally(FinallyTree tree) {
    visitChildren(tree);
  }

  protected void visitForInStatement(ForInStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitForOfStatement(ForOfStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitForStatement(ForStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitFormalParameterList(FormalParameterListTree tree) {
    visitChildren(tree);
  }

  protected void visitFunctionDeclaration(FunctionDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitGetAccessor(GetAccessorTree tree) {
    visitChildren(tree);
  }

  protected void visitIdentifierExpression(IdentifierExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitIfStatement(IfStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitImportBinding(ImportBindingTree tree) {
    visitChildren(tree);
  }

  protected void visitImportDeclaration(ImportDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitImportSpecifier(ImportSpecifierTree tree) {
    visitChildren(tree);
  }

  protected void visitImportSpecifierSet(ImportSpecifierSetTree tree) {
    visitChildren(tree);
  }

  protected void visitLabelledStatement(LabelledStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitLiteralExpression(LiteralExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitMemberExpression(MemberExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitMemberLookupExpression(MemberLookupExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitMissingPrimaryExpression(MissingPrimaryExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitModuleDeclaration(ModuleDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitModuleDefinition(ModuleDefinitionTree tree) {
    visitChildren(tree);
  }

  protected void visitModuleExpression(ModuleExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitModuleRequire(ModuleRequireTree tree) {
    visitChildren(tree);
  }

  protected void visitModuleSpecifier(ModuleSpecifierTree tree) {
    visitChildren(tree);
  }

  protected void visitNewExpression(NewExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitNull(NullTree tree) {
    visitChildren(tree);
  }

  protected void visitObjectLiteralExpression(ObjectLiteralExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitObjectPattern(ObjectPatternTree tree) {
    visitChildren(tree);
  }

  protected void visitObjectPatternField(ObjectPatternFieldTree tree) {
    visitChildren(tree);
  }

  protected void visitParenExpression(ParenExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitPostfixExpression(PostfixExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitProgram(ProgramTree tree) {
    visitChildren(tree);
  }

  protected void visitPropertyMethodAssignment(PropertyMethodAssignmentTree tree) {
    visitChildren(tree);
  }

  protected void visitPropertyNameAssignment(PropertyNameAssignmentTree tree) {
    visitChildren(tree);
  }

  protected void visitPropertyNameShorthand(PropertyNameShorthandTree tree) {
    visitChildren(tree);
  }

  protected void visitQuasiLiteralExpression(QuasiLiteralExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitQuasiLiteralPortion(QuasiLiteralPortionTree tree) {
    visitChildren(tree);
  }

  protected void visitQuasiSubstitution(QuasiSubstitutionTree tree) {
    visitChildren(tree);
  }

  protected void visitRestParameter(RestParameterTree tree) {
    visitChildren(tree);
  }

  protected void visitReturnStatement(ReturnStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitSetAccessor(SetAccessorTree tree) {
    visitChildren(tree);
  }

  protected void visitSpreadExpression(SpreadExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitSpreadPatternElement(SpreadPatternElementTree tree) {
    visitChildren(tree);
  }

  protected void visitStateMachine(StateMachineTree tree) {
    visitChildren(tree);
  }

  protected void visitSuperExpression(SuperExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitSwitchStatement(SwitchStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitThisExpression(ThisExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitThrowStatement(ThrowStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitTryStatement(TryStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitUnaryExpression(UnaryExpressionTree tree) {
    visitChildren(tree);
  }

  protected void visitVariableDeclaration(VariableDeclarationTree tree) {
    visitChildren(tree);
  }

  protected void visitVariableDeclarationList(VariableDeclarationListTree tree) {
    visitChildren(tree);
  }

  protected void visitVariableStatement(VariableStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitWhileStatement(WhileStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitWithStatement(WithStatementTree tree) {
    visitChildren(tree);
  }

  protected void visitYieldStatement(YieldStatementTree tree) {
    visitChildren(tree);
  }
}
