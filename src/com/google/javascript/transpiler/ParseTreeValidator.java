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

import com.google.javascript.transpiler.parsing.PredefinedName;
import com.google.javascript.transpiler.parsing.SourceRange;
import com.google.javascript.transpiler.parsing.TokenType;
import com.google.javascript.transpiler.parsing.trees.ArgumentListTree;
import com.google.javascript.transpiler.parsing.trees.ArrayLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ArrayPatternTree;
import com.google.javascript.transpiler.parsing.trees.ArrowFunctionExpressionTree;
import com.google.javascript.transpiler.parsing.trees.AwaitStatementTree;
import com.google.javascript.transpiler.parsing.trees.BinaryOperatorTree;
import com.google.javascript.transpiler.parsing.trees.BindingElementTree;
import com.google.javascript.transpiler.parsing.trees.BlockTree;
import com.google.javascript.transpiler.parsing.trees.CallExpressionTree;
import com.google.javascript.transpiler.parsing.trees.CaseClauseTree;
import com.google.javascript.transpiler.parsing.trees.CatchTree;
import com.google.javascript.transpiler.parsing.trees.ClassDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ClassExpressionTree;
import com.google.javascript.transpiler.parsing.trees.CommaExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ConditionalExpressionTree;
import com.google.javascript.transpiler.parsing.trees.DefaultClauseTree;
import com.google.javascript.transpiler.parsing.trees.DoWhileStatementTree;
import com.google.javascript.transpiler.parsing.trees.ExportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingListTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingTree;
import com.google.javascript.transpiler.parsing.trees.ExportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.ExpressionStatementTree;
import com.google.javascript.transpiler.parsing.trees.FinallyTree;
import com.google.javascript.transpiler.parsing.trees.ForInStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForOfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ForStatementTree;
import com.google.javascript.transpiler.parsing.trees.FormalParameterListTree;
import com.google.javascript.transpiler.parsing.trees.FunctionDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.GetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.IfStatementTree;
import com.google.javascript.transpiler.parsing.trees.ImportBindingTree;
import com.google.javascript.transpiler.parsing.trees.ImportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ImportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.LabelledStatementTree;
import com.google.javascript.transpiler.parsing.trees.MemberExpressionTree;
import com.google.javascript.transpiler.parsing.trees.MemberLookupExpressionTree;
import com.google.javascript.transpiler.parsing.trees.MissingPrimaryExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDefinitionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleRequireTree;
import com.google.javascript.transpiler.parsing.trees.ModuleSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.NewExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ObjectLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ObjectPatternFieldTree;
import com.google.javascript.transpiler.parsing.trees.ObjectPatternTree;
import com.google.javascript.transpiler.parsing.trees.ParenExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ParseTreeType;
import com.google.javascript.transpiler.parsing.trees.PostfixExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ProgramTree;
import com.google.javascript.transpiler.parsing.trees.PropertyMethodAssignmentTree;
import com.google.javascript.transpiler.parsing.trees.PropertyNameAssignmentTree;
import com.google.javascript.transpiler.parsing.trees.QuasiLiteralExpressionTree;
import com.google.javascript.transpiler.parsing.trees.QuasiSubstitutionTree;
import com.google.javascript.transpiler.parsing.trees.RestParameterTree;
import com.google.javascript.transpiler.parsing.trees.ReturnStatementTree;
import com.google.javascript.transpiler.parsing.trees.SetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.SpreadExpressionTree;
import com.google.javascript.transpiler.parsing.trees.SpreadPatternElementTree;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.SwitchStatementTree;
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
 * Validates the structure of a parse tree against the grammar of each tree kind.
 *
 * <p>Only rules local to one tree and its direct children are checked. The walk stops at the first
 * violation, before descending into the offending subtree, so a malformed tree is reported once.
 *
 * <p>Validation failures are compiler bugs: see {@link #validate}.
 */
public final class ParseTreeValidator extends ParseTreeVisitor {

  // Possible enhancements, which need context from enclosing trees:
  // * operator precedence
  // * expressions with or without "in"
  // * return statements must be in a function
  // * break must be enclosed in loops or switches, continue in loops

  /**
   * Unwinds the walk from a violation to {@link #validate}. Kept apart from every other exception
   * so that a bug in the validator itself is never reported as a malformed tree.
   */
  private static final class ValidationError extends RuntimeException {
    final @Nullable ParseTree tree;

    ValidationError(@Nullable ParseTree tree, String message) {
      super(message, null, false, false);
      this.tree = tree;
    }
  }

  private ParseTreeValidator() {}

  /**
   * Validates a parse tree.
   *
   * @throws ParseTreeValidationException describing the first violation, with the tree rendered
   *     and the offending subtree highlighted. Any other exception raised during the walk
   *     propagates unchanged.
   */
  public static void validate(ParseTree tree) {
    ParseTreeValidator validator = new ParseTreeValidator();
    try {
      validator.visitAny(tree);
    } catch (ValidationError e) {
      ParseTree offendingTree = e.tree != null ? e.tree : tree;
      SourceRange location = offendingTree.location;
      if (location == null) {
        location = tree.location;
      }
      String locationString = location != null ? location.start.toString() : "(unknown)";
      throw new ParseTreeValidationException(
          e.getMessage(),
          offendingTree,
          locationString,
          ParseTreeWriter.write(tree, offendingTree, /* showLineNumbers= */ true));
    }
  }

  /** Optional children may be absent or the NULL tree. */
  private static boolean isPresent(@Nullable ParseTree tree) {
    return tree != null && !tree.isNull();
  }

  private void fail(@Nullable ParseTree tree, String message) {
    throw new ValidationError(tree, message);
  }

  private void check(boolean condition, @Nullable ParseTree tree, String message) {
    if (!condition) {
      fail(tree, message);
    }
  }

  private void checkVisit(boolean condition, ParseTree tree, String message) {
    check(condition, tree, message);
    visitAny(tree);
  }

  private void checkType(ParseTreeType type, ParseTree tree, String message) {
    checkVisit(tree.type == type, tree, message);
  }

  /** Checks that a {@code new} used as an operand has its arguments. */
  private void checkNewHasArguments(ParseTree operand) {
    if (operand.type == ParseTreeType.NEW_EXPRESSION) {
      check(operand.asNewExpression().arguments != null, operand, "new args expected");
    }
  }

  @Override
  protected void visitArgumentList(ArgumentListTree tree) {
    for (ParseTree argument : tree.arguments) {
      checkVisit(argument.isAssignmentOrSpread(), argument, "assignment or spread expected");
    }
  }

  @Override
  protected void visitArrayLiteralExpression(ArrayLiteralExpressionTree tree) {
    for (ParseTree element : tree.elements) {
      checkVisit(
          element.isNull() || element.isAssignmentOrSpread(),
          element,
          "assignment or spread expected");
    }
  }

  @Override
  protected void visitArrayPattern(ArrayPatternTree tree) {
    for (int i = 0; i < tree.elements.size(); i++) {
      ParseTree element = tree.elements.get(i);
      if (element.isSpreadPatternElement()) {
        check(
            i == tree.elements.size() - 1,
            element,
            "spread in array patterns must be the last element");
      }
      checkVisit(
          element.isNull()
              || element.type == ParseTreeType.BINDING_ELEMENT
              || element.type == ParseTreeType.IDENTIFIER_EXPRESSION
              || element.isLeftHandSideExpression()
              || element.isPattern()
              || element.isSpreadPatternElement(),
          element,
          "null, sub pattern, left hand side expression or spread expected");
    }
  }

  @Override
  protected void visitArrowFunctionExpression(ArrowFunctionExpressionTree tree) {
    checkType(
        ParseTreeType.FORMAL_PARAMETER_LIST, tree.formalParameters, "formal parameters expected");
    checkVisit(
        tree.functionBody.type == ParseTreeType.BLOCK
            || tree.functionBody.isAssignmentExpression(),
        tree.functionBody,
        "block or assignment expression expected");
  }

  @Override
  protected void visitAwaitStatement(AwaitStatementTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "await must be expression");
  }

  @Override
  protected void visitBinaryOperator(BinaryOperatorTree tree) {
    switch (tree.operator.type) {
        // assignment
      case EQUAL:
      case STAR_EQUAL:
      case SLASH_EQUAL:
      case PERCENT_EQUAL:
      case PLUS_EQUAL:
      case MINUS_EQUAL:
      case LEFT_SHIFT_EQUAL:
      case RIGHT_SHIFT_EQUAL:
      case UNSIGNED_RIGHT_SHIFT_EQUAL:
      case AMPERSAND_EQUAL:
      case CARET_EQUAL:
      case BAR_EQUAL:
        check(
            tree.left.isLeftHandSideExpression() || tree.left.isPattern(),
            tree.left,
            "left hand side expression or pattern expected");
        check(tree.right.isAssignmentExpression(), tree.right, "assignment expression expected");
        break;

        // logical
      case AND:
      case OR:
      case BAR:
      case CARET:
      case AMPERSAND:

        // equality
      case EQUAL_EQUAL:
      case NOT_EQUAL:
      case EQUAL_EQUAL_EQUAL:
      case NOT_EQUAL_EQUAL:

        // relational
      case OPEN_ANGLE:
      case CLOSE_ANGLE:
      case GREATER_EQUAL:
      case LESS_EQUAL:
      case INSTANCEOF:
      case IN:

        // shift
      case LEFT_SHIFT:
      case RIGHT_SHIFT:
      case UNSIGNED_RIGHT_SHIFT:

        // additive
      case PLUS:
      case MINUS:

        // multiplicative
      case STAR:
      case SLASH:
      case PERCENT:
        checkAssignmentOperands(tree);
        break;

      case IDENTIFIER:
        String name = tree.operator.asIdentifier().value;
        if (!name.equals(PredefinedName.IS) && !name.equals(PredefinedName.ISNT)) {
          fail(tree, "unexpected binary operator");
        }
        checkAssignmentOperands(tree);
        break;

      default:
        fail(tree, "unexpected binary operator");
    }
    visitAny(tree.left);
    visitAny(tree.right);
  }

  private void checkAssignmentOperands(BinaryOperatorTree tree) {
    check(tree.left.isAssignmentExpression(), tree.left, "assignment expression expected");
    check(tree.right.isAssignmentExpression(), tree.right, "assignment expression expected");
  }

  @Override
  protected void visitBindingElement(BindingElementTree tree) {
    ParseTree binding = tree.binding;
    checkVisit(
        binding.type == ParseTreeType.BINDING_IDENTIFIER
            || binding.type == ParseTreeType.OBJECT_PATTERN
            || binding.type == ParseTreeType.ARRAY_PATTERN,
        binding,
        "expected valid binding element");
    if (isPresent(tree.initializer)) {
      checkVisit(
          tree.initializer.isAssignmentExpression(),
          tree.initializer,
          "assignment expression expected");
    }
  }

  @Override
  protected void visitBlock(BlockTree tree) {
    for (ParseTree statement : tree.statements) {
      checkVisit(
          statement.isSourceElement(), statement, "statement or function declaration expected");
    }
  }

  @Override
  protected void visitCallExpression(CallExpressionTree tree) {
    checkNewHasArguments(tree.operand);
    check(tree.operand.isMemberExpression(), tree.operand, "member expression expected");
    visitAny(tree.operand);
    visitAny(tree.arguments);
  }

  @Override
  protected void visitCaseClause(CaseClauseTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    for (ParseTree statement : tree.statements) {
      checkVisit(statement.isStatement(), statement, "statement expected");
    }
  }

  @Override
  protected void visitCatch(CatchTree tree) {
    checkVisit(
        tree.binding.isPattern() || tree.binding.type == ParseTreeType.BINDING_IDENTIFIER,
        tree.binding,
        "binding identifier expected");
    checkType(ParseTreeType.BLOCK, tree.catchBody, "block expected");
  }

  @Override
  protected void visitClassDeclaration(ClassDeclarationTree tree) {
    checkClass(tree.superClass, tree.elements);
  }

  @Override
  protected void visitClassExpression(ClassExpressionTree tree) {
    checkClass(tree.superClass, tree.elements);
  }

  private void checkClass(@Nullable ParseTree superClass, Iterable<ParseTree> elements) {
    if (isPresent(superClass)) {
      checkVisit(
          superClass.isAssignmentExpression(), superClass, "assignment expression expected");
    }
    for (ParseTree element : elements) {
      switch (element.type) {
        case GET_ACCESSOR:
        case SET_ACCESSOR:
        case PROPERTY_METHOD_ASSIGNMENT:
          break;
        default:
          fail(element, "class element expected");
      }
      visitAny(element);
    }
  }

  @Override
  protected void visitCommaExpression(CommaExpressionTree tree) {
    for (ParseTree expression : tree.expressions) {
      checkVisit(expression.isAssignmentExpression(), expression, "expression expected");
    }
  }

  @Override
  protected void visitConditionalExpression(ConditionalExpressionTree tree) {
    checkVisit(tree.condition.isAssignmentExpression(), tree.condition, "expression expected");
    checkVisit(tree.left.isAssignmentExpression(), tree.left, "expression expected");
    checkVisit(tree.right.isAssignmentExpression(), tree.right, "expression expected");
  }

  @Override
  protected void visitDefaultClause(DefaultClauseTree tree) {
    for (ParseTree statement : tree.statements) {
      checkVisit(statement.isStatement(), statement, "statement expected");
    }
  }

  @Override
  protected void visitDoWhileStatement(DoWhileStatementTree tree) {
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
    checkVisit(tree.condition.isExpression(), tree.condition, "expression expected");
  }

  @Override
  protected void visitExportDeclaration(ExportDeclarationTree tree) {
    ParseTreeType declType = tree.declaration.type;
    checkVisit(
        declType == ParseTreeType.VARIABLE_STATEMENT
            || declType == ParseTreeType.FUNCTION_DECLARATION
            || declType == ParseTreeType.MODULE_DEFINITION
            || declType == ParseTreeType.MODULE_DECLARATION
            || declType == ParseTreeType.CLASS_DECLARATION
            || declType == ParseTreeType.EXPORT_MAPPING_LIST,
        tree.declaration,
        "expected valid export tree");
  }

  @Override
  protected void visitExportMapping(ExportMappingTree tree) {
    if (isPresent(tree.moduleExpression)) {
      checkType(
          ParseTreeType.MODULE_EXPRESSION, tree.moduleExpression, "module expression expected");
    }
    ParseTreeType specifierType = tree.specifierSet.type;
    checkVisit(
        specifierType == ParseTreeType.EXPORT_SPECIFIER_SET
            || specifierType == ParseTreeType.IDENTIFIER_EXPRESSION,
        tree.specifierSet,
        "specifier set or identifier expected");
  }

  @Override
  protected void visitExportMappingList(ExportMappingListTree tree) {
    check(!tree.paths.isEmpty(), tree, "expected at least one path");
    for (ParseTree path : tree.paths) {
      checkType(ParseTreeType.EXPORT_MAPPING, path, "expected export mapping");
    }
  }

  @Override
  protected void visitExportSpecifierSet(ExportSpecifierSetTree tree) {
    check(!tree.specifiers.isEmpty(), tree, "expected at least one identifier");
    for (ParseTree specifier : tree.specifiers) {
      checkVisit(
          specifier.type == ParseTreeType.EXPORT_SPECIFIER
              || specifier.type == ParseTreeType.IDENTIFIER_EXPRESSION,
          specifier,
          "expected valid export specifier");
    }
  }

  @Override
  protected void visitExpressionStatement(ExpressionStatementTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
  }

  @Override
  protected void visitFinally(FinallyTree tree) {
    checkType(ParseTreeType.BLOCK, tree.block, "block expected");
  }

  @Override
  protected void visitForOfStatement(ForOfStatementTree tree) {
    ParseTree initializer = tree.initializer;
    checkVisit(
        initializer.isPattern()
            || initializer.type == ParseTreeType.IDENTIFIER_EXPRESSION
            || (initializer.type == ParseTreeType.VARIABLE_DECLARATION_LIST
                && initializer.asVariableDeclarationList().declarations.size() == 1),
        initializer,
        "for-each statement may not have more than one variable declaration");
    checkVisit(tree.collection.isExpression(), tree.collection, "expression expected");
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
  }

  @Override
  protected void visitForInStatement(ForInStatementTree tree) {
    ParseTree initializer = tree.initializer;
    if (initializer.type == ParseTreeType.VARIABLE_DECLARATION_LIST) {
      checkVisit(
          initializer.asVariableDeclarationList().declarations.size() <= 1,
          initializer,
          "for-in statement may not have more than one variable declaration");
    } else {
      checkVisit(
          initializer.isPattern() || initializer.isExpression(),
          initializer,
          "variable declaration, expression or pattern expected");
    }
    checkVisit(tree.collection.isExpression(), tree.collection, "expression expected");
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
  }

  @Override
  protected void visitFormalParameterList(FormalParameterListTree tree) {
    for (int i = 0; i < tree.parameters.size(); i++) {
      ParseTree parameter = tree.parameters.get(i);
      switch (parameter.type) {
        case BINDING_ELEMENT:
          break;

        case REST_PARAMETER:
          check(
              i == tree.parameters.size() - 1,
              parameter,
              "rest parameters must be the last parameter in a parameter list");
          break;

        default:
          fail(
              parameter,
              "parameters must be identifiers or rest parameters. Found: " + parameter.type);
      }
      visitAny(parameter);
    }
  }

  @Override
  protected void visitForStatement(ForStatementTree tree) {
    if (isPresent(tree.initializer)) {
      checkVisit(
          tree.initializer.isExpression()
              || tree.initializer.type == ParseTreeType.VARIABLE_DECLARATION_LIST,
          tree.initializer,
          "variable declaration list or expression expected");
    }
    if (isPresent(tree.condition)) {
      checkVisit(tree.condition.isExpression(), tree.condition, "expression expected");
    }
    if (isPresent(tree.increment)) {
      checkVisit(tree.increment.isExpression(), tree.increment, "expression expected");
    }
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
  }

  @Override
  protected void visitFunctionDeclaration(FunctionDeclarationTree tree) {
    if (isPresent(tree.name)) {
      checkType(ParseTreeType.BINDING_IDENTIFIER, tree.name, "binding identifier expected");
    }
    checkFunction(tree.formalParameterList, tree.functionBody);
  }

  private void checkFunction(ParseTree formalParameterList, ParseTree functionBody) {
    checkType(
        ParseTreeType.FORMAL_PARAMETER_LIST, formalParameterList, "formal parameters expected");
    checkType(ParseTreeType.BLOCK, functionBody, "block expected");
  }

  @Override
  protected void visitGetAccessor(GetAccessorTree tree) {
    checkType(ParseTreeType.BLOCK, tree.body, "block expected");
  }

  @Override
  protected void visitIfStatement(IfStatementTree tree) {
    checkVisit(tree.condition.isExpression(), tree.condition, "expression expected");
    checkVisit(tree.ifClause.isStatement(), tree.ifClause, "statement expected");
    if (isPresent(tree.elseClause)) {
      checkVisit(tree.elseClause.isStatement(), tree.elseClause, "statement expected");
    }
  }

  @Override
  protected void visitImportBinding(ImportBindingTree tree) {
    checkType(
        ParseTreeType.MODULE_EXPRESSION, tree.moduleExpression, "module expression expected");
    ParseTreeType specifierType = tree.importSpecifierSet.type;
    checkVisit(
        specifierType == ParseTreeType.IMPORT_SPECIFIER_SET
            || specifierType == ParseTreeType.IDENTIFIER_EXPRESSION,
        tree.importSpecifierSet,
        "specifier set or identifier expected");
  }

  @Override
  protected void visitImportDeclaration(ImportDeclarationTree tree) {
    check(!tree.importPathList.isEmpty(), tree, "expected at least one import path");
    for (ParseTree binding : tree.importPathList) {
      checkType(ParseTreeType.IMPORT_BINDING, binding, "import binding expected");
    }
  }

  @Override
  protected void visitImportSpecifierSet(ImportSpecifierSetTree tree) {
    check(!tree.specifiers.isEmpty(), tree, "expected at least one identifier");
    for (ParseTree specifier : tree.specifiers) {
      checkType(ParseTreeType.IMPORT_SPECIFIER, specifier, "expected valid import specifier");
    }
  }

  @Override
  protected void visitLabelledStatement(LabelledStatementTree tree) {
    checkVisit(tree.statement.isStatement(), tree.statement, "statement expected");
  }

  @Override
  protected void visitMemberExpression(MemberExpressionTree tree) {
    checkNewHasArguments(tree.operand);
    check(tree.operand.isMemberExpression(), tree.operand, "member expression expected");
    visitAny(tree.operand);
  }

  @Override
  protected void visitMemberLookupExpression(MemberLookupExpressionTree tree) {
    checkNewHasArguments(tree.operand);
    check(tree.operand.isMemberExpression(), tree.operand, "member expression expected");
    visitAny(tree.operand);
    checkVisit(
        tree.memberExpression.isExpression(), tree.memberExpression, "expression expected");
  }

  @Override
  protected void visitMissingPrimaryExpression(MissingPrimaryExpressionTree tree) {
    fail(tree, "parse tree contains errors");
  }

  @Override
  protected void visitModuleDeclaration(ModuleDeclarationTree tree) {
    for (ParseTree specifier : tree.specifiers) {
      checkType(ParseTreeType.MODULE_SPECIFIER, specifier, "module specifier expected");
    }
  }

  @Override
  protected void visitModuleDefinition(ModuleDefinitionTree tree) {
    for (ParseTree element : tree.elements) {
      checkVisit(
          (element.isStatement() && element.type != ParseTreeType.BLOCK)
              || element.type == ParseTreeType.CLASS_DECLARATION
              || element.type == ParseTreeType.EXPORT_DECLARATION
              || element.type == ParseTreeType.IMPORT_DECLARATION
              || element.type == ParseTreeType.MODULE_DEFINITION
              || element.type == ParseTreeType.MODULE_DECLARATION,
          element,
          "module element expected");
    }
  }

  @Override
  protected void visitModuleExpression(ModuleExpressionTree tree) {
    checkVisit(
        tree.reference.type == ParseTreeType.MODULE_REQUIRE
            || tree.reference.type == ParseTreeType.IDENTIFIER_EXPRESSION,
        tree.reference,
        "module require or identifier expected");
  }

  @Override
  protected void visitModuleRequire(ModuleRequireTree tree) {
    check(tree.url.type == TokenType.STRING, tree, "string expected");
  }

  @Override
  protected void visitModuleSpecifier(ModuleSpecifierTree tree) {
    checkType(ParseTreeType.MODULE_EXPRESSION, tree.expression, "module expression expected");
  }

  @Override
  protected void visitNewExpression(NewExpressionTree tree) {
    checkVisit(tree.operand.isMemberExpression(), tree.operand, "member expression expected");
    visitAny(tree.arguments);
  }

  @Override
  protected void visitObjectLiteralExpression(ObjectLiteralExpressionTree tree) {
    for (ParseTree propertyNameAndValue : tree.propertyNameAndValues) {
      switch (propertyNameAndValue.type) {
        case GET_ACCESSOR:
        case SET_ACCESSOR:
        case PROPERTY_METHOD_ASSIGNMENT:
        case PROPERTY_NAME_ASSIGNMENT:
        case PROPERTY_NAME_SHORTHAND:
          break;
        default:
          fail(
              propertyNameAndValue,
              "accessor, property name assignment or property method assignment expected");
      }
      visitAny(propertyNameAndValue);
    }
  }

  @Override
  protected void visitObjectPattern(ObjectPatternTree tree) {
    for (ParseTree field : tree.fields) {
      checkVisit(
          field.type == ParseTreeType.OBJECT_PATTERN_FIELD
              || field.type == ParseTreeType.BINDING_ELEMENT
              || field.type == ParseTreeType.IDENTIFIER_EXPRESSION,
          field,
          "object pattern field expected");
    }
  }

  @Override
  protected void visitObjectPatternField(ObjectPatternFieldTree tree) {
    checkVisit(
        tree.element.type == ParseTreeType.BINDING_ELEMENT
            || tree.element.isPattern()
            || tree.element.isLeftHandSideExpression(),
        tree.element,
        "binding element expected");
  }

  @Override
  protected void visitParenExpression(ParenExpressionTree tree) {
    if (tree.expression.isPattern()) {
      visitAny(tree.expression);
    } else {
      checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    }
  }

  @Override
  protected void visitPostfixExpression(PostfixExpressionTree tree) {
    check(
        tree.operator.type == TokenType.PLUS_PLUS || tree.operator.type == TokenType.MINUS_MINUS,
        tree,
        "unexpected postfix operator");
    checkVisit(
        tree.operand.isAssignmentExpression(), tree.operand, "assignment expression expected");
  }

  @Override
  protected void visitProgram(ProgramTree tree) {
    for (ParseTree programElement : tree.programElements) {
      checkVisit(
          programElement.isProgramElement(), programElement, "global program element expected");
    }
  }

  @Override
  protected void visitPropertyMethodAssignment(PropertyMethodAssignmentTree tree) {
    checkFunction(tree.formalParameterList, tree.functionBody);
  }

  @Override
  protected void visitPropertyNameAssignment(PropertyNameAssignmentTree tree) {
    checkVisit(tree.value.isAssignmentExpression(), tree.value, "assignment expression expected");
  }

  @Override
  protected void visitQuasiLiteralExpression(QuasiLiteralExpressionTree tree) {
    if (isPresent(tree.operand)) {
      checkVisit(
          tree.operand.isMemberExpression(), tree.operand, "member or call expression expected");
    }

    // The elements alternate between literal portions and substitutions.
    for (int i = 0; i < tree.elements.size(); i++) {
      ParseTree element = tree.elements.get(i);
      if (i % 2 == 1) {
        checkType(ParseTreeType.QUASI_SUBSTITUTION, element, "Quasi substitution expected");
      } else {
        checkType(ParseTreeType.QUASI_LITERAL_PORTION, element, "Quasi literal portion expected");
      }
    }
  }

  @Override
  protected void visitQuasiSubstitution(QuasiSubstitutionTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
  }

  @Override
  protected void visitRestParameter(RestParameterTree tree) {
    checkType(ParseTreeType.BINDING_IDENTIFIER, tree.identifier, "binding identifier expected");
  }

  @Override
  protected void visitReturnStatement(ReturnStatementTree tree) {
    if (isPresent(tree.expression)) {
      checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    }
  }

  @Override
  protected void visitSetAccessor(SetAccessorTree tree) {
    checkVisit(
        tree.parameter.type == ParseTreeType.BINDING_IDENTIFIER || tree.parameter.isPattern(),
        tree.parameter,
        "binding identifier expected");
    checkType(ParseTreeType.BLOCK, tree.body, "block expected");
  }

  @Override
  protected void visitSpreadExpression(SpreadExpressionTree tree) {
    checkVisit(
        tree.expression.isAssignmentExpression(),
        tree.expression,
        "assignment expression expected");
  }

  @Override
  protected void visitSpreadPatternElement(SpreadPatternElementTree tree) {
    checkVisit(
        tree.lvalue.isPattern() || tree.lvalue.isLeftHandSideExpression(),
        tree.lvalue,
        "pattern or left hand side expression expected");
  }

  @Override
  protected void visitStateMachine(StateMachineTree tree) {
    fail(tree, "State machines are never valid outside of the generator lowering pass.");
  }

  @Override
  protected void visitSwitchStatement(SwitchStatementTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    int defaultCount = 0;
    for (ParseTree caseClause : tree.caseClauses) {
      if (caseClause.type == ParseTreeType.DEFAULT_CLAUSE) {
        ++defaultCount;
        checkVisit(defaultCount <= 1, caseClause, "no more than one default clause allowed");
      } else {
        checkType(ParseTreeType.CASE_CLAUSE, caseClause, "case or default clause expected");
      }
    }
  }

  @Override
  protected void visitThrowStatement(ThrowStatementTree tree) {
    if (isPresent(tree.value)) {
      checkVisit(tree.value.isExpression(), tree.value, "expression expected");
    }
  }

  @Override
  protected void visitTryStatement(TryStatementTree tree) {
    check(tree.hasCatch() || tree.hasFinally(), tree, "either catch or finally must be present");
    checkType(ParseTreeType.BLOCK, tree.body, "block expected");
    if (tree.hasCatch()) {
      checkType(ParseTreeType.CATCH, tree.catchBlock, "catch block expected");
    }
    if (tree.hasFinally()) {
      checkType(ParseTreeType.FINALLY, tree.finallyBlock, "finally block expected");
    }
  }

  @Override
  protected void visitUnaryExpression(UnaryExpressionTree tree) {
    checkVisit(
        tree.operand.isAssignmentExpression(), tree.operand, "assignment expression expected");
  }

  @Override
  protected void visitVariableDeclaration(VariableDeclarationTree tree) {
    checkVisit(
        tree.lvalue.isPattern() || tree.lvalue.type == ParseTreeType.BINDING_IDENTIFIER,
        tree.lvalue,
        "binding identifier expected, found: " + tree.lvalue.type);
    if (isPresent(tree.initializer)) {
      checkVisit(
          tree.initializer.isAssignmentExpression(),
          tree.initializer,
          "assignment expression expected");
    }
  }

  @Override
  protected void visitVariableDeclarationList(VariableDeclarationListTree tree) {
    check(!tree.declarations.isEmpty(), tree, "expected at least one variable declaration");
    for (ParseTree declaration : tree.declarations) {
      checkType(
          ParseTreeType.VARIABLE_DECLARATION, declaration, "variable declaration expected");
    }
  }

  @Override
  protected void visitVariableStatement(VariableStatementTree tree) {
    checkType(
        ParseTreeType.VARIABLE_DECLARATION_LIST,
        tree.declarations,
        "variable declaration list expected");
  }

  @Override
  protected void visitWhileStatement(WhileStatementTree tree) {
    checkVisit(tree.condition.isExpression(), tree.condition, "expression expected");
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
  }

  @Override
  protected void visitWithStatement(WithStatementTree tree) {
    checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    checkVisit(tree.body.isStatement(), tree.body, "statement expected");
  }

  @Override
  protected void visitYieldStatement(YieldStatementTree tree) {
    if (isPresent(tree.expression)) {
      checkVisit(tree.expression.isExpression(), tree.expression, "expression expected");
    }
  }
}
