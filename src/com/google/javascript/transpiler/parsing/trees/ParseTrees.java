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

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.parsing.IdentifierToken;
import com.google.javascript.transpiler.parsing.LiteralToken;
import com.google.javascript.transpiler.parsing.Token;
import com.google.javascript.transpiler.parsing.TokenType;
import org.jspecify.annotations.Nullable;

/**
 * Parse tree construction helpers. Trees built here carry no source location.
 *
 * <p>The helpers do not check grammar rules; that is the validator's job.
 */
public final class ParseTrees {

  private ParseTrees() {}

  public static IdentifierToken identifierToken(String name) {
    checkArgument(!name.isEmpty(), "empty identifier");
    return new IdentifierToken(null, name);
  }

  private static @Nullable IdentifierToken optionalIdentifierToken(@Nullable String name) {
    return name == null ? null : identifierToken(name);
  }

  private static ImmutableList<ParseTree> list(ParseTree... trees) {
    return ImmutableList.copyOf(trees);
  }

  // Expressions

  public static IdentifierExpressionTree name(String name) {
    return new IdentifierExpressionTree(null, identifierToken(name));
  }

  public static BindingIdentifierTree binding(String name) {
    return new BindingIdentifierTree(null, identifierToken(name));
  }

  public static LiteralExpressionTree number(int value) {
    return new LiteralExpressionTree(
        null, new LiteralToken(TokenType.NUMBER, String.valueOf(value), null));
  }

  public static LiteralExpressionTree string(String value) {
    return new LiteralExpressionTree(
        null, new LiteralToken(TokenType.STRING, "'" + value + "'", null));
  }

  public static LiteralExpressionTree trueLiteral() {
    return new LiteralExpressionTree(null, new LiteralToken(TokenType.TRUE, "true", null));
  }

  public static ThisExpressionTree thisExpression() {
    return new ThisExpressionTree(null);
  }

  public static NullTree nullTree() {
    return new NullTree(null);
  }

  public static BinaryOperatorTree binary(ParseTree left, TokenType operator, ParseTree right) {
    return new BinaryOperatorTree(null, left, new Token(operator, null), right);
  }

  /** A binary operator spelled as an identifier, such as the contextual {@code is}. */
  public static BinaryOperatorTree binary(ParseTree left, String operator, ParseTree right) {
    return new BinaryOperatorTree(null, left, identifierToken(operator), right);
  }

  public static BinaryOperatorTree assign(ParseTree left, ParseTree right) {
    return binary(left, TokenType.EQUAL, right);
  }

  public static UnaryExpressionTree unary(TokenType operator, ParseTree operand) {
    return new UnaryExpressionTree(null, new Token(operator, null), operand);
  }

  public static PostfixExpressionTree postfix(ParseTree operand, TokenType operator) {
    return new PostfixExpressionTree(null, operand, new Token(operator, null));
  }

  public static CommaExpressionTree comma(ParseTree... expressions) {
    return new CommaExpressionTree(null, list(expressions));
  }

  public static ConditionalExpressionTree conditional(
      ParseTree condition, ParseTree left, ParseTree right) {
    return new ConditionalExpressionTree(null, condition, left, right);
  }

  public static ParenExpressionTree paren(ParseTree expression) {
    return new ParenExpressionTree(null, expression);
  }

  public static ArgumentListTree arguments(ParseTree... arguments) {
    return new ArgumentListTree(null, list(arguments));
  }

  public static CallExpressionTree call(ParseTree operand, ParseTree... arguments) {
    return new CallExpressionTree(null, operand, arguments(arguments));
  }

  public static NewExpressionTree newExpression(ParseTree operand, ParseTree... arguments) {
    return new NewExpressionTree(null, operand, arguments(arguments));
  }

  /** {@code new operand} without an argument list. */
  public static NewExpressionTree newExpressionWithoutArguments(ParseTree operand) {
    return new NewExpressionTree(null, operand, null);
  }

  public static MemberExpressionTree member(ParseTree operand, String memberName) {
    return new MemberExpressionTree(null, operand, identifierToken(memberName));
  }

  public static MemberLookupExpressionTree memberLookup(ParseTree operand, ParseTree member) {
    return new MemberLookupExpressionTree(null, operand, member);
  }

  public static SpreadExpressionTree spread(ParseTree expression) {
    return new SpreadExpressionTree(null, expression);
  }

  public static ArrayLiteralExpressionTree arrayLiteral(ParseTree... elements) {
    return new ArrayLiteralExpressionTree(null, list(elements));
  }

  public static ObjectLiteralExpressionTree objectLiteral(ParseTree... propertyNameAndValues) {
    return new ObjectLiteralExpressionTree(null, list(propertyNameAndValues));
  }

  public static PropertyNameAssignmentTree property(String name, ParseTree value) {
    return new PropertyNameAssignmentTree(null, identifierToken(name), value);
  }

  public static QuasiLiteralExpressionTree quasi(@Nullable ParseTree tag, ParseTree... elements) {
    return new QuasiLiteralExpressionTree(null, tag, list(elements));
  }

  public static QuasiLiteralPortionTree quasiPortion(String text) {
    return new QuasiLiteralPortionTree(
        null, new LiteralToken(TokenType.QUASI_LITERAL_PORTION, text, null));
  }

  public static QuasiSubstitutionTree quasiSubstitution(ParseTree expression) {
    return new QuasiSubstitutionTree(null, expression);
  }

  // Patterns and parameters

  public static ArrayPatternTree arrayPattern(ParseTree... elements) {
    return new ArrayPatternTree(null, list(elements));
  }

  public static ObjectPatternTree objectPattern(ParseTree... fields) {
    return new ObjectPatternTree(null, list(fields));
  }

  public static SpreadPatternElementTree spreadPattern(ParseTree lvalue) {
    return new SpreadPatternElementTree(null, lvalue);
  }

  public static BindingElementTree bindingElement(String name) {
    return new BindingElementTree(null, binding(name), null);
  }

  public static RestParameterTree rest(ParseTree identifier) {
    return new RestParameterTree(null, identifier);
  }

  public static FormalParameterListTree parameters(ParseTree... parameters) {
    return new FormalParameterListTree(null, list(parameters));
  }

  // Functions

  public static FunctionDeclarationTree function(
      @Nullable String name, ParseTree parameters, ParseTree body) {
    BindingIdentifierTree binding = name == null ? null : binding(name);
    return new FunctionDeclarationTree(null, binding, false, parameters, body);
  }

  public static FunctionDeclarationTree generator(String name, ParseTree... statements) {
    return new FunctionDeclarationTree(null, binding(name), true, parameters(), block(statements));
  }

  // Statements

  public static BlockTree block(ParseTree... statements) {
    return new BlockTree(null, list(statements));
  }

  public static ProgramTree program(ParseTree... elements) {
    return new ProgramTree(null, list(elements));
  }

  public static ExpressionStatementTree exprResult(ParseTree expression) {
    return new ExpressionStatementTree(null, expression);
  }

  public static EmptyStatementTree empty() {
    return new EmptyStatementTree(null);
  }

  public static VariableDeclarationTree declaration(String name, @Nullable ParseTree initializer) {
    return new VariableDeclarationTree(null, binding(name), initializer);
  }

  public static VariableDeclarationListTree declarations(ParseTree... declarations) {
    return new VariableDeclarationListTree(null, TokenType.VAR, list(declarations));
  }

  public static VariableStatementTree var(String name, @Nullable ParseTree initializer) {
    return new VariableStatementTree(null, declarations(declaration(name, initializer)));
  }

  public static BreakStatementTree breakStatement() {
    return breakStatement(null);
  }

  public static BreakStatementTree breakStatement(@Nullable String label) {
    return new BreakStatementTree(null, optionalIdentifierToken(label));
  }

  public static ContinueStatementTree continueStatement() {
    return continueStatement(null);
  }

  public static ContinueStatementTree continueStatement(@Nullable String label) {
    return new ContinueStatementTree(null, optionalIdentifierToken(label));
  }

  public static LabelledStatementTree label(String name, ParseTree statement) {
    return new LabelledStatementTree(null, identifierToken(name), statement);
  }

  public static ReturnStatementTree returnStatement(@Nullable ParseTree expression) {
    return new ReturnStatementTree(null, expression);
  }

  public static ThrowStatementTree throwStatement(ParseTree value) {
    return new ThrowStatementTree(null, value);
  }

  public static YieldStatementTree yieldStatement(@Nullable ParseTree expression) {
    return new YieldStatementTree(null, expression, false);
  }

  public static IfStatementTree ifStatement(
      ParseTree condition, ParseTree ifClause, @Nullable ParseTree elseClause) {
    return new IfStatementTree(null, condition, ifClause, elseClause);
  }

  public static WhileStatementTree whileLoop(ParseTree condition, ParseTree body) {
    return new WhileStatementTree(null, condition, body);
  }

  public static DoWhileStatementTree doLoop(ParseTree body, ParseTree condition) {
    return new DoWhileStatementTree(null, body, condition);
  }

  public static ForStatementTree forLoop(
      @Nullable ParseTree initializer,
      @Nullable ParseTree condition,
      @Nullable ParseTree increment,
      ParseTree body) {
    return new ForStatementTree(null, initializer, condition, increment, body);
  }

  public static ForInStatementTree forIn(
      ParseTree initializer, ParseTree collection, ParseTree body) {
    return new ForInStatementTree(null, initializer, collection, body);
  }

  public static ForOfStatementTree forOf(
      ParseTree initializer, ParseTree collection, ParseTree body) {
    return new ForOfStatementTree(null, initializer, collection, body);
  }

  public static WithStatementTree with(ParseTree expression, ParseTree body) {
    return new WithStatementTree(null, expression, body);
  }

  public static SwitchStatementTree switchStatement(ParseTree expression, ParseTree... clauses) {
    return new SwitchStatementTree(null, expression, list(clauses));
  }

  public static CaseClauseTree caseClause(ParseTree expression, ParseTree... statements) {
    return new CaseClauseTree(null, expression, list(statements));
  }

  public static DefaultClauseTree defaultClause(ParseTree... statements) {
    return new DefaultClauseTree(null, list(statements));
  }

  public static TryStatementTree tryStatement(
      ParseTree body, @Nullable ParseTree catchBlock, @Nullable ParseTree finallyBlock) {
    return new TryStatementTree(null, body, catchBlock, finallyBlock);
  }

  public static CatchTree catchClause(String name, ParseTree body) {
    return new CatchTree(null, binding(name), body);
  }

  public static FinallyTree finallyClause(ParseTree block) {
    return new FinallyTree(null, block);
  }
}
