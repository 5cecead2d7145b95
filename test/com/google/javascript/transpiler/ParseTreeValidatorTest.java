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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.arrayLiteral;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.arrayPattern;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.assign;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.binary;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.binding;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.bindingElement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.block;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.breakStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.call;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.caseClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.catchClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.comma;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.declaration;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.declarations;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.defaultClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.empty;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.exprResult;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.finallyClause;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forIn;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forLoop;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.forOf;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.function;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.generator;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.identifierToken;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.ifStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.label;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.member;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.memberLookup;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.name;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.newExpression;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.nullTree;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.number;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.objectLiteral;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.objectPattern;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.parameters;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.postfix;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.program;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.property;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.quasi;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.quasiPortion;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.quasiSubstitution;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.rest;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.returnStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.spread;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.spreadPattern;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.string;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.switchStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.tryStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.var;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.whileLoop;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.yieldStatement;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.transpiler.generator.BreakState;
import com.google.javascript.transpiler.generator.State;
import com.google.javascript.transpiler.parsing.LiteralToken;
import com.google.javascript.transpiler.parsing.SourceFile;
import com.google.javascript.transpiler.parsing.SourcePosition;
import com.google.javascript.transpiler.parsing.SourceRange;
import com.google.javascript.transpiler.parsing.TokenType;
import com.google.javascript.transpiler.parsing.trees.ArrowFunctionExpressionTree;
import com.google.javascript.transpiler.parsing.trees.BreakStatementTree;
import com.google.javascript.transpiler.parsing.trees.CatchTree;
import com.google.javascript.transpiler.parsing.trees.ClassDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ClassExpressionTree;
import com.google.javascript.transpiler.parsing.trees.DefaultClauseTree;
import com.google.javascript.transpiler.parsing.trees.ExportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingListTree;
import com.google.javascript.transpiler.parsing.trees.ExportMappingTree;
import com.google.javascript.transpiler.parsing.trees.ExportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.ExportSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.FunctionDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.GetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.ImportBindingTree;
import com.google.javascript.transpiler.parsing.trees.ImportDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ImportSpecifierSetTree;
import com.google.javascript.transpiler.parsing.trees.ImportSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.MissingPrimaryExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.ModuleDefinitionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleExpressionTree;
import com.google.javascript.transpiler.parsing.trees.ModuleRequireTree;
import com.google.javascript.transpiler.parsing.trees.ModuleSpecifierTree;
import com.google.javascript.transpiler.parsing.trees.ObjectPatternFieldTree;
import com.google.javascript.transpiler.parsing.trees.ParseTree;
import com.google.javascript.transpiler.parsing.trees.ParseTreeType;
import com.google.javascript.transpiler.parsing.trees.ParseTrees;
import com.google.javascript.transpiler.parsing.trees.ProgramTree;
import com.google.javascript.transpiler.parsing.trees.PropertyMethodAssignmentTree;
import com.google.javascript.transpiler.parsing.trees.SetAccessorTree;
import com.google.javascript.transpiler.parsing.trees.StateMachineTree;
import com.google.javascript.transpiler.parsing.trees.VariableDeclarationListTree;
import com.google.javascript.transpiler.parsing.trees.VariableDeclarationTree;
import com.google.javascript.transpiler.parsing.trees.VariableStatementTree;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParseTreeValidatorTest {

  private static final SourceFile SOURCE = new SourceFile("input.js");

  private static SourceRange range(int line, int column) {
    SourcePosition start = new SourcePosition(SOURCE, 0, line, column);
    return new SourceRange(start, start);
  }

  private static void expectValid(ParseTree tree) {
    ParseTreeValidator.validate(tree);
  }

  private static ParseTreeValidationException expectInvalid(ParseTree tree, String message) {
    ParseTreeValidationException e =
        assertThrows(ParseTreeValidationException.class, () -> ParseTreeValidator.validate(tree));
    assertThat(e.getValidationMessage()).isEqualTo(message);
    return e;
  }

  private static void expectInvalidAt(ParseTree tree, ParseTree offending, String message) {
    assertThat(expectInvalid(tree, message).getOffendingTree()).isSameInstanceAs(offending);
  }

  private static ImmutableList<ParseTree> list(ParseTree... trees) {
    return ImmutableList.copyOf(trees);
  }

  @Test
  public void testValidGenerator() {
    expectValid(
        program(
            generator(
                "g",
                var("x", number(0)),
                whileLoop(
                    binary(name("x"), TokenType.OPEN_ANGLE, number(10)),
                    block(
                        yieldStatement(name("x")),
                        exprResult(postfix(name("x"), TokenType.PLUS_PLUS)))),
                switchStatement(
                    name("x"),
                    caseClause(number(1), breakStatement()),
                    defaultClause(returnStatement(null))),
                tryStatement(
                    block(exprResult(call(member(name("console"), "log"), name("x")))),
                    catchClause("e", block()),
                    null))));
  }

  @Test
  public void testEmptyProgramIsValid() {
    expectValid(program());
  }

  @Test
  public void testMissingPrimaryExpression() {
    MissingPrimaryExpressionTree missing = new MissingPrimaryExpressionTree(null, null);
    ParseTreeValidationException e =
        expectInvalid(program(exprResult(missing)), "parse tree contains errors");
    assertThat(e.getOffendingTree()).isSameInstanceAs(missing);
  }

  @Test
  public void testTryNeedsCatchOrFinally() {
    expectValid(tryStatement(block(), catchClause("e", block()), null));
    expectValid(tryStatement(block(), null, finallyClause(block())));
    expectValid(tryStatement(block(), catchClause("e", block()), finallyClause(block())));

    expectInvalid(tryStatement(block(), null, null), "either catch or finally must be present");
    expectInvalid(
        tryStatement(block(), nullTree(), nullTree()), "either catch or finally must be present");
  }

  @Test
  public void testTryBodyMustBeBlock() {
    expectInvalid(tryStatement(empty(), null, finallyClause(block())), "block expected");
  }

  @Test
  public void testTryCatchBlockKind() {
    ParseTree notACatch = block();
    ParseTreeValidationException e =
        expectInvalid(tryStatement(block(), notACatch, null), "catch block expected");
    assertThat(e.getOffendingTree()).isSameInstanceAs(notACatch);
  }

  @Test
  public void testSwitchAllowsOneDefault() {
    expectValid(switchStatement(name("x"), caseClause(number(1)), defaultClause()));

    DefaultClauseTree second = defaultClause();
    ParseTreeValidationException e =
        expectInvalid(
            switchStatement(name("x"), defaultClause(), caseClause(number(1)), second),
            "no more than one default clause allowed");
    assertThat(e.getOffendingTree()).isSameInstanceAs(second);
  }

  @Test
  public void testSwitchClauseKind() {
    expectInvalid(
        switchStatement(name("x"), exprResult(number(1))), "case or default clause expected");
  }

  @Test
  public void testStateMachineRejectedWhenNested() {
    StateMachineTree stateMachine =
        new StateMachineTree(
            null,
            0,
            1,
            ImmutableList.<State>of(new BreakState(0, null)),
            ImmutableList.of());
    ParseTreeValidationException e =
        expectInvalid(
            block(stateMachine),
            "State machines are never valid outside of the generator lowering pass.");
    assertThat(e.getOffendingTree()).isSameInstanceAs(stateMachine);
  }

  @Test
  public void testSpreadPatternMustBeLast() {
    expectValid(exprResult(assign(arrayPattern(name("a"), spreadPattern(name("b"))), name("c"))));
    ParseTree spread = spreadPattern(name("b"));
    expectInvalidAt(
        exprResult(assign(arrayPattern(spread, name("a")), name("c"))),
        spread,
        "spread in array patterns must be the last element");
  }

  @Test
  public void testArrayPatternElementKind() {
    ParseTree element = empty();
    expectInvalidAt(
        exprResult(assign(arrayPattern(element), name("c"))),
        element,
        "null, sub pattern, left hand side expression or spread expected");
  }

  @Test
  public void testArrayLiteralElisionsAndSpread() {
    expectValid(exprResult(arrayLiteral(number(1), nullTree(), spread(name("xs")))));
    ParseTree element = empty();
    expectInvalidAt(exprResult(arrayLiteral(element)), element, "assignment or spread expected");
  }

  @Test
  public void testArgumentKind() {
    ParseTree argument = empty();
    expectInvalidAt(
        exprResult(call(name("f"), argument)), argument, "assignment or spread expected");
  }

  @Test
  public void testObjectPatternFieldKind() {
    expectValid(
        exprResult(
            assign(
                objectPattern(
                    name("a"),
                    new ObjectPatternFieldTree(null, identifierToken("b"), name("c"))),
                name("o"))));

    ParseTree field = number(1);
    expectInvalidAt(
        exprResult(assign(objectPattern(field), name("o"))),
        field,
        "object pattern field expected");
  }

  @Test
  public void testObjectPatternFieldElement() {
    ParseTree element = empty();
    expectInvalidAt(
        exprResult(
            assign(
                objectPattern(new ObjectPatternFieldTree(null, identifierToken("b"), element)),
                name("o"))),
        element,
        "binding element expected");
  }

  @Test
  public void testObjectLiteralMemberKind() {
    expectValid(exprResult(objectLiteral(property("a", number(1)))));
    ParseTree member = name("x");
    expectInvalidAt(
        exprResult(objectLiteral(member)),
        member,
        "accessor, property name assignment or property method assignment expected");
  }

  @Test
  public void testGetAccessorBody() {
    expectValid(
        exprResult(objectLiteral(new GetAccessorTree(null, identifierToken("x"), block()))));
    ParseTree body = empty();
    expectInvalidAt(
        exprResult(objectLiteral(new GetAccessorTree(null, identifierToken("x"), body))),
        body,
        "block expected");
  }

  @Test
  public void testSetAccessorParameter() {
    expectValid(
        exprResult(
            objectLiteral(
                new SetAccessorTree(null, identifierToken("x"), binding("v"), block()))));
    ParseTree parameter = name("v");
    expectInvalidAt(
        exprResult(
            objectLiteral(new SetAccessorTree(null, identifierToken("x"), parameter, block()))),
        parameter,
        "binding identifier expected");
  }

  @Test
  public void testPropertyMethodBody() {
    ParseTree body = empty();
    expectInvalidAt(
        exprResult(
            objectLiteral(
                new PropertyMethodAssignmentTree(
                    null, identifierToken("m"), false, parameters(), body))),
        body,
        "block expected");
  }

  @Test
  public void testClassElementKind() {
    ParseTree method =
        new PropertyMethodAssignmentTree(null, identifierToken("m"), false, parameters(), block());
    expectValid(new ClassDeclarationTree(null, identifierToken("C"), name("B"), list(method)));

    ParseTree element = exprResult(name("x"));
    expectInvalidAt(
        new ClassDeclarationTree(null, identifierToken("C"), null, list(element)),
        element,
        "class element expected");
  }

  @Test
  public void testClassSuperClass() {
    ParseTree superClass = comma(name("a"), name("b"));
    expectInvalidAt(
        exprResult(new ClassExpressionTree(null, null, superClass, ImmutableList.of())),
        superClass,
        "assignment expression expected");
  }

  @Test
  public void testArrowFunction() {
    expectValid(exprResult(new ArrowFunctionExpressionTree(null, parameters(), name("x"))));
    expectValid(exprResult(new ArrowFunctionExpressionTree(null, parameters(), block())));

    ParseTree parameters = name("a");
    expectInvalidAt(
        exprResult(new ArrowFunctionExpressionTree(null, parameters, block())),
        parameters,
        "formal parameters expected");

    ParseTree body = empty();
    expectInvalidAt(
        exprResult(new ArrowFunctionExpressionTree(null, parameters(), body)),
        body,
        "block or assignment expression expected");
  }

  @Test
  public void testStateMachineRejectedInArrowBody() {
    StateMachineTree stateMachine =
        new StateMachineTree(
            null, 3, 4, ImmutableList.<State>of(new BreakState(3, null)), ImmutableList.of());
    expectInvalidAt(
        exprResult(new ArrowFunctionExpressionTree(null, parameters(), block(stateMachine))),
        stateMachine,
        "State machines are never valid outside of the generator lowering pass.");
  }

  @Test
  public void testRestParameterMustBeLast() {
    expectValid(function("f", parameters(bindingElement("a"), rest(binding("b"))), block()));
    ParseTree rest = rest(binding("b"));
    expectInvalidAt(
        function("f", parameters(rest, bindingElement("a")), block()),
        rest,
        "rest parameters must be the last parameter in a parameter list");
  }

  @Test
  public void testRestParameterNeedsBindingIdentifier() {
    ParseTree identifier = name("b");
    expectInvalidAt(
        function("f", parameters(rest(identifier)), block()),
        identifier,
        "binding identifier expected");
  }

  @Test
  public void testFunctionParameterKind() {
    ParseTree parameter = name("a");
    expectInvalidAt(
        function("f", parameters(parameter), block()),
        parameter,
        "parameters must be identifiers or rest parameters. Found: IDENTIFIER_EXPRESSION");
  }

  @Test
  public void testFunctionBodyMustBeBlock() {
    ParseTree body = empty();
    expectInvalidAt(function("f", parameters(), body), body, "block expected");
  }

  @Test
  public void testFunctionNameKind() {
    ParseTree functionName = name("f");
    expectInvalidAt(
        new FunctionDeclarationTree(null, functionName, false, parameters(), block()),
        functionName,
        "binding identifier expected");
  }

  @Test
  public void testCallOnNewNeedsArguments() {
    expectValid(exprResult(call(newExpression(name("Foo")))));

    ParseTree callee = ParseTrees.newExpressionWithoutArguments(name("Foo"));
    expectInvalidAt(exprResult(call(callee)), callee, "new args expected");

    ParseTree object = ParseTrees.newExpressionWithoutArguments(name("Foo"));
    expectInvalidAt(exprResult(member(object, "bar")), object, "new args expected");
  }

  @Test
  public void testCallNeedsMemberExpression() {
    ParseTree callee = binary(name("a"), TokenType.PLUS, name("b"));
    expectInvalidAt(exprResult(call(callee)), callee, "member expression expected");
  }

  @Test
  public void testMemberLookup() {
    expectValid(exprResult(memberLookup(name("a"), string("b"))));

    ParseTree key = empty();
    expectInvalidAt(exprResult(memberLookup(name("a"), key)), key, "expression expected");

    ParseTree object = ParseTrees.newExpressionWithoutArguments(name("Foo"));
    expectInvalidAt(
        exprResult(memberLookup(object, number(0))), object, "new args expected");
  }

  @Test
  public void testNewOperandKind() {
    expectValid(exprResult(ParseTrees.newExpressionWithoutArguments(name("Foo"))));

    ParseTree operand = ParseTrees.newExpressionWithoutArguments(name("Foo"));
    expectInvalidAt(
        exprResult(ParseTrees.newExpressionWithoutArguments(operand)),
        operand,
        "member expression expected");
  }

  @Test
  public void testBinaryOperators() {
    expectValid(exprResult(binary(name("a"), TokenType.STAR, name("b"))));
    expectValid(exprResult(binary(name("a"), "is", name("b"))));
    expectValid(exprResult(binary(name("a"), "isnt", name("b"))));

    ParseTree contextual = binary(name("a"), "foo", name("b"));
    expectInvalidAt(exprResult(contextual), contextual, "unexpected binary operator");
    ParseTree increment = binary(name("a"), TokenType.PLUS_PLUS, name("b"));
    expectInvalidAt(exprResult(increment), increment, "unexpected binary operator");
  }

  @Test
  public void testBinaryOperands() {
    ParseTree right = comma(name("b"), name("c"));
    expectInvalidAt(
        exprResult(binary(name("a"), TokenType.MINUS, right)),
        right,
        "assignment expression expected");
  }

  @Test
  public void testAssignmentTarget() {
    expectValid(exprResult(assign(member(name("a"), "b"), number(1))));
    ParseTree target = binary(name("a"), TokenType.PLUS, name("b"));
    expectInvalidAt(
        exprResult(assign(target, number(1))),
        target,
        "left hand side expression or pattern expected");
  }

  @Test
  public void testPostfixOperator() {
    ParseTree postfix = postfix(name("x"), TokenType.PLUS);
    expectInvalidAt(exprResult(postfix), postfix, "unexpected postfix operator");
  }

  @Test
  public void testForLoopIncrementIsChecked() {
    expectValid(forLoop(nullTree(), null, null, empty()));
    expectValid(
        forLoop(
            declarations(declaration("i", number(0))),
            binary(name("i"), TokenType.OPEN_ANGLE, number(3)),
            postfix(name("i"), TokenType.PLUS_PLUS),
            empty()));

    ParseTree increment = empty();
    expectInvalidAt(
        forLoop(null, name("i"), increment, empty()), increment, "expression expected");
  }

  @Test
  public void testForInDeclarations() {
    expectValid(forIn(declarations(declaration("k", null)), name("o"), empty()));
    ParseTree initializer = declarations(declaration("k", null), declaration("j", null));
    expectInvalidAt(
        forIn(initializer, name("o"), empty()),
        initializer,
        "for-in statement may not have more than one variable declaration");
  }

  @Test
  public void testForOfDeclarations() {
    expectValid(forOf(name("v"), name("xs"), empty()));
    ParseTree initializer = declarations(declaration("a", null), declaration("b", null));
    expectInvalidAt(
        forOf(initializer, name("xs"), empty()),
        initializer,
        "for-each statement may not have more than one variable declaration");
  }

  @Test
  public void testVariableDeclarationListNotEmpty() {
    ParseTree list = new VariableDeclarationListTree(null, TokenType.VAR, ImmutableList.of());
    expectInvalidAt(
        new VariableStatementTree(null, list), list, "expected at least one variable declaration");
  }

  @Test
  public void testVariableDeclarationTarget() {
    ParseTree target = name("x");
    expectInvalidAt(
        new VariableStatementTree(
            null, declarations(new VariableDeclarationTree(null, target, null))),
        target,
        "binding identifier expected, found: IDENTIFIER_EXPRESSION");
  }

  @Test
  public void testQuasiElementsAlternate() {
    expectValid(
        exprResult(
            quasi(
                name("tag"),
                quasiPortion("a"),
                quasiSubstitution(name("x")),
                quasiPortion("b"))));
    ParseTree second = quasiPortion("b");
    expectInvalidAt(
        exprResult(quasi(null, quasiPortion("a"), second)), second, "Quasi substitution expected");
  }

  @Test
  public void testBlockStatementKind() {
    expectValid(block(function("f", parameters(), block()), label("l", breakStatement("l"))));
    ParseTree statement = name("x");
    expectInvalidAt(block(statement), statement, "statement or function declaration expected");
  }

  @Test
  public void testProgramElementKind() {
    ParseTree element = name("x");
    expectInvalidAt(program(element), element, "global program element expected");
  }

  @Test
  public void testIfClauses() {
    expectValid(ifStatement(name("x"), empty(), block()));
    expectValid(ifStatement(name("x"), empty(), nullTree()));
    ParseTree elseClause = name("y");
    expectInvalidAt(ifStatement(name("x"), empty(), elseClause), elseClause, "statement expected");
  }

  @Test
  public void testCatchBinding() {
    ParseTree binding = number(1);
    expectInvalidAt(
        tryStatement(block(), new CatchTree(null, binding, block()), null),
        binding,
        "binding identifier expected");
  }

  @Test
  public void testValidModuleProgram() {
    ParseTree moduleExpression =
        new ModuleExpressionTree(
            null,
            new ModuleRequireTree(null, new LiteralToken(TokenType.STRING, "'m'", null)),
            ImmutableList.of());
    expectValid(
        program(
            new ImportDeclarationTree(
                null,
                list(
                    new ImportBindingTree(
                        null,
                        moduleExpression,
                        new ImportSpecifierSetTree(
                            null,
                            list(new ImportSpecifierTree(null, identifierToken("a"), null)))))),
            new ExportDeclarationTree(null, var("x", number(1))),
            new ExportDeclarationTree(
                null,
                new ExportMappingListTree(
                    null,
                    list(
                        new ExportMappingTree(
                            null,
                            null,
                            new ExportSpecifierSetTree(
                                null,
                                list(
                                    new ExportSpecifierTree(
                                        null, identifierToken("x"), null)))))))));
  }

  @Test
  public void testExportDeclarationKind() {
    ParseTree declaration = exprResult(name("x"));
    expectInvalidAt(
        program(new ExportDeclarationTree(null, declaration)),
        declaration,
        "expected valid export tree");
  }

  @Test
  public void testExportMappingListNotEmpty() {
    ParseTree paths = new ExportMappingListTree(null, ImmutableList.of());
    expectInvalidAt(
        program(new ExportDeclarationTree(null, paths)), paths, "expected at least one path");
  }

  @Test
  public void testExportMappingModuleExpression() {
    ParseTree moduleExpression = name("m");
    ParseTree mapping = new ExportMappingTree(null, moduleExpression, name("x"));
    expectInvalidAt(
        program(new ExportDeclarationTree(null, new ExportMappingListTree(null, list(mapping)))),
        moduleExpression,
        "module expression expected");
  }

  @Test
  public void testExportSpecifierSetNotEmpty() {
    ParseTree specifiers = new ExportSpecifierSetTree(null, ImmutableList.of());
    ParseTree mapping = new ExportMappingTree(null, null, specifiers);
    expectInvalidAt(
        program(new ExportDeclarationTree(null, new ExportMappingListTree(null, list(mapping)))),
        specifiers,
        "expected at least one identifier");
  }

  @Test
  public void testImportDeclarationNotEmpty() {
    ParseTree declaration = new ImportDeclarationTree(null, ImmutableList.of());
    expectInvalidAt(program(declaration), declaration, "expected at least one import path");
  }

  @Test
  public void testImportSpecifierSetNotEmpty() {
    ParseTree specifiers = new ImportSpecifierSetTree(null, ImmutableList.of());
    ParseTree binding =
        new ImportBindingTree(
            null, new ModuleExpressionTree(null, name("m"), ImmutableList.of()), specifiers);
    expectInvalidAt(
        program(new ImportDeclarationTree(null, list(binding))),
        specifiers,
        "expected at least one identifier");
  }

  @Test
  public void testImportSpecifierKind() {
    ParseTree specifier = name("a");
    ParseTree binding =
        new ImportBindingTree(
            null,
            new ModuleExpressionTree(null, name("m"), ImmutableList.of()),
            new ImportSpecifierSetTree(null, list(specifier)));
    expectInvalidAt(
        program(new ImportDeclarationTree(null, list(binding))),
        specifier,
        "expected valid import specifier");
  }

  @Test
  public void testModuleRequireUrl() {
    ParseTree require = new ModuleRequireTree(null, new LiteralToken(TokenType.NUMBER, "1", null));
    ParseTree binding =
        new ImportBindingTree(
            null, new ModuleExpressionTree(null, require, ImmutableList.of()), name("a"));
    expectInvalidAt(
        program(new ImportDeclarationTree(null, list(binding))), require, "string expected");
  }

  @Test
  public void testModuleDeclarationSpecifiers() {
    ParseTree specifier = name("m");
    expectInvalidAt(
        program(new ModuleDeclarationTree(null, list(specifier))),
        specifier,
        "module specifier expected");

    ParseTree expression = name("x");
    expectInvalidAt(
        program(
            new ModuleDeclarationTree(
                null, list(new ModuleSpecifierTree(null, identifierToken("m"), expression)))),
        expression,
        "module expression expected");
  }

  @Test
  public void testModuleDefinitionElements() {
    expectValid(
        new ModuleDefinitionTree(null, identifierToken("M"), list(var("x", number(1)))));
    ParseTree element = block();
    expectInvalidAt(
        new ModuleDefinitionTree(null, identifierToken("M"), list(element)),
        element,
        "module element expected");
  }

  @Test
  public void testReportsFirstViolationOnly() {
    ParseTree first = empty();
    ParseTreeValidationException e =
        expectInvalid(
            block(whileLoop(name("x"), block(exprResult(first))), block(name("y"))),
            "expression expected");
    assertThat(e.getOffendingTree()).isSameInstanceAs(first);
  }

  @Test
  public void testLocationOfOffendingTree() {
    BreakStatementTree offending = new BreakStatementTree(range(2, 4), null);
    ParseTreeValidationException e =
        expectInvalid(
            block(exprResult(arrayLiteral(offending))), "assignment or spread expected");
    assertThat(e.getLocation()).isEqualTo("input.js:3:4");
    assertThat(e)
        .hasMessageThat()
        .startsWith(
            "Parse tree validation failure 'assignment or spread expected' at input.js:3:4");
  }

  @Test
  public void testLocationFallsBackToRoot() {
    ParseTree root = program(exprResult(arrayLiteral(empty())));
    ParseTree located =
        new ProgramTree(range(0, 0), ImmutableList.of(exprResult(arrayLiteral(empty()))));

    assertThat(expectInvalid(root, "assignment or spread expected").getLocation())
        .isEqualTo("(unknown)");
    assertThat(expectInvalid(located, "assignment or spread expected").getLocation())
        .isEqualTo("input.js:1:0");
  }

  @Test
  public void testTreeDumpHighlightsOffendingTree() {
    ParseTreeValidationException e =
        expectInvalid(
            block(tryStatement(block(), null, null)), "either catch or finally must be present");
    assertThat(e.getTreeDump()).contains(">>>     TRY_STATEMENT");
    assertThat(e.getTreeDump()).startsWith("         BLOCK\n");
    assertThat(e).hasMessageThat().endsWith(e.getTreeDump() + "\n");
  }

  @Test
  public void testValidationIsRepeatable() {
    ParseTree tree = block(switchStatement(name("x"), defaultClause(), defaultClause()));
    ParseTreeValidationException first =
        expectInvalid(tree, "no more than one default clause allowed");
    ParseTreeValidationException second =
        expectInvalid(tree, "no more than one default clause allowed");
    assertThat(second.getMessage()).isEqualTo(first.getMessage());

    ParseTree valid = block(var("x", number(1)));
    expectValid(valid);
    expectValid(valid);
  }

  @Test
  public void testOtherFailuresPropagate() {
    ParseTree malformed = new ParseTree(ParseTreeType.BLOCK, null) {};
    assertThrows(ClassCastException.class, () -> ParseTreeValidator.validate(malformed));
  }
}
