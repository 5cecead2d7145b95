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
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.arrayPattern;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.block;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.breakStatement;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.call;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.comma;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.function;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.name;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.newExpression;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.newExpressionWithoutArguments;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.nullTree;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.number;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.parameters;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.paren;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.spread;
import static com.google.javascript.transpiler.parsing.trees.ParseTrees.tryStatement;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParseTreeTest {

  @Test
  public void testParenthesizedPattern() {
    assertThat(arrayPattern(name("a")).isPattern()).isTrue();
    assertThat(paren(arrayPattern(name("a"))).isPattern()).isTrue();
    assertThat(paren(name("a")).isPattern()).isFalse();
  }

  @Test
  public void testNewIsMemberExpressionOnlyWithArguments() {
    assertThat(newExpression(name("Foo")).isMemberExpression()).isTrue();
    assertThat(newExpressionWithoutArguments(name("Foo")).isMemberExpression()).isFalse();
    assertThat(newExpressionWithoutArguments(name("Foo")).isLeftHandSideExpression()).isTrue();
  }

  @Test
  public void testExpressionCategories() {
    ParseTree sequence = comma(name("a"), name("b"));
    assertThat(sequence.isExpression()).isTrue();
    assertThat(sequence.isAssignmentExpression()).isFalse();

    assertThat(spread(name("a")).isAssignmentOrSpread()).isTrue();
    assertThat(spread(name("a")).isExpression()).isFalse();
    assertThat(call(name("f")).isAssignmentExpression()).isTrue();
  }

  @Test
  public void testStatementCategories() {
    ParseTree function = function("f", parameters(), block());
    assertThat(function.isStatement()).isFalse();
    assertThat(function.isSourceElement()).isTrue();
    assertThat(function.isProgramElement()).isTrue();
    assertThat(breakStatement().isStatement()).isTrue();
    assertThat(name("x").isStatement()).isFalse();
  }

  @Test
  public void testNullTree() {
    assertThat(nullTree().isNull()).isTrue();
    assertThat(nullTree().isExpression()).isFalse();
  }

  @Test
  public void testTryTreatsNullTreeAsAbsent() {
    TryStatementTree tree = tryStatement(block(), nullTree(), null);
    assertThat(tree.hasCatch()).isFalse();
    assertThat(tree.hasFinally()).isFalse();
  }

  @Test
  public void testChildrenSkipAbsentParts() {
    TryStatementTree tree = tryStatement(block(), null, ParseTrees.finallyClause(block()));
    assertThat(tree.children()).hasSize(2);
    assertThat(number(1).children()).isEmpty();
  }

  @Test
  public void testToStringIncludesDetail() {
    assertThat(name("x").toString()).isEqualTo("IDENTIFIER_EXPRESSION x");
    assertThat(breakStatement("out").toString()).isEqualTo("BREAK_STATEMENT out");
    assertThat(breakStatement().toString()).isEqualTo("BREAK_STATEMENT");
  }
}
