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

/** The closed set of parse tree kinds. Each constant has exactly one tree class. */
public enum ParseTreeType {
  ARGUMENT_LIST,
  ARRAY_LITERAL_EXPRESSION,
  ARRAY_PATTERN,
  ARROW_FUNCTION_EXPRESSION,
  AWAIT_STATEMENT,
  BINARY_OPERATOR,
  BINDING_ELEMENT,
  BINDING_IDENTIFIER,
  BLOCK,
  BREAK_STATEMENT,
  CALL_EXPRESSION,
  CASE_CLAUSE,
  CATCH,
  CLASS_DECLARATION,
  CLASS_EXPRESSION,
  COMMA_EXPRESSION,
  CONDITIONAL_EXPRESSION,
  CONTINUE_STATEMENT,
  DEBUGGER_STATEMENT,
  DEFAULT_CLAUSE,
  DO_WHILE_STATEMENT,
  EMPTY_STATEMENT,
  EXPORT_DECLARATION,
  EXPORT_MAPPING,
  EXPORT_MAPPING_LIST,
  EXPORT_SPECIFIER,
  EXPORT_SPECIFIER_SET,
  EXPRESSION_STATEMENT,
  FINALLY,
  FOR_IN_STATEMENT,
  FOR_OF_STATEMENT,
  FOR_STATEMENT,
  FORMAL_PARAMETER_LIST,
  FUNCTION_DECLARATION,
  GET_ACCESSOR,
  IDENTIFIER_EXPRESSION,
  IF_STATEMENT,
  IMPORT_BINDING,
  IMPORT_DECLARATION,
  IMPORT_SPECIFIER,
  IMPORT_SPECIFIER_SET,
  LABELLED_STATEMENT,
  LITERAL_EXPRESSION,
  MEMBER_EXPRESSION,
  MEMBER_LOOKUP_EXPRESSION,
  MISSING_PRIMARY_EXPRESSION,
  MODULE_DECLARATION,
  MODULE_DEFINITION,
  MODULE_EXPRESSION,
  MODULE_REQUIRE,
  MODULE_SPECIFIER,
  NEW_EXPRESSION,
  NULL,
  OBJECT_LITERAL_EXPRESSION,
  OBJECT_PATTERN,
  OBJECT_PATTERN_FIELD,
  PAREN_EXPRESSION,
  POSTFIX_EXPRESSION,
  PROGRAM,
  PROPERTY_METHOD_ASSIGNMENT,
  PROPERTY_NAME_ASSIGNMENT,
  PROPERTY_NAME_SHORTHAND,
  QUASI_LITERAL_EXPRESSION,
  QUASI_LITERAL_PORTION,
  QUASI_SUBSTITUTION,
  REST_PARAMETER,
  RETURN_STATEMENT,
  SET_ACCESSOR,
  SPREAD_EXPRESSION,
  SPREAD_PATTERN_ELEMENT,
  STATE_MACHINE,
  SUPER_EXPRESSION,
  SWITCH_STATEMENT,
  THIS_EXPRESSION,
  THROW_STATEMENT,
  TRY_STATEMENT,
  UNARY_EXPRESSION,
  VARIABLE_DECLARATION,
  VARIABLE_DECLARATION_LIST,
  VARIABLE_STATEMENT,
  WHILE_STATEMENT,
  WITH_STATEMENT,
  YIELD_STATEMENT,
}
