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

package com.google.javascript.ecmatree.ast;

/**
 * The closed set of node kinds. Each concrete {@link Node} class maps to exactly one constant.
 */
public enum Kind {
  // Value literals and names
  BOOLEAN(Category.LITERAL),
  NULL(Category.LITERAL),
  NUMBER(Category.LITERAL),
  STRING(Category.LITERAL),
  REGEX(Category.LITERAL),
  IDENTIFIER(Category.EXPRESSION),

  // Composite literals
  ARRAY(Category.LITERAL),
  OBJECT(Category.LITERAL),
  GET_PROP_ASSIGN(Category.PART),
  SET_PROP_ASSIGN(Category.PART),
  ELISION(Category.PART),

  // Access and calls
  BRACKET_ACCESSOR(Category.EXPRESSION),
  DOT_ACCESSOR(Category.EXPRESSION),
  FUNCTION_CALL(Category.EXPRESSION),
  NEW_EXPR(Category.EXPRESSION),

  // Operators
  ASSIGN(Category.EXPRESSION),
  BIN_OP(Category.EXPRESSION),
  UNARY_OP(Category.EXPRESSION),
  CONDITIONAL(Category.EXPRESSION),
  COMMA(Category.EXPRESSION),
  THIS(Category.EXPRESSION),
  FUNC_EXPR(Category.EXPRESSION),

  // Declarations
  VAR_STATEMENT(Category.STATEMENT),
  VAR_DECL(Category.PART),
  FUNC_DECL(Category.STATEMENT),

  // Control flow
  IF(Category.STATEMENT),
  WHILE(Category.STATEMENT),
  DO_WHILE(Category.STATEMENT),
  FOR(Category.STATEMENT),
  FOR_IN(Category.STATEMENT),
  SWITCH(Category.STATEMENT),
  CASE(Category.PART),
  DEFAULT(Category.PART),
  TRY(Category.STATEMENT),
  CATCH(Category.PART),
  FINALLY(Category.PART),
  LABEL(Category.STATEMENT),
  WITH(Category.STATEMENT),

  // Terminators
  RETURN(Category.STATEMENT),
  BREAK(Category.STATEMENT),
  CONTINUE(Category.STATEMENT),
  THROW(Category.STATEMENT),

  // Structure
  PROGRAM(Category.PART),
  BLOCK(Category.STATEMENT),
  EXPR_STATEMENT(Category.STATEMENT),
  EMPTY_STATEMENT(Category.STATEMENT),
  DEBUGGER(Category.STATEMENT);

  private enum Category {
    LITERAL,
    EXPRESSION,
    STATEMENT,
    // Only meaningful inside a specific parent: clauses, declarators, accessors, holes.
    PART
  }

  private final Category category;

  Kind(Category category) {
    this.category = category;
  }

  public boolean isLiteral() {
    return category == Category.LITERAL;
  }

  /** Literals count as expressions too. */
  public boolean isExpression() {
    return category == Category.EXPRESSION || category == Category.LITERAL;
  }

  public boolean isStatement() {
    return category == Category.STATEMENT;
  }
}
