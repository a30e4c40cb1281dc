/*
 * Copyright 2026 The PCRefine Authors.
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

package com.pcrefine.ast;

/** The node kinds of a parsed PeopleCode program. */
public enum Token {
  PROGRAM,
  IMPORT,

  // Type declarations.
  CLASS,
  INTERFACE,
  EXTENDS,
  CLASS_MEMBERS,

  // Members and callables.
  METHOD,
  FUNCTION,
  PARAM_LIST,
  PARAM,
  PROPERTY,
  GETTER,
  SETTER,

  // Declarations.
  INSTANCE_VAR,
  GLOBAL_VAR,
  COMPONENT_VAR,
  LOCAL_VAR,
  CONSTANT,

  // Statements.
  BLOCK,
  EXPR_RESULT,
  IF,
  FOR,
  WHILE,
  TRY,
  CATCH,
  RETURN,
  EXIT,
  THROW,
  BREAK,
  CONTINUE,
  ERROR,

  // Expressions.
  ASSIGN,
  NAME,
  MEMBER_NAME,
  MEMBER_ACCESS,
  CALL,
  CREATE,
  BINARY_OP,
  NOT,
  STRING,
  NUMBER,
  TRUE,
  FALSE,
  NULL,
  TYPE_REF,
  EMPTY;
}
