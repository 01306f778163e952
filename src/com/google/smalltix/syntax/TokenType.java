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

package com.google.smalltix.syntax;

/**
 * Kinds of lexical tokens.
 *
 * <p>The names match what {@link SyntaxError} reports, so they read as grammar symbols.
 */
public enum TokenType {
  CARET, // return arrow (^)
  ASSIGN, // :=
  DOT, // statement separator
  SEMI, // cascade separator
  LPAREN,
  RPAREN,
  LBRACKET,
  RBRACKET,
  BAR, // temporaries, block parameters, and the binary selector |
  INT,
  FLOAT,
  STRING,
  SYMBOL,
  KEYWORD, // identifier immediately followed by ':'; the text keeps the colon
  NAME,
  BLOCK_PARAM, // :name inside a block; the text drops the colon
  BINARY, // maximal run of operator characters
  END;
}
