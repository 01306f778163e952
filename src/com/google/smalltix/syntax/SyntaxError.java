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

import org.jspecify.annotations.Nullable;

/**
 * Raised by {@link Parser} when the token sequence does not match the method grammar. Parsing
 * never recovers from one of these.
 */
@SuppressWarnings("serial")
public final class SyntaxError extends SmalltixException {
  private final @Nullable TokenType expected;
  private final @Nullable TokenType actual;

  SyntaxError(String details, int offset) {
    this(details, null, null, offset);
  }

  private SyntaxError(
      String details, @Nullable TokenType expected, @Nullable TokenType actual, int offset) {
    super(details, offset);
    this.expected = expected;
    this.actual = actual;
  }

  static SyntaxError expected(TokenType expected, Token actual) {
    return new SyntaxError(
        "Expected " + expected + ", got " + describe(actual),
        expected,
        actual.type(),
        actual.offset());
  }

  static SyntaxError unexpected(String context, Token actual) {
    return new SyntaxError(
        "Unexpected token in " + context + ": " + describe(actual),
        null,
        actual.type(),
        actual.offset());
  }

  private static String describe(Token token) {
    return token.type() == TokenType.END
        ? "end of input"
        : token.type() + " ('" + token.text() + "')";
  }

  /** The token kind the parser required, or null if several kinds would have been accepted. */
  public @Nullable TokenType expected() {
    return expected;
  }

  /** The token kind actually found, or null if the failure is not about a single token. */
  public @Nullable TokenType actual() {
    return actual;
  }
}
