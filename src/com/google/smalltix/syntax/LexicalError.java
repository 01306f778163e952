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

/** Raised by {@link TokenStream} for source text that does not form a token. */
@SuppressWarnings("serial")
public final class LexicalError extends SmalltixException {
  private final char character;

  LexicalError(String details, char character, int offset) {
    super(details, offset);
    this.character = character;
  }

  static LexicalError unexpectedCharacter(char c, int offset) {
    return new LexicalError("Unexpected character: '" + c + "' at position " + offset, c, offset);
  }

  /** The character at which scanning failed. */
  public char character() {
    return character;
  }
}
