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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A token with its source offset.
 *
 * <p>For {@link TokenType#STRING} and {@link TokenType#SYMBOL} the text is the literal's
 * content with quotes and escapes removed.
 *
 * @param type the kind of token
 * @param text the token's text
 * @param offset zero-based offset of the token's first character
 */
public record Token(TokenType type, String text, int offset) {
  public Token {
    requireNonNull(type, "type");
    requireNonNull(text, "text");
    checkArgument(offset >= 0, "negative offset %s", offset);
    checkArgument(type != TokenType.KEYWORD || text.endsWith(":"), "keyword %s", text);
  }

  boolean is(TokenType t) {
    return type == t;
  }
}
