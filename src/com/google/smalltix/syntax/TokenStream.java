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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/**
 * This class implements the Smalltalk scanner.
 *
 * <p>Whitespace and {@code "..."} comments are skipped. Two characters need context: a {@code -}
 * belongs to a number only when a digit follows it, and a {@code .} is a decimal point only when
 * it sits between digits. Everywhere else they are a binary operator and the statement
 * separator.
 */
public final class TokenStream {
  static final CharMatcher BINARY_CHARS = CharMatcher.anyOf("+-*/\\<>=@%|&?,~");

  private final String source;
  private int pos;

  public TokenStream(String source) {
    this.source = source;
  }

  /** Scans all of {@code source}. The last token is always {@link TokenType#END}. */
  public static ImmutableList<Token> tokenize(String source) {
    TokenStream ts = new TokenStream(source);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    Token token;
    do {
      token = ts.getToken();
      tokens.add(token);
    } while (!token.is(TokenType.END));
    return tokens.build();
  }

  /** Returns the next token, or an END token at the source length once input is exhausted. */
  public Token getToken() {
    skipWhitespaceAndComments();
    if (pos >= source.length()) {
      return new Token(TokenType.END, "", source.length());
    }

    int start = pos;
    char c = source.charAt(pos);
    switch (c) {
      case '^':
        return single(TokenType.CARET);
      case '.':
        return single(TokenType.DOT);
      case ';':
        return single(TokenType.SEMI);
      case '(':
        return single(TokenType.LPAREN);
      case ')':
        return single(TokenType.RPAREN);
      case '[':
        return single(TokenType.LBRACKET);
      case ']':
        return single(TokenType.RBRACKET);
      case '|':
        return single(TokenType.BAR);
      case '\'':
        return readString();
      case '#':
        return readSymbol();
      case ':':
        if (peekChar(1) == '=') {
          pos += 2;
          return new Token(TokenType.ASSIGN, ":=", start);
        }
        if (isIdentifierStart(peekChar(1))) {
          pos++;
          String name = readIdentifier();
          return new Token(TokenType.BLOCK_PARAM, name, start);
        }
        throw LexicalError.unexpectedCharacter(c, start);
      default:
        break;
    }

    if (isDigit(c) || (c == '-' && isDigit(peekChar(1)))) {
      return readNumber();
    }
    if (isIdentifierStart(c)) {
      String name = readIdentifier();
      if (peekChar(0) == ':' && peekChar(1) != '=') {
        pos++;
        return new Token(TokenType.KEYWORD, name + ":", start);
      }
      return new Token(TokenType.NAME, name, start);
    }
    if (BINARY_CHARS.matches(c)) {
      while (pos < source.length() && BINARY_CHARS.matches(source.charAt(pos))) {
        pos++;
      }
      return new Token(TokenType.BINARY, source.substring(start, pos), start);
    }
    throw LexicalError.unexpectedCharacter(c, start);
  }

  private void skipWhitespaceAndComments() {
    while (pos < source.length()) {
      char c = source.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '"') {
        int close = source.indexOf('"', pos + 1);
        if (close < 0) {
          throw new LexicalError("Unterminated comment at position " + pos, c, pos);
        }
        pos = close + 1;
      } else {
        return;
      }
    }
  }

  private Token single(TokenType type) {
    int start = pos++;
    return new Token(type, source.substring(start, pos), start);
  }

  private Token readNumber() {
    int start = pos;
    if (source.charAt(pos) == '-') {
      pos++;
    }
    skipDigits();
    // A dot not followed by a digit ends the statement instead.
    if (peekChar(0) == '.' && isDigit(peekChar(1))) {
      pos++;
      skipDigits();
      return new Token(TokenType.FLOAT, source.substring(start, pos), start);
    }
    return new Token(TokenType.INT, source.substring(start, pos), start);
  }

  private void skipDigits() {
    while (pos < source.length() && isDigit(source.charAt(pos))) {
      pos++;
    }
  }

  private Token readString() {
    int start = pos;
    StringBuilder text = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= source.length()) {
        throw new LexicalError("Unterminated string literal at position " + start, '\'', start);
      }
      char c = source.charAt(pos);
      if (c == '\'') {
        if (peekChar(1) == '\'') {
          text.append('\'');
          pos += 2;
          continue;
        }
        pos++;
        return new Token(TokenType.STRING, text.toString(), start);
      }
      text.append(c);
      pos++;
    }
  }

  private Token readSymbol() {
    int start = pos;
    pos++;
    if (peekChar(0) == '\'') {
      int close = source.indexOf('\'', pos + 1);
      if (close < 0) {
        throw new LexicalError("Unterminated symbol literal at position " + start, '#', start);
      }
      String text = source.substring(pos + 1, close);
      pos = close + 1;
      return new Token(TokenType.SYMBOL, text, start);
    }
    int textStart = pos;
    while (pos < source.length()
        && (isIdentifierPart(source.charAt(pos)) || source.charAt(pos) == ':')) {
      pos++;
    }
    if (pos == textStart) {
      throw LexicalError.unexpectedCharacter('#', start);
    }
    return new Token(TokenType.SYMBOL, source.substring(textStart, pos), start);
  }

  private String readIdentifier() {
    int start = pos;
    while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
      pos++;
    }
    return source.substring(start, pos);
  }

  /** Returns the character {@code ahead} positions past the current one, or 0 past the end. */
  private char peekChar(int ahead) {
    int i = pos + ahead;
    return i < source.length() ? source.charAt(i) : 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
