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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.List;

/**
 * This class implements the Smalltalk method parser.
 *
 * <p>It is a recursive descent parser with one token of lookahead, plus a second token to tell
 * an assignment target from a unary message. Precedence, tightest first: primary, unary send,
 * binary send, keyword send, cascade, assignment. The first mismatch raises a {@link
 * SyntaxError}; there is no recovery.
 *
 * @see TokenStream
 */
public final class Parser {
  private final ImmutableList<Token> tokens;
  private int pos;

  public Parser(List<Token> tokens) {
    checkArgument(
        !tokens.isEmpty() && Iterables.getLast(tokens).is(TokenType.END),
        "token sequence must end with END");
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /** Scans and parses {@code source} as one method. */
  public static Method parse(String source) {
    return new Parser(TokenStream.tokenize(source)).parseMethod();
  }

  /** Parses a message pattern, optional temporaries, and statements up to end of input. */
  public Method parseMethod() {
    Token start = current();
    String selector;
    ImmutableList.Builder<String> params = ImmutableList.builder();
    switch (start.type()) {
      case NAME:
        selector = advance().text();
        break;
      case BINARY:
      case BAR:
        selector = advance().text();
        params.add(expect(TokenType.NAME).text());
        break;
      case KEYWORD:
        StringBuilder keywords = new StringBuilder();
        while (at(TokenType.KEYWORD)) {
          keywords.append(advance().text());
          params.add(expect(TokenType.NAME).text());
        }
        selector = keywords.toString();
        break;
      default:
        throw SyntaxError.unexpected("message pattern", start);
    }

    ImmutableList<String> temps = parseTemporaries();
    ImmutableList<Node> body = parseStatements();
    expect(TokenType.END);
    return new Method(selector, params.build(), temps, body);
  }

  private ImmutableList<String> parseTemporaries() {
    ImmutableList.Builder<String> temps = ImmutableList.builder();
    if (at(TokenType.BAR)) {
      advance();
      while (at(TokenType.NAME)) {
        temps.add(advance().text());
      }
      expect(TokenType.BAR);
    }
    return temps.build();
  }

  /** Parses dot-separated statements up to end of input or a closing bracket. */
  private ImmutableList<Node> parseStatements() {
    ImmutableList.Builder<Node> statements = ImmutableList.builder();
    while (!at(TokenType.END) && !at(TokenType.RBRACKET)) {
      if (at(TokenType.DOT)) {
        // Empty statement.
        advance();
        continue;
      }
      statements.add(parseStatement());
      if (!at(TokenType.DOT)) {
        break;
      }
      advance();
    }
    return statements.build();
  }

  private Node parseStatement() {
    if (at(TokenType.CARET)) {
      advance();
      return new Return(parseExpression());
    }
    return parseExpression();
  }

  private Node parseExpression() {
    if (at(TokenType.NAME) && peek(1).is(TokenType.ASSIGN)) {
      String name = advance().text();
      advance();
      return new Assign(name, parseExpression());
    }
    return parseCascade();
  }

  private Node parseCascade() {
    Node expr = parseKeywordSend();
    if (!at(TokenType.SEMI)) {
      return expr;
    }
    if (!(expr instanceof Send first)) {
      throw new SyntaxError("Cascade requires a message send", current().offset());
    }

    ImmutableList.Builder<Message> messages = ImmutableList.builder();
    messages.add(new Message(first.selector(), first.args()));
    while (at(TokenType.SEMI)) {
      advance();
      messages.add(parseCascadeMessage());
    }
    return new Cascade(first.receiver(), messages.build());
  }

  private Message parseCascadeMessage() {
    Token token = current();
    switch (token.type()) {
      case NAME:
        advance();
        return new Message(token.text());
      case BINARY:
      case BAR:
        advance();
        return new Message(token.text(), parseUnarySend());
      case KEYWORD:
        StringBuilder selector = new StringBuilder();
        ImmutableList.Builder<Node> args = ImmutableList.builder();
        while (at(TokenType.KEYWORD)) {
          selector.append(advance().text());
          args.add(parseBinarySend());
        }
        return new Message(selector.toString(), args.build());
      default:
        throw SyntaxError.unexpected("cascade", token);
    }
  }

  private Node parseKeywordSend() {
    Node receiver = parseBinarySend();
    if (!at(TokenType.KEYWORD)) {
      return receiver;
    }
    StringBuilder selector = new StringBuilder();
    ImmutableList.Builder<Node> args = ImmutableList.builder();
    while (at(TokenType.KEYWORD)) {
      selector.append(advance().text());
      args.add(parseBinarySend());
    }
    return new Send(receiver, selector.toString(), args.build());
  }

  private Node parseBinarySend() {
    Node receiver = parseUnarySend();
    while (at(TokenType.BINARY) || at(TokenType.BAR)) {
      String selector = advance().text();
      receiver = new Send(receiver, selector, parseUnarySend());
    }
    return receiver;
  }

  private Node parseUnarySend() {
    Node receiver = parsePrimary();
    while (at(TokenType.NAME) && !peek(1).is(TokenType.ASSIGN)) {
      receiver = new Send(receiver, advance().text());
    }
    return receiver;
  }

  private Node parsePrimary() {
    Token token = current();
    switch (token.type()) {
      case INT:
        advance();
        return new Literal(Literal.Kind.INT, token.text(), token.offset());
      case FLOAT:
        advance();
        return new Literal(Literal.Kind.FLOAT, token.text(), token.offset());
      case STRING:
        advance();
        return new Literal(Literal.Kind.STRING, token.text(), token.offset());
      case SYMBOL:
        advance();
        return new Literal(Literal.Kind.SYMBOL, token.text(), token.offset());
      case NAME:
        advance();
        return new Variable(token.text());
      case LPAREN:
        advance();
        Node expr = parseExpression();
        expect(TokenType.RPAREN);
        return expr;
      case LBRACKET:
        return parseBlock();
      default:
        throw SyntaxError.unexpected("primary", token);
    }
  }

  private Block parseBlock() {
    Token open = expect(TokenType.LBRACKET);
    int bodyStart = open.offset() + 1;

    ImmutableList.Builder<String> params = ImmutableList.builder();
    boolean hasParams = false;
    while (at(TokenType.BLOCK_PARAM)) {
      params.add(advance().text());
      hasParams = true;
    }
    if (hasParams) {
      // [:x] needs no bar.
      bodyStart = at(TokenType.RBRACKET) ? current().offset() : expect(TokenType.BAR).offset() + 1;
    }

    ImmutableList.Builder<String> temps = ImmutableList.builder();
    if (at(TokenType.BAR)) {
      advance();
      while (at(TokenType.NAME)) {
        temps.add(advance().text());
      }
      bodyStart = expect(TokenType.BAR).offset() + 1;
    }

    ImmutableList<Node> body = parseStatements();
    Token close = expect(TokenType.RBRACKET);
    return new Block(params.build(), temps.build(), body, bodyStart, close.offset());
  }

  private Token current() {
    return tokens.get(pos);
  }

  /** Looks {@code ahead} tokens past the current one; END repeats past the end. */
  private Token peek(int ahead) {
    return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
  }

  private boolean at(TokenType type) {
    return current().is(type);
  }

  private Token advance() {
    Token token = current();
    if (pos < tokens.size() - 1) {
      pos++;
    }
    return token;
  }

  private Token expect(TokenType type) {
    if (!at(type)) {
      throw SyntaxError.expected(type, current());
    }
    return advance();
  }
}
