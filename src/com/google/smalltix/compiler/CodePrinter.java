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

package com.google.smalltix.compiler;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.smalltix.syntax.Assign;
import com.google.smalltix.syntax.Block;
import com.google.smalltix.syntax.Cascade;
import com.google.smalltix.syntax.Literal;
import com.google.smalltix.syntax.Message;
import com.google.smalltix.syntax.Method;
import com.google.smalltix.syntax.Node;
import com.google.smalltix.syntax.Return;
import com.google.smalltix.syntax.Selectors;
import com.google.smalltix.syntax.Send;
import com.google.smalltix.syntax.Variable;
import java.util.List;

/**
 * CodePrinter prints an AST back to Smalltalk source, adding only the parentheses needed for
 * the result to parse back into the same tree.
 */
public final class CodePrinter {
  // Precedence levels, tightest first.
  private static final int PRIMARY = 0;
  private static final int UNARY = 1;
  private static final int BINARY = 2;
  private static final int KEYWORD = 3;
  private static final int CASCADE = 4;
  private static final int ASSIGNMENT = 5;

  private static final String INDENT = "  ";
  private static final CharMatcher PLAIN_SYMBOL_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_:"));

  private CodePrinter() {}

  /**
   * Prints a method: the message pattern on the first line, then temporaries and one statement
   * per line, indented.
   */
  public static String printMethod(Method method) {
    StringBuilder sb = new StringBuilder(pattern(method.selector(), method.params()));
    if (!method.temps().isEmpty()) {
      sb.append('\n').append(INDENT).append(declaration(method.temps()));
    }
    for (Node statement : method.body()) {
      sb.append('\n').append(INDENT).append(print(statement)).append('.');
    }
    return sb.append('\n').toString();
  }

  /** Prints a single statement or expression. */
  public static String print(Node node) {
    if (node instanceof Method method) {
      return printMethod(method);
    } else if (node instanceof Return ret) {
      return "^ " + print(ret.value(), ASSIGNMENT);
    }
    return print(node, ASSIGNMENT);
  }

  private static String pattern(String selector, List<String> params) {
    if (Selectors.isKeyword(selector)) {
      StringBuilder sb = new StringBuilder();
      ImmutableList<String> parts = Selectors.keywordParts(selector);
      for (int i = 0; i < parts.size(); i++) {
        if (i > 0) {
          sb.append(' ');
        }
        sb.append(parts.get(i)).append(' ').append(params.get(i));
      }
      return sb.toString();
    }
    return params.isEmpty() ? selector : selector + " " + params.get(0);
  }

  private static String declaration(List<String> temps) {
    return "| " + Joiner.on(' ').join(temps) + " |";
  }

  /** Prints {@code node}, parenthesized if it binds more loosely than {@code maxLevel}. */
  private static String print(Node node, int maxLevel) {
    String text = printUnparenthesized(node);
    return level(node) > maxLevel ? "(" + text + ")" : text;
  }

  private static int level(Node node) {
    if (node instanceof Send send) {
      return messageLevel(send.selector());
    } else if (node instanceof Cascade) {
      return CASCADE;
    } else if (node instanceof Assign) {
      return ASSIGNMENT;
    }
    return PRIMARY;
  }

  private static int messageLevel(String selector) {
    if (Selectors.isKeyword(selector)) {
      return KEYWORD;
    }
    return Selectors.isBinary(selector) ? BINARY : UNARY;
  }

  /** The loosest receiver a message can take without parentheses. */
  private static int receiverLevel(String selector) {
    return messageLevel(selector) == UNARY ? UNARY : BINARY;
  }

  private static String printUnparenthesized(Node node) {
    if (node instanceof Literal literal) {
      return printLiteral(literal);
    } else if (node instanceof Variable variable) {
      return variable.name();
    } else if (node instanceof Assign assign) {
      return assign.name() + " := " + print(assign.value(), ASSIGNMENT);
    } else if (node instanceof Send send) {
      return print(send.receiver(), receiverLevel(send.selector()))
          + printMessage(send.selector(), send.args());
    } else if (node instanceof Cascade cascade) {
      ImmutableList<Message> messages = cascade.messages();
      StringBuilder sb =
          new StringBuilder(print(cascade.receiver(), receiverLevel(messages.get(0).selector())));
      for (int i = 0; i < messages.size(); i++) {
        if (i > 0) {
          sb.append(';');
        }
        sb.append(printMessage(messages.get(i).selector(), messages.get(i).args()));
      }
      return sb.toString();
    } else if (node instanceof Block block) {
      return printBlock(block);
    }
    throw new IllegalArgumentException("Cannot print " + node);
  }

  /** Prints a message with a leading space, without its receiver. */
  private static String printMessage(String selector, List<Node> args) {
    switch (messageLevel(selector)) {
      case UNARY:
        return " " + selector;
      case BINARY:
        return " " + selector + " " + print(args.get(0), UNARY);
      default:
        StringBuilder sb = new StringBuilder();
        ImmutableList<String> parts = Selectors.keywordParts(selector);
        for (int i = 0; i < parts.size(); i++) {
          sb.append(' ').append(parts.get(i)).append(' ').append(print(args.get(i), BINARY));
        }
        return sb.toString();
    }
  }

  private static String printBlock(Block block) {
    StringBuilder sb = new StringBuilder("[");
    if (!block.params().isEmpty()) {
      for (String param : block.params()) {
        sb.append(" :").append(param);
      }
      sb.append(" |");
    }
    if (!block.temps().isEmpty()) {
      sb.append(' ').append(declaration(block.temps()));
    }
    for (int i = 0; i < block.body().size(); i++) {
      sb.append(i == 0 ? " " : ". ").append(print(block.body().get(i)));
    }
    return sb.append(" ]").toString();
  }

  private static String printLiteral(Literal literal) {
    switch (literal.kind()) {
      case STRING:
        return "'" + literal.text().replace("'", "''") + "'";
      case SYMBOL:
        String text = literal.text();
        return !text.isEmpty() && PLAIN_SYMBOL_CHARS.matchesAllOf(text)
            ? "#" + text
            : "#'" + text + "'";
      default:
        return literal.text();
    }
  }
}
