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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ParserTest {

  @Test
  public void testUnaryPattern() {
    Method method = Parser.parse("double ^ self + self .");
    assertThat(method)
        .isEqualTo(
            new Method(
                "double",
                ImmutableList.of(),
                ImmutableList.of(),
                ImmutableList.of(new Return(new Send(name("self"), "+", name("self"))))));
  }

  @Test
  public void testBinaryPattern() {
    Method method = Parser.parse("+ other ^ other");
    assertThat(method.selector()).isEqualTo("+");
    assertThat(method.params()).containsExactly("other");
  }

  @Test
  public void testBarAsBinaryPattern() {
    Method method = Parser.parse("| other ^ self or: other");
    assertThat(method.selector()).isEqualTo("|");
    assertThat(method.params()).containsExactly("other");
    assertThat(method.temps()).isEmpty();
  }

  @Test
  public void testKeywordPattern() {
    Method method = Parser.parse("at: i put: v ^ v");
    assertThat(method.selector()).isEqualTo("at:put:");
    assertThat(method.params()).containsExactly("i", "v").inOrder();
  }

  @Test
  public void testTemporaries() {
    Method method = Parser.parse("foo | a b | a := 1. ^ a");
    assertThat(method.temps()).containsExactly("a", "b").inOrder();
    assertThat(method.body())
        .containsExactly(new Assign("a", integer("1")), new Return(name("a")))
        .inOrder();
  }

  @Test
  public void testEmptyBody() {
    assertThat(Parser.parse("foo").body()).isEmpty();
  }

  @Test
  public void testEmptyStatementsAreSkipped() {
    assertThat(Parser.parse("foo . ^ 1 . .").body()).containsExactly(new Return(integer("1")));
  }

  @Test
  public void testBinaryIsLeftAssociative() {
    assertThat(statement("foo a + b * c"))
        .isEqualTo(new Send(new Send(name("a"), "+", name("b")), "*", name("c")));
  }

  @Test
  public void testPrecedence() {
    assertThat(statement("foo a bar + b baz: c qux"))
        .isEqualTo(
            new Send(
                new Send(new Send(name("a"), "bar"), "+", name("b")),
                "baz:",
                new Send(name("c"), "qux")));
  }

  @Test
  public void testKeywordPartsMakeOneSend() {
    assertThat(statement("foo d at: 1 put: 2 + 3"))
        .isEqualTo(
            new Send(
                name("d"), "at:put:", integer("1"), new Send(integer("2"), "+", integer("3"))));
  }

  @Test
  public void testParentheses() {
    assertThat(statement("foo a + (b * c)"))
        .isEqualTo(new Send(name("a"), "+", new Send(name("b"), "*", name("c"))));
    assertThat(statement("foo (a at: 1) size"))
        .isEqualTo(new Send(new Send(name("a"), "at:", integer("1")), "size"));
  }

  @Test
  public void testBarAsBinaryOperator() {
    assertThat(statement("foo a | b")).isEqualTo(new Send(name("a"), "|", name("b")));
  }

  @Test
  public void testChainedAssignment() {
    assertThat(statement("foo | a b | a := b := 3"))
        .isEqualTo(new Assign("a", new Assign("b", integer("3"))));
  }

  @Test
  public void testAssignmentTargetIsNotUnaryMessage() {
    assertThat(Parser.parse("foo | a | self bar. a := 1").body())
        .containsExactly(new Send(name("self"), "bar"), new Assign("a", integer("1")))
        .inOrder();
  }

  @Test
  public void testLiterals() {
    assertThat(statement("foo 2.5")).isEqualTo(new Literal(Literal.Kind.FLOAT, "2.5"));
    assertThat(statement("foo 'hi'")).isEqualTo(new Literal(Literal.Kind.STRING, "hi"));
    assertThat(statement("foo #hi")).isEqualTo(new Literal(Literal.Kind.SYMBOL, "hi"));
  }

  @Test
  public void testLiteralOffsets() {
    Send send = (Send) statement("foo self at: 'k' put: -3");
    assertThat(((Literal) send.args().get(0)).offset()).isEqualTo(13);
    assertThat(((Literal) send.args().get(1)).offset()).isEqualTo(22);
    // Equality is structural.
    assertThat(send.args().get(1)).isEqualTo(new Literal(Literal.Kind.INT, "-3"));
  }

  @Test
  public void testCascade() {
    assertThat(statement("fill: coll coll add: 1; add: 2; yourself"))
        .isEqualTo(
            new Cascade(
                name("coll"),
                ImmutableList.of(
                    new Message("add:", integer("1")),
                    new Message("add:", integer("2")),
                    new Message("yourself"))));
  }

  @Test
  public void testCascadeReceiverIsLastSendReceiver() {
    assertThat(statement("foo a b c; d; + 1"))
        .isEqualTo(
            new Cascade(
                new Send(name("a"), "b"),
                ImmutableList.of(
                    new Message("c"), new Message("d"), new Message("+", integer("1")))));
  }

  @Test
  public void testCascadeWithoutSend() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo a; b"));
    assertThat(e.details()).isEqualTo("Cascade requires a message send");
  }

  @Test
  public void testBlock() {
    assertThat(statement("foo [ :x | | t | t := x. t ]"))
        .isEqualTo(
            new Block(
                ImmutableList.of("x"),
                ImmutableList.of("t"),
                ImmutableList.of(new Assign("t", name("x")), name("t"))));
  }

  @Test
  public void testEmptyBlock() {
    assertThat(statement("foo []"))
        .isEqualTo(new Block(ImmutableList.of(), ImmutableList.of(), ImmutableList.of()));
  }

  @Test
  public void testBlockParamWithoutBar() {
    Block block = (Block) statement("foo [:x]");
    assertThat(block.params()).containsExactly("x");
    assertThat(block.body()).isEmpty();
    assertThat(block.sourceBodyStart()).isEqualTo(block.sourceBodyEnd());
  }

  @Test
  public void testBlockSourceSpan() {
    String source = "foo [ :x | x ]";
    Block block = (Block) statement(source);
    assertThat(source.substring(block.sourceBodyStart(), block.sourceBodyEnd())).isEqualTo(" x ");

    source = "foo [ | t | t ]";
    block = (Block) statement(source);
    assertThat(source.substring(block.sourceBodyStart(), block.sourceBodyEnd())).isEqualTo(" t ");

    source = "foo [ 1. 2 ]";
    block = (Block) statement(source);
    assertThat(source.substring(block.sourceBodyStart(), block.sourceBodyEnd()))
        .isEqualTo(" 1. 2 ");
  }

  @Test
  public void testBlockEqualityIgnoresSourceSpan() {
    Block parsed = (Block) statement("foo [ 1 ]");
    assertThat(parsed.hasSourceSpan()).isTrue();
    assertThat(parsed)
        .isEqualTo(
            new Block(ImmutableList.of(), ImmutableList.of(), ImmutableList.of(integer("1"))));
  }

  @Test
  public void testNestedBlocks() {
    Block outer = (Block) statement("foo [ [ 1 ] value ]");
    assertThat(outer.body()).hasSize(1);
    Send send = (Send) outer.body().get(0);
    assertThat(send.selector()).isEqualTo("value");
    assertThat(send.receiver()).isInstanceOf(Block.class);
  }

  @Test
  public void testBadPattern() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("3 foo"));
    assertThat(e.details()).isEqualTo("Unexpected token in message pattern: INT ('3')");
    assertThat(e.actual()).isEqualTo(TokenType.INT);
    assertThat(e.expected()).isNull();
  }

  @Test
  public void testBadPrimary() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo ^ )"));
    assertThat(e.offset()).isEqualTo(6);
    assertThat(e.actual()).isEqualTo(TokenType.RPAREN);
  }

  @Test
  public void testMissingCloseParen() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo ^ (1 + 2"));
    assertThat(e.expected()).isEqualTo(TokenType.RPAREN);
    assertThat(e.actual()).isEqualTo(TokenType.END);
    assertThat(e.details()).isEqualTo("Expected RPAREN, got end of input");
  }

  @Test
  public void testMissingCloseBracket() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo [ 1"));
    assertThat(e.expected()).isEqualTo(TokenType.RBRACKET);
  }

  @Test
  public void testStrayCloseBracket() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo ^ 1 ]"));
    assertThat(e.expected()).isEqualTo(TokenType.END);
    assertThat(e.actual()).isEqualTo(TokenType.RBRACKET);
  }

  @Test
  public void testMissingDotBetweenStatements() {
    // x-1 scans as x followed by the number -1.
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo ^ x-1"));
    assertThat(e.details()).isEqualTo("Expected END, got INT ('-1')");
  }

  @Test
  public void testUnterminatedTemporaries() {
    SyntaxError e = assertThrows(SyntaxError.class, () -> Parser.parse("foo | a ^ a"));
    assertThat(e.expected()).isEqualTo(TokenType.BAR);
  }

  @Test
  public void testTokensMustEndWithEnd() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Parser(ImmutableList.of(new Token(TokenType.NAME, "foo", 0))));
  }

  private static Node statement(String source) {
    ImmutableList<Node> body = Parser.parse(source).body();
    assertThat(body).hasSize(1);
    return body.get(0);
  }

  private static Variable name(String name) {
    return new Variable(name);
  }

  private static Literal integer(String text) {
    return new Literal(Literal.Kind.INT, text);
  }
}
