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

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import com.google.smalltix.syntax.Block;
import com.google.smalltix.syntax.Cascade;
import com.google.smalltix.syntax.Literal;
import com.google.smalltix.syntax.Message;
import com.google.smalltix.syntax.Method;
import com.google.smalltix.syntax.Parser;
import com.google.smalltix.syntax.Send;
import com.google.smalltix.syntax.Variable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  @Test
  public void testPrintMethodLayout() {
    assertThat(CodePrinter.printMethod(Parser.parse("double ^ self + self .")))
        .isEqualTo("double\n  ^ self + self.\n");
    assertThat(CodePrinter.printMethod(Parser.parse("at: i put: v | t | t := v. ^ t")))
        .isEqualTo("at: i put: v\n  | t |\n  t := v.\n  ^ t.\n");
  }

  @Test
  public void testMinimalParentheses() {
    Variable a = new Variable("a");
    Variable b = new Variable("b");
    Variable c = new Variable("c");
    assertThat(CodePrinter.print(new Send(new Send(a, "+", b), "*", c))).isEqualTo("a + b * c");
    assertThat(CodePrinter.print(new Send(a, "+", new Send(b, "*", c))))
        .isEqualTo("a + (b * c)");
    assertThat(CodePrinter.print(new Send(new Send(a, "foo"), "bar"))).isEqualTo("a foo bar");
    assertThat(CodePrinter.print(new Send(new Send(a, "+", b), "bar"))).isEqualTo("(a + b) bar");
    assertThat(CodePrinter.print(new Send(a, "at:put:", new Send(b, "+", c), new Send(c, "x"))))
        .isEqualTo("a at: b + c put: c x");
    assertThat(CodePrinter.print(new Send(a, "at:", new Send(b, "at:", c))))
        .isEqualTo("a at: (b at: c)");
  }

  @Test
  public void testCascadeAsArgument() {
    Cascade cascade =
        new Cascade(
            new Variable("a"), ImmutableList.of(new Message("b"), new Message("c")));
    assertThat(CodePrinter.print(cascade)).isEqualTo("a b; c");
    assertThat(CodePrinter.print(new Send(new Variable("x"), "foo:", cascade)))
        .isEqualTo("x foo: (a b; c)");
  }

  @Test
  public void testBlocks() {
    Block block =
        (Block) Parser.parse("foo [ :x | | t | t := x. t ]").body().get(0);
    assertThat(CodePrinter.print(block)).isEqualTo("[ :x | | t | t := x. t ]");
    assertThat(
            CodePrinter.print(
                new Block(ImmutableList.of(), ImmutableList.of(), ImmutableList.of())))
        .isEqualTo("[ ]");
  }

  @Test
  public void testLiterals() {
    assertThat(CodePrinter.print(new Literal(Literal.Kind.STRING, "it's"))).isEqualTo("'it''s'");
    assertThat(CodePrinter.print(new Literal(Literal.Kind.SYMBOL, "at:put:")))
        .isEqualTo("#at:put:");
    assertThat(CodePrinter.print(new Literal(Literal.Kind.SYMBOL, "a b"))).isEqualTo("#'a b'");
    assertThat(CodePrinter.print(new Literal(Literal.Kind.INT, "-3"))).isEqualTo("-3");
  }

  @Test
  public void testRoundTrip() {
    assertRoundTrip("double ^ self + self");
    assertRoundTrip("+ other ^ other");
    assertRoundTrip("| other ^ self | other");
    assertRoundTrip("at: i put: v | t | t := v. ^ t");
    assertRoundTrip("foo ^ a + (b * c)");
    assertRoundTrip("foo ^ (a at: 1) at: 2");
    assertRoundTrip("foo ^ a foo: (b bar: c)");
    assertRoundTrip("foo ^ (a + b) foo");
    assertRoundTrip("foo ^ a - -1");
    assertRoundTrip("foo | x y | ^ x := y := 3");
    assertRoundTrip("foo | b | ^ a foo: (b := 3)");
    assertRoundTrip("fill: coll coll add: 1; add: 2; yourself");
    assertRoundTrip("foo ^ (a foo; bar) baz");
    assertRoundTrip("foo ^ a + b + 1; c");
    assertRoundTrip("foo ^ a b at: 1; at: 2 put: 3");
    assertRoundTrip("foo self do: [ :each | | t | t := each. t printNl ]");
    assertRoundTrip("foo ^ [] value");
    assertRoundTrip("foo ^ [:x] value: [ [ 1 ] value ]");
    assertRoundTrip("foo ^ 'it''s' , #foo , #'a b' , -3 , 2.5");
  }

  private static void assertRoundTrip(String source) {
    Method method = Parser.parse(source);
    String printed = CodePrinter.printMethod(method);
    assertWithMessage("printed as:\n%s", printed)
        .that(Parser.parse(printed))
        .isEqualTo(method);
  }
}
