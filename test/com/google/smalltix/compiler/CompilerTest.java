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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.smalltix.syntax.LexicalError;
import com.google.smalltix.syntax.SmalltixException;
import com.google.smalltix.syntax.SyntaxError;
import com.google.smalltix.syntax.UnsupportedFeatureError;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CompilerTest {
  private final RecordingHandler handler = new RecordingHandler();
  private Level oldLevel;

  @Before
  public void setUp() {
    oldLevel = Compiler.logger.getLevel();
    Compiler.logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    Compiler.logger.removeHandler(handler);
    Compiler.setLoggingLevel(oldLevel);
  }

  @Test
  public void testCompile() {
    Result result = new Compiler().compile("printAll self do: [ :each | each printNl ]");
    assertThat(result.scripts()).hasSize(2);
    assertThat(result.primary.name()).isEqualTo("printAll");
    assertThat(result.blocks.get(0).name()).isEqualTo("printAll~block1");
  }

  @Test
  public void testCompilerIsReusable() {
    Compiler compiler = new Compiler();
    Result first = compiler.compile("foo ^ [ 1 ] value");
    Result second = compiler.compile("foo ^ [ 1 ] value");
    assertThat(second.scripts()).isEqualTo(first.scripts());
    assertThat(second.blocks.get(0).name()).isEqualTo("foo~block1");
  }

  @Test
  public void testSyntaxErrorLocation() {
    SyntaxError e =
        assertThrows(SyntaxError.class, () -> new Compiler().compile("foo.st", "foo\n  ^ )"));
    assertThat(e.offset()).isEqualTo(8);
    assertThat(e.sourceName()).isEqualTo("foo.st");
    assertThat(e.lineNumber()).isEqualTo(2);
    assertThat(e.columnNumber()).isEqualTo(5);
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("Unexpected token in primary: RPAREN (')') (foo.st#2:5)");
  }

  @Test
  public void testLexicalErrorLocation() {
    LexicalError e =
        assertThrows(LexicalError.class, () -> new Compiler().compile("x.st", "foo $"));
    assertThat(e.lineNumber()).isEqualTo(1);
    assertThat(e.columnNumber()).isEqualTo(5);
    assertThat(e.details()).isEqualTo("Unexpected character: '$' at position 4");
  }

  @Test
  public void testUnsupportedLiteralLocation() {
    UnsupportedFeatureError e =
        assertThrows(
            UnsupportedFeatureError.class,
            () -> new Compiler().compile("x.st", "foo\n  ^ self at: #key"));
    assertThat(e.lineNumber()).isEqualTo(2);
    assertThat(e.columnNumber()).isEqualTo(14);
    assertThat(e).hasMessageThat().isEqualTo("Symbol literals not yet supported (x.st#2:14)");
  }

  @Test
  public void testDeclaredNameErrorHasNoLocation() {
    UnsupportedFeatureError e =
        assertThrows(
            UnsupportedFeatureError.class, () -> new Compiler().compile("x.st", "foo: IFS ^ 1"));
    assertThat(e.lineNumber()).isEqualTo(0);
    assertThat(e).hasMessageThat().isEqualTo("Cannot declare IFS: it names a shell variable");
  }

  @Test
  public void testOriginIsRecordedOnce() {
    SmalltixException e =
        assertThrows(SmalltixException.class, () -> new Compiler().compile("foo ^ ("));
    assertThrows(IllegalStateException.class, () -> e.recordErrorOrigin("again", "foo ^ ("));
  }

  @Test
  public void testWarningsAreLogged() {
    CompilerOptions options =
        new CompilerOptions()
            .setInstanceVariables(ImmutableList.of("x"))
            .setUndeclaredInstanceVariableLevel(CheckLevel.WARNING);
    Result result = new Compiler(options).compile("foo.st", "foo ^ x + y");
    assertThat(result.warnings).hasSize(1);

    List<String> warnings = new ArrayList<>();
    for (LogRecord record : handler.records) {
      if (record.getLevel().equals(Level.WARNING)) {
        warnings.add(record.getMessage());
      }
    }
    assertThat(warnings)
        .containsExactly(
            "foo.st: WARNING - [ST_UNDECLARED_INSTANCE_VARIABLE] y is not a declared instance"
                + " variable, temporary or parameter");
  }

  @Test
  public void testUnresolvedNameError() {
    CompilerOptions options =
        new CompilerOptions().setUndeclaredInstanceVariableLevel(CheckLevel.ERROR);
    UnresolvedNameError e =
        assertThrows(
            UnresolvedNameError.class, () -> new Compiler(options).compile("foo ^ count"));
    assertThat(e.name()).isEqualTo("count");
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("count is not a declared instance variable, temporary or parameter");
  }

  @Test
  public void testProgressIsLoggedAtFine() {
    Compiler.setLoggingLevel(Level.FINE);
    new Compiler().compile("foo ^ 1");
    assertThat(handler.records).isNotEmpty();
    assertThat(handler.records.get(0).getLevel()).isEqualTo(Level.FINE);
  }

  private static final class RecordingHandler extends Handler {
    final List<LogRecord> records = new ArrayList<>();

    RecordingHandler() {
      setLevel(Level.ALL);
    }

    @Override
    public void publish(LogRecord record) {
      records.add(record);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
  }
}
