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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.smalltix.syntax.Method;
import com.google.smalltix.syntax.Parser;
import com.google.smalltix.syntax.SmalltixException;
import com.google.smalltix.syntax.Token;
import com.google.smalltix.syntax.TokenStream;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Compiler runs the pipeline for one method: scan, parse, then generate scripts. Each call to
 * {@link #compile} is independent; a Compiler keeps no state between them beyond its options.
 *
 * <p>Any {@link SmalltixException} aborts the compilation. It is rethrown with its line and
 * column resolved against the source, and nothing is generated.
 */
public class Compiler {
  /**
   * Logger for the whole com.google.smalltix.compiler domain - setting configuration for this
   * logger affects all loggers in other classes within the compiler.
   */
  public static final Logger logger = Logger.getLogger("com.google.smalltix.compiler");

  private final CompilerOptions options;

  public Compiler() {
    this(new CompilerOptions());
  }

  public Compiler(CompilerOptions options) {
    this.options = requireNonNull(options);
  }

  public CompilerOptions getOptions() {
    return options;
  }

  public Result compile(String source) {
    return compile(null, source);
  }

  /**
   * Compiles the method in {@code source}.
   *
   * @param sourceName name used in error messages, such as the file the source was read from
   * @throws SmalltixException if the source cannot be compiled
   */
  public Result compile(@Nullable String sourceName, String source) {
    try {
      ImmutableList<Token> tokens = TokenStream.tokenize(source);
      logger.fine(() -> "Scanned " + tokens.size() + " tokens from " + describe(sourceName));

      Method method = new Parser(tokens).parseMethod();
      logger.fine(() -> "Parsed method " + method.selector());

      Result result = ScriptGenerator.generate(method, source, options);
      for (Diagnostic warning : result.warnings) {
        logger.warning(describe(sourceName) + ": " + warning);
      }
      logger.fine(
          () -> "Generated " + result.scripts().size() + " script(s) for " + method.selector());
      return result;
    } catch (SmalltixException e) {
      e.recordErrorOrigin(sourceName, source);
      throw e;
    }
  }

  private static String describe(@Nullable String sourceName) {
    return sourceName != null ? sourceName : "<inline>";
  }

  /** Sets the logging level for the com.google.smalltix.compiler package. */
  public static void setLoggingLevel(Level level) {
    logger.setLevel(level);
  }
}
