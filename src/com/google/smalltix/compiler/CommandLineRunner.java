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

import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.MoreFiles;
import com.google.smalltix.syntax.SmalltixException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * CommandLineRunner translates flags into compiler options, compiles one method, and writes
 * the scripts out.
 *
 * <p>Typical usage:
 *
 * <pre>
 *   smalltix Point/x-y-.st out/Point
 *   smalltix -e 'double ^ self + self' --output_dir out/Integer
 * </pre>
 *
 * Without an output directory the scripts are printed to stdout, each under a {@code ==> name
 * <==} header.
 */
public class CommandLineRunner {
  /** Exit status for a method that failed to compile, or for a failed read or write. */
  static final int COMPILE_ERROR_STATUS = 1;

  /** Exit status for bad command-line usage. */
  static final int USAGE_ERROR_STATUS = 2;

  private static class Flags {
    @Option(name = "--help", usage = "Displays this message on stdout and exit")
    private boolean displayHelp = false;

    @Option(
        name = "-e",
        metaVar = "SOURCE",
        usage = "Method source to compile, instead of reading it from a file")
    private @Nullable String inlineSource = null;

    @Option(
        name = "--output_dir",
        aliases = {"-o"},
        metaVar = "DIR",
        usage = "Directory to write the scripts into. It is created if missing.")
    private @Nullable String outputDir = null;

    @Option(
        name = "--dispatcher",
        usage = "The program that performs message sends in the generated scripts")
    private String dispatcher = CompilerOptions.DEFAULT_DISPATCHER;

    @Option(
        name = "--shebang",
        usage = "An interpreter line, such as #!/bin/bash, to start each script with")
    private @Nullable String shebang = null;

    @Option(
        name = "--ivar",
        usage = "A declared instance variable of the receiver. You may specify multiple")
    private List<String> instanceVariables = new ArrayList<>();

    @Option(
        name = "--undeclared_ivars",
        usage =
            "How to treat names that are neither temporaries, parameters nor declared with"
                + " --ivar. Options: OFF, WARNING, ERROR")
    private CheckLevel undeclaredInstanceVariables = CheckLevel.OFF;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for compiler"
                + " progress. Does not control errors in the method under compilation")
    private String loggingLevel = Level.WARNING.getName();

    @Argument(metaVar = "[source_file] [output_dir]")
    private List<String> arguments = new ArrayList<>();
  }

  private final Flags flags = new Flags();
  private final CmdLineParser parser = new CmdLineParser(flags);
  private final PrintStream out;
  private final PrintStream err;

  private boolean errors = false;
  private boolean runCompiler = false;
  private @Nullable Path sourceFile = null;
  private @Nullable Path outputDir = null;

  public CommandLineRunner(String[] args) {
    this(args, System.out, System.err);
  }

  @VisibleForTesting
  CommandLineRunner(String[] args, PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    initConfigFromFlags(args);
  }

  private void initConfigFromFlags(String[] args) {
    try {
      parser.parseArgument(args);
      try {
        Compiler.setLoggingLevel(Level.parse(flags.loggingLevel));
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + flags.loggingLevel);
      }
      if (!flags.displayHelp) {
        resolvePaths();
      }
    } catch (CmdLineException e) {
      reportError(e.getMessage());
    }

    if (errors) {
      printShortUsageAfterErrors();
    } else if (flags.displayHelp) {
      printUsage(out);
    } else {
      runCompiler = true;
    }
  }

  private void resolvePaths() throws CmdLineException {
    List<String> outputs;
    if (flags.inlineSource != null) {
      outputs = flags.arguments;
    } else if (flags.arguments.isEmpty()) {
      throw new CmdLineException(parser, "No source file given, and no -e source");
    } else {
      sourceFile = Paths.get(flags.arguments.get(0));
      outputs = flags.arguments.subList(1, flags.arguments.size());
    }

    if (outputs.size() > 1) {
      throw new CmdLineException(parser, "Too many arguments: " + outputs);
    }
    if (!outputs.isEmpty() && flags.outputDir != null) {
      throw new CmdLineException(parser, "Output directory given twice");
    }
    if (!outputs.isEmpty()) {
      outputDir = Paths.get(outputs.get(0));
    } else if (flags.outputDir != null) {
      outputDir = Paths.get(flags.outputDir);
    }
  }

  private void reportError(String message) {
    errors = true;
    err.println(message);
    err.flush();
  }

  private void printUsage(PrintStream stream) {
    stream.println("Usage: smalltix [options] <source_file> [output_dir]");
    stream.println("       smalltix [options] -e <source> [output_dir]");
    parser.printUsage(stream);
    stream.flush();
  }

  private void printShortUsageAfterErrors() {
    err.println("Sample usage: smalltix -e 'double ^ self + self' --output_dir out");
    err.println("Run with --help for all options.");
    err.flush();
  }

  public boolean shouldRunCompiler() {
    return runCompiler;
  }

  public boolean hasErrors() {
    return errors;
  }

  /** Compiles the method and emits its scripts. Returns the process exit status. */
  public int run() {
    checkState(runCompiler, "run() called after flag errors or --help");
    try {
      String source;
      String sourceName;
      if (sourceFile != null) {
        source = readSource(sourceFile);
        sourceName = sourceFile.toString();
      } else {
        source = flags.inlineSource;
        sourceName = "-e";
      }

      Result result = new Compiler(createOptions()).compile(sourceName, source);
      if (outputDir != null) {
        writeScripts(result, outputDir);
      } else {
        printScripts(result);
      }
      return 0;
    } catch (SmalltixException | IOException e) {
      err.println("ERROR - " + e.getMessage());
      err.flush();
      return COMPILE_ERROR_STATUS;
    }
  }

  /** Reads {@code file} as UTF-8, failing on malformed input instead of replacing it. */
  private static String readSource(Path file) throws IOException {
    CharsetDecoder decoder =
        UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(MoreFiles.asByteSource(file).read())).toString();
    } catch (CharacterCodingException e) {
      throw new IOException(file + " is not valid UTF-8", e);
    }
  }

  @VisibleForTesting
  CompilerOptions createOptions() {
    return new CompilerOptions()
        .setDispatcher(flags.dispatcher)
        .setInterpreterLine(flags.shebang)
        .setInstanceVariables(flags.instanceVariables)
        .setUndeclaredInstanceVariableLevel(flags.undeclaredInstanceVariables);
  }

  private void writeScripts(Result result, Path dir) throws IOException {
    Files.createDirectories(dir);
    for (Script script : result.scripts()) {
      if (script.name().contains("/")) {
        throw new IOException("Cannot name a file after script " + script.name());
      }
      Path path = dir.resolve(script.name());
      MoreFiles.asCharSink(path, UTF_8).write(script.text());
      if (Files.getFileStore(path).supportsFileAttributeView(PosixFileAttributeView.class)) {
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
      }
      out.println("Wrote " + path);
    }
    out.flush();
  }

  private void printScripts(Result result) {
    for (Script script : result.scripts()) {
      out.println("==> " + script.name() + " <==");
      out.print(script.text());
    }
    out.flush();
  }

  public static void main(String[] args) {
    CommandLineRunner runner = new CommandLineRunner(args);
    int status = 0;
    if (runner.shouldRunCompiler()) {
      status = runner.run();
    } else if (runner.hasErrors()) {
      status = USAGE_ERROR_STATUS;
    }
    if (status != 0) {
      System.exit(status);
    }
  }
}
