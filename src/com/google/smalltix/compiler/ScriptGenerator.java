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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
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
import com.google.smalltix.syntax.UnsupportedFeatureError;
import com.google.smalltix.syntax.Variable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * ScriptGenerator turns a parsed method into shell scripts for the Smalltix runtime, where an
 * object is a directory, an instance variable is a file in it, and a send is a call to the
 * dispatcher.
 *
 * <p>Each expression is generated in one of two positions. In value position the result is
 * left in a shell variable, or is a self-describing word like {@code int/3}, and a {@link
 * ValueRef} says which. In tail position the result is written straight to standard output,
 * which is how a script returns a value, so the last send needs no capture.
 *
 * <p>Block literals cannot be inlined: the script that runs a block shares no stack with the
 * method that made it. Each block becomes a sibling script generated by its own
 * ScriptGenerator, with its own lines, temporary counter and scope, and the use site builds a
 * closure value from that script's path and a copy of every name in scope.
 */
final class ScriptGenerator {
  static final DiagnosticType UNDECLARED_INSTANCE_VARIABLE =
      DiagnosticType.warning(
          "ST_UNDECLARED_INSTANCE_VARIABLE",
          "{0} is not a declared instance variable, temporary or parameter");

  /** Captures up to this many values with one {@code with-...} send. */
  private static final int MAX_DIRECT_CAPTURES = 4;

  private static final CharMatcher SHELL_SAFE =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_-+=@%,/.~"));

  private static final Joiner SPACE_JOINER = Joiner.on(' ');
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private final Compilation compilation;
  private final String name;
  private final Scope scope;
  private final List<String> lines = new ArrayList<>();
  private int tmpCounter = 0;
  private int blockCounter = 0;

  private ScriptGenerator(Compilation compilation, String name, Scope scope) {
    this.compilation = compilation;
    this.name = name;
    this.scope = scope;
  }

  /** Generates the method's script and one script per block literal it contains. */
  static Result generate(Method method, String source, CompilerOptions options) {
    Compilation compilation = new Compilation(source, options);
    ScriptGenerator generator =
        new ScriptGenerator(
            compilation, Selectors.mangle(method.selector()), Scope.forMethod(method));
    Script primary = generator.generateMethod(method);
    return new Result(
        primary,
        ImmutableList.copyOf(compilation.blocks),
        ImmutableList.copyOf(compilation.warnings.values()));
  }

  private Script generateMethod(Method method) {
    addHeader(compilation.source.stripTrailing());
    lines.add("self=$1");
    bindPositionals(method.params(), 2);
    initTemporaries(method.temps());
    generateBody(method.body(), /* isBlock= */ false);
    return finish();
  }

  private Script generateBlock(Block block, List<String> bindings) {
    addHeader(name + "\n" + blockSource(block));
    bindPositionals(bindings, 1);
    initTemporaries(block.temps());
    generateBody(block.body(), /* isBlock= */ true);
    return finish();
  }

  private void addHeader(String comment) {
    CompilerOptions options = compilation.options;
    if (options.getInterpreterLine() != null) {
      lines.add(options.getInterpreterLine());
    }
    if (options.shouldEmitSourceComments()) {
      for (String line : LINE_SPLITTER.split(comment)) {
        lines.add(line.isEmpty() ? "#" : "# " + line);
      }
      lines.add("#");
    }
  }

  private void bindPositionals(List<String> names, int first) {
    int position = first;
    for (String param : names) {
      lines.add(param + "=" + positional(position++));
    }
  }

  private static String positional(int position) {
    return position < 10 ? "$" + position : "${" + position + "}";
  }

  private void initTemporaries(List<String> temps) {
    for (String temp : temps) {
      lines.add(temp + "=nil");
    }
  }

  private Script finish() {
    return new Script(name, Joiner.on('\n').join(lines) + "\n");
  }

  /** The block as written: declarations rebuilt, body copied from the source when available. */
  private String blockSource(Block block) {
    if (!block.hasSourceSpan()) {
      return CodePrinter.print(block);
    }
    StringBuilder sb = new StringBuilder("[");
    if (!block.params().isEmpty()) {
      for (String param : block.params()) {
        sb.append(" :").append(param);
      }
      sb.append(" |");
    }
    if (!block.temps().isEmpty()) {
      sb.append(" | ").append(SPACE_JOINER.join(block.temps())).append(" |");
    }
    sb.append(compilation.source, block.sourceBodyStart(), block.sourceBodyEnd());
    return sb.append(']').toString();
  }

  private void generateBody(List<Node> statements, boolean isBlock) {
    if (statements.isEmpty()) {
      if (isBlock) {
        lines.add("echo nil");
      }
      return;
    }
    int last = statements.size() - 1;
    for (int i = 0; i <= last; i++) {
      Node statement = statements.get(i);
      if (statement instanceof Return ret) {
        generateTail(ret.value(), /* echoAssignment= */ true);
        if (i != last) {
          lines.add("exit");
        }
      } else if (i == last) {
        // A method's closing assignment returns nothing; a block's returns the assigned value.
        generateTail(statement, /* echoAssignment= */ isBlock);
      } else {
        generateValue(statement);
      }
    }
  }

  /** Generates {@code node} so that its value goes to standard output. */
  private void generateTail(Node node, boolean echoAssignment) {
    if (node instanceof Literal literal) {
      lines.add("echo " + literalValue(literal).ref());
    } else if (node instanceof Variable variable) {
      if (scope.classify(variable.name()) == VariableKind.INSTANCE) {
        checkInstanceVariable(variable.name());
        lines.add(readInstanceVariable(variable.name()));
      } else {
        lines.add("echo " + variableValue(variable.name()).ref());
      }
    } else if (node instanceof Send send) {
      lines.add(sendCommand(send));
    } else if (node instanceof Cascade cascade) {
      lines.add(cascadeCommand(cascade));
    } else if (node instanceof Assign assign) {
      ValueRef value = generateAssign(assign);
      if (echoAssignment) {
        lines.add("echo " + value.ref());
      }
    } else if (node instanceof Block block) {
      lines.add("echo " + generateBlockLiteral(block).ref());
    } else {
      throw unknownNode(node);
    }
  }

  /** Generates {@code node} for its value, which the returned reference locates. */
  private ValueRef generateValue(Node node) {
    if (node instanceof Literal literal) {
      return literalValue(literal);
    } else if (node instanceof Variable variable) {
      return variableValue(variable.name());
    } else if (node instanceof Send send) {
      return ValueRef.local(capture(sendCommand(send), null));
    } else if (node instanceof Cascade cascade) {
      return ValueRef.local(capture(cascadeCommand(cascade), null));
    } else if (node instanceof Assign assign) {
      return generateAssign(assign);
    } else if (node instanceof Block block) {
      return generateBlockLiteral(block);
    }
    throw unknownNode(node);
  }

  /** Generates {@code node} with its value stored in the local {@code target}. */
  private void generateInto(Node node, String target) {
    if (node instanceof Send send) {
      capture(sendCommand(send), target);
    } else if (node instanceof Cascade cascade) {
      capture(cascadeCommand(cascade), target);
    } else if (node instanceof Variable variable
        && scope.classify(variable.name()) == VariableKind.INSTANCE) {
      checkInstanceVariable(variable.name());
      capture(readInstanceVariable(variable.name()), target);
    } else {
      lines.add(target + "=" + generateValue(node).ref());
    }
  }

  private static ValueRef literalValue(Literal literal) {
    return switch (literal.kind()) {
      case INT -> ValueRef.literal("int/" + literal.text());
      case FLOAT -> ValueRef.literal("float/" + literal.text());
      case STRING, SYMBOL -> throw UnsupportedFeatureError.literal(literal);
    };
  }

  private ValueRef variableValue(String variable) {
    switch (scope.classify(variable)) {
      case SELF:
        return ValueRef.local(Scope.SELF);
      case LOCAL:
        return ValueRef.local(variable);
      case RESERVED:
      case GLOBAL:
        return ValueRef.literal(variable);
      case INSTANCE:
        checkInstanceVariable(variable);
        return ValueRef.local(capture(readInstanceVariable(variable), null));
    }
    throw new AssertionError(variable);
  }

  private static String readInstanceVariable(String variable) {
    return "cat $self/" + variable;
  }

  private ValueRef generateAssign(Assign assign) {
    String target = assign.name();
    switch (scope.classify(target)) {
      case LOCAL:
        generateInto(assign.value(), target);
        return ValueRef.local(target);
      case INSTANCE:
        checkInstanceVariable(target);
        ValueRef value = generateValue(assign.value());
        lines.add("echo " + value.ref() + " > $self/" + target);
        return value;
      case SELF:
      case RESERVED:
        throw new UnsupportedFeatureError(
            "assignment to pseudo-variable", "Cannot assign to pseudo-variable " + target);
      case GLOBAL:
        throw new UnsupportedFeatureError(
            "assignment to global", "Cannot assign to global " + target);
    }
    throw new AssertionError(target);
  }

  /** Evaluates the receiver and then the arguments, and returns the dispatcher call. */
  private String sendCommand(Send send) {
    ValueRef receiver = pin(generateValue(send.receiver()), send.args());
    return messageCommand(receiver, send.selector(), send.args());
  }

  /**
   * Evaluates the receiver once and sends all but the last message, in order. Returns the call
   * for the last message, whose result is the cascade's value.
   */
  private String cascadeCommand(Cascade cascade) {
    ImmutableList<Message> messages = cascade.messages();
    List<Node> operands = new ArrayList<>();
    for (Message message : messages) {
      operands.addAll(message.args());
    }
    ValueRef receiver = pin(generateValue(cascade.receiver()), operands);
    for (Message message : messages.subList(0, messages.size() - 1)) {
      capture(messageCommand(receiver, message.selector(), message.args()), null);
    }
    Message last = messages.get(messages.size() - 1);
    return messageCommand(receiver, last.selector(), last.args());
  }

  private String messageCommand(ValueRef receiver, String selector, List<Node> args) {
    List<String> words = new ArrayList<>();
    words.add(compilation.options.getDispatcher());
    words.add(receiver.ref());
    words.add(shellWord(Selectors.mangle(selector)));
    for (int i = 0; i < args.size(); i++) {
      words.add(pin(generateValue(args.get(i)), args.subList(i + 1, args.size())).ref());
    }
    return SPACE_JOINER.join(words);
  }

  /**
   * Copies a local into a fresh one if any of the {@code later} operands assigns it. A {@code $x}
   * reference is expanded only when the command runs, after every later operand.
   */
  private ValueRef pin(ValueRef value, List<Node> later) {
    if (!value.bound() || !assignsAny(later, value.text())) {
      return value;
    }
    String tmp = newTmp();
    lines.add(tmp + "=" + value.ref());
    return ValueRef.local(tmp);
  }

  private static boolean assignsAny(List<Node> nodes, String variable) {
    for (Node node : nodes) {
      if (assigns(node, variable)) {
        return true;
      }
    }
    return false;
  }

  /** Whether evaluating {@code node} in this script assigns {@code variable}. */
  private static boolean assigns(Node node, String variable) {
    if (node instanceof Assign assign) {
      return assign.name().equals(variable) || assigns(assign.value(), variable);
    } else if (node instanceof Send send) {
      return assigns(send.receiver(), variable) || assignsAny(send.args(), variable);
    } else if (node instanceof Cascade cascade) {
      if (assigns(cascade.receiver(), variable)) {
        return true;
      }
      for (Message message : cascade.messages()) {
        if (assignsAny(message.args(), variable)) {
          return true;
        }
      }
      return false;
    }
    // A block's assignments run in its own script, on its own copies.
    return false;
  }

  /**
   * Compiles {@code block} into its own script and returns a closure value for it. Blocks are
   * named after this script plus a per-script counter, so nested and sibling blocks never
   * collide.
   */
  private ValueRef generateBlockLiteral(Block block) {
    String blockName = name + "~block" + (++blockCounter);
    ImmutableList<String> captured = scope.capturedNames();
    ImmutableList<String> bindings =
        ImmutableList.<String>builder().addAll(captured).addAll(block.params()).build();

    int slot = compilation.reserveBlockSlot();
    ScriptGenerator blockGenerator =
        new ScriptGenerator(compilation, blockName, Scope.forBlock(captured, block));
    compilation.fillBlockSlot(slot, blockGenerator.generateBlock(block, bindings));

    String container = buildCaptures(captured);
    CompilerOptions options = compilation.options;
    String closure =
        capture(
            SPACE_JOINER.join(
                options.getDispatcher(),
                options.getClosureClass(),
                "script-bindings-",
                "$(dirname $0)/" + shellWord(blockName),
                "$" + container),
            null);
    return ValueRef.local(closure);
  }

  /** Builds the ordered container of captured values and returns the local holding it. */
  private String buildCaptures(List<String> captured) {
    CompilerOptions options = compilation.options;
    List<String> refs = new ArrayList<>();
    for (String capturedName : captured) {
      refs.add(ValueRef.local(capturedName).ref());
    }
    if (captured.size() <= MAX_DIRECT_CAPTURES) {
      return capture(
          SPACE_JOINER.join(
              options.getDispatcher(),
              options.getArrayClass(),
              Strings.repeat("with-", captured.size()),
              SPACE_JOINER.join(refs)),
          null);
    }
    String array =
        capture(
            SPACE_JOINER.join(
                options.getDispatcher(), options.getArrayClass(), "new-", "int/" + refs.size()),
            null);
    String index = newTmp();
    String element = newTmp();
    lines.add(index + "=1");
    lines.add(
        "for " + element + " in " + SPACE_JOINER.join(refs) + "; do "
            + SPACE_JOINER.join(
                options.getDispatcher(),
                "$" + array,
                "at-put-",
                "int/$" + index,
                "$" + element,
                "> /dev/null;")
            + " " + index + "=$((" + index + "+1)); done");
    return array;
  }

  /** Emits {@code target=$(command)}, into a fresh local when target is null. */
  private String capture(String command, @Nullable String target) {
    String local = target != null ? target : newTmp();
    lines.add(local + "=$(" + command + ")");
    return local;
  }

  private String newTmp() {
    String tmp;
    do {
      tmp = "tmp" + (++tmpCounter);
    } while (scope.isBound(tmp));
    return tmp;
  }

  private void checkInstanceVariable(String variable) {
    CompilerOptions options = compilation.options;
    CheckLevel level = options.getUndeclaredInstanceVariableLevel();
    if (!level.isOn() || options.getInstanceVariables().contains(variable)) {
      return;
    }
    if (level == CheckLevel.ERROR) {
      throw new UnresolvedNameError(variable);
    }
    compilation.warnings.computeIfAbsent(
        variable, v -> Diagnostic.make(UNDECLARED_INSTANCE_VARIABLE, v));
  }

  /** Quotes a word that the shell would otherwise expand, split or treat as a redirection. */
  static String shellWord(String word) {
    if (!word.isEmpty() && SHELL_SAFE.matchesAllOf(word) && !word.startsWith("~")) {
      return word;
    }
    return "'" + word.replace("'", "'\\''") + "'";
  }

  private static UnsupportedFeatureError unknownNode(Node node) {
    return new UnsupportedFeatureError(
        "node", "Unknown node type: " + node.getClass().getSimpleName());
  }

  /** State shared by every script generated from one method. */
  private static final class Compilation {
    final String source;
    final CompilerOptions options;
    final List<@Nullable Script> blocks = new ArrayList<>();
    final Map<String, Diagnostic> warnings = new LinkedHashMap<>();

    Compilation(String source, CompilerOptions options) {
      this.source = source;
      this.options = options;
    }

    /** Reserves the next position so block scripts list in the order their literals open. */
    int reserveBlockSlot() {
      blocks.add(null);
      return blocks.size() - 1;
    }

    void fillBlockSlot(int slot, Script script) {
      checkState(blocks.get(slot) == null, "slot %s already filled", slot);
      blocks.set(slot, script);
    }
  }
}
