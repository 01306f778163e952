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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.smalltix.syntax.Block;
import com.google.smalltix.syntax.Method;
import com.google.smalltix.syntax.UnsupportedFeatureError;
import java.util.List;

/**
 * The names bound in one generated script. A method script binds its parameters and
 * temporaries; a block script binds its captured names and its own parameters as parameters,
 * plus its own temporaries.
 *
 * <p>Scopes never chain: a block script runs in its own process and can only see what was
 * captured into it, so an inner scope is built from the outer one's {@link #capturedNames}.
 */
final class Scope {
  static final String SELF = "self";
  static final ImmutableSet<String> RESERVED = ImmutableSet.of("true", "false", "nil");

  /** Shell variables that the generated scripts, or bash itself, depend on. */
  private static final ImmutableSet<String> SHELL_VARIABLES =
      ImmutableSet.of(
          "CDPATH", "ENV", "EUID", "GLOBIGNORE", "HOME", "IFS", "LANG", "LINENO", "OLDPWD",
          "OPTARG", "OPTIND", "PATH", "PPID", "PS4", "PWD", "RANDOM", "SECONDS", "SHELLOPTS",
          "TMPDIR", "UID");

  private static final CharMatcher SHELL_NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'));

  private final ImmutableSet<String> params;
  private final ImmutableSet<String> temps;

  private Scope(Iterable<String> params, Iterable<String> temps) {
    this.params = ImmutableSet.copyOf(params);
    this.temps = ImmutableSet.copyOf(temps);
  }

  static Scope forMethod(Method method) {
    checkDeclarable(method.params());
    checkDeclarable(method.temps());
    return new Scope(method.params(), method.temps());
  }

  /** Captured names were checked where they were declared; only the block's own are checked. */
  static Scope forBlock(List<String> captured, Block block) {
    checkDeclarable(block.params());
    checkDeclarable(block.temps());
    return new Scope(
        ImmutableList.<String>builder().addAll(captured).addAll(block.params()).build(),
        block.temps());
  }

  /**
   * Rejects parameter and temporary names that cannot be bound as shell variables without
   * breaking the script: pseudo-variables, names bash does not accept, and shell variables.
   */
  private static void checkDeclarable(List<String> names) {
    for (String name : names) {
      if (name.equals(SELF) || RESERVED.contains(name)) {
        throw new UnsupportedFeatureError(
            "declared name", "Cannot declare pseudo-variable " + name);
      }
      if (!SHELL_NAME_CHARS.matchesAllOf(name)) {
        throw new UnsupportedFeatureError(
            "declared name", "Cannot declare " + name + ": not a valid shell variable name");
      }
      if (SHELL_VARIABLES.contains(name) || name.startsWith("BASH") || name.startsWith("LC_")) {
        throw new UnsupportedFeatureError(
            "declared name", "Cannot declare " + name + ": it names a shell variable");
      }
    }
  }

  /**
   * Decides what {@code name} denotes. The rules apply in order, and the same way whether the
   * name is read or assigned.
   */
  VariableKind classify(String name) {
    if (name.equals(SELF)) {
      return VariableKind.SELF;
    } else if (RESERVED.contains(name)) {
      return VariableKind.RESERVED;
    } else if (isBound(name)) {
      return VariableKind.LOCAL;
    } else if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
      return VariableKind.GLOBAL;
    }
    return VariableKind.INSTANCE;
  }

  boolean isBound(String name) {
    return temps.contains(name) || params.contains(name);
  }

  /**
   * The names a block literal in this scope captures: {@code self}, then every temporary, then
   * every parameter, each once. This is the whole scope rather than the block's free variables,
   * so names used only by blocks nested further in are still passed along.
   */
  ImmutableList<String> capturedNames() {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    names.add(SELF);
    names.addAll(temps);
    names.addAll(params);
    return names.build().asList();
  }
}
