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

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** Compiler options. */
public class CompilerOptions {
  public static final String DEFAULT_DISPATCHER = "./send";

  /** The program every message send is routed through. */
  private String dispatcher = DEFAULT_DISPATCHER;

  /** Whether the source is copied into each script as comment lines. */
  private boolean emitSourceComments = true;

  /** A first line such as {@code #!/bin/bash}, or null for none. */
  private @Nullable String interpreterLine = null;

  /** Class that builds the container of captured values for a block. */
  private String arrayClass = "Array";

  /** Class that pairs a block script with its captured values. */
  private String closureClass = "BlockClosure";

  /** Instance variables of the receiver, for {@link #undeclaredInstanceVariableLevel}. */
  private ImmutableSet<String> instanceVariables = ImmutableSet.of();

  /**
   * How to report a name that falls through to an instance variable without being in {@link
   * #instanceVariables}. OFF keeps the closed-world reading where any such name is valid.
   */
  private CheckLevel undeclaredInstanceVariableLevel = CheckLevel.OFF;

  public String getDispatcher() {
    return dispatcher;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setDispatcher(String dispatcher) {
    this.dispatcher = requireNonNull(dispatcher);
    return this;
  }

  public boolean shouldEmitSourceComments() {
    return emitSourceComments;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setEmitSourceComments(boolean emitSourceComments) {
    this.emitSourceComments = emitSourceComments;
    return this;
  }

  public @Nullable String getInterpreterLine() {
    return interpreterLine;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setInterpreterLine(@Nullable String interpreterLine) {
    this.interpreterLine = interpreterLine;
    return this;
  }

  public String getArrayClass() {
    return arrayClass;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setArrayClass(String arrayClass) {
    this.arrayClass = requireNonNull(arrayClass);
    return this;
  }

  public String getClosureClass() {
    return closureClass;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setClosureClass(String closureClass) {
    this.closureClass = requireNonNull(closureClass);
    return this;
  }

  public ImmutableSet<String> getInstanceVariables() {
    return instanceVariables;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setInstanceVariables(Iterable<String> instanceVariables) {
    this.instanceVariables = ImmutableSet.copyOf(instanceVariables);
    return this;
  }

  public CheckLevel getUndeclaredInstanceVariableLevel() {
    return undeclaredInstanceVariableLevel;
  }

  @CanIgnoreReturnValue
  public CompilerOptions setUndeclaredInstanceVariableLevel(CheckLevel level) {
    this.undeclaredInstanceVariableLevel = requireNonNull(level);
    return this;
  }
}
