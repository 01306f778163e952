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

import com.google.smalltix.syntax.SmalltixException;

/**
 * Raised when a name resolves to an instance variable that was not declared, and undeclared
 * instance variables are configured as errors.
 *
 * @see CompilerOptions#setUndeclaredInstanceVariableLevel
 */
@SuppressWarnings("serial")
public final class UnresolvedNameError extends SmalltixException {
  private final String name;

  UnresolvedNameError(String name) {
    super(ScriptGenerator.UNDECLARED_INSTANCE_VARIABLE.format(name), -1);
    this.name = name;
  }

  public String name() {
    return name;
  }
}
