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

/** What a name denotes in generated code. See {@link Scope#classify}. */
enum VariableKind {
  /** {@code self}: the receiver path bound from the first argument. */
  SELF,
  /** {@code true}, {@code false}, {@code nil}: emitted verbatim. */
  RESERVED,
  /** A temporary or parameter of the script being generated. */
  LOCAL,
  /** A capitalized name: a class or global, emitted verbatim. */
  GLOBAL,
  /** Anything else: a file inside the receiver's directory. */
  INSTANCE
}
