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

/**
 * Where a computed value can be found in a generated script: either a shell variable, or text
 * that stands for itself, such as {@code int/3} or {@code nil}.
 */
record ValueRef(String text, boolean bound) {
  static ValueRef local(String name) {
    return new ValueRef(name, true);
  }

  static ValueRef literal(String text) {
    return new ValueRef(text, false);
  }

  /** The shell word that expands to the value. */
  String ref() {
    return bound ? "$" + text : text;
  }
}
