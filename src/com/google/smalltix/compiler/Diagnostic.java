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

/**
 * A non-fatal compile diagnostic.
 *
 * @param type the kind of diagnostic
 * @param level the level it was reported at
 * @param description the formatted message
 */
public record Diagnostic(DiagnosticType type, CheckLevel level, String description) {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(level, "level");
    requireNonNull(description, "description");
  }

  static Diagnostic make(DiagnosticType type, String... arguments) {
    return new Diagnostic(type, type.level, type.format(arguments));
  }

  @Override
  public String toString() {
    return level + " - [" + type.key + "] " + description;
  }
}
