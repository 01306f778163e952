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

import java.text.MessageFormat;

/** The type of a compile diagnostic. */
public final class DiagnosticType {
  /** An identifier, stable across releases. */
  public final String key;

  /** The default way to format the diagnostic. The style of format is java.text.MessageFormat. */
  public final String format;

  /** The level a diagnostic of this type is reported at. */
  public final CheckLevel level;

  /** Create a DiagnosticType at level CheckLevel.WARNING. */
  public static DiagnosticType warning(String name, String descriptionFormat) {
    return new DiagnosticType(name, CheckLevel.WARNING, descriptionFormat);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = requireNonNull(key);
    this.level = requireNonNull(level);
    this.format = requireNonNull(format);
  }

  String format(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object type) {
    return type instanceof DiagnosticType && ((DiagnosticType) type).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
