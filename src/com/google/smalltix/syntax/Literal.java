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

package com.google.smalltix.syntax;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * A literal. Integer and float text is kept exactly as scanned, sign included; string and symbol
 * text is the unquoted content.
 *
 * <p>{@code offset} is where the literal starts in the compiled source, or -1 for a literal that
 * was not parsed from source. Equality ignores it.
 */
public record Literal(Kind kind, String text, int offset) implements Node {
  /** Literal kinds. */
  public enum Kind {
    INT,
    FLOAT,
    STRING,
    SYMBOL
  }

  public Literal {
    requireNonNull(kind, "kind");
    requireNonNull(text, "text");
  }

  public Literal(Kind kind, String text) {
    this(kind, text, -1);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Literal other && kind == other.kind && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, text);
  }
}
