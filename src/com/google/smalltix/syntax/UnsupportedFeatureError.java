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

import com.google.common.base.Ascii;

/**
 * Raised by the script backend for well-formed source that uses a construct the Smalltix
 * runtime has no representation for, such as a string literal used as a value.
 */
@SuppressWarnings("serial")
public final class UnsupportedFeatureError extends SmalltixException {
  private final String feature;

  public UnsupportedFeatureError(String feature, String details) {
    this(feature, details, -1);
  }

  private UnsupportedFeatureError(String feature, String details, int offset) {
    super(details, offset);
    this.feature = feature;
  }

  /** Reports {@code literal} at its source offset, when it has one. */
  public static UnsupportedFeatureError literal(Literal literal) {
    String name = Ascii.toLowerCase(literal.kind().name());
    return new UnsupportedFeatureError(
        name + " literal",
        Character.toUpperCase(name.charAt(0)) + name.substring(1) + " literals not yet supported",
        literal.offset());
  }

  /** Short name of the unsupported construct, e.g. {@code "string literal"}. */
  public String feature() {
    return feature;
  }
}
