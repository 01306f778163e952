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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Static helpers for reading a selector's shape. */
public final class Selectors {
  private static final Splitter KEYWORD_SPLITTER = Splitter.on(':').omitEmptyStrings();

  private Selectors() {}

  /** Whether {@code selector} is made of {@code keyword:} parts. */
  public static boolean isKeyword(String selector) {
    return selector.endsWith(":");
  }

  /** Whether {@code selector} is a binary operator. */
  public static boolean isBinary(String selector) {
    return !selector.isEmpty() && TokenStream.BINARY_CHARS.matchesAllOf(selector);
  }

  /** The number of arguments a send of {@code selector} takes. */
  public static int arity(String selector) {
    if (isKeyword(selector)) {
      return CharMatcher.is(':').countIn(selector);
    }
    return isBinary(selector) ? 1 : 0;
  }

  /** Splits {@code at:put:} into {@code [at:, put:]}. */
  public static ImmutableList<String> keywordParts(String selector) {
    ImmutableList.Builder<String> parts = ImmutableList.builder();
    for (String part : KEYWORD_SPLITTER.split(selector)) {
      parts.add(part + ":");
    }
    return parts.build();
  }

  /**
   * The selector as the dispatcher receives it: colons become hyphens, since the dispatcher runs
   * the selector as an executable name.
   */
  public static String mangle(String selector) {
    return selector.replace(':', '-');
  }
}
