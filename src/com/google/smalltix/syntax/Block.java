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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * A block literal {@code [:a :b | | t | statements]}.
 *
 * <p>{@code sourceBodyStart} and {@code sourceBodyEnd} delimit the body's raw text in the
 * compiled source: everything after the parameter and temporary declarations up to, not
 * including, the closing bracket. They are -1 for blocks that were not parsed from source.
 * Equality is structural and ignores them, so a block re-parsed from printed source equals the
 * block it was printed from.
 */
public record Block(
    ImmutableList<String> params,
    ImmutableList<String> temps,
    ImmutableList<Node> body,
    int sourceBodyStart,
    int sourceBodyEnd)
    implements Node {
  public Block {
    requireNonNull(params, "params");
    requireNonNull(temps, "temps");
    requireNonNull(body, "body");
    checkArgument(
        sourceBodyStart <= sourceBodyEnd, "bad span %s..%s", sourceBodyStart, sourceBodyEnd);
  }

  public Block(
      ImmutableList<String> params, ImmutableList<String> temps, ImmutableList<Node> body) {
    this(params, temps, body, -1, -1);
  }

  public boolean hasSourceSpan() {
    return sourceBodyStart >= 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Block other
        && params.equals(other.params)
        && temps.equals(other.temps)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(params, temps, body);
  }
}
