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

/** The unit of compilation: a message pattern, its temporaries and its statements. */
public record Method(
    String selector,
    ImmutableList<String> params,
    ImmutableList<String> temps,
    ImmutableList<Node> body)
    implements Node {
  public Method {
    requireNonNull(selector, "selector");
    checkArgument(
        Selectors.arity(selector) == params.size(),
        "selector %s takes %s parameters, got %s",
        selector,
        Selectors.arity(selector),
        params.size());
    requireNonNull(temps, "temps");
    requireNonNull(body, "body");
  }
}
