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
import java.util.List;

/** One message of a {@link Cascade}: a selector and its arguments, without a receiver. */
public record Message(String selector, ImmutableList<Node> args) {
  public Message {
    requireNonNull(selector, "selector");
    checkArgument(
        Selectors.arity(selector) == args.size(),
        "selector %s takes %s arguments, got %s",
        selector,
        Selectors.arity(selector),
        args.size());
  }

  public Message(String selector, List<? extends Node> args) {
    this(selector, ImmutableList.<Node>copyOf(args));
  }

  public Message(String selector, Node... args) {
    this(selector, ImmutableList.copyOf(args));
  }
}
