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

/**
 * Messages sent in order to one receiver, written {@code r m1; m2; m3}. The receiver is the
 * receiver of the first message, factored out of it by the parser, so it is evaluated once.
 */
public record Cascade(Node receiver, ImmutableList<Message> messages) implements Node {
  public Cascade {
    requireNonNull(receiver, "receiver");
    checkArgument(!messages.isEmpty(), "empty cascade");
  }
}
