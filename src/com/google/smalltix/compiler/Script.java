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

import com.google.common.base.Splitter;
import java.util.List;

/**
 * One generated script.
 *
 * @param name file name: the mangled selector, or for blocks, the enclosing script's name
 *     followed by {@code ~block<N>}
 * @param text the script, ending in a newline
 */
public record Script(String name, String text) {
  public Script {
    requireNonNull(name, "name");
    requireNonNull(text, "text");
  }

  public List<String> lines() {
    return Splitter.on('\n').omitEmptyStrings().splitToList(text);
  }
}
