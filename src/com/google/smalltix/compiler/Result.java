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

import com.google.common.collect.ImmutableList;

/** Compilation results: the method's script, one script per block literal, and warnings. */
public final class Result {
  public final Script primary;
  public final ImmutableList<Script> blocks;
  public final ImmutableList<Diagnostic> warnings;

  Result(Script primary, ImmutableList<Script> blocks, ImmutableList<Diagnostic> warnings) {
    this.primary = primary;
    this.blocks = blocks;
    this.warnings = warnings;
  }

  /** The primary script followed by the block scripts. */
  public ImmutableList<Script> scripts() {
    return ImmutableList.<Script>builder().add(primary).addAll(blocks).build();
  }
}
