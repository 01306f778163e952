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
import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/**
 * The class of exceptions thrown while compiling a Smalltalk method. Every subclass is terminal
 * for the compilation: no partial output is ever produced once one of these is raised.
 *
 * <p>The offset is known at the point of failure; the line and column are filled in later by
 * {@link #recordErrorOrigin}, once the whole source text is at hand.
 */
@SuppressWarnings("serial")
public class SmalltixException extends RuntimeException {
  private final int offset;
  private @Nullable String sourceName;
  private int lineNumber;
  private int columnNumber;

  protected SmalltixException(String details, int offset) {
    super(details);
    this.offset = offset;
  }

  @Override
  public final String getMessage() {
    String details = details();
    if (lineNumber <= 0 && offset < 0) {
      return details;
    }
    StringBuilder buf = new StringBuilder(details);
    buf.append(" (");
    if (sourceName != null) {
      buf.append(sourceName);
    }
    if (lineNumber > 0) {
      buf.append('#').append(lineNumber).append(':').append(columnNumber);
    } else {
      buf.append("offset ").append(offset);
    }
    buf.append(')');
    return buf.toString();
  }

  /** The message without location information. */
  public String details() {
    return super.getMessage();
  }

  /** Zero-based offset into the source text, or -1 if unknown. */
  public final int offset() {
    return offset;
  }

  public final @Nullable String sourceName() {
    return sourceName;
  }

  /** One-based line of the fault, or zero if not yet recorded. */
  public final int lineNumber() {
    return lineNumber;
  }

  /** One-based column of the fault, or zero if not yet recorded. */
  public final int columnNumber() {
    return columnNumber;
  }

  /**
   * Resolves the offset against the source text it was computed from.
   *
   * @throws IllegalStateException if the origin was already recorded.
   */
  public final void recordErrorOrigin(@Nullable String sourceName, String source) {
    checkState(lineNumber == 0, "origin already recorded");
    this.sourceName = sourceName;
    if (offset < 0) {
      return;
    }
    checkArgument(offset <= source.length(), "offset %s past end of source", offset);
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    this.lineNumber = line;
    this.columnNumber = offset - lineStart + 1;
  }
}
