/*
 * Copyright 2025 The Rustfront Authors.
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

package org.rustfront.compiler;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.Node;

/**
 * Lightweight message formatter. The format of messages this formatter produces is very compact
 * and to the point.
 *
 * <p>There is no original source text after parsing, so the excerpt, when enabled, is the
 * offending node printed back as code.
 */
public final class LightweightMessageFormatter implements MessageFormatter {
  private boolean includeLocation = true;
  private boolean includeLevel = true;
  private boolean includeExcerpt = false;

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLocation(boolean includeLocation) {
    this.includeLocation = includeLocation;
    return this;
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeLevel(boolean includeLevel) {
    this.includeLevel = includeLevel;
    return this;
  }

  @CanIgnoreReturnValue
  public LightweightMessageFormatter setIncludeExcerpt(boolean includeExcerpt) {
    this.includeExcerpt = includeExcerpt;
    return this;
  }

  @Override
  public String formatError(RsError error) {
    return format(error, false);
  }

  @Override
  public String formatWarning(RsError warning) {
    return format(warning, true);
  }

  private String format(RsError error, boolean warning) {
    StringBuilder b = new StringBuilder();
    if (includeLocation) {
      appendPosition(b, error.sourceName(), error.lineno(), error.charno());
    }

    if (includeLevel) {
      b.append(warning ? CheckLevel.WARNING : CheckLevel.ERROR);
      b.append(" - [");
      b.append(error.type().key);
      b.append("] ");
    }

    b.append(error.description());

    Node node = error.node();
    if (includeExcerpt && node != null) {
      b.append('\n');
      b.append(new CodePrinter().print(node));
    }
    return b.toString();
  }

  private static void appendPosition(
      StringBuilder b, @Nullable String sourceName, int lineNumber, int charno) {
    if (sourceName != null) {
      b.append(sourceName);
      if (lineNumber > 0) {
        b.append(':').append(lineNumber);
        if (charno >= 0) {
          b.append(':').append(charno);
        }
      }
      b.append(": ");
    }
  }
}
