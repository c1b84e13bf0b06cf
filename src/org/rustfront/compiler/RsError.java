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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.rustfront.ast.Node;

/**
 * Compile error description.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param length Length of the error region.
 * @param node Node where the warning occurred.
 * @param defaultLevel The default level, before any option overrides are applied.
 */
public record RsError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    int length,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public RsError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;
  private static final int DEFAULT_LENGTH = 0;
  private static final @Nullable String DEFAULT_SOURCENAME = null;
  private static final @Nullable Node DEFAULT_NODE = null;

  /**
   * Creates an RsError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RsError make(DiagnosticType type, String... arguments) {
    return builder(type, arguments).build();
  }

  /**
   * Creates an RsError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RsError make(
      @Nullable String sourceName,
      int lineno,
      int charno,
      DiagnosticType type,
      String... arguments) {
    return builder(type, arguments).setSourceLocation(sourceName, lineno, charno).build();
  }

  /**
   * Creates an RsError from a file and Node position.
   *
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static RsError make(Node n, DiagnosticType type, String... arguments) {
    return builder(type, arguments).setNode(n).build();
  }

  static final class Builder {
    private final DiagnosticType type;
    private final String[] args;

    private CheckLevel level;
    private Node n = DEFAULT_NODE;
    private String sourceName = DEFAULT_SOURCENAME;
    private int lineno = DEFAULT_LINENO;
    private int charno = DEFAULT_CHARNO;
    private int length = DEFAULT_LENGTH;

    private Builder(DiagnosticType type, String... args) {
      this.type = type;
      this.args = args;
      this.level = type.level; // may be overwritten later
    }

    /**
     * Sets the location where this error occurred.
     *
     * <p>Incompatible with {@link #setSourceLocation(String, int, int)}
     */
    @CanIgnoreReturnValue
    Builder setNode(Node n) {
      Preconditions.checkState(
          Objects.equals(DEFAULT_SOURCENAME, this.sourceName),
          "Cannot provide a Node when there's already a source name");
      this.n = n;
      this.sourceName = NodeUtil.getSourceName(n);
      this.lineno = n.getLineno();
      this.charno = n.getCharno();
      this.length = n.getLength();
      return this;
    }

    /** Overwrites the default level of the DiagnosticType. */
    @CanIgnoreReturnValue
    Builder setLevel(CheckLevel level) {
      this.level = Preconditions.checkNotNull(level);
      return this;
    }

    /**
     * Sets the location where this error occurred
     *
     * <p>Incompatible with {@link #setNode(Node)}
     */
    @CanIgnoreReturnValue
    Builder setSourceLocation(@Nullable String sourceName, int lineno, int charno) {
      Preconditions.checkState(
          this.n == DEFAULT_NODE, "Cannot provide a source location when there is already a Node");
      this.sourceName = sourceName;
      this.lineno = lineno;
      this.charno = charno;
      return this;
    }

    RsError build() {
      return new RsError(type, type.format(args), sourceName, lineno, charno, length, n, level);
    }
  }

  /**
   * Creates a new builder.
   *
   * @param type the associated DiagnosticType
   * @param arguments formatting arguments used to format the DiagnosticType's description
   */
  static Builder builder(DiagnosticType type, String... arguments) {
    return new Builder(type, arguments);
  }

  /** @return the default rendering of an error as text. */
  @Override
  public final String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String charno =
        this.charno() != DEFAULT_CHARNO ? String.valueOf(this.charno()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + charno;
  }

  /**
   * Format a message at the given level.
   *
   * @return the formatted message or {@code null}
   */
  public final @Nullable String format(CheckLevel level, MessageFormatter formatter) {
    return switch (level) {
      case ERROR -> formatter.formatError(this);
      case WARNING -> formatter.formatWarning(this);
      default -> null;
    };
  }
}
