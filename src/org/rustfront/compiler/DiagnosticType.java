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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import java.io.Serializable;
import java.text.MessageFormat;

/**
 * A kind of diagnostic, such as {@code RSC_MISPLACED_PROPAGATION_OPERATOR}. Two types with the
 * same key are the same diagnostic, which is what {@link CompilerOptions#setWarningLevel} keys on.
 */
public final class DiagnosticType implements Serializable {
  private static final long serialVersionUID = 1L;

  private static final CharMatcher UPPER_CASE = CharMatcher.inRange('A', 'Z');
  private static final CharMatcher KEY_MATCHER =
      UPPER_CASE.or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_'));

  /** Upper-case identifier, stable across releases. */
  public final String key;

  /** Message with {@link MessageFormat} placeholders. */
  public final String format;

  /** Level used unless the options override it. Never {@code OFF}. */
  public final CheckLevel level;

  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(key, CheckLevel.ERROR, format);
  }

  public static DiagnosticType warning(String key, String format) {
    return new DiagnosticType(key, CheckLevel.WARNING, format);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    checkArgument(
        !key.isEmpty() && UPPER_CASE.matches(key.charAt(0)) && KEY_MATCHER.matchesAllOf(key),
        "Malformed diagnostic key: %s",
        key);
    this.key = key;
    this.level = level;
    this.format = checkNotNull(format);
  }

  String format(String... arguments) {
    return new MessageFormat(format).format(arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && ((DiagnosticType) other).key.equals(key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
