// Copyright 2024 The Pug Java Syntax Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pug.java.syntax;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A SyntaxError represents a lexical or structural error in a template, with the code that
 * identifies its kind, a message, and the position at which it was detected.
 */
public final class SyntaxError {

  /** The kinds of syntax error. Each is rendered as {@code PUG:<NAME>} by {@link #id}. */
  public enum Code {
    // Lexical errors.
    ASSERT_FAILED,
    BRACKET_MISMATCH,
    DEFAULT_WITH_EXPRESSION,
    ELSE_CONDITION,
    INCONSISTENT_INDENTATION,
    INCORRECT_NESTING,
    INVALID_CLASS_NAME,
    INVALID_ID,
    INVALID_INDENTATION,
    INVALID_KEY_CHARACTER,
    MALFORMED_EACH,
    MALFORMED_EXTENDS,
    MALFORMED_INCLUDE,
    NO_CASE_EXPRESSION,
    NO_END_BRACKET,
    NO_EXTENDS_PATH,
    NO_INCLUDE_PATH,
    NO_WHEN_EXPRESSION,
    NO_WHILE_EXPRESSION,
    SYNTAX_ERROR,
    UNEXPECTED_TEXT,

    // Structural errors.
    BLOCK_IN_BUFFERED_CODE,
    BLOCK_OUTSIDE_MIXIN,
    DUPLICATE_ATTRIBUTE,
    DUPLICATE_ID,
    INVALID_TOKEN,
    MIXIN_WITHOUT_BODY,
    RAW_INCLUDE_BLOCK;

    /** Returns the stable external identifier of this code, e.g. {@code PUG:INVALID_TOKEN}. */
    public String id() {
      return "PUG:" + name();
    }
  }

  private final Code code;
  private final Location location;
  private final String message;
  @Nullable private final String source;

  public SyntaxError(Code code, Location location, String message, @Nullable String source) {
    this.code = code;
    this.location = location;
    this.message = message;
    this.source = source;
  }

  public Code code() {
    return code;
  }

  /** Returns the location at which the error was detected. */
  public Location location() {
    return location;
  }

  public String message() {
    return message;
  }

  /** Returns the full source text, for error context, or null if it was not available. */
  @Nullable
  public String source() {
    return source;
  }

  /** Returns the source line on which the error was detected, or null if unknown. */
  @Nullable
  public String sourceLine() {
    if (source == null) {
      return null;
    }
    List<String> lines = Splitter.on('\n').splitToList(source);
    int index = location.line() - 1;
    return index >= 0 && index < lines.size() ? lines.get(index) : null;
  }

  /** Returns a string of the form "file:line:col: message". */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A checked exception that carries a syntax error out of the lexer or parser. The first error
   * detected aborts the operation, so an exception always carries exactly one error.
   */
  public static final class Exception extends java.lang.Exception {
    private final SyntaxError error;

    public Exception(SyntaxError error) {
      super(error.toString());
      this.error = error;
    }

    public SyntaxError error() {
      return error;
    }

    /** Returns the error as a singleton list, the form used by {@link PugFile#errors}. */
    public ImmutableList<SyntaxError> errors() {
      return ImmutableList.of(error);
    }
  }
}
