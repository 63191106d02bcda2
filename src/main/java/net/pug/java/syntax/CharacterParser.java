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

import com.google.common.base.CharMatcher;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.annotation.Nullable;

/**
 * A character-level scanner for the JavaScript fragments embedded in templates.
 *
 * <p>The scanner does not parse JavaScript. It tracks only what is needed to find the end of an
 * embedded expression: string literals (with escapes), line and block comments, and the nesting of
 * round, square and curly brackets. Regular expression literals are not recognized.
 */
final class CharacterParser {

  private static final CharMatcher PUNCTUATORS = CharMatcher.anyOf(".();,{}[]:?~%&*+-/<>^|!=");

  // Characters that cannot end a complete expression.
  private static final CharMatcher TRAILING_OPERATORS = CharMatcher.anyOf(".,?:=+-*/%&|^!~<>");

  private CharacterParser() {}

  /** The kinds of scanning failure. */
  enum Failure {
    END_OF_STRING_REACHED,
    MISMATCHED_BRACKET
  }

  /** Thrown when the scanned text ends inside a bracket or closes the wrong bracket. */
  static final class BracketException extends Exception {
    private final Failure failure;
    private final int index;

    BracketException(Failure failure, int index, String message) {
      super(message);
      this.failure = failure;
      this.index = index;
    }

    Failure failure() {
      return failure;
    }

    /** Returns the index within the scanned text at which scanning failed. */
    int index() {
      return index;
    }
  }

  /** A span of scanned text, from {@code start} (inclusive) to {@code end} (exclusive). */
  static final class Range {
    final int start;
    final int end;
    final String src;

    Range(int start, int end, String src) {
      this.start = start;
      this.end = end;
      this.src = src;
    }
  }

  /** The scanner state after a prefix of the text. */
  static final class State {
    private final Deque<Character> stack = new ArrayDeque<>();
    private char quote = 0;
    private boolean escaped;
    private boolean lineComment;
    private boolean blockComment;
    private char previous = 0;

    boolean isNesting() {
      return !stack.isEmpty();
    }

    boolean isString() {
      return quote != 0;
    }

    boolean isComment() {
      return lineComment || blockComment;
    }

    /**
     * Advances the state over one character.
     *
     * @param index the position of {@code c}, for error reporting
     */
    void parseChar(char c, int index) throws BracketException {
      if (quote != 0) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == quote) {
          quote = 0;
        }
        previous = c;
        return;
      }
      if (lineComment) {
        lineComment = c != '\n';
        previous = c;
        return;
      }
      if (blockComment) {
        if (previous == '*' && c == '/') {
          blockComment = false;
          previous = 0;
        } else {
          previous = c;
        }
        return;
      }
      if (previous == '/' && c == '/') {
        lineComment = true;
        previous = 0;
        return;
      }
      if (previous == '/' && c == '*') {
        blockComment = true;
        previous = 0;
        return;
      }
      switch (c) {
        case '\'', '"', '`' -> quote = c;
        case '(', '[', '{' -> stack.push(c);
        case ')', ']', '}' -> {
          Character open = stack.poll();
          if (open == null || closing(open) != c) {
            throw new BracketException(
                Failure.MISMATCHED_BRACKET, index, "Mismatched Bracket: " + c);
          }
        }
        default -> {}
      }
      previous = c;
    }
  }

  /** Returns the closing bracket for an opening one. */
  static char closing(char open) {
    return switch (open) {
      case '(' -> ')';
      case '[' -> ']';
      case '{' -> '}';
      default -> throw new IllegalArgumentException("not an opening bracket: " + open);
    };
  }

  /** Scans all of {@code src} and returns the final state. */
  static State parse(String src) throws BracketException {
    State state = new State();
    for (int i = 0; i < src.length(); i++) {
      state.parseChar(src.charAt(i), i);
    }
    return state;
  }

  /**
   * Scans {@code src} from {@code start} until an occurrence of {@code delimiter} that is outside
   * any string, comment or bracket, and returns the text in between.
   *
   * @throws BracketException if the end of {@code src} is reached first, or a closing bracket does
   *     not match
   */
  static Range parseUntil(String src, char delimiter, int start) throws BracketException {
    State state = new State();
    for (int i = start; i < src.length(); i++) {
      char c = src.charAt(i);
      if (c == delimiter && !state.isNesting() && !state.isString() && !state.isComment()) {
        return new Range(start, i, src.substring(start, i));
      }
      state.parseChar(c, i);
    }
    throw new BracketException(
        Failure.END_OF_STRING_REACHED,
        src.length(),
        "The end of the string was reached with no closing bracket found.");
  }

  /** Reports whether {@code c} is a JavaScript punctuator. */
  static boolean isPunctuator(char c) {
    return PUNCTUATORS.matches(c);
  }

  /**
   * Returns a description of why {@code src} cannot be an expression, or null if it is plausible:
   * non-blank, with balanced brackets and closed strings and block comments.
   */
  @Nullable
  static String checkExpression(String src) {
    if (CharMatcher.whitespace().matchesAllOf(src)) {
      return "Unexpected token (empty expression)";
    }
    State state;
    try {
      state = parse(src);
    } catch (BracketException e) {
      return e.getMessage();
    }
    if (state.isString()) {
      return "Unterminated string constant";
    }
    if (state.isNesting()) {
      return "Unexpected end of input";
    }
    if (state.blockComment) {
      return "Unterminated comment";
    }
    return null;
  }

  /**
   * Reports whether {@code src} reads as a finished expression: plausible, and not ending in an
   * operator that would need a right operand. Postfix {@code ++} and {@code --} are allowed.
   */
  static boolean isCompleteExpression(String src) {
    if (checkExpression(src) != null) {
      return false;
    }
    String trimmed = CharMatcher.whitespace().trimTrailingFrom(src);
    if (trimmed.endsWith("++") || trimmed.endsWith("--")) {
      return true;
    }
    return !TRAILING_OPERATORS.matches(trimmed.charAt(trimmed.length() - 1));
  }
}
