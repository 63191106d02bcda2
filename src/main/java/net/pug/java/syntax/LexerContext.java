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

import javax.annotation.Nullable;

/**
 * The view of a running {@link Lexer} offered to lexer plugins.
 *
 * <p>A plugin rule inspects {@link #remainingInput}, and if it recognizes the text there, creates
 * tokens with {@link #token} and {@link #push}, advances the input with {@link #consume}, and keeps
 * the position current with {@link #incrementColumn} and {@link #incrementLine}. Consuming input
 * does not move the position; the two are updated separately.
 */
public interface LexerContext {

  /** Returns the input not yet consumed. */
  String remainingInput();

  /** Returns the current position. */
  Location.Position position();

  /** Removes the first {@code length} characters of the remaining input. */
  void consume(int length);

  /** Moves the current position {@code n} columns to the right. */
  void incrementColumn(int n);

  /** Moves the current position {@code n} lines down, to column 1 if {@code n} is not zero. */
  void incrementLine(int n);

  /** Returns a builder for a token that starts at the current position. */
  Token.Builder token(TokenKind kind, @Nullable String value);

  /** Ends the token at the current position and appends it to the output. */
  void push(Token.Builder token);

  /**
   * Runs a lexer rule, its plugin handlers first, and reports whether it matched.
   *
   * @throws SyntaxError.Exception if the rule detects an error
   */
  boolean callRule(Lexer.Rule rule) throws SyntaxError.Exception;

  /** Returns an exception for an error at the current position, for the caller to throw. */
  SyntaxError.Exception error(SyntaxError.Code code, String message);
}
