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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;

/**
 * The view of a running {@link Parser} offered to parser plugins: the token stream, and the
 * productions a handler may call recursively.
 */
public interface ParserContext {

  /** Returns the next token without consuming it. */
  Token peek();

  /** Returns the {@code n}th token ahead (1-based) without consuming anything. */
  Token lookahead(int n);

  /** Consumes and returns the next token. */
  @CanIgnoreReturnValue
  Token advance();

  /** Pushes a token back onto the front of the stream. At most one may be pending. */
  void defer(Token token);

  /**
   * Consumes and returns the next token, which must be of the given kind.
   *
   * @throws SyntaxError.Exception ({@code INVALID_TOKEN}) if it is not
   */
  @CanIgnoreReturnValue
  Token expect(TokenKind kind) throws SyntaxError.Exception;

  /** Consumes and returns the next token if it is of the given kind, or returns null. */
  @CanIgnoreReturnValue
  @Nullable
  Token accept(TokenKind kind);

  /** Parses one statement-level construct. The result is a {@link Block} for runs of text. */
  Node parseExpr() throws SyntaxError.Exception;

  /** Parses an indented block, from {@code indent} to {@code outdent}. */
  Block block() throws SyntaxError.Exception;

  /** Parses a pipeless text block, or returns null if none starts here. */
  @Nullable
  Block parseTextBlock() throws SyntaxError.Exception;

  /** Returns an exception for an error at the given token, for the caller to throw. */
  SyntaxError.Exception error(SyntaxError.Code code, String message, Token token);
}
