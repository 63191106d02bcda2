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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A cursor over a lexer's token list, with a single slot for pushing back one token.
 *
 * <p>A deferred token is returned by the next {@link #peek} or {@link #advance}, ahead of the
 * remaining tokens. At most one token may be deferred at a time.
 */
public final class TokenStream {

  private final ImmutableList<Token> tokens;
  private int index = 0;
  @Nullable private Token deferred;

  public TokenStream(List<Token> tokens) {
    this.tokens = ImmutableList.copyOf(tokens);
  }

  /** Returns the next token without consuming it. */
  public Token peek() {
    return lookahead(1);
  }

  /**
   * Returns the {@code n}th token ahead without consuming anything; {@code lookahead(1)} is the
   * same as {@link #peek}.
   *
   * @throws IllegalStateException if the stream holds fewer than {@code n} tokens.
   */
  public Token lookahead(int n) {
    checkArgument(n >= 1, "lookahead distance must be positive: %s", n);
    if (deferred != null) {
      if (n == 1) {
        return deferred;
      }
      n--;
    }
    int i = index + n - 1;
    checkState(i < tokens.size(), "cannot read past the end of the token stream");
    return tokens.get(i);
  }

  /** Consumes and returns the next token. */
  @CanIgnoreReturnValue
  public Token advance() {
    if (deferred != null) {
      Token t = deferred;
      deferred = null;
      return t;
    }
    checkState(index < tokens.size(), "cannot read past the end of the token stream");
    return tokens.get(index++);
  }

  /**
   * Pushes a token back onto the front of the stream.
   *
   * @throws IllegalStateException if a token is already deferred.
   */
  public void defer(Token token) {
    checkState(deferred == null, "a token is already deferred: %s", deferred);
    deferred = token;
  }

  /** Reports whether any token remains, deferred or not. */
  public boolean hasNext() {
    return deferred != null || index < tokens.size();
  }
}
