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

import com.google.auto.value.AutoValue;
import javax.annotation.Nullable;

/**
 * A lexical token: its kind, its location, and the kind-specific payload.
 *
 * <p>The payload fields are null (or false) for kinds that do not use them:
 *
 * <ul>
 *   <li>{@link #value} holds the text, name, path or expression of most kinds;
 *   <li>{@link #name} holds the attribute name of an {@code attribute} token;
 *   <li>{@link #key} and {@link #code} hold the key variable and the collection expression of an
 *       {@code each} token;
 *   <li>{@link #args} holds the argument list of a {@code mixin} or {@code call} token;
 *   <li>{@link #mode} holds the mode of a named {@code block} token.
 * </ul>
 */
@AutoValue
public abstract class Token {

  public abstract TokenKind kind();

  public abstract Location location();

  @Nullable
  public abstract String value();

  @Nullable
  public abstract String name();

  @Nullable
  public abstract String key();

  @Nullable
  public abstract String code();

  @Nullable
  public abstract String args();

  @Nullable
  public abstract NamedBlock.Mode mode();

  /** Whether code or a comment is output (buffered). */
  public abstract boolean buffer();

  /** Whether buffered code or an attribute value is HTML-escaped. */
  public abstract boolean mustEscape();

  public abstract Builder toBuilder();

  /** Returns a builder for a token of the given kind, with unset flags defaulting to false. */
  public static Builder builder(TokenKind kind, Location location) {
    return new AutoValue_Token.Builder()
        .kind(kind)
        .location(location)
        .buffer(false)
        .mustEscape(false);
  }

  @Override
  public final String toString() {
    return value() == null ? kind().toString() : kind() + "(" + value() + ")";
  }

  /** Builder for {@link Token}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder kind(TokenKind kind);

    public abstract TokenKind kind();

    public abstract Builder location(Location location);

    public abstract Location location();

    public abstract Builder value(@Nullable String value);

    @Nullable
    public abstract String value();

    public abstract Builder name(@Nullable String name);

    public abstract Builder key(@Nullable String key);

    public abstract Builder code(@Nullable String code);

    public abstract Builder args(@Nullable String args);

    public abstract Builder mode(@Nullable NamedBlock.Mode mode);

    public abstract Builder buffer(boolean buffer);

    public abstract Builder mustEscape(boolean mustEscape);

    public abstract Token build();
  }
}
