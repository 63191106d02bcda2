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

/**
 * FileOptions is the set of options that affect lexing and parsing of a single template.
 *
 * <p>The source identifier and the source text travel with the {@link ParserInput}; the options
 * here say where the template starts within its source and which plugins extend the grammar.
 * Templates embedded in a larger document can set a starting line and column so that locations
 * and errors refer to the enclosing document.
 */
@AutoValue
public abstract class FileOptions {

  /** The default options: the template starts at line 1, column 1, with no plugins. */
  public static final FileOptions DEFAULT = builder().build();

  /** The 1-based line number of the first line of the input. */
  public abstract int startingLine();

  /** The 1-based column number of the first character of the input. */
  public abstract int startingColumn();

  /** Lexer and parser extensions. */
  public abstract PluginRegistry plugins();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder()
        .startingLine(1)
        .startingColumn(1)
        .plugins(PluginRegistry.EMPTY);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder startingLine(int value);

    public abstract Builder startingColumn(int value);

    public abstract Builder plugins(PluginRegistry value);

    public abstract FileOptions build();
  }
}
