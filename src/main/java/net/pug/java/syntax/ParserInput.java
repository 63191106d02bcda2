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

import com.google.common.base.Joiner;

/** The apparent name and contents of a template source. */
public final class ParserInput {

  private final String content;
  private final String file;

  private ParserInput(String content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the source text. */
  public String getContent() {
    return content;
  }

  /** Returns the apparent file name of the input, used as the source identifier of locations. */
  public String getFile() {
    return file;
  }

  /** Returns an input for the given text, labelled with the given file name. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content, file);
  }

  /**
   * Returns an unnamed input whose content is the given lines joined by newlines. Intended for
   * tests.
   */
  public static ParserInput fromLines(String... lines) {
    return new ParserInput(Joiner.on('\n').join(lines), "");
  }
}
