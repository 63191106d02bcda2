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

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** A test case for {@link ParserInput}. */
@RunWith(JUnit4.class)
public class ParserInputTest {

  @Test
  public void testFromString() {
    String content = "p Content provided as a string.";
    String pathName = "/the/name/of/the/page.pug";
    ParserInput input = ParserInput.fromString(content, pathName);
    assertThat(input.getContent()).isEqualTo(content);
    assertThat(input.getFile()).isEqualTo(pathName);
  }

  @Test
  public void testFromLines() {
    ParserInput input = ParserInput.fromLines("div", "  p");
    assertThat(input.getContent()).isEqualTo("div\n  p");
    assertThat(input.getFile()).isEmpty();
  }

  @Test
  public void testContentIsKeptVerbatim() {
    // Normalization of line endings is the lexer's job.
    ParserInput input = ParserInput.fromString("div\r\n", "a.pug");
    assertThat(input.getContent()).isEqualTo("div\r\n");
    assertThat(Lexer.normalize(input.getContent())).isEqualTo("div\n");
  }
}
