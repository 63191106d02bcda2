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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the bracket and string scanner used for embedded expressions. */
@RunWith(JUnit4.class)
public final class CharacterParserTest {

  @Test
  public void testParseUntilSkipsNestedBrackets() throws Exception {
    CharacterParser.Range range = CharacterParser.parseUntil("a(b)c)d", ')', 0);
    assertThat(range.start).isEqualTo(0);
    assertThat(range.end).isEqualTo(5);
    assertThat(range.src).isEqualTo("a(b)c");
  }

  @Test
  public void testParseUntilSkipsStringsAndComments() throws Exception {
    assertThat(CharacterParser.parseUntil("'a)'b)", ')', 0).src).isEqualTo("'a)'b");
    assertThat(CharacterParser.parseUntil("a // )\n)", ')', 0).end).isEqualTo(7);
    assertThat(CharacterParser.parseUntil("a /* ) */)", ')', 0).end).isEqualTo(9);
    assertThat(CharacterParser.parseUntil("f(a[0]) ]", ']', 0).src).isEqualTo("f(a[0]) ");
  }

  @Test
  public void testParseUntilReachesEnd() {
    CharacterParser.BracketException e =
        assertThrows(
            CharacterParser.BracketException.class,
            () -> CharacterParser.parseUntil("foo(", ')', 0));
    assertThat(e.failure()).isEqualTo(CharacterParser.Failure.END_OF_STRING_REACHED);
    assertThat(e.index()).isEqualTo(4);
  }

  @Test
  public void testMismatchedBracket() {
    CharacterParser.BracketException e =
        assertThrows(CharacterParser.BracketException.class, () -> CharacterParser.parse("a]"));
    assertThat(e.failure()).isEqualTo(CharacterParser.Failure.MISMATCHED_BRACKET);
    assertThat(e.index()).isEqualTo(1);
    assertThat(e).hasMessageThat().isEqualTo("Mismatched Bracket: ]");
  }

  @Test
  public void testParseState() throws Exception {
    assertThat(CharacterParser.parse("a(b").isNesting()).isTrue();
    assertThat(CharacterParser.parse("'a").isString()).isTrue();
    assertThat(CharacterParser.parse("a // b").isComment()).isTrue();
    assertThat(CharacterParser.parse("a(b)").isNesting()).isFalse();
  }

  @Test
  public void testCheckExpression() {
    assertThat(CharacterParser.checkExpression("a + b")).isNull();
    assertThat(CharacterParser.checkExpression("  "))
        .isEqualTo("Unexpected token (empty expression)");
    assertThat(CharacterParser.checkExpression("a + (b")).isEqualTo("Unexpected end of input");
    assertThat(CharacterParser.checkExpression("'abc")).isEqualTo("Unterminated string constant");
    assertThat(CharacterParser.checkExpression("a /* x")).isEqualTo("Unterminated comment");
    assertThat(CharacterParser.checkExpression("a)")).isEqualTo("Mismatched Bracket: )");
  }

  @Test
  public void testIsCompleteExpression() {
    assertThat(CharacterParser.isCompleteExpression("'x'")).isTrue();
    assertThat(CharacterParser.isCompleteExpression("a++")).isTrue();
    assertThat(CharacterParser.isCompleteExpression("a +")).isFalse();
    assertThat(CharacterParser.isCompleteExpression("a ? b :")).isFalse();
    assertThat(CharacterParser.isCompleteExpression("(a")).isFalse();
  }

  @Test
  public void testBrackets() {
    assertThat(CharacterParser.closing('(')).isEqualTo(')');
    assertThat(CharacterParser.closing('{')).isEqualTo('}');
    assertThrows(IllegalArgumentException.class, () -> CharacterParser.closing('x'));
    assertThat(CharacterParser.isPunctuator('.')).isTrue();
    assertThat(CharacterParser.isPunctuator('a')).isFalse();
  }
}
