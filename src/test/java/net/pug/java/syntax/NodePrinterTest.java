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

/** Tests {@link Node#toString} and {@code NodePrinter}. */
@RunWith(JUnit4.class)
public final class NodePrinterTest {

  private static Block parse(String... lines) throws SyntaxError.Exception {
    PugFile file = PugFile.parse(ParserInput.fromLines(lines));
    if (!file.ok()) {
      throw new SyntaxError.Exception(file.errors().get(0));
    }
    return file.getRoot();
  }

  private static void assertPrettyMatches(Node node, int indentLevel, String expected) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf, indentLevel).printNode(node);
    assertThat(buf.toString()).isEqualTo(expected);
  }

  private static void assertPrettyMatches(Node node, String expected) {
    assertPrettyMatches(node, 0, expected);
  }

  /**
   * Asserts that printing the template and parsing the result again gives the same tree, apart
   * from locations.
   */
  private static void assertRoundTrips(String... lines) throws SyntaxError.Exception {
    Block tree = parse(lines);
    String printed = NodePrinter.print(tree);
    Block reparsed = parse(printed);
    assertThat(NodeJson.encode(reparsed, false)).isEqualTo(NodeJson.encode(tree, false));
  }

  @Test
  public void testTags() throws Exception {
    assertPrettyMatches(parse("div", "  p hello"), "div\n  p hello\n");
    assertPrettyMatches(parse("img/"), "img/\n");
    assertPrettyMatches(parse("ul: li a"), "ul\n  li a\n");
  }

  @Test
  public void testIndentLevel() throws Exception {
    assertPrettyMatches(parse("div", "  p"), 2, "    div\n      p\n");
  }

  @Test
  public void testAttributes() throws Exception {
    assertPrettyMatches(
        parse("a(href='/x' target='_blank')"), "a(href='/x', target='_blank')\n");
    assertPrettyMatches(parse("a.btn(title!=t)"), "a(class!='btn', title!=t)\n");
    assertPrettyMatches(parse("div&attributes(extra)"), "div&attributes(extra)\n");
  }

  @Test
  public void testCode() throws Exception {
    assertPrettyMatches(parse("p= x"), "p= x\n");
    assertPrettyMatches(parse("p!= x"), "p!= x\n");
    assertPrettyMatches(parse("- var x = 1"), "- var x = 1\n");
    assertPrettyMatches(parse("-", "  a()", "  b()"), "-\n  a()\n  b()\n");
  }

  @Test
  public void testText() throws Exception {
    assertPrettyMatches(parse("p Hello #{name}!"), "p Hello #{name}!\n");
    assertPrettyMatches(parse("| one", "| two"), "| one\n| two\n");
    assertPrettyMatches(parse("p.", "  one", "  two"), "p.\n  one\n  two\n");
    // Literal interpolation markers are escaped again.
    assertPrettyMatches(parse("p \\#{x}"), "p \\#{x}\n");
  }

  @Test
  public void testControlFlow() throws Exception {
    assertPrettyMatches(
        parse("if a", "  p 1", "else if b", "  p 2", "else", "  p 3"),
        "if a\n  p 1\nelse if b\n  p 2\nelse\n  p 3\n");
    assertPrettyMatches(
        parse("each v, k in obj", "  li= v"), "each v, k in obj\n  li= v\n");
  }

  @Test
  public void testFilters() throws Exception {
    assertPrettyMatches(parse(":a:b text"), ":a:b\n  text\n");
    assertPrettyMatches(parse("include:md notes.md"), "include:md notes.md\n");
  }

  @Test
  public void testToString() throws Exception {
    Block root = parse("div", "  p");
    assertThat(root.getNodes().get(0).toString()).isEqualTo("Tag at :1:1");
    Tag div = (Tag) root.getNodes().get(0);
    assertThat(div.getBlock().getNodes().get(0).toString()).isEqualTo("Tag at :2:3");
  }

  @Test
  public void testRoundTripPage() throws Exception {
    assertRoundTrips(
        "doctype html",
        "html",
        "  head",
        "    title= title",
        "  body",
        "    h1#main.big Hello #{name}!",
        "    p.",
        "      Some text",
        "      more #{x}",
        "    ul",
        "      each item, i in items",
        "        li(class='x', data-i=i)= item",
        "      else",
        "        li none",
        "    if a",
        "      p a",
        "    else if b",
        "      p b",
        "    else",
        "      p c");
  }

  @Test
  public void testRoundTripStatements() throws Exception {
    assertRoundTrips(
        "mixin card(title)",
        "  .card",
        "    h2= title",
        "    block",
        "+card('x')(class='wide')",
        "  p body",
        "case n",
        "  when 1",
        "  when 2: p few",
        "  default",
        "    p many",
        "// note",
        "//- hidden",
        "  multi",
        "  line",
        "- var a = 1",
        ":markdown",
        "  # hi",
        "include part.pug",
        "include:md notes.md",
        "block content",
        "  p c",
        "block append s",
        "<br>",
        "| plain #[b bold] end");
  }

  @Test
  public void testRoundTripTextFollowingInlineText() throws Exception {
    assertRoundTrips("p text", "  | piped");
    assertRoundTrips("p a", "  | b", "  | c");
    assertPrettyMatches(parse("p text", "  | piped"), "p text\n  | piped\n");
  }

  @Test
  public void testRoundTripSelfClosingTagWithBody() throws Exception {
    assertRoundTrips("img/", "  | piped");
    assertPrettyMatches(parse("img/", "  | piped"), "img/\n  | piped\n");
  }

  @Test
  public void testRoundTripCaseWithOnlyComments() throws Exception {
    assertRoundTrips("case x", "  //- c");
    assertPrettyMatches(parse("case x", "  //- c"), "case x\n  //-\n");
  }
}
