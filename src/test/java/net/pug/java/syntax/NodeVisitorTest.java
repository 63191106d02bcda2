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
import static com.google.common.truth.Truth.assertWithMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link NodeVisitor}. */
@RunWith(JUnit4.class)
public final class NodeVisitorTest {

  private static Block parse(String... lines) throws SyntaxError.Exception {
    ParserInput input = ParserInput.fromLines(lines);
    return Parser.parse(Lexer.lex(input, FileOptions.DEFAULT), input, FileOptions.DEFAULT);
  }

  private static List<Node.Kind> kinds(Node root) {
    List<Node.Kind> kinds = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(Node node) {
        kinds.add(node.kind());
        super.visit(node);
      }
    }.visit(root);
    return kinds;
  }

  @Test
  public void testLexicalOrder() throws Exception {
    Tag div = (Tag) parse("div(a='1')&attributes(x)", "  p hi").getNodes().get(0);
    assertThat(kinds(div))
        .containsExactly(
            Node.Kind.TAG,
            Node.Kind.ATTRIBUTE,
            Node.Kind.ATTRIBUTE_BLOCK,
            Node.Kind.TAG,
            Node.Kind.TEXT)
        .inOrder();
  }

  @Test
  public void testIncludesAndConditionals() throws Exception {
    assertThat(kinds(parse("include:md(a=1) notes.md").getNodes().get(0)))
        .containsExactly(
            Node.Kind.RAW_INCLUDE,
            Node.Kind.FILE_REFERENCE,
            Node.Kind.INCLUDE_FILTER,
            Node.Kind.ATTRIBUTE)
        .inOrder();
    assertThat(kinds(parse("if a", "  p", "else", "  br").getNodes().get(0)))
        .containsExactly(Node.Kind.CONDITIONAL, Node.Kind.TAG, Node.Kind.BLOCK, Node.Kind.TAG)
        .inOrder();
  }

  @Test
  public void testChildrenLieWithinParents() throws Exception {
    Block root =
        parse(
            "doctype html",
            "mixin card(title)",
            "  .card(data-x=1)",
            "    h2= title",
            "    block",
            "html",
            "  body",
            "    p.",
            "      Hello #{name}",
            "      #[b bold] text",
            "    case n",
            "      when 1: p one",
            "      default",
            "        p many",
            "    each x, i in xs",
            "      +card(x)",
            "        span= i",
            "    else",
            "      p none",
            "    if a",
            "      p a",
            "    else",
            "      p b",
            "    while n < 3",
            "      - n++",
            "    //- hidden",
            "      text",
            "    :markdown",
            "      # hi",
            "    include part.pug",
            "      p extra",
            "    <br>");
    Deque<Node> parents = new ArrayDeque<>();
    int[] count = {0};
    new NodeVisitor() {
      @Override
      public void visit(Node node) {
        for (Node parent : parents) {
          assertWithMessage("%s within %s", node, parent)
              .that(parent.getLocation().contains(node.getLocation()))
              .isTrue();
        }
        count[0]++;
        parents.push(node);
        super.visit(node);
        parents.pop();
      }
    }.visit(root);
    assertThat(count[0]).isGreaterThan(40);
  }
}
