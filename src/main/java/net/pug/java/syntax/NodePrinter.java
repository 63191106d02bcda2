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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A pretty-printer that renders a syntax tree as template source.
 *
 * <p>Parsing the output yields a tree of the same structure, ignoring locations, for trees that
 * were themselves produced by the parser. Text is printed piped ({@code | text}) at statement level
 * and after the tag name on the tag's line; the text of a text-only tag, a block comment or a
 * filter is printed as an indented pipeless block.
 */
final class NodePrinter {

  private static final String INDENT = "  ";
  private static final CharMatcher NAME_BREAKS = CharMatcher.anyOf(" \t\n!=,'\"()");

  private final StringBuilder buf;
  private final int baseIndent;

  NodePrinter(StringBuilder buf) {
    this(buf, 0);
  }

  NodePrinter(StringBuilder buf, int indent) {
    this.buf = buf;
    this.baseIndent = indent;
  }

  /** Returns the source of a tree. */
  static String print(Node node) {
    StringBuilder buf = new StringBuilder();
    new NodePrinter(buf).printNode(node);
    return buf.toString();
  }

  /** Prints a node as one or more complete lines at the base indentation. */
  void printNode(Node node) {
    if (node.kind() == Node.Kind.BLOCK) {
      printStatements(((Block) node).getNodes(), baseIndent);
    } else {
      printStatements(ImmutableList.of(node), baseIndent);
    }
  }

  private void line(int indent, String text) {
    for (int i = 0; i < indent; i++) {
      buf.append(INDENT);
    }
    buf.append(text).append('\n');
  }

  private void printBody(@Nullable Block block, int indent) {
    if (block != null) {
      printStatements(block.getNodes(), indent + 1);
    }
  }

  // ==== statements ====

  private void printStatements(List<Node> nodes, int indent) {
    int i = 0;
    while (i < nodes.size()) {
      Node node = nodes.get(i);
      if (isInlineText(node)) {
        int end = i;
        while (end < nodes.size() && isInlineText(nodes.get(end))) {
          end++;
        }
        printPiped(nodes.subList(i, end), indent);
        i = end;
      } else {
        printStatement(node, indent);
        i++;
      }
    }
  }

  private static boolean isInlineText(Node node) {
    return (node instanceof Text text && !text.isHtml())
        || (node instanceof Code code && code.isInline());
  }

  private static boolean isNewline(Node node) {
    return node instanceof Text text && text.getValue().equals("\n");
  }

  // A run of text as piped lines, breaking at newline nodes.
  private void printPiped(List<Node> run, int indent) {
    StringBuilder text = new StringBuilder();
    for (Node node : run) {
      if (isNewline(node)) {
        line(indent, "| " + text);
        text.setLength(0);
      } else {
        appendInline(text, node, true);
      }
    }
    line(indent, text.length() == 0 ? "|" : "| " + text);
  }

  private void printStatement(Node node, int indent) {
    switch (node.kind()) {
      case TAG, INTERPOLATED_TAG -> printElement((Element) node, indent);
      case MIXIN -> {
        Mixin mixin = (Mixin) node;
        if (mixin.isCall()) {
          printElement(mixin, indent);
        } else {
          line(indent, "mixin " + mixin.getName() + args(mixin.getArgs()));
          printBody(mixin.getBlock(), indent);
        }
      }
      case TEXT -> {
        // Raw HTML, one line per line.
        for (String html : Splitter.on('\n').split(((Text) node).getValue())) {
          line(indent, html);
        }
      }
      case CODE -> {
        Code code = (Code) node;
        if (code.getValue().contains("\n")) {
          line(indent, "-");
          printLines(code.getValue(), indent + 1);
        } else {
          line(indent, (codePrefix(code) + " " + code.getValue()).trim());
        }
        printBody(code.getBlock(), indent);
      }
      case COMMENT -> {
        Comment comment = (Comment) node;
        line(indent, (comment.isBuffer() ? "//" : "//-") + comment.getValue());
      }
      case BLOCK_COMMENT -> {
        BlockComment comment = (BlockComment) node;
        line(indent, (comment.isBuffer() ? "//" : "//-") + comment.getValue());
        printPipeless(comment.getBlock(), indent + 1, comment.isBuffer());
      }
      case DOCTYPE -> {
        String value = ((Doctype) node).getValue();
        line(indent, value.isEmpty() ? "doctype" : "doctype " + value);
      }
      case EACH -> {
        Each each = (Each) node;
        String key = each.getKey() == null ? "" : ", " + each.getKey();
        line(indent, "each " + each.getVal() + key + " in " + each.getObj());
        printBody(each.getBlock(), indent);
        if (each.getAlternate() != null) {
          line(indent, "else");
          printBody(each.getAlternate(), indent);
        }
      }
      case WHILE -> {
        While loop = (While) node;
        line(indent, "while " + loop.getTest());
        printBody(loop.getBlock(), indent);
      }
      case CONDITIONAL -> printConditional((Conditional) node, "if ", indent);
      case CASE -> {
        Case c = (Case) node;
        line(indent, "case " + c.getExpr());
        if (c.getBlock().isEmpty()) {
          // a case needs an indented body, even one holding only comments
          line(indent + 1, "//-");
        }
        printBody(c.getBlock(), indent);
      }
      case WHEN -> {
        When when = (When) node;
        line(indent, when.isDefault() ? "default" : "when " + when.getExpr());
        printBody(when.getBlock(), indent);
      }
      case NAMED_BLOCK -> {
        NamedBlock block = (NamedBlock) node;
        String mode = block.getMode() == NamedBlock.Mode.REPLACE ? "" : block.getMode() + " ";
        line(indent, "block " + mode + block.getName());
        printBody(block, indent);
      }
      case MIXIN_BLOCK -> line(indent, "block");
      case YIELD_BLOCK -> line(indent, "yield");
      case EXTENDS -> line(indent, "extends " + ((Extends) node).getFile().getPath());
      case INCLUDE -> {
        Include include = (Include) node;
        line(indent, "include " + include.getFile().getPath());
        printBody(include.getBlock(), indent);
      }
      case RAW_INCLUDE -> {
        RawInclude include = (RawInclude) node;
        StringBuilder head = new StringBuilder("include");
        for (IncludeFilter filter : include.getFilters()) {
          head.append(':').append(filter.getName()).append(attributes(filter.getAttributes()));
        }
        line(indent, head.append(' ').append(include.getFile().getPath()).toString());
      }
      case FILTER -> printFilter((Filter) node, "", indent);
      case BLOCK -> printStatements(((Block) node).getNodes(), indent);
      default ->
          throw new IllegalArgumentException("cannot print " + node.kind() + " as a statement");
    }
  }

  private void printConditional(Conditional node, String keyword, int indent) {
    line(indent, keyword + node.getTest());
    printBody(node.getConsequent(), indent);
    Node alternate = node.getAlternate();
    if (alternate instanceof Conditional next) {
      printConditional(next, "else if ", indent);
    } else if (alternate != null) {
      line(indent, "else");
      printBody((Block) alternate, indent);
    }
  }

  // Nested filters print on one line, `:outer:inner`.
  private void printFilter(Filter filter, String outer, int indent) {
    String head = outer + ":" + filter.getName() + attributes(filter.getAttributes());
    ImmutableList<Node> body = filter.getBlock().getNodes();
    if (body.size() == 1 && body.get(0) instanceof Filter inner) {
      printFilter(inner, head, indent);
      return;
    }
    line(indent, head);
    printPipeless(filter.getBlock(), indent + 1, false);
  }

  private void printElement(Element element, int indent) {
    StringBuilder head = new StringBuilder();
    appendHead(head, element);
    if (element instanceof Tag tag && tag.isTextOnly()
        || element instanceof InterpolatedTag itag && itag.isTextOnly()) {
      line(indent, head.append('.').toString());
      printPipeless(element.getBlock(), indent + 1, true);
      return;
    }
    if (isSelfClosing(element)) {
      head.append('/');
    }
    List<Node> body =
        element.getBlock() == null ? ImmutableList.of() : element.getBlock().getNodes();
    // The body of a self-closing tag cannot share its line.
    int inline = isSelfClosing(element) ? 0 : inlinePrefix(body);
    if (inline == 1 && body.get(0) instanceof Code code) {
      head.append(codePrefix(code)).append(' ').append(code.getValue());
    } else if (inline > 0) {
      StringBuilder text = new StringBuilder();
      for (Node node : body.subList(0, inline)) {
        appendInline(text, node, true);
      }
      if (text.length() > 0) {
        head.append(' ').append(text);
      }
    }
    line(indent, head.toString());
    printStatements(body.subList(inline, body.size()), indent + 1);
  }

  // Returns the number of leading body nodes that can share the element's line. A line of text
  // never yields two adjacent Text nodes, so a second one starts the indented body.
  private static int inlinePrefix(List<Node> body) {
    int n = 0;
    while (n < body.size()
        && isInlineText(body.get(n))
        && !isNewline(body.get(n))
        && !(n > 0 && body.get(n) instanceof Text && body.get(n - 1) instanceof Text)) {
      n++;
    }
    if (n < body.size() && isNewline(body.get(n))) {
      return 0;
    }
    if (n == 1 && body.get(0) instanceof Code code && !code.isBuffer()) {
      return 1;
    }
    for (Node node : body.subList(0, n)) {
      if (node instanceof Code code && !code.isBuffer()) {
        return 0;
      }
    }
    return n;
  }

  private static boolean isSelfClosing(Element element) {
    return element instanceof Tag tag && tag.isSelfClosing()
        || element instanceof InterpolatedTag itag && itag.isSelfClosing();
  }

  private static void appendHead(StringBuilder head, Element element) {
    if (element instanceof Tag tag) {
      head.append(tag.getName());
    } else if (element instanceof InterpolatedTag itag) {
      head.append("#{").append(itag.getExpr()).append('}');
    } else {
      Mixin mixin = (Mixin) element;
      head.append('+').append(mixin.getName()).append(args(mixin.getArgs()));
      if (mixin.getArgs() == null && !element.getAttributes().isEmpty()) {
        // an empty argument list keeps the attributes from being read as arguments
        head.append("()");
      }
    }
    head.append(attributes(element.getAttributes()));
    for (AttributeBlock block : element.getAttributeBlocks()) {
      head.append("&attributes(").append(block.getValue()).append(')');
    }
  }

  private static String args(@Nullable String args) {
    return args == null ? "" : "(" + args + ")";
  }

  private static String attributes(List<Attribute> attributes) {
    if (attributes.isEmpty()) {
      return "";
    }
    List<String> parts = new ArrayList<>();
    for (Attribute attr : attributes) {
      String name = attr.getName();
      if (NAME_BREAKS.matchesAnyOf(name)) {
        name = "\"" + name + "\"";
      }
      parts.add(name + (attr.mustEscape() ? "=" : "!=") + attr.getValue());
    }
    return "(" + Joiner.on(", ").join(parts) + ")";
  }

  private static String codePrefix(Code code) {
    if (!code.isBuffer()) {
      return "-";
    }
    return code.mustEscape() ? "=" : "!=";
  }

  // ==== text ====

  // Appends a text node, interpolated code, or tag interpolation to a line of text.
  private static void appendInline(StringBuilder out, Node node, boolean interpolation) {
    if (node instanceof Text text) {
      out.append(interpolation ? escape(text.getValue()) : text.getValue());
    } else if (node instanceof Code code) {
      out.append(code.mustEscape() ? "#{" : "!{").append(code.getValue()).append('}');
    } else if (node instanceof Element element) {
      out.append("#[");
      appendHead(out, element);
      List<Node> body =
          element.getBlock() == null ? ImmutableList.of() : element.getBlock().getNodes();
      if (!body.isEmpty()) {
        out.append(' ');
        for (Node child : body) {
          appendInline(out, child, interpolation);
        }
      }
      out.append(']');
    } else {
      throw new IllegalArgumentException("cannot print " + node.kind() + " inline");
    }
  }

  private static String escape(String text) {
    return text.replace("#[", "\\#[").replace("#{", "\\#{").replace("!{", "\\!{");
  }

  // The nodes of a pipeless block, one line per newline node.
  private void printPipeless(Block block, int indent, boolean interpolation) {
    StringBuilder text = new StringBuilder();
    for (Node node : block.getNodes()) {
      if (isNewline(node)) {
        printLines(text.toString(), indent);
        text.setLength(0);
      } else {
        appendInline(text, node, interpolation);
      }
    }
    if (!block.isEmpty()) {
      printLines(text.toString(), indent);
    }
  }

  private void printLines(String text, int indent) {
    for (String l : Splitter.on('\n').split(text)) {
      if (l.isEmpty()) {
        buf.append('\n');
      } else {
        line(indent, l);
      }
    }
  }
}
