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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of parsing templates into syntax trees. */
@RunWith(TestParameterInjector.class)
public final class ParserTest {

  private static Block parse(FileOptions options, String... lines) throws SyntaxError.Exception {
    ParserInput input = ParserInput.fromLines(lines);
    return Parser.parse(Lexer.lex(input, options), input, options);
  }

  private static Block parse(String... lines) throws SyntaxError.Exception {
    return parse(FileOptions.DEFAULT, lines);
  }

  // Parses a template holding a single top-level node of the given type.
  private static <T extends Node> T parseSingle(Class<T> type, String... lines)
      throws SyntaxError.Exception {
    ImmutableList<Node> nodes = parse(lines).getNodes();
    assertThat(nodes).hasSize(1);
    assertThat(nodes.get(0)).isInstanceOf(type);
    return type.cast(nodes.get(0));
  }

  private static SyntaxError parseError(String... lines) {
    return assertThrows(SyntaxError.Exception.class, () -> parse(lines)).error();
  }

  @Test
  public void testSimpleTag() throws Exception {
    Tag tag = parseSingle(Tag.class, "div");
    assertThat(tag.getName()).isEqualTo("div");
    assertThat(tag.getAttributes()).isEmpty();
    assertThat(tag.getBlock().isEmpty()).isTrue();
    assertThat(tag.isSelfClosing()).isFalse();
    assertThat(tag.isInline()).isFalse();
    assertThat(tag.getLocation().start()).isEqualTo(new Location.Position(1, 1));
    assertThat(tag.getLocation().end()).isEqualTo(new Location.Position(1, 4));
  }

  @Test
  public void testNestedTags() throws Exception {
    Block root = parse("ul", "  li a", "  li b", "p");
    assertThat(root.getNodes()).hasSize(2);
    Tag ul = (Tag) root.getNodes().get(0);
    assertThat(ul.getBlock().getNodes()).hasSize(2);
    Tag li = (Tag) ul.getBlock().getNodes().get(1);
    assertThat(((Text) li.getBlock().getNodes().get(0)).getValue()).isEqualTo("b");
    assertThat(ul.getLocation().contains(li.getLocation())).isTrue();
  }

  @Test
  public void testInlineTagIsInline() throws Exception {
    assertThat(parseSingle(Tag.class, "span").isInline()).isTrue();
  }

  @Test
  public void testTextWithInterpolation() throws Exception {
    Tag p = parseSingle(Tag.class, "p Hello #{name}!");
    ImmutableList<Node> body = p.getBlock().getNodes();
    assertThat(body).hasSize(3);
    assertThat(((Text) body.get(0)).getValue()).isEqualTo("Hello ");
    Code code = (Code) body.get(1);
    assertThat(code.getValue()).isEqualTo("name");
    assertThat(code.isInline()).isTrue();
    assertThat(code.isBuffer()).isTrue();
    assertThat(code.mustEscape()).isTrue();
    assertThat(((Text) body.get(2)).getValue()).isEqualTo("!");
  }

  @Test
  public void testTextOnlyTag() throws Exception {
    Tag p = parseSingle(Tag.class, "p.", "  Hello #{name}");
    assertThat(p.isTextOnly()).isTrue();
    ImmutableList<Node> body = p.getBlock().getNodes();
    assertThat(body).hasSize(2);
    assertThat(((Text) body.get(0)).getValue()).isEqualTo("Hello ");
    assertThat(((Code) body.get(1)).isInline()).isTrue();
  }

  @Test
  public void testEmptyTextOnlyTag() throws Exception {
    Tag p = parseSingle(Tag.class, "p.");
    assertThat(p.isTextOnly()).isTrue();
    assertThat(p.getBlock().isEmpty()).isTrue();
  }

  @Test
  public void testTagInterpolation() throws Exception {
    Tag p = parseSingle(Tag.class, "p #[strong hi] there");
    ImmutableList<Node> body = p.getBlock().getNodes();
    assertThat(body).hasSize(3);
    assertThat(((Text) body.get(0)).getValue()).isEmpty();
    Tag strong = (Tag) body.get(1);
    assertThat(strong.getName()).isEqualTo("strong");
    assertThat(((Text) strong.getBlock().getNodes().get(0)).getValue()).isEqualTo("hi");
    assertThat(((Text) body.get(2)).getValue()).isEqualTo(" there");
  }

  @Test
  public void testShorthandImpliesDiv() throws Exception {
    Tag div = parseSingle(Tag.class, "#main.box hi");
    assertThat(div.getName()).isEqualTo("div");
    assertThat(div.getAttributes()).hasSize(2);
    Attribute id = div.getAttributes().get(0);
    assertThat(id.getName()).isEqualTo("id");
    assertThat(id.getValue()).isEqualTo("'main'");
    assertThat(id.mustEscape()).isFalse();
    assertThat(div.getAttributes().get(1).getValue()).isEqualTo("'box'");
    assertThat(div.getLocation().start()).isEqualTo(new Location.Position(1, 1));
  }

  @Test
  public void testClassMayRepeat() throws Exception {
    Tag div = parseSingle(Tag.class, "div.a.b(class='c')");
    assertThat(div.getAttributes()).hasSize(3);
    assertThat(div.getAttributes().get(2).getValue()).isEqualTo("'c'");
  }

  @Test
  public void testMultipleAttributeListsAreMerged() throws Exception {
    Tag div = parseSingle(Tag.class, "div(a='1')(b='2')");
    assertThat(div.getAttributes()).hasSize(2);
    assertThat(div.getAttributes().get(1).getName()).isEqualTo("b");
  }

  @Test
  public void testAttributeBlock() throws Exception {
    Tag div = parseSingle(Tag.class, "div&attributes(attrs)");
    assertThat(div.getAttributeBlocks()).hasSize(1);
    assertThat(div.getAttributeBlocks().get(0).getValue()).isEqualTo("attrs");
  }

  @Test
  public void testSelfClosingTag() throws Exception {
    Tag img = parseSingle(Tag.class, "img(src='a.png')/");
    assertThat(img.isSelfClosing()).isTrue();
    assertThat(img.getBlock().isEmpty()).isTrue();
  }

  @Test
  public void testBlockExpansion() throws Exception {
    Tag ul = parseSingle(Tag.class, "ul: li a");
    Tag li = (Tag) ul.getBlock().getNodes().get(0);
    assertThat(li.getName()).isEqualTo("li");
    assertThat(((Text) li.getBlock().getNodes().get(0)).getValue()).isEqualTo("a");
  }

  @Test
  public void testInlineCode() throws Exception {
    Tag p = parseSingle(Tag.class, "p= user.name");
    Code code = (Code) p.getBlock().getNodes().get(0);
    assertThat(code.getValue()).isEqualTo("user.name");
    assertThat(code.isInline()).isTrue();
    assertThat(code.isBuffer()).isTrue();
  }

  @Test
  public void testHtmlTextIsMerged() throws Exception {
    Text html = parseSingle(Text.class, "<div>", "  <p>x</p>", "</div>");
    assertThat(html.isHtml()).isTrue();
    assertThat(html.getValue()).isEqualTo("<div>\n<p>x</p>\n</div>");
  }

  @Test
  public void testCodeInsideHtmlIsInline() throws Exception {
    ImmutableList<Node> nodes = parse("<div>", "= x", "  p", "</div>").getNodes();
    assertThat(nodes).hasSize(4);
    assertThat(((Text) nodes.get(0)).getValue()).isEqualTo("<div>");
    Code code = (Code) nodes.get(1);
    assertThat(code.getValue()).isEqualTo("x");
    assertThat(code.isInline()).isTrue();
    assertThat(code.getBlock()).isNull();
    assertThat(((Tag) nodes.get(2)).getName()).isEqualTo("p");
    Text close = (Text) nodes.get(3);
    assertThat(close.isHtml()).isTrue();
    assertThat(close.getValue()).isEqualTo("</div>");
  }

  @Test
  public void testPipedText() throws Exception {
    Block root = parse("| one", "| two");
    assertThat(root.getNodes()).hasSize(3);
    assertThat(((Text) root.getNodes().get(1)).getValue()).isEqualTo("\n");
  }

  @Test
  public void testConditionalChain() throws Exception {
    Conditional cond =
        parseSingle(
            Conditional.class, "if a", "  p 1", "else if b", "  p 2", "else", "  p 3");
    assertThat(cond.getTest()).isEqualTo("a");
    assertThat(cond.getConsequent().getNodes()).hasSize(1);
    Conditional elseIf = (Conditional) cond.getAlternate();
    assertThat(elseIf.getTest()).isEqualTo("b");
    Block otherwise = (Block) elseIf.getAlternate();
    assertThat(((Tag) otherwise.getNodes().get(0)).getName()).isEqualTo("p");
  }

  @Test
  public void testUnless() throws Exception {
    Conditional cond = parseSingle(Conditional.class, "unless done", "  p");
    assertThat(cond.getTest()).isEqualTo("!(done)");
    assertThat(cond.getAlternate()).isNull();
  }

  @Test
  public void testCase() throws Exception {
    Case c =
        parseSingle(
            Case.class, "case n", "  when 1", "  when 2: p few", "  default", "    p many");
    assertThat(c.getExpr()).isEqualTo("n");
    ImmutableList<Node> branches = c.getBlock().getNodes();
    assertThat(branches).hasSize(3);
    When one = (When) branches.get(0);
    assertThat(one.getExpr()).isEqualTo("1");
    assertThat(one.getBlock()).isNull();
    When two = (When) branches.get(1);
    assertThat(((Tag) two.getBlock().getNodes().get(0)).getName()).isEqualTo("p");
    When otherwise = (When) branches.get(2);
    assertThat(otherwise.isDefault()).isTrue();
    assertThat(otherwise.getBlock().getNodes()).hasSize(1);
  }

  @Test
  public void testCaseKeepsRepeatedWhenValues() throws Exception {
    Case c = parseSingle(Case.class, "case x", "  when 1", "    p a", "  when 1", "    p b");
    ImmutableList<Node> branches = c.getBlock().getNodes();
    assertThat(branches).hasSize(2);
    When first = (When) branches.get(0);
    When second = (When) branches.get(1);
    assertThat(first.getExpr()).isEqualTo("1");
    assertThat(second.getExpr()).isEqualTo("1");
    assertThat(((Text) ((Tag) first.getBlock().getNodes().get(0)).getBlock().getNodes().get(0))
            .getValue())
        .isEqualTo("a");
    assertThat(((Text) ((Tag) second.getBlock().getNodes().get(0)).getBlock().getNodes().get(0))
            .getValue())
        .isEqualTo("b");
    assertThat(first.getLocation().start().line()).isLessThan(second.getLocation().start().line());
  }

  @Test
  public void testEachWithElse() throws Exception {
    Each each = parseSingle(Each.class, "each x, i in xs", "  li= x", "else", "  li none");
    assertThat(each.getObj()).isEqualTo("xs");
    assertThat(each.getVal()).isEqualTo("x");
    assertThat(each.getKey()).isEqualTo("i");
    assertThat(each.getBlock().getNodes()).hasSize(1);
    assertThat(each.getAlternate().getNodes()).hasSize(1);
  }

  @Test
  public void testWhile() throws Exception {
    While loop = parseSingle(While.class, "while n < 3", "  p= n++");
    assertThat(loop.getTest()).isEqualTo("n < 3");
    assertThat(loop.getBlock().getNodes()).hasSize(1);
  }

  @Test
  public void testUnbufferedCodeWithBlock() throws Exception {
    Code code = parseSingle(Code.class, "- if (a)", "  p");
    assertThat(code.isBuffer()).isFalse();
    assertThat(code.getBlock().getNodes()).hasSize(1);
  }

  @Test
  public void testBlockCode() throws Exception {
    Code code = parseSingle(Code.class, "-", "  var a = 1", "  var b = 2");
    assertThat(code.getValue()).isEqualTo("var a = 1\nvar b = 2");
    assertThat(code.isBuffer()).isFalse();
  }

  @Test
  public void testComments() throws Exception {
    Comment comment = parseSingle(Comment.class, "// note");
    assertThat(comment.getValue()).isEqualTo(" note");
    assertThat(comment.isBuffer()).isTrue();

    BlockComment block = parseSingle(BlockComment.class, "//- hidden", "  a", "  b");
    assertThat(block.isBuffer()).isFalse();
    assertThat(block.getBlock().getNodes()).hasSize(3);
  }

  @Test
  public void testFilter() throws Exception {
    Filter filter = parseSingle(Filter.class, ":markdown(flavor='gfm')", "  # Title #{x}");
    assertThat(filter.getName()).isEqualTo("markdown");
    assertThat(filter.getAttributes()).hasSize(1);
    // Filter bodies are not interpolated.
    assertThat(((Text) filter.getBlock().getNodes().get(0)).getValue()).isEqualTo("# Title #{x}");
  }

  @Test
  public void testNestedFilters() throws Exception {
    Filter outer = parseSingle(Filter.class, ":a:b text");
    Filter inner = (Filter) outer.getBlock().getNodes().get(0);
    assertThat(inner.getName()).isEqualTo("b");
    assertThat(((Text) inner.getBlock().getNodes().get(0)).getValue()).isEqualTo("text");
  }

  @Test
  public void testInclude() throws Exception {
    Include include = parseSingle(Include.class, "include part.pug", "  p");
    assertThat(include.getFile().getPath()).isEqualTo("part.pug");
    assertThat(include.getBlock().getNodes()).hasSize(1);

    RawInclude raw = parseSingle(RawInclude.class, "include:md(a=1) notes.md");
    assertThat(raw.getFile().getPath()).isEqualTo("notes.md");
    assertThat(raw.getFilters()).hasSize(1);
    assertThat(raw.getFilters().get(0).getName()).isEqualTo("md");
    assertThat(raw.getFilters().get(0).getAttributes()).hasSize(1);

    // A filtered template is included raw.
    assertThat(parseSingle(RawInclude.class, "include:verbatim part.pug").getFilters()).hasSize(1);
  }

  @Test
  public void testExtendsAndNamedBlocks() throws Exception {
    Block root = parse("extends layout.pug", "block content", "  p c", "block append scripts");
    Extends ext = (Extends) root.getNodes().get(0);
    assertThat(ext.getFile().getPath()).isEqualTo("layout.pug");
    NamedBlock content = (NamedBlock) root.getNodes().get(1);
    assertThat(content.getName()).isEqualTo("content");
    assertThat(content.getMode()).isEqualTo(NamedBlock.Mode.REPLACE);
    assertThat(content.getNodes()).hasSize(1);
    NamedBlock scripts = (NamedBlock) root.getNodes().get(2);
    assertThat(scripts.getMode()).isEqualTo(NamedBlock.Mode.APPEND);
    assertThat(scripts.isEmpty()).isTrue();
  }

  @Test
  public void testMixinDeclarationAndCall() throws Exception {
    Block root =
        parse(
            "mixin card(title)",
            "  .card",
            "    h2= title",
            "    block",
            "+card('x')(class='wide')",
            "  p body");
    Mixin decl = (Mixin) root.getNodes().get(0);
    assertThat(decl.isCall()).isFalse();
    assertThat(decl.getArgs()).isEqualTo("title");
    Tag card = (Tag) decl.getBlock().getNodes().get(0);
    assertThat(card.getBlock().getNodes().get(1)).isInstanceOf(MixinBlock.class);

    Mixin call = (Mixin) root.getNodes().get(1);
    assertThat(call.isCall()).isTrue();
    assertThat(call.getName()).isEqualTo("card");
    assertThat(call.getArgs()).isEqualTo("'x'");
    assertThat(call.getAttributes()).hasSize(1);
    assertThat(call.getBlock().getNodes()).hasSize(1);
  }

  @Test
  public void testCallWithoutBodyHasNoBlock() throws Exception {
    Mixin call = parseSingle(Mixin.class, "+item('a')");
    assertThat(call.getBlock()).isNull();
  }

  @Test
  public void testInterpolatedTag() throws Exception {
    InterpolatedTag tag = parseSingle(InterpolatedTag.class, "#{'h' + n} title");
    assertThat(tag.getExpr()).isEqualTo("'h' + n");
    assertThat(((Text) tag.getBlock().getNodes().get(0)).getValue()).isEqualTo("title");
  }

  @Test
  public void testDoctypeAndYield() throws Exception {
    assertThat(parseSingle(Doctype.class, "doctype html").getValue()).isEqualTo("html");
    assertThat(parseSingle(Doctype.class, "doctype").getValue()).isEmpty();
    parseSingle(YieldBlock.class, "yield");
  }

  @Test
  public void testEmptyTemplate() throws Exception {
    Block root = parse("");
    assertThat(root.isEmpty()).isTrue();
  }

  /** Templates rejected by the parser, with the error each one raises. */
  enum ErrorCase {
    DUPLICATE_ID_SHORTHAND(SyntaxError.Code.DUPLICATE_ID, "div#a#b"),
    DUPLICATE_ID_ATTRIBUTE(SyntaxError.Code.DUPLICATE_ID, "div#a(id='b')"),
    DUPLICATE_ATTRIBUTE(SyntaxError.Code.DUPLICATE_ATTRIBUTE, "a(href='x' href='y')"),
    MIXIN_WITHOUT_BODY(SyntaxError.Code.MIXIN_WITHOUT_BODY, "mixin foo(x)"),
    BLOCK_OUTSIDE_MIXIN(SyntaxError.Code.BLOCK_OUTSIDE_MIXIN, "block"),
    RAW_INCLUDE_BLOCK(SyntaxError.Code.RAW_INCLUDE_BLOCK, "include style.css\n  p"),
    BLOCK_IN_BUFFERED_CODE(SyntaxError.Code.BLOCK_IN_BUFFERED_CODE, "= x\n  p"),
    TAG_IN_CASE(SyntaxError.Code.INVALID_TOKEN, "case x\n  p"),
    SLASH_AFTER_CALL(SyntaxError.Code.INVALID_TOKEN, "+m/"),
    STRAY_WHEN(SyntaxError.Code.INVALID_TOKEN, "when x"),
    STRAY_ELSE(SyntaxError.Code.INVALID_TOKEN, "else");

    final SyntaxError.Code code;
    final String src;

    ErrorCase(SyntaxError.Code code, String src) {
      this.code = code;
      this.src = src;
    }
  }

  @Test
  public void testError(@TestParameter ErrorCase errorCase) {
    assertThat(parseError(errorCase.src).code()).isEqualTo(errorCase.code);
  }

  @Test
  public void testErrorMessages() {
    assertThat(parseError("a(href='x' href='y')").message())
        .isEqualTo("Duplicate attribute \"href\" is not allowed.");
    assertThat(parseError("div#a#b").message())
        .isEqualTo("Duplicate attribute \"id\" is not allowed.");
    assertThat(parseError("block").message())
        .isEqualTo("Anonymous blocks are not allowed unless they are part of a mixin.");
    assertThat(parseError("case x", "  p").message())
        .isEqualTo("Unexpected token \"tag\", expected \"when\", \"default\" or \"newline\"");
    assertThat(parseError("+m/").message())
        .isEqualTo(
            "Unexpected token `slash` expected `text`, `interpolated-code`, `code`, `:`,"
                + " `newline` or `eos`");
    assertThat(parseError("else").message()).isEqualTo("unexpected token \"else\"");
  }

  @Test
  public void testErrorLocation() {
    SyntaxError err = parseError("div", "mixin foo(x)");
    assertThat(err.location().line()).isEqualTo(2);
    assertThat(err.location().column()).isEqualTo(1);
    assertThat(err.message()).isEqualTo("Mixin foo declared without body");
  }

  @Test
  public void testTokensMustEndWithEos() {
    ParserInput input = ParserInput.fromLines("div");
    Token tag = Token.builder(TokenKind.TAG, Location.at("", 1, 1)).value("div").build();
    assertThrows(
        IllegalArgumentException.class,
        () -> Parser.parse(ImmutableList.of(tag), input, FileOptions.DEFAULT));
  }

  @Test
  public void testExpressionPlugin() throws Exception {
    Plugin slash =
        new Plugin() {
          @Override
          public ImmutableMap<TokenKind, ExpressionHandler> expressionTokens() {
            return ImmutableMap.of(
                TokenKind.SLASH, parser -> new Comment(parser.advance().location(), "/", false));
          }
        };
    FileOptions options = FileOptions.builder().plugins(PluginRegistry.of(slash)).build();
    Block root = parse(options, "/");
    assertThat(((Comment) root.getNodes().get(0)).getValue()).isEqualTo("/");

    assertThat(parseError("/").message()).isEqualTo("unexpected token \"slash\"");
  }

  @Test
  public void testTagPlugin() throws Exception {
    // Lets mixin calls be self-closing.
    Plugin selfClosingCalls =
        new Plugin() {
          @Override
          public ImmutableMap<TokenKind, ElementHandler> tagTokens() {
            return ImmutableMap.of(
                TokenKind.SLASH,
                (parser, element) -> {
                  element.setSelfClosing(true).extend(parser.advance().location());
                  return true;
                });
          }
        };
    FileOptions options =
        FileOptions.builder().plugins(PluginRegistry.of(selfClosingCalls)).build();
    Mixin call = (Mixin) parse(options, "+m/").getNodes().get(0);
    assertThat(call.getName()).isEqualTo("m");
    assertThat(call.getLocation().end()).isEqualTo(new Location.Position(1, 4));
  }
}
