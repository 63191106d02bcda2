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

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Recursive descent parser for Pug templates, consuming the tokens of a {@link Lexer}.
 *
 * <p>There is one method per production. Each node is built only once its children are known, so
 * its location is the merge of its anchor token and its children. The first error aborts the
 * parse.
 */
public final class Parser implements ParserContext {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final TokenStream tokens;
  private final String file;
  private final String source;
  private final PluginRegistry plugins;

  // Nesting depth of mixin declaration bodies.
  private int inMixin = 0;

  private Parser(List<Token> tokens, ParserInput input, FileOptions options) {
    this.tokens = new TokenStream(tokens);
    this.file = input.getFile();
    this.source = Lexer.normalize(input.getContent());
    this.plugins = options.plugins();
  }

  /**
   * Parses the tokens of a template into the root block.
   *
   * @param tokens the tokens produced by {@link Lexer#lex}, ending with {@code eos}
   * @param input the template source, for error context
   * @throws SyntaxError.Exception at the first structural error
   */
  public static Block parse(List<Token> tokens, ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    checkArgument(
        !tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == TokenKind.EOS,
        "token list must end with eos");
    return new Parser(tokens, input, options).parseFile();
  }

  private Block parseFile() throws SyntaxError.Exception {
    Block.Builder block = new Block.Builder();
    while (peek().kind() != TokenKind.EOS) {
      parseStatementInto(block);
    }
    return block.build(peek().location());
  }

  // One step of a statement list: skips a newline, or adds the nodes of one construct.
  private void parseStatementInto(Block.Builder block) throws SyntaxError.Exception {
    switch (peek().kind()) {
      case NEWLINE -> advance();
      case TEXT_HTML -> block.addAll(parseTextHtml());
      default -> addFlattened(block, parseExpr());
    }
  }

  // Adds a node, or the nodes of an anonymous block.
  private static void addFlattened(Block.Builder block, Node node) {
    if (node.kind() == Node.Kind.BLOCK) {
      block.addAll(((Block) node).getNodes());
    } else {
      block.add(node);
    }
  }

  // ==== ParserContext ====

  @Override
  public Token peek() {
    return tokens.peek();
  }

  @Override
  public Token lookahead(int n) {
    return tokens.lookahead(n);
  }

  @Override
  @CanIgnoreReturnValue
  public Token advance() {
    return tokens.advance();
  }

  @Override
  public void defer(Token token) {
    tokens.defer(token);
  }

  @Override
  @CanIgnoreReturnValue
  public Token expect(TokenKind kind) throws SyntaxError.Exception {
    if (peek().kind() == kind) {
      return advance();
    }
    throw errorf(
        SyntaxError.Code.INVALID_TOKEN,
        peek(),
        "expected \"%s\", but got \"%s\"",
        kind,
        peek().kind());
  }

  @Override
  @CanIgnoreReturnValue
  @Nullable
  public Token accept(TokenKind kind) {
    return peek().kind() == kind ? advance() : null;
  }

  @Override
  public SyntaxError.Exception error(SyntaxError.Code code, String message, Token token) {
    return new SyntaxError.Exception(new SyntaxError(code, token.location(), message, source));
  }

  @FormatMethod
  private SyntaxError.Exception errorf(
      SyntaxError.Code code, Token token, @FormatString String format, Object... args) {
    return error(code, String.format(format, args), token);
  }

  @Nullable
  private <T> T plugin(PluginRegistry.ExtensionPoint point, Token token, Class<T> type) {
    return plugins.handler(point, token.kind(), type);
  }

  // ==== statements ====

  @Override
  public Node parseExpr() throws SyntaxError.Exception {
    Token tok = peek();
    switch (tok.kind()) {
      case TAG:
        return parseTag();
      case MIXIN:
        return parseMixin();
      case BLOCK:
        return parseBlock();
      case MIXIN_BLOCK:
        return parseMixinBlock();
      case CASE:
        return parseCase();
      case EXTENDS:
        return parseExtends();
      case INCLUDE:
        return parseInclude();
      case DOCTYPE:
        return parseDoctype();
      case FILTER:
        return parseFilter();
      case COMMENT:
        return parseComment();
      case TEXT:
      case INTERPOLATED_CODE:
      case START_PUG_INTERPOLATION:
        return parseText(/* allowNewlines= */ true);
      case TEXT_HTML:
        return new Block.Builder().addAll(parseTextHtml()).build(tok.location());
      case DOT:
        return parseDot();
      case EACH:
        return parseEach();
      case CODE:
        return parseCode(/* inline= */ false);
      case BLOCK_CODE:
        return parseBlockCode();
      case IF:
        return parseConditional();
      case WHILE:
        return parseWhile();
      case CALL:
        return parseCall();
      case INTERPOLATION:
        return parseInterpolation();
      case YIELD:
        return parseYield();
      case ID:
      case CLASS:
        // A shorthand at the start of a statement implies a div.
        defer(Token.builder(TokenKind.TAG, tok.location().anchorStart()).value("div").build());
        return parseExpr();
      default:
        Plugin.ExpressionHandler handler =
            plugin(
                PluginRegistry.ExtensionPoint.EXPRESSION_TOKENS,
                tok,
                Plugin.ExpressionHandler.class);
        if (handler != null) {
          Node node = handler.parse(this);
          if (node != null) {
            return node;
          }
        }
        throw errorf(SyntaxError.Code.INVALID_TOKEN, tok, "unexpected token \"%s\"", tok.kind());
    }
  }

  private Node parseDot() throws SyntaxError.Exception {
    Token dot = advance();
    Block block = parseTextBlock();
    return block != null ? block : new Block.Builder().build(dot.location());
  }

  // Literal text with interpolations; a single piece is returned as is, several as a block.
  private Node parseText(boolean allowNewlines) throws SyntaxError.Exception {
    Token first = peek();
    Block.Builder nodes = new Block.Builder();
    loop:
    while (true) {
      Token tok = peek();
      switch (tok.kind()) {
        case TEXT -> {
          advance();
          nodes.add(new Text(tok.location(), tok.value(), false));
        }
        case INTERPOLATED_CODE -> {
          advance();
          nodes.add(interpolatedCode(tok));
        }
        case NEWLINE -> {
          if (!allowNewlines) {
            break loop;
          }
          advance();
          TokenKind next = peek().kind();
          if (next == TokenKind.TEXT || next == TokenKind.INTERPOLATED_CODE) {
            nodes.add(new Text(tok.location(), "\n", false));
          }
        }
        case START_PUG_INTERPOLATION -> {
          advance();
          nodes.add(parseExpr());
          expect(TokenKind.END_PUG_INTERPOLATION);
        }
        default -> {
          Plugin.NodeListHandler handler =
              plugin(PluginRegistry.ExtensionPoint.TEXT_TOKENS, tok, Plugin.NodeListHandler.class);
          if (handler == null || !handler.handle(this, nodes)) {
            break loop;
          }
        }
      }
    }
    Block block = nodes.build(first.location());
    return block.getNodes().size() == 1 ? block.getNodes().get(0) : block;
  }

  private static Code interpolatedCode(Token tok) {
    return new Code(
        tok.location(), tok.value(), tok.buffer(), tok.mustEscape(), /* inline= */ true, null);
  }

  // Consecutive lines of raw HTML, including indented ones, become a single Text node.
  private List<Node> parseTextHtml() throws SyntaxError.Exception {
    List<Node> nodes = new ArrayList<>();
    StringBuilder html = null;
    Location htmlLocation = null;
    loop:
    while (true) {
      Token tok = peek();
      switch (tok.kind()) {
        case TEXT_HTML -> {
          advance();
          if (html == null) {
            html = new StringBuilder(tok.value());
            htmlLocation = tok.location();
          } else {
            html.append('\n').append(tok.value());
            htmlLocation = Location.merge(htmlLocation, tok.location());
          }
        }
        case INDENT -> {
          for (Node node : block().getNodes()) {
            if (node instanceof Text text && text.isHtml()) {
              if (html == null) {
                html = new StringBuilder(text.getValue());
                htmlLocation = text.getLocation();
              } else {
                html.append('\n').append(text.getValue());
                htmlLocation = Location.merge(htmlLocation, text.getLocation());
              }
            } else {
              if (html != null) {
                nodes.add(new Text(htmlLocation, html.toString(), true));
                html = null;
              }
              nodes.add(node);
            }
          }
        }
        case CODE -> {
          if (html != null) {
            nodes.add(new Text(htmlLocation, html.toString(), true));
            html = null;
          }
          nodes.add(parseCode(/* inline= */ true));
        }
        case NEWLINE -> advance();
        default -> {
          break loop;
        }
      }
    }
    if (html != null) {
      nodes.add(new Text(htmlLocation, html.toString(), true));
    }
    return nodes;
  }

  // `: expr` on the same line, or an indented block.
  private Block parseBlockExpansion() throws SyntaxError.Exception {
    Token colon = accept(TokenKind.COLON);
    if (colon == null) {
      return block();
    }
    Node expr = parseExpr();
    if (expr.kind() == Node.Kind.BLOCK) {
      return (Block) expr;
    }
    return new Block.Builder().add(expr).build(colon.location());
  }

  private Case parseCase() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.CASE);
    Block.Builder block = new Block.Builder();
    Token indent = expect(TokenKind.INDENT);
    while (peek().kind() != TokenKind.OUTDENT) {
      Token next = peek();
      switch (next.kind()) {
        case COMMENT, NEWLINE -> advance();
        case WHEN -> block.add(parseWhen());
        case DEFAULT -> block.add(parseDefault());
        default -> {
          Plugin.NodeListHandler handler =
              plugin(PluginRegistry.ExtensionPoint.CASE_TOKENS, next, Plugin.NodeListHandler.class);
          if (handler == null || !handler.handle(this, block)) {
            throw errorf(
                SyntaxError.Code.INVALID_TOKEN,
                next,
                "Unexpected token \"%s\", expected \"when\", \"default\" or \"newline\"",
                next.kind());
          }
        }
      }
    }
    expect(TokenKind.OUTDENT);
    return new Case(tok.location(), tok.value(), block.build(indent.location()));
  }

  private When parseWhen() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.WHEN);
    TokenKind next = peek().kind();
    if (next == TokenKind.NEWLINE || next == TokenKind.OUTDENT || next == TokenKind.EOS) {
      // no body: falls through to the next branch
      return new When(tok.location(), tok.value(), null);
    }
    return new When(tok.location(), tok.value(), parseBlockExpansion());
  }

  private When parseDefault() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.DEFAULT);
    return new When(tok.location(), "default", parseBlockExpansion());
  }

  private Code parseCode(boolean inline) throws SyntaxError.Exception {
    Token tok = expect(TokenKind.CODE);
    Block block = null;
    if (!inline && peek().kind() == TokenKind.INDENT) {
      if (tok.buffer()) {
        throw error(
            SyntaxError.Code.BLOCK_IN_BUFFERED_CODE,
            "Buffered code cannot have a block attached to it",
            peek());
      }
      block = block();
    }
    return new Code(tok.location(), tok.value(), tok.buffer(), tok.mustEscape(), inline, block);
  }

  // Builds the else-if chain from the last branch back to the first.
  private Conditional parseConditional() throws SyntaxError.Exception {
    List<Token> tests = new ArrayList<>();
    List<Block> consequents = new ArrayList<>();
    Token tok = expect(TokenKind.IF);
    tests.add(tok);
    consequents.add(optionalBlock(tok));
    Block elseBlock = null;
    Location elseLocation = null;
    while (true) {
      Token next = peek();
      if (next.kind() == TokenKind.NEWLINE) {
        advance();
      } else if (next.kind() == TokenKind.ELSE_IF) {
        advance();
        tests.add(next);
        consequents.add(optionalBlock(next));
      } else if (next.kind() == TokenKind.ELSE) {
        advance();
        elseLocation = next.location();
        if (peek().kind() == TokenKind.INDENT) {
          elseBlock = block();
        }
        break;
      } else {
        break;
      }
    }
    Node alternate = elseBlock;
    Conditional node = null;
    for (int i = tests.size() - 1; i >= 0; i--) {
      Location anchor = tests.get(i).location();
      if (i == tests.size() - 1 && elseLocation != null) {
        anchor = Location.merge(anchor, elseLocation);
      }
      node = new Conditional(anchor, tests.get(i).value(), consequents.get(i), alternate);
      alternate = node;
    }
    return node;
  }

  // An indented block if one follows, else an empty block anchored at the token.
  private Block optionalBlock(Token tok) throws SyntaxError.Exception {
    return peek().kind() == TokenKind.INDENT ? block() : new Block.Builder().build(tok.location());
  }

  private While parseWhile() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.WHILE);
    return new While(tok.location(), tok.value(), optionalBlock(tok));
  }

  private Code parseBlockCode() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.BLOCK_CODE);
    Location loc = tok.location();
    StringBuilder text = new StringBuilder();
    if (peek().kind() == TokenKind.START_PIPELESS_TEXT) {
      advance();
      while (peek().kind() != TokenKind.END_PIPELESS_TEXT) {
        Token body = advance();
        switch (body.kind()) {
          case TEXT -> text.append(body.value());
          case NEWLINE -> text.append('\n');
          default -> {
            Plugin.BlockCodeHandler handler =
                plugin(
                    PluginRegistry.ExtensionPoint.BLOCK_CODE_TOKENS,
                    body,
                    Plugin.BlockCodeHandler.class);
            String code = handler == null ? null : handler.handle(this, body);
            if (code == null) {
              throw errorf(
                  SyntaxError.Code.INVALID_TOKEN, body, "Unexpected token type: %s", body.kind());
            }
            text.append(code);
          }
        }
        loc = Location.merge(loc, body.location());
      }
      advance();
    }
    return new Code(
        loc, text.toString(), /* buffer= */ false, /* mustEscape= */ false, false, null);
  }

  private Node parseComment() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.COMMENT);
    Block block = parseTextBlock();
    if (block != null) {
      return new BlockComment(tok.location(), tok.value(), tok.buffer(), block);
    }
    return new Comment(tok.location(), tok.value(), tok.buffer());
  }

  private Doctype parseDoctype() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.DOCTYPE);
    return new Doctype(tok.location(), tok.value() == null ? "" : tok.value());
  }

  private IncludeFilter parseIncludeFilter() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.FILTER);
    ImmutableList<Attribute> attrs = ImmutableList.of();
    if (peek().kind() == TokenKind.START_ATTRIBUTES) {
      ElementBuilder holder = new ElementBuilder(tok.location());
      attrs(holder, null);
      attrs = holder.attributes();
    }
    return new IncludeFilter(tok.location(), tok.value(), attrs);
  }

  private Filter parseFilter() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.FILTER);
    ElementBuilder holder = new ElementBuilder(tok.location());
    if (peek().kind() == TokenKind.START_ATTRIBUTES) {
      attrs(holder, null);
    }
    Block block;
    Token next = peek();
    if (next.kind() == TokenKind.TEXT) {
      advance();
      block =
          new Block.Builder()
              .add(new Text(next.location(), next.value(), false))
              .build(next.location());
    } else if (next.kind() == TokenKind.FILTER) {
      block = new Block.Builder().add(parseFilter()).build(next.location());
    } else {
      block = parseTextBlock();
      if (block == null) {
        block = new Block.Builder().build(holder.location());
      }
    }
    return new Filter(holder.location(), tok.value(), holder.attributes(), block);
  }

  private Each parseEach() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.EACH);
    Block block = block();
    Block alternate = null;
    if (accept(TokenKind.ELSE) != null) {
      alternate = block();
    }
    return new Each(tok.location(), tok.code(), tok.value(), tok.key(), block, alternate);
  }

  private Extends parseExtends() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.EXTENDS);
    Token path = expect(TokenKind.PATH);
    return new Extends(tok.location(), new FileReference(path.location(), path.value().trim()));
  }

  private NamedBlock parseBlock() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.BLOCK);
    Block body = optionalBlock(tok);
    return new NamedBlock(tok.location(), tok.value().trim(), tok.mode(), body.getNodes());
  }

  private MixinBlock parseMixinBlock() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.MIXIN_BLOCK);
    if (inMixin == 0) {
      throw error(
          SyntaxError.Code.BLOCK_OUTSIDE_MIXIN,
          "Anonymous blocks are not allowed unless they are part of a mixin.",
          tok);
    }
    return new MixinBlock(tok.location());
  }

  private YieldBlock parseYield() throws SyntaxError.Exception {
    return new YieldBlock(expect(TokenKind.YIELD).location());
  }

  private Node parseInclude() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.INCLUDE);
    ImmutableList.Builder<IncludeFilter> filters = ImmutableList.builder();
    boolean filtered = false;
    while (peek().kind() == TokenKind.FILTER) {
      filters.add(parseIncludeFilter());
      filtered = true;
    }
    Token pathToken = expect(TokenKind.PATH);
    String path = pathToken.value().trim();
    FileReference ref = new FileReference(pathToken.location(), path);

    boolean template = path.endsWith(".pug") || path.endsWith(".jade");
    if (template && !filtered) {
      Block block =
          peek().kind() == TokenKind.INDENT
              ? block()
              : new Block.Builder().build(pathToken.location());
      if (path.endsWith(".jade")) {
        logger.atWarning().log(
            "%s, line %d: The .jade extension is deprecated, use .pug for \"%s\".",
            file, tok.location().line(), path);
      }
      return new Include(tok.location(), ref, block);
    }
    if (peek().kind() == TokenKind.INDENT) {
      throw error(
          SyntaxError.Code.RAW_INCLUDE_BLOCK, "Raw inclusion cannot contain a block", peek());
    }
    return new RawInclude(tok.location(), ref, filters.build());
  }

  private Mixin parseCall() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.CALL);
    ElementBuilder element = new ElementBuilder(tok.location());
    tag(element, /* selfClosingAllowed= */ false);
    Block block = element.body().isEmpty() ? null : element.buildBody();
    return new Mixin(
        element.location(),
        tok.value(),
        tok.args(),
        /* call= */ true,
        element.attributes(),
        element.attributeBlocks(),
        block);
  }

  private Mixin parseMixin() throws SyntaxError.Exception {
    Token tok = expect(TokenKind.MIXIN);
    if (peek().kind() != TokenKind.INDENT) {
      throw errorf(
          SyntaxError.Code.MIXIN_WITHOUT_BODY, tok, "Mixin %s declared without body", tok.value());
    }
    inMixin++;
    Block body;
    try {
      body = block();
    } finally {
      inMixin--;
    }
    return new Mixin(
        tok.location(),
        tok.value(),
        tok.args(),
        /* call= */ false,
        ImmutableList.of(),
        ImmutableList.of(),
        body);
  }

  @Override
  @Nullable
  public Block parseTextBlock() throws SyntaxError.Exception {
    Token start = accept(TokenKind.START_PIPELESS_TEXT);
    if (start == null) {
      return null;
    }
    Block.Builder block = new Block.Builder();
    while (peek().kind() != TokenKind.END_PIPELESS_TEXT) {
      Token tok = advance();
      switch (tok.kind()) {
        case TEXT -> block.add(new Text(tok.location(), tok.value(), false));
        case NEWLINE -> block.add(new Text(tok.location(), "\n", false));
        case START_PUG_INTERPOLATION -> {
          block.add(parseExpr());
          expect(TokenKind.END_PUG_INTERPOLATION);
        }
        case INTERPOLATED_CODE -> block.add(interpolatedCode(tok));
        default -> {
          Plugin.TextBlockHandler handler =
              plugin(
                  PluginRegistry.ExtensionPoint.TEXT_BLOCK_TOKENS,
                  tok,
                  Plugin.TextBlockHandler.class);
          if (handler == null || !handler.handle(this, block, tok)) {
            throw errorf(
                SyntaxError.Code.INVALID_TOKEN, tok, "Unexpected token type: %s", tok.kind());
          }
        }
      }
    }
    advance();
    return block.build(start.location());
  }

  @Override
  public Block block() throws SyntaxError.Exception {
    Token indent = expect(TokenKind.INDENT);
    Block.Builder block = new Block.Builder();
    while (peek().kind() != TokenKind.OUTDENT) {
      parseStatementInto(block);
    }
    expect(TokenKind.OUTDENT);
    return block.build(indent.location());
  }

  private InterpolatedTag parseInterpolation() throws SyntaxError.Exception {
    Token tok = advance();
    ElementBuilder element = new ElementBuilder(tok.location());
    tag(element, /* selfClosingAllowed= */ true);
    return new InterpolatedTag(
        element.location(),
        tok.value(),
        element.attributes(),
        element.attributeBlocks(),
        element.buildBody(),
        element.isSelfClosing(),
        element.isTextOnly());
  }

  private Tag parseTag() throws SyntaxError.Exception {
    Token tok = advance();
    ElementBuilder element = new ElementBuilder(tok.location());
    tag(element, /* selfClosingAllowed= */ true);
    return new Tag(
        element.location(),
        tok.value(),
        element.attributes(),
        element.attributeBlocks(),
        element.buildBody(),
        element.isSelfClosing(),
        element.isTextOnly());
  }

  // The part shared by tags, interpolated tags and mixin calls: shorthands and attribute lists,
  // then at most one of inline text, inline code, block expansion or a self-closing slash, then
  // the body.
  private void tag(ElementBuilder element, boolean selfClosingAllowed)
      throws SyntaxError.Exception {
    boolean seenAttrs = false;
    Set<String> names = element.attributeNames();
    attributes:
    while (true) {
      Token tok = peek();
      switch (tok.kind()) {
        case ID, CLASS -> {
          advance();
          String name = tok.kind() == TokenKind.ID ? "id" : "class";
          if (tok.kind() == TokenKind.ID && !names.add("id")) {
            throw error(
                SyntaxError.Code.DUPLICATE_ID, "Duplicate attribute \"id\" is not allowed.", tok);
          }
          element.addAttribute(
              new Attribute(
                  tok.location(), name, "'" + tok.value() + "'", /* mustEscape= */ false));
        }
        case START_ATTRIBUTES -> {
          if (seenAttrs) {
            logger.atWarning().log(
                "%s, line %d: You should not have pug tags with multiple attributes.",
                file, tok.location().line());
          }
          seenAttrs = true;
          attrs(element, names);
        }
        case AMPERSAND_ATTRIBUTES -> {
          advance();
          element.addAttributeBlock(new AttributeBlock(tok.location(), tok.value()));
        }
        default -> {
          Plugin.ElementHandler handler =
              plugin(
                  PluginRegistry.ExtensionPoint.TAG_ATTRIBUTE_TOKENS,
                  tok,
                  Plugin.ElementHandler.class);
          if (handler == null || !handler.handle(this, element)) {
            break attributes;
          }
        }
      }
    }

    Token dot = accept(TokenKind.DOT);
    if (dot != null) {
      element.setTextOnly(true).extend(dot.location());
    }

    Token next = peek();
    switch (next.kind()) {
      case TEXT, INTERPOLATED_CODE -> addFlattened(element.body(), parseText(false));
      case CODE -> element.body().add(parseCode(/* inline= */ true));
      case COLON -> {
        advance();
        addFlattened(element.body(), parseExpr());
      }
      case NEWLINE, INDENT, OUTDENT, EOS, START_PIPELESS_TEXT, END_PUG_INTERPOLATION -> {}
      default -> {
        if (next.kind() == TokenKind.SLASH && selfClosingAllowed) {
          advance();
          element.setSelfClosing(true).extend(next.location());
          break;
        }
        Plugin.ElementHandler handler =
            plugin(PluginRegistry.ExtensionPoint.TAG_TOKENS, next, Plugin.ElementHandler.class);
        if (handler == null || !handler.handle(this, element)) {
          throw errorf(
              SyntaxError.Code.INVALID_TOKEN,
              next,
              "Unexpected token `%s` expected `text`, `interpolated-code`, `code`, `:`%s,"
                  + " `newline` or `eos`",
              next.kind(),
              selfClosingAllowed ? ", `slash`" : "");
        }
      }
    }

    while (accept(TokenKind.NEWLINE) != null) {}

    if (element.isTextOnly()) {
      Block text = parseTextBlock();
      if (text != null) {
        element.body().addAll(text.getNodes());
      }
    } else if (peek().kind() == TokenKind.INDENT) {
      element.body().addAll(block().getNodes());
    }
  }

  // Parses an attribute list into the element. Names are checked for duplicates against
  // `names`, if not null; class may repeat.
  private void attrs(ElementBuilder element, @Nullable Set<String> names)
      throws SyntaxError.Exception {
    expect(TokenKind.START_ATTRIBUTES);
    Token tok = advance();
    while (tok.kind() == TokenKind.ATTRIBUTE) {
      String name = tok.name();
      if (names != null && !name.equals("class") && !names.add(name)) {
        if (name.equals("id")) {
          throw error(
              SyntaxError.Code.DUPLICATE_ID, "Duplicate attribute \"id\" is not allowed.", tok);
        }
        throw errorf(
            SyntaxError.Code.DUPLICATE_ATTRIBUTE,
            tok,
            "Duplicate attribute \"%s\" is not allowed.",
            name);
      }
      element.addAttribute(new Attribute(tok.location(), name, tok.value(), tok.mustEscape()));
      tok = advance();
    }
    defer(tok);
    element.extend(expect(TokenKind.END_ATTRIBUTES).location());
  }
}
