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
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * A tokenizer for the Pug template language.
 *
 * <p>The lexer is a state machine over a stack of {@link Mode}s. Each mode has an ordered list of
 * {@link Rule}s; at each step the rules of the current mode are tried in order and the first one
 * that recognizes the remaining input emits zero or more tokens and consumes it. Attribute lists
 * and pipeless text blocks are lexed in modes of their own, pushed by the rule that encounters
 * them. Tag interpolations ({@code #[...]}) are lexed by a child lexer in interpolation mode.
 *
 * <p>Indentation is measured in units fixed by the first indented line: all spaces or all tabs,
 * of that width. A line indented by k units is at depth k. The lexer emits {@code indent} when the
 * depth grows by one, one {@code outdent} per level when it shrinks, and {@code newline} when it
 * stays the same. Blank lines do not take part. At end of input every open level is closed.
 */
public final class Lexer implements LexerContext {

  /** The tokenizing rules, each of which recognizes one construct. */
  public enum Rule {
    BLANK,
    EOS,
    END_INTERPOLATION,
    YIELD,
    DOCTYPE,
    INTERPOLATION,
    CASE,
    WHEN,
    DEFAULT,
    EXTENDS,
    APPEND,
    PREPEND,
    BLOCK,
    MIXIN_BLOCK,
    INCLUDE,
    PATH,
    MIXIN,
    CALL,
    CONDITIONAL,
    EACH,
    WHILE,
    TAG,
    FILTER,
    BLOCK_CODE,
    CODE,
    ID,
    DOT,
    CLASS_NAME,
    ATTRIBUTES,
    ATTRIBUTES_BLOCK,
    INDENT,
    TEXT,
    TEXT_HTML,
    COMMENT,
    SLASH,
    COLON,
    FAIL,
    PIPELESS_TEXT,
    ATTRIBUTE,
    END_ATTRIBUTES,
    PIPELESS_LINE,
    END_PIPELESS_TEXT
  }

  /** The lexer states, each with the rules it tries, in priority order. */
  enum Mode {
    DEFAULT(statementRules(/* interpolated= */ false)),
    INTERPOLATION(statementRules(/* interpolated= */ true)),
    TAG_ATTRIBUTES(ImmutableList.of(Rule.END_ATTRIBUTES, Rule.ATTRIBUTE)),
    PIPELESS_TEXT(ImmutableList.of(Rule.PIPELESS_LINE, Rule.END_PIPELESS_TEXT));

    private final ImmutableList<Rule> rules;

    Mode(ImmutableList<Rule> rules) {
      this.rules = rules;
    }

    // Inside `#[...]` the closing bracket is tried right after the end of input.
    private static ImmutableList<Rule> statementRules(boolean interpolated) {
      ImmutableList.Builder<Rule> rules = ImmutableList.builder();
      rules.add(Rule.BLANK, Rule.EOS);
      if (interpolated) {
        rules.add(Rule.END_INTERPOLATION);
      }
      return rules
          .add(
              Rule.YIELD,
              Rule.DOCTYPE,
              Rule.INTERPOLATION,
              Rule.CASE,
              Rule.WHEN,
              Rule.DEFAULT,
              Rule.EXTENDS,
              Rule.APPEND,
              Rule.PREPEND,
              Rule.BLOCK,
              Rule.MIXIN_BLOCK,
              Rule.INCLUDE,
              Rule.MIXIN,
              Rule.CALL,
              Rule.CONDITIONAL,
              Rule.EACH,
              Rule.WHILE,
              Rule.TAG,
              Rule.FILTER,
              Rule.BLOCK_CODE,
              Rule.CODE,
              Rule.ID,
              Rule.DOT,
              Rule.CLASS_NAME,
              Rule.ATTRIBUTES,
              Rule.ATTRIBUTES_BLOCK,
              Rule.INDENT,
              Rule.TEXT,
              Rule.TEXT_HTML,
              Rule.COMMENT,
              Rule.SLASH,
              Rule.COLON,
              Rule.FAIL)
          .build();
    }

    ImmutableList<Rule> rules() {
      return rules;
    }
  }

  private static final Pattern BLANK = Pattern.compile("\\n([ \\t]*)(?=\\n|\\z)");
  private static final Pattern BLANK_FIRST_LINE = Pattern.compile("[ \\t]+(?=\\n|\\z)");
  private static final Pattern YIELD = Pattern.compile("yield");
  private static final Pattern DOCTYPE = Pattern.compile("doctype *([^\\n]*)");
  private static final Pattern CASE = Pattern.compile("case +([^\\n]+)");
  private static final Pattern CASE_KEYWORD = Pattern.compile("case\\b");
  private static final Pattern WHEN = Pattern.compile("when +([^:\\n]+)");
  private static final Pattern WHEN_KEYWORD = Pattern.compile("when\\b");
  private static final Pattern WHEN_CONTINUATION = Pattern.compile(":([^:\\n]+)");
  private static final Pattern DEFAULT = Pattern.compile("default");
  private static final Pattern DEFAULT_KEYWORD = Pattern.compile("default\\b");
  private static final Pattern EXTENDS = Pattern.compile("extends?(?= |\\z|\\n)");
  private static final Pattern EXTENDS_KEYWORD = Pattern.compile("extends?\\b");
  private static final Pattern APPEND = Pattern.compile("(?:block +)?append +([^\\n]+)");
  private static final Pattern PREPEND = Pattern.compile("(?:block +)?prepend +([^\\n]+)");
  private static final Pattern BLOCK = Pattern.compile("block +([^\\n]+)");
  private static final Pattern MIXIN_BLOCK = Pattern.compile("block");
  private static final Pattern INCLUDE = Pattern.compile("include(?=:| |\\z|\\n)");
  private static final Pattern INCLUDE_KEYWORD = Pattern.compile("include\\b");
  private static final Pattern PATH = Pattern.compile(" ([^\\n]+)");
  private static final Pattern NON_SPACE = Pattern.compile("[^ \\n]+");
  private static final Pattern MIXIN = Pattern.compile("mixin +([-\\w]+)(?: *\\((.*)\\))? *");
  private static final Pattern CALL = Pattern.compile("\\+(\\s*)(([-\\w]+)|(#\\{))");
  private static final Pattern CALL_ARGUMENTS = Pattern.compile(" *\\(");
  private static final Pattern ATTRIBUTE_LIKE = Pattern.compile("\\s*[-\\w]+ *=");
  private static final Pattern CONDITIONAL =
      Pattern.compile("(if|unless|else if|else)\\b([^\\n]*)");
  private static final Pattern EACH =
      Pattern.compile(
          "(?:each|for) +([a-zA-Z_$][\\w$]*)(?: *, *([a-zA-Z_$][\\w$]*))? * in *([^\\n]+)");
  private static final Pattern EACH_KEYWORD = Pattern.compile("(?:each|for)\\b");
  private static final Pattern DASHED_EACH =
      Pattern.compile(
          "- *(?:each|for) +([a-zA-Z_$][\\w$]*)(?: *, *([a-zA-Z_$][\\w$]*))? +in +([^\\n]+)");
  private static final Pattern WHILE = Pattern.compile("while +([^\\n]+)");
  private static final Pattern WHILE_KEYWORD = Pattern.compile("while\\b");
  private static final Pattern TAG = Pattern.compile("(\\w(?:[-:\\w]*\\w)?)");
  private static final Pattern FILTER = Pattern.compile(":([\\w\\-]+)");
  private static final Pattern BLOCK_CODE = Pattern.compile("-");
  private static final Pattern CODE = Pattern.compile("(!?=|-)[ \\t]*([^\\n]+)");
  private static final Pattern ID = Pattern.compile("#([\\w-]+)");
  private static final Pattern DOT = Pattern.compile("\\.");
  private static final Pattern CLASS_NAME =
      Pattern.compile("\\.([_a-z0-9\\-]*[_a-z][_a-z0-9\\-]*)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DIGITS_CLASS_NAME =
      Pattern.compile("\\.[_a-z0-9\\-]+", Pattern.CASE_INSENSITIVE);
  private static final Pattern NAME_FRAGMENT = Pattern.compile(".[^ \\t(#.:]*");
  private static final Pattern ATTRIBUTES_BLOCK = Pattern.compile("&attributes\\b");
  private static final Pattern PIPED_TEXT = Pattern.compile("(?:\\| ?| )([^\\n]+)");
  private static final Pattern SPACE_TEXT = Pattern.compile("( )");
  private static final Pattern EMPTY_PIPE = Pattern.compile("\\|( ?)");
  private static final Pattern TEXT_HTML = Pattern.compile("(<[^\\n]*)");
  private static final Pattern COMMENT = Pattern.compile("//(-)?([^\\n]*)");
  private static final Pattern SLASH = Pattern.compile("/");
  private static final Pattern COLON = Pattern.compile(": +");
  private static final Pattern STRING_INTERPOLATION =
      Pattern.compile("(\\\\)?([#!])\\{([\\s\\S]*)\\z");
  private static final Pattern LEADING_SPACES = Pattern.compile("([ ]+)([^ ]*)");
  private static final Pattern END_OF_LINE = Pattern.compile("[ \\t]*(?:\\n|\\z)");
  private static final Pattern NEWLINES = Pattern.compile("\\r\\n|\\r");

  private static final CharMatcher BLANKS = CharMatcher.anyOf(" \t");
  private static final CharMatcher WHITESPACE = CharMatcher.anyOf(" \t\n");
  private static final CharMatcher QUOTES = CharMatcher.anyOf("'\"");

  /** One line of a pipeless text block, waiting to be emitted. */
  private static final class PipelessLine {
    final String text;
    final boolean indented;
    final boolean first;

    PipelessLine(String text, boolean indented, boolean first) {
      this.text = text;
      this.indented = indented;
      this.first = first;
    }
  }

  /** The result of scanning the value part of an attribute. */
  private static final class AttributeValue {
    @Nullable final String value;
    final boolean mustEscape;
    final String remaining;

    AttributeValue(@Nullable String value, boolean mustEscape, String remaining) {
      this.value = value;
      this.mustEscape = mustEscape;
      this.remaining = remaining;
    }
  }

  private final String file;
  private final String source; // the whole normalized source, for error context
  private final PluginRegistry plugins;
  private final boolean interpolated;

  private String input;
  private int lineno;
  private int colno;
  private final List<Token> tokens = new ArrayList<>();
  private final Deque<Mode> modes = new ArrayDeque<>();
  private boolean ended = false;
  private boolean interpolationAllowed = true;

  // Indentation: the unit is fixed by the first indented line.
  @Nullable private String indentUnit;
  private int depth = 0;

  // TAG_ATTRIBUTES mode: the unscanned part of the current attribute list.
  private String attributeSource = "";

  // PIPELESS_TEXT mode: the lines still to emit, and the indentation stripped from them.
  private final Deque<PipelessLine> pipelessLines = new ArrayDeque<>();
  private int pipelessIndent;

  private Lexer(
      String input,
      String file,
      String source,
      int line,
      int column,
      PluginRegistry plugins,
      boolean interpolated) {
    this.input = input;
    this.file = file;
    this.source = source;
    this.lineno = line;
    this.colno = column;
    this.plugins = plugins;
    this.interpolated = interpolated;
    modes.push(interpolated ? Mode.INTERPOLATION : Mode.DEFAULT);
  }

  /**
   * Returns the tokens of the given template, ending with {@code eos}.
   *
   * @throws SyntaxError.Exception at the first lexical error
   */
  public static ImmutableList<Token> lex(ParserInput input, FileOptions options)
      throws SyntaxError.Exception {
    String src = normalize(input.getContent());
    Lexer lexer =
        new Lexer(
            src,
            input.getFile(),
            src,
            options.startingLine(),
            options.startingColumn(),
            options.plugins(),
            /* interpolated= */ false);
    return lexer.tokenize();
  }

  /** Strips a byte order mark and converts all line endings to {@code \n}. */
  static String normalize(String content) {
    if (content.startsWith("\uFEFF")) {
      content = content.substring(1);
    }
    return NEWLINES.matcher(content).replaceAll("\n");
  }

  private ImmutableList<Token> tokenize() throws SyntaxError.Exception {
    while (!ended) {
      advance();
    }
    return ImmutableList.copyOf(tokens);
  }

  // Runs the first matching rule of the current mode.
  private void advance() throws SyntaxError.Exception {
    Mode mode = modes.peek();
    for (Rule rule : mode.rules()) {
      if (callRule(rule)) {
        return;
      }
    }
    throw new IllegalStateException("no lexer rule matched in mode " + mode);
  }

  // Pushes a mode and runs it until one of its rules pops it.
  private void drive(Mode mode) throws SyntaxError.Exception {
    modes.push(mode);
    int height = modes.size();
    while (!ended && modes.size() >= height) {
      advance();
    }
  }

  private void exitMode() {
    modes.pop();
  }

  @Override
  public boolean callRule(Rule rule) throws SyntaxError.Exception {
    for (Plugin.RuleHandler handler : plugins.ruleHandlers(rule)) {
      if (handler.tokenize(this)) {
        return true;
      }
    }
    return switch (rule) {
      case BLANK -> blank();
      case EOS -> eos();
      case END_INTERPOLATION -> endInterpolation();
      case YIELD -> emitEndOfLine(YIELD, TokenKind.YIELD);
      case DOCTYPE -> emitEndOfLine(DOCTYPE, TokenKind.DOCTYPE);
      case INTERPOLATION -> interpolation();
      case CASE -> caseRule();
      case WHEN -> when();
      case DEFAULT -> defaultRule();
      case EXTENDS -> extendsRule();
      case APPEND -> namedBlock(APPEND, NamedBlock.Mode.APPEND);
      case PREPEND -> namedBlock(PREPEND, NamedBlock.Mode.PREPEND);
      case BLOCK -> namedBlock(BLOCK, NamedBlock.Mode.REPLACE);
      case MIXIN_BLOCK -> emitEndOfLine(MIXIN_BLOCK, TokenKind.MIXIN_BLOCK);
      case INCLUDE -> include();
      case PATH -> path();
      case MIXIN -> mixin();
      case CALL -> call();
      case CONDITIONAL -> conditional();
      case EACH -> each();
      case WHILE -> whileRule();
      case TAG -> tag();
      case FILTER -> filter(/* inInclude= */ false);
      case BLOCK_CODE -> blockCode();
      case CODE -> code();
      case ID -> id();
      case DOT -> dot();
      case CLASS_NAME -> className();
      case ATTRIBUTES -> attrs();
      case ATTRIBUTES_BLOCK -> attributesBlock();
      case INDENT -> indent();
      case TEXT -> text();
      case TEXT_HTML -> textHtml();
      case COMMENT -> comment();
      case SLASH -> emit(SLASH, TokenKind.SLASH);
      case COLON -> emit(COLON, TokenKind.COLON);
      case FAIL -> throw fail();
      case PIPELESS_TEXT -> pipelessText(0);
      case ATTRIBUTE -> attribute();
      case END_ATTRIBUTES -> endAttributes();
      case PIPELESS_LINE -> pipelessLine();
      case END_PIPELESS_TEXT -> endPipelessText();
    };
  }

  // ==== LexerContext ====

  @Override
  public String remainingInput() {
    return input;
  }

  @Override
  public Location.Position position() {
    return new Location.Position(lineno, colno);
  }

  @Override
  public void consume(int length) {
    input = input.substring(length);
  }

  @Override
  public void incrementColumn(int n) {
    colno += n;
  }

  @Override
  public void incrementLine(int n) {
    lineno += n;
    if (n != 0) {
      colno = 1;
    }
  }

  @Override
  public Token.Builder token(TokenKind kind, @Nullable String value) {
    return Token.builder(kind, Location.at(file, lineno, colno)).value(value);
  }

  @Override
  public void push(Token.Builder token) {
    tokens.add(token.location(Location.of(file, token.location().start(), position())).build());
  }

  @Override
  public SyntaxError.Exception error(SyntaxError.Code code, String message) {
    return new SyntaxError.Exception(
        new SyntaxError(code, Location.at(file, lineno, colno), message, source));
  }

  // ==== helpers ====

  // Matches a pattern at the start of the input; on success consumes the match, moves past any
  // prefix before the first group, and returns a token whose value is the first group.
  @Nullable
  private Token.Builder scan(Pattern pattern, TokenKind kind) {
    Matcher m = pattern.matcher(input);
    if (!m.lookingAt()) {
      return null;
    }
    int len = m.end();
    String value = m.groupCount() >= 1 ? m.group(1) : null;
    Token.Builder tok = token(kind, value);
    consume(len);
    incrementColumn(len - (value == null ? 0 : value.length()));
    return tok;
  }

  // Like scan, but the match must be followed by the end of the line (trailing blanks allowed) or
  // by a colon (block expansion). The whole match is passed over.
  @Nullable
  private Token.Builder scanEndOfLine(Pattern pattern, TokenKind kind) {
    Matcher m = pattern.matcher(input);
    if (!m.lookingAt()) {
      return null;
    }
    String matched = m.group();
    String rest = input.substring(matched.length());
    int trailing;
    if (rest.startsWith(":")) {
      trailing = 0;
    } else if (END_OF_LINE.matcher(rest).lookingAt()) {
      trailing = leadingBlanks(rest, 0);
    } else {
      return null;
    }
    int whitespace = 0;
    Matcher ws = LEADING_SPACES.matcher(matched);
    if (ws.lookingAt()) {
      whitespace = ws.group(1).length();
      incrementColumn(whitespace);
    }
    input = rest.substring(trailing);
    Token.Builder tok = token(kind, m.groupCount() >= 1 ? m.group(1) : null);
    incrementColumn(matched.length() - whitespace);
    return tok;
  }

  private boolean emit(Pattern pattern, TokenKind kind) {
    Token.Builder tok = scan(pattern, kind);
    if (tok == null) {
      return false;
    }
    push(tok);
    return true;
  }

  private boolean emitEndOfLine(Pattern pattern, TokenKind kind) {
    Token.Builder tok = scanEndOfLine(pattern, kind);
    if (tok == null) {
      return false;
    }
    push(tok);
    return true;
  }

  // Returns the number of spaces and tabs at s[from:].
  private static int leadingBlanks(String s, int from) {
    int i = BLANKS.negate().indexIn(s, from);
    return (i < 0 ? s.length() : i) - from;
  }

  // Returns the indentation of a line, counted in the indentation character: the one of the
  // established unit, or else the first character of the line.
  private int lineIndentation(String line) {
    char c;
    if (indentUnit != null) {
      c = indentUnit.charAt(0);
    } else if (line.startsWith(" ") || line.startsWith("\t")) {
      c = line.charAt(0);
    } else {
      return 0;
    }
    int i = CharMatcher.isNot(c).indexIn(line);
    return i < 0 ? line.length() : i;
  }

  private int unitLength() {
    return indentUnit == null ? 0 : indentUnit.length();
  }

  private void assertExpression(String src) throws SyntaxError.Exception {
    String problem = CharacterParser.checkExpression(src);
    if (problem != null) {
      throw error(SyntaxError.Code.SYNTAX_ERROR, "Syntax Error: " + problem);
    }
  }

  private void assertNestingCorrect(String src) throws SyntaxError.Exception {
    CharacterParser.State state;
    try {
      state = CharacterParser.parse(src);
    } catch (CharacterParser.BracketException e) {
      throw error(SyntaxError.Code.BRACKET_MISMATCH, e.getMessage());
    }
    if (state.isNesting()) {
      throw error(
          SyntaxError.Code.INCORRECT_NESTING, "Nesting must match on expression `" + src + "`");
    }
  }

  private SyntaxError.Exception bracketError(
      CharacterParser.BracketException e, String endOfStringMessage) {
    return e.failure() == CharacterParser.Failure.END_OF_STRING_REACHED
        ? error(SyntaxError.Code.NO_END_BRACKET, endOfStringMessage)
        : error(SyntaxError.Code.BRACKET_MISMATCH, e.getMessage());
  }

  // Returns the bracketed expression that opens at input[skip], without the brackets. The range
  // indices are relative to the input.
  private CharacterParser.Range bracketExpression(int skip) throws SyntaxError.Exception {
    char start = skip < input.length() ? input.charAt(skip) : 0;
    if (start != '(' && start != '{' && start != '[') {
      throw error(
          SyntaxError.Code.ASSERT_FAILED, "The start character should be \"(\", \"{\" or \"[\"");
    }
    char end = CharacterParser.closing(start);
    try {
      return CharacterParser.parseUntil(input, end, skip + 1);
    } catch (CharacterParser.BracketException e) {
      moveOver(input, e.index());
      throw bracketError(
          e, "The end of the string reached with no closing bracket " + end + " found.");
    }
  }

  // Advances the position over text[0:end].
  private void moveOver(String text, int end) {
    int lastNewline = text.lastIndexOf('\n', end - 1);
    if (lastNewline < 0) {
      incrementColumn(end);
    } else {
      incrementLine(CharMatcher.is('\n').countIn(text.subSequence(0, end)));
      incrementColumn(end - lastNewline - 1);
    }
  }

  private SyntaxError.Exception fail() {
    String start = input.substring(0, Math.min(5, input.length()));
    return error(SyntaxError.Code.UNEXPECTED_TEXT, "unexpected text \"" + start + "\"");
  }

  // ==== rules ====

  // A line holding only whitespace, including the first and the last one, produces no tokens.
  private boolean blank() {
    if (!interpolated && tokens.isEmpty() && input.length() == source.length()) {
      Matcher first = BLANK_FIRST_LINE.matcher(input);
      if (first.lookingAt()) {
        consume(first.end());
        incrementColumn(first.end());
        return true;
      }
    }
    Matcher m = BLANK.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    consume(m.end());
    incrementLine(1);
    if (input.isEmpty()) {
      incrementColumn(m.group(1).length());
    }
    return true;
  }

  private boolean eos() throws SyntaxError.Exception {
    if (!input.isEmpty()) {
      return false;
    }
    if (interpolated) {
      throw error(
          SyntaxError.Code.NO_END_BRACKET,
          "End of line was reached with no closing bracket for interpolation.");
    }
    for (; depth > 0; depth--) {
      push(token(TokenKind.OUTDENT, null));
    }
    push(token(TokenKind.EOS, null));
    ended = true;
    return true;
  }

  private boolean endInterpolation() {
    if (!interpolated || !input.startsWith("]")) {
      return false;
    }
    consume(1);
    ended = true;
    return true;
  }

  private boolean interpolation() throws SyntaxError.Exception {
    if (!input.startsWith("#{")) {
      return false;
    }
    CharacterParser.Range match = bracketExpression(1);
    consume(match.end + 1);
    Token.Builder tok = token(TokenKind.INTERPOLATION, match.src);
    incrementColumn(2);
    assertExpression(match.src);
    List<String> lines = Splitter.on('\n').splitToList(match.src);
    incrementLine(lines.size() - 1);
    incrementColumn(lines.get(lines.size() - 1).length() + 1);
    push(tok);
    return true;
  }

  private boolean caseRule() throws SyntaxError.Exception {
    Token.Builder tok = scanEndOfLine(CASE, TokenKind.CASE);
    if (tok != null) {
      incrementColumn(-tok.value().length());
      assertExpression(tok.value());
      incrementColumn(tok.value().length());
      push(tok);
      return true;
    }
    if (scan(CASE_KEYWORD, TokenKind.CASE) != null) {
      throw error(SyntaxError.Code.NO_CASE_EXPRESSION, "missing expression for case");
    }
    return false;
  }

  private boolean when() throws SyntaxError.Exception {
    Token.Builder tok = scanEndOfLine(WHEN, TokenKind.WHEN);
    if (tok != null) {
      String value = tok.value();
      // A colon inside a string or brackets does not end the expression.
      while (isOpen(value)) {
        int eol = input.indexOf('\n');
        Matcher rest = WHEN_CONTINUATION.matcher(eol < 0 ? input : input.substring(0, eol));
        if (!rest.find()) {
          break;
        }
        value += rest.group();
        consume(rest.end());
        incrementColumn(rest.end());
      }
      tok.value(value);
      incrementColumn(-value.length());
      assertExpression(value);
      incrementColumn(value.length());
      push(tok);
      return true;
    }
    if (scan(WHEN_KEYWORD, TokenKind.WHEN) != null) {
      throw error(SyntaxError.Code.NO_WHEN_EXPRESSION, "missing expression for when");
    }
    return false;
  }

  private static boolean isOpen(String src) {
    try {
      CharacterParser.State state = CharacterParser.parse(src);
      return state.isNesting() || state.isString();
    } catch (CharacterParser.BracketException e) {
      return false;
    }
  }

  private boolean defaultRule() throws SyntaxError.Exception {
    if (emitEndOfLine(DEFAULT, TokenKind.DEFAULT)) {
      return true;
    }
    if (scan(DEFAULT_KEYWORD, TokenKind.DEFAULT) != null) {
      throw error(
          SyntaxError.Code.DEFAULT_WITH_EXPRESSION,
          "`default` cannot have an expression, it is the fallback of a case");
    }
    return false;
  }

  private boolean extendsRule() throws SyntaxError.Exception {
    if (emit(EXTENDS, TokenKind.EXTENDS)) {
      if (!callRule(Rule.PATH)) {
        throw error(SyntaxError.Code.NO_EXTENDS_PATH, "missing path for extends");
      }
      return true;
    }
    if (scan(EXTENDS_KEYWORD, TokenKind.EXTENDS) != null) {
      throw error(SyntaxError.Code.MALFORMED_EXTENDS, "malformed extends");
    }
    return false;
  }

  private boolean namedBlock(Pattern pattern, NamedBlock.Mode mode) {
    Matcher m = pattern.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    String matched = m.group();
    String name = m.group(1).trim();
    // A trailing "// comment" is left in the input for the comment rule.
    int end = matched.length();
    int comment = name.indexOf("//");
    if (comment >= 0) {
      name = name.substring(0, comment).trim();
      end = matched.indexOf("//", m.start(1));
    }
    if (name.isEmpty()) {
      return false;
    }
    Token.Builder tok = token(TokenKind.BLOCK, name).mode(mode);
    int len = end;
    while (len > 0 && WHITESPACE.matches(input.charAt(len - 1))) {
      len--;
    }
    incrementColumn(len);
    push(tok);
    consume(end);
    incrementColumn(end - len);
    return true;
  }

  private boolean include() throws SyntaxError.Exception {
    if (emit(INCLUDE, TokenKind.INCLUDE)) {
      while (filter(/* inInclude= */ true)) {}
      if (!callRule(Rule.PATH)) {
        if (NON_SPACE.matcher(input).lookingAt()) {
          throw fail();
        }
        throw error(SyntaxError.Code.NO_INCLUDE_PATH, "missing path for include");
      }
      return true;
    }
    if (scan(INCLUDE_KEYWORD, TokenKind.INCLUDE) != null) {
      throw error(SyntaxError.Code.MALFORMED_INCLUDE, "malformed include");
    }
    return false;
  }

  private boolean path() {
    Token.Builder tok = scanEndOfLine(PATH, TokenKind.PATH);
    if (tok == null) {
      return false;
    }
    String path = tok.value().trim();
    if (path.isEmpty()) {
      return false;
    }
    push(tok.value(path));
    return true;
  }

  private boolean mixin() {
    Matcher m = MIXIN.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    consume(m.end());
    Token.Builder tok = token(TokenKind.MIXIN, m.group(1)).args(m.group(2));
    incrementColumn(m.end());
    push(tok);
    return true;
  }

  private boolean call() throws SyntaxError.Exception {
    Matcher m = CALL.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    Token.Builder tok;
    int increment;
    if (m.group(3) != null) {
      increment = m.end();
      consume(increment);
      tok = token(TokenKind.CALL, m.group(3));
    } else {
      CharacterParser.Range match = bracketExpression(2 + m.group(1).length());
      increment = match.end + 1;
      consume(increment);
      assertExpression(match.src);
      tok = token(TokenKind.CALL, "#{" + match.src + "}");
    }
    incrementColumn(increment);

    // An argument list that reads like attributes is left for the attribute rule.
    Matcher args = CALL_ARGUMENTS.matcher(input);
    if (args.lookingAt()) {
      CharacterParser.Range range = bracketExpression(args.end() - 1);
      if (!ATTRIBUTE_LIKE.matcher(range.src).lookingAt()) {
        incrementColumn(args.end());
        consume(range.end + 1);
        tok.args(range.src);
        assertExpression("[" + range.src + "]");
        moveOver(range.src, range.src.length());
        incrementColumn(1);
      }
    }
    push(tok);
    return true;
  }

  private boolean conditional() throws SyntaxError.Exception {
    Matcher m = CONDITIONAL.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    consume(m.end());
    String type = m.group(1);
    String js = m.group(2).trim();
    Token.Builder tok;
    incrementColumn(m.end() - js.length());
    switch (type) {
      case "if" -> {
        tok = token(TokenKind.IF, js);
        assertExpression(js);
      }
      case "unless" -> {
        tok = token(TokenKind.IF, "!(" + js + ")");
        assertExpression(js);
      }
      case "else if" -> {
        tok = token(TokenKind.ELSE_IF, js);
        assertExpression(js);
      }
      default -> {
        if (!js.isEmpty()) {
          throw error(
              SyntaxError.Code.ELSE_CONDITION,
              "`else` cannot have a condition, perhaps you meant `else if`");
        }
        tok = token(TokenKind.ELSE, null);
      }
    }
    // The token starts at the keyword.
    tok.location(Location.at(file, lineno, colno - (m.end() - js.length())));
    incrementColumn(js.length());
    push(tok);
    return true;
  }

  private boolean each() throws SyntaxError.Exception {
    Matcher m = EACH.matcher(input);
    if (m.lookingAt()) {
      consume(m.end());
      Token.Builder tok = token(TokenKind.EACH, m.group(1)).key(m.group(2));
      String code = m.group(3);
      incrementColumn(m.end() - code.length());
      assertExpression(code);
      tok.code(code);
      incrementColumn(code.length());
      push(tok);
      return true;
    }
    String name = input.startsWith("each") ? "each" : "for";
    if (scan(EACH_KEYWORD, TokenKind.EACH) != null) {
      throw error(
          SyntaxError.Code.MALFORMED_EACH,
          String.format(
              "This `%1$s` has a syntax error. `%1$s` statements should be of the form: "
                  + "`%1$s VARIABLE_NAME in JS_EXPRESSION`",
              name));
    }
    if (DASHED_EACH.matcher(input).lookingAt()) {
      throw error(
          SyntaxError.Code.MALFORMED_EACH,
          "Pug each and for should no longer be prefixed with a dash (\"-\"). They are pug"
              + " keywords and not part of JavaScript.");
    }
    return false;
  }

  private boolean whileRule() throws SyntaxError.Exception {
    Matcher m = WHILE.matcher(input);
    if (m.lookingAt()) {
      consume(m.end());
      assertExpression(m.group(1));
      Token.Builder tok = token(TokenKind.WHILE, m.group(1));
      incrementColumn(m.end());
      push(tok);
      return true;
    }
    if (scan(WHILE_KEYWORD, TokenKind.WHILE) != null) {
      throw error(SyntaxError.Code.NO_WHILE_EXPRESSION, "missing expression for while");
    }
    return false;
  }

  private boolean tag() {
    Token.Builder tok = scan(TAG, TokenKind.TAG);
    if (tok == null) {
      return false;
    }
    incrementColumn(tok.value().length());
    push(tok);
    return true;
  }

  private boolean filter(boolean inInclude) throws SyntaxError.Exception {
    Token.Builder tok = scan(FILTER, TokenKind.FILTER);
    if (tok == null) {
      return false;
    }
    incrementColumn(tok.value().length());
    push(tok);
    callRule(Rule.ATTRIBUTES);
    if (!inInclude) {
      interpolationAllowed = false;
      callRule(Rule.PIPELESS_TEXT);
    }
    return true;
  }

  private boolean blockCode() throws SyntaxError.Exception {
    Token.Builder tok = scanEndOfLine(BLOCK_CODE, TokenKind.BLOCK_CODE);
    if (tok == null) {
      return false;
    }
    push(tok);
    interpolationAllowed = false;
    callRule(Rule.PIPELESS_TEXT);
    return true;
  }

  private boolean code() throws SyntaxError.Exception {
    Matcher m = CODE.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    String flags = m.group(1);
    String code = m.group(2);
    int shortened = 0;
    if (interpolated) {
      CharacterParser.Range parsed;
      try {
        parsed = CharacterParser.parseUntil(code, ']', 0);
      } catch (CharacterParser.BracketException e) {
        incrementColumn(m.end() - code.length() + e.index());
        throw bracketError(
            e, "End of line was reached with no closing bracket for interpolation.");
      }
      shortened = code.length() - parsed.end;
      code = parsed.src;
    }
    consume(m.end() - shortened);
    boolean buffer = flags.charAt(0) == '=' || (flags.length() > 1 && flags.charAt(1) == '=');
    Token.Builder tok =
        token(TokenKind.CODE, code).mustEscape(flags.charAt(0) == '=').buffer(buffer);
    incrementColumn(m.end() - m.group(2).length());
    if (buffer) {
      assertExpression(code);
    }
    incrementColumn(code.length());
    push(tok);
    return true;
  }

  private boolean id() throws SyntaxError.Exception {
    Token.Builder tok = scan(ID, TokenKind.ID);
    if (tok != null) {
      incrementColumn(tok.value().length());
      push(tok);
      return true;
    }
    if (input.startsWith("#")) {
      throw error(SyntaxError.Code.INVALID_ID, "\"" + nameFragment() + "\" is not a valid ID.");
    }
    return false;
  }

  // Returns the word after the first character of the input, for error messages.
  private String nameFragment() {
    Matcher m = NAME_FRAGMENT.matcher(input.substring(1));
    return m.lookingAt() ? m.group() : "";
  }

  private boolean dot() throws SyntaxError.Exception {
    if (!emitEndOfLine(DOT, TokenKind.DOT)) {
      return false;
    }
    callRule(Rule.PIPELESS_TEXT);
    return true;
  }

  private boolean className() throws SyntaxError.Exception {
    Token.Builder tok = scan(CLASS_NAME, TokenKind.CLASS);
    if (tok != null) {
      incrementColumn(tok.value().length());
      push(tok);
      return true;
    }
    if (DIGITS_CLASS_NAME.matcher(input).lookingAt()) {
      throw error(
          SyntaxError.Code.INVALID_CLASS_NAME,
          "Class names must contain at least one letter or underscore.");
    }
    if (input.startsWith(".")) {
      throw error(
          SyntaxError.Code.INVALID_CLASS_NAME,
          "\""
              + nameFragment()
              + "\" is not a valid class name.  Class names can only contain \"_\", \"-\", a-z"
              + " and 0-9, and must contain at least one of \"_\", or a-z");
    }
    return false;
  }

  private boolean attrs() throws SyntaxError.Exception {
    if (!input.startsWith("(")) {
      return false;
    }
    Token.Builder tok = token(TokenKind.START_ATTRIBUTES, null);
    int index = bracketExpression(0).end;
    String str = input.substring(1, index);
    incrementColumn(1);
    push(tok);
    assertNestingCorrect(str);
    consume(index + 1);
    attributeSource = str;
    drive(Mode.TAG_ATTRIBUTES);
    return true;
  }

  // TAG_ATTRIBUTES: skips separating whitespace, and closes the list when nothing else remains.
  private boolean endAttributes() {
    int i = 0;
    for (; i < attributeSource.length(); i++) {
      char c = attributeSource.charAt(i);
      if (!WHITESPACE.matches(c)) {
        break;
      }
      advanceOver(c);
    }
    attributeSource = attributeSource.substring(i);
    if (!attributeSource.isEmpty()) {
      return false;
    }
    Token.Builder tok = token(TokenKind.END_ATTRIBUTES, null);
    incrementColumn(1);
    push(tok);
    exitMode();
    return true;
  }

  private void advanceOver(char c) {
    if (c == '\n') {
      incrementLine(1);
    } else {
      incrementColumn(1);
    }
  }

  // TAG_ATTRIBUTES: lexes one attribute, and the comma after it.
  private boolean attribute() throws SyntaxError.Exception {
    String str = attributeSource;
    Token.Builder tok = token(TokenKind.ATTRIBUTE, null);
    int i = 0;
    char quote = 0;
    if (QUOTES.matches(str.charAt(0))) {
      quote = str.charAt(0);
      incrementColumn(1);
      i++;
    }
    StringBuilder key = new StringBuilder();
    for (; i < str.length(); i++) {
      char c = str.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          incrementColumn(1);
          i++;
          break;
        }
      } else if (WHITESPACE.matches(c) || c == '!' || c == '=' || c == ',') {
        break;
      }
      key.append(c);
      advanceOver(c);
    }
    tok.name(key.toString());

    AttributeValue value = attributeValue(str.substring(i));
    if (value.value != null) {
      tok.value(value.value).mustEscape(value.mustEscape);
    } else {
      // A bare attribute, such as a boolean one.
      tok.value("true").mustEscape(true);
    }
    str = value.remaining;
    push(tok);

    for (i = 0; i < str.length(); i++) {
      char c = str.charAt(i);
      if (!WHITESPACE.matches(c)) {
        break;
      }
      advanceOver(c);
    }
    if (i < str.length() && str.charAt(i) == ',') {
      incrementColumn(1);
      i++;
    }
    attributeSource = str.substring(i);
    return true;
  }

  private AttributeValue attributeValue(String str) throws SyntaxError.Exception {
    boolean escapeAttr = true;
    int col = colno;
    int line = lineno;
    int i = 0;

    // whitespace before the equals sign
    for (; i < str.length(); i++) {
      char c = str.charAt(i);
      if (!WHITESPACE.matches(c)) {
        break;
      }
      if (c == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }
    if (i == str.length()) {
      return new AttributeValue(null, true, str);
    }
    if (str.charAt(i) == '!') {
      escapeAttr = false;
      col++;
      i++;
      if (i >= str.length() || str.charAt(i) != '=') {
        throw error(
            SyntaxError.Code.INVALID_KEY_CHARACTER,
            "Unexpected character " + (i < str.length() ? str.charAt(i) : "") + " expected `=`");
      }
    }
    if (str.charAt(i) != '=') {
      // div("foo"bar)
      if (i == 0 && !WHITESPACE.matches(str.charAt(0)) && str.charAt(0) != ',') {
        throw error(
            SyntaxError.Code.INVALID_KEY_CHARACTER,
            "Unexpected character " + str.charAt(0) + " expected `=`");
      }
      return new AttributeValue(null, true, str);
    }

    lineno = line;
    colno = col + 1;
    i++;

    // whitespace before the value
    for (; i < str.length(); i++) {
      char c = str.charAt(i);
      if (!WHITESPACE.matches(c)) {
        break;
      }
      advanceOver(c);
    }
    line = lineno;
    col = colno;

    StringBuilder val = new StringBuilder();
    CharacterParser.State state = new CharacterParser.State();
    for (; i < str.length(); i++) {
      char c = str.charAt(i);
      if (!(state.isNesting() || state.isString())) {
        if (WHITESPACE.matches(c)) {
          // The value ends at whitespace unless what follows continues the expression.
          boolean done = false;
          int x = i;
          for (; x < str.length(); x++) {
            char next = str.charAt(x);
            if (!WHITESPACE.matches(next)) {
              boolean continues =
                  CharacterParser.isPunctuator(next)
                      && !QUOTES.matches(next)
                      && next != ':'
                      && !str.startsWith("...", x);
              if (!continues && CharacterParser.isCompleteExpression(val.toString())) {
                done = true;
              }
              break;
            }
          }
          if (done || x == str.length()) {
            break;
          }
        }
        if (c == ',' && CharacterParser.isCompleteExpression(val.toString())) {
          break;
        }
      }
      try {
        state.parseChar(c, i);
      } catch (CharacterParser.BracketException e) {
        throw error(SyntaxError.Code.BRACKET_MISMATCH, e.getMessage());
      }
      val.append(c);
      if (c == '\n') {
        line++;
        col = 1;
      } else {
        col++;
      }
    }

    assertExpression(val.toString());
    lineno = line;
    colno = col;
    return new AttributeValue(val.toString(), escapeAttr, str.substring(i));
  }

  private boolean attributesBlock() throws SyntaxError.Exception {
    if (!ATTRIBUTES_BLOCK.matcher(input).lookingAt()) {
      return false;
    }
    int consumed = "&attributes".length();
    consume(consumed);
    Token.Builder tok = token(TokenKind.AMPERSAND_ATTRIBUTES, null);
    incrementColumn(consumed);
    CharacterParser.Range args = bracketExpression(0);
    consumed = args.end + 1;
    consume(consumed);
    tok.value(args.src);
    incrementColumn(consumed);
    push(tok);
    return true;
  }

  private boolean indent() throws SyntaxError.Exception {
    if (!input.startsWith("\n")) {
      return false;
    }
    int n = leadingBlanks(input, 1);
    String ws = input.substring(1, 1 + n);
    incrementLine(1);
    consume(n + 1);

    // A line holding only whitespace is blank, whatever its indentation.
    if (input.isEmpty() || input.startsWith("\n")) {
      incrementColumn(n);
      interpolationAllowed = true;
      return true;
    }

    int level = indentationLevel(ws);
    if (level > depth + 1) {
      colno = 1 + (depth + 1) * unitLength();
      throw error(
          SyntaxError.Code.INVALID_INDENTATION,
          "Invalid indentation, a line can be indented at most one level deeper than the previous"
              + " one");
    }
    if (level > depth) {
      Token.Builder tok = token(TokenKind.INDENT, String.valueOf(n));
      colno = 1 + n;
      push(tok);
      depth++;
    } else if (level < depth) {
      while (depth > level) {
        depth--;
        colno = 1;
        Token.Builder tok = token(TokenKind.OUTDENT, null);
        colno = 1 + depth * unitLength();
        push(tok);
      }
    } else {
      Token.Builder tok = token(TokenKind.NEWLINE, null);
      colno = 1 + n;
      push(tok);
    }
    interpolationAllowed = true;
    return true;
  }

  // Returns the depth of a line with the given leading whitespace, fixing the indentation unit if
  // this is the first indented line.
  private int indentationLevel(String ws) throws SyntaxError.Exception {
    if (ws.isEmpty()) {
      return 0;
    }
    char c = indentUnit != null ? indentUnit.charAt(0) : ws.charAt(0);
    int foreign = CharMatcher.isNot(c).indexIn(ws);
    if (foreign >= 0) {
      colno = 1 + foreign;
      throw error(
          SyntaxError.Code.INVALID_INDENTATION,
          "Invalid indentation, you can use tabs or spaces but not both");
    }
    if (indentUnit == null) {
      indentUnit = ws;
      return 1;
    }
    int unit = indentUnit.length();
    int level = ws.length() / unit;
    if (ws.length() % unit != 0) {
      colno = 1 + level * unit;
      throw error(
          SyntaxError.Code.INCONSISTENT_INDENTATION,
          String.format(
              "Inconsistent indentation. Expecting either %d or %d %s.",
              level * unit, (level + 1) * unit, c == '\t' ? "tabs" : "spaces"));
    }
    return level;
  }

  private boolean text() throws SyntaxError.Exception {
    Token.Builder tok = scan(PIPED_TEXT, TokenKind.TEXT);
    if (tok == null) {
      tok = scan(SPACE_TEXT, TokenKind.TEXT);
    }
    if (tok == null) {
      tok = scan(EMPTY_PIPE, TokenKind.TEXT);
    }
    if (tok == null) {
      return false;
    }
    addText(TokenKind.TEXT, tok.value(), null, 0);
    return true;
  }

  private boolean textHtml() throws SyntaxError.Exception {
    Token.Builder tok = scan(TEXT_HTML, TokenKind.TEXT_HTML);
    if (tok == null) {
      return false;
    }
    addText(TokenKind.TEXT_HTML, tok.value(), null, 0);
    return true;
  }

  private boolean comment() throws SyntaxError.Exception {
    Matcher m = COMMENT.matcher(input);
    if (!m.lookingAt()) {
      return false;
    }
    consume(m.end());
    boolean buffer = m.group(1) == null;
    Token.Builder tok = token(TokenKind.COMMENT, m.group(2)).buffer(buffer);
    interpolationAllowed = buffer;
    incrementColumn(m.end());
    push(tok);
    callRule(Rule.PIPELESS_TEXT);
    return true;
  }

  /**
   * Emits text, splitting out {@code #{...}} and {@code !{...}} interpolated code and
   * {@code #[...]} tag interpolations. {@code prefix} is literal text already scanned (null at the
   * top level), and {@code escaped} counts the backslashes dropped from it, which still occupy
   * columns.
   */
  private void addText(TokenKind kind, String value, @Nullable String prefix, int escaped)
      throws SyntaxError.Exception {
    if (prefix != null && prefix.isEmpty() && value.isEmpty()) {
      return;
    }
    if (prefix == null) {
      prefix = "";
    }
    int none = Integer.MAX_VALUE;
    int indexOfEnd = interpolated ? orNone(value.indexOf(']')) : none;
    int indexOfStart = interpolationAllowed ? orNone(value.indexOf("#[")) : none;
    int indexOfEscaped = interpolationAllowed ? orNone(value.indexOf("\\#[")) : none;
    Matcher interp = STRING_INTERPOLATION.matcher(value);
    int indexOfStringInterp = interpolationAllowed && interp.find() ? interp.start() : none;

    if (indexOfEscaped != none
        && indexOfEscaped < indexOfEnd
        && indexOfEscaped < indexOfStart
        && indexOfEscaped < indexOfStringInterp) {
      addText(
          kind,
          value.substring(indexOfEscaped + 3),
          prefix + value.substring(0, indexOfEscaped) + "#[",
          escaped + 1);
      return;
    }

    if (indexOfStart != none
        && indexOfStart < indexOfEnd
        && indexOfStart < indexOfEscaped
        && indexOfStart < indexOfStringInterp) {
      Token.Builder tok = token(kind, prefix + value.substring(0, indexOfStart));
      incrementColumn(prefix.length() + indexOfStart + escaped);
      push(tok);
      tok = token(TokenKind.START_PUG_INTERPOLATION, null);
      incrementColumn(2);
      push(tok);
      Lexer child =
          new Lexer(
              value.substring(indexOfStart + 2),
              file,
              source,
              lineno,
              colno,
              plugins,
              /* interpolated= */ true);
      tokens.addAll(child.tokenize());
      colno = child.colno;
      tok = token(TokenKind.END_PUG_INTERPOLATION, null);
      incrementColumn(1);
      push(tok);
      addText(kind, child.input, null, 0);
      return;
    }

    if (indexOfEnd != none
        && indexOfEnd < indexOfStart
        && indexOfEnd < indexOfEscaped
        && indexOfEnd < indexOfStringInterp) {
      if (!prefix.isEmpty() || indexOfEnd > 0) {
        addText(kind, value.substring(0, indexOfEnd), prefix, escaped);
      }
      ended = true;
      input = value.substring(indexOfEnd + 1) + input;
      return;
    }

    if (indexOfStringInterp != none) {
      if (interp.group(1) != null) {
        addText(
            kind,
            value.substring(indexOfStringInterp + 3),
            prefix + value.substring(0, indexOfStringInterp) + interp.group(2) + "{",
            escaped + 1);
        return;
      }
      String before = value.substring(0, indexOfStringInterp);
      if (!prefix.isEmpty() || !before.isEmpty()) {
        before = prefix + before;
        Token.Builder tok = token(kind, before);
        incrementColumn(before.length() + escaped);
        push(tok);
      }

      String rest = interp.group(3);
      Token.Builder tok = token(TokenKind.INTERPOLATED_CODE, null);
      incrementColumn(2);
      CharacterParser.Range range;
      try {
        range = CharacterParser.parseUntil(rest, '}', 0);
      } catch (CharacterParser.BracketException e) {
        incrementColumn(e.index());
        throw bracketError(
            e, "End of line was reached with no closing bracket for interpolation.");
      }
      tok.mustEscape(interp.group(2).equals("#")).buffer(true).value(range.src);
      assertExpression(range.src);
      if (range.end + 1 < rest.length()) {
        incrementColumn(range.end + 1);
        push(tok);
        addText(kind, rest.substring(range.end + 1), null, 0);
      } else {
        incrementColumn(rest.length());
        push(tok);
      }
      return;
    }

    value = prefix + value;
    Token.Builder tok = token(kind, value);
    incrementColumn(value.length() + escaped);
    push(tok);
  }

  private static int orNone(int index) {
    return index < 0 ? Integer.MAX_VALUE : index;
  }

  // Starts a pipeless text block if the following lines are indented deeper than the current
  // depth. A line indented less than the first one, but still deeper than the current depth,
  // restarts the scan with its indentation.
  private boolean pipelessText(int indents) throws SyntaxError.Exception {
    while (callRule(Rule.BLANK)) {}
    if (!input.startsWith("\n")) {
      return false;
    }
    int owning = depth * unitLength();
    if (indents == 0) {
      int eol = input.indexOf('\n', 1);
      indents = lineIndentation(input.substring(1, eol < 0 ? input.length() : eol));
    }
    if (indents <= owning) {
      return false;
    }

    List<String> lines = new ArrayList<>();
    List<Boolean> indented = new ArrayList<>();
    int ptr = 0;
    boolean isMatch;
    do {
      int eol = input.indexOf('\n', ptr + 1);
      String str = input.substring(ptr + 1, eol < 0 ? input.length() : eol);
      int lineIndents = lineIndentation(str);
      isMatch = lineIndents >= indents;
      indented.add(isMatch);
      isMatch = isMatch || CharMatcher.whitespace().matchesAllOf(str);
      if (isMatch) {
        ptr += str.length() + 1;
        lines.add(str.length() > indents ? str.substring(indents) : "");
      } else if (lineIndents > owning) {
        return pipelessText(lineIndents);
      }
    } while (input.length() - ptr > 0 && isMatch);

    Token.Builder start = token(TokenKind.START_PIPELESS_TEXT, null);
    push(start);
    consume(ptr);
    while (input.isEmpty() && !lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    for (int i = 0; i < lines.size(); i++) {
      pipelessLines.add(new PipelessLine(lines.get(i), indented.get(i), i == 0));
    }
    pipelessIndent = indents;
    drive(Mode.PIPELESS_TEXT);
    return true;
  }

  // PIPELESS_TEXT: emits one line of the block.
  private boolean pipelessLine() throws SyntaxError.Exception {
    PipelessLine line = pipelessLines.poll();
    if (line == null) {
      return false;
    }
    incrementLine(1);
    Token.Builder newline = line.first ? null : token(TokenKind.NEWLINE, null);
    if (line.indented) {
      incrementColumn(pipelessIndent);
    }
    if (newline != null) {
      push(newline);
    }
    addText(TokenKind.TEXT, line.text, null, 0);
    return true;
  }

  // PIPELESS_TEXT: closes the block once every line is out.
  private boolean endPipelessText() {
    if (!pipelessLines.isEmpty()) {
      return false;
    }
    push(token(TokenKind.END_PIPELESS_TEXT, null));
    exitMode();
    return true;
  }
}
