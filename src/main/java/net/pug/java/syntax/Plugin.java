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

import com.google.common.collect.ImmutableMap;
import javax.annotation.Nullable;

/**
 * A Plugin extends the lexer and parser with handlers for new syntax.
 *
 * <p>Lexer handlers are keyed by {@link Lexer.Rule} and are tried, in registration order, before
 * the built-in rule of that name. Parser handlers are keyed by an extension point (the method that
 * declares them) and a token kind; the parser consults them only for tokens it does not handle
 * itself at that point. Each (extension point, token kind) pair may be claimed by at most one
 * plugin, see {@link PluginRegistry#of}.
 */
public interface Plugin {

  /** Tokenizes input the built-in rules do not recognize. */
  @FunctionalInterface
  interface RuleHandler {
    /** Returns true if the handler consumed input and emitted tokens. */
    boolean tokenize(LexerContext lexer) throws SyntaxError.Exception;
  }

  /** Parses an expression (statement-level construct) starting at an unrecognized token. */
  @FunctionalInterface
  interface ExpressionHandler {
    /** Returns the parsed node, or null to decline. */
    @Nullable
    Node parse(ParserContext parser) throws SyntaxError.Exception;
  }

  /** Adds nodes for an unrecognized token within inline text or a case body. */
  @FunctionalInterface
  interface NodeListHandler {
    /** Returns true if the token was consumed and parsing of the list should continue. */
    boolean handle(ParserContext parser, Block.Builder nodes) throws SyntaxError.Exception;
  }

  /** Handles an unrecognized token in the attribute position or the body position of a tag. */
  @FunctionalInterface
  interface ElementHandler {
    /** Returns true if the token was consumed. */
    boolean handle(ParserContext parser, ElementBuilder element) throws SyntaxError.Exception;
  }

  /** Converts an unrecognized, already consumed, token of a code block into code text. */
  @FunctionalInterface
  interface BlockCodeHandler {
    /** Returns the text to append, or null to decline. */
    @Nullable
    String handle(ParserContext parser, Token token) throws SyntaxError.Exception;
  }

  /** Handles an unrecognized, already consumed, token of a pipeless text block. */
  @FunctionalInterface
  interface TextBlockHandler {
    /** Returns true if the token was handled. */
    boolean handle(ParserContext parser, Block.Builder block, Token token)
        throws SyntaxError.Exception;
  }

  default ImmutableMap<Lexer.Rule, RuleHandler> lexerRules() {
    return ImmutableMap.of();
  }

  /** Handlers for statement-level tokens. */
  default ImmutableMap<TokenKind, ExpressionHandler> expressionTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens within a run of inline text. */
  default ImmutableMap<TokenKind, NodeListHandler> textTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens in the attribute position of a tag. */
  default ImmutableMap<TokenKind, ElementHandler> tagAttributeTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens in the body position of a tag. */
  default ImmutableMap<TokenKind, ElementHandler> tagTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens within the body of a case. */
  default ImmutableMap<TokenKind, NodeListHandler> caseTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens within a code block. */
  default ImmutableMap<TokenKind, BlockCodeHandler> blockCodeTokens() {
    return ImmutableMap.of();
  }

  /** Handlers for tokens within a pipeless text block. */
  default ImmutableMap<TokenKind, TextBlockHandler> textBlockTokens() {
    return ImmutableMap.of();
  }
}
