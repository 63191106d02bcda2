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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import javax.annotation.Nullable;

/**
 * The result of lexing and parsing one template: its tokens and syntax tree, or the error that
 * stopped it.
 *
 * <p>Unlike {@link Lexer#lex} and {@link Parser#parse}, which throw, {@link #parse} records the
 * error so that callers can inspect {@link #errors} after the fact.
 */
public final class PugFile {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final ParserInput input;
  private final FileOptions options;
  private final ImmutableList<Token> tokens;
  @Nullable private final Block root;
  private final ImmutableList<SyntaxError> errors;

  private PugFile(
      ParserInput input,
      FileOptions options,
      ImmutableList<Token> tokens,
      @Nullable Block root,
      ImmutableList<SyntaxError> errors) {
    this.input = input;
    this.options = options;
    this.tokens = tokens;
    this.root = root;
    this.errors = errors;
  }

  /** Lexes and parses a template. */
  public static PugFile parse(ParserInput input, FileOptions options) {
    ImmutableList<Token> tokens;
    try {
      tokens = Lexer.lex(input, options);
    } catch (SyntaxError.Exception e) {
      logger.atFine().log("lexing %s failed: %s", input.getFile(), e.error());
      return new PugFile(input, options, ImmutableList.of(), null, e.errors());
    }
    logger.atFine().log("%s: %d tokens", input.getFile(), tokens.size());
    try {
      Block root = Parser.parse(tokens, input, options);
      return new PugFile(input, options, tokens, root, ImmutableList.of());
    } catch (SyntaxError.Exception e) {
      logger.atFine().log("parsing %s failed: %s", input.getFile(), e.error());
      return new PugFile(input, options, tokens, null, e.errors());
    }
  }

  /** Lexes and parses a template with the default options. */
  public static PugFile parse(ParserInput input) {
    return parse(input, FileOptions.DEFAULT);
  }

  /** Reports whether the template was lexed and parsed without error. */
  public boolean ok() {
    return errors.isEmpty();
  }

  /** Returns the error that stopped lexing or parsing, if any; there is at most one. */
  public ImmutableList<SyntaxError> errors() {
    return errors;
  }

  /**
   * Returns the root block.
   *
   * @throws IllegalStateException if the template has an error
   */
  public Block getRoot() {
    checkState(root != null, "%s has errors: %s", input.getFile(), errors);
    return root;
  }

  /** Returns the tokens, which are empty if lexing failed. */
  public ImmutableList<Token> getTokens() {
    return tokens;
  }

  public String getFile() {
    return input.getFile();
  }

  public FileOptions getOptions() {
    return options;
  }
}
