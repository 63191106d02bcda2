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

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link PluginRegistry}. */
@RunWith(JUnit4.class)
public final class PluginRegistryTest {

  private static final Plugin.RuleHandler NEVER = lexer -> false;

  private static Plugin slashExpression(String value) {
    return new Plugin() {
      @Override
      public ImmutableMap<TokenKind, ExpressionHandler> expressionTokens() {
        return ImmutableMap.of(
            TokenKind.SLASH, parser -> new Comment(parser.advance().location(), value, false));
      }
    };
  }

  private static Plugin failRule(Plugin.RuleHandler handler) {
    return new Plugin() {
      @Override
      public ImmutableMap<Lexer.Rule, RuleHandler> lexerRules() {
        return ImmutableMap.of(Lexer.Rule.FAIL, handler);
      }
    };
  }

  @Test
  public void testEmpty() {
    assertThat(PluginRegistry.EMPTY.isEmpty()).isTrue();
    assertThat(PluginRegistry.of().isEmpty()).isTrue();
    assertThat(
            PluginRegistry.EMPTY.handler(
                PluginRegistry.ExtensionPoint.EXPRESSION_TOKENS,
                TokenKind.SLASH,
                Plugin.ExpressionHandler.class))
        .isNull();
  }

  @Test
  public void testHandlerLookup() {
    PluginRegistry registry = PluginRegistry.of(slashExpression("x"));
    assertThat(registry.isEmpty()).isFalse();
    assertThat(
            registry.handler(
                PluginRegistry.ExtensionPoint.EXPRESSION_TOKENS,
                TokenKind.SLASH,
                Plugin.ExpressionHandler.class))
        .isNotNull();
    assertThat(
            registry.handler(
                PluginRegistry.ExtensionPoint.TAG_TOKENS,
                TokenKind.SLASH,
                Plugin.ElementHandler.class))
        .isNull();
  }

  @Test
  public void testConflictingHandlers() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> PluginRegistry.of(slashExpression("a"), slashExpression("b")));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Multiple plugin handlers found for context \"expressionTokens\", token type"
                + " \"slash\"");
  }

  @Test
  public void testLexerRulesChainInOrder() {
    Plugin.RuleHandler second = lexer -> false;
    PluginRegistry registry = PluginRegistry.of(failRule(NEVER), failRule(second));
    assertThat(registry.ruleHandlers(Lexer.Rule.FAIL)).containsExactly(NEVER, second).inOrder();
    assertThat(registry.ruleHandlers(Lexer.Rule.TAG)).isEmpty();
  }
}
