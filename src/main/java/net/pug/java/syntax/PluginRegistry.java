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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;
import java.util.Arrays;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * An immutable index of the handlers contributed by a list of {@link Plugin}s.
 *
 * <p>Lexer rule handlers accumulate in plugin order. Parser handlers are indexed by extension
 * point and token kind, and a pair claimed by two plugins is a configuration error detected when
 * the registry is built, before any template is parsed.
 */
public final class PluginRegistry {

  /** The parser extension points, one per kind of plugin handler. */
  public enum ExtensionPoint {
    EXPRESSION_TOKENS("expressionTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.expressionTokens();
      }
    },
    TEXT_TOKENS("textTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.textTokens();
      }
    },
    TAG_ATTRIBUTE_TOKENS("tagAttributeTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.tagAttributeTokens();
      }
    },
    TAG_TOKENS("tagTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.tagTokens();
      }
    },
    CASE_TOKENS("caseTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.caseTokens();
      }
    },
    BLOCK_CODE_TOKENS("blockCodeTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.blockCodeTokens();
      }
    },
    TEXT_BLOCK_TOKENS("textBlockTokens") {
      @Override
      ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin) {
        return plugin.textBlockTokens();
      }
    };

    private final String context;

    ExtensionPoint(String context) {
      this.context = context;
    }

    abstract ImmutableMap<TokenKind, ?> handlersOf(Plugin plugin);

    @Override
    public String toString() {
      return context;
    }
  }

  /** The registry with no plugins. */
  public static final PluginRegistry EMPTY =
      new PluginRegistry(ImmutableTable.of(), ImmutableListMultimap.of());

  private final ImmutableTable<ExtensionPoint, TokenKind, Object> handlers;
  private final ImmutableListMultimap<Lexer.Rule, Plugin.RuleHandler> ruleHandlers;

  private PluginRegistry(
      ImmutableTable<ExtensionPoint, TokenKind, Object> handlers,
      ImmutableListMultimap<Lexer.Rule, Plugin.RuleHandler> ruleHandlers) {
    this.handlers = handlers;
    this.ruleHandlers = ruleHandlers;
  }

  public static PluginRegistry of(Plugin... plugins) {
    return of(Arrays.asList(plugins));
  }

  /**
   * Returns the registry of the given plugins.
   *
   * @throws IllegalArgumentException if two plugins handle the same token kind at the same
   *     extension point
   */
  public static PluginRegistry of(Iterable<? extends Plugin> plugins) {
    Table<ExtensionPoint, TokenKind, Object> table = HashBasedTable.create();
    ImmutableListMultimap.Builder<Lexer.Rule, Plugin.RuleHandler> rules =
        ImmutableListMultimap.builder();
    for (Plugin plugin : plugins) {
      rules.putAll(plugin.lexerRules().entrySet());
      for (ExtensionPoint point : ExtensionPoint.values()) {
        for (Map.Entry<TokenKind, ?> e : point.handlersOf(plugin).entrySet()) {
          checkArgument(
              !table.contains(point, e.getKey()),
              "Multiple plugin handlers found for context \"%s\", token type \"%s\"",
              point,
              e.getKey());
          table.put(point, e.getKey(), e.getValue());
        }
      }
    }
    return new PluginRegistry(ImmutableTable.copyOf(table), rules.build());
  }

  /** Returns the lexer handlers for a rule, in registration order. */
  ImmutableList<Plugin.RuleHandler> ruleHandlers(Lexer.Rule rule) {
    return ruleHandlers.get(rule);
  }

  /** Returns the handler for a token kind at an extension point, or null if there is none. */
  @Nullable
  <T> T handler(ExtensionPoint point, TokenKind kind, Class<T> type) {
    Object handler = handlers.get(point, kind);
    return handler == null ? null : type.cast(handler);
  }

  /** Reports whether no plugin contributes any handler. */
  public boolean isEmpty() {
    return handlers.isEmpty() && ruleHandlers.isEmpty();
  }
}
