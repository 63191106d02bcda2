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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Encodes syntax trees and tokens as JSON, for snapshots and for handing a tree to a code
 * generator in another process.
 *
 * <p>Each node becomes an object whose {@code type} member is the node type name ({@code "Tag"},
 * {@code "NamedBlock"}, ...), followed by the node's fields under their conventional names, and,
 * unless omitted, its {@code loc}: {@code {"filename", "start": {"line", "column"}, "end": ...}}.
 * Trees that differ only in locations have equal encodings without locations.
 */
public final class NodeJson {

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().serializeNulls().create();

  private final boolean locations;

  private NodeJson(boolean locations) {
    this.locations = locations;
  }

  /** Returns the encoding of a node, with or without locations. */
  public static JsonObject encode(Node node, boolean locations) {
    return new NodeJson(locations).node(node);
  }

  /** Returns the encoding of a token list, with or without locations. */
  public static JsonArray encodeTokens(List<Token> tokens, boolean locations) {
    NodeJson json = new NodeJson(locations);
    JsonArray array = new JsonArray();
    for (Token token : tokens) {
      array.add(json.token(token));
    }
    return array;
  }

  /** Returns the pretty-printed JSON text of a node, with locations. */
  public static String toJson(Node node) {
    return GSON.toJson(encode(node, true));
  }

  /** Returns the pretty-printed JSON text of a token list, with locations. */
  public static String toJson(List<Token> tokens) {
    return GSON.toJson(encodeTokens(tokens, true));
  }

  private JsonObject token(Token token) {
    JsonObject obj = new JsonObject();
    obj.addProperty("type", token.kind().toString());
    putIfSet(obj, "val", token.value());
    putIfSet(obj, "name", token.name());
    putIfSet(obj, "key", token.key());
    putIfSet(obj, "code", token.code());
    putIfSet(obj, "args", token.args());
    if (token.mode() != null) {
      obj.addProperty("mode", token.mode().toString());
    }
    if (token.buffer()) {
      obj.addProperty("buffer", true);
    }
    if (token.mustEscape()) {
      obj.addProperty("mustEscape", true);
    }
    if (locations) {
      obj.add("loc", location(token.location()));
    }
    return obj;
  }

  private static void putIfSet(JsonObject obj, String name, @Nullable String value) {
    if (value != null) {
      obj.addProperty(name, value);
    }
  }

  private static JsonObject location(Location loc) {
    JsonObject obj = new JsonObject();
    obj.addProperty("filename", loc.file());
    obj.add("start", position(loc.start()));
    obj.add("end", position(loc.end()));
    return obj;
  }

  private static JsonObject position(Location.Position pos) {
    JsonObject obj = new JsonObject();
    obj.addProperty("line", pos.line());
    obj.addProperty("column", pos.column());
    return obj;
  }

  private JsonElement nullable(@Nullable Node node) {
    return node == null ? JsonNull.INSTANCE : node(node);
  }

  private JsonArray nodes(List<? extends Node> nodes) {
    JsonArray array = new JsonArray();
    for (Node node : nodes) {
      array.add(node(node));
    }
    return array;
  }

  private JsonObject node(Node node) {
    JsonObject obj = new JsonObject();
    obj.addProperty("type", node.kind().typeName());
    switch (node.kind()) {
      case BLOCK -> obj.add("nodes", nodes(((Block) node).getNodes()));
      case NAMED_BLOCK -> {
        NamedBlock block = (NamedBlock) node;
        obj.addProperty("name", block.getName());
        obj.addProperty("mode", block.getMode().toString());
        obj.add("nodes", nodes(block.getNodes()));
      }
      case TAG -> {
        Tag tag = (Tag) node;
        obj.addProperty("name", tag.getName());
        obj.addProperty("selfClosing", tag.isSelfClosing());
        element(obj, tag);
        obj.addProperty("isInline", tag.isInline());
        if (tag.isTextOnly()) {
          obj.addProperty("textOnly", true);
        }
      }
      case INTERPOLATED_TAG -> {
        InterpolatedTag tag = (InterpolatedTag) node;
        obj.addProperty("expr", tag.getExpr());
        obj.addProperty("selfClosing", tag.isSelfClosing());
        element(obj, tag);
        obj.addProperty("isInline", false);
        if (tag.isTextOnly()) {
          obj.addProperty("textOnly", true);
        }
      }
      case MIXIN -> {
        Mixin mixin = (Mixin) node;
        obj.addProperty("name", mixin.getName());
        obj.addProperty("args", mixin.getArgs());
        element(obj, mixin);
        obj.addProperty("call", mixin.isCall());
      }
      case ATTRIBUTE -> {
        Attribute attr = (Attribute) node;
        obj.addProperty("name", attr.getName());
        obj.addProperty("val", attr.getValue());
        obj.addProperty("mustEscape", attr.mustEscape());
      }
      case ATTRIBUTE_BLOCK -> obj.addProperty("val", ((AttributeBlock) node).getValue());
      case TEXT -> {
        Text text = (Text) node;
        obj.addProperty("val", text.getValue());
        if (text.isHtml()) {
          obj.addProperty("isHtml", true);
        }
      }
      case CODE -> {
        Code code = (Code) node;
        obj.addProperty("val", code.getValue());
        obj.addProperty("buffer", code.isBuffer());
        obj.addProperty("mustEscape", code.mustEscape());
        obj.addProperty("isInline", code.isInline());
        if (code.getBlock() != null) {
          obj.add("block", node(code.getBlock()));
        }
      }
      case COMMENT -> {
        Comment comment = (Comment) node;
        obj.addProperty("val", comment.getValue());
        obj.addProperty("buffer", comment.isBuffer());
      }
      case BLOCK_COMMENT -> {
        BlockComment comment = (BlockComment) node;
        obj.addProperty("val", comment.getValue());
        obj.add("block", node(comment.getBlock()));
        obj.addProperty("buffer", comment.isBuffer());
      }
      case DOCTYPE -> obj.addProperty("val", ((Doctype) node).getValue());
      case EACH -> {
        Each each = (Each) node;
        obj.addProperty("obj", each.getObj());
        obj.addProperty("val", each.getVal());
        obj.addProperty("key", each.getKey());
        obj.add("block", node(each.getBlock()));
        if (each.getAlternate() != null) {
          obj.add("alternate", node(each.getAlternate()));
        }
      }
      case WHILE -> {
        While loop = (While) node;
        obj.addProperty("test", loop.getTest());
        obj.add("block", node(loop.getBlock()));
      }
      case CONDITIONAL -> {
        Conditional cond = (Conditional) node;
        obj.addProperty("test", cond.getTest());
        obj.add("consequent", node(cond.getConsequent()));
        obj.add("alternate", nullable(cond.getAlternate()));
      }
      case CASE -> {
        Case c = (Case) node;
        obj.addProperty("expr", c.getExpr());
        obj.add("block", node(c.getBlock()));
      }
      case WHEN -> {
        When when = (When) node;
        obj.addProperty("expr", when.getExpr());
        if (when.getBlock() != null) {
          obj.add("block", node(when.getBlock()));
        }
      }
      case MIXIN_BLOCK, YIELD_BLOCK -> {}
      case EXTENDS -> obj.add("file", node(((Extends) node).getFile()));
      case INCLUDE -> {
        Include include = (Include) node;
        obj.add("file", node(include.getFile()));
        obj.add("block", node(include.getBlock()));
      }
      case RAW_INCLUDE -> {
        RawInclude include = (RawInclude) node;
        obj.add("file", node(include.getFile()));
        obj.add("filters", nodes(include.getFilters()));
      }
      case INCLUDE_FILTER -> {
        IncludeFilter filter = (IncludeFilter) node;
        obj.addProperty("name", filter.getName());
        obj.add("attrs", nodes(filter.getAttributes()));
      }
      case FILTER -> {
        Filter filter = (Filter) node;
        obj.addProperty("name", filter.getName());
        obj.add("block", node(filter.getBlock()));
        obj.add("attrs", nodes(filter.getAttributes()));
      }
      case FILE_REFERENCE -> obj.addProperty("path", ((FileReference) node).getPath());
    }
    if (locations) {
      obj.add("loc", location(node.getLocation()));
    }
    return obj;
  }

  private void element(JsonObject obj, Element element) {
    obj.add("block", nullable(element.getBlock()));
    obj.add("attrs", nodes(element.getAttributes()));
    obj.add("attributeBlocks", nodes(element.getAttributeBlocks()));
  }
}
