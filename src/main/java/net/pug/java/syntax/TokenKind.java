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

/** A TokenKind represents the kind of a lexical token. */
public enum TokenKind {
  AMPERSAND_ATTRIBUTES("&attributes"),
  ATTRIBUTE("attribute"),
  BLOCK("block"),
  BLOCK_CODE("blockcode"),
  CALL("call"),
  CASE("case"),
  CLASS("class"),
  CODE("code"),
  COLON(":"),
  COMMENT("comment"),
  DEFAULT("default"),
  DOCTYPE("doctype"),
  DOT("dot"),
  EACH("each"),
  ELSE("else"),
  ELSE_IF("else-if"),
  END_ATTRIBUTES("end-attributes"),
  END_PIPELESS_TEXT("end-pipeless-text"),
  END_PUG_INTERPOLATION("end-pug-interpolation"),
  EOS("eos"),
  EXTENDS("extends"),
  FILTER("filter"),
  ID("id"),
  IF("if"),
  INCLUDE("include"),
  INDENT("indent"),
  INTERPOLATED_CODE("interpolated-code"),
  INTERPOLATION("interpolation"),
  MIXIN("mixin"),
  MIXIN_BLOCK("mixin-block"),
  NEWLINE("newline"),
  OUTDENT("outdent"),
  PATH("path"),
  SLASH("slash"),
  START_ATTRIBUTES("start-attributes"),
  START_PIPELESS_TEXT("start-pipeless-text"),
  START_PUG_INTERPOLATION("start-pug-interpolation"),
  TAG("tag"),
  TEXT("text"),
  TEXT_HTML("text-html"),
  WHEN("when"),
  WHILE("while"),
  YIELD("yield");

  private final String name;

  private TokenKind(String name) {
    this.name = name;
  }

  /** Returns the type name of this kind, as used in messages and in the JSON token format. */
  @Override
  public String toString() {
    return name;
  }
}
