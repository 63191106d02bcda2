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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** An HTML element, such as {@code div(class="x") text}. */
public final class Tag extends Element {

  /** The element names rendered inline. */
  public static final ImmutableSet<String> INLINE_TAGS =
      ImmutableSet.of(
          "a", "abbr", "acronym", "b", "br", "code", "em", "font", "i", "img", "ins", "kbd", "map",
          "samp", "small", "span", "strong", "sub", "sup");

  private final String name;
  private final boolean selfClosing;
  private final boolean textOnly;

  public Tag(
      Location anchor,
      String name,
      ImmutableList<Attribute> attributes,
      ImmutableList<AttributeBlock> attributeBlocks,
      Block block,
      boolean selfClosing,
      boolean textOnly) {
    super(anchor, attributes, attributeBlocks, block);
    this.name = name;
    this.selfClosing = selfClosing;
    this.textOnly = textOnly;
  }

  public String getName() {
    return name;
  }

  public boolean isSelfClosing() {
    return selfClosing;
  }

  /** Whether the body was given as pipeless text, {@code p.} */
  public boolean isTextOnly() {
    return textOnly;
  }

  public boolean isInline() {
    return INLINE_TAGS.contains(name);
  }

  @Override
  public Kind kind() {
    return Kind.TAG;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
