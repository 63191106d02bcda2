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

/** An element whose name is computed, {@code #{expr}}. */
public final class InterpolatedTag extends Element {

  private final String expr;
  private final boolean selfClosing;
  private final boolean textOnly;

  public InterpolatedTag(
      Location anchor,
      String expr,
      ImmutableList<Attribute> attributes,
      ImmutableList<AttributeBlock> attributeBlocks,
      Block block,
      boolean selfClosing,
      boolean textOnly) {
    super(anchor, attributes, attributeBlocks, block);
    this.expr = expr;
    this.selfClosing = selfClosing;
    this.textOnly = textOnly;
  }

  public String getExpr() {
    return expr;
  }

  public boolean isSelfClosing() {
    return selfClosing;
  }

  public boolean isTextOnly() {
    return textOnly;
  }

  @Override
  public Kind kind() {
    return Kind.INTERPOLATED_TAG;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
