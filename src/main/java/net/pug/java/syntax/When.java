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

import javax.annotation.Nullable;

/**
 * A {@code when expr} branch of a case, or the {@code default} branch, whose expression is
 * {@code default}. A branch without a body falls through to the next one.
 */
public final class When extends Node {

  private final String expr;
  @Nullable private final Block block;

  public When(Location anchor, String expr, @Nullable Block block) {
    super(span(anchor, block));
    this.expr = expr;
    this.block = block;
  }

  public String getExpr() {
    return expr;
  }

  public boolean isDefault() {
    return expr.equals("default");
  }

  @Nullable
  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.WHEN;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
