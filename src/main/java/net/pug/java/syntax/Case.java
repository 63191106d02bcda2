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

/** A {@code case expr} statement, whose block holds only {@link When} nodes. */
public final class Case extends Node {

  private final String expr;
  private final Block block;

  public Case(Location anchor, String expr, Block block) {
    super(span(anchor, block));
    this.expr = expr;
    this.block = block;
  }

  public String getExpr() {
    return expr;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.CASE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
