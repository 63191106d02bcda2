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
 * An {@code if}, {@code unless} or {@code else if} branch. The alternate is the next
 * {@code else if} branch (a Conditional), the {@code else} block, or null.
 */
public final class Conditional extends Node {

  private final String test;
  private final Block consequent;
  @Nullable private final Node alternate;

  public Conditional(Location anchor, String test, Block consequent, @Nullable Node alternate) {
    super(span(anchor, consequent, alternate));
    this.test = test;
    this.consequent = consequent;
    this.alternate = alternate;
  }

  public String getTest() {
    return test;
  }

  public Block getConsequent() {
    return consequent;
  }

  @Nullable
  public Node getAlternate() {
    return alternate;
  }

  @Override
  public Kind kind() {
    return Kind.CONDITIONAL;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
