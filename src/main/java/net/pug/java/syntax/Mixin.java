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
import javax.annotation.Nullable;

/**
 * A mixin declaration, {@code mixin name(args)} with a body, or a mixin call, {@code +name(args)}
 * with optional attributes and body.
 */
public final class Mixin extends Element {

  private final String name;
  @Nullable private final String args;
  private final boolean call;

  public Mixin(
      Location anchor,
      String name,
      @Nullable String args,
      boolean call,
      ImmutableList<Attribute> attributes,
      ImmutableList<AttributeBlock> attributeBlocks,
      @Nullable Block block) {
    super(anchor, attributes, attributeBlocks, block);
    this.name = name;
    this.args = args;
    this.call = call;
  }

  public String getName() {
    return name;
  }

  /** Returns the parameter or argument list text, without parentheses, or null if absent. */
  @Nullable
  public String getArgs() {
    return args;
  }

  public boolean isCall() {
    return call;
  }

  @Override
  public Kind kind() {
    return Kind.MIXIN;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
