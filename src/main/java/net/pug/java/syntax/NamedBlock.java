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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;

/** A named block, {@code block name}, that an extending template may replace or extend. */
public final class NamedBlock extends Block {

  /** How the content of the block combines with the block of the same name it overrides. */
  public enum Mode {
    REPLACE,
    APPEND,
    PREPEND;

    /** Returns the lower-case keyword, such as "append". */
    @Override
    public String toString() {
      return Ascii.toLowerCase(name());
    }
  }

  private final String name;
  private final Mode mode;

  public NamedBlock(Location anchor, String name, Mode mode, ImmutableList<Node> nodes) {
    super(span(anchor, nodes), nodes);
    this.name = name;
    this.mode = mode;
  }

  public String getName() {
    return name;
  }

  public Mode getMode() {
    return mode;
  }

  @Override
  public Kind kind() {
    return Kind.NAMED_BLOCK;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
