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
 * Embedded code. Buffered code ({@code = expr}, {@code != expr}, {@code #{expr}}) is output;
 * unbuffered code ({@code - stmt}, or a {@code -} block) is only run, and may have a body.
 */
public final class Code extends Node {

  private final String value;
  private final boolean buffer;
  private final boolean mustEscape;
  private final boolean inline;
  @Nullable private final Block block;

  public Code(
      Location anchor,
      String value,
      boolean buffer,
      boolean mustEscape,
      boolean inline,
      @Nullable Block block) {
    super(span(anchor, block));
    this.value = value;
    this.buffer = buffer;
    this.mustEscape = mustEscape;
    this.inline = inline;
    this.block = block;
  }

  public String getValue() {
    return value;
  }

  public boolean isBuffer() {
    return buffer;
  }

  public boolean mustEscape() {
    return mustEscape;
  }

  /** Whether the code is part of a line of text or follows a tag on its line. */
  public boolean isInline() {
    return inline;
  }

  @Nullable
  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.CODE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
