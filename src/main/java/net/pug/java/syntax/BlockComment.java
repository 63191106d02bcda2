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

/** A comment followed by an indented block of text. */
public final class BlockComment extends Node {

  private final String value;
  private final boolean buffer;
  private final Block block;

  public BlockComment(Location anchor, String value, boolean buffer, Block block) {
    super(span(anchor, block));
    this.value = value;
    this.buffer = buffer;
    this.block = block;
  }

  /** Returns the text on the comment's own line. */
  public String getValue() {
    return value;
  }

  public boolean isBuffer() {
    return buffer;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.BLOCK_COMMENT;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
