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

/** A loop, {@code each val, key in obj}, with an optional {@code else} for empty collections. */
public final class Each extends Node {

  private final String obj;
  private final String val;
  @Nullable private final String key;
  private final Block block;
  @Nullable private final Block alternate;

  public Each(
      Location anchor,
      String obj,
      String val,
      @Nullable String key,
      Block block,
      @Nullable Block alternate) {
    super(span(anchor, block, alternate));
    this.obj = obj;
    this.val = val;
    this.key = key;
    this.block = block;
    this.alternate = alternate;
  }

  /** Returns the collection expression. */
  public String getObj() {
    return obj;
  }

  public String getVal() {
    return val;
  }

  @Nullable
  public String getKey() {
    return key;
  }

  public Block getBlock() {
    return block;
  }

  @Nullable
  public Block getAlternate() {
    return alternate;
  }

  @Override
  public Kind kind() {
    return Kind.EACH;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
