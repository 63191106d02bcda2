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

/** A {@code while test} loop. */
public final class While extends Node {

  private final String test;
  private final Block block;

  public While(Location anchor, String test, Block block) {
    super(span(anchor, block));
    this.test = test;
    this.block = block;
  }

  public String getTest() {
    return test;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.WHILE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
