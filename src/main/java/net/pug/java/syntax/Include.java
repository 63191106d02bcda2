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

/**
 * An {@code include} of another template ({@code .pug} or {@code .jade}, without filters). Its
 * block supplies content for the included template's {@code yield}.
 */
public final class Include extends Node {

  private final FileReference file;
  private final Block block;

  public Include(Location anchor, FileReference file, Block block) {
    super(span(anchor, file, block));
    this.file = file;
    this.block = block;
  }

  public FileReference getFile() {
    return file;
  }

  public Block getBlock() {
    return block;
  }

  @Override
  public Kind kind() {
    return Kind.INCLUDE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
