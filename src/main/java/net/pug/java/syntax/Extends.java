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

/** An {@code extends path} statement. */
public final class Extends extends Node {

  private final FileReference file;

  public Extends(Location anchor, FileReference file) {
    super(span(anchor, file));
    this.file = file;
  }

  public FileReference getFile() {
    return file;
  }

  @Override
  public Kind kind() {
    return Kind.EXTENDS;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
