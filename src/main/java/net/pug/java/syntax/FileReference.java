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

/** The path operand of {@code extends} or {@code include}. It is not resolved. */
public final class FileReference extends Node {

  private final String path;

  public FileReference(Location location, String path) {
    super(location);
    this.path = path;
  }

  public String getPath() {
    return path;
  }

  @Override
  public Kind kind() {
    return Kind.FILE_REFERENCE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
