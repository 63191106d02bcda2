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

/** A {@code doctype} declaration; the value is empty for a bare {@code doctype}. */
public final class Doctype extends Node {

  private final String value;

  public Doctype(Location location, String value) {
    super(location);
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public Kind kind() {
    return Kind.DOCTYPE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
