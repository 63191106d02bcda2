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

/** Literal text; {@code isHtml} marks text written as raw HTML, starting with {@code <}. */
public final class Text extends Node {

  private final String value;
  private final boolean html;

  public Text(Location location, String value, boolean html) {
    super(location);
    this.value = value;
    this.html = html;
  }

  public String getValue() {
    return value;
  }

  public boolean isHtml() {
    return html;
  }

  @Override
  public Kind kind() {
    return Kind.TEXT;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
