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
 * An attribute of an element: {@code name=value}, {@code name!=value}, a bare name, or one of the
 * {@code #id} and {@code .class} shorthands. The value is the expression text; a bare name has the
 * value {@code true} and a shorthand has the quoted name.
 */
public final class Attribute extends Node {

  private final String name;
  private final String value;
  private final boolean mustEscape;

  public Attribute(Location location, String name, String value, boolean mustEscape) {
    super(location);
    this.name = name;
    this.value = value;
    this.mustEscape = mustEscape;
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  /** Whether the value is HTML-escaped when output. */
  public boolean mustEscape() {
    return mustEscape;
  }

  @Override
  public Kind kind() {
    return Kind.ATTRIBUTE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
