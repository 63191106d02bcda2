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

import com.google.common.collect.ImmutableList;

/** A filter applied to an included file, {@code include:name(attrs) path}. */
public final class IncludeFilter extends Node {

  private final String name;
  private final ImmutableList<Attribute> attributes;

  public IncludeFilter(Location anchor, String name, ImmutableList<Attribute> attributes) {
    super(span(anchor, attributes));
    this.name = name;
    this.attributes = attributes;
  }

  public String getName() {
    return name;
  }

  public ImmutableList<Attribute> getAttributes() {
    return attributes;
  }

  @Override
  public Kind kind() {
    return Kind.INCLUDE_FILTER;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
