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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashSet;
import java.util.Set;

/**
 * The mutable state of an element while its attributes and body are parsed. Element plugin
 * handlers receive it to add attributes or body nodes.
 */
public final class ElementBuilder {

  private Location location;
  private final ImmutableList.Builder<Attribute> attributes = ImmutableList.builder();
  private final ImmutableList.Builder<AttributeBlock> attributeBlocks = ImmutableList.builder();
  private final Block.Builder body = new Block.Builder();
  // Names checked for duplicates; class is never recorded.
  private final Set<String> attributeNames = new HashSet<>();
  private boolean selfClosing;
  private boolean textOnly;

  ElementBuilder(Location anchor) {
    this.location = anchor;
  }

  /** Returns the span of the element so far, not counting its body. */
  public Location location() {
    return location;
  }

  /** Extends the element's span over a token that belongs to it, such as a closing bracket. */
  @CanIgnoreReturnValue
  public ElementBuilder extend(Location loc) {
    location = Location.merge(location, loc);
    return this;
  }

  @CanIgnoreReturnValue
  public ElementBuilder addAttribute(Attribute attribute) {
    attributes.add(attribute);
    return extend(attribute.getLocation());
  }

  @CanIgnoreReturnValue
  public ElementBuilder addAttributeBlock(AttributeBlock block) {
    attributeBlocks.add(block);
    return extend(block.getLocation());
  }

  /** Returns the builder of the element's body. */
  public Block.Builder body() {
    return body;
  }

  @CanIgnoreReturnValue
  public ElementBuilder setSelfClosing(boolean selfClosing) {
    this.selfClosing = selfClosing;
    return this;
  }

  public boolean isSelfClosing() {
    return selfClosing;
  }

  @CanIgnoreReturnValue
  public ElementBuilder setTextOnly(boolean textOnly) {
    this.textOnly = textOnly;
    return this;
  }

  public boolean isTextOnly() {
    return textOnly;
  }

  Set<String> attributeNames() {
    return attributeNames;
  }

  ImmutableList<Attribute> attributes() {
    return attributes.build();
  }

  ImmutableList<AttributeBlock> attributeBlocks() {
    return attributeBlocks.build();
  }

  Block buildBody() {
    return body.build(location);
  }
}
