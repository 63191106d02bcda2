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
import com.google.common.collect.Iterables;
import javax.annotation.Nullable;

/** A node that takes attributes: a tag, an interpolated tag, or a mixin. */
public abstract class Element extends Node {

  private final ImmutableList<Attribute> attributes;
  private final ImmutableList<AttributeBlock> attributeBlocks;
  @Nullable private final Block block;

  Element(
      Location anchor,
      ImmutableList<Attribute> attributes,
      ImmutableList<AttributeBlock> attributeBlocks,
      @Nullable Block block) {
    super(span(span(anchor, Iterables.concat(attributes, attributeBlocks)), block));
    this.attributes = attributes;
    this.attributeBlocks = attributeBlocks;
    this.block = block;
  }

  public ImmutableList<Attribute> getAttributes() {
    return attributes;
  }

  public ImmutableList<AttributeBlock> getAttributeBlocks() {
    return attributeBlocks;
  }

  /** Returns the body, which is null only for a mixin call without one. */
  @Nullable
  public Block getBlock() {
    return block;
  }
}
