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
import javax.annotation.Nullable;

/**
 * A sequence of nodes: the root of a template, or the body of a tag, mixin, branch or loop.
 *
 * <p>The location of a non-empty block is the merge of its nodes' locations. An empty block is
 * given a zero-width location at the end of its context, such as the tag that owns it.
 */
public class Block extends Node {

  private final ImmutableList<Node> nodes;

  Block(Location location, ImmutableList<Node> nodes) {
    super(location);
    this.nodes = nodes;
  }

  public ImmutableList<Node> getNodes() {
    return nodes;
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  @Override
  public Kind kind() {
    return Kind.BLOCK;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Accumulates the nodes of a block, in order. */
  public static final class Builder {
    private final ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    @Nullable private Location location;
    private int size;

    @CanIgnoreReturnValue
    public Builder add(Node node) {
      nodes.add(node);
      location =
          location == null ? node.getLocation() : Location.merge(location, node.getLocation());
      size++;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addAll(Iterable<? extends Node> nodes) {
      for (Node node : nodes) {
        add(node);
      }
      return this;
    }

    public boolean isEmpty() {
      return size == 0;
    }

    public int size() {
      return size;
    }

    /**
     * Returns the block. If it is empty, its location is the zero-width location at the end of
     * {@code context}.
     */
    public Block build(Location context) {
      return new Block(location == null ? context.anchorEnd() : location, nodes.build());
    }
  }
}
