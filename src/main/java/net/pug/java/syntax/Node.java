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

import com.google.common.base.CaseFormat;
import javax.annotation.Nullable;

/**
 * A node of the syntax tree.
 *
 * <p>Nodes are immutable. The location of every node is computed when it is constructed, as the
 * merge of the location of its anchor token(s) and the locations of all its children, so a node's
 * span always contains the spans of its descendants.
 */
public abstract class Node {

  /** The node types. */
  public enum Kind {
    ATTRIBUTE,
    ATTRIBUTE_BLOCK,
    BLOCK,
    BLOCK_COMMENT,
    CASE,
    CODE,
    COMMENT,
    CONDITIONAL,
    DOCTYPE,
    EACH,
    EXTENDS,
    FILE_REFERENCE,
    FILTER,
    INCLUDE,
    INCLUDE_FILTER,
    INTERPOLATED_TAG,
    MIXIN,
    MIXIN_BLOCK,
    NAMED_BLOCK,
    RAW_INCLUDE,
    TAG,
    TEXT,
    WHEN,
    WHILE,
    YIELD_BLOCK;

    /** Returns the conventional type name of the node kind, such as "NamedBlock". */
    public String typeName() {
      return CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.UPPER_CAMEL, name());
    }
  }

  private final Location location;

  Node(Location location) {
    this.location = location;
  }

  /** Returns the span of source covered by this node and all its descendants. */
  public final Location getLocation() {
    return location;
  }

  public abstract Kind kind();

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);

  @Override
  public String toString() {
    return kind().typeName() + " at " + location;
  }

  // Returns the smallest location containing the anchor and every non-null child.
  static Location span(Location anchor, @Nullable Node... children) {
    Location loc = anchor;
    for (Node child : children) {
      if (child != null) {
        loc = Location.merge(loc, child.getLocation());
      }
    }
    return loc;
  }

  static Location span(Location anchor, Iterable<? extends Node> children) {
    Location loc = anchor;
    for (Node child : children) {
      loc = Location.merge(loc, child.getLocation());
    }
    return loc;
  }
}
