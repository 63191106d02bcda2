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

import java.util.List;
import javax.annotation.Nullable;

/**
 * A visitor for visiting the nodes of a syntax tree in lexical order.
 *
 * <p>Typical usage is for a subclass to override the {@code visit()} overloads for the node types
 * it cares about, and to rely on the default implementations here for traversal over the rest.
 * Overriding implementations should remember to traverse children, using either {@code
 * super.visit()} on the current node or explicit calls to {@link #visit(Node)}, {@link #visitAll}
 * or {@link #visitBlock} on child fields.
 */
public class NodeVisitor {

  /** Entrypoint for visiting a node. Clients should avoid calling node-specific overloads. */
  public void visit(Node node) {
    // Double-dispatch pattern.
    node.accept(this);
  }

  public final void visitAll(List<? extends Node> nodes) {
    for (Node node : nodes) {
      visit(node);
    }
  }

  /** Visits the nodes of a block, if it is not null; the block itself is not dispatched on. */
  public final void visitBlock(@Nullable Block block) {
    if (block != null) {
      visitAll(block.getNodes());
    }
  }

  // ==== containers ====

  public void visit(Block node) {
    visitBlock(node);
  }

  public void visit(NamedBlock node) {
    visitBlock(node);
  }

  // ==== elements ====

  public void visit(Tag node) {
    visitElement(node);
  }

  public void visit(InterpolatedTag node) {
    visitElement(node);
  }

  public void visit(Mixin node) {
    visitElement(node);
  }

  private void visitElement(Element node) {
    visitAll(node.getAttributes());
    visitAll(node.getAttributeBlocks());
    visitBlock(node.getBlock());
  }

  public void visit(@SuppressWarnings("unused") Attribute node) {}

  public void visit(@SuppressWarnings("unused") AttributeBlock node) {}

  // ==== text, code and comments ====

  public void visit(@SuppressWarnings("unused") Text node) {}

  public void visit(Code node) {
    visitBlock(node.getBlock());
  }

  public void visit(@SuppressWarnings("unused") Comment node) {}

  public void visit(BlockComment node) {
    visitBlock(node.getBlock());
  }

  public void visit(@SuppressWarnings("unused") Doctype node) {}

  public void visit(Filter node) {
    visitAll(node.getAttributes());
    visitBlock(node.getBlock());
  }

  // ==== control flow ====

  public void visit(Conditional node) {
    visitBlock(node.getConsequent());
    if (node.getAlternate() != null) {
      visit(node.getAlternate());
    }
  }

  public void visit(Each node) {
    visitBlock(node.getBlock());
    visitBlock(node.getAlternate());
  }

  public void visit(While node) {
    visitBlock(node.getBlock());
  }

  public void visit(Case node) {
    visitBlock(node.getBlock());
  }

  public void visit(When node) {
    visitBlock(node.getBlock());
  }

  public void visit(@SuppressWarnings("unused") MixinBlock node) {}

  public void visit(@SuppressWarnings("unused") YieldBlock node) {}

  // ==== template composition ====

  public void visit(Extends node) {
    visit((Node) node.getFile());
  }

  public void visit(Include node) {
    visit((Node) node.getFile());
    visitBlock(node.getBlock());
  }

  public void visit(RawInclude node) {
    visit((Node) node.getFile());
    visitAll(node.getFilters());
  }

  public void visit(IncludeFilter node) {
    visitAll(node.getAttributes());
  }

  public void visit(@SuppressWarnings("unused") FileReference node) {}
}
