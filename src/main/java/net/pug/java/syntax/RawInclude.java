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

/** An {@code include} of a file inserted as text, possibly through filters. */
public final class RawInclude extends Node {

  private final FileReference file;
  private final ImmutableList<IncludeFilter> filters;

  public RawInclude(Location anchor, FileReference file, ImmutableList<IncludeFilter> filters) {
    super(span(anchor, Iterables.concat(ImmutableList.of(file), filters)));
    this.file = file;
    this.filters = filters;
  }

  public FileReference getFile() {
    return file;
  }

  public ImmutableList<IncludeFilter> getFilters() {
    return filters;
  }

  @Override
  public Kind kind() {
    return Kind.RAW_INCLUDE;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
