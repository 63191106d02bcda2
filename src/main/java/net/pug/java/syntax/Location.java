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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * A Location denotes a half-open span of a template source, from {@link #start} (inclusive) to
 * {@link #end} (exclusive), together with the identifier of the source it belongs to.
 *
 * <p>Lines and columns are 1-based. A zero-width location (start equal to end) denotes a point,
 * such as the position of an error or an empty block.
 */
@Immutable
public final class Location {

  /** A line and column within a source. */
  @Immutable
  public static final class Position implements Comparable<Position> {
    private final int line;
    private final int column;

    public Position(int line, int column) {
      this.line = line;
      this.column = column;
    }

    public int line() {
      return line;
    }

    public int column() {
      return column;
    }

    @Override
    public int compareTo(Position that) {
      int cmp = Integer.compare(this.line, that.line);
      return cmp != 0 ? cmp : Integer.compare(this.column, that.column);
    }

    @Override
    public boolean equals(Object that) {
      return that instanceof Position
          && this.line == ((Position) that).line
          && this.column == ((Position) that).column;
    }

    @Override
    public int hashCode() {
      return 31 * line + column;
    }

    @Override
    public String toString() {
      return line + ":" + column;
    }
  }

  private final String file;
  private final Position start;
  private final Position end;

  private Location(String file, Position start, Position end) {
    this.file = file;
    this.start = start;
    this.end = end;
  }

  /** Returns the location spanning {@code start} to {@code end} in the given source. */
  public static Location of(String file, Position start, Position end) {
    checkArgument(start.compareTo(end) <= 0, "location start %s is after end %s", start, end);
    return new Location(file, start, end);
  }

  /** Returns a zero-width location at the given line and column. */
  public static Location at(String file, int line, int column) {
    Position p = new Position(line, column);
    return new Location(file, p, p);
  }

  /**
   * Returns the smallest location that contains both {@code a} and {@code b}. The operation is
   * commutative and associative.
   *
   * @throws IllegalArgumentException if the two locations belong to different sources.
   */
  public static Location merge(Location a, Location b) {
    checkArgument(
        a.file.equals(b.file),
        "cannot merge locations from different sources: %s and %s",
        a.file,
        b.file);
    Position start = a.start.compareTo(b.start) <= 0 ? a.start : b.start;
    Position end = a.end.compareTo(b.end) >= 0 ? a.end : b.end;
    return new Location(a.file, start, end);
  }

  /** Returns the zero-width location at the end of this one. */
  public Location anchorEnd() {
    return new Location(file, end, end);
  }

  /** Returns the zero-width location at the start of this one. */
  public Location anchorStart() {
    return new Location(file, start, start);
  }

  /** Reports whether {@code that} lies within this location (bounds included). */
  public boolean contains(Location that) {
    return file.equals(that.file)
        && start.compareTo(that.start) <= 0
        && that.end.compareTo(end) <= 0;
  }

  /** Returns the source identifier, typically a file name. */
  public String file() {
    return file;
  }

  public Position start() {
    return start;
  }

  public Position end() {
    return end;
  }

  /** Returns the 1-based line of the start position. */
  public int line() {
    return start.line;
  }

  /** Returns the 1-based column of the start position. */
  public int column() {
    return start.column;
  }

  @Override
  public boolean equals(Object that) {
    if (this == that) {
      return true;
    }
    if (!(that instanceof Location)) {
      return false;
    }
    Location loc = (Location) that;
    return file.equals(loc.file) && start.equals(loc.start) && end.equals(loc.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, start, end);
  }

  /** Returns "file:line:col" for the start position, the conventional form for error messages. */
  @Override
  public String toString() {
    return file + ":" + start;
  }
}
