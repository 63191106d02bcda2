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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link Location}. */
@RunWith(JUnit4.class)
public final class LocationTest {

  private static Location loc(int line1, int col1, int line2, int col2) {
    return Location.of(
        "a.pug", new Location.Position(line1, col1), new Location.Position(line2, col2));
  }

  @Test
  public void testMerge() {
    Location a = loc(1, 5, 1, 9);
    Location b = loc(2, 1, 3, 4);
    assertThat(Location.merge(a, b)).isEqualTo(loc(1, 5, 3, 4));
    assertThat(Location.merge(b, a)).isEqualTo(Location.merge(a, b));
    assertThat(Location.merge(a, loc(1, 6, 1, 7))).isEqualTo(a);
  }

  @Test
  public void testMergeRejectsDifferentFiles() {
    Location other = Location.at("b.pug", 1, 1);
    assertThrows(IllegalArgumentException.class, () -> Location.merge(loc(1, 1, 1, 2), other));
  }

  @Test
  public void testStartMustNotFollowEnd() {
    assertThrows(IllegalArgumentException.class, () -> loc(2, 1, 1, 9));
  }

  @Test
  public void testAnchors() {
    Location a = loc(1, 5, 2, 3);
    assertThat(a.anchorStart()).isEqualTo(Location.at("a.pug", 1, 5));
    assertThat(a.anchorEnd()).isEqualTo(Location.at("a.pug", 2, 3));
    assertThat(a.line()).isEqualTo(1);
    assertThat(a.column()).isEqualTo(5);
  }

  @Test
  public void testContains() {
    Location outer = loc(1, 1, 4, 1);
    assertThat(outer.contains(loc(2, 3, 3, 9))).isTrue();
    assertThat(outer.contains(outer)).isTrue();
    assertThat(outer.contains(outer.anchorEnd())).isTrue();
    assertThat(outer.contains(loc(3, 1, 4, 2))).isFalse();
    assertThat(outer.contains(Location.at("b.pug", 2, 1))).isFalse();
  }

  @Test
  public void testToString() {
    assertThat(loc(3, 7, 3, 9).toString()).isEqualTo("a.pug:3:7");
  }
}
