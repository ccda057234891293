/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.wick.space;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.wick.WickException;
import org.junit.jupiter.api.Test;

/** Tests {@link OrbitalSpaceInfo} and {@link OrbitalSpaces}. */
public class OrbitalSpaceInfoTest {
  private static OrbitalSpaceInfo occupiedVirtual() {
    final OrbitalSpaceInfo info = new OrbitalSpaceInfo();
    info.addSpace('o', FieldType.FERMION, SpaceType.OCCUPIED,
        ImmutableList.of("i", "j"));
    info.addSpace('v', FieldType.FERMION, SpaceType.UNOCCUPIED,
        ImmutableList.of("a", "b", "c"));
    return info;
  }

  @Test void testAddSpace() {
    final OrbitalSpaceInfo info = occupiedVirtual();
    assertThat(info.numSpaces(), is(2));
    assertThat(info.label(0), is('o'));
    assertThat(info.label(1), is('v'));
    assertThat(info.indices(1), is(ImmutableList.of("a", "b", "c")));
    assertThat(info.resolve('v').spaceType, is(SpaceType.UNOCCUPIED));
    assertThat(info.resolve('v').position, is(1));
    assertThat(info,
        hasToString("0 o fermion occupied [i, j]\n"
            + "1 v fermion unoccupied [a, b, c]"));
  }

  @Test void testAddSpaceFromStrings() {
    final OrbitalSpaceInfo info = new OrbitalSpaceInfo();
    final OrbitalSpace space =
        info.addSpace('b', "boson", "unoccupied",
            ImmutableList.of("w", "x"), ImmutableList.of());
    assertThat(space.fieldType, is(FieldType.BOSON));
    assertThat(space.isFermion(), is(false));
    assertThrows(IllegalArgumentException.class, () ->
        info.addSpace('c', "fermion", "half-full",
            ImmutableList.of("y"), ImmutableList.of()));
    assertThat(info.numSpaces(), is(1));
  }

  /** Registering two spaces whose index names overlap fails, and leaves the
   * registry as it was. */
  @Test void testDuplicateIndexName() {
    final OrbitalSpaceInfo info = new OrbitalSpaceInfo();
    info.addSpace('o', FieldType.FERMION, SpaceType.OCCUPIED,
        ImmutableList.of("i", "j"));
    final WickException e =
        assertThrows(WickException.class, () ->
            info.addSpace('v', FieldType.FERMION, SpaceType.UNOCCUPIED,
                ImmutableList.of("a", "j")));
    assertThat(e.kind(), is(WickException.Kind.DUPLICATE_SPACE));
    assertThat(e.getMessage(),
        is("index name 'j' of space 'v' is already used by space 'o'"));
    assertThat(info.numSpaces(), is(1));

    // The failed call did not claim index name "a".
    info.addSpace('v', FieldType.FERMION, SpaceType.UNOCCUPIED,
        ImmutableList.of("a", "b"));
    assertThat(info.numSpaces(), is(2));
  }

  @Test void testDuplicateLabel() {
    final OrbitalSpaceInfo info = occupiedVirtual();
    final WickException e =
        assertThrows(WickException.class, () ->
            info.addSpace('o', FieldType.FERMION, SpaceType.OCCUPIED,
                ImmutableList.of("m", "n")));
    assertThat(e.kind(), is(WickException.Kind.DUPLICATE_SPACE));

    // After reset, the label is free again.
    info.reset();
    assertThat(info.numSpaces(), is(0));
    info.addSpace('o', FieldType.FERMION, SpaceType.OCCUPIED,
        ImmutableList.of("m", "n"));
    assertThat(info.indices(0), is(ImmutableList.of("m", "n")));
  }

  @Test void testUnknownSpace() {
    final OrbitalSpaceInfo info = occupiedVirtual();
    final WickException e =
        assertThrows(WickException.class, () -> info.resolve('x'));
    assertThat(e.kind(), is(WickException.Kind.UNKNOWN_SPACE));
    assertThat(e,
        hasToString("UNKNOWN_SPACE Error: orbital space 'x' is not "
            + "registered"));

    final WickException e2 =
        assertThrows(WickException.class, () ->
            info.addSpace('g', FieldType.FERMION, SpaceType.GENERAL,
                ImmutableList.of("p"), ImmutableList.of('o', 'x')));
    assertThat(e2.kind(), is(WickException.Kind.UNKNOWN_SPACE));
  }

  @Test void testComposite() {
    final OrbitalSpaceInfo info = occupiedVirtual();
    final OrbitalSpace g =
        info.addSpace('g', "fermion", "general", ImmutableList.of("p", "q"),
            ImmutableList.of('o', 'v'));
    final OrbitalSpace o = info.resolve('o');
    final OrbitalSpace v = info.resolve('v');
    assertThat(g.isComposite(), is(true));
    assertThat(g.components(), is(ImmutableList.of(o, v)));
    assertThat(o.components(), is(ImmutableList.of(o)));
    assertThat(g.overlaps(o), is(true));
    assertThat(v.overlaps(g), is(true));
    assertThat(o.overlaps(v), is(false));
    assertThat(info.toString(),
        is("0 o fermion occupied [i, j]\n"
            + "1 v fermion unoccupied [a, b, c]\n"
            + "2 g fermion general [p, q] = o + v"));
    assertThat(info.toMap().get('g'),
        is(
            ImmutableMap.of("field_type", "fermion",
                "space_type", "general",
                "indices", ImmutableList.of("p", "q"),
                "elementary_spaces", ImmutableList.of('o', 'v'))));

    // Only a general space may be composite.
    assertThrows(IllegalArgumentException.class, () ->
        info.addSpace('h', FieldType.FERMION, SpaceType.OCCUPIED,
            ImmutableList.of("r"), ImmutableList.of('o')));
    // Components must be elementary.
    assertThrows(IllegalArgumentException.class, () ->
        info.addSpace('h', FieldType.FERMION, SpaceType.GENERAL,
            ImmutableList.of("r"), ImmutableList.of('g')));
  }

  @Test void testFreeze() {
    final OrbitalSpaceInfo info = occupiedVirtual();
    final OrbitalSpaces spaces = info.freeze();
    final OrbitalSpace o = spaces.resolve('o');
    info.reset();
    info.addSpace('x', FieldType.FERMION, SpaceType.OCCUPIED,
        ImmutableList.of("i"));
    assertThat(spaces.size(), is(2));
    assertThat(spaces.contains(o), is(true));
    assertThat(info.freeze().contains(o), is(false));
    final WickException e =
        assertThrows(WickException.class, () -> info.freeze().check(o));
    assertThat(e.kind(), is(WickException.Kind.UNKNOWN_SPACE));
  }

  @Test void testIndexName() {
    final OrbitalSpace o = occupiedVirtual().resolve('o');
    assertThat(o.indexName(0), is("i"));
    assertThat(o.indexName(1), is("j"));
    assertThat(o.indexName(2), is("i_{1}"));
    assertThat(o.indexName(5), is("j_{2}"));
  }
}

// End OrbitalSpaceInfoTest.java
