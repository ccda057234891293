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
package net.hydromatic.wick;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    assertThat(Prop.PARALLELISM.intValue(map), is(1));
    assertThat(Prop.SYMMETRY_PRUNING.booleanValue(map), is(true));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("parallelism"), is(Prop.PARALLELISM));
    assertThat(Prop.lookup("symmetryPruning"), is(Prop.SYMMETRY_PRUNING));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    Prop.PARALLELISM.setLenient(map, " 3 ");
    assertThat(Prop.PARALLELISM.intValue(map), is(3));
    Prop.SYMMETRY_PRUNING.setLenient(map, "false");
    assertThat(Prop.SYMMETRY_PRUNING.booleanValue(map), is(false));

    // null restores the default
    Prop.PARALLELISM.set(map, null);
    assertThat(Prop.PARALLELISM.intValue(map), is(1));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLELISM.set(map, "two"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLELISM.setLenient(map, "two"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PARALLELISM.set(map, -1));
  }
}

// End PropTest.java
