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
package net.hydromatic.wick.algebra;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.TestUtils;
import net.hydromatic.wick.parse.Operators;
import org.junit.jupiter.api.Test;

/** Tests {@link Commutators}. */
public class CommutatorsTest {
  private final Operators operators = TestUtils.operators();

  @Test void testAntisymmetric() {
    final Expression a = operators.op("f", ImmutableList.of("o+ v", "v+ o"));
    final Expression b = operators.op("t", ImmutableList.of("v+ o"));
    final Expression ab = Commutators.commutator(a, b).canonicalize();
    final Expression ba = Commutators.commutator(b, a).canonicalize();
    assertThat(ab.isEmpty(), is(false));
    assertThat(ab, is(ba.negate().canonicalize()));
  }

  @Test void testSelfCommutatorVanishes() {
    final Expression a =
        operators.op("v", ImmutableList.of("o+ o+ v v", "v+ o"));
    assertThat(Commutators.commutator(a, a).canonicalize().isEmpty(),
        is(true));
  }

  @Test void testNested() {
    final Expression a = operators.op("f", ImmutableList.of("o+ v"));
    final Expression b = operators.op("t", ImmutableList.of("v+ o"));
    final Expression c = operators.op("u", ImmutableList.of("v+ v"));
    assertThat(Commutators.commutator(a, b, c),
        is(
            Commutators.commutator(Commutators.commutator(a, b), c)));
  }

  /** Before canonicalization, the series to second order has six terms:
   * A, AB, -BA, AB²/2, -BAB and B²A/2. */
  @Test void testBchSeries() {
    final Expression a = operators.op("A", ImmutableList.of("v+ o"));
    final Expression b = operators.op("B", ImmutableList.of("o+ v"));
    final Expression bch = Commutators.bchSeries(a, b, 2);
    assertThat(bch.size(), is(6));
    final List<String> coefficients = new ArrayList<>();
    final List<Integer> tensorCounts = new ArrayList<>();
    for (Map.Entry<SymbolicTerm, Rational> entry : bch) {
      coefficients.add(entry.getValue().toString());
      tensorCounts.add(entry.getKey().tensors.size());
    }
    assertThat(coefficients,
        is(ImmutableList.of("1", "1", "-1", "1/2", "-1", "1/2")));
    assertThat(tensorCounts, is(ImmutableList.of(1, 2, 2, 3, 3, 3)));

    assertThat(Commutators.bchSeries(a, b, 0), is(a));
    assertThrows(IllegalArgumentException.class, () ->
        Commutators.bchSeries(a, b, -1));
  }

  /** Operators on different spaces commute, so the series collapses to its
   * first term. */
  @Test void testBchSeriesOfCommutingOperators() {
    final Expression c = operators.op("C", ImmutableList.of("o+ o"));
    final Expression d = operators.op("D", ImmutableList.of("v+ v"));
    final Expression bch = Commutators.bchSeries(c, d, 2);
    assertThat(bch.size(), is(6));
    assertThat(bch.canonicalize().size(), is(1));
    assertThat(bch.canonicalize(), is(c.canonicalize()));
  }
}

// End CommutatorsTest.java
