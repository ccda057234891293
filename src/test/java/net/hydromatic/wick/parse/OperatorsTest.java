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
package net.hydromatic.wick.parse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.wick.TestUtils;
import net.hydromatic.wick.WickException;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.Tensor;
import org.junit.jupiter.api.Test;

/** Tests {@link Operators}. */
public class OperatorsTest {
  private final Operators operators = TestUtils.operators();

  @Test void testOp() {
    assertThat(operators.op("T", ImmutableList.of("v+ v+ o o")),
        hasToString("1/4 T^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }"));
    assertThat(operators.op("T", ImmutableList.of("v+ v+ v v")),
        hasToString("1/4 T^{v2,v3}_{v0,v1} { a+(v0) a+(v1) a-(v3) a-(v2) }"));
    assertThat(operators.op("T", ImmutableList.of("v+ a+ a o")),
        hasToString("T^{o0,a1}_{v0,a0} { a+(v0) a+(a0) a-(a1) a-(o0) }"));
    assertThat(operators.op("T", ImmutableList.of("v+ a+ o a")),
        hasToString("T^{a1,o0}_{v0,a0} { a+(v0) a+(a0) a-(o0) a-(a1) }"));
  }

  @Test void testOpSeveralComponents() {
    assertThat(operators.op("f", ImmutableList.of("o+ v", "v+ o")),
        hasToString("f^{v0}_{o0} { a+(o0) a-(v0) }\n"
            + "+f^{o0}_{v0} { a+(v0) a-(o0) }"));
    // An empty component is a scalar.
    assertThat(operators.op("E", ImmutableList.of("")),
        hasToString("E^{}_{}"));
    // Tensors with the same label but different numbers of indices are
    // different tensors.
    assertThat(operators.op("t", ImmutableList.of("v+ o", "v+ v+ o o")),
        hasToString("t^{o0}_{v0} { a+(v0) a-(o0) }\n"
            + "+1/4 t^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }"));
    assertThat(operators.op("f", ImmutableList.of("o+ v", "")).size(),
        is(2));
  }

  @Test void testOpOptions() {
    assertThat(
        operators.op("t", ImmutableList.of("v+ o"), false,
            Tensor.Symmetry.NONE, Rational.of(-1, 2)),
        hasToString("-1/2 t^{o0}_{v0} a+(v0) a-(o0)"));
    // The factorial prefactor applies only to antisymmetric tensors.
    assertThat(
        operators.op("t", ImmutableList.of("v+ v+ o o"), true,
            Tensor.Symmetry.NONE, Rational.ONE),
        hasToString("t^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }"));
    assertThat(
        operators.op("t", ImmutableList.of("v+ v+ v+ o o o"), true,
            Tensor.Symmetry.ANTISYMMETRIC, Rational.of(2)),
        hasToString("1/18 t^{o0,o1,o2}_{v0,v1,v2} "
            + "{ a+(v0) a+(v1) a+(v2) a-(o2) a-(o1) a-(o0) }"));
  }

  @Test void testMalformed() {
    final WickException e =
        assertThrows(WickException.class, () ->
            operators.op("T", ImmutableList.of("v++ o")));
    assertThat(e.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e2 =
        assertThrows(WickException.class, () ->
            operators.op("T", ImmutableList.of("vo")));
    assertThat(e2.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e3 =
        assertThrows(WickException.class, () ->
            operators.op("T", ImmutableList.of("x+ o")));
    assertThat(e3.kind(), is(WickException.Kind.UNKNOWN_SPACE));
  }

  @Test void testExpressionErrors() {
    final WickException e =
        assertThrows(WickException.class, () ->
            operators.expression("t^{o0_{v0}"));
    assertThat(e.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e2 =
        assertThrows(WickException.class, () ->
            operators.expression("{a+(v0) a*(o0)}"));
    assertThat(e2.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e3 =
        assertThrows(WickException.class, () ->
            operators.expression("a+(z0)"));
    assertThat(e3.kind(), is(WickException.Kind.UNKNOWN_SPACE));
  }

  @Test void testExpressionNumbers() {
    // Coefficients are exact, however large.
    assertThat(operators.expression("123456789012345678901234 t^{o0}_{v0}"),
        hasToString("123456789012345678901234 t^{o0}_{v0}"));
    assertThat(operators.expression("-4/6 t^{o0}_{v0}"),
        hasToString("-2/3 t^{o0}_{v0}"));
    assertThat(operators.expression("a+(o2147483647)"),
        hasToString("a+(o2147483647)"));

    final WickException e =
        assertThrows(WickException.class, () ->
            operators.expression("1/0 t^{o0}_{v0}"));
    assertThat(e.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e2 =
        assertThrows(WickException.class, () ->
            operators.expression("a+(o4294967296) a-(o0)"));
    assertThat(e2.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
    final WickException e3 =
        assertThrows(WickException.class, () ->
            operators.expression("f^{v_2147483648}_{o0}"));
    assertThat(e3.kind(), is(WickException.Kind.MALFORMED_OPERATOR));
  }

  @Test void testExpressionSymmetry() {
    assertThat(
        operators.expression("t^{o0}_{v0}", Tensor.Symmetry.NONE)
            .terms.keySet().iterator().next().tensors.get(0).symmetry,
        is(Tensor.Symmetry.NONE));
    assertThat(
        operators.expression("t^{o0}_{v0}")
            .terms.keySet().iterator().next().tensors.get(0).symmetry,
        is(Tensor.Symmetry.ANTISYMMETRIC));
  }
}

// End OperatorsTest.java
