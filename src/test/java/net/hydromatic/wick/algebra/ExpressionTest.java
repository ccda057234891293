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
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.TestUtils;
import net.hydromatic.wick.WickException;
import net.hydromatic.wick.parse.Operators;
import net.hydromatic.wick.space.OrbitalSpace;
import net.hydromatic.wick.space.OrbitalSpaceInfo;
import net.hydromatic.wick.space.OrbitalSpaces;
import org.junit.jupiter.api.Test;

/** Tests {@link Expression}. */
public class ExpressionTest {
  private final OrbitalSpaces spaces = TestUtils.spaces();
  private final Operators operators = new Operators(spaces);

  private Expression expr(String s) {
    return operators.expression(s);
  }

  private Index index(char space, int ordinal) {
    return new Index(spaces.resolve(space), ordinal);
  }

  @Test void testBuildAndPrint() {
    final Expression.Builder builder = Expression.builder();
    builder.add(
        SymbolicTerm.normalOrdered(ImmutableList.of(),
            ImmutableList.of(SqOperator.cre(index('v', 0)),
                SqOperator.ann(index('o', 0)))),
        Rational.ONE);
    assertThat(builder.build(), hasToString("{ a+(v0) a-(o0) }"));

    final SymbolicTerm a0 =
        SymbolicTerm.normalOrdered(ImmutableList.of(),
            ImmutableList.of(SqOperator.cre(index('a', 0))));
    builder.add(a0, Rational.of(1, 2));
    assertThat(builder.build(),
        hasToString("{ a+(v0) a-(o0) }\n+1/2 a+(a0)"));

    final Expression e =
        builder.build().plus(Expression.of(a0));
    assertThat(e, hasToString("{ a+(v0) a-(o0) }\n+3/2 a+(a0)"));

    final Expression canonical = e.canonicalize();
    assertThat(canonical, hasToString("3/2 a+(a0)\n+{ a+(v0) a-(o0) }"));
    final List<String> entries = new ArrayList<>();
    for (Map.Entry<SymbolicTerm, Rational> entry : canonical) {
      entries.add(entry.getKey() + " : " + entry.getValue());
    }
    assertThat(entries,
        is(ImmutableList.of("a+(a0) : 3/2", "{ a+(v0) a-(o0) } : 1")));
  }

  @Test void testParseAndPrint() {
    assertThat(expr(""), hasToString(""));
    assertThat(expr("").isEmpty(), is(true));
    assertThat(expr("1"), hasToString("1"));
    assertThat(expr("-1"), hasToString("-1"));
    assertThat(expr("-t^{a_1}_{o_0} a+(a_1) a-(o_0)"),
        hasToString("-t^{a1}_{o0} a+(a1) a-(o0)"));
    assertThat(expr("-t^{a_1}_{o_0} {a+(a_1) a-(o_0)}"),
        hasToString("-t^{a1}_{o0} { a+(a1) a-(o0) }"));
    assertThat(expr("f^{o0}_{}"), hasToString("f^{o0}_{}"));
    assertThat(expr("3/6 f^{o0}_{v1}"), hasToString("1/2 f^{o0}_{v1}"));
  }

  @Test void testArithmetic() {
    final Expression a = expr("t^{o0}_{v0} {a+(v0) a-(o0)}");
    final Expression b = expr("2 f^{v0}_{o0}");
    assertThat(a.plus(b).minus(a), is(b));
    assertThat(a.minus(a).isEmpty(), is(true));
    assertThat(b.negate(), hasToString("-2 f^{v0}_{o0}"));
    assertThat(b.times(Rational.of(1, 4)), hasToString("1/2 f^{v0}_{o0}"));
    assertThat(b.times(Rational.ZERO).isEmpty(), is(true));
    assertThat(a.plus(b).size(), is(2));
    assertThat(a.plus(b).coefficient(b.terms.keySet().iterator().next()),
        is(Rational.of(2)));
  }

  /** The product renames the indices of the right operand so that they do
   * not clash with the left operand's. */
  @Test void testTimes() {
    final Expression a = expr("1/2 t^{o0}_{v0} {a+(v0) a-(o0)}");
    final Expression b = expr("-f^{v0}_{o0} {a+(o0) a-(v0)}");
    assertThat(a.times(b),
        hasToString("-1/2 t^{o0}_{v0} f^{v1}_{o1} { a+(v0) a-(o0) } "
            + "{ a+(o1) a-(v1) }"));
    assertThat(a.times(Expression.of(Rational.of(3))),
        hasToString("3/2 t^{o0}_{v0} { a+(v0) a-(o0) }"));
  }

  @Test void testDotAndNorm() {
    final Expression e = expr("2 a+(v_1) a-(o_0)");
    assertThat(e.dot(e), is(Rational.of(4)));
    assertThat(e.norm(), is(2.0));

    final Expression e2 = expr("-1 a+(v_2) a-(o_0)");
    assertThat(e.dot(e2), is(Rational.ZERO));
    assertThat(e2.dot(e), is(Rational.ZERO));
    assertThat(e2.norm(), is(1.0));

    final Expression e3 = expr("a+(v_1) a-(o_0)").minus(e2).plus(e);
    assertThat(e3.dot(e), is(Rational.of(6)));
    assertThat(e3.dot(e2), is(Rational.of(-1)));
  }

  @Test void testAdjoint() {
    final Expression e = expr("2 t^{o0}_{v0} {a+(v0) a-(o0)}");
    assertThat(e.adjoint(), hasToString("2 t^{v0}_{o0} { a+(o0) a-(v0) }"));
    assertThat(e.adjoint().adjoint(), is(e));

    // The order of products is reversed.
    final Expression e2 = expr("a+(v0) {a+(o0) a-(v1)}");
    assertThat(e2.adjoint(), hasToString("{ a+(v1) a-(o0) } a-(v0)"));
  }

  @Test void testReindex() {
    final Expression e = expr("t^{o0}_{v0} {a+(v0) a-(o0)}");
    final Map<Index, Index> map =
        ImmutableMap.of(index('o', 0), index('o', 5));
    assertThat(e.reindex(map), hasToString("t^{o5}_{v0} { a+(v0) a-(o5) }"));
    // Canonicalization undoes the renaming.
    assertThat(e.reindex(map).canonicalize(), is(e.canonicalize()));
  }

  @Test void testLatex() {
    final Expression e =
        expr("1/2 t^{o0}_{v0} {a+(v0) a-(o0)}")
            .plus(expr("-f^{o1}_{o0}"));
    assertThat(e.latex(),
        is("+\\frac{1}{2} t^{i}_{a} \\{ \\hat{a}^\\dagger_{a} \\hat{a}_{i} \\}"
            + " \\\\ \n"
            + "-f^{j}_{i}"));
    assertThat(e.latex(" "),
        is("+\\frac{1}{2} t^{i}_{a} \\{ \\hat{a}^\\dagger_{a} \\hat{a}_{i} \\}"
            + " -f^{j}_{i}"));
  }

  @Test void testArityMismatch() {
    // Same label, different numbers of indices: two different tensors.
    assertThat(expr("t^{o0}_{v0}").plus(expr("t^{o0,o1}_{v0,v1}")).size(),
        is(2));
    // Same label and numbers of indices, but a different symmetry.
    final Expression fixed =
        operators.expression("t^{o0,o1}_{v0,v1}", Tensor.Symmetry.NONE);
    final WickException e =
        assertThrows(WickException.class, () ->
            expr("t^{o0,o1}_{v0,v1}").plus(fixed));
    assertThat(e.kind(), is(WickException.Kind.INDEX_ARITY_MISMATCH));
    // With one upper and one lower index, symmetry makes no difference.
    assertThat(
        expr("t^{o0}_{v0}")
            .plus(operators.expression("t^{o1}_{v1}", Tensor.Symmetry.NONE))
            .size(),
        is(2));
  }

  /** Canonicalizing the parts of a sum, then the sum, gives the same result
   * as canonicalizing the sum. */
  @Test void testCanonicalizeIsCongruence() {
    final Expression e1 =
        expr("t^{o1}_{v1} {a+(v1) a-(o1)}")
            .plus(expr("1/2 w^{o0,o1}_{v0,v1} f^{v1}_{o1} {a+(v0) a-(o0)}"));
    final Expression e2 =
        expr("-t^{o2}_{v3} {a+(v3) a-(o2)}")
            .plus(expr("1/2 f^{v3}_{o3} w^{o3,o4}_{v3,v2} {a+(v2) a-(o4)}"));
    final Expression sum = e1.plus(e2).canonicalize();
    assertThat(e1.canonicalize().plus(e2.canonicalize()).canonicalize(),
        is(sum));
    assertThat(sum,
        hasToString("f^{v1}_{o1} w^{o0,o1}_{v0,v1} { a+(v0) a-(o0) }"));
    assertThat(sum.canonicalize(), is(sum));
  }

  @Test void testVacuumNormalOrder() {
    final Expression e = expr("a-(o0) a+(o0)");
    assertThat(e.isVacuumNormalOrdered(), is(false));
    final Expression ordered = e.vacuumNormalOrdered(true).canonicalize();
    assertThat(ordered, hasToString("delta^{o0}_{o0}\n-a+(o0) a-(o0)"));
    assertThat(ordered.isVacuumNormalOrdered(), is(true));

    // Different indices are different orbitals, unless asked otherwise.
    final Expression e2 = expr("t^{o0}_{o1} a-(o0) a+(o1)");
    assertThat(e2.vacuumNormalOrdered(true),
        hasToString("-t^{o0}_{o1} a+(o1) a-(o0)"));
    assertThat(e2.vacuumNormalOrdered(false).canonicalize(),
        hasToString("t^{o0}_{o0}\n-t^{o1}_{o0} a+(o0) a-(o1)"));
  }

  /** Bosons exchange without a sign. */
  @Test void testVacuumNormalOrderBoson() {
    final OrbitalSpaceInfo info = TestUtils.singleReference();
    final OrbitalSpace b =
        info.addSpace('b', "boson", "unoccupied", ImmutableList.of("w0"),
            ImmutableList.of());
    final Index b0 = new Index(b, 0);
    final Expression e =
        Expression.of(
            SymbolicTerm.bare(ImmutableList.of(),
                ImmutableList.of(SqOperator.ann(b0), SqOperator.cre(b0))));
    assertThat(e.vacuumNormalOrdered(true).canonicalize(),
        hasToString("delta^{b0}_{b0}\n+a+(b0) a-(b0)"));
  }

  /** An operator of a composite space exchanged with an operator of one of
   * its components gives a delta on that component. */
  @Test void testVacuumNormalOrderComposite() {
    final OrbitalSpaceInfo info = TestUtils.singleReference();
    info.addSpace('g', "fermion", "general", ImmutableList.of("p", "q"),
        ImmutableList.of('o', 'v'));
    final Operators operators = new Operators(info.freeze());
    final Expression e =
        operators.expression("a-(g0) a+(o0)")
            .vacuumNormalOrdered(false)
            .canonicalize();
    assertThat(e.size(), is(3));
    final List<String> terms = new ArrayList<>();
    e.forEach(entry ->
        terms.add(entry.getValue() + " " + entry.getKey()));
    assertThat(terms.contains("1 delta^{o0}_{o0}"), is(true));
    assertThat(terms.contains("-1 a+(o0) a-(v0)"), is(true));
    assertThat(e.isVacuumNormalOrdered(), is(true));
  }
}

// End ExpressionTest.java
