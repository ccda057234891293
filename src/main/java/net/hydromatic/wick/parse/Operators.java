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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.WickException;
import net.hydromatic.wick.algebra.Expression;
import net.hydromatic.wick.algebra.Index;
import net.hydromatic.wick.algebra.OperatorProduct;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.SqOperator;
import net.hydromatic.wick.algebra.SymbolicTerm;
import net.hydromatic.wick.algebra.Tensor;
import net.hydromatic.wick.space.OrbitalSpace;
import net.hydromatic.wick.space.OrbitalSpaces;

/**
 * Builds expressions from strings.
 *
 * <p>Two notations are supported. The operator notation, used by
 * {@link #op}, is a list of space labels, each followed by {@code +} for a
 * creation operator, for example {@code "v+ v+ o o"}. The term notation, used
 * by {@link #expression}, is the notation in which expressions print, for
 * example {@code "-1/2 t^{o0}_{v0} { a+(v0) a-(o0) }"}.
 */
public class Operators {
  private final OrbitalSpaces spaces;

  public Operators(OrbitalSpaces spaces) {
    this.spaces = requireNonNull(spaces, "spaces");
  }

  /** Creates a normal-ordered operator with an antisymmetric tensor and
   * coefficient 1. */
  public Expression op(String label, List<String> components) {
    return op(label, components, true, Tensor.Symmetry.ANTISYMMETRIC,
        Rational.ONE);
  }

  /**
   * Creates an operator expression, one term per component.
   *
   * <p>In each component, creation operators keep the order of their
   * tokens, and annihilation operators the reverse order. Indices are
   * numbered per space, creation operators first. The tensor is
   * {@code label^{annihilated}_{created}}. If the tensor is antisymmetric,
   * the coefficient is divided by the factorial of the number of creation
   * operators in each space and of annihilation operators in each space.
   *
   * <p>For example, component {@code "v+ v+ o o"} gives
   * {@code 1/4 T^{o0,o1}_{v0,v1} { a+(v0) a+(v1) a-(o1) a-(o0) }}.
   *
   * @param label Label of the tensor
   * @param components Operator strings
   * @param normalOrdered Whether the operators form one normal-ordered
   *     product; if false, they are a bare string
   * @param symmetry Symmetry of the tensor
   * @param coefficient Coefficient of each term
   */
  public Expression op(String label, List<String> components,
      boolean normalOrdered, Tensor.Symmetry symmetry, Rational coefficient) {
    final Expression.Builder builder = Expression.builder();
    for (String component : components) {
      final List<OrbitalSpace> creSpaces = new ArrayList<>();
      final List<OrbitalSpace> annSpaces = new ArrayList<>();
      for (String token : component.trim().split("\\s+")) {
        if (token.isEmpty()) {
          continue;
        }
        if (token.length() > 2
            || token.length() == 2 && token.charAt(1) != '+') {
          throw new WickException(WickException.Kind.MALFORMED_OPERATOR,
              "malformed operator '" + token + "' in '" + component + "'");
        }
        final OrbitalSpace space = spaces.resolve(token.charAt(0));
        (token.length() == 2 ? creSpaces : annSpaces).add(space);
      }

      final Map<OrbitalSpace, Integer> next = new HashMap<>();
      final Map<OrbitalSpace, Integer> creCounts = new HashMap<>();
      final Map<OrbitalSpace, Integer> annCounts = new HashMap<>();
      final List<Index> lower = new ArrayList<>();
      for (OrbitalSpace space : creSpaces) {
        lower.add(new Index(space, next.merge(space, 1, Integer::sum) - 1));
        creCounts.merge(space, 1, Integer::sum);
      }
      final List<Index> upper = new ArrayList<>();
      for (OrbitalSpace space : ImmutableList.copyOf(annSpaces).reverse()) {
        upper.add(new Index(space, next.merge(space, 1, Integer::sum) - 1));
        annCounts.merge(space, 1, Integer::sum);
      }
      final List<SqOperator> ops = new ArrayList<>();
      lower.forEach(index -> ops.add(SqOperator.cre(index)));
      ImmutableList.copyOf(upper).reverse()
          .forEach(index -> ops.add(SqOperator.ann(index)));

      Rational factor = coefficient;
      if (symmetry == Tensor.Symmetry.ANTISYMMETRIC) {
        for (int n : creCounts.values()) {
          factor = factor.times(Rational.inverseFactorial(n));
        }
        for (int n : annCounts.values()) {
          factor = factor.times(Rational.inverseFactorial(n));
        }
      }
      final List<Tensor> tensors =
          ImmutableList.of(new Tensor(label, upper, lower, symmetry));
      builder.add(
          normalOrdered
              ? SymbolicTerm.normalOrdered(tensors, ops)
              : SymbolicTerm.bare(tensors, ops),
          factor);
    }
    return builder.build();
  }

  /** Parses a term, with antisymmetric tensors. */
  public Expression expression(String s) {
    return expression(s, Tensor.Symmetry.ANTISYMMETRIC);
  }

  /**
   * Parses a term in the notation in which terms print.
   *
   * <p>A term is an optional sign, an optional coefficient such as
   * {@code 2} or {@code 1/2}, then tensors such as {@code t^{o0}_{v0}},
   * operators such as {@code a+(v0)} and normal-ordered products such as
   * {@code { a+(v0) a-(o0) }}. An index is a space label followed by an
   * ordinal, optionally separated by "_". An empty string is the empty
   * expression.
   */
  public Expression expression(String s, Tensor.Symmetry symmetry) {
    return new TermParser(s, symmetry).parse();
  }

  /** Recursive-descent parser for a term. */
  private class TermParser {
    private final String s;
    private final Tensor.Symmetry symmetry;
    private int pos;

    TermParser(String s, Tensor.Symmetry symmetry) {
      this.s = s;
      this.symmetry = symmetry;
    }

    Expression parse() {
      skipSpace();
      if (pos == s.length()) {
        return Expression.EMPTY;
      }
      Rational coefficient = Rational.ONE;
      if (peek() == '-' || peek() == '+') {
        if (s.charAt(pos++) == '-') {
          coefficient = Rational.MINUS_ONE;
        }
        skipSpace();
      }
      if (pos < s.length() && Character.isDigit(peek())) {
        final BigInteger numerator = number();
        BigInteger denominator = BigInteger.ONE;
        if (pos < s.length() && peek() == '/') {
          ++pos;
          denominator = number();
          if (denominator.signum() == 0) {
            throw error("zero denominator");
          }
        }
        coefficient = coefficient.times(Rational.of(numerator, denominator));
      }
      final List<Tensor> tensors = new ArrayList<>();
      final List<OperatorProduct> products = new ArrayList<>();
      for (;;) {
        skipSpace();
        if (pos == s.length()) {
          break;
        }
        if (peek() == '{') {
          ++pos;
          final List<SqOperator> ops = new ArrayList<>();
          for (;;) {
            skipSpace();
            if (pos < s.length() && peek() == '}') {
              ++pos;
              break;
            }
            ops.add(operator());
          }
          if (!ops.isEmpty()) {
            products.add(OperatorProduct.of(ops));
          }
        } else if (s.startsWith("a+(", pos) || s.startsWith("a-(", pos)) {
          products.add(OperatorProduct.of(operator()));
        } else {
          tensors.add(tensor());
        }
      }
      return Expression.of(SymbolicTerm.of(tensors, products), coefficient);
    }

    private char peek() {
      return s.charAt(pos);
    }

    private void skipSpace() {
      while (pos < s.length() && Character.isWhitespace(peek())) {
        ++pos;
      }
    }

    private void expect(String token) {
      if (!s.startsWith(token, pos)) {
        throw error("expected '" + token + "'");
      }
      pos += token.length();
    }

    private WickException error(String message) {
      return new WickException(WickException.Kind.MALFORMED_OPERATOR,
          message + " at position " + pos + " in '" + s + "'");
    }

    private BigInteger number() {
      final int start = pos;
      while (pos < s.length() && Character.isDigit(peek())) {
        ++pos;
      }
      if (pos == start) {
        throw error("expected number");
      }
      return new BigInteger(s.substring(start, pos));
    }

    private SqOperator operator() {
      if (s.startsWith("a+(", pos)) {
        pos += 3;
        final Index index = index();
        expect(")");
        return SqOperator.cre(index);
      }
      if (s.startsWith("a-(", pos)) {
        pos += 3;
        final Index index = index();
        expect(")");
        return SqOperator.ann(index);
      }
      throw error("expected operator");
    }

    private Index index() {
      if (pos == s.length()) {
        throw error("expected index");
      }
      final OrbitalSpace space = spaces.resolve(s.charAt(pos++));
      if (pos < s.length() && peek() == '_') {
        ++pos;
      }
      final BigInteger ordinal = number();
      if (ordinal.bitLength() >= Integer.SIZE) {
        throw error("index ordinal " + ordinal + " is too large");
      }
      return new Index(space, ordinal.intValue());
    }

    private Tensor tensor() {
      final int start = pos;
      while (pos < s.length() && peek() != '^') {
        if (Character.isWhitespace(peek())) {
          throw error("expected '^'");
        }
        ++pos;
      }
      if (pos == start || pos == s.length()) {
        throw error("expected tensor");
      }
      final String label = s.substring(start, pos);
      expect("^{");
      final List<Index> upper = indices();
      expect("_{");
      final List<Index> lower = indices();
      return new Tensor(label, upper, lower, symmetry);
    }

    /** Parses a comma-separated list of indices and the closing brace. */
    private List<Index> indices() {
      final List<Index> list = new ArrayList<>();
      skipSpace();
      if (pos < s.length() && peek() == '}') {
        ++pos;
        return list;
      }
      for (;;) {
        skipSpace();
        list.add(index());
        skipSpace();
        if (pos < s.length() && peek() == ',') {
          ++pos;
          continue;
        }
        expect("}");
        return list;
      }
    }
  }
}

// End Operators.java
