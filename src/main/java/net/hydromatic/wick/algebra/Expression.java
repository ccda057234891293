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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.WickException;

/**
 * Sum of terms, each a {@link SymbolicTerm} with an exact rational
 * coefficient.
 *
 * <p>An expression is immutable. Terms keep the order in which they were
 * first added, except that {@link #canonicalize()} sorts them. No term has a
 * zero coefficient, and no term occurs twice.
 *
 * <p>Two expressions are equal if they have the same terms with the same
 * coefficients. Expressions that are equal in value but written differently
 * become equal once both are canonicalized.
 */
public final class Expression
    implements Iterable<Map.Entry<SymbolicTerm, Rational>> {
  public static final Expression EMPTY = new Expression(ImmutableMap.of());

  /** Default separator between terms in {@link #latex()}. */
  public static final String LATEX_SEPARATOR = " \\\\ \n";

  public final ImmutableMap<SymbolicTerm, Rational> terms;

  private Expression(ImmutableMap<SymbolicTerm, Rational> terms) {
    this.terms = terms;
  }

  /** Creates an expression with one term. */
  public static Expression of(SymbolicTerm term, Rational coefficient) {
    return builder().add(term, coefficient).build();
  }

  /** Creates an expression with one term whose coefficient is 1. */
  public static Expression of(SymbolicTerm term) {
    return of(term, Rational.ONE);
  }

  /** Creates an expression that is a number. */
  public static Expression of(Rational value) {
    return of(SymbolicTerm.ONE, value);
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return terms.size();
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  /** Returns the coefficient of a term, or zero if absent. */
  public Rational coefficient(SymbolicTerm term) {
    return terms.getOrDefault(term, Rational.ZERO);
  }

  @Override public Iterator<Map.Entry<SymbolicTerm, Rational>> iterator() {
    return terms.entrySet().iterator();
  }

  public Expression plus(Expression e) {
    return builder().addAll(this).addAll(e).build();
  }

  public Expression minus(Expression e) {
    return builder().addAll(this).addAll(e, Rational.MINUS_ONE).build();
  }

  public Expression negate() {
    return times(Rational.MINUS_ONE);
  }

  /** Multiplies every coefficient by a number. */
  public Expression times(Rational factor) {
    return builder().addAll(this, factor).build();
  }

  /**
   * Returns the product of this expression and another.
   *
   * <p>The product does not commute: each term of the result is a term of this
   * expression followed by a term of {@code e}, whose summation indices are
   * renamed so as not to clash.
   *
   * @see SymbolicTerm#times(SymbolicTerm)
   */
  public Expression times(Expression e) {
    final Builder builder = builder();
    terms.forEach((term, coefficient) ->
        e.terms.forEach((term2, coefficient2) ->
            builder.add(term.times(term2), coefficient.times(coefficient2))));
    return builder.build();
  }

  /**
   * Returns the canonical form of this expression.
   *
   * <p>Every term is canonicalized by {@link Canonicalizer}; terms with the
   * same canonical form are merged; terms whose coefficient becomes zero are
   * removed; the remaining terms are sorted by {@link SymbolicTerm#ORDERING}.
   */
  public Expression canonicalize() {
    final Builder builder = builder();
    terms.forEach((term, coefficient) -> {
      final Canonicalizer.Canonical canonical =
          Canonicalizer.canonicalize(term);
      if (canonical.sign != 0) {
        builder.add(canonical.term, coefficient.times(canonical.sign));
      }
    });
    return builder.buildSorted();
  }

  /** Substitutes indices according to a map. Unlike canonicalization, this
   * renames specific indices, for example to align external indices. */
  public Expression reindex(Map<Index, Index> map) {
    final Builder builder = builder();
    terms.forEach((term, coefficient) ->
        builder.add(term.reindex(map), coefficient));
    return builder.build();
  }

  /** Returns the Hermitian conjugate. Coefficients are real, so they are
   * unchanged. */
  public Expression adjoint() {
    final Builder builder = builder();
    terms.forEach((term, coefficient) ->
        builder.add(term.adjoint(), coefficient));
    return builder.build();
  }

  /** Returns the sum, over terms that occur in both expressions, of the
   * product of their coefficients. Terms are compared as written. */
  public Rational dot(Expression e) {
    Rational sum = Rational.ZERO;
    for (Map.Entry<SymbolicTerm, Rational> entry : terms.entrySet()) {
      final Rational coefficient2 = e.terms.get(entry.getKey());
      if (coefficient2 != null) {
        sum = sum.plus(entry.getValue().times(coefficient2));
      }
    }
    return sum;
  }

  /** Returns the square root of the dot product of this expression with
   * itself. */
  public double norm() {
    return Math.sqrt(dot(this).doubleValue());
  }

  /** Returns whether, in every term, all creation operators are to the left
   * of all annihilation operators. */
  public boolean isVacuumNormalOrdered() {
    for (SymbolicTerm term : terms.keySet()) {
      if (firstDisorder(term.operators()) >= 0) {
        return false;
      }
    }
    return true;
  }

  /** Returns the position of the first annihilation operator that is
   * immediately followed by a creation operator, or -1. */
  private static int firstDisorder(List<SqOperator> ops) {
    for (int i = 0; i + 1 < ops.size(); i++) {
      if (!ops.get(i).isCreation() && ops.get(i + 1).isCreation()) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Moves creation operators to the left of annihilation operators, with
   * respect to the true vacuum.
   *
   * <p>The operators of each term are treated as a bare product. Each
   * exchange uses {@code a_p a_q^+ = delta_pq - a_q^+ a_p} (with {@code +}
   * for bosons). The delta term is produced when the two operators act on
   * the same index; when they act on different indices of the same space it
   * is produced, by substituting one index for the other, unless {@code
   * onlySameIndexContractions} is true, in which case different indices are
   * assumed to denote different orbitals. If the surviving index then occurs
   * nowhere else, the delta term gets the trace {@code delta^{p}_{p}}. If
   * the two operators act on overlapping spaces, one of them composite, the
   * term is first expanded over the components of its composite indices.
   *
   * @param onlySameIndexContractions Whether to contract only operators with
   *     the same index
   * @return Expression whose operators are bare and vacuum-normal-ordered
   */
  public Expression vacuumNormalOrdered(boolean onlySameIndexContractions) {
    final Builder builder = builder();
    final Deque<Pending> work = new ArrayDeque<>();
    terms.forEach((term, coefficient) ->
        work.push(new Pending(term.tensors, term.operators(), coefficient)));
    while (!work.isEmpty()) {
      final Pending pending = work.pop();
      final int i = firstDisorder(pending.operators);
      if (i < 0) {
        builder.add(SymbolicTerm.bare(pending.tensors, pending.operators),
            pending.coefficient);
        continue;
      }
      final SqOperator ann = pending.operators.get(i);
      final SqOperator cre = pending.operators.get(i + 1);
      if (!ann.index.space.equals(cre.index.space)
          && ann.index.space.overlaps(cre.index.space)) {
        // A composite space meets one of its components; split the term
        // over the components of its composite indices.
        for (SymbolicTerm term
            : SymbolicTerm.bare(pending.tensors, pending.operators)
                .expandComposite()) {
          work.push(
              new Pending(term.tensors, term.operators(), pending.coefficient));
        }
        continue;
      }
      final List<SqOperator> swapped = new ArrayList<>(pending.operators);
      swapped.set(i, cre);
      swapped.set(i + 1, ann);
      final boolean fermions = ann.isFermion() && cre.isFermion();
      work.push(
          new Pending(pending.tensors, swapped,
              fermions ? pending.coefficient.negate() : pending.coefficient));
      if (!ann.index.space.equals(cre.index.space)) {
        continue;
      }
      if (ann.index.equals(cre.index) || !onlySameIndexContractions) {
        final List<SqOperator> rest = new ArrayList<>(pending.operators);
        rest.remove(i + 1);
        rest.remove(i);
        final SymbolicTerm contracted =
            SymbolicTerm.bare(pending.tensors, rest)
                .reindex(ImmutableMap.of(cre.index, ann.index));
        final List<Tensor> tensors = new ArrayList<>(contracted.tensors);
        if (!contracted.indices().contains(ann.index)) {
          // The sum over the index is the dimension of its space.
          tensors.add(Tensor.trace(ann.index));
        }
        work.push(
            new Pending(tensors, contracted.operators(), pending.coefficient));
      }
    }
    return builder.build();
  }

  /**
   * Converts this expression into many-body equations.
   *
   * <p>Each term must have at most one normal-ordered product of operators.
   * Terms are grouped by a key made of the spaces of the creation operators
   * and of the annihilation operators, such as "oo|vv"; each term gives an
   * equation {@code label^{ann}_{cre} += coefficient * tensors}. A term with
   * no operators has key "|".
   *
   * @param label Label of the result tensor
   * @return Map from key to equations, in order of first occurrence
   */
  public Map<String, List<Equation>> toManybodyEquations(String label) {
    final Map<String, List<Equation>> map = new LinkedHashMap<>();
    terms.forEach((term, coefficient) -> {
      checkArgument(term.isNormalOrdered(),
          "term is not normal ordered: %s", term);
      final List<SqOperator> ops = term.operators();
      final StringBuilder lowerKey = new StringBuilder();
      final StringBuilder upperKey = new StringBuilder();
      final List<Index> lower = new ArrayList<>();
      final List<Index> upper = new ArrayList<>();
      boolean fermion = true;
      for (SqOperator op : ops) {
        if (op.isCreation()) {
          lowerKey.append(op.index.space.label);
          lower.add(op.index);
        } else {
          upperKey.append(op.index.space.label);
          upper.add(op.index);
        }
        fermion &= op.isFermion();
      }
      final Tensor lhs =
          new Tensor(label, upper, lower,
              fermion
                  ? Tensor.Symmetry.ANTISYMMETRIC
                  : Tensor.Symmetry.SYMMETRIC);
      final SymbolicTerm rhs =
          SymbolicTerm.of(term.tensors, ImmutableList.of());
      map.computeIfAbsent(lowerKey + "|" + upperKey, k -> new ArrayList<>())
          .add(new Equation(lhs, rhs, coefficient));
    });
    final ImmutableMap.Builder<String, List<Equation>> builder =
        ImmutableMap.builder();
    map.forEach((key, list) -> builder.put(key, ImmutableList.copyOf(list)));
    return builder.build();
  }

  @Override public int hashCode() {
    return terms.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Expression
        && terms.equals(((Expression) o).terms);
  }

  /**
   * Returns one line per term.
   *
   * <p>For example,
   *
   * <blockquote><pre>
   * 3/2 a+(a0)
   * +{ a+(v0) a-(o0) }
   * -1/4 t^{o0,o1}_{v0,v1} v^{v0,v1}_{o0,o1}</pre></blockquote>
   */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    terms.forEach((term, coefficient) -> {
      if (buf.length() > 0) {
        buf.append('\n');
        buf.append(coefficient.signum() < 0 ? '-' : '+');
      } else if (coefficient.signum() < 0) {
        buf.append('-');
      }
      final Rational abs = coefficient.abs();
      if (term == SymbolicTerm.ONE) {
        buf.append(abs);
      } else {
        if (!abs.isOne()) {
          buf.append(abs).append(' ');
        }
        term.describeTo(buf);
      }
    });
    return buf.toString();
  }

  /** Returns the LaTeX form, with terms separated by
   * {@link #LATEX_SEPARATOR}. */
  public String latex() {
    return latex(LATEX_SEPARATOR);
  }

  /** Returns the LaTeX form, with terms separated by a given string. */
  public String latex(String separator) {
    final StringBuilder buf = new StringBuilder();
    terms.forEach((term, coefficient) -> {
      if (buf.length() > 0) {
        buf.append(separator);
      }
      buf.append(coefficient.signum() < 0 ? "-" : "+");
      final Rational abs = coefficient.abs();
      if (term == SymbolicTerm.ONE) {
        buf.append(abs.latex());
      } else {
        if (!abs.isOne()) {
          buf.append(abs.latex()).append(' ');
        }
        buf.append(term.latex());
      }
    });
    return buf.toString();
  }

  /** Term waiting to be normal-ordered. */
  private static class Pending {
    final List<Tensor> tensors;
    final List<SqOperator> operators;
    final Rational coefficient;

    Pending(List<Tensor> tensors, List<SqOperator> operators,
        Rational coefficient) {
      this.tensors = tensors;
      this.operators = operators;
      this.coefficient = coefficient;
    }
  }

  /**
   * Accumulates terms, merging equal terms and dropping zeros.
   *
   * <p>A tensor is identified by its label and its numbers of upper and
   * lower indices, so {@code t^{o0}_{v0}} and {@code t^{o0,o1}_{v0,v1}} are
   * different tensors. If a tensor with more than one upper (or lower) index
   * is used with two different symmetries, throws {@link WickException} with
   * kind {@link WickException.Kind#INDEX_ARITY_MISMATCH}.
   */
  public static final class Builder {
    private final Map<SymbolicTerm, Rational> map = new LinkedHashMap<>();
    private final Map<List<Object>, Tensor> tensorByKey = new HashMap<>();

    private Builder() {}

    public Builder add(SymbolicTerm term, Rational coefficient) {
      requireNonNull(term, "term");
      if (coefficient.isZero()) {
        return this;
      }
      for (Tensor tensor : term.tensors) {
        if (!tensor.hasPermutableSlots()) {
          continue;
        }
        final Tensor previous =
            tensorByKey.putIfAbsent(
                ImmutableList.of(tensor.label, tensor.upper.size(),
                    tensor.lower.size()), tensor);
        if (previous != null && previous.symmetry != tensor.symmetry) {
          throw new WickException(WickException.Kind.INDEX_ARITY_MISMATCH,
              "tensor " + tensor + " is " + tensor.symmetry
                  + " but tensor " + previous + " is " + previous.symmetry);
        }
      }
      final Rational sum = map.getOrDefault(term, Rational.ZERO)
          .plus(coefficient);
      if (sum.isZero()) {
        map.remove(term);
      } else {
        map.put(term, sum);
      }
      return this;
    }

    public Builder addAll(Expression e) {
      e.terms.forEach(this::add);
      return this;
    }

    public Builder addAll(Expression e, Rational factor) {
      e.terms.forEach((term, coefficient) ->
          add(term, coefficient.times(factor)));
      return this;
    }

    public boolean isEmpty() {
      return map.isEmpty();
    }

    public Expression build() {
      return map.isEmpty() ? EMPTY : new Expression(ImmutableMap.copyOf(map));
    }

    /** Builds an expression whose terms are sorted. */
    Expression buildSorted() {
      final List<SymbolicTerm> list = new ArrayList<>(map.keySet());
      list.sort(SymbolicTerm.ORDERING);
      final ImmutableMap.Builder<SymbolicTerm, Rational> builder =
          ImmutableMap.builder();
      list.forEach(term -> builder.put(term, map.get(term)));
      return new Expression(builder.build());
    }
  }
}

// End Expression.java
