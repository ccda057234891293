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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Normal-ordered product of second-quantized operators.
 *
 * <p>Written {@code { a+(v0) a-(o0) }}. Inside the braces operators may be
 * permuted freely, at the cost of a sign for every transposition of two
 * fermion operators. A product of one operator is the same whether it is
 * regarded as normal-ordered or bare.
 */
public final class OperatorProduct {
  /** Order in which operators appear in a canonical product: creation
   * before annihilation, then by space. Ties keep their original order. */
  public static final Comparator<SqOperator> CANONICAL_ORDER =
      Comparator.comparing((SqOperator op) -> op.type)
          .thenComparingInt(op -> op.index.space.position);

  public final ImmutableList<SqOperator> operators;

  private OperatorProduct(ImmutableList<SqOperator> operators) {
    this.operators = operators;
  }

  public static OperatorProduct of(List<SqOperator> operators) {
    checkArgument(!operators.isEmpty(), "empty operator product");
    return new OperatorProduct(ImmutableList.copyOf(operators));
  }

  public static OperatorProduct of(SqOperator... operators) {
    return of(ImmutableList.copyOf(operators));
  }

  public int size() {
    return operators.size();
  }

  public SqOperator get(int i) {
    return operators.get(i);
  }

  /** Returns the number of fermion operators. */
  public int fermionCount() {
    int n = 0;
    for (SqOperator op : operators) {
      if (op.isFermion()) {
        ++n;
      }
    }
    return n;
  }

  /**
   * Returns whether this product commutes, up to sign, with another.
   *
   * <p>Two normal-ordered products commute if no creation operator of one and
   * annihilation operator of the other act on overlapping spaces; otherwise
   * exchanging them would generate contraction terms.
   */
  public boolean commutesWith(OperatorProduct other) {
    for (SqOperator op : operators) {
      for (SqOperator op2 : other.operators) {
        if (op.type != op2.type
            && op.index.space.overlaps(op2.index.space)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Sorts the operators into canonical order by adjacent transpositions.
   *
   * <p>Each transposition of two fermion operators flips the sign; other
   * transpositions are free. If the product contains the same fermion
   * operator twice, it is zero and the result has sign 0.
   */
  public Ordered normalOrder() {
    final List<SqOperator> list = new ArrayList<>(operators);
    for (int i = 0; i < list.size(); i++) {
      final SqOperator op = list.get(i);
      if (op.isFermion() && list.subList(i + 1, list.size()).contains(op)) {
        return new Ordered(0, this);
      }
    }
    int sign = 1;
    for (int end = list.size() - 1; end > 0; end--) {
      for (int i = 0; i < end; i++) {
        final SqOperator left = list.get(i);
        final SqOperator right = list.get(i + 1);
        if (CANONICAL_ORDER.compare(left, right) > 0) {
          list.set(i, right);
          list.set(i + 1, left);
          if (left.isFermion() && right.isFermion()) {
            sign = -sign;
          }
        }
      }
    }
    return new Ordered(sign, new OperatorProduct(ImmutableList.copyOf(list)));
  }

  /** Returns the Hermitian conjugate: operators reversed, each one
   * conjugated. */
  public OperatorProduct adjoint() {
    final ImmutableList.Builder<SqOperator> list = ImmutableList.builder();
    for (SqOperator op : operators.reverse()) {
      list.add(op.adjoint());
    }
    return new OperatorProduct(list.build());
  }

  /** Applies an index mapping. */
  public OperatorProduct reindex(Map<Index, Index> map) {
    return transform(op -> op.reindex(map));
  }

  OperatorProduct transform(Function<SqOperator, SqOperator> fn) {
    final ImmutableList.Builder<SqOperator> list = ImmutableList.builder();
    operators.forEach(op -> list.add(fn.apply(op)));
    return new OperatorProduct(list.build());
  }

  @Override public int hashCode() {
    return operators.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof OperatorProduct
        && operators.equals(((OperatorProduct) o).operators);
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes "a+(v0)" for a single operator,
   * "{ a+(v0) a-(o0) }" for a product of several. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (operators.size() == 1) {
      return buf.append(operators.get(0));
    }
    buf.append("{");
    operators.forEach(op -> buf.append(' ').append(op));
    return buf.append(" }");
  }

  public String latex() {
    if (operators.size() == 1) {
      return operators.get(0).latex();
    }
    final StringBuilder buf = new StringBuilder("\\{");
    operators.forEach(op -> buf.append(' ').append(op.latex()));
    return buf.append(" \\}").toString();
  }

  /** A product with the sign acquired by reordering it. */
  public static final class Ordered {
    /** -1, 0 or 1. */
    public final int sign;
    public final OperatorProduct product;

    Ordered(int sign, OperatorProduct product) {
      this.sign = sign;
      this.product = product;
    }
  }
}

// End OperatorProduct.java
