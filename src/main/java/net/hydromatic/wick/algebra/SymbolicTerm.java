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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.wick.space.OrbitalSpace;

/**
 * Product of tensors and operators, without its coefficient.
 *
 * <p>The operator part is an ordered list of normal-ordered products; a bare
 * string of operators is a list of products of one operator each. Every index
 * is summed over its space.
 *
 * @see Expression
 */
public final class SymbolicTerm {
  /** The term with no tensors and no operators; multiplied by a coefficient
   * it is a number. */
  public static final SymbolicTerm ONE =
      new SymbolicTerm(ImmutableList.of(), ImmutableList.of());

  /** Ordering used to sort the terms of a canonical expression: by number of
   * operators, then by number of products, then by text. */
  public static final Comparator<SymbolicTerm> ORDERING =
      Comparator.comparingInt(SymbolicTerm::numOps)
          .thenComparingInt((SymbolicTerm t) -> t.products.size())
          .thenComparing(SymbolicTerm::toString);

  public final ImmutableList<Tensor> tensors;
  public final ImmutableList<OperatorProduct> products;

  private SymbolicTerm(ImmutableList<Tensor> tensors,
      ImmutableList<OperatorProduct> products) {
    this.tensors = tensors;
    this.products = products;
  }

  public static SymbolicTerm of(List<Tensor> tensors,
      List<OperatorProduct> products) {
    if (tensors.isEmpty() && products.isEmpty()) {
      return ONE;
    }
    return new SymbolicTerm(ImmutableList.copyOf(tensors),
        ImmutableList.copyOf(products));
  }

  /** Creates a term with one normal-ordered product. */
  public static SymbolicTerm normalOrdered(List<Tensor> tensors,
      List<SqOperator> operators) {
    return of(tensors,
        operators.isEmpty()
            ? ImmutableList.of()
            : ImmutableList.of(OperatorProduct.of(operators)));
  }

  /** Creates a term whose operators form a bare string. */
  public static SymbolicTerm bare(List<Tensor> tensors,
      List<SqOperator> operators) {
    final ImmutableList.Builder<OperatorProduct> products =
        ImmutableList.builder();
    operators.forEach(op -> products.add(OperatorProduct.of(op)));
    return of(tensors, products.build());
  }

  /** Returns all operators, in order. */
  public List<SqOperator> operators() {
    final ImmutableList.Builder<SqOperator> list = ImmutableList.builder();
    products.forEach(p -> list.addAll(p.operators));
    return list.build();
  }

  /** Returns the number of operators. */
  public int numOps() {
    int n = 0;
    for (OperatorProduct product : products) {
      n += product.size();
    }
    return n;
  }

  /** Returns whether the operators form a single normal-ordered product
   * (or there are none). */
  public boolean isNormalOrdered() {
    return products.size() <= 1;
  }

  /** Returns the distinct indices, in order of occurrence: operators first,
   * then tensors. */
  public Set<Index> indices() {
    final Set<Index> set = new LinkedHashSet<>();
    forEachIndex(set::add);
    return set;
  }

  /** Calls an action for every occurrence of an index. */
  public void forEachIndex(Consumer<Index> consumer) {
    for (OperatorProduct product : products) {
      for (SqOperator op : product.operators) {
        consumer.accept(op.index);
      }
    }
    for (Tensor tensor : tensors) {
      tensor.upper.forEach(consumer);
      tensor.lower.forEach(consumer);
    }
  }

  /** Returns, for each space used, one more than the largest ordinal. */
  public Map<OrbitalSpace, Integer> nextOrdinals() {
    final Map<OrbitalSpace, Integer> map = new HashMap<>();
    forEachIndex(index ->
        map.merge(index.space, index.ordinal + 1, Math::max));
    return map;
  }

  /**
   * Returns the product of this term and another.
   *
   * <p>The indices of {@code other} are shifted past the indices of this term
   * so that the two terms share no summation index.
   */
  public SymbolicTerm times(SymbolicTerm other) {
    if (other == ONE) {
      return this;
    }
    if (this == ONE) {
      return other;
    }
    final Map<OrbitalSpace, Integer> offsets = nextOrdinals();
    final Map<Index, Index> map = new HashMap<>();
    for (Index index : other.indices()) {
      final int offset = offsets.getOrDefault(index.space, 0);
      map.put(index, index.withOrdinal(index.ordinal + offset));
    }
    final SymbolicTerm other2 = other.reindex(map);
    return of(
        ImmutableList.<Tensor>builder()
            .addAll(tensors).addAll(other2.tensors).build(),
        ImmutableList.<OperatorProduct>builder()
            .addAll(products).addAll(other2.products).build());
  }

  /**
   * Replaces each index of a composite space by an index of each of its
   * components, returning one term per combination.
   *
   * <p>New indices get ordinals beyond those already used in their space.
   * A term with no composite index is returned unchanged.
   */
  public List<SymbolicTerm> expandComposite() {
    final List<Index> composites = new ArrayList<>();
    final List<List<OrbitalSpace>> choices = new ArrayList<>();
    for (Index index : indices()) {
      if (index.space.isComposite()) {
        composites.add(index);
        choices.add(index.space.elementarySpaces);
      }
    }
    if (composites.isEmpty()) {
      return ImmutableList.of(this);
    }
    final Map<OrbitalSpace, Integer> nextOrdinals = nextOrdinals();
    final ImmutableList.Builder<SymbolicTerm> terms = ImmutableList.builder();
    for (List<OrbitalSpace> choice : Lists.cartesianProduct(choices)) {
      final Map<OrbitalSpace, Integer> next = new HashMap<>(nextOrdinals);
      final Map<Index, Index> map = new HashMap<>();
      for (int i = 0; i < composites.size(); i++) {
        final OrbitalSpace space = choice.get(i);
        final int ordinal = next.getOrDefault(space, 0);
        next.put(space, ordinal + 1);
        map.put(composites.get(i), new Index(space, ordinal));
      }
      terms.add(reindex(map));
    }
    return terms.build();
  }

  /** Applies an index mapping to every tensor and operator. */
  public SymbolicTerm reindex(Map<Index, Index> map) {
    if (map.isEmpty()) {
      return this;
    }
    final ImmutableList.Builder<Tensor> tensors2 = ImmutableList.builder();
    tensors.forEach(t -> tensors2.add(t.reindex(map)));
    final ImmutableList.Builder<OperatorProduct> products2 =
        ImmutableList.builder();
    products.forEach(p -> products2.add(p.reindex(map)));
    return of(tensors2.build(), products2.build());
  }

  /** Returns the Hermitian conjugate: products in reverse order, each
   * conjugated, and every tensor conjugated. */
  public SymbolicTerm adjoint() {
    final ImmutableList.Builder<Tensor> tensors2 = ImmutableList.builder();
    tensors.forEach(t -> tensors2.add(t.adjoint()));
    final ImmutableList.Builder<OperatorProduct> products2 =
        ImmutableList.builder();
    products.reverse().forEach(p -> products2.add(p.adjoint()));
    return of(tensors2.build(), products2.build());
  }

  @Override public int hashCode() {
    return tensors.hashCode() * 31 + products.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof SymbolicTerm
        && tensors.equals(((SymbolicTerm) o).tensors)
        && products.equals(((SymbolicTerm) o).products);
  }

  /** Returns "f^{v0}_{o0} { a+(o0) a-(v0) }", or "" for {@link #ONE}. */
  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    final int start = buf.length();
    for (Tensor tensor : tensors) {
      if (buf.length() > start) {
        buf.append(' ');
      }
      buf.append(tensor);
    }
    for (OperatorProduct product : products) {
      if (buf.length() > start) {
        buf.append(' ');
      }
      product.describeTo(buf);
    }
    return buf;
  }

  /** Returns the LaTeX form, such as
   * "f^{a}_{i} \{ \hat{a}^\dagger_{i} \hat{a}_{a} \}". */
  public String latex() {
    final StringBuilder buf = new StringBuilder();
    for (Tensor tensor : tensors) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(tensor.latex());
    }
    for (OperatorProduct product : products) {
      if (buf.length() > 0) {
        buf.append(' ');
      }
      buf.append(product.latex());
    }
    return buf.toString();
  }
}

// End SymbolicTerm.java
