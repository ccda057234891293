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
package net.hydromatic.wick.contract;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.wick.algebra.Expression;
import net.hydromatic.wick.algebra.Index;
import net.hydromatic.wick.algebra.OperatorProduct;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.SqOperator;
import net.hydromatic.wick.algebra.SymbolicTerm;
import net.hydromatic.wick.algebra.Tensor;
import net.hydromatic.wick.space.OrbitalSpace;
import net.hydromatic.wick.space.SpaceType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Enumerates the contractions of one term.
 *
 * <p>The operators of the term are a product of normal-ordered factors.
 * A contraction pairs two operators of different factors; the result of a
 * set of contractions is the product of the contraction values, the Wick
 * sign, and the normal-ordered product of the operators that remain.
 *
 * <p>The search is depth-first over an explicit stack. Each state decides
 * the first undecided operator: leave it uncontracted, or contract it with
 * a later operator that is still available. Availability is a bit set, so
 * a term may have at most 63 operators. States that cannot reach a number
 * of remaining operators within the rank window are not pushed.
 */
class ContractionEnumerator {
  private final SymbolicTerm term;
  private final Rational coefficient;
  private final int minRank;
  private final int maxRank;
  private final ImmutableList<SqOperator> ops;
  private final int[] factorOf;
  /** For each operator, the set of later operators it may contract with. */
  private final long[] candidates;
  private final OperatorSymmetry symmetry;

  /** Number of matchings that produced a term. */
  int matchings;
  /** Number of matchings skipped because they are equivalent to another. */
  int folded;

  ContractionEnumerator(SymbolicTerm term, Rational coefficient, int minRank,
      int maxRank, boolean symmetryPruning) {
    this.term = term;
    this.coefficient = coefficient;
    this.minRank = minRank;
    this.maxRank = maxRank;
    this.ops = ImmutableList.copyOf(term.operators());
    checkArgument(ops.size() < Long.SIZE, "too many operators in %s", term);
    this.factorOf = new int[ops.size()];
    int i = 0;
    for (int f = 0; f < term.products.size(); f++) {
      for (int k = 0; k < term.products.get(f).size(); k++) {
        factorOf[i++] = f;
      }
    }
    this.candidates = new long[ops.size()];
    for (int p = 0; p < ops.size(); p++) {
      for (int q = p + 1; q < ops.size(); q++) {
        if (factorOf[p] != factorOf[q]
            && contractible(ops.get(p), ops.get(q))) {
          candidates[p] |= 1L << q;
        }
      }
    }
    this.symmetry = symmetryPruning
        ? OperatorSymmetry.of(term, ops, factorOf)
        : OperatorSymmetry.trivial(ops.size());
  }

  /** Returns whether an operator contracts with an operator to its right to
   * a non-zero value, relative to the Fermi vacuum. */
  static boolean contractible(SqOperator left, SqOperator right) {
    final OrbitalSpace space = left.index.space;
    if (!space.equals(right.index.space)) {
      return false;
    }
    checkArgument(!space.isComposite(), "composite space %s", space);
    switch (space.spaceType) {
      case OCCUPIED:
        return left.isCreation() && !right.isCreation();
      case UNOCCUPIED:
        return !left.isCreation() && right.isCreation();
      case GENERAL:
        return left.type != right.type;
      default:
        throw new AssertionError(space.spaceType);
    }
  }

  /** Adds the terms produced by every retained matching to a builder. */
  void enumerate(Expression.Builder builder) {
    final int n = ops.size();
    if (n < minRank) {
      return;
    }
    final Deque<State> stack = new ArrayDeque<>();
    stack.push(new State(0, 0L, 0, null));
    while (!stack.isEmpty()) {
      final State state = stack.pop();
      int pos = state.pos;
      while (pos < n && (state.used & (1L << pos)) != 0) {
        ++pos;
      }
      if (pos == n) {
        leaf(state, builder);
        continue;
      }
      final long undecided = ~state.used & ~((1L << pos) - 1) & mask(n);
      final int remaining = Long.bitCount(undecided);
      final long used = state.used | (1L << pos);
      if (state.residual + remaining - 2 >= minRank) {
        long available = candidates[pos] & ~state.used;
        while (available != 0) {
          final int q = Long.numberOfTrailingZeros(available);
          available &= available - 1;
          stack.push(
              new State(pos + 1, used | (1L << q), state.residual,
                  new Pair(pos, q, state.pairs)));
        }
      }
      if (state.residual + 1 <= maxRank) {
        stack.push(new State(pos + 1, used, state.residual + 1, state.pairs));
      }
    }
  }

  private static long mask(int n) {
    return n == Long.SIZE ? -1L : (1L << n) - 1;
  }

  private void leaf(State state, Expression.Builder builder) {
    final int[] partner = new int[ops.size()];
    Arrays.fill(partner, -1);
    for (Pair p = state.pairs; p != null; p = p.next) {
      partner[p.left] = p.right;
      partner[p.right] = p.left;
    }
    int weight = 1;
    if (!symmetry.isTrivial()) {
      weight = symmetry.orbitSize(partner);
      if (weight == 0) {
        ++folded;
        return;
      }
    }
    ++matchings;
    builder.add(contractedTerm(state.pairs, partner),
        coefficient.times(sign(state.pairs, partner) * weight));
  }

  /** Returns the sign of the permutation that brings each contracted pair
   * together, followed by the remaining operators in their original order.
   * Only fermion operators count. */
  private int sign(@Nullable Pair pairs, int[] partner) {
    final List<Integer> order = new ArrayList<>();
    for (Pair p = pairs; p != null; p = p.next) {
      order.add(p.left);
      order.add(p.right);
    }
    for (int i = 0; i < partner.length; i++) {
      if (partner[i] < 0) {
        order.add(i);
      }
    }
    int inversions = 0;
    for (int i = 0; i < order.size(); i++) {
      if (!ops.get(order.get(i)).isFermion()) {
        continue;
      }
      for (int j = i + 1; j < order.size(); j++) {
        if (ops.get(order.get(j)).isFermion()
            && order.get(i) > order.get(j)) {
          ++inversions;
        }
      }
    }
    return inversions % 2 == 0 ? 1 : -1;
  }

  /**
   * Builds the term for a matching.
   *
   * <p>A pair in an occupied or unoccupied space is a Kronecker delta; its
   * two indices are merged, keeping the smaller. If a merged index occurs
   * nowhere else, the sum over it is the dimension of its space, written as
   * the trace {@code delta^{p}_{p}}. A pair in a general space is a density
   * tensor whose upper index is that of the creation operator:
   * {@code gamma1} if the creation operator is on the left,
   * {@code eta1} if it is on the right.
   */
  private SymbolicTerm contractedTerm(@Nullable Pair pairs, int[] partner) {
    final Map<Index, Index> parent = new HashMap<>();
    final List<Tensor> densities = new ArrayList<>();
    for (Pair p = pairs; p != null; p = p.next) {
      final SqOperator left = ops.get(p.left);
      final SqOperator right = ops.get(p.right);
      if (left.index.space.spaceType == SpaceType.GENERAL) {
        final SqOperator cre = left.isCreation() ? left : right;
        final SqOperator ann = left.isCreation() ? right : left;
        densities.add(
            Tensor.of(left.isCreation() ? Tensor.GAMMA1 : Tensor.ETA1,
                ImmutableList.of(cre.index), ImmutableList.of(ann.index)));
      } else {
        union(parent, left.index, right.index);
      }
    }
    final Map<Index, Index> map = new HashMap<>();
    final Set<Index> roots = new LinkedHashSet<>();
    for (Index index : parent.keySet()) {
      final Index root = find(parent, index);
      roots.add(root);
      if (!root.equals(index)) {
        map.put(index, root);
      }
    }
    final List<SqOperator> residual = new ArrayList<>();
    for (int i = 0; i < partner.length; i++) {
      if (partner[i] < 0) {
        residual.add(ops.get(i));
      }
    }
    final SymbolicTerm body =
        SymbolicTerm.normalOrdered(
            ImmutableList.<Tensor>builder()
                .addAll(term.tensors).addAll(densities).build(),
            residual).reindex(map);
    final Set<Index> used = body.indices();
    final ImmutableList.Builder<Tensor> tensors = ImmutableList.builder();
    tensors.addAll(body.tensors);
    roots.stream().sorted().forEach(root -> {
      if (!used.contains(root)) {
        tensors.add(Tensor.trace(root));
      }
    });
    return SymbolicTerm.of(tensors.build(), body.products);
  }

  private static Index find(Map<Index, Index> parent, Index index) {
    Index i = index;
    for (;;) {
      final Index p = parent.get(i);
      if (p == null || p.equals(i)) {
        return i;
      }
      i = p;
    }
  }

  private static void union(Map<Index, Index> parent, Index a, Index b) {
    parent.putIfAbsent(a, a);
    parent.putIfAbsent(b, b);
    final Index ra = find(parent, a);
    final Index rb = find(parent, b);
    if (ra.compareTo(rb) < 0) {
      parent.put(rb, ra);
    } else if (rb.compareTo(ra) < 0) {
      parent.put(ra, rb);
    }
  }

  /** Contracted pair, in a persistent list shared between states. */
  private static class Pair {
    final int left;
    final int right;
    final @Nullable Pair next;

    Pair(int left, int right, @Nullable Pair next) {
      this.left = left;
      this.right = right;
      this.next = next;
    }
  }

  /** Partial matching: operators before {@code pos} are decided, and so are
   * the operators in {@code used}. */
  private static class State {
    final int pos;
    final long used;
    final int residual;
    final @Nullable Pair pairs;

    State(int pos, long used, int residual, @Nullable Pair pairs) {
      this.pos = pos;
      this.used = used;
      this.residual = residual;
      this.pairs = pairs;
    }
  }
}

// End ContractionEnumerator.java
