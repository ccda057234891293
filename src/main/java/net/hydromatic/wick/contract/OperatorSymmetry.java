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

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.algebra.Index;
import net.hydromatic.wick.algebra.SqOperator;
import net.hydromatic.wick.algebra.SymbolicTerm;
import net.hydromatic.wick.algebra.Tensor;

/**
 * Group of permutations of operator positions that leave a term unchanged.
 *
 * <p>Two operators are interchangeable if they are in the same
 * normal-ordered factor, have the same type and space, and their indices
 * occur nowhere else except once each in the same index list of one tensor
 * whose symmetry matches the statistics of the operators (antisymmetric for
 * fermions, symmetric for bosons). Exchanging the two indices then changes
 * the sign of the tensor and of the operator product by the same amount, so
 * the term is invariant. The group is the product of the full symmetric
 * groups of the classes of interchangeable operators.
 *
 * <p>Matchings related by an element of the group produce equal terms after
 * canonicalization; the enumerator keeps one matching per orbit and weights
 * it by the size of the orbit.
 */
class OperatorSymmetry {
  /** Largest group that is enumerated; beyond this the symmetry is
   * ignored. */
  static final int MAX_GROUP_SIZE = 5040;

  /** Elements of the group, each a permutation of operator positions. The
   * first is the identity. */
  final ImmutableList<int[]> elements;

  private OperatorSymmetry(ImmutableList<int[]> elements) {
    this.elements = elements;
  }

  /** Returns the group that contains only the identity. */
  static OperatorSymmetry trivial(int n) {
    return new OperatorSymmetry(ImmutableList.of(identity(n)));
  }

  /** Computes the symmetry group of a term whose operators are
   * {@code ops}, where {@code factorOf[i]} is the factor of operator i. */
  static OperatorSymmetry of(SymbolicTerm term, List<SqOperator> ops,
      int[] factorOf) {
    final Map<List<Integer>, List<Integer>> classes = new LinkedHashMap<>();
    for (int i = 0; i < ops.size(); i++) {
      final List<Integer> key = key(term, ops, factorOf, i);
      if (key != null) {
        classes.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
      }
    }
    final List<List<Integer>> orbits = new ArrayList<>();
    final List<List<List<Integer>>> permutations = new ArrayList<>();
    long size = 1;
    for (List<Integer> positions : classes.values()) {
      if (positions.size() < 2) {
        continue;
      }
      for (int k = 2; k <= positions.size(); k++) {
        size *= k;
      }
      if (size > MAX_GROUP_SIZE) {
        return trivial(ops.size());
      }
      orbits.add(positions);
      permutations.add(
          ImmutableList.copyOf(Collections2.orderedPermutations(positions)));
    }
    if (orbits.isEmpty()) {
      return trivial(ops.size());
    }
    final ImmutableList.Builder<int[]> elements = ImmutableList.builder();
    for (List<List<Integer>> combination
        : Lists.cartesianProduct(permutations)) {
      final int[] g = identity(ops.size());
      for (int c = 0; c < orbits.size(); c++) {
        final List<Integer> positions = orbits.get(c);
        final List<Integer> image = combination.get(c);
        for (int k = 0; k < positions.size(); k++) {
          g[positions.get(k)] = image.get(k);
        }
      }
      elements.add(g);
    }
    return new OperatorSymmetry(elements.build());
  }

  /** Returns the key of the class of operator i, or null if the operator is
   * not interchangeable with any other. */
  private static List<Integer> key(SymbolicTerm term, List<SqOperator> ops,
      int[] factorOf, int i) {
    final SqOperator op = ops.get(i);
    for (int j = 0; j < ops.size(); j++) {
      if (j != i && ops.get(j).index.equals(op.index)) {
        return null;
      }
    }
    final Tensor.Symmetry symmetry =
        op.isFermion() ? Tensor.Symmetry.ANTISYMMETRIC
            : Tensor.Symmetry.SYMMETRIC;
    int slot = -1;
    for (int t = 0; t < term.tensors.size(); t++) {
      final Tensor tensor = term.tensors.get(t);
      final int upper = count(tensor.upper, op.index);
      final int lower = count(tensor.lower, op.index);
      if (upper + lower == 0) {
        continue;
      }
      if (slot >= 0 || upper + lower > 1 || tensor.symmetry != symmetry) {
        return null;
      }
      slot = 2 * t + (upper > 0 ? 0 : 1);
    }
    if (slot < 0) {
      return null;
    }
    return ImmutableList.of(factorOf[i], op.type.ordinal(),
        op.index.space.position, slot);
  }

  private static int count(List<Index> indices, Index index) {
    int n = 0;
    for (Index index2 : indices) {
      if (index2.equals(index)) {
        ++n;
      }
    }
    return n;
  }

  private static int[] identity(int n) {
    final int[] g = new int[n];
    for (int i = 0; i < n; i++) {
      g[i] = i;
    }
    return g;
  }

  boolean isTrivial() {
    return elements.size() == 1;
  }

  /**
   * Returns the size of the orbit of a matching if the matching is the
   * least member of its orbit, otherwise 0.
   *
   * @param partner For each operator position, the position of the operator
   *     it is contracted with, or -1
   */
  int orbitSize(int[] partner) {
    final int[] image = new int[partner.length];
    int stabilizer = 0;
    for (int[] g : elements) {
      Arrays.fill(image, -1);
      for (int i = 0; i < partner.length; i++) {
        if (partner[i] >= 0) {
          image[g[i]] = g[partner[i]];
        }
      }
      final int c = Arrays.compare(image, partner);
      if (c < 0) {
        return 0;
      }
      if (c == 0) {
        ++stabilizer;
      }
    }
    return elements.size() / stabilizer;
  }
}

// End OperatorSymmetry.java
