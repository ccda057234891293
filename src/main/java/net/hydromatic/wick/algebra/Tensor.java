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
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tensor with a label, upper and lower indices, and a permutation symmetry.
 *
 * <p>Written {@code T^{o0,o1}_{v0,v1}}. For an operator built from the
 * mini-language the lower indices are those of the creation operators and
 * the upper indices those of the annihilation operators.
 */
public final class Tensor {
  /** Label of the Kronecker delta; {@code delta^{o0}_{o0}} is the trace
   * over a space, that is, its number of orbitals. */
  public static final String DELTA = "delta";
  /** Label of the one-particle density of a general space. */
  public static final String GAMMA1 = "gamma1";
  /** Label of the one-hole density of a general space. */
  public static final String ETA1 = "eta1";

  public final String label;
  public final ImmutableList<Index> upper;
  public final ImmutableList<Index> lower;
  public final Symmetry symmetry;

  public Tensor(String label, List<Index> upper, List<Index> lower,
      Symmetry symmetry) {
    this.label = requireNonNull(label, "label");
    checkArgument(!label.isEmpty(), "empty tensor label");
    this.upper = ImmutableList.copyOf(upper);
    this.lower = ImmutableList.copyOf(lower);
    this.symmetry = requireNonNull(symmetry, "symmetry");
  }

  /** Creates a tensor with no symmetry. */
  public static Tensor of(String label, List<Index> upper, List<Index> lower) {
    return new Tensor(label, upper, lower, Symmetry.NONE);
  }

  /** Returns the trace tensor {@code delta^{p}_{p}}. */
  public static Tensor trace(Index index) {
    return of(DELTA, ImmutableList.of(index), ImmutableList.of(index));
  }

  /** Returns the number of indices. */
  public int rank() {
    return upper.size() + lower.size();
  }

  /** Returns whether the order of indices within the upper (or lower) list
   * matters, that is, whether either list has more than one index. */
  boolean hasPermutableSlots() {
    return upper.size() > 1 || lower.size() > 1;
  }

  /** Applies an index mapping. */
  public Tensor reindex(Map<Index, Index> map) {
    return new Tensor(label, reindex(upper, map), reindex(lower, map),
        symmetry);
  }

  private static ImmutableList<Index> reindex(List<Index> indices,
      Map<Index, Index> map) {
    final ImmutableList.Builder<Index> list = ImmutableList.builder();
    for (Index index : indices) {
      list.add(map.getOrDefault(index, index));
    }
    return list.build();
  }

  /** Returns the conjugate tensor, with upper and lower indices swapped. */
  public Tensor adjoint() {
    return new Tensor(label, lower, upper, symmetry);
  }

  @Override public int hashCode() {
    return Objects.hash(label, upper, lower, symmetry);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Tensor
        && label.equals(((Tensor) o).label)
        && upper.equals(((Tensor) o).upper)
        && lower.equals(((Tensor) o).lower)
        && symmetry == ((Tensor) o).symmetry;
  }

  /** Returns "T^{o0,o1}_{v0,v1}". */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder(label).append("^{");
    join(buf, upper, ",", false);
    buf.append("}_{");
    join(buf, lower, ",", false);
    return buf.append('}').toString();
  }

  /** Returns "T^{ij}_{ab}". */
  public String latex() {
    final StringBuilder buf = new StringBuilder(label).append("^{");
    join(buf, upper, "", true);
    buf.append("}_{");
    join(buf, lower, "", true);
    return buf.append('}').toString();
  }

  private static void join(StringBuilder buf, List<Index> indices,
      String separator, boolean latex) {
    for (int i = 0; i < indices.size(); i++) {
      if (i > 0) {
        buf.append(separator);
      }
      buf.append(latex ? indices.get(i).latex() : indices.get(i).toString());
    }
  }

  /** Permutation symmetry of the upper indices (and, independently, of the
   * lower indices) of a tensor. */
  public enum Symmetry {
    /** A permutation multiplies the tensor by the permutation's sign. */
    ANTISYMMETRIC,
    /** A permutation leaves the tensor unchanged. */
    SYMMETRIC,
    /** Indices are in a fixed order. */
    NONE;

    /** Returns whether indices within the upper (or lower) list may be
     * permuted. */
    public boolean permutable() {
      return this != NONE;
    }
  }
}

// End Tensor.java
