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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One contribution to a result tensor: {@code lhs += factor * rhs}.
 *
 * <p>The indices of {@link #lhs} are the free indices of the contribution;
 * every other index of {@link #rhs} is summed.
 *
 * @see Expression#toManybodyEquations(String)
 */
public final class Equation {
  public final Tensor lhs;
  public final SymbolicTerm rhs;
  public final Rational factor;

  public Equation(Tensor lhs, SymbolicTerm rhs, Rational factor) {
    this.lhs = requireNonNull(lhs, "lhs");
    this.rhs = requireNonNull(rhs, "rhs");
    this.factor = requireNonNull(factor, "factor");
  }

  @Override public int hashCode() {
    return lhs.hashCode() * 31 * 31 + rhs.hashCode() * 31 + factor.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Equation
        && lhs.equals(((Equation) o).lhs)
        && rhs.equals(((Equation) o).rhs)
        && factor.equals(((Equation) o).factor);
  }

  /** Returns "R^{o0}_{v0} += 1/2 f^{o0}_{v1} t^{v1}_{v0}". */
  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append(lhs).append(" +=");
    if (!factor.isOne() || rhs == SymbolicTerm.ONE) {
      buf.append(' ').append(factor);
    }
    if (rhs != SymbolicTerm.ONE) {
      rhs.describeTo(buf.append(' '));
    }
    return buf.toString();
  }

  public String latex() {
    final StringBuilder buf = new StringBuilder();
    buf.append(lhs.latex()).append(" \\mathrel{+}=");
    if (!factor.isOne() || rhs == SymbolicTerm.ONE) {
      buf.append(' ').append(factor.latex());
    }
    if (rhs != SymbolicTerm.ONE) {
      buf.append(' ').append(rhs.latex());
    }
    return buf.toString();
  }

  /** Generates a statement that evaluates this equation. */
  public String compile(Format format) {
    switch (format) {
      case EINSUM:
        return einsum();
      case AMBIT:
        return ambit();
      default:
        throw new AssertionError(format);
    }
  }

  /** Returns, for example,
   * {@code R["ov"] += 1/2 * np.einsum("ab,bc->ac", f["ov"], t["vv"],
   * optimize="optimal")}. */
  private String einsum() {
    final Map<Index, Character> letters = new HashMap<>();
    final StringBuilder buf = new StringBuilder(lhs.label);
    if (lhs.rank() > 0) {
      buf.append("[\"").append(spaces(lhs)).append("\"]");
    }
    buf.append(" += ").append(factor);
    if (rhs.tensors.isEmpty()) {
      return buf.toString();
    }
    buf.append(" * np.einsum(\"");
    for (int i = 0; i < rhs.tensors.size(); i++) {
      if (i > 0) {
        buf.append(',');
      }
      letters(buf, rhs.tensors.get(i), letters);
    }
    buf.append("->");
    letters(buf, lhs, letters);
    buf.append('"');
    for (Tensor tensor : rhs.tensors) {
      buf.append(", ").append(tensor.label);
      if (tensor.rank() > 0) {
        buf.append("[\"").append(spaces(tensor)).append("\"]");
      }
    }
    return buf.append(", optimize=\"optimal\")").toString();
  }

  /** Returns, for example,
   * {@code R["o0,v0"] += 0.5 * f["o0,v1"] * t["v1,v0"];}. */
  private String ambit() {
    final StringBuilder buf = new StringBuilder();
    ambitTensor(buf, lhs);
    buf.append(" += ").append(factor.doubleValue());
    for (Tensor tensor : rhs.tensors) {
      ambitTensor(buf.append(" * "), tensor);
    }
    return buf.append(';').toString();
  }

  private static void ambitTensor(StringBuilder buf, Tensor tensor) {
    buf.append(tensor.label).append("[\"");
    final int start = buf.length();
    for (List<Index> indices : ImmutableList.of(tensor.upper, tensor.lower)) {
      for (Index index : indices) {
        if (buf.length() > start) {
          buf.append(',');
        }
        buf.append(index);
      }
    }
    buf.append("\"]");
  }

  private static String spaces(Tensor tensor) {
    final StringBuilder buf = new StringBuilder();
    tensor.upper.forEach(index -> buf.append(index.space.label));
    tensor.lower.forEach(index -> buf.append(index.space.label));
    return buf.toString();
  }

  /** Appends one letter per index of a tensor, allocating letters in order
   * of first use. */
  private static void letters(StringBuilder buf, Tensor tensor,
      Map<Index, Character> letters) {
    tensor.upper.forEach(index -> buf.append(letter(index, letters)));
    tensor.lower.forEach(index -> buf.append(letter(index, letters)));
  }

  private static char letter(Index index, Map<Index, Character> letters) {
    return letters.computeIfAbsent(index, i -> {
      final int n = letters.size();
      if (n >= 52) {
        throw new IllegalStateException("too many indices for einsum");
      }
      return (char) (n < 26 ? 'a' + n : 'A' + n - 26);
    });
  }

  /** Target language of {@link #compile(Format)}. */
  public enum Format {
    /** Python with numpy's {@code einsum}. */
    EINSUM,
    /** C++ with the ambit tensor library. */
    AMBIT
  }
}

// End Equation.java
