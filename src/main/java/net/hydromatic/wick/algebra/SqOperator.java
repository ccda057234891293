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

import java.util.Map;

/** Second-quantized operator, a creation or annihilation operator acting
 * on the orbital denoted by an index. */
public final class SqOperator implements Comparable<SqOperator> {
  public final Type type;
  public final Index index;

  public SqOperator(Type type, Index index) {
    this.type = requireNonNull(type, "type");
    this.index = requireNonNull(index, "index");
  }

  /** Creates a creation operator. */
  public static SqOperator cre(Index index) {
    return new SqOperator(Type.CREATION, index);
  }

  /** Creates an annihilation operator. */
  public static SqOperator ann(Index index) {
    return new SqOperator(Type.ANNIHILATION, index);
  }

  public boolean isCreation() {
    return type == Type.CREATION;
  }

  /** Returns whether this operator anticommutes with other fermion
   * operators. */
  public boolean isFermion() {
    return index.space.isFermion();
  }

  /** Returns the Hermitian conjugate of this operator. */
  public SqOperator adjoint() {
    return new SqOperator(type.adjoint(), index);
  }

  /** Applies an index mapping; indices not in the map are unchanged. */
  public SqOperator reindex(Map<Index, Index> map) {
    final Index index2 = map.get(index);
    return index2 == null ? this : new SqOperator(type, index2);
  }

  @Override public int hashCode() {
    return type.hashCode() * 37 + index.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof SqOperator
        && type == ((SqOperator) o).type
        && index.equals(((SqOperator) o).index);
  }

  /** Orders creation before annihilation, then by index. */
  @Override public int compareTo(SqOperator o) {
    int c = type.compareTo(o.type);
    if (c != 0) {
      return c;
    }
    return index.compareTo(o.index);
  }

  /** Returns "a+(v0)" or "a-(o0)". */
  @Override public String toString() {
    return type.symbol + "(" + index + ")";
  }

  /** Returns "\hat{a}^\dagger_{a}" or "\hat{a}_{i}". */
  public String latex() {
    return "\\hat{a}" + (isCreation() ? "^\\dagger" : "")
        + "_{" + index.latex() + "}";
  }

  /** Type of operator. Creation sorts before annihilation. */
  public enum Type {
    CREATION("a+"),
    ANNIHILATION("a-");

    final String symbol;

    Type(String symbol) {
      this.symbol = symbol;
    }

    Type adjoint() {
      return this == CREATION ? ANNIHILATION : CREATION;
    }
  }
}

// End SqOperator.java
