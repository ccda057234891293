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

import net.hydromatic.wick.space.OrbitalSpace;

/**
 * Index of an orbital, a handle made of a space and an ordinal.
 *
 * <p>Every index in a term is summed over its space, so indices may be
 * renamed freely provided that the renaming is a bijection between indices
 * of the same space.
 */
public final class Index implements Comparable<Index> {
  public final OrbitalSpace space;
  public final int ordinal;

  public Index(OrbitalSpace space, int ordinal) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    this.space = requireNonNull(space, "space");
    this.ordinal = ordinal;
  }

  /** Returns an index in the same space with a different ordinal. */
  public Index withOrdinal(int ordinal) {
    return ordinal == this.ordinal ? this : new Index(space, ordinal);
  }

  @Override public int hashCode() {
    return space.label * 1031 + ordinal;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Index
        && ordinal == ((Index) o).ordinal
        && space.equals(((Index) o).space);
  }

  /** Orders by space position, then by ordinal. */
  @Override public int compareTo(Index o) {
    int c = Integer.compare(space.position, o.space.position);
    if (c != 0) {
      return c;
    }
    return Integer.compare(ordinal, o.ordinal);
  }

  /** Returns "o0", "v1" etc. */
  @Override public String toString() {
    return String.valueOf(space.label) + ordinal;
  }

  /** Returns the pretty name, such as "i" or "a". */
  public String latex() {
    return space.indexName(ordinal);
  }
}

// End Index.java
