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
package net.hydromatic.wick.space;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * Description of an orbital space.
 *
 * <p>A space has a one-character label (for example 'o' for occupied
 * orbitals), a field type, a space type, and a list of pretty index names
 * that are used when printing LaTeX. A general space may be composed of
 * elementary spaces; such a space is expanded into its components before
 * contraction.
 */
public class OrbitalSpace {
  /** Position of this space in its registry; defines canonical order. */
  public final int position;
  public final char label;
  public final FieldType fieldType;
  public final SpaceType spaceType;
  public final ImmutableList<String> indexNames;
  public final ImmutableList<OrbitalSpace> elementarySpaces;

  OrbitalSpace(int position, char label, FieldType fieldType,
      SpaceType spaceType, ImmutableList<String> indexNames,
      ImmutableList<OrbitalSpace> elementarySpaces) {
    checkArgument(position >= 0);
    checkArgument(!indexNames.isEmpty(), "space %s has no index names", label);
    this.position = position;
    this.label = label;
    this.fieldType = requireNonNull(fieldType, "fieldType");
    this.spaceType = requireNonNull(spaceType, "spaceType");
    this.indexNames = indexNames;
    this.elementarySpaces = elementarySpaces;
  }

  /** Returns whether this space is a union of elementary spaces. */
  public boolean isComposite() {
    return !elementarySpaces.isEmpty();
  }

  public boolean isFermion() {
    return fieldType == FieldType.FERMION;
  }

  /**
   * Returns whether two spaces share orbitals.
   *
   * <p>Distinct elementary spaces never overlap; a composite space overlaps
   * each of its components and any other composite space with which it has a
   * component in common.
   */
  public boolean overlaps(OrbitalSpace other) {
    if (equals(other)) {
      return true;
    }
    for (OrbitalSpace s : components()) {
      for (OrbitalSpace s2 : other.components()) {
        if (s.equals(s2)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns the elementary components, or a list of just this space. */
  public ImmutableList<OrbitalSpace> components() {
    return isComposite() ? elementarySpaces : ImmutableList.of(this);
  }

  /**
   * Returns the pretty name of the index with a given ordinal.
   *
   * <p>For example, if the names are [i, j, k], ordinals 0, 1, 2 are "i", "j",
   * "k", and ordinals 3 and 4 are "i_{1}" and "j_{1}".
   */
  public String indexName(int ordinal) {
    checkArgument(ordinal >= 0);
    final int n = indexNames.size();
    final String name = indexNames.get(ordinal % n);
    return ordinal < n ? name : name + "_{" + ordinal / n + "}";
  }

  @Override public int hashCode() {
    return Objects.hash(position, label, fieldType, spaceType);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof OrbitalSpace
        && position == ((OrbitalSpace) o).position
        && label == ((OrbitalSpace) o).label
        && fieldType == ((OrbitalSpace) o).fieldType
        && spaceType == ((OrbitalSpace) o).spaceType;
  }

  @Override public String toString() {
    return String.valueOf(label);
  }

  /** Writes a description of this space, for diagnostics. */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(position)
        .append(' ')
        .append(label)
        .append(' ')
        .append(fieldType)
        .append(' ')
        .append(spaceType)
        .append(' ')
        .append(indexNames);
    if (isComposite()) {
      buf.append(" = ");
      for (int i = 0; i < elementarySpaces.size(); i++) {
        if (i > 0) {
          buf.append(" + ");
        }
        buf.append(elementarySpaces.get(i).label);
      }
    }
    return buf;
  }
}

// End OrbitalSpace.java
