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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.wick.WickException;

/**
 * Registry of orbital spaces.
 *
 * <p>The registry is owned by the caller. It is mutated by {@link #reset()}
 * and {@link #addSpace}, and then {@link #freeze() frozen} into an immutable
 * {@link OrbitalSpaces} snapshot that derivations read. Mutating the registry
 * does not affect snapshots taken earlier.
 *
 * <p>This class is not thread-safe; callers must serialize mutation against
 * any use of the registry.
 */
public class OrbitalSpaceInfo {
  private final List<OrbitalSpace> spaces = new ArrayList<>();
  private final Map<Character, OrbitalSpace> spaceByLabel = new HashMap<>();
  private final Map<String, Character> labelByIndexName = new HashMap<>();

  /** Removes all spaces. */
  public void reset() {
    spaces.clear();
    spaceByLabel.clear();
    labelByIndexName.clear();
  }

  /** Adds an elementary space. */
  public OrbitalSpace addSpace(char label, FieldType fieldType,
      SpaceType spaceType, List<String> indices) {
    return addSpace(label, fieldType, spaceType, indices, ImmutableList.of());
  }

  /** Adds a space, parsing the field type and space type from strings
   * such as "fermion" and "occupied". */
  public OrbitalSpace addSpace(char label, String fieldType, String spaceType,
      List<String> indices, List<Character> elementarySpaces) {
    return addSpace(label, FieldType.of(fieldType), SpaceType.of(spaceType),
        indices, elementarySpaces);
  }

  /**
   * Adds a space.
   *
   * <p>Fails with {@link WickException.Kind#DUPLICATE_SPACE} if the label is
   * already registered or if an index name is already used by a space, and
   * with {@link WickException.Kind#UNKNOWN_SPACE} if an elementary space is
   * not registered.
   *
   * @param label Label, a single character such as 'o'
   * @param fieldType Statistics
   * @param spaceType Occupation in the vacuum
   * @param indices Pretty index names, for example [i, j, k]
   * @param elementarySpaces Labels of the elementary spaces that this space is
   *     the union of; empty for an elementary space
   * @return Newly added space
   */
  public OrbitalSpace addSpace(char label, FieldType fieldType,
      SpaceType spaceType, List<String> indices,
      List<Character> elementarySpaces) {
    checkArgument(!Character.isWhitespace(label) && label != '+',
        "invalid space label '%s'", label);
    checkArgument(!indices.isEmpty(), "space '%s' needs index names", label);
    if (spaceByLabel.containsKey(label)) {
      throw new WickException(WickException.Kind.DUPLICATE_SPACE,
          "orbital space '" + label + "' is already registered");
    }
    final Map<String, Character> newNames = new HashMap<>();
    for (String index : indices) {
      final Character owner = labelByIndexName.get(index);
      if (owner != null || newNames.containsKey(index)) {
        throw new WickException(WickException.Kind.DUPLICATE_SPACE,
            "index name '" + index + "' of space '" + label
                + "' is already used by space '"
                + (owner != null ? owner : label) + "'");
      }
      newNames.put(index, label);
    }
    final ImmutableList.Builder<OrbitalSpace> components =
        ImmutableList.builder();
    for (char c : elementarySpaces) {
      final OrbitalSpace component = spaceByLabel.get(c);
      if (component == null) {
        throw WickException.unknownSpace(c);
      }
      checkArgument(!component.isComposite(),
          "component '%s' of space '%s' is not elementary", c, label);
      checkArgument(component.fieldType == fieldType,
          "component '%s' of space '%s' has field type %s",
          c, label, component.fieldType);
      components.add(component);
    }
    final ImmutableList<OrbitalSpace> componentList = components.build();
    checkArgument(componentList.isEmpty() || spaceType == SpaceType.GENERAL,
        "only a general space may have elementary spaces");

    final OrbitalSpace space =
        new OrbitalSpace(spaces.size(), label, fieldType, spaceType,
            ImmutableList.copyOf(indices), componentList);
    spaces.add(space);
    spaceByLabel.put(label, space);
    labelByIndexName.putAll(newNames);
    return space;
  }

  /** Returns the number of spaces. */
  public int numSpaces() {
    return spaces.size();
  }

  /** Returns the label of the {@code i}th space. */
  public char label(int i) {
    return spaces.get(i).label;
  }

  /** Returns the index names of the {@code i}th space. */
  public List<String> indices(int i) {
    return spaces.get(i).indexNames;
  }

  /** Returns the space with a given label; throws if not registered. */
  public OrbitalSpace resolve(char label) {
    final OrbitalSpace space = spaceByLabel.get(label);
    if (space == null) {
      throw WickException.unknownSpace(label);
    }
    return space;
  }

  /** Returns an immutable snapshot of the current spaces. */
  public OrbitalSpaces freeze() {
    return new OrbitalSpaces(ImmutableList.copyOf(spaces));
  }

  /**
   * Returns the registry as a map from label to a description of each space
   * with keys "field_type", "space_type", "indices" and "elementary_spaces".
   */
  public Map<Character, Map<String, Object>> toMap() {
    final Map<Character, Map<String, Object>> map = new LinkedHashMap<>();
    for (OrbitalSpace space : spaces) {
      final List<Character> components = new ArrayList<>();
      space.elementarySpaces.forEach(s -> components.add(s.label));
      map.put(space.label,
          ImmutableMap.of("field_type", space.fieldType.toString(),
              "space_type", space.spaceType.toString(),
              "indices", space.indexNames,
              "elementary_spaces", ImmutableList.copyOf(components)));
    }
    return map;
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder();
    for (OrbitalSpace space : spaces) {
      if (buf.length() > 0) {
        buf.append('\n');
      }
      space.describeTo(buf);
    }
    return buf.toString();
  }
}

// End OrbitalSpaceInfo.java
