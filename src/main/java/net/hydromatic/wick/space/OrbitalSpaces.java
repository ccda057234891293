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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.wick.WickException;

/**
 * Immutable set of orbital spaces.
 *
 * <p>Created by {@link OrbitalSpaceInfo#freeze()}. Several derivations may
 * share a snapshot concurrently.
 */
public class OrbitalSpaces {
  public final ImmutableList<OrbitalSpace> spaces;
  private final ImmutableMap<Character, OrbitalSpace> spaceByLabel;

  OrbitalSpaces(ImmutableList<OrbitalSpace> spaces) {
    this.spaces = spaces;
    final ImmutableMap.Builder<Character, OrbitalSpace> builder =
        ImmutableMap.builder();
    spaces.forEach(space -> builder.put(space.label, space));
    this.spaceByLabel = builder.build();
  }

  /** Returns the space with a given label; throws if not registered. */
  public OrbitalSpace resolve(char label) {
    final OrbitalSpace space = spaceByLabel.get(label);
    if (space == null) {
      throw WickException.unknownSpace(label);
    }
    return space;
  }

  /** Returns whether a space belongs to this snapshot. */
  public boolean contains(OrbitalSpace space) {
    return space.equals(spaceByLabel.get(space.label));
  }

  /** Throws if a space does not belong to this snapshot. */
  public OrbitalSpace check(OrbitalSpace space) {
    if (!contains(space)) {
      throw WickException.unknownSpace(space.label);
    }
    return space;
  }

  public int size() {
    return spaces.size();
  }

  @Override public String toString() {
    return spaces.toString();
  }
}

// End OrbitalSpaces.java
