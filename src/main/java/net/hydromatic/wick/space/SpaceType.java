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

import java.util.Locale;

/** Occupation of an orbital space in the reference vacuum. */
public enum SpaceType {
  /** Every orbital is occupied in the vacuum (holes). */
  OCCUPIED,
  /** Every orbital is empty in the vacuum (particles). */
  UNOCCUPIED,
  /** Orbitals are partially occupied; contractions yield densities. */
  GENERAL;

  /** Converts a name such as "occupied" to a space type. */
  public static SpaceType of(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "occupied":
        return OCCUPIED;
      case "unoccupied":
        return UNOCCUPIED;
      case "general":
        return GENERAL;
      default:
        throw new IllegalArgumentException("space type must be one of "
            + "[occupied, unoccupied, general], was '" + name + "'");
    }
  }

  @Override public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End SpaceType.java
