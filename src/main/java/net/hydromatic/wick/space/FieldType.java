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

/** Statistics of the particles that an orbital space describes. */
public enum FieldType {
  /** Fermions; their operators anticommute. */
  FERMION,
  /** Bosons; their operators commute. */
  BOSON;

  /** Converts a name such as "fermion" to a field type. */
  public static FieldType of(String name) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "fermion":
        return FERMION;
      case "boson":
        return BOSON;
      default:
        throw new IllegalArgumentException(
            "field type must be one of [fermion, boson], was '" + name + "'");
    }
  }

  @Override public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End FieldType.java
