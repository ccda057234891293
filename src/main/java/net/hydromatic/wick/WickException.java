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
package net.hydromatic.wick;

import static java.util.Objects.requireNonNull;

/**
 * An error that aborts a derivation.
 *
 * <p>No partial result is returned when this exception is thrown; the caller
 * is expected to fix the orbital-space configuration or the input expression
 * and try again.
 */
public class WickException extends RuntimeException {
  private final Kind kind;

  public WickException(Kind kind, String message) {
    super(message);
    this.kind = requireNonNull(kind, "kind");
  }

  /** Creates an exception for a space label that is not registered. */
  public static WickException unknownSpace(char label) {
    return new WickException(Kind.UNKNOWN_SPACE,
        "orbital space '" + label + "' is not registered");
  }

  public Kind kind() {
    return kind;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(kind)
        .append(" Error: ")
        .append(getMessage());
  }

  /** Kind of error. */
  public enum Kind {
    /** A space label was used that is not registered. */
    UNKNOWN_SPACE,
    /** A space label, or one of its index names, is already registered. */
    DUPLICATE_SPACE,
    /** A tensor (a label with given numbers of upper and lower indices) is
     * used with different symmetries. */
    INDEX_ARITY_MISMATCH,
    /** The rank window of a contraction is empty or has a negative bound. */
    INVALID_RANK_WINDOW,
    /** An operator string in the mini-language cannot be parsed. */
    MALFORMED_OPERATOR
  }
}

// End WickException.java
