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
package net.hydromatic.wick.contract;

import net.hydromatic.wick.algebra.Expression;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.SymbolicTerm;

/** Called on various events during contraction. */
public interface Tracer {
  /** Called before a term is contracted, after composite spaces have been
   * expanded. */
  void onTerm(SymbolicTerm term, Rational coefficient);

  /**
   * Called when all contractions of a term have been enumerated.
   *
   * @param term Term that was contracted
   * @param matchings Number of matchings that produced a term
   * @param folded Number of matchings that were not enumerated because they
   *     are equivalent, by a symmetry of the term, to one that was
   */
  void onContractions(SymbolicTerm term, int matchings, int folded);

  /** Called with the canonicalized result of a contraction. */
  void onResult(Expression result);
}

// End Tracer.java
