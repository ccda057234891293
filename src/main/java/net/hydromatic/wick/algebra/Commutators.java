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

/**
 * Commutators and the Baker-Campbell-Hausdorff series.
 *
 * <p>Results are not canonicalized; call {@link Expression#canonicalize()} to
 * merge terms that are equal up to index renaming and reordering.
 */
public class Commutators {
  private Commutators() {}

  /** Returns {@code [a, b] = a b - b a}. */
  public static Expression commutator(Expression a, Expression b) {
    return a.times(b).minus(b.times(a));
  }

  /** Returns a nested commutator, associating to the left:
   * {@code [[[e0, e1], e2], ...]}. */
  public static Expression commutator(Expression e0, Expression e1,
      Expression... rest) {
    Expression e = commutator(e0, e1);
    for (Expression e2 : rest) {
      e = commutator(e, e2);
    }
    return e;
  }

  /**
   * Returns the Baker-Campbell-Hausdorff series of {@code exp(-b) a exp(b)},
   * truncated after {@code order} nested commutators.
   *
   * <p>The result is {@code sum_{k=0..order} (1/k!) ad_b^k(a)}, where
   * {@code ad_b^0(a) = a} and {@code ad_b^k(a) = [ad_b^(k-1)(a), b]}.
   */
  public static Expression bchSeries(Expression a, Expression b, int order) {
    checkArgument(order >= 0, "negative order %s", order);
    final Expression.Builder builder = Expression.builder().addAll(a);
    Expression nested = a;
    for (int k = 1; k <= order; k++) {
      nested = commutator(nested, b);
      builder.addAll(nested, Rational.inverseFactorial(k));
    }
    return builder.build();
  }
}

// End Commutators.java
