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

import com.google.common.math.BigIntegerMath;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Exact rational number.
 *
 * <p>Numerator and denominator are arbitrary-precision integers in lowest
 * terms, and the denominator is positive, so two rationals are equal if and
 * only if their numerators and denominators are equal.
 */
public final class Rational implements Comparable<Rational> {
  public static final Rational ZERO = new Rational(BigInteger.ZERO);
  public static final Rational ONE = new Rational(BigInteger.ONE);
  public static final Rational MINUS_ONE =
      new Rational(BigInteger.ONE.negate());

  public final BigInteger numerator;
  public final BigInteger denominator;

  private Rational(BigInteger numerator) {
    this.numerator = numerator;
    this.denominator = BigInteger.ONE;
  }

  private Rational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  /** Creates a rational from an integer. */
  public static Rational of(long n) {
    return n == 0 ? ZERO : n == 1 ? ONE : new Rational(BigInteger.valueOf(n));
  }

  /** Creates a rational from a numerator and denominator. */
  public static Rational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /** Creates a rational from a numerator and denominator, reducing it to
   * lowest terms. */
  public static Rational of(BigInteger numerator, BigInteger denominator) {
    requireNonNull(numerator, "numerator");
    if (denominator.signum() == 0) {
      throw new ArithmeticException("zero denominator");
    }
    if (numerator.signum() == 0) {
      return ZERO;
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Rational(numerator, denominator);
  }

  /** Returns {@code 1 / n!}. */
  public static Rational inverseFactorial(int n) {
    return of(BigInteger.ONE, BigIntegerMath.factorial(n));
  }

  /** Returns {@code n!}. */
  public static Rational factorial(int n) {
    return new Rational(BigIntegerMath.factorial(n));
  }

  public int signum() {
    return numerator.signum();
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isOne() {
    return numerator.equals(BigInteger.ONE)
        && denominator.equals(BigInteger.ONE);
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public Rational plus(Rational r) {
    if (isZero()) {
      return r;
    }
    if (r.isZero()) {
      return this;
    }
    if (denominator.equals(r.denominator)) {
      return of(numerator.add(r.numerator), denominator);
    }
    return of(numerator.multiply(r.denominator)
            .add(r.numerator.multiply(denominator)),
        denominator.multiply(r.denominator));
  }

  public Rational minus(Rational r) {
    return plus(r.negate());
  }

  public Rational times(Rational r) {
    if (isOne()) {
      return r;
    }
    if (r.isOne()) {
      return this;
    }
    return of(numerator.multiply(r.numerator),
        denominator.multiply(r.denominator));
  }

  public Rational times(long n) {
    return times(of(n));
  }

  public Rational divide(Rational r) {
    if (r.isZero()) {
      throw new ArithmeticException("division by zero");
    }
    return of(numerator.multiply(r.denominator),
        denominator.multiply(r.numerator));
  }

  public Rational negate() {
    return isZero() ? this : new Rational(numerator.negate(), denominator);
  }

  public Rational abs() {
    return signum() < 0 ? negate() : this;
  }

  /** Returns the nearest double; used only for display and norms. */
  public double doubleValue() {
    if (isInteger()) {
      return numerator.doubleValue();
    }
    return new BigDecimal(numerator)
        .divide(new BigDecimal(denominator), MathContext.DECIMAL64)
        .doubleValue();
  }

  @Override public int compareTo(Rational r) {
    return numerator.multiply(r.denominator)
        .compareTo(r.numerator.multiply(denominator));
  }

  @Override public int hashCode() {
    return numerator.hashCode() * 31 + denominator.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Rational
        && numerator.equals(((Rational) o).numerator)
        && denominator.equals(((Rational) o).denominator);
  }

  /** Returns "3/2", "-1", "0" etc. */
  @Override public String toString() {
    return isInteger()
        ? numerator.toString()
        : numerator + "/" + denominator;
  }

  /** Returns "\frac{3}{2}", "-1" etc. */
  public String latex() {
    if (isInteger()) {
      return numerator.toString();
    }
    return (signum() < 0 ? "-" : "")
        + "\\frac{" + numerator.abs() + "}{" + denominator + "}";
  }
}

// End Rational.java
