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

import java.util.function.Consumer;
import net.hydromatic.wick.algebra.Expression;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.SymbolicTerm;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each term before it
   * is contracted, then calls the underlying tracer. */
  public static Tracer withOnTerm(Tracer tracer,
      Consumer<SymbolicTerm> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTerm(SymbolicTerm term, Rational coefficient) {
        consumer.accept(term);
        super.onTerm(term, coefficient);
      }
    };
  }

  /** Returns a tracer that receives the number of matchings enumerated and
   * folded for each term, then calls the underlying tracer. */
  public static Tracer withOnContractions(Tracer tracer,
      ContractionConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onContractions(SymbolicTerm term, int matchings,
          int folded) {
        consumer.accept(term, matchings, folded);
        super.onContractions(term, matchings, folded);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of a
   * contraction, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<Expression> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Expression result) {
        consumer.accept(result);
        super.onResult(result);
      }
    };
  }

  /** Action on the contraction statistics of a term. */
  @FunctionalInterface
  public interface ContractionConsumer {
    void accept(SymbolicTerm term, int matchings, int folded);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onTerm(SymbolicTerm term, Rational coefficient) {
    }

    @Override public void onContractions(SymbolicTerm term, int matchings,
        int folded) {
    }

    @Override public void onResult(Expression result) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onTerm(SymbolicTerm term, Rational coefficient) {
      tracer.onTerm(term, coefficient);
    }

    @Override public void onContractions(SymbolicTerm term, int matchings,
        int folded) {
      tracer.onContractions(term, matchings, folded);
    }

    @Override public void onResult(Expression result) {
      tracer.onResult(result);
    }
  }
}

// End Tracers.java
