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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.hydromatic.wick.Prop;
import net.hydromatic.wick.WickException;
import net.hydromatic.wick.algebra.Expression;
import net.hydromatic.wick.algebra.Rational;
import net.hydromatic.wick.algebra.SymbolicTerm;
import net.hydromatic.wick.space.OrbitalSpaces;

/**
 * Applies Wick's theorem to an expression.
 *
 * <p>Each term of the expression is a product of normal-ordered factors
 * (a bare string of operators is a product of factors of one operator each).
 * The result is the sum, over all sets of contractions between operators of
 * different factors, of the contracted terms whose number of remaining
 * operators is between {@code minRank} and {@code maxRank}. Contractions are
 * relative to the Fermi vacuum defined by the occupation of each space.
 *
 * <p>Properties:
 *
 * <ul>
 * <li>{@link Prop#PARALLELISM}: number of threads that contract terms;
 * <li>{@link Prop#SYMMETRY_PRUNING}: whether to enumerate only one matching
 *     among those related by a symmetry of a term.
 * </ul>
 */
public class WickTheorem {
  private final OrbitalSpaces spaces;
  private final Map<Prop, Object> props;
  private final Tracer tracer;

  public WickTheorem(OrbitalSpaces spaces) {
    this(spaces, ImmutableMap.of(), Tracers.empty());
  }

  public WickTheorem(OrbitalSpaces spaces, Map<Prop, Object> props,
      Tracer tracer) {
    this.spaces = requireNonNull(spaces, "spaces");
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Returns a copy of this object with a given tracer. */
  public WickTheorem withTracer(Tracer tracer) {
    return new WickTheorem(spaces, props, tracer);
  }

  /**
   * Contracts an expression and returns the canonical result.
   *
   * @param e Expression to contract
   * @param minRank Minimum number of operators remaining in a term
   * @param maxRank Maximum number of operators remaining in a term
   * @return Canonicalized sum of contracted terms
   *
   * @throws WickException if the rank window is invalid, or if an index
   *     belongs to a space that is not registered
   */
  public Expression contract(Expression e, int minRank, int maxRank) {
    if (minRank < 0 || maxRank < minRank) {
      throw new WickException(WickException.Kind.INVALID_RANK_WINDOW,
          "invalid rank window [" + minRank + ", " + maxRank + "]");
    }
    final List<Task> tasks = new ArrayList<>();
    for (Map.Entry<SymbolicTerm, Rational> entry : e) {
      entry.getKey().forEachIndex(index -> spaces.check(index.space));
      for (SymbolicTerm term : entry.getKey().expandComposite()) {
        tracer.onTerm(term, entry.getValue());
        tasks.add(new Task(term, entry.getValue(), minRank, maxRank,
            Prop.SYMMETRY_PRUNING.booleanValue(props)));
      }
    }

    final int parallelism = Prop.PARALLELISM.intValue(props);
    final List<Task> done =
        parallelism > 1 && tasks.size() > 1
            ? runParallel(tasks, parallelism)
            : runSerial(tasks);

    final Expression.Builder builder = Expression.builder();
    for (Task task : done) {
      tracer.onContractions(task.term, task.enumerator.matchings,
          task.enumerator.folded);
      builder.addAll(task.result);
    }
    final Expression result = builder.build().canonicalize();
    tracer.onResult(result);
    return result;
  }

  private static List<Task> runSerial(List<Task> tasks) {
    tasks.forEach(Task::run);
    return tasks;
  }

  private static List<Task> runParallel(List<Task> tasks, int parallelism) {
    final ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(parallelism, tasks.size()));
    try {
      final List<Future<Task>> futures = new ArrayList<>();
      for (Task task : tasks) {
        final Callable<Task> callable = task::run;
        futures.add(executor.submit(callable));
      }
      final List<Task> done = new ArrayList<>();
      for (Future<Task> future : futures) {
        done.add(future.get());
      }
      return done;
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException(cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted during contraction", e);
    } finally {
      executor.shutdownNow();
    }
  }

  /** Contraction of one term. */
  private static class Task {
    final SymbolicTerm term;
    final ContractionEnumerator enumerator;
    Expression result = Expression.EMPTY;

    Task(SymbolicTerm term, Rational coefficient, int minRank, int maxRank,
        boolean symmetryPruning) {
      this.term = term;
      this.enumerator =
          new ContractionEnumerator(term, coefficient, minRank, maxRank,
              symmetryPruning);
    }

    Task run() {
      final Expression.Builder builder = Expression.builder();
      enumerator.enumerate(builder);
      result = builder.build().canonicalize();
      return this;
    }
  }
}

// End WickTheorem.java
