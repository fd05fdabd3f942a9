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
package net.hydromatic.solver.constraint;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Outcome of {@link ConstraintSystem#solve()}. */
public final class SolveResult {
  public final Kind kind;
  /** The surviving solutions, all with the best score. */
  public final ImmutableList<Solution> solutions;
  /** Failures recorded while solving. */
  public final ImmutableList<Failure> failures;
  /** If the result is ambiguous, the locator whose overload differs most
   * among the solutions, or null if they differ only in types. */
  public final @Nullable ConstraintLocator ambiguousLocator;

  SolveResult(Kind kind, List<Solution> solutions, List<Failure> failures,
      @Nullable ConstraintLocator ambiguousLocator) {
    this.kind = requireNonNull(kind);
    this.solutions = ImmutableList.copyOf(solutions);
    this.failures = ImmutableList.copyOf(failures);
    this.ambiguousLocator = ambiguousLocator;
  }

  @Override public String toString() {
    return kind + " " + solutions;
  }

  /** Returns the unique solution.
   *
   * @throws IllegalStateException if the result is not {@link Kind#SOLVED} */
  public Solution solution() {
    checkState(kind == Kind.SOLVED, "no unique solution: %s", kind);
    return solutions.get(0);
  }

  /** Returns the first failure recorded, or null. */
  public @Nullable Failure firstFailure() {
    return failures.isEmpty() ? null : failures.get(0);
  }

  /** Kind of outcome. */
  public enum Kind {
    /** There is exactly one best solution. */
    SOLVED,
    /** There are several equally good solutions. */
    AMBIGUOUS,
    /** There is no solution. */
    FAILED,
    /** The solver ran out of steps before it could decide. */
    TOO_COMPLEX
  }
}

// End SolveResult.java
