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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * Scope within which the solver makes a tentative decision.
 *
 * <p>Closing the scope undoes every change recorded on the trail since it
 * was opened, and restores the lists of active and inactive constraints.
 * Scopes nest, and must be closed in the reverse order that they were
 * opened; use them in a {@code try}-with-resources statement.
 */
class SolverScope implements AutoCloseable {
  private final ConstraintSystem cs;
  private final int trailSize;
  private final ImmutableList<Constraint> activeConstraints;
  private final ImmutableList<Constraint> inactiveConstraints;

  SolverScope(ConstraintSystem cs) {
    this.cs = requireNonNull(cs);
    this.trailSize = cs.trail.size();
    this.activeConstraints =
        ImmutableList.copyOf(cs.activeConstraints.asList());
    this.inactiveConstraints = ImmutableList.copyOf(cs.inactiveConstraints);
    ++cs.depth;
  }

  @Override public void close() {
    cs.trail.undoTo(trailSize);

    cs.activeConstraints.forEach(c -> c.setActive(false));
    cs.activeConstraints.clear();
    for (Constraint constraint : activeConstraints) {
      cs.activeConstraints.add(constraint);
      constraint.setActive(true);
    }

    cs.inactiveConstraints.forEach(c -> c.setActive(false));
    cs.inactiveConstraints.clear();
    cs.inactiveConstraints.addAll(inactiveConstraints);
    --cs.depth;
  }
}

// End SolverScope.java
