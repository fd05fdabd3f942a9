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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.List;

/** Log of changes to the state of a {@link ConstraintSystem}, so that the
 * state can be rolled back when the solver backtracks.
 *
 * @see SolverScope */
final class Trail {
  private final List<Change> changes = new ArrayList<>();

  /** Returns the number of changes recorded; pass it to
   * {@link #undoTo(int)} to roll back later changes. */
  int size() {
    return changes.size();
  }

  void record(Change change) {
    changes.add(change);
  }

  /** Undoes changes, most recent first, until {@code size} remain. */
  void undoTo(int size) {
    checkArgument(size <= changes.size(), "trail has %s changes, not %s",
        changes.size(), size);
    for (int i = changes.size() - 1; i >= size; i--) {
      changes.remove(i).undo();
    }
  }

  /** A change that knows how to undo itself. */
  @FunctionalInterface
  interface Change {
    void undo();
  }
}

// End Trail.java
