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

import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Record that the solver chose an overload at a locator.
 *
 * <p>Each record links to the record that was made before it, so the
 * choices made on the way to a solution can be replayed by walking from the
 * most recent record. */
public final class ResolvedOverload {
  /** The type variable that stands for the reference. */
  public final Type boundType;
  public final OverloadChoice choice;
  public final ConstraintLocator locator;
  /** Opened type of the declaration, including its {@code self}
   * parameter. */
  public final Type openedFullType;
  /** Type of the reference. */
  public final Type refType;
  /** The record made before this one, or null. */
  public final @Nullable ResolvedOverload previous;

  ResolvedOverload(Type boundType, OverloadChoice choice,
      ConstraintLocator locator, Type openedFullType, Type refType,
      @Nullable ResolvedOverload previous) {
    this.boundType = requireNonNull(boundType);
    this.choice = requireNonNull(choice);
    this.locator = requireNonNull(locator);
    this.openedFullType = requireNonNull(openedFullType);
    this.refType = requireNonNull(refType);
    this.previous = previous;
  }

  @Override public String toString() {
    return boundType + " := " + refType + " (" + choice + ")";
  }
}

// End ResolvedOverload.java
