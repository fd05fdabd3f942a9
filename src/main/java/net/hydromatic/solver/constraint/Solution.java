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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeShuttle;
import net.hydromatic.solver.type.TypeSystem;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A complete assignment of types to the type variables of a constraint
 * system, with the overloads chosen along the way.
 *
 * <p>Solutions are immutable. */
public final class Solution {
  private final TypeSystem typeSystem;
  private final ImmutableMap<TypeVariable, Type> typeBindings;
  private final ImmutableMap<ConstraintLocator, ResolvedOverload>
      overloadChoices;
  public final Score score;
  public final ImmutableList<Fix> fixes;

  Solution(TypeSystem typeSystem, Map<TypeVariable, Type> typeBindings,
      Map<ConstraintLocator, ResolvedOverload> overloadChoices, Score score,
      ImmutableList<Fix> fixes) {
    this.typeSystem = requireNonNull(typeSystem);
    this.typeBindings = ImmutableMap.copyOf(typeBindings);
    this.overloadChoices = ImmutableMap.copyOf(overloadChoices);
    this.score = requireNonNull(score);
    this.fixes = requireNonNull(fixes);
  }

  @Override public String toString() {
    return "Solution{score=" + score
        + ", bindings=" + typeBindings
        + ", overloads=" + overloadChoices.values()
        + (fixes.isEmpty() ? "" : ", fixes=" + fixes)
        + '}';
  }

  /** Returns the type that a type variable is bound to, or null if it is
   * free in this solution. */
  public @Nullable Type getFixedType(TypeVariable typeVariable) {
    return typeBindings.get(typeVariable);
  }

  public ImmutableMap<TypeVariable, Type> typeBindings() {
    return typeBindings;
  }

  /** Returns the overload that was chosen at a locator, or null. */
  public @Nullable ResolvedOverload getOverloadChoice(
      ConstraintLocator locator) {
    return overloadChoices.get(locator);
  }

  public ImmutableMap<ConstraintLocator, ResolvedOverload> overloadChoices() {
    return overloadChoices;
  }

  /** Returns whether the solution required fixes; if so, the expression is
   * ill-typed and the fixes say how to repair it. */
  public boolean isRecovered() {
    return !fixes.isEmpty();
  }

  /** Replaces each type variable in a type by the type it is bound to. */
  public Type simplifyType(Type type) {
    if (!type.hasTypeVariable()) {
      return type;
    }
    return type.accept(
        new TypeShuttle(typeSystem) {
          @Override public Type visit(TypeVariable typeVariable) {
            final Type bound = typeBindings.get(typeVariable);
            return bound == null ? typeVariable : bound;
          }
        });
  }

  /** Returns whether this solution binds the same type variables to the
   * same types, and chooses the same overloads, as another. */
  boolean isEquivalent(Solution that) {
    if (!typeBindings.equals(that.typeBindings)
        || !overloadChoices.keySet().equals(that.overloadChoices.keySet())) {
      return false;
    }
    for (Map.Entry<ConstraintLocator, ResolvedOverload> e
        : overloadChoices.entrySet()) {
      final ResolvedOverload other =
          requireNonNull(that.overloadChoices.get(e.getKey()));
      if (!e.getValue().choice.isSameChoice(other.choice)) {
        return false;
      }
    }
    return true;
  }
}

// End Solution.java
