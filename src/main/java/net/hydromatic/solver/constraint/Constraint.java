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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A relation that the solver must satisfy.
 *
 * <p>The set of type variables that a constraint mentions is computed when
 * it is created, and does not change; the
 * {@link ConstraintGraph} uses it to link the constraint to its variables.
 *
 * <p>Constraints are compared by identity.
 */
public final class Constraint {
  public final ConstraintKind kind;
  private final @Nullable Type first;
  private final @Nullable Type second;
  private final @Nullable String member;
  private final @Nullable OverloadChoice overloadChoice;
  private final ImmutableList<Constraint> nested;
  public final @Nullable ConstraintLocator locator;
  private final ImmutableSet<TypeVariable> typeVariables;

  private boolean favored;
  private boolean active;

  private Constraint(ConstraintKind kind, @Nullable Type first,
      @Nullable Type second, @Nullable String member,
      @Nullable OverloadChoice overloadChoice, List<Constraint> nested,
      @Nullable ConstraintLocator locator) {
    this.kind = requireNonNull(kind);
    this.first = first;
    this.second = second;
    this.member = member;
    this.overloadChoice = overloadChoice;
    this.nested = ImmutableList.copyOf(nested);
    this.locator = locator;
    this.typeVariables = collectTypeVariables();
  }

  private ImmutableSet<TypeVariable> collectTypeVariables() {
    final Set<TypeVariable> set = new LinkedHashSet<>();
    if (first != null) {
      set.addAll(first.typeVariables());
    }
    if (second != null) {
      set.addAll(second.typeVariables());
    }
    if (overloadChoice != null && overloadChoice.baseType != null) {
      set.addAll(overloadChoice.baseType.typeVariables());
    }
    for (Constraint constraint : nested) {
      set.addAll(constraint.typeVariables);
    }
    return ImmutableSet.copyOf(set);
  }

  /** Creates a constraint between two types. */
  public static Constraint create(ConstraintKind kind, Type first,
      Type second, @Nullable ConstraintLocator locator) {
    checkArgument(!kind.isMember() && !kind.isComposite()
            && kind != ConstraintKind.BIND_OVERLOAD,
        "use another factory method for %s", kind);
    return new Constraint(kind, requireNonNull(first), requireNonNull(second),
        null, null, ImmutableList.of(), locator);
  }

  /** Creates a constraint on a single type, such as
   * {@link ConstraintKind#BRIDGED_TO_OBJECTIVE_C}. */
  public static Constraint create(ConstraintKind kind, Type type,
      @Nullable ConstraintLocator locator) {
    checkArgument(kind == ConstraintKind.BRIDGED_TO_OBJECTIVE_C,
        "%s requires two types", kind);
    return new Constraint(kind, requireNonNull(type), null, null, null,
        ImmutableList.of(), locator);
  }

  /** Creates a member constraint: {@code memberType} is the type of the
   * member called {@code name} of {@code baseType}. */
  public static Constraint member(ConstraintKind kind, Type baseType,
      Type memberType, String name, @Nullable ConstraintLocator locator) {
    checkArgument(kind.isMember(), "not a member constraint: %s", kind);
    return new Constraint(kind, requireNonNull(baseType),
        requireNonNull(memberType), requireNonNull(name), null,
        ImmutableList.of(), locator);
  }

  /** Creates a constraint that binds a type to an overload choice. */
  public static Constraint bindOverload(Type boundType, OverloadChoice choice,
      @Nullable ConstraintLocator locator) {
    return new Constraint(ConstraintKind.BIND_OVERLOAD,
        requireNonNull(boundType), null, null, requireNonNull(choice),
        ImmutableList.of(), locator);
  }

  /** Creates a constraint that holds if all of the given constraints
   * hold. */
  public static Constraint conjunction(List<Constraint> constraints,
      @Nullable ConstraintLocator locator) {
    checkArgument(!constraints.isEmpty(), "empty conjunction");
    return new Constraint(ConstraintKind.CONJUNCTION, null, null, null, null,
        constraints, locator);
  }

  /** Creates a constraint that holds if at least one of the given constraints
   * holds. */
  public static Constraint disjunction(List<Constraint> constraints,
      @Nullable ConstraintLocator locator) {
    checkArgument(!constraints.isEmpty(), "empty disjunction");
    return new Constraint(ConstraintKind.DISJUNCTION, null, null, null, null,
        constraints, locator);
  }

  /** Returns the first type.
   *
   * @throws NullPointerException if this is a composite constraint */
  public Type first() {
    return requireNonNull(first, "first");
  }

  /** Returns the second type.
   *
   * @throws NullPointerException if this constraint has only one type */
  public Type second() {
    return requireNonNull(second, "second");
  }

  /** Returns the name of the member. */
  public String member() {
    return requireNonNull(member, "member");
  }

  public OverloadChoice overloadChoice() {
    return requireNonNull(overloadChoice, "overloadChoice");
  }

  /** Returns the constraints of a conjunction or disjunction. */
  public ImmutableList<Constraint> nested() {
    return nested;
  }

  /** Returns the type variables that this constraint mentions. */
  public ImmutableSet<TypeVariable> typeVariables() {
    return typeVariables;
  }

  /** Returns whether the solver should try this disjunct before the others
   * of its disjunction. */
  public boolean isFavored() {
    return favored;
  }

  public void setFavored(boolean favored) {
    this.favored = favored;
  }

  /** Returns whether this constraint is on the work list of its
   * system. */
  public boolean isActive() {
    return active;
  }

  void setActive(boolean active) {
    this.active = active;
  }

  @Override public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    switch (kind) {
    case CONJUNCTION:
    case DISJUNCTION:
      buf.append(kind.symbol).append(" {");
      for (int i = 0; i < nested.size(); i++) {
        buf.append(i > 0 ? "; " : "");
        nested.get(i).describeTo(buf);
      }
      buf.append('}');
      break;
    case BIND_OVERLOAD:
      buf.append(first()).append(" bound to ").append(overloadChoice());
      break;
    case BRIDGED_TO_OBJECTIVE_C:
      buf.append(first()).append(' ').append(kind.symbol);
      break;
    case VALUE_MEMBER:
    case UNRESOLVED_VALUE_MEMBER:
    case TYPE_MEMBER:
      buf.append(first()).append('[').append(kind.symbol).append(" .")
          .append(member()).append("] == ").append(second());
      break;
    default:
      buf.append(first()).append(' ').append(kind.symbol).append(' ')
          .append(second());
    }
    if (favored) {
      buf.append(" [favored]");
    }
    return buf;
  }
}

// End Constraint.java
