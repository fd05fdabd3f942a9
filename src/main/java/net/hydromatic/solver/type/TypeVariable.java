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
package net.hydromatic.solver.type;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Collection;
import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.constraint.ConstraintLocator;
import net.hydromatic.solver.decl.NominalDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Placeholder for a type that is not yet known.
 *
 * <p>A type variable belongs to one
 * {@link net.hydromatic.solver.constraint.ConstraintSystem}, which records its
 * equivalence class and the type it is bound to. Type variables are compared
 * by identity.
 */
public class TypeVariable extends BaseType {
  public final int id;
  public final @Nullable ConstraintLocator locator;
  private final ImmutableSet<Option> options;

  /** The system that created this variable. */
  public final Object owner;

  private @Nullable NominalDecl literalProtocol;

  /** Creates a TypeVariable. Use {@code ConstraintSystem.createTypeVariable}
   * rather than calling this directly. */
  public TypeVariable(Object owner, int id,
      @Nullable ConstraintLocator locator, Collection<Option> options) {
    super(Op.TYPE_VARIABLE, true);
    this.owner = owner;
    this.id = id;
    this.locator = locator;
    this.options = Sets.immutableEnumSet(options);
  }

  @Override public Key key() {
    return Keys.identity(this, "$T" + id);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public Type copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return this;
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return System.identityHashCode(this);
  }

  public boolean prefersSubtypeBinding() {
    return options.contains(Option.PREFERS_SUBTYPE_BINDING);
  }

  public boolean canBindToLValue() {
    return options.contains(Option.CAN_BIND_TO_LVALUE);
  }

  public ImmutableSet<Option> options() {
    return options;
  }

  /** Returns the literal protocol that this variable's type must conform
   * to, if it is the type of a literal. */
  public @Nullable NominalDecl literalProtocol() {
    return literalProtocol;
  }

  /** Marks this variable as the type of a literal. */
  public void setLiteralProtocol(NominalDecl protocol) {
    checkState(literalProtocol == null || literalProtocol == protocol,
        "%s already has literal protocol %s", this, literalProtocol);
    this.literalProtocol = protocol;
  }

  /** Returns the archetype that this variable was opened from, or null. */
  public @Nullable ArchetypeType archetype() {
    return locator == null ? null : locator.archetype();
  }

  /** Option that affects how a type variable is bound. */
  public enum Option {
    /** When trying bindings, prefer the most specific type. */
    PREFERS_SUBTYPE_BINDING,
    /** The variable may be bound to an l-value type. */
    CAN_BIND_TO_LVALUE
  }
}

// End TypeVariable.java
