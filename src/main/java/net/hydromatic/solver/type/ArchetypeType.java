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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.NominalDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract type that stands for a generic parameter, or for an associated
 * type of another archetype, inside the generic context that declares it.
 *
 * <p>Archetypes are compared by identity. Nested archetypes, such as
 * {@code T.Element}, are created on first request and then reused.
 */
public class ArchetypeType extends BaseType {
  public final String name;
  public final @Nullable ArchetypeType parent;
  public final ImmutableList<NominalDecl> conformsTo;
  public final @Nullable Type superclass;
  private final Map<String, ArchetypeType> nestedTypes = new HashMap<>();

  private ArchetypeType(String name, @Nullable ArchetypeType parent,
      ImmutableList<NominalDecl> conformsTo, @Nullable Type superclass) {
    super(Op.ARCHETYPE, false);
    this.name = name;
    this.parent = parent;
    this.conformsTo = conformsTo;
    this.superclass = superclass;
  }

  /** Creates an archetype. */
  public static ArchetypeType create(String name,
      @Nullable ArchetypeType parent, List<NominalDecl> conformsTo,
      @Nullable Type superclass) {
    return new ArchetypeType(name, parent, ImmutableList.copyOf(conformsTo),
        superclass);
  }

  @Override public Key key() {
    return Keys.identity(this, name);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public ArchetypeType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return this;
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return System.identityHashCode(this);
  }

  @Override public boolean mayHaveSuperclass() {
    return superclass != null;
  }

  /** Returns the associated type with a given name of one of the protocols
   * that this archetype conforms to, or null. */
  public @Nullable AssociatedTypeDecl lookupAssociatedType(String name) {
    for (NominalDecl protocol : conformsTo) {
      final AssociatedTypeDecl assocType =
          protocol.lookupAssociatedType(name);
      if (assocType != null) {
        return assocType;
      }
    }
    return null;
  }

  /** Returns the nested archetype for an associated type, creating it if
   * necessary.
   *
   * @throws IllegalArgumentException if no protocol of this archetype has an
   * associated type of that name */
  public ArchetypeType getNestedType(String name) {
    ArchetypeType nested = nestedTypes.get(name);
    if (nested == null) {
      final AssociatedTypeDecl assocType = lookupAssociatedType(name);
      checkArgument(assocType != null, "archetype %s has no member type %s",
          this, name);
      nested =
          new ArchetypeType(this.name + "." + name, this,
              assocType.conformsTo, assocType.superclass);
      nestedTypes.put(name, nested);
    }
    return nested;
  }
}

// End ArchetypeType.java
