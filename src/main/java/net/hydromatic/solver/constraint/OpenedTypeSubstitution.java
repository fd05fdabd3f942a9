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

import java.util.Map;
import net.hydromatic.solver.constraint.ConstraintLocator.PathElement;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.DependentMemberType;
import net.hydromatic.solver.type.GenericFnType;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeShuttle;
import net.hydromatic.solver.type.TypeVariable;
import net.hydromatic.solver.type.UnboundGenericType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Replaces generic parameters, archetypes and dependent member types in a
 * type by the type variables that a constraint system opened for them.
 *
 * <p>Generic function types and unbound generic types that occur in the type
 * are opened as they are met, and their parameters are added to the same
 * map of replacements.
 */
class OpenedTypeSubstitution extends TypeShuttle {
  private final ConstraintSystem cs;
  private final Map<Type, TypeVariable> replacements;
  private final @Nullable DependentTypeOpener opener;

  OpenedTypeSubstitution(ConstraintSystem cs,
      Map<Type, TypeVariable> replacements,
      @Nullable DependentTypeOpener opener) {
    super(cs.typeSystem);
    this.cs = requireNonNull(cs);
    this.replacements = requireNonNull(replacements);
    this.opener = opener;
  }

  /** Replaces the generic types in a type. */
  Type substitute(Type type) {
    return apply(type);
  }

  @Override public Type visit(GenericParamType genericParamType) {
    final TypeVariable typeVariable = replacements.get(genericParamType);
    return typeVariable == null ? genericParamType : typeVariable;
  }

  @Override public Type visit(ArchetypeType archetypeType) {
    final TypeVariable typeVariable = replacements.get(archetypeType);
    return typeVariable == null ? archetypeType : typeVariable;
  }

  @Override public Type visit(DependentMemberType dependentMemberType) {
    final Type base = apply(dependentMemberType.base);
    if (!(base instanceof TypeVariable)) {
      return typeSystem.dependentMemberType(base,
          dependentMemberType.assocType);
    }
    return getTypeVariable((TypeVariable) base,
        dependentMemberType.assocType);
  }

  @Override public Type visit(GenericFnType genericFnType) {
    cs.openGeneric(genericFnType.signature, false, opener, replacements);
    return typeSystem.fnType(apply(genericFnType.input),
        apply(genericFnType.result));
  }

  @Override public Type visit(UnboundGenericType unboundGenericType) {
    final NominalDecl decl = unboundGenericType.decl;
    cs.openGeneric(decl.genericSignature(), false, opener, replacements);
    return apply(decl.declaredInterfaceType());
  }

  /** Returns the type variable that stands for an associated type of a type
   * variable, creating it the first time. */
  private TypeVariable getTypeVariable(TypeVariable base,
      AssociatedTypeDecl assocType) {
    final TypeVariable existing =
        cs.graph.lookupMemberType(base, assocType.name);
    if (existing != null) {
      return existing;
    }

    final ArchetypeType baseArchetype = base.archetype();
    final ConstraintLocator locator;
    if (baseArchetype != null
        && baseArchetype.lookupAssociatedType(assocType.name) != null) {
      locator =
          cs.getConstraintLocator(null,
              PathElement.archetype(
                  baseArchetype.getNestedType(assocType.name)));
    } else {
      locator = cs.getConstraintLocator(null);
    }
    final TypeVariable memberTypeVariable =
        cs.createTypeVariable(locator,
            TypeVariable.Option.PREFERS_SUBTYPE_BINDING);
    cs.graph.setMemberType(base, assocType.name, memberTypeVariable);

    if (opener == null
        || opener.shouldBindAssociatedType(base, assocType,
            memberTypeVariable)) {
      cs.addConstraint(
          Constraint.member(ConstraintKind.TYPE_MEMBER, base,
              memberTypeVariable, assocType.name, locator));
    }
    if (opener != null) {
      final Type replacement =
          opener.openedAssociatedType(base, assocType, memberTypeVariable);
      if (replacement != null) {
        cs.addConstraint(
            Constraint.create(ConstraintKind.EQUAL, memberTypeVariable,
                replacement, locator));
      }
    }

    // The associated type's own requirements
    if (assocType.superclass != null) {
      cs.addConstraint(
          Constraint.create(ConstraintKind.SUBTYPE, memberTypeVariable,
              assocType.superclass, locator));
    }
    for (NominalDecl protocol : assocType.conformsTo) {
      cs.addConstraint(
          Constraint.create(ConstraintKind.CONFORMS_TO, memberTypeVariable,
              protocol.declaredInterfaceType(), locator));
    }
    return memberTypeVariable;
  }
}

// End OpenedTypeSubstitution.java
