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

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.solver.constraint.ConstraintSystem.OpenedReference;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.Conformance;
import net.hydromatic.solver.decl.ConstructorDecl;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.decl.SubscriptDecl;
import net.hydromatic.solver.decl.VarDecl;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.DynamicSelfType;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.MetatypeType;
import net.hydromatic.solver.type.ModuleType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Computes the type of a reference to a declaration, opening its generic
 * parameters and, for a member, the generic parameters of the type that
 * declares it.
 */
class ReferenceBuilder {
  private final ConstraintSystem cs;
  private final TypeSystem typeSystem;

  ReferenceBuilder(ConstraintSystem cs) {
    this.cs = requireNonNull(cs);
    this.typeSystem = cs.typeSystem;
  }

  /** Returns the declared type of a nominal type, with its generic
   * parameters opened. */
  private Type openNominal(NominalDecl decl,
      @Nullable DependentTypeOpener opener) {
    if (!decl.isGeneric()) {
      return decl.declaredInterfaceType();
    }
    return cs.openType(typeSystem.unboundGenericType(decl), new HashMap<>(),
        opener);
  }

  OpenedReference getTypeOfReference(Decl value, boolean isTypeReference,
      @Nullable DependentTypeOpener opener) {
    if (value instanceof NominalDecl) {
      final Type type = openNominal((NominalDecl) value, opener);
      final Type refType =
          isTypeReference ? type : typeSystem.metatypeType(type);
      return new OpenedReference(refType, refType, false);
    }

    final Map<Type, TypeVariable> replacements = new HashMap<>();
    if (value instanceof FuncDecl
        && ((FuncDecl) value).isOperator()
        && value.owner != null) {
      // An operator declared in a type is found by unqualified lookup;
      // its Self is inferred from the operands.
      cs.openGeneric(value.owner.genericSignature(), false, opener,
          replacements);
    }
    Type type = cs.openType(value.interfaceType(), replacements, opener);
    if (value instanceof VarDecl && value.isSettable()) {
      type = typeSystem.lvalueType(type);
    }
    return new OpenedReference(type, type, false);
  }

  OpenedReference getTypeOfMemberReference(Type baseType, Decl value,
      boolean isTypeReference, boolean isDynamicResult,
      @Nullable DependentTypeOpener opener) {
    Type baseObjectType =
        cs.getFixedTypeRecursive(baseType.rvalueType(), true);
    boolean isInstance = true;
    if (baseObjectType instanceof MetatypeType) {
      baseObjectType =
          cs.getFixedTypeRecursive(
              ((MetatypeType) baseObjectType).instanceType, true);
      isInstance = false;
    }

    if (baseObjectType instanceof ModuleType) {
      return getTypeOfReference(value, isTypeReference, opener);
    }

    if (value instanceof AssociatedTypeDecl) {
      final Type memberType =
          associatedType(baseObjectType, (AssociatedTypeDecl) value);
      final Type refType =
          isTypeReference ? memberType : typeSystem.metatypeType(memberType);
      return new OpenedReference(refType, refType, false);
    }

    if (value instanceof NominalDecl) {
      return getTypeOfReference(value, isTypeReference, opener);
    }

    final NominalDecl owner = requireNonNull(value.owner, "owner");
    final Map<Type, TypeVariable> replacements = new HashMap<>();
    final Type selfType;
    if (owner.isProtocol()) {
      cs.openGeneric(owner.genericSignature(), true, opener, replacements);
      selfType = requireNonNull(replacements.get(owner.selfType()));
    } else {
      selfType =
          owner.isGeneric()
              ? cs.openType(typeSystem.unboundGenericType(owner),
                  replacements, opener)
              : owner.declaredInterfaceType();
    }

    Type openedMember =
        cs.openType(value.interfaceType(), replacements, opener);
    if (value instanceof VarDecl
        && value.isSettable()
        && (baseType.isLValue() || owner.isClass() || !isInstance)) {
      openedMember = typeSystem.lvalueType(openedMember);
    }
    if (value.hasDynamicSelf()) {
      openedMember = typeSystem.replaceDynamicSelf(openedMember,
          baseObjectType);
    }
    if (value instanceof ConstructorDecl
        && openedMember instanceof FnType
        && (owner.isProtocol()
            || baseObjectType instanceof DynamicSelfType)) {
      openedMember =
          typeSystem.fnType(((FnType) openedMember).input, baseObjectType);
    }

    final Type selfParam;
    if (!value.isInstanceMember()) {
      selfParam = typeSystem.metatypeType(selfType);
    } else if (baseType.isLValue() && !owner.isClass()) {
      selfParam = typeSystem.lvalueType(selfType);
    } else {
      selfParam = selfType;
    }
    final Type openedFullType =
        typeSystem.fnType(typeSystem.tupleType(selfParam), openedMember);

    if (owner.isProtocol()) {
      cs.addConstraint(ConstraintKind.EQUAL, baseObjectType, selfType, null);
    } else if (!isDynamicResult) {
      addSelfConstraint(baseObjectType, selfType, owner);
    }

    final Type refType;
    final boolean isSubscript = value instanceof SubscriptDecl;
    if (isSubscript && openedMember instanceof FnType) {
      final FnType fnType = (FnType) openedMember;
      final Type element;
      if (value.isOptionalRequirement()) {
        element = typeSystem.optionalType(fnType.result);
      } else if (isDynamicResult) {
        element = typeSystem.implicitlyUnwrappedOptionalType(fnType.result);
      } else {
        element = fnType.result;
      }
      refType = typeSystem.fnType(fnType.input, element);
    } else if (isInstance || !value.isInstanceMember()) {
      refType = openedMember;
    } else {
      // A reference to an instance method through its type is curried:
      // it takes the instance and returns the method.
      refType = openedFullType;
    }
    return new OpenedReference(openedFullType, refType, isSubscript);
  }

  /** Constrains the base of a member reference to be usable as
   * {@code self}. */
  private void addSelfConstraint(Type baseObjectType, Type selfType,
      NominalDecl owner) {
    if (baseObjectType.isExistential() && selfType.isExistential()) {
      cs.addConstraint(ConstraintKind.SELF_OBJECT_OF_PROTOCOL,
          baseObjectType, selfType, null);
    } else if (owner.isClass()) {
      cs.addConstraint(ConstraintKind.SUBTYPE, baseObjectType, selfType,
          null);
    } else {
      cs.addConstraint(ConstraintKind.EQUAL, baseObjectType, selfType, null);
    }
  }

  /** Returns the type of an associated type of a base type: a nested
   * archetype, the witness of a conformance, or else a dependent member
   * type. */
  private Type associatedType(Type baseObjectType,
      AssociatedTypeDecl assocType) {
    if (baseObjectType instanceof ArchetypeType) {
      return ((ArchetypeType) baseObjectType).getNestedType(assocType.name);
    }
    final Conformance conformance =
        cs.context.conformsTo(baseObjectType, assocType.protocol());
    if (conformance != null) {
      final Type witness = conformance.typeWitness(assocType);
      if (witness != null) {
        return witness;
      }
    }
    return typeSystem.dependentMemberType(baseObjectType, assocType);
  }
}

// End ReferenceBuilder.java
