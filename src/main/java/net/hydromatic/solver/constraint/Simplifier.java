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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import net.hydromatic.solver.constraint.ConstraintLocator.PathElement;
import net.hydromatic.solver.constraint.ConstraintLocator.PathKind;
import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.decl.Conformance;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.KnownProtocol;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.DependentMemberType;
import net.hydromatic.solver.type.DynamicSelfType;
import net.hydromatic.solver.type.FnType;
import net.hydromatic.solver.type.LValueType;
import net.hydromatic.solver.type.MetatypeType;
import net.hydromatic.solver.type.NominalType;
import net.hydromatic.solver.type.TupleType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simplifies constraints.
 *
 * <p>Simplifying a constraint either decides it ({@link SolutionKind#SOLVED}
 * or {@link SolutionKind#ERROR}), or finds that it cannot be decided until
 * more type variables are bound ({@link SolutionKind#UNSOLVED}). Along the
 * way it may bind type variables, merge equivalence classes, and add simpler
 * constraints to the system.
 */
class Simplifier {
  /** Flag for {@link #matchTypes}: rather than returning
   * {@link SolutionKind#UNSOLVED}, add a constraint to the system and
   * return {@link SolutionKind#SOLVED}. */
  static final int GENERATE_CONSTRAINTS = 0x1;

  private final ConstraintSystem cs;
  private final TypeSystem typeSystem;

  Simplifier(ConstraintSystem cs) {
    this.cs = requireNonNull(cs);
    this.typeSystem = cs.typeSystem;
  }

  /** Simplifies a constraint. */
  SolutionKind simplify(Constraint constraint) {
    final ConstraintLocator locator = constraint.locator;
    switch (constraint.kind) {
    case BIND:
    case EQUAL:
    case SUBTYPE:
    case CONVERSION:
    case ARGUMENT_TUPLE_CONVERSION:
      return matchTypes(constraint.first(), constraint.second(),
          constraint.kind, 0, locator);

    case CONFORMS_TO:
    case SELF_OBJECT_OF_PROTOCOL:
      return simplifyConformsTo(constraint);

    case CHECKED_CAST:
      return simplifyCheckedCast(constraint);

    case BRIDGED_TO_OBJECTIVE_C:
      return simplifyBridgedToObjectiveC(constraint);

    case APPLICABLE_FUNCTION:
      return simplifyApplicableFunction(constraint);

    case OPTIONAL_OBJECT:
      return simplifyOptionalObject(constraint);

    case VALUE_MEMBER:
    case UNRESOLVED_VALUE_MEMBER:
      return simplifyValueMember(constraint);

    case TYPE_MEMBER:
      return simplifyTypeMember(constraint);

    case BIND_OVERLOAD:
      return cs.resolveOverload(requireNonNull(locator, "locator"),
          constraint.first(), constraint.overloadChoice())
          ? SolutionKind.SOLVED
          : SolutionKind.ERROR;

    case CONJUNCTION:
      for (Constraint nested : constraint.nested()) {
        if (!cs.addConstraint(nested)) {
          return SolutionKind.ERROR;
        }
      }
      return SolutionKind.SOLVED;

    case DISJUNCTION:
      // The solver tries each disjunct in turn.
      return SolutionKind.UNSOLVED;

    default:
      throw new AssertionError(constraint.kind);
    }
  }

  private SolutionKind fail(Failure.Kind kind, Type first,
      @Nullable Type second, @Nullable ConstraintLocator locator) {
    cs.recordFailure(kind, first, second, locator, null);
    return SolutionKind.ERROR;
  }

  private SolutionKind failMember(Type baseType, String name,
      @Nullable ConstraintLocator locator) {
    cs.recordFailure(Failure.Kind.DOES_NOT_HAVE_MEMBER, baseType, null,
        locator, name);
    return SolutionKind.ERROR;
  }

  private @Nullable ConstraintLocator extend(
      @Nullable ConstraintLocator locator, PathKind kind) {
    return cs.extendLocatorOpt(locator, PathElement.of(kind));
  }

  // Relational constraints

  /**
   * Matches two types according to a kind of relation.
   *
   * @param type1 First type
   * @param type2 Second type
   * @param kind Relation; one of the relational kinds of constraint
   * @param flags Zero or {@link #GENERATE_CONSTRAINTS}
   * @param locator Locator
   */
  SolutionKind matchTypes(Type type1, Type type2, ConstraintKind kind,
      int flags, @Nullable ConstraintLocator locator) {
    final boolean wantRValue = kind == ConstraintKind.EQUAL;
    final Type t1 = cs.getFixedTypeRecursive(type1, wantRValue);
    final Type t2 = cs.getFixedTypeRecursive(type2, wantRValue);
    if (t1 == t2) {
      return SolutionKind.SOLVED;
    }

    if (t1 instanceof TypeVariable || t2 instanceof TypeVariable) {
      return matchTypeVariable(t1, t2, kind, flags, locator);
    }

    final int subFlags = flags | GENERATE_CONSTRAINTS;

    // Loading from an l-value is the first conversion to consider.
    if (kind.isConversion() && t1 instanceof LValueType
        && !(t2 instanceof LValueType)) {
      return matchTypes(t1.rvalueType(), t2, kind, subFlags, locator);
    }

    // A conversion between optionals of different kinds, or of payloads
    // that are related, converts the payload.
    if (kind.isConversion()) {
      final Type object1 = typeSystem.optionalObjectType(t1);
      final Type object2 = typeSystem.optionalObjectType(t2);
      if (object1 != null && object2 != null) {
        return matchTypes(object1, object2, kind, subFlags,
            extend(locator, PathKind.OPTIONAL_PAYLOAD));
      }
    }

    if (t1.op() == t2.op()) {
      final SolutionKind structural =
          matchStructure(t1, t2, kind, subFlags, locator);
      if (structural != null) {
        return structural;
      }
    }

    if (kind.allowsSubtype()) {
      if (t1 instanceof DynamicSelfType) {
        return matchTypes(((DynamicSelfType) t1).selfType, t2, kind,
            subFlags, locator);
      }
      final NominalDecl decl2 = t2.nominalDecl();
      if (t1.mayHaveSuperclass() && decl2 != null && decl2.isClass()) {
        for (Type s = superclass(t1); s != null; s = superclass(s)) {
          if (s.nominalDecl() == decl2) {
            cs.increaseScore(Score.Kind.UPCAST);
            return matchTypes(s, t2, ConstraintKind.BIND, subFlags, locator);
          }
        }
      }
    }

    if (kind.isConversion()) {
      final SolutionKind converted =
          matchConversion(t1, t2, kind, subFlags, locator);
      if (converted != null) {
        return converted;
      }
    }

    if (kind == ConstraintKind.ARGUMENT_TUPLE_CONVERSION) {
      // A single argument matches a parameter list of one element, and an
      // argument list of one unlabeled element matches a single parameter.
      if (t2 instanceof TupleType && ((TupleType) t2).size() == 1
          && !(t1 instanceof TupleType)) {
        return matchTypes(t1, ((TupleType) t2).elementType(0),
            ConstraintKind.CONVERSION, subFlags,
            cs.extendLocatorOpt(locator, PathElement.tupleElement(0)));
      }
      if (t1 instanceof TupleType && ((TupleType) t1).size() == 1
          && ((TupleType) t1).label(0).isEmpty()
          && !(t2 instanceof TupleType)) {
        return matchTypes(((TupleType) t1).elementType(0), t2,
            ConstraintKind.CONVERSION, subFlags,
            cs.extendLocatorOpt(locator, PathElement.tupleElement(0)));
      }
    }

    if (t1 instanceof FnType != t2 instanceof FnType) {
      return fail(Failure.Kind.FUNCTION_TYPES_MISMATCH, t1, t2, locator);
    }
    return fail(Failure.kindFor(kind), t1, t2, locator);
  }

  private SolutionKind matchTypeVariable(Type t1, Type t2,
      ConstraintKind kind, int flags, @Nullable ConstraintLocator locator) {
    switch (kind) {
    case BIND:
    case EQUAL:
      if (t1 instanceof TypeVariable && t2 instanceof TypeVariable) {
        final TypeVariable v1 = (TypeVariable) t1;
        final TypeVariable v2 = (TypeVariable) t2;
        if (kind == ConstraintKind.EQUAL
            && v1.canBindToLValue() != v2.canBindToLValue()) {
          // Merging would lose the distinction; wait until one is bound.
          return deferOrUnsolved(t1, t2, kind, flags, locator);
        }
        if (v1.id <= v2.id) {
          cs.mergeEquivalenceClasses(v1, v2);
        } else {
          cs.mergeEquivalenceClasses(v2, v1);
        }
        return SolutionKind.SOLVED;
      }
      final TypeVariable v =
          (TypeVariable) (t1 instanceof TypeVariable ? t1 : t2);
      Type type = t1 instanceof TypeVariable ? t2 : t1;
      if (type.isLValue() && !v.canBindToLValue()) {
        if (kind == ConstraintKind.EQUAL) {
          type = type.rvalueType();
        } else {
          return fail(Failure.Kind.TYPES_NOT_EQUAL, t1, t2, locator);
        }
      }
      if (cs.occursIn(v, type)) {
        return fail(Failure.Kind.TYPES_NOT_EQUAL, t1, t2, locator);
      }
      cs.assignFixedType(v, type);
      return SolutionKind.SOLVED;

    default:
      return deferOrUnsolved(t1, t2, kind, flags, locator);
    }
  }

  private SolutionKind deferOrUnsolved(Type t1, Type t2, ConstraintKind kind,
      int flags, @Nullable ConstraintLocator locator) {
    if ((flags & GENERATE_CONSTRAINTS) == 0) {
      return SolutionKind.UNSOLVED;
    }
    return cs.addConstraint(Constraint.create(kind, t1, t2, locator))
        ? SolutionKind.SOLVED
        : SolutionKind.ERROR;
  }

  /** Matches two types that have the same operator, component by component;
   * returns null if the types are not structurally comparable. */
  private @Nullable SolutionKind matchStructure(Type t1, Type t2,
      ConstraintKind kind, int subFlags, @Nullable ConstraintLocator locator) {
    final ConstraintKind subKind =
        kind.isEquality() ? kind : ConstraintKind.SUBTYPE;
    switch (t1.op()) {
    case TUPLE_TYPE:
      return matchTuples((TupleType) t1, (TupleType) t2, kind, subFlags,
          locator);

    case FUNCTION_TYPE:
      final FnType fn1 = (FnType) t1;
      final FnType fn2 = (FnType) t2;
      return both(
          matchTypes(fn2.input, fn1.input, subKind, subFlags,
              extend(locator, PathKind.FUNCTION_ARGUMENT)),
          () -> matchTypes(fn1.result, fn2.result, subKind, subFlags,
              extend(locator, PathKind.FUNCTION_RESULT)));

    case LVALUE_TYPE:
      return matchTypes(((LValueType) t1).objectType,
          ((LValueType) t2).objectType, ConstraintKind.BIND, subFlags,
          locator);

    case METATYPE:
      return matchTypes(((MetatypeType) t1).instanceType,
          ((MetatypeType) t2).instanceType, subKind, subFlags,
          extend(locator, PathKind.INSTANCE_TYPE));

    case NOMINAL_TYPE:
      final NominalType n1 = (NominalType) t1;
      final NominalType n2 = (NominalType) t2;
      if (n1.decl != n2.decl) {
        return null;
      }
      SolutionKind result = SolutionKind.SOLVED;
      for (int i = 0; i < n1.args.size(); i++) {
        final SolutionKind argResult =
            matchTypes(n1.arg(i), n2.arg(i), ConstraintKind.BIND, subFlags,
                cs.extendLocatorOpt(locator,
                    PathElement.genericArgument(i)));
        if (argResult == SolutionKind.ERROR) {
          return argResult;
        }
        if (argResult == SolutionKind.UNSOLVED) {
          result = argResult;
        }
      }
      return result;

    case DEPENDENT_MEMBER:
      final DependentMemberType d1 = (DependentMemberType) t1;
      final DependentMemberType d2 = (DependentMemberType) t2;
      if (d1.assocType != d2.assocType) {
        return null;
      }
      return matchTypes(d1.base, d2.base, ConstraintKind.BIND, subFlags,
          locator);

    case DYNAMIC_SELF:
      return matchTypes(((DynamicSelfType) t1).selfType,
          ((DynamicSelfType) t2).selfType, kind, subFlags, locator);

    default:
      return null;
    }
  }

  private SolutionKind matchTuples(TupleType t1, TupleType t2,
      ConstraintKind kind, int subFlags,
      @Nullable ConstraintLocator locator) {
    if (t1.size() != t2.size()) {
      return fail(Failure.Kind.TUPLE_SIZE_MISMATCH, t1, t2, locator);
    }
    for (int i = 0; i < t1.size(); i++) {
      final String label1 = t1.label(i);
      final String label2 = t2.label(i);
      final boolean mismatch;
      switch (kind) {
      case CONVERSION:
        mismatch = !label1.isEmpty() && !label2.isEmpty()
            && !label1.equals(label2);
        break;
      case ARGUMENT_TUPLE_CONVERSION:
        mismatch = !label2.isEmpty() && !label1.equals(label2);
        break;
      default:
        mismatch = !label1.equals(label2);
      }
      if (mismatch) {
        return fail(Failure.Kind.TUPLE_NAME_MISMATCH, t1, t2, locator);
      }
    }
    final ConstraintKind subKind =
        kind == ConstraintKind.ARGUMENT_TUPLE_CONVERSION
            ? ConstraintKind.CONVERSION
            : kind;
    for (int i = 0; i < t1.size(); i++) {
      final PathElement element = t2.label(i).isEmpty()
          ? PathElement.tupleElement(i)
          : PathElement.of(PathKind.NAMED_TUPLE_ELEMENT, i);
      final SolutionKind result =
          matchTypes(t1.elementType(i), t2.elementType(i), subKind, subFlags,
              cs.extendLocatorOpt(locator, element));
      if (result != SolutionKind.SOLVED) {
        return result;
      }
    }
    return SolutionKind.SOLVED;
  }

  /** Returns the conversion of {@code t1} to {@code t2}, or null if there is
   * none. */
  private @Nullable SolutionKind matchConversion(Type t1, Type t2,
      ConstraintKind kind, int subFlags,
      @Nullable ConstraintLocator locator) {
    final NominalDecl decl2 = t2.nominalDecl();
    if (t2.isExistential() && decl2 != null && !t1.isExistential()) {
      if (cs.context.conformsTo(t1, decl2) != null) {
        cs.increaseScore(Score.Kind.EXISTENTIAL_CONVERSION);
        return SolutionKind.SOLVED;
      }
    }

    final Type object2 = typeSystem.optionalObjectType(t2);
    if (object2 != null) {
      cs.increaseScore(Score.Kind.VALUE_TO_OPTIONAL);
      return matchTypes(t1, object2, kind, subFlags,
          extend(locator, PathKind.OPTIONAL_PAYLOAD));
    }

    if (cs.isAttemptingFixes()) {
      final Type object1 = typeSystem.optionalObjectType(t1);
      if (object1 != null) {
        cs.recordFix(Fix.Kind.FORCE_UNWRAP, t1, t2, locator);
        return matchTypes(object1, t2, kind, subFlags, locator);
      }
      final NominalDecl decl1 = t1.nominalDecl();
      if (decl1 != null && decl2 != null && decl1.isClass()
          && decl2.isClass() && decl2.isSubclassOf(decl1)) {
        cs.recordFix(Fix.Kind.FORCE_DOWNCAST, t1, t2, locator);
        return SolutionKind.SOLVED;
      }
    }
    return null;
  }

  private @Nullable Type superclass(Type type) {
    if (type instanceof NominalType) {
      return ((NominalType) type).superclass(typeSystem);
    }
    if (type instanceof ArchetypeType) {
      return ((ArchetypeType) type).superclass;
    }
    if (type instanceof DynamicSelfType) {
      return superclass(((DynamicSelfType) type).selfType);
    }
    return null;
  }

  /** Combines the results of matching two components; does not match the
   * second if the first failed. */
  private static SolutionKind both(SolutionKind first,
      Supplier<SolutionKind> second) {
    if (first == SolutionKind.ERROR) {
      return first;
    }
    final SolutionKind kind = second.get();
    if (kind == SolutionKind.ERROR) {
      return kind;
    }
    return first == SolutionKind.UNSOLVED ? first : kind;
  }

  // Other constraints

  private SolutionKind simplifyConformsTo(Constraint constraint) {
    final Type type = cs.getFixedTypeRecursive(constraint.first(), true);
    if (type instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    final NominalDecl protocol =
        requireNonNull(constraint.second().nominalDecl());
    if (constraint.kind == ConstraintKind.SELF_OBJECT_OF_PROTOCOL) {
      final NominalDecl decl = type.nominalDecl();
      if (type.isExistential() && decl != null
          && decl.inheritsFrom(protocol)) {
        return SolutionKind.SOLVED;
      }
    }
    if (cs.context.conformsTo(type, protocol) != null) {
      return SolutionKind.SOLVED;
    }
    return fail(Failure.Kind.DOES_NOT_CONFORM_TO_PROTOCOL, type,
        constraint.second(), constraint.locator);
  }

  private SolutionKind simplifyCheckedCast(Constraint constraint) {
    final Type from = cs.getFixedTypeRecursive(constraint.first(), true);
    final Type to = cs.getFixedTypeRecursive(constraint.second(), true);
    if (from instanceof TypeVariable || to instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    return SolutionKind.SOLVED;
  }

  private SolutionKind simplifyBridgedToObjectiveC(Constraint constraint) {
    final Type type = cs.getFixedTypeRecursive(constraint.first(), true);
    if (type instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    if (cs.context.isBridgedToObjectiveC(type)) {
      return SolutionKind.SOLVED;
    }
    return fail(Failure.Kind.IS_NOT_BRIDGED_TO_OBJECTIVE_C, type, null,
        constraint.locator);
  }

  private SolutionKind simplifyApplicableFunction(Constraint constraint) {
    final FnType call = (FnType) constraint.first();
    final Type callee = cs.getFixedTypeRecursive(constraint.second(), true);
    if (callee instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    final ConstraintLocator locator = constraint.locator;
    if (callee instanceof FnType) {
      final FnType fn = (FnType) callee;
      return both(
          matchTypes(call.input, fn.input,
              ConstraintKind.ARGUMENT_TUPLE_CONVERSION, GENERATE_CONSTRAINTS,
              extend(locator, PathKind.APPLY_ARGUMENT)),
          () -> matchTypes(call.result, fn.result, ConstraintKind.BIND,
              GENERATE_CONSTRAINTS,
              extend(locator, PathKind.FUNCTION_RESULT)));
    }
    if (callee instanceof MetatypeType) {
      // Calling a type calls one of its initializers.
      final ConstraintLocator ctorLocator =
          extend(locator, PathKind.CONSTRUCTOR_MEMBER);
      final TypeVariable ctor =
          cs.createTypeVariable(ctorLocator,
              TypeVariable.Option.CAN_BIND_TO_LVALUE);
      if (!cs.addConstraint(
          Constraint.member(ConstraintKind.VALUE_MEMBER, callee, ctor, "init",
              ctorLocator))) {
        return SolutionKind.ERROR;
      }
      return cs.addConstraint(
          Constraint.create(ConstraintKind.APPLICABLE_FUNCTION, call, ctor,
              locator))
          ? SolutionKind.SOLVED
          : SolutionKind.ERROR;
    }
    return fail(Failure.Kind.IS_NOT_FUNCTION, callee, null, locator);
  }

  private SolutionKind simplifyOptionalObject(Constraint constraint) {
    final Type optional = cs.getFixedTypeRecursive(constraint.first(), true);
    if (optional instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    final Type object = typeSystem.optionalObjectType(optional);
    if (object == null) {
      return fail(Failure.Kind.TYPES_NOT_EQUAL, optional,
          typeSystem.optionalType(constraint.second()), constraint.locator);
    }
    return matchTypes(constraint.second(), object, ConstraintKind.BIND,
        GENERATE_CONSTRAINTS, constraint.locator);
  }

  private SolutionKind simplifyValueMember(Constraint constraint) {
    final String name = constraint.member();
    final ConstraintLocator locator = constraint.locator;
    Type baseType = cs.getFixedTypeRecursive(constraint.first(), false);
    final Type baseObjectType =
        cs.getFixedTypeRecursive(baseType.rvalueType(), true);
    if (baseObjectType instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    if (baseType.isLValue()) {
      baseType = typeSystem.lvalueType(baseObjectType);
    } else {
      baseType = baseObjectType;
    }

    final boolean unresolved =
        constraint.kind == ConstraintKind.UNRESOLVED_VALUE_MEMBER;
    Type instanceType = baseObjectType;
    final boolean isMetatype = baseObjectType instanceof MetatypeType;
    if (isMetatype) {
      instanceType =
          cs.getFixedTypeRecursive(
              ((MetatypeType) baseObjectType).instanceType, true);
      if (instanceType instanceof TypeVariable) {
        return SolutionKind.UNSOLVED;
      }
    }

    final Type memberType = constraint.second();
    if (instanceType instanceof TupleType && !isMetatype) {
      final TupleType tupleType = (TupleType) instanceType;
      int index = tupleType.indexOf(name);
      if (index < 0 && name.matches("[0-9]+")) {
        index = Integer.parseInt(name);
      }
      if (index < 0 || index >= tupleType.size()) {
        return failMember(baseObjectType, name, locator);
      }
      return cs.resolveOverload(requireNonNull(locator, "locator"),
          memberType, OverloadChoice.tupleIndex(baseType, index))
          ? SolutionKind.SOLVED
          : SolutionKind.ERROR;
    }

    final NominalDecl dynamicLookup =
        cs.context.getProtocol(KnownProtocol.DYNAMIC_LOOKUP);
    final boolean isDynamic = dynamicLookup != null
        && instanceType.nominalDecl() == dynamicLookup;
    final List<OverloadChoice> choices = new ArrayList<>();
    final Set<List<Object>> seen = new HashSet<>();
    for (Decl decl : cs.lookupMember(baseObjectType, name)) {
      final boolean isInstance = decl.isInstanceMember();
      if (unresolved && isInstance) {
        continue;
      }
      if (!isMetatype && !isInstance) {
        continue;
      }
      if (isDynamic) {
        // Several classes may declare the same method; one of each is
        // enough.
        final String selector =
            decl.selector() + (decl.isStatic() ? "#static" : "");
        final List<Object> key =
            ImmutableList.of(selector, decl.resultInterfaceType());
        if (seen.add(key)) {
          choices.add(OverloadChoice.declViaDynamic(baseType, decl));
        }
      } else {
        choices.add(OverloadChoice.decl(baseType, decl, false));
      }
    }
    if (choices.isEmpty()) {
      return failMember(baseObjectType, name, locator);
    }
    return cs.addOverloadSet(memberType, choices,
        requireNonNull(locator, "locator"))
        ? SolutionKind.SOLVED
        : SolutionKind.ERROR;
  }

  private SolutionKind simplifyTypeMember(Constraint constraint) {
    final String name = constraint.member();
    final ConstraintLocator locator = constraint.locator;
    final Type baseType = cs.getFixedTypeRecursive(constraint.first(), true);
    if (baseType instanceof TypeVariable) {
      return SolutionKind.UNSOLVED;
    }
    final Type memberType;
    if (baseType instanceof ArchetypeType) {
      final ArchetypeType archetype = (ArchetypeType) baseType;
      if (archetype.lookupAssociatedType(name) == null) {
        return failMember(baseType, name, locator);
      }
      memberType = archetype.getNestedType(name);
    } else {
      Type found = null;
      for (Decl decl : cs.lookupMember(baseType, name)) {
        if (decl instanceof AssociatedTypeDecl) {
          final AssociatedTypeDecl assocType = (AssociatedTypeDecl) decl;
          final Conformance conformance =
              cs.context.conformsTo(baseType, assocType.protocol());
          if (conformance != null) {
            found = conformance.typeWitness(assocType);
          }
          break;
        }
        if (decl instanceof NominalDecl) {
          found = ((NominalDecl) decl).declaredInterfaceType();
          break;
        }
      }
      if (found == null) {
        return failMember(baseType, name, locator);
      }
      memberType = found;
    }
    return matchTypes(constraint.second(), memberType, ConstraintKind.BIND,
        GENERATE_CONSTRAINTS, locator);
  }
}

// End Simplifier.java
