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
import static net.hydromatic.solver.util.Static.append;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.config.Prop;
import net.hydromatic.solver.constraint.ConstraintLocator.PathElement;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.decl.Requirement;
import net.hydromatic.solver.decl.SemanticContext;
import net.hydromatic.solver.type.ArchetypeType;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeShuttle;
import net.hydromatic.solver.type.TupleType;
import net.hydromatic.solver.type.TypeSystem;
import net.hydromatic.solver.type.TypeVariable;
import net.hydromatic.solver.util.ArrayQueue;
import net.hydromatic.solver.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * System of type variables and constraints, and the state of the search for
 * a solution.
 *
 * <p>Type variables are kept in a union-find structure: each variable
 * belongs to an equivalence class, whose representative may be bound to a
 * fixed type. When a variable is bound or merged, the constraints that
 * mention its class are moved from the inactive list to the active list,
 * and {@link #simplify()} revisits them.
 *
 * <p>Every change made while solving is recorded on a trail, so that a
 * {@link SolverScope} can roll the system back to an earlier state.
 * {@link Failure}s are the exception; they are kept.
 *
 * <p>A system is not thread-safe. Its type variables, constraints and
 * locators must not be used with any other system.
 */
public class ConstraintSystem {
  public final TypeSystem typeSystem;
  public final SemanticContext context;
  final ImmutableMap<Prop, Object> props;
  final Tracer tracer;

  final Trail trail = new Trail();
  public final ConstraintGraph graph;
  private final ResolvedOverloads resolvedOverloads;
  private final Simplifier simplifier;
  private final ReferenceBuilder referenceBuilder;

  private final List<TypeVariable> typeVariables = new ArrayList<>();
  private final List<TypeVariable> parents = new ArrayList<>();
  private final List<@Nullable Type> fixedTypes = new ArrayList<>();

  final ArrayQueue<Constraint> activeConstraints = new ArrayQueue<>();
  final List<Constraint> inactiveConstraints = new ArrayList<>();
  private final Set<Constraint> solvedConstraints =
      Sets.newIdentityHashSet();

  private final Map<LocatorKey, ConstraintLocator> locators = new HashMap<>();
  private final Table<Type, String, ImmutableList<Decl>> memberLookups =
      HashBasedTable.create();

  private Score score = Score.ZERO;
  private final List<Fix> fixes = new ArrayList<>();
  private final List<Failure> failures = new ArrayList<>();
  private @Nullable Constraint failedConstraint;
  private boolean failedBeforeSolving;
  private boolean solving;

  private final boolean recordSolverState;
  private final List<Constraint> generatedConstraints = new ArrayList<>();
  private final List<Constraint> retiredConstraints = new ArrayList<>();

  /** Depth of the current {@link SolverScope}; 0 outside the solver. */
  int depth;

  /** Creates a ConstraintSystem. */
  public ConstraintSystem(SemanticContext context, Map<Prop, Object> props,
      Tracer tracer) {
    this.context = requireNonNull(context);
    this.typeSystem = requireNonNull(context.typeSystem());
    this.props = ImmutableMap.copyOf(props);
    this.tracer = requireNonNull(tracer);
    this.graph = new ConstraintGraph(this, trail);
    this.resolvedOverloads = new ResolvedOverloads(trail);
    this.simplifier = new Simplifier(this);
    this.referenceBuilder = new ReferenceBuilder(this);
    this.recordSolverState = Prop.RECORD_SOLVER_STATE.booleanValue(props);
  }

  /** Creates a ConstraintSystem with default properties and no tracing. */
  public ConstraintSystem(SemanticContext context) {
    this(context, ImmutableMap.of(), Tracers.nullTracer());
  }

  // Type variables

  /** Creates a type variable. */
  public TypeVariable createTypeVariable(@Nullable ConstraintLocator locator,
      TypeVariable.Option... options) {
    final TypeVariable typeVariable =
        new TypeVariable(this, typeVariables.size(), locator,
            Arrays.asList(options));
    typeVariables.add(typeVariable);
    parents.add(typeVariable);
    fixedTypes.add(null);
    trail.record(() -> {
      final int last = typeVariables.size() - 1;
      typeVariables.remove(last);
      parents.remove(last);
      fixedTypes.remove(last);
    });
    return typeVariable;
  }

  /** Returns the type variables of this system, in order of creation. */
  public List<TypeVariable> getTypeVariables() {
    return ImmutableList.copyOf(typeVariables);
  }

  private void checkOwned(TypeVariable typeVariable) {
    checkArgument(typeVariable.owner == this
            && typeVariable.id < typeVariables.size()
            && typeVariables.get(typeVariable.id) == typeVariable,
        "type variable %s does not belong to this system", typeVariable);
  }

  /** Returns the representative of the equivalence class of a type
   * variable. */
  public TypeVariable getRepresentative(TypeVariable typeVariable) {
    checkOwned(typeVariable);
    TypeVariable v = typeVariable;
    for (;;) {
      final TypeVariable parent = parents.get(v.id);
      if (parent == v) {
        return v;
      }
      v = parent;
    }
  }

  /** Returns whether a type variable is the representative of its
   * equivalence class and is not bound. */
  boolean isFree(TypeVariable typeVariable) {
    return parents.get(typeVariable.id) == typeVariable
        && fixedTypes.get(typeVariable.id) == null;
  }

  /**
   * Merges the equivalence class of {@code other} into that of {@code rep}.
   *
   * <p>Both variables must be representatives. If {@code other} is bound, its
   * fixed type moves to {@code rep}, which must not also be bound.
   */
  public void mergeEquivalenceClasses(TypeVariable rep, TypeVariable other) {
    checkArgument(rep != other, "cannot merge %s with itself", rep);
    checkArgument(getRepresentative(rep) == rep, "not a representative: %s",
        rep);
    checkArgument(getRepresentative(other) == other,
        "not a representative: %s", other);
    final Type otherFixed = fixedTypes.get(other.id);
    if (otherFixed != null) {
      checkArgument(fixedTypes.get(rep.id) == null,
          "cannot merge %s and %s: both are bound", rep, other);
      setFixedType(rep, otherFixed);
    }
    parents.set(other.id, rep);
    trail.record(() -> parents.set(other.id, other));
    graph.mergeNodes(rep, other);
    tracer.onMerge(rep, other);
    addTypeVariableConstraintsToWorkList(rep);
  }

  private void setFixedType(TypeVariable typeVariable, @Nullable Type type) {
    final Type previous = fixedTypes.set(typeVariable.id, type);
    trail.record(() -> fixedTypes.set(typeVariable.id, previous));
  }

  /**
   * Binds a type variable to a type.
   *
   * <p>The variable must be a representative and not already bound to a
   * different type. If any member of its equivalence class is the type of a
   * literal and the type is not that literal's default type, the score
   * worsens.
   */
  public void assignFixedType(TypeVariable typeVariable, Type type) {
    checkArgument(getRepresentative(typeVariable) == typeVariable,
        "not a representative: %s", typeVariable);
    checkArgument(!(type instanceof TypeVariable),
        "cannot bind %s to a type variable; merge them", typeVariable);
    final Type existing = fixedTypes.get(typeVariable.id);
    if (existing == type) {
      return;
    }
    checkArgument(existing == null, "%s is already bound to %s",
        typeVariable, existing);

    for (TypeVariable v : graph.getEquivalenceClass(typeVariable)) {
      final NominalDecl literalProtocol = v.literalProtocol();
      if (literalProtocol != null) {
        final Type defaultType =
            context.getDefaultLiteralType(literalProtocol);
        if (defaultType != null
            && defaultType.nominalDecl() != type.rvalueType().nominalDecl()) {
          increaseScore(Score.Kind.NON_DEFAULT_LITERAL);
          break;
        }
      }
    }

    setFixedType(typeVariable, type);
    tracer.onBind(typeVariable, type);
    graph.bindTypeVariable(typeVariable, type);
    addTypeVariableConstraintsToWorkList(typeVariable);
  }

  /** Moves the inactive constraints that may be affected by a change to a
   * type variable onto the work list. */
  private void addTypeVariableConstraintsToWorkList(
      TypeVariable typeVariable) {
    for (Constraint constraint
        : graph.gatherAffectedConstraints(typeVariable)) {
      if (!constraint.isActive() && removeInactive(constraint)) {
        activeConstraints.add(constraint);
        constraint.setActive(true);
      }
    }
  }

  private boolean removeInactive(Constraint constraint) {
    for (int i = 0; i < inactiveConstraints.size(); i++) {
      if (inactiveConstraints.get(i) == constraint) {
        inactiveConstraints.remove(i);
        return true;
      }
    }
    return false;
  }

  /** Returns the type that a type variable's equivalence class is bound to,
   * or null. */
  public @Nullable Type getFixedType(TypeVariable typeVariable) {
    return fixedTypes.get(getRepresentative(typeVariable).id);
  }

  /**
   * Follows the bindings of type variables until it reaches a type that is
   * not a type variable, or a type variable that is free; in the latter case
   * returns the representative.
   *
   * @param wantRValue Whether to strip l-values at each step
   */
  public Type getFixedTypeRecursive(Type type, boolean wantRValue) {
    Type t = wantRValue ? type.rvalueType() : type;
    while (t instanceof TypeVariable) {
      final TypeVariable rep = getRepresentative((TypeVariable) t);
      final Type fixed = fixedTypes.get(rep.id);
      if (fixed == null) {
        return rep;
      }
      t = wantRValue ? fixed.rvalueType() : fixed;
    }
    return t;
  }

  /** Replaces each type variable in a type by the type it is bound to, or,
   * if it is free, by its representative. */
  public Type simplifyType(Type type) {
    if (!type.hasTypeVariable()) {
      return type;
    }
    return type.accept(
        new TypeShuttle(typeSystem) {
          @Override public Type visit(TypeVariable typeVariable) {
            final TypeVariable rep = getRepresentative(typeVariable);
            final Type fixed = fixedTypes.get(rep.id);
            return fixed == null ? rep : apply(fixed);
          }
        });
  }

  /** Returns whether a type variable occurs in a type, once the type has
   * been simplified. */
  boolean occursIn(TypeVariable typeVariable, Type type) {
    final TypeVariable rep = getRepresentative(typeVariable);
    for (TypeVariable v : simplifyType(type).typeVariables()) {
      if (getRepresentative(v) == rep) {
        return true;
      }
    }
    return false;
  }

  // Locators

  /** Returns the locator for an anchor and path, creating it the first
   * time. */
  public ConstraintLocator getConstraintLocator(@Nullable Expr anchor,
      List<PathElement> path) {
    final LocatorKey key = new LocatorKey(anchor, ImmutableList.copyOf(path));
    return locators.computeIfAbsent(key,
        k -> new ConstraintLocator(k.anchor, k.path));
  }

  /** Returns the locator for an anchor and path, creating it the first
   * time. */
  public ConstraintLocator getConstraintLocator(@Nullable Expr anchor,
      PathElement... path) {
    return getConstraintLocator(anchor, Arrays.asList(path));
  }

  /** Returns a locator whose path is that of another locator plus one
   * element. */
  public ConstraintLocator extendLocator(ConstraintLocator locator,
      PathElement element) {
    return getConstraintLocator(locator.anchor,
        append(locator.path, element));
  }

  /** As {@link #extendLocator}, but returns null if the locator is null. */
  @Nullable ConstraintLocator extendLocatorOpt(
      @Nullable ConstraintLocator locator, PathElement element) {
    return locator == null ? null : extendLocator(locator, element);
  }

  // Constraints

  /** Adds a constraint between two types.
   *
   * @see #addConstraint(Constraint) */
  public boolean addConstraint(ConstraintKind kind, Type first, Type second,
      @Nullable ConstraintLocator locator) {
    return addConstraint(Constraint.create(kind, first, second, locator));
  }

  /**
   * Adds a constraint, simplifying it immediately.
   *
   * <p>If the constraint is solved it is discarded; if it cannot be decided
   * yet it goes onto the inactive list and into the graph; if it fails, a
   * failure is recorded.
   *
   * @return whether the constraint may still hold
   */
  public boolean addConstraint(Constraint constraint) {
    if (solvedConstraints.contains(constraint)) {
      return true;
    }
    tracer.onAddConstraint(constraint);
    if (recordSolverState) {
      generatedConstraints.add(constraint);
    }
    final int failureCount = failures.size();
    switch (simplifier.simplify(constraint)) {
    case ERROR:
      constraintFailed(constraint, failureCount);
      return false;

    case SOLVED:
      markSolved(constraint);
      return true;

    case UNSOLVED:
    default:
      inactiveConstraints.add(constraint);
      graph.addConstraint(constraint);
      return true;
    }
  }

  private void markSolved(Constraint constraint) {
    if (solvedConstraints.add(constraint)) {
      trail.record(() -> solvedConstraints.remove(constraint));
    }
    if (recordSolverState) {
      retiredConstraints.add(constraint);
    }
  }

  private void constraintFailed(Constraint constraint, int failureCount) {
    if (failures.size() == failureCount) {
      final Type first =
          constraint.kind.isComposite() ? typeSystem.voidType()
              : constraint.first();
      recordFailure(Failure.kindFor(constraint.kind), first,
          constraint.kind.isRelational() ? constraint.second() : null,
          constraint.locator, null);
    }
    if (failedConstraint == null) {
      failedConstraint = constraint;
    }
    if (!solving) {
      failedBeforeSolving = true;
    }
    if (recordSolverState) {
      retiredConstraints.add(constraint);
    }
  }

  /**
   * Simplifies the constraints on the work list until it is empty or a
   * constraint fails.
   *
   * @return false if a constraint failed
   */
  public boolean simplify() {
    while (!activeConstraints.isEmpty()) {
      final Constraint constraint = requireNonNull(activeConstraints.poll());
      constraint.setActive(false);
      final int failureCount = failures.size();
      final SolutionKind kind = simplifier.simplify(constraint);
      tracer.onSimplify(constraint, kind);
      switch (kind) {
      case ERROR:
        constraintFailed(constraint, failureCount);
        return false;

      case SOLVED:
        graph.removeConstraint(constraint);
        markSolved(constraint);
        break;

      case UNSOLVED:
        inactiveConstraints.add(constraint);
        break;

      default:
        throw new AssertionError(kind);
      }
    }
    return true;
  }

  /** Moves every inactive constraint onto the work list. */
  void activateInactiveConstraints() {
    for (Constraint constraint : inactiveConstraints) {
      activeConstraints.add(constraint);
      constraint.setActive(true);
    }
    inactiveConstraints.clear();
  }

  /** Removes a constraint that the solver has decided, such as a
   * disjunction whose disjunct it is trying. */
  void retireConstraint(Constraint constraint) {
    removeInactive(constraint);
    graph.removeConstraint(constraint);
    markSolved(constraint);
  }

  /** Returns the constraints on the work list. */
  public List<Constraint> getActiveConstraints() {
    return ImmutableList.copyOf(activeConstraints.asList());
  }

  /** Returns the constraints that could not be decided when they were last
   * simplified. */
  public List<Constraint> getInactiveConstraints() {
    return ImmutableList.copyOf(inactiveConstraints);
  }

  /** Returns every constraint added, if
   * {@link Prop#RECORD_SOLVER_STATE} is set. */
  public List<Constraint> getGeneratedConstraints() {
    return ImmutableList.copyOf(generatedConstraints);
  }

  /** Returns every constraint that was solved or failed, if
   * {@link Prop#RECORD_SOLVER_STATE} is set. */
  public List<Constraint> getRetiredConstraints() {
    return ImmutableList.copyOf(retiredConstraints);
  }

  /** Returns the first constraint that failed, or null. */
  public @Nullable Constraint getFailedConstraint() {
    return failedConstraint;
  }

  /** Returns whether a constraint failed before {@link #solve()} was
   * called, in which case there can be no solution. */
  public boolean hasFailedBeforeSolving() {
    return failedBeforeSolving;
  }

  // Score, fixes and failures

  public Score getScore() {
    return score;
  }

  void increaseScore(Score.Kind kind) {
    final Score previous = score;
    score = score.plus(kind);
    trail.record(() -> score = previous);
  }

  void recordFix(Fix.Kind kind, Type fromType, Type toType,
      @Nullable ConstraintLocator locator) {
    fixes.add(new Fix(kind, simplifyType(fromType), simplifyType(toType),
        locator));
    trail.record(() -> fixes.remove(fixes.size() - 1));
    increaseScore(Score.Kind.FIX);
  }

  void recordFailure(Failure.Kind kind, Type first, @Nullable Type second,
      @Nullable ConstraintLocator locator, @Nullable String name) {
    final Failure failure =
        new Failure(kind, simplifyType(first),
            second == null ? null : simplifyType(second), locator, name);
    failures.add(failure);
    tracer.onFailure(failure);
  }

  /** Returns the failures recorded so far, including those on branches that
   * the solver has abandoned. */
  public List<Failure> getFailures() {
    return ImmutableList.copyOf(failures);
  }

  boolean isAttemptingFixes() {
    return Prop.ATTEMPT_FIXES.booleanValue(props);
  }

  // Members

  /** Looks up the members of a type that have a given name. Results are
   * cached. */
  ImmutableList<Decl> lookupMember(Type baseType, String name) {
    ImmutableList<Decl> decls = memberLookups.get(baseType, name);
    if (decls == null) {
      decls = ImmutableList.copyOf(context.lookupMember(baseType, name));
      memberLookups.put(baseType, name, decls);
    }
    return decls;
  }

  // Opening generic types

  /**
   * Replaces the generic parameters of a signature by fresh type variables,
   * and adds constraints for its requirements.
   *
   * @param signature Generic signature
   * @param skipProtocolSelfConstraint Whether to omit the requirement that a
   *   protocol's {@code Self} conforms to the protocol
   * @param opener Callback, or null
   * @param replacements Map to which the type variable of each parameter
   *   and of its archetype is added
   */
  public void openGeneric(GenericSignature signature,
      boolean skipProtocolSelfConstraint,
      @Nullable DependentTypeOpener opener,
      Map<Type, TypeVariable> replacements) {
    for (GenericParamType param : signature.params) {
      final ArchetypeType archetype = signature.archetype(param);
      final ConstraintLocator locator =
          getConstraintLocator(null, PathElement.archetype(archetype));
      final TypeVariable typeVariable =
          createTypeVariable(locator,
              TypeVariable.Option.PREFERS_SUBTYPE_BINDING);
      replacements.put(param, typeVariable);
      replacements.put(archetype, typeVariable);
      if (opener != null) {
        final Type replacement =
            opener.openedGenericParameter(param, typeVariable);
        if (replacement != null) {
          addConstraint(ConstraintKind.EQUAL, typeVariable, replacement,
              locator);
        }
      }
    }

    final OpenedTypeSubstitution substitution =
        new OpenedTypeSubstitution(this, replacements, opener);
    for (Requirement requirement : signature.requirements) {
      final Type first = substitution.substitute(requirement.first);
      final ConstraintLocator locator =
          first instanceof TypeVariable
              ? ((TypeVariable) first).locator
              : null;
      switch (requirement.kind) {
      case CONFORMANCE:
        final NominalDecl decl =
            requireNonNull(requirement.second.nominalDecl());
        if (decl.isProtocol()) {
          if (skipProtocolSelfConstraint
              && requirement.first instanceof GenericParamType
              && ((GenericParamType) requirement.first).isProtocolSelf()) {
            continue;
          }
          addConstraint(ConstraintKind.CONFORMS_TO, first,
              requirement.second, locator);
        } else {
          addConstraint(ConstraintKind.SUBTYPE, first,
              substitution.substitute(requirement.second), locator);
        }
        break;

      case SAME_TYPE:
        addConstraint(ConstraintKind.EQUAL, first,
            substitution.substitute(requirement.second), locator);
        break;

      default:
        throw new AssertionError(requirement.kind);
      }
    }
  }

  /** Replaces the generic parameters, archetypes and dependent member types
   * in a type with type variables, opening any generic function or unbound
   * generic type that it contains. */
  public Type openType(Type type, Map<Type, TypeVariable> replacements,
      @Nullable DependentTypeOpener opener) {
    return new OpenedTypeSubstitution(this, replacements, opener)
        .substitute(type);
  }

  /** Returns the type of an unqualified reference to a declaration. */
  public OpenedReference getTypeOfReference(Decl value,
      boolean isTypeReference, @Nullable DependentTypeOpener opener) {
    return referenceBuilder.getTypeOfReference(value, isTypeReference,
        opener);
  }

  /** Returns the type of a reference to a member of a value or type. */
  public OpenedReference getTypeOfMemberReference(Type baseType, Decl value,
      boolean isTypeReference, boolean isDynamicResult,
      @Nullable DependentTypeOpener opener) {
    return referenceBuilder.getTypeOfMemberReference(baseType, value,
        isTypeReference, isDynamicResult, opener);
  }

  // Overloads

  /** Adds a disjunction that binds {@code boundType} to one of several
   * choices. */
  public boolean addOverloadSet(Type boundType, List<OverloadChoice> choices,
      ConstraintLocator locator) {
    checkArgument(!choices.isEmpty(), "empty overload set");
    final List<Constraint> constraints = new ArrayList<>();
    for (OverloadChoice choice : choices) {
      constraints.add(Constraint.bindOverload(boundType, choice, locator));
    }
    return addConstraint(Constraint.disjunction(constraints, locator));
  }

  /**
   * Binds a type to the type of a reference to an overload choice, and
   * records the choice.
   *
   * @return whether the binding may hold
   */
  public boolean resolveOverload(ConstraintLocator locator, Type boundType,
      OverloadChoice choice) {
    final int failureCount = failures.size();
    final Type refType;
    final Type openedFullType;
    switch (choice.kind) {
    case DECL:
    case DECL_VIA_DYNAMIC:
    case TYPE_DECL:
      final boolean isTypeReference =
          choice.kind == OverloadChoice.Kind.TYPE_DECL;
      final boolean isDynamicResult =
          choice.kind == OverloadChoice.Kind.DECL_VIA_DYNAMIC;
      final Decl decl = choice.decl();
      final OpenedReference reference = choice.baseType == null
          ? getTypeOfReference(decl, isTypeReference, null)
          : getTypeOfMemberReference(choice.baseType, decl, isTypeReference,
              isDynamicResult, null);
      openedFullType = reference.openedFullType;
      if (decl.isOptionalRequirement() && !reference.isSubscript) {
        refType = typeSystem.optionalType(reference.refType.rvalueType());
      } else if (isDynamicResult && !reference.isSubscript) {
        refType =
            typeSystem.implicitlyUnwrappedOptionalType(
                reference.refType.rvalueType());
      } else {
        refType = reference.refType;
      }
      break;

    case BASE_TYPE:
      refType = openedFullType = requireNonNull(choice.baseType);
      break;

    case TUPLE_INDEX:
      final Type baseType = requireNonNull(choice.baseType);
      final Type tuple = getFixedTypeRecursive(baseType, true);
      final Type elementType =
          ((TupleType) tuple)
              .elementType(choice.tupleIndex).rvalueType();
      refType = openedFullType = baseType.isLValue()
          ? typeSystem.lvalueType(elementType)
          : elementType;
      break;

    default:
      throw new AssertionError(choice.kind);
    }

    final ResolvedOverload overload =
        resolvedOverloads.append(boundType, choice, locator, openedFullType,
            refType);
    tracer.onOverload(overload);
    if (failures.size() > failureCount) {
      // A constraint on the base of a member reference failed.
      return false;
    }
    return addConstraint(ConstraintKind.BIND, boundType, refType, locator);
  }

  /** Returns the overloads resolved so far. */
  public ResolvedOverloads getResolvedOverloads() {
    return resolvedOverloads;
  }

  // Solving

  /** Searches for solutions. The state of the system is the same afterwards
   * as before. */
  public SolveResult solve() {
    if (failedBeforeSolving) {
      return new SolveResult(SolveResult.Kind.FAILED, ImmutableList.of(),
          failures, null);
    }
    solving = true;
    try {
      return new Solver(this).solve();
    } finally {
      solving = false;
    }
  }

  /** Creates a solution from the current bindings. */
  Solution finalizeSolution() {
    final Map<TypeVariable, Type> bindings = new LinkedHashMap<>();
    for (TypeVariable typeVariable : typeVariables) {
      final Type type = simplifyType(typeVariable);
      if (!(type instanceof TypeVariable)) {
        bindings.put(typeVariable, type);
      }
    }
    final Map<ConstraintLocator, ResolvedOverload> overloads =
        new LinkedHashMap<>();
    for (ResolvedOverload o = resolvedOverloads.head(); o != null;
         o = o.previous) {
      overloads.putIfAbsent(o.locator, o);
    }
    return new Solution(typeSystem, bindings, overloads, score,
        ImmutableList.copyOf(fixes));
  }

  /** Key by which locators are interned. The anchor is compared by
   * identity. */
  private static class LocatorKey {
    final @Nullable Expr anchor;
    final ImmutableList<PathElement> path;

    LocatorKey(@Nullable Expr anchor, ImmutableList<PathElement> path) {
      this.anchor = anchor;
      this.path = path;
    }

    @Override public int hashCode() {
      return System.identityHashCode(anchor) * 31 + path.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof LocatorKey
          && anchor == ((LocatorKey) o).anchor
          && path.equals(((LocatorKey) o).path);
    }
  }

  /** Type of a reference to a declaration. */
  public static class OpenedReference {
    /** Type of the declaration with its generic parameters replaced, and,
     * for a member, its {@code self} parameter added. */
    public final Type openedFullType;
    /** Type of the reference. */
    public final Type refType;
    final boolean isSubscript;

    OpenedReference(Type openedFullType, Type refType, boolean isSubscript) {
      this.openedFullType = requireNonNull(openedFullType);
      this.refType = requireNonNull(refType);
      this.isSubscript = isSubscript;
    }

    @Override public String toString() {
      return refType + " (" + openedFullType + ")";
    }
  }

  /** Receives events from a constraint system, for debugging. */
  public interface Tracer {
    void onAddConstraint(Constraint constraint);

    void onSimplify(Constraint constraint, SolutionKind kind);

    void onBind(TypeVariable typeVariable, Type type);

    void onMerge(TypeVariable representative, TypeVariable merged);

    void onAttempt(int depth, Constraint constraint);

    void onOverload(ResolvedOverload overload);

    void onFailure(Failure failure);

    void onSolution(Solution solution);
  }
}

// End ConstraintSystem.java
