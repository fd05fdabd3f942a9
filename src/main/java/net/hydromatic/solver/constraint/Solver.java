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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.solver.config.Prop;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.type.NominalType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Depth-first search for the solutions of a constraint system.
 *
 * <p>At each step the solver simplifies the active constraints, then makes a
 * decision: it tries each disjunct of the smallest disjunction, or, if there
 * are no disjunctions, each potential binding of one type variable. Each
 * attempt happens inside a {@link SolverScope}, so the system is restored
 * before the next attempt.
 *
 * <p>The solver keeps only the solutions with the best score found so far,
 * and abandons any branch whose score is already worse.
 */
class Solver {
  private final ConstraintSystem cs;
  private final int stepLimit;
  private final int solutionLimit;
  private final boolean allowFreeTypeVariables;

  private final List<Solution> solutions = new ArrayList<>();
  private @Nullable Score bestScore;
  private int steps;
  private int solutionCount;

  Solver(ConstraintSystem cs) {
    this.cs = requireNonNull(cs);
    this.stepLimit = Prop.SOLVER_STEP_LIMIT.intValue(cs.props);
    this.solutionLimit = Prop.SOLUTION_LIMIT.intValue(cs.props);
    this.allowFreeTypeVariables =
        Prop.ALLOW_FREE_TYPE_VARIABLES.booleanValue(cs.props);
  }

  SolveResult solve() {
    try (SolverScope ignore = new SolverScope(cs)) {
      solveRec();
    } catch (TooComplexException e) {
      return new SolveResult(SolveResult.Kind.TOO_COMPLEX, ImmutableList.of(),
          cs.getFailures(), null);
    }
    switch (solutions.size()) {
    case 0:
      return new SolveResult(SolveResult.Kind.FAILED, ImmutableList.of(),
          cs.getFailures(), null);
    case 1:
      return new SolveResult(SolveResult.Kind.SOLVED, solutions,
          cs.getFailures(), null);
    default:
      return new SolveResult(SolveResult.Kind.AMBIGUOUS, solutions,
          cs.getFailures(), ambiguousLocator());
    }
  }

  private void step() {
    if (++steps > stepLimit) {
      throw new TooComplexException();
    }
  }

  private boolean isWorseThanBest() {
    return bestScore != null && cs.getScore().compareTo(bestScore) > 0;
  }

  private void solveRec() {
    if (!cs.simplify() || isWorseThanBest()) {
      return;
    }
    final Constraint disjunction = selectDisjunction();
    if (disjunction != null) {
      solveDisjunction(disjunction);
    } else if (!solveTypeVariable()) {
      finish();
    }
  }

  /** Returns the inactive disjunction with the fewest disjuncts, or null. */
  private @Nullable Constraint selectDisjunction() {
    Constraint best = null;
    for (Constraint constraint : cs.inactiveConstraints) {
      if (constraint.kind == ConstraintKind.DISJUNCTION
          && (best == null
              || constraint.nested().size() < best.nested().size())) {
        best = constraint;
      }
    }
    return best;
  }

  private void solveDisjunction(Constraint disjunction) {
    final List<Constraint> favored = new ArrayList<>();
    final List<Constraint> others = new ArrayList<>();
    for (Constraint constraint : disjunction.nested()) {
      (constraint.isFavored() ? favored : others).add(constraint);
    }
    final List<Constraint> ordered = new ArrayList<>(favored);
    ordered.addAll(others);
    for (Constraint constraint : ordered) {
      step();
      try (SolverScope ignore = new SolverScope(cs)) {
        cs.tracer.onAttempt(cs.depth, constraint);
        cs.retireConstraint(disjunction);
        if (!favored.isEmpty() && !constraint.isFavored()) {
          cs.increaseScore(Score.Kind.UNFAVORED_CHOICE);
        }
        if (cs.addConstraint(constraint)) {
          solveRec();
        }
      }
    }
  }

  /** Tries each potential binding of the type variable that has the fewest;
   * returns false if no free type variable has any. */
  private boolean solveTypeVariable() {
    TypeVariable best = null;
    List<Type> bestBindings = ImmutableList.of();
    for (TypeVariable typeVariable : cs.getTypeVariables()) {
      if (!cs.isFree(typeVariable)) {
        continue;
      }
      final List<Type> bindings = potentialBindings(typeVariable);
      if (!bindings.isEmpty()
          && (best == null || bindings.size() < bestBindings.size())) {
        best = typeVariable;
        bestBindings = bindings;
      }
    }
    if (best == null) {
      return false;
    }

    final int solutionCountBefore = solutionCount;
    for (Type binding : bestBindings) {
      step();
      try (SolverScope ignore = new SolverScope(cs)) {
        final Constraint constraint =
            Constraint.create(ConstraintKind.BIND, best, binding,
                best.locator);
        cs.tracer.onAttempt(cs.depth, constraint);
        if (cs.addConstraint(constraint)) {
          solveRec();
        }
      }
      if (solutionCount > solutionCountBefore) {
        break;
      }
    }
    return true;
  }

  /**
   * Returns the types that a type variable might be bound to, in the order
   * they should be tried.
   *
   * <p>Candidates come from the constraints on the variable's equivalence
   * class: exact bindings first, then lower and upper bounds, then the
   * default type of a literal, the superclasses of any class that is a lower
   * bound, and last the other types that a literal could have.
   */
  List<Type> potentialBindings(TypeVariable typeVariable) {
    final Set<Type> exact = new LinkedHashSet<>();
    final Set<Type> lower = new LinkedHashSet<>();
    final Set<Type> upper = new LinkedHashSet<>();
    final Set<NominalDecl> literalProtocols = new LinkedHashSet<>();
    for (TypeVariable v : cs.graph.getEquivalenceClass(typeVariable)) {
      if (v.literalProtocol() != null) {
        literalProtocols.add(v.literalProtocol());
      }
    }

    for (Constraint constraint : cs.graph.gatherConstraints(typeVariable)) {
      switch (constraint.kind) {
      case BIND:
      case EQUAL:
      case SUBTYPE:
      case CONVERSION:
      case ARGUMENT_TUPLE_CONVERSION:
        final boolean isFirst = refersTo(constraint.first(), typeVariable);
        final boolean isSecond = refersTo(constraint.second(), typeVariable);
        if (isFirst == isSecond) {
          continue;
        }
        Type other =
            cs.simplifyType(isFirst ? constraint.second() : constraint.first());
        if (other.hasTypeVariable()) {
          continue;
        }
        if (constraint.kind.isEquality()) {
          exact.add(constraint.kind == ConstraintKind.EQUAL
              ? other.rvalueType() : other);
        } else if (isFirst) {
          upper.add(other.rvalueType());
        } else {
          lower.add(other.rvalueType());
        }
        break;

      case CONFORMS_TO:
        if (refersTo(constraint.first(), typeVariable)) {
          final NominalDecl protocol = constraint.second().nominalDecl();
          if (protocol != null
              && cs.context.getDefaultLiteralType(protocol) != null) {
            literalProtocols.add(protocol);
          }
        }
        break;

      default:
        break;
      }
    }

    final Set<Type> bindings = new LinkedHashSet<>(exact);
    if (typeVariable.prefersSubtypeBinding()) {
      bindings.addAll(lower);
      bindings.addAll(upper);
    } else {
      bindings.addAll(upper);
      bindings.addAll(lower);
    }
    for (NominalDecl protocol : literalProtocols) {
      final Type defaultType = cs.context.getDefaultLiteralType(protocol);
      if (defaultType != null) {
        bindings.add(defaultType);
      }
    }
    for (Type type : lower) {
      if (type instanceof NominalType) {
        for (Type s = ((NominalType) type).superclass(cs.typeSystem);
             s != null;
             s = ((NominalType) s).superclass(cs.typeSystem)) {
          bindings.add(s);
        }
      }
    }
    for (NominalDecl protocol : literalProtocols) {
      bindings.addAll(cs.context.getTypesConformingTo(protocol));
    }
    return ImmutableList.copyOf(bindings);
  }

  private boolean refersTo(Type type, TypeVariable typeVariable) {
    final Type t = cs.getFixedTypeRecursive(type, false);
    return t instanceof TypeVariable
        && cs.getRepresentative((TypeVariable) t) == typeVariable;
  }

  /** Called when there are no more decisions to make. Re-checks the
   * remaining constraints and, if they all hold, records a solution. */
  private void finish() {
    if (!cs.inactiveConstraints.isEmpty()) {
      cs.activateInactiveConstraints();
      if (!cs.simplify()) {
        return;
      }
      if (!cs.inactiveConstraints.isEmpty()) {
        if (!allowFreeTypeVariables) {
          return;
        }
        for (Constraint constraint : cs.inactiveConstraints) {
          if (!mentionsFreeTypeVariable(constraint)) {
            return;
          }
        }
      }
    }
    if (!allowFreeTypeVariables) {
      for (TypeVariable typeVariable : cs.getTypeVariables()) {
        if (cs.isFree(typeVariable)) {
          return;
        }
      }
    }
    if (isWorseThanBest()) {
      return;
    }
    recordSolution(cs.finalizeSolution());
  }

  private boolean mentionsFreeTypeVariable(Constraint constraint) {
    for (TypeVariable typeVariable : constraint.typeVariables()) {
      final Type type = cs.getFixedTypeRecursive(typeVariable, false);
      if (type instanceof TypeVariable) {
        return true;
      }
    }
    return false;
  }

  private void recordSolution(Solution solution) {
    cs.tracer.onSolution(solution);
    ++solutionCount;
    final int c = bestScore == null ? -1 : solution.score.compareTo(bestScore);
    if (c < 0) {
      solutions.clear();
      solutions.add(solution);
      bestScore = solution.score;
    } else if (c == 0) {
      for (Solution s : solutions) {
        if (s.isEquivalent(solution)) {
          return;
        }
      }
      solutions.add(solution);
      if (solutions.size() > solutionLimit) {
        throw new TooComplexException();
      }
    }
  }

  /** Returns the locator whose overload choice differs among the most
   * solutions. */
  private @Nullable ConstraintLocator ambiguousLocator() {
    final Map<ConstraintLocator, List<OverloadChoice>> choices =
        new LinkedHashMap<>();
    for (Solution solution : solutions) {
      solution.overloadChoices().forEach((locator, overload) -> {
        final List<OverloadChoice> list =
            choices.computeIfAbsent(locator, k -> new ArrayList<>());
        if (list.stream().noneMatch(c -> c.isSameChoice(overload.choice))) {
          list.add(overload.choice);
        }
      });
    }
    ConstraintLocator best = null;
    int bestCount = 1;
    for (Map.Entry<ConstraintLocator, List<OverloadChoice>> e
        : choices.entrySet()) {
      if (e.getValue().size() > bestCount) {
        best = e.getKey();
        bestCount = e.getValue().size();
      }
    }
    return best;
  }

  /** Thrown when the solver exceeds one of its limits. */
  private static class TooComplexException extends RuntimeException {
    TooComplexException() {
      super("too complex", null, false, false);
    }
  }
}

// End Solver.java
