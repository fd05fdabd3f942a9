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

import static net.hydromatic.solver.Fixture.intLiteral;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.notNullValue;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.config.Prop;
import net.hydromatic.solver.constraint.ConstraintLocator.PathElement;
import net.hydromatic.solver.constraint.ConstraintLocator.PathKind;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import net.hydromatic.solver.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstraintSystem}: type variables, locators, and the
 * simplification of individual constraints. */
public class ConstraintSystemTest {
  final Fixture f = new Fixture();
  final ConstraintSystem cs = new ConstraintSystem(f.module);

  @Test void testCreateTypeVariable() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 =
        cs.createTypeVariable(null,
            TypeVariable.Option.PREFERS_SUBTYPE_BINDING);
    assertThat(v0.id, is(0));
    assertThat(v1.id, is(1));
    assertThat(v0.toString(), is("$T0"));
    assertThat(v0.prefersSubtypeBinding(), is(false));
    assertThat(v1.prefersSubtypeBinding(), is(true));
    assertThat(cs.getTypeVariables(), is(ImmutableList.of(v0, v1)));
    assertThat(cs.getRepresentative(v1), sameInstance(v1));
    assertThat(cs.getFixedType(v1), nullValue());
  }

  /** A type variable may only be used in the system that created it. */
  @Test void testTypeVariableOwnership() {
    final ConstraintSystem cs2 = new ConstraintSystem(f.module);
    final TypeVariable v = cs2.createTypeVariable(null);
    cs.createTypeVariable(null);
    assertThrows(IllegalArgumentException.class,
        () -> cs.getRepresentative(v));
  }

  @Test void testMergeAndBind() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 = cs.createTypeVariable(null);
    final TypeVariable v2 = cs.createTypeVariable(null);
    cs.mergeEquivalenceClasses(v0, v1);
    assertThat(cs.getRepresentative(v1), sameInstance(v0));
    assertThat(cs.graph.getEquivalenceClass(v1),
        is(ImmutableList.of(v0, v1)));

    cs.assignFixedType(v0, f.intType);
    assertThat(cs.getFixedType(v1), sameInstance(f.intType));
    assertThat(cs.simplifyType(f.tuple(v1, v2)),
        sameInstance(f.tuple(f.intType, v2)));
    assertThat(cs.getFixedTypeRecursive(v1, false),
        sameInstance(f.intType));

    // Only a representative may be bound
    assertThrows(IllegalArgumentException.class,
        () -> cs.assignFixedType(v1, f.stringType));
    // A bound variable may not be re-bound to a different type
    assertThrows(IllegalArgumentException.class,
        () -> cs.assignFixedType(v0, f.stringType));
  }

  /** Merging a bound variable into a free one moves the binding to the
   * representative. */
  @Test void testBindThenMerge() {
    final TypeVariable v = cs.createTypeVariable(null);
    final TypeVariable w = cs.createTypeVariable(null);
    final TypeVariable x = cs.createTypeVariable(null);
    cs.assignFixedType(v, f.intType);
    cs.mergeEquivalenceClasses(w, v);
    assertThat(cs.getRepresentative(v), sameInstance(w));
    assertThat(cs.getFixedType(w), sameInstance(f.intType));
    assertThat(cs.getFixedTypeRecursive(w, false), sameInstance(f.intType));
    assertThat(cs.simplifyType(f.fn(f.tuple(v), w)),
        sameInstance(f.fn(f.tuple(f.intType), f.intType)));

    // Two bound classes cannot be merged
    cs.assignFixedType(x, f.stringType);
    assertThrows(IllegalArgumentException.class,
        () -> cs.mergeEquivalenceClasses(w, x));
  }

  /** Adding a constraint that has already been solved does nothing. */
  @Test void testAddSolvedConstraintAgain() {
    final ConstraintSystem cs =
        new ConstraintSystem(f.module,
            ImmutableMap.of(Prop.RECORD_SOLVER_STATE, true),
            Tracers.nullTracer());
    final Constraint equal =
        Constraint.create(ConstraintKind.EQUAL, f.intType, f.intType, null);
    assertThat(cs.addConstraint(equal), is(true));
    assertThat(cs.addConstraint(equal), is(true));
    assertThat(cs.getGeneratedConstraints(), hasSize(1));
    assertThat(cs.getInactiveConstraints(), hasSize(0));

    // A constraint that is solved later, once its variable is bound
    final TypeVariable v0 = cs.createTypeVariable(null);
    final Constraint conversion =
        Constraint.create(ConstraintKind.CONVERSION, v0, f.intType, null);
    assertThat(cs.addConstraint(conversion), is(true));
    assertThat(cs.getInactiveConstraints(), hasSize(1));
    cs.assignFixedType(v0, f.intType);
    assertThat(cs.simplify(), is(true));
    assertThat(cs.getInactiveConstraints(), hasSize(0));
    assertThat(cs.addConstraint(conversion), is(true));
    assertThat(cs.getInactiveConstraints(), hasSize(0));
    assertThat(cs.getGeneratedConstraints(), hasSize(2));
    assertThat(cs.getRetiredConstraints(), hasSize(2));
  }

  /** Leaving a scope undoes everything that happened inside it. */
  @Test void testScopeRestoresState() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    cs.addConstraint(ConstraintKind.CONVERSION, v0, f.optional(f.intType),
        null);
    assertThat(cs.getInactiveConstraints(), hasSize(1));

    try (SolverScope ignore = new SolverScope(cs)) {
      assertThat(cs.depth, is(1));
      final TypeVariable v1 = cs.createTypeVariable(null);
      cs.mergeEquivalenceClasses(v0, v1);
      cs.assignFixedType(v0, f.intType);
      assertThat(cs.simplify(), is(true));
      assertThat(cs.getInactiveConstraints(), hasSize(0));
      assertThat(cs.getScore().get(Score.Kind.VALUE_TO_OPTIONAL), is(1));
      assertThat(cs.getTypeVariables(), hasSize(2));
    }

    assertThat(cs.depth, is(0));
    assertThat(cs.getTypeVariables(), hasSize(1));
    assertThat(cs.getFixedType(v0), nullValue());
    assertThat(cs.graph.getEquivalenceClass(v0), is(ImmutableList.of(v0)));
    assertThat(cs.getInactiveConstraints(), hasSize(1));
    assertThat(cs.getScore().isZero(), is(true));
  }

  @Test void testLocatorsAreInterned() {
    final Expr e1 = intLiteral(1);
    final Expr e2 = intLiteral(1);
    final ConstraintLocator l1 =
        cs.getConstraintLocator(e1, PathElement.of(PathKind.APPLY_FUNCTION));
    final ConstraintLocator l2 =
        cs.extendLocator(cs.getConstraintLocator(e1),
            PathElement.of(PathKind.APPLY_FUNCTION));
    assertThat(l2, sameInstance(l1));

    // Anchors are compared by identity, not by structure
    final ConstraintLocator l3 =
        cs.getConstraintLocator(e2, PathElement.of(PathKind.APPLY_FUNCTION));
    assertThat(l3 == l1, is(false));
    assertThat(l1.toString(), is("locator@INT_LITERAL(1) [apply_function]"));

    final ConstraintLocator l4 =
        cs.extendLocator(l1, PathElement.tupleElement(2));
    assertThat(l4.toString(),
        is("locator@INT_LITERAL(1) [apply_function -> tuple_element #2]"));
  }

  @Test void testLocatorSummaryFlags() {
    final Expr e = intLiteral(1);
    final ConstraintLocator l1 =
        cs.getConstraintLocator(e, PathElement.of(PathKind.APPLY_ARGUMENT),
            PathElement.tupleElement(0));
    assertThat(l1.isForApplyArgument(), is(true));
    assertThat(l1.isFunctionConversion(), is(false));
    final ConstraintLocator l2 =
        cs.getConstraintLocator(e, PathElement.of(PathKind.FUNCTION_RESULT));
    assertThat(l2.isForApplyArgument(), is(false));
    assertThat(l2.isFunctionConversion(), is(true));
    assertThrows(IllegalArgumentException.class,
        () -> PathElement.of(PathKind.TUPLE_ELEMENT));
  }

  @Test void testEqualIgnoresLValue() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.EQUAL, v0, f.lvalue(f.intType), null),
        is(true));
    assertThat(cs.getFixedType(v0), sameInstance(f.intType));
  }

  @Test void testBindPreservesLValue() {
    final TypeVariable v0 =
        cs.createTypeVariable(null, TypeVariable.Option.CAN_BIND_TO_LVALUE);
    assertThat(
        cs.addConstraint(ConstraintKind.BIND, v0, f.lvalue(f.intType), null),
        is(true));
    assertThat(cs.getFixedType(v0), sameInstance(f.lvalue(f.intType)));

    // A variable that cannot hold an l-value cannot be bound to one
    final TypeVariable v1 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.BIND, v1, f.lvalue(f.intType), null),
        is(false));
    assertThat(cs.getFailures().get(0).kind,
        is(Failure.Kind.TYPES_NOT_EQUAL));
  }

  @Test void testOccursCheck() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.BIND, v0,
            f.fn(f.tuple(v0), f.intType), null),
        is(false));
    assertThat(cs.getFixedType(v0), nullValue());
    assertThat(cs.hasFailedBeforeSolving(), is(true));
    assertThat(cs.solve().kind, is(SolveResult.Kind.FAILED));
  }

  /** Each kind of implicit conversion makes the score worse. */
  @Test void testConversionScores() {
    assertThat(scoreOf(f.intType, f.optional(f.intType)),
        is(Score.ZERO.plus(Score.Kind.VALUE_TO_OPTIONAL)));
    assertThat(scoreOf(f.derivedType, f.baseType),
        is(Score.ZERO.plus(Score.Kind.UPCAST)));
    assertThat(scoreOf(f.intType, f.equatableType),
        is(Score.ZERO.plus(Score.Kind.EXISTENTIAL_CONVERSION)));
    assertThat(scoreOf(f.intType, f.intType), is(Score.ZERO));
    assertThat(scoreOf(f.optional(f.derivedType), f.optional(f.baseType)),
        is(Score.ZERO.plus(Score.Kind.UPCAST)));
  }

  private Score scoreOf(Type from, Type to) {
    final ConstraintSystem cs = new ConstraintSystem(f.module);
    assertThat(cs.addConstraint(ConstraintKind.CONVERSION, from, to, null),
        is(true));
    return cs.getScore();
  }

  @Test void testConversionFailures() {
    assertThat(failureOf(ConstraintKind.CONVERSION, f.baseType,
            f.derivedType),
        is("'Base' is not convertible to 'Derived'"));
    assertThat(failureOf(ConstraintKind.SUBTYPE, f.intType,
            f.optional(f.intType)),
        is("'Int' is not a subtype of 'Optional<Int>'"));
    assertThat(failureOf(ConstraintKind.EQUAL, f.intType, f.stringType),
        is("'Int' is not identical to 'String'"));
    assertThat(failureOf(ConstraintKind.CONVERSION,
            f.optional(f.intType), f.intType),
        is("'Optional<Int>' is not convertible to 'Int'"));
    assertThat(failureOf(ConstraintKind.CONVERSION,
            f.fn(f.tuple(), f.intType), f.intType),
        is("function types '() -> Int' and 'Int' do not match"));
  }

  @Test void testTupleConversions() {
    assertThat(failureOf(ConstraintKind.CONVERSION,
            f.labeled("x", f.intType), f.labeled("y", f.intType)),
        is("tuple types '(x: Int)' and '(y: Int)' have different element "
            + "names"));
    assertThat(failureOf(ConstraintKind.CONVERSION,
            f.tuple(f.intType, f.intType), f.tuple(f.intType)),
        is("tuple types '(Int, Int)' and '(Int)' have a different number "
            + "of elements"));

    // A label may be added or dropped by a conversion, but not by equality
    assertThat(scoreOf(f.labeled("x", f.intType), f.tuple(f.intType)),
        is(Score.ZERO));
    assertThat(scoreOf(f.tuple(f.intType), f.labeled("x", f.intType)),
        is(Score.ZERO));
    assertThat(failureOf(ConstraintKind.EQUAL,
            f.labeled("x", f.intType), f.tuple(f.intType)),
        is("tuple types '(x: Int)' and '(Int)' have different element "
            + "names"));

    // Elements convert individually
    assertThat(scoreOf(f.tuple(f.derivedType, f.intType),
            f.tuple(f.baseType, f.optional(f.intType))),
        is(Score.ZERO.plus(Score.Kind.UPCAST)
            .plus(Score.Kind.VALUE_TO_OPTIONAL)));
  }

  /** Function types are contravariant in their input and covariant in their
   * result. */
  @Test void testFunctionVariance() {
    final Type baseToDerived =
        f.fn(f.tuple(f.baseType), f.derivedType);
    final Type derivedToBase =
        f.fn(f.tuple(f.derivedType), f.baseType);
    assertThat(
        new ConstraintSystem(f.module)
            .addConstraint(ConstraintKind.SUBTYPE, baseToDerived,
                derivedToBase, null),
        is(true));
    assertThat(
        failureOf(ConstraintKind.SUBTYPE, derivedToBase, baseToDerived),
        is("'Base' is not a subtype of 'Derived'"));
  }

  private String failureOf(ConstraintKind kind, Type first, Type second) {
    final ConstraintSystem cs = new ConstraintSystem(f.module);
    assertThat(cs.addConstraint(kind, first, second, null), is(false));
    assertThat(cs.getFailures(), hasSize(1));
    return cs.getFailures().get(0).describe();
  }

  /** A constraint that mentions a free type variable waits until the
   * variable is bound. */
  @Test void testDeferredConstraint() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.CONVERSION, v0, f.intType, null),
        is(true));
    final List<Constraint> inactive = cs.getInactiveConstraints();
    assertThat(inactive, hasSize(1));
    assertThat(inactive.get(0).toString(), is("$T0 <c Int"));
    assertThat(cs.graph.getConstraints(v0), is(inactive));

    cs.assignFixedType(v0, f.stringType);
    assertThat(cs.getInactiveConstraints(), hasSize(0));
    assertThat(cs.getActiveConstraints(), is(inactive));
    assertThat(cs.simplify(), is(false));
    assertThat(cs.getFailedConstraint(), sameInstance(inactive.get(0)));
    assertThat(cs.getFailures().get(0).describe(),
        is("'String' is not convertible to 'Int'"));
  }

  @Test void testConformsTo() {
    assertThat(
        cs.addConstraint(ConstraintKind.CONFORMS_TO, f.intType,
            f.equatableType, null),
        is(true));
    // A subclass inherits its superclass's conformances
    assertThat(
        cs.addConstraint(ConstraintKind.CONFORMS_TO, f.derivedType,
            f.anyObjectType, null),
        is(true));
    assertThat(
        cs.addConstraint(ConstraintKind.CONFORMS_TO, f.stringType,
            f.integerLiteral.declaredInterfaceType(), null),
        is(false));
    assertThat(cs.getFailures().get(0).describe(),
        is("type 'String' does not conform to protocol "
            + "'IntegerLiteralConvertible'"));
  }

  @Test void testOptionalObject() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.OPTIONAL_OBJECT,
            f.optional(f.intType), v0, null),
        is(true));
    assertThat(cs.getFixedType(v0), sameInstance(f.intType));

    final TypeVariable v1 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.OPTIONAL_OBJECT, f.intType, v1,
            null),
        is(false));
  }

  @Test void testApplicableFunction() {
    final TypeVariable result = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.APPLICABLE_FUNCTION,
            f.fn(f.tuple(f.intType), result),
            f.fn(f.tuple(f.intType), f.stringType), null),
        is(true));
    assertThat(cs.getFixedType(result), sameInstance(f.stringType));

    // A single argument matches a parameter list of one element
    final TypeVariable result2 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.APPLICABLE_FUNCTION,
            f.fn(f.intType, result2),
            f.fn(f.tuple(f.optional(f.intType)), f.boolType), null),
        is(true));
    assertThat(cs.getFixedType(result2), sameInstance(f.boolType));
    assertThat(cs.getScore().get(Score.Kind.VALUE_TO_OPTIONAL), is(1));

    final TypeVariable result3 = cs.createTypeVariable(null);
    assertThat(
        cs.addConstraint(ConstraintKind.APPLICABLE_FUNCTION,
            f.fn(f.tuple(), result3), f.intType, null),
        is(false));
    assertThat(cs.getFailures().get(0).describe(),
        is("cannot call value of non-function type 'Int'"));
  }

  @Test void testBridgedToObjectiveC() {
    f.module.bridge(f.stringDecl);
    assertThat(
        cs.addConstraint(
            Constraint.create(ConstraintKind.BRIDGED_TO_OBJECTIVE_C,
                f.stringType, null)),
        is(true));
    assertThat(
        cs.addConstraint(
            Constraint.create(ConstraintKind.BRIDGED_TO_OBJECTIVE_C,
                f.baseType, null)),
        is(true));
    assertThat(
        cs.addConstraint(
            Constraint.create(ConstraintKind.BRIDGED_TO_OBJECTIVE_C,
                f.intType, null)),
        is(false));
    assertThat(cs.getFailures().get(0).describe(),
        is("'Int' is not bridged to Objective-C"));
  }

  @Test void testConjunction() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 = cs.createTypeVariable(null);
    final Constraint c =
        Constraint.conjunction(
            ImmutableList.of(
                Constraint.create(ConstraintKind.BIND, v0, f.intType, null),
                Constraint.create(ConstraintKind.BIND, v1, v0, null)),
            null);
    assertThat(c.toString(), is("and {$T0 bind Int; $T1 bind $T0}"));
    assertThat(cs.addConstraint(c), is(true));
    assertThat(cs.getFixedType(v1), sameInstance(f.intType));
  }

  /** With {@link Prop#RECORD_SOLVER_STATE},
   * the system keeps every constraint that it generates. */
  @Test void testRecordSolverState() {
    final ConstraintSystem cs =
        new ConstraintSystem(f.module,
            ImmutableMap.of(Prop.RECORD_SOLVER_STATE, true),
            Tracers.nullTracer());
    final TypeVariable v0 = cs.createTypeVariable(null);
    cs.addConstraint(ConstraintKind.CONVERSION, v0, f.intType, null);
    cs.addConstraint(ConstraintKind.EQUAL, f.intType, f.intType, null);
    cs.addConstraint(ConstraintKind.EQUAL, f.intType, f.stringType, null);
    assertThat(cs.getGeneratedConstraints(), hasSize(3));
    assertThat(cs.getRetiredConstraints(), hasSize(2));
    assertThat(cs.getFailedConstraint(), notNullValue());
  }
}

// End ConstraintSystemTest.java
