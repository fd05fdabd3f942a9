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

import static net.hydromatic.solver.Fixture.apply;
import static net.hydromatic.solver.Fixture.intLiteral;
import static net.hydromatic.solver.Fixture.name;
import static net.hydromatic.solver.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsNull.notNullValue;
import static org.hamcrest.core.IsNull.nullValue;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.ast.Pos;
import net.hydromatic.solver.compile.ConstraintGenerator;
import net.hydromatic.solver.compile.Environments;
import net.hydromatic.solver.config.Prop;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.GenericSignature;
import net.hydromatic.solver.decl.VarDecl;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import net.hydromatic.solver.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for the search that {@link ConstraintSystem#solve()} performs. */
public class SolverTest {
  final Fixture f = new Fixture();
  final Map<Prop, Object> props = new HashMap<>();
  ConstraintSystem.Tracer tracer = Tracers.nullTracer();

  /** Most recent system created by {@link #solve}. */
  ConstraintSystem cs;

  /** Generates constraints for an expression, converts it to a contextual
   * type if one is given, and solves. */
  private SolveResult solve(Expr e, @Nullable Type contextualType) {
    cs = new ConstraintSystem(f.module, props, tracer);
    final Type type =
        new ConstraintGenerator(cs, Environments.of(f.module)).generate(e);
    if (contextualType != null) {
      cs.addConstraint(ConstraintKind.CONVERSION, type, contextualType,
          cs.getConstraintLocator(e));
    }
    return cs.solve();
  }

  private Type typeOf(SolveResult result, Expr e) {
    return result.solution().simplifyType(requireType(e));
  }

  private static Type requireType(Expr e) {
    final Type type = e.getType();
    assertThat(type, notNullValue());
    return type;
  }

  /** The contextual type picks one of two overloads that differ only in
   * their result. */
  @Test void testOverloadChosenByContext() {
    final FuncDecl f1 =
        f.module.func(null, "f", f.fn(f.tuple(), f.intType));
    f.module.func(null, "f", f.fn(f.tuple(), f.stringType));
    final Expr.Apply e = apply(name("f"));
    final SolveResult result = solve(e, f.intType);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    assertThat(typeOf(result, e), sameInstance(f.intType));

    final ResolvedOverload overload =
        result.solution().getOverloadChoice(cs.getConstraintLocator(e.fn));
    assertThat(overload, notNullValue());
    assertThat(overload.choice.decl(), sameInstance(f1));
    assertThat(result.solution().overloadChoices().size(), is(1));
    assertThat(result.solution().score, is(Score.ZERO));

    // The branch that tried the other overload failed
    assertThat(result.failures.isEmpty(), is(false));
    assertThat(result.firstFailure().describe(),
        is("'String' is not convertible to 'Int'"));
  }

  /** Two overloads that accept the same argument, with no context to choose
   * between them, are ambiguous. */
  @Test void testAmbiguous() {
    declareAmbiguousOverloads();
    final Expr.Apply e = apply(name("g"), intLiteral(1));
    final SolveResult result = solve(e, null);
    assertThat(result.kind, is(SolveResult.Kind.AMBIGUOUS));
    assertThat(result.solutions, hasSize(2));
    assertThat(result.ambiguousLocator,
        sameInstance(cs.getConstraintLocator(e.fn)));
  }

  private void declareAmbiguousOverloads() {
    f.module.func(null, "g", f.fn(f.tuple(f.intType), f.intType));
    f.module.func(null, "g", f.fn(f.tuple(f.intType), f.stringType));
  }

  /** Calling a generic function binds its parameter to the argument's
   * type. */
  @Test void testGenericFunction() {
    declareIdentity();
    final List<String> attempts = new ArrayList<>();
    tracer =
        Tracers.nullTracer()
            .withAttemptHandler((depth, c) -> attempts.add(c.toString()));
    final Expr.Apply e = apply(name("id"), intLiteral(5));
    final SolveResult result = solve(e, null);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    assertThat(typeOf(result, e), sameInstance(f.intType));
    assertThat(typeOf(result, e.fn),
        sameInstance(f.fn(f.tuple(f.intType), f.intType)));

    // The generic parameter T was opened as $T1. The solver bound the
    // literal first, because it had candidate types, then T.
    assertThat(attempts,
        is(ImmutableList.of("$T2 bind Int", "$T1 bind Int")));
    final TypeVariable t = cs.getTypeVariables().get(1);
    assertThat(t.archetype(), notNullValue());
    assertThat(t.archetype().name, is("T"));
    assertThat(result.solution().getFixedType(t), sameInstance(f.intType));
  }

  private FuncDecl declareIdentity() {
    final GenericParamType t = f.module.genericParams("T").get(0);
    return f.module.func(null, "id",
        f.typeSystem.genericFnType(GenericSignature.of(t), f.tuple(t), t));
  }

  /** Solving leaves the system as it found it. */
  @Test void testSolveRestoresState() {
    declareIdentity();
    final Expr.Apply e = apply(name("id"), intLiteral(5));
    cs = new ConstraintSystem(f.module);
    new ConstraintGenerator(cs, Environments.of(f.module)).generate(e);
    final List<@Nullable Type> before = fixedTypes();
    final int activeCount = cs.getActiveConstraints().size();
    final int inactiveCount = cs.getInactiveConstraints().size();

    final SolveResult result = cs.solve();
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    assertThat(fixedTypes(), is(before));
    assertThat(cs.getScore(), is(Score.ZERO));
    assertThat(cs.getActiveConstraints().size(), is(activeCount));
    assertThat(cs.getInactiveConstraints().size(), is(inactiveCount));

    // Solving a second time gives the same answer
    final SolveResult result2 = cs.solve();
    assertThat(result2.kind, is(SolveResult.Kind.SOLVED));
    assertThat(result2.solution().simplifyType(requireType(e)),
        sameInstance(f.intType));
  }

  private List<@Nullable Type> fixedTypes() {
    final List<@Nullable Type> list = new ArrayList<>();
    for (TypeVariable typeVariable : cs.getTypeVariables()) {
      list.add(cs.getFixedType(typeVariable));
    }
    return list;
  }

  @Test void testLiteralDefault() {
    final Expr e = intLiteral(5);
    final SolveResult result = solve(e, null);
    assertThat(typeOf(result, e), sameInstance(f.intType));
    assertThat(result.solution().score, is(Score.ZERO));
  }

  /** A literal may have a type other than its default, at a cost. */
  @Test void testNonDefaultLiteral() {
    final Expr e = intLiteral(5);
    final SolveResult result = solve(e, f.doubleType);
    assertThat(typeOf(result, e), sameInstance(f.doubleType));
    assertThat(result.solution().score,
        is(Score.ZERO.plus(Score.Kind.NON_DEFAULT_LITERAL)));

    assertThat(solve(intLiteral(5), f.stringType).kind,
        is(SolveResult.Kind.FAILED));
  }

  @Test void testLiteralToOptional() {
    final Expr e = intLiteral(5);
    final SolveResult result = solve(e, f.optional(f.intType));
    assertThat(typeOf(result, e), sameInstance(f.intType));
    assertThat(result.solution().score,
        is(Score.ZERO.plus(Score.Kind.VALUE_TO_OPTIONAL)));
  }

  /** An overload whose parameter type is the default type of the literal
   * argument is favored; the other overload has a worse score, so it is
   * not a competing solution. */
  @Test void testFavoredOverload() {
    final FuncDecl hInt =
        f.module.func(null, "h", f.fn(f.tuple(f.intType), f.intType));
    f.module.func(null, "h", f.fn(f.tuple(f.doubleType), f.intType));
    final List<String> attempts = new ArrayList<>();
    tracer =
        Tracers.nullTracer()
            .withAttemptHandler((depth, c) -> attempts.add(c.toString()));
    final Expr.Apply e = apply(name("h"), intLiteral(1));
    final SolveResult result = solve(e, null);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    final ResolvedOverload overload =
        result.solution().getOverloadChoice(cs.getConstraintLocator(e.fn));
    assertThat(overload, notNullValue());
    assertThat(overload.choice.decl(), sameInstance(hInt));
    assertThat(attempts.get(0),
        is("$T0 bound to h: (Int) -> Int [favored]"));
  }

  /** Of two viable overloads, the one that needs no conversion wins. */
  @Test void testBetterScoreWins() {
    f.module.func(null, "k",
        f.fn(f.tuple(f.optional(f.baseType)), f.intType));
    final FuncDecl kBase =
        f.module.func(null, "k", f.fn(f.tuple(f.baseType), f.intType));
    final VarDecl d = f.var("d", f.derivedType);
    final Expr.Apply e =
        apply(name("k"), expr.declRef(Pos.ZERO, d));
    final SolveResult result = solve(e, null);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    final ResolvedOverload overload =
        result.solution().getOverloadChoice(cs.getConstraintLocator(e.fn));
    assertThat(overload, notNullValue());
    assertThat(overload.choice.decl(), sameInstance(kBase));
    assertThat(result.solution().score,
        is(Score.ZERO.plus(Score.Kind.UPCAST)));
  }

  /** An operator declared in a protocol is opened with a fresh
   * {@code Self}, which the operands determine. */
  @Test void testProtocolOperator() {
    final Type self = f.equatable.selfType();
    final FuncDecl eq =
        f.module.func(f.equatable, "==",
            f.fn(f.tuple(self, self), f.boolType));
    final Expr.Apply e =
        expr.apply(Pos.ZERO, expr.declRef(Pos.ZERO, eq), intLiteral(1),
            intLiteral(2));
    final SolveResult result = solve(e, null);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    assertThat(typeOf(result, e), sameInstance(f.boolType));
    assertThat(typeOf(result, e.fn),
        sameInstance(f.fn(f.tuple(f.intType, f.intType), f.boolType)));

    // Bool is not Equatable
    final Expr.Apply e2 =
        expr.apply(Pos.ZERO, expr.declRef(Pos.ZERO, eq),
            expr.boolLiteral(Pos.ZERO, true),
            expr.boolLiteral(Pos.ZERO, false));
    assertThat(solve(e2, null).kind, is(SolveResult.Kind.FAILED));
  }

  @Test void testStepLimit() {
    declareAmbiguousOverloads();
    Prop.SOLVER_STEP_LIMIT.set(props, 1);
    final SolveResult result =
        solve(apply(name("g"), intLiteral(1)), null);
    assertThat(result.kind, is(SolveResult.Kind.TOO_COMPLEX));
    assertThat(result.solutions, hasSize(0));
  }

  @Test void testSolutionLimit() {
    declareAmbiguousOverloads();
    Prop.SOLUTION_LIMIT.set(props, 1);
    final SolveResult result =
        solve(apply(name("g"), intLiteral(1)), null);
    assertThat(result.kind, is(SolveResult.Kind.TOO_COMPLEX));
  }

  @Test void testFreeTypeVariables() {
    final ConstraintSystem cs = new ConstraintSystem(f.module);
    final TypeVariable v = cs.createTypeVariable(null);
    assertThat(cs.solve().kind, is(SolveResult.Kind.FAILED));

    final ConstraintSystem cs2 =
        new ConstraintSystem(f.module,
            ImmutableMap.of(Prop.ALLOW_FREE_TYPE_VARIABLES, true),
            Tracers.nullTracer());
    final TypeVariable v2 = cs2.createTypeVariable(null);
    final TypeVariable v3 = cs2.createTypeVariable(null);
    cs2.addConstraint(ConstraintKind.CONVERSION, v2, v3, null);
    final SolveResult result = cs2.solve();
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    assertThat(result.solution().getFixedType(v2), nullValue());
    assertThat(v.id, is(0));
  }

  /** With fixes enabled, an optional value converts to its payload, and a
   * class converts to its subclass, but each at a cost. */
  @Test void testFixes() {
    Prop.ATTEMPT_FIXES.set(props, true);
    final VarDecl o = f.var("o", f.optional(f.intType));
    final SolveResult result =
        solve(expr.declRef(Pos.ZERO, o), f.intType);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    final Solution solution = result.solution();
    assertThat(solution.isRecovered(), is(true));
    assertThat(solution.fixes, hasSize(1));
    assertThat(solution.fixes.get(0).kind, is(Fix.Kind.FORCE_UNWRAP));
    assertThat(solution.fixes.get(0).describe(),
        is("value of optional type 'Optional<Int>' not unwrapped; "
            + "did you mean to use '!'?"));
    assertThat(solution.score.get(Score.Kind.FIX), is(1));

    final VarDecl b = f.var("b", f.baseType);
    final SolveResult result2 =
        solve(expr.declRef(Pos.ZERO, b), f.derivedType);
    assertThat(result2.kind, is(SolveResult.Kind.SOLVED));
    assertThat(result2.solution().fixes.get(0).describe(),
        is("'Base' is not convertible to 'Derived'; "
            + "did you mean to use 'as!' to force downcast?"));

    // Without fixes, both fail
    props.clear();
    assertThat(solve(expr.declRef(Pos.ZERO, o), f.intType).kind,
        is(SolveResult.Kind.FAILED));
    assertThat(solve(expr.declRef(Pos.ZERO, b), f.derivedType).kind,
        is(SolveResult.Kind.FAILED));
  }

  /** The print tracer writes each step of the solver. */
  @Test void testPrintTracer() {
    declareIdentity();
    final StringWriter sw = new StringWriter();
    tracer = Tracers.printTracer(new PrintWriter(sw));
    final SolveResult result =
        solve(apply(name("id"), intLiteral(5)), null);
    assertThat(result.kind, is(SolveResult.Kind.SOLVED));
    final String s = sw.toString();
    assertThat(s.contains("attempt $T2 bind Int"), is(true));
    assertThat(s.contains("bind $T1 := Int"), is(true));
    assertThat(s.contains("solution Solution{score=()"), is(true));
  }
}

// End SolverTest.java
