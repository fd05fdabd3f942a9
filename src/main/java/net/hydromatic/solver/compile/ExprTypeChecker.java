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
package net.hydromatic.solver.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.ast.Pos;
import net.hydromatic.solver.config.Prop;
import net.hydromatic.solver.constraint.ConstraintKind;
import net.hydromatic.solver.constraint.ConstraintLocator;
import net.hydromatic.solver.constraint.ConstraintSystem;
import net.hydromatic.solver.constraint.Failure;
import net.hydromatic.solver.constraint.Fix;
import net.hydromatic.solver.constraint.ResolvedOverload;
import net.hydromatic.solver.constraint.Solution;
import net.hydromatic.solver.constraint.SolveResult;
import net.hydromatic.solver.decl.SemanticContext;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.util.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type-checks expressions.
 *
 * <p>For each expression, creates a {@link ConstraintSystem}, generates
 * constraints, solves them, and writes the resolved type of each
 * sub-expression into the expression. If the expression has no unique
 * solution, throws {@link TypeException}.
 */
public class ExprTypeChecker {
  private final SemanticContext context;
  private final Environment env;
  private final ImmutableMap<Prop, Object> props;
  private final ConstraintSystem.Tracer tracer;

  /** Creates an ExprTypeChecker. */
  public ExprTypeChecker(SemanticContext context, Environment env,
      Map<Prop, Object> props, ConstraintSystem.Tracer tracer) {
    this.context = requireNonNull(context);
    this.env = requireNonNull(env);
    this.props = ImmutableMap.copyOf(props);
    this.tracer = Prop.DEBUG_CONSTRAINT_SOLVER.booleanValue(props)
        ? Tracers.printTracer(System.out)
        : requireNonNull(tracer);
  }

  /** Creates an ExprTypeChecker that resolves names in the top level of
   * the context, with default properties. */
  public ExprTypeChecker(SemanticContext context) {
    this(context, Environments.of(context), ImmutableMap.of(),
        Tracers.nullTracer());
  }

  /** Returns a copy of this checker with a different environment. */
  public ExprTypeChecker withEnvironment(Environment env) {
    return new ExprTypeChecker(context, env, props, tracer);
  }

  /**
   * Type-checks an expression.
   *
   * @param expr Expression
   * @param contextualType Type that the expression must be convertible to,
   *   or null
   * @return The solution, whose types have been written into the
   *   expression
   * @throws TypeException if the expression is ill-typed, ambiguous, or too
   *   complex
   */
  public Solution typeCheck(Expr expr, @Nullable Type contextualType) {
    final SolveResult result = solve(expr, contextualType, props);
    switch (result.kind) {
    case SOLVED:
      final Solution solution = result.solution();
      applySolution(expr, solution);
      return solution;

    case AMBIGUOUS:
      final ConstraintLocator locator = result.ambiguousLocator;
      if (locator == null) {
        throw new TypeException("type of expression is ambiguous", expr.pos);
      }
      final ResolvedOverload overload =
          requireNonNull(result.solutions.get(0).getOverloadChoice(locator));
      throw new TypeException("ambiguous use of '"
          + (overload.choice.isDecl() ? overload.choice.decl().name
              : String.valueOf(locator.anchor))
          + "'", pos(locator, expr));

    case TOO_COMPLEX:
      throw new TypeException("expression was too complex to be solved in "
          + "reasonable time", expr.pos);

    case FAILED:
    default:
      throw diagnoseFailure(expr, contextualType, result);
    }
  }

  /** Creates an exception that explains why an expression has no solution.
   * Solves again, allowing fixes; a fix is the most precise explanation. */
  private TypeException diagnoseFailure(Expr expr,
      @Nullable Type contextualType, SolveResult result) {
    if (!Prop.ATTEMPT_FIXES.booleanValue(props)) {
      final Map<Prop, Object> props2 = new HashMap<>(props);
      Prop.ATTEMPT_FIXES.set(props2, true);
      final SolveResult result2 = solve(expr, contextualType, props2);
      if (result2.kind == SolveResult.Kind.SOLVED
          && result2.solution().isRecovered()) {
        final Fix fix = result2.solution().fixes.get(0);
        return new TypeException(fix.describe(), pos(fix.locator, expr));
      }
    }
    final Failure failure = result.firstFailure();
    if (failure == null) {
      return new TypeException(
          "type of expression is ambiguous without more context", expr.pos);
    }
    return new TypeException(failure.describe(), pos(failure.locator, expr));
  }

  private SolveResult solve(Expr expr, @Nullable Type contextualType,
      Map<Prop, Object> props) {
    final ConstraintSystem cs = new ConstraintSystem(context, props, tracer);
    final Type type = new ConstraintGenerator(cs, env).generate(expr);
    if (contextualType != null) {
      cs.addConstraint(ConstraintKind.CONVERSION, type, contextualType,
          cs.getConstraintLocator(expr));
    }
    return cs.solve();
  }

  private static Pos pos(@Nullable ConstraintLocator locator, Expr expr) {
    return locator != null && locator.anchor != null
        ? locator.anchor.pos
        : expr.pos;
  }

  /** Replaces the type of each sub-expression by its type in a
   * solution. */
  private static void applySolution(Expr expr, Solution solution) {
    final Type type = expr.getType();
    if (type != null) {
      expr.setType(solution.simplifyType(type));
    }
    for (Expr child : expr.children()) {
      applySolution(child, solution);
    }
  }
}

// End ExprTypeChecker.java
