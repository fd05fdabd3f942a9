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
package net.hydromatic.solver.util;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.solver.util.Static.str;

import java.io.OutputStream;
import java.io.PrintWriter;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.solver.constraint.Constraint;
import net.hydromatic.solver.constraint.ConstraintSystem;
import net.hydromatic.solver.constraint.Failure;
import net.hydromatic.solver.constraint.ResolvedOverload;
import net.hydromatic.solver.constraint.Solution;
import net.hydromatic.solver.constraint.SolutionKind;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;

/** Implementations of {@link ConstraintSystem.Tracer}. */
public class Tracers {

  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static ConfigurableTracer nullTracer() {
    return ConfigurableTracerImpl.INITIAL;
  }

  /** Returns a tracer that writes debugging messages to a writer. */
  public static ConfigurableTracer printTracer(PrintWriter w) {
    final PrintTracer p = new PrintTracer(w);
    return ConfigurableTracerImpl.INITIAL
        .withAddConstraintHandler(p::onAddConstraint)
        .withSimplifyHandler(p::onSimplify)
        .withBindHandler(p::onBind)
        .withMergeHandler(p::onMerge)
        .withAttemptHandler(p::onAttempt)
        .withOverloadHandler(p::onOverload)
        .withFailureHandler(p::onFailure)
        .withSolutionHandler(p::onSolution);
  }

  /** Returns a tracer that writes debugging messages to a stream. */
  public static ConfigurableTracer printTracer(OutputStream stream) {
    return printTracer(new PrintWriter(stream));
  }

  /**
   * Implementation of {@link ConstraintSystem.Tracer} that writes to a given
   * {@link PrintWriter}.
   */
  private static class PrintTracer {
    private final StringBuilder b = new StringBuilder();
    private final PrintWriter w;

    PrintTracer(PrintWriter w) {
      this.w = requireNonNull(w);
    }

    private void flush() {
      w.println(str(b));
      w.flush();
    }

    void onAddConstraint(Constraint constraint) {
      b.append("add ");
      constraint.describeTo(b);
      flush();
    }

    void onSimplify(Constraint constraint, SolutionKind kind) {
      b.append("simplify ");
      constraint.describeTo(b).append(": ").append(kind);
      flush();
    }

    void onBind(TypeVariable typeVariable, Type type) {
      b.append("bind ").append(typeVariable).append(" := ").append(type);
      flush();
    }

    void onMerge(TypeVariable representative, TypeVariable merged) {
      b.append("merge ").append(merged).append(" into ")
          .append(representative);
      flush();
    }

    void onAttempt(int depth, Constraint constraint) {
      for (int i = 0; i < depth; i++) {
        b.append("  ");
      }
      b.append("attempt ");
      constraint.describeTo(b);
      flush();
    }

    void onOverload(ResolvedOverload overload) {
      b.append("overload ").append(overload);
      flush();
    }

    void onFailure(Failure failure) {
      b.append("failure ").append(failure.describe());
      if (failure.locator != null) {
        b.append(" at ").append(failure.locator);
      }
      flush();
    }

    void onSolution(Solution solution) {
      b.append("solution ").append(solution);
      flush();
    }
  }

  /** Consumer of an int and an object. */
  @FunctionalInterface
  public interface DepthConsumer<T> {
    void accept(int depth, T t);
  }

  /** Tracer that allows each of its methods to be modified using a handler. */
  public interface ConfigurableTracer extends ConstraintSystem.Tracer {
    /** Sets handler for {@link #onAddConstraint(Constraint)}. */
    ConfigurableTracer withAddConstraintHandler(Consumer<Constraint> handler);
    /** Sets handler for {@link #onSimplify(Constraint, SolutionKind)}. */
    ConfigurableTracer withSimplifyHandler(
        BiConsumer<Constraint, SolutionKind> handler);
    /** Sets handler for {@link #onBind(TypeVariable, Type)}. */
    ConfigurableTracer withBindHandler(BiConsumer<TypeVariable, Type> handler);
    /** Sets handler for {@link #onMerge(TypeVariable, TypeVariable)}. */
    ConfigurableTracer withMergeHandler(
        BiConsumer<TypeVariable, TypeVariable> handler);
    /** Sets handler for {@link #onAttempt(int, Constraint)}. */
    ConfigurableTracer withAttemptHandler(DepthConsumer<Constraint> handler);
    /** Sets handler for {@link #onOverload(ResolvedOverload)}. */
    ConfigurableTracer withOverloadHandler(Consumer<ResolvedOverload> handler);
    /** Sets handler for {@link #onFailure(Failure)}. */
    ConfigurableTracer withFailureHandler(Consumer<Failure> handler);
    /** Sets handler for {@link #onSolution(Solution)}. */
    ConfigurableTracer withSolutionHandler(Consumer<Solution> handler);
  }

  /**
   * Implementation of {@link ConfigurableTracer} that has a field for each
   * handler.
   */
  private static class ConfigurableTracerImpl implements ConfigurableTracer {
    static final ConfigurableTracerImpl INITIAL =
        new ConfigurableTracerImpl(
            constraint -> {},
            (constraint, kind) -> {},
            (typeVariable, type) -> {},
            (representative, merged) -> {},
            (depth, constraint) -> {},
            overload -> {},
            failure -> {},
            solution -> {});

    private final Consumer<Constraint> addConstraintHandler;
    private final BiConsumer<Constraint, SolutionKind> simplifyHandler;
    private final BiConsumer<TypeVariable, Type> bindHandler;
    private final BiConsumer<TypeVariable, TypeVariable> mergeHandler;
    private final DepthConsumer<Constraint> attemptHandler;
    private final Consumer<ResolvedOverload> overloadHandler;
    private final Consumer<Failure> failureHandler;
    private final Consumer<Solution> solutionHandler;

    private ConfigurableTracerImpl(
        Consumer<Constraint> addConstraintHandler,
        BiConsumer<Constraint, SolutionKind> simplifyHandler,
        BiConsumer<TypeVariable, Type> bindHandler,
        BiConsumer<TypeVariable, TypeVariable> mergeHandler,
        DepthConsumer<Constraint> attemptHandler,
        Consumer<ResolvedOverload> overloadHandler,
        Consumer<Failure> failureHandler,
        Consumer<Solution> solutionHandler) {
      this.addConstraintHandler = requireNonNull(addConstraintHandler);
      this.simplifyHandler = requireNonNull(simplifyHandler);
      this.bindHandler = requireNonNull(bindHandler);
      this.mergeHandler = requireNonNull(mergeHandler);
      this.attemptHandler = requireNonNull(attemptHandler);
      this.overloadHandler = requireNonNull(overloadHandler);
      this.failureHandler = requireNonNull(failureHandler);
      this.solutionHandler = requireNonNull(solutionHandler);
    }

    @Override public ConfigurableTracer withAddConstraintHandler(
        Consumer<Constraint> addConstraintHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withSimplifyHandler(
        BiConsumer<Constraint, SolutionKind> simplifyHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withBindHandler(
        BiConsumer<TypeVariable, Type> bindHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withMergeHandler(
        BiConsumer<TypeVariable, TypeVariable> mergeHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withAttemptHandler(
        DepthConsumer<Constraint> attemptHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withOverloadHandler(
        Consumer<ResolvedOverload> overloadHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withFailureHandler(
        Consumer<Failure> failureHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public ConfigurableTracer withSolutionHandler(
        Consumer<Solution> solutionHandler) {
      return new ConfigurableTracerImpl(addConstraintHandler,
          simplifyHandler, bindHandler, mergeHandler, attemptHandler,
          overloadHandler, failureHandler, solutionHandler);
    }

    @Override public void onAddConstraint(Constraint constraint) {
      addConstraintHandler.accept(constraint);
    }

    @Override public void onSimplify(Constraint constraint,
        SolutionKind kind) {
      simplifyHandler.accept(constraint, kind);
    }

    @Override public void onBind(TypeVariable typeVariable, Type type) {
      bindHandler.accept(typeVariable, type);
    }

    @Override public void onMerge(TypeVariable representative,
        TypeVariable merged) {
      mergeHandler.accept(representative, merged);
    }

    @Override public void onAttempt(int depth, Constraint constraint) {
      attemptHandler.accept(depth, constraint);
    }

    @Override public void onOverload(ResolvedOverload overload) {
      overloadHandler.accept(overload);
    }

    @Override public void onFailure(Failure failure) {
      failureHandler.accept(failure);
    }

    @Override public void onSolution(Solution solution) {
      solutionHandler.accept(solution);
    }
  }
}

// End Tracers.java
