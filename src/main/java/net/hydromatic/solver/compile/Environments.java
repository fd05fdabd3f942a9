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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.SemanticContext;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  private Environments() {}

  /** Returns an empty environment. */
  public static Environment empty() {
    return EmptyEnvironment.INSTANCE;
  }

  /** Returns an environment whose names are those at the top level of a
   * semantic context. */
  public static Environment of(SemanticContext context) {
    return new ContextEnvironment(context);
  }

  /** Environment that inherits from a parent environment and adds one
   * declaration. */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Decl decl;

    SubEnvironment(Environment parent, Decl decl) {
      this.parent = requireNonNull(parent);
      this.decl = requireNonNull(decl);
    }

    @Override public String toString() {
      return decl + ", ...";
    }

    @Override public List<Decl> lookup(String name) {
      if (!name.equals(decl.name)) {
        return parent.lookup(name);
      }
      if (!(decl instanceof FuncDecl)) {
        return ImmutableList.of(decl);
      }
      final ImmutableList.Builder<Decl> b = ImmutableList.builder();
      b.add(decl);
      for (Decl d : parent.lookup(name)) {
        if (d instanceof FuncDecl) {
          b.add(d);
        }
      }
      return b.build();
    }

    @Override public Environment bind(Decl decl) {
      Environment env = this;
      if (!(decl instanceof FuncDecl)) {
        // The new declaration hides every declaration of the same name, so
        // bind the nearest ancestor that declares something else. This keeps
        // chains short.
        while (env instanceof SubEnvironment
            && ((SubEnvironment) env).decl.name.equals(decl.name)) {
          env = ((SubEnvironment) env).parent;
        }
      }
      return new SubEnvironment(env, decl);
    }

    @Override void visit(Consumer<Decl> consumer) {
      consumer.accept(decl);
      parent.visit(consumer);
    }
  }

  /** Environment that looks up names in a semantic context. */
  private static class ContextEnvironment extends Environment {
    private final SemanticContext context;

    ContextEnvironment(SemanticContext context) {
      this.context = requireNonNull(context);
    }

    @Override public String toString() {
      return context.toString();
    }

    @Override public List<Decl> lookup(String name) {
      return context.lookupUnqualified(name);
    }

    @Override void visit(Consumer<Decl> consumer) {
      // The context cannot enumerate its names.
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override public List<Decl> lookup(String name) {
      return ImmutableList.of();
    }

    @Override void visit(Consumer<Decl> consumer) {}
  }
}

// End Environments.java
