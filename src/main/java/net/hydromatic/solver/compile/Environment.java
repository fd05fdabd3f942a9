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

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.solver.decl.Decl;

/**
 * Environment in which unqualified names are resolved.
 *
 * <p>Every environment is immutable; when you call {@link #bind}, a new
 * environment is created that inherits from the previous environment. A
 * declaration hides declarations of the same name in the old environment,
 * except that functions overload: a function adds to the functions of the
 * same name that are already visible.
 *
 * <p>To create an empty environment, call {@link Environments#empty()}.
 */
public abstract class Environment {
  /**
   * Visits every declaration in this environment.
   *
   * <p>Declarations that are hidden by more recent declarations of the same
   * name are visited, but after the declarations that hide them.
   */
  abstract void visit(Consumer<Decl> consumer);

  /**
   * Converts this environment to a string.
   *
   * <p>This method does not override the {@link #toString()} method; if we
   * did, debuggers would invoke it automatically, burning lots of CPU and
   * memory.
   */
  public String asString() {
    final StringBuilder b = new StringBuilder();
    final Set<String> names = new HashSet<>();
    visit(decl -> {
      if (names.add(decl.name)) {
        for (Decl d : lookup(decl.name)) {
          b.append(d).append(": ").append(d.interfaceType()).append("\n");
        }
      }
    });
    return b.toString();
  }

  /** Returns the declarations that an unqualified reference to
   * {@code name} may refer to; empty if there are none. */
  public abstract List<Decl> lookup(String name);

  /** Creates an environment that is the same as this, plus one more
   * declaration. */
  public Environment bind(Decl decl) {
    return new Environments.SubEnvironment(this, decl);
  }

  /** Creates an environment that is the same as this, plus the given
   * declarations. */
  public final Environment bindAll(Iterable<? extends Decl> decls) {
    Environment env = this;
    for (Decl decl : decls) {
      env = env.bind(decl);
    }
    return env;
  }
}

// End Environment.java
