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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.FuncDecl;
import net.hydromatic.solver.decl.Module;
import net.hydromatic.solver.decl.VarDecl;
import org.junit.jupiter.api.Test;

/** Tests for {@link Environment}. */
public class EnvironmentTest {
  final Fixture f = new Fixture();
  final Module other = new Module("other", f.typeSystem);

  @Test void testContext() {
    final VarDecl x = f.var("x", f.intType);
    final Environment env = Environments.of(f.module);
    assertThat(env.lookup("x"), is(ImmutableList.<Decl>of(x)));
    assertThat(env.lookup("y").isEmpty(), is(true));
    assertThat(env.lookup("Int"),
        is(ImmutableList.<Decl>of(f.intDecl)));
  }

  /** A variable hides everything of the same name; a function adds to the
   * functions of the same name. */
  @Test void testBind() {
    final FuncDecl f1 =
        other.func(null, "f", f.fn(f.tuple(f.intType), f.intType));
    final FuncDecl f2 =
        other.func(null, "f", f.fn(f.tuple(f.stringType), f.intType));
    final VarDecl f3 = other.var(null, "f", f.intType);
    final VarDecl y = other.var(null, "y", f.intType);

    final Environment env0 = Environments.empty().bind(f1).bind(y);
    final Environment env1 = env0.bind(f2);
    assertThat(env1.lookup("f"), is(ImmutableList.<Decl>of(f2, f1)));
    assertThat(env1.lookup("y"), is(ImmutableList.<Decl>of(y)));

    final Environment env2 = env1.bind(f3);
    assertThat(env2.lookup("f"), is(ImmutableList.<Decl>of(f3)));
    assertThat(env2.lookup("y"), is(ImmutableList.<Decl>of(y)));

    final Environment env3 = env2.bindAll(ImmutableList.of(f1));
    assertThat(env3.lookup("f"), is(ImmutableList.<Decl>of(f1)));
  }

  @Test void testAsString() {
    final VarDecl y = other.var(null, "y", f.intType);
    final VarDecl y2 = other.var(null, "y", f.stringType);
    final Environment env = Environments.empty().bind(y).bind(y2);
    assertThat(env.asString(), is(y2 + ": String\n"));
  }
}

// End EnvironmentTest.java
