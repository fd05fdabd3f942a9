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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;

import com.google.common.collect.ImmutableList;
import net.hydromatic.solver.Fixture;
import net.hydromatic.solver.type.TypeVariable;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConstraintGraph}. */
public class ConstraintGraphTest {
  final Fixture f = new Fixture();
  final ConstraintSystem cs = new ConstraintSystem(f.module);
  final ConstraintGraph graph = cs.graph;

  @Test void testAddConstraint() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 = cs.createTypeVariable(null);
    final TypeVariable v2 = cs.createTypeVariable(null);
    assertThat(graph.getConstraints(v0).isEmpty(), is(true));
    assertThat(graph.getEquivalenceClass(v0), is(ImmutableList.of(v0)));

    cs.addConstraint(ConstraintKind.CONVERSION, v0, v1, null);
    cs.addConstraint(ConstraintKind.CONFORMS_TO, v2, f.equatableType, null);
    final Constraint c0 = graph.getConstraints(v0).get(0);
    assertThat(c0.toString(), is("$T0 <c $T1"));
    assertThat(graph.getConstraints(v1).get(0), sameInstance(c0));
    assertThat(graph.getConstraints(v2).size(), is(1));
    assertThat(graph.size(), is(3));
  }

  /** Merging type variables merges the constraints that they gather, and
   * leaving the scope undoes the merge. */
  @Test void testMerge() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 = cs.createTypeVariable(null);
    final TypeVariable v2 = cs.createTypeVariable(null);
    cs.addConstraint(ConstraintKind.CONVERSION, v0, v1, null);
    cs.addConstraint(ConstraintKind.CONFORMS_TO, v2, f.equatableType, null);
    assertThat(graph.gatherConstraints(v0).size(), is(1));

    try (SolverScope ignore = new SolverScope(cs)) {
      cs.mergeEquivalenceClasses(v0, v2);
      assertThat(cs.getRepresentative(v2), sameInstance(v0));
      assertThat(graph.getEquivalenceClass(v2),
          is(ImmutableList.of(v0, v2)));
      assertThat(graph.gatherConstraints(v2).size(), is(2));
      assertThat(graph.gatherConstraints(v1).size(), is(1));
    }

    assertThat(cs.getRepresentative(v2), sameInstance(v2));
    assertThat(graph.getEquivalenceClass(v0), is(ImmutableList.of(v0)));
    assertThat(graph.gatherConstraints(v0).size(), is(1));
    assertThat(graph.gatherConstraints(v2).size(), is(1));
  }

  /** Binding a type variable to a type that mentions another type variable
   * makes the first variable's constraints depend on the second. */
  @Test void testAffectedConstraints() {
    final TypeVariable v0 = cs.createTypeVariable(null);
    final TypeVariable v1 = cs.createTypeVariable(null);
    final TypeVariable v2 = cs.createTypeVariable(null);
    cs.addConstraint(ConstraintKind.CONVERSION, v0, v2, null);
    assertThat(graph.gatherAffectedConstraints(v1).isEmpty(), is(true));

    try (SolverScope ignore = new SolverScope(cs)) {
      cs.assignFixedType(v0, f.optional(v1));
      assertThat(graph.gatherAffectedConstraints(v1).size(), is(1));
    }
    assertThat(graph.gatherAffectedConstraints(v1).isEmpty(), is(true));
  }
}

// End ConstraintGraphTest.java
