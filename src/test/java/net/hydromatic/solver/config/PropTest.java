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
package net.hydromatic.solver.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test void testLookup() {
    assertThat(Prop.lookup("solutionLimit"), is(Prop.SOLUTION_LIMIT));
    assertThat(Prop.lookup("SOLUTION_LIMIT"), is(Prop.SOLUTION_LIMIT));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("noSuchProp"));
    assertThat(e.getMessage(), is("property noSuchProp not found"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.ALLOW_FREE_TYPE_VARIABLES));
  }

  @Test void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.SOLVER_STEP_LIMIT.intValue(map), is(100_000));
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(64));
    assertThat(Prop.ATTEMPT_FIXES.booleanValue(map), is(false));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.ATTEMPT_FIXES.intValue(map));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SOLUTION_LIMIT.set(map, 3);
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(3));
    Prop.SOLUTION_LIMIT.setLenient(map, "5");
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(5));
    Prop.RECORD_SOLVER_STATE.setLenient(map, "true");
    assertThat(Prop.RECORD_SOLVER_STATE.booleanValue(map), is(true));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.SOLUTION_LIMIT.setLenient(map, "many"));
    assertThat(e.getMessage(),
        is("value for property solutionLimit must be an integer"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SOLUTION_LIMIT.set(map, true));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SOLUTION_LIMIT.set(map, null));

    assertThat(Prop.SOLUTION_LIMIT.remove(map), is(5));
    assertThat(Prop.SOLUTION_LIMIT.intValue(map), is(64));
  }
}

// End PropTest.java
