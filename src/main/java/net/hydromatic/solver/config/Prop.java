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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls the behavior of a constraint system.
 *
 * <p>Properties are held in a {@code Map<Prop, Object>}; a property that is
 * absent from the map has its default value.
 *
 * @see net.hydromatic.solver.constraint.ConstraintSystem
 */
public enum Prop {
  /**
   * Integer property "solverStepLimit" is the maximum number of solver steps
   * (disjunct attempts plus type-variable binding attempts) before the solver
   * gives up and reports that the expression is too complex.
   */
  SOLVER_STEP_LIMIT("solverStepLimit", Integer.class, true, 100_000),

  /**
   * Integer property "solutionLimit" is the maximum number of distinct
   * solutions of equal score that the solver will retain. If more are found,
   * the expression is reported as too complex.
   */
  SOLUTION_LIMIT("solutionLimit", Integer.class, true, 64),

  /**
   * Boolean property "recordSolverState" controls whether the system retains
   * every generated and retired constraint, including every constraint that
   * failed, for later diagnosis.
   */
  RECORD_SOLVER_STATE("recordSolverState", Boolean.class, true, false),

  /**
   * Boolean property "attemptFixes" controls whether the solver may apply
   * fixes (such as forcing an optional value) to recover from a mismatch.
   * Every fix worsens the score of a solution.
   */
  ATTEMPT_FIXES("attemptFixes", Boolean.class, true, false),

  /**
   * Boolean property "allowFreeTypeVariables" controls whether a solution may
   * leave type variables unbound.
   */
  ALLOW_FREE_TYPE_VARIABLES("allowFreeTypeVariables", Boolean.class, true,
      false),

  /**
   * Boolean property "debugConstraintSolver" controls whether the type
   * checker prints each step of the solver to standard output.
   */
  DEBUG_CONSTRAINT_SOLVER("debugConstraintSolver", Boolean.class, true,
      false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  public static final ImmutableMap<String, Prop> BY_NAME;

  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(CaseFormat.LOWER_CAMEL
        .to(CaseFormat.UPPER_UNDERSCORE, camelName)
        .equals(name()));
    checkArgument(type.isInstance(defaultValue),
        "default value of %s must have type %s", camelName, type);
  }

  /** Looks up a property by its camel-case or upper-case name. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Sets the value of this property, converting from a string if
   * necessary. */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = (String) value;
      if (type == Boolean.class) {
        set(map, Boolean.parseBoolean(s));
        return;
      }
      if (type == Integer.class) {
        try {
          set(map, Integer.parseInt(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer", e);
        }
        return;
      }
    }
    set(map, value);
  }

  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property "
            + camelName + " must have type " + type);
      }
      map.put(this, value);
    }
  }

  public Object remove(Map<Prop, Object> map) {
    return map.remove(this);
  }
}

// End Prop.java
