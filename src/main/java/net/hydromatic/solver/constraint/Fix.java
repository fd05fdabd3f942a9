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

import static java.util.Objects.requireNonNull;

import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** A repair that the solver made so that an ill-typed expression could be
 * solved; the repaired solution describes what the user probably meant. */
public final class Fix {
  public final Kind kind;
  public final Type fromType;
  public final Type toType;
  public final @Nullable ConstraintLocator locator;

  Fix(Kind kind, Type fromType, Type toType,
      @Nullable ConstraintLocator locator) {
    this.kind = requireNonNull(kind);
    this.fromType = requireNonNull(fromType);
    this.toType = requireNonNull(toType);
    this.locator = locator;
  }

  @Override public String toString() {
    return kind + " " + fromType + " to " + toType;
  }

  /** Describes the fix as advice to the user. */
  public String describe() {
    switch (kind) {
    case FORCE_UNWRAP:
      return "value of optional type '" + fromType
          + "' not unwrapped; did you mean to use '!'?";
    case FORCE_DOWNCAST:
      return "'" + fromType + "' is not convertible to '" + toType
          + "'; did you mean to use 'as!' to force downcast?";
    default:
      throw new AssertionError(kind);
    }
  }

  /** Kind of fix. */
  public enum Kind {
    /** Unwrap an optional value with "!". */
    FORCE_UNWRAP,
    /** Cast a class instance to one of its subclasses. */
    FORCE_DOWNCAST
  }
}

// End Fix.java
