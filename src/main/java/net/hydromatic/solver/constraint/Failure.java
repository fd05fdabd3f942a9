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

/**
 * Description of a relation that could not hold.
 *
 * <p>Failures are kept when the solver backtracks past the point where they
 * were recorded, so that if no solution is found they can be used to explain
 * why.
 */
public final class Failure {
  public final Kind kind;
  public final Type first;
  public final @Nullable Type second;
  public final @Nullable ConstraintLocator locator;
  /** Name of the member, for {@link Kind#DOES_NOT_HAVE_MEMBER}. */
  public final @Nullable String name;

  Failure(Kind kind, Type first, @Nullable Type second,
      @Nullable ConstraintLocator locator, @Nullable String name) {
    this.kind = requireNonNull(kind);
    this.first = requireNonNull(first);
    this.second = second;
    this.locator = locator;
    this.name = name;
  }

  /** Returns the kind of failure that a constraint of a given kind
   * reports. */
  static Kind kindFor(ConstraintKind constraintKind) {
    switch (constraintKind) {
    case BIND:
    case EQUAL:
    case OPTIONAL_OBJECT:
      return Kind.TYPES_NOT_EQUAL;
    case SUBTYPE:
      return Kind.TYPES_NOT_SUBTYPES;
    case CONFORMS_TO:
    case SELF_OBJECT_OF_PROTOCOL:
      return Kind.DOES_NOT_CONFORM_TO_PROTOCOL;
    case VALUE_MEMBER:
    case UNRESOLVED_VALUE_MEMBER:
    case TYPE_MEMBER:
      return Kind.DOES_NOT_HAVE_MEMBER;
    case BRIDGED_TO_OBJECTIVE_C:
      return Kind.IS_NOT_BRIDGED_TO_OBJECTIVE_C;
    case APPLICABLE_FUNCTION:
      return Kind.IS_NOT_FUNCTION;
    default:
      return Kind.TYPES_NOT_CONVERTIBLE;
    }
  }

  @Override public String toString() {
    return kind + " " + first + (second == null ? "" : " " + second)
        + (name == null ? "" : " '" + name + "'");
  }

  /** Describes this failure as an error message. */
  public String describe() {
    switch (kind) {
    case TYPES_NOT_EQUAL:
      return "'" + first + "' is not identical to '" + second + "'";
    case TYPES_NOT_SUBTYPES:
      return "'" + first + "' is not a subtype of '" + second + "'";
    case TYPES_NOT_CONVERTIBLE:
      return "'" + first + "' is not convertible to '" + second + "'";
    case TUPLE_SIZE_MISMATCH:
      return "tuple types '" + first + "' and '" + second
          + "' have a different number of elements";
    case TUPLE_NAME_MISMATCH:
      return "tuple types '" + first + "' and '" + second
          + "' have different element names";
    case FUNCTION_TYPES_MISMATCH:
      return "function types '" + first + "' and '" + second
          + "' do not match";
    case DOES_NOT_CONFORM_TO_PROTOCOL:
      return "type '" + first + "' does not conform to protocol '"
          + second + "'";
    case DOES_NOT_HAVE_MEMBER:
      return "'" + first + "' does not have a member named '" + name + "'";
    case IS_NOT_BRIDGED_TO_OBJECTIVE_C:
      return "'" + first + "' is not bridged to Objective-C";
    case IS_NOT_FUNCTION:
      return "cannot call value of non-function type '" + first + "'";
    default:
      throw new AssertionError(kind);
    }
  }

  /** Kind of failure. */
  public enum Kind {
    TYPES_NOT_EQUAL,
    TYPES_NOT_SUBTYPES,
    TYPES_NOT_CONVERTIBLE,
    TUPLE_SIZE_MISMATCH,
    TUPLE_NAME_MISMATCH,
    FUNCTION_TYPES_MISMATCH,
    DOES_NOT_CONFORM_TO_PROTOCOL,
    DOES_NOT_HAVE_MEMBER,
    IS_NOT_BRIDGED_TO_OBJECTIVE_C,
    IS_NOT_FUNCTION
  }
}

// End Failure.java
