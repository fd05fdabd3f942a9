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

/** Kind of {@link Constraint}. */
public enum ConstraintKind {
  /** The two types are bound to the same type; l-values are preserved. */
  BIND("bind"),
  /** The two types are the same once l-values have been stripped. */
  EQUAL("=="),
  /** The first type is a subtype of the second. */
  SUBTYPE("<"),
  /** The first type is convertible to the second. */
  CONVERSION("<c"),
  /** The first type, an argument tuple, is convertible to the second, a
   * parameter tuple. */
  ARGUMENT_TUPLE_CONVERSION("<arg"),
  /** The first type conforms to the protocol that is the second type. */
  CONFORMS_TO("conforms to"),
  /** The first type is the object type of a protocol's {@code Self}; an
   * existential of the protocol itself qualifies. */
  SELF_OBJECT_OF_PROTOCOL("self object of"),
  /** A value of the first type may be cast to the second type. */
  CHECKED_CAST("checked cast to"),
  /** The first type can be bridged to Objective-C. */
  BRIDGED_TO_OBJECTIVE_C("bridged to Objective-C"),
  /** The first type, a function type, describes a call of the second
   * type. */
  APPLICABLE_FUNCTION("applicable fn"),
  /** The second type is the object type of the optional that is the first
   * type. */
  OPTIONAL_OBJECT("optional object of"),
  /** The second type is the type of a value member of the first type. */
  VALUE_MEMBER("value member"),
  /** The second type is the type of a value member of the metatype that is
   * the first type, whose instance type is not yet known. */
  UNRESOLVED_VALUE_MEMBER("unresolved member"),
  /** The second type is a member type of the first type. */
  TYPE_MEMBER("type member"),
  /** The first type is bound to an overload choice. */
  BIND_OVERLOAD("bind overload"),
  /** All of the nested constraints hold. */
  CONJUNCTION("and"),
  /** At least one of the nested constraints holds. */
  DISJUNCTION("or");

  /** Symbol used when printing a constraint. */
  public final String symbol;

  ConstraintKind(String symbol) {
    this.symbol = symbol;
  }

  /** Returns whether this is a relation between two types. */
  public boolean isRelational() {
    return compareTo(ARGUMENT_TUPLE_CONVERSION) <= 0;
  }

  /** Returns whether this is {@link #BIND} or {@link #EQUAL}. */
  public boolean isEquality() {
    return this == BIND || this == EQUAL;
  }

  /** Returns whether this kind allows a subtype on the left; that is,
   * whether it is {@link #SUBTYPE} or a conversion. */
  public boolean allowsSubtype() {
    return this == SUBTYPE || isConversion();
  }

  /** Returns whether this kind allows conversions. */
  public boolean isConversion() {
    return this == CONVERSION || this == ARGUMENT_TUPLE_CONVERSION;
  }

  /** Returns whether this kind looks up a member. */
  public boolean isMember() {
    return this == VALUE_MEMBER
        || this == UNRESOLVED_VALUE_MEMBER
        || this == TYPE_MEMBER;
  }

  /** Returns whether this kind groups other constraints. */
  public boolean isComposite() {
    return this == CONJUNCTION || this == DISJUNCTION;
  }
}

// End ConstraintKind.java
