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
package net.hydromatic.solver.ast;

import java.util.Locale;

/**
 * Sub-types of {@link Expr} and of {@link net.hydromatic.solver.type.Type}.
 */
public enum Op {
  // literal expressions
  INT_LITERAL(true),
  FLOAT_LITERAL(true),
  STRING_LITERAL(true),
  BOOL_LITERAL(true),

  // reference expressions
  NAME_REF(true),
  DECL_REF(true),
  OVERLOADED_DECL_REF(true),
  MEMBER_REF("."),
  UNRESOLVED_MEMBER("."),

  // compound expressions
  APPLY(" "),
  TUPLE(", "),
  COERCE(" as "),
  CHECKED_CAST(" as? "),
  FORCE_VALUE("!"),
  ASSIGN(" = "),

  // types
  NOMINAL_TYPE(true),
  UNBOUND_GENERIC_TYPE(true),
  TUPLE_TYPE(", "),
  FUNCTION_TYPE(" -> "),
  GENERIC_FUNCTION_TYPE(" -> "),
  LVALUE_TYPE(true),
  METATYPE(".Type"),
  GENERIC_PARAM(true),
  DEPENDENT_MEMBER("."),
  ARCHETYPE(true),
  DYNAMIC_SELF(true),
  MODULE_TYPE(true),
  TYPE_VARIABLE(true);

  /** Padded name, e.g. " -> ". */
  public final String padded;

  /** Whether the node is atomic, that is, does not need parentheses when it
   * occurs inside another node. */
  public final boolean atom;

  Op(boolean atom) {
    this(atom, null);
  }

  Op(String padded) {
    this(false, padded);
  }

  Op(boolean atom, String padded) {
    this.atom = atom;
    this.padded = padded == null ? name().toLowerCase(Locale.ROOT) : padded;
  }

  /** Returns whether this operator describes a type, as opposed to an
   * expression. */
  public boolean isType() {
    return compareTo(NOMINAL_TYPE) >= 0;
  }

  /** Returns whether this operator is a literal expression. */
  public boolean isLiteral() {
    return compareTo(INT_LITERAL) >= 0 && compareTo(BOOL_LITERAL) <= 0;
  }
}

// End Op.java
