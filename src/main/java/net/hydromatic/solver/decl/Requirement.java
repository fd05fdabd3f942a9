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
package net.hydromatic.solver.decl;

import static java.util.Objects.requireNonNull;

import net.hydromatic.solver.type.Type;

/** Requirement in a generic signature.
 *
 * <p>A conformance requirement {@code T: P} states that the subject type
 * {@code T} conforms to protocol {@code P}, or, if the constraint type is a
 * class, inherits from that class. A same-type requirement
 * {@code T.Element == U} states that two types are the same. */
public class Requirement {
  public final Kind kind;
  public final Type first;
  public final Type second;

  private Requirement(Kind kind, Type first, Type second) {
    this.kind = requireNonNull(kind);
    this.first = requireNonNull(first);
    this.second = requireNonNull(second);
  }

  /** Creates a conformance requirement. */
  public static Requirement conformance(Type subject, Type constraint) {
    return new Requirement(Kind.CONFORMANCE, subject, constraint);
  }

  /** Creates a same-type requirement. */
  public static Requirement sameType(Type first, Type second) {
    return new Requirement(Kind.SAME_TYPE, first, second);
  }

  @Override public String toString() {
    return first + (kind == Kind.CONFORMANCE ? ": " : " == ") + second;
  }

  /** Kind of requirement. */
  public enum Kind {
    CONFORMANCE,
    SAME_TYPE
  }
}

// End Requirement.java
