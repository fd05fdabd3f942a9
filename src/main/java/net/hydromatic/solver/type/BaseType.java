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
package net.hydromatic.solver.type;

import static java.util.Objects.requireNonNull;

import net.hydromatic.solver.ast.Op;

/** Abstract implementation of Type. */
abstract class BaseType implements Type {
  final Op op;
  private final boolean hasTypeVariable;
  private int hash;

  protected BaseType(Op op, boolean hasTypeVariable) {
    this.op = requireNonNull(op);
    this.hasTypeVariable = hasTypeVariable;
  }

  /** Returns whether any of a list of types mentions a type variable. */
  static boolean anyHasTypeVariable(Iterable<? extends Type> types) {
    for (Type type : types) {
      if (type.hasTypeVariable()) {
        return true;
      }
    }
    return false;
  }

  @Override public Op op() {
    return op;
  }

  @Override public boolean hasTypeVariable() {
    return hasTypeVariable;
  }

  @Override public String toString() {
    return key().toString();
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof BaseType
        && op == ((BaseType) o).op
        && key().equals(((BaseType) o).key());
  }

  @Override public int hashCode() {
    if (hash == 0) {
      hash = key().hashCode();
    }
    return hash;
  }
}

// End BaseType.java
