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

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.decl.NominalDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type.
 *
 * <p>Types are immutable and are interned by a {@link TypeSystem}, so two
 * types that have the same {@link #key()} are the same object. */
public interface Type {
  /**
   * Description of the type, e.g. "{@code Int}",
   * "{@code (Int, String) -> Bool}".
   */
  Key key();

  /** Type operator. */
  Op op();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Copies this type, applying a given transform to its immediate component
   * types, and returning the original type if the component types are
   * unchanged.
   */
  Type copy(TypeSystem typeSystem, UnaryOperator<Type> transform);

  /** Returns whether this type mentions a {@link TypeVariable}. */
  boolean hasTypeVariable();

  /** Returns the type of the value stored in an l-value; for other types,
   * returns this type. */
  default Type rvalueType() {
    return this;
  }

  /** Returns whether this is an l-value type. */
  default boolean isLValue() {
    return false;
  }

  /** Returns the declaration of a nominal type, or null. */
  default @Nullable NominalDecl nominalDecl() {
    return null;
  }

  /** Returns whether this is a protocol type used as a value (an
   * existential). */
  default boolean isExistential() {
    return false;
  }

  /** Returns whether this is the type of an instance of a class, or of a
   * value whose type is bounded by a class. */
  default boolean mayHaveSuperclass() {
    return false;
  }

  /** Returns the type variables mentioned in this type, in order of first
   * occurrence. */
  default Set<TypeVariable> typeVariables() {
    final Set<TypeVariable> set = new LinkedHashSet<>();
    if (hasTypeVariable()) {
      accept(new TypeVisitor<Void>() {
        @Override public Void visit(TypeVariable typeVariable) {
          set.add(typeVariable);
          return null;
        }
      });
    }
    return set;
  }

  /** Structural identifier of a type. */
  abstract class Key {
    public final Op op;

    /** Creates a key. */
    protected Key(Op op) {
      this.op = requireNonNull(op);
    }

    @Override public String toString() {
      return describe(new StringBuilder()).toString();
    }

    /** Writes a description of this key to a string builder. */
    abstract StringBuilder describe(StringBuilder buf);

    /** Converts this key to a type, and ensures that it is registered in the
     * type system. */
    public abstract Type toType(TypeSystem typeSystem);
  }
}

// End Type.java
