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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.solver.decl.Decl;
import net.hydromatic.solver.decl.NominalDecl;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** One of the candidates in an overload set: what a reference might
 * denote. */
public final class OverloadChoice {
  public final Kind kind;
  /** Type of the base of a member reference, or null for an unqualified
   * reference. */
  public final @Nullable Type baseType;
  private final @Nullable Decl decl;
  /** Index of the element, if {@link #kind} is {@link Kind#TUPLE_INDEX}. */
  public final int tupleIndex;
  /** Whether the reference has explicit generic arguments. */
  public final boolean specialized;

  private OverloadChoice(Kind kind, @Nullable Type baseType,
      @Nullable Decl decl, int tupleIndex, boolean specialized) {
    this.kind = requireNonNull(kind);
    this.baseType = baseType;
    this.decl = decl;
    this.tupleIndex = tupleIndex;
    this.specialized = specialized;
  }

  /** Creates a choice that refers to a declaration. */
  public static OverloadChoice decl(@Nullable Type baseType, Decl decl,
      boolean specialized) {
    return new OverloadChoice(Kind.DECL, baseType, requireNonNull(decl), -1,
        specialized);
  }

  /** Creates a choice that refers to a declaration found by dynamic
   * lookup. */
  public static OverloadChoice declViaDynamic(Type baseType, Decl decl) {
    return new OverloadChoice(Kind.DECL_VIA_DYNAMIC, requireNonNull(baseType),
        requireNonNull(decl), -1, false);
  }

  /** Creates a choice that refers to a type declaration as a type rather
   * than as a value. */
  public static OverloadChoice typeDecl(@Nullable Type baseType,
      NominalDecl decl) {
    return new OverloadChoice(Kind.TYPE_DECL, baseType, requireNonNull(decl),
        -1, false);
  }

  /** Creates a choice that refers to the base type itself. */
  public static OverloadChoice baseType(Type baseType) {
    return new OverloadChoice(Kind.BASE_TYPE, requireNonNull(baseType), null,
        -1, false);
  }

  /** Creates a choice that refers to an element of a tuple. */
  public static OverloadChoice tupleIndex(Type baseType, int index) {
    checkArgument(index >= 0, "negative index %s", index);
    return new OverloadChoice(Kind.TUPLE_INDEX, requireNonNull(baseType),
        null, index, false);
  }

  /** Returns whether this choice refers to a declaration. */
  public boolean isDecl() {
    return decl != null;
  }

  /** Returns the declaration.
   *
   * @throws NullPointerException if this choice does not refer to a
   * declaration */
  public Decl decl() {
    return requireNonNull(decl, "decl");
  }

  /** Returns whether two choices select the same thing. */
  public boolean isSameChoice(OverloadChoice that) {
    return kind == that.kind
        && decl == that.decl
        && tupleIndex == that.tupleIndex;
  }

  @Override public String toString() {
    switch (kind) {
    case TUPLE_INDEX:
      return "tuple element #" + tupleIndex + " of " + baseType;
    case BASE_TYPE:
      return "base type " + baseType;
    default:
      final StringBuilder buf = new StringBuilder();
      if (kind == Kind.DECL_VIA_DYNAMIC) {
        buf.append("dynamic ");
      } else if (kind == Kind.TYPE_DECL) {
        buf.append("type ");
      }
      if (baseType != null) {
        buf.append(baseType).append('.');
      }
      return buf.append(decl().name).append(": ")
          .append(decl().interfaceType()).toString();
    }
  }

  /** Kind of overload choice. */
  public enum Kind {
    /** A declaration. */
    DECL,
    /** A declaration found by looking up a member of {@code AnyObject}. */
    DECL_VIA_DYNAMIC,
    /** A type declaration, referenced as a type. */
    TYPE_DECL,
    /** The base type itself. */
    BASE_TYPE,
    /** An element of a tuple. */
    TUPLE_INDEX
  }
}

// End OverloadChoice.java
