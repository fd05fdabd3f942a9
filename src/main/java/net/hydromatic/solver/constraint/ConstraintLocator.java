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
import static net.hydromatic.solver.util.Static.last;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.solver.ast.Expr;
import net.hydromatic.solver.type.ArchetypeType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Describes where a constraint came from: an anchor expression and a path
 * from that expression to the part of its type that is constrained.
 *
 * <p>Locators are interned by their {@link ConstraintSystem}, so two locators
 * with the same anchor and path are the same object, and locators may be
 * compared using {@code ==}. To obtain a locator, call
 * {@link ConstraintSystem#getConstraintLocator}.
 */
public final class ConstraintLocator {
  /** Summary flag: the path goes into the argument or result of a function
   * type. */
  public static final int FUNCTION_CONVERSION = 0x1;

  /** Summary flag: the path goes into the argument of an application. */
  public static final int APPLY_ARGUMENT = 0x2;

  public final @Nullable Expr anchor;
  public final ImmutableList<PathElement> path;
  private final int summaryFlags;

  ConstraintLocator(@Nullable Expr anchor, ImmutableList<PathElement> path) {
    this.anchor = anchor;
    this.path = requireNonNull(path);
    this.summaryFlags = summaryFlags(path);
  }

  /** Computes the summary flags of a path. */
  static int summaryFlags(List<PathElement> path) {
    int flags = 0;
    for (PathElement element : path) {
      flags |= element.kind.summaryFlags;
    }
    return flags;
  }

  public int summaryFlags() {
    return summaryFlags;
  }

  /** Returns whether this locator's path goes into the argument or result
   * of a function type. */
  public boolean isFunctionConversion() {
    return (summaryFlags & FUNCTION_CONVERSION) != 0;
  }

  /** Returns whether this locator's path goes into the argument of an
   * application. */
  public boolean isForApplyArgument() {
    return (summaryFlags & APPLY_ARGUMENT) != 0;
  }

  /** Returns the archetype that the last element of the path refers to, or
   * null. Type variables created by opening a generic signature have such
   * a locator. */
  public @Nullable ArchetypeType archetype() {
    if (path.isEmpty()) {
      return null;
    }
    final PathElement element = last(path);
    return element.kind == PathKind.ARCHETYPE ? element.archetype : null;
  }

  @Override public String toString() {
    final StringBuilder buf = new StringBuilder("locator@");
    if (anchor == null) {
      buf.append("<null>");
    } else {
      buf.append(anchor.op.name()).append('(').append(anchor).append(')');
    }
    buf.append(" [");
    for (int i = 0; i < path.size(); i++) {
      buf.append(i > 0 ? " -> " : "");
      path.get(i).describeTo(buf);
    }
    return buf.append(']').toString();
  }

  /** Kind of step in a locator's path. */
  public enum PathKind {
    ADDRESS_OF,
    APPLY_ARGUMENT(ConstraintLocator.APPLY_ARGUMENT),
    APPLY_FUNCTION,
    ARCHETYPE,
    ASSIGN_DEST,
    ASSIGN_SOURCE,
    CHECKED_CAST_OPERAND,
    CONSTRUCTOR_MEMBER,
    FUNCTION_ARGUMENT(FUNCTION_CONVERSION),
    FUNCTION_RESULT(FUNCTION_CONVERSION),
    GENERIC_ARGUMENT(0, true),
    INSTANCE_TYPE,
    LOAD,
    MEMBER,
    MEMBER_REF_BASE,
    NAMED_TUPLE_ELEMENT(0, true),
    OPTIONAL_PAYLOAD,
    RVALUE_ADJUSTMENT,
    SUBSCRIPT_INDEX,
    SUBSCRIPT_RESULT,
    TUPLE_ELEMENT(0, true),
    UNRESOLVED_MEMBER;

    final int summaryFlags;

    /** Whether an element of this kind carries an index. */
    public final boolean hasValue;

    PathKind() {
      this(0, false);
    }

    PathKind(int summaryFlags) {
      this(summaryFlags, false);
    }

    PathKind(int summaryFlags, boolean hasValue) {
      this.summaryFlags = summaryFlags;
      this.hasValue = hasValue;
    }
  }

  /** Step in a locator's path. */
  public static final class PathElement {
    public final PathKind kind;
    public final int value;
    public final @Nullable ArchetypeType archetype;

    private PathElement(PathKind kind, int value,
        @Nullable ArchetypeType archetype) {
      this.kind = requireNonNull(kind);
      this.value = value;
      this.archetype = archetype;
    }

    /** Creates a path element that has no index. */
    public static PathElement of(PathKind kind) {
      checkArgument(!kind.hasValue && kind != PathKind.ARCHETYPE,
          "%s requires a value", kind);
      return new PathElement(kind, 0, null);
    }

    /** Creates a path element with an index, such as
     * {@link PathKind#TUPLE_ELEMENT}. */
    public static PathElement of(PathKind kind, int value) {
      checkArgument(kind.hasValue, "%s does not have a value", kind);
      return new PathElement(kind, value, null);
    }

    public static PathElement tupleElement(int i) {
      return of(PathKind.TUPLE_ELEMENT, i);
    }

    public static PathElement genericArgument(int i) {
      return of(PathKind.GENERIC_ARGUMENT, i);
    }

    /** Creates a path element that refers to an archetype. */
    public static PathElement archetype(ArchetypeType archetype) {
      return new PathElement(PathKind.ARCHETYPE, 0,
          requireNonNull(archetype));
    }

    @Override public int hashCode() {
      return Objects.hash(kind, value, archetype);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PathElement
          && kind == ((PathElement) o).kind
          && value == ((PathElement) o).value
          && archetype == ((PathElement) o).archetype;
    }

    @Override public String toString() {
      return describeTo(new StringBuilder()).toString();
    }

    StringBuilder describeTo(StringBuilder buf) {
      buf.append(kind.name().toLowerCase(Locale.ROOT));
      if (kind.hasValue) {
        buf.append(" #").append(value);
      }
      if (archetype != null) {
        buf.append(" '").append(archetype.name).append('\'');
      }
      return buf;
    }
  }
}

// End ConstraintLocator.java
