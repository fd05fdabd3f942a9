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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Arrays;
import java.util.Collection;
import net.hydromatic.solver.type.AnyFunctionType;
import net.hydromatic.solver.type.TupleType;
import net.hydromatic.solver.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declaration of a named entity: a type, function, constructor, variable,
 * subscript or associated type.
 *
 * <p>A declaration's <em>interface type</em> is its type written in terms of
 * the generic parameters of its context. The interface type of a member does
 * not include the implicit {@code self} parameter.
 */
public abstract class Decl {
  public final String name;

  /** The nominal type that contains this declaration, or null if it is
   * declared at module scope. */
  public final @Nullable NominalDecl owner;

  private final ImmutableSet<Attribute> attributes;
  private @Nullable Type interfaceType;

  protected Decl(String name, @Nullable NominalDecl owner,
      Collection<Attribute> attributes) {
    this.name = requireNonNull(name);
    this.owner = owner;
    this.attributes = Sets.immutableEnumSet(attributes);
  }

  /** Creates an attribute set. */
  public static ImmutableSet<Attribute> attributes(Attribute... attributes) {
    return Sets.immutableEnumSet(Arrays.asList(attributes));
  }

  @Override public String toString() {
    return owner == null ? name : owner.name + "." + name;
  }

  /** Returns the interface type of this declaration. */
  public Type interfaceType() {
    return requireNonNull(interfaceType, () -> "no type for " + this);
  }

  boolean hasInterfaceType() {
    return interfaceType != null;
  }

  /** Sets the interface type; may be called only once. */
  void setInterfaceType(Type interfaceType) {
    checkState(this.interfaceType == null, "type of %s already set", this);
    this.interfaceType = requireNonNull(interfaceType);
  }

  public boolean is(Attribute attribute) {
    return attributes.contains(attribute);
  }

  public boolean isStatic() {
    return is(Attribute.STATIC);
  }

  /** Returns whether this is an optional requirement of a protocol. */
  public boolean isOptionalRequirement() {
    return is(Attribute.OPTIONAL);
  }

  /** Returns whether this declaration can be reached by dynamic lookup. */
  public boolean isObjC() {
    return is(Attribute.OBJC);
  }

  /** Returns whether a reference to this declaration can be assigned to. */
  public boolean isSettable() {
    return is(Attribute.SETTABLE);
  }

  /** Returns whether the result type of this declaration is the dynamic type
   * of {@code self}. */
  public boolean hasDynamicSelf() {
    return is(Attribute.DYNAMIC_SELF);
  }

  /** Returns whether this declaration is a member that is accessed on an
   * instance, as opposed to the type. */
  public boolean isInstanceMember() {
    return owner != null && !isStatic();
  }

  /** Returns whether this declaration is a requirement of a protocol. */
  public boolean isProtocolRequirement() {
    return owner != null && owner.isProtocol();
  }

  /** Returns whether this declaration is, or is declared inside, a generic
   * context. */
  public boolean isGenericContext() {
    return owner != null && !owner.genericSignature().isEmpty();
  }

  /**
   * Returns the selector of this declaration, the name by which it is found
   * via dynamic lookup. Two members with the same selector and result type
   * are indistinguishable to dynamic lookup.
   */
  public String selector() {
    return name;
  }

  /** Returns the type of the value produced by a reference to this
   * declaration, ignoring parameters. */
  public abstract Type resultInterfaceType();

  /** Appends a selector piece for each element of a parameter tuple. */
  static String selector(String name, Type interfaceType) {
    if (!(interfaceType instanceof AnyFunctionType)) {
      return name;
    }
    final Type input = ((AnyFunctionType) interfaceType).input();
    if (!(input instanceof TupleType)) {
      return name + ":";
    }
    final TupleType tuple = (TupleType) input;
    final StringBuilder buf = new StringBuilder(name);
    for (int i = 0; i < tuple.size(); i++) {
      buf.append(tuple.label(i)).append(':');
    }
    return buf.toString();
  }

  /** Attribute of a declaration. */
  public enum Attribute {
    STATIC,
    /** Protocol requirement that conforming types need not implement. */
    OPTIONAL,
    OBJC,
    SETTABLE,
    DYNAMIC_SELF
  }
}

// End Decl.java
