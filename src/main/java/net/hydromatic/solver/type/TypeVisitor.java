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

/** Visitor over {@link Type} objects.
 *
 * <p>The default implementation of each method visits the component types
 * and returns null.
 *
 * @param <R> return type from {@code visit} methods
 *
 * @see Type#accept(TypeVisitor)
 */
public class TypeVisitor<R> {
  /** Visits a {@link TypeVariable}. */
  public R visit(TypeVariable typeVariable) {
    return null;
  }

  /** Visits a {@link NominalType}. */
  public R visit(NominalType nominalType) {
    nominalType.args.forEach(t -> t.accept(this));
    return null;
  }

  /** Visits an {@link UnboundGenericType}. */
  public R visit(UnboundGenericType unboundGenericType) {
    return null;
  }

  /** Visits a {@link TupleType}. */
  public R visit(TupleType tupleType) {
    R r = null;
    for (Type type : tupleType.elementTypes) {
      r = type.accept(this);
    }
    return r;
  }

  /** Visits a {@link FnType}. */
  public R visit(FnType fnType) {
    R r = fnType.input.accept(this);
    return fnType.result.accept(this);
  }

  /** Visits a {@link GenericFnType}. */
  public R visit(GenericFnType genericFnType) {
    R r = genericFnType.input.accept(this);
    return genericFnType.result.accept(this);
  }

  /** Visits an {@link LValueType}. */
  public R visit(LValueType lvalueType) {
    return lvalueType.objectType.accept(this);
  }

  /** Visits a {@link MetatypeType}. */
  public R visit(MetatypeType metatypeType) {
    return metatypeType.instanceType.accept(this);
  }

  /** Visits a {@link GenericParamType}. */
  public R visit(GenericParamType genericParamType) {
    return null;
  }

  /** Visits a {@link DependentMemberType}. */
  public R visit(DependentMemberType dependentMemberType) {
    return dependentMemberType.base.accept(this);
  }

  /** Visits an {@link ArchetypeType}. */
  public R visit(ArchetypeType archetypeType) {
    return null;
  }

  /** Visits a {@link DynamicSelfType}. */
  public R visit(DynamicSelfType dynamicSelfType) {
    return dynamicSelfType.selfType.accept(this);
  }

  /** Visits a {@link ModuleType}. */
  public R visit(ModuleType moduleType) {
    return null;
  }
}

// End TypeVisitor.java
