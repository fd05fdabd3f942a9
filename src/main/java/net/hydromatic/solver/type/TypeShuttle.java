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

/** Visitor over {@link Type} objects that returns types.
 *
 * <p>Rebuilds each type from the results of visiting its components, and
 * returns the original type if nothing changed. */
public class TypeShuttle extends TypeVisitor<Type> {
  protected final TypeSystem typeSystem;

  public TypeShuttle(TypeSystem typeSystem) {
    this.typeSystem = typeSystem;
  }

  /** Applies this shuttle to a type. */
  public Type apply(Type type) {
    return type.accept(this);
  }

  @Override public Type visit(TypeVariable typeVariable) {
    return typeVariable;
  }

  @Override public Type visit(NominalType nominalType) {
    return nominalType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(UnboundGenericType unboundGenericType) {
    return unboundGenericType;
  }

  @Override public Type visit(TupleType tupleType) {
    return tupleType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(FnType fnType) {
    return fnType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(GenericFnType genericFnType) {
    return genericFnType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(LValueType lvalueType) {
    return lvalueType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(MetatypeType metatypeType) {
    return metatypeType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(GenericParamType genericParamType) {
    return genericParamType;
  }

  @Override public Type visit(DependentMemberType dependentMemberType) {
    return dependentMemberType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(ArchetypeType archetypeType) {
    return archetypeType;
  }

  @Override public Type visit(DynamicSelfType dynamicSelfType) {
    return dynamicSelfType.copy(typeSystem, this::apply);
  }

  @Override public Type visit(ModuleType moduleType) {
    return moduleType;
  }
}

// End TypeShuttle.java
