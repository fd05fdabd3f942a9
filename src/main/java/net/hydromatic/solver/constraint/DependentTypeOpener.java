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

import net.hydromatic.solver.decl.AssociatedTypeDecl;
import net.hydromatic.solver.type.GenericParamType;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeVariable;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Callback that is told when generic parameters and associated types are
 * replaced by type variables, and that may supply the types the variables
 * must equal.
 *
 * <p>For example, when checking whether a declaration witnesses a protocol
 * requirement, the requirement's {@code Self} can be replaced by the
 * conforming type.
 */
public interface DependentTypeOpener {
  /** Called when a generic parameter has been replaced by a type variable.
   * Returns the type that the variable must equal, or null. */
  default @Nullable Type openedGenericParameter(GenericParamType param,
      TypeVariable typeVariable) {
    return null;
  }

  /** Returns whether the type variable that stands for an associated type
   * of a type variable should be tied to the base by a
   * {@link ConstraintKind#TYPE_MEMBER} constraint. */
  default boolean shouldBindAssociatedType(TypeVariable baseTypeVariable,
      AssociatedTypeDecl assocType, TypeVariable memberTypeVariable) {
    return true;
  }

  /** Called when an associated type of a type variable has been replaced by
   * a type variable. Returns the type that the variable must equal, or
   * null. */
  default @Nullable Type openedAssociatedType(TypeVariable baseTypeVariable,
      AssociatedTypeDecl assocType, TypeVariable memberTypeVariable) {
    return null;
  }
}

// End DependentTypeOpener.java
