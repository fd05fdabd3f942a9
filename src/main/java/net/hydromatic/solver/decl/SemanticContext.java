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

import java.util.List;
import net.hydromatic.solver.type.Type;
import net.hydromatic.solver.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Semantic information that the constraint system obtains from the
 * surrounding type checker: protocol conformance, member lookup, and the
 * protocols and literal types the language treats specially.
 *
 * @see Module
 */
public interface SemanticContext {
  /** Returns the type system in which types are created. */
  TypeSystem typeSystem();

  /** Returns how a type conforms to a protocol, or null if it does not. */
  @Nullable Conformance conformsTo(Type type, NominalDecl protocol);

  /** Returns the members of a type that have a given name.
   *
   * <p>If the base is a metatype, looks in its instance type. */
  List<Decl> lookupMember(Type baseType, String name);

  /** Returns the declarations at module scope that have a given name. */
  List<Decl> lookupUnqualified(String name);

  /** Returns a known protocol, or null if it is not defined. */
  @Nullable NominalDecl getProtocol(KnownProtocol knownProtocol);

  /** Returns the type that a literal of a given protocol has when nothing
   * else constrains it, or null. */
  @Nullable Type getDefaultLiteralType(NominalDecl protocol);

  /** Returns the types that conform to a protocol, in the order that they
   * should be tried as the type of a literal. */
  List<Type> getTypesConformingTo(NominalDecl protocol);

  /** Returns whether a type can be bridged to Objective-C. */
  boolean isBridgedToObjectiveC(Type type);
}

// End SemanticContext.java
