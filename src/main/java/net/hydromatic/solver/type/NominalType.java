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

import static net.hydromatic.solver.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.decl.NominalDecl;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Type of an instance of a struct, enum, class or protocol, with arguments
 * for its generic parameters.
 *
 * <p>If the declaration is a protocol, this is an <em>existential</em>
 * type, a value of some type that conforms to the protocol. */
public class NominalType extends BaseType {
  public final NominalDecl decl;
  public final ImmutableList<Type> args;

  NominalType(NominalDecl decl, ImmutableList<Type> args) {
    super(Op.NOMINAL_TYPE, anyHasTypeVariable(args));
    this.decl = decl;
    this.args = args;
  }

  @Override public Key key() {
    return Keys.nominal(decl, Keys.toKeys(args));
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public NominalType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final List<Type> args2 = transformEager(args, transform);
    return args2.equals(args) ? this : typeSystem.nominalType(decl, args2);
  }

  @Override public NominalDecl nominalDecl() {
    return decl;
  }

  @Override public boolean isExistential() {
    return decl.isProtocol();
  }

  @Override public boolean mayHaveSuperclass() {
    return decl.isClass();
  }

  /** Returns the {@code i}th generic argument. */
  public Type arg(int i) {
    return args.get(i);
  }

  /** Substitutes this type's generic arguments for the generic parameters
   * of its declaration in a type. */
  public Type substitute(TypeSystem typeSystem, Type type) {
    if (args.isEmpty()) {
      return type;
    }
    return typeSystem.substitute(type,
        decl.genericSignature().substitutions(args));
  }

  /** Returns the superclass of this class type, or null. */
  public @Nullable NominalType superclass(TypeSystem typeSystem) {
    if (decl.superclass == null) {
      return null;
    }
    return (NominalType) substitute(typeSystem, decl.superclass);
  }
}

// End NominalType.java
