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

import java.util.function.UnaryOperator;
import net.hydromatic.solver.ast.Op;
import net.hydromatic.solver.decl.AssociatedTypeDecl;

/** Associated type of a type that is not yet known, such as
 * {@code T.Element}. */
public class DependentMemberType extends BaseType {
  public final Type base;
  public final AssociatedTypeDecl assocType;

  DependentMemberType(Type base, AssociatedTypeDecl assocType) {
    super(Op.DEPENDENT_MEMBER, base.hasTypeVariable());
    this.base = base;
    this.assocType = assocType;
  }

  @Override public Key key() {
    return Keys.dependentMember(base.key(), assocType);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public DependentMemberType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final Type base2 = transform.apply(base);
    return base2 == base
        ? this
        : typeSystem.dependentMemberType(base2, assocType);
  }
}

// End DependentMemberType.java
