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
import net.hydromatic.solver.decl.NominalDecl;

/** Generic nominal type without arguments, such as {@code Array} in the
 * expression {@code Array()}. */
public class UnboundGenericType extends BaseType {
  public final NominalDecl decl;

  UnboundGenericType(NominalDecl decl) {
    super(Op.UNBOUND_GENERIC_TYPE, false);
    this.decl = decl;
  }

  @Override public Key key() {
    return Keys.unboundGeneric(decl);
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public UnboundGenericType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    return this;
  }

  @Override public NominalDecl nominalDecl() {
    return decl;
  }
}

// End UnboundGenericType.java
