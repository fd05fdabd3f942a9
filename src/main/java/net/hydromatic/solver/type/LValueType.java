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

/** Type of a storage location that can be assigned to. */
public class LValueType extends BaseType {
  public final Type objectType;

  LValueType(Type objectType) {
    super(Op.LVALUE_TYPE, objectType.hasTypeVariable());
    this.objectType = objectType;
  }

  @Override public Key key() {
    return Keys.lvalue(objectType.key());
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public Type copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final Type objectType2 = transform.apply(objectType);
    return objectType2 == objectType
        ? this
        : typeSystem.lvalueType(objectType2);
  }

  @Override public Type rvalueType() {
    return objectType;
  }

  @Override public boolean isLValue() {
    return true;
  }
}

// End LValueType.java
