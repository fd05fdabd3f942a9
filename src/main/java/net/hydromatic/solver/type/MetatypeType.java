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

/** Type of a type, such as {@code Int.Type}. */
public class MetatypeType extends BaseType {
  public final Type instanceType;

  MetatypeType(Type instanceType) {
    super(Op.METATYPE, instanceType.hasTypeVariable());
    this.instanceType = instanceType;
  }

  @Override public Key key() {
    return Keys.metatype(instanceType.key());
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public MetatypeType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final Type instanceType2 = transform.apply(instanceType);
    return instanceType2 == instanceType
        ? this
        : typeSystem.metatypeType(instanceType2);
  }
}

// End MetatypeType.java
