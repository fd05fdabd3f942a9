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

/** The type of a function value. */
public class FnType extends BaseType implements AnyFunctionType {
  public final Type input;
  public final Type result;

  FnType(Type input, Type result) {
    super(Op.FUNCTION_TYPE,
        input.hasTypeVariable() || result.hasTypeVariable());
    this.input = input;
    this.result = result;
  }

  @Override public Key key() {
    return Keys.fn(input.key(), result.key());
  }

  @Override public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override public FnType copy(TypeSystem typeSystem,
      UnaryOperator<Type> transform) {
    final Type input2 = transform.apply(input);
    final Type result2 = transform.apply(result);
    return input2 == input && result2 == result
        ? this
        : typeSystem.fnType(input2, result2);
  }

  @Override public Type input() {
    return input;
  }

  @Override public Type result() {
    return result;
  }
}

// End FnType.java
